package logsink;

import logsink.codec.ExceptionCodec;
import logsink.codec.MessageTemplate;
import logsink.model.SerializedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable structured log entry.
 *
 * <p>Entries built by producers carry {@code id == 0}; the store assigns the row id
 * and entries read back from storage carry it. The rendered message is derived from
 * the template and parameters when not set explicitly.
 *
 * @see SinkLogger
 * @see LogSink#enqueue(LogEntry)
 */
public final class LogEntry {
    private final long id;
    private final Instant timestamp;
    private final LogLevel level;
    private final String category;
    private final int eventId;
    private final String eventName;
    private final long threadId;
    private final String messageTemplate;
    private final String renderedMessage;
    private final Map<String, Object> parameters;
    private final List<Map<String, Object>> scopes;
    private final SerializedException exception;

    private LogEntry(Builder builder) {
        if (builder.id < 0) {
            throw new IllegalArgumentException("id must be >= 0");
        }
        this.id = builder.id;
        this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
        this.level = Objects.requireNonNull(builder.level, "level");
        this.category = builder.category == null ? "" : builder.category;
        this.eventId = builder.eventId;
        this.eventName = builder.eventName;
        this.threadId = builder.threadId;
        this.messageTemplate = builder.messageTemplate == null ? "" : builder.messageTemplate;

        Map<String, Object> params = builder.parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        if (params.containsKey(null)) {
            throw new IllegalArgumentException("parameters cannot contain null keys");
        }
        this.parameters = params;

        if (builder.scopes == null || builder.scopes.isEmpty()) {
            this.scopes = Collections.emptyList();
        } else {
            List<Map<String, Object>> copy = new ArrayList<>(builder.scopes.size());
            for (Map<String, Object> scope : builder.scopes) {
                if (scope == null) {
                    copy.add(Collections.emptyMap());
                    continue;
                }
                Map<String, Object> values = new LinkedHashMap<>(scope);
                if (values.containsKey(null)) {
                    throw new IllegalArgumentException("scopes cannot contain null keys");
                }
                copy.add(Collections.unmodifiableMap(values));
            }
            this.scopes = Collections.unmodifiableList(copy);
        }
        this.exception = builder.exception;

        if (builder.renderedMessage != null) {
            this.renderedMessage = builder.renderedMessage;
        } else {
            this.renderedMessage = params.isEmpty()
                    ? this.messageTemplate
                    : MessageTemplate.format(this.messageTemplate, params);
        }
    }

    public static Builder builder(LogLevel level) {
        return new Builder().level(level);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this entry's values.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.id = id;
        b.timestamp = timestamp;
        b.level = level;
        b.category = category;
        b.eventId = eventId;
        b.eventName = eventName;
        b.threadId = threadId;
        b.messageTemplate = messageTemplate;
        b.renderedMessage = renderedMessage;
        b.parameters = parameters;
        b.scopes = scopes;
        b.exception = exception;
        return b;
    }

    /**
     * Row id assigned by the store, or {@code 0} if the entry has not been read from storage.
     *
     * @return the row id
     */
    public long id() {
        return id;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public LogLevel level() {
        return level;
    }

    public String category() {
        return category;
    }

    public int eventId() {
        return eventId;
    }

    public String eventName() {
        return eventName;
    }

    public long threadId() {
        return threadId;
    }

    public String messageTemplate() {
        return messageTemplate;
    }

    public String renderedMessage() {
        return renderedMessage;
    }

    public Map<String, Object> parameters() {
        return parameters;
    }

    /**
     * Scope chain active when the entry was logged, outermost first.
     *
     * @return the scope chain, never {@code null}
     */
    public List<Map<String, Object>> scopes() {
        return scopes;
    }

    public SerializedException exception() {
        return exception;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("LogEntry{");
        if (id != 0) {
            sb.append("id=").append(id).append(", ");
        }
        sb.append("timestamp=").append(timestamp)
                .append(", level=").append(level)
                .append(", category=").append(category)
                .append(", message=").append(renderedMessage);
        if (exception != null) {
            sb.append(", exception=").append(exception.type());
        }
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link LogEntry}. Only {@code level} is required.
     */
    public static final class Builder {
        private long id;
        private Instant timestamp;
        private LogLevel level;
        private String category;
        private int eventId;
        private String eventName;
        private long threadId = Thread.currentThread().getId();
        private String messageTemplate;
        private String renderedMessage;
        private Map<String, Object> parameters;
        private List<Map<String, Object>> scopes;
        private SerializedException exception;

        private Builder() {
        }

        /**
         * Sets the row id. Used by readers materializing stored rows.
         */
        public Builder id(long id) {
            this.id = id;
            return this;
        }

        /**
         * Sets the entry time. Defaults to {@link Instant#now()} at build time.
         */
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder level(LogLevel level) {
            this.level = level;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder eventId(int eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder eventName(String eventName) {
            this.eventName = eventName;
            return this;
        }

        /**
         * Sets the producing thread id. Defaults to the thread that created the builder.
         */
        public Builder threadId(long threadId) {
            this.threadId = threadId;
            return this;
        }

        public Builder messageTemplate(String messageTemplate) {
            this.messageTemplate = messageTemplate;
            return this;
        }

        /**
         * Sets the rendered message explicitly instead of deriving it from the template.
         */
        public Builder renderedMessage(String renderedMessage) {
            this.renderedMessage = renderedMessage;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters == null ? null : new LinkedHashMap<>(parameters);
            return this;
        }

        /**
         * Adds a single named parameter.
         */
        public Builder parameter(String key, Object value) {
            Objects.requireNonNull(key, "key");
            if (this.parameters == null) {
                this.parameters = new LinkedHashMap<>();
            } else if (!(this.parameters instanceof LinkedHashMap)) {
                this.parameters = new LinkedHashMap<>(this.parameters);
            }
            this.parameters.put(key, value);
            return this;
        }

        public Builder scopes(List<Map<String, Object>> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder exception(SerializedException exception) {
            this.exception = exception;
            return this;
        }

        /**
         * Snapshots {@code throwable} and its causes.
         */
        public Builder exception(Throwable throwable) {
            this.exception = ExceptionCodec.flatten(throwable);
            return this;
        }

        /**
         * Builds the entry.
         *
         * @return a new {@link LogEntry}
         * @throws NullPointerException if {@code level} is not set
         * @throws IllegalArgumentException if parameters contain a null key or {@code id} is negative
         */
        public LogEntry build() {
            return new LogEntry(this);
        }
    }
}
