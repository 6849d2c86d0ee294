package logsink;

import java.time.Instant;

/**
 * Filter and paging criteria for {@link logsink.spi.LogReader#getEntries(LogQuery)}.
 *
 * <p>All filters are optional and combined with AND. {@code from} is inclusive,
 * {@code to} exclusive. {@code messageContains} matches the rendered message
 * case-sensitively. Results are ordered by row id.
 *
 * @param minLevel        lowest level to include, or {@code null}
 * @param category        exact category, or {@code null}
 * @param from            earliest timestamp, or {@code null}
 * @param to              timestamp upper bound, or {@code null}
 * @param messageContains substring of the rendered message, or {@code null}
 * @param offset          rows to skip
 * @param limit           maximum rows to return, {@code 0} for no limit
 * @param descending      newest first when {@code true}
 */
public record LogQuery(
    LogLevel minLevel,
    String category,
    Instant from,
    Instant to,
    String messageContains,
    int offset,
    int limit,
    boolean descending
) {

  public LogQuery {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
    if (from != null && to != null && to.isBefore(from)) {
      throw new IllegalArgumentException("to must not be before from");
    }
  }

  /** Query matching every row in id order. */
  public static LogQuery all() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link LogQuery}. */
  public static final class Builder {
    private LogLevel minLevel;
    private String category;
    private Instant from;
    private Instant to;
    private String messageContains;
    private int offset;
    private int limit;
    private boolean descending;

    private Builder() {}

    public Builder minLevel(LogLevel minLevel) {
      this.minLevel = minLevel;
      return this;
    }

    public Builder category(String category) {
      this.category = category;
      return this;
    }

    public Builder from(Instant from) {
      this.from = from;
      return this;
    }

    public Builder to(Instant to) {
      this.to = to;
      return this;
    }

    public Builder messageContains(String messageContains) {
      this.messageContains = messageContains;
      return this;
    }

    public Builder offset(int offset) {
      this.offset = offset;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder descending(boolean descending) {
      this.descending = descending;
      return this;
    }

    public LogQuery build() {
      return new LogQuery(minLevel, category, from, to, messageContains, offset, limit, descending);
    }
  }
}
