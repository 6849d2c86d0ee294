package logsink.spi;

/**
 * Observability hook for exporting sink counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of entries accepted into the write buffer.
     */
    void incrementAccepted();

    /**
     * Increments the count of entries dropped because the write buffer was full
     * or closed while a producer waited.
     */
    void incrementDiscarded();

    /**
     * Adds to the count of entries written to storage.
     *
     * @param entries entries in the committed batch
     */
    void incrementWritten(int entries);

    /**
     * Increments the count of batch insert attempts that failed and will be retried.
     */
    default void incrementWriteRetried() {
    }

    /**
     * Records a batch abandoned after exhausting retries.
     *
     * @param entries entries lost with the batch
     */
    void incrementBatchFailed(int entries);

    /**
     * Increments the count of entries dropped because they could not be encoded.
     */
    default void incrementEntryRejected() {
    }

    /**
     * Adds to the count of rows removed by housekeeping.
     *
     * @param rows rows deleted
     */
    default void incrementHousekeepingDeleted(int rows) {
    }

    /**
     * Records the number of entries waiting in the write buffer.
     *
     * @param depth queued entries
     */
    void recordQueueDepth(int depth);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementAccepted() {
        }

        @Override
        public void incrementDiscarded() {
        }

        @Override
        public void incrementWritten(int entries) {
        }

        @Override
        public void incrementBatchFailed(int entries) {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
