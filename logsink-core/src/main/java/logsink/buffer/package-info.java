/**
 * Producer-side buffering and the single background batch writer.
 *
 * <p>{@link logsink.buffer.WriteBuffer} accepts entries from any number of threads;
 * {@link logsink.buffer.BatchWriter} drains it on one daemon thread and inserts
 * entries in transactional batches.
 */
package logsink.buffer;
