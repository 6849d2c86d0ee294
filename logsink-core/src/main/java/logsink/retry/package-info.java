/**
 * Bounded retry with backoff for storage writes and deletes.
 */
package logsink.retry;
