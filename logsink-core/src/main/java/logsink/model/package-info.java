/**
 * Persisted value types.
 */
package logsink.model;
