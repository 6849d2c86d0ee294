/**
 * Text encodings of the structured columns: parameters and scopes as JSON objects,
 * exception chains as nested JSON, and message template rendering.
 */
package logsink.codec;
