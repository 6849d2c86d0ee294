/**
 * Retention: on-demand and scheduled deletion of old log rows.
 *
 * @see logsink.housekeeping.Housekeeper
 */
package logsink.housekeeping;
