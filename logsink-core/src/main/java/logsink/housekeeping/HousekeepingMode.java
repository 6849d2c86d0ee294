package logsink.housekeeping;

/**
 * Whether rows are deleted only on request or also by a background sweep.
 */
public enum HousekeepingMode {
  /** Rows are deleted only by explicit calls. No background thread is started. */
  MANUAL,
  /** A background sweep applies the retention rules at a fixed interval. */
  AUTOMATIC
}
