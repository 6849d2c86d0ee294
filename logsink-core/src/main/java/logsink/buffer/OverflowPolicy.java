package logsink.buffer;

/**
 * What {@link WriteBuffer#enqueue} does when the buffer is full.
 */
public enum OverflowPolicy {
  /** Discard the incoming entry and count it. Producers never wait. */
  DROP_NEWEST,
  /** Wait for space. Producers still waiting when the buffer closes have their entry discarded. */
  BLOCK
}
