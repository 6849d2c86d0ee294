package logsink.buffer;

import logsink.retry.ExponentialBackoffRetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BatchingOptionsTest {

  @Test
  void defaults() {
    BatchingOptions options = BatchingOptions.defaults();

    assertEquals(100, options.maxBatchSize());
    assertEquals(Duration.ofMillis(500), options.maxWaitTime());
    assertEquals(1000, options.queueCapacity());
    assertEquals(OverflowPolicy.DROP_NEWEST, options.overflowPolicy());
    assertEquals(3, options.maxWriteAttempts());
    assertEquals(Duration.ofSeconds(5), options.shutdownTimeout());
    assertInstanceOf(ExponentialBackoffRetryPolicy.class, options.retryPolicy());
  }

  @Test
  void rejectsZeroBatchSize() {
    assertThrows(IllegalArgumentException.class, () ->
        BatchingOptions.builder().maxBatchSize(0).build());
  }

  @Test
  void rejectsZeroQueueCapacity() {
    assertThrows(IllegalArgumentException.class, () ->
        BatchingOptions.builder().queueCapacity(0).build());
  }

  @Test
  void rejectsNonPositiveWaitTime() {
    assertThrows(IllegalArgumentException.class, () ->
        BatchingOptions.builder().maxWaitTime(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () ->
        BatchingOptions.builder().maxWaitTime(Duration.ofMillis(-1)).build());
  }

  @Test
  void rejectsZeroWriteAttempts() {
    assertThrows(IllegalArgumentException.class, () ->
        BatchingOptions.builder().maxWriteAttempts(0).build());
  }

  @Test
  void rejectsNegativeShutdownTimeout() {
    assertThrows(IllegalArgumentException.class, () ->
        BatchingOptions.builder().shutdownTimeout(Duration.ofSeconds(-1)).build());
  }

  @Test
  void rejectsNullOverflowPolicy() {
    assertThrows(NullPointerException.class, () ->
        BatchingOptions.builder().overflowPolicy(null).build());
  }
}
