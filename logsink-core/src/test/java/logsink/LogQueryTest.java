package logsink;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LogQueryTest {

  @Test
  void allHasNoFilters() {
    LogQuery query = LogQuery.all();

    assertNull(query.minLevel());
    assertNull(query.category());
    assertEquals(0, query.offset());
    assertEquals(0, query.limit());
    assertFalse(query.descending());
  }

  @Test
  void rejectsNegativePaging() {
    assertThrows(IllegalArgumentException.class, () -> LogQuery.builder().offset(-1).build());
    assertThrows(IllegalArgumentException.class, () -> LogQuery.builder().limit(-1).build());
  }

  @Test
  void rejectsInvertedRange() {
    Instant now = Instant.now();
    assertThrows(IllegalArgumentException.class, () ->
        LogQuery.builder().from(now).to(now.minusSeconds(1)).build());
    assertDoesNotThrow(() -> LogQuery.builder().from(now).to(now).build());
  }
}
