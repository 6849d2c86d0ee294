package logsink;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelTest {

  @Test
  void codesFollowSeverityOrder() {
    LogLevel[] levels = LogLevel.values();
    for (int i = 0; i < levels.length; i++) {
      assertEquals(i, levels[i].code());
      assertSame(levels[i], LogLevel.fromCode(i));
    }
  }

  @Test
  void unknownCodesMapToNone() {
    assertEquals(LogLevel.NONE, LogLevel.fromCode(-1));
    assertEquals(LogLevel.NONE, LogLevel.fromCode(42));
  }

  @Test
  void isAtLeast() {
    assertTrue(LogLevel.ERROR.isAtLeast(LogLevel.WARNING));
    assertTrue(LogLevel.WARNING.isAtLeast(LogLevel.WARNING));
    assertFalse(LogLevel.DEBUG.isAtLeast(LogLevel.INFORMATION));
  }
}
