package logsink;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlobalContextMiddlewareTest {

  @Test
  void addsMissingKeysOnly() {
    GlobalContextMiddleware context = new GlobalContextMiddleware()
        .put("App", "billing")
        .put("Region", "eu");
    LogEntry entry = LogEntry.builder(LogLevel.INFORMATION)
        .messageTemplate("Started")
        .parameter("Region", "us")
        .build();

    LogEntry result = context.apply(entry);

    assertEquals("billing", result.parameters().get("App"));
    assertEquals("us", result.parameters().get("Region"));
    assertEquals("Started", result.renderedMessage());
  }

  @Test
  void rerendersWhenTemplateUsesContextKey() {
    GlobalContextMiddleware context = new GlobalContextMiddleware().put("App", "billing");
    LogEntry entry = LogEntry.builder(LogLevel.INFORMATION)
        .messageTemplate("{App} started in {Ms} ms")
        .parameter("Ms", 12)
        .build();
    assertEquals("MissingMsgParam started in 12 ms", entry.renderedMessage());

    assertEquals("billing started in 12 ms", context.apply(entry).renderedMessage());
  }

  @Test
  void emptyContextReturnsSameEntry() {
    GlobalContextMiddleware context = new GlobalContextMiddleware();
    LogEntry entry = LogEntry.builder(LogLevel.INFORMATION).build();

    assertSame(entry, context.apply(entry));
  }

  @Test
  void putNullRemovesKey() {
    GlobalContextMiddleware context = new GlobalContextMiddleware().put("a", 1).put("b", 2);
    context.put("a", null);
    context.remove("missing");

    assertEquals(Map.of("b", 2), context.snapshot());
    context.clear();
    assertTrue(context.snapshot().isEmpty());
  }
}
