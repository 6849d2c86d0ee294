package logsink;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class LogScopesTest {
  private final LogScopes scopes = new LogScopes();

  @Test
  void nestedScopesAreOutermostFirst() {
    try (LogScopes.Scope outer = scopes.begin("Request", "r-1");
         LogScopes.Scope inner = scopes.begin(Map.of("Step", 2))) {
      assertEquals(List.of(Map.of("Request", "r-1"), Map.of("Step", 2)), scopes.current());
    }
    assertTrue(scopes.current().isEmpty());
  }

  @Test
  void outOfOrderCloseRemovesTheRightScope() {
    LogScopes.Scope first = scopes.begin("a", 1);
    LogScopes.Scope second = scopes.begin("b", 2);

    first.close();
    assertEquals(List.of(Map.of("b", 2)), scopes.current());

    second.close();
    second.close();
    assertTrue(scopes.current().isEmpty());
  }

  @Test
  void scopesAreThreadConfined() throws InterruptedException {
    AtomicReference<List<Map<String, Object>>> seen = new AtomicReference<>();
    try (LogScopes.Scope scope = scopes.begin("main", true)) {
      Thread other = new Thread(() -> seen.set(scopes.current()));
      other.start();
      other.join();
    }
    assertTrue(seen.get().isEmpty());
  }

  @Test
  void valuesAreCopied() {
    HashMap<String, Object> values = new HashMap<>();
    values.put("k", "v");
    try (LogScopes.Scope scope = scopes.begin(values)) {
      values.put("k", "changed");
      assertEquals("v", scopes.current().get(0).get("k"));
    }
  }

  @Test
  void nullValueIsAllowedForSingleKey() {
    try (LogScopes.Scope scope = scopes.begin("k", null)) {
      assertTrue(scopes.current().get(0).containsKey("k"));
    }
  }

  @Test
  void rejectsNullKeyAtBegin() {
    Map<String, Object> values = new HashMap<>();
    values.put(null, "v");

    assertThrows(IllegalArgumentException.class, () -> scopes.begin(values));
    assertTrue(scopes.current().isEmpty());
  }
}
