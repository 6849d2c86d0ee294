package logsink.codec;

import logsink.model.SerializedException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionCodecTest {
  private final ExceptionCodec codec = ExceptionCodec.getDefault();

  static class OrderException extends RuntimeException implements ExceptionData {
    OrderException(String message, Throwable cause) {
      super(message, cause);
    }

    @Override
    public Map<String, Object> exceptionData() {
      return Map.of("orderId", 42);
    }
  }

  @Test
  void flattenCapturesTypeMessageSourceAndCauses() {
    IllegalStateException root = new IllegalStateException("disk full");
    RuntimeException top = new RuntimeException("write failed", root);

    SerializedException flat = ExceptionCodec.flatten(top);

    assertEquals(RuntimeException.class.getName(), flat.type());
    assertEquals("write failed", flat.message());
    assertEquals(2, flat.depth());
    assertEquals(IllegalStateException.class.getName(), flat.root().type());
    assertEquals("disk full", flat.root().message());
    assertEquals(ExceptionCodecTest.class.getName(), flat.source());
    assertTrue(flat.stackTrace().startsWith("\tat "));
  }

  @Test
  void flattenNullIsNull() {
    assertNull(ExceptionCodec.flatten(null));
    assertNull(codec.encode((Throwable) null));
    assertNull(codec.encode((SerializedException) null));
  }

  @Test
  void nullMessageBecomesEmpty() {
    SerializedException flat = ExceptionCodec.flatten(new NullPointerException());

    assertEquals("", flat.message());
  }

  @Test
  void roundTripPreservesChain() {
    Exception e = new RuntimeException("outer",
        new IllegalArgumentException("middle", new IllegalStateException("inner")));

    SerializedException decoded = codec.decode(codec.encode(e));

    assertEquals(3, decoded.depth());
    assertEquals("outer", decoded.message());
    assertEquals("middle", decoded.inner().message());
    assertEquals(IllegalStateException.class.getName(), decoded.root().type());
    assertEquals(ExceptionCodec.flatten(e), decoded);
  }

  @Test
  void exceptionDataIsCarried() {
    OrderException e = new OrderException("rejected", new IllegalStateException("stock"));

    SerializedException decoded = codec.decode(codec.encode(e));

    assertEquals(42, decoded.data().get("orderId"));
    assertTrue(decoded.inner().data().isEmpty());
  }

  @Test
  void cyclicCauseChainTerminates() {
    Exception a = new Exception("a");
    Exception b = new Exception("b");
    a.initCause(b);
    b.initCause(a);

    SerializedException flat = ExceptionCodec.flatten(a);

    assertEquals(2, flat.depth());
    assertEquals("a", flat.message());
    assertEquals("b", flat.inner().message());
    assertNotNull(codec.encode(a));
  }

  @Test
  void deepChainIsCappedWhenFlattening() {
    Throwable t = new RuntimeException("level0");
    for (int i = 1; i < 100; i++) {
      t = new RuntimeException("level" + i, t);
    }

    assertEquals(ExceptionCodec.MAX_DEPTH, ExceptionCodec.flatten(t).depth());
  }

  @Test
  void deeplyNestedDocumentIsCappedWhenDecoding() {
    StringBuilder json = new StringBuilder();
    for (int i = 0; i < 100; i++) {
      json.append("{\"type\":\"T").append(i).append("\",\"message\":\"m\",\"inner\":");
    }
    json.append("null");
    for (int i = 0; i < 100; i++) {
      json.append('}');
    }

    SerializedException decoded = codec.decode(json.toString());

    assertEquals(ExceptionCodec.MAX_DEPTH, decoded.depth());
    assertEquals("T0", decoded.type());
  }

  @Test
  void decodeNullOrBlankIsNull() {
    assertNull(codec.decode(null));
    assertNull(codec.decode(""));
    assertNull(codec.decode("   "));
    assertNull(codec.decode("null"));
  }

  @Test
  void decodeDefaultsMissingFields() {
    SerializedException decoded = codec.decode("{\"message\":\"boom\"}");

    assertEquals("Unknown", decoded.type());
    assertEquals("boom", decoded.message());
    assertNull(decoded.stackTrace());
    assertNull(decoded.inner());
  }

  @Test
  void decodeRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.decode("{not json"));
    assertThrows(IllegalArgumentException.class, () -> codec.decode("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> codec.decode("\"text\""));
  }

  static class NullKeyException extends RuntimeException implements ExceptionData {
    NullKeyException() {
      super("bad data");
    }

    @Override
    public Map<String, Object> exceptionData() {
      Map<String, Object> data = new HashMap<>();
      data.put(null, "lost");
      data.put("kept", 7);
      return data;
    }
  }

  @Test
  void flattenDropsNullDataKeys() {
    SerializedException flat = ExceptionCodec.flatten(new NullKeyException());

    assertEquals(Map.of("kept", 7), flat.data());
    SerializedException decoded = codec.decode(codec.encode(flat));
    assertEquals(7, decoded.data().get("kept"));
  }

  @Test
  void serializedExceptionRejectsNullDataKeys() {
    Map<String, Object> data = new HashMap<>();
    data.put(null, 1);

    assertThrows(IllegalArgumentException.class,
        () -> new SerializedException("java.lang.Exception", "m", null, null, data, null));
  }
}
