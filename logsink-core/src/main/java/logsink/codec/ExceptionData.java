package logsink.codec;

import java.util.Map;

/**
 * Implemented by exceptions that carry additional key/value context. The
 * {@link ExceptionCodec} copies this data into the serialized form.
 */
public interface ExceptionData {

  /**
   * @return context data for this exception; may be empty but not {@code null}
   */
  Map<String, Object> exceptionData();
}
