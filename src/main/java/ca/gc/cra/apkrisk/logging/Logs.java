package ca.gc.cra.apkrisk.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that keep instrumentation payloads readable and safe in logs.
 * <p><strong>Why:</strong> Hook payloads can be large and URLs may carry credentials or tokens in their
 * query string.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }

  /**
   * Masks user-info and query components of a URL-like payload.
   *
   * @param payload event payload, possibly a URL
   * @return payload with {@code user:pass@} and {@code ?query} replaced by a placeholder
   */
  public static String redactUrl(String payload) {
    if (payload == null) {
      return NULL_PLACEHOLDER;
    }
    String result = payload;
    int schemeEnd = result.indexOf("://");
    if (schemeEnd >= 0) {
      int authorityStart = schemeEnd + 3;
      int at = result.indexOf('@', authorityStart);
      int slash = result.indexOf('/', authorityStart);
      if (at >= 0 && (slash < 0 || at < slash)) {
        result = result.substring(0, authorityStart) + REDACTED_PLACEHOLDER + result.substring(at);
      }
    }
    int query = result.indexOf('?');
    if (query >= 0) {
      result = result.substring(0, query + 1) + REDACTED_PLACEHOLDER;
    }
    return result;
  }
}
