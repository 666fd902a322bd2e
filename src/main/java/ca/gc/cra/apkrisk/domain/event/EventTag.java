package ca.gc.cra.apkrisk.domain.event;

import java.util.Locale;

/**
 * Closed set of instrumentation event categories understood by the ingestor.
 *
 * <p>Hook scripts emit free-form tag strings; {@link #fromRaw(String)} maps them once at the ingestion
 * boundary. Anything unrecognised becomes {@link #UNKNOWN} rather than an error.</p>
 *
 * @since 0.1.0
 */
public enum EventTag {
  /** A runtime permission check or protected API invocation. */
  PERMISSION,
  /** An outbound network connection or request. */
  NETWORK,
  /** A write to the device file system. */
  FILE_WRITE,
  /** Any tag the ingestor does not classify. */
  UNKNOWN;

  /**
   * Maps a raw hook tag to a known category.
   *
   * @param raw tag string such as {@code PERMISSION} or {@code file_write}; may be {@code null}
   * @return matching tag, or {@link #UNKNOWN}
   */
  public static EventTag fromRaw(String raw) {
    if (raw == null) {
      return UNKNOWN;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    return switch (normalized) {
      case "PERMISSION" -> PERMISSION;
      case "NETWORK" -> NETWORK;
      case "FILE_WRITE" -> FILE_WRITE;
      default -> UNKNOWN;
    };
  }
}
