package ca.gc.cra.apkrisk.infrastructure.events;

import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses the {@code TAG:payload} lines written by instrumentation hooks.
 *
 * <p>The tag is everything before the first colon; the payload is the remainder, so URLs keep their
 * own colons. Blank lines and lines starting with {@code #} are skipped.</p>
 *
 * @since 0.1.0
 */
public final class EventLineParser {
  private EventLineParser() {}

  /**
   * Parses one hook line.
   *
   * @param line raw line; may be {@code null}
   * @param timestamp time to attach to the event
   * @return event, or empty for blank and comment lines
   */
  public static Optional<InstrumentationEvent> parse(String line, Instant timestamp) {
    if (line == null) {
      return Optional.empty();
    }
    String trimmed = line.strip();
    if (trimmed.isEmpty() || trimmed.startsWith("#")) {
      return Optional.empty();
    }
    int colon = trimmed.indexOf(':');
    if (colon < 0) {
      return Optional.of(InstrumentationEvent.of(trimmed, "", timestamp));
    }
    return Optional.of(InstrumentationEvent.of(
        trimmed.substring(0, colon), trimmed.substring(colon + 1).strip(), timestamp));
  }

  /**
   * Reads every event from a hook log file.
   *
   * @param file UTF-8 text file of {@code TAG:payload} lines
   * @param timestamp time attached to every event, since hook logs carry no per-line time
   * @return events in file order
   * @throws IOException if the file cannot be read
   */
  public static List<InstrumentationEvent> readAll(Path file, Instant timestamp) throws IOException {
    List<InstrumentationEvent> events = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        parse(line, timestamp).ifPresent(events::add);
      }
    }
    return events;
  }
}
