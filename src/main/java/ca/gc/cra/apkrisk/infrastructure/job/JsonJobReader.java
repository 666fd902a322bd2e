package ca.gc.cra.apkrisk.infrastructure.job;

import ca.gc.cra.apkrisk.application.port.ClockPort;
import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import ca.gc.cra.apkrisk.infrastructure.events.EventLineParser;
import ca.gc.cra.apkrisk.infrastructure.json.JsonSupport;
import ca.gc.cra.apkrisk.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads job files describing one assessment.
 * <p><strong>Format:</strong>
 * <pre>{@code
 * {
 *   "jobId": "job-42",
 *   "static": {"manifest": {...}, "permissions": {...}, "yara": "unavailable"},
 *   "dynamic": {"windowMs": 60000, "events": [{"tag": "NETWORK", "payload": "http://x"}, "FILE_WRITE:/sdcard/a"]},
 *   "config": {"weights": {...}, "caps": {...}, "bands": {"medium": 40, "high": 70}}
 * }
 * }</pre>
 * A static entry that is a string marks the extractor unavailable with that string as reason. Unknown
 * extractor keys are logged and ignored. Events without a timestamp receive the reader clock's time.</p>
 * <p><strong>Errors:</strong> shape problems raise {@link IllegalArgumentException}; read failures raise
 * {@link IOException}.</p>
 *
 * @since 0.1.0
 */
public final class JsonJobReader {
  private static final Logger log = LoggerFactory.getLogger(JsonJobReader.class);
  private static final int MAX_JOB_ID_LENGTH = 128;

  private final JsonSupport json;
  private final ClockPort clock;

  /**
   * Creates a reader.
   *
   * @param json JSON parser
   * @param clock clock used to stamp events without a timestamp
   */
  public JsonJobReader(JsonSupport json, ClockPort clock) {
    this.json = Objects.requireNonNull(json, "json");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Reads a job file.
   *
   * @param file job JSON file
   * @return parsed job
   * @throws IOException if the file cannot be read
   */
  public JobDescription read(Path file) throws IOException {
    Object root = json.parse(file);
    String fallbackId = fileStem(file);
    return toJob(root, fallbackId);
  }

  /**
   * Parses a job document held in memory.
   *
   * @param document JSON text
   * @return parsed job
   */
  public JobDescription parse(String document) {
    return toJob(json.parse(document), null);
  }

  private JobDescription toJob(Object rootNode, String fallbackId) {
    Map<String, Object> root = asMap(rootNode, "job");
    Object idNode = root.get("jobId");
    String jobId = idNode != null ? idNode.toString() : fallbackId;
    if (jobId == null) {
      throw new IllegalArgumentException("jobId is required");
    }
    jobId = Strings.requirePrintableAscii("jobId", jobId, MAX_JOB_ID_LENGTH);

    Map<ExtractorId, ExtractorResult> results = parseStatic(root.get("static"));
    Map<String, Object> dynamic = root.get("dynamic") == null ? Map.of() : asMap(root.get("dynamic"), "dynamic");
    List<InstrumentationEvent> events = parseEvents(dynamic.get("events"));
    Duration window = parseWindow(dynamic.get("windowMs"));
    Map<String, Object> config = root.get("config") == null ? Map.of() : asMap(root.get("config"), "config");
    return new JobDescription(jobId, results, events, window, config);
  }

  private Map<ExtractorId, ExtractorResult> parseStatic(Object node) {
    Map<ExtractorId, ExtractorResult> results = new EnumMap<>(ExtractorId.class);
    if (node == null) {
      return results;
    }
    for (Map.Entry<String, Object> entry : asMap(node, "static").entrySet()) {
      ExtractorId id;
      try {
        id = ExtractorId.fromKey(entry.getKey());
      } catch (IllegalArgumentException ex) {
        log.warn("Ignoring unknown extractor '{}' in job file", entry.getKey());
        continue;
      }
      Object value = entry.getValue();
      if (value == null) {
        continue;
      }
      if (value instanceof String reason) {
        results.put(id, ExtractorResult.unavailable(reason));
      } else {
        results.put(id, ExtractorResult.present(asMap(value, "static." + entry.getKey())));
      }
    }
    return results;
  }

  private List<InstrumentationEvent> parseEvents(Object node) {
    List<InstrumentationEvent> events = new ArrayList<>();
    if (node == null) {
      return events;
    }
    if (!(node instanceof List<?> list)) {
      throw new IllegalArgumentException("dynamic.events must be a list");
    }
    Instant now = Instant.ofEpochMilli(clock.nowMillis());
    for (Object item : list) {
      if (item instanceof String line) {
        EventLineParser.parse(line, now).ifPresent(events::add);
        continue;
      }
      Map<String, Object> map = asMap(item, "event");
      Object tag = map.get("tag");
      if (tag == null) {
        throw new IllegalArgumentException("event is missing its tag");
      }
      Object payload = map.get("payload");
      events.add(InstrumentationEvent.of(
          tag.toString(), payload == null ? "" : payload.toString(), parseTimestamp(map.get("timestamp"), now)));
    }
    return events;
  }

  private static Instant parseTimestamp(Object node, Instant fallback) {
    if (node == null) {
      return fallback;
    }
    if (node instanceof Number number) {
      return Instant.ofEpochMilli(number.longValue());
    }
    try {
      return Instant.parse(node.toString().trim());
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("Invalid event timestamp: " + node, ex);
    }
  }

  private static Duration parseWindow(Object node) {
    if (node == null) {
      return null;
    }
    long millis;
    if (node instanceof Number number) {
      millis = number.longValue();
    } else {
      try {
        millis = Long.parseLong(node.toString().trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("dynamic.windowMs must be an integer", ex);
      }
    }
    if (millis < 0) {
      throw new IllegalArgumentException("dynamic.windowMs must not be negative");
    }
    return Duration.ofMillis(millis);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a JSON object");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      map.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return map;
  }

  private static String fileStem(Path file) {
    Path name = file.getFileName();
    if (name == null) {
      return null;
    }
    String text = name.toString();
    int dot = text.lastIndexOf('.');
    return dot > 0 ? text.substring(0, dot) : text;
  }
}
