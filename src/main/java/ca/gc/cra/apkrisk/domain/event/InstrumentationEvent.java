package ca.gc.cra.apkrisk.domain.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Tagged behavioral observation emitted by an instrumentation hook.
 *
 * <p>Events are consumed once by the ingestor and are not retained after aggregation.</p>
 *
 * @param tag classified category; never {@code null}
 * @param rawTag tag string exactly as emitted by the hook; never {@code null}
 * @param payload event detail such as a permission name, URL, or file path; never {@code null}
 * @param timestamp observation time; never {@code null}
 * @since 0.1.0
 */
public record InstrumentationEvent(EventTag tag, String rawTag, String payload, Instant timestamp) {

  /**
   * Validates required fields.
   */
  public InstrumentationEvent {
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(rawTag, "rawTag");
    payload = payload == null ? "" : payload;
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /**
   * Builds an event from a raw hook tag, classifying it into {@link EventTag}.
   *
   * @param rawTag tag string from the hook
   * @param payload event detail
   * @param timestamp observation time
   * @return classified event
   */
  public static InstrumentationEvent of(String rawTag, String payload, Instant timestamp) {
    String tag = rawTag == null ? "" : rawTag.trim();
    return new InstrumentationEvent(EventTag.fromRaw(tag), tag, payload, timestamp);
  }
}
