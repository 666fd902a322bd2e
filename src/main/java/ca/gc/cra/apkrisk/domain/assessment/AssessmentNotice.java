package ca.gc.cra.apkrisk.domain.assessment;

import ca.gc.cra.apkrisk.domain.feature.OptionalFeature;
import java.util.Objects;

/**
 * Informational notice carried by an assessment.
 *
 * @param kind condition that produced the notice
 * @param subject feature label or stream the notice refers to
 * @param message human-readable message
 * @since 0.1.0
 */
public record AssessmentNotice(NoticeKind kind, String subject, String message) {
  public AssessmentNotice {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(message, "message");
  }

  /**
   * Builds the neutral notice recorded when an optional capability is missing.
   *
   * @param feature missing capability
   * @return notice naming the dependency that would enable it
   */
  public static AssessmentNotice optionalFeatureUnavailable(OptionalFeature feature) {
    Objects.requireNonNull(feature, "feature");
    String message = "Optional feature unavailable: `" + feature.label() + "` — skipping. Install `"
        + feature.dependency() + "` to enable `" + feature.capability() + "`.";
    return new AssessmentNotice(NoticeKind.OPTIONAL_DEPENDENCY_UNAVAILABLE, feature.label(), message);
  }

  /**
   * Builds the notice recorded when the instrumentation window elapsed before the stream ended.
   *
   * @param windowMillis configured window
   * @param eventsIngested events aggregated before the cut-off
   * @return timeout notice
   */
  public static AssessmentNotice instrumentationTimeout(long windowMillis, long eventsIngested) {
    String message = "dynamic analysis truncated after " + windowMillis + " ms ("
        + eventsIngested + " events ingested)";
    return new AssessmentNotice(NoticeKind.INSTRUMENTATION_TIMEOUT, "dynamic", message);
  }
}
