package ca.gc.cra.apkrisk.application.pipeline;

import ca.gc.cra.apkrisk.application.port.InstrumentationEventSource;
import ca.gc.cra.apkrisk.application.scoring.ScoringConfig;
import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inputs for one assessment job with pre-collected static results.
 *
 * @param jobId job identifier
 * @param staticResults results keyed by extractor; extractors that never reported are absent
 * @param dynamicEvents instrumentation stream; {@link InstrumentationEventSource#EMPTY} when dynamic
 *     analysis was skipped
 * @param dynamicWindow wall-clock budget for consuming {@code dynamicEvents}
 * @param scoringConfig per-call overrides
 * @since 0.1.0
 */
public record AssessmentRequest(
    String jobId,
    Map<ExtractorId, ExtractorResult> staticResults,
    InstrumentationEventSource dynamicEvents,
    Duration dynamicWindow,
    ScoringConfig scoringConfig) {

  /** Window applied when none is supplied. */
  public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);

  public AssessmentRequest {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(staticResults, "staticResults");
    Map<ExtractorId, ExtractorResult> copy = new EnumMap<>(ExtractorId.class);
    copy.putAll(staticResults);
    staticResults = Collections.unmodifiableMap(copy);
    dynamicEvents = dynamicEvents == null ? InstrumentationEventSource.EMPTY : dynamicEvents;
    dynamicWindow = dynamicWindow == null ? DEFAULT_WINDOW : dynamicWindow;
    scoringConfig = scoringConfig == null ? ScoringConfig.EMPTY : scoringConfig;
  }

  /**
   * Creates a request with static results only, default window and no overrides.
   *
   * @param jobId job identifier
   * @param staticResults static extractor results
   * @return request
   */
  public static AssessmentRequest staticOnly(String jobId, Map<ExtractorId, ExtractorResult> staticResults) {
    return new AssessmentRequest(jobId, staticResults, null, null, null);
  }
}
