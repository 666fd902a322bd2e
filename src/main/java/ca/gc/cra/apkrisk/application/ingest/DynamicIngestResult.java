package ca.gc.cra.apkrisk.application.ingest;

import ca.gc.cra.apkrisk.domain.assessment.AssessmentNotice;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.List;
import java.util.Objects;

/**
 * Dynamic metrics aggregated from one instrumentation stream.
 *
 * @param metrics one available value per dynamic catalog metric, in catalog order
 * @param eventsIngested number of events consumed before the stream ended or the window elapsed
 * @param truncated {@code true} when the window elapsed before the stream was exhausted
 * @param notices timeout notice when truncated; otherwise empty
 * @since 0.1.0
 */
public record DynamicIngestResult(
    List<MetricValue> metrics, long eventsIngested, boolean truncated, List<AssessmentNotice> notices) {
  public DynamicIngestResult {
    metrics = List.copyOf(Objects.requireNonNull(metrics, "metrics"));
    notices = List.copyOf(Objects.requireNonNull(notices, "notices"));
    if (eventsIngested < 0) {
      throw new IllegalArgumentException("eventsIngested must be non-negative");
    }
  }
}
