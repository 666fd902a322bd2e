package ca.gc.cra.apkrisk.application.extract;

import ca.gc.cra.apkrisk.domain.assessment.AssessmentNotice;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.List;
import java.util.Objects;

/**
 * Static metrics produced by the adapter layer together with the notices it recorded.
 *
 * @param metrics one value per static catalog metric, in catalog order
 * @param notices one notice per skipped optional capability
 * @since 0.1.0
 */
public record AdaptedStaticMetrics(List<MetricValue> metrics, List<AssessmentNotice> notices) {
  public AdaptedStaticMetrics {
    metrics = List.copyOf(Objects.requireNonNull(metrics, "metrics"));
    notices = List.copyOf(Objects.requireNonNull(notices, "notices"));
  }
}
