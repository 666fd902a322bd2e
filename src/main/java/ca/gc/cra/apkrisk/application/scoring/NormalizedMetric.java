package ca.gc.cra.apkrisk.application.scoring;

import ca.gc.cra.apkrisk.domain.metric.MetricSpec;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.Objects;

/**
 * Metric value mapped onto {@code [0, 1]} against its effective cap.
 *
 * @param spec catalog entry
 * @param value original metric value
 * @param normalized value in {@code [0, 1]}; {@code 0} when unavailable
 * @since 0.1.0
 */
public record NormalizedMetric(MetricSpec spec, MetricValue value, double normalized) {
  public NormalizedMetric {
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(value, "value");
    if (normalized < 0.0 || normalized > 1.0 || Double.isNaN(normalized)) {
      throw new IllegalArgumentException("normalized value out of range for " + spec.name() + ": " + normalized);
    }
  }

  public String name() {
    return spec.name();
  }

  public boolean available() {
    return value.available();
  }
}
