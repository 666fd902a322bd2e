package ca.gc.cra.apkrisk.application.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of the weighted scoring engine.
 *
 * @param score final score in {@code [0, 100]}
 * @param rawScore unrounded weighted sum in {@code [0, 1]} before scaling
 * @param contributions per-metric contributions of available metrics, in catalog order
 * @param breakdown contribution in score points rounded to two decimals, in catalog order
 * @since 0.1.0
 */
public record ScoreResult(
    int score, double rawScore, List<Contribution> contributions, Map<String, Double> breakdown) {

  /**
   * Weighted contribution of one available metric.
   *
   * @param metric normalized metric
   * @param effectiveWeight configured weight scaled by the redistribution factor
   * @param contribution {@code effectiveWeight * normalized}, on the {@code [0, 1]} scale
   */
  public record Contribution(NormalizedMetric metric, double effectiveWeight, double contribution) {
    public Contribution {
      Objects.requireNonNull(metric, "metric");
    }

    public String name() {
      return metric.name();
    }
  }

  public ScoreResult {
    contributions = List.copyOf(Objects.requireNonNull(contributions, "contributions"));
    breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(breakdown, "breakdown")));
  }
}
