package ca.gc.cra.apkrisk.application.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Combines normalized metrics and effective weights into a 0-100 score.
 * <p><strong>Unavailable metrics:</strong> excluded from the sum and from the breakdown. Their weight is
 * redistributed proportionally over the available metrics:
 * {@code effectiveWeight = weight * (totalWeight / availableWeight)}. When nothing is available the score
 * is {@code 0}.</p>
 * <p><strong>Rounding:</strong> {@code round_half_up(clamp(raw * 100, 0, 100))}; breakdown values are score
 * points rounded half-up to two decimals.</p>
 * <p><strong>Thread-safety:</strong> Stateless pure function; identical inputs yield identical output.</p>
 *
 * @since 0.1.0
 */
public final class WeightedScoringEngine {

  /**
   * Scores normalized metrics.
   *
   * @param metrics normalized metrics in catalog order
   * @param table effective table the metrics were normalized against
   * @return score, contributions and breakdown
   */
  public ScoreResult score(List<NormalizedMetric> metrics, ScoringTable table) {
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(table, "table");

    double availableWeight = 0.0;
    for (NormalizedMetric metric : metrics) {
      if (metric.available()) {
        availableWeight += weightOf(table, metric);
      }
    }
    double factor = availableWeight > 0.0 ? table.totalWeight() / availableWeight : 0.0;

    List<ScoreResult.Contribution> contributions = new ArrayList<>();
    Map<String, Double> breakdown = new LinkedHashMap<>();
    double raw = 0.0;
    for (NormalizedMetric metric : metrics) {
      if (!metric.available()) {
        continue;
      }
      double effectiveWeight = weightOf(table, metric) * factor;
      double contribution = effectiveWeight * metric.normalized();
      raw += contribution;
      contributions.add(new ScoreResult.Contribution(metric, effectiveWeight, contribution));
      breakdown.put(metric.name(), roundHalfUp(contribution * 100.0, 2));
    }

    double scaled = Math.max(0.0, Math.min(100.0, raw * 100.0));
    int score = (int) roundHalfUp(scaled, 0);
    return new ScoreResult(score, raw, contributions, breakdown);
  }

  private static double weightOf(ScoringTable table, NormalizedMetric metric) {
    return table.entry(metric.name())
        .orElseThrow(() -> new IllegalArgumentException("Metric not in scoring table: " + metric.name()))
        .weight();
  }

  static double roundHalfUp(double value, int scale) {
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
  }
}
