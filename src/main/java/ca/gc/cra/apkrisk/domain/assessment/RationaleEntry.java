package ca.gc.cra.apkrisk.domain.assessment;

import java.util.Objects;

/**
 * One ranked driver of a risk score.
 *
 * @param metricName catalog metric name
 * @param share fraction of the raw score attributable to this metric, in {@code [0, 1]}
 * @param weightedContribution contribution in score points
 * @param explanation human-readable line
 * @since 0.1.0
 */
public record RationaleEntry(
    String metricName, double share, double weightedContribution, String explanation) {
  public RationaleEntry {
    Objects.requireNonNull(metricName, "metricName");
    Objects.requireNonNull(explanation, "explanation");
  }
}
