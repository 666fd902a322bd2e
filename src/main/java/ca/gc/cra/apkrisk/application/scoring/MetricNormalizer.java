package ca.gc.cra.apkrisk.application.scoring;

import ca.gc.cra.apkrisk.domain.metric.MetricSpec;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Clamps count metrics to their caps and maps every metric kind onto {@code [0, 1]}.
 *
 * <p>Counts normalize to {@code min(raw, cap) / cap} (a cap of {@code 0} yields {@code 0}); continuous values
 * map to themselves; booleans map to {@code 0} or {@code 1}. Catalog metrics absent from the input are
 * treated as measured zero. Output follows catalog declaration order.</p>
 *
 * @since 0.1.0
 */
public final class MetricNormalizer {

  /**
   * Normalizes metric values against an effective table.
   *
   * @param metrics static and dynamic metric values; names must be unique catalog entries
   * @param table effective scoring table
   * @return one normalized metric per catalog entry
   * @throws IllegalArgumentException if a metric is unknown, duplicated or of the wrong kind
   */
  public List<NormalizedMetric> normalize(List<MetricValue> metrics, ScoringTable table) {
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(table, "table");
    Map<String, MetricValue> byName = new HashMap<>();
    for (MetricValue value : metrics) {
      ScoringTable.Entry entry = table.entry(value.name())
          .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + value.name()));
      if (entry.spec().kind() != value.kind()) {
        throw new IllegalArgumentException("Metric " + value.name() + " must be " + entry.spec().kind()
            + " (was " + value.kind() + ")");
      }
      if (byName.put(value.name(), value) != null) {
        throw new IllegalArgumentException("Duplicate metric: " + value.name());
      }
    }

    List<NormalizedMetric> normalized = new ArrayList<>(table.entries().size());
    for (ScoringTable.Entry entry : table.entries()) {
      MetricSpec spec = entry.spec();
      MetricValue value = byName.get(spec.name());
      if (value == null) {
        value = new MetricValue(spec.name(), 0.0, spec.kind(), spec.source(), true);
      }
      normalized.add(new NormalizedMetric(spec, value, normalize(value, entry)));
    }
    return normalized;
  }

  /**
   * Normalizes a single value.
   *
   * @param value metric value
   * @param entry effective settings for the metric
   * @return value in {@code [0, 1]}
   */
  static double normalize(MetricValue value, ScoringTable.Entry entry) {
    if (!value.available()) {
      return 0.0;
    }
    return switch (value.kind()) {
      case COUNT -> {
        long cap = entry.cap() == null ? 0L : entry.cap();
        yield cap == 0L ? 0.0 : Math.min(value.rawValue(), cap) / cap;
      }
      case CONTINUOUS, BOOLEAN -> value.rawValue();
    };
  }
}
