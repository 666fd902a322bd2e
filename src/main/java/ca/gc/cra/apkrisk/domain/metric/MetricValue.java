package ca.gc.cra.apkrisk.domain.metric;

import java.util.Objects;

/**
 * Typed measurement produced by an extractor adapter or the dynamic ingestor.
 *
 * <p><strong>Invariants:</strong> continuous values are clamped to {@code [0, 1]}; counts are
 * non-negative integers; booleans are stored as {@code 0} or {@code 1}. Unavailable metrics carry a raw
 * value of {@code 0} and are excluded from scoring.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param name catalog metric name; never blank
 * @param rawValue measured value in the metric's native scale
 * @param kind value shape; never {@code null}
 * @param source static or dynamic origin; never {@code null}
 * @param available {@code false} when the backing extractor could not run
 * @since 0.1.0
 */
public record MetricValue(
    String name, double rawValue, MetricKind kind, MetricSource source, boolean available) {

  /**
   * Validates the name and enforces the per-kind value invariants.
   */
  public MetricValue {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("metric name must not be blank");
    }
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(source, "source");
    if (Double.isNaN(rawValue) || Double.isInfinite(rawValue)) {
      throw new IllegalArgumentException("metric " + name + " must be finite (was " + rawValue + ")");
    }
    if (!available) {
      rawValue = 0.0;
    } else {
      rawValue = switch (kind) {
        case CONTINUOUS -> Math.max(0.0, Math.min(1.0, rawValue));
        case COUNT -> requireCount(name, rawValue);
        case BOOLEAN -> rawValue != 0.0 ? 1.0 : 0.0;
      };
    }
  }

  /**
   * Creates an available continuous metric, clamping the value into {@code [0, 1]}.
   *
   * @param name metric name
   * @param source metric origin
   * @param value ratio to record
   * @return metric value
   */
  public static MetricValue continuous(String name, MetricSource source, double value) {
    return new MetricValue(name, value, MetricKind.CONTINUOUS, source, true);
  }

  /**
   * Creates an available count metric.
   *
   * @param name metric name
   * @param source metric origin
   * @param count non-negative count
   * @return metric value
   * @throws IllegalArgumentException when {@code count} is negative
   */
  public static MetricValue count(String name, MetricSource source, long count) {
    return new MetricValue(name, count, MetricKind.COUNT, source, true);
  }

  /**
   * Creates an available boolean metric.
   *
   * @param name metric name
   * @param source metric origin
   * @param flag flag value
   * @return metric value holding {@code 1} for {@code true}
   */
  public static MetricValue flag(String name, MetricSource source, boolean flag) {
    return new MetricValue(name, flag ? 1.0 : 0.0, MetricKind.BOOLEAN, source, true);
  }

  /**
   * Creates the unavailable placeholder for a catalog metric.
   *
   * @param spec catalog entry whose extractor could not run
   * @return unavailable metric value
   */
  public static MetricValue unavailable(MetricSpec spec) {
    Objects.requireNonNull(spec, "spec");
    return new MetricValue(spec.name(), 0.0, spec.kind(), spec.source(), false);
  }

  /**
   * Returns the raw value as a boolean; meaningful for {@link MetricKind#BOOLEAN} metrics.
   *
   * @return {@code true} when the stored value is {@code 1}
   */
  public boolean asFlag() {
    return rawValue != 0.0;
  }

  private static double requireCount(String name, double value) {
    if (value < 0) {
      throw new IllegalArgumentException("count metric " + name + " must be non-negative (was " + value + ")");
    }
    if (value != Math.rint(value)) {
      throw new IllegalArgumentException("count metric " + name + " must be an integer (was " + value + ")");
    }
    return value;
  }
}
