package ca.gc.cra.apkrisk.domain.metric;

/**
 * Value shape of a risk metric, which determines how it is normalized before weighting.
 *
 * @since 0.1.0
 */
public enum MetricKind {
  /** Ratio already confined to {@code [0, 1]}. */
  CONTINUOUS,
  /** Non-negative integer count; normalized against a cap. */
  COUNT,
  /** Presence flag mapped to {@code 0} or {@code 1}. */
  BOOLEAN
}
