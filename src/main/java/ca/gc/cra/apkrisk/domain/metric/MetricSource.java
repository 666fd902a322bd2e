package ca.gc.cra.apkrisk.domain.metric;

/**
 * Origin of a metric measurement.
 *
 * @since 0.1.0
 */
public enum MetricSource {
  /** Derived from inspecting the decompiled package without executing it. */
  STATIC,
  /** Derived from behavior observed during sandboxed execution. */
  DYNAMIC
}
