package ca.gc.cra.apkrisk.application.port;

/**
 * <strong>What:</strong> Port abstracting operational metrics emission for assessment jobs.
 * <p><strong>Why:</strong> Lets the pipeline count jobs, notices and ingested events without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates; extractor calls run on a
 * worker pool.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code assess.jobs.completed},
 * {@code ingest.events.network}).</p>
 *
 * @implNote Callers must not pass {@code null} keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (milliseconds, score points); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that drops every update. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
