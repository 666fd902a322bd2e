/**
 * Metrics adapters: OpenTelemetry export of pipeline counters and latency histograms.
 *
 * @since 0.1.0
 */
package ca.gc.cra.apkrisk.infrastructure.metrics;
