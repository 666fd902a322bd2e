package ca.gc.cra.apkrisk.application.ingest;

import ca.gc.cra.apkrisk.application.port.ClockPort;
import ca.gc.cra.apkrisk.application.port.EndpointReputation;
import ca.gc.cra.apkrisk.application.port.InstrumentationEventSource;
import ca.gc.cra.apkrisk.application.port.MetricsPort;
import ca.gc.cra.apkrisk.domain.assessment.AssessmentNotice;
import ca.gc.cra.apkrisk.domain.event.EventTag;
import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import ca.gc.cra.apkrisk.domain.metric.MetricCatalog;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricSpec;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import ca.gc.cra.apkrisk.logging.Logs;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Aggregates a time-bounded instrumentation stream into dynamic count metrics.
 * <p><strong>Why:</strong> Sandbox runs may hang or be cut short; the assessment must still complete with
 * whatever behavior was observed.</p>
 * <p><strong>Role:</strong> Application service invoked by the pipeline while {@code COLLECTING}.</p>
 * <p><strong>Aggregation:</strong>
 * <ul>
 *   <li>{@code PERMISSION} counts a runtime permission invocation.</li>
 *   <li>{@code NETWORK} counts a cleartext endpoint when the payload scheme is cleartext, and a malicious
 *   endpoint when {@link EndpointReputation} flags the host. One event may count as both.</li>
 *   <li>{@code FILE_WRITE} counts a file write.</li>
 *   <li>Anything else counts as an unclassified event.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; each call consumes its own source.</p>
 * <p><strong>Observability:</strong> Emits {@code ingest.events.<tag>} and {@code ingest.truncated}.</p>
 *
 * @since 0.1.0
 */
public final class DynamicEventIngestor {
  private static final Logger log = LoggerFactory.getLogger(DynamicEventIngestor.class);
  private static final int MAX_LOGGED_PAYLOAD_BYTES = 256;
  /** Upper bound for a single blocking poll so the deadline is re-checked regularly. */
  static final long MAX_POLL_MILLIS = 250L;

  private final MetricCatalog catalog;
  private final ClockPort clock;
  private final EndpointReputation reputation;
  private final MetricsPort metrics;

  /**
   * Creates an ingestor.
   *
   * @param catalog catalog listing the dynamic metrics to emit
   * @param clock clock used to enforce the window
   * @param reputation threat intelligence lookup for network hosts
   * @param metrics operational metrics sink
   */
  public DynamicEventIngestor(
      MetricCatalog catalog, ClockPort clock, EndpointReputation reputation, MetricsPort metrics) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.reputation = Objects.requireNonNull(reputation, "reputation");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Consumes events until the source is exhausted or the window elapses.
   *
   * @param source event stream; consumed once
   * @param window wall-clock budget for the stream; must not be negative
   * @return dynamic metrics plus truncation details
   * @throws InterruptedException if interrupted while waiting for events
   */
  public DynamicIngestResult ingest(InstrumentationEventSource source, Duration window)
      throws InterruptedException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(window, "window");
    if (window.isNegative()) {
      throw new IllegalArgumentException("window must not be negative");
    }
    long windowMillis = window.toMillis();
    long deadline = clock.nowMillis() + windowMillis;
    Map<String, Long> counts = new HashMap<>();
    long ingested = 0;
    boolean truncated = false;

    while (!source.exhausted()) {
      long remaining = deadline - clock.nowMillis();
      if (remaining <= 0) {
        truncated = true;
        break;
      }
      Optional<InstrumentationEvent> next = source.poll(Math.min(remaining, MAX_POLL_MILLIS));
      if (next.isPresent()) {
        aggregate(next.get(), counts);
        ingested++;
      }
    }

    List<AssessmentNotice> notices = new ArrayList<>();
    if (truncated) {
      AssessmentNotice notice = AssessmentNotice.instrumentationTimeout(windowMillis, ingested);
      notices.add(notice);
      metrics.increment("ingest.truncated");
      log.warn("Instrumentation window of {} ms elapsed before the event stream ended; {} events kept",
          windowMillis, ingested);
    } else {
      log.debug("Ingested {} instrumentation events", ingested);
    }

    List<MetricValue> values = new ArrayList<>();
    for (MetricSpec spec : catalog.forSource(MetricSource.DYNAMIC)) {
      values.add(MetricValue.count(spec.name(), MetricSource.DYNAMIC, counts.getOrDefault(spec.name(), 0L)));
    }
    return new DynamicIngestResult(values, ingested, truncated, notices);
  }

  private void aggregate(InstrumentationEvent event, Map<String, Long> counts) {
    EventTag tag = event.tag();
    metrics.increment("ingest.events." + tag.name().toLowerCase(Locale.ROOT));
    if (log.isDebugEnabled()) {
      log.debug("Event {} ({}): {}", tag, event.rawTag(),
          Logs.truncate(Logs.redactUrl(event.payload()), MAX_LOGGED_PAYLOAD_BYTES));
    }
    switch (tag) {
      case PERMISSION -> bump(counts, MetricNames.PERMISSION_INVOCATION_COUNT);
      case FILE_WRITE -> bump(counts, MetricNames.FILE_WRITE_COUNT);
      case NETWORK -> {
        if (EndpointClassifier.isCleartext(event.payload())) {
          bump(counts, MetricNames.CLEARTEXT_ENDPOINT_COUNT);
        }
        Optional<String> host = EndpointClassifier.host(event.payload());
        if (host.isPresent() && reputation.isMalicious(host.get())) {
          bump(counts, MetricNames.MALICIOUS_ENDPOINT_COUNT);
          log.info("Connection to flagged endpoint {}", host.get());
        }
      }
      case UNKNOWN -> bump(counts, MetricNames.OTHER_EVENT_COUNT);
    }
  }

  private static void bump(Map<String, Long> counts, String metric) {
    counts.merge(metric, 1L, Long::sum);
  }
}
