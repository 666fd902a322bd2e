package ca.gc.cra.apkrisk.application.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.apkrisk.application.port.EndpointReputation;
import ca.gc.cra.apkrisk.application.port.InstrumentationEventSource;
import ca.gc.cra.apkrisk.domain.assessment.AssessmentNotice;
import ca.gc.cra.apkrisk.domain.assessment.NoticeKind;
import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import ca.gc.cra.apkrisk.domain.metric.MetricCatalog;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import ca.gc.cra.apkrisk.infrastructure.events.ListEventSource;
import ca.gc.cra.apkrisk.testing.ManualClock;
import ca.gc.cra.apkrisk.testing.RecordingMetricsPort;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DynamicEventIngestorTest {
  private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

  private final ManualClock clock = new ManualClock(1_000L);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final EndpointReputation reputation = host -> host.equals("evil.example");
  private final DynamicEventIngestor ingestor =
      new DynamicEventIngestor(MetricCatalog.defaults(), clock, reputation, metrics);

  @Test
  void tagsMapOntoDynamicCounts() throws InterruptedException {
    List<InstrumentationEvent> events = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      events.add(InstrumentationEvent.of("PERMISSION", "android.permission.CAMERA", T0));
    }
    events.add(InstrumentationEvent.of("FILE_WRITE", "/sdcard/a.txt", T0));
    events.add(InstrumentationEvent.of("file-write", "/sdcard/b.txt", T0));
    events.add(InstrumentationEvent.of("NETWORK", "http://evil.example/beacon", T0));
    events.add(InstrumentationEvent.of("NETWORK", "https://cdn.example.org/lib.js", T0));
    events.add(InstrumentationEvent.of("CRYPTO", "AES/ECB", T0));

    DynamicIngestResult result = ingestor.ingest(new ListEventSource(events), Duration.ofMinutes(1));

    assertFalse(result.truncated());
    assertTrue(result.notices().isEmpty());
    assertEquals(8, result.eventsIngested());
    assertEquals(3.0, count(result, MetricNames.PERMISSION_INVOCATION_COUNT));
    assertEquals(2.0, count(result, MetricNames.FILE_WRITE_COUNT));
    assertEquals(1.0, count(result, MetricNames.CLEARTEXT_ENDPOINT_COUNT));
    assertEquals(1.0, count(result, MetricNames.MALICIOUS_ENDPOINT_COUNT));
    assertEquals(1.0, count(result, MetricNames.OTHER_EVENT_COUNT));
    assertEquals(3, metrics.count("ingest.events.permission"));
    assertEquals(1, metrics.count("ingest.events.unknown"));
    assertFalse(metrics.hasCounter("ingest.truncated"));
  }

  @Test
  void windowElapsingTruncatesAndRecordsNotice() throws InterruptedException {
    InstrumentationEventSource endless = new InstrumentationEventSource() {
      @Override
      public Optional<InstrumentationEvent> poll(long timeoutMillis) {
        clock.advance(100);
        return Optional.of(InstrumentationEvent.of("FILE_WRITE", "/data/cache", T0));
      }

      @Override
      public boolean exhausted() {
        return false;
      }
    };

    DynamicIngestResult result = ingestor.ingest(endless, Duration.ofMillis(250));

    assertTrue(result.truncated());
    assertEquals(3, result.eventsIngested());
    assertEquals(3.0, count(result, MetricNames.FILE_WRITE_COUNT));
    AssessmentNotice notice = result.notices().get(0);
    assertEquals(NoticeKind.INSTRUMENTATION_TIMEOUT, notice.kind());
    assertEquals("dynamic analysis truncated after 250 ms (3 events ingested)", notice.message());
    assertEquals(1, metrics.count("ingest.truncated"));
  }

  @Test
  void zeroWindowOverFinishedStreamIsNotTruncated() throws InterruptedException {
    DynamicIngestResult result = ingestor.ingest(InstrumentationEventSource.EMPTY, Duration.ZERO);

    assertFalse(result.truncated());
    assertEquals(0, result.eventsIngested());
    assertEquals(5, result.metrics().size());
    assertTrue(result.metrics().stream().allMatch(m -> m.available() && m.rawValue() == 0.0));
  }

  @Test
  void zeroWindowOverLiveStreamKeepsNothing() throws InterruptedException {
    ListEventSource source = new ListEventSource(List.of(InstrumentationEvent.of("PERMISSION", "x", T0)));

    DynamicIngestResult result = ingestor.ingest(source, Duration.ZERO);

    assertTrue(result.truncated());
    assertEquals(0.0, count(result, MetricNames.PERMISSION_INVOCATION_COUNT));
  }

  @Test
  void rejectsNegativeWindow() {
    assertThrows(IllegalArgumentException.class,
        () -> ingestor.ingest(InstrumentationEventSource.EMPTY, Duration.ofMillis(-1)));
  }

  private static double count(DynamicIngestResult result, String name) {
    return result.metrics().stream()
        .filter(m -> m.name().equals(name))
        .map(MetricValue::rawValue)
        .findFirst()
        .orElseThrow();
  }
}
