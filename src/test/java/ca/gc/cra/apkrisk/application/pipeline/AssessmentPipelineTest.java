package ca.gc.cra.apkrisk.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.apkrisk.application.extract.ExtractorAdapterLayer;
import ca.gc.cra.apkrisk.application.ingest.DynamicEventIngestor;
import ca.gc.cra.apkrisk.application.port.EndpointReputation;
import ca.gc.cra.apkrisk.application.port.FeatureProbe;
import ca.gc.cra.apkrisk.application.port.InstrumentationEventSource;
import ca.gc.cra.apkrisk.application.scoring.ScoringConfig;
import ca.gc.cra.apkrisk.domain.assessment.AssessmentNotice;
import ca.gc.cra.apkrisk.domain.assessment.NoticeKind;
import ca.gc.cra.apkrisk.domain.assessment.RiskAssessment;
import ca.gc.cra.apkrisk.domain.assessment.RiskLevel;
import ca.gc.cra.apkrisk.domain.error.ConfigurationException;
import ca.gc.cra.apkrisk.domain.error.MandatoryExtractorMissingException;
import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import ca.gc.cra.apkrisk.domain.feature.FeatureAvailability;
import ca.gc.cra.apkrisk.domain.feature.OptionalFeature;
import ca.gc.cra.apkrisk.domain.metric.MetricCatalog;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.infrastructure.events.ListEventSource;
import ca.gc.cra.apkrisk.testing.Findings;
import ca.gc.cra.apkrisk.testing.ManualClock;
import ca.gc.cra.apkrisk.testing.RecordingMetricsPort;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class AssessmentPipelineTest {
  private static final List<String> HAPPY_PATH = List.of(
      "COLLECTING->NORMALIZING", "NORMALIZING->SCORING", "SCORING->DONE");

  @TempDir Path apk;

  private final MetricCatalog catalog = MetricCatalog.defaults();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final RecordingJobStatusListener listener = new RecordingJobStatusListener();
  private final ManualClock clock = new ManualClock(0L);

  @Test
  void permissionDensityAloneDrivesTheScore() throws Exception {
    RiskAssessment assessment = pipeline(FeatureProbe.ALL_AVAILABLE)
        .assess(AssessmentRequest.staticOnly("job-a", Findings.clean(0.6)));

    assertEquals(14, assessment.score());
    assertEquals(RiskLevel.LOW, assessment.level());
    assertEquals(1, assessment.rationale().size());
    assertEquals(MetricNames.PERMISSION_DENSITY, assessment.rationale().get(0).metricName());
    assertTrue(assessment.notices().isEmpty());
    assertFalse(assessment.dynamicTruncated());
    assertEquals(transitions("job-a", HAPPY_PATH), listener.transitions);
    assertEquals(1, metrics.count("assess.jobs.completed"));
    assertEquals(List.of(14L), metrics.observed("assess.score"));
    assertNull(MDC.get("jobId"));
  }

  @Test
  void unavailableYaraEngineStillCompletesWithNotice() throws Exception {
    FeatureProbe noYara = () -> FeatureAvailability.allAvailable().without(OptionalFeature.YARA_ENGINE);

    RiskAssessment assessment = pipeline(noYara)
        .assess(AssessmentRequest.staticOnly("job-d", Findings.clean(0.6)));

    assertEquals(transitions("job-d", HAPPY_PATH), listener.transitions);
    assertEquals(1, assessment.notices().size());
    AssessmentNotice notice = assessment.notices().get(0);
    assertEquals(NoticeKind.OPTIONAL_DEPENDENCY_UNAVAILABLE, notice.kind());
    assertEquals("yara", notice.subject());
    assertFalse(assessment.breakdown().containsKey(MetricNames.YARA_MATCH_COUNT));
    assertTrue(assessment.breakdown().containsKey(MetricNames.HARDCODED_SECRET_COUNT));
    assertEquals(14, assessment.score());
    assertEquals(1, metrics.count("assess.notices.optional"));
  }

  @Test
  void missingMandatoryExtractorFailsDuringCollection() {
    Map<ExtractorId, ExtractorResult> results = Findings.clean(0.6);
    results.remove(ExtractorId.MANIFEST);

    MandatoryExtractorMissingException ex = assertThrows(MandatoryExtractorMissingException.class,
        () -> pipeline(FeatureProbe.ALL_AVAILABLE).assess(AssessmentRequest.staticOnly("job-m", results)));

    assertEquals(List.of("job-m:COLLECTING->FAILED"), listener.transitions);
    assertEquals(List.of(ex), listener.failures);
    assertEquals(1, metrics.count("assess.jobs.failed"));
    assertEquals(0, metrics.count("assess.jobs.completed"));
  }

  @Test
  void unknownOverrideMetricFailsBeforeEventsAreRead() {
    Instant now = Instant.parse("2024-05-01T00:00:00Z");
    CountingEventSource events = new CountingEventSource(new ListEventSource(List.of(
        InstrumentationEvent.of("PERMISSION", "android.permission.READ_SMS", now),
        InstrumentationEvent.of("FILE_WRITE", "/sdcard/a", now),
        InstrumentationEvent.of("NETWORK", "http://tracker.example/collect", now))));
    AssessmentRequest request = new AssessmentRequest("job-c", Findings.clean(0.6), events, Duration.ofSeconds(30),
        new ScoringConfig(Map.of("battery_drain", 0.2), Map.of(), Map.of()));

    assertThrows(ConfigurationException.class, () -> pipeline(FeatureProbe.ALL_AVAILABLE).assess(request));

    assertEquals(0, events.polls);
    assertEquals(transitions("job-c", List.of("COLLECTING->FAILED")), listener.transitions);
    assertEquals(1, listener.failures.size());
    assertEquals(1, metrics.count("assess.jobs.failed"));
  }

  @Test
  void extractorsAndEventsFeedOneAssessment() throws Exception {
    Instant now = Instant.parse("2024-05-01T00:00:00Z");
    ListEventSource events = new ListEventSource(List.of(
        InstrumentationEvent.of("PERMISSION", "android.permission.READ_SMS", now),
        InstrumentationEvent.of("NETWORK", "http://tracker.example/collect", now)));

    RiskAssessment assessment = pipeline(FeatureProbe.ALL_AVAILABLE).assess(
        "job-x", apk, FixedExtractor.from(Findings.worstCase()), events, Duration.ofSeconds(30), null);

    assertEquals(RiskLevel.HIGH, assessment.level());
    assertTrue(assessment.score() >= 70);
    assertTrue(assessment.breakdown().get(MetricNames.CLEARTEXT_ENDPOINT_COUNT) > 0.0);
    assertTrue(assessment.breakdown().get(MetricNames.PERMISSION_INVOCATION_COUNT) > 0.0);
    assertEquals(transitions("job-x", HAPPY_PATH), listener.transitions);
  }

  @Test
  void sameInputsProduceSameAssessment() throws Exception {
    AssessmentPipeline pipeline = pipeline(FeatureProbe.ALL_AVAILABLE);

    RiskAssessment first = pipeline.assess(AssessmentRequest.staticOnly("job-r", Findings.worstCase()));
    RiskAssessment second = pipeline.assess(AssessmentRequest.staticOnly("job-r", Findings.worstCase()));

    assertEquals(first, second);
  }

  private AssessmentPipeline pipeline(FeatureProbe probe) {
    return new AssessmentPipeline(
        catalog,
        ExtractorAdapterLayer.withDefaultAdapters(catalog),
        new DynamicEventIngestor(catalog, clock, EndpointReputation.NONE, metrics),
        new StaticExtractionCoordinator(Executors::newFixedThreadPool, 4, Duration.ofSeconds(5), metrics),
        probe,
        listener,
        metrics,
        clock);
  }

  private static List<String> transitions(String jobId, List<String> steps) {
    return steps.stream().map(step -> jobId + ":" + step).toList();
  }

  private static final class CountingEventSource implements InstrumentationEventSource {
    private final InstrumentationEventSource delegate;
    private int polls;

    CountingEventSource(InstrumentationEventSource delegate) {
      this.delegate = delegate;
    }

    @Override
    public Optional<InstrumentationEvent> poll(long timeoutMillis) throws InterruptedException {
      polls++;
      return delegate.poll(timeoutMillis);
    }

    @Override
    public boolean exhausted() {
      return delegate.exhausted();
    }
  }
}
