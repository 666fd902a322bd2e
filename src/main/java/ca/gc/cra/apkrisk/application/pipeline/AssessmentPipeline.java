package ca.gc.cra.apkrisk.application.pipeline;

import ca.gc.cra.apkrisk.application.extract.AdaptedStaticMetrics;
import ca.gc.cra.apkrisk.application.extract.ExtractorAdapterLayer;
import ca.gc.cra.apkrisk.application.ingest.DynamicEventIngestor;
import ca.gc.cra.apkrisk.application.ingest.DynamicIngestResult;
import ca.gc.cra.apkrisk.application.port.ClockPort;
import ca.gc.cra.apkrisk.application.port.FeatureProbe;
import ca.gc.cra.apkrisk.application.port.InstrumentationEventSource;
import ca.gc.cra.apkrisk.application.port.JobStatusListener;
import ca.gc.cra.apkrisk.application.port.MetricsPort;
import ca.gc.cra.apkrisk.application.port.StaticExtractor;
import ca.gc.cra.apkrisk.application.scoring.MetricNormalizer;
import ca.gc.cra.apkrisk.application.scoring.NormalizedMetric;
import ca.gc.cra.apkrisk.application.scoring.RationaleGenerator;
import ca.gc.cra.apkrisk.application.scoring.ScoreResult;
import ca.gc.cra.apkrisk.application.scoring.ScoringConfig;
import ca.gc.cra.apkrisk.application.scoring.ScoringTable;
import ca.gc.cra.apkrisk.application.scoring.WeightedScoringEngine;
import ca.gc.cra.apkrisk.domain.assessment.AssessmentNotice;
import ca.gc.cra.apkrisk.domain.assessment.NoticeKind;
import ca.gc.cra.apkrisk.domain.assessment.PipelineState;
import ca.gc.cra.apkrisk.domain.assessment.RationaleEntry;
import ca.gc.cra.apkrisk.domain.assessment.RiskAssessment;
import ca.gc.cra.apkrisk.domain.assessment.RiskLevel;
import ca.gc.cra.apkrisk.domain.error.AssessmentException;
import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import ca.gc.cra.apkrisk.domain.feature.FeatureAvailability;
import ca.gc.cra.apkrisk.domain.metric.MetricCatalog;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Orchestrates one assessment job from raw inputs to an immutable
 * {@link RiskAssessment}.
 * <p><strong>Why:</strong> Keeps the stage ordering and failure semantics in one place so the scoring
 * components stay pure.</p>
 * <p><strong>State machine:</strong> {@code COLLECTING -> NORMALIZING -> SCORING -> DONE}. A configuration
 * error or missing mandatory data moves the job straight to {@code FAILED}; the typed cause is reported to
 * the {@link JobStatusListener} and rethrown. Missing optional data only produces notices.</p>
 * <p><strong>Thread-safety:</strong> Holds no per-job state; concurrent jobs may share one instance.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code jobId}; emits {@code assess.jobs.started},
 * {@code assess.jobs.completed}, {@code assess.jobs.failed}, {@code assess.notices.optional},
 * {@code assess.score} and {@code assess.latency.ms}.</p>
 *
 * @since 0.1.0
 */
public final class AssessmentPipeline {
  private static final Logger log = LoggerFactory.getLogger(AssessmentPipeline.class);

  private final MetricCatalog catalog;
  private final ExtractorAdapterLayer adapterLayer;
  private final DynamicEventIngestor ingestor;
  private final StaticExtractionCoordinator coordinator;
  private final FeatureProbe featureProbe;
  private final JobStatusListener listener;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final MetricNormalizer normalizer = new MetricNormalizer();
  private final WeightedScoringEngine engine = new WeightedScoringEngine();
  private final RationaleGenerator rationaleGenerator = new RationaleGenerator();

  /**
   * Creates a pipeline.
   *
   * @param catalog metric catalog used for every job
   * @param adapterLayer static findings adapter
   * @param ingestor dynamic event ingestor
   * @param coordinator concurrent static extraction runner
   * @param featureProbe optional capability probe, consulted once per job
   * @param listener job status observer
   * @param metrics metrics sink
   * @param clock clock used for latency measurement
   */
  public AssessmentPipeline(
      MetricCatalog catalog,
      ExtractorAdapterLayer adapterLayer,
      DynamicEventIngestor ingestor,
      StaticExtractionCoordinator coordinator,
      FeatureProbe featureProbe,
      JobStatusListener listener,
      MetricsPort metrics,
      ClockPort clock) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.adapterLayer = Objects.requireNonNull(adapterLayer, "adapterLayer");
    this.ingestor = Objects.requireNonNull(ingestor, "ingestor");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.featureProbe = Objects.requireNonNull(featureProbe, "featureProbe");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Assesses a job whose static results were collected beforehand.
   *
   * @param request job inputs
   * @return immutable assessment
   * @throws AssessmentException if configuration is invalid or mandatory data is missing
   * @throws InterruptedException if interrupted while consuming instrumentation events
   */
  public RiskAssessment assess(AssessmentRequest request) throws AssessmentException, InterruptedException {
    Objects.requireNonNull(request, "request");
    return execute(request.jobId(), request::staticResults, request.dynamicEvents(), request.dynamicWindow(),
        request.scoringConfig());
  }

  /**
   * Collects static results through the coordinator, then assesses the job.
   *
   * @param jobId job identifier
   * @param target analysis target handed to each extractor
   * @param extractors static extractors to run
   * @param events instrumentation stream
   * @param window wall-clock budget for {@code events}
   * @param config per-call scoring overrides
   * @return immutable assessment
   * @throws AssessmentException if configuration is invalid or mandatory data is missing
   * @throws InterruptedException if interrupted while collecting or ingesting
   */
  public RiskAssessment assess(
      String jobId,
      Path target,
      List<? extends StaticExtractor> extractors,
      InstrumentationEventSource events,
      Duration window,
      ScoringConfig config) throws AssessmentException, InterruptedException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(extractors, "extractors");
    return execute(jobId, () -> coordinator.collect(target, extractors),
        events == null ? InstrumentationEventSource.EMPTY : events,
        window == null ? AssessmentRequest.DEFAULT_WINDOW : window,
        config == null ? ScoringConfig.EMPTY : config);
  }

  @FunctionalInterface
  private interface StaticCollector {
    Map<ExtractorId, ExtractorResult> collect() throws InterruptedException;
  }

  private RiskAssessment execute(
      String jobId,
      StaticCollector collector,
      InstrumentationEventSource events,
      Duration window,
      ScoringConfig config) throws AssessmentException, InterruptedException {
    Objects.requireNonNull(jobId, "jobId");
    String previousJobId = MDC.get("jobId");
    MDC.put("jobId", jobId);
    long started = clock.nowMillis();
    PipelineRun run = new PipelineRun(jobId, listener);
    metrics.increment("assess.jobs.started");
    log.info("Assessment started");
    try {
      RiskAssessment assessment = runStages(run, collector, events, window, config);
      metrics.increment("assess.jobs.completed");
      metrics.observe("assess.score", assessment.score());
      log.info("Assessment completed: score={} level={} ({})",
          assessment.score(), assessment.level().display(), assessment.summary());
      return assessment;
    } catch (AssessmentException ex) {
      run.fail(ex);
      metrics.increment("assess.jobs.failed");
      log.error("Assessment failed: {}", ex.getMessage());
      throw ex;
    } catch (InterruptedException | RuntimeException ex) {
      run.abort(ex);
      metrics.increment("assess.jobs.failed");
      log.error("Assessment aborted", ex);
      throw ex;
    } finally {
      metrics.observe("assess.latency.ms", Math.max(0L, clock.nowMillis() - started));
      if (previousJobId == null) {
        MDC.remove("jobId");
      } else {
        MDC.put("jobId", previousJobId);
      }
    }
  }

  private RiskAssessment runStages(
      PipelineRun run,
      StaticCollector collector,
      InstrumentationEventSource events,
      Duration window,
      ScoringConfig config) throws AssessmentException, InterruptedException {
    // Resolved before extraction; the event source can be read only once.
    ScoringTable table = ScoringTable.resolve(catalog, config);
    FeatureAvailability features = featureProbe.probe();
    log.debug("Optional capabilities available: {}", features);

    Map<ExtractorId, ExtractorResult> staticResults = collector.collect();
    AdaptedStaticMetrics adapted = adapterLayer.adapt(staticResults, features);
    DynamicIngestResult dynamic = ingestor.ingest(events, window);
    run.advance(PipelineState.NORMALIZING);

    List<MetricValue> values = new ArrayList<>(adapted.metrics());
    values.addAll(dynamic.metrics());
    List<NormalizedMetric> normalized = normalizer.normalize(values, table);
    run.advance(PipelineState.SCORING);

    ScoreResult result = engine.score(normalized, table);
    List<RationaleEntry> rationale = rationaleGenerator.explain(result, catalog);
    RiskLevel level = rationaleGenerator.level(result.score(), table.bands());

    List<AssessmentNotice> notices = new ArrayList<>(adapted.notices());
    notices.addAll(dynamic.notices());
    for (AssessmentNotice notice : notices) {
      if (notice.kind() == NoticeKind.OPTIONAL_DEPENDENCY_UNAVAILABLE) {
        metrics.increment("assess.notices.optional");
      }
    }

    RiskAssessment assessment = new RiskAssessment(
        run.jobId(), result.score(), level, rationale, result.breakdown(), notices, dynamic.truncated());
    run.advance(PipelineState.DONE);
    return assessment;
  }
}
