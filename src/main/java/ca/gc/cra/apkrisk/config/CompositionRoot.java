package ca.gc.cra.apkrisk.config;

import ca.gc.cra.apkrisk.application.extract.ExtractorAdapterLayer;
import ca.gc.cra.apkrisk.application.ingest.DynamicEventIngestor;
import ca.gc.cra.apkrisk.application.pipeline.AssessmentPipeline;
import ca.gc.cra.apkrisk.application.pipeline.StaticExtractionCoordinator;
import ca.gc.cra.apkrisk.application.port.ClockPort;
import ca.gc.cra.apkrisk.application.port.EndpointReputation;
import ca.gc.cra.apkrisk.application.port.FeatureProbe;
import ca.gc.cra.apkrisk.application.port.JobStatusListener;
import ca.gc.cra.apkrisk.application.port.MetricsPort;
import ca.gc.cra.apkrisk.domain.metric.MetricCatalog;
import ca.gc.cra.apkrisk.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.apkrisk.infrastructure.feature.ConfiguredFeatureProbe;
import ca.gc.cra.apkrisk.infrastructure.feature.PathFeatureProbe;
import ca.gc.cra.apkrisk.infrastructure.intel.FeedEndpointReputation;
import ca.gc.cra.apkrisk.infrastructure.job.ArtifactDirectoryExtractor;
import ca.gc.cra.apkrisk.infrastructure.job.JsonJobReader;
import ca.gc.cra.apkrisk.infrastructure.json.JsonSupport;
import ca.gc.cra.apkrisk.infrastructure.report.AssessmentJsonWriter;
import ca.gc.cra.apkrisk.infrastructure.report.AssessmentTextRenderer;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that wires the assessment pipeline to concrete adapters.
 * <p><strong>Role:</strong> Translates an {@link AssessConfig} into a runnable {@link AssessmentPipeline}
 * plus the readers and writers the CLI needs around it.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances and
 * are not synchronized.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final AssessConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final FeatureProbe baseProbe;
  private final MetricCatalog catalog = MetricCatalog.defaults();
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates a composition root. Optional tools are probed on {@code PATH} only when
   * {@link AssessConfig#probeTools()} is set; recorded findings otherwise decide availability.
   *
   * @param config invocation settings
   * @param metrics metrics adapter shared by constructed components
   * @param clock time source
   */
  public CompositionRoot(AssessConfig config, MetricsPort metrics, ClockPort clock) {
    this(config, metrics, clock,
        config.probeTools() ? PathFeatureProbe.fromEnvironment() : FeatureProbe.ALL_AVAILABLE);
  }

  /**
   * Creates a composition root with an explicit base feature probe.
   *
   * @param config invocation settings
   * @param metrics metrics adapter shared by constructed components
   * @param clock time source
   * @param baseProbe probe consulted before configured overrides are applied
   */
  public CompositionRoot(AssessConfig config, MetricsPort metrics, ClockPort clock, FeatureProbe baseProbe) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.baseProbe = Objects.requireNonNull(baseProbe, "baseProbe");
  }

  /**
   * Returns the metric catalog shared by every component built here.
   *
   * @return default catalog
   */
  public MetricCatalog catalog() {
    return catalog;
  }

  /**
   * Builds the feature probe with configured {@code features.*} overrides applied.
   *
   * @return feature probe
   */
  public FeatureProbe featureProbe() {
    if (config.featureOverrides().isEmpty()) {
      return baseProbe;
    }
    return new ConfiguredFeatureProbe(baseProbe, config.featureOverrides());
  }

  /**
   * Loads the configured threat intelligence feeds.
   *
   * @return reputation lookup; flags nothing when no feeds are configured
   * @throws IOException if a feed exists but cannot be read
   */
  public EndpointReputation endpointReputation() throws IOException {
    if (config.intelFeeds().isEmpty()) {
      return EndpointReputation.NONE;
    }
    return FeedEndpointReputation.load(config.intelFeeds());
  }

  /**
   * Wires the assessment pipeline.
   *
   * @param listener job status observer
   * @return pipeline ready to assess jobs
   * @throws IOException if threat intelligence feeds cannot be read
   */
  public AssessmentPipeline assessmentPipeline(JobStatusListener listener) throws IOException {
    StaticExtractionCoordinator coordinator = new StaticExtractionCoordinator(
        size -> ExecutorFactories.newExtractorPool(size, "apkrisk-extract", null),
        config.extractorThreads(),
        config.extractorTimeout(),
        metrics);
    DynamicEventIngestor ingestor = new DynamicEventIngestor(catalog, clock, endpointReputation(), metrics);
    return new AssessmentPipeline(
        catalog,
        ExtractorAdapterLayer.withDefaultAdapters(catalog),
        ingestor,
        coordinator,
        featureProbe(),
        listener,
        metrics,
        clock);
  }

  /**
   * Creates a job file reader.
   *
   * @return reader stamping undated events with this root's clock
   */
  public JsonJobReader jobReader() {
    return new JsonJobReader(json, clock);
  }

  /**
   * Creates one artifact-directory extractor per known extractor.
   *
   * @return extractors reading {@code <extractor>.json} files
   */
  public List<ArtifactDirectoryExtractor> artifactExtractors() {
    return ArtifactDirectoryExtractor.forAllExtractors(json);
  }

  /**
   * Creates the JSON report writer.
   *
   * @return writer honouring the configured pretty-print flag
   */
  public AssessmentJsonWriter jsonWriter() {
    return new AssessmentJsonWriter(json.factory(), config.pretty());
  }

  /**
   * Creates the terminal report renderer.
   *
   * @return text renderer
   */
  public AssessmentTextRenderer textRenderer() {
    return new AssessmentTextRenderer();
  }
}
