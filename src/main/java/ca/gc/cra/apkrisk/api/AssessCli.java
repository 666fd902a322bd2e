package ca.gc.cra.apkrisk.api;

import ca.gc.cra.apkrisk.application.pipeline.AssessmentPipeline;
import ca.gc.cra.apkrisk.application.pipeline.AssessmentRequest;
import ca.gc.cra.apkrisk.application.port.ClockPort;
import ca.gc.cra.apkrisk.application.port.JobStatusListener;
import ca.gc.cra.apkrisk.application.port.MetricsPort;
import ca.gc.cra.apkrisk.application.scoring.ScoringConfig;
import ca.gc.cra.apkrisk.config.AssessConfig;
import ca.gc.cra.apkrisk.config.CompositionRoot;
import ca.gc.cra.apkrisk.domain.assessment.RiskAssessment;
import ca.gc.cra.apkrisk.domain.error.AssessmentException;
import ca.gc.cra.apkrisk.domain.error.ConfigurationException;
import ca.gc.cra.apkrisk.domain.error.MandatoryExtractorMissingException;
import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import ca.gc.cra.apkrisk.infrastructure.events.EventLineParser;
import ca.gc.cra.apkrisk.infrastructure.events.ListEventSource;
import ca.gc.cra.apkrisk.infrastructure.job.ArtifactDirectoryExtractor;
import ca.gc.cra.apkrisk.infrastructure.job.JobDescription;
import ca.gc.cra.apkrisk.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.apkrisk.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.apkrisk.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.apkrisk.logging.LoggingConfigurator;
import ca.gc.cra.apkrisk.validation.Paths;
import ca.gc.cra.apkrisk.validation.Strings;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for assessing one job, either from a job file or from an extractor artifact directory.
 *
 * @since 0.1.0
 */
public final class AssessCli {
  private static final Logger log = LoggerFactory.getLogger(AssessCli.class);
  private static final int MAX_JOB_ID_LENGTH = 128;
  private static final String SUMMARY_USAGE =
      "usage: assess (job=FILE | artifacts=DIR) [config=YAML] [format=json|text] [out=FILE] "
          + "[weights.<metric>=W] [caps.<metric>=N] [bands.medium=N] [bands.high=N] [--verbose]";
  private static final String HELP_TEXT = """
      APKRISK assess

      Usage:
        assess (job=FILE | artifacts=DIR) [options]

      Inputs (exactly one required):
        job=FILE                  Job JSON with static findings, recorded events and scoring overrides
        artifacts=DIR             Directory holding <extractor>.json files and an optional events.log
        jobId=ID                  Job id for artifacts runs (default: directory name)

      Output:
        format=json|text          Report format (default json)
        pretty=true|false         Indent JSON output (default true)
        out=FILE                  Write the report to FILE instead of stdout

      Scoring overrides:
        weights.<metric>=W        Weight in [0,1] for a catalog metric
        caps.<metric>=N           Cap for a count metric
        bands.medium=N            Lowest score labelled Medium (default 40)
        bands.high=N              Lowest score labelled High (default 70)

      Runtime:
        config=YAML               YAML file with common/assess sections
        dynamicWindowMs=N         Dynamic analysis window (default 300000)
        extractorTimeoutMs=N      Budget for static extraction (default 120000)
        extractorThreads=N        Concurrent extractor calls (default 4)
        intelFeeds=F1,F2          Threat intelligence feeds (one IP or domain per line)
        probeTools=true|false     Probe PATH for optional tools (default false)
        features.<name>=BOOL      Force an optional feature on or off (yara, secrets, signature, ...)
        metricsExporter=otlp|none OpenTelemetry metrics exporter
        otelEndpoint=URL          OTLP gRPC endpoint
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Exit codes:
        0 success, 2 invalid arguments or job file, 3 I/O error, 4 invalid scoring configuration,
        5 unexpected failure, 6 mandatory extractor data missing, 130 interrupted
      """;

  private AssessCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the assess CLI and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(CliInput.parse(args));
  }

  static ExitCode run(CliInput input) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for assess CLI");
    }

    AssessConfig config;
    try {
      input.rejectUnknownFlags();
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      config = AssessConfig.fromMap(ConfigCliUtils.effectiveConfig("assess", kv, log::warn));
    } catch (ConfigurationException ex) {
      log.error("Invalid scoring configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }
    if (config.verbose() && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    TelemetrySettings telemetry;
    try {
      telemetry = TelemetryConfigurator.settingsFor(config);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid telemetry configuration: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(telemetry)) {
      return execute(config, metrics, new SystemClockAdapter());
    }
  }

  static ExitCode execute(AssessConfig config, MetricsPort metrics, ClockPort clock) {
    CompositionRoot root = new CompositionRoot(config, metrics, clock);
    JobStatusListener listener = (jobId, from, to) -> log.debug("Job {} moved {} -> {}", jobId, from, to);
    try {
      AssessmentPipeline pipeline = root.assessmentPipeline(listener);
      RiskAssessment assessment = config.jobFile().isPresent()
          ? assessJobFile(root, pipeline, config)
          : assessArtifacts(root, pipeline, config, clock);
      emit(root, config, assessment);
      return ExitCode.SUCCESS;
    } catch (ConfigurationException ex) {
      log.error("Invalid scoring configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (MandatoryExtractorMissingException ex) {
      log.error("Assessment failed: {}", ex.getMessage());
      return ExitCode.ASSESSMENT_FAILED;
    } catch (AssessmentException ex) {
      log.error("Assessment failed", ex);
      return ExitCode.ASSESSMENT_FAILED;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid job input: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Assessment I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Assessment interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in assess", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static RiskAssessment assessJobFile(
      CompositionRoot root, AssessmentPipeline pipeline, AssessConfig config)
      throws IOException, AssessmentException, InterruptedException {
    Path file = Paths.requireReadableFile("job", config.jobFile().orElseThrow());
    JobDescription job = root.jobReader().read(file);
    // Job-level overrides and window are more specific than the invocation defaults.
    ScoringConfig scoring = config.scoring().overriddenBy(ScoringConfig.fromTree(job.scoringOverrides()));
    Duration window = job.declaredWindow().orElse(config.dynamicWindow());
    log.info("Assessing job {} from {} ({} static results, {} recorded events)",
        job.jobId(), file, job.staticResults().size(), job.events().size());
    return pipeline.assess(new AssessmentRequest(
        job.jobId(), job.staticResults(), new ListEventSource(job.events()), window, scoring));
  }

  private static RiskAssessment assessArtifacts(
      CompositionRoot root, AssessmentPipeline pipeline, AssessConfig config, ClockPort clock)
      throws IOException, AssessmentException, InterruptedException {
    Path dir = Paths.requireReadableDir("artifacts", config.artifactsDir().orElseThrow());
    String jobId = Strings.requirePrintableAscii(
        "jobId", config.jobId().orElseGet(() -> defaultJobId(dir)), MAX_JOB_ID_LENGTH);
    Path eventsFile = dir.resolve(ArtifactDirectoryExtractor.EVENTS_FILE);
    List<InstrumentationEvent> events = Files.isRegularFile(eventsFile)
        ? EventLineParser.readAll(eventsFile, Instant.ofEpochMilli(clock.nowMillis()))
        : List.of();
    log.info("Assessing artifacts in {} as job {} ({} recorded events)", dir, jobId, events.size());
    return pipeline.assess(jobId, dir, root.artifactExtractors(), new ListEventSource(events),
        config.dynamicWindow(), config.scoring());
  }

  private static String defaultJobId(Path dir) {
    Path name = dir.getFileName();
    return name == null ? "artifacts" : name.toString();
  }

  private static void emit(CompositionRoot root, AssessConfig config, RiskAssessment assessment)
      throws IOException {
    if (config.out().isEmpty()) {
      CliPrinter.printBlock(config.format() == AssessConfig.ReportFormat.TEXT
          ? root.textRenderer().render(assessment)
          : root.jsonWriter().toJson(assessment));
      return;
    }
    Path out = Paths.requireWritableFile("out", config.out().get());
    try (Writer writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
      if (config.format() == AssessConfig.ReportFormat.TEXT) {
        writer.write(root.textRenderer().render(assessment));
      } else {
        root.jsonWriter().write(assessment, writer);
      }
    }
    log.info("Wrote {} report to {}", config.format().name().toLowerCase(Locale.ROOT), out);
  }
}
