package ca.gc.cra.apkrisk.config;

import ca.gc.cra.apkrisk.application.scoring.ScoringConfig;
import ca.gc.cra.apkrisk.domain.error.ConfigurationException;
import ca.gc.cra.apkrisk.domain.feature.OptionalFeature;
import ca.gc.cra.apkrisk.infrastructure.feature.ConfiguredFeatureProbe;
import ca.gc.cra.apkrisk.validation.Numbers;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable settings for one {@code assess} invocation.
 * <p><strong>Role:</strong> Configuration record consumed by {@link CompositionRoot} and the assess CLI.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent reads.</p>
 *
 * @param jobFile job JSON input, when assessing a recorded job
 * @param artifactsDir artifact directory input, when assessing extractor output on disk
 * @param jobId explicit job id for artifact runs; defaults to the directory name
 * @param format report format
 * @param pretty whether JSON output is indented
 * @param out report destination; empty writes to stdout
 * @param dynamicWindow default dynamic analysis window
 * @param extractorTimeout budget for one static collection round
 * @param extractorThreads upper bound on concurrent extractor calls
 * @param intelFeeds threat intelligence feed files
 * @param featureOverrides forced optional feature availability
 * @param probeTools whether optional features are probed on {@code PATH}; otherwise all are assumed present
 * @param scoring weight, cap and band overrides
 * @param metricsExporter OpenTelemetry exporter name ({@code otlp} or {@code none}); blank defers to the environment
 * @param otelEndpoint OTLP endpoint; blank defers to the environment
 * @param verbose whether DEBUG logging was requested through configuration
 * @since 0.1.0
 */
public record AssessConfig(
    Optional<Path> jobFile,
    Optional<Path> artifactsDir,
    Optional<String> jobId,
    ReportFormat format,
    boolean pretty,
    Optional<Path> out,
    Duration dynamicWindow,
    Duration extractorTimeout,
    int extractorThreads,
    List<Path> intelFeeds,
    Map<OptionalFeature, Boolean> featureOverrides,
    boolean probeTools,
    ScoringConfig scoring,
    String metricsExporter,
    String otelEndpoint,
    boolean verbose) {

  static final long MAX_WINDOW_MS = 86_400_000L;
  static final long MAX_EXTRACTOR_TIMEOUT_MS = 3_600_000L;
  static final int MAX_EXTRACTOR_THREADS = 64;

  /** Report rendering choices. */
  public enum ReportFormat {
    JSON,
    TEXT;

    static ReportFormat fromString(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "", "json" -> JSON;
        case "text" -> TEXT;
        default -> throw new IllegalArgumentException("format must be 'json' or 'text' (was '" + raw + "')");
      };
    }
  }

  public AssessConfig {
    Objects.requireNonNull(jobFile, "jobFile");
    Objects.requireNonNull(artifactsDir, "artifactsDir");
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(out, "out");
    Objects.requireNonNull(dynamicWindow, "dynamicWindow");
    Objects.requireNonNull(extractorTimeout, "extractorTimeout");
    intelFeeds = List.copyOf(Objects.requireNonNull(intelFeeds, "intelFeeds"));
    Map<OptionalFeature, Boolean> overrides = new EnumMap<>(OptionalFeature.class);
    overrides.putAll(Objects.requireNonNull(featureOverrides, "featureOverrides"));
    featureOverrides = Collections.unmodifiableMap(overrides);
    Objects.requireNonNull(scoring, "scoring");
    Objects.requireNonNull(metricsExporter, "metricsExporter");
    Objects.requireNonNull(otelEndpoint, "otelEndpoint");
    if (extractorThreads <= 0) {
      throw new IllegalArgumentException("extractorThreads must be positive");
    }
  }

  /**
   * Returns the settings used when nothing is configured.
   *
   * @return default configuration with no input selected
   */
  public static AssessConfig defaults() {
    return new AssessConfig(
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        ReportFormat.JSON,
        true,
        Optional.empty(),
        Duration.ofMinutes(5),
        Duration.ofMinutes(2),
        4,
        List.of(),
        Map.of(),
        false,
        ScoringConfig.EMPTY,
        "",
        "",
        false);
  }

  /**
   * Builds configuration from the merged flat map.
   *
   * @param args effective key/value settings
   * @return parsed configuration
   * @throws IllegalArgumentException when an operational setting is malformed
   * @throws ConfigurationException when a scoring override is malformed
   */
  public static AssessConfig fromMap(Map<String, String> args) throws ConfigurationException {
    Objects.requireNonNull(args, "args");
    AssessConfig defaults = defaults();
    Duration window = args.containsKey("dynamicWindowMs")
        ? Duration.ofMillis(Numbers.parseInRange("dynamicWindowMs", args.get("dynamicWindowMs"), 0, MAX_WINDOW_MS))
        : defaults.dynamicWindow();
    Duration timeout = args.containsKey("extractorTimeoutMs")
        ? Duration.ofMillis(Numbers.parseInRange(
            "extractorTimeoutMs", args.get("extractorTimeoutMs"), 1, MAX_EXTRACTOR_TIMEOUT_MS))
        : defaults.extractorTimeout();
    int threads = args.containsKey("extractorThreads")
        ? (int) Numbers.parseInRange("extractorThreads", args.get("extractorThreads"), 1, MAX_EXTRACTOR_THREADS)
        : defaults.extractorThreads();

    return new AssessConfig(
        optionalPath(args.get("job")),
        optionalPath(args.get("artifacts")),
        optionalString(args.get("jobId")),
        ReportFormat.fromString(args.get("format")),
        parseBoolean(args.get("pretty"), defaults.pretty()),
        optionalPath(args.get("out")),
        window,
        timeout,
        threads,
        parseFeeds(args.get("intelFeeds")),
        ConfiguredFeatureProbe.parseOverrides(args),
        parseBoolean(args.get("probeTools"), defaults.probeTools()),
        ScoringConfig.fromFlatMap(args),
        optionalString(args.get("metricsExporter")).orElse(""),
        optionalString(args.get("otelEndpoint")).orElse(""),
        parseBoolean(args.get("verbose"), false));
  }

  private static List<Path> parseFeeds(String raw) {
    List<Path> feeds = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return feeds;
    }
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        feeds.add(Path.of(trimmed));
      }
    }
    return feeds;
  }

  private static Optional<Path> optionalPath(String value) {
    return optionalString(value).map(Path::of);
  }

  private static Optional<String> optionalString(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
