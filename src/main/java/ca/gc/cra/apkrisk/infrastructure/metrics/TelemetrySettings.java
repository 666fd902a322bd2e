package ca.gc.cra.apkrisk.infrastructure.metrics;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry export settings resolved from CLI/YAML values, then JVM properties, then environment.
 *
 * @param exporter exporter selection
 * @param endpoint OTLP gRPC endpoint
 * @param exportInterval periodic export interval
 * @param resourceAttributes extra resource attributes
 * @since 0.1.0
 */
public record TelemetrySettings(
    Exporter exporter, String endpoint, Duration exportInterval, Map<String, String> resourceAttributes) {
  private static final Logger log = LoggerFactory.getLogger(TelemetrySettings.class);

  static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

  /** Supported metric exporters. */
  public enum Exporter {
    OTLP,
    NONE;

    /**
     * Parses an exporter name; unknown values fall back to {@link #OTLP} with a warning.
     *
     * @param raw exporter name
     * @return exporter
     */
    public static Exporter from(String raw) {
      if (raw == null || raw.isBlank()) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> {
          log.warn("Unknown metrics exporter '{}'; defaulting to otlp", raw);
          yield OTLP;
        }
      };
    }
  }

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(exportInterval, "exportInterval");
    resourceAttributes = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(resourceAttributes, "resourceAttributes")));
  }

  /**
   * Resolves settings, preferring explicit values over {@code otel.*} system properties and
   * {@code OTEL_*} environment variables.
   *
   * @param exporterOverride exporter from CLI or YAML; may be {@code null}
   * @param endpointOverride endpoint from CLI or YAML; may be {@code null}
   * @return resolved settings
   */
  public static TelemetrySettings resolve(String exporterOverride, String endpointOverride) {
    return resolve(exporterOverride, endpointOverride, System.getProperties(), System::getenv);
  }

  static TelemetrySettings resolve(
      String exporterOverride, String endpointOverride, Properties props, Function<String, String> env) {
    String exporter = firstNonBlank(exporterOverride,
        props.getProperty("otel.metrics.exporter"), env.apply("OTEL_METRICS_EXPORTER"), "otlp");
    String endpoint = firstNonBlank(endpointOverride,
        props.getProperty("otel.exporter.otlp.endpoint"), env.apply("OTEL_EXPORTER_OTLP_ENDPOINT"),
        DEFAULT_ENDPOINT);
    String attrs = firstNonBlank(null,
        props.getProperty("otel.resource.attributes"), env.apply("OTEL_RESOURCE_ATTRIBUTES"), "");
    return new TelemetrySettings(Exporter.from(exporter), endpoint, DEFAULT_INTERVAL, parseAttributes(attrs));
  }

  static Map<String, String> parseAttributes(String raw) {
    Map<String, String> attributes = new LinkedHashMap<>();
    if (raw == null || raw.isBlank()) {
      return attributes;
    }
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        if (!trimmed.isEmpty()) {
          log.warn("Ignoring malformed resource attribute entry: {}", trimmed);
        }
        continue;
      }
      attributes.put(trimmed.substring(0, idx).trim(), trimmed.substring(idx + 1).trim());
    }
    return attributes;
  }

  private static String firstNonBlank(String a, String b, String c, String fallback) {
    for (String candidate : new String[] {a, b, c}) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return fallback;
  }
}
