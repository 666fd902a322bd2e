package ca.gc.cra.apkrisk.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each APKRISK CLI command.
 *
 * <p>Scoring weights, caps and bands have no entries here: their defaults live in the metric catalog
 * and only explicit overrides travel through configuration.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param command target CLI command (assess, catalog)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "assess" -> buildAssessDefaults();
      case "catalog" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "");
    map.put("otelEndpoint", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildAssessDefaults() {
    AssessConfig defaults = AssessConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("format", defaults.format().name().toLowerCase(Locale.ROOT));
    map.put("pretty", Boolean.toString(defaults.pretty()));
    map.put("dynamicWindowMs", Long.toString(defaults.dynamicWindow().toMillis()));
    map.put("extractorTimeoutMs", Long.toString(defaults.extractorTimeout().toMillis()));
    map.put("extractorThreads", Integer.toString(defaults.extractorThreads()));
    map.put("intelFeeds", "");
    map.put("probeTools", Boolean.toString(defaults.probeTools()));
    return map;
  }
}
