package ca.gc.cra.apkrisk.application.scoring;

import ca.gc.cra.apkrisk.domain.error.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Per-call scoring overrides: weights, caps and score band floors.
 *
 * <p>Keys not mentioned fall back to catalog defaults when the overrides are resolved into a
 * {@link ScoringTable}. Values are kept as supplied; range checks happen during resolution so that every
 * invalid override surfaces as a {@link ConfigurationException}.</p>
 *
 * @param weights weight overrides keyed by metric name
 * @param caps cap overrides keyed by metric name
 * @param bands band floor overrides keyed by {@code medium} or {@code high}
 * @since 0.1.0
 */
public record ScoringConfig(Map<String, Double> weights, Map<String, Long> caps, Map<String, Integer> bands) {
  /** No overrides. */
  public static final ScoringConfig EMPTY = new ScoringConfig(Map.of(), Map.of(), Map.of());

  static final String WEIGHTS_PREFIX = "weights.";
  static final String CAPS_PREFIX = "caps.";
  static final String BANDS_PREFIX = "bands.";

  /**
   * Copies the override maps, preserving insertion order.
   */
  public ScoringConfig {
    weights = freeze(Objects.requireNonNull(weights, "weights"));
    caps = freeze(Objects.requireNonNull(caps, "caps"));
    bands = freeze(Objects.requireNonNull(bands, "bands"));
  }

  /**
   * Indicates whether no override is present.
   *
   * @return {@code true} when all maps are empty
   */
  public boolean isEmpty() {
    return weights.isEmpty() && caps.isEmpty() && bands.isEmpty();
  }

  /**
   * Layers {@code override} on top of this configuration; keys present in both take the override's value.
   *
   * @param override higher-precedence overrides
   * @return merged configuration
   */
  public ScoringConfig overriddenBy(ScoringConfig override) {
    Objects.requireNonNull(override, "override");
    Map<String, Double> w = new LinkedHashMap<>(weights);
    w.putAll(override.weights);
    Map<String, Long> c = new LinkedHashMap<>(caps);
    c.putAll(override.caps);
    Map<String, Integer> b = new LinkedHashMap<>(bands);
    b.putAll(override.bands);
    return new ScoringConfig(w, c, b);
  }

  /**
   * Parses dotted keys such as {@code weights.permission_density=0.5}, {@code caps.file_write_count=20}
   * and {@code bands.high=80}. Other keys are ignored.
   *
   * @param flat flattened configuration entries
   * @return parsed overrides
   * @throws ConfigurationException if a value is not a number of the expected shape
   */
  public static ScoringConfig fromFlatMap(Map<String, String> flat) throws ConfigurationException {
    Objects.requireNonNull(flat, "flat");
    Map<String, Double> weights = new LinkedHashMap<>();
    Map<String, Long> caps = new LinkedHashMap<>();
    Map<String, Integer> bands = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : flat.entrySet()) {
      String key = entry.getKey();
      if (key.startsWith(WEIGHTS_PREFIX)) {
        weights.put(suffix(key, WEIGHTS_PREFIX), parseWeight(key, entry.getValue()));
      } else if (key.startsWith(CAPS_PREFIX)) {
        caps.put(suffix(key, CAPS_PREFIX), parseCap(key, entry.getValue()));
      } else if (key.startsWith(BANDS_PREFIX)) {
        bands.put(suffix(key, BANDS_PREFIX).toLowerCase(Locale.ROOT), parseBand(key, entry.getValue()));
      }
    }
    return new ScoringConfig(weights, caps, bands);
  }

  /**
   * Parses a nested tree {@code {weights: {...}, caps: {...}, bands: {...}}} as found in job files and
   * YAML documents.
   *
   * @param tree configuration subtree; {@code null} yields {@link #EMPTY}
   * @return parsed overrides
   * @throws ConfigurationException if a section is not a mapping or a value is not numeric
   */
  public static ScoringConfig fromTree(Map<String, ?> tree) throws ConfigurationException {
    if (tree == null || tree.isEmpty()) {
      return EMPTY;
    }
    Map<String, String> flat = new LinkedHashMap<>();
    flattenSection(tree, "weights", flat);
    flattenSection(tree, "caps", flat);
    flattenSection(tree, "bands", flat);
    return fromFlatMap(flat);
  }

  private static void flattenSection(Map<String, ?> tree, String section, Map<String, String> flat)
      throws ConfigurationException {
    Object node = tree.get(section);
    if (node == null) {
      return;
    }
    if (!(node instanceof Map<?, ?> map)) {
      throw new ConfigurationException(section + " overrides must be a mapping");
    }
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      Object value = entry.getValue();
      if (value == null) {
        throw new ConfigurationException(section + "." + entry.getKey() + " must not be null");
      }
      flat.put(section + "." + entry.getKey(), String.valueOf(value));
    }
  }

  private static String suffix(String key, String prefix) {
    return key.substring(prefix.length()).trim();
  }

  private static double parseWeight(String key, String raw) throws ConfigurationException {
    try {
      return Double.parseDouble(requireValue(key, raw));
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(key + " must be a number (was '" + raw + "')", ex);
    }
  }

  private static long parseCap(String key, String raw) throws ConfigurationException {
    String value = requireValue(key, raw);
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException ex) {
      // YAML and JSON may render integral caps as 50.0
      try {
        double d = Double.parseDouble(value);
        if (d == Math.rint(d) && !Double.isInfinite(d)) {
          return (long) d;
        }
      } catch (NumberFormatException nested) {
        ex.addSuppressed(nested);
      }
      throw new ConfigurationException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  private static int parseBand(String key, String raw) throws ConfigurationException {
    try {
      return Integer.parseInt(requireValue(key, raw));
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  private static String requireValue(String key, String raw) throws ConfigurationException {
    if (raw == null || raw.isBlank()) {
      throw new ConfigurationException(key + " must not be blank");
    }
    return raw.trim();
  }

  private static <V> Map<String, V> freeze(Map<String, V> source) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
