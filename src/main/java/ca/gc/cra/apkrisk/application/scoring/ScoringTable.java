package ca.gc.cra.apkrisk.application.scoring;

import ca.gc.cra.apkrisk.domain.assessment.ScoreBands;
import ca.gc.cra.apkrisk.domain.error.ConfigurationException;
import ca.gc.cra.apkrisk.domain.metric.MetricCatalog;
import ca.gc.cra.apkrisk.domain.metric.MetricKind;
import ca.gc.cra.apkrisk.domain.metric.MetricSpec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Effective weights, caps and score bands for one scoring call.
 * <p><strong>Why:</strong> Overrides are validated once, before any metric is normalized, so a bad override
 * can never yield a partial score.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class ScoringTable {
  /**
   * Effective settings for one catalog metric.
   *
   * @param spec catalog entry
   * @param weight effective configured weight
   * @param cap effective cap; {@code null} for non-count metrics
   */
  public record Entry(MetricSpec spec, double weight, Long cap) {
    public Entry {
      Objects.requireNonNull(spec, "spec");
    }

    /**
     * Returns the metric name.
     *
     * @return catalog metric name
     */
    public String name() {
      return spec.name();
    }
  }

  private final MetricCatalog catalog;
  private final List<Entry> entries;
  private final Map<String, Entry> byName;
  private final ScoreBands bands;
  private final double totalWeight;

  private ScoringTable(MetricCatalog catalog, List<Entry> entries, ScoreBands bands) {
    this.catalog = catalog;
    this.entries = List.copyOf(entries);
    Map<String, Entry> index = new LinkedHashMap<>();
    double sum = 0.0;
    for (Entry entry : entries) {
      index.put(entry.name(), entry);
      sum += entry.weight();
    }
    this.byName = index;
    this.bands = bands;
    this.totalWeight = sum;
  }

  /**
   * Applies overrides to the catalog defaults.
   *
   * @param catalog metric catalog
   * @param config per-call overrides
   * @return validated effective table
   * @throws ConfigurationException if an override names an unknown metric, a weight is outside
   *     {@code [0, 1]}, a cap is negative or applied to a non-count metric, or the bands are inconsistent
   */
  public static ScoringTable resolve(MetricCatalog catalog, ScoringConfig config) throws ConfigurationException {
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(config, "config");

    for (Map.Entry<String, Double> override : config.weights().entrySet()) {
      requireKnown(catalog, override.getKey(), "weight");
      Double weight = override.getValue();
      if (weight == null || weight.isNaN() || weight.isInfinite() || weight < 0.0 || weight > 1.0) {
        throw new ConfigurationException(
            "Weight for " + override.getKey() + " must be within [0,1] (was " + weight + ")");
      }
    }
    for (Map.Entry<String, Long> override : config.caps().entrySet()) {
      MetricSpec spec = requireKnown(catalog, override.getKey(), "cap");
      if (spec.kind() != MetricKind.COUNT) {
        String kind = spec.kind().name().toLowerCase(Locale.ROOT);
        throw new ConfigurationException("Cap override for " + spec.name() + " is invalid: metric is "
            + kind + ", caps apply to count metrics only");
      }
      Long cap = override.getValue();
      if (cap == null || cap < 0) {
        throw new ConfigurationException("Cap for " + spec.name() + " must be non-negative (was " + cap + ")");
      }
    }

    List<Entry> entries = new ArrayList<>();
    for (MetricSpec spec : catalog.specs()) {
      double weight = config.weights().getOrDefault(spec.name(), spec.defaultWeight());
      Long cap = null;
      if (spec.kind() == MetricKind.COUNT) {
        OptionalLong defaultCap = spec.defaultCap();
        cap = config.caps().getOrDefault(spec.name(), defaultCap.isPresent() ? defaultCap.getAsLong() : 0L);
      }
      entries.add(new Entry(spec, weight, cap));
    }
    return new ScoringTable(catalog, entries, resolveBands(config.bands()));
  }

  /**
   * Resolves the catalog defaults without overrides.
   *
   * @param catalog metric catalog
   * @return default table
   */
  public static ScoringTable defaults(MetricCatalog catalog) {
    try {
      return resolve(catalog, ScoringConfig.EMPTY);
    } catch (ConfigurationException ex) {
      throw new IllegalStateException("Catalog defaults failed validation", ex);
    }
  }

  private static MetricSpec requireKnown(MetricCatalog catalog, String name, String what)
      throws ConfigurationException {
    Optional<MetricSpec> spec = catalog.find(name);
    if (spec.isEmpty()) {
      throw new ConfigurationException("Unknown metric in " + what + " override: " + name);
    }
    return spec.get();
  }

  private static ScoreBands resolveBands(Map<String, Integer> overrides) throws ConfigurationException {
    int medium = ScoreBands.DEFAULT.mediumFloor();
    int high = ScoreBands.DEFAULT.highFloor();
    for (Map.Entry<String, Integer> band : overrides.entrySet()) {
      Integer value = band.getValue();
      if (value == null) {
        throw new ConfigurationException("Band " + band.getKey() + " must not be null");
      }
      switch (band.getKey()) {
        case "medium" -> medium = value;
        case "high" -> high = value;
        default -> throw new ConfigurationException("Unknown score band: " + band.getKey());
      }
    }
    try {
      return new ScoreBands(medium, high);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("Invalid score bands: " + ex.getMessage(), ex);
    }
  }

  public MetricCatalog catalog() {
    return catalog;
  }

  /**
   * Returns the effective entries in catalog declaration order.
   *
   * @return immutable entry list
   */
  public List<Entry> entries() {
    return entries;
  }

  /**
   * Looks up the entry for a metric.
   *
   * @param name metric name
   * @return entry, or empty when the metric is not in the catalog
   */
  public Optional<Entry> entry(String name) {
    return Optional.ofNullable(byName.get(name));
  }

  public ScoreBands bands() {
    return bands;
  }

  /**
   * Returns the sum of effective configured weights across every catalog metric.
   *
   * @return total weight
   */
  public double totalWeight() {
    return totalWeight;
  }
}
