package ca.gc.cra.apkrisk.infrastructure.feature;

import ca.gc.cra.apkrisk.application.port.FeatureProbe;
import ca.gc.cra.apkrisk.domain.feature.FeatureAvailability;
import ca.gc.cra.apkrisk.domain.feature.OptionalFeature;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link FeatureProbe} that applies explicit {@code features.<label>=true|false} settings on top of a
 * delegate probe.
 *
 * @since 0.1.0
 */
public final class ConfiguredFeatureProbe implements FeatureProbe {
  private final FeatureProbe delegate;
  private final Map<OptionalFeature, Boolean> overrides;

  /**
   * Creates a probe.
   *
   * @param delegate probe consulted for capabilities without an override
   * @param overrides forced availability per capability
   */
  public ConfiguredFeatureProbe(FeatureProbe delegate, Map<OptionalFeature, Boolean> overrides) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    Map<OptionalFeature, Boolean> copy = new EnumMap<>(OptionalFeature.class);
    copy.putAll(Objects.requireNonNull(overrides, "overrides"));
    this.overrides = copy;
  }

  /**
   * Parses overrides from flattened configuration keys such as {@code features.yara=false}.
   *
   * @param flat flattened configuration
   * @return overrides keyed by capability
   * @throws IllegalArgumentException if a key names an unknown capability or a value is not boolean
   */
  public static Map<OptionalFeature, Boolean> parseOverrides(Map<String, String> flat) {
    Map<OptionalFeature, Boolean> overrides = new EnumMap<>(OptionalFeature.class);
    for (Map.Entry<String, String> entry : flat.entrySet()) {
      if (!entry.getKey().startsWith("features.")) {
        continue;
      }
      OptionalFeature feature = OptionalFeature.fromLabel(entry.getKey().substring("features.".length()));
      String value = entry.getValue() == null ? "" : entry.getValue().trim();
      if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
        throw new IllegalArgumentException(entry.getKey() + " must be true or false (was '" + value + "')");
      }
      overrides.put(feature, Boolean.parseBoolean(value));
    }
    return overrides;
  }

  @Override
  public FeatureAvailability probe() {
    Set<OptionalFeature> available = EnumSet.noneOf(OptionalFeature.class);
    available.addAll(delegate.probe().available());
    for (Map.Entry<OptionalFeature, Boolean> override : overrides.entrySet()) {
      if (override.getValue()) {
        available.add(override.getKey());
      } else {
        available.remove(override.getKey());
      }
    }
    return FeatureAvailability.of(available);
  }
}
