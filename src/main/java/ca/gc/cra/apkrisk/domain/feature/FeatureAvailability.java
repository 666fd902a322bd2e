package ca.gc.cra.apkrisk.domain.feature;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of which optional capabilities are installed, probed once at pipeline start.
 *
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across concurrent jobs.</p>
 *
 * @since 0.1.0
 */
public final class FeatureAvailability {
  private static final FeatureAvailability ALL =
      new FeatureAvailability(EnumSet.allOf(OptionalFeature.class));

  private final Set<OptionalFeature> available;

  private FeatureAvailability(Set<OptionalFeature> available) {
    this.available = Set.copyOf(available);
  }

  /**
   * Returns an availability snapshot in which every optional feature is installed.
   *
   * @return shared instance
   */
  public static FeatureAvailability allAvailable() {
    return ALL;
  }

  /**
   * Creates a snapshot containing exactly the supplied features.
   *
   * @param features installed features; must not be {@code null}
   * @return availability snapshot
   */
  public static FeatureAvailability of(Set<OptionalFeature> features) {
    Objects.requireNonNull(features, "features");
    return new FeatureAvailability(features.isEmpty() ? EnumSet.noneOf(OptionalFeature.class) : EnumSet.copyOf(features));
  }

  /**
   * Returns a copy of this snapshot with {@code feature} removed.
   *
   * @param feature feature to mark missing
   * @return new snapshot
   */
  public FeatureAvailability without(OptionalFeature feature) {
    Objects.requireNonNull(feature, "feature");
    EnumSet<OptionalFeature> copy = EnumSet.noneOf(OptionalFeature.class);
    copy.addAll(available);
    copy.remove(feature);
    return new FeatureAvailability(copy);
  }

  /**
   * Reports whether the feature is installed.
   *
   * @param feature feature to query
   * @return {@code true} when available
   */
  public boolean isAvailable(OptionalFeature feature) {
    return available.contains(feature);
  }

  /**
   * Returns the installed features.
   *
   * @return immutable set of features
   */
  public Set<OptionalFeature> available() {
    return available;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FeatureAvailability other && available.equals(other.available);
  }

  @Override
  public int hashCode() {
    return available.hashCode();
  }

  @Override
  public String toString() {
    return "FeatureAvailability" + available;
  }
}
