package ca.gc.cra.apkrisk.domain.metric;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Catalog entry describing one risk metric and its default scoring parameters.
 *
 * @param name metric name used in overrides, breakdowns, and rationales
 * @param kind value shape
 * @param source static or dynamic origin
 * @param extractor owning static extractor; {@code null} for dynamic metrics
 * @param defaultWeight default weight in {@code [0, 1]}
 * @param cap default cap for count metrics; {@code null} for other kinds
 * @param description phrase completing "due to ..." in rationale lines
 * @since 0.1.0
 */
public record MetricSpec(
    String name,
    MetricKind kind,
    MetricSource source,
    ExtractorId extractor,
    double defaultWeight,
    Long cap,
    String description) {

  /**
   * Validates catalog invariants.
   */
  public MetricSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(description, "description");
    if (!(defaultWeight >= 0.0 && defaultWeight <= 1.0)) {
      throw new IllegalArgumentException("default weight for " + name + " must be within [0,1]");
    }
    if (source == MetricSource.STATIC && extractor == null) {
      throw new IllegalArgumentException("static metric " + name + " requires an extractor");
    }
    if (source == MetricSource.DYNAMIC && extractor != null) {
      throw new IllegalArgumentException("dynamic metric " + name + " must not declare an extractor");
    }
    if (kind == MetricKind.COUNT) {
      if (cap == null || cap < 0) {
        throw new IllegalArgumentException("count metric " + name + " requires a non-negative cap");
      }
    } else if (cap != null) {
      throw new IllegalArgumentException("only count metrics carry a cap (" + name + ")");
    }
  }

  static MetricSpec ratio(String name, ExtractorId extractor, double weight, String description) {
    return new MetricSpec(name, MetricKind.CONTINUOUS, MetricSource.STATIC, extractor, weight, null, description);
  }

  static MetricSpec flag(String name, ExtractorId extractor, double weight, String description) {
    return new MetricSpec(name, MetricKind.BOOLEAN, MetricSource.STATIC, extractor, weight, null, description);
  }

  static MetricSpec staticCount(
      String name, ExtractorId extractor, double weight, long cap, String description) {
    return new MetricSpec(name, MetricKind.COUNT, MetricSource.STATIC, extractor, weight, cap, description);
  }

  static MetricSpec dynamicCount(String name, double weight, long cap, String description) {
    return new MetricSpec(name, MetricKind.COUNT, MetricSource.DYNAMIC, null, weight, cap, description);
  }

  /**
   * Returns the owning extractor.
   *
   * @return extractor for static metrics; empty for dynamic metrics
   */
  public Optional<ExtractorId> extractorId() {
    return Optional.ofNullable(extractor);
  }

  /**
   * Returns the default cap.
   *
   * @return cap for count metrics; empty otherwise
   */
  public OptionalLong defaultCap() {
    return cap == null ? OptionalLong.empty() : OptionalLong.of(cap);
  }
}
