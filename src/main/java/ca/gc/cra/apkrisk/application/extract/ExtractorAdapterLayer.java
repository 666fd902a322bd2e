package ca.gc.cra.apkrisk.application.extract;

import ca.gc.cra.apkrisk.domain.assessment.AssessmentNotice;
import ca.gc.cra.apkrisk.domain.error.MandatoryExtractorMissingException;
import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import ca.gc.cra.apkrisk.domain.feature.FeatureAvailability;
import ca.gc.cra.apkrisk.domain.feature.OptionalFeature;
import ca.gc.cra.apkrisk.domain.metric.MetricCatalog;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricSpec;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Turns per-extractor results into typed static metrics.
 * <p><strong>Why:</strong> Optional scanners come and go between installations; their absence must
 * degrade the assessment gracefully instead of failing it.</p>
 * <p><strong>Role:</strong> First stage of the assessment pipeline, run while the job is
 * {@code COLLECTING}.</p>
 * <p><strong>Behavior:</strong>
 * <ul>
 *   <li>Mandatory extractors (manifest, permissions) that are missing, unavailable or malformed raise
 *   {@link MandatoryExtractorMissingException}.</li>
 *   <li>Optional extractors in that situation, or whose capability is not installed, yield one neutral
 *   notice and unavailable placeholders for every metric they own.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless after construction; safe to share across jobs.</p>
 *
 * @since 0.1.0
 */
public final class ExtractorAdapterLayer {
  private static final Logger log = LoggerFactory.getLogger(ExtractorAdapterLayer.class);

  private final MetricCatalog catalog;
  private final Map<ExtractorId, ExtractorAdapter> adapters;

  /**
   * Creates a layer over the supplied adapters.
   *
   * @param catalog metric catalog that defines which static metrics exist
   * @param adapters one adapter per extractor
   * @throws IllegalArgumentException if an extractor has no adapter or has more than one
   */
  public ExtractorAdapterLayer(MetricCatalog catalog, List<? extends ExtractorAdapter> adapters) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(adapters, "adapters");
    Map<ExtractorId, ExtractorAdapter> byId = new EnumMap<>(ExtractorId.class);
    for (ExtractorAdapter adapter : adapters) {
      if (byId.put(adapter.id(), adapter) != null) {
        throw new IllegalArgumentException("Duplicate adapter for extractor " + adapter.id().key());
      }
    }
    for (ExtractorId id : ExtractorId.values()) {
      if (!byId.containsKey(id)) {
        throw new IllegalArgumentException("No adapter registered for extractor " + id.key());
      }
    }
    this.adapters = byId;
  }

  /**
   * Creates a layer with the built-in adapter for every extractor.
   *
   * @param catalog metric catalog
   * @return adapter layer
   */
  public static ExtractorAdapterLayer withDefaultAdapters(MetricCatalog catalog) {
    return new ExtractorAdapterLayer(catalog, List.of(
        new ManifestAdapter(),
        new PermissionsAdapter(),
        new NetworkSecurityAdapter(),
        new SecretsAdapter(),
        new DependenciesAdapter(),
        new CryptoAdapter(),
        new SignatureAdapter(),
        new YaraAdapter()));
  }

  /**
   * Adapts every extractor result.
   *
   * @param results results keyed by extractor; extractors that never reported are simply absent
   * @param features optional capabilities probed at pipeline start
   * @return static metrics in catalog order plus notices for skipped capabilities
   * @throws MandatoryExtractorMissingException if manifest or permission data cannot be used
   */
  public AdaptedStaticMetrics adapt(Map<ExtractorId, ExtractorResult> results, FeatureAvailability features)
      throws MandatoryExtractorMissingException {
    Objects.requireNonNull(results, "results");
    Objects.requireNonNull(features, "features");
    Map<String, MetricValue> byName = new HashMap<>();
    List<AssessmentNotice> notices = new ArrayList<>();

    for (ExtractorId id : ExtractorId.values()) {
      ExtractorResult result = results.get(id);
      try (MDC.MDCCloseable ignored = MDC.putCloseable("extractor", id.key())) {
        List<MetricValue> values = id.mandatory()
            ? adaptMandatory(id, result)
            : adaptOptional(id, result, features, notices);
        for (MetricValue value : values) {
          byName.put(value.name(), value);
        }
      }
    }

    List<MetricValue> ordered = new ArrayList<>();
    for (MetricSpec spec : catalog.forSource(MetricSource.STATIC)) {
      MetricValue value = byName.get(spec.name());
      // catalog metrics no adapter reported count as measured zero
      ordered.add(value != null ? value : zero(spec));
    }
    return new AdaptedStaticMetrics(ordered, notices);
  }

  private List<MetricValue> adaptMandatory(ExtractorId id, ExtractorResult result)
      throws MandatoryExtractorMissingException {
    if (result == null) {
      throw new MandatoryExtractorMissingException(id, "extractor did not report");
    }
    if (result instanceof ExtractorResult.Unavailable unavailable) {
      throw new MandatoryExtractorMissingException(id, "reported unavailable (" + unavailable.reason() + ")");
    }
    ExtractorResult.Present present = (ExtractorResult.Present) result;
    try {
      List<MetricValue> values = adapters.get(id).adapt(present.findings());
      log.debug("Adapted {} metrics from {}", values.size(), id.key());
      return values;
    } catch (IllegalArgumentException ex) {
      throw new MandatoryExtractorMissingException(id, "malformed findings: " + ex.getMessage(), ex);
    }
  }

  private List<MetricValue> adaptOptional(
      ExtractorId id, ExtractorResult result, FeatureAvailability features, List<AssessmentNotice> notices) {
    OptionalFeature feature = id.feature().orElseThrow();
    String reason;
    if (!features.isAvailable(feature)) {
      reason = "capability not installed";
    } else if (result == null) {
      reason = "extractor did not report";
    } else if (result instanceof ExtractorResult.Unavailable unavailable) {
      reason = unavailable.reason();
    } else {
      ExtractorResult.Present present = (ExtractorResult.Present) result;
      try {
        List<MetricValue> values = adapters.get(id).adapt(present.findings());
        log.debug("Adapted {} metrics from {}", values.size(), id.key());
        return values;
      } catch (IllegalArgumentException ex) {
        log.warn("Discarding malformed {} findings: {}", id.key(), ex.getMessage());
        reason = "malformed findings";
      }
    }

    AssessmentNotice notice = AssessmentNotice.optionalFeatureUnavailable(feature);
    notices.add(notice);
    log.info("{} ({})", notice.message(), reason);
    List<MetricValue> placeholders = new ArrayList<>();
    for (MetricSpec spec : catalog.forExtractor(id)) {
      placeholders.add(MetricValue.unavailable(spec));
    }
    return placeholders;
  }

  private static MetricValue zero(MetricSpec spec) {
    return new MetricValue(spec.name(), 0.0, spec.kind(), spec.source(), true);
  }
}
