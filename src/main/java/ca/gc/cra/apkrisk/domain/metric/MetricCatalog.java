package ca.gc.cra.apkrisk.domain.metric;

import static ca.gc.cra.apkrisk.domain.metric.MetricNames.CLEARTEXT_ENDPOINT_COUNT;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.CLEARTEXT_TRAFFIC_PERMITTED;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.COMPONENT_EXPOSURE;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.DEBUGGABLE_APPLICATION;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.DEBUG_OVERRIDES;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.EXPIRED_CERTIFICATE;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.FILE_WRITE_COUNT;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.HARDCODED_SECRET_COUNT;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.MALICIOUS_ENDPOINT_COUNT;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.MISSING_CERTIFICATE_PINNING;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.OTHER_EVENT_COUNT;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.PERMISSION_DENSITY;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.PERMISSION_INVOCATION_COUNT;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.SELF_SIGNED_CERTIFICATE;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.UNTRUSTED_SIGNATURE;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.VULNERABLE_DEPENDENCY_COUNT;
import static ca.gc.cra.apkrisk.domain.metric.MetricNames.YARA_MATCH_COUNT;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, ordered set of metric specifications used by every scoring call.
 *
 * <p><strong>Ordering:</strong> declaration order is significant. Breakdowns list metrics in this order
 * and the rationale uses it to break ties between equal contributions.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the default instance is built once and shared.</p>
 *
 * @since 0.1.0
 */
public final class MetricCatalog {
  private static final MetricCatalog DEFAULTS = new MetricCatalog(List.of(
      MetricSpec.ratio(PERMISSION_DENSITY, ExtractorId.PERMISSIONS, 0.23,
          "elevated declared-permission ratio"),
      MetricSpec.ratio(COMPONENT_EXPOSURE, ExtractorId.MANIFEST, 0.12,
          "many exported components"),
      MetricSpec.flag(DEBUGGABLE_APPLICATION, ExtractorId.MANIFEST, 0.02,
          "debuggable build flag"),
      MetricSpec.flag(CLEARTEXT_TRAFFIC_PERMITTED, ExtractorId.NETWORK_SECURITY, 0.04,
          "cleartext traffic permitted"),
      MetricSpec.flag(MISSING_CERTIFICATE_PINNING, ExtractorId.NETWORK_SECURITY, 0.03,
          "missing certificate pinning"),
      MetricSpec.flag(DEBUG_OVERRIDES, ExtractorId.NETWORK_SECURITY, 0.01,
          "debug network overrides present"),
      MetricSpec.staticCount(HARDCODED_SECRET_COUNT, ExtractorId.SECRETS, 0.04, 10,
          "hardcoded secrets in code or resources"),
      MetricSpec.staticCount(VULNERABLE_DEPENDENCY_COUNT, ExtractorId.DEPENDENCIES, 0.07, 50,
          "known vulnerable dependencies"),
      MetricSpec.flag(EXPIRED_CERTIFICATE, ExtractorId.CRYPTO, 0.03,
          "expired signing certificate"),
      MetricSpec.flag(SELF_SIGNED_CERTIFICATE, ExtractorId.CRYPTO, 0.03,
          "self-signed signing certificate"),
      MetricSpec.flag(UNTRUSTED_SIGNATURE, ExtractorId.SIGNATURE, 0.04,
          "untrusted or missing signature"),
      MetricSpec.staticCount(YARA_MATCH_COUNT, ExtractorId.YARA, 0.04, 10,
          "YARA rule matches"),
      MetricSpec.dynamicCount(PERMISSION_INVOCATION_COUNT, 0.12, 50,
          "frequent runtime permission use"),
      MetricSpec.dynamicCount(CLEARTEXT_ENDPOINT_COUNT, 0.08, 10,
          "cleartext network endpoints contacted"),
      MetricSpec.dynamicCount(FILE_WRITE_COUNT, 0.06, 100,
          "file system writes observed"),
      MetricSpec.dynamicCount(MALICIOUS_ENDPOINT_COUNT, 0.03, 10,
          "connections to known malicious endpoints"),
      MetricSpec.dynamicCount(OTHER_EVENT_COUNT, 0.01, 100,
          "unclassified runtime events")));

  private final List<MetricSpec> specs;
  private final Map<String, MetricSpec> byName;

  /**
   * Creates a catalog from an ordered list of specifications.
   *
   * @param specs ordered specifications; names must be unique
   * @throws IllegalArgumentException when names repeat
   */
  public MetricCatalog(List<MetricSpec> specs) {
    Objects.requireNonNull(specs, "specs");
    Map<String, MetricSpec> index = new LinkedHashMap<>();
    for (MetricSpec spec : specs) {
      if (index.put(spec.name(), spec) != null) {
        throw new IllegalArgumentException("Duplicate metric in catalog: " + spec.name());
      }
    }
    this.specs = List.copyOf(specs);
    this.byName = Map.copyOf(index);
  }

  /**
   * Returns the default catalog, whose weights sum to {@code 1.0}.
   *
   * @return shared default catalog
   */
  public static MetricCatalog defaults() {
    return DEFAULTS;
  }

  /**
   * Returns all specifications in declaration order.
   *
   * @return immutable ordered list
   */
  public List<MetricSpec> specs() {
    return specs;
  }

  /**
   * Looks up a specification by name.
   *
   * @param name metric name
   * @return specification, or empty when unknown
   */
  public Optional<MetricSpec> find(String name) {
    return Optional.ofNullable(name == null ? null : byName.get(name));
  }

  /**
   * Reports whether the catalog defines {@code name}.
   *
   * @param name metric name
   * @return {@code true} when known
   */
  public boolean contains(String name) {
    return name != null && byName.containsKey(name);
  }

  /**
   * Returns the declaration index of a metric, used as the rationale tie-break.
   *
   * @param name metric name
   * @return zero-based index, or {@code -1} when unknown
   */
  public int ordinal(String name) {
    for (int i = 0; i < specs.size(); i++) {
      if (specs.get(i).name().equals(name)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Returns the specifications owned by one static extractor, in declaration order.
   *
   * @param extractor extractor to filter by
   * @return immutable list, possibly empty
   */
  public List<MetricSpec> forExtractor(ExtractorId extractor) {
    List<MetricSpec> result = new ArrayList<>();
    for (MetricSpec spec : specs) {
      if (spec.extractor() == extractor) {
        result.add(spec);
      }
    }
    return List.copyOf(result);
  }

  /**
   * Returns the specifications of a given source, in declaration order.
   *
   * @param source static or dynamic
   * @return immutable list
   */
  public List<MetricSpec> forSource(MetricSource source) {
    List<MetricSpec> result = new ArrayList<>();
    for (MetricSpec spec : specs) {
      if (spec.source() == source) {
        result.add(spec);
      }
    }
    return List.copyOf(result);
  }

  /**
   * Sums the default weights.
   *
   * @return total default weight mass
   */
  public double totalDefaultWeight() {
    double total = 0.0;
    for (MetricSpec spec : specs) {
      total += spec.defaultWeight();
    }
    return total;
  }
}
