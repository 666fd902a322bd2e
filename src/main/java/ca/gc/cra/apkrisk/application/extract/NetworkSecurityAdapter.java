package ca.gc.cra.apkrisk.application.extract;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.List;
import java.util.Map;

/**
 * Maps network security configuration findings to cleartext, pinning and debug-override flags.
 *
 * @since 0.1.0
 */
public final class NetworkSecurityAdapter implements ExtractorAdapter {
  @Override
  public ExtractorId id() {
    return ExtractorId.NETWORK_SECURITY;
  }

  @Override
  public List<MetricValue> adapt(Map<String, Object> findings) {
    boolean cleartext = RawFindings.booleanOrDefault(findings, "cleartext_permitted", false);
    boolean pinned = RawFindings.booleanOrDefault(findings, "certificate_pinning", false);
    boolean debugOverrides = RawFindings.booleanOrDefault(findings, "debug_overrides", false);
    return List.of(
        MetricValue.flag(MetricNames.CLEARTEXT_TRAFFIC_PERMITTED, MetricSource.STATIC, cleartext),
        MetricValue.flag(MetricNames.MISSING_CERTIFICATE_PINNING, MetricSource.STATIC, !pinned),
        MetricValue.flag(MetricNames.DEBUG_OVERRIDES, MetricSource.STATIC, debugOverrides));
  }
}
