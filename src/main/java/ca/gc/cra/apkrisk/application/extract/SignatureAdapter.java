package ca.gc.cra.apkrisk.application.extract;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.List;
import java.util.Map;

/**
 * Flags packages whose signature did not verify. A missing {@code trusted} field counts as untrusted.
 *
 * @since 0.1.0
 */
public final class SignatureAdapter implements ExtractorAdapter {
  @Override
  public ExtractorId id() {
    return ExtractorId.SIGNATURE;
  }

  @Override
  public List<MetricValue> adapt(Map<String, Object> findings) {
    boolean trusted = RawFindings.booleanOrDefault(findings, "trusted", false);
    return List.of(MetricValue.flag(MetricNames.UNTRUSTED_SIGNATURE, MetricSource.STATIC, !trusted));
  }
}
