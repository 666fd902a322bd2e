package ca.gc.cra.apkrisk.application.extract;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.List;
import java.util.Map;

/**
 * Maps signing certificate findings to expiry and self-signed flags.
 *
 * @since 0.1.0
 */
public final class CryptoAdapter implements ExtractorAdapter {
  @Override
  public ExtractorId id() {
    return ExtractorId.CRYPTO;
  }

  @Override
  public List<MetricValue> adapt(Map<String, Object> findings) {
    boolean expired = RawFindings.booleanOrDefault(findings, "expired", false);
    boolean selfSigned = RawFindings.booleanOrDefault(findings, "self_signed", false);
    return List.of(
        MetricValue.flag(MetricNames.EXPIRED_CERTIFICATE, MetricSource.STATIC, expired),
        MetricValue.flag(MetricNames.SELF_SIGNED_CERTIFICATE, MetricSource.STATIC, selfSigned));
  }
}
