package ca.gc.cra.apkrisk.application.extract;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.List;
import java.util.Map;

/**
 * Counts hardcoded secrets from a {@code findings} list or a precomputed {@code count}.
 *
 * @since 0.1.0
 */
public final class SecretsAdapter implements ExtractorAdapter {
  @Override
  public ExtractorId id() {
    return ExtractorId.SECRETS;
  }

  @Override
  public List<MetricValue> adapt(Map<String, Object> findings) {
    long count = CountFindings.count(findings, "findings", "count");
    return List.of(MetricValue.count(MetricNames.HARDCODED_SECRET_COUNT, MetricSource.STATIC, count));
  }
}
