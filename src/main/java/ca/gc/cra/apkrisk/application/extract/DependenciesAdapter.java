package ca.gc.cra.apkrisk.application.extract;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.List;
import java.util.Map;

/**
 * Counts dependencies matched against known CVEs.
 *
 * @since 0.1.0
 */
public final class DependenciesAdapter implements ExtractorAdapter {
  @Override
  public ExtractorId id() {
    return ExtractorId.DEPENDENCIES;
  }

  @Override
  public List<MetricValue> adapt(Map<String, Object> findings) {
    long count = CountFindings.count(findings, "vulnerable", "vulnerable_count");
    return List.of(
        MetricValue.count(MetricNames.VULNERABLE_DEPENDENCY_COUNT, MetricSource.STATIC, count));
  }
}
