package ca.gc.cra.apkrisk.application.extract;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.List;
import java.util.Map;

/**
 * Totals YARA hits. {@code matches} may be a list of hits or a mapping of rule name to hits.
 *
 * @since 0.1.0
 */
public final class YaraAdapter implements ExtractorAdapter {
  @Override
  public ExtractorId id() {
    return ExtractorId.YARA;
  }

  @Override
  public List<MetricValue> adapt(Map<String, Object> findings) {
    long count = CountFindings.count(findings, "matches", "count");
    return List.of(MetricValue.count(MetricNames.YARA_MATCH_COUNT, MetricSource.STATIC, count));
  }
}
