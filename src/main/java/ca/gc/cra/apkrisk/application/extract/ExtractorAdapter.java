package ca.gc.cra.apkrisk.application.extract;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.List;
import java.util.Map;

/**
 * Converts one extractor's raw findings into typed static metrics.
 *
 * <p>Implementations are stateless. They emit exactly the catalog metrics owned by {@link #id()} and
 * throw {@link IllegalArgumentException} when the findings do not have the expected shape.</p>
 *
 * @since 0.1.0
 */
public interface ExtractorAdapter {
  /**
   * Returns the extractor whose findings this adapter understands.
   *
   * @return extractor identifier
   */
  ExtractorId id();

  /**
   * Maps findings to metrics.
   *
   * @param findings raw findings tree
   * @return available metric values in catalog order
   * @throws IllegalArgumentException if the findings are malformed
   */
  List<MetricValue> adapt(Map<String, Object> findings);
}
