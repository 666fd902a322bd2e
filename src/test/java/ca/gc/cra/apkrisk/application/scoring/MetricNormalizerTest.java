package ca.gc.cra.apkrisk.application.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.apkrisk.domain.error.ConfigurationException;
import ca.gc.cra.apkrisk.domain.metric.MetricCatalog;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricSpec;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricNormalizerTest {
  private final MetricCatalog catalog = MetricCatalog.defaults();
  private final MetricNormalizer normalizer = new MetricNormalizer();

  @Test
  void countsAboveCapNormalizeLikeTheCap() throws ConfigurationException {
    ScoringTable table = ScoringTable.resolve(catalog,
        new ScoringConfig(Map.of(), Map.of(MetricNames.PERMISSION_INVOCATION_COUNT, 50L), Map.of()));

    double atCap = normalizedFor(table, 50);
    double beyondCap = normalizedFor(table, 75);

    assertEquals(1.0, atCap);
    assertEquals(atCap, beyondCap);
    assertEquals(0.5, normalizedFor(table, 25));
  }

  @Test
  void countNormalizationIsMonotonic() {
    ScoringTable table = ScoringTable.defaults(catalog);
    double previous = -1.0;
    for (long count = 0; count <= 80; count += 5) {
      double current = normalizedFor(table, count);
      assertTrue(current >= previous, "not monotonic at " + count);
      previous = current;
    }
  }

  @Test
  void zeroCapNormalizesToZero() throws ConfigurationException {
    ScoringTable table = ScoringTable.resolve(catalog,
        new ScoringConfig(Map.of(), Map.of(MetricNames.PERMISSION_INVOCATION_COUNT, 0L), Map.of()));

    assertEquals(0.0, normalizedFor(table, 12));
  }

  @Test
  void absentMetricsBecomeAvailableZeros() {
    List<NormalizedMetric> result = normalizer.normalize(
        List.of(MetricValue.continuous(MetricNames.PERMISSION_DENSITY, MetricSource.STATIC, 0.6)),
        ScoringTable.defaults(catalog));

    assertEquals(catalog.specs().size(), result.size());
    assertEquals(MetricNames.PERMISSION_DENSITY, result.get(0).name());
    assertEquals(0.6, result.get(0).normalized());
    for (NormalizedMetric metric : result.subList(1, result.size())) {
      assertTrue(metric.available(), metric.name());
      assertEquals(0.0, metric.normalized(), metric.name());
    }
  }

  @Test
  void unavailableMetricsStayUnavailable() {
    MetricSpec yara = catalog.find(MetricNames.YARA_MATCH_COUNT).orElseThrow();

    List<NormalizedMetric> result = normalizer.normalize(
        List.of(MetricValue.unavailable(yara)), ScoringTable.defaults(catalog));

    NormalizedMetric metric = result.get(catalog.ordinal(MetricNames.YARA_MATCH_COUNT));
    assertFalse(metric.available());
    assertEquals(0.0, metric.normalized());
  }

  @Test
  void rejectsUnknownDuplicateOrMistypedMetrics() {
    ScoringTable table = ScoringTable.defaults(catalog);

    assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(
        List.of(MetricValue.count("battery_drain", MetricSource.DYNAMIC, 3)), table));
    assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(
        List.of(MetricValue.count(MetricNames.PERMISSION_DENSITY, MetricSource.STATIC, 3)), table));
    MetricValue writes = MetricValue.count(MetricNames.FILE_WRITE_COUNT, MetricSource.DYNAMIC, 3);
    assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(List.of(writes, writes), table));
  }

  private double normalizedFor(ScoringTable table, long invocations) {
    List<NormalizedMetric> result = normalizer.normalize(
        List.of(MetricValue.count(MetricNames.PERMISSION_INVOCATION_COUNT, MetricSource.DYNAMIC, invocations)),
        table);
    return result.get(catalog.ordinal(MetricNames.PERMISSION_INVOCATION_COUNT)).normalized();
  }
}
