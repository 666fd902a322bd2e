package ca.gc.cra.apkrisk.application.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.apkrisk.domain.error.ConfigurationException;
import ca.gc.cra.apkrisk.domain.metric.MetricCatalog;
import ca.gc.cra.apkrisk.domain.metric.MetricKind;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricSpec;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WeightedScoringEngineTest {
  private final MetricCatalog catalog = MetricCatalog.defaults();
  private final ScoringTable defaults = ScoringTable.defaults(catalog);
  private final MetricNormalizer normalizer = new MetricNormalizer();
  private final WeightedScoringEngine engine = new WeightedScoringEngine();

  @Test
  void singleRatioMetricScoresItsWeightedTerm() {
    ScoreResult result = score(List.of(
        MetricValue.continuous(MetricNames.PERMISSION_DENSITY, MetricSource.STATIC, 0.6)), defaults);

    assertEquals(14, result.score());
    assertEquals(13.8, result.breakdown().get(MetricNames.PERMISSION_DENSITY), 1e-9);
    assertEquals(0.0, result.breakdown().get(MetricNames.FILE_WRITE_COUNT), 1e-9);
  }

  @Test
  void allZeroMetricsScoreZero() {
    ScoreResult result = score(List.of(), defaults);

    assertEquals(0, result.score());
    assertEquals(catalog.specs().size(), result.breakdown().size());
  }

  @Test
  void worstCaseReachesOneHundred() {
    assertEquals(100, score(worstCase(false), defaults).score());
  }

  @Test
  void unavailableMetricIsExcludedAndItsWeightRedistributed() {
    ScoreResult result = score(worstCase(true), defaults);

    assertEquals(100, result.score());
    assertFalse(result.breakdown().containsKey(MetricNames.YARA_MATCH_COUNT));
    assertEquals(catalog.specs().size() - 1, result.breakdown().size());
    double effectiveTotal = 0.0;
    for (ScoreResult.Contribution contribution : result.contributions()) {
      effectiveTotal += contribution.effectiveWeight();
    }
    assertEquals(defaults.totalWeight(), effectiveTotal, 1e-9);
  }

  @Test
  void everythingUnavailableScoresZero() {
    List<MetricValue> values = new ArrayList<>();
    for (MetricSpec spec : catalog.specs()) {
      values.add(MetricValue.unavailable(spec));
    }

    ScoreResult result = score(values, defaults);

    assertEquals(0, result.score());
    assertTrue(result.breakdown().isEmpty());
    assertTrue(result.contributions().isEmpty());
  }

  @Test
  void identicalInputsScoreIdentically() {
    List<MetricValue> values = List.of(
        MetricValue.continuous(MetricNames.COMPONENT_EXPOSURE, MetricSource.STATIC, 0.37),
        MetricValue.count(MetricNames.FILE_WRITE_COUNT, MetricSource.DYNAMIC, 42),
        MetricValue.flag(MetricNames.DEBUGGABLE_APPLICATION, MetricSource.STATIC, true));

    ScoreResult first = score(values, defaults);
    ScoreResult second = score(values, defaults);

    assertEquals(first.score(), second.score());
    assertEquals(first.rawScore(), second.rawScore());
    assertEquals(first.breakdown(), second.breakdown());
  }

  @Test
  void weightOverridesApplyOnlyToTheTableTheyResolve() throws ConfigurationException {
    List<MetricValue> values = List.of(
        MetricValue.continuous(MetricNames.PERMISSION_DENSITY, MetricSource.STATIC, 0.6));
    ScoringTable heavier = ScoringTable.resolve(catalog,
        new ScoringConfig(Map.of(MetricNames.PERMISSION_DENSITY, 0.5), Map.of(), Map.of()));

    ScoreResult overridden = score(values, heavier);
    ScoreResult untouched = score(values, defaults);

    assertEquals(30, overridden.score());
    assertEquals(14, untouched.score());
    assertEquals(0.23, catalog.find(MetricNames.PERMISSION_DENSITY).orElseThrow().defaultWeight());
  }

  private ScoreResult score(List<MetricValue> values, ScoringTable table) {
    return engine.score(normalizer.normalize(values, table), table);
  }

  private List<MetricValue> worstCase(boolean yaraUnavailable) {
    List<MetricValue> values = new ArrayList<>();
    for (MetricSpec spec : catalog.specs()) {
      if (yaraUnavailable && spec.name().equals(MetricNames.YARA_MATCH_COUNT)) {
        values.add(MetricValue.unavailable(spec));
        continue;
      }
      double raw = spec.kind() == MetricKind.COUNT ? spec.cap() : 1.0;
      values.add(new MetricValue(spec.name(), raw, spec.kind(), spec.source(), true));
    }
    return values;
  }
}
