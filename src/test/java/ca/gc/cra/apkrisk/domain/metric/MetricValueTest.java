package ca.gc.cra.apkrisk.domain.metric;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MetricValueTest {

  @Test
  void continuousValuesAreClampedToUnitInterval() {
    assertEquals(1.0, MetricValue.continuous("density", MetricSource.STATIC, 1.7).rawValue());
    assertEquals(0.0, MetricValue.continuous("density", MetricSource.STATIC, -0.2).rawValue());
    assertEquals(0.35, MetricValue.continuous("density", MetricSource.STATIC, 0.35).rawValue());
  }

  @Test
  void countsMustBeNonNegativeIntegers() {
    assertEquals(7.0, MetricValue.count("writes", MetricSource.DYNAMIC, 7).rawValue());
    assertThrows(IllegalArgumentException.class, () -> MetricValue.count("writes", MetricSource.DYNAMIC, -1));
    assertThrows(IllegalArgumentException.class,
        () -> new MetricValue("writes", 2.5, MetricKind.COUNT, MetricSource.DYNAMIC, true));
  }

  @Test
  void booleansCollapseToZeroOrOne() {
    MetricValue value = new MetricValue("flag", 0.3, MetricKind.BOOLEAN, MetricSource.STATIC, true);
    assertEquals(1.0, value.rawValue());
    assertTrue(value.asFlag());
    assertFalse(MetricValue.flag("flag", MetricSource.STATIC, false).asFlag());
  }

  @Test
  void unavailableValuesCarryZero() {
    MetricSpec spec = MetricCatalog.defaults().find(MetricNames.YARA_MATCH_COUNT).orElseThrow();
    MetricValue value = MetricValue.unavailable(spec);
    assertFalse(value.available());
    assertEquals(0.0, value.rawValue());
    assertEquals(MetricKind.COUNT, value.kind());
  }

  @Test
  void rejectsBlankNamesAndNonFiniteValues() {
    assertThrows(IllegalArgumentException.class, () -> MetricValue.continuous(" ", MetricSource.STATIC, 0.1));
    assertThrows(IllegalArgumentException.class,
        () -> MetricValue.continuous("density", MetricSource.STATIC, Double.NaN));
    assertThrows(NullPointerException.class, () -> MetricValue.continuous(null, MetricSource.STATIC, 0.1));
  }
}
