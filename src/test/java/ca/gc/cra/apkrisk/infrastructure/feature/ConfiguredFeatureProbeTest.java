package ca.gc.cra.apkrisk.infrastructure.feature;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.apkrisk.application.port.FeatureProbe;
import ca.gc.cra.apkrisk.domain.feature.FeatureAvailability;
import ca.gc.cra.apkrisk.domain.feature.OptionalFeature;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ConfiguredFeatureProbeTest {

  @Test
  void parsesFeatureKeysByLabelOrName() {
    Map<OptionalFeature, Boolean> overrides = ConfiguredFeatureProbe.parseOverrides(Map.of(
        "features.yara", "false",
        "features.SECRET_SCANNER", "TRUE",
        "format", "json"));

    assertEquals(Map.of(OptionalFeature.YARA_ENGINE, false, OptionalFeature.SECRET_SCANNER, true), overrides);
  }

  @Test
  void rejectsUnknownFeaturesAndNonBooleans() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfiguredFeatureProbe.parseOverrides(Map.of("features.frida", "true")));
    assertThrows(IllegalArgumentException.class,
        () -> ConfiguredFeatureProbe.parseOverrides(Map.of("features.yara", "maybe")));
  }

  @Test
  void overridesAddAndRemoveCapabilities() {
    FeatureProbe base = () -> FeatureAvailability.of(Set.of(OptionalFeature.YARA_ENGINE));
    ConfiguredFeatureProbe probe = new ConfiguredFeatureProbe(base, Map.of(
        OptionalFeature.YARA_ENGINE, false,
        OptionalFeature.CERTIFICATE_PARSER, true));

    FeatureAvailability features = probe.probe();

    assertFalse(features.isAvailable(OptionalFeature.YARA_ENGINE));
    assertTrue(features.isAvailable(OptionalFeature.CERTIFICATE_PARSER));
    assertEquals(1, features.available().size());
  }
}
