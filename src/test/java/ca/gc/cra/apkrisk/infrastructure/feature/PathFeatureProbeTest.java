package ca.gc.cra.apkrisk.infrastructure.feature;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import ca.gc.cra.apkrisk.domain.feature.FeatureAvailability;
import ca.gc.cra.apkrisk.domain.feature.OptionalFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathFeatureProbeTest {
  @TempDir Path bin;

  @Test
  void featureIsAvailableWhenItsExecutableIsOnThePath() throws IOException {
    Path yara = Files.createFile(bin.resolve("yara"));
    assumeTrue(yara.toFile().setExecutable(true), "filesystem does not support executable bit");

    PathFeatureProbe probe = new PathFeatureProbe(List.of(bin), Map.of(
        OptionalFeature.YARA_ENGINE, "yara",
        OptionalFeature.SECRET_SCANNER, "jadx"));

    FeatureAvailability features = probe.probe();

    assertTrue(features.isAvailable(OptionalFeature.YARA_ENGINE));
    assertFalse(features.isAvailable(OptionalFeature.SECRET_SCANNER));
    // features without a mapped executable are not probed
    assertTrue(features.isAvailable(OptionalFeature.DEPENDENCY_SCANNER));
  }

  @Test
  void emptySearchPathFindsNothing() {
    FeatureAvailability features =
        new PathFeatureProbe(List.of(), PathFeatureProbe.DEFAULT_EXECUTABLES).probe();

    assertFalse(features.isAvailable(OptionalFeature.YARA_ENGINE));
    assertFalse(features.isAvailable(OptionalFeature.SIGNATURE_VERIFIER));
    assertTrue(features.isAvailable(OptionalFeature.DEPENDENCY_SCANNER));
  }
}
