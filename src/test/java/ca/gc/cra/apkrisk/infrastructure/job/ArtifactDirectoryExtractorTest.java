package ca.gc.cra.apkrisk.infrastructure.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import ca.gc.cra.apkrisk.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactDirectoryExtractorTest {
  @TempDir Path artifacts;

  private final JsonSupport json = new JsonSupport();

  @Test
  void readsFindingsFromNamedJsonFile() throws IOException {
    Files.writeString(artifacts.resolve("permissions.json"), "{\"permission_density\": 0.5}");

    ExtractorResult result = new ArtifactDirectoryExtractor(ExtractorId.PERMISSIONS, json).extract(artifacts);

    ExtractorResult.Present present = (ExtractorResult.Present) result;
    assertEquals(0.5, ((Number) present.findings().get("permission_density")).doubleValue());
  }

  @Test
  void cryptoFallsBackToCertificatesFile() throws IOException {
    Files.writeString(artifacts.resolve("certificates.json"), "{\"self_signed\": true}");

    ExtractorResult result = new ArtifactDirectoryExtractor(ExtractorId.CRYPTO, json).extract(artifacts);

    assertTrue(result instanceof ExtractorResult.Present);
  }

  @Test
  void missingOrStringArtifactIsUnavailable() throws IOException {
    Files.writeString(artifacts.resolve("yara.json"), "\"no rules compiled\"");

    assertEquals(ExtractorResult.unavailable("no rules compiled"),
        new ArtifactDirectoryExtractor(ExtractorId.YARA, json).extract(artifacts));
    assertTrue(new ArtifactDirectoryExtractor(ExtractorId.SECRETS, json).extract(artifacts)
        instanceof ExtractorResult.Unavailable);
  }

  @Test
  void nonObjectArtifactIsAnIoError() throws IOException {
    Files.writeString(artifacts.resolve("manifest.json"), "[1, 2]");

    assertThrows(IOException.class,
        () -> new ArtifactDirectoryExtractor(ExtractorId.MANIFEST, json).extract(artifacts));
  }

  @Test
  void oneExtractorPerId() {
    List<ArtifactDirectoryExtractor> extractors = ArtifactDirectoryExtractor.forAllExtractors(json);

    assertEquals(ExtractorId.values().length, extractors.size());
  }
}
