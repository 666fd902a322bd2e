package ca.gc.cra.apkrisk.infrastructure.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.apkrisk.domain.event.EventTag;
import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import ca.gc.cra.apkrisk.infrastructure.json.JsonSupport;
import ca.gc.cra.apkrisk.testing.ManualClock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonJobReaderTest {
  private static final String JOB = """
      {
        "jobId": "com.example.app-42",
        "static": {
          "manifest": {"total_component_count": 10, "exported_component_count": 3},
          "permissions": {"permission_density": 0.4},
          "certificates": {"expired": true},
          "yara": "yara-python not installed",
          "strings": {"count": 3}
        },
        "dynamic": {
          "windowMs": 60000,
          "events": [
            "PERMISSION:android.permission.READ_SMS",
            {"tag": "NETWORK", "payload": "http://a.example", "timestamp": "2024-05-01T10:00:00Z"},
            {"tag": "FILE_WRITE", "payload": "/sdcard/x", "timestamp": 1714557600000}
          ]
        },
        "config": {"weights": {"permission_density": 0.3}}
      }
      """;

  private final JsonJobReader reader = new JsonJobReader(new JsonSupport(), new ManualClock(5_000L));

  @Test
  void readsStaticDynamicAndConfigSections() {
    JobDescription job = reader.parse(JOB);

    assertEquals("com.example.app-42", job.jobId());
    assertEquals(4, job.staticResults().size());
    assertTrue(job.staticResults().get(ExtractorId.CRYPTO) instanceof ExtractorResult.Present);
    assertEquals(ExtractorResult.unavailable("yara-python not installed"), job.staticResults().get(ExtractorId.YARA));
    assertFalse(job.staticResults().containsKey(ExtractorId.SECRETS));

    List<InstrumentationEvent> events = job.events();
    assertEquals(List.of(EventTag.PERMISSION, EventTag.NETWORK, EventTag.FILE_WRITE),
        events.stream().map(InstrumentationEvent::tag).toList());
    assertEquals(Instant.ofEpochMilli(5_000L), events.get(0).timestamp());
    assertEquals(Instant.parse("2024-05-01T10:00:00Z"), events.get(1).timestamp());
    assertEquals(Instant.ofEpochMilli(1714557600000L), events.get(2).timestamp());

    assertEquals(Duration.ofMinutes(1), job.declaredWindow().orElseThrow());
    assertEquals(Map.of("permission_density", 0.3), job.scoringOverrides().get("weights"));
  }

  @Test
  void jobIdDefaultsToFileStem(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("sample-app.json");
    Files.writeString(file, "{\"static\": {}}");

    JobDescription job = reader.read(file);

    assertEquals("sample-app", job.jobId());
    assertTrue(job.declaredWindow().isEmpty());
    assertTrue(job.events().isEmpty());
  }

  @Test
  void rejectsMalformedJobs() {
    assertThrows(IllegalArgumentException.class, () -> reader.parse("[]"));
    assertThrows(IllegalArgumentException.class, () -> reader.parse("{\"static\": {}}"));
    assertThrows(IllegalArgumentException.class,
        () -> reader.parse("{\"jobId\": \"j\", \"dynamic\": {\"windowMs\": -5}}"));
    assertThrows(IllegalArgumentException.class,
        () -> reader.parse("{\"jobId\": \"j\", \"dynamic\": {\"events\": [{\"payload\": \"x\"}]}}"));
    assertThrows(IllegalArgumentException.class,
        () -> reader.parse("{\"jobId\": \"bad\\u0007id\"}"));
  }
}
