package ca.gc.cra.apkrisk.infrastructure.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.apkrisk.infrastructure.json.JsonSupport;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AssessmentJsonWriterTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  @SuppressWarnings("unchecked")
  void writesEveryAssessmentField() {
    String document = new AssessmentJsonWriter(json.factory(), false).toJson(ReportFixtures.sample());

    Map<String, Object> root = (Map<String, Object>) json.parse(document);
    assertEquals(1, ((Number) root.get("schemaVersion")).intValue());
    assertEquals("job-7", root.get("jobId"));
    assertEquals(14, ((Number) root.get("score")).intValue());
    assertEquals("Low", root.get("level"));
    assertEquals(Boolean.TRUE, root.get("dynamicTruncated"));

    Map<String, Object> rationale = (Map<String, Object>) root.get("rationale");
    assertTrue(((String) rationale.get("summary")).startsWith("permission_density contributed 100%"));
    List<Object> entries = (List<Object>) rationale.get("entries");
    Map<String, Object> entry = (Map<String, Object>) entries.get(0);
    assertEquals("permission_density", entry.get("metric"));
    assertEquals(13.8, ((Number) entry.get("contribution")).doubleValue(), 1e-9);

    Map<String, Object> breakdown = (Map<String, Object>) root.get("breakdown");
    assertEquals(List.of("permission_density", "component_exposure"), List.copyOf(breakdown.keySet()));

    Map<String, Object> notice = (Map<String, Object>) ((List<Object>) root.get("notices")).get(0);
    assertEquals("OPTIONAL_DEPENDENCY_UNAVAILABLE", notice.get("kind"));
    assertEquals("yara", notice.get("subject"));
  }

  @Test
  void prettyPrintingSpansLines() {
    String compact = new AssessmentJsonWriter(json.factory(), false).toJson(ReportFixtures.sample());
    String pretty = new AssessmentJsonWriter(json.factory(), true).toJson(ReportFixtures.sample());

    assertFalse(compact.contains("\n"));
    assertTrue(pretty.contains("\n"));
    assertEquals(json.parse(compact), json.parse(pretty));
  }
}
