package ca.gc.cra.apkrisk.infrastructure.report;

import ca.gc.cra.apkrisk.domain.assessment.AssessmentNotice;
import ca.gc.cra.apkrisk.domain.assessment.RationaleEntry;
import ca.gc.cra.apkrisk.domain.assessment.RiskAssessment;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes a {@link RiskAssessment} with Jackson's streaming generator.
 *
 * <p>Output shape:
 * <pre>{@code
 * {"schemaVersion":1,"jobId":"...","score":14,"level":"Low",
 *  "rationale":{"summary":"...","entries":[{"metric":"...","share":1.0,"contribution":13.8,"explanation":"..."}]},
 *  "breakdown":{"permission_density":13.8,...},
 *  "notices":[{"kind":"OPTIONAL_DEPENDENCY_UNAVAILABLE","subject":"yara","message":"..."}],
 *  "dynamicTruncated":false}
 * }</pre>
 * The document carries no timestamps so identical assessments serialize identically.</p>
 *
 * @since 0.1.0
 */
public final class AssessmentJsonWriter {
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory factory;
  private final boolean pretty;

  /**
   * Creates a writer.
   *
   * @param factory JSON factory
   * @param pretty whether to indent output
   */
  public AssessmentJsonWriter(JsonFactory factory, boolean pretty) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.pretty = pretty;
  }

  /**
   * Writes the assessment to {@code out}. The writer is flushed but not closed.
   *
   * @param assessment assessment to serialize
   * @param out destination
   * @throws IOException if writing fails
   */
  public void write(RiskAssessment assessment, Writer out) throws IOException {
    Objects.requireNonNull(assessment, "assessment");
    Objects.requireNonNull(out, "out");
    JsonGenerator gen = factory.createGenerator(out);
    gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    if (pretty) {
      gen.useDefaultPrettyPrinter();
    }
    try (gen) {
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("jobId", assessment.jobId());
      gen.writeNumberField("score", assessment.score());
      gen.writeStringField("level", assessment.level().display());
      writeRationale(gen, assessment);
      gen.writeObjectFieldStart("breakdown");
      for (Map.Entry<String, Double> entry : assessment.breakdown().entrySet()) {
        gen.writeNumberField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();
      gen.writeArrayFieldStart("notices");
      for (AssessmentNotice notice : assessment.notices()) {
        gen.writeStartObject();
        gen.writeStringField("kind", notice.kind().name());
        gen.writeStringField("subject", notice.subject());
        gen.writeStringField("message", notice.message());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeBooleanField("dynamicTruncated", assessment.dynamicTruncated());
      gen.writeEndObject();
    }
    out.flush();
  }

  /**
   * Serializes the assessment to a string.
   *
   * @param assessment assessment to serialize
   * @return JSON document
   */
  public String toJson(RiskAssessment assessment) {
    StringWriter out = new StringWriter();
    try {
      write(assessment, out);
    } catch (IOException ex) {
      throw new UncheckedIOException("StringWriter failed", ex);
    }
    return out.toString();
  }

  private static void writeRationale(JsonGenerator gen, RiskAssessment assessment) throws IOException {
    gen.writeObjectFieldStart("rationale");
    gen.writeStringField("summary", assessment.summary());
    gen.writeArrayFieldStart("entries");
    for (RationaleEntry entry : assessment.rationale()) {
      gen.writeStartObject();
      gen.writeStringField("metric", entry.metricName());
      gen.writeNumberField("share", entry.share());
      gen.writeNumberField("contribution", entry.weightedContribution());
      gen.writeStringField("explanation", entry.explanation());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }
}
