package ca.gc.cra.apkrisk.infrastructure.report;

import ca.gc.cra.apkrisk.domain.assessment.AssessmentNotice;
import ca.gc.cra.apkrisk.domain.assessment.RationaleEntry;
import ca.gc.cra.apkrisk.domain.assessment.RiskAssessment;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a {@link RiskAssessment} as plain text for terminals.
 *
 * @since 0.1.0
 */
public final class AssessmentTextRenderer {

  /**
   * Renders the assessment.
   *
   * @param assessment assessment to render
   * @return multi-line report ending with a newline
   */
  public String render(RiskAssessment assessment) {
    Objects.requireNonNull(assessment, "assessment");
    StringBuilder sb = new StringBuilder(512);
    sb.append("Job: ").append(assessment.jobId()).append('\n');
    sb.append("Risk score: ").append(assessment.score()).append("/100 (")
        .append(assessment.level().display()).append(")\n");
    sb.append("Summary: ").append(assessment.summary()).append('\n');

    if (!assessment.rationale().isEmpty()) {
      sb.append('\n').append("Drivers:").append('\n');
      int rank = 1;
      for (RationaleEntry entry : assessment.rationale()) {
        sb.append(String.format(Locale.ROOT, "  %2d. %s\n", rank++, entry.explanation()));
      }
    }

    sb.append('\n').append("Breakdown (score points):").append('\n');
    int width = 0;
    for (String name : assessment.breakdown().keySet()) {
      width = Math.max(width, name.length());
    }
    for (Map.Entry<String, Double> entry : assessment.breakdown().entrySet()) {
      sb.append(String.format(Locale.ROOT, "  %-" + Math.max(1, width) + "s %7.2f\n",
          entry.getKey(), entry.getValue()));
    }

    if (!assessment.notices().isEmpty()) {
      sb.append('\n').append("Notices:").append('\n');
      for (AssessmentNotice notice : assessment.notices()) {
        sb.append("  - ").append(notice.message()).append('\n');
      }
    }
    if (assessment.dynamicTruncated()) {
      sb.append('\n').append("Dynamic analysis was truncated; dynamic metrics reflect partial data.").append('\n');
    }
    return sb.toString();
  }
}
