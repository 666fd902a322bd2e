package ca.gc.cra.apkrisk.domain.assessment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Final, immutable outcome of one risk assessment job.
 * <p><strong>Why:</strong> Gives analysts an auditable score together with the ranked reasons behind it.</p>
 * <p><strong>Ownership:</strong> Produced once by the pipeline and handed to the caller for persistence
 * or rendering.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the breakdown keeps catalog declaration order.</p>
 *
 * @param jobId identifier of the job that produced the assessment
 * @param score final score in {@code [0, 100]}
 * @param level qualitative label for the score
 * @param rationale drivers ranked by descending contribution
 * @param breakdown weighted contribution per available metric, in score points
 * @param notices informational notices (optional features skipped, truncated dynamic analysis)
 * @param dynamicTruncated {@code true} when the dynamic event stream was cut off by its window
 * @since 0.1.0
 */
public record RiskAssessment(
    String jobId,
    int score,
    RiskLevel level,
    List<RationaleEntry> rationale,
    Map<String, Double> breakdown,
    List<AssessmentNotice> notices,
    boolean dynamicTruncated) {

  static final String NO_FACTORS = "no significant risk factors observed";

  /**
   * Validates the score range and freezes the collections.
   */
  public RiskAssessment {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(level, "level");
    if (score < 0 || score > 100) {
      throw new IllegalArgumentException("score must be within [0,100] (was " + score + ")");
    }
    rationale = List.copyOf(Objects.requireNonNull(rationale, "rationale"));
    breakdown = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(breakdown, "breakdown")));
    notices = List.copyOf(Objects.requireNonNull(notices, "notices"));
  }

  /**
   * Renders the rationale as a single line for logs and plain-text reports.
   *
   * @return explanations joined with {@code "; "}, or a fixed phrase when nothing contributed
   */
  public String summary() {
    if (rationale.isEmpty()) {
      return NO_FACTORS;
    }
    return rationale.stream().map(RationaleEntry::explanation).collect(Collectors.joining("; "));
  }
}
