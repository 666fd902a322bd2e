package ca.gc.cra.apkrisk.application.scoring;

import ca.gc.cra.apkrisk.domain.assessment.RationaleEntry;
import ca.gc.cra.apkrisk.domain.assessment.RiskLevel;
import ca.gc.cra.apkrisk.domain.assessment.ScoreBands;
import ca.gc.cra.apkrisk.domain.metric.MetricCatalog;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Ranks and explains the drivers of a score.
 *
 * <p>Metrics with a non-zero contribution are ordered by descending absolute contribution, ties broken by
 * catalog declaration order. Each entry reads like
 * {@code "permission_density contributed 100% of the score due to elevated declared-permission ratio"}.</p>
 *
 * @since 0.1.0
 */
public final class RationaleGenerator {

  /**
   * Builds ranked rationale entries.
   *
   * @param result scoring output
   * @param catalog catalog providing declaration order and descriptions
   * @return ranked entries; empty when nothing contributed
   */
  public List<RationaleEntry> explain(ScoreResult result, MetricCatalog catalog) {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(catalog, "catalog");
    List<ScoreResult.Contribution> drivers = new ArrayList<>();
    for (ScoreResult.Contribution contribution : result.contributions()) {
      if (contribution.contribution() != 0.0) {
        drivers.add(contribution);
      }
    }
    drivers.sort(Comparator
        .comparingDouble((ScoreResult.Contribution c) -> Math.abs(c.contribution())).reversed()
        .thenComparingInt(c -> catalog.ordinal(c.name())));

    List<RationaleEntry> entries = new ArrayList<>(drivers.size());
    for (ScoreResult.Contribution driver : drivers) {
      double share = result.rawScore() == 0.0 ? 0.0 : driver.contribution() / result.rawScore();
      String explanation = String.format(Locale.ROOT, "%s contributed %d%% of the score due to %s",
          driver.name(), Math.round(share * 100.0), driver.metric().spec().description());
      entries.add(new RationaleEntry(
          driver.name(),
          share,
          WeightedScoringEngine.roundHalfUp(driver.contribution() * 100.0, 2),
          explanation));
    }
    return entries;
  }

  /**
   * Maps a score to its qualitative level.
   *
   * @param score final score
   * @param bands effective band floors
   * @return risk level
   */
  public RiskLevel level(int score, ScoreBands bands) {
    return Objects.requireNonNull(bands, "bands").classify(score);
  }
}
