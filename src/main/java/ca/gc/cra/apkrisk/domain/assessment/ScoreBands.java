package ca.gc.cra.apkrisk.domain.assessment;

/**
 * Score thresholds separating the qualitative risk levels.
 *
 * <p>A score below {@code mediumFloor} is {@link RiskLevel#LOW}, below {@code highFloor} is
 * {@link RiskLevel#MEDIUM}, and anything else is {@link RiskLevel#HIGH}.</p>
 *
 * @param mediumFloor lowest score labelled medium
 * @param highFloor lowest score labelled high
 * @since 0.1.0
 */
public record ScoreBands(int mediumFloor, int highFloor) {
  /** Default bands: medium from 40, high from 70. */
  public static final ScoreBands DEFAULT = new ScoreBands(40, 70);

  /**
   * Enforces {@code 0 <= mediumFloor <= highFloor <= 100}.
   */
  public ScoreBands {
    if (mediumFloor < 0 || mediumFloor > 100 || highFloor < 0 || highFloor > 100) {
      throw new IllegalArgumentException("score bands must be within [0,100]");
    }
    if (mediumFloor > highFloor) {
      throw new IllegalArgumentException(
          "medium band floor " + mediumFloor + " exceeds high band floor " + highFloor);
    }
  }

  /**
   * Classifies a score.
   *
   * @param score final score in {@code [0, 100]}
   * @return qualitative level
   */
  public RiskLevel classify(int score) {
    if (score < mediumFloor) {
      return RiskLevel.LOW;
    }
    if (score < highFloor) {
      return RiskLevel.MEDIUM;
    }
    return RiskLevel.HIGH;
  }
}
