package ca.gc.cra.apkrisk.domain.assessment;

/**
 * Qualitative label derived from the numeric score through {@link ScoreBands}.
 *
 * @since 0.1.0
 */
public enum RiskLevel {
  LOW("Low"),
  MEDIUM("Medium"),
  HIGH("High");

  private final String display;

  RiskLevel(String display) {
    this.display = display;
  }

  /**
   * Returns the label shown to analysts.
   *
   * @return capitalized label
   */
  public String display() {
    return display;
  }
}
