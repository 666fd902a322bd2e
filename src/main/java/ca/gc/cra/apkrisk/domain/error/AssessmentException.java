package ca.gc.cra.apkrisk.domain.error;

/**
 * Checked failure that aborts an assessment job without producing a score.
 *
 * @since 0.1.0
 */
public abstract class AssessmentException extends Exception {
  private static final long serialVersionUID = 1L;

  protected AssessmentException(String message) {
    super(message);
  }

  protected AssessmentException(String message, Throwable cause) {
    super(message, cause);
  }
}
