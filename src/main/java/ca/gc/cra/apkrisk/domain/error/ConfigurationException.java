package ca.gc.cra.apkrisk.domain.error;

/**
 * Raised when scoring overrides are invalid: an unknown metric name, a negative or misplaced cap, an
 * out-of-range weight, or inconsistent score bands.
 *
 * <p>This is a configuration error, not a data error; it is detected before any scoring proceeds.</p>
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends AssessmentException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
