package ca.gc.cra.apkrisk.domain.error;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import java.util.Objects;

/**
 * Raised when manifest or permission data is absent, reported unavailable, or unreadable.
 *
 * @since 0.1.0
 */
public final class MandatoryExtractorMissingException extends AssessmentException {
  private static final long serialVersionUID = 1L;

  private final ExtractorId extractor;

  public MandatoryExtractorMissingException(ExtractorId extractor, String detail) {
    super(message(extractor, detail));
    this.extractor = extractor;
  }

  public MandatoryExtractorMissingException(ExtractorId extractor, String detail, Throwable cause) {
    super(message(extractor, detail), cause);
    this.extractor = extractor;
  }

  /**
   * Returns the mandatory extractor that failed.
   *
   * @return extractor identifier
   */
  public ExtractorId extractor() {
    return extractor;
  }

  private static String message(ExtractorId extractor, String detail) {
    Objects.requireNonNull(extractor, "extractor");
    return "Mandatory extractor '" + extractor.key() + "' missing: " + detail;
  }
}
