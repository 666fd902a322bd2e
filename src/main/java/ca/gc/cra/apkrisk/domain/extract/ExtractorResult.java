package ca.gc.cra.apkrisk.domain.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome reported by a static extractor: findings, or an explicit unavailability marker.
 *
 * @since 0.1.0
 */
public sealed interface ExtractorResult permits ExtractorResult.Present, ExtractorResult.Unavailable {

  /**
   * Wraps extractor findings.
   *
   * @param findings findings tree of maps, lists, and scalars
   * @return present result
   */
  static ExtractorResult present(Map<String, Object> findings) {
    return new Present(findings);
  }

  /**
   * Creates the explicit unavailability marker.
   *
   * @param reason why the extractor produced nothing
   * @return unavailable result
   */
  static ExtractorResult unavailable(String reason) {
    return new Unavailable(reason);
  }

  /**
   * Findings reported by an extractor that ran.
   *
   * @param findings generic findings tree; keys are extractor-specific
   */
  record Present(Map<String, Object> findings) implements ExtractorResult {
    public Present {
      Objects.requireNonNull(findings, "findings");
      // JSON nulls are legal values, so Map.copyOf is not an option here.
      findings = Collections.unmodifiableMap(new LinkedHashMap<>(findings));
    }
  }

  /**
   * Marker for an extractor that did not run.
   *
   * @param reason human-readable cause; never {@code null}
   */
  record Unavailable(String reason) implements ExtractorResult {
    public Unavailable {
      reason = reason == null || reason.isBlank() ? "unavailable" : reason;
    }
  }
}
