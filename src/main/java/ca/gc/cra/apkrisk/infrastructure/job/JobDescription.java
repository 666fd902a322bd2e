package ca.gc.cra.apkrisk.infrastructure.job;

import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed content of a job file.
 *
 * @param jobId job identifier
 * @param staticResults static results keyed by extractor
 * @param events recorded instrumentation events in file order
 * @param window dynamic window from the file; {@code null} when absent
 * @param scoringOverrides raw {@code config} subtree ({@code weights}, {@code caps}, {@code bands})
 * @since 0.1.0
 */
public record JobDescription(
    String jobId,
    Map<ExtractorId, ExtractorResult> staticResults,
    List<InstrumentationEvent> events,
    Duration window,
    Map<String, Object> scoringOverrides) {

  public JobDescription {
    Objects.requireNonNull(jobId, "jobId");
    Map<ExtractorId, ExtractorResult> results = new EnumMap<>(ExtractorId.class);
    results.putAll(Objects.requireNonNull(staticResults, "staticResults"));
    staticResults = Collections.unmodifiableMap(results);
    events = List.copyOf(Objects.requireNonNull(events, "events"));
    scoringOverrides = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(scoringOverrides, "scoringOverrides")));
  }

  /**
   * Returns the window declared by the job file.
   *
   * @return window, or empty to use the configured default
   */
  public Optional<Duration> declaredWindow() {
    return Optional.ofNullable(window);
  }
}
