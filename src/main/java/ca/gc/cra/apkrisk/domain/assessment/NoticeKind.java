package ca.gc.cra.apkrisk.domain.assessment;

/**
 * Non-fatal conditions recorded inside an assessment instead of failing the job.
 *
 * @since 0.1.0
 */
public enum NoticeKind {
  /** An optional extractor's backing capability was missing; its metrics were excluded. */
  OPTIONAL_DEPENDENCY_UNAVAILABLE,
  /** The dynamic event stream did not finish within its window; partial counts were used. */
  INSTRUMENTATION_TIMEOUT
}
