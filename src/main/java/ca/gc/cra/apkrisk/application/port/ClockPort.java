package ca.gc.cra.apkrisk.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the dynamic ingestor and the pipeline.
 * <p><strong>Why:</strong> Instrumentation windows are enforced against deadlines; tests substitute a
 * controllable clock so truncation is reproducible.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.apkrisk.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default clock delegating to {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
