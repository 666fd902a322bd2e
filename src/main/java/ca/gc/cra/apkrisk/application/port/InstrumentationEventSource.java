package ca.gc.cra.apkrisk.application.port;

import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import java.util.Optional;

/**
 * <strong>What:</strong> Finite, non-restartable stream of instrumentation events from the sandbox.
 * <p><strong>Contract:</strong> Each event is delivered once. After {@link #exhausted()} returns
 * {@code true} no further events are produced. An empty source means dynamic analysis was skipped.</p>
 * <p><strong>Thread-safety:</strong> Consumed by a single ingestor thread; producers may feed the
 * implementation from other threads.</p>
 *
 * @since 0.1.0
 */
public interface InstrumentationEventSource {
  /**
   * Waits up to {@code timeoutMillis} for the next event.
   *
   * @param timeoutMillis maximum wait in milliseconds; {@code 0} polls without waiting
   * @return next event, or empty when none arrived in time or the stream is exhausted
   * @throws InterruptedException if interrupted while waiting
   */
  Optional<InstrumentationEvent> poll(long timeoutMillis) throws InterruptedException;

  /**
   * Indicates whether the stream has ended and every event has been delivered.
   *
   * @return {@code true} once no further events will arrive
   */
  boolean exhausted();

  /** Source with no events, used when dynamic analysis did not run. */
  InstrumentationEventSource EMPTY = new InstrumentationEventSource() {
    @Override
    public Optional<InstrumentationEvent> poll(long timeoutMillis) {
      return Optional.empty();
    }

    @Override
    public boolean exhausted() {
      return true;
    }
  };
}
