package ca.gc.cra.apkrisk.infrastructure.events;

import ca.gc.cra.apkrisk.application.port.InstrumentationEventSource;
import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link InstrumentationEventSource} over events already held in memory, such as a job file or a
 * recorded hook log. Polls never block.
 *
 * @since 0.1.0
 */
public final class ListEventSource implements InstrumentationEventSource {
  private final List<InstrumentationEvent> events;
  private int next;

  /**
   * Creates a source that yields {@code events} in order.
   *
   * @param events events to deliver
   */
  public ListEventSource(List<InstrumentationEvent> events) {
    this.events = List.copyOf(Objects.requireNonNull(events, "events"));
  }

  @Override
  public synchronized Optional<InstrumentationEvent> poll(long timeoutMillis) {
    if (next >= events.size()) {
      return Optional.empty();
    }
    return Optional.of(events.get(next++));
  }

  @Override
  public synchronized boolean exhausted() {
    return next >= events.size();
  }
}
