package ca.gc.cra.apkrisk.infrastructure.events;

import ca.gc.cra.apkrisk.application.port.InstrumentationEventSource;
import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <strong>What:</strong> {@link InstrumentationEventSource} fed by live hooks from another thread.
 * <p><strong>Contract:</strong> Producers call {@link #publish(InstrumentationEvent, long)} and the owner
 * of the stream finally calls {@link #complete()}. The source is exhausted once it is complete and every
 * queued event has been polled. An event is either delivered or reported as rejected: publishing returns
 * {@code false} when the stream completed before the event could be queued, or when the backlog stayed
 * full for the whole timeout. A consumer that stops at its window stops draining, so the owner must call
 * {@link #complete()} to release producers waiting for space.</p>
 * <p><strong>Thread-safety:</strong> Safe for one consumer and many producers.</p>
 *
 * @since 0.1.0
 */
public final class QueueEventSource implements InstrumentationEventSource {
  private static final long WAIT_SLICE_MS = 50L;

  private final BlockingQueue<InstrumentationEvent> queue;
  private final AtomicBoolean completed = new AtomicBoolean();

  /**
   * Creates a source with a bounded backlog.
   *
   * @param capacity maximum queued events before producers wait
   */
  public QueueEventSource(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.queue = new LinkedBlockingQueue<>(capacity);
  }

  /**
   * Enqueues an event, waiting up to {@code timeoutMillis} for space while the stream is open.
   *
   * @param event event to deliver
   * @param timeoutMillis longest wait for space in the backlog
   * @return {@code true} if the event will be delivered; {@code false} if it was rejected
   * @throws InterruptedException if interrupted while waiting for space
   */
  public boolean publish(InstrumentationEvent event, long timeoutMillis) throws InterruptedException {
    Objects.requireNonNull(event, "event");
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMillis));
    while (!completed.get()) {
      long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      if (queue.offer(event, Math.max(0L, Math.min(remaining, WAIT_SLICE_MS)), TimeUnit.MILLISECONDS)) {
        // Completion may have raced the offer; withdraw the event unless the consumer already took it.
        return !(completed.get() && queue.remove(event));
      }
      if (remaining <= 0) {
        return false;
      }
    }
    return false;
  }

  /** Marks the end of the stream and releases producers waiting for space. */
  public void complete() {
    completed.set(true);
  }

  @Override
  public Optional<InstrumentationEvent> poll(long timeoutMillis) throws InterruptedException {
    InstrumentationEvent event = queue.poll(Math.max(0L, timeoutMillis), TimeUnit.MILLISECONDS);
    return Optional.ofNullable(event);
  }

  @Override
  public boolean exhausted() {
    return completed.get() && queue.isEmpty();
  }
}
