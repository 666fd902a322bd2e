package ca.gc.cra.apkrisk.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class QueueEventSourceTest {
  private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

  @Test
  void drainsPublishedEventsBeforeReportingExhausted() throws InterruptedException {
    QueueEventSource source = new QueueEventSource(8);
    InstrumentationEvent event = InstrumentationEvent.of("PERMISSION", "android.permission.CAMERA", T0);
    assertTrue(source.publish(event, 10));
    source.complete();

    assertFalse(source.exhausted());
    assertEquals(event, source.poll(10).orElseThrow());
    assertTrue(source.exhausted());
    assertTrue(source.poll(0).isEmpty());
  }

  @Test
  void pollTimesOutWhileStreamIsOpen() throws InterruptedException {
    QueueEventSource source = new QueueEventSource(1);

    assertTrue(source.poll(5).isEmpty());
    assertFalse(source.exhausted());
  }

  @Test
  void rejectsPublishingAfterCompletion() throws InterruptedException {
    QueueEventSource source = new QueueEventSource(1);
    source.complete();

    assertFalse(source.publish(InstrumentationEvent.of("NETWORK", "http://x", T0), 10));
    assertTrue(source.exhausted());
    assertThrows(IllegalArgumentException.class, () -> new QueueEventSource(0));
  }

  @Test
  void fullBacklogTimesOutInsteadOfBlocking() throws InterruptedException {
    QueueEventSource source = new QueueEventSource(1);
    assertTrue(source.publish(InstrumentationEvent.of("FILE_WRITE", "/a", T0), 0));

    assertFalse(source.publish(InstrumentationEvent.of("FILE_WRITE", "/b", T0), 20));
    assertEquals("/a", source.poll(0).orElseThrow().payload());
  }

  @Test
  void completionReleasesWaitingProducer() throws Exception {
    QueueEventSource source = new QueueEventSource(1);
    assertTrue(source.publish(InstrumentationEvent.of("FILE_WRITE", "/a", T0), 0));
    AtomicReference<Boolean> accepted = new AtomicReference<>();
    Thread producer = new Thread(() -> {
      try {
        accepted.set(source.publish(InstrumentationEvent.of("FILE_WRITE", "/b", T0), 60_000));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "hook-producer");

    producer.start();
    source.complete();
    producer.join(5_000);

    assertFalse(producer.isAlive());
    assertEquals(Boolean.FALSE, accepted.get());
    assertEquals("/a", source.poll(0).orElseThrow().payload());
    assertTrue(source.exhausted());
  }

  @Test
  void listSourceReplaysInOrder() {
    InstrumentationEvent first = InstrumentationEvent.of("FILE_WRITE", "/a", T0);
    InstrumentationEvent second = InstrumentationEvent.of("FILE_WRITE", "/b", T0);
    ListEventSource source = new ListEventSource(List.of(first, second));

    assertEquals(first, source.poll(0).orElseThrow());
    assertEquals(second, source.poll(0).orElseThrow());
    assertTrue(source.exhausted());
  }
}
