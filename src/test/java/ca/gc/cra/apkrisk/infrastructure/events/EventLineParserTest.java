package ca.gc.cra.apkrisk.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.apkrisk.domain.event.EventTag;
import ca.gc.cra.apkrisk.domain.event.InstrumentationEvent;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EventLineParserTest {
  private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

  @Test
  void splitsOnFirstColon() {
    InstrumentationEvent event = EventLineParser.parse("NETWORK: http://a.example:8080/x", T0).orElseThrow();

    assertEquals(EventTag.NETWORK, event.tag());
    assertEquals("NETWORK", event.rawTag());
    assertEquals("http://a.example:8080/x", event.payload());
    assertEquals(T0, event.timestamp());
  }

  @Test
  void unknownTagsAndBarewordsFallBackToUnknown() {
    InstrumentationEvent reflection = EventLineParser.parse("REFLECTION:Class.forName", T0).orElseThrow();
    InstrumentationEvent bare = EventLineParser.parse("heartbeat", T0).orElseThrow();

    assertEquals(EventTag.UNKNOWN, reflection.tag());
    assertEquals("REFLECTION", reflection.rawTag());
    assertEquals(EventTag.UNKNOWN, bare.tag());
    assertEquals("", bare.payload());
  }

  @Test
  void skipsBlankLinesAndComments() {
    assertTrue(EventLineParser.parse("   ", T0).isEmpty());
    assertTrue(EventLineParser.parse("# captured by frida", T0).isEmpty());
    assertTrue(EventLineParser.parse(null, T0).isEmpty());
  }

  @Test
  void readsWholeLogFile(@TempDir Path dir) throws IOException {
    Path log = dir.resolve("events.log");
    Files.writeString(log, String.join("\n",
        "# session 1",
        "PERMISSION:android.permission.CAMERA",
        "",
        "FILE_WRITE:/sdcard/out.bin",
        "NETWORK:ftp://files.example"), StandardCharsets.UTF_8);

    List<InstrumentationEvent> events = EventLineParser.readAll(log, T0);

    assertEquals(List.of(EventTag.PERMISSION, EventTag.FILE_WRITE, EventTag.NETWORK),
        events.stream().map(InstrumentationEvent::tag).toList());
  }
}
