package ca.gc.cra.apkrisk.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private final StringWriter output = new StringWriter();

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(output.toString().startsWith("usage: apkrisk"));
  }

  @Test
  void helpWithoutCommandSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(output.toString().contains("Commands:"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"scan"}));
  }

  @Test
  void dispatchesToCatalog() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"CATALOG"}));
    assertTrue(output.toString().contains("total weight: 1.00"));
  }

  @Test
  void dispatchesCommandHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"assess", "--help"}));
    assertTrue(output.toString().contains("APKRISK assess"));
  }
}
