package ca.gc.cra.apkrisk.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for usage text and reports written to stdout.
 *
 * <p>Writes through the stdout file descriptor so logging (which targets the console appender) and report
 * bodies do not share a {@code System.out} reference.</p>
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a multi-line block, adding a trailing newline only when the block lacks one.
   *
   * @param block text to emit
   */
  static void printBlock(String block) {
    PrintWriter writer = writer();
    writer.print(block);
    if (!block.endsWith("\n")) {
      writer.println();
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
