package ca.gc.cra.diagloc.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output helper for CLI results and usage text.
 *
 * <p>Writes UTF-8 to the stdout file descriptor; logging stays on stderr.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout using the shared CLI writer.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    PrintWriter writer = writer();
    writer.println(message);
    writer.flush();
  }

  /**
   * Prints zero or more lines to stdout using the shared CLI writer.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  /**
   * Redirects CLI output, letting tests capture lookup and dump results.
   *
   * @param writer destination for subsequent output
   */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  /**
   * Clears any test writer override; output returns to stdout.
   */
  static void clearTestWriter() {
    override = null;
  }

  /**
   * Resolves the active writer, preferring a test override.
   *
   * @return writer used for CLI output
   */
  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
