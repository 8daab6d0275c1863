package org.groupscholar.planner.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Stdout printer for help text, dry-run settings and the console report.
 *
 * <p>Writes to the stdout file descriptor directly so report text stays separate from log output, which goes to
 * stderr.</p>
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final int SETTING_WIDTH = 22;
  private static volatile PrintWriter override;

  private CliPrinter() {}

  public static void println(String message) {
    writer().println(message);
  }

  public static void blankLine() {
    writer().println();
  }

  /**
   * Prints a multi-line text block such as command help, without its trailing newline.
   *
   * @param block text block
   */
  public static void printBlock(String block) {
    writer().println(block == null ? "" : block.stripTrailing());
  }

  /**
   * Prints one aligned {@code name : value} row as used by dry runs.
   *
   * @param name setting name
   * @param value resolved value; {@code null} prints as {@code <none>}
   */
  public static void printSetting(String name, Object value) {
    writer().println(String.format(Locale.ROOT, " %-" + SETTING_WIDTH + "s : %s", name,
        value == null ? "<none>" : value));
  }

  /**
   * Returns a line sink bound to the current writer, for adapters that print through a {@link Consumer}.
   *
   * @return sink writing one line per call
   */
  public static Consumer<String> lineSink() {
    PrintWriter writer = writer();
    return writer::println;
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
