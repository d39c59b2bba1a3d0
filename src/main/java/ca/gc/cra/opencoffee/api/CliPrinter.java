package ca.gc.cra.opencoffee.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Console output for usage text, the version line and dry-run plans.
 *
 * <p>Writes to the stdout file descriptor directly so that plans are not mixed into log output, which goes to
 * stderr.</p>
 */
public final class CliPrinter {
  /** Width of the label column in {@link #printPlan}. */
  static final int LABEL_WIDTH = 17;

  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {}

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a dry-run plan: the heading, one aligned {@code label : value} row per entry, then the footer.
   *
   * @param heading first line
   * @param rows labels and values in display order
   * @param footer last line, or {@code null} for none
   */
  public static void printPlan(String heading, Map<String, String> rows, String footer) {
    PrintWriter writer = writer();
    writer.println(heading);
    for (Map.Entry<String, String> row : rows.entrySet()) {
      writer.println(" " + padLabel(row.getKey()) + ": " + row.getValue());
    }
    if (footer != null) {
      writer.println(" " + footer);
    }
    writer.flush();
  }

  static String padLabel(String label) {
    StringBuilder padded = new StringBuilder(label);
    while (padded.length() < LABEL_WIDTH) {
      padded.append(' ');
    }
    return padded.toString();
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
