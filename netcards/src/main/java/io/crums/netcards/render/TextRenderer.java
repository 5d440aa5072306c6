/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.crums.netcards.CardSettings;
import io.crums.netcards.Values;
import io.crums.util.main.TablePrint;

/**
 * Plain text rendering. The label column is right-aligned, the value
 * columns left-aligned, and columns are separated by two spaces. Footnotes
 * are marked with unicode superscripts and listed below the table,
 * following a blank line.
 *
 * <pre>
 *             Name  Karate club
 *             Kind  Undirected, unweighted
 *              ...
 *          Degree¹  4.58824 [1, 17]
 *       Clustering  0.571
 *              ...
 *
 * ¹: Distributions summarized with average [min, max].
 * </pre>
 */
public class TextRenderer {

  public final static TextRenderer DEFAULT = new TextRenderer(CardSettings.DEFAULT);

  private final static String GUTTER = "  ";

  private final int significantDigits;


  public TextRenderer(CardSettings settings) {
    this.significantDigits = settings.getSignificantDigits();
  }


  /**
   * Renders the given table as text.
   */
  public String render(CardTable table) {
    Objects.requireNonNull(table, "null table");
    var encoding = FootnoteCodec.encode(table, MarkStyle.TEXT);
    final int rowCount = table.rowCount();
    final int columns = table.valueColumns();

    // cells[row][col]: col 0 is the label
    var cells = new String[rowCount][columns + 1];
    var widths = new int[columns + 1];
    for (int r = 0; r < rowCount; ++r) {
      cells[r][0] = encoding.labels().get(r);
      var values = table.rows().get(r).values();
      for (int c = 0; c < columns; ++c)
        cells[r][c + 1] = Values.toText(values.get(c), significantDigits);
      for (int c = 0; c <= columns; ++c)
        widths[c] = Math.max(widths[c], cells[r][c].length());
    }

    var lines = new ArrayList<String>(rowCount + encoding.legend().size() + 1);
    if (rowCount > 0)
      printTable(cells, widths, lines);
    if (encoding.hasFootnotes()) {
      lines.add("");
      lines.addAll(encoding.legendLines());
    }
    return String.join("\n", lines);
  }


  /**
   * Prints the cells with a {@linkplain TablePrint} and collects the
   * printed lines. The last column is given no width, so it is never
   * padded.
   */
  private static void printTable(String[][] cells, int[] widths, List<String> lines) {
    // the separator is printed inside each column's width
    var colWidths = new int[widths.length - 1];
    for (int c = 0; c < colWidths.length; ++c)
      colWidths[c] = c == 0 ? widths[0] : widths[c] + GUTTER.length();

    var buffer = new ByteArrayOutputStream();
    var out = new PrintStream(buffer, false, StandardCharsets.UTF_8);
    var table = new TablePrint(out, colWidths);
    table.setColSeparator(GUTTER);
    for (var row : cells) {
      var printRow = new Object[row.length];
      // right-align the label
      printRow[0] = " ".repeat(widths[0] - row[0].length()) + row[0];
      for (int c = 1; c < row.length; ++c)
        printRow[c] = row[c];
      table.printRow(printRow);
    }
    out.flush();
    var printed = buffer.toString(StandardCharsets.UTF_8).split("\\R", -1);
    // the last println leaves an empty tail
    for (int index = 0; index < printed.length - 1; ++index)
      lines.add(printed[index].stripTrailing());
  }


  /** Returns the rendered lines of the given table. */
  public List<String> renderLines(CardTable table) {
    return List.of(render(table).split("\n", -1));
  }

}
