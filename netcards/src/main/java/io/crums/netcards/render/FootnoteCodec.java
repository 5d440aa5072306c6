/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import io.crums.netcards.render.FootnoteRegistry.Mark;

/**
 * Numbers a table's footnotes. Rows are scanned top to bottom, each row's
 * footnotes left to right; the first occurrence of a text is assigned the
 * next number, repeats reuse it. A text attached more than once to the same
 * row is marked once.
 */
public class FootnoteCodec {

  /**
   * The encoded table.
   *
   * @param labels  per-row field labels, suffixed with their marks
   * @param marks   per-row marks (the empty string, if none)
   * @param legend  the numbered footnotes, in first-seen order
   * @param style   the mark style used
   */
  public record Encoding(
      List<String> labels, List<String> marks, List<Mark> legend, MarkStyle style) {

    /** Tells whether there are any footnotes. */
    public boolean hasFootnotes() {
      return !legend.isEmpty();
    }

    /** Returns the legend, one line per footnote. */
    public List<String> legendLines() {
      var lines = new ArrayList<String>(legend.size());
      for (var note : legend)
        lines.add(style.legendLine(note));
      return lines;
    }
  }


  // only a namespace
  private FootnoteCodec() {  }


  /**
   * Encodes the given table's footnotes in the given style. Every invocation
   * uses a fresh {@linkplain FootnoteRegistry registry}, so encoding the same
   * table twice yields the same result.
   */
  public static Encoding encode(CardTable table, MarkStyle style) {
    var registry = new FootnoteRegistry(style.firstNumber());
    var labels = new ArrayList<String>(table.rowCount());
    var marks = new ArrayList<String>(table.rowCount());
    for (var row : table.rows()) {
      var rowMarks = new ArrayList<Mark>();
      for (var note : new LinkedHashSet<>(row.footnotes()))
        rowMarks.add(registry.register(note));
      String suffix = style.marks(rowMarks);
      marks.add(suffix);
      labels.add(row.field() + suffix);
    }
    return new Encoding(
        List.copyOf(labels), List.copyOf(marks), List.copyOf(registry.legend()), style);
  }

}
