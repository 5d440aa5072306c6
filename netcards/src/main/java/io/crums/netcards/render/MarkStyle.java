/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.util.ArrayList;
import java.util.List;

import io.crums.netcards.render.FootnoteRegistry.Mark;

/**
 * Format-specific footnote glyphs. Numbering itself is format independent
 * and done by {@linkplain FootnoteCodec}.
 */
public enum MarkStyle {

  /**
   * Unicode superscripts, comma separated: {@code Degree¹,²}. Legend lines
   * read {@code ¹: text}.
   */
  TEXT(1) {
    @Override
    public String marks(List<Mark> marks) {
      var out = new StringBuilder();
      for (var mark : marks) {
        if (out.length() > 0)
          out.append(',');
        out.append(superscript(mark.number()));
      }
      return out.toString();
    }

    @Override
    public String legendLine(Mark note) {
      return superscript(note.number()) + ": " + note.text();
    }
  },

  /**
   * Parenthesized, ascending numbers: {@code Degree (1,2)}. Legend lines read
   * {@code 1: text}.
   */
  SPREADSHEET(1) {
    @Override
    public String marks(List<Mark> marks) {
      if (marks.isEmpty())
        return "";
      var numbers = new ArrayList<Integer>(marks.size());
      for (var mark : marks)
        numbers.add(mark.number());
      numbers.sort(null);
      var out = new StringBuilder(" (");
      for (int index = 0; index < numbers.size(); ++index) {
        if (index > 0)
          out.append(',');
        out.append(numbers.get(index));
      }
      return out.append(')').toString();
    }
  },

  /**
   * Zero-based LaTeX cross references. A footnote's first mark defines it
   * ({@code \tablefootnote{\label{foot0}text}}); later marks refer to it
   * ({@code \textsuperscript{\ref{foot0}}}). Marks are separated by a
   * superscript comma. There is no legend: footnotes are typeset inline.
   */
  LATEX(0) {
    @Override
    public String marks(List<Mark> marks) {
      var out = new StringBuilder();
      for (var mark : marks) {
        if (out.length() > 0)
          out.append("\\textsuperscript{,}");
        if (mark.first())
          out.append("\\tablefootnote{\\label{foot").append(mark.number()).append('}')
              .append(TexRenderer.escape(mark.text())).append('}');
        else
          out.append("\\textsuperscript{\\ref{foot").append(mark.number()).append("}}");
      }
      return out.toString();
    }
  },

  /**
   * Comma separated numbers, raised by the PDF renderer. Legend lines read
   * {@code 1: text}.
   */
  PDF(1) {
    @Override
    public String marks(List<Mark> marks) {
      var out = new StringBuilder();
      for (var mark : marks) {
        if (out.length() > 0)
          out.append(',');
        out.append(mark.number());
      }
      return out.toString();
    }
  };


  private final static char[] SUPERSCRIPT_DIGITS =
      "⁰¹²³⁴⁵⁶⁷⁸⁹".toCharArray();


  /**
   * Returns the given non-negative number in unicode superscript digits.
   */
  public static String superscript(int number) {
    if (number < 0)
      throw new IllegalArgumentException("negative number " + number);
    var digits = Integer.toString(number).toCharArray();
    for (int index = 0; index < digits.length; ++index)
      digits[index] = SUPERSCRIPT_DIGITS[digits[index] - '0'];
    return new String(digits);
  }



  private final int firstNumber;

  private MarkStyle(int firstNumber) {
    this.firstNumber = firstNumber;
  }


  /** Returns the number of the first footnote. */
  public int firstNumber() {
    return firstNumber;
  }


  /**
   * Returns the marks suffixed to a field's label.
   *
   * @param marks the row's marks, in order (possibly empty)
   * @return the empty string, if {@code marks} is empty
   */
  public abstract String marks(List<Mark> marks);


  /**
   * Returns the legend line for the given footnote.
   */
  public String legendLine(Mark note) {
    return note.number() + ": " + note.text();
  }

}
