/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import io.crums.netcards.CardSettings;
import io.crums.netcards.NetworkCard;
import io.crums.netcards.Panel;
import io.crums.netcards.Values;

/**
 * LaTeX {@code tabular} rendering, meant to be included in a table
 * environment of the caller's document. Panels are separated by
 * {@code \midrule}s; footnotes are typeset with the {@code tablefootnote}
 * package.
 *
 * <pre>
 * \begin{tabular}{ll}
 * \toprule
 * Name &amp; Karate club \\
 * ...
 * \midrule
 * Number of nodes &amp; 34 \\
 * ...
 * \bottomrule
 * \end{tabular}
 * % footnotes require tablefootnote package (put {@literal \}usepackage{tablefootnote} in preamble)
 * </pre>
 */
public class TexRenderer {

  public final static TexRenderer DEFAULT = new TexRenderer(CardSettings.DEFAULT);

  public final static String FOOTNOTE_COMMENT =
      "% footnotes require tablefootnote package (put \\usepackage{tablefootnote} in preamble)";

  public final static String ARRAY_COMMENT = "% put \\usepackage{array} in preamble";


  private final static Map<String, String> ESCAPES;
  private final static Pattern ESCAPE_PATTERN;

  static {
    var escapes = new LinkedHashMap<String, String>();
    escapes.put("&", "\\&");
    escapes.put("%", "\\%");
    escapes.put("$", "\\$");
    escapes.put("#", "\\#");
    escapes.put("_", "\\_");
    escapes.put("{", "\\{");
    escapes.put("}", "\\}");
    escapes.put("~", "\\textasciitilde{}");
    escapes.put("^", "\\^{}");
    escapes.put("\\", "\\textbackslash{}");
    escapes.put("<", "\\textless{}");
    escapes.put(">", "\\textgreater{}");
    ESCAPES = escapes;
    // longest match first
    ESCAPE_PATTERN = Pattern.compile(
        escapes.keySet().stream()
        .sorted(Comparator.comparingInt(String::length).reversed())
        .map(Pattern::quote)
        .collect(Collectors.joining("|")));
  }


  /**
   * Escapes LaTeX's reserved characters in the given text. Replacements are
   * made in a single pass, so a replacement is never itself re-escaped.
   */
  public static String escape(String text) {
    Matcher matcher = ESCAPE_PATTERN.matcher(text);
    var out = new StringBuilder(text.length() + 16);
    while (matcher.find())
      matcher.appendReplacement(out, Matcher.quoteReplacement(ESCAPES.get(matcher.group())));
    matcher.appendTail(out);
    return out.toString();
  }



  private final int decimals;
  private final Double valueWidth;
  private final double multiWidth;


  public TexRenderer(CardSettings settings) {
    this.decimals = settings.getTexDecimals();
    this.valueWidth = settings.getTexValueWidth();
    this.multiWidth = settings.getTexMultiWidth();
  }


  /**
   * Returns the column format, e.g. {@code ll}.
   */
  public String columnFormat(CardTable table) {
    if (table.valueColumns() == 1)
      return valueWidth == null ? "ll" : "lp{" + Values.formatG(valueWidth, 6) + "cm}";
    var format = new StringBuilder("l");
    String column = ">{\\raggedright\\arraybackslash}p{" + Values.formatG(multiWidth, 6) + "cm}";
    for (int count = table.valueColumns(); count-- > 0; )
      format.append(column);
    return format.toString();
  }


  /**
   * Renders the given table as a LaTeX {@code tabular} block.
   */
  public String render(CardTable table) {
    Objects.requireNonNull(table, "null table");
    var encoding = FootnoteCodec.encode(table, MarkStyle.LATEX);

    var lines = new ArrayList<String>(table.rowCount() + 8);
    lines.add("\\begin{tabular}{" + columnFormat(table) + "}");
    lines.add("\\toprule");
    for (int r = 0; r < table.rowCount(); ++r) {
      var row = table.rows().get(r);
      var line = new StringBuilder();
      line.append(escape(row.field())).append(encoding.marks().get(r));
      for (var value : row.values())
        line.append(" & ").append(escape(Values.toFixedText(value, decimals)));
      lines.add(line.append(" \\\\").toString());
    }
    lines.add("\\bottomrule");
    lines.add("\\end{tabular}");

    // separators before the metainfo and structure panels (in that order,
    // so the first insertion doesn't shift the second)
    lines.add(table.panelOffset(Panel.METAINFO) + 2, "\\midrule");
    lines.add(table.panelOffset(Panel.STRUCTURE) + 2, "\\midrule");

    lines.add(FOOTNOTE_COMMENT);
    if (table.valueColumns() > 1)
      lines.add(ARRAY_COMMENT);
    return String.join("\n", lines);
  }


  /**
   * Writes the given table to the given writer.
   */
  public void write(CardTable table, Writer out) throws IOException {
    out.write(render(table));
    out.write('\n');
    out.flush();
  }


  /**
   * Writes the given table to the given file (UTF-8), overwriting it if it
   * exists.
   */
  public void write(CardTable table, File file) throws IOException {
    try (var out = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
      write(table, out);
    }
    Logger.getLogger(NetworkCard.LOG_NAME).fine(() -> "wrote " + file);
  }

}
