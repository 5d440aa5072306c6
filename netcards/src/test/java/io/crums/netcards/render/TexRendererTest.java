/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.netcards.CardSettings;
import io.crums.netcards.MultiCard;

/**
 * 
 */
public class TexRendererTest {

  @TempDir
  File tempDir;


  @Test
  public void testEscape() {
    assertEquals("plain text", TexRenderer.escape("plain text"));
    assertEquals("IRB \\#12\\_a", TexRenderer.escape("IRB #12_a"));
    assertEquals(
        "\\& \\% \\$ \\{x\\} \\textasciitilde{} \\^{} \\textbackslash{} \\textless{} \\textgreater{}",
        TexRenderer.escape("& % $ {x} ~ ^ \\ < >"));
  }


  @Test
  public void testSingle() {
    var expected = String.join(
        "\n",
        "\\begin{tabular}{ll}",
        "\\toprule",
        "Name & G \\\\",
        "\\midrule",
        "Degree\\tablefootnote{\\label{foot0}Distributions summarized with average [min, max].} & 2.5 [1, 4] \\\\",
        "Clustering & 0.5706 \\\\",
        "\\midrule",
        "Ethics & IRB \\#12\\_a \\\\",
        "\\bottomrule",
        "\\end{tabular}",
        TexRenderer.FOOTNOTE_COMMENT);
    assertEquals(expected, TexRenderer.DEFAULT.render(CardTable.of(SampleCards.small())));
  }


  @Test
  public void testValueWidth() {
    var props = new Properties();
    props.setProperty(CardSettings.TEX_VALUE_WIDTH, "6");
    var renderer = new TexRenderer(new CardSettings(props));
    assertEquals("lp{6cm}", renderer.columnFormat(CardTable.of(SampleCards.small())));
  }


  @Test
  public void testMulti() {
    var multi = new MultiCard(List.of(SampleCards.plain("a", 1), SampleCards.plain("b", 2)));
    var table = CardTable.of(multi);
    var column = ">{\\raggedright\\arraybackslash}p{2.5cm}";
    assertEquals("l" + column + column, TexRenderer.DEFAULT.columnFormat(table));

    var lines = TexRenderer.DEFAULT.render(table).split("\n");
    assertEquals("Number of nodes & 1 & 2 \\\\", lines[4]);
    assertEquals(TexRenderer.FOOTNOTE_COMMENT, lines[lines.length - 2]);
    assertEquals(TexRenderer.ARRAY_COMMENT, lines[lines.length - 1]);
  }


  @Test
  public void testWriteFile() throws Exception {
    var file = new File(tempDir, "card.tex");
    TexRenderer.DEFAULT.write(CardTable.of(SampleCards.small()), file);
    var text = Files.readString(file.toPath(), StandardCharsets.UTF_8);
    assertTrue(text.startsWith("\\begin{tabular}{ll}\n"));
    assertTrue(text.endsWith(TexRenderer.FOOTNOTE_COMMENT + "\n"));
  }

}
