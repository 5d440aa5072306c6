/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import io.crums.netcards.CardSettings;
import io.crums.netcards.MultiCard;
import io.crums.netcards.NetworkCard;

/**
 * 
 */
public class TextRendererTest {

  @Test
  public void testSingle() {
    var expected = String.join(
        "\n",
        "      Name  G",
        "   Degree¹  2.5 [1, 4]",
        "Clustering  0.571",
        "    Ethics  IRB #12_a",
        "",
        "¹: " + SampleCards.NOTE);
    assertEquals(expected, TextRenderer.DEFAULT.render(CardTable.of(SampleCards.small())));
    assertEquals(expected, SampleCards.small().toString());
  }


  @Test
  public void testNoFootnotes() {
    var lines = TextRenderer.DEFAULT.renderLines(CardTable.of(SampleCards.plain("x", 3)));
    assertEquals(
        List.of(
            "           Name  x",
            "Number of nodes  3",
            "       Citation"),
        lines);
  }


  @Test
  public void testMulti() {
    var multi = new MultiCard(List.of(SampleCards.plain("first", 3), SampleCards.plain("2nd", 100)));
    var lines = TextRenderer.DEFAULT.renderLines(CardTable.of(multi));
    assertEquals(
        List.of(
            "           Name  first  2nd",
            "Number of nodes  3      100",
            "       Citation"),
        lines);
  }


  @Test
  public void testSignificantDigits() {
    var props = new Properties();
    props.setProperty(CardSettings.SIGNIFICANT_DIGITS, "2");
    var renderer = new TextRenderer(new CardSettings(props));
    var lines = renderer.renderLines(CardTable.of(SampleCards.small()));
    assertEquals("Clustering  0.57", lines.get(2));
  }


  @Test
  public void testEmpty() {
    assertEquals("", TextRenderer.DEFAULT.render(CardTable.of(new NetworkCard())));
  }

}
