/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.netcards.NetworkCard;
import io.crums.netcards.Panel;

/**
 * 
 */
public class FootnoteCodecTest {

  private CardTable sharedNotes() {
    var card = new NetworkCard();
    card.update(Panel.STRUCTURE, "Degree (in)", "2 [0, 5]");
    card.addFootnote("Degree (in)", "Summary.");
    card.update(Panel.STRUCTURE, "Clustering", 0.1);
    card.update(Panel.STRUCTURE, "Degree", "3 [1, 6]");
    card.addFootnote("Degree", "Undirected.");
    card.addFootnote("Degree", "Summary.");
    card.addFootnote("Degree", "Undirected.");
    return CardTable.of(card);
  }


  @Test
  public void testSharedNumbering() {
    var encoding = FootnoteCodec.encode(sharedNotes(), MarkStyle.TEXT);
    assertTrue(encoding.hasFootnotes());
    assertEquals(List.of("Degree (in)¹", "Clustering", "Degree²,¹"), encoding.labels());
    assertEquals(List.of("¹", "", "²,¹"), encoding.marks());
    assertEquals(List.of("¹: Summary.", "²: Undirected."), encoding.legendLines());
  }


  @Test
  public void testEncodeTwice() {
    var table = sharedNotes();
    assertEquals(
        FootnoteCodec.encode(table, MarkStyle.SPREADSHEET),
        FootnoteCodec.encode(table, MarkStyle.SPREADSHEET));
  }


  @Test
  public void testSpreadsheetMarks() {
    var encoding = FootnoteCodec.encode(sharedNotes(), MarkStyle.SPREADSHEET);
    assertEquals("Degree (1,2)", encoding.labels().get(2));
    assertEquals("1: Summary.", encoding.legendLines().get(0));
  }


  @Test
  public void testLatexMarks() {
    var encoding = FootnoteCodec.encode(sharedNotes(), MarkStyle.LATEX);
    assertEquals("\\tablefootnote{\\label{foot0}Summary.}", encoding.marks().get(0));
    assertEquals(
        "\\tablefootnote{\\label{foot1}Undirected.}\\textsuperscript{,}\\textsuperscript{\\ref{foot0}}",
        encoding.marks().get(2));
  }


  @Test
  public void testNoFootnotes() {
    var encoding = FootnoteCodec.encode(CardTable.of(SampleCards.plain("x", 3)), MarkStyle.PDF);
    assertFalse(encoding.hasFootnotes());
    assertEquals(List.of("Name", "Number of nodes", "Citation"), encoding.labels());
  }


  @Test
  public void testRegistry() {
    var registry = new FootnoteRegistry();
    var a = registry.register("a");
    var b = registry.register("b");
    var a2 = registry.register("a");
    assertEquals(1, a.number());
    assertTrue(a.first());
    assertEquals(2, b.number());
    assertEquals(1, a2.number());
    assertFalse(a2.first());
    assertEquals(2, registry.size());
    assertEquals(2, registry.numberOf("b").get());
    assertTrue(registry.numberOf("c").isEmpty());
  }


  @Test
  public void testSuperscript() {
    assertEquals("¹²", MarkStyle.superscript(12));
    assertEquals("⁰", MarkStyle.superscript(0));
  }

}
