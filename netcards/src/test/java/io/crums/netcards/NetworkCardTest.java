/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards;


import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;
import org.junit.jupiter.api.Test;

import io.crums.netcards.stats.StatisticsPopulator;

/**
 * 
 */
public class NetworkCardTest {

  @Test
  public void testEmpty() {
    var card = new NetworkCard();
    assertEquals(0, card.size());
    for (var panel : Panel.values()) {
      assertEquals(0, card.panelSize(panel));
      assertEquals(0, card.panelOffset(panel));
    }
    assertEquals("", card.getBlank());
    assertTrue(card.getSource().isEmpty());
  }


  @Test
  public void testUpdateAppendsInOrder() {
    var card = new NetworkCard();
    card.update(Panel.OVERALL, "Name", "Karate club");
    card.update(Panel.OVERALL, "Kind");
    card.update(Panel.STRUCTURE, "Number of nodes", 34);
    card.update(Panel.OVERALL, "Name", "Zachary");

    assertEquals(List.of("Name", "Kind"), card.fields(Panel.OVERALL));
    assertEquals("Zachary", card.getValue("Name"));
    assertEquals("", card.getValue("Kind"));
    assertEquals(34L, card.getValue("Number of nodes"));
    assertEquals(2, card.panelOffset(Panel.STRUCTURE));
    assertEquals(3, card.panelOffset(Panel.METAINFO));
    assertEquals(3, card.cumulativeSize(Panel.STRUCTURE));
    assertEquals(3, card.size());
  }


  @Test
  public void testUpdateKeepsFootnotes() {
    var card = new NetworkCard();
    card.update(Panel.STRUCTURE, "Degree", "2.5 [1, 6]");
    card.addFootnote("Degree", "Summarized.");
    card.update(Panel.STRUCTURE, "Degree", "3 [1, 7]");
    var entry = card.getEntry(Panel.STRUCTURE, "Degree").get();
    assertEquals("3 [1, 7]", entry.value());
    assertEquals(List.of("Summarized."), entry.footnotes());
  }


  @Test
  public void testUpdateMap() {
    var card = new NetworkCard("-");
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("Node metadata", "Age");
    fields.put("Link metadata", null);
    card.update(Panel.METAINFO, fields);
    assertEquals(List.of("Node metadata", "Link metadata"), card.fields(Panel.METAINFO));
    assertEquals("-", card.getValue("Link metadata"));
  }


  @Test
  public void testUpdateNullIsBlank() {
    var card = new NetworkCard("-");
    card.update(Panel.STRUCTURE, "Diameter", null);
    assertEquals("-", card.getValue("Diameter"));
    card.update(Panel.STRUCTURE, "Diameter", 4);
    card.addFootnote("Diameter", "Largest component.");
    card.set("Diameter", null);
    var entry = card.getEntry(Panel.STRUCTURE, "Diameter").get();
    assertEquals("-", entry.value());
    assertEquals(List.of("Largest component."), entry.footnotes());
  }


  @Test
  public void testUpdateMapIsAtomic() {
    var card = new NetworkCard();
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("Good", 1);
    fields.put("", 2);
    assertThrows(IllegalArgumentException.class, () -> card.update(Panel.METAINFO, fields));
    assertEquals(0, card.size());
  }


  @Test
  public void testBadValue() {
    var card = new NetworkCard();
    assertThrows(
        IllegalArgumentException.class,
        () -> card.update(Panel.OVERALL, "Name", List.of("x")));
    assertThrows(
        IllegalArgumentException.class,
        () -> card.update(Panel.OVERALL, "", "x"));
  }


  @Test
  public void testSetSearchesPanelsInOrder() {
    var card = new NetworkCard();
    card.update(Panel.STRUCTURE, "Notes", "a");
    card.update(Panel.METAINFO, "Notes", "b");
    card.set("Notes", "c");
    assertEquals("c", card.getEntry(Panel.STRUCTURE, "Notes").get().value());
    assertEquals("b", card.getEntry(Panel.METAINFO, "Notes").get().value());
    assertEquals(Panel.STRUCTURE, card.findPanel("Notes").get());
  }


  @Test
  public void testFieldNotFound() {
    var card = new NetworkCard();
    card.update(Panel.OVERALL, "Name", "x");
    var fnfx = assertThrows(FieldNotFoundException.class, () -> card.set("Nmae", 1));
    assertEquals("Nmae", fnfx.getField());
    assertEquals(List.of(Panel.values()), fnfx.getPanelsSearched());
    assertThrows(FieldNotFoundException.class, () -> card.getValue("Nmae"));
    assertThrows(FieldNotFoundException.class, () -> card.addFootnote("Nmae", "note"));
    fnfx = assertThrows(
        FieldNotFoundException.class, () -> card.remove(Panel.STRUCTURE, "Name"));
    assertEquals(List.of(Panel.STRUCTURE), fnfx.getPanelsSearched());
  }


  @Test
  public void testRemove() {
    var card = new NetworkCard();
    card.update(Panel.OVERALL, "A", 1);
    card.update(Panel.OVERALL, "B", 2);
    card.update(Panel.OVERALL, "C", 3);
    card.update(Panel.STRUCTURE, "D", 4);
    var removed = card.remove(Panel.OVERALL, "B");
    assertEquals(2L, removed.value());
    assertEquals(List.of("A", "C"), card.fields(Panel.OVERALL));
    assertEquals(2, card.panelOffset(Panel.STRUCTURE));
    assertEquals(3, card.size());
  }


  @Test
  public void testAddFootnoteAppendsEachTime() {
    var card = new NetworkCard();
    card.update(Panel.STRUCTURE, "Degree", 1);
    card.addFootnote(Panel.STRUCTURE, "Degree", "Undirected.");
    card.addFootnote(Panel.STRUCTURE, "Degree", "Undirected.");
    assertEquals(
        List.of("Undirected.", "Undirected."),
        card.getEntry(Panel.STRUCTURE, "Degree").get().footnotes());
  }


  @Test
  public void testClear() {
    var card = new NetworkCard();
    card.update(Panel.OVERALL, "Name", "x");
    card.update(Panel.STRUCTURE, "Degree", 3);
    card.addFootnote("Degree", "note");

    card.clear("?", true);
    assertEquals("?", card.getValue("Name"));
    assertEquals("?", card.getValue("Degree"));
    assertEquals(List.of("note"), card.getEntry(Panel.STRUCTURE, "Degree").get().footnotes());

    card.clear();
    assertEquals("", card.getValue("Degree"));
    assertFalse(card.getEntry(Panel.STRUCTURE, "Degree").get().hasFootnotes());
    assertEquals(2, card.size());
  }


  @Test
  public void testOfGraph() {
    var graph = new SimpleGraph<Integer, DefaultEdge>(DefaultEdge.class);
    graph.addVertex(1);
    graph.addVertex(2);
    graph.addVertex(3);
    graph.addEdge(1, 2);
    graph.addEdge(2, 3);

    var card = NetworkCard.of("path", graph);
    assertEquals("path", card.getValue(StatisticsPopulator.NAME));
    assertEquals("Undirected, unweighted", card.getValue(StatisticsPopulator.KIND));
    assertEquals(3L, card.getValue(StatisticsPopulator.NUMBER_OF_NODES));
    assertEquals(2L, card.getValue(StatisticsPopulator.NUMBER_OF_LINKS));
    assertEquals("Yes", card.getValue(StatisticsPopulator.CONNECTED));
    assertEquals(2L, card.getValue(StatisticsPopulator.DIAMETER));
    assertTrue(card.getSource().isPresent());
    assertEquals(
        StatisticsPopulator.METAINFO_FIELDS, card.fields(Panel.METAINFO));

    var text = card.toString();
    assertTrue(text.contains("Number of nodes  3"));
  }

}
