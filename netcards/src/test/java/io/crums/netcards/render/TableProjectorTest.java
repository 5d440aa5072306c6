/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.netcards.NetworkCard;
import io.crums.netcards.Panel;

/**
 * 
 */
public class TableProjectorTest {

  @Test
  public void testProject() {
    var card = SampleCards.small();
    var rows = TableProjector.project(card);
    assertEquals(4, rows.size());
    assertEquals(new ProjectedRow(Panel.OVERALL, "Name", "G", List.of()), rows.get(0));
    assertEquals(List.of(SampleCards.NOTE), rows.get(1).footnotes());
    assertEquals(List.of(0.5706), rows.get(2).values());
    assertEquals(Panel.METAINFO, rows.get(3).panel());
    assertEquals(card.getEntry(Panel.STRUCTURE, "Degree").get(), rows.get(1).toEntry());
  }


  @Test
  public void testProjectIsPanelOrdered() {
    var card = new NetworkCard();
    card.update(Panel.METAINFO, "Access", "open");
    card.update(Panel.OVERALL, "Name", "x");
    var rows = TableProjector.project(card);
    assertEquals("Name", rows.get(0).field());
    assertEquals("Access", rows.get(1).field());
  }


  @Test
  public void testAlign() {
    var a = new NetworkCard();
    a.update(Panel.OVERALL, "Name", "a");
    a.update(Panel.OVERALL, "Kind", "k");
    a.update(Panel.STRUCTURE, "Degree", 1);
    a.addFootnote("Degree", "X");

    var b = new NetworkCard();
    b.update(Panel.OVERALL, "Name", "b");
    b.update(Panel.OVERALL, "Extra", "e");
    b.update(Panel.STRUCTURE, "Degree", 2);
    b.addFootnote("Degree", "Y");
    b.addFootnote("Degree", "X");

    var rows = TableProjector.align(List.of(a, b), "-");
    assertEquals(4, rows.size());
    assertEquals(new MultiRow(Panel.OVERALL, "Name", List.of("a", "b"), List.of()), rows.get(0));
    assertEquals(List.of("k", "-"), rows.get(1).values());
    assertEquals("Extra", rows.get(2).field());
    assertEquals(List.of("-", "e"), rows.get(2).values());
    assertEquals(List.of(1L, 2L), rows.get(3).values());
    assertEquals(List.of("X", "Y"), rows.get(3).footnotes());

    assertEquals(List.of("", "e"), TableProjector.align(List.of(a, b)).get(2).values());
  }


  @Test
  public void testAlignNone() {
    assertThrows(IllegalArgumentException.class, () -> TableProjector.align(List.of()));
  }


  @Test
  public void testCardTable() {
    var table = CardTable.of(SampleCards.small());
    assertEquals(4, table.rowCount());
    assertEquals(1, table.valueColumns());
    assertEquals(2, table.columns());
    assertEquals(2, table.panelSize(Panel.STRUCTURE));
    assertEquals(1, table.panelOffset(Panel.STRUCTURE));
    assertEquals(3, table.panelOffset(Panel.METAINFO));

    var rows = TableProjector.project(SampleCards.small());
    assertThrows(IllegalArgumentException.class, () -> new CardTable(rows, 2));
    assertThrows(IllegalArgumentException.class, () -> new CardTable(rows, 0));
  }

}
