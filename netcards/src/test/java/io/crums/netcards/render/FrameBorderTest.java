/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.netcards.render.FrameBorder.Run;
import io.crums.netcards.render.FrameBorder.Sides;

/**
 * 
 */
public class FrameBorderTest {

  @Test
  public void testSingleCell() {
    var runs = FrameBorder.runs(2, 3, 1, 1);
    assertEquals(List.of(new Run(2, 3, 2, 3, Sides.ALL)), runs);
    assertEquals(Sides.NONE, FrameBorder.sidesAt(runs, 2, 4));
  }


  @Test
  public void testSingleRow() {
    var runs = FrameBorder.runs(0, 0, 1, 4);
    assertEquals(3, runs.size());
    assertEquals(new Sides(true, true, true, false), FrameBorder.sidesAt(runs, 0, 0));
    assertEquals(new Sides(true, false, true, false), FrameBorder.sidesAt(runs, 0, 1));
    assertEquals(new Sides(true, false, true, false), FrameBorder.sidesAt(runs, 0, 2));
    assertEquals(new Sides(true, false, true, true), FrameBorder.sidesAt(runs, 0, 3));
    assertEquals(2, runs.get(1).cells());

    // no middle
    assertEquals(2, FrameBorder.runs(0, 0, 1, 2).size());
  }


  @Test
  public void testSingleColumn() {
    var runs = FrameBorder.runs(1, 0, 3, 1);
    assertEquals(new Sides(true, true, false, true), FrameBorder.sidesAt(runs, 1, 0));
    assertEquals(new Sides(false, true, false, true), FrameBorder.sidesAt(runs, 2, 0));
    assertEquals(new Sides(false, true, true, true), FrameBorder.sidesAt(runs, 3, 0));
  }


  @Test
  public void testBlock() {
    var runs = FrameBorder.runs(0, 0, 3, 2);
    // 4 corners, left and right edges; the top and bottom edges are empty
    assertEquals(6, runs.size());
    assertEquals(new Sides(true, true, false, false), FrameBorder.sidesAt(runs, 0, 0));
    assertEquals(new Sides(false, true, false, false), FrameBorder.sidesAt(runs, 1, 0));
    assertEquals(new Sides(false, false, false, true), FrameBorder.sidesAt(runs, 1, 1));
    assertEquals(new Sides(false, false, true, true), FrameBorder.sidesAt(runs, 2, 1));

    runs = FrameBorder.runs(0, 0, 4, 4);
    assertEquals(8, runs.size());
    assertTrue(FrameBorder.sidesAt(runs, 1, 1).isNone());
  }


  @Test
  public void testEmpty() {
    assertTrue(FrameBorder.runs(5, 0, 0, 3).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> FrameBorder.runs(-1, 0, 1, 1));
  }


  @Test
  public void testAdjacentFrames() {
    var runs = FrameBorder.runs(0, 0, 1, 2);
    runs = new java.util.ArrayList<>(runs);
    runs.addAll(FrameBorder.runs(1, 0, 2, 2));
    assertEquals(new Sides(true, true, true, false), FrameBorder.sidesAt(runs, 0, 0));
    assertEquals(new Sides(true, true, false, false), FrameBorder.sidesAt(runs, 1, 0));
  }

}
