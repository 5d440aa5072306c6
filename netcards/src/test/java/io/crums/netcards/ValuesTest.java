/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards;


import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class ValuesTest {

  @Test
  public void testNormalize() {
    assertEquals(5L, Values.normalize(5));
    assertEquals(5L, Values.normalize((short) 5));
    assertEquals(1.5, Values.normalize(1.5f));
    assertEquals(12.0, Values.normalize(BigInteger.valueOf(12)));
    assertEquals("x", Values.normalize("x"));
  }

  @Test
  public void testNormalizeRejects() {
    assertThrows(IllegalArgumentException.class, () -> Values.normalize(null));
    assertThrows(IllegalArgumentException.class, () -> Values.normalize(List.of()));
    assertThrows(IllegalArgumentException.class, () -> Values.normalize(Boolean.TRUE));
  }

  @Test
  public void testIsFloating() {
    assertTrue(Values.isFloating(0.25));
    assertFalse(Values.isFloating(3L));
    assertFalse(Values.isFloating("0.25"));
  }

  @Test
  public void testFormatG() {
    assertEquals("0.5", Values.formatG(0.5, 3));
    assertEquals("1.4", Values.formatG(1.4, 6));
    assertEquals("33.3", Values.formatG(33.3333, 3));
    assertEquals("25", Values.formatG(25.0, 3));
    assertEquals("1.23457e+06", Values.formatG(1234567.0, 6));
    assertEquals("1.23e-05", Values.formatG(0.00001234, 3));
    assertEquals("0", Values.formatG(0.0, 3));
    assertEquals("-0.012", Values.formatG(-0.012, 3));
    assertEquals("nan", Values.formatG(Double.NaN, 3));
  }

  @Test
  public void testToText() {
    assertEquals("0.571", Values.toText(0.5706, 3));
    assertEquals("34", Values.toText(34L, 3));
    assertEquals("n/a", Values.toText(Values.NOT_APPLICABLE, 3));
  }

  @Test
  public void testToFixedText() {
    assertEquals("0.5706", Values.toFixedText(0.570638, 4));
    assertEquals("2.0000", Values.toFixedText(2.0, 4));
    assertEquals("7", Values.toFixedText(7L, 4));
  }

  @Test
  public void testPercent() {
    assertEquals("75.00%", Values.percent(0.75, 2));
    assertEquals("44.00%", Values.percent(22 / 50.0, 2));
  }

  @Test
  public void testRoundSignificant() {
    assertEquals(0.571, Values.roundSignificant(0.570638, 3));
    assertEquals(1230.0, Values.roundSignificant(1234.5, 3));
    assertEquals(0.0, Values.roundSignificant(0.0, 3));
  }

}
