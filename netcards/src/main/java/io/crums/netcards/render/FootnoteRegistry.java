/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Render-scoped footnote numbering. The first time a footnote text is
 * registered it is assigned the next number; thereafter it reuses that
 * number. Each render creates its own instance.
 */
public class FootnoteRegistry {

  /**
   * A numbered footnote reference.
   *
   * @param number  the footnote's number
   * @param text    the footnote's text
   * @param first   {@code true} iff this reference introduced the number
   */
  public record Mark(int number, String text, boolean first) {  }


  private final int firstNumber;
  private final LinkedHashMap<String, Integer> numbers = new LinkedHashMap<>();


  /** Creates a 1-based registry. */
  public FootnoteRegistry() {
    this(1);
  }


  /**
   * @param firstNumber the number assigned to the first footnote (0 or 1,
   *                    typically)
   */
  public FootnoteRegistry(int firstNumber) {
    if (firstNumber < 0)
      throw new IllegalArgumentException("firstNumber " + firstNumber);
    this.firstNumber = firstNumber;
  }


  public int firstNumber() {
    return firstNumber;
  }


  /**
   * Registers a reference to the given footnote text and returns its mark.
   */
  public Mark register(String text) {
    Objects.requireNonNull(text, "null footnote");
    Integer number = numbers.get(text);
    if (number != null)
      return new Mark(number, text, false);
    number = firstNumber + numbers.size();
    numbers.put(text, number);
    return new Mark(number, text, true);
  }


  /** Returns the number assigned the given text, if any. */
  public Optional<Integer> numberOf(String text) {
    return Optional.ofNullable(numbers.get(text));
  }


  /** Returns the number of distinct footnotes registered. */
  public int size() {
    return numbers.size();
  }


  /**
   * Returns the registered footnotes, in first-seen (i.e. numeric) order.
   */
  public List<Mark> legend() {
    var legend = new ArrayList<Mark>(numbers.size());
    for (var e : numbers.entrySet())
      legend.add(new Mark(e.getValue(), e.getKey(), true));
    return legend;
  }

}
