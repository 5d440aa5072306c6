/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards;


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.crums.netcards.render.CardTable;
import io.crums.netcards.render.MultiRow;
import io.crums.netcards.render.TableProjector;
import io.crums.netcards.render.TextRenderer;

/**
 * Several network cards aligned side by side, one value column per card.
 * The rows are the union of the cards' fields, grouped by panel; a field
 * missing from a card is blank in that card's column. Each row's footnotes
 * are the union of the cards' footnotes for that field.
 *
 * <h2>Reordering</h2>
 * <p>
 * Rows may be reordered manually with {@linkplain #swapRows(int, int)}, after
 * inspecting their positions with {@linkplain #showFields()}. Positions are
 * absolute; swapping rows across a panel boundary breaks the panel grouping
 * and is the caller's responsibility.
 * </p>
 *
 * @see TableProjector#align(List, Object)
 */
public class MultiCard {

  private final List<MultiRow> rows;
  private final int cardCount;


  /**
   * Creates an instance aligning the given cards (in order). Missing fields
   * are the empty string.
   *
   * @param cards non-empty
   */
  public MultiCard(List<NetworkCard> cards) {
    this(cards, NetworkCard.BLANK);
  }


  /**
   * @param cards non-empty
   * @param blank the value of missing fields
   */
  public MultiCard(List<NetworkCard> cards, Object blank) {
    Objects.requireNonNull(cards, "null cards");
    this.rows = new ArrayList<>(TableProjector.align(cards, blank));
    this.cardCount = cards.size();
  }


  /** Returns the number of cards (value columns). */
  public int cardCount() {
    return cardCount;
  }


  /** Returns a read-only view of the rows, in their current order. */
  public List<MultiRow> rows() {
    return Collections.unmodifiableList(rows);
  }


  /** Returns the number of rows. */
  public int size() {
    return rows.size();
  }


  /** Returns the number of rows in the given panel. */
  public int panelSize(Panel panel) {
    Objects.requireNonNull(panel, "null panel");
    int count = 0;
    for (var row : rows)
      if (row.panel() == panel)
        ++count;
    return count;
  }


  /** Returns the field names, in row order. */
  public List<String> fields() {
    var fields = new ArrayList<String>(rows.size());
    for (var row : rows)
      fields.add(row.field());
    return fields;
  }


  /** Returns the field names of the given panel, in row order. */
  public List<String> fields(Panel panel) {
    Objects.requireNonNull(panel, "null panel");
    var fields = new ArrayList<String>();
    for (var row : rows)
      if (row.panel() == panel)
        fields.add(row.field());
    return fields;
  }


  /** Returns the row positions: {@code 0, 1, .., size() - 1}. */
  public List<Integer> getIndex() {
    var index = new ArrayList<Integer>(rows.size());
    for (int pos = 0; pos < rows.size(); ++pos)
      index.add(pos);
    return index;
  }


  /**
   * Returns a listing of the fields and their row positions, grouped by
   * panel. E.g.
   * <pre>
   * Overall:
   *  0  Name
   *  1  Kind
   *  ..
   *
   * Structure:
   *  6  Number of nodes
   *  ..
   * </pre>
   */
  public String showFields() {
    int width = Integer.toString(Math.max(rows.size() - 1, 0)).length();
    var out = new StringBuilder();
    for (var panel : Panel.values()) {
      if (out.length() > 0)
        out.append('\n');
      out.append(panel.title()).append(":\n");
      for (int pos = 0; pos < rows.size(); ++pos) {
        var row = rows.get(pos);
        if (row.panel() != panel)
          continue;
        var num = Integer.toString(pos);
        out.append(" ".repeat(width - num.length() + 1)).append(num)
            .append("  ").append(row.field()).append('\n');
      }
    }
    return out.toString();
  }


  /**
   * Swaps the rows at the given positions. Panel boundaries are not
   * checked.
   *
   * @throws IndexOutOfBoundsException if either position is out of bounds
   */
  public void swapRows(int pos1, int pos2) throws IndexOutOfBoundsException {
    Objects.checkIndex(pos1, rows.size());
    Objects.checkIndex(pos2, rows.size());
    Collections.swap(rows, pos1, pos2);
  }


  /**
   * Returns the plain text rendering of this multi-card.
   *
   * @see TextRenderer
   */
  @Override
  public String toString() {
    return TextRenderer.DEFAULT.render(CardTable.of(this));
  }

}
