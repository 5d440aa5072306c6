/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.util.List;

import io.crums.netcards.MultiCard;
import io.crums.netcards.NetworkCard;
import io.crums.netcards.Panel;

/**
 * The render-ready view of a card or a multi-card: its rows, number of value
 * columns, and panel boundaries. Panel sizes are row counts per panel;
 * panel offsets are their cumulative sums in panel order.
 */
public class CardTable {

  /**
   * Returns a fresh projection of the given card.
   */
  public static CardTable of(NetworkCard card) {
    return new CardTable(TableProjector.project(card), 1);
  }

  /**
   * Returns the given multi-card's current rows.
   */
  public static CardTable of(MultiCard multiCard) {
    return new CardTable(multiCard.rows(), multiCard.cardCount());
  }


  private final List<CardRow> rows;
  private final int valueColumns;
  private final int[] sizes = new int[Panel.values().length];


  /**
   * @param rows          the rows, grouped by panel
   * @param valueColumns  the number of values in each row (&ge; 1)
   */
  public CardTable(List<? extends CardRow> rows, int valueColumns) {
    if (valueColumns < 1)
      throw new IllegalArgumentException("valueColumns " + valueColumns);
    this.rows = List.copyOf(rows);
    this.valueColumns = valueColumns;
    for (var row : this.rows) {
      if (row.values().size() != valueColumns)
        throw new IllegalArgumentException(
            "row '" + row.field() + "' has " + row.values().size() +
            " values; expected " + valueColumns);
      ++sizes[row.panel().ordinal()];
    }
  }


  public List<CardRow> rows() {
    return rows;
  }

  public int rowCount() {
    return rows.size();
  }

  public int valueColumns() {
    return valueColumns;
  }

  /** Returns the number of columns, the label column included. */
  public int columns() {
    return valueColumns + 1;
  }

  public int panelSize(Panel panel) {
    return sizes[panel.ordinal()];
  }

  /** Returns the zero-based index of the panel's first row. */
  public int panelOffset(Panel panel) {
    int offset = 0;
    for (int index = 0; index < panel.ordinal(); ++index)
      offset += sizes[index];
    return offset;
  }

}
