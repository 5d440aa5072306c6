/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

import io.crums.netcards.NetworkCard;
import io.crums.netcards.Panel;

/**
 * Flattens cards into row sequences. Rows are created fresh on every call;
 * nothing is cached.
 */
public class TableProjector {

  // only a namespace
  private TableProjector() {  }


  /**
   * Returns the card's rows: panels in fixed order, fields in their panel's
   * order. Footnotes are carried through as is.
   */
  public static List<ProjectedRow> project(NetworkCard card) {
    var rows = new ArrayList<ProjectedRow>(card.size());
    for (var panel : Panel.values())
      for (var e : card.entries(panel).entrySet())
        rows.add(new ProjectedRow(panel, e.getKey(), e.getValue()));
    return rows;
  }


  /**
   * Aligns the given cards, missing fields taking the empty string.
   *
   * @see #align(List, Object)
   */
  public static List<MultiRow> align(List<NetworkCard> cards) {
    return align(cards, NetworkCard.BLANK);
  }


  /**
   * Aligns the given cards side by side. The rows are the union of the
   * cards' (panel, field) pairs, grouped by panel in fixed order and, within
   * a panel, in order of first appearance across the cards (in the order
   * given). A field missing from a card takes the {@code blank} value in
   * that card's column. Each row's footnotes are the union of the cards'
   * footnotes for that field.
   *
   * @param cards non-empty list
   * @param blank value of missing fields
   */
  public static List<MultiRow> align(List<NetworkCard> cards, Object blank) {
    if (cards.isEmpty())
      throw new IllegalArgumentException("no cards");
    Objects.requireNonNull(blank, "null blank");
    final int count = cards.size();

    var rows = new ArrayList<MultiRow>();
    for (var panel : Panel.values()) {
      var merged = new LinkedHashMap<String, Merge>();
      for (int index = 0; index < count; ++index) {
        for (var e : cards.get(index).entries(panel).entrySet()) {
          var merge = merged.computeIfAbsent(e.getKey(), f -> new Merge(count, blank));
          merge.values[index] = e.getValue().value();
          merge.footnotes.addAll(e.getValue().footnotes());
        }
      }
      for (var e : merged.entrySet()) {
        var merge = e.getValue();
        rows.add(
            new MultiRow(
                panel, e.getKey(),
                Arrays.asList(merge.values),
                new ArrayList<>(merge.footnotes)));
      }
    }
    return rows;
  }


  private static class Merge {
    final Object[] values;
    final LinkedHashSet<String> footnotes = new LinkedHashSet<>();

    Merge(int count, Object blank) {
      values = new Object[count];
      Arrays.fill(values, blank);
    }
  }

}
