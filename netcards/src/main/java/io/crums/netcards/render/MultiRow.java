/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

import io.crums.netcards.Panel;
import io.crums.netcards.Values;

/**
 * A multi-card row: one value per card, and the union of the cards'
 * footnotes for the field. Footnotes are de-duplicated by exact string
 * equality, in first-seen order.
 *
 * @param panel     the panel the field belongs to
 * @param field     the field name
 * @param values    one value per card
 * @param footnotes distinct footnote texts
 */
public record MultiRow(Panel panel, String field, List<Object> values, List<String> footnotes)
    implements CardRow {

  public MultiRow {
    Objects.requireNonNull(panel, "null panel");
    Objects.requireNonNull(field, "null field");
    if (values.isEmpty())
      throw new IllegalArgumentException("no values");
    var normalized = new ArrayList<Object>(values.size());
    for (var value : values)
      normalized.add(Values.normalize(value));
    values = Collections.unmodifiableList(normalized);
    footnotes = footnotes == null ?
        List.of() : List.copyOf(new LinkedHashSet<>(footnotes));
  }

}
