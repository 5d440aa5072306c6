/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.util.List;
import java.util.Objects;

import io.crums.netcards.Entry;
import io.crums.netcards.Panel;
import io.crums.netcards.Values;

/**
 * A single card's row.
 *
 * @param panel     the panel the field belongs to
 * @param field     the field name
 * @param value     a {@code String} or {@code Number}
 * @param footnotes footnote texts, in attachment order
 */
public record ProjectedRow(Panel panel, String field, Object value, List<String> footnotes)
    implements CardRow {

  public ProjectedRow {
    Objects.requireNonNull(panel, "null panel");
    Objects.requireNonNull(field, "null field");
    value = Values.normalize(value);
    footnotes = footnotes == null ? List.of() : List.copyOf(footnotes);
  }


  public ProjectedRow(Panel panel, String field, Entry entry) {
    this(panel, field, entry.value(), entry.footnotes());
  }


  /** Returns the row's value and footnotes as an entry. */
  public Entry toEntry() {
    return new Entry(value, footnotes);
  }


  @Override
  public List<Object> values() {
    return List.of(value);
  }

}
