/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import java.util.List;

import io.crums.netcards.Panel;

/**
 * A render-ready table row: a field, one value per card, and the row's
 * (not yet numbered) footnote texts.
 *
 * @see ProjectedRow
 * @see MultiRow
 */
public interface CardRow {

  Panel panel();

  String field();

  /** Returns the row's values, one per value column. */
  List<Object> values();

  /** Returns the footnote texts, in order. */
  List<String> footnotes();

}
