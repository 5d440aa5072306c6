/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A field's value plus its (possibly empty) ordered list of footnote texts.
 * Instances are immutable; the "mutators" return new instances.
 * 
 * @param value     a {@code String} or {@code Number} (normalized on construction)
 * @param footnotes footnote texts, in attachment order (duplicates allowed)
 * 
 * @see Values#normalize(Object)
 */
public record Entry(Object value, List<String> footnotes) {
  
  public Entry {
    value = Values.normalize(value);
    footnotes = footnotes == null ? List.of() : List.copyOf(footnotes);
    for (var note : footnotes)
      if (note.isEmpty())
        throw new IllegalArgumentException("empty footnote");
  }
  
  
  /** Creates a bare (footnote-less) entry. */
  public Entry(Object value) {
    this(value, List.of());
  }
  
  
  /** Returns a copy of this instance with the given value; footnotes are kept. */
  public Entry withValue(Object newValue) {
    return new Entry(newValue, footnotes);
  }
  
  
  /** Returns a copy of this instance with the given footnote appended. */
  public Entry withFootnote(String note) {
    Objects.requireNonNull(note, "null footnote");
    var notes = new ArrayList<String>(footnotes.size() + 1);
    notes.addAll(footnotes);
    notes.add(note);
    return new Entry(value, notes);
  }
  
  
  public boolean hasFootnotes() {
    return !footnotes.isEmpty();
  }

}
