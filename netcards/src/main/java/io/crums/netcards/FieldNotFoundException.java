/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards;


import java.util.List;
import java.util.NoSuchElementException;

/**
 * Raised when a field-level operation names a field that is not present
 * in the panel(s) searched.
 */
@SuppressWarnings("serial")
public class FieldNotFoundException extends NoSuchElementException {
  
  private final String field;
  private final List<Panel> searched;
  
  
  public FieldNotFoundException(String field, Panel panel) {
    this(field, List.of(panel));
  }
  
  
  public FieldNotFoundException(String field, List<Panel> searched) {
    super(message(field, searched));
    this.field = field;
    this.searched = List.copyOf(searched);
  }
  
  
  private static String message(String field, List<Panel> searched) {
    if (searched.size() == 1)
      return "field '" + field + "' not found in " + searched.get(0).title() + " panel";
    return "field '" + field + "' not found in any panel";
  }
  
  
  /** Returns the name of the missing field. */
  public String getField() {
    return field;
  }
  
  
  /** Returns the panels that were searched, in search order. */
  public List<Panel> getPanelsSearched() {
    return searched;
  }

}
