/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards;


/**
 * The three panels of a network card, in their fixed order.
 */
public enum Panel {
  
  OVERALL("Overall", "overall"),
  STRUCTURE("Structure", "structure"),
  METAINFO("Metainformation", "metainfo");
  
  
  private Panel(String title, String key) {
    this.title = title;
    this.key = key;
  }
  
  private final String title;
  private final String key;
  
  
  /** Returns the display name ("Overall", "Structure", "Metainformation"). */
  public String title() {
    return title;
  }
  
  
  /** Returns the key used in structured dumps. */
  public String key() {
    return key;
  }
  
  
  /**
   * Returns the panel with the given {@linkplain #key() key}, or
   * {@linkplain #title() title}. Case-insensitive.
   * 
   * @throws IllegalArgumentException if no panel matches
   */
  public static Panel forName(String name) throws IllegalArgumentException {
    for (var panel : values())
      if (panel.key.equalsIgnoreCase(name) || panel.title.equalsIgnoreCase(name))
        return panel;
    throw new IllegalArgumentException("unknown panel: " + name);
  }

}
