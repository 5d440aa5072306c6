/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.render;


import io.crums.netcards.NetworkCard;
import io.crums.netcards.Panel;

/**
 * Small hand-built cards shared by the renderer tests.
 */
class SampleCards {

  final static String NOTE = "Distributions summarized with average [min, max].";

  private SampleCards() {  }


  /**
   * Returns a 4-row card, one field footnoted:
   * <pre>
   *       Name  G
   *    Degree¹  2.5 [1, 4]
   * Clustering  0.571
   *     Ethics  IRB #12_a
   * </pre>
   */
  static NetworkCard small() {
    var card = new NetworkCard();
    card.update(Panel.OVERALL, "Name", "G");
    card.update(Panel.STRUCTURE, "Degree", "2.5 [1, 4]");
    card.addFootnote("Degree", NOTE);
    card.update(Panel.STRUCTURE, "Clustering", 0.5706);
    card.update(Panel.METAINFO, "Ethics", "IRB #12_a");
    return card;
  }


  /** Returns a card with 3 fields, no footnotes. */
  static NetworkCard plain(String name, long nodes) {
    var card = new NetworkCard();
    card.update(Panel.OVERALL, "Name", name);
    card.update(Panel.STRUCTURE, "Number of nodes", nodes);
    card.update(Panel.METAINFO, "Citation", "");
    return card;
  }

}
