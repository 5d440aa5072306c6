/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.json;


import static io.crums.netcards.json.JsonUtils.*;

import java.util.LinkedHashMap;
import java.util.Map;

import io.crums.netcards.NetworkCard;
import io.crums.netcards.Panel;

/**
 * Snapshot JSON parser. A snapshot is an object with exactly 3 keys,
 * {@code overall}, {@code structure} and {@code metainfo}, each an ordered
 * field-to-value object. E.g.
 * <pre>{@code
 *  {
 *    "overall": { "Name": "Karate club", "Kind": "Undirected, unweighted", .. },
 *    "structure": { "Number of nodes": 34, .. },
 *    "metainfo": { "Node metadata": "", .. }
 *  }
 * }</pre>
 * <p>
 * Footnotes are a presentation concern and are not part of the snapshot:
 * a loaded card has none (and no statistics source).
 * </p>
 *
 * @see CardRowsParser
 */
public class CardParser implements JsonEntityParser<NetworkCard> {

  /**
   * Singleton stateless instance.
   */
  public final static CardParser INSTANCE = new CardParser();


  protected CardParser() {  }


  /**
   * Returns the snapshot of the given card.
   */
  @Override
  public Map<String, Object> toJson(NetworkCard card) {
    var jObj = new LinkedHashMap<String, Object>();
    for (var panel : Panel.values()) {
      var fields = new LinkedHashMap<String, Object>();
      for (var e : card.entries(panel).entrySet())
        fields.put(e.getKey(), e.getValue().value());
      jObj.put(panel.key(), fields);
    }
    return jObj;
  }


  /**
   * Reconstructs a card from the given snapshot.
   *
   * @throws JsonParsingException if a panel is missing, an unknown key is
   *         present, or a value is neither a string nor a number
   */
  @Override
  public NetworkCard toEntity(Object json) throws JsonParsingException {
    var jObj = asObject(json, "network card");
    for (var key : jObj.keySet()) {
      if (!isPanelKey(key))
        throw new JsonParsingException("unknown key '" + key + "'");
    }
    var card = new NetworkCard();
    for (var panel : Panel.values()) {
      var fields = getJsonObject(jObj, panel.key(), true);
      var values = new LinkedHashMap<String, Object>();
      for (var e : fields.entrySet()) {
        if (e.getKey().isEmpty())
          throw new JsonParsingException("empty field name in '" + panel.key() + "'");
        values.put(e.getKey(), getEntryValue(e.getValue(), e.getKey()));
      }
      card.update(panel, values);
    }
    return card;
  }


  private boolean isPanelKey(String key) {
    for (var panel : Panel.values())
      if (panel.key().equals(key))
        return true;
    return false;
  }

}
