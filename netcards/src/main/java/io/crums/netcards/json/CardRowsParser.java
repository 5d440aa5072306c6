/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.json;


import static io.crums.netcards.json.JsonUtils.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.crums.netcards.NetworkCard;
import io.crums.netcards.Panel;
import io.crums.netcards.render.ProjectedRow;
import io.crums.netcards.render.TableProjector;

/**
 * Full-fidelity card JSON: an array of rows, one per field, in order, each
 * carrying its footnotes.
 * <pre>{@code
 *  [
 *    { "panel": "overall", "field": "Name", "value": "Karate club", "footnotes": [] },
 *    ..
 *    { "panel": "structure", "field": "Degree", "value": "4.58824 [1, 17]",
 *      "footnotes": [ "Distributions summarized with average [min, max]." ] },
 *    ..
 *  ]
 * }</pre>
 *
 * @see CardParser
 */
public class CardRowsParser implements JsonEntityParser<NetworkCard> {

  public final static String PANEL = "panel";
  public final static String FIELD = "field";
  public final static String VALUE = "value";
  public final static String FOOTNOTES = "footnotes";

  /**
   * Singleton stateless instance.
   */
  public final static CardRowsParser INSTANCE = new CardRowsParser();


  protected CardRowsParser() {  }


  @Override
  public List<Object> toJson(NetworkCard card) {
    var jArray = new ArrayList<Object>(card.size());
    for (var row : TableProjector.project(card))
      jArray.add(toJsonObject(row));
    return jArray;
  }


  public Map<String, Object> toJsonObject(ProjectedRow row) {
    var jObj = new LinkedHashMap<String, Object>();
    jObj.put(PANEL, row.panel().key());
    jObj.put(FIELD, row.field());
    jObj.put(VALUE, row.value());
    jObj.put(FOOTNOTES, new ArrayList<>(row.footnotes()));
    return jObj;
  }


  public ProjectedRow toRow(Object json) throws JsonParsingException {
    var jObj = asObject(json, "row");
    var panelKey = getString(jObj, PANEL, true);
    Panel panel;
    try {
      panel = Panel.forName(panelKey);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("unknown panel '" + panelKey + "'", iax);
    }
    var field = getString(jObj, FIELD, true);
    if (field.isEmpty())
      throw new JsonParsingException("empty field name");
    var value = getEntryValue(jObj.get(VALUE), field);
    var notes = getJsonArray(jObj, FOOTNOTES, false);
    var footnotes = new ArrayList<String>(notes == null ? 0 : notes.size());
    if (notes != null) {
      for (var note : notes) {
        if (!(note instanceof String text) || text.isEmpty())
          throw new JsonParsingException(
              "field '" + field + "' expects non-empty footnote strings: " + note);
        footnotes.add(text);
      }
    }
    return new ProjectedRow(panel, field, value, footnotes);
  }


  /**
   * Reconstructs a card, footnotes included, from the given row array. Rows
   * are appended to their panels in order.
   */
  @Override
  public NetworkCard toEntity(Object json) throws JsonParsingException {
    var card = new NetworkCard();
    for (var element : asArray(json, "network card rows")) {
      var row = toRow(element);
      if (card.getEntry(row.panel(), row.field()).isPresent())
        throw new JsonParsingException(
            "duplicate field '" + row.field() + "' in " + row.panel().title());
      card.put(row.panel(), row.field(), row.toEntry());
    }
    return card;
  }

}
