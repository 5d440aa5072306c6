/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards;


import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jgrapht.Graph;

import io.crums.netcards.render.CardTable;
import io.crums.netcards.render.TextRenderer;
import io.crums.netcards.stats.GraphStatistics;
import io.crums.netcards.stats.JGraphTStatistics;
import io.crums.netcards.stats.StatisticsPopulator;

/**
 * A network card: a semi-standardized, three-panel table summarizing a
 * network. The panels, in order, are
 * <ol>
 * <li>{@linkplain Panel#OVERALL Overall},</li>
 * <li>{@linkplain Panel#STRUCTURE Structure},</li>
 * <li>{@linkplain Panel#METAINFO Metainformation}.</li>
 * </ol>
 * <p>
 * Each panel maps field names to {@linkplain Entry entries} in insertion
 * order; the order is significant and is preserved by every renderer.
 * Instances are mutable and not thread-safe.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>
 *                     Name  Experiment A-1
 *                     Kind  Undirected, weighted
 *                Nodes are  Survey participants
 *                Links are  Self-reported social ties
 *         Link weights are  Number of contacts per day
 *           Considerations  Data gathered for a two-week period
 *          Number of nodes  50
 *          Number of links  34
 *                  Degree¹  1.36 [0, 6]
 *               Clustering  0
 *                Connected  18 components [44.00% in largest]
 *          Component size¹  2.77778 [1, 22]
 *                 Diameter  n/a
 * Largest component's diameter  9
 *   Assortativity (degree)  -0.012
 *            Node metadata  Age, gender
 *                      ...
 *
 * ¹: Distributions summarized with average [min, max].
 * </pre>
 *
 * @see #of(String, Graph)
 * @see io.crums.netcards.render.TableProjector
 */
public class NetworkCard {

  /**
   * Logger name used across this library.
   */
  public final static String LOG_NAME = "netcards";

  /**
   * The default blank value.
   */
  public final static String BLANK = "";


  /**
   * Creates and returns a card populated from the given graph using the
   * default settings.
   *
   * @param name  the network's name (may be null)
   * @param graph non-null
   */
  public static <V, E> NetworkCard of(String name, Graph<V, E> graph) {
    return of(new JGraphTStatistics<>(name, graph));
  }


  /**
   * Creates and returns a card populated from the given statistics using the
   * default settings.
   */
  public static NetworkCard of(GraphStatistics stats) {
    return StatisticsPopulator.DEFAULT.newCard(stats);
  }




  private final EnumMap<Panel, LinkedHashMap<String, Entry>> panels =
      new EnumMap<>(Panel.class);

  private final Object blank;

  private GraphStatistics source;

  // eagerly maintained; indexed by Panel.ordinal()
  private final int[] sizes = new int[Panel.values().length];
  private final int[] offsets = new int[Panel.values().length];
  private int size;



  /**
   * Creates an empty card with blank value {@code ""}.
   */
  public NetworkCard() {
    this(BLANK);
  }


  /**
   * Creates an empty card with the given blank value.
   *
   * @param blank the value fields take when inserted without one
   */
  public NetworkCard(Object blank) {
    this.blank = Values.normalize(blank);
    for (var panel : Panel.values())
      panels.put(panel, new LinkedHashMap<>());
  }


  /** Returns the value fields take when inserted without one. */
  public final Object getBlank() {
    return blank;
  }


  /**
   * Returns the statistics this card was populated from, if any. This is
   * only used at population time.
   */
  public final Optional<GraphStatistics> getSource() {
    return Optional.ofNullable(source);
  }


  /**
   * Sets the source statistics. Invoked by the populator.
   */
  public void setSource(GraphStatistics source) {
    this.source = source;
  }



  //    M U T A T O R S


  /**
   * Inserts the given field with the blank value, or if present, sets its value
   * to blank (keeping its footnotes).
   */
  public void update(Panel panel, String field) {
    update(panel, field, blank);
  }


  /**
   * Inserts or updates a field. If the field is absent, it's appended at the end
   * of the panel; o.w. only its value is overwritten (its footnotes are
   * untouched).
   *
   * @param panel the target panel
   * @param field not empty
   * @param value a {@code String} or {@code Number}; {@code null} means blank
   */
  public void update(Panel panel, String field, Object value) {
    checkField(field);
    if (value == null)
      value = blank;
    var dest = panel(panel);
    var entry = dest.get(field);
    dest.put(field, entry == null ? new Entry(value) : entry.withValue(value));
    resize();
  }


  /**
   * Inserts or updates several fields at once, in the map's iteration order.
   *
   * @see #update(Panel, String, Object)
   */
  public void update(Panel panel, Map<String, ?> fields) {
    var dest = panel(panel);
    // validate first, so a bad argument leaves the card as it was
    var staged = new LinkedHashMap<String, Entry>(dest);
    for (var e : fields.entrySet()) {
      checkField(e.getKey());
      var entry = staged.get(e.getKey());
      var value = e.getValue() == null ? blank : e.getValue();
      staged.put(e.getKey(), entry == null ? new Entry(value) : entry.withValue(value));
    }
    dest.clear();
    dest.putAll(staged);
    resize();
  }


  /**
   * Inserts or replaces the whole entry (footnotes included) of the given field.
   */
  public void put(Panel panel, String field, Entry entry) {
    checkField(field);
    panel(panel).put(field, Objects.requireNonNull(entry, "null entry"));
    resize();
  }


  /**
   * Sets the value of an existing field, searching the panels in order.
   *
   * @throws FieldNotFoundException if no panel contains {@code field}
   */
  public void set(String field, Object value) throws FieldNotFoundException {
    var panel = findPanel(field).orElseThrow(() -> notFound(field));
    update(panel, field, value);
  }


  /**
   * Removes the given field from the given panel. The order of the remaining
   * fields is unchanged.
   *
   * @return the removed entry
   * @throws FieldNotFoundException if the field is not in the panel
   */
  public Entry remove(Panel panel, String field) throws FieldNotFoundException {
    var removed = panel(panel).remove(field);
    if (removed == null)
      throw new FieldNotFoundException(field, panel);
    resize();
    return removed;
  }


  /**
   * Appends a footnote to the given field in the first panel that contains it
   * (searched in panel order).
   *
   * @throws FieldNotFoundException if no panel contains {@code field}
   */
  public void addFootnote(String field, String note) throws FieldNotFoundException {
    var panel = findPanel(field).orElseThrow(() -> notFound(field));
    addFootnote(panel, field, note);
  }


  /**
   * Appends a footnote to the given field's entry in the given panel. Each
   * invocation appends exactly one footnote, even if the text is already
   * attached.
   *
   * @throws FieldNotFoundException if the field is not in the panel
   */
  public void addFootnote(Panel panel, String field, String note) throws FieldNotFoundException {
    var dest = panel(panel);
    var entry = dest.get(field);
    if (entry == null)
      throw new FieldNotFoundException(field, panel);
    dest.put(field, entry.withFootnote(note));
  }


  /**
   * Clears every value to {@code ""} and drops all footnotes. The fields
   * themselves (and their order) are retained.
   */
  public void clear() {
    clear(BLANK, false);
  }


  /**
   * Clears every value, retaining the fields themselves. Useful for creating a
   * blank card template.
   *
   * @param value         the value every field is set to
   * @param keepFootnotes if {@code false}, footnotes are dropped too
   */
  public void clear(Object value, boolean keepFootnotes) {
    var cleared = Values.normalize(value);
    for (var dest : panels.values())
      dest.replaceAll(
          (field, entry) -> keepFootnotes ?
              entry.withValue(cleared) : new Entry(cleared));
  }



  //    A C C E S S O R S


  /**
   * Returns the entry for the given field in the given panel, if present.
   */
  public Optional<Entry> getEntry(Panel panel, String field) {
    return Optional.ofNullable(panel(panel).get(field));
  }


  /**
   * Returns the value of the given field (first panel containing it).
   *
   * @throws FieldNotFoundException if no panel contains {@code field}
   */
  public Object getValue(String field) throws FieldNotFoundException {
    var panel = findPanel(field).orElseThrow(() -> notFound(field));
    return panel(panel).get(field).value();
  }


  /**
   * Returns the first panel (in panel order) containing the given field.
   */
  public Optional<Panel> findPanel(String field) {
    for (var panel : Panel.values())
      if (panels.get(panel).containsKey(field))
        return Optional.of(panel);
    return Optional.empty();
  }


  /** Returns the field names of the given panel, in order. */
  public List<String> fields(Panel panel) {
    return Collections.unmodifiableList(new ArrayList<>(panel(panel).keySet()));
  }


  /** Returns a read-only, ordered view of the given panel. */
  public Map<String, Entry> entries(Panel panel) {
    return Collections.unmodifiableMap(panel(panel));
  }


  /** Returns the number of fields in the given panel. */
  public final int panelSize(Panel panel) {
    return sizes[panel.ordinal()];
  }


  /**
   * Returns the number of fields in the panels <em>before</em> the given one.
   * This is the (zero-based) row offset of the panel in a projected table.
   */
  public final int panelOffset(Panel panel) {
    return offsets[panel.ordinal()];
  }


  /**
   * Returns the number of fields up to and including the given panel.
   */
  public final int cumulativeSize(Panel panel) {
    return offsets[panel.ordinal()] + sizes[panel.ordinal()];
  }


  /** Returns the total number of fields. */
  public final int size() {
    return size;
  }


  /**
   * Returns the plain text rendering of this card.
   *
   * @see TextRenderer
   */
  @Override
  public String toString() {
    return TextRenderer.DEFAULT.render(CardTable.of(this));
  }




  private LinkedHashMap<String, Entry> panel(Panel panel) {
    return panels.get(Objects.requireNonNull(panel, "null panel"));
  }


  private void resize() {
    int offset = 0;
    for (var panel : Panel.values()) {
      int count = panels.get(panel).size();
      sizes[panel.ordinal()] = count;
      offsets[panel.ordinal()] = offset;
      offset += count;
    }
    size = offset;
  }


  private FieldNotFoundException notFound(String field) {
    return new FieldNotFoundException(field, List.of(Panel.values()));
  }


  private static void checkField(String field) {
    if (Objects.requireNonNull(field, "null field").isEmpty())
      throw new IllegalArgumentException("empty field name");
  }

}
