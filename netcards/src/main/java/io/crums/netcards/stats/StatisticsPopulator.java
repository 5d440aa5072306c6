/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.stats;


import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import io.crums.netcards.CardSettings;
import io.crums.netcards.Entry;
import io.crums.netcards.NetworkCard;
import io.crums.netcards.Panel;
import io.crums.netcards.Values;

/**
 * Populates a card's default fields from {@linkplain GraphStatistics graph
 * statistics}. The {@code label}-methods each return the field(s) a single
 * statistic contributes, in order; {@linkplain #populate(NetworkCard, GraphStatistics)}
 * lays them out across the three panels.
 *
 * <h2>Degenerate Statistics</h2>
 * <p>
 * Statistics undefined on the given graph are never reported as numbers.
 * Clustering on an empty graph is {@code 0}; connectivity and diameter on an
 * empty graph, an empty distribution, and an undefined assortativity are
 * {@linkplain Values#NOT_APPLICABLE "n/a"}.
 * </p>
 */
public class StatisticsPopulator {

  /** Footnote attached to summarized distributions. */
  public final static String SUMMARY_NOTE = "Distributions summarized with average [min, max].";

  /** Footnote attached to a directed graph's undirected-equivalent degree. */
  public final static String UNDIRECTED_NOTE = "Undirected.";

  public final static String NAME = "Name";
  public final static String KIND = "Kind";
  public final static String NODES_ARE = "Nodes are";
  public final static String LINKS_ARE = "Links are";
  public final static String LINK_WEIGHTS_ARE = "Link weights are";
  public final static String CONSIDERATIONS = "Considerations";

  public final static String NUMBER_OF_NODES = "Number of nodes";
  public final static String NUMBER_OF_LINKS = "Number of links";
  public final static String BIDIRECTIONAL_LINKS = "Bidirectional links";
  public final static String DEGREE = "Degree";
  public final static String DEGREE_IN = "Degree (in)";
  public final static String DEGREE_OUT = "Degree (out)";
  public final static String CLUSTERING = "Clustering";
  public final static String CONNECTED = "Connected";
  public final static String COMPONENT_SIZE = "Component size";
  public final static String DIAMETER = "Diameter";
  public final static String LARGEST_DIAMETER = "Largest component's diameter";
  public final static String ASSORTATIVITY = "Assortativity (degree)";

  /** Metainformation fields, in order. These are always blank when populated. */
  public final static List<String> METAINFO_FIELDS = List.of(
      "Node metadata",
      "Link metadata",
      "Date of creation",
      "Data generating process",
      "Ethics",
      "Funding",
      "Citation",
      "Access");


  /**
   * Instance with default settings.
   */
  public final static StatisticsPopulator DEFAULT = new StatisticsPopulator(CardSettings.DEFAULT);


  private final CardSettings settings;


  public StatisticsPopulator(CardSettings settings) {
    this.settings = Objects.requireNonNull(settings, "null settings");
  }


  public CardSettings getSettings() {
    return settings;
  }


  /**
   * Creates and returns a new card populated from the given statistics.
   */
  public NetworkCard newCard(GraphStatistics stats) {
    var card = new NetworkCard(settings.getBlank());
    populate(card, stats);
    return card;
  }


  /**
   * Populates the given card's default fields. Existing fields with the same
   * names are overwritten (their footnotes replaced); other fields are left
   * as is.
   */
  public void populate(NetworkCard card, GraphStatistics stats) {
    Objects.requireNonNull(card, "null card");
    Objects.requireNonNull(stats, "null stats");
    card.setSource(stats);

    final Object blank = card.getBlank();
    final boolean weighted = stats.isWeighted(settings.getWeightAttribute());

    put(card, Panel.OVERALL, labelName(stats));
    put(card, Panel.OVERALL, labelKind(stats));
    card.update(Panel.OVERALL, NODES_ARE, blank);
    card.update(Panel.OVERALL, LINKS_ARE, blank);
    if (weighted)
      card.update(Panel.OVERALL, LINK_WEIGHTS_ARE, blank);
    card.update(Panel.OVERALL, CONSIDERATIONS, blank);

    put(card, Panel.STRUCTURE, labelNodes(stats));
    put(card, Panel.STRUCTURE, labelLinks(stats));
    if (stats.isDirected())
      put(card, Panel.STRUCTURE, labelBidirectionalLinks(stats));
    put(card, Panel.STRUCTURE, labelDegree(stats));
    put(card, Panel.STRUCTURE, labelClustering(stats));
    put(card, Panel.STRUCTURE, labelConnected(stats));
    put(card, Panel.STRUCTURE, labelAssortativity(stats));

    for (var field : METAINFO_FIELDS)
      card.update(Panel.METAINFO, field, blank);

    log().fine(() -> "populated card '" + stats.name() + "': " + card.size() + " fields");
  }


  private void put(NetworkCard card, Panel panel, Map<String, Entry> fields) {
    for (var e : fields.entrySet())
      card.put(panel, e.getKey(), e.getValue());
  }


  private Logger log() {
    return Logger.getLogger(NetworkCard.LOG_NAME);
  }



  //    L A B E L S


  public Map<String, Entry> labelName(GraphStatistics stats) {
    return Map.of(NAME, new Entry(stats.name()));
  }


  /**
   * Returns the {@code Kind} field: the alphabetically sorted, comma-joined,
   * capitalized tags describing directedness and weightedness. E.g.
   * "Directed, weighted (negatively)".
   */
  public Map<String, Entry> labelKind(GraphStatistics stats) {
    var tags = new ArrayList<String>(2);
    tags.add(stats.isDirected() ? "directed" : "undirected");
    String attr = settings.getWeightAttribute();
    if (stats.isWeighted(attr))
      tags.add(stats.isNegativelyWeighted(attr) ? "weighted (negatively)" : "weighted");
    else
      tags.add("unweighted");
    Collections.sort(tags);
    String kind = String.join(", ", tags);
    kind = Character.toUpperCase(kind.charAt(0)) + kind.substring(1);
    return Map.of(KIND, new Entry(kind));
  }


  public Map<String, Entry> labelNodes(GraphStatistics stats) {
    return Map.of(NUMBER_OF_NODES, new Entry(stats.nodeCount()));
  }


  /**
   * Returns the number of links. Self-loops, if any, are noted in
   * parentheses, e.g. "7 (1 self-loop)".
   */
  public Map<String, Entry> labelLinks(GraphStatistics stats) {
    int m = stats.edgeCount();
    int loops = stats.selfLoopCount();
    if (loops == 0)
      return Map.of(NUMBER_OF_LINKS, new Entry(m));
    String text = m + " (" + loops + (loops == 1 ? " self-loop)" : " self-loops)");
    return Map.of(NUMBER_OF_LINKS, new Entry(text));
  }


  /**
   * Returns the percentage of directed links whose reverse link also exists.
   * Directed graphs only.
   */
  public Map<String, Entry> labelBidirectionalLinks(GraphStatistics stats) {
    int m = stats.edgeCount();
    if (m == 0) {
      log().info("no links: bidirectional links n/a");
      return Map.of(BIDIRECTIONAL_LINKS, new Entry(Values.NOT_APPLICABLE));
    }
    double ratio = (m - stats.linkedPairCount()) / (double) m;
    return Map.of(
        BIDIRECTIONAL_LINKS,
        new Entry(Values.formatG(100 * ratio, 3) + "%"));
  }


  /**
   * Returns the degree distribution summary. Directed graphs get three
   * fields: in-degree, out-degree, and the (footnoted) undirected-equivalent
   * degree.
   */
  public Map<String, Entry> labelDegree(GraphStatistics stats) {
    if (!stats.isDirected())
      return Map.of(DEGREE, summarizeDistribution(stats.degrees()));

    var fields = new LinkedHashMap<String, Entry>();
    fields.put(DEGREE_IN, summarizeDistribution(stats.inDegrees()));
    fields.put(DEGREE_OUT, summarizeDistribution(stats.outDegrees()));
    var degree = summarizeDistribution(stats.degrees());
    var notes = new ArrayList<String>();
    notes.add(UNDIRECTED_NOTE);
    notes.addAll(degree.footnotes());
    fields.put(DEGREE, new Entry(degree.value(), notes));
    return fields;
  }


  /**
   * Returns the average clustering coefficient; zero on an empty graph.
   */
  public Map<String, Entry> labelClustering(GraphStatistics stats) {
    double clustering;
    try {
      clustering = stats.averageClustering();
    } catch (ArithmeticException ax) {
      log().info("clustering undefined (" + ax.getMessage() + "): reporting 0");
      return Map.of(CLUSTERING, new Entry(0L));
    }
    log().fine("average clustering: " + clustering);
    return Map.of(CLUSTERING, new Entry(clustering));
  }


  /**
   * Returns the connectivity fields.
   *
   * <h4>Undirected</h4>
   * <p>
   * If connected, {@code Connected}={@code Yes} and the diameter. O.w. the
   * number of components and share of nodes in the largest, a summary of the
   * component sizes, an {@code n/a} diameter, and the largest component's
   * diameter.
   * </p>
   * <h4>Directed</h4>
   * <p>
   * Strongly connected (with diameter), weakly connected, or disconnected.
   * </p>
   */
  public Map<String, Entry> labelConnected(GraphStatistics stats) {
    var fields = new LinkedHashMap<String, Entry>();
    if (stats.nodeCount() == 0) {
      log().info("empty graph: connectivity n/a");
      fields.put(CONNECTED, new Entry(Values.NOT_APPLICABLE));
      fields.put(DIAMETER, new Entry(Values.NOT_APPLICABLE));
      return fields;
    }

    if (stats.isDirected()) {
      if (stats.isStronglyConnected()) {
        fields.put(CONNECTED, new Entry("Strongly connected"));
        fields.put(DIAMETER, diameter(stats));
      } else if (stats.isWeaklyConnected())
        fields.put(CONNECTED, new Entry("Weakly connected"));
      else
        fields.put(CONNECTED, new Entry("Disconnected"));
      return fields;
    }

    if (stats.isConnected()) {
      fields.put(CONNECTED, new Entry("Yes"));
      fields.put(DIAMETER, diameter(stats));
      return fields;
    }

    var sizes = stats.componentSizes();
    double largestShare = sizes.get(0) / (double) stats.nodeCount();
    fields.put(
        CONNECTED,
        new Entry(sizes.size() + " components [" + Values.percent(largestShare, 2) + " in largest]"));
    fields.put(COMPONENT_SIZE, summarizeDistribution(sizes));
    fields.put(DIAMETER, new Entry(Values.NOT_APPLICABLE));
    Entry largest;
    try {
      largest = new Entry(stats.largestComponentDiameter());
    } catch (ArithmeticException ax) {
      log().info("largest component diameter undefined: " + ax.getMessage());
      largest = new Entry(Values.NOT_APPLICABLE);
    }
    fields.put(LARGEST_DIAMETER, largest);
    return fields;
  }


  private Entry diameter(GraphStatistics stats) {
    try {
      return new Entry(stats.diameter());
    } catch (ArithmeticException ax) {
      log().info("diameter undefined: " + ax.getMessage());
      return new Entry(Values.NOT_APPLICABLE);
    }
  }


  /**
   * Returns the degree assortativity coefficient, or {@code n/a} if
   * undefined.
   */
  public Map<String, Entry> labelAssortativity(GraphStatistics stats) {
    double r = stats.degreeAssortativity();
    if (Double.isNaN(r)) {
      log().info("assortativity undefined: n/a");
      return Map.of(ASSORTATIVITY, new Entry(Values.NOT_APPLICABLE));
    }
    return Map.of(ASSORTATIVITY, new Entry(r));
  }


  /**
   * Summarizes the given distribution. If it has no more values than the
   * {@linkplain CardSettings#getSummaryThreshold() summary threshold} (5, by
   * default), the values are listed in descending order (e.g. "[2, 1, 1]");
   * o.w. the mean, min and max are given (e.g. "2.4 [1, 6]") and the entry is
   * footnoted with {@linkplain #SUMMARY_NOTE}. An empty distribution is
   * {@code n/a}.
   */
  public Entry summarizeDistribution(List<? extends Number> values) {
    if (values.isEmpty())
      return new Entry(Values.NOT_APPLICABLE);

    if (values.size() <= settings.getSummaryThreshold()) {
      var sorted = new ArrayList<Number>(values);
      sorted.sort((a, b) -> Double.compare(b.doubleValue(), a.doubleValue()));
      return new Entry(sorted.toString());
    }

    double sum = 0;
    Number min = values.get(0);
    Number max = min;
    for (var n : values) {
      sum += n.doubleValue();
      if (n.doubleValue() < min.doubleValue())
        min = n;
      if (n.doubleValue() > max.doubleValue())
        max = n;
    }
    String summary =
        Values.formatG(sum / values.size(), 6) + " [" + min + ", " + max + "]";
    return new Entry(summary, List.of(SUMMARY_NOTE));
  }

}
