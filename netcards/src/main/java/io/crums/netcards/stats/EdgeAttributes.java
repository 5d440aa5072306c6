/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.stats;


import java.util.Map;
import java.util.Objects;

import org.jgrapht.Graph;

/**
 * Named edge attribute lookup. JGraphT edges carry at most an intrinsic
 * weight; this adapts whatever attribute store the caller keeps.
 * 
 * @param <E> edge type
 */
@FunctionalInterface
public interface EdgeAttributes<E> {
  
  /** The conventional weight attribute name. */
  String WEIGHT = "weight";
  
  
  /**
   * Returns the named attribute of the given edge, or {@code null} if the edge
   * doesn't carry it.
   */
  Object get(E edge, String attribute);
  
  
  
  /**
   * Returns the graph's intrinsic edge weights under the name
   * {@linkplain #WEIGHT "weight"}, if the graph type is weighted; no
   * attributes, o.w.
   */
  static <V, E> EdgeAttributes<E> intrinsicWeights(Graph<V, E> graph) {
    Objects.requireNonNull(graph, "null graph");
    if (!graph.getType().isWeighted())
      return none();
    return (edge, attribute) -> WEIGHT.equals(attribute) ? graph.getEdgeWeight(edge) : null;
  }
  
  
  /**
   * Returns a lookup backed by the given per-edge attribute maps.
   */
  static <E> EdgeAttributes<E> fromMap(Map<E, ? extends Map<String, ?>> attributes) {
    Objects.requireNonNull(attributes, "null attributes");
    return (edge, attribute) -> {
      var attrs = attributes.get(edge);
      return attrs == null ? null : attrs.get(attribute);
    };
  }
  
  
  /** Returns a lookup with no attributes. */
  static <E> EdgeAttributes<E> none() {
    return (edge, attribute) -> null;
  }

}
