/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.stats;


import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToIntFunction;

import org.jgrapht.Graph;
import org.jgrapht.GraphMetrics;
import org.jgrapht.GraphTests;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.alg.scoring.ClusteringCoefficient;
import org.jgrapht.graph.AsSubgraph;
import org.jgrapht.graph.AsUnweightedGraph;

/**
 * {@linkplain GraphStatistics Graph statistics} computed with JGraphT.
 * Distances (diameters) are hop counts: edge weights are ignored.
 *
 * @param <V> vertex type
 * @param <E> edge type
 */
public class JGraphTStatistics<V, E> implements GraphStatistics {

  private final String name;
  private final Graph<V, E> graph;
  private final EdgeAttributes<E> attributes;


  /**
   * Creates an instance whose edge attributes are the graph's intrinsic
   * weights (if any).
   *
   * @param name  network name (null counts as unnamed)
   * @param graph non-null
   *
   * @see EdgeAttributes#intrinsicWeights(Graph)
   */
  public JGraphTStatistics(String name, Graph<V, E> graph) {
    this(name, graph, EdgeAttributes.intrinsicWeights(graph));
  }


  /**
   * Full constructor.
   *
   * @param name        network name (null counts as unnamed)
   * @param graph       non-null
   * @param attributes  named edge attribute lookup
   */
  public JGraphTStatistics(String name, Graph<V, E> graph, EdgeAttributes<E> attributes) {
    this.name = name == null ? "" : name;
    this.graph = Objects.requireNonNull(graph, "null graph");
    this.attributes = Objects.requireNonNull(attributes, "null attributes");
  }


  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean isDirected() {
    return graph.getType().isDirected();
  }

  @Override
  public int nodeCount() {
    return graph.vertexSet().size();
  }

  @Override
  public int edgeCount() {
    return graph.edgeSet().size();
  }

  @Override
  public int selfLoopCount() {
    int count = 0;
    for (var edge : graph.edgeSet())
      if (isLoop(edge))
        ++count;
    return count;
  }

  @Override
  public int linkedPairCount() {
    Set<Set<V>> pairs = new HashSet<>();
    for (var edge : graph.edgeSet()) {
      V u = graph.getEdgeSource(edge);
      V v = graph.getEdgeTarget(edge);
      pairs.add(u.equals(v) ? Set.of(u) : Set.of(u, v));
    }
    return pairs.size();
  }

  @Override
  public List<Integer> degrees() {
    return collect(graph::degreeOf);
  }

  @Override
  public List<Integer> inDegrees() {
    return collect(graph::inDegreeOf);
  }

  @Override
  public List<Integer> outDegrees() {
    return collect(graph::outDegreeOf);
  }


  private List<Integer> collect(ToIntFunction<V> func) {
    var values = new ArrayList<Integer>(graph.vertexSet().size());
    for (var vertex : graph.vertexSet())
      values.add(func.applyAsInt(vertex));
    return values;
  }


  @Override
  public boolean isWeighted(String attribute) {
    if (graph.edgeSet().isEmpty())
      return false;
    for (var edge : graph.edgeSet())
      if (attributes.get(edge, attribute) == null)
        return false;
    return true;
  }

  @Override
  public boolean isNegativelyWeighted(String attribute) {
    for (var edge : graph.edgeSet())
      if (attributes.get(edge, attribute) instanceof Number weight &&
          weight.doubleValue() < 0)
        return true;
    return false;
  }

  @Override
  public double averageClustering() throws ArithmeticException {
    if (graph.vertexSet().isEmpty())
      throw new ArithmeticException("average clustering undefined on an empty graph");
    return new ClusteringCoefficient<>(graph).getAverageClusteringCoefficient();
  }


  /**
   * {@inheritDoc}
   *
   * <p>This is the Pearson correlation of the degrees at either end of each
   * edge. For undirected graphs each edge is counted in both directions; for
   * directed graphs the source's out-degree is paired with the target's
   * in-degree.</p>
   */
  @Override
  public double degreeAssortativity() {
    final boolean directed = isDirected();
    int n = 0;
    double sumX = 0, sumY = 0, sumXX = 0, sumYY = 0, sumXY = 0;
    for (var edge : graph.edgeSet()) {
      V u = graph.getEdgeSource(edge);
      V v = graph.getEdgeTarget(edge);
      double x, y;
      if (directed) {
        x = graph.outDegreeOf(u);
        y = graph.inDegreeOf(v);
      } else {
        x = graph.degreeOf(u);
        y = graph.degreeOf(v);
        // the reverse orientation
        sumX += y;  sumY += x;
        sumXX += y * y;  sumYY += x * x;
        sumXY += x * y;
        ++n;
      }
      sumX += x;  sumY += y;
      sumXX += x * x;  sumYY += y * y;
      sumXY += x * y;
      ++n;
    }
    if (n == 0)
      return Double.NaN;
    double cov = sumXY / n - (sumX / n) * (sumY / n);
    double varX = sumXX / n - (sumX / n) * (sumX / n);
    double varY = sumYY / n - (sumY / n) * (sumY / n);
    double denom = Math.sqrt(varX * varY);
    // regular graphs (and the like) have no degree variance
    if (denom < 1e-12)
      return Double.NaN;
    return cov / denom;
  }

  @Override
  public boolean isConnected() {
    return new ConnectivityInspector<>(graph).isConnected();
  }

  @Override
  public boolean isStronglyConnected() {
    return !graph.vertexSet().isEmpty() && GraphTests.isStronglyConnected(graph);
  }

  @Override
  public boolean isWeaklyConnected() {
    return !graph.vertexSet().isEmpty() && GraphTests.isWeaklyConnected(graph);
  }

  @Override
  public List<Integer> componentSizes() {
    var sizes = new ArrayList<Integer>();
    for (var component : new ConnectivityInspector<>(graph).connectedSets())
      sizes.add(component.size());
    sizes.sort(Collections.reverseOrder());
    return sizes;
  }

  @Override
  public long diameter() throws ArithmeticException {
    if (graph.vertexSet().isEmpty())
      throw new ArithmeticException("diameter undefined on an empty graph");
    return hops(GraphMetrics.getDiameter(new AsUnweightedGraph<>(graph)));
  }

  @Override
  public long largestComponentDiameter() throws ArithmeticException {
    if (graph.vertexSet().isEmpty())
      throw new ArithmeticException("diameter undefined on an empty graph");
    Set<V> largest = null;
    for (var component : new ConnectivityInspector<>(graph).connectedSets())
      if (largest == null || component.size() > largest.size())
        largest = component;
    var subgraph = new AsSubgraph<>(new AsUnweightedGraph<>(graph), largest);
    return hops(GraphMetrics.getDiameter(subgraph));
  }


  private long hops(double diameter) throws ArithmeticException {
    if (Double.isInfinite(diameter) || Double.isNaN(diameter))
      throw new ArithmeticException("diameter undefined (graph is not connected)");
    return Math.round(diameter);
  }


  private boolean isLoop(E edge) {
    return graph.getEdgeSource(edge).equals(graph.getEdgeTarget(edge));
  }

}
