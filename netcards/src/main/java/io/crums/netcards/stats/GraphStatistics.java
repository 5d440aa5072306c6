/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.stats;


import java.util.List;

/**
 * The graph statistics a network card is populated from. Implementations
 * delegate to a graph-algorithms library; the card itself never inspects the
 * graph.
 * 
 * @see JGraphTStatistics
 * @see StatisticsPopulator
 */
public interface GraphStatistics {
  
  /** Returns the network's name, or the empty string, if unnamed. */
  String name();
  
  boolean isDirected();
  
  int nodeCount();
  
  /** Returns the number of edges (directed edges, if directed). */
  int edgeCount();
  
  int selfLoopCount();
  
  /**
   * Returns the number of unordered node pairs {u, v} with at least one edge
   * between them (in either direction). A self-loop counts as the pair {u, u}.
   */
  int linkedPairCount();
  
  /**
   * Returns the degree of every node. For directed graphs, this is the
   * undirected-equivalent degree (in + out). Self-loops count twice.
   */
  List<Integer> degrees();
  
  /** Returns the in-degree of every node. Directed graphs only. */
  List<Integer> inDegrees();
  
  /** Returns the out-degree of every node. Directed graphs only. */
  List<Integer> outDegrees();
  
  /**
   * Tells whether every edge carries the named attribute, whatever its
   * value. A graph with no edges is not weighted.
   */
  boolean isWeighted(String attribute);
  
  /**
   * Tells whether any edge's named attribute is negative.
   */
  boolean isNegativelyWeighted(String attribute);
  
  /**
   * Returns the average clustering coefficient.
   * 
   * @throws ArithmeticException if the graph has no nodes
   */
  double averageClustering() throws ArithmeticException;
  
  /**
   * Returns the degree assortativity coefficient; {@code NaN} if undefined.
   */
  double degreeAssortativity();
  
  /** Undirected graphs: tells whether the graph is connected. */
  boolean isConnected();
  
  /** Directed graphs. */
  boolean isStronglyConnected();
  
  /** Directed graphs. */
  boolean isWeaklyConnected();
  
  /**
   * Returns the (weakly) connected component sizes, largest first.
   */
  List<Integer> componentSizes();
  
  /**
   * Returns the (unweighted) diameter of the graph.
   * 
   * @throws ArithmeticException if the graph is empty or not connected
   */
  long diameter() throws ArithmeticException;
  
  /**
   * Returns the (unweighted) diameter of the subgraph induced by the largest
   * connected component.
   * 
   * @throws ArithmeticException if the graph is empty
   */
  long largestComponentDiameter() throws ArithmeticException;

}
