/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.stats;


import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;
import org.junit.jupiter.api.Test;

/**
 * 
 */
public class JGraphTStatisticsTest {

  private static SimpleGraph<Integer, DefaultEdge> star(int leaves) {
    var graph = new SimpleGraph<Integer, DefaultEdge>(DefaultEdge.class);
    graph.addVertex(0);
    for (int v = 1; v <= leaves; ++v) {
      graph.addVertex(v);
      graph.addEdge(0, v);
    }
    return graph;
  }


  @Test
  public void testStar() {
    var stats = new JGraphTStatistics<>("star", star(4));
    assertEquals("star", stats.name());
    assertFalse(stats.isDirected());
    assertEquals(5, stats.nodeCount());
    assertEquals(4, stats.edgeCount());
    assertEquals(0, stats.selfLoopCount());
    assertEquals(4, stats.linkedPairCount());
    assertEquals(-1.0, stats.degreeAssortativity(), 1e-9);
    assertEquals(0.0, stats.averageClustering());
    assertTrue(stats.isConnected());
    assertEquals(2, stats.diameter());
    assertFalse(stats.isWeighted(EdgeAttributes.WEIGHT));
  }


  @Test
  public void testComponents() {
    var graph = star(2);
    graph.addVertex(10);
    graph.addVertex(11);
    graph.addVertex(12);
    graph.addEdge(11, 12);
    var stats = new JGraphTStatistics<>(null, graph);
    assertEquals("", stats.name());
    assertFalse(stats.isConnected());
    assertEquals(List.of(3, 2, 1), stats.componentSizes());
    assertThrows(ArithmeticException.class, stats::diameter);
    assertEquals(2, stats.largestComponentDiameter());
  }


  @Test
  public void testDirectedPairs() {
    var graph = new DefaultDirectedGraph<Integer, DefaultEdge>(DefaultEdge.class);
    for (int v = 0; v < 3; ++v)
      graph.addVertex(v);
    graph.addEdge(0, 1);
    graph.addEdge(1, 0);
    graph.addEdge(1, 2);
    var stats = new JGraphTStatistics<>("", graph);
    assertTrue(stats.isDirected());
    assertEquals(3, stats.edgeCount());
    assertEquals(2, stats.linkedPairCount());
    assertFalse(stats.isStronglyConnected());
    assertTrue(stats.isWeaklyConnected());

    graph.addEdge(2, 1);
    assertTrue(stats.isStronglyConnected());
    assertEquals(2, stats.diameter());
  }


  @Test
  public void testEmpty() {
    var stats = new JGraphTStatistics<>("", new SimpleGraph<Integer, DefaultEdge>(DefaultEdge.class));
    assertThrows(ArithmeticException.class, stats::averageClustering);
    assertThrows(ArithmeticException.class, stats::diameter);
    assertTrue(Double.isNaN(stats.degreeAssortativity()));
    assertFalse(stats.isStronglyConnected());
    assertFalse(stats.isWeaklyConnected());
  }

}
