/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.polis.graph;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.polis.util.OrderedSet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Directed graph whose edges carry an optional label.
 *
 * <p>Two nodes may be joined by several edges if the edges have different
 * labels. The label is part of the identity of an edge; an edge without a
 * label has label null.
 *
 * <p>Nodes are traversed in the order they were added, so that traversals,
 * and the cycles they report, are reproducible.
 *
 * <p>The results of the last depth-first search are cached, and every
 * mutation discards them.
 *
 * @param <N> Node type
 * @param <L> Label type
 */
public class Graph<N, L> {
  final OrderedSet<N> nodes = new OrderedSet<>();

  /** Outgoing edges of each node that has at least one. */
  final Map<N, OrderedSet<Edge<N, L>>> edges = new HashMap<>();

  private @Nullable Traversal<N> traversal;

  /** Creates an empty graph. */
  public Graph() {}

  /**
   * Creates an empty graph of the same class as this, for {@link #union}.
   * Subclasses with state must override.
   */
  protected Graph<N, L> newGraph() {
    return new Graph<>();
  }

  /** Discards the cached traversal. */
  protected void invalidate() {
    traversal = null;
  }

  /** Adds a node; returns whether it was not already present. */
  public boolean addNode(N node) {
    invalidate();
    return nodes.add(node);
  }

  /** Deletes a node and every edge into or out of it. */
  public void deleteNode(N node) {
    if (!nodes.discard(node)) {
      return;
    }
    invalidate();
    edges.remove(node);
    edges
        .values()
        .removeIf(
            set -> {
              set.removeIf(e -> e.to.equals(node));
              return set.isEmpty();
            });
  }

  /** Adds an edge, and its end points if they are not present. */
  public void addEdge(N from, N to, @Nullable L label) {
    invalidate();
    addNode(from);
    addNode(to);
    edges.computeIfAbsent(from, n -> new OrderedSet<>())
        .add(new Edge<>(from, to, label));
  }

  /**
   * Deletes an edge. The label must match, even if it is null. Does not
   * delete the end points.
   */
  public void deleteEdge(N from, N to, @Nullable L label) {
    final OrderedSet<Edge<N, L>> set = edges.get(from);
    if (set == null || !set.discard(new Edge<>(from, to, label))) {
      return;
    }
    if (set.isEmpty()) {
      edges.remove(from);
    }
    invalidate();
  }

  public boolean nodeIn(N node) {
    return nodes.contains(node);
  }

  public boolean edgeIn(N from, N to, @Nullable L label) {
    final OrderedSet<Edge<N, L>> set = edges.get(from);
    return set != null && set.contains(new Edge<>(from, to, label));
  }

  /** Returns a snapshot of the nodes, in the order they were added. */
  public Set<N> nodes() {
    return ImmutableSet.copyOf(nodes);
  }

  /** Returns the edges, grouped by source node. */
  public List<Edge<N, L>> edges() {
    final ImmutableList.Builder<Edge<N, L>> b = ImmutableList.builder();
    for (N node : nodes) {
      b.addAll(outEdges(node));
    }
    return b.build();
  }

  /** Returns a snapshot of the edges out of a node. */
  public Set<Edge<N, L>> outEdges(N node) {
    final OrderedSet<Edge<N, L>> set = edges.get(node);
    return set == null ? ImmutableSet.of() : ImmutableSet.copyOf(set);
  }

  /** Returns the number of nodes plus the number of edges. */
  public int size() {
    int n = nodes.size();
    for (OrderedSet<Edge<N, L>> set : edges.values()) {
      n += set.size();
    }
    return n;
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Runs a depth-first search from every node, in order, that an earlier
   * search has not reached; records timestamps and cycles.
   */
  public void depthFirstSearch() {
    final Traversal<N> t = new Traversal<>(null);
    for (N node : nodes) {
      if (!t.data.containsKey(node)) {
        dfs(t, node);
      }
    }
    traversal = t;
  }

  /**
   * Runs a depth-first search of the nodes reachable from {@code node};
   * records timestamps and cycles.
   */
  public void depthFirstSearchNode(N node) {
    final Traversal<N> t = new Traversal<>(node);
    if (nodes.contains(node)) {
      dfs(t, node);
    }
    traversal = t;
  }

  private void dfs(Traversal<N> t, N node) {
    final Interval interval = new Interval(t.counter++);
    t.data.put(node, interval);
    for (Edge<N, L> edge : outEdges(node)) {
      final Interval target = t.data.get(edge.to);
      if (target == null) {
        t.backpath.put(edge.to, node);
        dfs(t, edge.to);
      } else if (target.end < 0) {
        t.cycles.add(constructCycle(t, node, edge.to));
      }
    }
    interval.end = t.counter++;
  }

  /**
   * Constructs the cycle closed by an edge from {@code from} to {@code to},
   * where {@code to} is an ancestor of {@code from} (or {@code from} itself)
   * in the search tree. The cycle starts at {@code to}.
   */
  private static <N> List<N> constructCycle(Traversal<N> t, N from, N to) {
    final List<N> path = new ArrayList<>();
    N node = from;
    path.add(node);
    while (!node.equals(to)) {
      node = requireNonNull(t.backpath.get(node));
      path.add(node);
    }
    return ImmutableList.copyOf(Lists.reverse(path));
  }

  /** Returns the cached traversal of the whole graph, running it if needed. */
  private Traversal<N> fullTraversal() {
    if (traversal == null || traversal.root != null) {
      depthFirstSearch();
    }
    return requireNonNull(traversal);
  }

  /** Returns whether the graph has a cycle. */
  public boolean hasCycle() {
    return !fullTraversal().cycles.isEmpty();
  }

  /**
   * Returns the cycles found by a depth-first search of the whole graph. Each
   * cycle is listed once, starting at the node at which the search closed it.
   */
  public List<List<N>> cycles() {
    return ImmutableList.copyOf(fullTraversal().cycles);
  }

  /**
   * Returns the time at which the last depth-first search discovered a node,
   * or null if it did not reach the node. Runs a search of the whole graph if
   * there is none.
   */
  public @Nullable Integer begin(N node) {
    final Interval interval = currentTraversal().data.get(node);
    return interval == null ? null : interval.begin;
  }

  /**
   * Returns the time at which the last depth-first search finished a node,
   * or null if it did not reach the node.
   */
  public @Nullable Integer end(N node) {
    final Interval interval = currentTraversal().data.get(node);
    return interval == null ? null : interval.end;
  }

  private Traversal<N> currentTraversal() {
    return traversal != null ? traversal : fullTraversal();
  }

  /**
   * Returns the nodes reachable from {@code node}, including itself, or null
   * if the node is not in the graph.
   *
   * <p>These are the nodes whose discovery/finish interval nests inside that
   * of {@code node} in a search rooted at {@code node}. A search of the whole
   * graph is not enough, because it may have reached some of those nodes
   * before {@code node}.
   */
  public @Nullable Set<N> dependencies(N node) {
    if (!nodes.contains(node)) {
      return null;
    }
    if (traversal == null || !node.equals(traversal.root)) {
      depthFirstSearchNode(node);
    }
    final Traversal<N> t = requireNonNull(traversal);
    final Interval outer = requireNonNull(t.data.get(node));
    final ImmutableSet.Builder<N> b = ImmutableSet.builder();
    t.data.forEach((n, interval) -> {
      if (outer.begin <= interval.begin && interval.end <= outer.end) {
        b.add(n);
      }
    });
    return b.build();
  }

  /** Returns the nodes that have no incoming edge. */
  public Set<N> roots() {
    final Set<N> roots = new OrderedSet<>(nodes);
    for (OrderedSet<Edge<N, L>> set : edges.values()) {
      for (Edge<N, L> edge : set) {
        roots.remove(edge.to);
      }
    }
    return ImmutableSet.copyOf(roots);
  }

  /**
   * Assigns each node to a stratum, or returns null if that is impossible.
   *
   * <p>Every node starts in stratum 1. The assignment satisfies, for each edge
   * from {@code u} to {@code v}, {@code stratum(u) >= stratum(v)}, and {@code
   * stratum(u) >= stratum(v) + 1} if the edge's label is in {@code labels}.
   *
   * <p>No node of a satisfiable graph needs a stratum higher than the number
   * of nodes; if relaxation pushes a node beyond that, there is a cycle
   * through a labeled edge, and this method returns null.
   *
   * @param labels Labels of edges that force a change of stratum; may
   *     contain null, meaning unlabeled edges
   */
  public @Nullable Map<N, Integer> stratification(Set<? extends L> labels) {
    final Map<N, Integer> stratum = new LinkedHashMap<>();
    for (N node : nodes) {
      stratum.put(node, 1);
    }
    final int limit = nodes.size();
    boolean changes = true;
    while (changes) {
      changes = false;
      for (N node : nodes) {
        for (Edge<N, L> edge : outEdges(node)) {
          final int old = stratum.get(node);
          final int required =
              stratum.get(edge.to) + (edge.labelIn(labels) ? 1 : 0);
          if (required > old) {
            if (required > limit) {
              return null;
            }
            stratum.put(node, required);
            changes = true;
          }
        }
      }
    }
    return ImmutableMap.copyOf(stratum);
  }

  /**
   * Returns a graph, of the same class as this, that contains the nodes and
   * edges of this graph and another.
   */
  public Graph<N, L> union(Graph<N, L> other) {
    final Graph<N, L> g = newGraph();
    g.addAll(this);
    g.addAll(other);
    return g;
  }

  /**
   * Adds the nodes and edges of another graph to this graph. If the other
   * graph is empty, does nothing, and keeps the cached traversal.
   */
  public Graph<N, L> addAll(Graph<N, L> other) {
    if (other.isEmpty()) {
      return this;
    }
    invalidate();
    for (N node : ImmutableList.copyOf(other.nodes)) {
      addNode(node);
    }
    for (Edge<N, L> edge : other.edges()) {
      addEdge(edge.from, edge.to, edge.label);
    }
    return this;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    int i = 0;
    for (N node : nodes) {
      if (i++ > 0) {
        b.append(", ");
      }
      describeNode(b, node);
      b.append(": ").append(ImmutableList.copyOf(outEdges(node)));
    }
    return b.append('}').toString();
  }

  /** Writes a node to a string builder; the bag graph adds its count. */
  protected void describeNode(StringBuilder b, N node) {
    b.append(node);
  }

  /**
   * Edge of a graph.
   *
   * @param <N> Node type
   * @param <L> Label type
   */
  public static final class Edge<N, L> {
    public final N from;
    public final N to;
    public final @Nullable L label;

    Edge(N from, N to, @Nullable L label) {
      this.from = requireNonNull(from);
      this.to = requireNonNull(to);
      this.label = label;
    }

    /** Returns whether this edge's label, possibly null, is in a set. */
    boolean labelIn(Set<? extends L> labels) {
      if (label == null) {
        // Some sets throw if asked whether they contain null.
        return labels.stream().anyMatch(Objects::isNull);
      }
      return labels.contains(label);
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return this == o
          || o instanceof Edge
              && from.equals(((Edge<?, ?>) o).from)
              && to.equals(((Edge<?, ?>) o).to)
              && Objects.equals(label, ((Edge<?, ?>) o).label);
    }

    @Override
    public int hashCode() {
      return Objects.hash(from, to, label);
    }

    @Override
    public String toString() {
      return label == null
          ? from + " -> " + to
          : from + " -[" + label + "]-> " + to;
    }
  }

  /** Discovery and finish times of a node; finish is -1 until finished. */
  private static class Interval {
    final int begin;
    int end = -1;

    Interval(int begin) {
      this.begin = begin;
    }
  }

  /** Working state and results of one depth-first search. */
  private static class Traversal<N> {
    /** Node the search started from, or null if it covered all nodes. */
    final @Nullable N root;

    final Map<N, Interval> data = new LinkedHashMap<>();
    final Map<N, N> backpath = new HashMap<>();
    final List<List<N>> cycles = new ArrayList<>();
    int counter;

    Traversal(@Nullable N root) {
      this.root = root;
    }
  }
}

// End Graph.java
