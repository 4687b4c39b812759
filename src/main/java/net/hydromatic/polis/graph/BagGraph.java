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

import java.util.HashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Graph with bag semantics for nodes and edges.
 *
 * <p>Keeps track of the number of times each node and edge has been added. A
 * node or edge is removed from the graph only once it has been deleted the
 * same number of times it was added. Deleting a node or edge that is not
 * present does nothing.
 *
 * <p>Adding an edge also adds its two end points, so a node stays in the
 * graph at least as long as the edges that touch it.
 *
 * @param <N> Node type
 * @param <L> Label type
 */
public class BagGraph<N, L> extends Graph<N, L> {
  /** Count of each node; absent if zero. */
  private final Map<N, Integer> nodeRefCounts = new HashMap<>();

  /** Count of each edge; absent if zero. */
  private final Map<Edge<N, L>, Integer> edgeRefCounts = new HashMap<>();

  @Override
  protected BagGraph<N, L> newGraph() {
    return new BagGraph<>();
  }

  @Override
  public boolean addNode(N node) {
    final boolean added = super.addNode(node);
    nodeRefCounts.merge(node, 1, Integer::sum);
    return added;
  }

  /**
   * Decrements the count of a node. When the count reaches zero, removes the
   * node, and any edges that still touch it.
   */
  @Override
  public void deleteNode(N node) {
    final Integer count = nodeRefCounts.get(node);
    if (count == null) {
      return;
    }
    invalidate();
    if (count > 1) {
      nodeRefCounts.put(node, count - 1);
      return;
    }
    nodeRefCounts.remove(node);
    edgeRefCounts
        .keySet()
        .removeIf(e -> e.from.equals(node) || e.to.equals(node));
    super.deleteNode(node);
  }

  @Override
  public void addEdge(N from, N to, @Nullable L label) {
    super.addEdge(from, to, label);
    edgeRefCounts.merge(new Edge<>(from, to, label), 1, Integer::sum);
  }

  /**
   * Decrements the count of an edge and of its end points. The label must
   * match, even if it is null.
   */
  @Override
  public void deleteEdge(N from, N to, @Nullable L label) {
    final Edge<N, L> edge = new Edge<>(from, to, label);
    final Integer count = edgeRefCounts.get(edge);
    if (count == null) {
      return;
    }
    invalidate();
    if (count > 1) {
      edgeRefCounts.put(edge, count - 1);
    } else {
      edgeRefCounts.remove(edge);
      super.deleteEdge(from, to, label);
    }
    deleteNode(from);
    deleteNode(to);
  }

  @Override
  public boolean nodeIn(N node) {
    return nodeRefCounts.containsKey(node);
  }

  @Override
  public boolean edgeIn(N from, N to, @Nullable L label) {
    return edgeRefCounts.containsKey(new Edge<>(from, to, label));
  }

  /** Returns the number of times a node has been added, net of deletes. */
  public int nodeCount(N node) {
    return nodeRefCounts.getOrDefault(node, 0);
  }

  /** Returns the number of times an edge has been added, net of deletes. */
  public int edgeCount(N from, N to, @Nullable L label) {
    return edgeRefCounts.getOrDefault(new Edge<>(from, to, label), 0);
  }

  /** Returns the sum of the counts of all nodes and edges. */
  @Override
  public int size() {
    int n = 0;
    for (int count : nodeRefCounts.values()) {
      n += count;
    }
    for (int count : edgeRefCounts.values()) {
      n += count;
    }
    return n;
  }

  @Override
  protected void describeNode(StringBuilder b, N node) {
    b.append(node).append(" *").append(nodeCount(node));
  }
}

// End BagGraph.java
