/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.bipartite.graph;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A mutable simple directed graph. Both the out- and in-adjacency of every vertex are stored as
 * sorted lists without duplicates. Self-loops are allowed.
 */
public final class SimpleDigraph implements IntDigraph {

  private final List<List<Integer>> out;
  private final List<List<Integer>> in;
  private int edgeCount;

  private SimpleDigraph(int vertexCount) {
    this.out = new ArrayList<>(vertexCount);
    this.in = new ArrayList<>(vertexCount);
    for (int i = 0; i < vertexCount; i++) {
      out.add(new ArrayList<>());
      in.add(new ArrayList<>());
    }
  }

  /** Creates a graph with {@code vertexCount} vertices and no edges. */
  public static SimpleDigraph create(int vertexCount) {
    checkArgument(vertexCount >= 0, "negative vertex count: %s", vertexCount);
    return new SimpleDigraph(vertexCount);
  }

  @Override
  public int getVertexCount() {
    return out.size();
  }

  public int getEdgeCount() {
    return edgeCount;
  }

  /** Adds a vertex with no edges and returns its id. */
  @CanIgnoreReturnValue
  public int addVertex() {
    out.add(new ArrayList<>());
    in.add(new ArrayList<>());
    return out.size();
  }

  /**
   * Adds the edge {@code source -> destination}.
   *
   * @return false if the edge was already present
   * @throws IndexOutOfBoundsException if either endpoint is not a vertex
   */
  @CanIgnoreReturnValue
  public boolean addEdge(int source, int destination) {
    checkVertex(source);
    checkVertex(destination);
    List<Integer> successors = out.get(source - 1);
    int index = Collections.binarySearch(successors, destination);
    if (index >= 0) {
      return false;
    }
    successors.add(-index - 1, destination);
    List<Integer> predecessors = in.get(destination - 1);
    predecessors.add(-Collections.binarySearch(predecessors, source) - 1, source);
    edgeCount++;
    return true;
  }

  /**
   * Removes the edge {@code source -> destination}.
   *
   * @return false if there was no such edge
   */
  @CanIgnoreReturnValue
  public boolean removeEdge(int source, int destination) {
    checkVertex(source);
    checkVertex(destination);
    List<Integer> successors = out.get(source - 1);
    int index = Collections.binarySearch(successors, destination);
    if (index < 0) {
      return false;
    }
    successors.remove(index);
    List<Integer> predecessors = in.get(destination - 1);
    predecessors.remove(Collections.binarySearch(predecessors, source));
    edgeCount--;
    return true;
  }

  public boolean hasEdge(int source, int destination) {
    return hasVertex(source)
        && hasVertex(destination)
        && Collections.binarySearch(out.get(source - 1), destination) >= 0;
  }

  @Override
  public List<Integer> getOutNeighbors(int v) {
    checkVertex(v);
    return Collections.unmodifiableList(out.get(v - 1));
  }

  @Override
  public List<Integer> getInNeighbors(int v) {
    checkVertex(v);
    return Collections.unmodifiableList(in.get(v - 1));
  }

  /** Returns all edges, ordered by source and then by destination. */
  public Iterable<DirectedEdge> getEdges() {
    return Digraphs.edges(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("vertices", getVertexCount())
        .add("edges", edgeCount)
        .toString();
  }

  private void checkVertex(int v) {
    if (!hasVertex(v)) {
      throw new IndexOutOfBoundsException(
          "vertex " + v + " out of range 1.." + getVertexCount());
    }
  }
}
