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

import com.google.bipartite.BipartiteGraph;
import com.google.bipartite.matching.Assignment;
import com.google.bipartite.matching.Matching;
import com.google.common.base.MoreObjects;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A directed view of a bipartite graph in which every matched edge is contracted into a single
 * vertex.
 *
 * <p>When not transposed the vertices are the sources of the bipartite graph. There is an edge
 * {@code v -> w} for every destination {@code d} adjacent to {@code v} that is matched to a
 * source {@code w != v}. Walking such an edge follows an unmatched edge from {@code v} to {@code
 * d} and then the matched edge from {@code d} back to {@code w}, so paths in this graph are
 * alternating paths of the bipartite graph.
 *
 * <p>When transposed the vertices are the destinations, and there is an edge {@code e -> d} for
 * every destination {@code e != d} adjacent to the source matched to {@code d}.
 *
 * <p>Only one direction is cheap to compute for each orientation. The other direction is answered
 * through {@link #invview()}, which requires both the bipartite graph and the matching to be
 * completed.
 *
 * <p>The view holds its graph and matching by reference, and reflects later mutations of them
 * except for the memoized edge count.
 */
public final class DiCMOBiGraph implements IntDigraph {

  private static final Logger logger = Logger.getLogger(DiCMOBiGraph.class.getName());

  private final BipartiteGraph<?> graph;
  private final Matching<?> matching;
  private final boolean transposed;
  private @Nullable Integer edgeCount;

  private DiCMOBiGraph(
      BipartiteGraph<?> graph,
      Matching<?> matching,
      boolean transposed,
      @Nullable Integer edgeCount) {
    this.graph = graph;
    this.matching = matching;
    this.transposed = transposed;
    this.edgeCount = edgeCount;
  }

  /**
   * Creates a view of {@code graph} under an empty matching over its destinations. Such a view has
   * no edges.
   */
  public static DiCMOBiGraph create(BipartiteGraph<?> graph, boolean transposed) {
    return new DiCMOBiGraph(graph, Matching.create(graph.getDstCount()), transposed, 0);
  }

  public static DiCMOBiGraph create(
      BipartiteGraph<?> graph, Matching<?> matching, boolean transposed) {
    return new DiCMOBiGraph(graph, matching, transposed, null);
  }

  /** Creates a plain directed graph, the materialized counterpart of these views. */
  public static SimpleDigraph create(int vertexCount) {
    return SimpleDigraph.create(vertexCount);
  }

  @Override
  public SimpleDigraph createEmpty(int vertexCount) {
    return create(vertexCount);
  }

  public BipartiteGraph<?> getGraph() {
    return graph;
  }

  public Matching<?> getMatching() {
    return matching;
  }

  public boolean isTransposed() {
    return transposed;
  }

  /**
   * Returns the same view seen from the other side: the inverted graph, the inverted matching and
   * the opposite orientation. Out-neighbors of this view are in-neighbors of the result.
   *
   * @throws com.google.bipartite.NotCompletedException if the graph or the matching is not
   *     completed
   */
  public DiCMOBiGraph invview() {
    return new DiCMOBiGraph(graph.invview(), matching.invview(), !transposed, edgeCount);
  }

  @Override
  public int getVertexCount() {
    return transposed ? graph.getDstCount() : graph.getSrcCount();
  }

  @Override
  public Iterable<Integer> getOutNeighbors(int v) {
    checkVertex(v);
    return transposed ? invview().alternatingSuccessors(v) : alternatingSuccessors(v);
  }

  /**
   * {@inheritDoc}
   *
   * @throws com.google.bipartite.NotCompletedException if this view is not transposed and the
   *     graph or the matching is not completed
   */
  @Override
  public Iterable<Integer> getInNeighbors(int v) {
    checkVertex(v);
    return transposed ? contractedPredecessors(v) : invview().contractedPredecessors(v);
  }

  /** Returns the number of edges, counting parallel edges. The count is computed once. */
  public int getEdgeCount() {
    if (edgeCount == null) {
      int count = 0;
      for (int v = 1; v <= getVertexCount(); v++) {
        count += Iterables.size(transposed ? contractedPredecessors(v) : alternatingSuccessors(v));
      }
      edgeCount = count;
      logger.fine("Counted " + count + " contracted edges over " + getVertexCount() + " vertices");
    }
    return edgeCount;
  }

  /**
   * Returns the edges of this view. A transposed view enumerates them grouped by destination, any
   * other view grouped by source.
   */
  public Iterable<DirectedEdge> getEdges() {
    if (!transposed) {
      return Digraphs.edges(this);
    }
    return Iterables.concat(
        Iterables.transform(
            getVertices(),
            v ->
                Iterables.transform(contractedPredecessors(v), w -> DirectedEdge.create(w, v))));
  }

  public boolean hasEdge(int source, int destination) {
    if (!hasVertex(source) || !hasVertex(destination)) {
      return false;
    }
    return transposed
        ? Iterables.contains(contractedPredecessors(destination), source)
        : Iterables.contains(alternatingSuccessors(source), destination);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("transposed", transposed)
        .add("vertices", getVertexCount())
        .add("matching", matching)
        .toString();
  }

  /** The sources reached from source {@code v} over one unmatched and one matched edge. */
  private Iterable<Integer> alternatingSuccessors(int v) {
    List<Integer> dsts = graph.getSrcNeighbors(v);
    return () ->
        new AbstractIterator<Integer>() {
          private int position = 0;

          @Override
          protected Integer computeNext() {
            while (position < dsts.size()) {
              int w = matchedVertex(dsts.get(position++));
              if (w != 0 && w != v) {
                return w;
              }
            }
            return endOfData();
          }
        };
  }

  /** The other destinations of the source matched to destination {@code v}. */
  private Iterable<Integer> contractedPredecessors(int v) {
    int src = matchedVertex(v);
    if (src == 0) {
      return ImmutableList.of();
    }
    return Iterables.filter(graph.getSrcNeighbors(src), d -> d != v);
  }

  /** Returns the vertex matched to {@code v}, or 0. Entries past the end are unassigned. */
  private int matchedVertex(int v) {
    if (v > matching.size()) {
      return 0;
    }
    Assignment<?> entry = matching.get(v);
    return entry.isMatched() ? entry.getVertex() : 0;
  }

  private void checkVertex(int v) {
    if (!hasVertex(v)) {
      throw new IndexOutOfBoundsException(
          "vertex " + v + " out of range 1.." + getVertexCount());
    }
  }
}
