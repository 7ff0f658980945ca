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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/** Algorithms over {@link IntDigraph}s. */
public final class Digraphs {

  private Digraphs() {}

  /** Returns the edges of {@code graph}, ordered by source vertex. */
  public static Iterable<DirectedEdge> edges(IntDigraph graph) {
    return Iterables.concat(
        Iterables.transform(
            graph.getVertices(),
            v -> Iterables.transform(graph.getOutNeighbors(v), w -> DirectedEdge.create(v, w))));
  }

  /**
   * Returns the subgraph induced by {@code vertices}. Vertex {@code i} of the result stands for
   * {@code vertices.get(i - 1)}. Duplicate edges of a non-strict view collapse into one.
   *
   * @throws IllegalArgumentException if a vertex is repeated or does not exist
   */
  public static SimpleDigraph inducedSubgraph(IntDigraph graph, List<Integer> vertices) {
    int[] position = new int[graph.getVertexCount() + 1];
    for (int i = 0; i < vertices.size(); i++) {
      int v = vertices.get(i);
      checkArgument(graph.hasVertex(v), "vertex %s out of range 1..%s", v, graph.getVertexCount());
      checkArgument(position[v] == 0, "vertex %s appears more than once", v);
      position[v] = i + 1;
    }
    SimpleDigraph subgraph = graph.createEmpty(vertices.size());
    for (int i = 0; i < vertices.size(); i++) {
      for (int w : graph.getOutNeighbors(vertices.get(i))) {
        if (position[w] != 0) {
          subgraph.addEdge(i + 1, position[w]);
        }
      }
    }
    return subgraph;
  }

  /**
   * Computes the strongly connected components of {@code graph} with Tarjan's algorithm.
   *
   * <p>The components are returned in topological order of the condensation: if some edge leads
   * from component {@code a} to a different component {@code b}, then {@code a} comes first. The
   * members of each component are sorted.
   */
  public static ImmutableList<ImmutableList<Integer>> stronglyConnectedComponents(
      IntDigraph graph) {
    int n = graph.getVertexCount();
    // index[v] == 0 means v has not been visited.
    int[] index = new int[n + 1];
    int[] lowLink = new int[n + 1];
    boolean[] onStack = new boolean[n + 1];
    Deque<Integer> stack = new ArrayDeque<>();
    Deque<Frame> frames = new ArrayDeque<>();
    List<ImmutableList<Integer>> components = new ArrayList<>();
    int counter = 0;

    for (int root = 1; root <= n; root++) {
      if (index[root] != 0) {
        continue;
      }
      index[root] = lowLink[root] = ++counter;
      stack.push(root);
      onStack[root] = true;
      frames.push(new Frame(root, graph.getOutNeighbors(root).iterator()));

      while (!frames.isEmpty()) {
        Frame frame = frames.peek();
        int v = frame.vertex;
        if (frame.successors.hasNext()) {
          int w = frame.successors.next();
          if (index[w] == 0) {
            index[w] = lowLink[w] = ++counter;
            stack.push(w);
            onStack[w] = true;
            frames.push(new Frame(w, graph.getOutNeighbors(w).iterator()));
          } else if (onStack[w]) {
            lowLink[v] = Math.min(lowLink[v], index[w]);
          }
          continue;
        }

        frames.pop();
        if (!frames.isEmpty()) {
          int parent = frames.peek().vertex;
          lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
        }
        if (lowLink[v] == index[v]) {
          List<Integer> members = new ArrayList<>();
          int w;
          do {
            w = stack.pop();
            onStack[w] = false;
            members.add(w);
          } while (w != v);
          Collections.sort(members);
          components.add(ImmutableList.copyOf(members));
        }
      }
    }
    // Tarjan emits sinks first.
    return ImmutableList.copyOf(components).reverse();
  }

  private static final class Frame {
    final int vertex;
    final Iterator<Integer> successors;

    Frame(int vertex, Iterator<Integer> successors) {
      this.vertex = vertex;
      this.successors = successors;
    }
  }
}
