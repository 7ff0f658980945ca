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

import com.google.common.collect.ContiguousSet;

/**
 * A directed graph over the contiguous vertex ids {@code 1..getVertexCount()}.
 *
 * <p>Implementations may be derived views that compute neighbors on demand. Such views need not
 * be strict: a neighbor may be enumerated more than once, reflecting the multiplicity of the
 * underlying edges.
 */
public interface IntDigraph {

  int getVertexCount();

  default ContiguousSet<Integer> getVertices() {
    return ContiguousSet.closedOpen(1, getVertexCount() + 1);
  }

  default boolean hasVertex(int v) {
    return 1 <= v && v <= getVertexCount();
  }

  /** Returns the vertices {@code w} such that there is an edge {@code v -> w}. */
  Iterable<Integer> getOutNeighbors(int v);

  /** Returns the vertices {@code w} such that there is an edge {@code w -> v}. */
  Iterable<Integer> getInNeighbors(int v);

  /**
   * Creates an empty, materialized graph with {@code vertexCount} vertices, for algorithms that
   * copy part of this graph out.
   */
  default SimpleDigraph createEmpty(int vertexCount) {
    return SimpleDigraph.create(vertexCount);
  }
}
