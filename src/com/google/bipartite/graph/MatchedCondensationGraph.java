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

import com.google.common.collect.Iterables;
import java.util.Collection;
import java.util.List;
import java.util.function.IntFunction;

/**
 * The condensation of a {@link DiCMOBiGraph} by a partition of its vertices, normally its
 * strongly connected components. There is an edge {@code a -> b} for every edge of the
 * underlying view that leaves a member of {@code a} for a member of {@code b}, with {@code a !=
 * b}. Parallel edges are not merged.
 */
public final class MatchedCondensationGraph extends AbstractCondensationGraph {

  private final DiCMOBiGraph graph;

  private MatchedCondensationGraph(
      DiCMOBiGraph graph, List<? extends Collection<Integer>> components) {
    super(graph.getVertexCount(), components);
    this.graph = graph;
  }

  /**
   * @throws IllegalArgumentException if a component is empty, or a vertex is out of range or
   *     appears in two components
   */
  public static MatchedCondensationGraph create(
      DiCMOBiGraph graph, List<? extends Collection<Integer>> components) {
    return new MatchedCondensationGraph(graph, components);
  }

  /**
   * Same as {@link #create(DiCMOBiGraph, List)}, with each component given as an array of
   * vertex ids.
   */
  public static MatchedCondensationGraph create(DiCMOBiGraph graph, int[]... components) {
    return create(graph, asComponents(components));
  }

  public DiCMOBiGraph getGraph() {
    return graph;
  }

  @Override
  public Iterable<Integer> getOutNeighbors(int c) {
    checkComponent(c);
    return crossing(c, graph::getOutNeighbors);
  }

  @Override
  public Iterable<Integer> getInNeighbors(int c) {
    checkComponent(c);
    return crossing(c, graph::getInNeighbors);
  }

  private Iterable<Integer> crossing(int c, IntFunction<Iterable<Integer>> step) {
    return Iterables.concat(
        Iterables.transform(
            getMembers(c),
            v ->
                Iterables.filter(
                    Iterables.transform(step.apply(v), this::getComponentOf),
                    k -> k != 0 && k != c)));
  }
}
