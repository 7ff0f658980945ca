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
import com.google.common.collect.Iterables;
import java.util.Collection;
import java.util.List;

/**
 * The condensation induced on the destinations of a completed bipartite graph by an ordered
 * partition of them. Destinations {@code d} and {@code e} are linked when some source is adjacent
 * to both. Edges are oriented by the order of the partition: component {@code a} has an edge to
 * component {@code b} exactly when {@code a < b} and some member of {@code a} is linked to some
 * member of {@code b}. Parallel edges are not merged.
 *
 * <p>Given the components of a transposed {@link DiCMOBiGraph} in topological order, this yields
 * the block structure of the bipartite graph.
 */
public final class InducedCondensationGraph extends AbstractCondensationGraph {

  private final BipartiteGraph<?> graph;

  private InducedCondensationGraph(
      BipartiteGraph<?> graph, List<? extends Collection<Integer>> components) {
    super(graph.getDstCount(), components);
    this.graph = graph;
  }

  /**
   * @throws com.google.bipartite.NotCompletedException if {@code graph} is not completed
   * @throws IllegalArgumentException if a component is empty, or a destination is out of range or
   *     appears in two components
   */
  public static InducedCondensationGraph create(
      BipartiteGraph<?> graph, List<? extends Collection<Integer>> components) {
    graph.requireComplete();
    return new InducedCondensationGraph(graph, components);
  }

  /**
   * Same as {@link #create(BipartiteGraph, List)}, with each component given as an array of
   * destination ids.
   */
  public static InducedCondensationGraph create(BipartiteGraph<?> graph, int[]... components) {
    return create(graph, asComponents(components));
  }

  public BipartiteGraph<?> getGraph() {
    return graph;
  }

  @Override
  public Iterable<Integer> getOutNeighbors(int c) {
    checkComponent(c);
    return Iterables.filter(linkedComponents(c), k -> k > c);
  }

  @Override
  public Iterable<Integer> getInNeighbors(int c) {
    checkComponent(c);
    return Iterables.filter(linkedComponents(c), k -> k != 0 && k < c);
  }

  /** Components of the destinations sharing a source with a member of {@code c}. */
  private Iterable<Integer> linkedComponents(int c) {
    return Iterables.transform(
        Iterables.concat(
            Iterables.transform(
                getMembers(c),
                d ->
                    Iterables.concat(
                        Iterables.transform(graph.getDstNeighbors(d), graph::getSrcNeighbors)))),
        this::getComponentOf);
  }
}
