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
import com.google.common.primitives.Ints;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A directed graph whose vertices are the components of a partition of some underlying vertex
 * set. Component {@code c} is vertex {@code c}; the order of the components given at construction
 * is kept.
 *
 * <p>A trivial component is given as a one-element collection, or a one-element array through
 * the {@code int[]} factories, and is stored as a bare vertex id.
 *
 * <p>Underlying vertices that belong to no component are ignored by the neighbor queries.
 */
public abstract class AbstractCondensationGraph implements IntDigraph {

  // Singleton components live in singleMember[c - 1] and have a null entry in members.
  private final int[] singleMember;
  private final int[][] members;
  private final int[] componentOf;

  protected AbstractCondensationGraph(
      int underlyingVertexCount, List<? extends Collection<Integer>> components) {
    int count = components.size();
    this.singleMember = new int[count];
    this.members = new int[count][];
    this.componentOf = new int[underlyingVertexCount + 1];
    for (int c = 1; c <= count; c++) {
      Collection<Integer> component = components.get(c - 1);
      checkArgument(!component.isEmpty(), "component %s is empty", c);
      for (int v : component) {
        checkArgument(
            1 <= v && v <= underlyingVertexCount,
            "vertex %s out of range 1..%s",
            v,
            underlyingVertexCount);
        checkArgument(
            componentOf[v] == 0, "vertex %s is in components %s and %s", v, componentOf[v], c);
        componentOf[v] = c;
      }
      if (component.size() == 1) {
        singleMember[c - 1] = component.iterator().next();
      } else {
        members[c - 1] = Ints.toArray(component);
      }
    }
  }

  /** Views each array as one component. */
  protected static List<List<Integer>> asComponents(int[]... components) {
    ImmutableList.Builder<List<Integer>> lists = ImmutableList.builder();
    for (int[] component : components) {
      lists.add(Ints.asList(component));
    }
    return lists.build();
  }

  @Override
  public final int getVertexCount() {
    return members.length;
  }

  /** Returns the number of vertices of the underlying graph. */
  public final int getUnderlyingVertexCount() {
    return componentOf.length - 1;
  }

  /** Returns the underlying vertices of component {@code c}, in the order they were given. */
  public final List<Integer> getMembers(int c) {
    checkComponent(c);
    int[] group = members[c - 1];
    return group == null
        ? ImmutableList.of(singleMember[c - 1])
        : Collections.unmodifiableList(Ints.asList(group));
  }

  /** Returns the component holding underlying vertex {@code v}, or 0 if there is none. */
  public final int getComponentOf(int v) {
    if (v < 1 || v >= componentOf.length) {
      throw new IndexOutOfBoundsException(
          "vertex " + v + " out of range 1.." + getUnderlyingVertexCount());
    }
    return componentOf[v];
  }

  protected final void checkComponent(int c) {
    if (!hasVertex(c)) {
      throw new IndexOutOfBoundsException(
          "component " + c + " out of range 1.." + getVertexCount());
    }
  }
}
