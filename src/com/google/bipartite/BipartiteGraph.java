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

package com.google.bipartite;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A bipartite graph between two independently numbered vertex classes. Source vertices are
 * labelled {@code 1..getSrcCount()} and map to the destination vertices
 * {@code 1..getDstCount()} on which they depend.
 *
 * <p>The forward adjacency (source to destinations) is always stored. The backward adjacency
 * (destination to sources) is optional: a graph built without it only records the destination
 * count, and every backward query throws {@link NotCompletedException} until {@link #complete()}
 * materializes it. A completed graph answers backward queries in constant time at the cost of
 * slower edge insertion.
 *
 * <p>All adjacency lists are kept sorted and free of duplicates, and the backward table, when
 * present, is the exact transpose of the forward table.
 *
 * <p>Optionally every forward adjacency entry carries a metadata value of type {@code M}. The
 * metadata table mirrors the shape of the forward adjacency and is updated in lockstep with it.
 *
 * <p>{@link #invview()} returns a view with the two vertex classes swapped. A view shares its
 * storage, including the edge count, with the graph it came from, so a mutation through either
 * handle is visible through both. Metadata can only be addressed through an uninverted handle.
 *
 * @param <M> The type of the per-edge metadata.
 */
public final class BipartiteGraph<M> {

  private static final Logger logger = Logger.getLogger(BipartiteGraph.class.getName());

  /** The tables shared by a graph and every view of it. */
  private static final class Storage<M> {
    // srcAdj[s - 1] = destinations of source s
    final List<List<Integer>> srcAdj;
    // dstAdj[d - 1] = sources of destination d, or null until completion
    @Nullable List<List<Integer>> dstAdj;
    // Only consulted while dstAdj is null.
    int dstCount;
    // Parallel to srcAdj.
    final @Nullable List<List<M>> metadata;
    int edgeCount;

    Storage(
        List<List<Integer>> srcAdj,
        @Nullable List<List<Integer>> dstAdj,
        int dstCount,
        @Nullable List<List<M>> metadata,
        int edgeCount) {
      this.srcAdj = srcAdj;
      this.dstAdj = dstAdj;
      this.dstCount = dstCount;
      this.metadata = metadata;
      this.edgeCount = edgeCount;
    }

    Storage<M> deepCopy() {
      return new Storage<>(
          copyLists(srcAdj),
          dstAdj == null ? null : copyLists(dstAdj),
          dstCount,
          metadata == null ? null : copyLists(metadata),
          edgeCount);
    }

    private static <T> List<List<T>> copyLists(List<List<T>> lists) {
      List<List<T>> copy = new ArrayList<>(lists.size());
      for (List<T> list : lists) {
        copy.add(new ArrayList<>(list));
      }
      return copy;
    }
  }

  private final Storage<M> storage;
  private final boolean inverted;

  private BipartiteGraph(Storage<M> storage, boolean inverted) {
    this.storage = storage;
    this.inverted = inverted;
  }

  /** Creates a completed graph with the given vertex counts and no edges. */
  public static <M> BipartiteGraph<M> create(int srcCount, int dstCount) {
    return create(srcCount, dstCount, true);
  }

  /**
   * Creates a graph with the given vertex counts and no edges.
   *
   * @param withBackEdges whether to store the backward adjacency from the start. Pass false to
   *     defer it until {@link #complete()}.
   */
  public static <M> BipartiteGraph<M> create(int srcCount, int dstCount, boolean withBackEdges) {
    checkArgument(srcCount >= 0, "negative source count: %s", srcCount);
    checkArgument(dstCount >= 0, "negative destination count: %s", dstCount);
    return new BipartiteGraph<>(
        new Storage<M>(
            emptyLists(srcCount), withBackEdges ? emptyLists(dstCount) : null, dstCount, null, 0),
        false);
  }

  /**
   * Creates a graph from forward adjacency lists. The destination count is the largest
   * destination referenced, and the backward adjacency is not stored.
   */
  public static <M> BipartiteGraph<M> fromAdjacency(List<? extends List<Integer>> fadj) {
    int dstCount = 0;
    for (List<Integer> list : fadj) {
      for (int dst : list) {
        dstCount = Math.max(dstCount, dst);
      }
    }
    return fromAdjacency(fadj, dstCount);
  }

  /**
   * Creates a graph from forward adjacency lists over {@code dstCount} destinations. The
   * backward adjacency is not stored; use {@link #complete()} to compute it post-facto.
   */
  public static <M> BipartiteGraph<M> fromAdjacency(
      List<? extends List<Integer>> fadj, int dstCount) {
    checkArgument(dstCount >= 0, "negative destination count: %s", dstCount);
    List<List<Integer>> srcAdj = copyAdjacency(fadj, dstCount, VertexKind.SRC);
    return new BipartiteGraph<>(
        new Storage<M>(srcAdj, null, dstCount, null, countEntries(srcAdj)), false);
  }

  /**
   * Creates a completed graph from both adjacency tables. {@code badj} must be the transpose of
   * {@code fadj}.
   */
  public static <M> BipartiteGraph<M> fromAdjacency(
      List<? extends List<Integer>> fadj, List<? extends List<Integer>> badj) {
    List<List<Integer>> srcAdj = copyAdjacency(fadj, badj.size(), VertexKind.SRC);
    return fromAdjacency(countEntries(srcAdj), fadj, badj);
  }

  /**
   * Creates a completed graph with {@code edgeCount} edges from both adjacency tables.
   *
   * @throws IllegalArgumentException if the tables disagree with each other or with
   *     {@code edgeCount}
   */
  public static <M> BipartiteGraph<M> fromAdjacency(
      int edgeCount, List<? extends List<Integer>> fadj, List<? extends List<Integer>> badj) {
    List<List<Integer>> srcAdj = copyAdjacency(fadj, badj.size(), VertexKind.SRC);
    List<List<Integer>> dstAdj = copyAdjacency(badj, fadj.size(), VertexKind.DST);
    checkArgument(
        edgeCount == countEntries(srcAdj),
        "edge count %s does not match the %s forward adjacency entries",
        edgeCount,
        countEntries(srcAdj));
    checkArgument(
        dstAdj.equals(transpose(srcAdj, dstAdj.size())),
        "backward adjacency is not the transpose of the forward adjacency");
    return new BipartiteGraph<>(
        new Storage<M>(srcAdj, dstAdj, dstAdj.size(), null, edgeCount), false);
  }

  /**
   * Creates a graph whose forward adjacency entries carry metadata. {@code metadata.get(s - 1)}
   * must have the same length as {@code fadj.get(s - 1)}. The backward adjacency is not stored.
   */
  public static <M> BipartiteGraph<M> withMetadata(
      List<? extends List<Integer>> fadj,
      int dstCount,
      List<? extends List<? extends M>> metadata) {
    checkArgument(
        metadata.size() == fadj.size(),
        "metadata covers %s sources, graph has %s",
        metadata.size(),
        fadj.size());
    List<List<Integer>> srcAdj = copyAdjacency(fadj, dstCount, VertexKind.SRC);
    List<List<M>> values = new ArrayList<>(metadata.size());
    for (int s = 1; s <= metadata.size(); s++) {
      List<? extends M> row = metadata.get(s - 1);
      checkArgument(
          row.size() == srcAdj.get(s - 1).size(),
          "metadata of source %s has %s entries, expected %s",
          s,
          row.size(),
          srcAdj.get(s - 1).size());
      values.add(new ArrayList<M>(row));
    }
    return new BipartiteGraph<>(
        new Storage<>(srcAdj, null, dstCount, values, countEntries(srcAdj)), false);
  }

  /** Returns a deep copy of this graph that shares no storage with it. */
  public BipartiteGraph<M> copy() {
    return new BipartiteGraph<>(storage.deepCopy(), inverted);
  }

  /** Whether the backward adjacency is stored. Views returned by {@link #invview()} always are. */
  public boolean isComplete() {
    return backward() != null;
  }

  /** @throws NotCompletedException if the backward adjacency is not stored */
  public void requireComplete() {
    if (!isComplete()) {
      throw new NotCompletedException("The graph has no back edges. Use complete().");
    }
  }

  /**
   * Populates the backward adjacency, if it is not already stored. Runs in time linear in the
   * number of edges.
   *
   * @return this graph
   */
  @CanIgnoreReturnValue
  public BipartiteGraph<M> complete() {
    if (storage.dstAdj == null) {
      storage.dstAdj = transpose(storage.srcAdj, storage.dstCount);
      logger.fine(
          "Completed back edges for " + storage.dstCount + " destinations, "
              + storage.edgeCount + " edges");
    }
    return this;
  }

  /**
   * Returns a view of this graph with the source and destination vertices swapped. The view
   * aliases this graph.
   *
   * @throws NotCompletedException if the graph is not complete
   */
  public BipartiteGraph<M> invview() {
    requireComplete();
    return new BipartiteGraph<>(storage, !inverted);
  }

  public int getSrcCount() {
    return forward().size();
  }

  public int getDstCount() {
    List<List<Integer>> badj = backward();
    return badj != null ? badj.size() : storage.dstCount;
  }

  /** Returns the total number of vertices of both classes. */
  public int getVertexCount() {
    return getSrcCount() + getDstCount();
  }

  public int getEdgeCount() {
    return storage.edgeCount;
  }

  public ContiguousSet<Integer> getSrcVertices() {
    return ContiguousSet.closedOpen(1, getSrcCount() + 1);
  }

  public ContiguousSet<Integer> getDstVertices() {
    return ContiguousSet.closedOpen(1, getDstCount() + 1);
  }

  public boolean hasSrcVertex(int v) {
    return 1 <= v && v <= getSrcCount();
  }

  public boolean hasDstVertex(int v) {
    return 1 <= v && v <= getDstCount();
  }

  /** Returns the sorted destinations of source {@code src}, as an unmodifiable live view. */
  public List<Integer> getSrcNeighbors(int src) {
    checkSrcInRange(src);
    return Collections.unmodifiableList(forward().get(src - 1));
  }

  /**
   * Returns the sorted sources of destination {@code dst}, as an unmodifiable live view.
   *
   * @throws NotCompletedException if the graph is not complete
   */
  public List<Integer> getDstNeighbors(int dst) {
    requireComplete();
    checkDstInRange(dst);
    return Collections.unmodifiableList(backward().get(dst - 1));
  }

  /** Returns the destinations of {@code src}, each paired with the metadata of its edge. */
  public ImmutableList<Map.Entry<Integer, M>> getSrcNeighborsWithMetadata(int src) {
    checkMetadataAddressable();
    checkSrcInRange(src);
    List<Integer> dsts = forward().get(src - 1);
    List<M> values = storage.metadata.get(src - 1);
    ImmutableList.Builder<Map.Entry<Integer, M>> builder = ImmutableList.builder();
    for (int i = 0; i < dsts.size(); i++) {
      builder.add(Maps.immutableEntry(dsts.get(i), values.get(i)));
    }
    return builder.build();
  }

  /** Returns the sources of {@code dst}, each paired with the metadata of its edge. */
  public ImmutableList<Map.Entry<Integer, M>> getDstNeighborsWithMetadata(int dst) {
    checkMetadataAddressable();
    requireComplete();
    checkDstInRange(dst);
    ImmutableList.Builder<Map.Entry<Integer, M>> builder = ImmutableList.builder();
    for (int src : backward().get(dst - 1)) {
      int index = Collections.binarySearch(forward().get(src - 1), dst);
      builder.add(Maps.immutableEntry(src, storage.metadata.get(src - 1).get(index)));
    }
    return builder.build();
  }

  /** Whether the graph has the edge. Out-of-range endpoints are simply not connected. */
  public boolean hasEdge(int src, int dst) {
    if (!hasSrcVertex(src) || !hasDstVertex(dst)) {
      return false;
    }
    return Collections.binarySearch(forward().get(src - 1), dst) >= 0;
  }

  public boolean hasEdge(BipartiteEdge edge) {
    return hasEdge(edge.getSrc(), edge.getDst());
  }

  /**
   * Adds an edge from source {@code src} to destination {@code dst}. If the graph carries
   * metadata, the new entry gets {@code null}.
   *
   * @return false if the edge was already present, in which case nothing changes
   * @throws IndexOutOfBoundsException if either endpoint is out of range
   */
  @CanIgnoreReturnValue
  public boolean addEdge(int src, int dst) {
    return insertEdge(src, dst, null);
  }

  /**
   * Adds an edge carrying {@code metadata}.
   *
   * @throws IllegalStateException if this handle does not address metadata
   */
  @CanIgnoreReturnValue
  public boolean addEdge(int src, int dst, @Nullable M metadata) {
    checkMetadataAddressable();
    return insertEdge(src, dst, metadata);
  }

  @CanIgnoreReturnValue
  public boolean addEdge(BipartiteEdge edge) {
    return addEdge(edge.getSrc(), edge.getDst());
  }

  private boolean insertEdge(int src, int dst, @Nullable M metadata) {
    checkEdgeInRange(src, dst);
    List<Integer> list = forward().get(src - 1);
    int index = Collections.binarySearch(list, dst);
    if (index >= 0) {
      return false;
    }
    int insertAt = -index - 1;
    list.add(insertAt, dst);
    List<M> values = forwardMetadata(src);
    if (values != null) {
      values.add(insertAt, metadata);
    }
    storage.edgeCount++;
    if (backward() != null) {
      insertBackReference(dst, src);
    }
    return true;
  }

  /**
   * Removes the edge from source {@code src} to destination {@code dst}, along with its
   * metadata.
   *
   * @throws IndexOutOfBoundsException if either endpoint is out of range
   * @throws IllegalArgumentException if the graph does not have the edge
   */
  public void removeEdge(int src, int dst) {
    checkEdgeInRange(src, dst);
    List<Integer> list = forward().get(src - 1);
    int index = Collections.binarySearch(list, dst);
    checkArgument(index >= 0, "graph does not have edge %s", BipartiteEdge.create(src, dst));
    list.remove(index);
    List<M> values = forwardMetadata(src);
    if (values != null) {
      values.remove(index);
    }
    storage.edgeCount--;
    if (backward() != null) {
      removeBackReference(dst, src);
    }
  }

  public void removeEdge(BipartiteEdge edge) {
    removeEdge(edge.getSrc(), edge.getDst());
  }

  /**
   * Adds a vertex of the given kind with no edges.
   *
   * @return the id of the new vertex
   * @throws IllegalArgumentException if {@code kind} is null
   */
  @CanIgnoreReturnValue
  public int addVertex(VertexKind kind) {
    checkArgument(kind != null, "vertex kind must be SRC or DST");
    switch (kind) {
      case SRC:
        forward().add(new ArrayList<>());
        if (!inverted && storage.metadata != null) {
          storage.metadata.add(new ArrayList<>());
        }
        return forward().size();
      case DST:
        List<List<Integer>> badj = backward();
        if (badj == null) {
          return ++storage.dstCount;
        }
        badj.add(new ArrayList<>());
        if (inverted && storage.metadata != null) {
          storage.metadata.add(new ArrayList<>());
        }
        return badj.size();
    }
    throw new IllegalArgumentException("unknown vertex kind: " + kind);
  }

  /**
   * Replaces the destinations of source {@code src} with {@code newNeighbors}, which need not be
   * sorted or distinct. Metadata survives for destinations that were already neighbors; new
   * neighbors get {@code null}.
   *
   * <p>All arguments are validated before anything is modified.
   */
  public void setNeighbors(int src, Collection<Integer> newNeighbors) {
    checkSrcInRange(src);
    ImmutableSortedSet<Integer> replacement = ImmutableSortedSet.copyOf(newNeighbors);
    for (int dst : replacement) {
      checkDstInRange(dst);
    }

    List<Integer> old = forward().get(src - 1);
    if (backward() != null) {
      for (int dst : old) {
        if (!replacement.contains(dst)) {
          removeBackReference(dst, src);
        }
      }
      for (int dst : replacement) {
        if (Collections.binarySearch(old, dst) < 0) {
          insertBackReference(dst, src);
        }
      }
    }

    List<M> values = forwardMetadata(src);
    if (values != null) {
      List<M> kept = new ArrayList<>(replacement.size());
      for (int dst : replacement) {
        int index = Collections.binarySearch(old, dst);
        kept.add(index >= 0 ? values.get(index) : null);
      }
      values.clear();
      values.addAll(kept);
    }

    storage.edgeCount += replacement.size() - old.size();
    old.clear();
    old.addAll(replacement);
  }

  /**
   * Removes all edges incident on the given sources. If {@code removeVertices} is true, also
   * removes the vertices themselves, which renumbers the remaining sources: each keeps its
   * relative order and moves down by the number of removed sources below it.
   *
   * <p>All ids are validated before anything is modified.
   */
  public void deleteSrcs(Collection<Integer> srcs, boolean removeVertices) {
    ImmutableSortedSet<Integer> doomed = ImmutableSortedSet.copyOf(srcs);
    for (int src : doomed) {
      checkSrcInRange(src);
    }
    for (int src : doomed) {
      setNeighbors(src, ImmutableList.<Integer>of());
    }
    if (!removeVertices) {
      return;
    }

    int srcCount = getSrcCount();
    // renumbered[old] = new id, or 0 for a removed source
    int[] renumbered = new int[srcCount + 1];
    int offset = 0;
    for (int src = 1; src <= srcCount; src++) {
      if (doomed.contains(src)) {
        offset++;
      } else {
        renumbered[src] = src - offset;
      }
    }

    List<List<Integer>> badj = backward();
    if (badj != null) {
      // Back references to removed sources are already gone, so the lists stay sorted.
      for (List<Integer> list : badj) {
        for (int i = 0; i < list.size(); i++) {
          list.set(i, renumbered[list.get(i)]);
        }
      }
    }
    retainRenumbered(forward(), renumbered);
    if (!inverted && storage.metadata != null) {
      retainRenumbered(storage.metadata, renumbered);
    }
    logger.fine("Removed " + doomed.size() + " of " + srcCount + " vertices, renumbering the rest");
  }

  /**
   * Removes all edges incident on the given destinations, and optionally the destinations
   * themselves. Works through {@link #invview()}, so the graph must be complete.
   *
   * @throws NotCompletedException if the graph is not complete
   */
  public void deleteDsts(Collection<Integer> dsts, boolean removeVertices) {
    invview().deleteSrcs(dsts, removeVertices);
  }

  /** Removes every edge, keeping all vertices. */
  public void clear() {
    for (List<Integer> list : forward()) {
      list.clear();
    }
    List<List<Integer>> badj = backward();
    if (badj != null) {
      for (List<Integer> list : badj) {
        list.clear();
      }
    }
    if (storage.metadata != null) {
      for (List<M> values : storage.metadata) {
        values.clear();
      }
    }
    storage.edgeCount = 0;
  }

  /** Same as {@link #getSrcEdges()}. */
  public Iterable<BipartiteEdge> getEdges() {
    return getSrcEdges();
  }

  /**
   * Returns all edges, ordered by source vertex and then by destination vertex. The iteration
   * reads the live adjacency; do not mutate the graph while iterating.
   */
  public Iterable<BipartiteEdge> getSrcEdges() {
    return () ->
        new AbstractIterator<BipartiteEdge>() {
          private int src = 1;
          private int position = 0;

          @Override
          protected BipartiteEdge computeNext() {
            List<List<Integer>> fadj = forward();
            while (src <= fadj.size()) {
              List<Integer> dsts = fadj.get(src - 1);
              if (position < dsts.size()) {
                return BipartiteEdge.create(src, dsts.get(position++));
              }
              src++;
              position = 0;
            }
            return endOfData();
          }
        };
  }

  /**
   * Returns all edges, ordered by destination vertex and then by source vertex.
   *
   * @throws NotCompletedException if the graph is not complete
   */
  public Iterable<BipartiteEdge> getDstEdges() {
    requireComplete();
    return () ->
        new AbstractIterator<BipartiteEdge>() {
          private int dst = 1;
          private int position = 0;

          @Override
          protected BipartiteEdge computeNext() {
            List<List<Integer>> badj = backward();
            while (dst <= badj.size()) {
              List<Integer> srcs = badj.get(dst - 1);
              if (position < srcs.size()) {
                return BipartiteEdge.create(srcs.get(position++), dst);
              }
              dst++;
              position = 0;
            }
            return endOfData();
          }
        };
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BipartiteGraph)) {
      return false;
    }
    BipartiteGraph<?> that = (BipartiteGraph<?>) o;
    return getEdgeCount() == that.getEdgeCount()
        && getDstCount() == that.getDstCount()
        && forward().equals(that.forward())
        && Objects.equals(backward(), that.backward());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getEdgeCount(), getDstCount(), forward());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("srcs", getSrcCount())
        .add("dsts", getDstCount())
        .add("edges", getEdgeCount())
        .add("complete", isComplete())
        .toString();
  }

  private List<List<Integer>> forward() {
    return inverted ? storage.dstAdj : storage.srcAdj;
  }

  private @Nullable List<List<Integer>> backward() {
    return inverted ? storage.srcAdj : storage.dstAdj;
  }

  private @Nullable List<M> forwardMetadata(int src) {
    return inverted || storage.metadata == null ? null : storage.metadata.get(src - 1);
  }

  private @Nullable List<M> backwardMetadata(int dst) {
    return inverted && storage.metadata != null ? storage.metadata.get(dst - 1) : null;
  }

  private void insertBackReference(int dst, int src) {
    List<Integer> srcs = backward().get(dst - 1);
    int index = Collections.binarySearch(srcs, src);
    if (index < 0) {
      int insertAt = -index - 1;
      srcs.add(insertAt, src);
      List<M> values = backwardMetadata(dst);
      if (values != null) {
        values.add(insertAt, null);
      }
    }
  }

  private void removeBackReference(int dst, int src) {
    List<Integer> srcs = backward().get(dst - 1);
    int index = Collections.binarySearch(srcs, src);
    if (index >= 0) {
      srcs.remove(index);
      List<M> values = backwardMetadata(dst);
      if (values != null) {
        values.remove(index);
      }
    }
  }

  private void checkMetadataAddressable() {
    checkState(storage.metadata != null, "graph carries no metadata");
    checkState(!inverted, "metadata is only addressable through the uninverted graph");
  }

  private void checkSrcInRange(int src) {
    if (!hasSrcVertex(src)) {
      throw new IndexOutOfBoundsException(
          "source vertex " + src + " out of range 1.." + getSrcCount());
    }
  }

  private void checkDstInRange(int dst) {
    if (!hasDstVertex(dst)) {
      throw new IndexOutOfBoundsException(
          "destination vertex " + dst + " out of range 1.." + getDstCount());
    }
  }

  private void checkEdgeInRange(int src, int dst) {
    if (!hasSrcVertex(src) || !hasDstVertex(dst)) {
      throw new IndexOutOfBoundsException(
          "edge (" + BipartiteEdge.create(src, dst) + ") out of range.");
    }
  }

  private static <T> void retainRenumbered(List<T> lists, int[] renumbered) {
    List<T> kept = new ArrayList<>(lists.size());
    for (int v = 1; v <= lists.size(); v++) {
      if (renumbered[v] != 0) {
        kept.add(lists.get(v - 1));
      }
    }
    lists.clear();
    lists.addAll(kept);
  }

  private static List<List<Integer>> emptyLists(int count) {
    List<List<Integer>> lists = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      lists.add(new ArrayList<>());
    }
    return lists;
  }

  private static List<List<Integer>> transpose(List<List<Integer>> adj, int targetCount) {
    List<List<Integer>> transposed = emptyLists(targetCount);
    for (int v = 1; v <= adj.size(); v++) {
      for (int w : adj.get(v - 1)) {
        transposed.get(w - 1).add(v);
      }
    }
    return transposed;
  }

  private static int countEntries(List<List<Integer>> adj) {
    int count = 0;
    for (List<Integer> list : adj) {
      count += list.size();
    }
    return count;
  }

  /** Copies adjacency lists, checking that each is strictly increasing and within range. */
  private static List<List<Integer>> copyAdjacency(
      List<? extends List<Integer>> lists, int neighborCount, VertexKind kind) {
    checkNotNull(lists);
    List<List<Integer>> copy = new ArrayList<>(lists.size());
    for (int v = 1; v <= lists.size(); v++) {
      List<Integer> list = lists.get(v - 1);
      int previous = 0;
      for (int neighbor : list) {
        checkArgument(
            neighbor > previous,
            "neighbors of %s vertex %s are not strictly increasing positive ids: %s",
            kind,
            v,
            list);
        checkArgument(
            neighbor <= neighborCount,
            "%s vertex %s has neighbor %s, out of range 1..%s",
            kind,
            v,
            neighbor,
            neighborCount);
        previous = neighbor;
      }
      copy.add(new ArrayList<>(list));
    }
    return copy;
  }
}
