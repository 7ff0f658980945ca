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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link BipartiteGraph}. */
@RunWith(JUnit4.class)
public final class BipartiteGraphTest {

  private static final ImmutableList<ImmutableList<Integer>> FADJ =
      ImmutableList.of(
          ImmutableList.of(1, 3), ImmutableList.of(2), ImmutableList.of(), ImmutableList.of(1, 2));

  @Test
  public void testCreateHasNoEdges() {
    BipartiteGraph<Void> g = BipartiteGraph.create(3, 4);
    assertThat(g.getSrcCount()).isEqualTo(3);
    assertThat(g.getDstCount()).isEqualTo(4);
    assertThat(g.getVertexCount()).isEqualTo(7);
    assertThat(g.getEdgeCount()).isEqualTo(0);
    assertThat(g.isComplete()).isTrue();
    assertThat(g.getSrcVertices()).containsExactly(1, 2, 3).inOrder();
    assertThat(g.getDstVertices()).containsExactly(1, 2, 3, 4).inOrder();
    assertThat(g.getEdges()).isEmpty();
  }

  @Test
  public void testCreateRejectsNegativeCounts() {
    assertThrows(IllegalArgumentException.class, () -> BipartiteGraph.create(-1, 2));
    assertThrows(IllegalArgumentException.class, () -> BipartiteGraph.create(2, -1, false));
  }

  @Test
  public void testFromAdjacencyInfersDstCount() {
    BipartiteGraph<Void> g = BipartiteGraph.fromAdjacency(FADJ);
    assertThat(g.getSrcCount()).isEqualTo(4);
    assertThat(g.getDstCount()).isEqualTo(3);
    assertThat(g.getEdgeCount()).isEqualTo(5);
    assertThat(g.isComplete()).isFalse();
    assertThat(g.getSrcNeighbors(4)).containsExactly(1, 2).inOrder();
  }

  @Test
  public void testFromAdjacencyValidatesLists() {
    assertThrows(
        IllegalArgumentException.class,
        () -> BipartiteGraph.fromAdjacency(ImmutableList.of(ImmutableList.of(2, 1)), 2));
    assertThrows(
        IllegalArgumentException.class,
        () -> BipartiteGraph.fromAdjacency(ImmutableList.of(ImmutableList.of(1, 1)), 2));
    assertThrows(
        IllegalArgumentException.class,
        () -> BipartiteGraph.fromAdjacency(ImmutableList.of(ImmutableList.of(3)), 2));
    assertThrows(
        IllegalArgumentException.class,
        () -> BipartiteGraph.fromAdjacency(ImmutableList.of(ImmutableList.of(0)), 2));
  }

  @Test
  public void testFromAdjacencyCopiesInput() {
    List<List<Integer>> fadj = ImmutableList.of(new ArrayList<>(ImmutableList.of(1)));
    BipartiteGraph<Void> g = BipartiteGraph.fromAdjacency(fadj, 2);
    fadj.get(0).add(2);
    assertThat(g.getSrcNeighbors(1)).containsExactly(1);
  }

  @Test
  public void testFromBothTables() {
    BipartiteGraph<Void> g =
        BipartiteGraph.fromAdjacency(
            FADJ,
            ImmutableList.of(
                ImmutableList.of(1, 4), ImmutableList.of(2, 4), ImmutableList.of(1)));
    assertThat(g.isComplete()).isTrue();
    assertThat(g.getEdgeCount()).isEqualTo(5);
    assertThat(g.getDstNeighbors(1)).containsExactly(1, 4).inOrder();
  }

  @Test
  public void testFromBothTablesRejectsMismatch() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            BipartiteGraph.fromAdjacency(
                FADJ,
                ImmutableList.of(
                    ImmutableList.of(1), ImmutableList.of(2, 4), ImmutableList.of(1))));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            BipartiteGraph.fromAdjacency(
                4,
                FADJ,
                ImmutableList.of(
                    ImmutableList.of(1, 4), ImmutableList.of(2, 4), ImmutableList.of(1))));
  }

  @Test
  public void testBackwardQueriesRequireCompletion() {
    BipartiteGraph<Void> g = BipartiteGraph.fromAdjacency(FADJ);
    NotCompletedException e =
        assertThrows(NotCompletedException.class, () -> g.getDstNeighbors(1));
    assertThat(e).hasMessageThat().contains("complete()");
    assertThrows(NotCompletedException.class, g::invview);
    assertThrows(NotCompletedException.class, g::getDstEdges);
    assertThrows(
        NotCompletedException.class, () -> g.deleteDsts(ImmutableList.of(1), false));
  }

  @Test
  public void testCompleteTransposes() {
    BipartiteGraph<Void> g = BipartiteGraph.fromAdjacency(FADJ);
    assertThat(g.complete()).isSameInstanceAs(g);
    assertThat(g.getDstNeighbors(1)).containsExactly(1, 4).inOrder();
    assertThat(g.getDstNeighbors(2)).containsExactly(2, 4).inOrder();
    assertThat(g.getDstNeighbors(3)).containsExactly(1);
    assertTransposeConsistent(g);
  }

  @Test
  public void testCompleteIsIdempotent() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    List<Integer> before = ImmutableList.copyOf(g.getDstNeighbors(1));
    g.complete();
    assertThat(g.getDstNeighbors(1)).isEqualTo(before);
  }

  @Test
  public void testCompletePreservesDstCountBeyondLargestNeighbor() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ, 5).complete();
    assertThat(g.getDstCount()).isEqualTo(5);
    assertThat(g.getDstNeighbors(5)).isEmpty();
  }

  @Test
  public void testNeighborRangeChecks() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    assertThrows(IndexOutOfBoundsException.class, () -> g.getSrcNeighbors(0));
    assertThrows(IndexOutOfBoundsException.class, () -> g.getSrcNeighbors(5));
    assertThrows(IndexOutOfBoundsException.class, () -> g.getDstNeighbors(4));
  }

  @Test
  public void testNeighborsAreUnmodifiable() {
    BipartiteGraph<Void> g = BipartiteGraph.fromAdjacency(FADJ);
    assertThrows(UnsupportedOperationException.class, () -> g.getSrcNeighbors(1).add(2));
  }

  @Test
  public void testHasEdge() {
    BipartiteGraph<Void> g = BipartiteGraph.fromAdjacency(FADJ);
    assertThat(g.hasEdge(1, 3)).isTrue();
    assertThat(g.hasEdge(1, 2)).isFalse();
    assertThat(g.hasEdge(BipartiteEdge.create(4, 2))).isTrue();
    assertThat(g.hasEdge(9, 1)).isFalse();
    assertThat(g.hasEdge(1, 9)).isFalse();
  }

  @Test
  public void testAddEdgeKeepsListsSorted() {
    BipartiteGraph<Void> g = BipartiteGraph.create(2, 4);
    assertThat(g.addEdge(1, 3)).isTrue();
    assertThat(g.addEdge(1, 1)).isTrue();
    assertThat(g.addEdge(2, 3)).isTrue();
    assertThat(g.addEdge(1, 3)).isFalse();
    assertThat(g.getEdgeCount()).isEqualTo(3);
    assertThat(g.getSrcNeighbors(1)).containsExactly(1, 3).inOrder();
    assertThat(g.getDstNeighbors(3)).containsExactly(1, 2).inOrder();
    assertTransposeConsistent(g);
  }

  @Test
  public void testAddEdgeOutOfRange() {
    BipartiteGraph<Void> g = BipartiteGraph.create(2, 2);
    IndexOutOfBoundsException e =
        assertThrows(IndexOutOfBoundsException.class, () -> g.addEdge(3, 1));
    assertThat(e).hasMessageThat().isEqualTo("edge ([src: 3] => [dst: 1]) out of range.");
    assertThrows(IndexOutOfBoundsException.class, () -> g.addEdge(1, 3));
    assertThat(g.getEdgeCount()).isEqualTo(0);
  }

  @Test
  public void testAddThenRemoveRestoresGraph() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    BipartiteGraph<Void> original = g.copy();
    g.addEdge(3, 2);
    assertThat(g).isNotEqualTo(original);
    g.removeEdge(3, 2);
    assertThat(g).isEqualTo(original);
    assertThat(g.hashCode()).isEqualTo(original.hashCode());
  }

  @Test
  public void testRemoveMissingEdge() {
    BipartiteGraph<Void> g = BipartiteGraph.fromAdjacency(FADJ);
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> g.removeEdge(1, 2));
    assertThat(e).hasMessageThat().contains("does not have edge");
    assertThat(g.getEdgeCount()).isEqualTo(5);
  }

  @Test
  public void testRemoveEdgeUpdatesBothSides() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    g.removeEdge(BipartiteEdge.create(4, 1));
    assertThat(g.getEdgeCount()).isEqualTo(4);
    assertThat(g.getSrcNeighbors(4)).containsExactly(2);
    assertThat(g.getDstNeighbors(1)).containsExactly(1);
    assertTransposeConsistent(g);
  }

  @Test
  public void testAddVertex() {
    BipartiteGraph<Void> g = BipartiteGraph.fromAdjacency(FADJ);
    assertThat(g.addVertex(VertexKind.SRC)).isEqualTo(5);
    assertThat(g.addVertex(VertexKind.DST)).isEqualTo(4);
    assertThat(g.getSrcNeighbors(5)).isEmpty();
    g.addEdge(5, 4);
    g.complete();
    assertThat(g.getDstNeighbors(4)).containsExactly(5);
    assertThrows(IllegalArgumentException.class, () -> g.addVertex(null));
  }

  @Test
  public void testSetNeighbors() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    g.setNeighbors(1, ImmutableList.of(2, 2, 1));
    assertThat(g.getSrcNeighbors(1)).containsExactly(1, 2).inOrder();
    assertThat(g.getEdgeCount()).isEqualTo(5);
    assertThat(g.getDstNeighbors(3)).isEmpty();
    assertThat(g.getDstNeighbors(2)).containsExactly(1, 2, 4).inOrder();
    assertTransposeConsistent(g);
  }

  @Test
  public void testSetNeighborsValidatesBeforeMutating() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    BipartiteGraph<Void> original = g.copy();
    assertThrows(
        IndexOutOfBoundsException.class, () -> g.setNeighbors(1, ImmutableList.of(2, 7)));
    assertThat(g).isEqualTo(original);
  }

  @Test
  public void testDeleteSrcsKeepingVertices() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    g.deleteSrcs(ImmutableList.of(1, 4), false);
    assertThat(g.getSrcCount()).isEqualTo(4);
    assertThat(g.getEdgeCount()).isEqualTo(1);
    assertThat(g.getDstNeighbors(2)).containsExactly(2);
    assertTransposeConsistent(g);
  }

  @Test
  public void testDeleteSrcsRenumbers() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    g.deleteSrcs(ImmutableList.of(2), true);
    assertThat(g.getSrcCount()).isEqualTo(3);
    assertThat(g.getEdgeCount()).isEqualTo(4);
    assertThat(g.getSrcNeighbors(1)).containsExactly(1, 3).inOrder();
    assertThat(g.getSrcNeighbors(2)).isEmpty();
    assertThat(g.getSrcNeighbors(3)).containsExactly(1, 2).inOrder();
    assertThat(g.getDstNeighbors(1)).containsExactly(1, 3).inOrder();
    assertThat(g.getDstNeighbors(2)).containsExactly(3);
    assertTransposeConsistent(g);
  }

  @Test
  public void testDeleteSrcsValidatesBeforeMutating() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    BipartiteGraph<Void> original = g.copy();
    assertThrows(
        IndexOutOfBoundsException.class, () -> g.deleteSrcs(ImmutableList.of(1, 9), true));
    assertThat(g).isEqualTo(original);
  }

  @Test
  public void testDeleteDsts() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    g.deleteDsts(ImmutableList.of(1), true);
    assertThat(g.getDstCount()).isEqualTo(2);
    assertThat(g.getEdgeCount()).isEqualTo(3);
    assertThat(g.getSrcNeighbors(1)).containsExactly(2);
    assertThat(g.getSrcNeighbors(2)).containsExactly(1);
    assertThat(g.getSrcNeighbors(4)).containsExactly(1);
    assertTransposeConsistent(g);
  }

  @Test
  public void testClear() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    g.clear();
    assertThat(g.getEdgeCount()).isEqualTo(0);
    assertThat(g.getSrcCount()).isEqualTo(4);
    assertThat(g.getDstCount()).isEqualTo(3);
    assertThat(g.getEdges()).isEmpty();
    assertThat(g.getDstNeighbors(1)).isEmpty();
  }

  @Test
  public void testInvviewSwapsRoles() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    BipartiteGraph<Void> inv = g.invview();
    assertThat(inv.getSrcCount()).isEqualTo(3);
    assertThat(inv.getDstCount()).isEqualTo(4);
    assertThat(inv.getEdgeCount()).isEqualTo(5);
    assertThat(inv.getSrcNeighbors(1)).containsExactly(1, 4).inOrder();
    assertThat(inv.getDstNeighbors(4)).containsExactly(1, 2).inOrder();
    assertThat(inv.invview()).isEqualTo(g);
  }

  @Test
  public void testInvviewAliasesStorage() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    BipartiteGraph<Void> inv = g.invview();
    inv.addEdge(2, 3);
    assertThat(g.hasEdge(3, 2)).isTrue();
    assertThat(g.getEdgeCount()).isEqualTo(6);
    g.removeEdge(1, 1);
    assertThat(inv.getSrcNeighbors(1)).containsExactly(4);
    assertThat(inv.getEdgeCount()).isEqualTo(5);
  }

  @Test
  public void testCopyIsIndependent() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    BipartiteGraph<Void> copy = g.copy();
    copy.addEdge(3, 3);
    assertThat(g.hasEdge(3, 3)).isFalse();
    assertThat(g.getEdgeCount()).isEqualTo(5);
  }

  @Test
  public void testEdgeIteration() {
    BipartiteGraph<Void> g = BipartiteGraph.<Void>fromAdjacency(FADJ).complete();
    assertThat(g.getSrcEdges())
        .containsExactly(
            BipartiteEdge.create(1, 1),
            BipartiteEdge.create(1, 3),
            BipartiteEdge.create(2, 2),
            BipartiteEdge.create(4, 1),
            BipartiteEdge.create(4, 2))
        .inOrder();
    assertThat(g.getDstEdges())
        .containsExactly(
            BipartiteEdge.create(1, 1),
            BipartiteEdge.create(4, 1),
            BipartiteEdge.create(2, 2),
            BipartiteEdge.create(4, 2),
            BipartiteEdge.create(1, 3))
        .inOrder();
    assertThat(g.getEdges()).containsExactlyElementsIn(g.getDstEdges());
  }

  @Test
  public void testEqualsConsidersCompletion() {
    BipartiteGraph<Void> a = BipartiteGraph.fromAdjacency(FADJ);
    BipartiteGraph<Void> b = BipartiteGraph.fromAdjacency(FADJ);
    assertThat(a).isEqualTo(b);
    b.complete();
    assertThat(a).isNotEqualTo(b);
    a.complete();
    assertThat(a).isEqualTo(b);
    assertThat(a).isNotEqualTo(BipartiteGraph.fromAdjacency(FADJ, 4).complete());
  }

  @Test
  public void testMetadata() {
    BipartiteGraph<String> g =
        BipartiteGraph.withMetadata(
            ImmutableList.of(ImmutableList.of(1, 2), ImmutableList.of(2)),
            2,
            ImmutableList.of(ImmutableList.of("a", "b"), ImmutableList.of("c")));
    g.complete();
    assertThat(g.getSrcNeighborsWithMetadata(1))
        .containsExactly(Maps.immutableEntry(1, "a"), Maps.immutableEntry(2, "b"))
        .inOrder();
    assertThat(g.getDstNeighborsWithMetadata(2))
        .containsExactly(Maps.immutableEntry(1, "b"), Maps.immutableEntry(2, "c"))
        .inOrder();

    g.addEdge(2, 1, "d");
    assertThat(g.getSrcNeighborsWithMetadata(2))
        .containsExactly(Maps.immutableEntry(1, "d"), Maps.immutableEntry(2, "c"))
        .inOrder();

    g.removeEdge(1, 1);
    assertThat(g.getSrcNeighborsWithMetadata(1)).containsExactly(Maps.immutableEntry(2, "b"));

    g.setNeighbors(2, ImmutableList.of(2));
    assertThat(g.getSrcNeighborsWithMetadata(2)).containsExactly(Maps.immutableEntry(2, "c"));
  }

  @Test
  public void testMetadataThroughInvertedView() {
    BipartiteGraph<String> g =
        BipartiteGraph.withMetadata(
            ImmutableList.of(ImmutableList.of(2), ImmutableList.of(1, 2)),
            2,
            ImmutableList.of(ImmutableList.of("a"), ImmutableList.of("b", "c")));
    g.complete();
    BipartiteGraph<String> inv = g.invview();
    assertThrows(IllegalStateException.class, () -> inv.getSrcNeighborsWithMetadata(1));

    inv.addEdge(1, 1);
    assertThat(g.getSrcNeighborsWithMetadata(1))
        .containsExactly(Maps.immutableEntry(1, null), Maps.immutableEntry(2, "a"))
        .inOrder();
    inv.removeEdge(2, 2);
    assertThat(g.getSrcNeighborsWithMetadata(2)).containsExactly(Maps.immutableEntry(1, "b"));
  }

  @Test
  public void testMetadataFollowsRenumberedSources() {
    BipartiteGraph<String> g = metadataGraph();
    g.deleteSrcs(ImmutableList.of(2), true);
    assertThat(g.getSrcCount()).isEqualTo(2);
    assertThat(g.getEdgeCount()).isEqualTo(4);
    assertThat(g.getSrcNeighborsWithMetadata(1))
        .containsExactly(Maps.immutableEntry(1, "a"), Maps.immutableEntry(2, "b"))
        .inOrder();
    assertThat(g.getSrcNeighborsWithMetadata(2))
        .containsExactly(Maps.immutableEntry(1, "d"), Maps.immutableEntry(2, "e"))
        .inOrder();
    assertThat(g.getDstNeighborsWithMetadata(2))
        .containsExactly(Maps.immutableEntry(1, "b"), Maps.immutableEntry(2, "e"))
        .inOrder();
  }

  @Test
  public void testMetadataFollowsDeletedDsts() {
    BipartiteGraph<String> g = metadataGraph();
    g.deleteSrcs(ImmutableList.of(2), true);
    g.deleteDsts(ImmutableList.of(1), true);
    assertThat(g.getDstCount()).isEqualTo(1);
    assertThat(g.getEdgeCount()).isEqualTo(2);
    assertThat(g.getSrcNeighborsWithMetadata(1)).containsExactly(Maps.immutableEntry(1, "b"));
    assertThat(g.getSrcNeighborsWithMetadata(2)).containsExactly(Maps.immutableEntry(1, "e"));
    assertThat(g.getDstNeighborsWithMetadata(1))
        .containsExactly(Maps.immutableEntry(1, "b"), Maps.immutableEntry(2, "e"))
        .inOrder();
  }

  @Test
  public void testMetadataForAddedVertices() {
    BipartiteGraph<String> g = metadataGraph();
    int src = g.addVertex(VertexKind.SRC);
    int dst = g.addVertex(VertexKind.DST);
    assertThat(src).isEqualTo(4);
    assertThat(dst).isEqualTo(3);
    assertThat(g.getSrcNeighborsWithMetadata(src)).isEmpty();

    g.addEdge(src, 1, "f");
    g.addEdge(1, dst, "g");
    assertThat(g.getSrcNeighborsWithMetadata(src)).containsExactly(Maps.immutableEntry(1, "f"));
    assertThat(g.getSrcNeighborsWithMetadata(1))
        .containsExactly(
            Maps.immutableEntry(1, "a"), Maps.immutableEntry(2, "b"), Maps.immutableEntry(3, "g"))
        .inOrder();
    assertThat(g.getDstNeighborsWithMetadata(1))
        .containsExactly(
            Maps.immutableEntry(1, "a"), Maps.immutableEntry(3, "d"), Maps.immutableEntry(4, "f"))
        .inOrder();
    assertThat(g.getDstNeighborsWithMetadata(dst)).containsExactly(Maps.immutableEntry(1, "g"));
  }

  @Test
  public void testMetadataForVertexAddedThroughInvertedView() {
    BipartiteGraph<String> g = metadataGraph();
    BipartiteGraph<String> inv = g.invview();
    int src = inv.addVertex(VertexKind.DST);
    assertThat(src).isEqualTo(4);
    inv.addEdge(2, src);
    assertThat(g.getSrcNeighborsWithMetadata(src)).containsExactly(Maps.immutableEntry(2, null));
    g.setNeighbors(src, ImmutableList.of(1, 2));
    assertThat(g.getSrcNeighborsWithMetadata(src))
        .containsExactly(Maps.immutableEntry(1, null), Maps.immutableEntry(2, null))
        .inOrder();
  }

  @Test
  public void testMetadataRequiresMetadataGraph() {
    BipartiteGraph<String> g = BipartiteGraph.create(1, 1);
    assertThrows(IllegalStateException.class, () -> g.addEdge(1, 1, "x"));
    assertThrows(IllegalStateException.class, () -> g.getSrcNeighborsWithMetadata(1));
  }

  @Test
  public void testMetadataShapeMismatch() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            BipartiteGraph.withMetadata(
                ImmutableList.of(ImmutableList.of(1, 2)),
                2,
                ImmutableList.of(ImmutableList.of("a"))));
  }

  private static BipartiteGraph<String> metadataGraph() {
    return BipartiteGraph.<String>withMetadata(
            ImmutableList.of(
                ImmutableList.of(1, 2), ImmutableList.of(2), ImmutableList.of(1, 2)),
            2,
            ImmutableList.of(
                ImmutableList.of("a", "b"), ImmutableList.of("c"), ImmutableList.of("d", "e")))
        .complete();
  }

  private static void assertTransposeConsistent(BipartiteGraph<?> g) {
    int entries = 0;
    for (int s : g.getSrcVertices()) {
      for (int d : g.getSrcNeighbors(s)) {
        assertThat(g.getDstNeighbors(d)).contains(s);
        entries++;
      }
    }
    for (int d : g.getDstVertices()) {
      for (int s : g.getDstNeighbors(d)) {
        assertThat(g.getSrcNeighbors(s)).contains(d);
      }
    }
    assertThat(g.getEdgeCount()).isEqualTo(entries);
  }
}
