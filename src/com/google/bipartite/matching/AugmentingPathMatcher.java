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

package com.google.bipartite.matching;

import com.google.bipartite.BipartiteGraph;
import com.google.bipartite.matching.Assignment.Kind;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.function.IntPredicate;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Computes matchings of destination vertices to source vertices by augmenting paths.
 *
 * <p>Only destinations whose entry is plainly {@link Kind#UNASSIGNED} are free. An unassigned
 * entry carrying a payload is neither free nor re-routable, so callers can pin destinations out
 * of the search by giving them a payload.
 */
public final class AugmentingPathMatcher {

  private static final Logger logger = Logger.getLogger(AugmentingPathMatcher.class.getName());

  private static final IntPredicate ALL = v -> true;

  private AugmentingPathMatcher() {}

  /**
   * Tries to grow {@code matching} by one pair rooted at {@code src}, using fresh color buffers.
   *
   * @return whether an augmenting path was found and applied
   */
  @CanIgnoreReturnValue
  public static <U> boolean tryAugment(
      Matching<U> matching, BipartiteGraph<?> graph, int src, IntPredicate dstFilter) {
    return tryAugment(matching, graph, src, dstFilter, new BitSet(graph.getDstCount() + 1), null);
  }

  /**
   * Tries to grow {@code matching} by one pair rooted at {@code src}.
   *
   * <p>First, the neighbors of {@code src} are scanned in ascending order for a free destination
   * passing {@code dstFilter}; the first one found is matched to {@code src}. Failing that, each
   * uncolored neighbor passing the filter is colored and its current source is re-routed in the
   * same way; on success the neighbor is handed to {@code src}. The two-pass order decides which
   * of several maximum matchings gets built.
   *
   * <p>The color buffers are indexed by vertex id and belong to the caller. They are modified
   * even when no path is found, and must be cleared before being reused for an independent
   * search. The search keeps its own stack, so path length is not limited by the thread stack.
   *
   * @param dstColor destinations already visited by this search
   * @param srcColor if non-null, records every source the search visits
   * @return whether an augmenting path was found and applied. If not, the matching is unchanged.
   */
  @CanIgnoreReturnValue
  public static <U> boolean tryAugment(
      Matching<U> matching,
      BipartiteGraph<?> graph,
      int src,
      IntPredicate dstFilter,
      BitSet dstColor,
      @Nullable BitSet srcColor) {
    if (claimFreeDst(matching, graph, src, dstFilter, srcColor)) {
      return true;
    }
    Deque<SearchFrame> frames = new ArrayDeque<>();
    frames.push(new SearchFrame(src, graph.getSrcNeighbors(src)));
    boolean found = false;
    while (!frames.isEmpty()) {
      SearchFrame frame = frames.peek();
      if (found) {
        // The source above this frame moved off pendingDst.
        frames.pop();
        matching.match(frame.pendingDst, frame.src);
        continue;
      }

      int next = 0;
      while (frame.position < frame.dsts.size()) {
        int dst = frame.dsts.get(frame.position++);
        if (!dstFilter.test(dst) || dstColor.get(dst)) {
          continue;
        }
        dstColor.set(dst);
        if (matching.get(dst).isMatched()) {
          next = dst;
          break;
        }
      }
      if (next == 0) {
        frames.pop();
        continue;
      }

      frame.pendingDst = next;
      int holder = matching.get(next).getVertex();
      if (claimFreeDst(matching, graph, holder, dstFilter, srcColor)) {
        found = true;
      } else {
        frames.push(new SearchFrame(holder, graph.getSrcNeighbors(holder)));
      }
    }
    return found;
  }

  /** Marks {@code src} visited and matches it to its first free neighbor, if any. */
  private static <U> boolean claimFreeDst(
      Matching<U> matching,
      BipartiteGraph<?> graph,
      int src,
      IntPredicate dstFilter,
      @Nullable BitSet srcColor) {
    if (srcColor != null) {
      srcColor.set(src);
    }
    for (int dst : graph.getSrcNeighbors(src)) {
      if (dstFilter.test(dst) && matching.get(dst).getKind() == Kind.UNASSIGNED) {
        matching.match(dst, src);
        return true;
      }
    }
    return false;
  }

  /** Returns a maximum matching of {@code graph}. */
  public static <U> Matching<U> maximumMatching(BipartiteGraph<?> graph) {
    return maximumMatching(graph, ALL, ALL);
  }

  /**
   * Returns a maximum-cardinality matching of destinations to sources, in which only sources
   * passing {@code srcFilter} and destinations passing {@code dstFilter} may be matched.
   *
   * <p>This is often called a "maximal matching", but the guarantee is stronger than
   * inclusion-maximality: each source is tried once, in ascending order, and stays unmatched
   * only if no augmenting path exists for it at that point, which yields maximum cardinality.
   * Runs in O(V * (V + E)).
   *
   * <p>The result has {@code max(getSrcCount(), getDstCount())} entries and no inverse.
   */
  public static <U> Matching<U> maximumMatching(
      BipartiteGraph<?> graph, IntPredicate srcFilter, IntPredicate dstFilter) {
    Matching<U> matching =
        Matching.create(Math.max(graph.getSrcCount(), graph.getDstCount()));
    BitSet dstColor = new BitSet(graph.getDstCount() + 1);
    int tried = 0;
    int matched = 0;
    for (int src = 1; src <= graph.getSrcCount(); src++) {
      if (!srcFilter.test(src)) {
        continue;
      }
      tried++;
      dstColor.clear();
      if (tryAugment(matching, graph, src, dstFilter, dstColor, null)) {
        matched++;
      }
    }
    logger.fine("Matched " + matched + " of " + tried + " candidate sources");
    return matching;
  }

  private static final class SearchFrame {
    final int src;
    final List<Integer> dsts;
    int position;
    // The destination whose holder is being re-routed.
    int pendingDst;

    SearchFrame(int src, List<Integer> dsts) {
      this.src = src;
      this.dsts = dsts;
    }
  }
}
