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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.bipartite.NotCompletedException;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A partial injective mapping from destination vertices to source vertices: no two destinations
 * are matched to the same source.
 *
 * <p>The forward table is indexed by destination id. An inverse table, indexed by source id, is
 * optional; {@link #complete()} builds it. While the inverse exists, every assignment keeps both
 * tables consistent: {@code get(d)} is matched to {@code s} if and only if the inverse entry of
 * {@code s} is matched to {@code d}.
 *
 * <p>{@link #invview()} returns a matching with the two tables swapped. It aliases this one.
 *
 * @param <U> The payload type unassigned entries may carry.
 */
public final class Matching<U> implements Iterable<Assignment<U>> {

  private final List<Assignment<U>> match;
  private @Nullable List<Assignment<U>> inverse;

  private Matching(List<Assignment<U>> match, @Nullable List<Assignment<U>> inverse) {
    this.match = match;
    this.inverse = inverse;
  }

  /** Creates a matching of {@code size} unassigned entries, without an inverse. */
  public static <U> Matching<U> create(int size) {
    checkArgument(size >= 0, "negative size: %s", size);
    return new Matching<>(unassignedEntries(size), null);
  }

  /**
   * Creates a matching from explicit entries, without an inverse. Injectivity is checked when
   * the matching is completed.
   */
  public static <U> Matching<U> of(List<Assignment<U>> entries) {
    List<Assignment<U>> match = new ArrayList<>(entries.size());
    for (Assignment<U> entry : entries) {
      match.add(checkNotNull(entry));
    }
    return new Matching<>(match, null);
  }

  /** Returns an independent copy of this matching, including its inverse if present. */
  public Matching<U> copy() {
    return new Matching<>(
        new ArrayList<>(match), inverse == null ? null : new ArrayList<>(inverse));
  }

  /** Returns the number of entries in the forward table. */
  public int size() {
    return match.size();
  }

  public Assignment<U> get(int dst) {
    checkInRange(dst);
    return match.get(dst - 1);
  }

  public boolean isMatched(int dst) {
    return get(dst).isMatched();
  }

  /**
   * Returns the source matched to {@code dst}.
   *
   * @throws IllegalStateException if {@code dst} is unassigned
   */
  public int getSource(int dst) {
    return get(dst).getVertex();
  }

  /** Returns the number of matched entries. */
  public int getMatchedCount() {
    int count = 0;
    for (Assignment<U> entry : match) {
      if (entry.isMatched()) {
        count++;
      }
    }
    return count;
  }

  /** Returns the forward table as an unmodifiable live view. */
  public List<Assignment<U>> getEntries() {
    return Collections.unmodifiableList(match);
  }

  @Override
  public Iterator<Assignment<U>> iterator() {
    return getEntries().iterator();
  }

  /**
   * Sets the entry of {@code dst}. If the inverse exists it is kept consistent: a destination
   * already holding the same source is unassigned, and the previous source of {@code dst} loses
   * its inverse entry.
   */
  public void set(int dst, Assignment<U> value) {
    checkInRange(dst);
    checkNotNull(value);
    if (inverse != null) {
      Assignment<U> previous = match.get(dst - 1);
      if (value.isMatched()) {
        int src = value.getVertex();
        if (src <= inverse.size()) {
          Assignment<U> holder = inverse.get(src - 1);
          if (holder.isMatched()) {
            match.set(holder.getVertex() - 1, Assignment.unassigned());
          }
        }
      }
      if (previous.isMatched()) {
        int oldSrc = previous.getVertex();
        checkState(
            oldSrc <= inverse.size() && inverse.get(oldSrc - 1).equals(Assignment.matchedTo(dst)),
            "inverse of source %s does not point back to destination %s",
            oldSrc,
            dst);
        inverse.set(oldSrc - 1, Assignment.unassigned());
      }
      if (value.isMatched()) {
        int src = value.getVertex();
        while (inverse.size() < src) {
          inverse.add(Assignment.unassigned());
        }
        inverse.set(src - 1, Assignment.matchedTo(dst));
      }
    }
    match.set(dst - 1, value);
  }

  /** Matches {@code dst} to {@code src}. */
  public void match(int dst, int src) {
    set(dst, Assignment.matchedTo(src));
  }

  /** Makes {@code dst} unassigned. */
  public void unassign(int dst) {
    set(dst, Assignment.unassigned());
  }

  /** Appends an entry to the forward table, growing and updating the inverse if present. */
  public void push(Assignment<U> value) {
    checkNotNull(value);
    match.add(Assignment.unassigned());
    set(match.size(), value);
  }

  public boolean isComplete() {
    return inverse != null;
  }

  /** @throws NotCompletedException if the inverse has not been built */
  public void requireComplete() {
    if (inverse == null) {
      throw new NotCompletedException(
          "Backwards matching not defined. complete() the matching first.");
    }
  }

  /**
   * Builds the inverse, sized to the largest matched source. Does nothing if it already exists.
   *
   * @return this matching
   */
  @CanIgnoreReturnValue
  public Matching<U> complete() {
    if (inverse != null) {
      return this;
    }
    return complete(largestMatchedVertex());
  }

  /**
   * Builds an inverse with {@code size} entries in one pass over the forward table. Does nothing
   * if the inverse already exists.
   *
   * @return this matching
   * @throws IllegalArgumentException if a matched source exceeds {@code size}
   * @throws IllegalStateException if two destinations are matched to the same source
   */
  @CanIgnoreReturnValue
  public Matching<U> complete(int size) {
    if (inverse != null) {
      return this;
    }
    int largest = largestMatchedVertex();
    checkArgument(
        size >= largest, "inverse of size %s cannot hold matched source %s", size, largest);
    List<Assignment<U>> inv = unassignedEntries(size);
    for (int dst = 1; dst <= match.size(); dst++) {
      Assignment<U> entry = match.get(dst - 1);
      if (!entry.isMatched()) {
        continue;
      }
      int src = entry.getVertex();
      checkState(
          !inv.get(src - 1).isMatched(),
          "source %s is matched to both destination %s and destination %s",
          src,
          inv.get(src - 1),
          dst);
      inv.set(src - 1, Assignment.matchedTo(dst));
    }
    inverse = inv;
    return this;
  }

  /**
   * Returns a matching with the forward and inverse tables swapped. The returned matching aliases
   * this one.
   *
   * @throws NotCompletedException if the inverse has not been built
   */
  public Matching<U> invview() {
    requireComplete();
    return new Matching<>(inverse, match);
  }

  @Override
  public String toString() {
    return "Matching" + match;
  }

  private int largestMatchedVertex() {
    int largest = 0;
    for (Assignment<U> entry : match) {
      if (entry.isMatched()) {
        largest = Math.max(largest, entry.getVertex());
      }
    }
    return largest;
  }

  private void checkInRange(int dst) {
    if (dst < 1 || dst > match.size()) {
      throw new IndexOutOfBoundsException(
          "vertex " + dst + " out of range 1.." + match.size());
    }
  }

  private static <U> List<Assignment<U>> unassignedEntries(int size) {
    List<Assignment<U>> entries = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      entries.add(Assignment.<U>unassigned());
    }
    return entries;
  }
}
