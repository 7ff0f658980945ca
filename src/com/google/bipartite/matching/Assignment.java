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

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One entry of a {@link Matching}: either unassigned, unassigned with a caller-supplied payload,
 * or matched to a vertex id.
 *
 * @param <U> The type of the payload an unassigned entry may carry.
 */
public abstract class Assignment<U> {

  /** The three shapes an assignment can take. */
  public enum Kind {
    UNASSIGNED,
    UNASSIGNED_WITH_PAYLOAD,
    MATCHED
  }

  private Assignment() {}

  /** Returns the plain unassigned entry. */
  @SuppressWarnings("unchecked") // Unassigned holds no U
  public static <U> Assignment<U> unassigned() {
    return (Assignment<U>) Unassigned.INSTANCE;
  }

  /** Returns an unassigned entry carrying {@code payload}. */
  public static <U> Assignment<U> unassignedWith(U payload) {
    return new UnassignedWithPayload<>(checkNotNull(payload));
  }

  /** Returns an entry matched to vertex {@code vertex}. */
  public static <U> Assignment<U> matchedTo(int vertex) {
    checkArgument(vertex >= 1, "vertex ids start at 1, got %s", vertex);
    return new Matched<>(vertex);
  }

  public abstract Kind getKind();

  public final boolean isMatched() {
    return getKind() == Kind.MATCHED;
  }

  /**
   * Returns the matched vertex.
   *
   * @throws IllegalStateException if this entry is unassigned
   */
  public int getVertex() {
    throw new IllegalStateException("entry is unassigned");
  }

  /**
   * Returns the payload of an unassigned entry, or null if it carries none.
   *
   * @throws IllegalStateException if this entry is matched
   */
  public @Nullable U getPayload() {
    checkState(!isMatched(), "entry is matched");
    return null;
  }

  private static final class Unassigned extends Assignment<Object> {
    static final Unassigned INSTANCE = new Unassigned();

    @Override
    public Kind getKind() {
      return Kind.UNASSIGNED;
    }

    @Override
    public String toString() {
      return "u";
    }
  }

  private static final class UnassignedWithPayload<U> extends Assignment<U> {
    private final U payload;

    UnassignedWithPayload(U payload) {
      this.payload = payload;
    }

    @Override
    public Kind getKind() {
      return Kind.UNASSIGNED_WITH_PAYLOAD;
    }

    @Override
    public U getPayload() {
      return payload;
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return o instanceof UnassignedWithPayload
          && payload.equals(((UnassignedWithPayload<?>) o).payload);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Kind.UNASSIGNED_WITH_PAYLOAD, payload);
    }

    @Override
    public String toString() {
      return "u(" + payload + ")";
    }
  }

  private static final class Matched<U> extends Assignment<U> {
    private final int vertex;

    Matched(int vertex) {
      this.vertex = vertex;
    }

    @Override
    public Kind getKind() {
      return Kind.MATCHED;
    }

    @Override
    public int getVertex() {
      return vertex;
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return o instanceof Matched && vertex == ((Matched<?>) o).vertex;
    }

    @Override
    public int hashCode() {
      return vertex;
    }

    @Override
    public String toString() {
      return Integer.toString(vertex);
    }
  }
}
