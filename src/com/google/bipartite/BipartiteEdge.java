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

import com.google.auto.value.AutoValue;

/** An edge of a {@link BipartiteGraph}, from a source vertex to a destination vertex. */
@AutoValue
public abstract class BipartiteEdge {

  public static BipartiteEdge create(int src, int dst) {
    return new AutoValue_BipartiteEdge(src, dst);
  }

  /** The source vertex id. */
  public abstract int getSrc();

  /** The destination vertex id. */
  public abstract int getDst();

  @Override
  public final String toString() {
    return "[src: " + getSrc() + "] => [dst: " + getDst() + "]";
  }
}
