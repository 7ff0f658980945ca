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

import com.google.auto.value.AutoValue;

/** An edge of an {@link IntDigraph}. */
@AutoValue
public abstract class DirectedEdge {

  public static DirectedEdge create(int source, int destination) {
    return new AutoValue_DirectedEdge(source, destination);
  }

  public abstract int getSource();

  public abstract int getDestination();

  @Override
  public final String toString() {
    return getSource() + " => " + getDestination();
  }
}
