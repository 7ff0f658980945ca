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

/**
 * Thrown when an operation needs the backward half of a dual table (the backward adjacency of a
 * {@link BipartiteGraph}, or the inverse of a matching) before it has been materialized.
 *
 * <p>The failure is recoverable: complete the structure and retry.
 */
public class NotCompletedException extends IllegalStateException {
  private static final long serialVersionUID = 1;

  public NotCompletedException(String message) {
    super(message);
  }
}
