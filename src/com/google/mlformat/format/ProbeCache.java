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

package com.google.mlformat.format;

import com.google.mlformat.format.WriterModel.LineState;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Remembers the outcome of laying out a document on a single line, keyed by the document and the
 * line state it started from.
 *
 * <p>A cache belongs to one format call. It is not thread safe and must never be shared between
 * files.
 */
final class ProbeCache {

  /** The result of a probe: the line state after the document, or null if it did not fit. */
  record Outcome(@Nullable LineState after) {
    boolean fits() {
      return after != null;
    }
  }

  static final Outcome DOES_NOT_FIT = new Outcome(null);

  // Docs have identity equality, so a document is only ever matched with itself.
  private record Key(Doc doc, LineState before) {}

  private final Map<Key, Outcome> outcomes = new HashMap<>();
  private int hits;
  private int misses;

  @Nullable Outcome lookup(Doc doc, LineState before) {
    Outcome outcome = outcomes.get(new Key(doc, before));
    if (outcome != null) {
      hits++;
    } else {
      misses++;
    }
    return outcome;
  }

  void store(Doc doc, LineState before, Outcome outcome) {
    outcomes.put(new Key(doc, before), outcome);
  }

  int getHits() {
    return hits;
  }

  int getMisses() {
    return misses;
  }

  int size() {
    return outcomes.size();
  }

  @Override
  public String toString() {
    return "ProbeCache(size=" + outcomes.size() + ", hits=" + hits + ", misses=" + misses + ")";
  }
}
