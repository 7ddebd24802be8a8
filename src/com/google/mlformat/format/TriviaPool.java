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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.mlformat.syntax.Trivia;
import java.util.Arrays;

/** The trivia of one file, each item tracked until it is attached to a node or dropped. */
final class TriviaPool {
  enum State {
    UNATTACHED,
    ATTACHED,
    DROPPED
  }

  private final ImmutableList<Trivia> items;
  private final State[] states;

  TriviaPool(ImmutableList<Trivia> items) {
    this.items = items;
    this.states = new State[items.size()];
    Arrays.fill(states, State.UNATTACHED);
  }

  int size() {
    return items.size();
  }

  Trivia get(int index) {
    return items.get(index);
  }

  void markAttached(int index) {
    settle(index, State.ATTACHED);
  }

  void markDropped(int index) {
    settle(index, State.DROPPED);
  }

  private void settle(int index, State state) {
    checkState(
        states[index] == State.UNATTACHED, "%s is already %s", items.get(index), states[index]);
    states[index] = state;
  }

  /** Whether every item has been attached or dropped. */
  boolean isSettled() {
    for (State state : states) {
      if (state == State.UNATTACHED) {
        return false;
      }
    }
    return true;
  }

  ImmutableList<Trivia> getDropped() {
    ImmutableList.Builder<Trivia> dropped = ImmutableList.builder();
    for (int i = 0; i < states.length; i++) {
      if (states[i] == State.DROPPED) {
        dropped.add(items.get(i));
      }
    }
    return dropped.build();
  }
}
