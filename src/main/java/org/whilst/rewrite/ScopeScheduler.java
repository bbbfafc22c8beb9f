/*
 * Copyright 2025 The Whilst Authors
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

package org.whilst.rewrite;

import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracks the brace-delimited scopes that are open at the current point of a compilation pass, and
 * the actions that must run when each of them closes.
 *
 * <p>The closing text of a {@code whilst} construct can only be emitted once the pass reaches the
 * closing brace of its block, which is discovered long after the construct's head was rewritten.
 * The rewrite engine therefore leaves an action here, and the pass calls {@link #closeScope} each
 * time it consumes a closing brace.
 *
 * <p>Scopes form a stack, since scope-end events nest; the actions of a scope run once, the most
 * recently scheduled first. Actions that are still pending when the pass ends (because the source
 * had unbalanced braces) are simply never run.
 */
final class ScopeScheduler {

  /** Something to do when a scope closes. */
  @FunctionalInterface
  interface ScopeEndAction {
    /**
     * Called with the buffer's offset just after the scope's closing brace; may edit the buffer
     * at the offset.
     */
    void run(SourceBuffer buffer);
  }

  /** The actions of each open scope; the innermost scope is first. */
  private final ArrayDeque<List<ScopeEndAction>> scopes = new ArrayDeque<>();

  /** Actions waiting for the next scope to open. */
  private final List<ScopeEndAction> armed = new ArrayList<>();

  /** The number of actions that have been run. */
  private int fired;

  /**
   * Arranges for {@code action} to be scheduled on the next scope opened, i.e. before the brace
   * that opens it has been consumed.
   */
  void armNextScope(ScopeEndAction action) {
    armed.add(action);
  }

  /** Called when the pass consumes an opening brace. */
  void openScope() {
    scopes.push(new ArrayList<>());
    if (!armed.isEmpty()) {
      armed.forEach(this::scheduleScopeEnd);
      armed.clear();
    }
  }

  /** Registers {@code action} to run once when the innermost open scope closes. */
  void scheduleScopeEnd(ScopeEndAction action) {
    checkState(!scopes.isEmpty(), "No open scope");
    scopes.peek().add(action);
  }

  /**
   * Called when the pass consumes a closing brace; runs the actions of the innermost open scope,
   * most recently scheduled first. Returns the number of actions run (zero for an unmatched
   * brace).
   */
  @CanIgnoreReturnValue
  int closeScope(SourceBuffer buffer) {
    if (scopes.isEmpty()) {
      return 0;
    }
    List<ScopeEndAction> actions = scopes.pop();
    for (int i = actions.size() - 1; i >= 0; i--) {
      actions.get(i).run(buffer);
    }
    fired += actions.size();
    return actions.size();
  }

  /** The number of scopes currently open. */
  int depth() {
    return scopes.size();
  }

  /** The number of actions scheduled or armed that have not yet run. */
  int pending() {
    return armed.size() + scopes.stream().mapToInt(List::size).sum();
  }

  int fired() {
    return fired;
  }
}
