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

import com.google.common.collect.ImmutableList;

/**
 * The result of expanding a compilation unit.
 *
 * @param source the identifier passed to {@link Expander#expand}, e.g. a filename
 * @param text the rewritten source
 * @param invocations every construct that was rewritten, in the order their keywords were found
 *     (a construct nested in a condition comes before the construct whose condition contains it)
 * @param edits the splices made to the unit's text, in order
 * @param unclosedScopes the number of scopes still open at the end of the unit; if non-zero the
 *     source had unbalanced braces
 * @param unfiredEdits the number of closing edits that were never made because their block was
 *     never closed; if non-zero, {@code text} is malformed
 */
public record Expansion(
    Object source,
    String text,
    ImmutableList<Invocation> invocations,
    ImmutableList<SourceBuffer.Edit> edits,
    int unclosedScopes,
    int unfiredEdits) {

  /** True if every construct found was completely rewritten. */
  public boolean isComplete() {
    return unfiredEdits == 0;
  }
}
