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

import java.util.function.UnaryOperator;
import org.whilst.rewrite.CompileError.Kind;

/**
 * Rewrites a single occurrence of the keyword.
 *
 * <p>Given a Cursor positioned at the keyword, {@link #rewrite} removes the keyword, condition and
 * label, inserts the dialect's loop head in front of the block's opening brace, and arms an action
 * on the ScopeScheduler that will insert the dialect's closing text once the pass reaches the
 * block's closing brace. The block itself is left as it is and becomes the body of the generated
 * loop.
 */
final class RewriteEngine {

  /** Expands any constructs nested in a condition before it is copied into the loop head. */
  private final UnaryOperator<String> conditionExpander;

  RewriteEngine(UnaryOperator<String> conditionExpander) {
    this.conditionExpander = conditionExpander;
  }

  Invocation rewrite(Cursor cursor, Installation installation) {
    SourceBuffer buffer = cursor.buffer;
    Dialect dialect = cursor.dialect;
    // Errors are reported at the keyword, so find it before we remove it.
    int lineNum = buffer.lineNumber(cursor.position());
    int charPositionInLine = buffer.column(cursor.position());
    String keyword = installation.keyword();
    cursor.skipDeclarator(keyword);
    cursor.skipWhitespace();

    int conditionStart = cursor.position();
    int conditionLine = buffer.lineNumber(conditionStart);
    // Skip the opening parenthesis
    int conditionColumn = buffer.column(conditionStart) + 1;
    String condition = cursor.extractCondition();
    if (condition == null) {
      throw CompileError.error(
          Kind.MISSING_CONDITION,
          lineNum,
          charPositionInLine,
          "Expected condition after %s keyword",
          keyword);
    }
    try {
      condition = conditionExpander.apply(condition);
    } catch (CompileError e) {
      throw e.relocate(conditionLine, conditionColumn);
    }

    String label = cursor.tryConsumeLabel();
    if (label == null) {
      label = dialect.defaultLabel();
    }

    String symbol = installation.nextSymbol(dialect.symbolPrefix());
    // The closing text can only be inserted once we reach the end of the block; arm it now so that
    // it is bound to the scope opened by the block's brace.
    String end = dialect.renderBlockEnd(symbol);
    cursor.scheduler.armNextScope(b -> b.insertAndSkip(end));

    if (!cursor.expectBlock(dialect.renderBlockBegin(condition, symbol, label))) {
      throw CompileError.error(
          Kind.MISSING_BLOCK,
          lineNum,
          charPositionInLine,
          "Expected block after %s condition",
          keyword);
    }
    return new Invocation(keyword, condition, label, symbol, lineNum, charPositionInLine);
  }
}
