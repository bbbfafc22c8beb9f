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
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * A Cursor reads a SourceBuffer forward from its offset, using the Dialect's lexical rules to skip
 * whitespace, comments and string literals.
 *
 * <p>The methods that consume parts of a {@code whilst} construct (the keyword, the condition and
 * the label) splice them out of the buffer rather than stepping over them, since they have no place
 * in the rewritten text. All edits are made at the offset.
 */
final class Cursor {

  /** An identifier immediately followed by a colon. */
  private static final Pattern LABEL =
      Pattern.compile("([a-z_][a-z0-9_]*):", Pattern.CASE_INSENSITIVE);

  final SourceBuffer buffer;
  final Dialect dialect;
  final ScopeScheduler scheduler;

  Cursor(SourceBuffer buffer, Dialect dialect, ScopeScheduler scheduler) {
    this.buffer = buffer;
    this.dialect = dialect;
    this.scheduler = scheduler;
  }

  int position() {
    return buffer.offset();
  }

  /** Removes the keyword, which must be at the offset. */
  void skipDeclarator(String keyword) {
    checkState(buffer.startsWith(keyword, buffer.offset()), "Not at %s: %s", keyword, buffer);
    buffer.delete(keyword.length());
  }

  /** Advances past any whitespace and comments. */
  void skipWhitespace() {
    while (!buffer.atEnd()) {
      if (Character.isWhitespace(buffer.current())) {
        buffer.advance(1);
      } else if (!skipComment()) {
        break;
      }
    }
  }

  /** If a comment starts at the offset, advances past it and returns true. */
  @CanIgnoreReturnValue
  boolean skipComment() {
    int length = dialect.commentLength(buffer, buffer.offset());
    buffer.advance(length);
    return length != 0;
  }

  /** If a string literal starts at the offset, advances past it and returns true. */
  @CanIgnoreReturnValue
  boolean skipString() {
    if (!dialect.isQuote(buffer.current())) {
      return false;
    }
    buffer.setOffset(endOfString(buffer.offset()));
    return true;
  }

  /** Returns the identifier at the offset (possibly empty), without advancing. */
  String peekIdentifier() {
    int start = buffer.offset();
    int end = start;
    while (end < buffer.length() && dialect.isIdentifierPart(buffer.charAt(end))) {
      end++;
    }
    return buffer.substring(start, end);
  }

  /**
   * Given the position of an opening quote, returns the position just after the matching closing
   * quote (or the end of the buffer if there is none). Backslash escapes the following character.
   */
  private int endOfString(int pos) {
    char quote = buffer.charAt(pos);
    int i = pos + 1;
    while (i < buffer.length()) {
      char c = buffer.charAt(i);
      if (c == '\\') {
        i += 2;
      } else {
        i++;
        if (c == quote) {
          break;
        }
      }
    }
    return Math.min(i, buffer.length());
  }

  /**
   * If the offset is at an opening parenthesis, finds the matching closing parenthesis (ignoring
   * any in nested string literals or comments), removes the whole parenthesized text, and returns
   * the text between the parentheses. Returns null if there is no opening parenthesis or it is
   * never closed.
   */
  @Nullable String extractCondition() {
    if (buffer.current() != '(') {
      return null;
    }
    int start = buffer.offset();
    int depth = 0;
    int i = start;
    while (i < buffer.length()) {
      int comment = dialect.commentLength(buffer, i);
      char c = buffer.charAt(i);
      if (comment != 0) {
        i += comment;
        continue;
      } else if (dialect.isQuote(c)) {
        i = endOfString(i);
        continue;
      } else if (c == '(') {
        depth++;
      } else if (c == ')' && --depth == 0) {
        String parenthesized = buffer.delete(i + 1 - start);
        return parenthesized.substring(1, parenthesized.length() - 1);
      }
      i++;
    }
    return null;
  }

  /**
   * Skips whitespace; if that leaves the offset at a label (an identifier immediately followed by a
   * single colon), removes the label and its colon, skips any following whitespace, and returns the
   * label's identifier. Otherwise returns null and leaves the buffer unchanged.
   */
  @Nullable String tryConsumeLabel() {
    skipWhitespace();
    Matcher matcher = LABEL.matcher(buffer.rest());
    if (!matcher.lookingAt() || buffer.charAt(buffer.offset() + matcher.end()) == ':') {
      return null;
    }
    buffer.delete(matcher.end());
    skipWhitespace();
    return matcher.group(1);
  }

  /**
   * Skips whitespace; if that leaves the offset at an opening brace, inserts {@code head} before
   * the brace, advances past both, opens the block's scope, and returns true. Otherwise returns
   * false without changing the buffer. The block's contents are not examined.
   */
  boolean expectBlock(String head) {
    skipWhitespace();
    if (buffer.current() != '{') {
      return false;
    }
    buffer.insertAndSkip(head);
    buffer.advance(1);
    scheduler.openScope();
    return true;
  }
}
