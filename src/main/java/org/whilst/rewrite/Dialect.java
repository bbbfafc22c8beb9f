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

import com.google.common.base.Ascii;

/**
 * Everything the rewriter needs to know about a host language: just enough of its lexical
 * structure to find balanced delimiters (comments, string quotes, identifiers), and the text of
 * the three fragments that together replace a {@code whilst} construct.
 *
 * <p>A construct {@code whilst (COND) LABEL: {BODY}} is rewritten to
 *
 * <pre>
 *   renderBlockBegin(COND, SYMBOL, LABEL) + "{BODY}" + renderBlockEnd(SYMBOL)
 * </pre>
 *
 * The begin and end fragments must together balance their braces, since they are never scanned.
 */
public interface Dialect {

  /** The label given to the generated loop when the construct doesn't provide one. */
  String DEFAULT_LABEL = "WHILST";

  /** A short lowercase name, e.g. "perl". */
  String name();

  /** The label used for the generated loop when none is given. */
  default String defaultLabel() {
    return DEFAULT_LABEL;
  }

  /** Prepended to generated symbol names (e.g. a sigil); may be empty. */
  String symbolPrefix();

  /**
   * Returns the text emitted just before the block's opening brace: it must declare {@code symbol}
   * as an empty sequence, open a loop labeled {@code label} that continues while {@code condition}
   * holds, and start appending the value(s) of the block that follows to {@code symbol}.
   */
  String renderBlockBegin(String condition, String symbol, String label);

  /**
   * Returns the text emitted just after the block's closing brace: it finishes the append, closes
   * the loop, and makes the whole construct evaluate to {@code symbol}.
   */
  String renderBlockEnd(String symbol);

  default boolean isIdentifierStart(char c) {
    return Ascii.isLowerCase(c) || Ascii.isUpperCase(c) || c == '_';
  }

  default boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || (c >= '0' && c <= '9');
  }

  /** Returns true if {@code c} opens a string literal that is closed by the same character. */
  boolean isQuote(char c);

  /**
   * If a comment starts at {@code pos}, returns its length (up to but not including a terminating
   * newline); otherwise returns 0.
   */
  int commentLength(SourceBuffer buffer, int pos);

  /**
   * Returns true if an identifier starting at {@code pos} could be a keyword, rather than e.g. a
   * variable name following a sigil or a member name following a dot.
   */
  boolean canStartKeyword(SourceBuffer buffer, int pos);

  /**
   * Returns true if the identifier from {@code start} to {@code end} is used as a plain name (such
   * as a hash key) rather than as a keyword, judging by the text around it.
   */
  default boolean isBareword(SourceBuffer buffer, int start, int end) {
    return false;
  }

  /**
   * Returns true if {@code identifier}, found at {@code pos}, marks the end of the code in the
   * unit; whatever follows it is left unexamined.
   */
  default boolean endsCode(SourceBuffer buffer, int pos, String identifier) {
    return false;
  }

  /** Returns the dialect with the given name ("perl" or "javascript"/"js"). */
  static Dialect forName(String name) {
    switch (Ascii.toLowerCase(name)) {
      case "perl":
      case "pl":
        return PerlDialect.INSTANCE;
      case "javascript":
      case "js":
        return JavaScriptDialect.INSTANCE;
      default:
        throw new IllegalArgumentException("Unknown dialect: " + name);
    }
  }

  /** Returns the length of the comment that runs from {@code pos} to the end of its line. */
  static int toEndOfLine(SourceBuffer buffer, int pos) {
    int end = pos;
    while (end < buffer.length() && buffer.charAt(end) != '\n') {
      end++;
    }
    return end - pos;
  }
}
