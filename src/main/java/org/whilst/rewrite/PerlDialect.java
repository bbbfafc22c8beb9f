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

/**
 * Rewrites {@code whilst (COND) LABEL: {BODY}} into
 *
 * <pre>
 *   (do { my @S; LABEL: while (COND) { push @S, (do {BODY}) } @S })
 * </pre>
 *
 * The body is evaluated in list context, so each iteration may push any number of values. The
 * outer {@code do} evaluates to {@code @S}, which gives the collected values in list context and
 * their count in scalar context.
 *
 * <p>Only {@code #} comments, POD sections and the three quote characters are recognized. Regular
 * expressions, {@code q{}}-style quotes and heredocs are scanned as code, so a brace, parenthesis
 * or quote character inside one (e.g. {@code /\(/} in a condition) will confuse the scanner. The
 * pass stops at an {@code __END__} or {@code __DATA__} line.
 */
public final class PerlDialect implements Dialect {

  public static final PerlDialect INSTANCE = new PerlDialect();

  private PerlDialect() {}

  @Override
  public String name() {
    return "perl";
  }

  @Override
  public String symbolPrefix() {
    return "@";
  }

  @Override
  public String renderBlockBegin(String condition, String symbol, String label) {
    return String.format(
        "(do { my %s; %s: while (%s) { push %s, (do ", symbol, label, condition, symbol);
  }

  @Override
  public String renderBlockEnd(String symbol) {
    return String.format(") } %s })", symbol);
  }

  @Override
  public boolean isQuote(char c) {
    return c == '"' || c == '\'' || c == '`';
  }

  @Override
  public int commentLength(SourceBuffer buffer, int pos) {
    char c = buffer.charAt(pos);
    if (c == '#') {
      // "$#array" is the last index of @array, not a comment
      return (buffer.charAt(pos - 1) == '$') ? 0 : Dialect.toEndOfLine(buffer, pos);
    } else if (c == '=' && (pos == 0 || buffer.charAt(pos - 1) == '\n')) {
      // A POD section runs from "=something" at the start of a line through a "=cut" line.
      if (!isIdentifierStart(buffer.charAt(pos + 1))) {
        return 0;
      }
      int end = pos;
      while (end < buffer.length()) {
        int lineLength = Dialect.toEndOfLine(buffer, end);
        boolean isCut = buffer.startsWith("=cut", end);
        end += lineLength;
        if (isCut) {
          break;
        }
        end++;
      }
      return Math.min(end, buffer.length()) - pos;
    }
    return 0;
  }

  @Override
  public boolean canStartKeyword(SourceBuffer buffer, int pos) {
    char prev = buffer.charAt(pos - 1);
    switch (prev) {
      case '$':
      case '@':
        // A variable named like the keyword
        return false;
      case '&':
      case '*':
        // "&&" and "**" are always operators
        if (buffer.charAt(pos - 2) == prev) {
          return true;
        }
        // fall through
      case '%':
        // A sigil (e.g. a hash, sub or glob named like the keyword) unless it follows an operand
        return endsOperand(buffer, pos - 2);
      case '>':
        // A method call
        return buffer.charAt(pos - 2) != '-';
      case ':':
        // A package-qualified name
        return buffer.charAt(pos - 2) != ':';
      default:
        return !isIdentifierPart(prev);
    }
  }

  /**
   * Returns true if the code ending at {@code pos} (ignoring trailing whitespace) is an operand, so
   * that a following {@code %}, {@code &} or {@code *} must be a binary operator. Only numbers,
   * variables, closing parentheses and brackets, and string literals are recognized; anything else
   * (including a closing brace) is assumed to leave Perl expecting a term.
   */
  private boolean endsOperand(SourceBuffer buffer, int pos) {
    while (pos >= 0 && Character.isWhitespace(buffer.charAt(pos))) {
      pos--;
    }
    char c = buffer.charAt(pos);
    if (c == ')' || c == ']' || isQuote(c)) {
      return true;
    } else if (!isIdentifierPart(c)) {
      return false;
    }
    int start = pos;
    while (isIdentifierPart(buffer.charAt(start - 1))) {
      start--;
    }
    char before = buffer.charAt(start - 1);
    char first = buffer.charAt(start);
    return (first >= '0' && first <= '9') || before == '$' || before == '@';
  }

  @Override
  public boolean isBareword(SourceBuffer buffer, int start, int end) {
    int next = skipSpaces(buffer, end, 1);
    if (buffer.startsWith("=>", next)) {
      // A fat-comma key
      return true;
    }
    // A hash subscript such as $h{whilst}
    return buffer.charAt(next) == '}' && buffer.charAt(skipSpaces(buffer, start - 1, -1)) == '{';
  }

  /** Steps from {@code pos} in direction {@code step} while there are spaces or tabs. */
  private static int skipSpaces(SourceBuffer buffer, int pos, int step) {
    while (buffer.charAt(pos) == ' ' || buffer.charAt(pos) == '\t') {
      pos += step;
    }
    return pos;
  }

  @Override
  public boolean endsCode(SourceBuffer buffer, int pos, String identifier) {
    return (identifier.equals("__END__") || identifier.equals("__DATA__"))
        && (pos == 0 || buffer.charAt(pos - 1) == '\n');
  }

  @Override
  public String toString() {
    return name();
  }
}
