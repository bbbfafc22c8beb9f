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
 * JavaScript blocks have no value, so in this dialect the body contributes values with {@code
 * yield} (any number per iteration). {@code whilst (COND) LABEL: {BODY}} is rewritten to
 *
 * <pre>
 *   (function () { var S = [], S_fn = function* () { LABEL: while (COND) {BODY} },
 *   S_gen = S_fn(); for (var S_next = S_gen.next(); !S_next.done; S_next = S_gen.next()) {
 *   S.push(S_next.value); } return S; }).call(this)
 * </pre>
 *
 * which evaluates to an array of the yielded values; its {@code length} is the number of values.
 *
 * <p>Since the condition and body run inside a generator function, {@code return} ends the loop
 * and {@code arguments} refers to the generator's (empty) arguments. The generator is called
 * directly (Rhino cannot apply {@code call} to a generator function), so {@code this} in the
 * condition and body is the global object. Labels don't cross function boundaries in JavaScript,
 * so a nested {@code whilst} body cannot {@code break} out of an outer one.
 */
public final class JavaScriptDialect implements Dialect {

  public static final JavaScriptDialect INSTANCE = new JavaScriptDialect();

  private JavaScriptDialect() {}

  @Override
  public String name() {
    return "javascript";
  }

  @Override
  public String symbolPrefix() {
    return "";
  }

  @Override
  public String renderBlockBegin(String condition, String symbol, String label) {
    return String.format(
        "(function () { var %1$s = [], %1$s_fn = function* () { %2$s: while (%3$s) ",
        symbol, label, condition);
  }

  @Override
  public String renderBlockEnd(String symbol) {
    return String.format(
        " }, %1$s_gen = %1$s_fn(); for (var %1$s_next = %1$s_gen.next(); !%1$s_next.done;"
            + " %1$s_next = %1$s_gen.next()) { %1$s.push(%1$s_next.value); }"
            + " return %1$s; }).call(this)",
        symbol);
  }

  @Override
  public boolean isIdentifierStart(char c) {
    return Dialect.super.isIdentifierStart(c) || c == '$';
  }

  @Override
  public boolean isQuote(char c) {
    return c == '"' || c == '\'' || c == '`';
  }

  @Override
  public int commentLength(SourceBuffer buffer, int pos) {
    if (buffer.charAt(pos) != '/') {
      return 0;
    }
    char next = buffer.charAt(pos + 1);
    if (next == '/') {
      return Dialect.toEndOfLine(buffer, pos);
    } else if (next == '*') {
      int end = pos + 2;
      while (end < buffer.length() && !buffer.startsWith("*/", end)) {
        end++;
      }
      return Math.min(end + 2, buffer.length()) - pos;
    }
    return 0;
  }

  @Override
  public boolean canStartKeyword(SourceBuffer buffer, int pos) {
    char prev = buffer.charAt(pos - 1);
    if (prev == '.') {
      // A property access, unless it's a spread
      return buffer.charAt(pos - 2) == '.' && buffer.charAt(pos - 3) == '.';
    }
    return !isIdentifierPart(prev);
  }

  @Override
  public boolean isBareword(SourceBuffer buffer, int start, int end) {
    int next = end;
    while (buffer.charAt(next) == ' ' || buffer.charAt(next) == '\t') {
      next++;
    }
    // A property name in an object literal
    return buffer.charAt(next) == ':';
  }

  @Override
  public String toString() {
    return name();
  }
}
