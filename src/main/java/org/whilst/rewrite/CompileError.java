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

import com.google.errorprone.annotations.FormatMethod;

/**
 * All errors detected while rewriting throw a CompileError. They are fatal for the compilation unit
 * being expanded.
 */
public class CompileError extends RuntimeException {

  /** The structural problems a {@code whilst} construct can have. */
  public enum Kind {
    /** The keyword was not followed by a parenthesized condition. */
    MISSING_CONDITION,
    /** The condition (and optional label) was not followed by a block. */
    MISSING_BLOCK
  }

  public final Kind kind;
  public final String msg;

  /** The 1-based line of the keyword in the original source. */
  public final int lineNum;

  /** The 0-based column of the keyword in the original source. */
  public final int charPositionInLine;

  public CompileError(Kind kind, String msg, int lineNum, int charPositionInLine) {
    super(msg);
    this.kind = kind;
    this.msg = msg;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
  }

  /** Returns a new CompileError with a formatted message. */
  @FormatMethod
  static CompileError error(
      Kind kind, int lineNum, int charPositionInLine, String fmt, Object... fmtArgs) {
    return new CompileError(kind, String.format(fmt, fmtArgs), lineNum, charPositionInLine);
  }

  /**
   * Returns an equivalent CompileError for an error found in a fragment of source that starts at
   * the given line and column of the enclosing source.
   */
  CompileError relocate(int fragmentLine, int fragmentColumn) {
    int col = (lineNum == 1) ? fragmentColumn + charPositionInLine : charPositionInLine;
    return new CompileError(kind, msg, fragmentLine + lineNum - 1, col);
  }

  @Override
  public String toString() {
    return String.format("%s:%s: %s", lineNum, charPositionInLine, msg);
  }
}
