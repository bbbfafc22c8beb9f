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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkPositionIndex;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * The text of a compilation unit being rewritten, plus the offset of the single forward pass over
 * it.
 *
 * <p>Text before the offset has been consumed and is never looked at or changed again; all edits
 * are made at the offset, and the offset only moves forward. Each edit is recorded in an
 * append-only log, which lets us map a position in the rewritten text back to the corresponding
 * position in the original source.
 */
public final class SourceBuffer {

  /** One splice: {@code removed} at {@code position} was replaced by {@code inserted}. */
  public record Edit(int position, String removed, String inserted) {
    /** How much this edit moved the text that follows it. */
    int delta() {
      return inserted.length() - removed.length();
    }
  }

  private final String original;
  private final StringBuilder text;
  private int offset;
  private final List<Edit> edits = new ArrayList<>();

  public SourceBuffer(String source) {
    this.original = source;
    this.text = new StringBuilder(source);
  }

  /** The current (partially rewritten) text. */
  public String text() {
    return text.toString();
  }

  /** The text as it was before any edits. */
  public String original() {
    return original;
  }

  public int offset() {
    return offset;
  }

  public int length() {
    return text.length();
  }

  public boolean atEnd() {
    return offset >= text.length();
  }

  /** Returns the character at the given absolute position, or {@code 0} if it is out of range. */
  public char charAt(int pos) {
    return (pos >= 0 && pos < text.length()) ? text.charAt(pos) : 0;
  }

  /** Returns the character at the offset, or {@code 0} at the end of the buffer. */
  public char current() {
    return charAt(offset);
  }

  /** Returns the text from the offset to the end of the buffer. */
  public CharSequence rest() {
    return text.subSequence(offset, text.length());
  }

  public String substring(int start, int end) {
    return text.substring(start, end);
  }

  /** Returns true if the text at {@code pos} starts with {@code s}. */
  public boolean startsWith(String s, int pos) {
    if (pos < 0 || pos + s.length() > text.length()) {
      return false;
    }
    for (int i = 0; i < s.length(); i++) {
      if (text.charAt(pos + i) != s.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  /** Moves the offset forward by {@code n} characters. */
  public void advance(int n) {
    checkArgument(n >= 0, "Cannot move backwards (%s)", n);
    setOffset(offset + n);
  }

  /** Moves the offset forward to {@code pos}; text behind the offset may not be revisited. */
  public void setOffset(int pos) {
    checkArgument(pos >= offset, "Cannot move backwards from %s to %s", offset, pos);
    checkPositionIndex(pos, text.length());
    offset = pos;
  }

  /**
   * Inserts {@code s} at the offset and moves the offset past it; the inserted text is never
   * scanned.
   */
  public void insertAndSkip(String s) {
    replace(0, s);
    offset += s.length();
  }

  /** Removes {@code n} characters at the offset and returns them. */
  public String delete(int n) {
    String removed = text.substring(offset, offset + n);
    replace(n, "");
    return removed;
  }

  private void replace(int n, String s) {
    checkArgument(offset + n <= text.length(), "Edit past the end of the buffer");
    if (n == 0 && s.isEmpty()) {
      return;
    }
    String removed = text.substring(offset, offset + n);
    text.replace(offset, offset + n, s);
    edits.add(new Edit(offset, removed, s));
  }

  /** Every edit made so far, in the order they were made. */
  public ImmutableList<Edit> edits() {
    return ImmutableList.copyOf(edits);
  }

  /**
   * Maps a position in the current text to the corresponding position in the original source. A
   * position inside inserted text maps to the point where the insertion was made.
   *
   * <p>Since edits are made in increasing order of position and never behind the offset, the
   * position of each logged edit is also its position in the current text.
   */
  public int originalPosition(int pos) {
    int shift = 0;
    for (Edit edit : edits) {
      if (pos < edit.position()) {
        break;
      } else if (pos < edit.position() + edit.inserted().length()) {
        return edit.position() - shift;
      }
      shift += edit.delta();
    }
    return pos - shift;
  }

  /** Returns the 1-based line number of the given position in the current text. */
  public int lineNumber(int pos) {
    int origPos = Math.min(originalPosition(pos), original.length());
    int line = 1;
    for (int i = 0; i < origPos; i++) {
      if (original.charAt(i) == '\n') {
        line++;
      }
    }
    return line;
  }

  /** Returns the 0-based column of the given position in the current text. */
  public int column(int pos) {
    int origPos = Math.min(originalPosition(pos), original.length());
    int lineStart = original.lastIndexOf('\n', origPos - 1) + 1;
    return origPos - lineStart;
  }

  @Override
  public String toString() {
    return text.substring(0, offset) + "^" + text.substring(offset);
  }
}
