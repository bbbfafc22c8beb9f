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

package org.whilst.testing;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter.TestParameterValuesProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Splits each file in a testdata directory into test programs: each program is a chunk of source
 * code followed by a comment matching the given pattern, whose first group is returned as the
 * program's comment. Any code after the last comment becomes a program with a null comment.
 */
public class TestdataScanner implements TestParameterValuesProvider {

  /**
   * A chunk of code from a testdata file.
   *
   * @param name identifies the file and the line on which the chunk starts
   */
  public record TestProgram(String name, String fileName, String code, @Nullable String comment) {
    @Override
    public String toString() {
      return name;
    }
  }

  private final Path dir;
  private final Pattern commentPattern;

  public TestdataScanner(Path dir, Pattern commentPattern) {
    this.dir = dir;
    this.commentPattern = commentPattern;
  }

  @Override
  public List<TestProgram> provideValues() {
    ImmutableList.Builder<TestProgram> result = ImmutableList.builder();
    try (Stream<Path> files = Files.list(dir)) {
      for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
        scan(file, result);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return result.build();
  }

  private void scan(Path file, ImmutableList.Builder<TestProgram> result) throws IOException {
    String fileName = file.getFileName().toString();
    String text = Files.readString(file, StandardCharsets.UTF_8);
    Matcher matcher = commentPattern.matcher(text);
    int start = 0;
    while (matcher.find()) {
      String code = text.substring(start, matcher.start());
      result.add(new TestProgram(name(fileName, text, start), fileName, code, matcher.group(1)));
      start = matcher.end();
    }
    if (!text.substring(start).isBlank()) {
      result.add(
          new TestProgram(name(fileName, text, start), fileName, text.substring(start), null));
    }
  }

  /** Returns "fileName:line" for the line containing position {@code start} of {@code text}. */
  private static String name(String fileName, String text, int start) {
    long line = 1 + text.substring(0, start).chars().filter(c -> c == '\n').count();
    return fileName + ":" + line;
  }
}
