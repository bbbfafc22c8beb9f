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

package org.whilst.tools;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.whilst.rewrite.CompileError;
import org.whilst.rewrite.Dialect;
import org.whilst.rewrite.Expander;
import org.whilst.rewrite.Expansion;
import org.whilst.rewrite.KeywordRegistry;

/**
 * A simple command-line tool that expands the {@code whilst} constructs in a single file and
 * writes the result to standard output.
 *
 * <p>Recognizes the system properties {@code dialect} ("perl" or "javascript"; by default chosen
 * from the file's extension), {@code keyword} (installs the construct under this name instead of
 * "whilst") and {@code namespace} (default "main").
 */
public class Expand {
  private Expand() {}

  static void checkUsage(boolean condition, String use) {
    if (!condition) {
      System.err.println("Use: " + use);
      System.exit(1);
    }
  }

  /** Returns the dialect named by the "dialect" property, or the one matching the file's name. */
  static Dialect dialectFor(Path file) {
    String name = System.getProperty("dialect");
    if (name == null) {
      name = file.getFileName().toString().endsWith(".js") ? "javascript" : "perl";
    }
    return Dialect.forName(name);
  }

  /**
   * Reads and expands the given file with the keyword configured by the system properties. Prints
   * any compile error and returns null, or prints a warning if some construct was left incomplete.
   */
  static @Nullable Expansion expandFile(Path file, Dialect dialect) throws IOException {
    String fileName = file.getFileName().toString();
    String namespace = System.getProperty("namespace", "main");
    KeywordRegistry registry = new KeywordRegistry();
    registry.install(namespace, System.getProperty("keyword"));
    String input = Files.readString(file, StandardCharsets.UTF_8);
    Expansion expansion;
    try {
      expansion = Expander.expand(input, fileName, dialect, registry, namespace);
    } catch (CompileError e) {
      System.err.printf("%s:%s:%s: %s\n", fileName, e.lineNum, e.charPositionInLine, e.msg);
      return null;
    } finally {
      registry.teardown(namespace);
    }
    if (!expansion.isComplete()) {
      System.err.printf(
          "%s: %s block(s) never closed; output is incomplete\n",
          fileName, expansion.unfiredEdits());
    }
    return expansion;
  }

  public static void main(String[] args) throws IOException {
    checkUsage(args.length == 1, "expand <fileName>");
    Path file = Path.of(args[0]);
    Expansion expansion = expandFile(file, dialectFor(file));
    if (expansion == null) {
      System.exit(1);
    }
    System.out.print(expansion.text());
  }
}
