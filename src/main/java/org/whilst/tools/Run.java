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
import java.nio.file.Path;
import org.mozilla.javascript.RhinoException;
import org.whilst.rewrite.Dialect;
import org.whilst.rewrite.Expansion;
import org.whilst.rewrite.JavaScriptDialect;

/**
 * A simple command-line tool for running a single JavaScript program that uses {@code whilst}:
 * expands it, evaluates the result on Rhino, and prints the JSON value of its last statement.
 * Recognizes the same system properties as {@link Expand}, except that the dialect is always
 * JavaScript.
 */
public class Run {
  private Run() {}

  public static void main(String[] args) throws IOException {
    Expand.checkUsage(args.length == 1, "run <fileName.js>");
    Path file = Path.of(args[0]);
    Dialect dialect = Expand.dialectFor(file);
    Expand.checkUsage(dialect instanceof JavaScriptDialect, "run <fileName.js>");
    Expansion expansion = Expand.expandFile(file, dialect);
    if (expansion == null) {
      System.exit(1);
    }
    String fileName = file.getFileName().toString();
    try {
      String result = RhinoEvaluator.evaluateToJson(expansion.text(), fileName);
      System.out.printf("/* RUN %s RETURNS\n  %s\n*/\n", fileName, result);
    } catch (RhinoException e) {
      System.out.printf("/* RUN %s ERRORS\n  %s\n", fileName, e.details());
      System.out.print(e.getScriptStackTrace());
      System.out.println("*/");
    }
  }
}
