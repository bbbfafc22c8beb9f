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

import org.mozilla.javascript.Context;
import org.mozilla.javascript.NativeJSON;
import org.mozilla.javascript.Scriptable;

/** A static-only class that runs expanded JavaScript on Rhino. */
public final class RhinoEvaluator {

  private RhinoEvaluator() {}

  /**
   * Evaluates {@code script} (which may use generators, so it is run in ES6 mode) in a fresh
   * top-level scope, and returns the JSON encoding of the value of its last statement ({@code
   * "undefined"} if it has none).
   *
   * @throws org.mozilla.javascript.RhinoException if the script fails to compile or throws
   */
  public static String evaluateToJson(String script, String sourceName) {
    try (Context cx = Context.enter()) {
      cx.setLanguageVersion(Context.VERSION_ES6);
      // Generators are best supported by the interpreter.
      cx.setOptimizationLevel(-1);
      Scriptable scope = cx.initStandardObjects();
      Object result = cx.evaluateString(scope, script, sourceName, 1, null);
      return Context.toString(NativeJSON.stringify(cx, scope, result, null, null));
    }
  }
}
