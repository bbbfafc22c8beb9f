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
 * One occurrence of the keyword that has been rewritten.
 *
 * @param keyword the keyword as it appeared in the source
 * @param condition the loop condition, after expanding any constructs nested in it
 * @param label the label given to the generated loop
 * @param symbol the temporary sequence that collects the body's values
 * @param lineNum the 1-based line of the keyword in the original source
 * @param charPositionInLine the 0-based column of the keyword in the original source
 */
public record Invocation(
    String keyword,
    String condition,
    String label,
    String symbol,
    int lineNum,
    int charPositionInLine) {}
