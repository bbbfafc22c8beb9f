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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * The binding of the {@code whilst} construct to a keyword in a target namespace, as returned by
 * {@link KeywordRegistry#install}. Also serves as the handle used to unbind it.
 */
public final class Installation {
  private final KeywordRegistry registry;
  private final String target;
  private final String keyword;
  private final int instanceId;
  private final AtomicInteger symbolCount = new AtomicInteger();

  Installation(KeywordRegistry registry, String target, String keyword, int instanceId) {
    this.registry = registry;
    this.target = target;
    this.keyword = keyword;
    this.instanceId = instanceId;
  }

  /** The namespace in which the keyword is recognized. */
  public String target() {
    return target;
  }

  /** The keyword that introduces the construct, {@code whilst} unless installed under an alias. */
  public String keyword() {
    return keyword;
  }

  public int instanceId() {
    return instanceId;
  }

  /** Returns a symbol that no other call on any Installation from the same allocator returns. */
  String nextSymbol(String prefix) {
    return SymbolAllocator.symbolName(prefix, instanceId, symbolCount.getAndIncrement());
  }

  /** Removes this binding from its registry; does nothing if it has already been removed. */
  public void uninstall() {
    registry.uninstall(this);
  }

  @Override
  public String toString() {
    return String.format("%s in %s (#%s)", keyword, target, instanceId);
  }
}
