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
 * Hands out the instance ids from which each Installation mints its temporary symbols.
 *
 * <p>A symbol is {@code <prefix>__whilst_lex_<instance>_<count>}, where {@code instance} is
 * distinct for every Installation created from the same allocator and {@code count} is distinct
 * for every symbol minted by that Installation, so no two symbols from one allocator are ever the
 * same. Compilation units that may end up in the same program must share an allocator; {@link
 * #GLOBAL} is the one used by default.
 */
public final class SymbolAllocator {

  /** The allocator shared by everything in this process that doesn't ask for its own. */
  public static final SymbolAllocator GLOBAL = new SymbolAllocator();

  private final AtomicInteger installCount = new AtomicInteger();

  /** Returns a new instance id; called once for each Installation. */
  int nextInstallationId() {
    return installCount.getAndIncrement();
  }

  /** The number of instance ids handed out so far. */
  public int installations() {
    return installCount.get();
  }

  static String symbolName(String prefix, int instance, int count) {
    return String.format("%s__whilst_lex_%s_%s", prefix, instance, count);
  }
}
