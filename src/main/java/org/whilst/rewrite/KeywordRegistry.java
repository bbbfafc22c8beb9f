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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Records which keywords introduce a {@code whilst} construct in each target namespace.
 *
 * <p>A registry is only mutated between compilation passes; each pass takes a snapshot of the
 * installations for its namespace when it starts.
 */
public final class KeywordRegistry {

  /** The keyword used when none is specified. */
  public static final String DEFAULT_KEYWORD = "whilst";

  private final SymbolAllocator allocator;

  /** Maps each namespace to its installations, keyed by keyword in order of installation. */
  private final Map<String, Map<String, Installation>> namespaces = new HashMap<>();

  public KeywordRegistry() {
    this(SymbolAllocator.GLOBAL);
  }

  /** Creates a registry whose installations get their symbols from {@code allocator}. */
  public KeywordRegistry(SymbolAllocator allocator) {
    this.allocator = allocator;
  }

  /** Binds {@link #DEFAULT_KEYWORD} in the given namespace. */
  @CanIgnoreReturnValue
  public Installation install(String target) {
    return install(target, null);
  }

  /**
   * Binds the construct in the given namespace under {@code alias}, or under {@link
   * #DEFAULT_KEYWORD} if {@code alias} is null. Any existing binding of the same keyword in that
   * namespace is replaced.
   */
  @CanIgnoreReturnValue
  public synchronized Installation install(String target, @Nullable String alias) {
    String keyword = (alias == null) ? DEFAULT_KEYWORD : alias;
    checkArgument(isValidKeyword(keyword), "Not a valid keyword: '%s'", keyword);
    Installation result =
        new Installation(this, target, keyword, allocator.nextInstallationId());
    namespaces.computeIfAbsent(target, k -> new LinkedHashMap<>()).put(keyword, result);
    return result;
  }

  /** Removes the given binding, if it is still present. */
  synchronized void uninstall(Installation installation) {
    Map<String, Installation> bindings = namespaces.get(installation.target());
    if (bindings != null) {
      bindings.remove(installation.keyword(), installation);
      if (bindings.isEmpty()) {
        namespaces.remove(installation.target());
      }
    }
  }

  /**
   * Removes every binding in the given namespace, as is done once a compilation unit that
   * installed them has been expanded. Returns the number of bindings removed.
   */
  @CanIgnoreReturnValue
  public synchronized int teardown(String target) {
    Map<String, Installation> removed = namespaces.remove(target);
    return (removed == null) ? 0 : removed.size();
  }

  /** Returns the current bindings in the given namespace, keyed by keyword. */
  public synchronized ImmutableMap<String, Installation> installations(String target) {
    Map<String, Installation> bindings = namespaces.get(target);
    return (bindings == null) ? ImmutableMap.of() : ImmutableMap.copyOf(bindings);
  }

  @VisibleForTesting
  static boolean isValidKeyword(String keyword) {
    if (keyword.isEmpty() || !PerlDialect.INSTANCE.isIdentifierStart(keyword.charAt(0))) {
      return false;
    }
    return keyword.chars().allMatch(c -> PerlDialect.INSTANCE.isIdentifierPart((char) c));
  }
}
