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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class KeywordRegistryTest {

  private final SymbolAllocator allocator = new SymbolAllocator();
  private final KeywordRegistry registry = new KeywordRegistry(allocator);

  @Test
  public void installDefault() {
    Installation installation = registry.install("main");
    assertThat(installation.keyword()).isEqualTo("whilst");
    assertThat(installation.target()).isEqualTo("main");
    assertThat(installation.instanceId()).isEqualTo(0);
    assertThat(installation.toString()).isEqualTo("whilst in main (#0)");
    assertThat(registry.installations("main")).containsExactly("whilst", installation);
    assertThat(registry.installations("other")).isEmpty();
  }

  @Test
  public void installAlias() {
    Installation whilst = registry.install("main");
    Installation mapwhile = registry.install("main", "mapwhile");
    assertThat(mapwhile.keyword()).isEqualTo("mapwhile");
    assertThat(mapwhile.instanceId()).isEqualTo(1);
    assertThat(registry.installations("main"))
        .containsExactly("whilst", whilst, "mapwhile", mapwhile)
        .inOrder();
    assertThat(allocator.installations()).isEqualTo(2);
  }

  @Test
  public void reinstallReplaces() {
    Installation first = registry.install("main");
    Installation second = registry.install("main");
    assertThat(registry.installations("main")).containsExactly("whilst", second);
    // Removing the replaced binding leaves the current one
    first.uninstall();
    assertThat(registry.installations("main")).containsExactly("whilst", second);
    second.uninstall();
    assertThat(registry.installations("main")).isEmpty();
    second.uninstall();
  }

  @Test
  public void teardown() {
    registry.install("main");
    registry.install("main", "collect");
    Installation other = registry.install("other");
    assertThat(registry.teardown("main")).isEqualTo(2);
    assertThat(registry.installations("main")).isEmpty();
    assertThat(registry.installations("other")).containsExactly("whilst", other);
    assertThat(registry.teardown("main")).isEqualTo(0);
  }

  @Test
  @Parameters({"1abc", "foo-bar", "$whilst", "foo bar"})
  public void invalidKeyword(String keyword) {
    assertThat(KeywordRegistry.isValidKeyword(keyword)).isFalse();
    assertThrows(IllegalArgumentException.class, () -> registry.install("main", keyword));
  }

  @Test
  @Parameters({"whilst", "_x", "mapWhile2"})
  public void validKeyword(String keyword) {
    assertThat(KeywordRegistry.isValidKeyword(keyword)).isTrue();
  }

  @Test
  public void emptyKeyword() {
    assertThat(KeywordRegistry.isValidKeyword("")).isFalse();
  }

  @Test
  public void symbols() {
    Installation first = registry.install("main");
    Installation second = registry.install("main", "collect");
    assertThat(first.nextSymbol("@")).isEqualTo("@__whilst_lex_0_0");
    assertThat(first.nextSymbol("@")).isEqualTo("@__whilst_lex_0_1");
    assertThat(second.nextSymbol("")).isEqualTo("__whilst_lex_1_0");
    assertThat(first.nextSymbol("")).isEqualTo("__whilst_lex_0_2");
  }

  @Test
  public void symbolsAreUniqueAcrossThreads() throws Exception {
    Installation first = registry.install("a");
    Installation second = registry.install("b");
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<List<String>>> futures = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        Installation installation = (i % 2 == 0) ? first : second;
        futures.add(
            executor.submit(
                () -> {
                  List<String> symbols = new ArrayList<>();
                  for (int j = 0; j < 1000; j++) {
                    symbols.add(installation.nextSymbol("@"));
                  }
                  return symbols;
                }));
      }
      Set<String> all = new HashSet<>();
      for (Future<List<String>> future : futures) {
        all.addAll(future.get());
      }
      assertThat(all).hasSize(8000);
    } finally {
      executor.shutdown();
    }
  }
}
