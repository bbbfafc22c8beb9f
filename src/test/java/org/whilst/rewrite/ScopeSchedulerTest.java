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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ScopeSchedulerTest {

  private final ScopeScheduler scheduler = new ScopeScheduler();
  private final SourceBuffer buffer = new SourceBuffer("");

  private static ScopeScheduler.ScopeEndAction insert(String s) {
    return b -> b.insertAndSkip(s);
  }

  @Test
  public void actionsRunInReverseOrder() {
    scheduler.openScope();
    scheduler.scheduleScopeEnd(insert("a"));
    scheduler.scheduleScopeEnd(insert("b"));
    assertThat(scheduler.pending()).isEqualTo(2);
    assertThat(scheduler.closeScope(buffer)).isEqualTo(2);
    assertThat(buffer.text()).isEqualTo("ba");
    assertThat(scheduler.pending()).isEqualTo(0);
    assertThat(scheduler.fired()).isEqualTo(2);
  }

  @Test
  public void armedActionsBindToNextScope() {
    scheduler.openScope();
    scheduler.armNextScope(insert("x"));
    assertThat(scheduler.pending()).isEqualTo(1);
    scheduler.openScope();
    assertThat(scheduler.depth()).isEqualTo(2);
    // Closing the inner scope runs the armed action; the outer scope has none
    assertThat(scheduler.closeScope(buffer)).isEqualTo(1);
    assertThat(buffer.text()).isEqualTo("x");
    assertThat(scheduler.closeScope(buffer)).isEqualTo(0);
    assertThat(scheduler.depth()).isEqualTo(0);
  }

  @Test
  public void nestedScopes() {
    scheduler.openScope();
    scheduler.scheduleScopeEnd(insert("outer"));
    scheduler.openScope();
    scheduler.scheduleScopeEnd(insert("inner"));
    scheduler.closeScope(buffer);
    assertThat(buffer.text()).isEqualTo("inner");
    scheduler.closeScope(buffer);
    assertThat(buffer.text()).isEqualTo("innerouter");
  }

  @Test
  public void unmatchedClose() {
    assertThat(scheduler.closeScope(buffer)).isEqualTo(0);
    assertThat(buffer.text()).isEmpty();
  }

  @Test
  public void scheduleWithoutScope() {
    assertThrows(IllegalStateException.class, () -> scheduler.scheduleScopeEnd(insert("a")));
  }

  @Test
  public void unclosedScopesArePending() {
    scheduler.armNextScope(insert("a"));
    scheduler.openScope();
    scheduler.openScope();
    scheduler.scheduleScopeEnd(insert("b"));
    scheduler.closeScope(buffer);
    assertThat(scheduler.depth()).isEqualTo(1);
    assertThat(scheduler.pending()).isEqualTo(1);
    assertThat(scheduler.fired()).isEqualTo(1);
  }
}
