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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands every {@code whilst} construct in a compilation unit, in a single forward pass.
 *
 * <p>The pass skips comments and string literals, tracks the scopes opened and closed by braces
 * (so that the ScopeScheduler can fire the closing edit of each construct when its block ends),
 * and hands each installed keyword it finds to the RewriteEngine. Everything else is copied
 * through unchanged. The pass stops early if the dialect finds a marker (such as Perl's
 * {@code __END__}) after which the unit holds no code.
 */
public final class Expander {

  private final Dialect dialect;

  /** The installations in the unit's namespace, keyed by keyword. */
  private final ImmutableMap<String, Installation> keywords;

  private final RewriteEngine engine = new RewriteEngine(this::expandFragment);

  private final List<Invocation> invocations = new ArrayList<>();

  private Expander(Dialect dialect, ImmutableMap<String, Installation> keywords) {
    this.dialect = dialect;
    this.keywords = keywords;
  }

  /**
   * Expands a compilation unit.
   *
   * @param input the unit's source text
   * @param source an identifier for the unit, e.g. a filename; only used to identify the result
   * @param dialect the host language the unit is written in
   * @param registry the keyword bindings; only those for {@code target} are recognized
   * @param target the namespace the unit is compiled into
   * @throws CompileError if a construct is malformed
   */
  public static Expansion expand(
      String input, Object source, Dialect dialect, KeywordRegistry registry, String target) {
    Expander expander = new Expander(dialect, registry.installations(target));
    Pass pass = expander.new Pass(input);
    pass.run();
    return new Expansion(
        source,
        pass.buffer.text(),
        ImmutableList.copyOf(expander.invocations),
        pass.buffer.edits(),
        pass.scheduler.depth(),
        pass.scheduler.pending());
  }

  /**
   * Expands the constructs in a fragment (a construct's condition) with a pass of its own. The
   * fragment is balanced, so all of its scopes close within it.
   */
  private String expandFragment(String fragment) {
    Pass pass = new Pass(fragment);
    pass.run();
    return pass.buffer.text();
  }

  /** The state of one pass over some source text. */
  private final class Pass {
    final SourceBuffer buffer;
    final ScopeScheduler scheduler = new ScopeScheduler();
    final Cursor cursor;

    Pass(String input) {
      this.buffer = new SourceBuffer(input);
      this.cursor = new Cursor(buffer, dialect, scheduler);
    }

    void run() {
      while (!buffer.atEnd()) {
        if (cursor.skipComment() || cursor.skipString()) {
          continue;
        }
        char c = buffer.current();
        if (c == '{') {
          buffer.advance(1);
          scheduler.openScope();
        } else if (c == '}') {
          buffer.advance(1);
          scheduler.closeScope(buffer);
        } else if (dialect.isIdentifierStart(c)) {
          String id = cursor.peekIdentifier();
          int start = buffer.offset();
          Installation installation = keywords.get(id);
          if (dialect.endsCode(buffer, start, id)) {
            buffer.setOffset(buffer.length());
          } else if (installation != null
              && dialect.canStartKeyword(buffer, start)
              && !dialect.isBareword(buffer, start, start + id.length())) {
            invocations.add(engine.rewrite(cursor, installation));
          } else {
            buffer.advance(id.length());
          }
        } else {
          buffer.advance(1);
        }
      }
    }
  }
}
