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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.whilst.rewrite.Expansion;
import org.whilst.rewrite.JavaScriptDialect;
import org.whilst.rewrite.PerlDialect;

@RunWith(JUnit4.class)
public class ExpandTest {

  @Rule public final TemporaryFolder tempFolder = new TemporaryFolder();

  @After
  public void clearProperties() {
    System.clearProperty("dialect");
    System.clearProperty("keyword");
  }

  private Path write(String name, String contents) throws IOException {
    File file = tempFolder.newFile(name);
    Files.writeString(file.toPath(), contents, UTF_8);
    return file.toPath();
  }

  @Test
  public void dialectFromFileName() {
    assertThat(Expand.dialectFor(Path.of("a.js"))).isSameInstanceAs(JavaScriptDialect.INSTANCE);
    assertThat(Expand.dialectFor(Path.of("a.pl"))).isSameInstanceAs(PerlDialect.INSTANCE);
    assertThat(Expand.dialectFor(Path.of("script"))).isSameInstanceAs(PerlDialect.INSTANCE);
  }

  @Test
  public void dialectFromProperty() {
    System.setProperty("dialect", "js");
    assertThat(Expand.dialectFor(Path.of("a.pl"))).isSameInstanceAs(JavaScriptDialect.INSTANCE);
  }

  @Test
  public void expandFile() throws IOException {
    Path file = write("count.pl", "my $n = () = whilst ($i--) { $i };\n");
    Expansion expansion = Expand.expandFile(file, PerlDialect.INSTANCE);
    assertThat(expansion).isNotNull();
    assertThat(expansion.source()).isEqualTo("count.pl");
    assertThat(expansion.invocations()).hasSize(1);
    assertThat(expansion.text()).contains("while ($i--) { push @__whilst_lex_");
  }

  @Test
  public void expandFileWithKeyword() throws IOException {
    System.setProperty("keyword", "collect");
    Path file = write("collect.pl", "collect ($i--) { $i } whilst;\n");
    Expansion expansion = Expand.expandFile(file, PerlDialect.INSTANCE);
    assertThat(expansion.invocations()).hasSize(1);
    assertThat(expansion.invocations().get(0).keyword()).isEqualTo("collect");
    assertThat(expansion.text()).endsWith(" whilst;\n");
  }

  @Test
  public void expandFileWithError() throws IOException {
    Path file = write("bad.pl", "whilst { 1 }\n");
    assertThat(Expand.expandFile(file, PerlDialect.INSTANCE)).isNull();
  }
}
