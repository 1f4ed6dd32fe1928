/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.tag2acg;

import static net.hydromatic.tag2acg.AcgGeneratorTest.resource;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests the command line. */
public class MainTest {
  @TempDir Path dir;

  /** Runs the tool and returns what it wrote to standard error. */
  private static String run(int expectedStatus, String... args) {
    final StringWriter err = new StringWriter();
    final int status = new Main(ImmutableList.copyOf(args), err).run();
    assertThat(err.toString(), status, is(expectedStatus));
    return err.toString();
  }

  private Path write(String name, String content) throws IOException {
    final Path path = dir.resolve(name);
    Files.write(path, content.getBytes(StandardCharsets.UTF_8));
    return path;
  }

  @Test
  void testUsage() {
    assertThat(run(1), containsString(Main.USAGE));
    assertThat(run(1, "in.json"), containsString(Main.USAGE));
    assertThat(run(1, "a", "b", "c"), containsString(Main.USAGE));
    assertThat(run(1, "--colour=red", "in.json", "out.acg"),
        startsWith("property colour not found\n" + Main.USAGE));
    assertThat(run(1, "--parallel=maybe", "in.json", "out.acg"),
        startsWith("value for property parallel must be 'true' or 'false'"));
    assertThat(run(1, "--parallel", "in.json", "out.acg"),
        startsWith("missing value in option '--parallel'"));
    assertThat(run(1, "--abstractLexicon=", "in.json", "out.acg"),
        startsWith("value for property abstractLexicon must not be empty"));
    assertThat(run(1), containsString("  --variablePrefix=lvar\n"));
  }

  @Test
  void testConvert() throws IOException {
    final Path input = write("sleeps.json", resource("grammars/sleeps.json"));
    final Path output = dir.resolve("sleeps.acg");
    assertThat(run(0, input.toString(), output.toString()), is(""));
    final String text =
        new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
    assertThat(text, is(resource("grammars/sleeps.acg")));
  }

  @Test
  void testConvertWithProperties() throws IOException {
    final Path input = write("sleeps.json", resource("grammars/sleeps.json"));
    final Path output = dir.resolve("sleeps.acg");
    run(0, "--parallel=true", "--fullLexicon=Composed", input.toString(),
        output.toString());
    final String text =
        new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
    assertThat(text, containsString("lexicon Composed = Yield << Abs\n"));
  }

  /** On error, the tool writes a message and no output file. */
  @Test
  void testStructuralError() throws IOException {
    final Path input =
        write("bad.json",
            resource("grammars/sleeps.json").replace("(john)", "(mary)"));
    final Path output = dir.resolve("bad.acg");
    assertThat(run(1, input.toString(), output.toString()),
        is("initials[1]:1.6-1.9 Error: undeclared terminal 'mary'\n"));
    assertThat(Files.exists(output), is(false));
  }

  @Test
  void testReservedTerminal() throws IOException {
    final Path input =
        write("plus.json",
            resource("grammars/sleeps.json")
                .replace("\"soundly\"]", "\"soundly\", \"+\"]"));
    final Path output = dir.resolve("plus.acg");
    assertThat(run(1, input.toString(), output.toString()),
        is("Error: terminal '+' has the name of the concatenation operator\n"));
    assertThat(Files.exists(output), is(false));
  }

  @Test
  void testFormatError() throws IOException {
    final Path input = write("bad.json", "{\"terminals\": []}");
    final Path output = dir.resolve("bad.acg");
    assertThat(run(1, input.toString(), output.toString()),
        is(input + " Error: missing field 'nonterminals'\n"));
    assertThat(Files.exists(output), is(false));
  }

  @Test
  void testMissingInput() {
    final Path input = dir.resolve("missing.json");
    final Path output = dir.resolve("missing.acg");
    assertThat(run(1, input.toString(), output.toString()),
        startsWith("Error: cannot read " + input));
    assertThat(Files.exists(output), is(false));
  }
}

// End MainTest.java
