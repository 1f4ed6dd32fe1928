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

import static org.hamcrest.CoreMatchers.allOf;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.hydromatic.tag2acg.ast.Grammar;
import net.hydromatic.tag2acg.parse.GrammarReader;
import net.hydromatic.tag2acg.parse.TagParseException;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests reading grammars from JSON. */
public class GrammarReaderTest {
  private static final String SLEEPS = "{\n"
      + "  \"terminals\": [\"john\", \"sleeps\", \"soundly\"],\n"
      + "  \"nonterminals\": [\"S\", \"NP\", \"VP\"],\n"
      + "  \"initials\": [\"(S (NP) (VP (sleeps)))\", \"(NP (john))\"],\n"
      + "  \"auxiliaries\": [\"(VP (VP*_NA) (soundly))\"],\n"
      + "  \"distinguished\": \"S\"\n"
      + "}\n";

  private static void assertReadError(String json, Matcher<String> matcher) {
    final TagParseException e =
        assertThrows(TagParseException.class, () -> GrammarReader.read(json));
    assertThat(e.describeTo(new StringBuilder()).toString(), matcher);
  }

  @Test
  void testRead() {
    final Grammar grammar = GrammarReader.read(SLEEPS);
    assertThat(grammar.terminals.toString(), is("[john, sleeps, soundly]"));
    assertThat(grammar.nonterminals.toString(), is("[S, NP, VP]"));
    assertThat(grammar.distinguished, is("S"));
    assertThat(grammar.initialTrees.size(), is(2));
    assertThat(grammar.auxiliaryTrees.size(), is(1));
    assertThat(grammar.trees().toString(),
        is("[C_TI0 = S (NP) (VP (sleeps)), C_TI1 = NP (john), "
            + "C_TA2 = VP (VP*_NA) (soundly)]"));
  }

  @Test
  void testReadFile(@TempDir Path dir) throws IOException {
    final Path path = dir.resolve("sleeps.json");
    Files.write(path, SLEEPS.getBytes(StandardCharsets.UTF_8));
    final Grammar grammar = GrammarReader.read(path);
    assertThat(grammar.trees().size(), is(3));

    final Path bad = dir.resolve("bad.json");
    Files.write(bad, "{}".getBytes(StandardCharsets.UTF_8));
    final TagParseException e =
        assertThrows(TagParseException.class, () -> GrammarReader.read(bad));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is(bad + " Error: missing field 'terminals'"));
  }

  @Test
  void testFieldErrors() {
    assertReadError(
        SLEEPS.replace("  \"distinguished\": \"S\"\n", "  \"x\": 1\n"),
        is("Error: missing field 'distinguished'"));
    assertReadError(
        SLEEPS.replace("\"S\"\n", "1\n"),
        is("Error: field 'distinguished' must be a string"));
    assertReadError(
        SLEEPS.replace("[\"john\", \"sleeps\", \"soundly\"]", "\"john\""),
        is("Error: field 'terminals' must be an array of strings"));
    assertReadError(
        SLEEPS.replace("[\"john\", \"sleeps\", \"soundly\"]", "[\"john\", 1]"),
        is("Error: element 1 of 'terminals' must be a string"));
    assertReadError(
        SLEEPS.replace("[\"S\", \"NP\", \"VP\"]", "[\"S\", \"NP\", \"S\"]"),
        is("Error: duplicate symbol 'S' in 'nonterminals'"));
  }

  @Test
  void testRecordErrors() {
    assertReadError("[]", is("Error: grammar record must be a JSON object"));
    assertReadError("", is("Error: empty grammar record"));
    // Malformed JSON; the position and message come from the JSON parser
    assertReadError("{\"terminals\": [",
        allOf(startsWith("1."), containsString(" Error: ")));
  }

  /** Errors in tree descriptions are located by field and index. */
  @Test
  void testTreeError() {
    assertReadError(
        SLEEPS.replace("(NP (john))", "(NP (john)"),
        is("initials[1]:1.1-1.10 Error: "
            + "unbalanced parentheses: missing ')'"));
  }
}

// End GrammarReaderTest.java
