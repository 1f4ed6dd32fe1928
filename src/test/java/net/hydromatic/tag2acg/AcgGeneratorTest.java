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

import static net.hydromatic.tag2acg.Tag.sleeps;
import static net.hydromatic.tag2acg.Tag.tag;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.io.Resources;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tag2acg.acg.Acg;
import net.hydromatic.tag2acg.acg.BasicLexicon;
import net.hydromatic.tag2acg.acg.ComposedLexicon;
import net.hydromatic.tag2acg.acg.Lexicon;
import net.hydromatic.tag2acg.acg.Signature;
import net.hydromatic.tag2acg.ast.Grammar;
import net.hydromatic.tag2acg.compile.AcgGenerator;
import net.hydromatic.tag2acg.compile.Prop;
import net.hydromatic.tag2acg.compile.Tracer;
import net.hydromatic.tag2acg.compile.Tracers;
import net.hydromatic.tag2acg.parse.GrammarReader;
import net.hydromatic.tag2acg.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests generation of whole grammars. */
public class AcgGeneratorTest {
  static String resource(String name) throws IOException {
    return Resources.toString(Resources.getResource(name),
        StandardCharsets.UTF_8);
  }

  /** Compares the output for a small grammar with a reference file. */
  @Test
  void testSleeps() throws IOException {
    final String expected = resource("grammars/sleeps.acg");
    sleeps().assertAcg(is(expected));

    // Same grammar, read from JSON
    final Grammar grammar =
        GrammarReader.read(resource("grammars/sleeps.json"));
    final Acg acg = new AcgGenerator().generate(grammar);
    assertThat(acg.toString(), is(expected));
  }

  @Test
  void testIdempotent() {
    final Tag tag = sleeps();
    assertThat(tag.text(), is(tag.text()));
    final Grammar grammar = tag.grammar();
    final AcgGenerator generator = new AcgGenerator();
    assertThat(generator.generate(grammar).toString(),
        is(generator.generate(grammar).toString()));
  }

  /** Builds a grammar with many trees, and checks that generating in
   * parallel gives the same text as generating sequentially. */
  @Test
  void testParallel() {
    Tag tag =
        tag()
            .withTerminals("john", "sleeps", "soundly", "very")
            .withNonterminals("S", "NP", "VP", "ADV");
    for (int i = 0; i < 50; i++) {
      tag = tag.withInitial("S (NP) (VP (sleeps))")
          .withInitial("NP (john)")
          .withAuxiliary("VP (VP*_NA) (ADV (soundly))")
          .withAuxiliary("ADV (ADV (very)) (ADV*)");
    }
    final String sequential = tag.with(Prop.PARALLEL, false).text();
    final String parallel = tag.with(Prop.PARALLEL, true).text();
    assertThat(parallel, is(sequential));
    assertThat(sequential,
        containsString("    C_TA199: ADV_A -> ADV_A -> ADV_A -> ADV_A;\n"));
  }

  @Test
  void testStructure() {
    sleeps()
        .withAcg(
            acg -> {
              assertThat(acg.signatures.size(), is(3));
              assertThat(acg.lexicons.size(), is(3));
              final Signature derivation = acg.signatures.get(0);
              assertThat(derivation.name, is("Derivation_trees"));
              assertThat(derivation.types.size(), is(6));
              assertThat(derivation.constants.size(), is(6));

              final Lexicon abs = acg.lexicon("Abs");
              assertThat(abs, instanceOf(BasicLexicon.class));
              assertThat(abs.source(), is("Derivation_trees"));
              assertThat(abs.target(), is("Derived_trees"));
              final BasicLexicon.Mapping mapping =
                  ((BasicLexicon) abs).mapping("NP_A");
              assertThat(mapping.type.toString(), is("tree -> tree"));

              final Lexicon full = acg.lexicon("Full");
              assertThat(full, instanceOf(ComposedLexicon.class));
              assertThat(full.source(), is("Derivation_trees"));
              assertThat(full.target(), is("Strings"));
              assertThat(full.toString(),
                  is("lexicon Full = Yield << Abs\n\n"));
            });
  }

  @Test
  void testNames() {
    final String text =
        sleeps()
            .with(Prop.DERIVATION_SIGNATURE, "Derivations")
            .with(Prop.DERIVED_SIGNATURE, "Trees")
            .with(Prop.STRING_SIGNATURE, "Words")
            .with(Prop.ABSTRACT_LEXICON, "TreeLex")
            .with(Prop.YIELD_LEXICON, "WordLex")
            .with(Prop.FULL_LEXICON, "All")
            .text();
    assertThat(text, containsString("signature Derivations = \n"));
    assertThat(text, containsString("signature Trees = \n"));
    assertThat(text, containsString("signature Words = \n"));
    assertThat(text,
        containsString("lexicon TreeLex(Derivations): Trees = \n"));
    assertThat(text, containsString("lexicon WordLex(Trees): Words = \n"));
    assertThat(text, containsString("lexicon All = WordLex << TreeLex\n"));
  }

  @Test
  void testVariablePrefix() {
    final String text = sleeps().with(Prop.VARIABLE_PREFIX, "x").text();
    assertThat(text,
        containsString("    C_TA2 := lambda x0 x. x0 (VP_2 (x) (soundly));\n"));
    assertThat(text, containsString("    I_VP := lambda x. x;\n"));
  }

  @Test
  void testTracer() {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnSignature(tracer, s -> events.add(s.name));
    tracer = Tracers.withOnLexicon(tracer, l -> events.add(l.name));
    sleeps().generate(tracer);
    assertThat(events.toString(),
        is("[Derivation_trees, Derived_trees, Strings, Abs, Yield, Full]"));
  }

  @Test
  void testEmptyGrammar() {
    // No trees at all: the signatures still have their fixed parts.
    final String text = tag().withNonterminals("S").text();
    assertThat(text, containsString("    I_S: S_A;\n"));
    assertThat(text, containsString("    Empty: tree;\n"));
    assertThat(text, containsString("    Empty := E;\n"));
  }

  @Test
  void testComposeMismatch() {
    final TypeSystem typeSystem = new TypeSystem();
    final BasicLexicon a =
        BasicLexicon.builder("A", "X", "Y")
            .mapType("x", typeSystem.atom("y"))
            .build();
    final BasicLexicon b = BasicLexicon.builder("B", "Z", "W").build();
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> new ComposedLexicon("C", a, b));
    assertThat(e.getMessage(),
        is("cannot compose B after A: target Y is not source Z"));
  }

  @Test
  void testProp() {
    assertThat(Prop.lookup("parallel"), is(Prop.PARALLEL));
    assertThat(Prop.lookup("VARIABLE_PREFIX"), is(Prop.VARIABLE_PREFIX));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.ABSTRACT_LEXICON));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("colour"));
    assertThat(e.getMessage(), is("property colour not found"));
  }
}

// End AcgGeneratorTest.java
