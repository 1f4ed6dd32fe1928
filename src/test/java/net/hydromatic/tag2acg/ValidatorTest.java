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
import static org.hamcrest.CoreMatchers.is;

import net.hydromatic.tag2acg.compile.Prop;
import org.junit.jupiter.api.Test;

/** Tests the structural checks that run before generation. */
public class ValidatorTest {
  @Test
  void testValid() {
    sleeps().assertTypes("C_TI0: S_A -> VP_A -> NP_S -> S_S",
        "C_TI1: NP_A -> NP_S",
        "C_TA2: VP_A -> VP_A");
  }

  @Test
  void testDeclarations() {
    sleeps()
        .withTerminals("John", "sleeps", "soundly")
        .assertCompileError(
            is("Error: terminal 'John' starts with an uppercase letter, "
                + "so it would be read as a nonterminal"));
    sleeps()
        .withNonterminals("S", "np", "VP")
        .assertCompileError(
            is("Error: nonterminal 'np' does not start with an uppercase "
                + "letter, so it would be read as a terminal"));
    sleeps()
        .withNonterminals("S", "NP", "VP", "john")
        .assertCompileError(
            is("Error: symbol 'john' is declared as both terminal and "
                + "nonterminal"));
    sleeps()
        .withDistinguished("X")
        .assertCompileError(
            is("Error: distinguished symbol 'X' is not a declared "
                + "nonterminal"));
    sleeps()
        .withDistinguished("john")
        .assertCompileError(
            is("Error: distinguished symbol 'john' is not a declared "
                + "nonterminal"));
  }

  @Test
  void testUndeclaredSymbol() {
    sleeps()
        .withInitial("S (NP) (VP (snores))")
        .assertCompileError(
            is("initials[2]:1.13-1.18 Error: undeclared terminal 'snores'"));
    sleeps()
        .withAuxiliary("VP (ADV (soundly)) (VP*)")
        .assertCompileError(
            is("auxiliaries[1]:1.5-1.7 Error: undeclared nonterminal 'ADV'"));
  }

  @Test
  void testRoot() {
    tag()
        .withTerminals("john")
        .withNonterminals("S")
        .withInitial("john")
        .assertCompileError(
            is("initials[0]:1.1-1.4 Error: "
                + "root of tree C_TI0 must be a nonterminal"));
    sleeps()
        .withAuxiliary("VP*")
        .assertCompileError(
            is("auxiliaries[1]:1.1-1.3 Error: "
                + "root of tree C_TA3 must not be a footnode"));
  }

  @Test
  void testChildren() {
    sleeps()
        .withInitial("S (john (NP))")
        .assertCompileError(
            is("initials[2]:1.4-1.7 Error: "
                + "terminal 'john' must not have children"));
    sleeps()
        .withAuxiliary("VP (VP* (sleeps))")
        .assertCompileError(
            is("auxiliaries[1]:1.5-1.7 Error: "
                + "footnode 'VP' must not have children"));
  }

  @Test
  void testFootnodes() {
    sleeps()
        .withInitial("S (NP) (VP*)")
        .assertCompileError(
            is("initials[2]:1.9-1.11 Error: "
                + "initial tree C_TI2 must not have a footnode"));
    sleeps()
        .withAuxiliary("VP (VP) (soundly)")
        .assertCompileError(
            is("auxiliaries[1]:1.1-1.2 Error: "
                + "auxiliary tree C_TA3 must have a footnode"));
    sleeps()
        .withAuxiliary("VP (VP*) (VP*_NA)")
        .assertCompileError(
            is("auxiliaries[1]:1.11-1.16 Error: footnodes of auxiliary tree "
                + "C_TA3 disagree on whether they are nonadjoining"));
  }

  /** A terminal must not be captured by a variable that a term binds. */
  @Test
  void testVariableNames() {
    sleeps()
        .withTerminals("john", "sleeps", "soundly", "lvar0")
        .withInitial("NP (lvar0)")
        .assertCompileError(
            is("initials[2]:1.5-1.9 Error: terminal 'lvar0' has the name of "
                + "a bound variable; choose another variable prefix"));
    sleeps()
        .withTerminals("john", "sleeps", "soundly", "lvar")
        .withAuxiliary("VP (VP*) (lvar)")
        .assertCompileError(
            is("auxiliaries[1]:1.11-1.14 Error: terminal 'lvar' has the name "
                + "of a bound variable; choose another variable prefix"));
    sleeps()
        .with(Prop.VARIABLE_PREFIX, "soundly")
        .assertCompileError(
            is("auxiliaries[0]:1.15-1.21 Error: terminal 'soundly' has the "
                + "name of a bound variable; choose another variable prefix"));

    // Declared but unused, or the prefix followed by letters: no capture
    sleeps()
        .withTerminals("john", "sleeps", "soundly", "lvar1")
        .assertTypes("C_TI0: S_A -> VP_A -> NP_S -> S_S",
            "C_TI1: NP_A -> NP_S",
            "C_TA2: VP_A -> VP_A");
    sleeps()
        .with(Prop.VARIABLE_PREFIX, "sleep")
        .assertTerms("C_TI0 := lambda sleep0 sleep2 sleep1. "
                + "sleep0 (S_2 (sleep1) (sleep2 (VP_1 (sleeps))))",
            "C_TI1 := lambda sleep0. sleep0 (NP_1 (john))",
            "C_TA2 := lambda sleep0 sleep. sleep0 (VP_2 (sleep) (soundly))");
  }

  /** A terminal must not clash with a constant of the strings signature. */
  @Test
  void testReservedNames() {
    sleeps()
        .withTerminals("john", "sleeps", "soundly", "+")
        .assertCompileError(
            is("Error: terminal '+' has the name of the concatenation "
                + "operator"));
  }

  /** Footnodes that agree are allowed, whether or not they are
   * adjoinable. */
  @Test
  void testSeveralFootnodes() {
    sleeps()
        .withAuxiliary("VP (VP*) (VP*)")
        .assertTypes("C_TI0: S_A -> VP_A -> NP_S -> S_S",
            "C_TI1: NP_A -> NP_S",
            "C_TA2: VP_A -> VP_A",
            "C_TA3: VP_A -> VP_A -> VP_A");
    sleeps()
        .withAuxiliary("VP (VP*_NA) (VP*_NA)")
        .assertTerms("C_TI0 := lambda lvar0 lvar2 lvar1. "
                + "lvar0 (S_2 (lvar1) (lvar2 (VP_1 (sleeps))))",
            "C_TI1 := lambda lvar0. lvar0 (NP_1 (john))",
            "C_TA2 := lambda lvar0 lvar. lvar0 (VP_2 (lvar) (soundly))",
            "C_TA3 := lambda lvar0 lvar. lvar0 (VP_2 (lvar) (lvar))");
  }
}

// End ValidatorTest.java
