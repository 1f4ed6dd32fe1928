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
package net.hydromatic.tag2acg.compile;

/** Names of the types and constants of the generated grammar. */
public class Names {
  private Names() {}

  /** Base type of the derived-trees signature. */
  public static final String TREE = "tree";

  /** Base type of the strings signature. */
  public static final String O = "o";

  /** Type of strings, defined as {@code o -> o}. */
  public static final String STRING = "string";

  /** Constant for the empty derived tree. */
  public static final String EMPTY = "Empty";

  /** Constant for the empty string. */
  public static final String EMPTY_STRING = "E";

  /** Infix concatenation operator of the strings signature. */
  public static final String CONCAT = "+";

  /** Returns the substitution type of a nonterminal, e.g. "NP_S". */
  public static String substitution(String nonterminal) {
    return nonterminal + "_S";
  }

  /** Returns the adjunction type of a nonterminal, e.g. "NP_A". */
  public static String adjunction(String nonterminal) {
    return nonterminal + "_A";
  }

  /**
   * Returns the constant that represents "no adjunction" at a node of a
   * nonterminal, e.g. "I_NP".
   */
  public static String identity(String nonterminal) {
    return "I_" + nonterminal;
  }

  /**
   * Returns the derived-tree constructor for nodes of a nonterminal with a
   * given number of children, e.g. "NP_2".
   */
  public static String constructor(String nonterminal, int arity) {
    return nonterminal + "_" + arity;
  }
}

// End Names.java
