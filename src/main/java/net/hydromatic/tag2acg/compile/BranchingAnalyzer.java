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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.tag2acg.ast.ElementaryTree;
import net.hydromatic.tag2acg.ast.Grammar;
import net.hydromatic.tag2acg.ast.Tree;

/**
 * Computes the maximum branching of each nonterminal, and from it the tree
 * constructors of the derived-trees signature.
 *
 * <p>A nonterminal whose nodes have at most {@code n} children needs
 * constructors of arity 1 through {@code n}. There is one constructor per
 * arity, not one per node, so the signature grows with the shape of the
 * grammar rather than its size.
 */
public class BranchingAnalyzer {
  private BranchingAnalyzer() {}

  /**
   * Returns the maximum number of children of any node of each nonterminal,
   * over all initial and auxiliary trees. Keys are the grammar's
   * nonterminals, in declaration order; a nonterminal that has no node with
   * children maps to 0.
   */
  public static ImmutableMap<String, Integer> maxBranching(Grammar grammar) {
    final Map<String, Integer> branching = new LinkedHashMap<>();
    for (String nonterminal : grammar.nonterminals) {
      branching.put(nonterminal, 0);
    }
    for (ElementaryTree elementaryTree : grammar.trees()) {
      visit(elementaryTree.tree, branching);
    }
    return ImmutableMap.copyOf(branching);
  }

  private static void visit(Tree tree, Map<String, Integer> branching) {
    if (!tree.symbol.isNonterminal()) {
      return;
    }
    branching.merge(tree.root(), tree.children.size(), Math::max);
    for (Tree child : tree.children) {
      visit(child, branching);
    }
  }

  /**
   * Returns the constructors needed for a branching table: for each
   * nonterminal in order, one constructor for each arity from 1 to its
   * maximum branching.
   */
  public static ImmutableList<Constructor> constructors(
      Map<String, Integer> branching) {
    final ImmutableList.Builder<Constructor> constructors =
        ImmutableList.builder();
    branching.forEach(
        (nonterminal, max) -> {
          for (int arity = 1; arity <= max; arity++) {
            constructors.add(new Constructor(nonterminal, arity));
          }
        });
    return constructors.build();
  }

  /** Constructor of derived trees, such as "{@code NP_2}". */
  public static class Constructor {
    public final String nonterminal;
    public final int arity;
    public final String name;

    Constructor(String nonterminal, int arity) {
      this.nonterminal = requireNonNull(nonterminal);
      this.arity = arity;
      this.name = Names.constructor(nonterminal, arity);
    }

    @Override
    public String toString() {
      return name;
    }
  }
}

// End BranchingAnalyzer.java
