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
package net.hydromatic.tag2acg.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;

/**
 * Tree-Adjoining Grammar.
 *
 * <p>Elementary trees are numbered when the grammar is created: initial trees
 * first, then auxiliary trees, using a single count, so that the trees of a
 * grammar with two initial trees are "{@code C_TI0}", "{@code C_TI1}",
 * "{@code C_TA2}", and so forth.
 */
public class Grammar {
  public final ImmutableSet<String> terminals;
  public final ImmutableSet<String> nonterminals;
  public final ImmutableList<ElementaryTree> initialTrees;
  public final ImmutableList<ElementaryTree> auxiliaryTrees;
  public final String distinguished;

  private Grammar(
      ImmutableSet<String> terminals,
      ImmutableSet<String> nonterminals,
      ImmutableList<ElementaryTree> initialTrees,
      ImmutableList<ElementaryTree> auxiliaryTrees,
      String distinguished) {
    this.terminals = terminals;
    this.nonterminals = nonterminals;
    this.initialTrees = initialTrees;
    this.auxiliaryTrees = auxiliaryTrees;
    this.distinguished = requireNonNull(distinguished);
  }

  /** Creates a grammar, assigning an identifier to each tree. */
  public static Grammar of(
      Iterable<String> terminals,
      Iterable<String> nonterminals,
      List<Tree> initials,
      List<Tree> auxiliaries,
      String distinguished) {
    final ImmutableList.Builder<ElementaryTree> initialTrees =
        ImmutableList.builder();
    final ImmutableList.Builder<ElementaryTree> auxiliaryTrees =
        ImmutableList.builder();
    int count = 0;
    count = number(initials, ElementaryTree.Kind.INITIAL, count, initialTrees);
    number(auxiliaries, ElementaryTree.Kind.AUXILIARY, count, auxiliaryTrees);
    return new Grammar(
        ImmutableSet.copyOf(terminals),
        ImmutableSet.copyOf(nonterminals),
        initialTrees.build(),
        auxiliaryTrees.build(),
        distinguished);
  }

  /** Numbers a list of trees, starting at {@code count}; returns the next
   * number. */
  private static int number(
      List<Tree> trees,
      ElementaryTree.Kind kind,
      int count,
      ImmutableList.Builder<ElementaryTree> builder) {
    for (Tree tree : trees) {
      builder.add(new ElementaryTree(kind.prefix + count++, kind, tree));
    }
    return count;
  }

  /** Returns all elementary trees, initial trees before auxiliary trees. */
  public ImmutableList<ElementaryTree> trees() {
    return ImmutableList.<ElementaryTree>builder()
        .addAll(initialTrees)
        .addAll(auxiliaryTrees)
        .build();
  }
}

// End Grammar.java
