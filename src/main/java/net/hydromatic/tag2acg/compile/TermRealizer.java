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
import static net.hydromatic.tag2acg.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.tag2acg.ast.ElementaryTree;
import net.hydromatic.tag2acg.ast.Term;
import net.hydromatic.tag2acg.ast.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds the lambda term that an elementary tree maps to in the abstract
 * lexicon.
 *
 * <p>The term abstracts over one variable per site, in the same order as the
 * arguments of the type inferred by {@link TypeInferrer}, and its body
 * rebuilds the tree with the constructors found by {@link BranchingAnalyzer}.
 * For example, the initial tree "{@code S (NP) (VP (sleeps))}" becomes
 *
 * <blockquote>
 *
 * <pre>lambda lvar0 lvar2 lvar1.
 *   lvar0 (S_2 (lvar1) (lvar2 (VP_1 (sleeps))))</pre>
 *
 * </blockquote>
 *
 * <p>where {@code lvar0} and {@code lvar2} are what is adjoined at the
 * {@code S} and {@code VP} nodes, and {@code lvar1} is the tree substituted
 * at the {@code NP} leaf.
 *
 * <p>An auxiliary tree also binds the foot binder {@code lvar}, the tree that
 * is threaded through its footnode. If the footnode may itself be adjoined
 * into, the variable of the footnode is bound just before the foot binder.
 */
public class TermRealizer {
  private final String prefix;

  /**
   * Creates a TermRealizer.
   *
   * @param prefix Prefix of variable names; also the name of the foot binder
   */
  public TermRealizer(String prefix) {
    this.prefix = requireNonNull(prefix);
  }

  /** Builds the term of an elementary tree. */
  public Term realize(ElementaryTree elementaryTree) {
    return realize(elementaryTree.tree, elementaryTree.isInitial());
  }

  /** Builds the term of a tree. */
  public Term realize(Tree tree, boolean initial) {
    // A new generator for each tree, so that its variables start at 0.
    final Realization realization = new Realization(new NameGenerator(prefix));
    realization.assign(tree);

    final ImmutableList.Builder<String> params = ImmutableList.builder();
    params.addAll(realization.interiorVars.build());
    params.addAll(realization.substitutionVars.build());
    if (!initial) {
      if (realization.footVar != null) {
        params.add(realization.footVar);
      }
      params.add(realization.names.reserved());
    }
    final List<String> paramList = params.build();
    final Term body = realization.construct(tree);
    return paramList.isEmpty() ? body : Term.lambda(paramList, body);
  }

  /** State of the realization of one tree. */
  private static class Realization {
    final NameGenerator names;
    final Map<Tree, String> varNames = new IdentityHashMap<>();
    final ImmutableList.Builder<String> interiorVars = ImmutableList.builder();
    final ImmutableList.Builder<String> substitutionVars =
        ImmutableList.builder();
    @Nullable String footVar;

    Realization(NameGenerator names) {
      this.names = names;
    }

    /** Names every nonterminal node, in depth-first order. */
    void assign(Tree node) {
      if (node.symbol.isNonterminal()) {
        final String name = names.get();
        varNames.put(node, name);
        switch (node.siteKind()) {
          case ADJUNCTION:
            interiorVars.add(name);
            break;
          case SUBSTITUTION:
            substitutionVars.add(name);
            break;
          default:
            if (node.footnode && !node.nonadjoining && footVar == null) {
              footVar = name;
            }
            break;
        }
      }
      for (Tree child : node.children) {
        assign(child);
      }
    }

    /** Builds the term that rebuilds a node. */
    Term construct(Tree node) {
      if (node.symbol.isTerminal()) {
        return Term.constant(node.root());
      }
      final Term footBinder = Term.var(names.reserved());
      if (node.footnode) {
        return node.nonadjoining
            ? footBinder
            : Term.apply(Term.var(requireNonNull(footVar)), footBinder);
      }
      if (node.isLeaf()) {
        return node.nonadjoining
            ? Term.constant(Names.EMPTY)
            : Term.var(varName(node));
      }
      final String constructor =
          Names.constructor(node.root(), node.children.size());
      final Term subtree =
          Term.apply(
              Term.constant(constructor),
              transformEager(node.children, this::construct));
      return node.nonadjoining
          ? subtree
          : Term.apply(Term.var(varName(node)), subtree);
    }

    private String varName(Tree node) {
      return requireNonNull(varNames.get(node), "variable");
    }
  }
}

// End TermRealizer.java
