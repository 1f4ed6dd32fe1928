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
import net.hydromatic.tag2acg.ast.ElementaryTree;
import net.hydromatic.tag2acg.ast.Tree;
import net.hydromatic.tag2acg.type.AtomType;
import net.hydromatic.tag2acg.type.Type;
import net.hydromatic.tag2acg.type.TypeSystem;

/**
 * Infers the type of an elementary tree in the derivation-trees signature.
 *
 * <p>Each adjunction site (an interior nonterminal node that is neither a
 * footnode nor nonadjoining) contributes an argument of type
 * "{@code X_A}"; each substitution site (such a node that is a leaf)
 * contributes "{@code X_S}". All adjunction sites come before all
 * substitution sites, each group in depth-first order.
 *
 * <p>The result type is "{@code R_S}" for an initial tree with root
 * {@code R}; for an auxiliary tree, "{@code R_A}" if its footnode is
 * nonadjoining, otherwise "{@code R_A -> R_A}".
 */
public class TypeInferrer {
  private final TypeSystem typeSystem;

  public TypeInferrer(TypeSystem typeSystem) {
    this.typeSystem = requireNonNull(typeSystem);
  }

  /** Infers the type of an elementary tree. */
  public TreeType infer(ElementaryTree elementaryTree) {
    return infer(elementaryTree.tree, elementaryTree.isInitial());
  }

  /** Infers the type of a tree. */
  public TreeType infer(Tree tree, boolean initial) {
    final ImmutableList.Builder<Type> adjunctionTypes = ImmutableList.builder();
    final ImmutableList.Builder<Type> substitutionTypes =
        ImmutableList.builder();
    final boolean footNonadjoining =
        collect(tree, adjunctionTypes, substitutionTypes);

    final String root = tree.root();
    final Type resultType;
    if (initial) {
      resultType = typeSystem.atom(Names.substitution(root));
    } else {
      final AtomType rootAdjunction = typeSystem.atom(Names.adjunction(root));
      resultType = footNonadjoining
          ? rootAdjunction
          : typeSystem.fnType(rootAdjunction, rootAdjunction);
    }
    return new TreeType(
        ImmutableList.<Type>builder()
            .addAll(adjunctionTypes.build())
            .addAll(substitutionTypes.build())
            .build(),
        resultType);
  }

  /**
   * Adds the site types of a node and its descendants, in depth-first order,
   * and returns whether any of them is a nonadjoining footnode.
   */
  private boolean collect(
      Tree node,
      ImmutableList.Builder<Type> adjunctionTypes,
      ImmutableList.Builder<Type> substitutionTypes) {
    switch (node.siteKind()) {
      case ADJUNCTION:
        adjunctionTypes.add(typeSystem.atom(Names.adjunction(node.root())));
        break;
      case SUBSTITUTION:
        substitutionTypes.add(typeSystem.atom(Names.substitution(node.root())));
        break;
      default:
        break;
    }
    boolean footNonadjoining = node.footnode && node.nonadjoining;
    for (Tree child : node.children) {
      footNonadjoining |= collect(child, adjunctionTypes, substitutionTypes);
    }
    return footNonadjoining;
  }
}

// End TypeInferrer.java
