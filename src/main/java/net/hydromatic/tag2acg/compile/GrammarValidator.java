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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tag2acg.ast.ElementaryTree;
import net.hydromatic.tag2acg.ast.Grammar;
import net.hydromatic.tag2acg.ast.Pos;
import net.hydromatic.tag2acg.ast.Symbol;
import net.hydromatic.tag2acg.ast.Tree;

/**
 * Checks that a grammar satisfies the assumptions of type inference and term
 * realization.
 *
 * <p>The checks are structural only; a grammar that passes them may still be
 * linguistically odd.
 */
public class GrammarValidator {
  private final Grammar grammar;
  private final String variablePrefix;

  private GrammarValidator(Grammar grammar, String variablePrefix) {
    this.grammar = grammar;
    this.variablePrefix = variablePrefix;
  }

  /**
   * Validates a grammar.
   *
   * @param grammar Grammar
   * @param variablePrefix Prefix of the variables that terms will bind; a
   *     terminal must not have the name of such a variable
   * @throws CompileException if the grammar is not valid
   */
  public static void validate(Grammar grammar, String variablePrefix) {
    new GrammarValidator(grammar, variablePrefix).validate();
  }

  private void validate() {
    final Pos pos = Pos.ZERO;
    for (String terminal : grammar.terminals) {
      if (Symbol.kindOf(terminal) != Symbol.Kind.TERMINAL) {
        throw new CompileException("terminal '" + terminal
            + "' starts with an uppercase letter, so it would be read as a "
            + "nonterminal", pos);
      }
      if (grammar.nonterminals.contains(terminal)) {
        throw new CompileException("symbol '" + terminal
            + "' is declared as both terminal and nonterminal", pos);
      }
      if (terminal.equals(Names.CONCAT)) {
        throw new CompileException("terminal '" + terminal
            + "' has the name of the concatenation operator", pos);
      }
    }
    for (String nonterminal : grammar.nonterminals) {
      if (Symbol.kindOf(nonterminal) != Symbol.Kind.NONTERMINAL) {
        throw new CompileException("nonterminal '" + nonterminal
            + "' does not start with an uppercase letter, so it would be read "
            + "as a terminal", pos);
      }
    }
    if (!grammar.nonterminals.contains(grammar.distinguished)) {
      throw new CompileException("distinguished symbol '"
          + grammar.distinguished + "' is not a declared nonterminal", pos);
    }
    for (ElementaryTree elementaryTree : grammar.trees()) {
      validate(elementaryTree);
    }
  }

  private void validate(ElementaryTree elementaryTree) {
    final Tree tree = elementaryTree.tree;
    if (!tree.symbol.isNonterminal()) {
      throw new CompileException("root of tree " + elementaryTree.id
          + " must be a nonterminal", tree.pos);
    }
    if (tree.footnode) {
      throw new CompileException("root of tree " + elementaryTree.id
          + " must not be a footnode", tree.pos);
    }
    final List<Tree> footnodes = new ArrayList<>();
    tree.forEachNode(node -> validateNode(node, footnodes));
    if (elementaryTree.isInitial()) {
      if (!footnodes.isEmpty()) {
        throw new CompileException("initial tree " + elementaryTree.id
            + " must not have a footnode", footnodes.get(0).pos);
      }
    } else {
      if (footnodes.isEmpty()) {
        throw new CompileException("auxiliary tree " + elementaryTree.id
            + " must have a footnode", tree.pos);
      }
      final boolean nonadjoining = footnodes.get(0).nonadjoining;
      for (Tree footnode : footnodes) {
        if (footnode.nonadjoining != nonadjoining) {
          throw new CompileException("footnodes of auxiliary tree "
              + elementaryTree.id + " disagree on whether they are "
              + "nonadjoining", footnode.pos);
        }
      }
    }
  }

  private void validateNode(Tree node, List<Tree> footnodes) {
    final Symbol symbol = node.symbol;
    final boolean declared = symbol.isNonterminal()
        ? grammar.nonterminals.contains(symbol.name)
        : grammar.terminals.contains(symbol.name);
    if (!declared) {
      // Declared symbols have been checked against their kind, so a symbol
      // declared with the other kind is also caught here.
      throw new CompileException("undeclared " + symbol.kind.description()
          + " '" + symbol + "'", node.pos);
    }
    if (symbol.isTerminal() && isVariable(symbol.name)) {
      throw new CompileException("terminal '" + symbol
          + "' has the name of a bound variable; choose another "
          + "variable prefix", node.pos);
    }
    if (symbol.isTerminal() && !node.isLeaf()) {
      throw new CompileException("terminal '" + symbol
          + "' must not have children", node.pos);
    }
    if (node.footnode) {
      if (!node.isLeaf()) {
        throw new CompileException("footnode '" + symbol
            + "' must not have children", node.pos);
      }
      footnodes.add(node);
    }
  }

  /** Returns whether a name is the prefix, or the prefix and digits. */
  private boolean isVariable(String name) {
    if (!name.startsWith(variablePrefix)) {
      return false;
    }
    for (int i = variablePrefix.length(); i < name.length(); i++) {
      if (!Character.isDigit(name.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}

// End GrammarValidator.java
