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
import java.util.List;
import java.util.function.Consumer;

/**
 * Node of an elementary tree.
 *
 * <p>Trees are immutable. Analyses that need to attach information to nodes
 * (such as variable names) keep it in a side table keyed by node identity.
 */
public class Tree {
  /** Suffix that marks a footnode in the tree notation. */
  public static final String FOOT_MARKER = "*";

  /** Suffix that marks a nonadjoining node in the tree notation. */
  public static final String NA_MARKER = "_NA";

  public final Symbol symbol;
  public final ImmutableList<Tree> children;
  public final boolean footnode;
  public final boolean nonadjoining;
  public final Pos pos;

  /** Creates a Tree. */
  public Tree(
      Symbol symbol,
      List<Tree> children,
      boolean footnode,
      boolean nonadjoining,
      Pos pos) {
    this.symbol = requireNonNull(symbol);
    this.children = ImmutableList.copyOf(children);
    this.footnode = footnode;
    this.nonadjoining = nonadjoining;
    this.pos = requireNonNull(pos);
  }

  /** Creates a leaf without markers. */
  public static Tree leaf(String name) {
    return new Tree(
        Symbol.of(name), ImmutableList.of(), false, false, Pos.ZERO);
  }

  /** Creates a node without markers. */
  public static Tree node(String name, Tree... children) {
    return new Tree(
        Symbol.of(name),
        ImmutableList.copyOf(children),
        false,
        false,
        Pos.ZERO);
  }

  /** Returns the name of this node's symbol, without markers. */
  public String root() {
    return symbol.name;
  }

  public boolean isLeaf() {
    return children.isEmpty();
  }

  /**
   * Returns what this node contributes to the combinatorial behavior of its
   * tree.
   *
   * <p>A nonterminal that is neither a footnode nor nonadjoining is a site:
   * an adjunction site if it has children, a substitution site otherwise.
   */
  public SiteKind siteKind() {
    if (!symbol.isNonterminal() || footnode || nonadjoining) {
      return SiteKind.NONE;
    }
    return isLeaf() ? SiteKind.SUBSTITUTION : SiteKind.ADJUNCTION;
  }

  /** Calls an action for this node and its descendants, in pre-order. */
  public void forEachNode(Consumer<Tree> action) {
    action.accept(this);
    for (Tree child : children) {
      child.forEachNode(action);
    }
  }

  /**
   * Unparses this tree in the notation it was parsed from, e.g. "{@code S
   * (NP) (VP (sleeps))}".
   */
  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /** Appends the unparsed tree to a buffer. */
  public StringBuilder unparse(StringBuilder buf) {
    buf.append(symbol.name);
    if (footnode) {
      buf.append(FOOT_MARKER);
    }
    if (nonadjoining) {
      buf.append(NA_MARKER);
    }
    for (Tree child : children) {
      buf.append(" (");
      child.unparse(buf);
      buf.append(')');
    }
    return buf;
  }

  /** Role of a node in the type and term of its tree. */
  public enum SiteKind {
    /** Interior node where an auxiliary tree may adjoin. */
    ADJUNCTION,
    /** Leaf where an initial tree is substituted. */
    SUBSTITUTION,
    /** Terminal, footnode, or nonadjoining node. */
    NONE
  }
}

// End Tree.java
