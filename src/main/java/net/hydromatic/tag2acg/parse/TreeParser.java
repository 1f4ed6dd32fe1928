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
package net.hydromatic.tag2acg.parse;

import static net.hydromatic.tag2acg.ast.Tree.FOOT_MARKER;
import static net.hydromatic.tag2acg.ast.Tree.NA_MARKER;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tag2acg.ast.Pos;
import net.hydromatic.tag2acg.ast.Symbol;
import net.hydromatic.tag2acg.ast.Tree;

/**
 * Parser for the parenthesized tree notation.
 *
 * <p>A list "{@code (S (NP) (VP (sleeps)))}" is a node whose symbol is the
 * first element and whose children are the remaining elements; a symbol on
 * its own, or alone in a list, is a leaf. The outermost parentheses may be
 * omitted: "{@code S (NP) (VP (sleeps))}".
 *
 * <p>A symbol may carry markers: a trailing "{@code *}" makes a footnode, a
 * trailing "{@code _NA}" makes a nonadjoining node, and "{@code NP*_NA}" is
 * a nonadjoining footnode.
 */
public class TreeParser {
  private final String text;
  private final String file;
  private int offset;

  private TreeParser(String text, String file) {
    this.text = text;
    this.file = file;
  }

  /**
   * Parses a tree description.
   *
   * @param text Tree description
   * @param file Name of the input, used in positions, e.g. "initials[0]"
   * @throws TagParseException if the description is malformed
   */
  public static Tree parse(String text, String file) {
    return new TreeParser(text, file).parseTop();
  }

  private Tree parseTop() {
    final String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      throw error("empty tree description", 0, text.length());
    }
    final Tree tree;
    skipSpace();
    if (trimmed.startsWith("(")) {
      tree = parseExpression();
      skipSpace();
      if (offset < text.length()) {
        throw error("unexpected input after tree", offset, text.length());
      }
    } else {
      // Implicit outer parentheses; the list ends at end of input.
      tree = parseList(-1);
    }
    return tree;
  }

  /** Parses a symbol or a parenthesized list. */
  private Tree parseExpression() {
    skipSpace();
    if (offset >= text.length()) {
      throw error("unexpected end of tree description", text.length() - 1,
          text.length());
    }
    final char c = text.charAt(offset);
    if (c == '(') {
      final int start = offset++;
      return parseList(start);
    }
    if (c == ')') {
      throw error("unbalanced parentheses: unexpected ')'", offset, offset + 1);
    }
    return parseSymbol(ImmutableList.of());
  }

  /**
   * Parses the contents of a list, up to and including the closing
   * parenthesis, or to the end of input if {@code start} is negative.
   */
  private Tree parseList(int start) {
    skipSpace();
    if (offset >= text.length()) {
      throw error("unbalanced parentheses: missing ')'", Math.max(start, 0),
          text.length());
    }
    if (!isSymbolChar(text.charAt(offset))) {
      if (text.charAt(offset) == ')') {
        throw error("empty list", Math.max(start, 0), offset + 1);
      }
      throw error("list must start with a symbol", offset, offset + 1);
    }
    final int symbolStart = offset;
    final String token = readToken();
    final int symbolEnd = offset;
    final List<Tree> children = new ArrayList<>();
    for (;;) {
      skipSpace();
      if (offset >= text.length()) {
        if (start >= 0) {
          throw error("unbalanced parentheses: missing ')'", start,
              text.length());
        }
        break;
      }
      if (text.charAt(offset) == ')') {
        if (start < 0) {
          throw error("unbalanced parentheses: unexpected ')'", offset,
              offset + 1);
        }
        ++offset;
        break;
      }
      children.add(parseExpression());
    }
    return node(token, symbolStart, symbolEnd, children);
  }

  private Tree parseSymbol(List<Tree> children) {
    final int start = offset;
    final String token = readToken();
    return node(token, start, offset, children);
  }

  private String readToken() {
    final int start = offset;
    while (offset < text.length() && isSymbolChar(text.charAt(offset))) {
      ++offset;
    }
    if (offset == start) {
      throw error("unexpected character '" + text.charAt(offset) + "'",
          offset, offset + 1);
    }
    return text.substring(start, offset);
  }

  /** Creates a node from a symbol token, stripping its markers. */
  private Tree node(String token, int start, int end, List<Tree> children) {
    String name = token;
    boolean nonadjoining = false;
    boolean footnode = false;
    if (name.endsWith(NA_MARKER)) {
      if (Symbol.kindOf(name) != Symbol.Kind.NONTERMINAL) {
        throw error("terminal '" + token + "' cannot be nonadjoining", start,
            end);
      }
      nonadjoining = true;
      name = name.substring(0, name.length() - NA_MARKER.length());
    }
    if (name.endsWith(FOOT_MARKER)) {
      footnode = true;
      name = name.substring(0, name.length() - FOOT_MARKER.length());
    }
    if (name.endsWith(NA_MARKER)) {
      throw error("misplaced nonadjoining marker in '" + token
          + "'; a nonadjoining footnode is written '"
          + name.substring(0, name.length() - NA_MARKER.length())
          + FOOT_MARKER + NA_MARKER + "'", start, end);
    }
    if (name.endsWith(FOOT_MARKER)) {
      throw error("duplicate footnode marker in '" + token + "'", start, end);
    }
    if (name.isEmpty()) {
      throw error("marker without symbol '" + token + "'", start, end);
    }
    final Symbol symbol = Symbol.of(name);
    if (footnode && symbol.isTerminal()) {
      throw error("terminal '" + name + "' cannot be a footnode", start, end);
    }
    return new Tree(symbol, children, footnode, nonadjoining,
        Pos.of(text, file, start, end));
  }

  private void skipSpace() {
    while (offset < text.length()
        && Character.isWhitespace(text.charAt(offset))) {
      ++offset;
    }
  }

  private static boolean isSymbolChar(char c) {
    return !Character.isWhitespace(c)
        && c != '('
        && c != ')'
        && c != '"'
        && c != '\''
        && c != ';';
  }

  private TagParseException error(String message, int start, int end) {
    return new TagParseException(message, Pos.of(text, file, start, end));
  }
}

// End TreeParser.java
