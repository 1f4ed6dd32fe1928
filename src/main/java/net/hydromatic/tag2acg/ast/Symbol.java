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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Symbol of a grammar, tagged as terminal or nonterminal.
 *
 * <p>The kind is decided once, by {@link #of(String)}, and every algorithm
 * asks the symbol rather than looking at its name again.
 */
public final class Symbol {
  public final String name;
  public final Kind kind;

  private Symbol(String name, Kind kind) {
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    checkArgument(!name.isEmpty(), "empty symbol");
  }

  /**
   * Creates a symbol, classifying it by the case of its first character: an
   * uppercase first character makes a nonterminal, anything else a terminal.
   */
  public static Symbol of(String name) {
    checkArgument(!name.isEmpty(), "empty symbol");
    return new Symbol(name, kindOf(name));
  }

  /** Returns the kind a symbol with the given name would have. */
  public static Kind kindOf(String name) {
    return !name.isEmpty() && Character.isUpperCase(name.charAt(0))
        ? Kind.NONTERMINAL
        : Kind.TERMINAL;
  }

  public boolean isNonterminal() {
    return kind == Kind.NONTERMINAL;
  }

  public boolean isTerminal() {
    return kind == Kind.TERMINAL;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Symbol
            && name.equals(((Symbol) o).name)
            && kind == ((Symbol) o).kind;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Kind of symbol. */
  public enum Kind {
    TERMINAL,
    NONTERMINAL;

    /** Returns "terminal" or "nonterminal", for messages. */
    public String description() {
      return this == TERMINAL ? "terminal" : "nonterminal";
    }
  }
}

// End Symbol.java
