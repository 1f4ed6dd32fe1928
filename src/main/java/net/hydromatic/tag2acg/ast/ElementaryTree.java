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

/** Initial or auxiliary tree of a grammar, with its identifier. */
public class ElementaryTree {
  public final String id;
  public final Kind kind;
  public final Tree tree;

  ElementaryTree(String id, Kind kind, Tree tree) {
    this.id = requireNonNull(id);
    this.kind = requireNonNull(kind);
    this.tree = requireNonNull(tree);
  }

  public boolean isInitial() {
    return kind == Kind.INITIAL;
  }

  @Override
  public String toString() {
    return id + " = " + tree;
  }

  /** Kind of elementary tree. */
  public enum Kind {
    INITIAL("C_TI"),
    AUXILIARY("C_TA");

    /** Prefix of the identifiers of trees of this kind. */
    public final String prefix;

    Kind(String prefix) {
      this.prefix = prefix;
    }
  }
}

// End ElementaryTree.java
