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
package net.hydromatic.tag2acg.type;

/**
 * Type of a constant or term in an ACG signature.
 *
 * <p>There are two kinds: {@link AtomType} (a declared base type such as
 * {@code tree} or {@code NP_A}) and {@link FnType} (an arrow).
 */
public interface Type {
  /**
   * Writes a description of this type to a buffer, e.g. "{@code tree}",
   * "{@code (tree -> tree) -> tree}".
   *
   * @param buf Buffer
   * @param left Whether this type is the parameter of an arrow, and therefore
   *     needs parentheses if it is itself an arrow
   */
  StringBuilder describe(StringBuilder buf, boolean left);

  /**
   * Returns the number of arrows along the result spine of this type; 0 for
   * an atom, 2 for "{@code a -> b -> c}".
   */
  default int arity() {
    return 0;
  }
}

// End Type.java
