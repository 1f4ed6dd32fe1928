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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** The type of a function, "{@code paramType -> resultType}". */
public class FnType implements Type {
  public final Type paramType;
  public final Type resultType;

  FnType(Type paramType, Type resultType) {
    this.paramType = requireNonNull(paramType);
    this.resultType = requireNonNull(resultType);
  }

  @Override
  public StringBuilder describe(StringBuilder buf, boolean left) {
    // Arrow is right-associative; only a parameter needs parentheses.
    if (left) {
      buf.append('(');
    }
    paramType.describe(buf, true);
    buf.append(" -> ");
    resultType.describe(buf, false);
    if (left) {
      buf.append(')');
    }
    return buf;
  }

  @Override
  public int arity() {
    return 1 + resultType.arity();
  }

  @Override
  public int hashCode() {
    return Objects.hash(paramType, resultType);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FnType
            && paramType.equals(((FnType) o).paramType)
            && resultType.equals(((FnType) o).resultType);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder(), false).toString();
  }
}

// End FnType.java
