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
import net.hydromatic.tag2acg.type.Type;
import net.hydromatic.tag2acg.type.TypeSystem;

/**
 * Type of an elementary tree in the derivation-trees signature, split into
 * the types of its sites and its result type.
 *
 * <p>The result type of an adjoinable auxiliary tree is itself a function
 * type, "{@code VP_A -> VP_A}", so the split cannot be recovered from the
 * curried type alone.
 */
public class TreeType {
  /** Types of the adjunction sites then the substitution sites. */
  public final ImmutableList<Type> argTypes;
  public final Type resultType;

  TreeType(ImmutableList<Type> argTypes, Type resultType) {
    this.argTypes = requireNonNull(argTypes);
    this.resultType = requireNonNull(resultType);
  }

  /** Returns the curried type, "{@code T1 -> ... -> Tn -> R}". */
  public Type toType(TypeSystem typeSystem) {
    return typeSystem.fnType(argTypes, resultType);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    for (Type argType : argTypes) {
      argType.describe(buf, true).append(" -> ");
    }
    return resultType.describe(buf, false).toString();
  }
}

// End TreeType.java
