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

import static net.hydromatic.tag2acg.util.Static.nCopies;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A collection of types.
 *
 * <p>Atoms are interned, so there is one {@link AtomType} per name.
 */
public class TypeSystem {
  private final Map<String, AtomType> atoms = new ConcurrentHashMap<>();

  /** Returns the atomic type with a given name, creating it if necessary. */
  public AtomType atom(String name) {
    return atoms.computeIfAbsent(name, AtomType::new);
  }

  /** Creates a function type. */
  public FnType fnType(Type paramType, Type resultType) {
    return new FnType(paramType, resultType);
  }

  /**
   * Creates a curried function type, "{@code p0 -> p1 -> ... -> result}". If
   * there are no parameter types, returns the result type.
   */
  public Type fnType(List<? extends Type> paramTypes, Type resultType) {
    Type type = resultType;
    for (Type paramType : ImmutableList.copyOf(paramTypes).reverse()) {
      type = fnType(paramType, type);
    }
    return type;
  }

  /**
   * Creates the type of a function from {@code n} values of a type to a value
   * of that type; for example, {@code chain(tree, 2)} is "{@code tree -> tree
   * -> tree}".
   */
  public Type chain(Type type, int n) {
    return fnType(nCopies(n, type), type);
  }
}

// End TypeSystem.java
