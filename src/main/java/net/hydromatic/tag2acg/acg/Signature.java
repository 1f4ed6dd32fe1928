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
package net.hydromatic.tag2acg.acg;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashSet;
import java.util.Set;
import net.hydromatic.tag2acg.ast.Term;
import net.hydromatic.tag2acg.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Signature of an abstract categorial grammar: a set of type declarations
 * and a set of typed constants.
 *
 * <p>Declarations keep the order in which they were added. A signature is
 * immutable; use {@link #builder(String)} to create one.
 */
public class Signature {
  public final String name;
  public final ImmutableList<TypeDecl> types;
  public final ImmutableList<ConstantDecl> constants;

  private Signature(
      String name,
      ImmutableList<TypeDecl> types,
      ImmutableList<ConstantDecl> constants) {
    this.name = requireNonNull(name);
    this.types = requireNonNull(types);
    this.constants = requireNonNull(constants);
  }

  /** Creates a builder for a signature with a given name. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Returns the declaration of a constant, or null. */
  public @Nullable ConstantDecl constant(String name) {
    for (ConstantDecl constant : constants) {
      if (constant.name.equals(name)) {
        return constant;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return AcgWriter.write(this, new StringBuilder()).toString();
  }

  /** Declaration of a type, optionally defined as another type. */
  public static class TypeDecl {
    public final String name;
    public final @Nullable Type definition;

    TypeDecl(String name, @Nullable Type definition) {
      this.name = requireNonNull(name);
      this.definition = definition;
    }
  }

  /**
   * Declaration of a constant, optionally defined as a term.
   *
   * <p>An infix constant, such as "{@code +}", is used between its
   * arguments.
   */
  public static class ConstantDecl {
    public final String name;
    public final Type type;
    public final @Nullable Term definition;
    public final boolean infix;

    ConstantDecl(
        String name, Type type, @Nullable Term definition, boolean infix) {
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.definition = definition;
      this.infix = infix;
      checkArgument(!infix || definition != null,
          "infix constant %s must have a definition", name);
    }
  }

  /** Builder for {@link Signature}. */
  public static class Builder {
    private final String name;
    private final ImmutableList.Builder<TypeDecl> types =
        ImmutableList.builder();
    private final ImmutableList.Builder<ConstantDecl> constants =
        ImmutableList.builder();
    private final Set<String> typeNames = new HashSet<>();
    private final Set<String> constantNames = new HashSet<>();

    Builder(String name) {
      this.name = requireNonNull(name);
    }

    /** Declares a type. */
    @CanIgnoreReturnValue
    public Builder addType(String name) {
      return addType(name, null);
    }

    /** Declares a type that is an abbreviation for another type. */
    @CanIgnoreReturnValue
    public Builder addType(String name, @Nullable Type definition) {
      checkArgument(typeNames.add(name),
          "duplicate type %s in signature %s", name, this.name);
      types.add(new TypeDecl(name, definition));
      return this;
    }

    /** Declares a constant. */
    @CanIgnoreReturnValue
    public Builder addConstant(String name, Type type) {
      return addConstant(name, type, null, false);
    }

    /** Declares a constant, optionally defined by a term. */
    @CanIgnoreReturnValue
    public Builder addConstant(
        String name, Type type, @Nullable Term definition, boolean infix) {
      checkArgument(constantNames.add(name),
          "duplicate constant %s in signature %s", name, this.name);
      constants.add(new ConstantDecl(name, type, definition, infix));
      return this;
    }

    public Signature build() {
      return new Signature(name, types.build(), constants.build());
    }
  }
}

// End Signature.java
