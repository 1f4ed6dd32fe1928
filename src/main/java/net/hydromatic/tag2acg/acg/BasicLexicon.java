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
 * Lexicon given by an explicit list of mappings. Each type of the source
 * signature maps to a type of the target signature, and each constant to a
 * term.
 */
public class BasicLexicon extends Lexicon {
  public final String source;
  public final String target;
  public final ImmutableList<Mapping> mappings;

  private BasicLexicon(
      String name, String source, String target,
      ImmutableList<Mapping> mappings) {
    super(name);
    this.source = requireNonNull(source);
    this.target = requireNonNull(target);
    this.mappings = requireNonNull(mappings);
  }

  /** Creates a builder for a lexicon. */
  public static Builder builder(String name, String source, String target) {
    return new Builder(name, source, target);
  }

  @Override
  public String source() {
    return source;
  }

  @Override
  public String target() {
    return target;
  }

  /** Returns the mapping of a key, or null. */
  public @Nullable Mapping mapping(String key) {
    for (Mapping mapping : mappings) {
      if (mapping.key.equals(key)) {
        return mapping;
      }
    }
    return null;
  }

  /** Mapping of a type to a type, or of a constant to a term. */
  public static class Mapping {
    public final String key;
    public final @Nullable Type type;
    public final @Nullable Term term;

    Mapping(String key, @Nullable Type type, @Nullable Term term) {
      this.key = requireNonNull(key);
      this.type = type;
      this.term = term;
      checkArgument((type == null) != (term == null));
    }

    /** Appends the right-hand side of this mapping to a buffer. */
    public StringBuilder describeValue(StringBuilder buf) {
      if (type != null) {
        return type.describe(buf, false);
      }
      return requireNonNull(term).unparse(buf);
    }
  }

  /** Builder for {@link BasicLexicon}. */
  public static class Builder {
    private final String name;
    private final String source;
    private final String target;
    private final ImmutableList.Builder<Mapping> mappings =
        ImmutableList.builder();
    private final Set<String> keys = new HashSet<>();

    Builder(String name, String source, String target) {
      this.name = requireNonNull(name);
      this.source = requireNonNull(source);
      this.target = requireNonNull(target);
    }

    /** Maps a type of the source signature to a type. */
    @CanIgnoreReturnValue
    public Builder mapType(String key, Type type) {
      return add(new Mapping(key, requireNonNull(type), null));
    }

    /** Maps a constant of the source signature to a term. */
    @CanIgnoreReturnValue
    public Builder mapConstant(String key, Term term) {
      return add(new Mapping(key, null, requireNonNull(term)));
    }

    private Builder add(Mapping mapping) {
      checkArgument(keys.add(mapping.key),
          "duplicate key %s in lexicon %s", mapping.key, name);
      mappings.add(mapping);
      return this;
    }

    public BasicLexicon build() {
      return new BasicLexicon(name, source, target, mappings.build());
    }
  }
}

// End BasicLexicon.java
