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

import static java.util.Objects.requireNonNull;

/**
 * Lexicon that is the composition of two lexicons, "{@code second <<
 * first}".
 *
 * <p>The composition is not computed; the lexicon refers to its two parts
 * by name.
 */
public class ComposedLexicon extends Lexicon {
  public final Lexicon first;
  public final Lexicon second;

  /**
   * Creates a ComposedLexicon.
   *
   * @param name Name of this lexicon
   * @param first Lexicon that is applied first
   * @param second Lexicon that is applied to the result of the first; its
   *     source must be the target of {@code first}
   */
  public ComposedLexicon(String name, Lexicon first, Lexicon second) {
    super(name);
    this.first = requireNonNull(first);
    this.second = requireNonNull(second);
    if (!first.target().equals(second.source())) {
      throw new IllegalArgumentException("cannot compose " + second.name
          + " after " + first.name + ": target " + first.target()
          + " is not source " + second.source());
    }
  }

  @Override
  public String source() {
    return first.source();
  }

  @Override
  public String target() {
    return second.target();
  }
}

// End ComposedLexicon.java
