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
 * Lexicon of an abstract categorial grammar, a homomorphism from the types
 * and constants of one signature to the types and terms of another.
 *
 * @see BasicLexicon
 * @see ComposedLexicon
 */
public abstract class Lexicon {
  public final String name;

  protected Lexicon(String name) {
    this.name = requireNonNull(name);
  }

  /** Returns the name of the signature this lexicon maps from. */
  public abstract String source();

  /** Returns the name of the signature this lexicon maps to. */
  public abstract String target();

  @Override
  public String toString() {
    return AcgWriter.write(this, new StringBuilder()).toString();
  }
}

// End Lexicon.java
