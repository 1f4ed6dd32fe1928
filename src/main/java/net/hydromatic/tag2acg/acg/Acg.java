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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Abstract categorial grammar, a list of signatures and lexicons. */
public class Acg {
  public final ImmutableList<Signature> signatures;
  public final ImmutableList<Lexicon> lexicons;

  public Acg(List<Signature> signatures, List<Lexicon> lexicons) {
    this.signatures = ImmutableList.copyOf(signatures);
    this.lexicons = ImmutableList.copyOf(lexicons);
  }

  /** Returns the signature with a given name, or null. */
  public @Nullable Signature signature(String name) {
    requireNonNull(name);
    for (Signature signature : signatures) {
      if (signature.name.equals(name)) {
        return signature;
      }
    }
    return null;
  }

  /** Returns the lexicon with a given name, or null. */
  public @Nullable Lexicon lexicon(String name) {
    requireNonNull(name);
    for (Lexicon lexicon : lexicons) {
      if (lexicon.name.equals(name)) {
        return lexicon;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return AcgWriter.write(this, new StringBuilder()).toString();
  }
}

// End Acg.java
