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

import java.util.Map;
import net.hydromatic.tag2acg.acg.Lexicon;
import net.hydromatic.tag2acg.acg.Signature;
import net.hydromatic.tag2acg.ast.ElementaryTree;
import net.hydromatic.tag2acg.ast.Term;

/**
 * Called on various events during generation.
 *
 * <p>If trees are processed in parallel, {@link #onTreeType} and {@link
 * #onTreeTerm} may be called from several threads, in no particular order.
 */
public interface Tracer {
  /** Called when the type of an elementary tree has been inferred. */
  void onTreeType(ElementaryTree tree, TreeType type);

  /** Called when the term of an elementary tree has been built. */
  void onTreeTerm(ElementaryTree tree, Term term);

  /** Called with the maximum branching of each nonterminal. */
  void onBranching(Map<String, Integer> branching);

  /** Called when a signature is complete. */
  void onSignature(Signature signature);

  /** Called when a lexicon is complete. */
  void onLexicon(Lexicon lexicon);
}

// End Tracer.java
