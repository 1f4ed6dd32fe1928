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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import net.hydromatic.tag2acg.acg.Acg;
import net.hydromatic.tag2acg.acg.BasicLexicon;
import net.hydromatic.tag2acg.acg.ComposedLexicon;
import net.hydromatic.tag2acg.acg.Lexicon;
import net.hydromatic.tag2acg.acg.Signature;
import net.hydromatic.tag2acg.ast.ElementaryTree;
import net.hydromatic.tag2acg.ast.Grammar;
import net.hydromatic.tag2acg.ast.Term;
import net.hydromatic.tag2acg.type.AtomType;
import net.hydromatic.tag2acg.type.Type;
import net.hydromatic.tag2acg.type.TypeSystem;

/**
 * Generates an abstract categorial grammar from a tree-adjoining grammar.
 *
 * <p>The result has three signatures and three lexicons:
 *
 * <ul>
 *   <li>the signature of derivation trees, with a constant for each
 *       elementary tree;
 *   <li>the signature of derived trees, with a constant for each terminal
 *       and a constructor for each branching of each nonterminal;
 *   <li>the signature of strings;
 *   <li>the abstract lexicon, from derivation trees to derived trees;
 *   <li>the yield lexicon, from derived trees to strings;
 *   <li>the full lexicon, the composition of the other two.
 * </ul>
 *
 * <p>Each generator may be used for any number of grammars; it holds no
 * state between calls to {@link #generate(Grammar)}.
 */
public class AcgGenerator {
  private final Map<Prop, Object> props;
  private final Tracer tracer;

  /**
   * Creates an AcgGenerator.
   *
   * @param props Property values; a property that is absent has its default
   *     value
   * @param tracer Receives events during generation
   */
  public AcgGenerator(Map<Prop, Object> props, Tracer tracer) {
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates an AcgGenerator with default properties. */
  public AcgGenerator() {
    this(ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Generates the grammar.
   *
   * @throws CompileException if the grammar is not valid
   */
  public Acg generate(Grammar grammar) {
    GrammarValidator.validate(grammar,
        Prop.VARIABLE_PREFIX.stringValue(props));
    return new Generation(grammar).generate();
  }

  /** Type and term of an elementary tree. */
  private static class CompiledTree {
    final ElementaryTree tree;
    final TreeType type;
    final Term term;

    CompiledTree(ElementaryTree tree, TreeType type, Term term) {
      this.tree = tree;
      this.type = type;
      this.term = term;
    }
  }

  /** State of the generation of one grammar. */
  private class Generation {
    final Grammar grammar;
    final TypeSystem typeSystem = new TypeSystem();
    final String prefix = Prop.VARIABLE_PREFIX.stringValue(props);
    final AtomType tree = typeSystem.atom(Names.TREE);
    final AtomType o = typeSystem.atom(Names.O);
    final AtomType string = typeSystem.atom(Names.STRING);

    Generation(Grammar grammar) {
      this.grammar = grammar;
    }

    Acg generate() {
      final ImmutableList<CompiledTree> compiledTrees = compileTrees();
      final Map<String, Integer> branching =
          BranchingAnalyzer.maxBranching(grammar);
      tracer.onBranching(branching);
      final List<BranchingAnalyzer.Constructor> constructors =
          BranchingAnalyzer.constructors(branching);

      final List<Signature> signatures = new ArrayList<>();
      signatures.add(signature(derivationTrees(compiledTrees)));
      signatures.add(signature(derivedTrees(constructors)));
      signatures.add(signature(strings()));

      final List<Lexicon> lexicons = new ArrayList<>();
      final Lexicon abs = lexicon(abstractLexicon(compiledTrees));
      final Lexicon yield = lexicon(yieldLexicon(constructors));
      lexicons.add(abs);
      lexicons.add(yield);
      lexicons.add(
          lexicon(
              new ComposedLexicon(
                  Prop.FULL_LEXICON.stringValue(props), abs, yield)));
      return new Acg(signatures, lexicons);
    }

    /**
     * Infers the type and builds the term of each elementary tree. The
     * result is in grammar order even if the trees are processed in
     * parallel.
     */
    ImmutableList<CompiledTree> compileTrees() {
      final TypeInferrer typeInferrer = new TypeInferrer(typeSystem);
      final TermRealizer termRealizer = new TermRealizer(prefix);
      final List<ElementaryTree> trees = grammar.trees();
      final Stream<ElementaryTree> stream =
          Prop.PARALLEL.booleanValue(props)
              ? trees.parallelStream()
              : trees.stream();
      return stream
          .map(
              elementaryTree -> {
                final TreeType type = typeInferrer.infer(elementaryTree);
                tracer.onTreeType(elementaryTree, type);
                final Term term = termRealizer.realize(elementaryTree);
                tracer.onTreeTerm(elementaryTree, term);
                return new CompiledTree(elementaryTree, type, term);
              })
          .collect(ImmutableList.toImmutableList());
    }

    Signature signature(Signature signature) {
      tracer.onSignature(signature);
      return signature;
    }

    Lexicon lexicon(Lexicon lexicon) {
      tracer.onLexicon(lexicon);
      return lexicon;
    }

    Signature derivationTrees(List<CompiledTree> compiledTrees) {
      final Signature.Builder b =
          Signature.builder(Prop.DERIVATION_SIGNATURE.stringValue(props));
      for (String nonterminal : grammar.nonterminals) {
        b.addType(Names.substitution(nonterminal));
        b.addType(Names.adjunction(nonterminal));
      }
      for (CompiledTree compiledTree : compiledTrees) {
        b.addConstant(
            compiledTree.tree.id, compiledTree.type.toType(typeSystem));
      }
      for (String nonterminal : grammar.nonterminals) {
        b.addConstant(
            Names.identity(nonterminal),
            typeSystem.atom(Names.adjunction(nonterminal)));
      }
      return b.build();
    }

    Signature derivedTrees(List<BranchingAnalyzer.Constructor> constructors) {
      final Signature.Builder b =
          Signature.builder(Prop.DERIVED_SIGNATURE.stringValue(props));
      b.addType(Names.TREE);
      for (String terminal : grammar.terminals) {
        b.addConstant(terminal, tree);
      }
      for (BranchingAnalyzer.Constructor constructor : constructors) {
        b.addConstant(
            constructor.name, typeSystem.chain(tree, constructor.arity));
      }
      b.addConstant(Names.EMPTY, tree);
      return b.build();
    }

    Signature strings() {
      final Signature.Builder b =
          Signature.builder(Prop.STRING_SIGNATURE.stringValue(props));
      b.addType(Names.O);
      b.addType(Names.STRING, typeSystem.fnType(o, o));
      // Strings are functions o -> o, so concatenation is composition.
      b.addConstant(
          Names.CONCAT,
          typeSystem.chain(string, 2),
          Term.lambda(
              ImmutableList.of("x", "y", "z"),
              Term.apply(
                  Term.var("x"), Term.apply(Term.var("y"), Term.var("z")))),
          true);
      for (String terminal : grammar.terminals) {
        b.addConstant(terminal, string);
      }
      b.addConstant(Names.EMPTY_STRING, string, identity(), false);
      return b.build();
    }

    BasicLexicon abstractLexicon(List<CompiledTree> compiledTrees) {
      final BasicLexicon.Builder b =
          BasicLexicon.builder(
              Prop.ABSTRACT_LEXICON.stringValue(props),
              Prop.DERIVATION_SIGNATURE.stringValue(props),
              Prop.DERIVED_SIGNATURE.stringValue(props));
      final Type treeToTree = typeSystem.fnType(tree, tree);
      for (String nonterminal : grammar.nonterminals) {
        b.mapType(Names.substitution(nonterminal), tree);
        b.mapType(Names.adjunction(nonterminal), treeToTree);
      }
      for (CompiledTree compiledTree : compiledTrees) {
        b.mapConstant(compiledTree.tree.id, compiledTree.term);
      }
      for (String nonterminal : grammar.nonterminals) {
        b.mapConstant(Names.identity(nonterminal), identity());
      }
      return b.build();
    }

    BasicLexicon yieldLexicon(
        List<BranchingAnalyzer.Constructor> constructors) {
      final BasicLexicon.Builder b =
          BasicLexicon.builder(
              Prop.YIELD_LEXICON.stringValue(props),
              Prop.DERIVED_SIGNATURE.stringValue(props),
              Prop.STRING_SIGNATURE.stringValue(props));
      b.mapType(Names.TREE, string);
      for (String terminal : grammar.terminals) {
        b.mapConstant(terminal, Term.constant(terminal));
      }
      for (BranchingAnalyzer.Constructor constructor : constructors) {
        final ImmutableList.Builder<String> variables = ImmutableList.builder();
        for (int i = 0; i < constructor.arity; i++) {
          variables.add("x" + i);
        }
        final List<String> variableList = variables.build();
        b.mapConstant(
            constructor.name,
            Term.lambda(variableList, Term.concat(variableList)));
      }
      b.mapConstant(Names.EMPTY, Term.constant(Names.EMPTY_STRING));
      return b.build();
    }

    /** Returns the identity function, "{@code lambda lvar. lvar}". */
    Term identity() {
      return Term.lambda(ImmutableList.of(prefix), prefix);
    }
  }
}

// End AcgGenerator.java
