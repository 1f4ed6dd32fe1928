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

import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.tag2acg.acg.Lexicon;
import net.hydromatic.tag2acg.acg.Signature;
import net.hydromatic.tag2acg.ast.ElementaryTree;
import net.hydromatic.tag2acg.ast.Term;
import org.slf4j.Logger;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that writes to a logger: signatures and lexicons at
   * INFO level, elementary trees at DEBUG level.
   */
  public static Tracer logging(Logger logger) {
    return new LoggingTracer(logger);
  }

  /**
   * Returns a tracer that performs the given action on the type of each
   * elementary tree, then calls the underlying tracer.
   */
  public static Tracer withOnTreeType(
      Tracer tracer, BiConsumer<ElementaryTree, TreeType> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTreeType(ElementaryTree tree, TreeType type) {
        consumer.accept(tree, type);
        super.onTreeType(tree, type);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the term of each
   * elementary tree, then calls the underlying tracer.
   */
  public static Tracer withOnTreeTerm(
      Tracer tracer, BiConsumer<ElementaryTree, Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTreeTerm(ElementaryTree tree, Term term) {
        consumer.accept(tree, term);
        super.onTreeTerm(tree, term);
      }
    };
  }

  public static Tracer withOnBranching(
      Tracer tracer, Consumer<Map<String, Integer>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onBranching(Map<String, Integer> branching) {
        consumer.accept(branching);
        super.onBranching(branching);
      }
    };
  }

  public static Tracer withOnSignature(
      Tracer tracer, Consumer<Signature> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onSignature(Signature signature) {
        consumer.accept(signature);
        super.onSignature(signature);
      }
    };
  }

  public static Tracer withOnLexicon(
      Tracer tracer, Consumer<Lexicon> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onLexicon(Lexicon lexicon) {
        consumer.accept(lexicon);
        super.onLexicon(lexicon);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onTreeType(ElementaryTree tree, TreeType type) {}

    @Override
    public void onTreeTerm(ElementaryTree tree, Term term) {}

    @Override
    public void onBranching(Map<String, Integer> branching) {}

    @Override
    public void onSignature(Signature signature) {}

    @Override
    public void onLexicon(Lexicon lexicon) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onTreeType(ElementaryTree tree, TreeType type) {
      tracer.onTreeType(tree, type);
    }

    @Override
    public void onTreeTerm(ElementaryTree tree, Term term) {
      tracer.onTreeTerm(tree, term);
    }

    @Override
    public void onBranching(Map<String, Integer> branching) {
      tracer.onBranching(branching);
    }

    @Override
    public void onSignature(Signature signature) {
      tracer.onSignature(signature);
    }

    @Override
    public void onLexicon(Lexicon lexicon) {
      tracer.onLexicon(lexicon);
    }
  }

  /** Tracer that writes to an SLF4J logger. */
  private static class LoggingTracer implements Tracer {
    private final Logger logger;

    LoggingTracer(Logger logger) {
      this.logger = requireNonNull(logger);
    }

    @Override
    public void onTreeType(ElementaryTree tree, TreeType type) {
      logger.debug("{}: {} has type {}", tree.id, tree.tree, type);
    }

    @Override
    public void onTreeTerm(ElementaryTree tree, Term term) {
      logger.debug("{} := {}", tree.id, term);
    }

    @Override
    public void onBranching(Map<String, Integer> branching) {
      logger.debug("maximum branching {}", branching);
    }

    @Override
    public void onSignature(Signature signature) {
      logger.info("Generated signature {} ({} types, {} constants)",
          signature.name, signature.types.size(), signature.constants.size());
    }

    @Override
    public void onLexicon(Lexicon lexicon) {
      logger.info("Generated lexicon {} from {} to {}",
          lexicon.name, lexicon.source(), lexicon.target());
    }
  }
}

// End Tracers.java
