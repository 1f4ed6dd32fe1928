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
package net.hydromatic.tag2acg;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.tag2acg.acg.Acg;
import net.hydromatic.tag2acg.acg.AcgWriter;
import net.hydromatic.tag2acg.ast.Grammar;
import net.hydromatic.tag2acg.compile.AcgGenerator;
import net.hydromatic.tag2acg.compile.CompileException;
import net.hydromatic.tag2acg.compile.Prop;
import net.hydromatic.tag2acg.compile.Tracers;
import net.hydromatic.tag2acg.parse.GrammarReader;
import net.hydromatic.tag2acg.parse.TagParseException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line tool that converts a tree-adjoining grammar into an abstract
 * categorial grammar.
 *
 * <p>Usage:
 *
 * <blockquote>
 *
 * <pre>tag2acg [--property=value]... input.json output.acg</pre>
 *
 * </blockquote>
 */
public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  static final String USAGE =
      "Usage: tag2acg [--property=value]... input.json output.acg";

  private final List<String> argList;
  private final PrintWriter err;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main = new Main(ImmutableList.copyOf(args), System.err);
    System.exit(main.run());
  }

  /** Creates a Main. */
  public Main(List<String> argList, PrintStream err) {
    this(argList, new OutputStreamWriter(err, StandardCharsets.UTF_8));
  }

  /** Creates a Main. */
  public Main(List<String> argList, Writer err) {
    this.argList = ImmutableList.copyOf(argList);
    this.err =
        err instanceof PrintWriter ? (PrintWriter) err : new PrintWriter(err);
  }

  /** Runs the tool; returns the exit status. */
  public int run() {
    try {
      return run2();
    } finally {
      err.flush();
    }
  }

  private int run2() {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    final List<String> files = new ArrayList<>();
    for (String arg : argList) {
      if (arg.startsWith("--")) {
        final int eq = arg.indexOf('=');
        if (eq < 0) {
          return usage("missing value in option '" + arg + "'");
        }
        try {
          Prop.lookup(arg.substring(2, eq))
              .setLenient(propMap, arg.substring(eq + 1));
        } catch (IllegalArgumentException e) {
          return usage(e.getMessage());
        }
      } else {
        files.add(arg);
      }
    }
    if (files.size() != 2) {
      return usage(null);
    }
    final Path inputPath = Paths.get(files.get(0));
    final Path outputPath = Paths.get(files.get(1));

    final String text;
    try {
      final Grammar grammar = GrammarReader.read(inputPath);
      final AcgGenerator generator =
          new AcgGenerator(propMap, Tracers.logging(LOGGER));
      final Acg acg = generator.generate(grammar);
      text = AcgWriter.write(acg, new StringBuilder()).toString();
    } catch (TagParseException | CompileException e) {
      err.println(e.describeTo(new StringBuilder()));
      return 1;
    } catch (IOException e) {
      err.println("Error: cannot read " + inputPath + ": " + e);
      return 1;
    }

    try {
      Files.write(outputPath, text.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      err.println("Error: cannot write " + outputPath + ": " + e);
      return 1;
    }
    LOGGER.info("Wrote {}", outputPath);
    return 0;
  }

  private int usage(@Nullable String message) {
    if (message != null) {
      err.println(message);
    }
    err.println(USAGE);
    err.println("Properties:");
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      err.println("  --" + prop.camelName + "=" + prop.get(ImmutableMap.of()));
    }
    return 1;
  }
}

// End Main.java
