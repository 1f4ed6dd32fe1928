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
package net.hydromatic.tag2acg.parse;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.tag2acg.ast.Grammar;
import net.hydromatic.tag2acg.ast.Pos;
import net.hydromatic.tag2acg.ast.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads a grammar from its JSON record.
 *
 * <p>The record has the form
 *
 * <blockquote>
 *
 * <pre>{
 *   "terminals": ["john", "sleeps"],
 *   "nonterminals": ["S", "NP", "VP"],
 *   "initials": ["S (NP) (VP (sleeps))", "NP (john)"],
 *   "auxiliaries": [],
 *   "distinguished": "S"
 * }</pre>
 *
 * </blockquote>
 */
public class GrammarReader {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private GrammarReader() {}

  /** Reads a grammar from a file. */
  public static Grammar read(Path path) throws IOException {
    try (Reader reader =
        Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader, path.toString());
    }
  }

  /** Reads a grammar from a string. */
  public static Grammar read(String json) {
    try {
      return read(new StringReader(json), "");
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
  }

  /**
   * Reads a grammar.
   *
   * @param reader Source of the JSON record
   * @param file Name of the source, for error positions
   * @throws TagParseException if the record is malformed
   * @throws IOException if the source cannot be read
   */
  public static Grammar read(Reader reader, String file) throws IOException {
    final JsonNode root;
    try {
      root = MAPPER.readTree(reader);
    } catch (JsonProcessingException e) {
      throw new TagParseException(e.getOriginalMessage(),
          pos(file, e.getLocation()), e);
    }
    if (root == null || root.isMissingNode()) {
      throw new TagParseException("empty grammar record", Pos.of(file));
    }
    if (!root.isObject()) {
      throw new TagParseException("grammar record must be a JSON object",
          Pos.of(file));
    }
    final Set<String> terminals = symbols(root, "terminals", file);
    final Set<String> nonterminals = symbols(root, "nonterminals", file);
    final List<Tree> initials = trees(root, "initials", file);
    final List<Tree> auxiliaries = trees(root, "auxiliaries", file);
    final JsonNode distinguished = field(root, "distinguished", file);
    if (!distinguished.isTextual()) {
      throw new TagParseException("field 'distinguished' must be a string",
          Pos.of(file));
    }
    return Grammar.of(terminals, nonterminals, initials, auxiliaries,
        distinguished.textValue());
  }

  private static Pos pos(String file, @Nullable JsonLocation location) {
    if (location == null || location.getLineNr() < 0) {
      return Pos.of(file);
    }
    final int line = location.getLineNr();
    final int column = location.getColumnNr();
    return new Pos(file, line, column, line, column);
  }

  private static JsonNode field(JsonNode root, String name, String file) {
    final JsonNode node = root.get(name);
    if (node == null) {
      throw new TagParseException("missing field '" + name + "'",
          Pos.of(file));
    }
    return node;
  }

  /** Reads an array of strings. */
  private static List<String> strings(JsonNode root, String name, String file) {
    final JsonNode node = field(root, name, file);
    if (!node.isArray()) {
      throw new TagParseException(
          "field '" + name + "' must be an array of strings", Pos.of(file));
    }
    final ImmutableList.Builder<String> list = ImmutableList.builder();
    for (int i = 0; i < node.size(); i++) {
      final JsonNode element = node.get(i);
      if (!element.isTextual()) {
        throw new TagParseException(
            "element " + i + " of '" + name + "' must be a string",
            Pos.of(file));
      }
      list.add(element.textValue());
    }
    return list.build();
  }

  /** Reads an array of symbol names, which must be distinct. */
  private static Set<String> symbols(JsonNode root, String name, String file) {
    final Set<String> set = new LinkedHashSet<>();
    for (String symbol : strings(root, name, file)) {
      if (!set.add(symbol)) {
        throw new TagParseException(
            "duplicate symbol '" + symbol + "' in '" + name + "'",
            Pos.of(file));
      }
    }
    return set;
  }

  /** Reads an array of tree descriptions. */
  private static List<Tree> trees(JsonNode root, String name, String file) {
    final List<String> descriptions = strings(root, name, file);
    final ImmutableList.Builder<Tree> trees = ImmutableList.builder();
    for (int i = 0; i < descriptions.size(); i++) {
      trees.add(TreeParser.parse(descriptions.get(i), name + "[" + i + "]"));
    }
    return trees.build();
  }
}

// End GrammarReader.java
