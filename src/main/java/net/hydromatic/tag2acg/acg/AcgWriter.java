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

/**
 * Writes an abstract categorial grammar in the text format read by ACG
 * toolkits.
 *
 * <p>For example,
 *
 * <blockquote>
 *
 * <pre>
 * signature Strings =
 *     o: type;
 *     string = o -&gt; o: type;
 *
 *     infix + = lambda x y z. x (y z): string -&gt; string -&gt; string;
 *     john: string;
 *     E = lambda lvar. lvar: string;
 * end
 *
 * lexicon Full = Yield &lt;&lt; Abs
 * </pre>
 *
 * </blockquote>
 *
 * <p>Each header line ends with "{@code = }" (with a trailing space) and
 * each declaration is followed by an empty line.
 */
public class AcgWriter {
  private static final String INDENT = "    ";

  private AcgWriter() {}

  /** Appends a grammar to a buffer: its signatures, then its lexicons. */
  public static StringBuilder write(Acg acg, StringBuilder buf) {
    for (Signature signature : acg.signatures) {
      write(signature, buf);
    }
    for (Lexicon lexicon : acg.lexicons) {
      write(lexicon, buf);
    }
    return buf;
  }

  /** Appends a signature to a buffer. */
  public static StringBuilder write(Signature signature, StringBuilder buf) {
    buf.append("signature ").append(signature.name).append(" = \n");
    for (Signature.TypeDecl type : signature.types) {
      buf.append(INDENT).append(type.name);
      if (type.definition != null) {
        type.definition.describe(buf.append(" = "), false);
      }
      buf.append(": type;\n");
    }
    buf.append('\n');
    for (Signature.ConstantDecl constant : signature.constants) {
      buf.append(INDENT);
      if (constant.infix) {
        buf.append("infix ");
      }
      buf.append(constant.name);
      if (constant.definition != null) {
        constant.definition.unparse(buf.append(" = "));
      }
      constant.type.describe(buf.append(": "), false).append(";\n");
    }
    return buf.append("end\n\n");
  }

  /** Appends a lexicon to a buffer. */
  public static StringBuilder write(Lexicon lexicon, StringBuilder buf) {
    if (lexicon instanceof ComposedLexicon) {
      final ComposedLexicon composed = (ComposedLexicon) lexicon;
      return buf.append("lexicon ")
          .append(composed.name)
          .append(" = ")
          .append(composed.second.name)
          .append(" << ")
          .append(composed.first.name)
          .append("\n\n");
    }
    final BasicLexicon basic = (BasicLexicon) lexicon;
    buf.append("lexicon ")
        .append(basic.name)
        .append('(')
        .append(basic.source)
        .append("): ")
        .append(basic.target)
        .append(" = \n");
    for (BasicLexicon.Mapping mapping : basic.mappings) {
      buf.append(INDENT).append(mapping.key).append(" := ");
      mapping.describeValue(buf).append(";\n");
    }
    return buf.append("end\n\n");
  }
}

// End AcgWriter.java
