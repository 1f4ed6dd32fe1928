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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import net.hydromatic.tag2acg.type.AtomType;
import net.hydromatic.tag2acg.type.FnType;
import net.hydromatic.tag2acg.type.Type;
import net.hydromatic.tag2acg.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for types and the type system. */
public class TypeTest {
  @Test
  void testAtom() {
    final TypeSystem typeSystem = new TypeSystem();
    final AtomType tree = typeSystem.atom("tree");
    assertThat(tree.toString(), is("tree"));
    assertThat(tree.arity(), is(0));
    assertThat(typeSystem.atom("tree"), sameInstance(tree));
    assertThat(typeSystem.atom("NP_S"), not(tree));
  }

  @Test
  void testFnType() {
    final TypeSystem typeSystem = new TypeSystem();
    final Type tree = typeSystem.atom("tree");
    final FnType treeToTree = typeSystem.fnType(tree, tree);
    assertThat(treeToTree.toString(), is("tree -> tree"));
    assertThat(treeToTree.arity(), is(1));

    // Arrow is right-associative
    final Type curried = typeSystem.fnType(tree, treeToTree);
    assertThat(curried.toString(), is("tree -> tree -> tree"));
    assertThat(curried.arity(), is(2));

    // A function-typed parameter needs parentheses
    final Type higher = typeSystem.fnType(treeToTree, tree);
    assertThat(higher.toString(), is("(tree -> tree) -> tree"));
    assertThat(higher.arity(), is(1));

    assertThat(typeSystem.fnType(tree, tree), is(treeToTree));
    assertThat(higher, not(curried));
  }

  @Test
  void testCurried() {
    final TypeSystem typeSystem = new TypeSystem();
    final Type sA = typeSystem.atom("S_A");
    final Type vpA = typeSystem.atom("VP_A");
    final Type npS = typeSystem.atom("NP_S");
    final Type sS = typeSystem.atom("S_S");
    assertThat(
        typeSystem.fnType(ImmutableList.of(sA, vpA, npS), sS).toString(),
        is("S_A -> VP_A -> NP_S -> S_S"));
    assertThat(typeSystem.fnType(ImmutableList.of(), sS), sameInstance(sS));
    assertThat(
        typeSystem.fnType(ImmutableList.of(vpA), typeSystem.fnType(vpA, vpA))
            .toString(),
        is("VP_A -> VP_A -> VP_A"));
  }

  @Test
  void testChain() {
    final TypeSystem typeSystem = new TypeSystem();
    final Type tree = typeSystem.atom("tree");
    assertThat(typeSystem.chain(tree, 0), sameInstance(tree));
    assertThat(typeSystem.chain(tree, 1).toString(), is("tree -> tree"));
    assertThat(typeSystem.chain(tree, 3).toString(),
        is("tree -> tree -> tree -> tree"));
    assertThat(typeSystem.chain(tree, 3).arity(), is(3));
  }
}

// End TypeTest.java
