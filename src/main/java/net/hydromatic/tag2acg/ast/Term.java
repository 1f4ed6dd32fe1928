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
package net.hydromatic.tag2acg.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.tag2acg.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Simply-typed lambda term, as written in the right-hand sides of lexicons
 * and in constant definitions.
 *
 * <p>This class functions as a namespace for the kinds of term, so that we
 * can keep the class names short.
 */
public abstract class Term {
  private Term() {}

  /** Creates a reference to a constant. */
  public static Const constant(String name) {
    return new Const(name);
  }

  /** Creates a reference to a variable. */
  public static Var var(String name) {
    return new Var(name);
  }

  /** Creates an application. */
  public static Apply apply(Term fn, List<? extends Term> args) {
    return new Apply(fn, ImmutableList.copyOf(args));
  }

  /** Creates an application. */
  public static Apply apply(Term fn, Term... args) {
    return apply(fn, ImmutableList.copyOf(args));
  }

  /** Creates an abstraction over one or more variables. */
  public static Lambda lambda(List<String> params, Term body) {
    return new Lambda(ImmutableList.copyOf(params), body);
  }

  /** Creates an abstraction over one or more variables. */
  public static Lambda lambda(List<String> params, String body) {
    return lambda(params, var(body));
  }

  /** Creates a concatenation of variables, "{@code x0 + x1 + x2}". */
  public static Concat concat(List<String> operands) {
    return new Concat(transformEager(operands, Term::var));
  }

  /** Whether this term prints without parentheses in argument position. */
  public boolean isAtom() {
    return false;
  }

  @Override
  public final String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /** Appends this term to a buffer. */
  public abstract StringBuilder unparse(StringBuilder buf);

  /** Reference to a constant of a signature. */
  public static class Const extends Term {
    public final String name;

    Const(String name) {
      this.name = requireNonNull(name);
    }

    @Override
    public boolean isAtom() {
      return true;
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Const && name.equals(((Const) o).name);
    }
  }

  /** Reference to a bound variable. */
  public static class Var extends Term {
    public final String name;

    Var(String name) {
      this.name = requireNonNull(name);
    }

    @Override
    public boolean isAtom() {
      return true;
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() + 1;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && name.equals(((Var) o).name);
    }
  }

  /**
   * Application of a function to arguments.
   *
   * <p>If the function is a constant (a tree constructor), every argument is
   * parenthesized, e.g. "{@code S_2 (lvar1) (lvar2 (VP_1 (sleeps)))}";
   * otherwise only compound arguments are, e.g. "{@code x (y z)}".
   */
  public static class Apply extends Term {
    public final Term fn;
    public final ImmutableList<Term> args;

    Apply(Term fn, ImmutableList<Term> args) {
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
      checkArgument(!args.isEmpty(), "application needs an argument");
      checkArgument(fn.isAtom(), "function must be atomic: %s", fn);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      fn.unparse(buf);
      final boolean parenthesizeAll = fn instanceof Const;
      for (Term arg : args) {
        buf.append(' ');
        if (parenthesizeAll || !arg.isAtom()) {
          arg.unparse(buf.append('(')).append(')');
        } else {
          arg.unparse(buf);
        }
      }
      return buf;
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
              && fn.equals(((Apply) o).fn)
              && args.equals(((Apply) o).args);
    }
  }

  /** Abstraction, "{@code lambda x y. body}". */
  public static class Lambda extends Term {
    public final ImmutableList<String> params;
    public final Term body;

    Lambda(ImmutableList<String> params, Term body) {
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
      checkArgument(!params.isEmpty(), "lambda needs a parameter");
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      buf.append("lambda");
      for (String param : params) {
        buf.append(' ').append(param);
      }
      return body.unparse(buf.append(". "));
    }

    @Override
    public int hashCode() {
      return Objects.hash(params, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Lambda
              && params.equals(((Lambda) o).params)
              && body.equals(((Lambda) o).body);
    }
  }

  /**
   * Concatenation of strings with the infix "{@code +}" operator of the string
   * signature.
   */
  public static class Concat extends Term {
    public final ImmutableList<Term> operands;

    Concat(ImmutableList<Term> operands) {
      this.operands = requireNonNull(operands);
      checkArgument(!operands.isEmpty(), "concatenation needs an operand");
    }

    @Override
    public boolean isAtom() {
      return operands.size() == 1 && operands.get(0).isAtom();
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      for (int i = 0; i < operands.size(); i++) {
        if (i > 0) {
          buf.append(" + ");
        }
        operands.get(i).unparse(buf);
      }
      return buf;
    }

    @Override
    public int hashCode() {
      return operands.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Concat && operands.equals(((Concat) o).operands);
    }
  }
}

// End Term.java
