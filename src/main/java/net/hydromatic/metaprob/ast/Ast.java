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
package net.hydromatic.metaprob.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Various sub-classes of AST nodes.
 *
 * <p>An AST is the surface form of a program, as written by the user (or as
 * produced by a front end that generates surface expressions). It is consumed
 * by {@link net.hydromatic.metaprob.compile.Desugarer}, which produces
 * {@link Core}, and by {@link net.hydromatic.metaprob.compile.TrieCompiler},
 * which produces a trace tree.
 */
public class Ast {
  private Ast() {}

  /**
   * Base class for a pattern.
   *
   * <p>For example, "x" in "(define x 5)" is an {@link IdPat}; the "[x y]" in
   * "(define [x y] (make-pair 1 2))" is a {@link TuplePat}.
   */
  public abstract static class Pat extends AstNode {
    Pat(Pos pos, Op op) {
      super(pos, op);
    }

    /** Returns whether this pattern is a single name. */
    public boolean isAtomic() {
      return false;
    }
  }

  /**
   * Named pattern, the pattern analog of the {@link Id} expression.
   *
   * <p>For example, "x" in "(define x 5)".
   */
  public static class IdPat extends Pat {
    public final String name;

    IdPat(Pos pos, String name) {
      super(pos, Op.ID_PAT);
      this.name = requireNonNull(name);
    }

    @Override
    public boolean isAtomic() {
      return true;
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof IdPat && name.equals(((IdPat) o).name);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.id(name);
    }
  }

  /**
   * Wildcard pattern.
   *
   * <p>For example, "{@code _}" in "{@code (define [_ y] pair)}". A wildcard
   * matches any value and binds nothing.
   */
  public static class WildcardPat extends Pat {
    WildcardPat(Pos pos) {
      super(pos, Op.WILDCARD_PAT);
    }

    @Override
    public int hashCode() {
      return "_".hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof WildcardPat;
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append("_");
    }
  }

  /**
   * Tuple pattern, the pattern analog of the {@link Tuple} expression.
   *
   * <p>For example, "[x [y _]]" in "(define [x [y _]] (f))".
   */
  public static class TuplePat extends Pat {
    public final List<Pat> args;

    TuplePat(Pos pos, ImmutableList<Pat> args) {
      super(pos, Op.TUPLE_PAT);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return args.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TuplePat && args.equals(((TuplePat) o).args);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.list("[", "", args, "]");
    }
  }

  /** Base class of expression AST nodes. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Reference to a variable. */
  public static class Id extends Exp {
    public final String name;

    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.id(name);
    }
  }

  /**
   * Reference to the trace of the current execution, written "{@code
   * (&this)}".
   */
  public static class This extends Exp {
    This(Pos pos) {
      super(pos, Op.THIS);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append("(&this)");
    }
  }

  /** Literal constant: a number, string, boolean or keyword. */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;

    Literal(Pos pos, Op op, Comparable value) {
      super(pos, op);
      this.value = requireNonNull(value);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.appendLiteral(value);
    }
  }

  /**
   * Program (function literal).
   *
   * <p>For example, "(program [x y] (+ x y))". The parameter pattern is a
   * tuple pattern if the program has a parameter list, or a single name if
   * the program takes exactly one argument.
   */
  public static class Program extends Exp {
    public final Pat pat;
    public final List<Exp> body;

    Program(Pos pos, Pat pat, ImmutableList<Exp> body) {
      super(pos, Op.PROGRAM);
      this.pat = requireNonNull(pat);
      this.body = requireNonNull(body);
      checkArgument(!body.isEmpty(), "program must have a body");
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      w.append("(program ").append(pat);
      body.forEach(e -> w.append(" ").append(e));
      return w.append(")");
    }
  }

  /** "If ... then ... else" expression. */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.list("(", "if",
          ImmutableList.of(condition, ifTrue, ifFalse), ")");
    }
  }

  /**
   * Block: a sequence of statements, some of which may be definitions, whose
   * value is the value of the last statement.
   */
  public static class Block extends Exp {
    public final List<Exp> exps;

    Block(Pos pos, ImmutableList<Exp> exps) {
      super(pos, Op.BLOCK);
      this.exps = requireNonNull(exps);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.list("(", "block", exps, ")");
    }
  }

  /** Local definition, "(define pattern expression)". */
  public static class Define extends Exp {
    public final Pat pat;
    public final Exp exp;

    Define(Pos pos, Pat pat, Exp exp) {
      super(pos, Op.DEFINE);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    /**
     * Returns whether this defines a named function; that is, the pattern is
     * a name and the right-hand side is a program.
     */
    public boolean isProgramDefinition() {
      return pat.op == Op.ID_PAT && exp.op == Op.PROGRAM;
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append("(define ").append(pat).append(" ").append(exp)
          .append(")");
    }
  }

  /**
   * Expression evaluated at a given address in the trace,
   * "(with-address tag expression)".
   */
  public static class WithAddress extends Exp {
    public final Exp tag;
    public final Exp exp;

    WithAddress(Pos pos, Exp tag, Exp exp) {
      super(pos, Op.WITH_ADDRESS);
      this.tag = requireNonNull(tag);
      this.exp = requireNonNull(exp);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.list("(", "with-address", ImmutableList.of(tag, exp), ")");
    }
  }

  /** Tuple literal, written "[a b c]" or "(tuple a b c)". */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.TUPLE);
      this.args = requireNonNull(args);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.list("[", "", args, "]");
    }
  }

  /** Application of a function (or procedure) to arguments. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final List<Exp> args;

    Apply(Pos pos, Exp fn, ImmutableList<Exp> args) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      w.append("(").append(fn);
      args.forEach(arg -> w.append(" ").append(arg));
      return w.append(")");
    }
  }

  /** Splice marker, "(splice expression)". */
  public static class Splice extends Exp {
    public final Exp exp;

    Splice(Pos pos, Exp exp) {
      super(pos, Op.SPLICE);
      this.exp = requireNonNull(exp);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append("(splice ").append(exp).append(")");
    }
  }

  /** Unquote marker, "(unquote expression)". */
  public static class Unquote extends Exp {
    public final Exp exp;

    Unquote(Pos pos, Exp exp) {
      super(pos, Op.UNQUOTE);
      this.exp = requireNonNull(exp);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append("(unquote ").append(exp).append(")");
    }
  }
}

// End Ast.java
