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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.metaprob.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.metaprob.compile.CompiledProgram;

/**
 * Core expressions.
 *
 * <p>Core is the desugared form of a surface expression. It has no blocks, no
 * definitions and no patterns: sequencing is {@link Seq}; each definition is a
 * {@link Let} that binds one name ({@link NonRecValDecl}) or a group of
 * mutually recursive functions ({@link RecValDecl}); a tuple pattern becomes
 * a binding of the whole value followed by projections. Every bound name is
 * atomic.
 */
public class Core {
  private Core() {}

  /** Base class of core expressions. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    /** Returns whether this expression is a name or constant. */
    public boolean isAtom() {
      return false;
    }
  }

  /** Code of a literal (constant). */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;

    Literal(Op op, Comparable value) {
      super(Pos.ZERO, op);
      this.value = requireNonNull(value);
    }

    @Override
    public boolean isAtom() {
      return true;
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && op == ((Literal) o).op
              && value.equals(((Literal) o).value);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.appendLiteral(value);
    }
  }

  /** Reference to a variable. */
  public static class Id extends Exp {
    public final String name;

    Id(String name) {
      super(Pos.ZERO, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public boolean isAtom() {
      return true;
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Id && name.equals(((Id) o).name);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.id(name);
    }
  }

  /** Reference to the trace of the current execution. */
  public static class This extends Exp {
    static final This INSTANCE = new This();

    private This() {
      super(Pos.ZERO, Op.THIS);
    }

    @Override
    public boolean isAtom() {
      return true;
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append("this");
    }
  }

  /**
   * Lambda expression.
   *
   * <p>Parameters are atomic names. The {@link #program} records the name,
   * identity key, source trie and scope of the program that this function
   * was desugared from.
   */
  public static class Fn extends Exp {
    public final List<String> params;
    public final Exp exp;
    public final CompiledProgram program;

    Fn(ImmutableList<String> params, Exp exp, CompiledProgram program) {
      super(Pos.ZERO, Op.FN);
      this.params = requireNonNull(params);
      this.exp = requireNonNull(exp);
      this.program = requireNonNull(program);
    }

    @Override
    public int hashCode() {
      return Objects.hash(params, exp, program);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Fn
              && params.equals(((Fn) o).params)
              && exp.equals(((Fn) o).exp)
              && program.equals(((Fn) o).program);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      w.append("fn ");
      if (params.size() == 1) {
        w.id(params.get(0));
      } else {
        w.append("(");
        for (int i = 0; i < params.size(); i++) {
          w.append(i == 0 ? "" : ", ").id(params.get(i));
        }
        w.append(")");
      }
      return w.append(" => ").append(exp);
    }
  }

  /** "If ... then ... else" expression. */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Exp condition, Exp ifTrue, Exp ifFalse) {
      super(Pos.ZERO, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof If
              && condition.equals(((If) o).condition)
              && ifTrue.equals(((If) o).ifTrue)
              && ifFalse.equals(((If) o).ifFalse);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append("if ").append(condition)
          .append(" then ").append(ifTrue)
          .append(" else ").append(ifFalse);
    }
  }

  /** Application of a function to arguments. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final List<Exp> args;

    Apply(Exp fn, ImmutableList<Exp> args) {
      super(Pos.ZERO, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
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

    @Override
    public AstWriter unparse(AstWriter w) {
      if (fn.isAtom()) {
        w.append(fn);
      } else {
        w.append("(").append(fn).append(")");
      }
      return w.append(" (").sep(args, ", ").append(")");
    }
  }

  /** Tuple expression. */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(ImmutableList<Exp> args) {
      super(Pos.ZERO, Op.TUPLE);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return args.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Tuple && args.equals(((Tuple) o).args);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append("[").sep(args, ", ").append("]");
    }
  }

  /** Expression evaluated at an address within the trace. */
  public static class WithAddress extends Exp {
    public final Exp tag;
    public final Exp exp;

    WithAddress(Exp tag, Exp exp) {
      super(Pos.ZERO, Op.WITH_ADDRESS);
      this.tag = requireNonNull(tag);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(tag, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof WithAddress
              && tag.equals(((WithAddress) o).tag)
              && exp.equals(((WithAddress) o).exp);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append("with_address (").append(tag).append(", ").append(exp)
          .append(")");
    }
  }

  /** Splice or unquote marker around an expression. */
  public static class Marker extends Exp {
    public final Exp exp;

    Marker(Op op, Exp exp) {
      super(Pos.ZERO, op);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Marker
              && op == ((Marker) o).op
              && exp.equals(((Marker) o).exp);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append(op.lowerName()).append(" (").append(exp).append(")");
    }
  }

  /**
   * Sequence of expressions, evaluated left to right; the value is the value
   * of the last expression.
   */
  public static class Seq extends Exp {
    public final List<Exp> exps;

    Seq(ImmutableList<Exp> exps) {
      super(Pos.ZERO, Op.SEQ);
      this.exps = requireNonNull(exps);
    }

    @Override
    public int hashCode() {
      return exps.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Seq && exps.equals(((Seq) o).exps);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append("(").sep(exps, "; ").append(")");
    }
  }

  /** Value declaration. */
  public abstract static class ValDecl extends AstNode {
    ValDecl(Op op) {
      super(Pos.ZERO, op);
    }

    /** Returns the names bound by this declaration, in order. */
    public abstract List<String> names();
  }

  /**
   * Non-recursive value declaration; binds one name.
   *
   * @see RecValDecl#list
   */
  public static class NonRecValDecl extends ValDecl {
    public final String name;
    public final Exp exp;

    NonRecValDecl(String name, Exp exp) {
      super(Op.VAL_DECL);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
    }

    @Override
    public List<String> names() {
      return ImmutableList.of(name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof NonRecValDecl
              && name.equals(((NonRecValDecl) o).name)
              && exp.equals(((NonRecValDecl) o).exp);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append("val ").id(name).append(" = ").append(exp);
    }
  }

  /**
   * Recursive value declaration; binds a group of functions, each of which
   * can see all the others.
   */
  public static class RecValDecl extends ValDecl {
    public final List<NonRecValDecl> list;

    RecValDecl(ImmutableList<NonRecValDecl> list) {
      super(Op.REC_VAL_DECL);
      this.list = requireNonNull(list);
    }

    @Override
    public List<String> names() {
      final ImmutableList.Builder<String> names = ImmutableList.builder();
      list.forEach(decl -> names.add(decl.name));
      return names.build();
    }

    @Override
    public int hashCode() {
      return list.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof RecValDecl && list.equals(((RecValDecl) o).list);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      w.append("val rec ");
      for (int i = 0; i < list.size(); i++) {
        final NonRecValDecl decl = list.get(i);
        w.append(i == 0 ? "" : " and ")
            .id(decl.name).append(" = ").append(decl.exp);
      }
      return w;
    }

    /** Returns a copy of this group with a declaration added at the start. */
    public RecValDecl plus(NonRecValDecl decl) {
      return core.recValDecl(
          ImmutableList.<NonRecValDecl>builder().add(decl).addAll(list)
              .build());
    }
  }

  /** "Let" expression. */
  public static class Let extends Exp {
    public final ValDecl decl;
    public final Exp exp;

    Let(ValDecl decl, Exp exp) {
      super(Pos.ZERO, Op.LET);
      this.decl = requireNonNull(decl);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(decl, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Let
              && decl.equals(((Let) o).decl)
              && exp.equals(((Let) o).exp);
    }

    @Override
    public AstWriter unparse(AstWriter w) {
      return w.append("let ").append(decl)
          .append(" in ").append(exp)
          .append(" end");
    }
  }
}

// End Core.java
