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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.metaprob.compile.CompiledProgram;

/** Builds {@link Core} nodes. */
public enum CoreBuilder {
  /**
   * The singleton instance of the CORE builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  core;

  /** Name of the function that projects a member from a tuple. */
  public static final String NTH = "nth";

  private final Core.Literal unitLiteral =
      new Core.Literal(Op.UNIT_LITERAL, Unit.INSTANCE);

  /** Converts a surface literal to a core literal. */
  public Core.Literal literal(Ast.Literal literal) {
    return new Core.Literal(literal.op, literal.value);
  }

  /** Creates an integer literal. */
  public Core.Literal intLiteral(long value) {
    return new Core.Literal(Op.INT_LITERAL, value);
  }

  /** Returns the unit literal, the value of an empty block. */
  public Core.Literal unitLiteral() {
    return unitLiteral;
  }

  public Core.Id id(String name) {
    return new Core.Id(name);
  }

  public Core.This thisExp() {
    return Core.This.INSTANCE;
  }

  public Core.Fn fn(List<String> params, Core.Exp exp,
      CompiledProgram program) {
    return new Core.Fn(ImmutableList.copyOf(params), exp, program);
  }

  public Core.If ifThenElse(
      Core.Exp condition, Core.Exp ifTrue, Core.Exp ifFalse) {
    return new Core.If(condition, ifTrue, ifFalse);
  }

  public Core.Apply apply(Core.Exp fn, List<? extends Core.Exp> args) {
    return new Core.Apply(fn, ImmutableList.copyOf(args));
  }

  /**
   * Creates an expression that projects the {@code i}th member (0-based) of a
   * tuple-valued variable; "nth (v, i)".
   */
  public Core.Apply nth(String name, int i) {
    return apply(id(NTH), ImmutableList.of(id(name), intLiteral(i)));
  }

  public Core.Tuple tuple(List<? extends Core.Exp> args) {
    return new Core.Tuple(ImmutableList.copyOf(args));
  }

  public Core.WithAddress withAddress(Core.Exp tag, Core.Exp exp) {
    return new Core.WithAddress(tag, exp);
  }

  public Core.Marker splice(Core.Exp exp) {
    return new Core.Marker(Op.SPLICE, exp);
  }

  public Core.Marker unquote(Core.Exp exp) {
    return new Core.Marker(Op.UNQUOTE, exp);
  }

  /**
   * Creates an expression that evaluates a list of expressions in order.
   *
   * <p>Returns the unit literal if the list is empty, and the sole element if
   * there is one.
   */
  public Core.Exp seq(List<? extends Core.Exp> exps) {
    switch (exps.size()) {
      case 0:
        return unitLiteral;
      case 1:
        return exps.get(0);
      default:
        return new Core.Seq(ImmutableList.copyOf(exps));
    }
  }

  public Core.NonRecValDecl nonRecValDecl(String name, Core.Exp exp) {
    return new Core.NonRecValDecl(name, exp);
  }

  public Core.RecValDecl recValDecl(List<Core.NonRecValDecl> list) {
    checkArgument(!list.isEmpty(), "empty recursive group");
    return new Core.RecValDecl(ImmutableList.copyOf(list));
  }

  public Core.Let let(Core.ValDecl decl, Core.Exp exp) {
    return new Core.Let(decl, exp);
  }
}

// End CoreBuilder.java
