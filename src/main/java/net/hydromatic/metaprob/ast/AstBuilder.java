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

import static java.lang.String.format;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import net.hydromatic.metaprob.compile.CompileException;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a reference to a variable. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  /** Creates a reference to the current trace, "(&this)". */
  public Ast.This thisExp(Pos pos) {
    return new Ast.This(pos);
  }

  /**
   * Creates a literal.
   *
   * <p>The value must be a number, string, boolean or {@link Keyword}; any
   * other value is not an expression, and the builder throws.
   */
  public Ast.Literal literal(Pos pos, Object value) {
    if (value instanceof Integer || value instanceof Long) {
      return new Ast.Literal(pos, Op.INT_LITERAL, ((Number) value).longValue());
    }
    if (value instanceof Float || value instanceof Double) {
      return new Ast.Literal(
          pos, Op.REAL_LITERAL, ((Number) value).doubleValue());
    }
    if (value instanceof BigDecimal) {
      return new Ast.Literal(pos, Op.REAL_LITERAL, (BigDecimal) value);
    }
    if (value instanceof String) {
      return new Ast.Literal(pos, Op.STRING_LITERAL, (String) value);
    }
    if (value instanceof Boolean) {
      return new Ast.Literal(pos, Op.BOOL_LITERAL, (Boolean) value);
    }
    if (value instanceof Keyword) {
      return new Ast.Literal(pos, Op.KEYWORD_LITERAL, (Keyword) value);
    }
    throw new CompileException(
        format("bogus expression: %s (%s)", value,
            value == null ? "null" : value.getClass().getSimpleName()),
        false, pos);
  }

  public Ast.IdPat idPat(Pos pos, String name) {
    return new Ast.IdPat(pos, name);
  }

  public Ast.WildcardPat wildcardPat(Pos pos) {
    return new Ast.WildcardPat(pos);
  }

  public Ast.TuplePat tuplePat(Pos pos, Iterable<? extends Ast.Pat> args) {
    return new Ast.TuplePat(pos, ImmutableList.copyOf(args));
  }

  public Ast.TuplePat tuplePat(Pos pos, Ast.Pat... args) {
    return new Ast.TuplePat(pos, ImmutableList.copyOf(args));
  }

  public Ast.Program program(Pos pos, Ast.Pat pat,
      List<? extends Ast.Exp> body) {
    return new Ast.Program(pos, pat, ImmutableList.copyOf(body));
  }

  public Ast.Program program(Pos pos, Ast.Pat pat, Ast.Exp... body) {
    return new Ast.Program(pos, pat, ImmutableList.copyOf(body));
  }

  public Ast.If ifThenElse(
      Pos pos, Ast.Exp condition, Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  public Ast.Block block(Pos pos, List<? extends Ast.Exp> exps) {
    return new Ast.Block(pos, ImmutableList.copyOf(exps));
  }

  public Ast.Block block(Pos pos, Ast.Exp... exps) {
    return new Ast.Block(pos, ImmutableList.copyOf(exps));
  }

  public Ast.Define define(Pos pos, Ast.Pat pat, Ast.Exp exp) {
    return new Ast.Define(pos, pat, exp);
  }

  public Ast.WithAddress withAddress(Pos pos, Ast.Exp tag, Ast.Exp exp) {
    return new Ast.WithAddress(pos, tag, exp);
  }

  public Ast.Tuple tuple(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(args));
  }

  public Ast.Tuple tuple(Pos pos, Ast.Exp... args) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(args));
  }

  public Ast.Apply apply(Pos pos, Ast.Exp fn, List<? extends Ast.Exp> args) {
    return new Ast.Apply(pos, fn, ImmutableList.copyOf(args));
  }

  public Ast.Apply apply(Pos pos, Ast.Exp fn, Ast.Exp... args) {
    return new Ast.Apply(pos, fn, ImmutableList.copyOf(args));
  }

  public Ast.Splice splice(Pos pos, Ast.Exp exp) {
    return new Ast.Splice(pos, exp);
  }

  public Ast.Unquote unquote(Pos pos, Ast.Exp exp) {
    return new Ast.Unquote(pos, exp);
  }
}

// End AstBuilder.java
