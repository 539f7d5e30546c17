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
package net.hydromatic.metaprob.compile;

import static net.hydromatic.metaprob.ast.CoreBuilder.core;
import static net.hydromatic.metaprob.util.Static.transformEager;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.metaprob.ast.Ast;
import net.hydromatic.metaprob.ast.Core;
import net.hydromatic.metaprob.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts surface expressions to core expressions.
 *
 * <p>Definitions inside a block become {@code let} expressions whose scope
 * is the rest of the block. Consecutive definitions of functions become a
 * single mutually recursive group, so that
 *
 * <blockquote><pre>(block
 *   (define f (program [n] (g n)))
 *   (define g (program [n] (f n)))
 *   (f 1))</pre></blockquote>
 *
 * <p>becomes
 *
 * <blockquote><pre>let val rec f = fn n =&gt; g n
 *   and g = fn n =&gt; f n
 * in f 1 end</pre></blockquote>
 *
 * <p>Definitions whose pattern is a tuple are expanded by
 * {@link Destructurer}.
 */
public class Desugarer {
  private final TrieCompiler trieCompiler;
  private final Supplier<Environment> environment;
  private final boolean warnLateDefinition;
  private final Consumer<CompileException> warningConsumer;

  Desugarer(TrieCompiler trieCompiler, Supplier<Environment> environment,
      boolean warnLateDefinition,
      Consumer<CompileException> warningConsumer) {
    this.trieCompiler = trieCompiler;
    this.environment = environment;
    this.warnLateDefinition = warnLateDefinition;
    this.warningConsumer = warningConsumer;
  }

  /**
   * Creates a Desugarer.
   *
   * <p>The environment captured by compiled programs is resolved the first
   * time it is needed, and at most once per Desugarer.
   */
  public static Desugarer of(Session session,
      Consumer<CompileException> warningConsumer) {
    final String namespace = Prop.NAMESPACE.stringValue(session.map);
    return new Desugarer(TrieCompiler.of(session),
        Suppliers.memoize(() ->
            session.scopeResolver.resolveTopLevel(namespace)),
        Prop.WARN_LATE_DEFINITION.booleanValue(session.map),
        warningConsumer);
  }

  /** Converts an expression to core. */
  public Core.Exp toCore(Ast.Exp exp) {
    switch (exp.op) {
      case BOOL_LITERAL:
      case INT_LITERAL:
      case REAL_LITERAL:
      case STRING_LITERAL:
      case KEYWORD_LITERAL:
        return core.literal((Ast.Literal) exp);

      case ID:
        final String name = ((Ast.Id) exp).name;
        if (name.equals("this")) {
          return core.thisExp();
        }
        Compiles.checkName(name, exp.pos);
        return core.id(name);

      case THIS:
        return core.thisExp();

      case PROGRAM:
        return toFn((Ast.Program) exp, null);

      case IF:
        final Ast.If if_ = (Ast.If) exp;
        return core.ifThenElse(toCore(if_.condition), toCore(if_.ifTrue),
            toCore(if_.ifFalse));

      case BLOCK:
        return block(((Ast.Block) exp).exps);

      case DEFINE:
        // A definition that is not a statement of a block is treated as a
        // block of one statement.
        return block(ImmutableList.of(exp));

      case WITH_ADDRESS:
        final Ast.WithAddress withAddress = (Ast.WithAddress) exp;
        return core.withAddress(toCore(withAddress.tag),
            toCore(withAddress.exp));

      case TUPLE:
        return core.tuple(transformEager(((Ast.Tuple) exp).args, this::toCore));

      case SPLICE:
        return core.splice(toCore(((Ast.Splice) exp).exp));

      case UNQUOTE:
        return core.unquote(toCore(((Ast.Unquote) exp).exp));

      case APPLY:
        final Ast.Apply apply = (Ast.Apply) exp;
        return core.apply(toCore(apply.fn),
            transformEager(apply.args, this::toCore));

      default:
        throw new AssertionError("unknown expression " + exp.op);
    }
  }

  /**
   * Converts a definition at the top level of a namespace to a list of
   * declarations.
   *
   * <p>If the right-hand side is a program and the pattern is a name, the
   * program is compiled with that name. A wildcard pattern yields no
   * declarations.
   */
  public List<Core.NonRecValDecl> toTopLevel(Ast.Define define) {
    if (define.isProgramDefinition()) {
      final String name = ((Ast.IdPat) define.pat).name;
      Compiles.checkBindableName(name, define.pat.pos);
      return ImmutableList.of(
          core.nonRecValDecl(name, toFn((Ast.Program) define.exp, name)));
    }
    return Destructurer.destructure(define.pat, toCore(define.exp));
  }

  /** Converts a program to a function, compiling its source. */
  private Core.Fn toFn(Ast.Program program, @Nullable String name) {
    final CompiledProgram compiledProgram =
        trieCompiler.compileProgram(program, name, environment.get());

    // Parameters become atomic names; nested tuples are unpacked at the
    // start of the body.
    final ImmutableList.Builder<String> params = ImmutableList.builder();
    final ImmutableList.Builder<Core.NonRecValDecl> decls =
        ImmutableList.builder();
    switch (program.pat.op) {
      case ID_PAT:
        final String param = ((Ast.IdPat) program.pat).name;
        Compiles.checkBindableName(param, program.pat.pos);
        params.add(param);
        break;

      case WILDCARD_PAT:
        params.add(NameGenerator.positionalParam(0));
        break;

      case TUPLE_PAT:
        final List<Ast.Pat> args = ((Ast.TuplePat) program.pat).args;
        for (int i = 0; i < args.size(); i++) {
          final Ast.Pat arg = args.get(i);
          switch (arg.op) {
            case ID_PAT:
              final String argName = ((Ast.IdPat) arg).name;
              Compiles.checkBindableName(argName, arg.pos);
              params.add(argName);
              break;

            case WILDCARD_PAT:
              params.add(NameGenerator.positionalParam(i));
              break;

            default:
              final String tupleName = NameGenerator.positionalParam(i);
              params.add(tupleName);
              Destructurer.projections((Ast.TuplePat) arg, tupleName, decls);
          }
        }
        break;

      default:
        throw new AssertionError("unknown pattern " + program.pat.op);
    }

    return core.fn(params.build(), let(decls.build(), block(program.body)),
        compiledProgram);
  }

  /**
   * Converts the statements of a block to core.
   *
   * <p>Statements are processed from last to first. At each step,
   * {@code rest} holds the core form of the statements that follow.
   */
  private Core.Exp block(List<Ast.Exp> exps) {
    final List<Core.Exp> rest = new ArrayList<>();

    // Whether "rest" is a single "let" over a recursive group that we created
    // for a function definition, and into which a preceding function
    // definition may be merged.
    boolean group = false;

    for (int i = exps.size() - 1; i >= 0; i--) {
      final Ast.Exp exp = exps.get(i);
      if (exp.op != Op.DEFINE) {
        rest.add(0, toCore(exp));
        group = false;
        continue;
      }

      final Ast.Define define = (Ast.Define) exp;
      final boolean last = i == exps.size() - 1;
      if (last && warnLateDefinition) {
        warningConsumer.accept(
            new CompileException("Definition of " + define.pat
                + " occurs at end of block", true, define.pos));
      }

      if (define.pat.op == Op.WILDCARD_PAT) {
        // Nothing to bind; evaluate the right-hand side for its effect.
        rest.add(0, toCore(define.exp));
        group = false;
        continue;
      }

      // If the definition is the last statement, the value of the block is
      // the value that it binds.
      final Core.Exp body =
          last ? core.id(boundName(define.pat)) : core.seq(rest);

      final Core.Exp step;
      if (define.isProgramDefinition()) {
        final String name = ((Ast.IdPat) define.pat).name;
        Compiles.checkBindableName(name, define.pat.pos);
        final Core.NonRecValDecl decl =
            core.nonRecValDecl(name, toFn((Ast.Program) define.exp, name));
        if (group) {
          final Core.Let groupLet = (Core.Let) rest.get(0);
          step = core.let(((Core.RecValDecl) groupLet.decl).plus(decl),
              groupLet.exp);
        } else {
          step = core.let(core.recValDecl(ImmutableList.of(decl)), body);
        }
        group = true;
      } else {
        step = let(Destructurer.destructure(define.pat, toCore(define.exp)),
            body);
        group = false;
      }
      rest.clear();
      rest.add(step);
    }
    return core.seq(rest);
  }

  /** Wraps an expression in a "let" for each declaration, the first
   * declaration outermost. */
  private static Core.Exp let(List<Core.NonRecValDecl> decls, Core.Exp exp) {
    for (int i = decls.size() - 1; i >= 0; i--) {
      exp = core.let(decls.get(i), exp);
    }
    return exp;
  }

  /** Returns the name that holds the value bound by a pattern. */
  private static String boundName(Ast.Pat pat) {
    return NameGenerator.patternName(pat);
  }
}

// End Desugarer.java
