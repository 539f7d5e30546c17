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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.metaprob.ast.Ast;
import net.hydromatic.metaprob.ast.Core;
import net.hydromatic.metaprob.ast.CoreBuilder;
import net.hydromatic.metaprob.ast.Op;
import net.hydromatic.metaprob.ast.Pos;
import net.hydromatic.metaprob.parse.Parser;
import net.hydromatic.metaprob.trie.Trie;

/** Helpers for {@link Desugarer} and {@link TrieCompiler}. */
public abstract class Compiles {
  private Compiles() {}

  /**
   * Checks that a name may be used as a variable or bound by a pattern.
   *
   * <p>A name may not be one of the keywords that introduce a form, and may
   * not contain {@link NameGenerator#SEPARATOR}, which is reserved for
   * generated names.
   *
   * @throws CompileException if the name is not valid
   */
  public static void checkName(String name, Pos pos) {
    if (Parser.KEYWORDS.containsKey(name)) {
      throw new CompileException(
          "'" + name + "' is a reserved keyword and cannot be used as a name",
          false, pos);
    }
    if (name.indexOf(NameGenerator.SEPARATOR) >= 0) {
      throw new CompileException("invalid name '" + name
          + "': may not contain '" + NameGenerator.SEPARATOR + "'",
          false, pos);
    }
  }

  /**
   * Checks that a name may be bound by a pattern, a parameter or a
   * definition.
   *
   * <p>In addition to the checks of {@link #checkName}, the name may not be
   * {@link CoreBuilder#NTH}, which the projections generated for tuple
   * patterns refer to.
   *
   * @throws CompileException if the name may not be bound
   */
  public static void checkBindableName(String name, Pos pos) {
    checkName(name, pos);
    if (name.equals(CoreBuilder.NTH)) {
      throw new CompileException("'" + name
          + "' is a reserved name and cannot be bound", false, pos);
    }
  }

  /** Parses a string containing zero or more statements. */
  public static List<Ast.Exp> parse(String text, String file) {
    return new Parser(text, file).expressions();
  }

  /**
   * Compiles a statement to a trace tree and to core.
   *
   * <p>A definition at the top level becomes a list of declarations;
   * any other statement becomes a core expression.
   *
   * @param session Session
   * @param statement Statement
   * @param warningConsumer Receives each warning as it is found
   * @param tracer Tracer
   */
  public static CompiledStatement prepareStatement(Session session,
      Ast.Exp statement, Consumer<CompileException> warningConsumer,
      Tracer tracer) {
    final List<CompileException> warningList = new ArrayList<>();
    final Consumer<CompileException> warningConsumer2 = w -> {
      warningList.add(w);
      warningConsumer.accept(w);
    };

    final Trie trie = TrieCompiler.of(session).toTrie(statement);
    tracer.onTrie(trie);

    final Desugarer desugarer = Desugarer.of(session, warningConsumer2);
    final CompiledStatement compiled;
    if (statement.op == Op.DEFINE) {
      final List<Core.NonRecValDecl> decls =
          desugarer.toTopLevel((Ast.Define) statement);
      tracer.onDecls(decls);
      compiled = new CompiledStatement(statement, trie, null, decls);
    } else {
      final Core.Exp core = desugarer.toCore(statement);
      tracer.onCore(core);
      compiled = new CompiledStatement(statement, trie, core, null);
    }
    tracer.onWarnings(warningList);
    return compiled;
  }
}

// End Compiles.java
