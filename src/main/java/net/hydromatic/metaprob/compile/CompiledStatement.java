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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.metaprob.ast.Ast;
import net.hydromatic.metaprob.ast.Core;
import net.hydromatic.metaprob.trie.Trie;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Statement that has been compiled to a trace tree and to core.
 *
 * <p>Exactly one of {@link #core} and {@link #decls} is not null.
 */
public class CompiledStatement {
  public final Ast.Exp statement;
  public final Trie trie;

  /** Core form of an expression, or null if the statement is a top-level
   * definition. */
  public final Core.@Nullable Exp core;

  /** Declarations made by a top-level definition, or null if the statement
   * is an expression. */
  public final @Nullable List<Core.NonRecValDecl> decls;

  CompiledStatement(Ast.Exp statement, Trie trie, Core.@Nullable Exp core,
      @Nullable List<Core.NonRecValDecl> decls) {
    this.statement = requireNonNull(statement);
    this.trie = requireNonNull(trie);
    this.core = core;
    this.decls = decls == null ? null : ImmutableList.copyOf(decls);
  }

  /** Returns the core form of the statement: the expression, or each
   * declaration, one per line. */
  public String coreString() {
    if (core != null) {
      return core.toString();
    }
    final StringBuilder b = new StringBuilder();
    requireNonNull(decls).forEach(decl -> {
      if (b.length() > 0) {
        b.append("\n");
      }
      b.append(decl);
    });
    return b.toString();
  }
}

// End CompiledStatement.java
