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

import static net.hydromatic.metaprob.ast.AstBuilder.ast;
import static net.hydromatic.metaprob.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.metaprob.ast.Ast;
import net.hydromatic.metaprob.ast.AstNode;
import net.hydromatic.metaprob.ast.Pos;
import net.hydromatic.metaprob.trie.Trie;
import net.hydromatic.metaprob.trie.TrieService;
import net.hydromatic.metaprob.trie.Tries;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts surface expressions to trace trees.
 *
 * <p>Each form becomes one node whose type identifies the form and whose
 * children are the compiled sub-expressions. For example,
 *
 * <blockquote><pre>(if (flip) 1 x)</pre></blockquote>
 *
 * <p>becomes
 *
 * <blockquote><pre>if{predicate=application[variable{name="flip"}],
 *   then=literal{value=1},
 *   else=variable{name="x"}}</pre></blockquote>
 */
public class TrieCompiler {
  public static final String APPLICATION = "application";
  public static final String BLOCK = "block";
  public static final String DEFINITION = "definition";
  public static final String IF = "if";
  public static final String LITERAL = "literal";
  public static final String PROGRAM = "program";
  public static final String SPLICE = "splice";
  public static final String THIS = "this";
  public static final String TUPLE = "tuple";
  public static final String UNQUOTE = "unquote";
  public static final String VARIABLE = "variable";
  public static final String WITH_ADDRESS = "with_address";

  /** Field of a definition whose pattern is not a name. */
  public static final String DEFINIENS = "definiens";

  private final TrieService tries;
  private final Prop.IdentityKey identityKey;

  TrieCompiler(TrieService tries, Prop.IdentityKey identityKey) {
    this.tries = tries;
    this.identityKey = identityKey;
  }

  /** Creates a TrieCompiler for a session. */
  public static TrieCompiler of(Session session) {
    return new TrieCompiler(session.trieService,
        Prop.IDENTITY_KEY.enumValue(session.map, Prop.IdentityKey.class));
  }

  /** Converts an expression to a trace tree. */
  public Trie toTrie(Ast.Exp exp) {
    return check(exp, toTrie_(exp));
  }

  private Trie toTrie_(Ast.Exp exp) {
    switch (exp.op) {
      case BOOL_LITERAL:
      case INT_LITERAL:
      case REAL_LITERAL:
      case STRING_LITERAL:
      case KEYWORD_LITERAL:
        return keyed(LITERAL, "value", tries.leaf(((Ast.Literal) exp).value));

      case ID:
        return variable(((Ast.Id) exp).name, exp.pos);

      case THIS:
        return tries.keyed(THIS, ImmutableMap.of());

      case PROGRAM:
        return program((Ast.Program) exp);

      case IF:
        final Ast.If if_ = (Ast.If) exp;
        return tries.keyed(IF,
            ImmutableMap.of("predicate", toTrie(if_.condition),
                "then", toTrie(if_.ifTrue),
                "else", toTrie(if_.ifFalse)));

      case BLOCK:
        return sequence(BLOCK, ((Ast.Block) exp).exps);

      case WITH_ADDRESS:
        final Ast.WithAddress withAddress = (Ast.WithAddress) exp;
        return tries.keyed(WITH_ADDRESS,
            ImmutableMap.of("tag", toTrie(withAddress.tag),
                "expression", toTrie(withAddress.exp)));

      case DEFINE:
        return definition((Ast.Define) exp);

      case TUPLE:
        return sequence(TUPLE, ((Ast.Tuple) exp).args);

      case SPLICE:
        return keyed(SPLICE, "expression", toTrie(((Ast.Splice) exp).exp));

      case UNQUOTE:
        return keyed(UNQUOTE, "expression", toTrie(((Ast.Unquote) exp).exp));

      default:
        // Any list that is not introduced by a keyword is an application.
        final Ast.Apply apply = (Ast.Apply) exp;
        final ImmutableList.Builder<Trie> list = ImmutableList.builder();
        list.add(toTrie(apply.fn));
        apply.args.forEach(arg -> list.add(toTrie(arg)));
        return tries.sequence(APPLICATION, list.build());
    }
  }

  /** Converts a reference to a variable. The name "this" refers to the
   * current trace, and becomes a {@code this} node. */
  private Trie variable(String name, Pos pos) {
    if (name.equals("this")) {
      return tries.keyed(THIS, ImmutableMap.of());
    }
    Compiles.checkName(name, pos);
    return keyed(VARIABLE, "name", tries.leaf(name));
  }

  private Trie program(Ast.Program program) {
    // A body of one statement is written as is; a longer body is a block.
    final Ast.Exp body =
        program.body.size() == 1
            ? program.body.get(0)
            : ast.block(Pos.sum(program.body), program.body);
    return tries.keyed(PROGRAM,
        ImmutableMap.of("pattern", toTrie(program.pat),
            "body", toTrie(body)));
  }

  private Trie definition(Ast.Define define) {
    final String key;
    if (define.pat.isAtomic()) {
      key = ((Ast.IdPat) define.pat).name;
      if (key.equals("pattern")) {
        throw new CompileException(
            "cannot define 'pattern': it is the name of a field of a "
                + "definition node",
            false, define.pat.pos);
      }
    } else {
      key = DEFINIENS;
    }
    return tries.keyed(DEFINITION,
        ImmutableMap.of("pattern", toTrie(define.pat),
            key, toTrie(define.exp)));
  }

  /** Converts a pattern to a trace tree. */
  public Trie toTrie(Ast.Pat pat) {
    final Trie trie;
    switch (pat.op) {
      case ID_PAT:
        final String name = ((Ast.IdPat) pat).name;
        Compiles.checkBindableName(name, pat.pos);
        trie = keyed(VARIABLE, "name", tries.leaf(name));
        break;

      case WILDCARD_PAT:
        trie = keyed(VARIABLE, "name", tries.leaf("_"));
        break;

      case TUPLE_PAT:
        trie = tries.sequence(TUPLE,
            transformEager(((Ast.TuplePat) pat).args, this::toTrie));
        break;

      default:
        throw new AssertionError("unknown pattern " + pat.op);
    }
    return check(pat, trie);
  }

  /**
   * Compiles a program, computing its identity key and attaching the
   * environment in which it was compiled.
   *
   * @param program Program
   * @param name Name to which the program is bound, or null if anonymous
   * @param environment Scope captured by the program
   */
  public CompiledProgram compileProgram(Ast.Program program,
      @Nullable String name,
      Environment environment) {
    final Trie source = toTrie(program);
    final Object key;
    final Trie keyTrie;
    switch (identityKey) {
      case HASH:
        key = Tries.hash(source).toString();
        keyTrie = tries.leaf(key);
        break;
      case TRACE:
        key = source;
        keyTrie = source;
        break;
      default:
        throw new AssertionError(identityKey);
    }
    final Trie trace =
        tries.keyed(CompiledProgram.TYPE,
            ImmutableMap.of("name", keyTrie,
                "source", source,
                "environment", tries.leaf(environment)));
    return new CompiledProgram(name, key, source, environment,
        check(program, trace));
  }

  private Trie keyed(String type, String field, Trie child) {
    return tries.keyed(type, ImmutableMap.of(field, child));
  }

  private Trie sequence(String type, List<Ast.Exp> exps) {
    return tries.sequence(type, transformEager(exps, this::toTrie));
  }

  /** Checks that the trie service recognizes what we produced as a node. */
  private Trie check(AstNode term, Object output) {
    if (!tries.isTrie(output)) {
      throw new InvalidTrieException(term, output);
    }
    return (Trie) output;
  }
}

// End TrieCompiler.java
