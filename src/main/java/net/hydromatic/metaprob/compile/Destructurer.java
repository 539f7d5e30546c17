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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.metaprob.ast.Ast;
import net.hydromatic.metaprob.ast.Core;
import net.hydromatic.metaprob.ast.Op;

/**
 * Converts a binding pattern and a right-hand side into an ordered list of
 * atomic bindings.
 *
 * <p>An atomic pattern {@code p} bound to {@code r} yields the single
 * binding {@code (p, r)}. A tuple pattern first binds the whole value to the
 * pattern's generated name, then binds each component that is not a
 * wildcard to a projection of that name. For example,
 *
 * <blockquote><pre>[a [b c]] = r</pre></blockquote>
 *
 * <p>yields
 *
 * <blockquote><pre>a|b|c = r
 * a = nth (a|b|c, 0)
 * b|c = nth (a|b|c, 1)
 * b = nth (b|c, 0)
 * c = nth (b|c, 1)</pre></blockquote>
 *
 * <p>A wildcard yields no bindings.
 */
public class Destructurer {
  private Destructurer() {}

  /** Destructures a pattern against an expression. */
  public static List<Core.NonRecValDecl> destructure(Ast.Pat pat,
      Core.Exp exp) {
    final ImmutableList.Builder<Core.NonRecValDecl> decls =
        ImmutableList.builder();
    destructure(pat, exp, decls);
    return decls.build();
  }

  private static void destructure(Ast.Pat pat, Core.Exp exp,
      ImmutableList.Builder<Core.NonRecValDecl> decls) {
    switch (pat.op) {
      case ID_PAT:
        final String name = ((Ast.IdPat) pat).name;
        Compiles.checkBindableName(name, pat.pos);
        decls.add(core.nonRecValDecl(name, exp));
        return;

      case WILDCARD_PAT:
        return;

      case TUPLE_PAT:
        final Ast.TuplePat tuplePat = (Ast.TuplePat) pat;
        final String aggregate = NameGenerator.patternName(tuplePat);
        decls.add(core.nonRecValDecl(aggregate, exp));
        projections(tuplePat, aggregate, decls);
        return;

      default:
        throw new AssertionError("unknown pattern " + pat.op);
    }
  }

  /** Binds each non-wildcard component of a tuple pattern to a projection
   * of an already-bound name. */
  static void projections(Ast.TuplePat tuplePat, String name,
      ImmutableList.Builder<Core.NonRecValDecl> decls) {
    if (tuplePat.args.isEmpty()) {
      throw new CompileException("empty tuple pattern", false, tuplePat.pos);
    }
    for (int i = 0; i < tuplePat.args.size(); i++) {
      final Ast.Pat arg = tuplePat.args.get(i);
      if (arg.op != Op.WILDCARD_PAT) {
        destructure(arg, core.nth(name, i), decls);
      }
    }
  }
}

// End Destructurer.java
