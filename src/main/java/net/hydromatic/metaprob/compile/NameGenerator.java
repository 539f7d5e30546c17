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

import net.hydromatic.metaprob.ast.Ast;

/**
 * Generates names for values that have no name in the source program.
 *
 * <p>Names are a pure function of the shape of the source, so that compiling
 * the same program twice produces the same names. Every generated name that
 * is not a user identifier contains {@link #SEPARATOR}, which user
 * identifiers may not contain.
 */
public class NameGenerator {
  /** Separator between the components of a generated name. */
  public static final char SEPARATOR = '|';

  private NameGenerator() {}

  /**
   * Returns the name of the value matched by a pattern.
   *
   * <p>For an identifier pattern, the identifier; for a wildcard, "_"; for a
   * tuple pattern, the names of its components joined by the separator. For
   * example, the name for "[a [b _]]" is "a|b|_". A tuple of one component
   * is followed by the separator, so that "[x]" is "x|", not "x".
   */
  public static String patternName(Ast.Pat pat) {
    switch (pat.op) {
      case ID_PAT:
        return ((Ast.IdPat) pat).name;

      case WILDCARD_PAT:
        return "_";

      case TUPLE_PAT:
        final StringBuilder b = new StringBuilder();
        for (Ast.Pat arg : ((Ast.TuplePat) pat).args) {
          if (b.length() > 0) {
            b.append(SEPARATOR);
          }
          b.append(patternName(arg));
        }
        if (((Ast.TuplePat) pat).args.size() == 1) {
          b.append(SEPARATOR);
        }
        return b.toString();

      default:
        throw new AssertionError("unknown pattern " + pat.op);
    }
  }

  /** Returns the name of the parameter at position {@code i} of a program
   * when the parameter is a wildcard or a tuple; for example "_|1".
   *
   * <p>The name depends only on the position, so no two parameters of a
   * program have the same generated name. */
  public static String positionalParam(int i) {
    return "_" + SEPARATOR + i;
  }
}

// End NameGenerator.java
