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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import net.hydromatic.metaprob.parse.Parsers;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  @CanIgnoreReturnValue
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  @CanIgnoreReturnValue
  public AstWriter append(AstNode node) {
    return node.unparse(this);
  }

  /** Appends an identifier, quoting it if it is not a plain name. */
  @CanIgnoreReturnValue
  public AstWriter id(String name) {
    return append(Parsers.isPlainIdentifier(name) ? name
        : Parsers.quoteIdentifier(name));
  }

  /** Appends a literal value. */
  @CanIgnoreReturnValue
  public AstWriter appendLiteral(Object value) {
    if (value instanceof String) {
      return append(Parsers.quoteString((String) value));
    }
    return append(String.valueOf(value));
  }

  /**
   * Appends a parenthesized s-expression: a head, then each of a list of
   * nodes, separated by spaces.
   */
  public AstWriter list(String open, String head, List<? extends AstNode> args,
      String close) {
    append(open).append(head);
    for (int i = 0; i < args.size(); i++) {
      if (!head.isEmpty() || i > 0) {
        append(" ");
      }
      append(args.get(i));
    }
    return append(close);
  }

  /** Appends a list of nodes separated by a delimiter. */
  public AstWriter sep(List<? extends AstNode> nodes, String separator) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(separator);
      }
      append(nodes.get(i));
    }
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
