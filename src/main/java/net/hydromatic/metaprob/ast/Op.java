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

import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID,
  THIS("&this"),

  // literals
  BOOL_LITERAL,
  INT_LITERAL,
  REAL_LITERAL,
  STRING_LITERAL,
  KEYWORD_LITERAL,
  /** Value of an empty block. Occurs in Core, not in Ast. */
  UNIT_LITERAL,

  // patterns
  ID_PAT,
  WILDCARD_PAT,
  TUPLE_PAT,

  // surface forms
  PROGRAM("program"),
  IF("if"),
  BLOCK("block"),
  DEFINE("define"),
  WITH_ADDRESS("with-address"),
  TUPLE("tuple"),
  SPLICE("splice"),
  UNQUOTE("unquote"),
  /** Application; the form of any list whose head is not a keyword. */
  APPLY,

  // core forms
  FN,
  SEQ,
  LET,
  VAL_DECL,
  REC_VAL_DECL;

  /** Keyword that introduces this form in surface text, or null. */
  public final @Nullable String keyword;

  Op() {
    this(null);
  }

  Op(@Nullable String keyword) {
    this.keyword = keyword;
  }

  /** Returns the name of this op in lower case, e.g. "with_address". */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

// End Op.java
