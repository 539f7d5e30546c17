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

import net.hydromatic.metaprob.ast.AstNode;

/**
 * Thrown when the compiler produces a value that the trie service does not
 * recognize as a node.
 *
 * <p>This indicates a bug in the compiler, not a problem with the program
 * being compiled.
 */
public class InvalidTrieException extends IllegalStateException {
  /** The term whose compilation produced the bad output. */
  public final AstNode term;

  /** The bad output. */
  public final Object output;

  public InvalidTrieException(AstNode term, Object output) {
    super("bad answer " + output + " for term " + term);
    this.term = requireNonNull(term);
    this.output = requireNonNull(output);
  }
}

// End InvalidTrieException.java
