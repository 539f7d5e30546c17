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

import java.util.List;
import net.hydromatic.metaprob.ast.Core;
import net.hydromatic.metaprob.trie.Trie;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called when a statement is converted to core. */
  void onCore(Core.Exp e);

  /** Called when a top-level definition is converted to core
   * declarations. */
  void onDecls(List<Core.NonRecValDecl> decls);

  /** Called when a statement is converted to a trace tree. */
  void onTrie(Trie trie);

  /** Called with the list of warnings after compiling a statement. */
  void onWarnings(List<CompileException> warningList);

  /**
   * Called with the exception thrown during compilation, or null if no
   * exception was thrown. Returns whether a handler was found.
   */
  boolean handleCompileException(@Nullable CompileException e);
}

// End Tracer.java
