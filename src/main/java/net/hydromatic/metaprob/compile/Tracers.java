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
import java.util.function.Consumer;
import net.hydromatic.metaprob.ast.Core;
import net.hydromatic.metaprob.trie.Trie;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a core expression,
   * then calls the underlying tracer. */
  public static Tracer withOnCore(Tracer tracer, Consumer<Core.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCore(Core.Exp e) {
        consumer.accept(e);
        super.onCore(e);
      }
    };
  }

  /** Returns a tracer that performs the given action on the declarations of
   * a top-level definition, then calls the underlying tracer. */
  public static Tracer withOnDecls(Tracer tracer,
      Consumer<List<Core.NonRecValDecl>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDecls(List<Core.NonRecValDecl> decls) {
        consumer.accept(decls);
        super.onDecls(decls);
      }
    };
  }

  /** Returns a tracer that performs the given action on a trace tree,
   * then calls the underlying tracer. */
  public static Tracer withOnTrie(Tracer tracer, Consumer<Trie> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTrie(Trie trie) {
        consumer.accept(trie);
        super.onTrie(trie);
      }
    };
  }

  public static Tracer withOnWarnings(Tracer tracer,
      Consumer<List<CompileException>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onWarnings(List<CompileException> warningList) {
        consumer.accept(warningList);
        super.onWarnings(warningList);
      }
    };
  }

  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<@Nullable CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(@Nullable CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onCore(Core.Exp e) {}

    @Override
    public void onDecls(List<Core.NonRecValDecl> decls) {}

    @Override
    public void onTrie(Trie trie) {}

    @Override
    public void onWarnings(List<CompileException> warningList) {}

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onCore(Core.Exp e) {
      tracer.onCore(e);
    }

    @Override
    public void onDecls(List<Core.NonRecValDecl> decls) {
      tracer.onDecls(decls);
    }

    @Override
    public void onTrie(Trie trie) {
      tracer.onTrie(trie);
    }

    @Override
    public void onWarnings(List<CompileException> warningList) {
      tracer.onWarnings(warningList);
    }

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
