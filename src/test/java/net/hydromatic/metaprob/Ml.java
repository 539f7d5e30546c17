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
package net.hydromatic.metaprob;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.metaprob.ast.Ast;
import net.hydromatic.metaprob.compile.CompileException;
import net.hydromatic.metaprob.compile.CompiledStatement;
import net.hydromatic.metaprob.compile.Compiles;
import net.hydromatic.metaprob.compile.Environments;
import net.hydromatic.metaprob.compile.Prop;
import net.hydromatic.metaprob.compile.ScopeResolver;
import net.hydromatic.metaprob.compile.Session;
import net.hydromatic.metaprob.compile.Tracer;
import net.hydromatic.metaprob.compile.Tracers;
import net.hydromatic.metaprob.parse.Parser;
import net.hydromatic.metaprob.trie.Trie;
import net.hydromatic.metaprob.trie.TrieService;
import net.hydromatic.metaprob.trie.Tries;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.Matcher;

/** Fluent test helper. */
public class Ml {
  private final String text;
  private final Map<Prop, Object> propMap;
  private final TrieService trieService;
  private final ScopeResolver scopeResolver;
  private final Tracer tracer;

  Ml(String text, Map<Prop, Object> propMap, TrieService trieService,
      ScopeResolver scopeResolver, Tracer tracer) {
    this.text = text;
    this.propMap = ImmutableMap.copyOf(propMap);
    this.trieService = trieService;
    this.scopeResolver = scopeResolver;
    this.tracer = tracer;
  }

  /** Creates an {@code Ml}. */
  public static Ml ml(String text) {
    return new Ml(text, ImmutableMap.of(), Tries.service(),
        Environments.resolver(), Tracers.empty());
  }

  /**
   * Runs a task and checks that it throws an exception.
   *
   * @param runnable Task to run
   * @param matcher Checks whether exception is as expected
   */
  public static void assertError(Runnable runnable,
      Matcher<Throwable> matcher) {
    try {
      runnable.run();
      fail("expected error");
    } catch (Throwable e) {
      assertThat(e, matcher);
    }
  }

  public Ml withProp(Prop prop, Object value) {
    final Map<Prop, Object> propMap = new LinkedHashMap<>(this.propMap);
    prop.set(propMap, value);
    return new Ml(text, propMap, trieService, scopeResolver, tracer);
  }

  public Ml withTrieService(TrieService trieService) {
    return new Ml(text, propMap, trieService, scopeResolver, tracer);
  }

  public Ml withScopeResolver(ScopeResolver scopeResolver) {
    return new Ml(text, propMap, trieService, scopeResolver, tracer);
  }

  public Ml withTracer(Tracer tracer) {
    return new Ml(text, propMap, trieService, scopeResolver, tracer);
  }

  public Ml withWarningsMatcher(
      Matcher<? super List<CompileException>> matcher) {
    final Consumer<List<CompileException>> consumer =
        warningList -> assertThat(warningList, matcher);
    return withTracer(Tracers.withOnWarnings(this.tracer, consumer));
  }

  /** Returns an Ml that expects compilation to fail with an exception that
   * matches. */
  public Ml withCompileExceptionMatcher(Matcher<Throwable> matcher) {
    final Consumer<@Nullable CompileException> consumer = e -> {
      if (e == null) {
        fail("expected error");
      }
      assertThat(e, matcher);
    };
    return withTracer(Tracers.withOnCompileException(this.tracer, consumer));
  }

  Session session() {
    return new Session(propMap, trieService, scopeResolver);
  }

  /** Parses the text as a single statement. */
  public Ast.Exp parse() {
    return new Parser(text, "stdIn").expressionEof();
  }

  /** Parses the text as a single pattern. */
  public Ast.Pat parsePattern() {
    return new Parser(text, "stdIn").patternEof();
  }

  /** Checks that the text parses, and unparses to the given string. */
  @CanIgnoreReturnValue
  public Ml assertParse(String expected) {
    final Ast.Exp exp = parse();
    assertThat(exp.toString(), is(expected));

    // Parsing the unparsed text gives the same text.
    final Ast.Exp exp2 = new Parser(expected, "stdIn").expressionEof();
    assertThat(exp2.toString(), is(expected));
    return this;
  }

  /** Checks that the text parses, and unparses to itself. */
  @CanIgnoreReturnValue
  public Ml assertParseSame() {
    return assertParse(text);
  }

  @CanIgnoreReturnValue
  public Ml assertParseThrows(Matcher<Throwable> matcher) {
    assertError(this::parse, matcher);
    return this;
  }

  private Ml withCompile(Consumer<CompiledStatement> action) {
    final Ast.Exp statement = parse();
    try {
      final CompiledStatement compiled =
          Compiles.prepareStatement(session(), statement, w -> {}, tracer);
      tracer.handleCompileException(null);
      action.accept(compiled);
    } catch (CompileException e) {
      if (!tracer.handleCompileException(e)) {
        throw e;
      }
    }
    return this;
  }

  /** Checks the core form of the statement. */
  @CanIgnoreReturnValue
  public Ml assertCore(String expected) {
    return withCompile(compiled ->
        assertThat(compiled.coreString(), is(expected)));
  }

  /** Checks the trace tree of the statement. */
  @CanIgnoreReturnValue
  public Ml assertTrie(Matcher<Trie> matcher) {
    return withCompile(compiled -> assertThat(compiled.trie, matcher));
  }

  @CanIgnoreReturnValue
  public Ml assertTrie(String expected) {
    return assertTrie(Matchers.isTrie(expected));
  }

  /** Compiles the statement, so that the tracer's matchers are invoked. */
  @CanIgnoreReturnValue
  public Ml assertCompiles() {
    return withCompile(compiled -> {});
  }

  /** Checks that compilation throws. */
  @CanIgnoreReturnValue
  public Ml assertCompileThrows(Matcher<Throwable> matcher) {
    return withCompileExceptionMatcher(matcher).assertCompiles();
  }
}

// End Ml.java
