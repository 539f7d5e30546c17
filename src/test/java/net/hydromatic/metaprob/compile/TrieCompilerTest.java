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

import static net.hydromatic.metaprob.Matchers.hasType;
import static net.hydromatic.metaprob.Matchers.throwsA;
import static net.hydromatic.metaprob.Ml.assertError;
import static net.hydromatic.metaprob.Ml.ml;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.metaprob.ast.Ast;
import net.hydromatic.metaprob.trie.Trie;
import net.hydromatic.metaprob.trie.TrieService;
import net.hydromatic.metaprob.trie.Tries;
import org.junit.jupiter.api.Test;

/** Tests {@link TrieCompiler}. */
public class TrieCompilerTest {
  private static Trie toTrie(String text) {
    final TrieCompiler compiler =
        TrieCompiler.of(new Session(ImmutableMap.of()));
    return compiler.toTrie(ml(text).parse());
  }

  /** A program that returns its argument. */
  @Test
  void testIdentityProgram() {
    final Trie trie = toTrie("(program x x)");
    assertThat(trie.toString(),
        is("program{pattern=variable{name=\"x\"}, "
            + "body=variable{name=\"x\"}}"));
    assertThat(trie.type(), is(TrieCompiler.PROGRAM));
    assertThat(trie.at("pattern"), hasType(TrieCompiler.VARIABLE));
    assertThat(trie.at("pattern", "name").value(), is("x"));
    assertThat(trie.at("body"), is(trie.at("pattern")));
  }

  /** The tracer sees the trace tree of each statement, including a
   * definition, whose core form is a list of declarations. */
  @Test
  void testTracerSeesTrie() {
    final List<Trie> tries = new ArrayList<>();
    ml("(define x 1)")
        .withTracer(Tracers.withOnTrie(Tracers.empty(), tries::add))
        .assertCore("val x = 1");
    assertThat(tries.size(), is(1));
    assertThat(tries.get(0).toString(),
        is("definition{pattern=variable{name=\"x\"}, "
            + "x=literal{value=1}}"));
  }

  @Test
  void testProgramBody() {
    ml("(program [a b] (f a))")
        .assertTrie("program{"
            + "pattern=tuple[variable{name=\"a\"}, variable{name=\"b\"}], "
            + "body=application[variable{name=\"f\"}, variable{name=\"a\"}]}");

    // A body of several statements is a block.
    final Trie trie = toTrie("(program [a] (f a) a)");
    assertThat(trie.at("body"), hasType(TrieCompiler.BLOCK));
    assertThat(trie.at("body").elements().size(), is(2));
    assertThat(trie.at("body", 1, "name").value(), is("a"));
    assertThat(trie.toString(),
        is(toTrie("(program [a] (block (f a) a))").toString()));

    assertThat(toTrie("(program _ 1)").at("pattern", "name").value(),
        is("_"));
    assertThat(toTrie("(program [] 1)").at("pattern").toString(),
        is("tuple[]"));
  }

  @Test
  void testForms() {
    ml("(if c 1 2)")
        .assertTrie("if{predicate=variable{name=\"c\"}, "
            + "then=literal{value=1}, else=literal{value=2}}");
    ml("(block)").assertTrie("block[]");
    ml("(block 1 x)")
        .assertTrie("block[literal{value=1}, variable{name=\"x\"}]");
    ml("(with-address :a 1)")
        .assertTrie("with_address{tag=literal{value=:a}, "
            + "expression=literal{value=1}}");
    ml("(f 1 \"s\")")
        .assertTrie("application[variable{name=\"f\"}, literal{value=1}, "
            + "literal{value=\"s\"}]");
    ml("(f)").assertTrie("application[variable{name=\"f\"}]");
    ml("[1 2]")
        .assertTrie("tuple[literal{value=1}, literal{value=2}]");
    ml("(tuple a)").assertTrie("tuple[variable{name=\"a\"}]");
    ml("(splice x)").assertTrie("splice{expression=variable{name=\"x\"}}");
    ml("(unquote x)")
        .assertTrie("unquote{expression=variable{name=\"x\"}}");
    ml("(&this)").assertTrie("this");
    ml("this").assertTrie("this");
  }

  @Test
  void testLiterals() {
    ml("1").assertTrie("literal{value=1}");
    ml("2.5").assertTrie("literal{value=2.5}");
    ml("true").assertTrie("literal{value=true}");
    ml("\"a\\\"b\"").assertTrie("literal{value=\"a\\\"b\"}");
    ml(":k").assertTrie("literal{value=:k}");
    assertThat(toTrie("7").at("value").value(), is(7L));
  }

  @Test
  void testDefinition() {
    // The right-hand side is stored under the name being defined.
    ml("(define x 1)")
        .assertTrie("definition{pattern=variable{name=\"x\"}, "
            + "x=literal{value=1}}");
    ml("(define [a _] p)")
        .assertTrie("definition{"
            + "pattern=tuple[variable{name=\"a\"}, variable{name=\"_\"}], "
            + "definiens=variable{name=\"p\"}}");
    ml("(define _ p)")
        .assertTrie("definition{pattern=variable{name=\"_\"}, "
            + "definiens=variable{name=\"p\"}}");
    final Trie trie = toTrie("(block (define f (program x x)) (f 1))");
    assertThat(trie.at(0, "f"), hasType(TrieCompiler.PROGRAM));
    assertThat(trie.at(1, 0, "name").value(), is("f"));
  }

  @Test
  void testDefinePattern() {
    ml("(define pattern 1)")
        .assertCompileThrows(
            throwsA(CompileException.class,
                containsString("cannot define 'pattern'")));
  }

  /** A variable named after a keyword is a naming error. */
  @Test
  void testReservedName() {
    assertError(() -> toTrie("(f if)"),
        throwsA(CompileException.class,
            is("'if' is a reserved keyword and cannot be used as a name")));
    assertError(() -> toTrie("(program [probprog] 1)"),
        throwsA(CompileException.class,
            is("'probprog' is a reserved keyword and cannot be used as a "
                + "name")));
    assertError(() -> toTrie("(with-address :a `mp-splice`)"),
        throwsA(CompileException.class,
            is("'mp-splice' is a reserved keyword and cannot be used as a "
                + "name")));
  }

  @Test
  void testErrorPos() {
    try {
      toTrie("(f\n  block)");
      throw new AssertionError("expected error");
    } catch (CompileException e) {
      assertThat(e.pos().toString(), is("stdIn:2.3-2.8"));
      assertThat(e.warning(), is(false));
    }
  }

  /** Compiling the same expression twice gives equal tries. */
  @Test
  void testIdempotent() {
    final String text = "(block (define [a b] (pair 1 2))\n"
        + "  (with-address :x (if (flip) (f a) (g b))))";
    final Trie trie1 = toTrie(text);
    final Trie trie2 = toTrie(text);
    assertThat(trie1, is(trie2));
    assertThat(trie1.hashCode(), is(trie2.hashCode()));
    assertThat(Tries.hash(trie1), is(Tries.hash(trie2)));
    assertThat(Tries.hash(trie1).equals(Tries.hash(toTrie("(f a)"))),
        is(false));
  }

  @Test
  void testCompileProgram() {
    final TrieCompiler compiler =
        TrieCompiler.of(new Session(ImmutableMap.of()));
    final Ast.Program program = (Ast.Program) ml("(program x x)").parse();
    final Environment env = Environments.topLevel("user");
    final CompiledProgram p1 = compiler.compileProgram(program, "id", env);
    final CompiledProgram p2 = compiler.compileProgram(program, "id", env);
    assertThat(p1, is(p2));
    assertThat(p1.key, is(p2.key));
    assertThat(((String) p1.key).matches("[0-9a-f]{32}"), is(true));
    assertThat(p1.source, is(toTrie("(program x x)")));
    assertThat(p1.trace().type(), is("prob prog"));
    assertThat(p1.trace().fields().keySet().toString(),
        is("[name, source, environment]"));
    assertThat(p1.trace().at("environment").value().toString(),
        is("#<environment user>"));

    final CompiledProgram p3 = compiler.compileProgram(program, null, env);
    assertThat(p3.name, nullValue());
    assertThat(p3.key, is(p1.key));
  }

  /** If the trie service does not recognize a node, compilation fails with
   * an internal error that holds the term and the bad output. */
  @Test
  void testInvalidTrie() {
    final TrieService service = new RejectingTrieService(Tries.service(), "if");
    assertError(() ->
            ml("(f (if a b c))").withTrieService(service).assertCompiles(),
        throwsA(InvalidTrieException.class,
            containsString("for term (if a b c)")));
    try {
      ml("(if a b c)").withTrieService(service).assertCompiles();
      throw new AssertionError("expected error");
    } catch (InvalidTrieException e) {
      assertThat(e.term.toString(), is("(if a b c)"));
      assertThat(((Trie) e.output).type(), is("if"));
    }

    // Other nodes are unaffected.
    ml("(f a)").withTrieService(service)
        .assertTrie("application[variable{name=\"f\"}, "
            + "variable{name=\"a\"}]");
  }

  /** Trie service that does not recognize nodes of a given type. */
  private static class RejectingTrieService implements TrieService {
    private final TrieService service;
    private final String rejectedType;

    RejectingTrieService(TrieService service, String rejectedType) {
      this.service = service;
      this.rejectedType = rejectedType;
    }

    @Override
    public Trie leaf(Object value) {
      return service.leaf(value);
    }

    @Override
    public Trie keyed(String type, Map<String, Trie> fields) {
      return service.keyed(type, fields);
    }

    @Override
    public Trie sequence(String type, List<Trie> elements) {
      return service.sequence(type, elements);
    }

    @Override
    public boolean isTrie(Object o) {
      return service.isTrie(o) && !rejectedType.equals(((Trie) o).type());
    }
  }
}

// End TrieCompilerTest.java
