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
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Kick the tires.
 */
public class MainTest {
  private static String run(List<String> args, String text) {
    final StringWriter out = new StringWriter();
    new Main(args, new StringReader(text), out, ImmutableMap.of()).run();
    return out.toString();
  }

  private static String run(String text) {
    return run(ImmutableList.of(), text);
  }

  @Test
  void testEmpty() {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (PrintStream ps = new PrintStream(out)) {
      final InputStream in = new ByteArrayInputStream(new byte[0]);
      new Main(ImmutableList.of(), in, ps, ImmutableMap.of()).run();
    }
    assertThat(out.size(), is(0));
  }

  @Test
  void testTrie() {
    final String text = "(program x x)\n"
        + "(f 1) ; apply f\n";
    final String expected = "program{pattern=variable{name=\"x\"}, "
        + "body=variable{name=\"x\"}}\n"
        + "application[variable{name=\"f\"}, literal{value=1}]\n";
    assertThat(run(text), is(expected));
  }

  @Test
  void testCore() {
    final String text = "(define x 1)\n"
        + "(block (define y 2))\n"
        + "(define [a b] p)\n";
    final String expected = "val x = 1\n"
        + "stdIn:2.8-2.20 Warning: Definition of y occurs at end of block\n"
        + "let val y = 2 in y end\n"
        + "val `a|b` = p\n"
        + "val a = nth (`a|b`, 0)\n"
        + "val b = nth (`a|b`, 1)\n";
    assertThat(run(ImmutableList.of("--core"), text), is(expected));
  }

  @Test
  void testEcho() {
    final String text = "(probprog x x)\n";
    final String expected = "(program x x)\n"
        + "fn x => x\n";
    assertThat(run(ImmutableList.of("--echo", "--core"), text),
        is(expected));
  }

  /** After a compilation error, continues with the next statement. */
  @Test
  void testCompileError() {
    final String text = "(f if)\n"
        + "(g)\n";
    final String expected = "stdIn:1.4-1.6 Error: "
        + "'if' is a reserved keyword and cannot be used as a name\n"
        + "application[variable{name=\"g\"}]\n";
    assertThat(run(text), is(expected));
  }

  @Test
  void testParseError() {
    assertThat(run("(g)\n(f 1"), is("stdIn:2.5 Error: missing ')'\n"));
  }

  @Test
  void testProperties() {
    final String expected = "if{\n"
        + "  predicate=variable{name=\"c\"},\n"
        + "  then=literal{value=1},\n"
        + "  else=literal{value=2}}\n";
    assertThat(run(ImmutableList.of("--lineWidth=30"), "(if c 1 2)"),
        is(expected));
    assertThat(
        run(ImmutableList.of("--warnLateDefinition=false", "--core"),
            "(block (define y 2))"),
        is("let val y = 2 in y end\n"));
  }

  @Test
  void testFiles(@TempDir Path dir) throws IOException {
    final Path file = dir.resolve("a.mp");
    Files.write(file, "(f x)\n".getBytes(StandardCharsets.UTF_8));
    final String missing = dir.resolve("missing.mp").toString();
    final String out =
        run(ImmutableList.of("--core", missing, file.toString()), "");
    final String[] lines = out.split("\n");
    assertThat(lines.length, is(2));
    assertThat(lines[0], startsWith("[opening " + missing + " failed: "));
    assertThat(lines[1], is("f (x)"));
  }
}

// End MainTest.java
