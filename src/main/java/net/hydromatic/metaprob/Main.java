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

import static net.hydromatic.metaprob.util.Static.str;

import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.metaprob.ast.Ast;
import net.hydromatic.metaprob.compile.CompileException;
import net.hydromatic.metaprob.compile.CompiledStatement;
import net.hydromatic.metaprob.compile.Compiles;
import net.hydromatic.metaprob.compile.Prop;
import net.hydromatic.metaprob.compile.Session;
import net.hydromatic.metaprob.compile.Tracers;
import net.hydromatic.metaprob.parse.SurfaceParseException;
import net.hydromatic.metaprob.trie.Tries;
import net.hydromatic.metaprob.util.MetaprobException;

/**
 * Command-line driver.
 *
 * <p>Reads surface text from each file named on the command line, or from
 * standard input if there are none, and prints the trace tree of each
 * statement. Options:
 *
 * <ul>
 *   <li>{@code --core} prints the core form of each statement instead of its
 *   trace tree;
 *   <li>{@code --echo} prints each statement before its output;
 *   <li>{@code --name=value} sets a property (see {@link Prop}).
 * </ul>
 */
public class Main {
  private final List<String> files;
  private final BufferedReader in;
  private final PrintWriter out;
  private final boolean echo;
  private final boolean core;
  final Session session;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    final Main main = new Main(argList, System.in, System.out, propMap);
    try {
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(List<String> args, InputStream in, PrintStream out,
      Map<Prop, Object> propMap) {
    this(args, new InputStreamReader(in, StandardCharsets.UTF_8),
        new OutputStreamWriter(out, StandardCharsets.UTF_8), propMap);
  }

  /** Creates a Main. */
  public Main(List<String> argList, Reader in, Writer out,
      Map<Prop, Object> propMap) {
    this.in = buffer(in);
    this.out = buffer(out);
    final Map<Prop, Object> propMap2 = new LinkedHashMap<>(propMap);
    final List<String> files = new ArrayList<>();
    boolean echo = false;
    boolean core = false;
    for (String arg : argList) {
      if (arg.equals("--echo")) {
        echo = true;
      } else if (arg.equals("--core")) {
        core = true;
      } else if (arg.startsWith("--") && arg.contains("=")) {
        final int i = arg.indexOf('=');
        Prop.lookup(arg.substring(2, i))
            .setLenient(propMap2, arg.substring(i + 1));
      } else {
        files.add(arg);
      }
    }
    this.files = ImmutableList.copyOf(files);
    this.echo = echo;
    this.core = core;
    this.session = new Session(propMap2);
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  private static BufferedReader buffer(Reader in) {
    if (in instanceof BufferedReader) {
      return (BufferedReader) in;
    } else {
      return new BufferedReader(in);
    }
  }

  private static void readerToString(Reader r, StringBuilder b) {
    final char[] chars = new char[1024];
    try {
      for (;;) {
        final int read = r.read(chars);
        if (read < 0) {
          return;
        }
        b.append(chars, 0, read);
      }
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  public void run() {
    if (files.isEmpty()) {
      final StringBuilder b = new StringBuilder();
      readerToString(in, b);
      run(str(b), "stdIn");
    } else {
      for (String file : files) {
        final String text;
        try {
          text = new String(Files.readAllBytes(Paths.get(file)),
              StandardCharsets.UTF_8);
        } catch (IOException e) {
          out.println("[opening " + file + " failed: " + e.getMessage() + "]");
          continue;
        }
        run(text, file);
      }
    }
    out.flush();
  }

  /** Compiles each statement in a piece of text, printing its output. */
  private void run(String text, String file) {
    final List<Ast.Exp> statements;
    try {
      statements = Compiles.parse(text, file);
    } catch (SurfaceParseException e) {
      // We cannot find the start of the next statement, so give up on the
      // rest of the text.
      out.println(describe(e));
      return;
    }
    for (Ast.Exp statement : statements) {
      if (echo) {
        out.println(statement);
      }
      try {
        final CompiledStatement compiled =
            Compiles.prepareStatement(session, statement,
                w -> out.println(describe(w)), Tracers.empty());
        if (core) {
          out.println(compiled.coreString());
        } else {
          out.println(
              Tries.toPrettyString(compiled.trie,
                  Prop.LINE_WIDTH.intValue(session.map)));
        }
      } catch (CompileException e) {
        out.println(describe(e));
      }
    }
  }

  private static String describe(MetaprobException e) {
    return e.describeTo(new StringBuilder()).toString();
  }
}

// End Main.java
