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
package net.hydromatic.metaprob.parse;

import static java.lang.String.format;
import static net.hydromatic.metaprob.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import net.hydromatic.metaprob.ast.Ast;
import net.hydromatic.metaprob.ast.Keyword;
import net.hydromatic.metaprob.ast.Op;
import net.hydromatic.metaprob.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads surface text and converts it to {@link Ast} expressions.
 *
 * <p>Surface text is a sequence of s-expressions. A parenthesized list whose
 * head is a keyword (see {@link #KEYWORDS}) is the corresponding form; any
 * other parenthesized list is an application. A bracketed list is a tuple in
 * expression position and a tuple pattern in pattern position.
 */
public class Parser {
  /**
   * Map from each keyword that introduces a form to the form's {@link Op}.
   * Several forms have an alternative spelling.
   */
  public static final ImmutableMap<String, Op> KEYWORDS =
      ImmutableMap.<String, Op>builder()
          .put("program", Op.PROGRAM)
          .put("probprog", Op.PROGRAM)
          .put("if", Op.IF)
          .put("block", Op.BLOCK)
          .put("define", Op.DEFINE)
          .put("with-address", Op.WITH_ADDRESS)
          .put("with-addr", Op.WITH_ADDRESS)
          .put("tuple", Op.TUPLE)
          .put("&this", Op.THIS)
          .put("splice", Op.SPLICE)
          .put("mp-splice", Op.SPLICE)
          .put("unquote", Op.UNQUOTE)
          .put("mp-unquote", Op.UNQUOTE)
          .build();

  private final String s;
  private final String file;
  private int i = 0;
  private int line = 1;
  private int column = 1;
  private @Nullable Token peeked;

  /** Creates a Parser. */
  public Parser(String s, String file) {
    this.s = s;
    this.file = file;
  }

  /** Creates a Parser that reads from a string with no file name. */
  public static Parser of(String s) {
    return new Parser(s, "");
  }

  /** Returns whether there are no more expressions to read. */
  public boolean atEof() {
    return peek().kind == Kind.EOF;
  }

  /** Reads all remaining expressions. */
  public List<Ast.Exp> expressions() {
    final ImmutableList.Builder<Ast.Exp> list = ImmutableList.builder();
    while (!atEof()) {
      list.add(expression());
    }
    return list.build();
  }

  /** Reads one expression and checks that it is the last in the input. */
  public Ast.Exp expressionEof() {
    final Ast.Exp exp = expression();
    expectEof();
    return exp;
  }

  /** Reads one pattern and checks that it is the last in the input. */
  public Ast.Pat patternEof() {
    final Ast.Pat pat = pattern();
    expectEof();
    return pat;
  }

  private void expectEof() {
    final Token t = next();
    if (t.kind != Kind.EOF) {
      throw new SurfaceParseException(
          format("expected end of input, got '%s'", t.text), t.pos);
    }
  }

  /** Reads an expression. */
  public Ast.Exp expression() {
    final Token t = next();
    switch (t.kind) {
      case OPEN_PAREN:
        return list(t);

      case OPEN_BRACKET:
        final List<Ast.Exp> members = new ArrayList<>();
        final Token close = expressionsUntil(Kind.CLOSE_BRACKET, members);
        return ast.tuple(t.pos.plus(close.pos), members);

      case STRING:
        try {
          return ast.literal(t.pos, Parsers.unquoteString(t.text));
        } catch (IllegalArgumentException e) {
          throw new SurfaceParseException(e.getMessage(), t.pos, e);
        }

      case QUOTED_ID:
        return ast.id(t.pos, Parsers.unquoteIdentifier(t.text));

      case SYMBOL:
        return atom(t);

      default:
        throw unexpected(t);
    }
  }

  /** Integer literal, without a leading '+'. */
  private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");

  /** Decimal literal, without a leading '+'. Unlike
   * {@link Double#parseDouble}, does not allow a type suffix ("1.5f"),
   * hexadecimal, "NaN" or "Infinity". */
  private static final Pattern DECIMAL =
      Pattern.compile("-?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][-+]?[0-9]+)?");

  /** Converts a symbol token to a literal or identifier. */
  private Ast.Exp atom(Token t) {
    switch (t.text) {
      case "true":
        return ast.literal(t.pos, true);
      case "false":
        return ast.literal(t.pos, false);
      default:
        break;
    }
    if (t.text.startsWith(":")) {
      if (t.text.length() == 1) {
        throw new SurfaceParseException("empty keyword", t.pos);
      }
      return ast.literal(t.pos, Keyword.of(t.text.substring(1)));
    }
    if (Parsers.looksNumeric(t.text)) {
      return ast.literal(t.pos, number(t));
    }
    return ast.id(t.pos, t.text);
  }

  private static Object number(Token t) {
    final String text =
        t.text.startsWith("+") ? t.text.substring(1) : t.text;
    try {
      if (INTEGER.matcher(text).matches()) {
        return Long.parseLong(text);
      }
      if (DECIMAL.matcher(text).matches()) {
        return Double.parseDouble(text);
      }
      throw new SurfaceParseException(
          format("invalid number '%s'", t.text), t.pos);
    } catch (NumberFormatException e) {
      throw new SurfaceParseException(
          format("invalid number '%s'", t.text), t.pos, e);
    }
  }

  /** Reads the remainder of a parenthesized list, whose '(' is {@code open}. */
  private Ast.Exp list(Token open) {
    final Token head = peek();
    switch (head.kind) {
      case CLOSE_PAREN:
        next();
        throw new SurfaceParseException(
            "malformed application: empty list", open.pos.plus(head.pos));
      case SYMBOL:
        final Op op = KEYWORDS.get(head.text);
        if (op != null) {
          next();
          return form(open, head, op);
        }
        break;
      default:
        break;
    }

    // Not a keyword. The list is an application of its first element to the
    // others.
    final Ast.Exp fn = expression();
    final List<Ast.Exp> args = new ArrayList<>();
    final Token close = expressionsUntil(Kind.CLOSE_PAREN, args);
    return ast.apply(open.pos.plus(close.pos), fn, args);
  }

  /** Reads the arguments of a form introduced by a keyword. */
  private Ast.Exp form(Token open, Token keyword, Op op) {
    final List<Ast.Exp> args = new ArrayList<>();
    final Ast.Pat pat;
    final Token close;
    switch (op) {
      case PROGRAM:
        pat = patternArg(keyword);
        close = expressionsUntil(Kind.CLOSE_PAREN, args);
        final Pos programPos = open.pos.plus(close.pos);
        checkArity(keyword, programPos, args, 1, Integer.MAX_VALUE);
        return ast.program(programPos, pat, args);

      case DEFINE:
        pat = patternArg(keyword);
        close = expressionsUntil(Kind.CLOSE_PAREN, args);
        final Pos definePos = open.pos.plus(close.pos);
        checkArity(keyword, definePos, args, 1, 1);
        return ast.define(definePos, pat, args.get(0));

      default:
        break;
    }

    close = expressionsUntil(Kind.CLOSE_PAREN, args);
    final Pos pos = open.pos.plus(close.pos);
    switch (op) {
      case IF:
        checkArity(keyword, pos, args, 3, 3);
        return ast.ifThenElse(pos, args.get(0), args.get(1), args.get(2));

      case BLOCK:
        return ast.block(pos, args);

      case WITH_ADDRESS:
        checkArity(keyword, pos, args, 2, 2);
        return ast.withAddress(pos, args.get(0), args.get(1));

      case TUPLE:
        return ast.tuple(pos, args);

      case THIS:
        checkArity(keyword, pos, args, 0, 0);
        return ast.thisExp(pos);

      case SPLICE:
        checkArity(keyword, pos, args, 1, 1);
        return ast.splice(pos, args.get(0));

      case UNQUOTE:
        checkArity(keyword, pos, args, 1, 1);
        return ast.unquote(pos, args.get(0));

      default:
        throw new AssertionError("unknown form " + op);
    }
  }

  /** Reads the pattern that follows a keyword such as "define". */
  private Ast.Pat patternArg(Token keyword) {
    final Token t = peek();
    if (t.kind == Kind.CLOSE_PAREN || t.kind == Kind.EOF) {
      throw new SurfaceParseException(
          format("'%s' requires a pattern", keyword.text), t.pos);
    }
    return pattern();
  }

  private static void checkArity(Token keyword, Pos pos, List<Ast.Exp> args,
      int min, int max) {
    if (args.size() < min || args.size() > max) {
      final String expected =
          min == max ? String.valueOf(min)
              : max == Integer.MAX_VALUE ? "at least " + min
              : min + " to " + max;
      throw new SurfaceParseException(
          format("'%s' requires %s argument%s, got %d", keyword.text,
              expected, min == 1 && (max == 1 || max == Integer.MAX_VALUE)
                  ? "" : "s",
              args.size()),
          pos);
    }
  }

  /**
   * Reads expressions into a list until a closing token of a given kind, and
   * returns the closing token.
   */
  private Token expressionsUntil(Kind close, List<Ast.Exp> list) {
    for (;;) {
      final Token t = peek();
      if (t.kind == close) {
        return next();
      }
      if (t.kind == Kind.EOF) {
        throw new SurfaceParseException(
            format("missing '%s'", close == Kind.CLOSE_PAREN ? ")" : "]"),
            t.pos);
      }
      list.add(expression());
    }
  }

  /** Reads a pattern. */
  public Ast.Pat pattern() {
    final Token t = next();
    switch (t.kind) {
      case QUOTED_ID:
        return ast.idPat(t.pos, Parsers.unquoteIdentifier(t.text));

      case SYMBOL:
        if (t.text.equals("_")) {
          return ast.wildcardPat(t.pos);
        }
        if (!Parsers.isPlainIdentifier(t.text) && !t.text.contains("|")) {
          throw new SurfaceParseException(
              format("expected pattern, got '%s'", t.text), t.pos);
        }
        return ast.idPat(t.pos, t.text);

      case OPEN_BRACKET:
        final List<Ast.Pat> args = new ArrayList<>();
        for (;;) {
          final Token t2 = peek();
          if (t2.kind == Kind.CLOSE_BRACKET) {
            return ast.tuplePat(t.pos.plus(next().pos), args);
          }
          if (t2.kind == Kind.EOF) {
            throw new SurfaceParseException("missing ']'", t2.pos);
          }
          args.add(pattern());
        }

      case EOF:
        throw unexpected(t);

      default:
        throw new SurfaceParseException(
            format("expected pattern, got '%s'", t.text), t.pos);
    }
  }

  private static SurfaceParseException unexpected(Token t) {
    return new SurfaceParseException(
        t.kind == Kind.EOF ? "unexpected end of input"
            : format("unexpected '%s'", t.text),
        t.pos);
  }

  // Tokenizer

  private Token peek() {
    if (peeked == null) {
      peeked = readToken();
    }
    return peeked;
  }

  private Token next() {
    final Token t = peek();
    peeked = null;
    return t;
  }

  private Token readToken() {
    skipSpace();
    final int startLine = line;
    final int startColumn = column;
    if (i >= s.length()) {
      return new Token(Kind.EOF, "",
          new Pos(file, startLine, startColumn, startLine, startColumn + 1));
    }
    final int start = i;
    final char c = advance();
    final Kind kind;
    switch (c) {
      case '(':
        kind = Kind.OPEN_PAREN;
        break;
      case ')':
        kind = Kind.CLOSE_PAREN;
        break;
      case '[':
        kind = Kind.OPEN_BRACKET;
        break;
      case ']':
        kind = Kind.CLOSE_BRACKET;
        break;
      case '"':
        kind = Kind.STRING;
        for (;;) {
          if (i >= s.length()) {
            throw new SurfaceParseException("unterminated string",
                new Pos(file, startLine, startColumn, line, column));
          }
          final char c2 = advance();
          if (c2 == '\\' && i < s.length()) {
            advance();
          } else if (c2 == '"') {
            break;
          }
        }
        break;
      case '`':
        kind = Kind.QUOTED_ID;
        for (;;) {
          if (i >= s.length()) {
            throw new SurfaceParseException("unterminated identifier",
                new Pos(file, startLine, startColumn, line, column));
          }
          if (advance() == '`') {
            if (i < s.length() && s.charAt(i) == '`') {
              advance(); // doubled back-tick
            } else {
              break;
            }
          }
        }
        break;
      default:
        kind = Kind.SYMBOL;
        while (i < s.length() && Parsers.isSymbolChar(s.charAt(i))) {
          advance();
        }
        break;
    }
    return new Token(kind, s.substring(start, i),
        new Pos(file, startLine, startColumn, line, column));
  }

  private char advance() {
    final char c = s.charAt(i++);
    if (c == '\n') {
      ++line;
      column = 1;
    } else {
      ++column;
    }
    return c;
  }

  /** Skips white space and comments. A comment runs from ';' to the end of
   * the line. */
  private void skipSpace() {
    while (i < s.length()) {
      final char c = s.charAt(i);
      if (Character.isWhitespace(c) || c == ',') {
        advance();
      } else if (c == ';') {
        while (i < s.length() && s.charAt(i) != '\n') {
          advance();
        }
      } else {
        break;
      }
    }
  }

  /** Kind of token. */
  private enum Kind {
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    STRING,
    QUOTED_ID,
    SYMBOL,
    EOF
  }

  /** Token. */
  private static class Token {
    final Kind kind;
    final String text;
    final Pos pos;

    Token(Kind kind, String text, Pos pos) {
      this.kind = kind;
      this.text = text;
      this.pos = pos;
    }
  }
}

// End Parser.java
