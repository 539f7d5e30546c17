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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;

/** Utilities for parsing and unparsing surface text. */
public final class Parsers {
  private Parsers() {}

  /** Characters that end a symbol token. Comma counts as white space. */
  private static final String DELIMITERS = "()[]\";`,";

  private static final CharMatcher HEX_DIGIT =
      CharMatcher.inRange('0', '9')
          .or(CharMatcher.inRange('a', 'f'))
          .or(CharMatcher.inRange('A', 'F'));

  /** Returns whether a character may occur in a symbol token. */
  public static boolean isSymbolChar(char c) {
    return !Character.isWhitespace(c) && DELIMITERS.indexOf(c) < 0;
  }

  /**
   * Returns whether an identifier can be written as it is, without
   * back-ticks, and will be read back as the same identifier.
   *
   * <p>Names that look like numbers, booleans or keywords, and names
   * containing the separator '|' or delimiters, are not plain.
   */
  public static boolean isPlainIdentifier(String s) {
    if (s.isEmpty()
        || s.equals("true")
        || s.equals("false")
        || s.charAt(0) == ':'
        || looksNumeric(s)) {
      return false;
    }
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (!isSymbolChar(c) || c == '|') {
        return false;
      }
    }
    return true;
  }

  /** Returns whether a token starts like a number, e.g. "12", "-3", "+.5". */
  static boolean looksNumeric(String s) {
    int i = 0;
    if (s.charAt(0) == '-' || s.charAt(0) == '+') {
      ++i;
    }
    if (i < s.length() && s.charAt(i) == '.') {
      ++i;
    }
    return i < s.length() && Character.isDigit(s.charAt(i));
  }

  /**
   * Given identifier {@code abc} returns {@code `abc`}. Doubles any
   * back-ticks.
   *
   * <p>Inverse of {@link #unquoteIdentifier}.
   */
  public static String quoteIdentifier(String s) {
    return "`" + s.replace("`", "``") + "`";
  }

  /**
   * Given quoted identifier {@code `abc`} returns {@code abc}. Converts any
   * doubled back-ticks to a single back-tick. Assumes there are no single
   * back-ticks.
   */
  public static String unquoteIdentifier(String s) {
    checkArgument(s.length() >= 2);
    checkArgument(s.charAt(0) == '`');
    checkArgument(s.charAt(s.length() - 1) == '`');
    s = s.substring(1, s.length() - 1);
    return s.replace("``", "`");
  }

  /**
   * Given string {@code a"b} returns {@code "a\"b"}.
   *
   * <p>Inverse of {@link #unquoteString}.
   */
  public static String quoteString(String s) {
    final StringBuilder b = new StringBuilder("\"");
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"':
          b.append("\\\"");
          break;
        case '\\':
          b.append("\\\\");
          break;
        case '\n':
          b.append("\\n");
          break;
        case '\t':
          b.append("\\t");
          break;
        case '\r':
          b.append("\\r");
          break;
        case '\b':
          b.append("\\b");
          break;
        case '\f':
          b.append("\\f");
          break;
        default:
          if (c < 32) {
            b.append(String.format("\\u%04x", (int) c));
          } else {
            b.append(c);
          }
      }
    }
    return b.append('"').toString();
  }

  /**
   * Given quoted string {@code "abc"} returns {@code abc}; {@code "\t"} returns
   * the tab character; {@code "A"} returns "A".
   *
   * @throws IllegalArgumentException if the string contains an invalid escape
   */
  public static String unquoteString(String s) {
    checkArgument(s.length() >= 2);
    checkArgument(s.charAt(0) == '"');
    checkArgument(s.charAt(s.length() - 1) == '"');
    s = s.substring(1, s.length() - 1);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); ) {
      final char c = s.charAt(i++);
      if (c != '\\') {
        b.append(c);
        continue;
      }
      checkArgument(i < s.length(), "illegal escape; no character after \\");
      final char c2 = s.charAt(i++);
      switch (c2) {
        case '"':
        case '\\':
          b.append(c2);
          break;
        case 'n':
          b.append('\n');
          break;
        case 't':
          b.append('\t');
          break;
        case 'r':
          b.append('\r');
          break;
        case 'b':
          b.append('\b');
          break;
        case 'f':
          b.append('\f');
          break;
        case 'u':
          checkArgument(i + 4 <= s.length(),
              "illegal unicode escape; too few digits after \\u");
          final String digits = s.substring(i, i + 4);
          checkArgument(HEX_DIGIT.matchesAllOf(digits),
              "illegal unicode escape \\u%s", digits);
          b.append((char) Integer.parseInt(digits, 16));
          i += 4;
          break;
        default:
          throw new IllegalArgumentException("illegal escape \\" + c2);
      }
    }
    return b.toString();
  }
}

// End Parsers.java
