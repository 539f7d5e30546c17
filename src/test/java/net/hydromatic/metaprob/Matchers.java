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

import net.hydromatic.metaprob.ast.AstNode;
import net.hydromatic.metaprob.trie.Trie;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an AST node by its string representation. */
  public static <T extends AstNode> Matcher<T> isAst(Class<? extends T> clazz,
      String expected) {
    return new CustomTypeSafeMatcher<T>("ast with value " + expected) {
      @Override protected boolean matchesSafely(T t) {
        assertThat(clazz.isInstance(t), is(true));
        final String s = t.toString();
        return s.equals(expected) && s.equals(t.toString());
      }
    };
  }

  /** Matches a trie by its string representation. */
  public static Matcher<Trie> isTrie(String expected) {
    return new CustomTypeSafeMatcher<Trie>("trie " + expected) {
      @Override protected boolean matchesSafely(Trie trie) {
        return trie.toString().equals(expected);
      }
    };
  }

  /** Matches a trie whose type is as given. */
  public static Matcher<Trie> hasType(String type) {
    return new CustomTypeSafeMatcher<Trie>("trie of type " + type) {
      @Override protected boolean matchesSafely(Trie trie) {
        return type.equals(trie.type());
      }
    };
  }

  public static Matcher<Throwable> throwsA(String message) {
    return new CustomTypeSafeMatcher<Throwable>("throwable: " + message) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item.toString().contains(message);
      }
    };
  }

  public static <T extends Throwable> Matcher<Throwable> throwsA(
      Class<T> clazz, Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + messageMatcher) {
      @Override protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }
}

// End Matchers.java
