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
package net.hydromatic.metaprob.trie;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests {@link Trie} and {@link Tries}. */
public class TriesTest {
  private static final TrieService S = Tries.service();

  private static Trie variable(String name) {
    return S.keyed("variable", ImmutableMap.of("name", S.leaf(name)));
  }

  private static Trie literal(Object value) {
    return S.keyed("literal", ImmutableMap.of("value", S.leaf(value)));
  }

  /** Returns the trie for "(if c 1 2)". */
  private static Trie ifTrie() {
    return S.keyed("if",
        ImmutableMap.of("predicate", variable("c"),
            "then", literal(1L),
            "else", literal(2L)));
  }

  @Test
  void testNodes() {
    final Trie leaf = S.leaf("x");
    assertThat(leaf.type(), nullValue());
    assertThat(leaf.hasValue(), is(true));
    assertThat(leaf.value(), is("x"));
    assertThat(leaf.toString(), is("\"x\""));

    final Trie trie = ifTrie();
    assertThat(trie.type(), is("if"));
    assertThat(trie.hasValue(), is(false));
    assertThat(trie.isSequence(), is(false));
    assertThat(trie.fields().size(), is(3));
    assertThat(trie.elements().isEmpty(), is(true));
    assertThat(trie.toString(),
        is("if{predicate=variable{name=\"c\"}, then=literal{value=1}, "
            + "else=literal{value=2}}"));

    final Trie seq = S.sequence("tuple", ImmutableList.of(S.leaf(1L), leaf));
    assertThat(seq.isSequence(), is(true));
    assertThat(seq.fields().isEmpty(), is(true));
    assertThat(seq.toString(), is("tuple[1, \"x\"]"));
    assertThat(S.keyed("this", ImmutableMap.of()).toString(), is("this"));
    assertThat(S.sequence("block", ImmutableList.of()).toString(),
        is("block[]"));
  }

  @Test
  void testIsTrie() {
    assertThat(S.isTrie(ifTrie()), is(true));
    assertThat(S.isTrie(S.leaf(1)), is(true));
    assertThat(S.isTrie("x"), is(false));
    assertThat(S.isTrie(ImmutableMap.of()), is(false));

    // A node is valid only if all of its descendants are nodes of this
    // service.
    final Trie foreign = new ForeignTrie();
    final Trie parent =
        S.keyed("splice", ImmutableMap.of("expression", foreign));
    assertThat(S.isTrie(parent), is(false));
    assertThat(S.isTrie(S.sequence("block", ImmutableList.of(parent))),
        is(false));
  }

  /** Checks validity at every level of a deep trie, as the compiler does
   * after building each node. Each check looks at a node and its immediate
   * children, so the whole loop is linear in the depth. */
  @Test
  void testIsTrieDeep() {
    Trie trie = literal(0L);
    for (int i = 0; i < 100_000; i++) {
      trie = S.keyed("splice", ImmutableMap.of("expression", trie));
      assertThat(S.isTrie(trie), is(true));
    }
    assertThat(trie.type(), is("splice"));
  }

  @Test
  void testAddress() {
    final Trie trie =
        S.sequence("block", ImmutableList.of(ifTrie(), variable("d")));
    assertThat(trie.at(0, "predicate", "name").value(), is("c"));
    assertThat(trie.at(1), is(variable("d")));
    assertThat(trie.at(ImmutableList.of()), is(trie));
    assertThat(trie.at(2), nullValue());
    assertThat(trie.at(-1), nullValue());
    assertThat(trie.at("predicate"), nullValue());
    assertThat(trie.at(0, 0), nullValue());
    assertThat(trie.at(0, "then", "value", "x"), nullValue());
  }

  @Test
  void testForEachAddress() {
    final List<String> list = new ArrayList<>();
    Tries.forEachAddress(ifTrie(),
        (address, node) -> list.add(address + " " + node.type()));
    assertThat(list,
        is(ImmutableList.of("[] if",
            "[predicate] variable",
            "[predicate, name] null",
            "[then] literal",
            "[then, value] null",
            "[else] literal",
            "[else, value] null")));

    final List<List<Object>> addresses = new ArrayList<>();
    Tries.forEachAddress(
        S.sequence("tuple", ImmutableList.of(S.leaf(1L), S.leaf(2L))),
        (address, node) -> addresses.add(address));
    assertThat(addresses.toString(), is("[[], [0], [1]]"));
  }

  @Test
  void testEquals() {
    assertThat(ifTrie(), is(ifTrie()));
    assertThat(ifTrie().hashCode(), is(ifTrie().hashCode()));
    assertThat(literal(1L).equals(literal(2L)), is(false));
    assertThat(literal(1L).equals(literal("1")), is(false));
    assertThat(
        S.sequence("t", ImmutableList.of()).equals(
            S.keyed("t", ImmutableMap.of())),
        is(false));
  }

  /** The hash depends on content, not on the order in which fields were
   * added. */
  @Test
  void testHash() {
    final Trie a =
        S.keyed("t", ImmutableMap.of("x", S.leaf(1L), "y", S.leaf(2L)));
    final Trie b =
        S.keyed("t", ImmutableMap.of("y", S.leaf(2L), "x", S.leaf(1L)));
    assertThat(Tries.hash(a), is(Tries.hash(b)));
    assertThat(Tries.hash(ifTrie()), is(Tries.hash(ifTrie())));
    assertThat(Tries.hash(literal(1L)).equals(Tries.hash(literal("1"))),
        is(false));
    assertThat(Tries.hash(literal(1L)).equals(Tries.hash(literal(2L))),
        is(false));
    assertThat(Tries.hash(a).bits(), is(128));
  }

  @Test
  void testPrettyString() {
    final Trie trie = ifTrie();
    assertThat(Tries.toPrettyString(trie, 100), is(trie.toString()));
    assertThat(Tries.toPrettyString(trie, 30),
        is("if{\n"
            + "  predicate=variable{name=\"c\"},\n"
            + "  then=literal{value=1},\n"
            + "  else=literal{value=2}}"));
    final Trie seq =
        S.sequence("block", ImmutableList.of(S.leaf(1L), S.leaf(2L)));
    assertThat(Tries.toPrettyString(seq, 5), is("block[\n  1,\n  2]"));
  }

  /** Implementation of {@link Trie} that is not created by a
   * {@link TrieService}. */
  private static class ForeignTrie implements Trie {
    @Override
    public String type() {
      return "foreign";
    }

    @Override
    public boolean hasValue() {
      return false;
    }

    @Override
    public @Nullable Object value() {
      return null;
    }

    @Override
    public boolean isSequence() {
      return false;
    }

    @Override
    public Map<String, Trie> fields() {
      return ImmutableMap.of();
    }

    @Override
    public List<Trie> elements() {
      return ImmutableList.of();
    }

    @Override
    public @Nullable Trie get(Object key) {
      return null;
    }
  }
}

// End TriesTest.java
