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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import net.hydromatic.metaprob.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Trie} and {@link TrieService}. */
public abstract class Tries {
  private Tries() {}

  /** Returns the default trie service, which creates immutable nodes. */
  public static TrieService service() {
    return ImmutableTrieService.INSTANCE;
  }

  /**
   * Computes a hash of the content of a trie.
   *
   * <p>The hash depends only on types, field names, element order and leaf
   * values; fields are visited in name order, so it does not depend on the
   * order in which fields were added. Equal tries have equal hashes, in this
   * and any other JVM.
   */
  public static HashCode hash(Trie trie) {
    final Hasher hasher = Hashing.murmur3_128().newHasher();
    hash(hasher, trie);
    return hasher.hash();
  }

  private static void hash(Hasher hasher, Trie trie) {
    final String type = trie.type();
    hasher.putString(type == null ? "" : type, StandardCharsets.UTF_8)
        .putChar('\0');
    if (trie.hasValue()) {
      final Object value = requireNonNull(trie.value());
      hasher.putChar('=')
          .putString(value.getClass().getName(), StandardCharsets.UTF_8)
          .putChar('\0')
          .putString(value.toString(), StandardCharsets.UTF_8)
          .putChar('\0');
    }
    if (trie.isSequence()) {
      hasher.putChar('[').putInt(trie.elements().size());
      trie.elements().forEach(element -> hash(hasher, element));
    } else {
      hasher.putChar('{').putInt(trie.fields().size());
      ImmutableSortedMap.copyOf(trie.fields()).forEach((name, child) -> {
        hasher.putString(name, StandardCharsets.UTF_8).putChar('\0');
        hash(hasher, child);
      });
    }
  }

  /**
   * Calls an action for each node of a trie, with its address, in pre-order.
   * The root has the empty address.
   */
  public static void forEachAddress(Trie trie,
      BiConsumer<List<Object>, Trie> action) {
    forEachAddress(trie, new ArrayList<>(), action);
  }

  private static void forEachAddress(Trie trie, List<Object> address,
      BiConsumer<List<Object>, Trie> action) {
    action.accept(ImmutableList.copyOf(address), trie);
    if (trie.isSequence()) {
      for (int i = 0; i < trie.elements().size(); i++) {
        address.add(i);
        forEachAddress(trie.elements().get(i), address, action);
        address.remove(address.size() - 1);
      }
    } else {
      trie.fields().forEach((name, child) -> {
        address.add(name);
        forEachAddress(child, address, action);
        address.remove(address.size() - 1);
      });
    }
  }

  /**
   * Writes a trie as a string, breaking it over several lines if it does not
   * fit within {@code lineWidth} characters.
   */
  public static String toPrettyString(Trie trie, int lineWidth) {
    final StringBuilder b = new StringBuilder();
    pretty(b, trie, 0, lineWidth);
    return b.toString();
  }

  private static void pretty(StringBuilder b, Trie trie, int indent,
      int lineWidth) {
    final String s = trie.toString();
    if (indent + s.length() <= lineWidth
        || trie.fields().isEmpty() && trie.elements().isEmpty()) {
      b.append(s);
      return;
    }
    final String type = trie.type();
    b.append(type == null ? "" : type);
    final String pad = Strings.repeat(" ", indent + 2);
    if (trie.isSequence()) {
      b.append("[");
      for (int i = 0; i < trie.elements().size(); i++) {
        b.append(i == 0 ? "\n" : ",\n").append(pad);
        pretty(b, trie.elements().get(i), indent + 2, lineWidth);
      }
      b.append("]");
    } else {
      b.append("{");
      final int[] i = {0};
      trie.fields().forEach((name, child) -> {
        b.append(i[0]++ == 0 ? "\n" : ",\n").append(pad).append(name)
            .append('=');
        pretty(b, child, indent + 2, lineWidth);
      });
      b.append("}");
    }
  }

  /** Implementation of {@link TrieService} that creates immutable tries. */
  private enum ImmutableTrieService implements TrieService {
    INSTANCE;

    @Override
    public Trie leaf(Object value) {
      return new ImmutableTrie(null, requireNonNull(value, "value"),
          ImmutableMap.of(), null);
    }

    @Override
    public Trie keyed(String type, Map<String, Trie> fields) {
      return new ImmutableTrie(requireNonNull(type, "type"), null,
          ImmutableMap.copyOf(fields), null);
    }

    @Override
    public Trie sequence(String type, List<Trie> elements) {
      return new ImmutableTrie(requireNonNull(type, "type"), null,
          ImmutableMap.of(), ImmutableList.copyOf(elements));
    }

    @Override
    public boolean isTrie(Object o) {
      return o instanceof ImmutableTrie && ((ImmutableTrie) o).isValid();
    }
  }

  /** Immutable trie node. */
  private static class ImmutableTrie implements Trie {
    private final @Nullable String type;
    private final @Nullable Object value;
    private final ImmutableMap<String, Trie> fields;
    private final @Nullable ImmutableList<Trie> elements;
    private final boolean valid;

    ImmutableTrie(@Nullable String type, @Nullable Object value,
        ImmutableMap<String, Trie> fields,
        @Nullable ImmutableList<Trie> elements) {
      this.type = type;
      this.value = value;
      this.fields = requireNonNull(fields);
      this.elements = elements;
      this.valid = computeValid();
    }

    /** A node is valid if it is a leaf with a value, or a typed node whose
     * children are all valid. Each child computed its own validity when it
     * was created, so only the immediate children are visited. */
    private boolean computeValid() {
      if (type == null) {
        return value != null && fields.isEmpty() && elements == null;
      }
      for (Trie child : fields.values()) {
        if (!isValid(child)) {
          return false;
        }
      }
      if (elements != null) {
        for (Trie child : elements) {
          if (!isValid(child)) {
            return false;
          }
        }
      }
      return true;
    }

    private static boolean isValid(Trie child) {
      return child instanceof ImmutableTrie && ((ImmutableTrie) child).valid;
    }

    boolean isValid() {
      return valid;
    }

    @Override
    public @Nullable String type() {
      return type;
    }

    @Override
    public boolean hasValue() {
      return value != null;
    }

    @Override
    public @Nullable Object value() {
      return value;
    }

    @Override
    public boolean isSequence() {
      return elements != null;
    }

    @Override
    public Map<String, Trie> fields() {
      return fields;
    }

    @Override
    public List<Trie> elements() {
      return elements == null ? ImmutableList.of() : elements;
    }

    @Override
    public @Nullable Trie get(Object key) {
      if (key instanceof Integer) {
        final int i = (Integer) key;
        return elements != null && i >= 0 && i < elements.size()
            ? elements.get(i)
            : null;
      }
      return fields.get(key);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, value, fields, elements);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ImmutableTrie
              && Objects.equals(type, ((ImmutableTrie) o).type)
              && Objects.equals(value, ((ImmutableTrie) o).value)
              && fields.equals(((ImmutableTrie) o).fields)
              && Objects.equals(elements, ((ImmutableTrie) o).elements);
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      if (type == null) {
        return b.append(value instanceof String
            ? Parsers.quoteString((String) value)
            : String.valueOf(value)).toString();
      }
      b.append(type);
      if (elements != null) {
        b.append('[');
        for (int i = 0; i < elements.size(); i++) {
          b.append(i == 0 ? "" : ", ").append(elements.get(i));
        }
        return b.append(']').toString();
      }
      if (!fields.isEmpty()) {
        b.append('{');
        final int[] i = {0};
        fields.forEach((name, child) ->
            b.append(i[0]++ == 0 ? "" : ", ").append(name).append('=')
                .append(child));
        b.append('}');
      }
      return b.toString();
    }
  }
}

// End Tries.java
