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

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Node of a trace tree.
 *
 * <p>A node has a type (null for a leaf) and either named fields or a
 * sequence of elements; a leaf holds a value. Each node in a tree has an
 * address, the path of field names and element indexes that leads to it from
 * the root.
 *
 * <p>Tries are immutable. Two tries are equal if they have the same type,
 * value and children.
 *
 * @see TrieService
 */
public interface Trie {
  /** Returns the type of this node, or null if it is an untyped leaf. */
  @Nullable String type();

  /** Returns whether this node holds a value. */
  boolean hasValue();

  /** Returns the value held by this node, or null. */
  @Nullable Object value();

  /** Returns whether this node's children are a sequence. */
  boolean isSequence();

  /** Returns the named children of this node; empty if it is a sequence. */
  Map<String, Trie> fields();

  /** Returns the children of this node if it is a sequence; otherwise empty. */
  List<Trie> elements();

  /**
   * Returns the child with a given key, or null.
   *
   * <p>The key is a {@link String} field name, or an {@link Integer} index
   * into a sequence.
   */
  @Nullable Trie get(Object key);

  /** Returns the node at a given address relative to this node, or null. */
  default @Nullable Trie at(List<?> address) {
    Trie trie = this;
    for (Object key : address) {
      trie = trie.get(key);
      if (trie == null) {
        return null;
      }
    }
    return trie;
  }

  /** Returns the node at a given address relative to this node, or null. */
  default @Nullable Trie at(Object... address) {
    return at(Arrays.asList(address));
  }
}

// End Trie.java
