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

import java.util.List;
import java.util.Map;

/**
 * Constructs and recognizes trace tree nodes.
 *
 * <p>The compiler creates nodes only through this interface, so that the
 * engine that consumes the trees can supply its own representation.
 */
public interface TrieService {
  /** Creates an untyped leaf node holding a value. */
  Trie leaf(Object value);

  /** Creates a node of a given type whose children are named fields. */
  Trie keyed(String type, Map<String, Trie> fields);

  /** Creates a node of a given type whose children are a sequence. */
  Trie sequence(String type, List<Trie> elements);

  /** Returns whether an object is a valid node created by this service. */
  boolean isTrie(Object o);
}

// End TrieService.java
