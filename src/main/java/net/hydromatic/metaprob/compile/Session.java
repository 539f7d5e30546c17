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

import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.metaprob.trie.TrieService;
import net.hydromatic.metaprob.trie.Tries;

/**
 * Compilation context.
 *
 * <p>Holds the property values and the collaborators that the compiler
 * consumes: the service that creates trie nodes, and the resolver that
 * provides the scope captured by compiled programs.
 */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;
  public final TrieService trieService;
  public final ScopeResolver scopeResolver;

  /** Creates a Session with given properties and default collaborators. */
  public Session(Map<Prop, Object> map) {
    this(map, Tries.service(), Environments.resolver());
  }

  /** Creates a Session. */
  public Session(Map<Prop, Object> map, TrieService trieService,
      ScopeResolver scopeResolver) {
    this.map = new LinkedHashMap<>(map);
    this.trieService = requireNonNull(trieService);
    this.scopeResolver = requireNonNull(scopeResolver);
  }
}

// End Session.java
