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

import java.util.Objects;
import net.hydromatic.metaprob.trie.Trie;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A program (function literal) after compilation, with the information that
 * the inference engine needs in order to recognize it and to execute it.
 *
 * <p>The identity key is derived from the program's source, not from object
 * identity, so two compilations of the same source have equal keys.
 */
public class CompiledProgram {
  /** Type of the node returned by {@link #trace()}. */
  public static final String TYPE = "prob prog";

  /** Name to which the program is bound, or null if it is anonymous. */
  public final @Nullable String name;

  /** Identity key: a hex string if the key is a hash, otherwise the source
   * trie. */
  public final Object key;

  /** Trace tree of the program's source. */
  public final Trie source;

  /** Scope captured when the program was compiled. */
  public final Environment environment;

  private final Trie trace;

  CompiledProgram(@Nullable String name, Object key, Trie source,
      Environment environment, Trie trace) {
    this.name = name;
    this.key = requireNonNull(key);
    this.source = requireNonNull(source);
    this.environment = requireNonNull(environment);
    this.trace = requireNonNull(trace);
  }

  /**
   * Returns a trie of type {@link #TYPE} with fields "name" (the identity
   * key), "source" (the source trie) and "environment" (the captured scope).
   */
  public Trie trace() {
    return trace;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, key, environment);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof CompiledProgram
            && Objects.equals(name, ((CompiledProgram) o).name)
            && key.equals(((CompiledProgram) o).key)
            && source.equals(((CompiledProgram) o).source)
            && environment.equals(((CompiledProgram) o).environment);
  }

  @Override
  public String toString() {
    return "program " + (name == null ? "<anonymous>" : name) + " " + key;
  }
}

// End CompiledProgram.java
