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

/** Implementations of {@link Environment} and {@link ScopeResolver}. */
public abstract class Environments {
  private Environments() {}

  /** Returns a resolver that creates a {@link #topLevel} environment for
   * each namespace. */
  public static ScopeResolver resolver() {
    return Environments::topLevel;
  }

  /** Creates an environment that refers to the top level of a namespace.
   * Two such environments are equal if they have the same namespace. */
  public static Environment topLevel(String namespace) {
    return new TopLevelEnvironment(namespace);
  }

  /** Environment that is the top level of a namespace. */
  private static class TopLevelEnvironment implements Environment {
    private final String namespace;

    TopLevelEnvironment(String namespace) {
      this.namespace = requireNonNull(namespace);
    }

    @Override
    public String namespace() {
      return namespace;
    }

    @Override
    public int hashCode() {
      return namespace.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TopLevelEnvironment
              && namespace.equals(((TopLevelEnvironment) o).namespace);
    }

    @Override
    public String toString() {
      return "#<environment " + namespace + ">";
    }
  }
}

// End Environments.java
