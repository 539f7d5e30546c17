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
package net.hydromatic.metaprob.ast;

import static java.util.Objects.requireNonNull;

/**
 * Keyword constant, such as {@code :heads}.
 *
 * <p>Keywords evaluate to themselves. Two keywords are equal if they have the
 * same name.
 */
public final class Keyword implements Comparable<Keyword> {
  public final String name;

  private Keyword(String name) {
    this.name = requireNonNull(name);
  }

  /** Creates a keyword with a given name (without the leading colon). */
  public static Keyword of(String name) {
    return new Keyword(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Keyword && name.equals(((Keyword) o).name);
  }

  @Override
  public int compareTo(Keyword o) {
    return name.compareTo(o.name);
  }

  @Override
  public String toString() {
    return ":" + name;
  }
}

// End Keyword.java
