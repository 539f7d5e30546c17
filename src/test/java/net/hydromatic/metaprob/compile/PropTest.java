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

import static net.hydromatic.metaprob.Matchers.throwsA;
import static net.hydromatic.metaprob.Ml.assertError;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.metaprob.trie.Tries;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop} and {@link Session}. */
public class PropTest {
  @Test
  void testDefaults() {
    final Map<Prop, Object> map = ImmutableMap.of();
    assertThat(Prop.NAMESPACE.stringValue(map), is("user"));
    assertThat(Prop.WARN_LATE_DEFINITION.booleanValue(map), is(true));
    assertThat(Prop.IDENTITY_KEY.enumValue(map, Prop.IdentityKey.class),
        is(Prop.IdentityKey.HASH));
    assertThat(Prop.LINE_WIDTH.intValue(map), is(79));
  }

  @Test
  void testLookup() {
    assertThat(Prop.lookup("lineWidth"), is(Prop.LINE_WIDTH));
    assertThat(Prop.lookup("warnLateDefinition"),
        is(Prop.WARN_LATE_DEFINITION));
    assertThat(Prop.BY_NAME.size(), is(Prop.values().length));
    assertError(() -> Prop.lookup("bogus"),
        throwsA(RuntimeException.class, is("property bogus not found")));
  }

  @Test
  void testSetLenient() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.IDENTITY_KEY.setLenient(map, "trace");
    assertThat(Prop.IDENTITY_KEY.enumValue(map, Prop.IdentityKey.class),
        is(Prop.IdentityKey.TRACE));
    Prop.LINE_WIDTH.setLenient(map, "40");
    assertThat(Prop.LINE_WIDTH.intValue(map), is(40));
    Prop.WARN_LATE_DEFINITION.setLenient(map, "false");
    assertThat(Prop.WARN_LATE_DEFINITION.booleanValue(map), is(false));
    Prop.NAMESPACE.setLenient(map, "models");
    assertThat(Prop.NAMESPACE.stringValue(map), is("models"));

    assertError(() -> Prop.IDENTITY_KEY.setLenient(map, "bogus"),
        throwsA(RuntimeException.class,
            is("value must be one of: 'HASH', 'TRACE'")));
    assertError(() -> Prop.LINE_WIDTH.setLenient(map, "wide"),
        throwsA(RuntimeException.class,
            is("value for property lineWidth must be an integer")));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertError(() -> Prop.LINE_WIDTH.set(map, "40"),
        throwsA(RuntimeException.class,
            is("value for property must have type class java.lang.Integer")));
    assertError(() -> Prop.NAMESPACE.set(map, null),
        throwsA(RuntimeException.class, is("property is required")));
    assertError(() -> Prop.LINE_WIDTH.booleanValue(map),
        throwsA(IllegalArgumentException.class,
            is("invalid type class java.lang.Integer for property "
                + "lineWidth")));
  }

  /** A session copies its properties. */
  @Test
  void testSession() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.LINE_WIDTH.set(map, 20);
    final Session session = new Session(map);
    map.clear();
    assertThat(Prop.LINE_WIDTH.intValue(session.map), is(20));
    assertThat(session.trieService, is(Tries.service()));
    assertThat(session.scopeResolver.resolveTopLevel("a"),
        is(Environments.topLevel("a")));
    assertThat(Environments.topLevel("a").toString(),
        is("#<environment a>"));
  }
}

// End PropTest.java
