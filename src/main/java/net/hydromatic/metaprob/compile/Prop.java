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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls the behavior of the compiler.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}, usually the map of a
 * {@link Session}. A property that has no value in the map has its default
 * value.
 */
public enum Prop {
  /**
   * String property "namespace" is the namespace whose top-level environment
   * is captured by compiled programs. Default is "user".
   */
  NAMESPACE("namespace", String.class, true, "user"),

  /**
   * Boolean property "warnLateDefinition" controls whether the compiler warns
   * if a definition is the last statement of a block. Default is true.
   */
  WARN_LATE_DEFINITION("warnLateDefinition", Boolean.class, true, true),

  /**
   * Enum property "identityKey" controls how the identity key of a compiled
   * program is derived from its source. Default is {@link IdentityKey#HASH}.
   */
  IDENTITY_KEY("identityKey", IdentityKey.class, true, IdentityKey.HASH),

  /**
   * Integer property "lineWidth" is the width at which trace trees are
   * broken over several lines when printed. Default is 79.
   */
  LINE_WIDTH("lineWidth", Integer.class, true, 79);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /** Map of all properties, keyed by both upper-case and camel-case name. */
  public static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : values()) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new RuntimeException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) get(map);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    return type.cast(get(map));
  }

  /** Sets the value of a property, allowing strings for enum, boolean and
   * integer types. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = (String) value;
      if (type.isEnum()) {
        Optional<Enum> optional =
            Enums.getIfPresent((Class<Enum>) type, s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(Enum::name)
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new RuntimeException("value must be one of: " + values);
        }
        set(map, optional.get());
        return;
      }
      if (type == Boolean.class) {
        set(map, Boolean.valueOf(s));
        return;
      }
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
        } catch (NumberFormatException e) {
          throw new RuntimeException(
              "value for property " + camelName + " must be an integer", e);
        }
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new RuntimeException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new RuntimeException("value for property must have type " + type);
      }
      map.put(this, value);
    }
  }

  /** Allowed values for {@link #IDENTITY_KEY} property. */
  public enum IdentityKey {
    /** The key is a hash of the content of the program's source trie. The
     * default. */
    HASH,
    /** The key is the program's source trie itself. */
    TRACE
  }
}

// End Prop.java
