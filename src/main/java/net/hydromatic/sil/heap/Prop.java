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
package net.hydromatic.sil.heap;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls the behavior of the heap layer.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}, usually the one in a
 * {@link Session}.
 */
public enum Prop {
  /**
   * Boolean property "nelseg"; whether {@link Sigmas#toSigmaNe} splits each
   * possibly-empty list segment into its empty and non-empty cases. Default
   * false.
   */
  NELSEG("nelseg", Boolean.class, false),

  /**
   * Boolean property "compactParameterBodies"; whether {@link SharingEnv}
   * compacts the bodies of list-segment parameters. Default true.
   */
  COMPACT_PARAMETER_BODIES("compactParameterBodies", Boolean.class, true),

  /**
   * String property "freshIdentName"; the name of existential identifiers
   * created by {@link Instantiator}. Default "t".
   */
  FRESH_IDENT_NAME("freshIdentName", String.class, "t");

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /** Map of all properties, keyed by both upper-case and camel-case name. */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties, sorted by camel-case name. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /**
   * Looks up a property by name.
   *
   * @throws IllegalArgumentException if not found; never returns null
   */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    checkArgument(prop != null, "property %s not found", propName);
    return prop;
  }

  /** Returns the value of a property, or its default value. */
  public Object get(Map<Prop, Object> map) {
    final Object o = map.get(this);
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

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) get(map);
  }

  /**
   * Sets the value of a property; null restores the default. Checks that the
   * value's type is valid.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      checkArgument(
          type.isInstance(value),
          "value for property %s must have type %s",
          camelName,
          type);
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous
   * value or null.
   */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
