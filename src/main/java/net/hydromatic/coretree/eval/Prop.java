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
package net.hydromatic.coretree.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.coretree.util.ContractException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * <p>Configuration is a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value.
 *
 * @see net.hydromatic.coretree.compile.Meta
 */
public enum Prop {
  /**
   * String property "metaModule" is the name of the module that the calls in
   * a meta tree refer to, and that the evaluator accepts. Default is "core".
   */
  META_MODULE("metaModule", String.class, true, "core"),

  /**
   * String property "metaVarMarker" is the annotation that marks a variable
   * as a meta-variable. A meta-variable is not quoted; the marker is removed.
   * Default is "meta_var".
   */
  META_VAR_MARKER("metaVarMarker", String.class, true, "meta_var"),

  /**
   * Boolean property "batchLists" controls whether a run of two or more
   * list cells is quoted as one call to {@code make_list}, rather than one
   * call to {@code c_cons} per cell. Default is true.
   */
  BATCH_LISTS("batchLists", Boolean.class, true, true);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
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
      throw new ContractException("property " + propName + " not found");
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
    ContractException.check(type == requestedType,
        "invalid type %s for property %s", requestedType, camelName);
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

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new ContractException("property " + camelName
            + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new ContractException("value for property " + camelName
            + " must have type " + type);
      }
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous value
   * or null.
   */
  public Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
