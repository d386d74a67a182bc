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
package net.hydromatic.dependentc.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Option of a compilation run.
 *
 * <p>A run's options are a {@code Map<Prop, Object>}. An option that is
 * absent from the map takes its default.
 *
 * @see Compiles#check
 */
public enum Prop {
  /** Whether the evaluator replaces a name declared with an initializer by
   * that initializer, so that after "type T = u32;" the type "T" is "u32".
   * Boolean, default true. */
  UNFOLD_DEFINITIONS(Boolean.class, true),

  /** Most function applications that one evaluation may reduce before it
   * fails with {@link TypeException.Kind#EVALUATION_LIMIT}. Integer, default
   * 0, meaning unlimited. */
  EVAL_STEP_LIMIT(Integer.class, 0),

  /** Whether a failed declaration leaves the rest of the translation unit to
   * be checked. Boolean, default true. */
  CONTINUE_ON_ERROR(Boolean.class, true);

  /** Name in lower camel case, e.g. "evalStepLimit". */
  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  Prop(Class<?> type, Object defaultValue) {
    checkArgument(type.isInstance(defaultValue));
    this.camelName =
        CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());
    this.type = type;
    this.defaultValue = defaultValue;
  }

  /** Finds an option by its camel-case or upper-case name. */
  public static Prop lookup(String name) {
    for (Prop prop : values()) {
      if (prop.camelName.equals(name) || prop.name().equals(name)) {
        return prop;
      }
    }
    throw new IllegalArgumentException("unknown option '" + name + "'");
  }

  /** Returns this option's value in {@code map}, or its default. */
  public Object get(Map<Prop, Object> map) {
    return map.getOrDefault(this, defaultValue);
  }

  public boolean booleanValue(Map<Prop, Object> map) {
    return valueAs(Boolean.class, map);
  }

  public int intValue(Map<Prop, Object> map) {
    return valueAs(Integer.class, map);
  }

  private <T> T valueAs(Class<T> requested, Map<Prop, Object> map) {
    checkArgument(type == requested, "option %s is %s, not %s", camelName,
        type.getSimpleName(), requested.getSimpleName());
    return requested.cast(get(map));
  }

  /** Stores a value for this option in a mutable map. A null value removes
   * the option, so that it reverts to its default. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
      return;
    }
    checkArgument(type.isInstance(value), "option %s requires %s, got '%s'",
        camelName, type.getSimpleName(), value);
    map.put(this, value);
  }
}

// End Prop.java
