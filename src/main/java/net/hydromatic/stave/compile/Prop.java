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
package net.hydromatic.stave.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls effect inference.
 *
 * @see EffectInferrer#EffectInferrer(LookupTable, Map, Map, Tracer)
 */
public enum Prop {
  /**
   * Integer property "builtinNameArity" is the arity assumed for a built-in
   * operator that is referenced by name rather than applied; for example,
   * {@code iadd} in {@code fold(s, 0, iadd)}. Default is 2.
   */
  BUILTIN_NAME_ARITY("builtinNameArity", Integer.class, 2),

  /**
   * Integer property "locationLength" is the maximum length of the
   * expression text in the location of an error. Longer text is abbreviated
   * with "...". Default is 70.
   */
  LOCATION_LENGTH("locationLength", Integer.class, 70),

  /**
   * Boolean property "trace" controls whether inference events are printed
   * to standard output if no tracer is given. Default is false.
   */
  TRACE("trace", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue),
        "default value of property %s must have type %s", camelName, type);
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return (T) (o == null ? defaultValue : o);
  }

  /**
   * Sets the value of a property. Checks that its type is valid. A null value
   * removes the property, so that it reverts to its default value.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new RuntimeException("value for property must have type "
            + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
