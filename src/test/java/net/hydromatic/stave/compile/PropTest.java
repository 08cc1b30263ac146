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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Test for {@link Prop}. */
public class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.BUILTIN_NAME_ARITY.intValue(map), is(2));
    assertThat(Prop.LOCATION_LENGTH.intValue(map), is(70));
    assertThat(Prop.TRACE.booleanValue(map), is(false));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.LOCATION_LENGTH.set(map, 20);
    Prop.TRACE.set(map, true);
    assertThat(Prop.LOCATION_LENGTH.intValue(map), is(20));
    assertThat(Prop.TRACE.booleanValue(map), is(true));
    assertThat(map.size(), is(2));

    // Setting null reverts to the default
    Prop.LOCATION_LENGTH.set(map, null);
    assertThat(Prop.LOCATION_LENGTH.intValue(map), is(70));
    assertThat(map.containsKey(Prop.LOCATION_LENGTH), is(false));
    Prop.TRACE.set(map, null);
    assertThat(Prop.TRACE.booleanValue(map), is(false));
    assertThat(map.isEmpty(), is(true));
  }

  @Test void testInvalidType() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThrows(RuntimeException.class,
        () -> Prop.LOCATION_LENGTH.set(map, "twenty"));
    assertThat(map.isEmpty(), is(true));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.TRACE.intValue(map));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.BUILTIN_NAME_ARITY.booleanValue(map));
  }

  @Test void testCamelName() {
    assertThat(Prop.BUILTIN_NAME_ARITY.camelName, is("builtinNameArity"));
    assertThat(Prop.LOCATION_LENGTH.camelName, is("locationLength"));
    assertThat(Prop.TRACE.camelName, is("trace"));
  }
}

// End PropTest.java
