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

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import java.util.Optional;
import net.hydromatic.stave.effect.ArrowEffect;
import net.hydromatic.stave.effect.Component;
import org.junit.jupiter.api.Test;

/** Test for {@link BuiltIn}. */
public class BuiltInTest {
  @Test void testLookup() {
    assertThat(BuiltIn.lookup("iadd"), is(Optional.of(BuiltIn.IADD)));
    assertThat(BuiltIn.lookup("+"), is(Optional.of(BuiltIn.IADD)));
    assertThat(BuiltIn.lookup("'"), is(Optional.of(BuiltIn.ASSIGN)));
    assertThat(BuiltIn.lookup("map"), is(Optional.of(BuiltIn.MAP_LAMBDA)));
    assertThat(BuiltIn.lookup("Map"), is(Optional.of(BuiltIn.MAP)));
    assertThat(BuiltIn.lookup("foo"), is(Optional.empty()));
  }

  @Test void testStandardPropagation() {
    assertThat(BuiltIn.standardPropagation(2),
        hasToString("(Read[r0] & Temporal[t0], Read[r1] & Temporal[t1]) => "
            + "Read[r0, r1] & Temporal[t0, t1]"));
    assertThat(BuiltIn.standardPropagation(1),
        hasToString("(Read[r0] & Temporal[t0]) => Read[r0] & Temporal[t0]"));
    assertThat(BuiltIn.standardPropagation(0), hasToString("() => Pure"));
    assertThat(BuiltIn.EQ.signature(3), is(BuiltIn.standardPropagation(3)));
  }

  @Test void testActionPropagation() {
    assertThat(BuiltIn.AND.signature(1),
        hasToString("(Read[r0] & Update[u0] & Temporal[t0]) => "
            + "Read[r0] & Update[u0] & Temporal[t0]"));
    assertThat(
        BuiltIn.propagateComponents(2, Component.Kind.UPDATE),
        hasToString("(Update[u0], Update[u1]) => Update[u0, u1]"));
  }

  @Test void testBespokeSignatures() {
    assertThat(BuiltIn.ASSIGN.signature(2),
        hasToString("(Read[r0], Read[r1]) => Read[r1] & Update[r0]"));
    assertThat(BuiltIn.ITE.signature(3),
        hasToString("(Read[r0], Read[r1] & Update[u0], Read[r2] & Update[u0])"
            + " => Read[r0, r1, r2] & Update[u0]"));
    assertThat(BuiltIn.EXISTS.signature(2),
        hasToString("(Read[r0], (Read[r0]) => Read[r1] & Update[u0]) => "
            + "Read[r0, r1] & Update[u0]"));
    assertThat(BuiltIn.FOLD.signature(3),
        hasToString("(Read[r0], Read[r1], (Read[r1], Read[r0]) => Read[r2])"
            + " => Read[r0, r1, r2]"));
    assertThat(BuiltIn.ALWAYS.signature(1),
        hasToString("(Read[r0] & Temporal[t0]) => Temporal[r0, t0]"));
    assertThat(BuiltIn.NEXT.signature(1),
        hasToString("(Read[r0]) => Temporal[r0]"));
    assertThat(BuiltIn.ENABLED.signature(1),
        hasToString("(Read[r0] & Update[u0]) => Read[r0]"));
  }

  /** Every operator has an arrow effect. */
  @Test void testAllAreArrows() {
    for (BuiltIn builtIn : BuiltIn.values()) {
      assertThat(builtIn.name, builtIn.signature(2),
          instanceOf(ArrowEffect.class));
      assertThat(BuiltIn.BY_NAME.get(builtIn.name), is(builtIn));
    }
  }
}

// End BuiltInTest.java
