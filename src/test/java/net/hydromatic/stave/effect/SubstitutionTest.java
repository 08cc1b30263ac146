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
package net.hydromatic.stave.effect;

import static net.hydromatic.stave.effect.Terms.arrow;
import static net.hydromatic.stave.effect.Terms.concrete;
import static net.hydromatic.stave.effect.Terms.e;
import static net.hydromatic.stave.effect.Terms.effect;
import static net.hydromatic.stave.effect.Terms.read;
import static net.hydromatic.stave.effect.Terms.union;
import static net.hydromatic.stave.effect.Terms.v;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Test for {@link Substitution}. */
public class SubstitutionTest {
  private static Substitution.Binding bind(String name, Entity entity) {
    return Substitution.bindEntity(name, entity);
  }

  @Test void testApplyResolvesChains() throws Exception {
    final Substitution s =
        Substitution.of(bind("r0", v("r1")), bind("r1", concrete("x")));
    assertThat(s.apply(read(v("r0"))), hasToString("Read[x]"));
    assertThat(s.apply(v("r0")), is(concrete("x")));

    // Unbound variables are unchanged
    assertThat(s.apply(read(v("r5"))), hasToString("Read[r5]"));
    assertThat(s.apply(e("e0")), is(e("e0")));

    // Lookup returns the value as bound, not resolved
    assertThat(s.entityValue("r0"), is((Entity) v("r1")));
    assertThat(s.entityValue("r5"), nullValue());
    assertThat(s.effectValue("r0"), nullValue());
  }

  @Test void testApplySimplifies() throws Exception {
    final Substitution s =
        Substitution.of(bind("r0", ConcreteEntity.EMPTY),
            bind("r1", concrete("x")));
    final Effect effect =
        effect(Component.read(union(v("r0"), v("r1"))),
            Component.update(v("r0")));
    assertThat(s.apply(effect), hasToString("Read[x]"));
    assertThat(s.apply(read(v("r0"))), is(ConcreteEffect.PURE));
  }

  @Test void testApplyToArrow() throws Exception {
    final Substitution s =
        Substitution.of(
            Substitution.bindEffect("e1", read(v("r0"))),
            bind("r0", concrete("y")));
    final Effect effect = arrow(e("e1"), e("e1"), read(v("r0")));
    assertThat(s.apply(effect), hasToString("(Read[y], Read[y]) => Read[y]"));
  }

  @Test void testCycle() {
    final Substitution s =
        Substitution.of(bind("r0", v("r1")), bind("r1", v("r0")));
    final Substitution.CycleException e =
        assertThrows(Substitution.CycleException.class,
            () -> s.apply(read(v("r0"))));
    assertThat(e.variable, is("r0"));
    assertThat(e.getMessage(), is("Can't bind r0 to r1: cyclical binding"));
  }

  @Test void testCompose() throws Exception {
    final Substitution older = Substitution.of(bind("r0", v("r1")));
    final Substitution newer =
        Substitution.of(bind("r1", concrete("x")), bind("r0", concrete("y")));
    final Substitution s = Substitution.compose(older, newer);
    // The binding of r0 in "newer" is dropped; "older" already binds r0
    assertThat(s, hasToString("[[x]/r0, [x]/r1]"));
    assertThat(Substitution.compose(Substitution.EMPTY, newer), is(newer));
    assertThat(Substitution.compose(older, Substitution.EMPTY), is(older));
  }

  /** Applying a composed substitution is the same as applying the first
   * substitution and then the second. */
  @Test void testComposeThenApply() throws Exception {
    final Substitution s1 =
        Substitution.of(Substitution.bindEffect("e0", read(v("r0"))));
    final Substitution s2 = Substitution.of(bind("r0", concrete("x", "y")));
    final Effect effect = arrow(e("e0"), read(v("r0")));
    assertThat(Substitution.compose(s1, s2).apply(effect),
        is(s2.apply(s1.apply(effect))));
    assertThat(Substitution.compose(s1, s2).apply(effect),
        hasToString("(Read[x, y]) => Read[x, y]"));
  }

  @Test void testComposeIsAssociative() throws Exception {
    final Substitution a = Substitution.of(bind("r0", v("r1")));
    final Substitution b = Substitution.of(bind("r1", concrete("x")));
    final Substitution c =
        Substitution.of(bind("r2", concrete("y")),
            Substitution.bindEffect("e0", read(v("r0"))));
    final Substitution left =
        Substitution.compose(Substitution.compose(a, b), c);
    final Substitution right =
        Substitution.compose(a, Substitution.compose(b, c));
    assertThat(left, is(right));
    assertThat(left, hasToString("[[x]/r0, [x]/r1, [y]/r2, Read[r0]/e0]"));
  }
}

// End SubstitutionTest.java
