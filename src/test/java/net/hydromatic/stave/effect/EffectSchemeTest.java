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
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import net.hydromatic.stave.util.NameGenerator;
import org.junit.jupiter.api.Test;

/** Test for {@link EffectScheme}. */
public class EffectSchemeTest {
  @Test void testGeneralize() {
    final Effect effect =
        arrow(effect(Component.read(v("r0")), Component.update(v("u0"))),
            read(v("r0")), e("e1"));
    final EffectScheme scheme = EffectScheme.generalize(effect);
    assertThat(scheme.quantified,
        hasToString("{effects: [e1], entities: [r0, u0]}"));
    assertThat(scheme,
        hasToString("forall e1, r0, u0. (Read[r0], e1) => Read[r0] & "
            + "Update[u0]"));
  }

  @Test void testInstantiate() {
    final NameGenerator nameGenerator = new NameGenerator();
    final Effect effect = arrow(e("e0"), read(v("r0")), e("e0"));
    final EffectScheme scheme = EffectScheme.generalize(effect);
    final Effect instance1 = scheme.instantiate(nameGenerator);
    assertThat(instance1, hasToString("(Read[_v1], _e0) => _e0"));

    // Each instance has new names
    final Effect instance2 = scheme.instantiate(nameGenerator);
    assertThat(instance2, hasToString("(Read[_v3], _e2) => _e2"));
    assertThat(nameGenerator.count(), is(4));
  }

  /** An instance of a generalized effect is the same effect, up to a
   * consistent renaming of its variables. */
  @Test void testInstanceIsRenaming() throws Exception {
    final NameGenerator nameGenerator = new NameGenerator();
    final Effect effect =
        arrow(effect(Component.read(union(v("r0"), v("r1")))),
            read(v("r0")), read(v("r1")));
    final Effect instance =
        EffectScheme.generalize(effect).instantiate(nameGenerator);
    assertThat(instance, not(is(effect)));
    final Substitution back =
        Substitution.of(
            ImmutableList.of(Substitution.bindEntity("_v0", v("r0")),
                Substitution.bindEntity("_v1", v("r1"))));
    assertThat(back.apply(instance), is(effect));
  }

  @Test void testMonomorphic() {
    final Effect effect = read(v("r0"));
    final EffectScheme scheme = EffectScheme.monomorphic(effect);
    assertThat(scheme.quantified.isEmpty(), is(true));
    assertThat(scheme.instantiate(new NameGenerator()),
        sameInstance(effect));
    assertThat(scheme, hasToString("Read[r0]"));
  }

  /** Variables that are not quantified keep their names. */
  @Test void testPartialQuantification() {
    final Effect effect =
        arrow(effect(Component.read(union(v("r0"), v("r1")))),
            read(v("r0")));
    final EffectScheme scheme =
        EffectScheme.of(Names.of(read(v("r0"))), effect);
    assertThat(scheme, hasToString("forall r0. (Read[r0]) => Read[r0, r1]"));
    assertThat(scheme.instantiate(new NameGenerator()),
        hasToString("(Read[_v0]) => Read[_v0, r1]"));
  }

  @Test void testConcreteIsUnchanged() {
    final Effect effect = read(concrete("x"));
    final EffectScheme scheme = EffectScheme.generalize(effect);
    assertThat(scheme.quantified.isEmpty(), is(true));
    assertThat(scheme.instantiate(new NameGenerator()), is(effect));
  }
}

// End EffectSchemeTest.java
