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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.stave.util.NameGenerator;

/**
 * Effect that is universally quantified over some of its variables.
 *
 * <p>Each use of a scheme calls {@link #instantiate}, which renames the
 * quantified variables to fresh variables. Two uses therefore never share
 * unification state, and an operator may have a different effect at each
 * call site.
 */
public final class EffectScheme {
  /** Quantified effect variables and entity variables. */
  public final Names quantified;
  public final Effect effect;

  private EffectScheme(Names quantified, Effect effect) {
    this.quantified = requireNonNull(quantified);
    this.effect = requireNonNull(effect);
  }

  /** Creates a scheme that is quantified over the given names. */
  public static EffectScheme of(Names quantified, Effect effect) {
    return new EffectScheme(quantified, effect);
  }

  /** Creates a scheme that is not quantified over any variables. */
  public static EffectScheme monomorphic(Effect effect) {
    return new EffectScheme(Names.EMPTY, effect);
  }

  /** Creates a scheme that is quantified over all variables in an effect. */
  public static EffectScheme generalize(Effect effect) {
    return new EffectScheme(effect.names(), effect);
  }

  /**
   * Returns a copy of the effect in which each quantified variable is
   * replaced with a fresh variable.
   */
  public Effect instantiate(NameGenerator nameGenerator) {
    if (quantified.isEmpty()) {
      return effect;
    }
    final List<Substitution.Binding> bindings = new ArrayList<>();
    quantified.effectVariables.forEach(name ->
        bindings.add(
            Substitution.bindEffect(name,
                EffectVar.of(nameGenerator.effectVariable()))));
    quantified.entityVariables.forEach(name ->
        bindings.add(
            Substitution.bindEntity(name,
                EntityVar.of(nameGenerator.entityVariable()))));
    try {
      return Substitution.of(bindings).apply(effect);
    } catch (Substitution.CycleException e) {
      // Cannot happen: fresh names are never bound
      throw new AssertionError("Error applying fresh names substitution: "
          + e.getMessage(), e);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(quantified, effect);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof EffectScheme
            && quantified.equals(((EffectScheme) obj).quantified)
            && effect.equals(((EffectScheme) obj).effect);
  }

  @Override
  public String toString() {
    if (quantified.isEmpty()) {
      return effect.toString();
    }
    final StringBuilder buf = new StringBuilder("forall ");
    int i = 0;
    for (String name : quantified.effectVariables) {
      buf.append(i++ > 0 ? ", " : "").append(name);
    }
    for (String name : quantified.entityVariables) {
      buf.append(i++ > 0 ? ", " : "").append(name);
    }
    buf.append(". ");
    return effect.describeTo(buf).toString();
  }
}

// End EffectScheme.java
