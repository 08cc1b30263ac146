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

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.util.Objects;

/**
 * Names of the effect variables and entity variables that occur in a term.
 *
 * <p>Effect variables and entity variables have separate name spaces.
 */
public final class Names {
  public static final Names EMPTY =
      new Names(ImmutableSortedSet.of(), ImmutableSortedSet.of());

  public final ImmutableSortedSet<String> effectVariables;
  public final ImmutableSortedSet<String> entityVariables;

  private Names(
      ImmutableSortedSet<String> effectVariables,
      ImmutableSortedSet<String> entityVariables) {
    this.effectVariables = effectVariables;
    this.entityVariables = entityVariables;
  }

  /** Creates a Names. */
  public static Names of(
      Iterable<String> effectVariables, Iterable<String> entityVariables) {
    return new Names(
        ImmutableSortedSet.copyOf(effectVariables),
        ImmutableSortedSet.copyOf(entityVariables));
  }

  /** Returns the names of the variables in an effect. */
  public static Names of(Effect effect) {
    final Builder builder = builder();
    effect.collectNames(builder);
    return builder.build();
  }

  /** Returns the names of the variables in an entity. */
  public static Names of(Entity entity) {
    final Builder builder = builder();
    entity.collectNames(builder);
    return builder.build();
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns whether there are no names. */
  public boolean isEmpty() {
    return effectVariables.isEmpty() && entityVariables.isEmpty();
  }

  /** Returns the union of this and another set of names. */
  public Names union(Names names) {
    return builder().addAll(this).addAll(names).build();
  }

  /** Returns the names in this set that are not in another set. */
  public Names minus(Names names) {
    return new Names(
        ImmutableSortedSet.copyOf(
            Sets.difference(effectVariables, names.effectVariables)),
        ImmutableSortedSet.copyOf(
            Sets.difference(entityVariables, names.entityVariables)));
  }

  @Override
  public int hashCode() {
    return Objects.hash(effectVariables, entityVariables);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Names
            && effectVariables.equals(((Names) obj).effectVariables)
            && entityVariables.equals(((Names) obj).entityVariables);
  }

  @Override
  public String toString() {
    return "{effects: " + effectVariables
        + ", entities: " + entityVariables + "}";
  }

  /** Builder for {@link Names}. */
  public static final class Builder {
    private final ImmutableSortedSet.Builder<String> effectVariables =
        ImmutableSortedSet.naturalOrder();
    private final ImmutableSortedSet.Builder<String> entityVariables =
        ImmutableSortedSet.naturalOrder();

    private Builder() {}

    public Builder addEffectVariable(String name) {
      effectVariables.add(name);
      return this;
    }

    public Builder addEntityVariable(String name) {
      entityVariables.add(name);
      return this;
    }

    public Builder addAll(Names names) {
      effectVariables.addAll(names.effectVariables);
      entityVariables.addAll(names.entityVariables);
      return this;
    }

    public Names build() {
      return new Names(effectVariables.build(), entityVariables.build());
    }
  }
}

// End Names.java
