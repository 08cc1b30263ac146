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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Ordered list of bindings from effect variables to effects and from entity
 * variables to entities.
 *
 * <p>A substitution is applied to a term by replacing each bound variable
 * with its value, repeatedly, until no bound variable remains. If a variable
 * is reached again while its own value is being expanded, the bindings are
 * cyclic and application fails with a {@link CycleException}.
 */
public final class Substitution implements EffectUnifier.Result {
  /** Substitution that has no bindings, and so maps every term to itself. */
  public static final Substitution EMPTY =
      new Substitution(ImmutableList.of());

  public final ImmutableList<Binding> bindings;
  private final ImmutableMap<String, Effect> effectMap;
  private final ImmutableMap<String, Entity> entityMap;

  private Substitution(ImmutableList<Binding> bindings) {
    this.bindings = requireNonNull(bindings);
    final Map<String, Effect> effectMap = new LinkedHashMap<>();
    final Map<String, Entity> entityMap = new LinkedHashMap<>();
    for (Binding binding : bindings) {
      // If a variable is bound more than once, the first binding wins
      if (binding instanceof EffectBinding) {
        effectMap.putIfAbsent(binding.name, ((EffectBinding) binding).value);
      } else {
        entityMap.putIfAbsent(binding.name, ((EntityBinding) binding).value);
      }
    }
    this.effectMap = ImmutableMap.copyOf(effectMap);
    this.entityMap = ImmutableMap.copyOf(entityMap);
  }

  /** Creates a Substitution. */
  public static Substitution of(Iterable<? extends Binding> bindings) {
    final ImmutableList<Binding> list = ImmutableList.copyOf(bindings);
    return list.isEmpty() ? EMPTY : new Substitution(list);
  }

  /** Creates a Substitution. */
  public static Substitution of(Binding... bindings) {
    return of(Arrays.asList(bindings));
  }

  /** Creates a binding of an effect variable to an effect. */
  public static Binding bindEffect(String name, Effect value) {
    return new EffectBinding(name, value);
  }

  /** Creates a binding of an entity variable to an entity. */
  public static Binding bindEntity(String name, Entity value) {
    return new EntityBinding(name, value);
  }

  /**
   * Composes two substitutions.
   *
   * <p>Applies {@code newer} to the value of each binding in {@code older},
   * then appends the bindings of {@code newer} whose variables are not bound
   * in {@code older}. Applying the result is equivalent to applying
   * {@code older} and then {@code newer}.
   */
  public static Substitution compose(Substitution older, Substitution newer)
      throws CycleException {
    if (newer.bindings.isEmpty()) {
      return older;
    }
    if (older.bindings.isEmpty()) {
      return newer;
    }
    final List<Binding> list = new ArrayList<>();
    for (Binding binding : older.bindings) {
      list.add(binding.apply(newer));
    }
    for (Binding binding : newer.bindings) {
      if (!older.binds(binding)) {
        list.add(binding);
      }
    }
    return of(list);
  }

  /** Returns whether this substitution binds the variable of a binding. */
  private boolean binds(Binding binding) {
    return binding instanceof EffectBinding
        ? effectMap.containsKey(binding.name)
        : entityMap.containsKey(binding.name);
  }

  /** Returns the value bound to an effect variable, or null. */
  public @Nullable Effect effectValue(String name) {
    return effectMap.get(name);
  }

  /** Returns the value bound to an entity variable, or null. */
  public @Nullable Entity entityValue(String name) {
    return entityMap.get(name);
  }

  /** Returns whether this substitution has no bindings. */
  public boolean isEmpty() {
    return bindings.isEmpty();
  }

  /** Applies this substitution to an effect, and simplifies the result. */
  public Effect apply(Effect effect) throws CycleException {
    if (bindings.isEmpty()) {
      return effect.simplify();
    }
    return new Expander().expand(effect).simplify();
  }

  /** Applies this substitution to an entity, and flattens the result. */
  public Entity apply(Entity entity) throws CycleException {
    if (bindings.isEmpty()) {
      return entity.flatten();
    }
    return new Expander().expand(entity).flatten();
  }

  @Override
  public int hashCode() {
    return bindings.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof Substitution
            && bindings.equals(((Substitution) obj).bindings);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("[");
    for (int i = 0; i < bindings.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      bindings.get(i).describeTo(buf);
    }
    return buf.append(']').toString();
  }

  /** Expands variables, keeping track of the variables being expanded. */
  private class Expander {
    final Set<String> activeEffects = new HashSet<>();
    final Set<String> activeEntities = new HashSet<>();

    Effect expand(Effect effect) throws CycleException {
      if (effect instanceof EffectVar) {
        final String name = ((EffectVar) effect).name;
        final Effect value = effectMap.get(name);
        if (value == null) {
          return effect;
        }
        if (!activeEffects.add(name)) {
          throw new CycleException(name, value);
        }
        final Effect effect2 = expand(value);
        activeEffects.remove(name);
        return effect2;
      }
      if (effect instanceof ArrowEffect) {
        final ArrowEffect arrow = (ArrowEffect) effect;
        final List<Effect> params = new ArrayList<>();
        for (Effect param : arrow.params) {
          params.add(expand(param));
        }
        return ArrowEffect.of(params, expand(arrow.result));
      }
      final ConcreteEffect concrete = (ConcreteEffect) effect;
      final List<Component> components = new ArrayList<>();
      for (Component component : concrete.components) {
        components.add(component.withEntity(expand(component.entity)));
      }
      return ConcreteEffect.of(components);
    }

    Entity expand(Entity entity) throws CycleException {
      if (entity instanceof EntityVar) {
        final String name = ((EntityVar) entity).name;
        final Entity value = entityMap.get(name);
        if (value == null) {
          return entity;
        }
        if (!activeEntities.add(name)) {
          throw new CycleException(name, value);
        }
        final Entity entity2 = expand(value);
        activeEntities.remove(name);
        return entity2;
      }
      if (entity instanceof UnionEntity) {
        final List<Entity> entities = new ArrayList<>();
        for (Entity member : ((UnionEntity) entity).entities) {
          entities.add(expand(member));
        }
        return UnionEntity.of(entities);
      }
      return entity;
    }
  }

  /** Binding of a variable to a term. */
  public abstract static class Binding {
    public final String name;

    Binding(String name) {
      this.name = requireNonNull(name);
    }

    /** Applies a substitution to the value of this binding. */
    abstract Binding apply(Substitution substitution) throws CycleException;

    abstract StringBuilder describeTo(StringBuilder buf);

    @Override
    public String toString() {
      return describeTo(new StringBuilder()).toString();
    }
  }

  /** Binding of an effect variable to an effect. */
  public static final class EffectBinding extends Binding {
    public final Effect value;

    EffectBinding(String name, Effect value) {
      super(name);
      this.value = requireNonNull(value);
    }

    @Override
    Binding apply(Substitution substitution) throws CycleException {
      final Effect value2 = substitution.apply(value);
      return value2.equals(value) ? this : new EffectBinding(name, value2);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return value.describeTo(buf).append('/').append(name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, value);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof EffectBinding
              && name.equals(((EffectBinding) obj).name)
              && value.equals(((EffectBinding) obj).value);
    }
  }

  /** Binding of an entity variable to an entity. */
  public static final class EntityBinding extends Binding {
    public final Entity value;

    EntityBinding(String name, Entity value) {
      super(name);
      this.value = requireNonNull(value);
    }

    @Override
    Binding apply(Substitution substitution) throws CycleException {
      final Entity value2 = substitution.apply(value);
      return value2.equals(value) ? this : new EntityBinding(name, value2);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      buf.append('[');
      return value.describeTo(buf).append("]/").append(name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, value);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof EntityBinding
              && name.equals(((EntityBinding) obj).name)
              && value.equals(((EntityBinding) obj).value);
    }
  }

  /**
   * Thrown by {@link #apply(Effect)} and {@link #compose} if a variable's
   * value refers, directly or via other bindings, to the variable itself.
   */
  public static class CycleException extends Exception {
    public final String variable;

    CycleException(String variable, Object value) {
      super("Can't bind " + variable + " to " + value + ": cyclical binding");
      this.variable = variable;
    }
  }
}

// End Substitution.java
