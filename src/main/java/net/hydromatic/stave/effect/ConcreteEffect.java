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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Effect that is an explicit set of components, such as
 * {@code Read[x] & Update[y]}.
 *
 * <p>There is at most one component of each {@link Component.Kind}; the
 * factory methods merge components of the same kind into a union. An effect
 * with no components is {@link #PURE}.
 */
public final class ConcreteEffect implements Effect {
  /** The effect that neither reads nor updates any state. */
  public static final ConcreteEffect PURE =
      new ConcreteEffect(ImmutableList.of());

  /** Components, sorted by kind. */
  public final ImmutableList<Component> components;

  private ConcreteEffect(ImmutableList<Component> components) {
    this.components = components;
  }

  /** Creates a ConcreteEffect. */
  public static ConcreteEffect of(Iterable<Component> components) {
    final Map<Component.Kind, List<Entity>> map =
        new EnumMap<>(Component.Kind.class);
    for (Component component : components) {
      map.computeIfAbsent(component.kind, k -> new ArrayList<>())
          .add(component.entity);
    }
    if (map.isEmpty()) {
      return PURE;
    }
    final ImmutableList.Builder<Component> list = ImmutableList.builder();
    map.forEach(
        (kind, entities) ->
            list.add(
                Component.of(
                    kind,
                    entities.size() == 1
                        ? entities.get(0)
                        : UnionEntity.of(entities))));
    return new ConcreteEffect(list.build());
  }

  /** Creates a ConcreteEffect. */
  public static ConcreteEffect of(Component... components) {
    return of(Arrays.asList(components));
  }

  /** Returns the entity of the component of a given kind, or null. */
  public @Nullable Entity entity(Component.Kind kind) {
    for (Component component : components) {
      if (component.kind == kind) {
        return component.entity;
      }
    }
    return null;
  }

  /** Returns whether this effect has no components. */
  public boolean isPure() {
    return components.isEmpty();
  }

  @Override
  public void collectNames(Names.Builder builder) {
    components.forEach(c -> c.entity.collectNames(builder));
  }

  @Override
  public boolean contains(String effectVariable) {
    return false;
  }

  @Override
  public boolean containsEntity(String entityVariable) {
    for (Component component : components) {
      if (component.entity.contains(entityVariable)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public ConcreteEffect simplify() {
    final List<Component> list = new ArrayList<>();
    for (Component component : components) {
      final Entity entity = component.entity.flatten();
      if (!entity.isEmpty()) {
        list.add(component.withEntity(entity));
      }
    }
    return list.equals(components) ? this : of(list);
  }

  @Override
  public int hashCode() {
    return components.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof ConcreteEffect
            && components.equals(((ConcreteEffect) obj).components);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    if (components.isEmpty()) {
      return buf.append("Pure");
    }
    for (int i = 0; i < components.size(); i++) {
      if (i > 0) {
        buf.append(" & ");
      }
      components.get(i).describeTo(buf);
    }
    return buf;
  }
}

// End ConcreteEffect.java
