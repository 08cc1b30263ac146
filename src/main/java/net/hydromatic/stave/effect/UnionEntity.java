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
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Entity that is the union of several entities.
 *
 * <p>For example, the result of {@code iadd} reads the union of what its two
 * arguments read, {@code Read[r0, r1]}. Members are unordered.
 */
public final class UnionEntity implements Entity {
  public final ImmutableSet<Entity> entities;

  private UnionEntity(ImmutableSet<Entity> entities) {
    this.entities = entities;
  }

  /** Creates a UnionEntity. Does not simplify; see {@link #flatten()}. */
  public static UnionEntity of(Iterable<? extends Entity> entities) {
    return new UnionEntity(ImmutableSet.copyOf(entities));
  }

  /** Creates a UnionEntity. */
  public static UnionEntity of(Entity... entities) {
    return of(Arrays.asList(entities));
  }

  @Override
  public void collectNames(Names.Builder builder) {
    entities.forEach(e -> e.collectNames(builder));
  }

  @Override
  public boolean contains(String entityVariable) {
    for (Entity entity : entities) {
      if (entity.contains(entityVariable)) {
        return true;
      }
    }
    return false;
  }

  /** {@inheritDoc}
   *
   * <p>The result is never a union that contains a union. If the result is a
   * union, at most one of its members is concrete, and that member is not
   * empty. A union with no members flattens to {@link ConcreteEntity#EMPTY},
   * and a union with one member flattens to that member. */
  @Override
  public Entity flatten() {
    final Set<StateVariable> stateVariables = new TreeSet<>();
    final Set<Entity> others = new LinkedHashSet<>();
    addTo(this, stateVariables, others);

    final ImmutableList.Builder<Entity> members = ImmutableList.builder();
    if (!stateVariables.isEmpty()) {
      members.add(ConcreteEntity.of(stateVariables));
    }
    members.addAll(others);
    final ImmutableList<Entity> list = members.build();
    switch (list.size()) {
      case 0:
        return ConcreteEntity.EMPTY;
      case 1:
        return list.get(0);
      default:
        return new UnionEntity(ImmutableSet.copyOf(list));
    }
  }

  private static void addTo(
      Entity entity, Set<StateVariable> stateVariables, Set<Entity> others) {
    if (entity instanceof UnionEntity) {
      for (Entity member : ((UnionEntity) entity).entities) {
        addTo(member, stateVariables, others);
      }
    } else if (entity instanceof ConcreteEntity) {
      stateVariables.addAll(((ConcreteEntity) entity).stateVariables);
    } else {
      others.add(entity);
    }
  }

  @Override
  public int hashCode() {
    return entities.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof UnionEntity
            && entities.equals(((UnionEntity) obj).entities);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    int i = 0;
    for (Entity entity : entities) {
      if (entity.isEmpty()) {
        continue;
      }
      if (i++ > 0) {
        buf.append(", ");
      }
      entity.describeTo(buf);
    }
    return buf;
  }
}

// End UnionEntity.java
