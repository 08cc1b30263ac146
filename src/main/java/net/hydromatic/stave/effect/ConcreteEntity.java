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
import java.util.Arrays;

/** Entity that is an explicit set of state variables. */
public final class ConcreteEntity implements Entity {
  /** The entity that references no state variables. */
  public static final ConcreteEntity EMPTY =
      new ConcreteEntity(ImmutableSortedSet.of());

  public final ImmutableSortedSet<StateVariable> stateVariables;

  private ConcreteEntity(ImmutableSortedSet<StateVariable> stateVariables) {
    this.stateVariables = stateVariables;
  }

  /** Creates a ConcreteEntity. */
  public static ConcreteEntity of(Iterable<StateVariable> stateVariables) {
    final ImmutableSortedSet<StateVariable> set =
        ImmutableSortedSet.copyOf(stateVariables);
    return set.isEmpty() ? EMPTY : new ConcreteEntity(set);
  }

  /** Creates a ConcreteEntity. */
  public static ConcreteEntity of(StateVariable... stateVariables) {
    return of(Arrays.asList(stateVariables));
  }

  /**
   * Returns the names of the state variables. Unification compares concrete
   * entities by these names.
   */
  public ImmutableSortedSet<String> names() {
    final ImmutableSortedSet.Builder<String> names =
        ImmutableSortedSet.naturalOrder();
    stateVariables.forEach(v -> names.add(v.name));
    return names.build();
  }

  @Override
  public void collectNames(Names.Builder builder) {
    // no variables
  }

  @Override
  public boolean contains(String entityVariable) {
    return false;
  }

  @Override
  public boolean isEmpty() {
    return stateVariables.isEmpty();
  }

  @Override
  public int hashCode() {
    return stateVariables.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof ConcreteEntity
            && stateVariables.equals(((ConcreteEntity) obj).stateVariables);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    int i = 0;
    for (String name : names()) {
      if (i++ > 0) {
        buf.append(", ");
      }
      buf.append(name);
    }
    return buf;
  }
}

// End ConcreteEntity.java
