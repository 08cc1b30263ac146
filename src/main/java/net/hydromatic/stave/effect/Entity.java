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

/**
 * Set of state variables referenced by a component of an effect.
 *
 * <p>An entity is either a {@link ConcreteEntity} (an explicit set of state
 * variables), an {@link EntityVar} (a placeholder, to be solved by
 * unification) or a {@link UnionEntity}.
 */
public interface Entity {
  /** Adds the names of the entity variables in this entity to a builder. */
  void collectNames(Names.Builder builder);

  /** Returns whether this entity references a given entity variable. */
  boolean contains(String entityVariable);

  /**
   * Returns an equivalent entity with nested unions flattened and concrete
   * members of unions merged.
   */
  default Entity flatten() {
    return this;
  }

  /** Returns whether this entity is the empty concrete entity. */
  default boolean isEmpty() {
    return false;
  }

  /** Writes a description of this entity to a buffer. */
  StringBuilder describeTo(StringBuilder buf);
}

// End Entity.java
