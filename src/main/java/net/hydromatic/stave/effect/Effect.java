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
 * Effect of an expression or operator: which state variables it reads,
 * updates, or refers to in a temporal formula.
 *
 * <p>An effect is a {@link ConcreteEffect}, an {@link EffectVar} or an
 * {@link ArrowEffect}. Effects are immutable, and two effects are equal if
 * they have the same structure.
 */
public interface Effect {
  /**
   * Adds the names of the effect variables and entity variables in this
   * effect to a builder.
   */
  void collectNames(Names.Builder builder);

  /** Returns the names of the variables in this effect. */
  default Names names() {
    return Names.of(this);
  }

  /** Returns whether this effect references a given effect variable. */
  boolean contains(String effectVariable);

  /** Returns whether this effect references a given entity variable. */
  boolean containsEntity(String entityVariable);

  /**
   * Returns an equivalent effect whose entities are flattened and whose
   * concrete effects have no empty components.
   */
  Effect simplify();

  /** Writes a description of this effect to a buffer. */
  StringBuilder describeTo(StringBuilder buf);
}

// End Effect.java
