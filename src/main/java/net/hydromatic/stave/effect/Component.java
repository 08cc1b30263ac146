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

import java.util.Objects;

/** Component of a {@link ConcreteEffect}: a direction and an entity. */
public final class Component {
  public final Kind kind;
  public final Entity entity;

  private Component(Kind kind, Entity entity) {
    this.kind = requireNonNull(kind);
    this.entity = requireNonNull(entity);
  }

  /** Creates a Component. */
  public static Component of(Kind kind, Entity entity) {
    return new Component(kind, entity);
  }

  /** Creates a component that reads an entity. */
  public static Component read(Entity entity) {
    return new Component(Kind.READ, entity);
  }

  /** Creates a component that updates an entity. */
  public static Component update(Entity entity) {
    return new Component(Kind.UPDATE, entity);
  }

  /** Creates a component that refers to an entity in a temporal formula. */
  public static Component temporal(Entity entity) {
    return new Component(Kind.TEMPORAL, entity);
  }

  /** Returns a component of the same kind with a different entity. */
  public Component withEntity(Entity entity) {
    return entity.equals(this.entity) ? this : new Component(kind, entity);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, entity);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Component
            && kind == ((Component) obj).kind
            && entity.equals(((Component) obj).entity);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(kind.displayName).append('[');
    return entity.describeTo(buf).append(']');
  }

  /** Direction of a component. */
  public enum Kind {
    READ("Read", "r"),
    UPDATE("Update", "u"),
    TEMPORAL("Temporal", "t");

    /** Name used when printing an effect, e.g. "Read". */
    public final String displayName;

    /**
     * Prefix of the entity variables in builtin signatures, e.g. "r" in
     * "Read[r0]".
     */
    public final String prefix;

    Kind(String displayName, String prefix) {
      this.displayName = displayName;
      this.prefix = prefix;
    }
  }
}

// End Component.java
