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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/** Entity variable (e.g. {@code r0}), which can be quantified. */
public final class EntityVar implements Entity {
  public final String name;

  private EntityVar(String name) {
    this.name = requireNonNull(name);
    checkArgument(!name.isEmpty(), "empty name");
  }

  /** Creates an EntityVar. */
  public static EntityVar of(String name) {
    return new EntityVar(name);
  }

  @Override
  public void collectNames(Names.Builder builder) {
    builder.addEntityVariable(name);
  }

  @Override
  public boolean contains(String entityVariable) {
    return name.equals(entityVariable);
  }

  @Override
  public int hashCode() {
    return name.hashCode() + 1237;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof EntityVar && name.equals(((EntityVar) obj).name);
  }

  @Override
  public String toString() {
    return name;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(name);
  }
}

// End EntityVar.java
