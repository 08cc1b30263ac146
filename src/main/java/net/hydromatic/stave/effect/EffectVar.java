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

/** Effect variable (e.g. {@code e0}), to be solved by unification. */
public final class EffectVar implements Effect {
  public final String name;

  private EffectVar(String name) {
    this.name = requireNonNull(name);
    checkArgument(!name.isEmpty(), "empty name");
  }

  /** Creates an EffectVar. */
  public static EffectVar of(String name) {
    return new EffectVar(name);
  }

  @Override
  public void collectNames(Names.Builder builder) {
    builder.addEffectVariable(name);
  }

  @Override
  public boolean contains(String effectVariable) {
    return name.equals(effectVariable);
  }

  @Override
  public boolean containsEntity(String entityVariable) {
    return false;
  }

  @Override
  public EffectVar simplify() {
    return this;
  }

  @Override
  public int hashCode() {
    return name.hashCode() + 6563;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof EffectVar && name.equals(((EffectVar) obj).name);
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

// End EffectVar.java
