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

/**
 * Reference to a state variable: its name and the id of the {@code var}
 * declaration that defines it.
 */
public final class StateVariable implements Comparable<StateVariable> {
  public final String name;
  public final long reference;

  private StateVariable(String name, long reference) {
    this.name = requireNonNull(name);
    this.reference = reference;
  }

  /** Creates a StateVariable. */
  public static StateVariable of(String name, long reference) {
    return new StateVariable(name, reference);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, reference);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof StateVariable
            && name.equals(((StateVariable) obj).name)
            && reference == ((StateVariable) obj).reference;
  }

  @Override
  public int compareTo(StateVariable o) {
    int c = name.compareTo(o.name);
    if (c == 0) {
      c = Long.compare(reference, o.reference);
    }
    return c;
  }

  @Override
  public String toString() {
    return name;
  }
}

// End StateVariable.java
