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

/** An effect could not be inferred. */
public class EffectException extends RuntimeException {
  private final ErrorTree errorTree;

  public EffectException(ErrorTree errorTree) {
    super(errorTree.toString());
    this.errorTree = requireNonNull(errorTree);
  }

  /** Returns the tree of errors that caused this exception. */
  public ErrorTree errorTree() {
    return errorTree;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Error: ");
    return errorTree.describeTo(buf);
  }
}

// End EffectException.java
