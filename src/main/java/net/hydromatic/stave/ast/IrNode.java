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
package net.hydromatic.stave.ast;

import static java.util.Objects.requireNonNull;

/**
 * Node in the intermediate representation of a module.
 *
 * <p>Every node has an identifier that is unique within its module. Inference
 * results are keyed by this identifier.
 */
public abstract class IrNode {
  public final long id;
  public final Op op;

  IrNode(long id, Op op) {
    this.id = id;
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a string in a syntax close to the source
   * language.
   *
   * <p>The purpose of this string is debugging, and describing the location
   * of errors.
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new StringBuilder()).toString();
  }

  abstract StringBuilder unparse(StringBuilder buf);
}

// End IrNode.java
