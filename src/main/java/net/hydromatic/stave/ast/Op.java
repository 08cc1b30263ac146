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

/** Sub-types of {@link IrNode}. */
public enum Op {
  // declarations
  VAR,
  CONST,
  OP_DEF,

  // identifiers
  NAME,

  // literals
  BOOL_LITERAL,
  INT_LITERAL,
  STR_LITERAL,

  // expressions
  APP,
  LAMBDA,
  LET,

  // miscellaneous
  PARAM;

  /** Returns whether this is the operator of a literal. */
  public boolean isLiteral() {
    return this == BOOL_LITERAL || this == INT_LITERAL || this == STR_LITERAL;
  }
}

// End Op.java
