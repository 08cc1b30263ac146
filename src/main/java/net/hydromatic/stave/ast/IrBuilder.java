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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;

/**
 * Builds nodes of the intermediate representation.
 *
 * <p>Each node gets an identifier from a counter owned by the builder. Use
 * one builder per module, so that identifiers are unique within the module.
 */
public class IrBuilder {
  private long nextId;

  /** Creates a builder whose first identifier is 1. */
  public IrBuilder() {
    this(1L);
  }

  /** Creates a builder with a given first identifier. */
  public IrBuilder(long firstId) {
    this.nextId = firstId;
  }

  private long id() {
    return nextId++;
  }

  /** Creates a state variable declaration, "var name". */
  public Ir.VarDecl var(String name) {
    return new Ir.VarDecl(id(), name);
  }

  /** Creates a declaration of a constant that is not an operator. */
  public Ir.ConstDecl constant(String name) {
    return new Ir.ConstDecl(id(), name, -1);
  }

  /** Creates a declaration of a constant whose type is an operator type. */
  public Ir.ConstDecl operatorConstant(String name, int arity) {
    if (arity < 0) {
      throw new IllegalArgumentException("negative arity " + arity);
    }
    return new Ir.ConstDecl(id(), name, arity);
  }

  /** Creates an operator definition, "def name = expr". */
  public Ir.OpDef opDef(String name, Ir.Expr expr) {
    return new Ir.OpDef(id(), name, expr);
  }

  /** Creates a reference to a name. */
  public Ir.Name name(String name) {
    return new Ir.Name(id(), name);
  }

  public Ir.Literal boolLiteral(boolean value) {
    return new Ir.Literal(id(), Op.BOOL_LITERAL, value);
  }

  public Ir.Literal intLiteral(BigInteger value) {
    return new Ir.Literal(id(), Op.INT_LITERAL, value);
  }

  public Ir.Literal intLiteral(long value) {
    return intLiteral(BigInteger.valueOf(value));
  }

  public Ir.Literal stringLiteral(String value) {
    return new Ir.Literal(id(), Op.STR_LITERAL, value);
  }

  /** Creates an application, "opcode(arg0, ..., argN)". */
  public Ir.App app(String opcode, List<? extends Ir.Expr> args) {
    return new Ir.App(id(), opcode, ImmutableList.copyOf(args));
  }

  /** Creates an application, "opcode(arg0, ..., argN)". */
  public Ir.App app(String opcode, Ir.Expr... args) {
    return app(opcode, ImmutableList.copyOf(args));
  }

  /** Creates a lambda parameter; "_" is the anonymous parameter. */
  public Ir.Param param(String name) {
    return new Ir.Param(id(), name);
  }

  /** Creates a lambda, "(p0, ..., pN) => expr". */
  public Ir.Lambda lambda(List<Ir.Param> params, Ir.Expr expr) {
    return new Ir.Lambda(id(), ImmutableList.copyOf(params), expr);
  }

  /** Creates a lambda with one parameter, "(p) => expr". */
  public Ir.Lambda lambda(Ir.Param param, Ir.Expr expr) {
    return lambda(ImmutableList.of(param), expr);
  }

  /** Creates a let expression, "def name = expr { body }". */
  public Ir.Let let(Ir.OpDef opDef, Ir.Expr expr) {
    return new Ir.Let(id(), opDef, expr);
  }
}

// End IrBuilder.java
