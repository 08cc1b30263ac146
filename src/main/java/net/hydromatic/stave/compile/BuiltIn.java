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
package net.hydromatic.stave.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import net.hydromatic.stave.effect.ArrowEffect;
import net.hydromatic.stave.effect.Component;
import net.hydromatic.stave.effect.ConcreteEffect;
import net.hydromatic.stave.effect.Effect;
import net.hydromatic.stave.effect.Entity;
import net.hydromatic.stave.effect.EntityVar;
import net.hydromatic.stave.effect.UnionEntity;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in operators and their effect signatures.
 *
 * <p>Most operators have the "standard propagation" signature: the result
 * reads (and refers temporally to) exactly what the arguments do. Action
 * operators such as {@link #ASSIGN} introduce an {@code Update} component,
 * and temporal operators such as {@link #ALWAYS} turn reads into temporal
 * references.
 *
 * <p>The entity variables in a signature are quantified; the inferrer
 * instantiates a signature afresh at each use.
 */
public enum BuiltIn {
  // Sets of values; operators of arity 0.
  BOOL("Bool", null, BuiltIn::standardPropagation),
  INT("Int", null, BuiltIn::standardPropagation),
  NAT("Nat", null, BuiltIn::standardPropagation),

  // Booleans
  EQ("eq", "==", BuiltIn::standardPropagation),
  NEQ("neq", "!=", BuiltIn::standardPropagation),
  NOT("not", null, BuiltIn::standardPropagation),
  IFF("iff", null, BuiltIn::standardPropagation),
  IMPLIES("implies", null, BuiltIn::standardPropagation),

  /**
   * Operator "and", of any arity. Unlike most operators it propagates
   * updates, so that {@code and(x' = 1, y' = 2)} updates both {@code x} and
   * {@code y}.
   */
  AND("and", null, BuiltIn::actionPropagation),
  OR("or", null, BuiltIn::actionPropagation),
  ACTION_ALL("actionAll", null, BuiltIn::actionPropagation),
  ACTION_ANY("actionAny", null, BuiltIn::actionPropagation),

  // Integers
  IADD("iadd", "+", BuiltIn::standardPropagation),
  ISUB("isub", "-", BuiltIn::standardPropagation),
  IMUL("imul", "*", BuiltIn::standardPropagation),
  IDIV("idiv", "/", BuiltIn::standardPropagation),
  IMOD("imod", "%", BuiltIn::standardPropagation),
  IPOW("ipow", "^", BuiltIn::standardPropagation),
  IUMINUS("iuminus", null, BuiltIn::standardPropagation),
  ILT("ilt", "<", BuiltIn::standardPropagation),
  ILTE("ilte", "<=", BuiltIn::standardPropagation),
  IGT("igt", ">", BuiltIn::standardPropagation),
  IGTE("igte", ">=", BuiltIn::standardPropagation),

  // Sets
  SET("Set", null, BuiltIn::standardPropagation),
  IN("in", null, BuiltIn::standardPropagation),
  CONTAINS("contains", null, BuiltIn::standardPropagation),
  NOTIN("notin", null, BuiltIn::standardPropagation),
  UNION("union", null, BuiltIn::standardPropagation),
  INTERSECT("intersect", null, BuiltIn::standardPropagation),
  EXCLUDE("exclude", null, BuiltIn::standardPropagation),
  SUBSETEQ("subseteq", null, BuiltIn::standardPropagation),
  POWERSET("powerset", null, BuiltIn::standardPropagation),
  FLATTEN("flatten", null, BuiltIn::standardPropagation),
  SIZE("size", null, BuiltIn::standardPropagation),
  IS_FINITE("isFinite", null, BuiltIn::standardPropagation),
  CHOOSE_SOME("chooseSome", null, BuiltIn::standardPropagation),
  ONE_OF("oneOf", null, BuiltIn::standardPropagation),
  TO("to", null, BuiltIn::standardPropagation),

  // Tuples and records
  TUP("Tup", null, BuiltIn::standardPropagation),
  ITEM("item", null, BuiltIn::standardPropagation),
  REC("Rec", null, BuiltIn::standardPropagation),
  FIELD("field", null, BuiltIn::standardPropagation),
  WITH("with", null, BuiltIn::standardPropagation),

  // Lists
  LIST("List", null, BuiltIn::standardPropagation),
  NTH("nth", null, BuiltIn::standardPropagation),
  HEAD("head", null, BuiltIn::standardPropagation),
  TAIL("tail", null, BuiltIn::standardPropagation),
  APPEND("append", null, BuiltIn::standardPropagation),
  CONCAT("concat", null, BuiltIn::standardPropagation),
  LENGTH("length", null, BuiltIn::standardPropagation),
  RANGE("range", null, BuiltIn::standardPropagation),

  // Maps
  MAP("Map", null, BuiltIn::standardPropagation),
  GET("get", null, BuiltIn::standardPropagation),
  KEYS("keys", null, BuiltIn::standardPropagation),
  PUT("put", null, BuiltIn::standardPropagation),
  SET_VALUE("set", null, BuiltIn::standardPropagation),
  SET_OF_MAPS("setOfMaps", null, BuiltIn::standardPropagation),

  /**
   * Operator "exists", whose effect is {@code (Read[r0], (Read[r0]) =>
   * Read[r1] & Update[u0]) => Read[r0, r1] & Update[u0]}. The body of the
   * lambda reads the elements of the set, and may update state.
   */
  EXISTS("exists", null, arity -> quantifier()),
  FORALL("forall", null, arity -> quantifier()),

  /**
   * Operator "map", whose effect is {@code (Read[r0], (Read[r0]) =>
   * Read[r1]) => Read[r0, r1]}.
   */
  MAP_LAMBDA("map", null, arity -> mapping()),
  FILTER("filter", null, arity -> mapping()),
  SELECT("select", null, arity -> mapping()),
  MAP_BY("mapBy", null, arity -> mapping()),
  SET_BY("setBy", null, arity -> mapping()),

  /**
   * Operator "fold", whose effect is {@code (Read[r0], Read[r1], (Read[r1],
   * Read[r0]) => Read[r2]) => Read[r0, r1, r2]}.
   */
  FOLD("fold", null, arity -> folding()),
  FOLDL("foldl", null, arity -> folding()),

  /**
   * Operator "assign", written {@code x' = e}, whose effect is
   * {@code (Read[r0], Read[r1]) => Read[r1] & Update[r0]}. It updates the
   * variable that its first argument reads.
   */
  ASSIGN("assign", "'", arity ->
      arrow(ImmutableList.of(effect(read("r0")), effect(read("r1"))),
          effect(read("r1"), update("r0")))),

  /**
   * Operator "ite", whose effect is {@code (Read[r0], Read[r1] & Update[u0],
   * Read[r2] & Update[u0]) => Read[r0, r1, r2] & Update[u0]}. Both branches
   * must update the same variables.
   */
  ITE("ite", null, arity ->
      arrow(
          ImmutableList.of(effect(read("r0")),
              effect(read("r1"), update("u0")),
              effect(read("r2"), update("u0"))),
          effect(read("r0", "r1", "r2"), update("u0")))),

  THEN("then", null, arity ->
      arrow(
          ImmutableList.of(effect(read("r0"), update("u0")),
              effect(read("r1"), update("u1"))),
          effect(read("r0", "r1"), update("u1")))),

  REPS("reps", null, arity ->
      arrow(
          ImmutableList.of(effect(read("r0")),
              arrow(ImmutableList.of(effect(read("r0"))),
                  effect(read("r1"), update("u0")))),
          effect(read("r0", "r1"), update("u0")))),

  FAIL("fail", null, arity ->
      arrow(ImmutableList.of(effect(read("r0"), update("u0"))),
          effect(read("r0"), update("u0")))),

  ASSERT("assert", null, arity ->
      arrow(ImmutableList.of(effect(read("r0"))), effect(read("r0")))),

  /**
   * Temporal operator "always", whose effect is
   * {@code (Read[r0] & Temporal[t0]) => Temporal[r0, t0]}.
   */
  ALWAYS("always", null, arity -> temporalFormula()),
  EVENTUALLY("eventually", null, arity -> temporalFormula()),

  /** Temporal operator "next", of effect {@code (Read[r0]) => Temporal[r0]}. */
  NEXT("next", null, arity ->
      arrow(ImmutableList.of(effect(read("r0"))), effect(temporal("r0")))),

  OR_KEEP("orKeep", null, arity -> actionFormula()),
  MUST_CHANGE("mustChange", null, arity -> actionFormula()),
  WEAK_FAIR("weakFair", null, arity -> actionFormula()),
  STRONG_FAIR("strongFair", null, arity -> actionFormula()),

  ENABLED("enabled", null, arity ->
      arrow(ImmutableList.of(effect(read("r0"), update("u0"))),
          effect(read("r0"))));

  /** Name of the operator in the intermediate representation. */
  public final String name;

  /** Alternative name, such as "+" for "iadd", or null. */
  public final @Nullable String alias;

  private final Signature signature;

  /** Map of all built-in operators, keyed by both name and alias. */
  public static final ImmutableMap<String, BuiltIn> BY_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      b.put(builtIn.name, builtIn);
      if (builtIn.alias != null) {
        b.put(builtIn.alias, builtIn);
      }
    }
    BY_NAME = b.build();
  }

  BuiltIn(String name, @Nullable String alias, Signature signature) {
    this.name = requireNonNull(name);
    this.alias = alias;
    this.signature = requireNonNull(signature);
  }

  /** Looks up a built-in operator by name or alias. */
  public static Optional<BuiltIn> lookup(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }

  /**
   * Returns the effect of this operator when applied to a given number of
   * arguments. Assumes that the arity is valid for the operator.
   */
  public Effect signature(int arity) {
    checkArgument(arity >= 0, "negative arity %s", arity);
    return signature.effect(arity);
  }

  /**
   * Returns the effect of an operator whose result reads, and refers
   * temporally to, the union of what its arguments do.
   *
   * <p>For arity 2, returns {@code (Read[r0] & Temporal[t0], Read[r1] &
   * Temporal[t1]) => Read[r0, r1] & Temporal[t0, t1]}.
   */
  public static Effect standardPropagation(int arity) {
    return propagateComponents(arity, Component.Kind.READ,
        Component.Kind.TEMPORAL);
  }

  /** As {@link #standardPropagation(int)}, but also propagates updates. */
  public static Effect actionPropagation(int arity) {
    return propagateComponents(arity, Component.Kind.READ,
        Component.Kind.TEMPORAL, Component.Kind.UPDATE);
  }

  /**
   * Returns an arrow effect whose i<sup>th</sup> parameter has one component
   * of each given kind, over entity variables such as {@code r<i>}, and whose
   * result has, for each kind, the union of those variables.
   */
  public static Effect propagateComponents(int arity,
      Component.Kind... kinds) {
    final List<Effect> params = new ArrayList<>();
    final List<Component> resultComponents = new ArrayList<>();
    for (Component.Kind kind : kinds) {
      final List<Entity> entities = new ArrayList<>();
      for (int i = 0; i < arity; i++) {
        entities.add(EntityVar.of(kind.prefix + i));
      }
      resultComponents.add(Component.of(kind, UnionEntity.of(entities)));
    }
    for (int i = 0; i < arity; i++) {
      final List<Component> components = new ArrayList<>();
      for (Component.Kind kind : kinds) {
        components.add(Component.of(kind, EntityVar.of(kind.prefix + i)));
      }
      params.add(ConcreteEffect.of(components));
    }
    return ArrowEffect.of(params,
        ConcreteEffect.of(resultComponents).simplify());
  }

  private static Effect quantifier() {
    return arrow(
        ImmutableList.of(effect(read("r0")),
            arrow(ImmutableList.of(effect(read("r0"))),
                effect(read("r1"), update("u0")))),
        effect(read("r0", "r1"), update("u0")));
  }

  private static Effect mapping() {
    return arrow(
        ImmutableList.of(effect(read("r0")),
            arrow(ImmutableList.of(effect(read("r0"))),
                effect(read("r1")))),
        effect(read("r0", "r1")));
  }

  private static Effect folding() {
    return arrow(
        ImmutableList.of(effect(read("r0")), effect(read("r1")),
            arrow(ImmutableList.of(effect(read("r1")), effect(read("r0"))),
                effect(read("r2")))),
        effect(read("r0", "r1", "r2")));
  }

  private static Effect temporalFormula() {
    return arrow(ImmutableList.of(effect(read("r0"), temporal("t0"))),
        effect(temporal("r0", "t0")));
  }

  private static Effect actionFormula() {
    return arrow(
        ImmutableList.of(effect(read("r0"), update("u0")),
            effect(read("r1"))),
        effect(temporal("r0", "u0", "r1")));
  }

  private static ArrowEffect arrow(List<Effect> params, Effect result) {
    return ArrowEffect.of(params, result);
  }

  private static ConcreteEffect effect(Component... components) {
    return ConcreteEffect.of(components);
  }

  private static Component read(String... names) {
    return Component.read(entity(names));
  }

  private static Component update(String... names) {
    return Component.update(entity(names));
  }

  private static Component temporal(String... names) {
    return Component.temporal(entity(names));
  }

  /** Returns a variable, or the union of several variables. */
  private static Entity entity(String... names) {
    if (names.length == 1) {
      return EntityVar.of(names[0]);
    }
    return UnionEntity.of(
        Arrays.stream(names).map(EntityVar::of).toArray(Entity[]::new));
  }

  /** Computes the effect signature of an operator for a given arity. */
  @FunctionalInterface
  interface Signature {
    Effect effect(int arity);
  }
}

// End BuiltIn.java
