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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.stave.util.Static.abbreviate;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.stave.ast.Ir;
import net.hydromatic.stave.ast.IrNode;
import net.hydromatic.stave.effect.ArrowEffect;
import net.hydromatic.stave.effect.Component;
import net.hydromatic.stave.effect.ConcreteEffect;
import net.hydromatic.stave.effect.ConcreteEntity;
import net.hydromatic.stave.effect.Effect;
import net.hydromatic.stave.effect.EffectException;
import net.hydromatic.stave.effect.EffectScheme;
import net.hydromatic.stave.effect.EffectUnifier;
import net.hydromatic.stave.effect.EffectVar;
import net.hydromatic.stave.effect.ErrorTree;
import net.hydromatic.stave.effect.Names;
import net.hydromatic.stave.effect.StateVariable;
import net.hydromatic.stave.effect.Substitution;
import net.hydromatic.stave.util.NameGenerator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Infers the effect of every expression in a module.
 *
 * <p>Walks each definition in post-order, and applies one inference rule per
 * kind of node. The effect of each node is recorded, keyed by the node's
 * identifier, for use by enclosing nodes and by later definitions. If a rule
 * fails, an {@link ErrorTree} is recorded instead.
 *
 * <p>Once any error has been recorded, rules that depend on the results of
 * other nodes (names, applications, lambdas, definitions and lets) are
 * skipped, so that one mistake does not cause a cascade of errors.
 *
 * <p>An inferrer holds the state of one run (the results, the accumulated
 * substitution, and the generator of fresh names) and is not thread-safe.
 */
public class EffectInferrer {
  private final LookupTable lookupTable;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;
  private final NameGenerator nameGenerator = new NameGenerator();

  private final Map<Long, EffectScheme> effects = new LinkedHashMap<>();
  private final Map<Long, ErrorTree> errors = new LinkedHashMap<>();

  /** Nodes visited so far, by identifier. */
  private final Map<Long, IrNode> nodes = new HashMap<>();

  /** Lambdas whose bodies are being visited, innermost first. */
  private final Deque<Ir.Lambda> lambdas = new ArrayDeque<>();

  /** Substitution accumulated over all applications so far. */
  private Substitution substitution = Substitution.EMPTY;

  /** Description of the current step, for the locations of errors. */
  private String location = "";

  /** Creates an inferrer with default properties. */
  public EffectInferrer(LookupTable lookupTable) {
    this(lookupTable, ImmutableMap.of(), ImmutableMap.of(), null);
  }

  /**
   * Creates an inferrer.
   *
   * @param lookupTable Declaration that each name occurrence refers to
   * @param effects Effects of declarations in previously analyzed modules
   * @param propMap Property values
   * @param tracer Tracer; if null, uses a tracer that prints to standard
   *   output if {@link Prop#TRACE} is set, otherwise an empty tracer
   */
  public EffectInferrer(LookupTable lookupTable,
      Map<Long, EffectScheme> effects, Map<Prop, Object> propMap,
      @Nullable Tracer tracer) {
    this.lookupTable = requireNonNull(lookupTable);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.effects.putAll(effects);
    this.tracer =
        tracer != null ? tracer
            : Prop.TRACE.booleanValue(propMap)
                ? Tracers.printTracer(System.out)
                : Tracers.empty();
  }

  /** Infers effects for a list of definitions, using a new inferrer. */
  public static Resolved inferEffects(LookupTable lookupTable,
      List<? extends Ir.Def> defs) {
    return new EffectInferrer(lookupTable).inferEffects(defs);
  }

  /**
   * Infers an effect for every expression in a list of definitions.
   *
   * <p>Never throws for errors in the definitions; they are returned in
   * {@link Resolved#errors()}. Throws {@link AssertionError} if the
   * definitions are not well-formed, for example if two different nodes have
   * the same identifier, or a node is used before it has been visited.
   */
  public Resolved inferEffects(List<? extends Ir.Def> defs) {
    defs.forEach(this::walk);
    return new Resolved(effects, errors);
  }

  /** Visits a node and its descendants, in post-order. */
  private void walk(IrNode node) {
    register(node);
    switch (node.op) {
    case VAR:
      exitVar((Ir.VarDecl) node);
      break;

    case CONST:
      exitConst((Ir.ConstDecl) node);
      break;

    case OP_DEF:
      final Ir.OpDef opDef = (Ir.OpDef) node;
      walk(opDef.expr);
      exitOpDef(opDef);
      break;

    case NAME:
      enterExpr((Ir.Expr) node);
      exitName((Ir.Name) node);
      break;

    case BOOL_LITERAL:
    case INT_LITERAL:
    case STR_LITERAL:
      enterExpr((Ir.Expr) node);
      exitLiteral((Ir.Literal) node);
      break;

    case APP:
      final Ir.App app = (Ir.App) node;
      enterExpr(app);
      app.args.forEach(this::walk);
      exitApp(app);
      break;

    case LAMBDA:
      final Ir.Lambda lambda = (Ir.Lambda) node;
      enterExpr(lambda);
      enterLambda(lambda);
      lambdas.push(lambda);
      walk(lambda.expr);
      lambdas.pop();
      exitLambda(lambda);
      break;

    case LET:
      final Ir.Let let = (Ir.Let) node;
      enterExpr(let);
      walk(let.opDef);
      walk(let.expr);
      exitLet(let);
      break;

    default:
      // Parameters are visited by their lambda
      throw new AssertionError("unexpected " + node.op + ": " + node);
    }
  }

  private void register(IrNode node) {
    final IrNode previous = nodes.putIfAbsent(node.id, node);
    if (previous != null && previous != node) {
      throw new AssertionError("Nodes " + describe(previous) + " and "
          + describe(node) + " have the same id " + node.id);
    }
  }

  private void enterExpr(Ir.Expr expr) {
    location = "Inferring effect for " + describe(expr);
  }

  //   c has operator type with n arguments
  // ---------------------------------------------- (CONST-OPER)
  //  const c: standardPropagation(n)
  //
  //   c does not have operator type
  // ---------------------------------------------- (CONST-VAL)
  //  const c: Pure
  private void exitConst(Ir.ConstDecl def) {
    if (def.isOperator()) {
      publish(def,
          EffectScheme.generalize(
              BuiltIn.standardPropagation(def.operatorArity)));
    } else {
      publish(def, EffectScheme.monomorphic(ConcreteEffect.PURE));
    }
  }

  // ---------------------------------------------- (VAR)
  //  var x: Read[x]
  private void exitVar(Ir.VarDecl def) {
    final ConcreteEntity entity =
        ConcreteEntity.of(StateVariable.of(def.name, def.id));
    publish(def,
        EffectScheme.monomorphic(ConcreteEffect.of(Component.read(entity))));
  }

  // Literals are always Pure
  private void exitLiteral(Ir.Literal literal) {
    publish(literal, EffectScheme.monomorphic(ConcreteEffect.PURE));
  }

  //  name: E in environment
  // ---------------------------------------------- (NAME)
  //  name: newInstance(E)
  private void exitName(Ir.Name name) {
    if (skip(name)) {
      return;
    }
    try {
      final int arity = Prop.BUILTIN_NAME_ARITY.intValue(propMap);
      publish(name,
          EffectScheme.monomorphic(effectForName(name.name, name.id, arity)));
    } catch (EffectException e) {
      fail(name, e.errorTree());
    }
  }

  //  op: E in environment   a0: E0 ... aN: EN
  //  Eres fresh   S = unify(newInstance(E), (E0, ..., EN) => Eres)
  // ---------------------------------------------- (APP)
  //  op(a0, ..., aN): S(Eres)
  private void exitApp(Ir.App app) {
    if (skip(app)) {
      return;
    }
    location =
        "Trying to infer effect for operator application in " + describe(app);
    try {
      final List<Effect> args = new ArrayList<>();
      for (Ir.Expr arg : app.args) {
        args.add(fetchResult(arg.id).instantiate(nameGenerator));
      }
      final EffectVar result = EffectVar.of(nameGenerator.effectVariable());
      final Effect signature =
          effectForName(app.opcode, app.id, app.args.size());
      final Substitution s = unify(signature, ArrowEffect.of(args, result));
      substitution = Substitution.compose(substitution, s);

      // Each argument now has a more precise effect
      for (int i = 0; i < args.size(); i++) {
        publish(app.args.get(i),
            EffectScheme.monomorphic(substitution.apply(args.get(i))));
      }
      publish(app, EffectScheme.monomorphic(substitution.apply(result)));
    } catch (EffectException e) {
      fail(app, e.errorTree());
    } catch (Substitution.CycleException e) {
      fail(app, ErrorTree.leaf(location, e.getMessage()));
    }
  }

  //  expr: E   S accumulated substitution
  //  V names in the parameters of enclosing lambdas
  // ---------------------------------------------- (OPDEF)
  //  def op = expr: forall (names(S(E)) - V). S(E)
  private void exitOpDef(Ir.OpDef def) {
    if (skip(def)) {
      return;
    }
    try {
      final Effect effect =
          substitution.apply(fetchResult(def.expr.id).effect);
      publish(def,
          EffectScheme.of(effect.names().minus(enclosingNames()), effect));
    } catch (EffectException e) {
      fail(def, e.errorTree());
    } catch (Substitution.CycleException e) {
      fail(def, ErrorTree.leaf(location, e.getMessage()));
    }
  }

  /** Returns the names that occur in the parameters of the enclosing
   * lambdas. A definition must not quantify over them. */
  private Names enclosingNames() throws Substitution.CycleException {
    Names names = Names.EMPTY;
    for (Ir.Lambda lambda : lambdas) {
      for (Ir.Param param : lambda.params) {
        final Effect effect = substitution.apply(fetchResult(param.id).effect);
        names = names.union(effect.names());
      }
    }
    return names;
  }

  //  expr: E
  // ---------------------------------------------- (LET)
  //  opDef { expr }: E
  private void exitLet(Ir.Let let) {
    if (skip(let)) {
      return;
    }
    try {
      publish(let, fetchResult(let.expr.id));
    } catch (EffectException e) {
      fail(let, e.errorTree());
    }
  }

  // ---------------------------------------------- (LAMBDA-PARAM)
  //  p: e_p_id
  //
  //  e fresh
  // ---------------------------------------------- (UNDERSCORE)
  //  _: e
  private void enterLambda(Ir.Lambda lambda) {
    for (Ir.Param param : lambda.params) {
      register(param);
      final String name =
          param.isAnonymous()
              ? nameGenerator.effectVariable()
              : "e_" + param.name + "_" + param.id;
      publish(param, EffectScheme.monomorphic(EffectVar.of(name)));
    }
  }

  //  expr: E
  // ---------------------------------------------- (LAMBDA)
  //  (p0, ..., pN) => expr: quantify((E0, ..., EN) => E)
  private void exitLambda(Ir.Lambda lambda) {
    if (skip(lambda)) {
      return;
    }
    location = "Inferring effect for " + describe(lambda);
    try {
      final EffectScheme body = fetchResult(lambda.expr.id);
      final List<Effect> params = new ArrayList<>();
      for (Ir.Param param : lambda.params) {
        final Effect effect =
            substitution.apply(
                fetchResult(param.id).instantiate(nameGenerator));
        publish(param, EffectScheme.monomorphic(effect));
        params.add(effect);
      }
      final EffectScheme scheme =
          EffectScheme.of(body.quantified, ArrowEffect.of(params, body.effect));
      final Effect effect =
          substitution.apply(scheme.instantiate(nameGenerator));
      if (!(effect instanceof ArrowEffect)) {
        throw new AssertionError("Arrow effect after substitution should be "
            + "an arrow: " + effect);
      }
      final ArrowEffect arrow = (ArrowEffect) effect;
      if (arrow.result instanceof ArrowEffect) {
        // Report on the body, which is more precise than the whole lambda
        fail(lambda.expr,
            ErrorTree.leaf(location, "Result cannot be an operator"));
        return;
      }

      // Variables that occur in the parameters are bound by this lambda
      Names names = Names.EMPTY;
      for (Effect param : arrow.params) {
        names = names.union(param.names());
      }
      publish(lambda, EffectScheme.of(names, arrow));
    } catch (EffectException e) {
      fail(lambda, e.errorTree());
    } catch (Substitution.CycleException e) {
      fail(lambda, ErrorTree.leaf(location, e.getMessage()));
    }
  }

  /** Returns whether to skip a rule because errors have been recorded. */
  private boolean skip(IrNode node) {
    if (errors.isEmpty()) {
      return false;
    }
    tracer.onSkip(node);
    return true;
  }

  /** Unifies two effects under the accumulated substitution. */
  private Substitution unify(Effect left, Effect right)
      throws Substitution.CycleException {
    final Effect left2 = substitution.apply(left);
    final Effect right2 = substitution.apply(right);
    final EffectUnifier.Result result = EffectUnifier.unify(left2, right2);
    tracer.onUnify(left2, right2, result);
    if (result instanceof EffectUnifier.Failure) {
      throw new EffectException(((EffectUnifier.Failure) result).errorTree);
    }
    return (Substitution) result;
  }

  /**
   * Returns a fresh instance of the effect of a name.
   *
   * <p>A built-in operator takes precedence over a declaration. Assumes that
   * {@code arity} is valid for the operator.
   */
  private Effect effectForName(String name, long nameId, int arity) {
    final Optional<BuiltIn> builtIn = BuiltIn.lookup(name);
    if (builtIn.isPresent()) {
      return EffectScheme.generalize(builtIn.get().signature(arity))
          .instantiate(nameGenerator);
    }
    final LookupTable.Definition def = lookupTable.get(nameId);
    if (def == null
        || !effects.containsKey(def.reference)
            && !errors.containsKey(def.reference)) {
      throw new EffectException(
          ErrorTree.leaf(location, "Signature not found for name: " + name));
    }
    return fetchResult(def.reference).instantiate(nameGenerator);
  }

  /**
   * Returns the recorded effect of a node.
   *
   * <p>Throws {@link EffectException} if an error was recorded for the node,
   * and {@link AssertionError} if nothing was recorded; the latter means that
   * the node was not visited before its consumer.
   */
  private EffectScheme fetchResult(long id) {
    final ErrorTree error = errors.get(id);
    if (error != null) {
      throw new EffectException(error);
    }
    final EffectScheme scheme = effects.get(id);
    if (scheme == null) {
      throw new AssertionError("Couldn't find any result for id " + id
          + " while " + location);
    }
    return scheme;
  }

  private void publish(IrNode node, EffectScheme scheme) {
    effects.put(node.id, scheme);
    tracer.onEffect(node, scheme);
  }

  private void fail(IrNode node, ErrorTree error) {
    final ErrorTree errorTree = ErrorTree.of(location, error);
    effects.remove(node.id);
    errors.put(node.id, errorTree);
    tracer.onError(node, errorTree);
  }

  private String describe(IrNode node) {
    return abbreviate(node.toString(),
        Prop.LOCATION_LENGTH.intValue(propMap));
  }

  /** Result of effect inference. */
  public static class Resolved {
    private final ImmutableMap<Long, EffectScheme> effects;
    private final ImmutableMap<Long, ErrorTree> errors;

    Resolved(Map<Long, EffectScheme> effects, Map<Long, ErrorTree> errors) {
      this.effects = ImmutableMap.copyOf(effects);
      this.errors = ImmutableMap.copyOf(errors);
    }

    /** Returns the effects of nodes whose effect was inferred. */
    public ImmutableMap<Long, EffectScheme> effects() {
      return effects;
    }

    /** Returns the errors of nodes whose effect could not be inferred. */
    public ImmutableMap<Long, ErrorTree> errors() {
      return errors;
    }

    /** Returns the effect of a node, or null. */
    public @Nullable EffectScheme effect(long id) {
      return effects.get(id);
    }

    /** Returns the error of a node, or null. */
    public @Nullable ErrorTree error(long id) {
      return errors.get(id);
    }

    public boolean hasErrors() {
      return !errors.isEmpty();
    }

    /** Throws if any errors were recorded; otherwise returns this. */
    public Resolved checkNoErrors() {
      if (!errors.isEmpty()) {
        throw new EffectException(errors.values().iterator().next());
      }
      return this;
    }

    @Override
    public String toString() {
      return "effects " + effects + ", errors " + errors;
    }
  }
}

// End EffectInferrer.java
