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

import static com.google.common.base.MoreObjects.firstNonNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Robinson-style unification of effects and entities.
 *
 * <p>Given two effects, finds the most general substitution that makes them
 * equal, or returns a {@link Failure} that explains why there is none.
 *
 * <p>The cases are tried in this order:
 *
 * <ol>
 *   <li>Equal terms unify with the empty substitution.
 *   <li>A variable unifies with a term that does not contain it, by binding
 *       the variable to the term.
 *   <li>A variable does not unify with a term that contains it (occurs check).
 *   <li>Two arrows unify if they have the same number of parameters and their
 *       parameters and results unify, left to right.
 *   <li>Two concrete effects unify if, for each kind of component, their
 *       entities unify. A missing component is the empty entity.
 *   <li>Any other pair of effects fails to unify.
 * </ol>
 */
public class EffectUnifier {
  private EffectUnifier() {}

  /** Unifies two effects. */
  public static Result unify(Effect left, Effect right) {
    final String location =
        "Trying to unify " + requireNonNull(left) + " and "
            + requireNonNull(right);
    final Effect e1 = left.simplify();
    final Effect e2 = right.simplify();
    if (e1.equals(e2)) {
      return Substitution.EMPTY;
    }
    if (e1 instanceof EffectVar) {
      return bindEffect(location, (EffectVar) e1, e2);
    }
    if (e2 instanceof EffectVar) {
      return bindEffect(location, (EffectVar) e2, e1);
    }
    if (e1 instanceof ArrowEffect && e2 instanceof ArrowEffect) {
      return unifyArrows(location, (ArrowEffect) e1, (ArrowEffect) e2);
    }
    if (e1 instanceof ConcreteEffect && e2 instanceof ConcreteEffect) {
      return unifyConcrete(location, (ConcreteEffect) e1,
          (ConcreteEffect) e2);
    }
    return failure(location, "Can't unify different types of effects");
  }

  /** Unifies two entities. */
  public static Result unifyEntities(Entity left, Entity right) {
    final Entity v1 = left.flatten();
    final Entity v2 = right.flatten();
    final String location =
        "Trying to unify entities [" + v1 + "] and [" + v2 + "]";
    if (v1.equals(v2)) {
      return Substitution.EMPTY;
    }
    if (v1 instanceof ConcreteEntity && v2 instanceof ConcreteEntity) {
      return unifyConcreteEntities(location, (ConcreteEntity) v1,
          (ConcreteEntity) v2);
    }
    if (v1 instanceof EntityVar) {
      return bindEntity(location, (EntityVar) v1, v2);
    }
    if (v2 instanceof EntityVar) {
      return bindEntity(location, (EntityVar) v2, v1);
    }
    if (v1 instanceof UnionEntity && v2 instanceof ConcreteEntity) {
      return unifyUnion(location, (UnionEntity) v1, (ConcreteEntity) v2);
    }
    if (v1 instanceof ConcreteEntity && v2 instanceof UnionEntity) {
      return unifyUnion(location, (UnionEntity) v2, (ConcreteEntity) v1);
    }
    return failure(location,
        "Unification for unions of entities is not implemented");
  }

  private static Result bindEffect(String location, EffectVar variable,
      Effect effect) {
    if (effect.contains(variable.name)) {
      return failure(location,
          format("Can't bind %s to %s: cyclical binding", variable, effect));
    }
    return Substitution.of(Substitution.bindEffect(variable.name, effect));
  }

  private static Result bindEntity(String location, EntityVar variable,
      Entity entity) {
    if (entity.contains(variable.name)) {
      return failure(location,
          format("Can't bind %s to %s: cyclical binding", variable, entity));
    }
    return Substitution.of(Substitution.bindEntity(variable.name, entity));
  }

  private static Result unifyArrows(String location, ArrowEffect e1,
      ArrowEffect e2) {
    if (e1.params.size() != e2.params.size()) {
      return failure(location,
          format("Expected %d arguments, got %d", e1.params.size(),
              e2.params.size()));
    }
    Substitution substitution = Substitution.EMPTY;
    try {
      for (int i = 0; i < e1.params.size(); i++) {
        final Result result =
            unify(substitution.apply(e1.params.get(i)),
                substitution.apply(e2.params.get(i)));
        if (result instanceof Failure) {
          return ((Failure) result).wrap(location);
        }
        substitution = Substitution.compose(substitution,
            (Substitution) result);
      }
      final Result result =
          unify(substitution.apply(e1.result),
              substitution.apply(e2.result));
      if (result instanceof Failure) {
        return ((Failure) result).wrap(location);
      }
      return Substitution.compose(substitution, (Substitution) result);
    } catch (Substitution.CycleException e) {
      return failure(location, e.getMessage());
    }
  }

  private static Result unifyConcrete(String location, ConcreteEffect e1,
      ConcreteEffect e2) {
    Substitution substitution = Substitution.EMPTY;
    final List<ErrorTree> errors = new ArrayList<>();
    try {
      for (Component.Kind kind : Component.Kind.values()) {
        final Entity v1 = e1.entity(kind);
        final Entity v2 = e2.entity(kind);
        if (v1 == null && v2 == null) {
          continue;
        }
        final Result result =
            unifyEntities(
                substitution.apply(firstNonNull(v1, ConcreteEntity.EMPTY)),
                substitution.apply(firstNonNull(v2, ConcreteEntity.EMPTY)));
        if (result instanceof Failure) {
          errors.add(((Failure) result).errorTree);
          continue;
        }
        substitution = Substitution.compose(substitution,
            (Substitution) result);
      }
    } catch (Substitution.CycleException e) {
      return failure(location, e.getMessage());
    }
    if (!errors.isEmpty()) {
      return new Failure(ErrorTree.of(location, errors));
    }
    return substitution;
  }

  private static Result unifyConcreteEntities(String location,
      ConcreteEntity v1, ConcreteEntity v2) {
    final ImmutableSortedSet<String> names1 = v1.names();
    final ImmutableSortedSet<String> names2 = v2.names();
    if (names1.equals(names2)) {
      return Substitution.EMPTY;
    }
    return failure(location,
        format("Expected variables [%s] and [%s] to be the same", v1, v2));
  }

  /**
   * Unifies a flattened union with a concrete entity.
   *
   * <p>The concrete members of the union must be contained in the concrete
   * entity. If the union has no variable members, the concrete members must
   * cover the concrete entity. Each variable member is bound to the whole of
   * the concrete entity.
   */
  private static Result unifyUnion(String location, UnionEntity union,
      ConcreteEntity concrete) {
    final ImmutableSortedSet<String> names = concrete.names();
    final ImmutableSortedSet.Builder<String> memberNames =
        ImmutableSortedSet.naturalOrder();
    final List<Substitution.Binding> bindings = new ArrayList<>();
    for (Entity member : union.entities) {
      if (member instanceof ConcreteEntity) {
        memberNames.addAll(((ConcreteEntity) member).names());
      } else if (member instanceof EntityVar) {
        bindings.add(
            Substitution.bindEntity(((EntityVar) member).name, concrete));
      } else {
        return failure(location,
            "Unification for unions of entities is not implemented");
      }
    }
    final ImmutableSortedSet<String> concreteNames = memberNames.build();
    if (!names.containsAll(concreteNames)
        || bindings.isEmpty() && !names.equals(concreteNames)) {
      return failure(location,
          format("Expected variables [%s] and [%s] to be the same", union,
              concrete));
    }
    return Substitution.of(bindings);
  }

  private static Failure failure(String location, String message) {
    return new Failure(ErrorTree.leaf(location, message));
  }

  /**
   * Result of attempting unification. A success is a {@link Substitution}; a
   * failure is a {@link Failure}.
   */
  public interface Result {}

  /** Result indicating that unification was not possible. */
  public static final class Failure implements Result {
    public final ErrorTree errorTree;

    Failure(ErrorTree errorTree) {
      this.errorTree = requireNonNull(errorTree);
    }

    /** Returns a failure whose tree has an extra root for a location. */
    Failure wrap(String location) {
      return new Failure(ErrorTree.of(location, errorTree));
    }

    /** Returns the reason for the failure. */
    public String reason() {
      return errorTree.toString();
    }

    @Override
    public String toString() {
      return "failure(" + reason() + ")";
    }
  }
}

// End EffectUnifier.java
