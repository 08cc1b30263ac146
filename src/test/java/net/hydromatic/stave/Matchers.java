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
package net.hydromatic.stave;

import java.util.Collections;
import net.hydromatic.stave.compile.EffectInferrer;
import net.hydromatic.stave.effect.EffectScheme;
import net.hydromatic.stave.effect.EffectUnifier;
import net.hydromatic.stave.effect.ErrorTree;
import net.hydromatic.stave.effect.Substitution;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in Stave tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a result that has an effect for a node, with a given string
   * representation, and no error for that node. */
  public static Matcher<EffectInferrer.Resolved> hasEffect(long id,
      String expected) {
    return new CustomTypeSafeMatcher<EffectInferrer.Resolved>(
        "effect of #" + id + " is " + expected) {
      @Override protected boolean matchesSafely(
          EffectInferrer.Resolved resolved) {
        final EffectScheme scheme = resolved.effect(id);
        return scheme != null
            && scheme.toString().equals(expected)
            && resolved.error(id) == null;
      }
    };
  }

  /** Matches a result that has an error for a node, whose messages include a
   * given message, and no effect for that node. */
  public static Matcher<EffectInferrer.Resolved> hasError(long id,
      String message) {
    return new CustomTypeSafeMatcher<EffectInferrer.Resolved>(
        "error of #" + id + " has message " + message) {
      @Override protected boolean matchesSafely(
          EffectInferrer.Resolved resolved) {
        final ErrorTree errorTree = resolved.error(id);
        return errorTree != null
            && errorTree.messages().contains(message)
            && resolved.effect(id) == null;
      }
    };
  }

  /** Matches a successful unification whose substitution has a given
   * string representation. */
  public static Matcher<EffectUnifier.Result> isSubstitution(String expected) {
    return new CustomTypeSafeMatcher<EffectUnifier.Result>(
        "substitution " + expected) {
      @Override protected boolean matchesSafely(EffectUnifier.Result result) {
        return result instanceof Substitution
            && result.toString().equals(expected);
      }
    };
  }

  /** Matches a failed unification whose error tree has exactly one message,
   * the given message. */
  public static Matcher<EffectUnifier.Result> isFailure(String message) {
    return new CustomTypeSafeMatcher<EffectUnifier.Result>(
        "failure with message " + message) {
      @Override protected boolean matchesSafely(EffectUnifier.Result result) {
        return result instanceof EffectUnifier.Failure
            && ((EffectUnifier.Failure) result).errorTree.messages()
                .equals(Collections.singletonList(message));
      }
    };
  }
}

// End Matchers.java
