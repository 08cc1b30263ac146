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
import static net.hydromatic.stave.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * The effect of an operator: a function from the effects of its parameters
 * to the effect of its result.
 *
 * <p>For example, {@code iadd} has effect
 * {@code (Read[r0] & Temporal[t0], Read[r1] & Temporal[t1])
 * => Read[r0, r1] & Temporal[t0, t1]}.
 */
public final class ArrowEffect implements Effect {
  public final ImmutableList<Effect> params;
  public final Effect result;

  private ArrowEffect(ImmutableList<Effect> params, Effect result) {
    this.params = requireNonNull(params);
    this.result = requireNonNull(result);
  }

  /** Creates an ArrowEffect. */
  public static ArrowEffect of(Iterable<? extends Effect> params,
      Effect result) {
    return new ArrowEffect(ImmutableList.copyOf(params), result);
  }

  @Override
  public void collectNames(Names.Builder builder) {
    params.forEach(p -> p.collectNames(builder));
    result.collectNames(builder);
  }

  @Override
  public boolean contains(String effectVariable) {
    for (Effect param : params) {
      if (param.contains(effectVariable)) {
        return true;
      }
    }
    return result.contains(effectVariable);
  }

  @Override
  public boolean containsEntity(String entityVariable) {
    for (Effect param : params) {
      if (param.containsEntity(entityVariable)) {
        return true;
      }
    }
    return result.containsEntity(entityVariable);
  }

  @Override
  public ArrowEffect simplify() {
    final ImmutableList<Effect> params2 =
        transformEager(params, Effect::simplify);
    final Effect result2 = result.simplify();
    return params2.equals(params) && result2.equals(result)
        ? this
        : new ArrowEffect(params2, result2);
  }

  @Override
  public int hashCode() {
    return Objects.hash(params, result);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof ArrowEffect
            && params.equals(((ArrowEffect) obj).params)
            && result.equals(((ArrowEffect) obj).result);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append('(');
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      params.get(i).describeTo(buf);
    }
    buf.append(") => ");
    return result.describeTo(buf);
  }
}

// End ArrowEffect.java
