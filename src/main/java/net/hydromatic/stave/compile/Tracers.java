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

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.stave.ast.IrNode;
import net.hydromatic.stave.effect.Effect;
import net.hydromatic.stave.effect.EffectScheme;
import net.hydromatic.stave.effect.EffectUnifier;
import net.hydromatic.stave.effect.ErrorTree;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes each event as a line to a writer. */
  public static Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /** Returns a tracer that writes each event as a line to a stream. */
  public static Tracer printTracer(OutputStream out) {
    return printTracer(
        new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8)));
  }

  /** Returns a tracer that performs the given action on a recorded effect,
   * then calls the underlying tracer. */
  public static Tracer withOnEffect(Tracer tracer,
      BiConsumer<IrNode, EffectScheme> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onEffect(IrNode node, EffectScheme scheme) {
        consumer.accept(node, scheme);
        super.onEffect(node, scheme);
      }
    };
  }

  /** Returns a tracer that performs the given action on a recorded error,
   * then calls the underlying tracer. */
  public static Tracer withOnError(Tracer tracer,
      BiConsumer<IrNode, ErrorTree> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onError(IrNode node, ErrorTree errorTree) {
        consumer.accept(node, errorTree);
        super.onError(node, errorTree);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of each
   * unification, then calls the underlying tracer. */
  public static Tracer withOnUnify(Tracer tracer,
      Consumer<EffectUnifier.Result> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onUnify(Effect left, Effect right,
          EffectUnifier.Result result) {
        consumer.accept(result);
        super.onUnify(left, right, result);
      }
    };
  }

  public static Tracer withOnSkip(Tracer tracer, Consumer<IrNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSkip(IrNode node) {
        consumer.accept(node);
        super.onSkip(node);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onUnify(Effect left, Effect right,
        EffectUnifier.Result result) {
    }

    @Override public void onEffect(IrNode node, EffectScheme scheme) {
    }

    @Override public void onError(IrNode node, ErrorTree errorTree) {
    }

    @Override public void onSkip(IrNode node) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override public void onUnify(Effect left, Effect right,
        EffectUnifier.Result result) {
      tracer.onUnify(left, right, result);
    }

    @Override public void onEffect(IrNode node, EffectScheme scheme) {
      tracer.onEffect(node, scheme);
    }

    @Override public void onError(IrNode node, ErrorTree errorTree) {
      tracer.onError(node, errorTree);
    }

    @Override public void onSkip(IrNode node) {
      tracer.onSkip(node);
    }
  }

  /** Tracer that prints each event. */
  private static class PrintTracer implements Tracer {
    final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    @Override public void onUnify(Effect left, Effect right,
        EffectUnifier.Result result) {
      w.println("unify " + left + " with " + right + ": " + result);
      w.flush();
    }

    @Override public void onEffect(IrNode node, EffectScheme scheme) {
      w.println("effect #" + node.id + " " + node + ": " + scheme);
      w.flush();
    }

    @Override public void onError(IrNode node, ErrorTree errorTree) {
      w.println("error #" + node.id + " " + node + ":");
      w.println(errorTree.describeTo(new StringBuilder()));
      w.flush();
    }

    @Override public void onSkip(IrNode node) {
      w.println("skip #" + node.id + " " + node);
      w.flush();
    }
  }
}

// End Tracers.java
