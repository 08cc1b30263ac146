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

import net.hydromatic.stave.ast.IrNode;
import net.hydromatic.stave.effect.Effect;
import net.hydromatic.stave.effect.EffectScheme;
import net.hydromatic.stave.effect.EffectUnifier;
import net.hydromatic.stave.effect.ErrorTree;

/** Called on various events during effect inference. */
public interface Tracer {
  /** Called after an attempt to unify two effects. */
  void onUnify(Effect left, Effect right, EffectUnifier.Result result);

  /**
   * Called when an effect is recorded for a node. May be called more than
   * once for the same node, if an application refines the effect of its
   * arguments.
   */
  void onEffect(IrNode node, EffectScheme scheme);

  /** Called when an error is recorded for a node. */
  void onError(IrNode node, ErrorTree errorTree);

  /** Called when inference for a node is skipped because of earlier errors. */
  void onSkip(IrNode node);
}

// End Tracer.java
