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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Failure to infer an effect, with the failures that caused it.
 *
 * <p>Each node has a location, which describes the step that was being
 * attempted (e.g. "Trying to unify Read[x] and Pure"). A leaf also has a
 * message. A failure inside a sub-step becomes a child of the failure of the
 * enclosing step.
 */
public final class ErrorTree {
  public final String location;
  public final @Nullable String message;
  public final ImmutableList<ErrorTree> children;

  private ErrorTree(String location, @Nullable String message,
      ImmutableList<ErrorTree> children) {
    this.location = requireNonNull(location);
    this.message = message;
    this.children = requireNonNull(children);
  }

  /** Creates an error with a message and no children. */
  public static ErrorTree leaf(String location, String message) {
    return new ErrorTree(location, requireNonNull(message),
        ImmutableList.of());
  }

  /**
   * Wraps an error in a node for an enclosing location.
   *
   * <p>If the error already has the same location, returns it unchanged, so
   * that wrapping twice at the same step does not add a level.
   */
  public static ErrorTree of(String location, ErrorTree child) {
    if (child.location.equals(location)) {
      return child;
    }
    return new ErrorTree(location, null, ImmutableList.of(child));
  }

  /** Creates an error whose causes are a list of errors. */
  public static ErrorTree of(String location, List<ErrorTree> children) {
    if (children.size() == 1) {
      return of(location, children.get(0));
    }
    return new ErrorTree(location, null, ImmutableList.copyOf(children));
  }

  /** Returns the messages of this tree's leaves, in order. */
  public List<String> messages() {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    addMessages(b);
    return b.build();
  }

  private void addMessages(ImmutableList.Builder<String> b) {
    if (message != null) {
      b.add(message);
    }
    children.forEach(child -> child.addMessages(b));
  }

  @Override
  public int hashCode() {
    return Objects.hash(location, message, children);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof ErrorTree
            && location.equals(((ErrorTree) obj).location)
            && Objects.equals(message, ((ErrorTree) obj).message)
            && children.equals(((ErrorTree) obj).children);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes this tree to a buffer, one location per line, indented. */
  public StringBuilder describeTo(StringBuilder buf) {
    return describeTo(buf, 0);
  }

  private StringBuilder describeTo(StringBuilder buf, int indent) {
    if (indent > 0) {
      buf.append('\n');
    }
    buf.append(Strings.repeat("  ", indent)).append(location);
    if (message != null) {
      buf.append(": ").append(message);
    }
    children.forEach(child -> child.describeTo(buf, indent + 1));
    return buf;
  }
}

// End ErrorTree.java
