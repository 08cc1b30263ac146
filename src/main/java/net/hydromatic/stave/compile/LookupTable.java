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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.stave.ast.Ir;
import net.hydromatic.stave.ast.IrNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Table that maps each occurrence of a name to the declaration it refers to.
 *
 * <p>It is produced by name resolution, and keyed by the identifier of the
 * {@link Ir.Name} (or, for an application, the {@link Ir.App}) in which the
 * name occurs.
 */
public class LookupTable {
  /** Table that has no entries. */
  public static final LookupTable EMPTY = new LookupTable(ImmutableMap.of());

  private final ImmutableMap<Long, Definition> map;

  private LookupTable(ImmutableMap<Long, Definition> map) {
    this.map = requireNonNull(map);
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the definition that a name occurrence refers to, or null. */
  public @Nullable Definition get(long nameId) {
    return map.get(nameId);
  }

  public int size() {
    return map.size();
  }

  @Override
  public String toString() {
    return map.toString();
  }

  /** Kind of declaration. */
  public enum Kind {
    VAR,
    CONST,
    DEF,
    PARAM;

    /** Returns the kind of a declaration node. */
    static Kind of(IrNode node) {
      switch (node.op) {
      case VAR:
        return VAR;
      case CONST:
        return CONST;
      case OP_DEF:
        return DEF;
      case PARAM:
        return PARAM;
      default:
        throw new IllegalArgumentException("not a declaration: " + node);
      }
    }
  }

  /** Declaration that a name refers to. */
  public static final class Definition {
    public final String name;
    public final Kind kind;
    /** Identifier of the declaring node. */
    public final long reference;

    Definition(String name, Kind kind, long reference) {
      this.name = requireNonNull(name);
      this.kind = requireNonNull(kind);
      this.reference = reference;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, kind, reference);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Definition
              && name.equals(((Definition) obj).name)
              && kind == ((Definition) obj).kind
              && reference == ((Definition) obj).reference;
    }

    @Override
    public String toString() {
      return kind.name().toLowerCase(Locale.ROOT) + " " + name
          + "#" + reference;
    }
  }

  /** Builder for {@link LookupTable}. */
  public static final class Builder {
    private final Map<Long, Definition> map = new LinkedHashMap<>();

    /** Records that a name occurrence refers to a declaration node. */
    public Builder put(long nameId, IrNode declaration) {
      final String name;
      if (declaration instanceof Ir.Def) {
        name = ((Ir.Def) declaration).name;
      } else if (declaration instanceof Ir.Param) {
        name = ((Ir.Param) declaration).name;
      } else {
        throw new IllegalArgumentException("not a declaration: "
            + declaration);
      }
      return put(nameId, name, Kind.of(declaration), declaration.id);
    }

    /** Records that a name occurrence refers to a declaration. */
    public Builder put(long nameId, String name, Kind kind, long reference) {
      map.put(nameId, new Definition(name, kind, reference));
      return this;
    }

    public LookupTable build() {
      return map.isEmpty() ? EMPTY : new LookupTable(ImmutableMap.copyOf(map));
    }
  }
}

// End LookupTable.java
