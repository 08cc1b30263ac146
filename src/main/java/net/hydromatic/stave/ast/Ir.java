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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

/** Various sub-classes of nodes in the intermediate representation. */
public class Ir {
  private Ir() {}

  /** Name of a parameter that cannot be referenced. */
  public static final String ANONYMOUS = "_";

  /** Top-level definition, or the definition in a "let". */
  public abstract static class Def extends IrNode {
    public final String name;

    Def(long id, Op op, String name) {
      super(id, op);
      this.name = requireNonNull(name);
    }
  }

  /** State variable declaration, "var x". */
  public static class VarDecl extends Def {
    VarDecl(long id, String name) {
      super(id, Op.VAR, name);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append("var ").append(name);
    }
  }

  /**
   * Constant declaration, "const c".
   *
   * <p>If the declared type is an operator type, {@link #operatorArity} is
   * the number of arguments of the operator; otherwise it is negative.
   */
  public static class ConstDecl extends Def {
    public final int operatorArity;

    ConstDecl(long id, String name, int operatorArity) {
      super(id, Op.CONST, name);
      this.operatorArity = operatorArity;
    }

    /** Returns whether the constant has an operator type. */
    public boolean isOperator() {
      return operatorArity >= 0;
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append("const ").append(name);
      if (isOperator()) {
        buf.append(": (");
        for (int i = 0; i < operatorArity; i++) {
          buf.append(i > 0 ? ", " : "").append('_');
        }
        buf.append(") => _");
      }
      return buf;
    }
  }

  /** Operator definition, "def name = expr". */
  public static class OpDef extends Def {
    public final Expr expr;

    OpDef(long id, String name, Expr expr) {
      super(id, Op.OP_DEF, name);
      this.expr = requireNonNull(expr);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return expr.unparse(buf.append("def ").append(name).append(" = "));
    }
  }

  /** Base class of expressions. */
  public abstract static class Expr extends IrNode {
    Expr(long id, Op op) {
      super(id, op);
    }
  }

  /** Reference to a name. */
  public static class Name extends Expr {
    public final String name;

    Name(long id, String name) {
      super(id, Op.NAME);
      this.name = requireNonNull(name);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }
  }

  /** Boolean, integer or string literal. */
  public static class Literal extends Expr {
    public final Comparable value;

    Literal(long id, Op op, Comparable value) {
      super(id, op);
      checkArgument(op.isLiteral(), "not a literal: %s", op);
      this.value = requireNonNull(value);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      switch (op) {
      case STR_LITERAL:
        return buf.append('"').append(value).append('"');
      default:
        return buf.append(value);
      }
    }
  }

  /** Application of an operator to arguments, "opcode(arg0, ..., argN)". */
  public static class App extends Expr {
    public final String opcode;
    public final ImmutableList<Expr> args;

    App(long id, String opcode, ImmutableList<Expr> args) {
      super(id, Op.APP);
      this.opcode = requireNonNull(opcode);
      this.args = requireNonNull(args);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append(opcode).append('(');
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        args.get(i).unparse(buf);
      }
      return buf.append(')');
    }
  }

  /** Parameter of a lambda. */
  public static class Param extends IrNode {
    public final String name;

    Param(long id, String name) {
      super(id, Op.PARAM);
      this.name = requireNonNull(name);
    }

    /** Returns whether this is the placeholder parameter "_". */
    public boolean isAnonymous() {
      return name.equals(ANONYMOUS);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }
  }

  /** Lambda, "(p0, ..., pN) => expr". */
  public static class Lambda extends Expr {
    public final ImmutableList<Param> params;
    public final Expr expr;

    Lambda(long id, ImmutableList<Param> params, Expr expr) {
      super(id, Op.LAMBDA);
      this.params = requireNonNull(params);
      this.expr = requireNonNull(expr);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append('(');
      for (int i = 0; i < params.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        params.get(i).unparse(buf);
      }
      return expr.unparse(buf.append(") => "));
    }
  }

  /** Let expression, "def name = expr { body }". */
  public static class Let extends Expr {
    public final OpDef opDef;
    public final Expr expr;

    Let(long id, OpDef opDef, Expr expr) {
      super(id, Op.LET);
      this.opDef = requireNonNull(opDef);
      this.expr = requireNonNull(expr);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      opDef.unparse(buf).append(" { ");
      return expr.unparse(buf).append(" }");
    }
  }
}

// End Ir.java
