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
package net.hydromatic.integral.function;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.integral.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableMap;
import java.util.function.DoubleUnaryOperator;
import java.util.function.UnaryOperator;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in elementary functions.
 *
 * <p>Each function has one argument. For each, we know its derivative, its
 * numeric value, its class in the LIATE ordering, and (for most) an
 * antiderivative.
 */
public enum BuiltIn {
  /** Function "exp", the exponential function. */
  EXP(
      "exp",
      null,
      Liate.EXPONENTIAL,
      Parity.NONE,
      Math::exp,
      u -> expr.exp(u),
      u -> expr.exp(u)),

  /** Function "ln", the natural logarithm. Alias "log". */
  LN(
      "ln",
      "log",
      Liate.LOGARITHMIC,
      Parity.NONE,
      Math::log,
      u -> expr.reciprocal(u),
      u -> expr.sub(expr.mul(u, expr.ln(u)), u)),

  SIN(
      "sin",
      null,
      Liate.TRIGONOMETRIC,
      Parity.ODD,
      Math::sin,
      u -> expr.cos(u),
      u -> expr.neg(expr.cos(u))),

  COS(
      "cos",
      null,
      Liate.TRIGONOMETRIC,
      Parity.EVEN,
      Math::cos,
      u -> expr.neg(expr.sin(u)),
      u -> expr.sin(u)),

  TAN(
      "tan",
      null,
      Liate.TRIGONOMETRIC,
      Parity.ODD,
      Math::tan,
      u -> expr.pow(expr.cos(u), -2),
      u -> expr.neg(expr.lnAbs(expr.cos(u)))),

  COT(
      "cot",
      null,
      Liate.TRIGONOMETRIC,
      Parity.ODD,
      a -> 1d / Math.tan(a),
      u -> expr.neg(expr.pow(expr.sin(u), -2)),
      u -> expr.lnAbs(expr.sin(u))),

  SEC(
      "sec",
      null,
      Liate.TRIGONOMETRIC,
      Parity.EVEN,
      a -> 1d / Math.cos(a),
      u -> expr.mul(expr.sin(u), expr.pow(expr.cos(u), -2)),
      u -> expr.lnAbs(expr.add(call("sec", u), expr.tan(u)))),

  CSC(
      "csc",
      null,
      Liate.TRIGONOMETRIC,
      Parity.ODD,
      a -> 1d / Math.sin(a),
      u -> expr.neg(expr.mul(expr.cos(u), expr.pow(expr.sin(u), -2))),
      u ->
          expr.neg(
              expr.lnAbs(
                  expr.add(
                      call("csc", u), call("cot", u))))),

  ARCSIN(
      "arcsin",
      "asin",
      Liate.INVERSE_TRIGONOMETRIC,
      Parity.ODD,
      Math::asin,
      u -> expr.pow(oneMinusSquare(u), BigRational.HALF.negate()),
      u ->
          expr.add(
              expr.mul(u, call("arcsin", u)),
              expr.sqrt(oneMinusSquare(u)))),

  ARCCOS(
      "arccos",
      "acos",
      Liate.INVERSE_TRIGONOMETRIC,
      Parity.NONE,
      Math::acos,
      u -> expr.neg(expr.pow(oneMinusSquare(u), BigRational.HALF.negate())),
      u ->
          expr.sub(
              expr.mul(u, call("arccos", u)),
              expr.sqrt(oneMinusSquare(u)))),

  ARCTAN(
      "arctan",
      "atan",
      Liate.INVERSE_TRIGONOMETRIC,
      Parity.ODD,
      Math::atan,
      u -> expr.reciprocal(onePlusSquare(u)),
      u ->
          expr.sub(
              expr.mul(u, call("arctan", u)),
              expr.mul(BigRational.HALF, expr.ln(onePlusSquare(u))))),

  SINH(
      "sinh",
      null,
      Liate.EXPONENTIAL,
      Parity.ODD,
      Math::sinh,
      u -> call("cosh", u),
      u -> call("cosh", u)),

  COSH(
      "cosh",
      null,
      Liate.EXPONENTIAL,
      Parity.EVEN,
      Math::cosh,
      u -> call("sinh", u),
      u -> call("sinh", u)),

  TANH(
      "tanh",
      null,
      Liate.EXPONENTIAL,
      Parity.ODD,
      Math::tanh,
      u -> expr.pow(call("cosh", u), -2),
      u -> expr.ln(call("cosh", u))),

  /** Function "abs", absolute value. Its derivative is "u / abs(u)". */
  ABS(
      "abs",
      null,
      Liate.ALGEBRAIC,
      Parity.EVEN,
      Math::abs,
      u -> expr.mul(u, expr.reciprocal(expr.abs(u))),
      u -> expr.mul(BigRational.HALF, expr.mul(u, expr.abs(u))));

  /** Name used when printing, e.g. "arcsin". */
  public final String functionName;

  /** Alternative name accepted by the parser, e.g. "asin"; or null. */
  public final @Nullable String alias;

  public final Liate liate;

  public final Parity parity;

  private final DoubleUnaryOperator evaluator;
  private final UnaryOperator<Expr> derivative;
  private final @Nullable UnaryOperator<Expr> antiderivative;

  /** Map of all functions, keyed by both function name and alias. */
  public static final ImmutableMap<String, BuiltIn> BY_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      b.put(builtIn.functionName, builtIn);
      if (builtIn.alias != null) {
        b.put(builtIn.alias, builtIn);
      }
    }
    BY_NAME = b.build();
  }

  BuiltIn(
      String functionName,
      @Nullable String alias,
      Liate liate,
      Parity parity,
      DoubleUnaryOperator evaluator,
      UnaryOperator<Expr> derivative,
      @Nullable UnaryOperator<Expr> antiderivative) {
    this.functionName = requireNonNull(functionName);
    this.alias = alias;
    this.liate = requireNonNull(liate);
    this.parity = requireNonNull(parity);
    this.evaluator = requireNonNull(evaluator);
    this.derivative = requireNonNull(derivative);
    this.antiderivative = antiderivative;
  }

  /** Calls a function by name. Enum constants use this to refer to each
   * other before they are initialized. */
  private static Expr call(String name, Expr u) {
    return expr.call(requireNonNull(BY_NAME.get(name), name), u);
  }

  private static Expr oneMinusSquare(Expr u) {
    return expr.sub(expr.one(), expr.pow(u, 2));
  }

  private static Expr onePlusSquare(Expr u) {
    return expr.add(expr.one(), expr.pow(u, 2));
  }

  /** Evaluates this function numerically. */
  public double apply(double arg) {
    return evaluator.applyAsDouble(arg);
  }

  /**
   * Returns the derivative of this function evaluated at {@code u}, that is,
   * f'(u). The caller multiplies by u' (chain rule).
   */
  public Expr derivative(Expr u) {
    return derivative.apply(u);
  }

  /** Returns whether this function has a known elementary antiderivative. */
  public boolean hasAntiderivative() {
    return antiderivative != null;
  }

  /**
   * Returns an antiderivative F(u) of this function, so that F'(u) = f(u); or
   * null if none is known.
   */
  public @Nullable Expr antiderivative(Expr u) {
    return antiderivative == null ? null : antiderivative.apply(u);
  }

  /**
   * Applies function-specific identities to a call whose argument has
   * already been simplified. Returns a (not necessarily simplified)
   * replacement, or null if no identity applies.
   */
  public @Nullable Expr simplify(Expr arg) {
    if (arg.isNum(0)) {
      switch (this) {
        case EXP:
        case COS:
        case SEC:
        case COSH:
          return expr.one();
        case SIN:
        case TAN:
        case ARCSIN:
        case ARCTAN:
        case SINH:
        case TANH:
        case ABS:
          return expr.zero();
        default:
          break;
      }
    }
    if (parity != Parity.NONE && isNegated(arg)) {
      final Expr call = expr.call(this, expr.neg(arg));
      return parity == Parity.EVEN ? call : expr.neg(call);
    }
    switch (this) {
      case EXP:
        if (arg.isCall(LN)) {
          return ((Expr.Call) arg).arg;
        }
        if (arg instanceof Expr.Mul) {
          // exp(c * ln(u)) = u ^ c
          final Expr.Mul mul = (Expr.Mul) arg;
          if (mul.factors.size() == 2
              && mul.factors.get(0).isNum()
              && mul.factors.get(1).isCall(LN)) {
            return expr.pow(
                ((Expr.Call) mul.factors.get(1)).arg, mul.factors.get(0));
          }
        }
        return null;
      case LN:
        if (arg.isNum(1)) {
          return expr.zero();
        }
        if (arg.isCall(EXP)) {
          return ((Expr.Call) arg).arg;
        }
        return null;
      case ABS:
        if (arg instanceof Expr.Num) {
          return expr.num(((Expr.Num) arg).value.abs());
        }
        if (arg.isCall(ABS) || arg.isCall(EXP) || arg.isCall(COSH)) {
          return arg;
        }
        return null;
      default:
        return null;
    }
  }

  /**
   * Returns whether an expression is "negative" in form: a negative number or
   * a product whose numeric coefficient is negative.
   */
  static boolean isNegated(Expr e) {
    if (e instanceof Expr.Num) {
      return ((Expr.Num) e).value.signum() < 0;
    }
    if (e instanceof Expr.Mul) {
      final Expr first = ((Expr.Mul) e).factors.get(0);
      return first instanceof Expr.Num && ((Expr.Num) first).value.signum() < 0;
    }
    return false;
  }

  /** Symmetry of a function under negation of its argument. */
  public enum Parity {
    /** f(-x) = -f(x). */
    ODD,
    /** f(-x) = f(x). */
    EVEN,
    NONE
  }
}

// End BuiltIn.java
