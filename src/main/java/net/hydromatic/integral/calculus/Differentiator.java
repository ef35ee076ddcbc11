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
package net.hydromatic.integral.calculus;

import static net.hydromatic.integral.ast.ExprBuilder.expr;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.algebra.Exprs;
import net.hydromatic.integral.algebra.Replacer;
import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.function.BuiltIn;
import net.hydromatic.integral.util.Static;

/**
 * Differentiates expressions.
 *
 * <p>Differentiation is exact. The derivative of {@code ln(abs(u))} is
 * {@code u' / u}. The derivative of an unevaluated integral with respect to
 * its own variable is its integrand.
 */
public class Differentiator {
  private Differentiator() {}

  /** Returns the simplified derivative of {@code e} with respect to x. */
  public static Expr derivative(Expr e, Expr.Sym x) {
    return Simplifier.simplify(derive(e, x));
  }

  private static Expr derive(Expr e, Expr.Sym x) {
    if (Exprs.freeOf(e, x)) {
      return expr.zero();
    }
    switch (e.op) {
      case SYM:
        return expr.one();
      case ADD:
        return expr.add(
            Static.transformEager(((Expr.Add) e).terms, t -> derive(t, x)));
      case MUL:
        // Product rule: (f g h)' = f' g h + f g' h + f g h'
        final List<Expr> factors = ((Expr.Mul) e).factors;
        final List<Expr> terms = new ArrayList<>();
        for (int i = 0; i < factors.size(); i++) {
          if (Exprs.freeOf(factors.get(i), x)) {
            continue;
          }
          final List<Expr> list = new ArrayList<>(factors);
          list.set(i, derive(factors.get(i), x));
          terms.add(expr.mul(list));
        }
        return expr.add(terms);
      case POW:
        return derivePow((Expr.Pow) e, x);
      case CALL:
        return deriveCall((Expr.Call) e, x);
      case INTEGRAL:
        return deriveIntegral((Expr.Integral) e, x);
      default:
        throw new AssertionError(e.op);
    }
  }

  private static Expr derivePow(Expr.Pow pow, Expr.Sym x) {
    final Expr f = pow.base;
    final Expr g = pow.exponent;
    if (Exprs.freeOf(g, x)) {
      // (f ^ g)' = g f ^ (g - 1) f'
      return expr.mul(
          g, expr.pow(f, expr.sub(g, expr.one())), derive(f, x));
    }
    if (Exprs.freeOf(f, x)) {
      // (c ^ g)' = c ^ g ln(c) g'
      return expr.mul(pow, expr.ln(f), derive(g, x));
    }
    // (f ^ g)' = f ^ g (g' ln(f) + g f' / f)
    return expr.mul(
        pow,
        expr.add(
            expr.mul(derive(g, x), expr.ln(f)),
            expr.mul(g, derive(f, x), expr.reciprocal(f))));
  }

  private static Expr deriveCall(Expr.Call call, Expr.Sym x) {
    if (call.fn == BuiltIn.LN && call.arg.isCall(BuiltIn.ABS)) {
      // ln(abs(u))' = u' / u
      final Expr u = ((Expr.Call) call.arg).arg;
      return expr.mul(derive(u, x), expr.reciprocal(u));
    }
    // Chain rule
    return expr.mul(call.fn.derivative(call.arg), derive(call.arg, x));
  }

  private static Expr deriveIntegral(Expr.Integral integral, Expr.Sym x) {
    if (!integral.isDefinite()) {
      if (integral.variable.equals(x)) {
        return integral.integrand;
      }
      // Differentiate under the integral sign
      return expr.integral(derive(integral.integrand, x), integral.variable);
    }
    // Leibniz rule: d/dx integral(f, t, a, b)
    //   = f(b) b' - f(a) a' + integral(df/dx, t, a, b)
    final Expr a = integral.lower;
    final Expr b = integral.upper;
    final Expr.Sym t = integral.variable;
    final List<Expr> terms = new ArrayList<>();
    if (a != null && b != null) {
      terms.add(
          expr.mul(
              Replacer.replace(integral.integrand, t, b),
              derive(b, x)));
      terms.add(
          expr.neg(
              expr.mul(
                  Replacer.replace(integral.integrand, t, a),
                  derive(a, x))));
      if (!t.equals(x) && !Exprs.freeOf(integral.integrand, x)) {
        terms.add(
            expr.integral(derive(integral.integrand, x), t, a, b));
      }
    }
    return expr.add(terms);
  }
}

// End Differentiator.java
