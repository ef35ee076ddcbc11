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
package net.hydromatic.integral.integrate;

import static net.hydromatic.integral.ast.ExprBuilder.expr;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.algebra.Expander;
import net.hydromatic.integral.algebra.Exprs;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.function.BuiltIn;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Strategy that integrates powers and products of trigonometric functions
 * of a linear argument θ = a x + b.
 *
 * <p>Handles:
 *
 * <ul>
 *   <li>{@code sin(θ) ^ m * cos(θ) ^ n} with an odd power, by substituting
 *       w = sin(θ) (if n is odd) or w = cos(θ) (if m is odd) and expanding
 *       {@code (1 - w ^ 2) ^ k} by the binomial theorem;
 *   <li>{@code sin(θ) ^ m} and {@code cos(θ) ^ n} with even powers, by the
 *       reduction formula;
 *   <li>{@code sin(θ) ^ m * cos(θ) ^ n} with both powers even, by the
 *       half-angle identities;
 *   <li>{@code tan(θ) ^ n} and {@code sec(θ) ^ n}, by reduction formulas;
 *   <li>products of sines and cosines of different arguments, by the
 *       product-to-sum identities.
 * </ul>
 */
public class TrigonometricReduction implements Strategy {
  @Override public StrategyKind kind() {
    return StrategyKind.TRIGONOMETRIC;
  }

  @Override public StrategyOutcome attempt(IntegrationRequest request,
      Integrator integrator) {
    final Expr.Sym x = request.variable;
    final Exprs.Split split = Exprs.split(request.integrand, x);
    final int maxPower = integrator.intValue(Prop.TRIG_MAX_POWER);
    final @Nullable Expr e =
        integrate(split.dependent, x, maxPower, request, integrator);
    if (e == null) {
      return StrategyOutcome.notApplicable();
    }
    if (!Integrator.isClosed(e)) {
      return StrategyOutcome.notApplicable();
    }
    return StrategyOutcome.found(expr.mul(split.coefficient, e));
  }

  private static @Nullable Expr integrate(Expr core, Expr.Sym x,
      int maxPower, IntegrationRequest request, Integrator integrator) {
    final @Nullable SinCos sc = SinCos.of(core, x, maxPower);
    if (sc != null) {
      final int m = sc.m;
      final int n = sc.n;
      if (n % 2 == 1 && (m % 2 == 0 || n <= m)) {
        // w = sin(θ), cos(θ) ^ (n - 1) = (1 - w ^ 2) ^ k
        return oddPower(expr.sin(sc.theta), m, (n - 1) / 2, sc.a, false);
      }
      if (m % 2 == 1) {
        // w = cos(θ), sin(θ) ^ (m - 1) = (1 - w ^ 2) ^ k
        return oddPower(expr.cos(sc.theta), n, (m - 1) / 2, sc.a, true);
      }
      if (n == 0) {
        return sinPower(sc.theta, x, sc.a, m);
      }
      if (m == 0) {
        return cosPower(sc.theta, x, sc.a, n);
      }
      // Both even: sin ^ 2 = (1 - cos 2θ) / 2, cos ^ 2 = (1 + cos 2θ) / 2
      final Expr cos2 = expr.cos(expr.mul(expr.num(2), sc.theta));
      final Expr half = expr.num(1, 2);
      final Expr rewritten =
          expr.mul(
              expr.pow(expr.mul(half, expr.sub(expr.one(), cos2)), m / 2),
              expr.pow(expr.mul(half, expr.add(expr.one(), cos2)), n / 2));
      return integrator.integrate(
          request.nested(Expander.expand(rewritten)));
    }
    if (core instanceof Expr.Pow
        && ((Expr.Pow) core).exponent instanceof Expr.Num) {
      final Expr.Pow pow = (Expr.Pow) core;
      final BigRational k = ((Expr.Num) pow.exponent).value;
      if (k.isSmallInteger() && k.signum() > 0
          && k.intValueExact() <= maxPower) {
        final Exprs.@Nullable Linear tan =
            IntegrationTable.callOfLinear(pow.base, BuiltIn.TAN, x);
        if (tan != null) {
          return tanPower(((Expr.Call) pow.base).arg, x, tan.a,
              k.intValueExact());
        }
        final Exprs.@Nullable Linear sec =
            IntegrationTable.callOfLinear(pow.base, BuiltIn.SEC, x);
        if (sec != null) {
          return secPower(((Expr.Call) pow.base).arg, x, sec.a,
              k.intValueExact());
        }
      }
      if (k.isSmallInteger() && k.signum() < 0
          && -k.intValueExact() <= maxPower) {
        // cos(θ) ^ -n = sec(θ) ^ n
        final Exprs.@Nullable Linear cos =
            IntegrationTable.callOfLinear(pow.base, BuiltIn.COS, x);
        if (cos != null) {
          return secPower(((Expr.Call) pow.base).arg, x, cos.a,
              -k.intValueExact());
        }
      }
    }
    final @Nullable Expr sum = productToSum(core, x);
    if (sum != null) {
      return integrator.integrate(request.nested(sum));
    }
    return null;
  }

  /**
   * Returns the sum over i of
   * {@code ±C(k, i) (-1) ^ i w ^ (p + 2i + 1) / ((p + 2i + 1) a)},
   * the integral of {@code w ^ p (1 - w ^ 2) ^ k dw / a}.
   */
  private static Expr oddPower(Expr w, int p, int k, Expr a,
      boolean negate) {
    final List<Expr> terms = new ArrayList<>();
    BigRational binomial = BigRational.ONE;
    for (int i = 0; i <= k; i++) {
      final int e = p + 2 * i + 1;
      BigRational c = binomial.divide(e);
      if (i % 2 == 1) {
        c = c.negate();
      }
      terms.add(expr.mul(expr.num(c), expr.pow(w, e)));
      binomial = binomial.multiply(k - i).divide(i + 1);
    }
    final Expr sum = expr.div(expr.add(terms), a);
    return negate ? expr.neg(sum) : sum;
  }

  /**
   * Integrates {@code sin(θ) ^ m} by the reduction formula
   * {@code -sin ^ (m-1) cos / (m a) + (m-1)/m * integral(sin ^ (m-2))}.
   */
  static Expr sinPower(Expr theta, Expr.Sym x, Expr a, int m) {
    if (m == 0) {
      return x;
    }
    if (m == 1) {
      return expr.neg(expr.div(expr.cos(theta), a));
    }
    return expr.add(
        expr.neg(
            expr.div(
                expr.mul(expr.pow(expr.sin(theta), m - 1), expr.cos(theta)),
                expr.mul(expr.num(m), a))),
        expr.mul(expr.num(m - 1, m), sinPower(theta, x, a, m - 2)));
  }

  /**
   * Integrates {@code cos(θ) ^ n} by the reduction formula
   * {@code cos ^ (n-1) sin / (n a) + (n-1)/n * integral(cos ^ (n-2))}.
   */
  static Expr cosPower(Expr theta, Expr.Sym x, Expr a, int n) {
    if (n == 0) {
      return x;
    }
    if (n == 1) {
      return expr.div(expr.sin(theta), a);
    }
    return expr.add(
        expr.div(
            expr.mul(expr.pow(expr.cos(theta), n - 1), expr.sin(theta)),
            expr.mul(expr.num(n), a)),
        expr.mul(expr.num(n - 1, n), cosPower(theta, x, a, n - 2)));
  }

  /**
   * Integrates {@code tan(θ) ^ n}:
   * {@code tan ^ (n-1) / ((n-1) a) - integral(tan ^ (n-2))}.
   */
  static Expr tanPower(Expr theta, Expr.Sym x, Expr a, int n) {
    if (n == 0) {
      return x;
    }
    if (n == 1) {
      return expr.neg(expr.div(expr.lnAbs(expr.cos(theta)), a));
    }
    return expr.sub(
        expr.div(expr.pow(expr.tan(theta), n - 1),
            expr.mul(expr.num(n - 1), a)),
        tanPower(theta, x, a, n - 2));
  }

  /**
   * Integrates {@code sec(θ) ^ n}:
   * {@code sec ^ (n-2) tan / ((n-1) a) + (n-2)/(n-1) integral(sec ^ (n-2))}.
   */
  static Expr secPower(Expr theta, Expr.Sym x, Expr a, int n) {
    final Expr sec = expr.call(BuiltIn.SEC, theta);
    if (n == 0) {
      return x;
    }
    if (n == 1) {
      return expr.div(expr.lnAbs(expr.add(sec, expr.tan(theta))), a);
    }
    return expr.add(
        expr.div(expr.mul(expr.pow(sec, n - 2), expr.tan(theta)),
            expr.mul(expr.num(n - 1), a)),
        expr.mul(expr.num(n - 2, n - 1), secPower(theta, x, a, n - 2)));
  }

  /**
   * Rewrites a product of sines and cosines of two different linear
   * arguments as a sum; returns null if the expression is not such a
   * product.
   */
  static @Nullable Expr productToSum(Expr e, Expr.Sym x) {
    if (!(e instanceof Expr.Mul) || ((Expr.Mul) e).factors.size() != 2) {
      return null;
    }
    final Expr f0 = ((Expr.Mul) e).factors.get(0);
    final Expr f1 = ((Expr.Mul) e).factors.get(1);
    if (!isSinOrCos(f0, x) || !isSinOrCos(f1, x)) {
      return null;
    }
    final Expr.Call c0 = (Expr.Call) f0;
    final Expr.Call c1 = (Expr.Call) f1;
    if (c0.arg.equals(c1.arg)) {
      return null;
    }
    final Expr half = expr.num(1, 2);
    final Expr sum = expr.add(c0.arg, c1.arg);
    final Expr difference = expr.sub(c0.arg, c1.arg);
    if (c0.fn == BuiltIn.SIN && c1.fn == BuiltIn.SIN) {
      // sin A sin B = (cos(A - B) - cos(A + B)) / 2
      return expr.mul(half,
          expr.sub(expr.cos(difference), expr.cos(sum)));
    }
    if (c0.fn == BuiltIn.COS && c1.fn == BuiltIn.COS) {
      // cos A cos B = (cos(A - B) + cos(A + B)) / 2
      return expr.mul(half,
          expr.add(expr.cos(difference), expr.cos(sum)));
    }
    // sin A cos B = (sin(A + B) + sin(A - B)) / 2
    final Expr.Call sin = c0.fn == BuiltIn.SIN ? c0 : c1;
    final Expr.Call cos = c0.fn == BuiltIn.SIN ? c1 : c0;
    return expr.mul(half,
        expr.add(expr.sin(expr.add(sin.arg, cos.arg)),
            expr.sin(expr.sub(sin.arg, cos.arg))));
  }

  private static boolean isSinOrCos(Expr e, Expr.Sym x) {
    return (e.isCall(BuiltIn.SIN) || e.isCall(BuiltIn.COS))
        && Exprs.linear(((Expr.Call) e).arg, x) != null;
  }

  /** Product {@code sin(θ) ^ m * cos(θ) ^ n} with θ linear in x. */
  private static class SinCos {
    final Expr theta;
    final Expr a;
    final int m;
    final int n;

    SinCos(Expr theta, Expr a, int m, int n) {
      this.theta = theta;
      this.a = a;
      this.m = m;
      this.n = n;
    }

    static @Nullable SinCos of(Expr e, Expr.Sym x, int maxPower) {
      @Nullable Expr theta = null;
      int m = 0;
      int n = 0;
      for (Expr factor : Exprs.factors(e)) {
        final Expr base;
        final int k;
        if (factor instanceof Expr.Pow) {
          final Expr exponent = ((Expr.Pow) factor).exponent;
          if (!(exponent instanceof Expr.Num)
              || !((Expr.Num) exponent).value.isSmallInteger()
              || ((Expr.Num) exponent).value.signum() <= 0) {
            return null;
          }
          base = ((Expr.Pow) factor).base;
          k = ((Expr.Num) exponent).value.intValueExact();
        } else {
          base = factor;
          k = 1;
        }
        if (!base.isCall(BuiltIn.SIN) && !base.isCall(BuiltIn.COS)) {
          return null;
        }
        final Expr arg = ((Expr.Call) base).arg;
        if (theta == null) {
          theta = arg;
        } else if (!theta.equals(arg)) {
          return null;
        }
        if (base.isCall(BuiltIn.SIN)) {
          m += k;
        } else {
          n += k;
        }
      }
      if (theta == null || m > maxPower || n > maxPower) {
        return null;
      }
      final Exprs.@Nullable Linear linear = Exprs.linear(theta, x);
      if (linear == null) {
        return null;
      }
      return new SinCos(theta, linear.a, m, n);
    }
  }
}

// End TrigonometricReduction.java
