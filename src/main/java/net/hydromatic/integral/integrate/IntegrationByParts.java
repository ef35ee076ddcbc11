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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.integral.ast.ExprBuilder.expr;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.algebra.Exprs;
import net.hydromatic.integral.algebra.Polynomials;
import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.calculus.Differentiator;
import net.hydromatic.integral.function.BuiltIn;
import net.hydromatic.integral.function.Liate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Strategy that integrates a product of two factors by parts:
 * {@code integral(u dv) = u v - integral(v du)}.
 *
 * <p>The factor to differentiate, u, is chosen by the LIATE rule
 * (logarithmic, inverse trigonometric, algebraic, trigonometric,
 * exponential). u must rank strictly above dv, or the two must be a
 * trigonometric and an exponential function; if u is algebraic, it must be
 * a polynomial.
 *
 * <p>Repeated steps are carried out in a loop, up to
 * {@link Prop#BY_PARTS_MAX_STEPS}, rather than by recursion; nested
 * requests never integrate by parts again. If a step produces a constant
 * multiple of the original integrand, as in {@code exp(x) sin(x)}, the
 * resulting equation is solved for the integral.
 */
public class IntegrationByParts implements Strategy {
  @Override public StrategyKind kind() {
    return StrategyKind.BY_PARTS;
  }

  @Override public StrategyOutcome attempt(IntegrationRequest request,
      Integrator integrator) {
    final Expr.Sym x = request.variable;
    final Exprs.Split split = Exprs.split(request.integrand, x);
    final Expr core = split.dependent;
    if (choose(core, x) == null) {
      return StrategyOutcome.notApplicable();
    }
    final IntegrationRequest nested =
        request.suppress(StrategyKind.BY_PARTS);
    final int maxSteps = integrator.intValue(Prop.BY_PARTS_MAX_STEPS);

    // integral(core) = sum + sign * integral(r)
    final List<Expr> sum = new ArrayList<>();
    Expr sign = expr.one();
    Expr r = core;
    for (int step = 0; step < maxSteps; step++) {
      final Exprs.Split rSplit = Exprs.split(r, x);
      final @Nullable Parts parts = choose(rSplit.dependent, x);
      if (parts == null) {
        break;
      }
      final Expr v = integrator.integrate(nested.nested(parts.dv));
      if (!Integrator.isClosed(v)) {
        break;
      }
      final Expr du = Differentiator.derivative(parts.u, x);
      sign = Simplifier.simplify(expr.mul(sign, rSplit.coefficient));
      sum.add(expr.mul(sign, parts.u, v));
      sign = Simplifier.simplify(expr.neg(sign));
      r = Simplifier.simplify(expr.mul(v, du));
      if (r.isNum(0)) {
        return found(split.coefficient, sum);
      }
      // If r = k * core, then integral(core) = sum / (1 - sign * k)
      final Expr k = Simplifier.simplify(expr.div(r, core));
      if (Exprs.freeOf(k, x)) {
        final Expr denominator =
            Simplifier.simplify(expr.sub(expr.one(), expr.mul(sign, k)));
        if (denominator.isNum(0)) {
          return StrategyOutcome.notApplicable();
        }
        return StrategyOutcome.found(
            expr.div(expr.mul(split.coefficient, expr.add(sum)),
                denominator));
      }
      if (request.deadline.isExpired()) {
        return StrategyOutcome.timedOut();
      }
    }
    if (sum.isEmpty()) {
      return StrategyOutcome.notApplicable();
    }
    final Expr rest = integrator.integrate(nested.nested(r));
    if (!Integrator.isClosed(rest)) {
      return StrategyOutcome.notApplicable();
    }
    sum.add(expr.mul(sign, rest));
    return found(split.coefficient, sum);
  }

  private static StrategyOutcome found(Expr coefficient, List<Expr> sum) {
    return StrategyOutcome.found(expr.mul(coefficient, expr.add(sum)));
  }

  /**
   * Chooses u and dv for a product of two factors that depend on x;
   * returns null if the product is not suitable.
   */
  static @Nullable Parts choose(Expr e, Expr.Sym x) {
    if (!(e instanceof Expr.Mul) || ((Expr.Mul) e).factors.size() != 2) {
      return null;
    }
    final Expr f0 = ((Expr.Mul) e).factors.get(0);
    final Expr f1 = ((Expr.Mul) e).factors.get(1);
    final Liate c0 = classify(f0, x);
    final Liate c1 = classify(f1, x);
    final Expr u;
    final Expr dv;
    final Liate uClass;
    if (c0.outranks(c1)) {
      u = f0;
      dv = f1;
      uClass = c0;
    } else if (c1.outranks(c0)) {
      u = f1;
      dv = f0;
      uClass = c1;
    } else {
      return null;
    }
    if (uClass == Liate.ALGEBRAIC && Polynomials.coefficients(u, x) == null) {
      return null;
    }
    return new Parts(u, dv);
  }

  /** Returns the LIATE class of a factor. */
  static Liate classify(Expr e, Expr.Sym x) {
    if (e instanceof Expr.Call) {
      final BuiltIn fn = ((Expr.Call) e).fn;
      return fn.liate;
    }
    if (e instanceof Expr.Pow) {
      final Expr.Pow pow = (Expr.Pow) e;
      if (Exprs.freeOf(pow.base, x)) {
        return Liate.EXPONENTIAL;
      }
      if (pow.base instanceof Expr.Call
          && pow.exponent instanceof Expr.Num
          && ((Expr.Num) pow.exponent).value.isInteger()) {
        return classify(pow.base, x);
      }
    }
    return Liate.ALGEBRAIC;
  }

  /** Choice of u and dv. */
  static class Parts {
    final Expr u;
    final Expr dv;

    Parts(Expr u, Expr dv) {
      this.u = requireNonNull(u);
      this.dv = requireNonNull(dv);
    }
  }
}

// End IntegrationByParts.java
