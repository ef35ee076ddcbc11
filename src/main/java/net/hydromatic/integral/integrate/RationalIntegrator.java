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
import net.hydromatic.integral.algebra.Polynomials;
import net.hydromatic.integral.algebra.Poly;
import net.hydromatic.integral.algebra.RationalFunction;
import net.hydromatic.integral.algebra.Rationals;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.function.BuiltIn;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Strategy that integrates rational functions with rational coefficients.
 *
 * <p>Divides out the polynomial part, factors the denominator into linear
 * and quadratic factors, decomposes into partial fractions, and integrates
 * each term. Linear terms give logarithms and negative powers; quadratic
 * terms give logarithms and arctangents, using a reduction formula for
 * higher powers. If the denominator has an irreducible factor of degree 3
 * or more, the strategy is not applicable.
 */
public class RationalIntegrator implements Strategy {
  @Override public StrategyKind kind() {
    return StrategyKind.RATIONAL;
  }

  @Override public StrategyOutcome attempt(IntegrationRequest request,
      Integrator integrator) {
    final @Nullable Expr e = integrate(request.integrand, request.variable);
    return e == null
        ? StrategyOutcome.notApplicable()
        : StrategyOutcome.found(e);
  }

  /**
   * Integrates a rational function of {@code x}; returns null if the
   * integrand is not one or its denominator cannot be factored.
   */
  public static @Nullable Expr integrate(Expr f, Expr.Sym x) {
    final @Nullable RationalFunction<BigRational> rf =
        Polynomials.toRationalFunction(f, x);
    if (rf == null) {
      return null;
    }
    final @Nullable PartialFractionDecomposition pfd =
        PartialFractionDecomposition.decompose(rf);
    if (pfd == null) {
      return null;
    }
    final List<Expr> terms = new ArrayList<>();
    terms.add(integratePoly(pfd.polynomial, x));
    for (PartialFractionDecomposition.LinearTerm term : pfd.linearTerms) {
      terms.add(integrateLinear(term, x));
    }
    for (PartialFractionDecomposition.QuadraticTerm term
        : pfd.quadraticTerms) {
      terms.add(integrateQuadratic(term, x));
    }
    return expr.add(terms);
  }

  /** Integrates a polynomial term by term. */
  static Expr integratePoly(Poly<BigRational> p, Expr.Sym x) {
    final List<BigRational> coefficients = new ArrayList<>();
    coefficients.add(BigRational.ZERO);
    for (int i = 0; i <= p.degree(); i++) {
      coefficients.add(p.coefficient(i).divide(i + 1));
    }
    return Polynomials.fromPoly(Poly.of(Rationals.Q, coefficients), x);
  }

  /**
   * Integrates {@code A / (x - r) ^ j}: {@code A ln|x - r|} if j = 1,
   * otherwise {@code A (x - r) ^ (1 - j) / (1 - j)}.
   */
  private static Expr integrateLinear(
      PartialFractionDecomposition.LinearTerm term, Expr.Sym x) {
    final Expr t = expr.sub(x, expr.num(term.root));
    final Expr a = expr.num(term.coefficient);
    if (term.multiplicity == 1) {
      return expr.mul(a, expr.lnAbs(t));
    }
    final int m = 1 - term.multiplicity;
    return expr.mul(a, expr.num(BigRational.ONE.divide(m)), expr.pow(t, m));
  }

  /**
   * Integrates {@code (B x + C) / g ^ j} where g = x ^ 2 + p x + q is
   * irreducible.
   *
   * <p>With s = x + p/2 and k = q - p^2/4, g = s ^ 2 + k and
   * B x + C = B s + D, where D = C - B p / 2. The B s term integrates to a
   * logarithm or power of g; the D term to {@link #reduce}.
   */
  private static Expr integrateQuadratic(
      PartialFractionDecomposition.QuadraticTerm term, Expr.Sym x) {
    final BigRational p = term.quadratic.coefficient(1);
    final BigRational q = term.quadratic.coefficient(0);
    final BigRational b = term.numerator.coefficient(1);
    final BigRational c = term.numerator.coefficient(0);
    final BigRational halfP = p.divide(2);
    final BigRational k = q.subtract(halfP.multiply(halfP));
    final BigRational d = c.subtract(b.multiply(halfP));
    final int j = term.multiplicity;
    final Expr s = expr.add(x, expr.num(halfP));
    final Expr g = Polynomials.fromPoly(term.quadratic, x);
    final List<Expr> terms = new ArrayList<>();
    if (!b.isZero()) {
      if (j == 1) {
        terms.add(expr.mul(expr.num(b.divide(2)), expr.lnAbs(g)));
      } else {
        terms.add(
            expr.mul(expr.num(b.divide(2).divide(1 - j)),
                expr.pow(g, 1 - j)));
      }
    }
    if (!d.isZero()) {
      terms.add(expr.mul(expr.num(d), reduce(s, k, j)));
    }
    return expr.add(terms);
  }

  /**
   * Returns the integral of {@code 1 / (s ^ 2 + k) ^ j} with respect to s,
   * where k is non-zero.
   *
   * <p>Uses the reduction formula
   * {@code I(j) = s / (2 k (j - 1) (s ^ 2 + k) ^ (j - 1))
   * + (2 j - 3) / (2 k (j - 1)) I(j - 1)}.
   */
  static Expr reduce(Expr s, BigRational k, int j) {
    if (j == 1) {
      if (k.signum() > 0) {
        // arctan(s / sqrt(k)) / sqrt(k)
        final Expr root = expr.sqrt(expr.num(k));
        return expr.div(expr.call(BuiltIn.ARCTAN, expr.div(s, root)), root);
      }
      // (ln|s - r| - ln|s + r|) / (2 r), r = sqrt(-k)
      final Expr r = expr.sqrt(expr.num(k.negate()));
      return expr.div(
          expr.sub(expr.lnAbs(expr.sub(s, r)), expr.lnAbs(expr.add(s, r))),
          expr.mul(expr.num(2), r));
    }
    final BigRational denominator = k.multiply(2).multiply(j - 1);
    final Expr sk = expr.add(expr.pow(s, 2), expr.num(k));
    return expr.add(
        expr.mul(expr.num(denominator.reciprocal()), s,
            expr.pow(sk, 1 - j)),
        expr.mul(expr.num(BigRational.of(2L * j - 3).divide(denominator)),
            reduce(s, k, j - 1)));
  }
}

// End RationalIntegrator.java
