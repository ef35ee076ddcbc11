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
package net.hydromatic.integral.integrate.risch;

import static net.hydromatic.integral.algebra.Rationals.Q;
import static net.hydromatic.integral.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.algebra.Exprs;
import net.hydromatic.integral.algebra.Poly;
import net.hydromatic.integral.algebra.Polynomials;
import net.hydromatic.integral.algebra.RationalFunction;
import net.hydromatic.integral.algebra.Replacer;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.integrate.IntegrationRequest;
import net.hydromatic.integral.integrate.Integrator;
import net.hydromatic.integral.integrate.Prop;
import net.hydromatic.integral.integrate.RationalIntegrator;
import net.hydromatic.integral.integrate.Strategy;
import net.hydromatic.integral.integrate.StrategyKind;
import net.hydromatic.integral.integrate.StrategyOutcome;
import net.hydromatic.integral.util.BigRational;
import net.hydromatic.integral.util.Deadline;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Strategy that applies the Risch decision procedure to integrands built
 * from x, rational operations, exponentials and logarithms.
 *
 * <p>The integrand is converted to an element of an {@link ExtensionTower}
 * and integrated level by level, starting at the top. At each level the
 * integrand is split into a polynomial part and a normal part; the normal
 * part goes through {@link HermiteReduction} and {@link ResidueReduction};
 * the polynomial part is integrated by the power rule (at x), by solving a
 * {@link RischDifferentialEquation} for each power of an exponential, or by
 * the recurrence for polynomials in a logarithm.
 *
 * <p>The result is found, proven non-elementary, or undecided; the
 * procedure never claims non-elementarity unless a necessary condition for
 * an elementary integral has failed.
 */
public class RischIntegrator implements Strategy {
  @Override public StrategyKind kind() {
    return StrategyKind.RISCH;
  }

  @Override public StrategyOutcome attempt(IntegrationRequest request,
      Integrator integrator) {
    final Expr.Sym x = request.variable;
    final Deadline deadline =
        request.deadline.min(
            Deadline.ofMillis(
                integrator.intValue(Prop.RISCH_TIME_BUDGET_MILLIS)));
    final TowerBuilder builder =
        new TowerBuilder(x, integrator.intValue(Prop.RISCH_MAX_LEVELS),
            deadline);
    final TowerElement element;
    try {
      builder.prepare(request.integrand);
      element = builder.convert(request.integrand);
    } catch (TowerBuilder.UnsupportedExtensionException e) {
      return StrategyOutcome.unsupported(e.getMessage());
    } catch (TowerBuilder.TimeoutException e) {
      return StrategyOutcome.timedOut();
    }
    final ExtensionTower tower = builder.tower();
    final RischResult result = new Session(tower, deadline).integrate(element);
    switch (result.kind) {
      case ELEMENTARY:
        return StrategyOutcome.found(result.toExpr(tower));
      case NON_ELEMENTARY:
        return StrategyOutcome.provenNonElementary(
            expr.integral(request.integrand, x));
      case TIMED_OUT:
        return StrategyOutcome.timedOut();
      default:
        return StrategyOutcome.notApplicable();
    }
  }

  /** Integrates the elements of one tower. */
  static class Session {
    final ExtensionTower tower;
    final Deadline deadline;
    final TowerField f = TowerField.INSTANCE;

    Session(ExtensionTower tower, Deadline deadline) {
      this.tower = tower;
      this.deadline = deadline;
    }

    /** Integrates an element with respect to x. */
    RischResult integrate(TowerElement e) {
      if (deadline.isExpired()) {
        return RischResult.timedOut();
      }
      if (e.isConstant()) {
        return RischResult.elementary(f.multiply(e, tower.generator(0)));
      }
      final int k = e.level;
      final TowerLevel level = tower.level(k);
      final RationalFunction<TowerElement> rf = e.rf();
      final Poly.DivisionResult<TowerElement> qr =
          rf.numerator.divide(rf.denominator);

      // Split into a polynomial part (a Laurent polynomial if the level is
      // exponential, since t divides no normal polynomial) and a normal part
      TowerElement polynomial = TowerElement.of(k, qr.quotient);
      Poly<TowerElement> normalNumerator = qr.remainder;
      Poly<TowerElement> normalDenominator = rf.denominator;
      final int m = rf.denominator.lowestDegree();
      if (level.kind == TowerLevel.Kind.EXPONENTIAL && m > 0) {
        final Poly<TowerElement> tm = Poly.monomial(f, f.one(), m);
        normalDenominator = rf.denominator.quotient(tm);
        if (normalDenominator.degree() == 0) {
          polynomial = e;
          normalNumerator = Poly.zero(f);
        } else {
          // s dn + u t^m = r, deg s < m: r / (t^m dn) = s / t^m + u / dn
          final Poly.ExtendedGcd<TowerElement> su =
              Poly.diophantine(normalDenominator, tm, qr.remainder);
          polynomial = f.add(polynomial,
              TowerElement.of(k, RationalFunction.of(su.s, tm)));
          normalNumerator = su.t;
        }
      }

      RischResult result = RischResult.elementary(f.zero());
      if (!normalNumerator.isZero()) {
        final HermiteReduction hermite =
            HermiteReduction.reduce(tower, k, normalNumerator,
                normalDenominator);
        result = result.plus(RischResult.elementary(hermite.reduced));
        polynomial = f.add(polynomial, TowerElement.of(k, hermite.polynomial));
        if (!hermite.numerator.isZero()) {
          final RischResult simple =
              integrateSimple(k, hermite.numerator, hermite.denominator);
          if (simple.kind == RischResult.Kind.NON_ELEMENTARY) {
            return simple;
          }
          result = result.plus(simple);
          if (simple.isElementary() && !simple.hasExtra()) {
            // What the log terms do not account for is polynomial
            TowerElement remainder =
                TowerElement.of(k,
                    RationalFunction.of(hermite.numerator,
                        hermite.denominator));
            for (RischResult.LogTerm log : simple.logs) {
              final TowerElement logDerivative =
                  f.divide(tower.derivative(log.argument), log.argument);
              remainder =
                  f.subtract(remainder,
                      f.multiply(f.fromRational(log.coefficient),
                          logDerivative));
            }
            polynomial = f.add(polynomial, remainder);
          }
        }
      }
      return result.plus(integratePolynomial(k, polynomial));
    }

    /** Integrates a simple fraction {@code a / d} in the generator of
     * level {@code k}; returns the log terms, or an extra expression at
     * level 0 if some residues are irrational. */
    private RischResult integrateSimple(int k, Poly<TowerElement> a,
        Poly<TowerElement> d) {
      final ResidueReduction residues =
          ResidueReduction.reduce(tower, k, a, d);
      switch (residues.kind) {
        case NON_CONSTANT:
          return RischResult.nonElementary();
        case RATIONAL:
          return RischResult.elementary(f.zero(), residues.logs, expr.zero());
        case IRRATIONAL:
          final @Nullable Expr integral = integrateRationally(k, a, d);
          if (integral != null) {
            return RischResult.elementary(f.zero(), ImmutableList.of(),
                integral);
          }
          return RischResult.undecided();
        default:
          return RischResult.undecided();
      }
    }

    /**
     * Integrates {@code a / d} by partial fractions, or returns null.
     *
     * <p>At level 0 the fraction is a rational function of x. At an
     * exponential level t = exp(g) with g' = c rational, and with rational
     * coefficients, the substitution u = t, du = c u dx gives the rational
     * function {@code a(u) / (c u d(u))}.
     */
    private @Nullable Expr integrateRationally(int k, Poly<TowerElement> a,
        Poly<TowerElement> d) {
      if (k == 0) {
        final Expr h =
            tower.toExpr(TowerElement.of(0, RationalFunction.of(a, d)));
        return RationalIntegrator.integrate(h, tower.variable);
      }
      final TowerLevel level = tower.level(k);
      if (level.kind != TowerLevel.Kind.EXPONENTIAL
          || !level.eta.isConstant()
          || !isRational(a)
          || !isRational(d)) {
        return null;
      }
      final Expr.Sym u = Exprs.freshSymbol(level.generator, "u");
      final Poly<BigRational> numerator = a.map(Q, TowerElement::constant);
      final Poly<BigRational> denominator =
          d.map(Q, TowerElement::constant)
              .multiply(Poly.monomial(Q, level.eta.constant(), 1));
      final Expr h =
          Polynomials.fromRationalFunction(
              RationalFunction.of(numerator, denominator), u);
      final @Nullable Expr integral = RationalIntegrator.integrate(h, u);
      return integral == null
          ? null
          : Replacer.substitute(integral, u, level.generator);
    }

    /** Returns whether every coefficient of a polynomial is rational. */
    private static boolean isRational(Poly<TowerElement> p) {
      for (TowerElement c : p.coefficients()) {
        if (!c.isConstant()) {
          return false;
        }
      }
      return true;
    }

    /** Integrates the polynomial part at level {@code k}. The element may
     * belong to a lower level. */
    private RischResult integratePolynomial(int k, TowerElement p) {
      if (p.isZero()) {
        return RischResult.elementary(f.zero());
      }
      if (p.level < k) {
        return integrate(p);
      }
      final RationalFunction<TowerElement> rf = p.rf();
      final TowerLevel level = tower.level(k);
      switch (level.kind) {
        case VARIABLE:
          if (!rf.isPolynomial()) {
            return RischResult.undecided();
          }
          return RischResult.elementary(powerRule(rf.numerator));
        case EXPONENTIAL:
          return integrateExponentialPolynomial(level, rf);
        case LOGARITHMIC:
          if (!rf.isPolynomial()) {
            return RischResult.undecided();
          }
          return integrateLogarithmicPolynomial(level, p);
        default:
          throw new AssertionError(level.kind);
      }
    }

    /** Integrates a polynomial in x with rational coefficients. */
    private TowerElement powerRule(Poly<TowerElement> p) {
      final List<TowerElement> list = new ArrayList<>();
      list.add(f.zero());
      for (int i = 0; i <= p.degree(); i++) {
        list.add(
            f.divide(p.coefficient(i), f.fromRational(BigRational.of(i + 1))));
      }
      return TowerElement.of(0, Poly.of(f, list));
    }

    /**
     * Integrates {@code sum a_j t^j}, where t = exp(g) and j may be
     * negative. The term j = 0 is integrated one level down; each other
     * term needs y_j with {@code y_j' + j g' y_j = a_j}, and then
     * contributes {@code y_j t^j}.
     */
    private RischResult integrateExponentialPolynomial(TowerLevel level,
        RationalFunction<TowerElement> rf) {
      final int k = level.index;
      final int m = rf.denominator.degree();
      if (!rf.denominator.equals(Poly.monomial(f, f.one(), m))) {
        return RischResult.undecided();
      }
      RischResult result = RischResult.elementary(f.zero());
      for (int i = 0; i <= rf.numerator.degree(); i++) {
        final TowerElement a = rf.numerator.coefficient(i);
        final int j = i - m;
        if (a.isZero()) {
          continue;
        }
        if (j == 0) {
          result = result.plus(integrate(a));
          continue;
        }
        if (a.level > 0 || level.eta.level > 0) {
          result = result.plus(RischResult.undecided());
          continue;
        }
        if (deadline.isExpired()) {
          return RischResult.timedOut();
        }
        final TowerElement fj =
            f.multiply(f.fromRational(BigRational.of(j)), level.eta);
        final RischDifferentialEquation rde =
            RischDifferentialEquation.solve(fj, a);
        switch (rde.kind) {
          case SOLVED:
            final TowerElement term =
                f.multiply(rde.solution(), f.power(tower.generator(k), j));
            result = result.plus(RischResult.elementary(term));
            break;
          case NO_SOLUTION:
            // Over Q(x) the equation decides the question; higher up a
            // solution might involve the intermediate generators
            if (k == 1) {
              return RischResult.nonElementary();
            }
            result = result.plus(RischResult.undecided());
            break;
          default:
            result = result.plus(RischResult.undecided());
            break;
        }
      }
      return result;
    }

    /**
     * Integrates a polynomial in t = ln(u). Working down from the leading
     * term {@code a t^n}, finds b and a constant c with
     * {@code a = b' + c u'/u}, subtracts the derivative of
     * {@code c t^(n+1) / (n+1) + b t^n}, and repeats; the remaining term,
     * free of t, is integrated one level down.
     */
    private RischResult integrateLogarithmicPolynomial(TowerLevel level,
        TowerElement p) {
      final int k = level.index;
      final TowerElement t = tower.generator(k);
      TowerElement integrated = f.zero();
      TowerElement current = p;
      while (current.level == k) {
        if (deadline.isExpired()) {
          return RischResult.timedOut();
        }
        final Poly<TowerElement> poly = current.rf().numerator;
        final int n = poly.degree();
        final TowerElement a = poly.leadingCoefficient();
        final RischResult r = integrate(a);
        if (!r.isElementary()) {
          return r;
        }
        final @Nullable BigRational c = logCoefficient(r, level);
        if (c == null) {
          return RischResult.undecided();
        }
        final TowerElement q =
            f.add(
                f.multiply(
                    f.fromRational(c.divide(n + 1)), f.power(t, n + 1)),
                f.multiply(r.rational, f.power(t, n)));
        integrated = f.add(integrated, q);
        current = f.subtract(current, tower.derivative(q));
      }
      return RischResult.elementary(integrated).plus(integrate(current));
    }

    /**
     * If every log term of an integral is a constant multiple of the
     * logarithm that generates a level, and there is no extra part, returns
     * the total coefficient; otherwise null.
     */
    private @Nullable BigRational logCoefficient(RischResult r,
        TowerLevel level) {
      if (r.hasExtra()) {
        return null;
      }
      BigRational c = BigRational.ZERO;
      for (RischResult.LogTerm log : r.logs) {
        if (!f.divide(log.argument, level.argument).isConstant()) {
          return null;
        }
        c = c.add(log.coefficient);
      }
      return c;
    }
  }
}

// End RischIntegrator.java
