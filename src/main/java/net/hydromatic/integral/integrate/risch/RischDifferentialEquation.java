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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.integral.algebra.Rationals.Q;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.algebra.LinearSystems;
import net.hydromatic.integral.algebra.Poly;
import net.hydromatic.integral.algebra.RationalFunction;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Solves the Risch differential equation {@code y' + f y = g} for y in
 * Q(x).
 *
 * <p>The coefficient f must be the derivative of an element of Q(x),
 * multiplied by an integer, so that it has no simple poles. Then every pole
 * of y is a pole of g, and the denominator of g bounds the denominator of
 * y. Writing y = z / e reduces the problem to a polynomial equation
 * {@code a z' + b z = c}; a bound on the degree of z turns it into a linear
 * system over Q. If the system is inconsistent there is no solution.
 */
public class RischDifferentialEquation {
  /** Solutions of higher degree are not attempted. */
  static final int MAX_DEGREE = 64;

  /** Kind of outcome. */
  public enum Kind {
    SOLVED,
    /** Proven to have no solution in Q(x). */
    NO_SOLUTION,
    /** The degree bound was too large to attempt. */
    UNKNOWN
  }

  public final Kind kind;
  private final @Nullable TowerElement solution;

  private RischDifferentialEquation(Kind kind,
      @Nullable TowerElement solution) {
    this.kind = requireNonNull(kind);
    this.solution = solution;
  }

  /** Returns the solution y. */
  public TowerElement solution() {
    return requireNonNull(solution, "no solution");
  }

  /**
   * Solves {@code y' + f y = g}, where f and g are elements of level 0 or
   * below.
   */
  public static RischDifferentialEquation solve(TowerElement f,
      TowerElement g) {
    final RationalFunction<BigRational> fq = toRational(f);
    final RationalFunction<BigRational> gq = toRational(g);
    if (gq.isZero()) {
      return solved(TowerField.INSTANCE.zero());
    }
    // y = z / e: z' + (f - e'/e) z = g e
    final Poly<BigRational> e = gq.denominator;
    final RationalFunction<BigRational> h =
        fq.subtract(RationalFunction.of(e.derivative(), e));
    final RationalFunction<BigRational> rhs =
        gq.multiply(RationalFunction.of(e));
    final Poly<BigRational> l = lcm(h.denominator, rhs.denominator);
    final Poly<BigRational> a = l;
    final Poly<BigRational> b =
        h.numerator.multiply(l.quotient(h.denominator));
    final Poly<BigRational> c =
        rhs.numerator.multiply(l.quotient(rhs.denominator));
    final int n = degreeBound(a, b, c);
    if (n < 0) {
      return new RischDifferentialEquation(Kind.NO_SOLUTION, null);
    }
    if (n > MAX_DEGREE) {
      return new RischDifferentialEquation(Kind.UNKNOWN, null);
    }
    // Coefficient of x^i in a z' + b z, for z = sum z_j x^j
    final int rows =
        Math.max(Math.max(a.degree() + n, b.degree() + n), c.degree()) + 1;
    final List<List<BigRational>> matrix = new ArrayList<>();
    final List<BigRational> rhsColumn = new ArrayList<>();
    for (int i = 0; i < rows; i++) {
      final List<BigRational> row = new ArrayList<>();
      for (int j = 0; j <= n; j++) {
        BigRational v = i - j >= 0 ? b.coefficient(i - j) : BigRational.ZERO;
        if (j > 0 && i - j + 1 >= 0) {
          v = v.add(a.coefficient(i - j + 1).multiply(j));
        }
        row.add(v);
      }
      matrix.add(row);
      rhsColumn.add(c.coefficient(i));
    }
    final @Nullable List<BigRational> z =
        LinearSystems.solve(Q, matrix, rhsColumn, n + 1);
    if (z == null) {
      return new RischDifferentialEquation(Kind.NO_SOLUTION, null);
    }
    return solved(
        toElement(RationalFunction.of(Poly.of(Q, z), e)));
  }

  private static RischDifferentialEquation solved(TowerElement y) {
    return new RischDifferentialEquation(Kind.SOLVED, y);
  }

  /**
   * Returns an upper bound on the degree of a polynomial z satisfying
   * {@code a z' + b z = c}, or -1 if there is none.
   */
  static int degreeBound(Poly<BigRational> a, Poly<BigRational> b,
      Poly<BigRational> c) {
    final int da = a.degree();
    final int db = b.degree();
    final int dc = c.degree();
    if (db < 0) {
      // a z' = c
      return dc - da + 1;
    }
    if (db > da - 1) {
      return dc - db;
    }
    if (db < da - 1) {
      return dc - da + 1;
    }
    // The leading terms cancel if deg z = -lc(b) / lc(a)
    int bound = dc - db;
    final BigRational n =
        b.leadingCoefficient().divide(a.leadingCoefficient()).negate();
    if (n.isSmallInteger() && n.signum() > 0) {
      bound = Math.max(bound, n.intValueExact());
    }
    return bound;
  }

  private static Poly<BigRational> lcm(Poly<BigRational> a,
      Poly<BigRational> b) {
    return a.multiply(b).quotient(Poly.gcd(a, b)).monic();
  }

  /** Converts an element of level 0 or below to a rational function. */
  static RationalFunction<BigRational> toRational(TowerElement e) {
    if (e.isConstant()) {
      return RationalFunction.of(Poly.constant(Q, e.constant()));
    }
    if (e.level != 0) {
      throw new IllegalArgumentException("not in Q(x): " + e);
    }
    final RationalFunction<TowerElement> rf = e.rf();
    return RationalFunction.of(rf.numerator.map(Q, TowerElement::constant),
        rf.denominator.map(Q, TowerElement::constant));
  }

  /** Converts a rational function in x to an element of level 0. */
  static TowerElement toElement(RationalFunction<BigRational> rf) {
    final TowerField f = TowerField.INSTANCE;
    return TowerElement.of(0,
        RationalFunction.of(rf.numerator.map(f, f::fromRational),
            rf.denominator.map(f, f::fromRational)));
  }
}

// End RischDifferentialEquation.java
