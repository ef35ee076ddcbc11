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
package net.hydromatic.integral.algebra;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.integral.algebra.Rationals.Q;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factors polynomials over the rationals.
 *
 * <p>Finds linear factors (rational roots) and quadratic factors; quartics
 * of the form "t^4 + p t^2 + q" are split into quadratics where possible.
 * Anything left is reported as a factor of kind {@link Kind#OTHER}.
 */
public class Factorizer {
  private Factorizer() {}

  /** Factors a non-zero polynomial. */
  public static Factorization factor(Poly<BigRational> p) {
    if (p.isZero()) {
      throw new ArithmeticException("cannot factor zero");
    }
    final BigRational unit = p.leadingCoefficient();
    final List<Poly<BigRational>> squarefree = p.squarefree();
    final ImmutableList.Builder<Factor> factors = ImmutableList.builder();
    for (int i = 0; i < squarefree.size(); i++) {
      final int multiplicity = i + 1;
      for (Poly<BigRational> q : splitSquarefree(squarefree.get(i))) {
        factors.add(new Factor(q, multiplicity));
      }
    }
    return new Factorization(unit, factors.build());
  }

  /** Splits a monic squarefree polynomial into monic factors. */
  static List<Poly<BigRational>> splitSquarefree(Poly<BigRational> p) {
    final List<Poly<BigRational>> list = new ArrayList<>();
    if (p.degree() <= 0) {
      return list;
    }
    for (BigRational root : Rationals.rationalRoots(p)) {
      final Poly<BigRational> linear =
          Poly.of(Q, root.negate(), BigRational.ONE);
      list.add(linear);
      p = p.quotient(linear);
    }
    if (p.degree() == 4) {
      final @Nullable List<Poly<BigRational>> quadratics = splitQuartic(p);
      if (quadratics != null) {
        list.addAll(quadratics);
        return list;
      }
    }
    if (p.degree() > 0) {
      list.add(p.monic());
    }
    return list;
  }

  /**
   * Splits a monic quartic without rational roots into two quadratics, if
   * it has the form "t^4 + p t^2 + q" and such a split exists over Q.
   */
  private static @Nullable List<Poly<BigRational>> splitQuartic(
      Poly<BigRational> f) {
    if (!f.coefficient(1).isZero() || !f.coefficient(3).isZero()) {
      return null;
    }
    final BigRational p = f.coefficient(2);
    final BigRational q = f.coefficient(0);
    // As a quadratic in y = t^2: y^2 + p y + q
    final BigRational disc = p.multiply(p).subtract(q.multiply(4));
    final @Nullable BigRational root = Rationals.sqrt(disc);
    if (root != null) {
      final BigRational y1 = p.negate().add(root).divide(2);
      final BigRational y2 = p.negate().subtract(root).divide(2);
      return ImmutableList.of(
          Poly.of(Q, y1.negate(), BigRational.ZERO, BigRational.ONE),
          Poly.of(Q, y2.negate(), BigRational.ZERO, BigRational.ONE));
    }
    // t^4 + p t^2 + s^2 = (t^2 + s)^2 - (2s - p) t^2
    //   = (t^2 - m t + s) (t^2 + m t + s) if 2s - p = m^2
    final @Nullable BigRational s0 = Rationals.sqrt(q);
    if (s0 == null) {
      return null;
    }
    for (BigRational s : ImmutableList.of(s0, s0.negate())) {
      final @Nullable BigRational m =
          Rationals.sqrt(s.multiply(2).subtract(p));
      if (m != null && !m.isZero()) {
        return ImmutableList.of(
            Poly.of(Q, s, m.negate(), BigRational.ONE),
            Poly.of(Q, s, m, BigRational.ONE));
      }
    }
    return null;
  }

  /** Kind of factor. */
  public enum Kind {
    /** Monic polynomial of degree 1, "t - r". */
    LINEAR,
    /** Monic polynomial of degree 2 with no rational roots. */
    QUADRATIC,
    /** Polynomial of degree 3 or more that was not split. */
    OTHER
  }

  /** Irreducible (or unsplit) factor and its multiplicity. */
  public static class Factor {
    public final Poly<BigRational> poly;
    public final int multiplicity;
    public final Kind kind;

    Factor(Poly<BigRational> poly, int multiplicity) {
      this.poly = requireNonNull(poly);
      this.multiplicity = multiplicity;
      this.kind =
          poly.degree() == 1
              ? Kind.LINEAR
              : poly.degree() == 2 ? Kind.QUADRATIC : Kind.OTHER;
    }

    @Override
    public String toString() {
      return "(" + poly + ")^" + multiplicity;
    }
  }

  /** Result of factoring: a unit times a product of factors. */
  public static class Factorization {
    public final BigRational unit;
    public final ImmutableList<Factor> factors;

    Factorization(BigRational unit, ImmutableList<Factor> factors) {
      this.unit = requireNonNull(unit);
      this.factors = requireNonNull(factors);
    }

    /** Returns whether every factor is linear or quadratic. */
    public boolean isComplete() {
      for (Factor factor : factors) {
        if (factor.kind == Kind.OTHER) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder().append(unit);
      for (Factor factor : factors) {
        b.append(" * ").append(factor);
      }
      return b.toString();
    }
  }
}

// End Factorizer.java
