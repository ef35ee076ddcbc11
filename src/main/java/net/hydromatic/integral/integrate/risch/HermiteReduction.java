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

import java.util.List;
import net.hydromatic.integral.algebra.Poly;
import net.hydromatic.integral.algebra.RationalFunction;
import net.hydromatic.integral.util.BigRational;

/**
 * Hermite reduction in a monomial extension.
 *
 * <p>Given A / D with D normal, finds g and a simple remainder h such that
 * {@code A / D = g' + h + q}, where the denominator of h is squarefree and
 * q is a polynomial.
 */
public class HermiteReduction {
  /** Part that has been integrated. */
  public final TowerElement reduced;
  /** Polynomial part of the remainder. */
  public final Poly<TowerElement> polynomial;
  /** Numerator of the simple part; its degree is less than that of
   * {@link #denominator}. */
  public final Poly<TowerElement> numerator;
  /** Squarefree monic denominator of the simple part. */
  public final Poly<TowerElement> denominator;

  private HermiteReduction(TowerElement reduced,
      Poly<TowerElement> polynomial, Poly<TowerElement> numerator,
      Poly<TowerElement> denominator) {
    this.reduced = requireNonNull(reduced);
    this.polynomial = requireNonNull(polynomial);
    this.numerator = requireNonNull(numerator);
    this.denominator = requireNonNull(denominator);
  }

  /**
   * Reduces {@code a / d}, a fraction in the generator of level {@code k}.
   *
   * @param d Normal monic denominator
   */
  public static HermiteReduction reduce(ExtensionTower tower, int k,
      Poly<TowerElement> a, Poly<TowerElement> d) {
    final TowerField f = TowerField.INSTANCE;
    TowerElement g = f.zero();
    for (;;) {
      final List<Poly<TowerElement>> factors = d.squarefree();
      final int m = factors.size();
      if (m <= 1) {
        break;
      }
      // d = u v^m, with v the factors of highest multiplicity.
      // Solve b u v' + c v = a / (1 - m); then
      // a / (u v^m) = (b / v^(m-1))' + ((1 - m) c - u b') / (u v^(m-1))
      final Poly<TowerElement> v = factors.get(m - 1);
      final Poly<TowerElement> u = d.quotient(v.pow(m));
      final TowerElement oneMinusM = f.fromRational(BigRational.of(1 - m));
      final Poly.ExtendedGcd<TowerElement> bc =
          Poly.diophantine(u.multiply(tower.derivative(v, k)), v,
              a.scale(f.inverse(oneMinusM)));
      final Poly<TowerElement> b = bc.s;
      final Poly<TowerElement> c = bc.t;
      g = f.add(g,
          TowerElement.of(k, RationalFunction.of(b, v.pow(m - 1))));
      a = c.scale(oneMinusM).subtract(u.multiply(tower.derivative(b, k)));
      d = u.multiply(v.pow(m - 1));
    }
    final RationalFunction<TowerElement> h = RationalFunction.of(a, d);
    final Poly.DivisionResult<TowerElement> qr =
        h.numerator.divide(h.denominator);
    return new HermiteReduction(g, qr.quotient, qr.remainder,
        h.denominator);
  }
}

// End HermiteReduction.java
