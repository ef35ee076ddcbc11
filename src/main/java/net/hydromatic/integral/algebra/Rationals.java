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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/** The field of rational numbers, and utilities for polynomials over it. */
public enum Rationals implements Field<BigRational> {
  /** The singleton instance. */
  // CHECKSTYLE: IGNORE 1
  Q;

  /**
   * Integers whose absolute value exceeds this limit are not factored when
   * searching for rational roots.
   */
  private static final BigInteger FACTOR_LIMIT = BigInteger.TEN.pow(12);

  @Override
  public BigRational zero() {
    return BigRational.ZERO;
  }

  @Override
  public BigRational one() {
    return BigRational.ONE;
  }

  @Override
  public BigRational fromRational(BigRational r) {
    return r;
  }

  @Override
  public BigRational add(BigRational a, BigRational b) {
    return a.add(b);
  }

  @Override
  public BigRational negate(BigRational a) {
    return a.negate();
  }

  @Override
  public BigRational multiply(BigRational a, BigRational b) {
    return a.multiply(b);
  }

  @Override
  public BigRational divide(BigRational a, BigRational b) {
    return a.divide(b);
  }

  @Override
  public boolean isZero(BigRational a) {
    return a.isZero();
  }

  @Override
  public BigRational toRational(BigRational a) {
    return a;
  }

  /** Creates a polynomial with rational coefficients, lowest degree first. */
  public static Poly<BigRational> poly(long... coefficients) {
    final List<BigRational> list = new ArrayList<>();
    for (long c : coefficients) {
      list.add(BigRational.of(c));
    }
    return Poly.of(Q, list);
  }

  /**
   * Returns the integer polynomial that is a rational multiple of a given
   * polynomial, with coprime coefficients.
   */
  public static List<BigInteger> primitive(Poly<BigRational> p) {
    BigInteger lcm = BigInteger.ONE;
    for (BigRational c : p.coefficients()) {
      lcm = lcm.divide(lcm.gcd(c.denominator)).multiply(c.denominator);
    }
    final List<BigInteger> list = new ArrayList<>();
    BigInteger gcd = BigInteger.ZERO;
    for (BigRational c : p.coefficients()) {
      final BigInteger n = c.numerator.multiply(lcm.divide(c.denominator));
      list.add(n);
      gcd = gcd.gcd(n);
    }
    if (gcd.signum() != 0 && !gcd.equals(BigInteger.ONE)) {
      for (int i = 0; i < list.size(); i++) {
        list.set(i, list.get(i).divide(gcd));
      }
    }
    return list;
  }

  /**
   * Returns the distinct rational roots of a polynomial, in ascending order.
   *
   * <p>Uses the rational root theorem. If a coefficient is too large to
   * factor, the search may miss roots; callers must treat the absence of a
   * root as "unknown", not as a proof.
   */
  public static List<BigRational> rationalRoots(Poly<BigRational> p) {
    final TreeSet<BigRational> roots = new TreeSet<>();
    if (p.degree() <= 0) {
      return ImmutableList.of();
    }
    final int low = p.lowestDegree();
    if (low > 0) {
      roots.add(BigRational.ZERO);
      p = p.divide(Poly.monomial(Q, BigRational.ONE, low)).quotient;
    }
    while (p.degree() > 0) {
      final @Nullable BigRational root = findRoot(p);
      if (root == null) {
        break;
      }
      roots.add(root);
      final Poly<BigRational> linear =
          Poly.of(Q, root.negate(), BigRational.ONE);
      while (p.degree() > 0 && p.isDivisibleBy(linear)) {
        p = p.quotient(linear);
      }
    }
    return ImmutableList.copyOf(roots);
  }

  private static @Nullable BigRational findRoot(Poly<BigRational> p) {
    final List<BigInteger> c = primitive(p);
    final BigInteger a0 = c.get(0).abs();
    final BigInteger an = c.get(c.size() - 1).abs();
    if (p.degree() == 1) {
      return p.coefficient(0).negate().divide(p.coefficient(1));
    }
    if (a0.compareTo(FACTOR_LIMIT) > 0 || an.compareTo(FACTOR_LIMIT) > 0) {
      return null;
    }
    for (BigInteger q : divisors(an)) {
      for (BigInteger n : divisors(a0)) {
        for (int sign = 1; sign >= -1; sign -= 2) {
          final BigRational r =
              BigRational.of(sign > 0 ? n : n.negate(), q);
          if (p.evaluate(r).isZero()) {
            return r;
          }
        }
      }
    }
    return null;
  }

  /** Returns the positive divisors of a positive integer, ascending. */
  static List<BigInteger> divisors(BigInteger n) {
    final TreeSet<BigInteger> set = new TreeSet<>();
    if (n.signum() == 0) {
      return ImmutableList.of();
    }
    final long v = n.longValueExact();
    for (long d = 1; d * d <= v; d++) {
      if (v % d == 0) {
        set.add(BigInteger.valueOf(d));
        set.add(BigInteger.valueOf(v / d));
      }
    }
    return ImmutableList.copyOf(set);
  }

  /**
   * Returns the square root of a rational, if it is the square of a
   * rational; otherwise null.
   */
  public static @Nullable BigRational sqrt(BigRational r) {
    return r.root(2);
  }
}

// End Rationals.java
