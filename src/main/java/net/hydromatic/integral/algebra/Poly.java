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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.integral.util.BigRational;

/**
 * Dense univariate polynomial with coefficients in a field.
 *
 * <p>Coefficients are stored lowest degree first, without trailing zeros, so
 * that two equal polynomials have equal representations. The zero
 * polynomial has no coefficients and degree -1.
 *
 * @param <E> Coefficient type
 */
public final class Poly<E> {
  public final Field<E> field;
  private final ImmutableList<E> coefficients;

  private Poly(Field<E> field, ImmutableList<E> coefficients) {
    this.field = requireNonNull(field);
    this.coefficients = requireNonNull(coefficients);
  }

  /** Creates a polynomial from its coefficients, lowest degree first. */
  public static <E> Poly<E> of(Field<E> field, List<E> coefficients) {
    int n = coefficients.size();
    while (n > 0 && field.isZero(coefficients.get(n - 1))) {
      --n;
    }
    return new Poly<>(field, ImmutableList.copyOf(coefficients.subList(0, n)));
  }

  @SafeVarargs
  public static <E> Poly<E> of(Field<E> field, E... coefficients) {
    final List<E> list = new ArrayList<>();
    Collections.addAll(list, coefficients);
    return of(field, list);
  }

  public static <E> Poly<E> zero(Field<E> field) {
    return new Poly<>(field, ImmutableList.of());
  }

  public static <E> Poly<E> one(Field<E> field) {
    return constant(field, field.one());
  }

  public static <E> Poly<E> constant(Field<E> field, E c) {
    return of(field, ImmutableList.of(c));
  }

  /** Returns the polynomial "t", where t is the indeterminate. */
  public static <E> Poly<E> t(Field<E> field) {
    return monomial(field, field.one(), 1);
  }

  /** Returns the polynomial "c * t ^ n". */
  public static <E> Poly<E> monomial(Field<E> field, E c, int n) {
    checkArgument(n >= 0);
    if (field.isZero(c)) {
      return zero(field);
    }
    final List<E> list = new ArrayList<>(n + 1);
    for (int i = 0; i < n; i++) {
      list.add(field.zero());
    }
    list.add(c);
    return new Poly<>(field, ImmutableList.copyOf(list));
  }

  /** Returns the degree; -1 for the zero polynomial. */
  public int degree() {
    return coefficients.size() - 1;
  }

  public boolean isZero() {
    return coefficients.isEmpty();
  }

  /** Returns whether this polynomial is a constant (possibly zero). */
  public boolean isConstant() {
    return coefficients.size() <= 1;
  }

  public boolean isOne() {
    return coefficients.size() == 1 && field.isOne(coefficients.get(0));
  }

  /** Returns the coefficient of "t ^ i"; zero if i is beyond the degree. */
  public E coefficient(int i) {
    return i < coefficients.size() ? coefficients.get(i) : field.zero();
  }

  /** Returns the coefficients, lowest degree first. */
  public List<E> coefficients() {
    return coefficients;
  }

  public E leadingCoefficient() {
    return isZero() ? field.zero() : coefficients.get(coefficients.size() - 1);
  }

  /** Returns the smallest i such that the coefficient of t^i is non-zero. */
  public int lowestDegree() {
    for (int i = 0; i < coefficients.size(); i++) {
      if (!field.isZero(coefficients.get(i))) {
        return i;
      }
    }
    return -1;
  }

  public Poly<E> add(Poly<E> o) {
    final int n = Math.max(coefficients.size(), o.coefficients.size());
    final List<E> list = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      list.add(field.add(coefficient(i), o.coefficient(i)));
    }
    return of(field, list);
  }

  public Poly<E> negate() {
    final List<E> list = new ArrayList<>(coefficients.size());
    for (E c : coefficients) {
      list.add(field.negate(c));
    }
    return new Poly<>(field, ImmutableList.copyOf(list));
  }

  public Poly<E> subtract(Poly<E> o) {
    return add(o.negate());
  }

  public Poly<E> multiply(Poly<E> o) {
    if (isZero() || o.isZero()) {
      return zero(field);
    }
    final int n = coefficients.size() + o.coefficients.size() - 1;
    final List<E> list = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      list.add(field.zero());
    }
    for (int i = 0; i < coefficients.size(); i++) {
      final E a = coefficients.get(i);
      if (field.isZero(a)) {
        continue;
      }
      for (int j = 0; j < o.coefficients.size(); j++) {
        final E ab = field.multiply(a, o.coefficients.get(j));
        list.set(i + j, field.add(list.get(i + j), ab));
      }
    }
    return of(field, list);
  }

  /** Multiplies each coefficient by a scalar. */
  public Poly<E> scale(E c) {
    if (field.isZero(c)) {
      return zero(field);
    }
    final List<E> list = new ArrayList<>(coefficients.size());
    for (E a : coefficients) {
      list.add(field.multiply(a, c));
    }
    return of(field, list);
  }

  /** Multiplies by "t ^ n". */
  public Poly<E> shift(int n) {
    checkArgument(n >= 0);
    if (n == 0 || isZero()) {
      return this;
    }
    final List<E> list = new ArrayList<>(coefficients.size() + n);
    for (int i = 0; i < n; i++) {
      list.add(field.zero());
    }
    list.addAll(coefficients);
    return new Poly<>(field, ImmutableList.copyOf(list));
  }

  public Poly<E> pow(int n) {
    checkArgument(n >= 0);
    Poly<E> result = one(field);
    Poly<E> p = this;
    while (n > 0) {
      if ((n & 1) != 0) {
        result = result.multiply(p);
      }
      n >>= 1;
      if (n > 0) {
        p = p.multiply(p);
      }
    }
    return result;
  }

  /** Returns this polynomial divided by its leading coefficient. */
  public Poly<E> monic() {
    if (isZero() || field.isOne(leadingCoefficient())) {
      return this;
    }
    return scale(field.inverse(leadingCoefficient()));
  }

  /**
   * Divides by another polynomial, returning quotient and remainder.
   *
   * @throws ArithmeticException if the divisor is zero
   */
  public DivisionResult<E> divide(Poly<E> divisor) {
    if (divisor.isZero()) {
      throw new ArithmeticException("division by zero polynomial");
    }
    final int n = divisor.degree();
    if (degree() < n) {
      return new DivisionResult<>(zero(field), this);
    }
    final E lc = divisor.leadingCoefficient();
    final List<E> r = new ArrayList<>(coefficients);
    final List<E> q = new ArrayList<>();
    for (int i = 0; i <= degree() - n; i++) {
      q.add(field.zero());
    }
    for (int k = degree() - n; k >= 0; k--) {
      final E c = field.divide(r.get(k + n), lc);
      q.set(k, c);
      if (field.isZero(c)) {
        continue;
      }
      for (int j = 0; j <= n; j++) {
        final E cd = field.multiply(c, divisor.coefficient(j));
        r.set(k + j, field.subtract(r.get(k + j), cd));
      }
    }
    return new DivisionResult<>(of(field, q), of(field, r.subList(0, n)));
  }

  public Poly<E> quotient(Poly<E> divisor) {
    return divide(divisor).quotient;
  }

  public Poly<E> remainder(Poly<E> divisor) {
    return divide(divisor).remainder;
  }

  /** Returns whether this polynomial is divisible by another. */
  public boolean isDivisibleBy(Poly<E> divisor) {
    return divide(divisor).remainder.isZero();
  }

  /** Returns the formal derivative with respect to the indeterminate. */
  public Poly<E> derivative() {
    if (coefficients.size() <= 1) {
      return zero(field);
    }
    final List<E> list = new ArrayList<>(coefficients.size() - 1);
    for (int i = 1; i < coefficients.size(); i++) {
      final E n = field.fromRational(BigRational.of(i));
      list.add(field.multiply(n, coefficients.get(i)));
    }
    return of(field, list);
  }

  /** Evaluates this polynomial at a point, using Horner's rule. */
  public E evaluate(E at) {
    E result = field.zero();
    for (int i = coefficients.size() - 1; i >= 0; i--) {
      result = field.add(field.multiply(result, at), coefficients.get(i));
    }
    return result;
  }

  /** Converts the coefficients into another field. */
  public <F> Poly<F> map(Field<F> field2, Function<E, F> fn) {
    final List<F> list = new ArrayList<>(coefficients.size());
    for (E c : coefficients) {
      list.add(fn.apply(c));
    }
    return of(field2, list);
  }

  /** Returns the monic greatest common divisor of two polynomials. */
  public static <E> Poly<E> gcd(Poly<E> a, Poly<E> b) {
    while (!b.isZero()) {
      final Poly<E> r = a.remainder(b);
      a = b;
      b = r;
    }
    return a.monic();
  }

  /**
   * Extended Euclidean algorithm. Returns (g, s, t) such that {@code s * a +
   * t * b = g} where g is the monic gcd of a and b.
   */
  public static <E> ExtendedGcd<E> extendedGcd(Poly<E> a, Poly<E> b) {
    final Field<E> field = a.field;
    Poly<E> r0 = a;
    Poly<E> r1 = b;
    Poly<E> s0 = one(field);
    Poly<E> s1 = zero(field);
    Poly<E> t0 = zero(field);
    Poly<E> t1 = one(field);
    while (!r1.isZero()) {
      final DivisionResult<E> d = r0.divide(r1);
      final Poly<E> r2 = d.remainder;
      final Poly<E> s2 = s0.subtract(d.quotient.multiply(s1));
      final Poly<E> t2 = t0.subtract(d.quotient.multiply(t1));
      r0 = r1;
      r1 = r2;
      s0 = s1;
      s1 = s2;
      t0 = t1;
      t1 = t2;
    }
    if (r0.isZero()) {
      return new ExtendedGcd<>(r0, s0, t0);
    }
    final E inv = field.inverse(r0.leadingCoefficient());
    return new ExtendedGcd<>(r0.scale(inv), s0.scale(inv), t0.scale(inv));
  }

  /**
   * Solves {@code s * a + t * b = c} for s with {@code deg(s) < deg(b)},
   * given that gcd(a, b) divides c. Returns (s, t).
   *
   * @throws ArithmeticException if gcd(a, b) does not divide c
   */
  public static <E> ExtendedGcd<E> diophantine(
      Poly<E> a, Poly<E> b, Poly<E> c) {
    final ExtendedGcd<E> e = extendedGcd(a, b);
    final DivisionResult<E> qr = c.divide(e.gcd);
    if (!qr.remainder.isZero()) {
      throw new ArithmeticException("gcd does not divide right-hand side");
    }
    Poly<E> s = e.s.multiply(qr.quotient);
    Poly<E> t = e.t.multiply(qr.quotient);
    if (!b.isConstant()) {
      final DivisionResult<E> d = s.divide(b);
      s = d.remainder;
      t = t.add(d.quotient.multiply(a));
    }
    return new ExtendedGcd<>(e.gcd, s, t);
  }

  /**
   * Returns the squarefree decomposition by Yun's algorithm. Element i of the
   * result is the monic product of the irreducible factors of multiplicity
   * i + 1, so that {@code p = lc(p) * Π result[i] ^ (i + 1)}.
   */
  public List<Poly<E>> squarefree() {
    final List<Poly<E>> factors = new ArrayList<>();
    if (degree() <= 0) {
      return factors;
    }
    final Poly<E> p = monic();
    final Poly<E> dp = p.derivative();
    final Poly<E> c = gcd(p, dp);
    Poly<E> w = p.quotient(c);
    Poly<E> y = dp.quotient(c);
    Poly<E> z = y.subtract(w.derivative());
    while (w.degree() > 0) {
      final Poly<E> g = gcd(w, z);
      factors.add(g);
      w = w.quotient(g);
      y = z.quotient(g);
      z = y.subtract(w.derivative());
    }
    return factors;
  }

  /** Returns whether this polynomial has no repeated factors. */
  public boolean isSquarefree() {
    return degree() <= 0 || gcd(this, derivative()).degree() == 0;
  }

  /**
   * Returns the resultant of two polynomials, computed by the Euclidean
   * algorithm.
   */
  public static <E> E resultant(Poly<E> a, Poly<E> b) {
    final Field<E> field = a.field;
    if (a.isZero() || b.isZero()) {
      return field.zero();
    }
    E result = field.one();
    while (b.degree() > 0) {
      final int m = a.degree();
      final int n = b.degree();
      final Poly<E> r = a.remainder(b);
      if (r.isZero()) {
        return field.zero();
      }
      if ((m & 1) == 1 && (n & 1) == 1) {
        result = field.negate(result);
      }
      final E lc = b.leadingCoefficient();
      for (int i = 0; i < m - r.degree(); i++) {
        result = field.multiply(result, lc);
      }
      a = b;
      b = r;
    }
    // b is a non-zero constant
    final E c = b.leadingCoefficient();
    for (int i = 0; i < a.degree(); i++) {
      result = field.multiply(result, c);
    }
    return result;
  }

  /**
   * Returns the polynomial of least degree through the given points, using
   * Newton's divided differences.
   */
  public static <E> Poly<E> interpolate(
      Field<E> field, List<E> xs, List<E> ys) {
    checkArgument(xs.size() == ys.size());
    final int n = xs.size();
    final List<E> d = new ArrayList<>(ys);
    for (int j = 1; j < n; j++) {
      for (int i = n - 1; i >= j; i--) {
        d.set(
            i,
            field.divide(
                field.subtract(d.get(i), d.get(i - 1)),
                field.subtract(xs.get(i), xs.get(i - j))));
      }
    }
    Poly<E> result = zero(field);
    for (int i = n - 1; i >= 0; i--) {
      result =
          result
              .multiply(of(field, field.negate(xs.get(i)), field.one()))
              .add(constant(field, d.get(i)));
    }
    return result;
  }

  @Override
  public int hashCode() {
    return coefficients.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Poly && coefficients.equals(((Poly<?>) o).coefficients);
  }

  @Override
  public String toString() {
    return toString("t");
  }

  /** Prints using a given name for the indeterminate. */
  public String toString(String name) {
    if (isZero()) {
      return "0";
    }
    final StringBuilder b = new StringBuilder();
    for (int i = coefficients.size() - 1; i >= 0; i--) {
      final E c = coefficients.get(i);
      if (field.isZero(c)) {
        continue;
      }
      if (b.length() > 0) {
        b.append(" + ");
      }
      if (i == 0 || !field.isOne(c)) {
        b.append(i == 0 ? c.toString() : "(" + c + ")");
      }
      if (i > 0) {
        if (!field.isOne(c)) {
          b.append(" * ");
        }
        b.append(name);
        if (i > 1) {
          b.append('^').append(i);
        }
      }
    }
    return b.toString();
  }

  /** Quotient and remainder of polynomial division. */
  public static class DivisionResult<E> {
    public final Poly<E> quotient;
    public final Poly<E> remainder;

    DivisionResult(Poly<E> quotient, Poly<E> remainder) {
      this.quotient = quotient;
      this.remainder = remainder;
    }
  }

  /** Result of the extended Euclidean algorithm. */
  public static class ExtendedGcd<E> {
    public final Poly<E> gcd;
    public final Poly<E> s;
    public final Poly<E> t;

    ExtendedGcd(Poly<E> gcd, Poly<E> s, Poly<E> t) {
      this.gcd = gcd;
      this.s = s;
      this.t = t;
    }
  }
}

// End Poly.java
