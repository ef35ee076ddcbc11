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

import java.util.Objects;

/**
 * Quotient of two polynomials over a field.
 *
 * <p>Always normalized: numerator and denominator are coprime and the
 * denominator is monic. Consequently equal rational functions have equal
 * representations.
 *
 * @param <E> Coefficient type
 */
public final class RationalFunction<E> {
  public final Poly<E> numerator;
  public final Poly<E> denominator;

  private RationalFunction(Poly<E> numerator, Poly<E> denominator) {
    this.numerator = requireNonNull(numerator);
    this.denominator = requireNonNull(denominator);
  }

  /**
   * Creates a rational function, reducing it to lowest terms.
   *
   * @throws ArithmeticException if the denominator is zero
   */
  public static <E> RationalFunction<E> of(
      Poly<E> numerator, Poly<E> denominator) {
    if (denominator.isZero()) {
      throw new ArithmeticException("zero denominator");
    }
    if (numerator.isZero()) {
      return new RationalFunction<>(numerator, Poly.one(numerator.field));
    }
    if (!denominator.isConstant()) {
      final Poly<E> g = Poly.gcd(numerator, denominator);
      if (!g.isOne()) {
        numerator = numerator.quotient(g);
        denominator = denominator.quotient(g);
      }
    }
    final Field<E> field = denominator.field;
    final E lc = denominator.leadingCoefficient();
    if (!field.isOne(lc)) {
      final E inv = field.inverse(lc);
      numerator = numerator.scale(inv);
      denominator = denominator.scale(inv);
    }
    return new RationalFunction<>(numerator, denominator);
  }

  public static <E> RationalFunction<E> of(Poly<E> p) {
    return new RationalFunction<>(p, Poly.one(p.field));
  }

  public static <E> RationalFunction<E> constant(Field<E> field, E c) {
    return of(Poly.constant(field, c));
  }

  public Field<E> field() {
    return numerator.field;
  }

  public boolean isZero() {
    return numerator.isZero();
  }

  /** Returns whether the denominator is 1. */
  public boolean isPolynomial() {
    return denominator.isOne();
  }

  /** Returns whether this is a constant (an element of the coefficient
   * field). */
  public boolean isConstant() {
    return denominator.isOne() && numerator.isConstant();
  }

  public RationalFunction<E> add(RationalFunction<E> o) {
    if (isZero()) {
      return o;
    }
    if (o.isZero()) {
      return this;
    }
    if (denominator.equals(o.denominator)) {
      return of(numerator.add(o.numerator), denominator);
    }
    final Poly<E> n =
        numerator
            .multiply(o.denominator)
            .add(o.numerator.multiply(denominator));
    return of(n, denominator.multiply(o.denominator));
  }

  public RationalFunction<E> negate() {
    return new RationalFunction<>(numerator.negate(), denominator);
  }

  public RationalFunction<E> subtract(RationalFunction<E> o) {
    return add(o.negate());
  }

  public RationalFunction<E> multiply(RationalFunction<E> o) {
    if (isZero() || o.isZero()) {
      return of(Poly.zero(field()));
    }
    return of(
        numerator.multiply(o.numerator), denominator.multiply(o.denominator));
  }

  /**
   * Divides by another rational function.
   *
   * @throws ArithmeticException if {@code o} is zero
   */
  public RationalFunction<E> divide(RationalFunction<E> o) {
    if (o.isZero()) {
      throw new ArithmeticException("division by zero");
    }
    return of(
        numerator.multiply(o.denominator), denominator.multiply(o.numerator));
  }

  @Override
  public int hashCode() {
    return Objects.hash(numerator, denominator);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof RationalFunction
            && numerator.equals(((RationalFunction<?>) o).numerator)
            && denominator.equals(((RationalFunction<?>) o).denominator);
  }

  @Override
  public String toString() {
    return denominator.isOne()
        ? numerator.toString()
        : "(" + numerator + ") / (" + denominator + ")";
  }
}

// End RationalFunction.java
