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
package net.hydromatic.integral.util;

import static java.util.Objects.requireNonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Exact rational number.
 *
 * <p>Always in lowest terms, with a positive denominator. Instances are
 * immutable.
 */
public final class BigRational implements Comparable<BigRational> {
  public static final BigRational ZERO = new BigRational(BigInteger.ZERO);
  public static final BigRational ONE = new BigRational(BigInteger.ONE);
  public static final BigRational TWO = new BigRational(BigInteger.valueOf(2));
  public static final BigRational MINUS_ONE =
      new BigRational(BigInteger.ONE.negate());
  public static final BigRational HALF =
      new BigRational(BigInteger.ONE, BigInteger.valueOf(2));

  public final BigInteger numerator;
  public final BigInteger denominator;

  private BigRational(BigInteger numerator) {
    this(numerator, BigInteger.ONE);
  }

  private BigRational(BigInteger numerator, BigInteger denominator) {
    this.numerator = requireNonNull(numerator);
    this.denominator = requireNonNull(denominator);
  }

  /** Creates a rational from a numerator and a denominator. */
  public static BigRational of(BigInteger numerator, BigInteger denominator) {
    if (denominator.signum() == 0) {
      throw new ArithmeticException("zero denominator");
    }
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    final BigInteger gcd = numerator.gcd(denominator);
    if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    if (numerator.signum() == 0) {
      return ZERO;
    }
    return new BigRational(numerator, denominator);
  }

  public static BigRational of(long numerator, long denominator) {
    return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  public static BigRational of(BigInteger value) {
    return value.signum() == 0 ? ZERO : new BigRational(value);
  }

  public static BigRational of(long value) {
    return of(BigInteger.valueOf(value));
  }

  /** Converts a decimal string such as "2.5" or "-17" to an exact value. */
  public static BigRational parse(String s) {
    final BigDecimal d = new BigDecimal(s);
    if (d.scale() <= 0) {
      return of(d.toBigIntegerExact());
    }
    return of(d.unscaledValue(), BigInteger.TEN.pow(d.scale()));
  }

  public int signum() {
    return numerator.signum();
  }

  public boolean isZero() {
    return numerator.signum() == 0;
  }

  public boolean isOne() {
    return numerator.equals(BigInteger.ONE)
        && denominator.equals(BigInteger.ONE);
  }

  public boolean isInteger() {
    return denominator.equals(BigInteger.ONE);
  }

  /** Returns whether this is an integer that fits in an {@code int}. */
  public boolean isSmallInteger() {
    return isInteger() && numerator.bitLength() < 31;
  }

  /** Returns this value as an {@code int}; throws if it is not an integer. */
  public int intValueExact() {
    if (!isInteger()) {
      throw new ArithmeticException("not an integer: " + this);
    }
    return numerator.intValueExact();
  }

  public double doubleValue() {
    final double d = numerator.doubleValue() / denominator.doubleValue();
    if (Double.isFinite(d)) {
      return d;
    }
    return new BigDecimal(numerator)
        .divide(new BigDecimal(denominator), MathContext.DECIMAL64)
        .doubleValue();
  }

  public BigRational add(BigRational o) {
    if (isZero()) {
      return o;
    }
    if (o.isZero()) {
      return this;
    }
    if (denominator.equals(o.denominator)) {
      return of(numerator.add(o.numerator), denominator);
    }
    return of(
        numerator.multiply(o.denominator)
            .add(o.numerator.multiply(denominator)),
        denominator.multiply(o.denominator));
  }

  public BigRational subtract(BigRational o) {
    return add(o.negate());
  }

  public BigRational multiply(BigRational o) {
    if (isZero() || o.isZero()) {
      return ZERO;
    }
    if (isOne()) {
      return o;
    }
    if (o.isOne()) {
      return this;
    }
    return of(
        numerator.multiply(o.numerator), denominator.multiply(o.denominator));
  }

  public BigRational multiply(long n) {
    return multiply(of(n));
  }

  public BigRational divide(BigRational o) {
    if (o.isZero()) {
      throw new ArithmeticException("division by zero");
    }
    return of(
        numerator.multiply(o.denominator), denominator.multiply(o.numerator));
  }

  public BigRational divide(long n) {
    return divide(of(n));
  }

  public BigRational negate() {
    return isZero() ? this : new BigRational(numerator.negate(), denominator);
  }

  public BigRational abs() {
    return signum() < 0 ? negate() : this;
  }

  public BigRational reciprocal() {
    return ONE.divide(this);
  }

  /** Raises to an integer power; negative powers take the reciprocal. */
  public BigRational pow(int n) {
    if (n < 0) {
      return pow(-n).reciprocal();
    }
    return of(numerator.pow(n), denominator.pow(n));
  }

  /**
   * Returns the exact {@code n}th root, or null if this number has no
   * rational {@code n}th root.
   */
  public @Nullable BigRational root(int n) {
    if (n <= 0) {
      throw new IllegalArgumentException("root " + n);
    }
    if (n == 1) {
      return this;
    }
    if (signum() < 0) {
      if (n % 2 == 0) {
        return null;
      }
      final BigRational r = negate().root(n);
      return r == null ? null : r.negate();
    }
    final BigInteger p = integerRoot(numerator, n);
    final BigInteger q = integerRoot(denominator, n);
    if (p == null || q == null) {
      return null;
    }
    return of(p, q);
  }

  private static @Nullable BigInteger integerRoot(BigInteger a, int n) {
    if (a.signum() == 0 || a.equals(BigInteger.ONE)) {
      return a;
    }
    // Newton iteration from an upper bound
    BigInteger x = BigInteger.ONE.shiftLeft(a.bitLength() / n + 1);
    final BigInteger bn = BigInteger.valueOf(n);
    final BigInteger bn1 = BigInteger.valueOf(n - 1);
    for (;;) {
      final BigInteger y =
          bn1.multiply(x).add(a.divide(x.pow(n - 1))).divide(bn);
      if (y.compareTo(x) >= 0) {
        break;
      }
      x = y;
    }
    return x.pow(n).equals(a) ? x : null;
  }

  public BigRational min(BigRational o) {
    return compareTo(o) <= 0 ? this : o;
  }

  public BigRational max(BigRational o) {
    return compareTo(o) >= 0 ? this : o;
  }

  @Override
  public int compareTo(BigRational o) {
    return numerator
        .multiply(o.denominator)
        .compareTo(o.numerator.multiply(denominator));
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof BigRational
            && numerator.equals(((BigRational) o).numerator)
            && denominator.equals(((BigRational) o).denominator);
  }

  @Override
  public int hashCode() {
    return numerator.hashCode() * 31 + denominator.hashCode();
  }

  @Override
  public String toString() {
    return isInteger() ? numerator.toString() : numerator + "/" + denominator;
  }
}

// End BigRational.java
