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

import net.hydromatic.integral.algebra.Field;
import net.hydromatic.integral.algebra.Poly;
import net.hydromatic.integral.algebra.RationalFunction;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The field of {@link TowerElement} values.
 *
 * <p>One instance serves every level of a tower: each operation lifts its
 * operands to the higher of their two levels, and the result is lowered
 * again if possible.
 */
public enum TowerField implements Field<TowerElement> {
  INSTANCE;

  private static final TowerElement ZERO = TowerElement.of(BigRational.ZERO);
  private static final TowerElement ONE = TowerElement.of(BigRational.ONE);

  @Override public TowerElement zero() {
    return ZERO;
  }

  @Override public TowerElement one() {
    return ONE;
  }

  @Override public TowerElement fromRational(BigRational r) {
    return TowerElement.of(r);
  }

  @Override public TowerElement add(TowerElement a, TowerElement b) {
    if (a.isConstant() && b.isConstant()) {
      return TowerElement.of(a.constant().add(b.constant()));
    }
    if (a.isZero()) {
      return b;
    }
    if (b.isZero()) {
      return a;
    }
    final int level = Math.max(a.level, b.level);
    return TowerElement.of(level, lift(a, level).add(lift(b, level)));
  }

  @Override public TowerElement negate(TowerElement a) {
    if (a.isConstant()) {
      return TowerElement.of(a.constant().negate());
    }
    return TowerElement.of(a.level, a.rf().negate());
  }

  @Override public TowerElement multiply(TowerElement a, TowerElement b) {
    if (a.isConstant() && b.isConstant()) {
      return TowerElement.of(a.constant().multiply(b.constant()));
    }
    if (a.isZero() || b.isZero()) {
      return ZERO;
    }
    final int level = Math.max(a.level, b.level);
    return TowerElement.of(level,
        lift(a, level).multiply(lift(b, level)));
  }

  @Override public TowerElement divide(TowerElement a, TowerElement b) {
    if (b.isZero()) {
      throw new ArithmeticException("division by zero");
    }
    if (a.isConstant() && b.isConstant()) {
      return TowerElement.of(a.constant().divide(b.constant()));
    }
    if (a.isZero()) {
      return ZERO;
    }
    final int level = Math.max(a.level, b.level);
    return TowerElement.of(level, lift(a, level).divide(lift(b, level)));
  }

  @Override public @Nullable BigRational toRational(TowerElement a) {
    return a.isConstant() ? a.constant() : null;
  }

  /** Returns an element raised to an integer power. */
  public TowerElement power(TowerElement a, int n) {
    if (n < 0) {
      return inverse(power(a, -n));
    }
    TowerElement result = ONE;
    TowerElement square = a;
    for (int k = n; k > 0; k >>= 1) {
      if ((k & 1) == 1) {
        result = multiply(result, square);
      }
      if (k > 1) {
        square = multiply(square, square);
      }
    }
    return result;
  }

  /** Returns an element as a rational function in the generator of a given
   * level, which must be at least the element's own level. */
  RationalFunction<TowerElement> lift(TowerElement e, int level) {
    if (e.level == level) {
      return e.rf();
    }
    return RationalFunction.of(Poly.constant(this, e));
  }
}

// End TowerField.java
