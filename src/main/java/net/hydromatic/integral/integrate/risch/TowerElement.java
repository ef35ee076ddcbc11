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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.integral.algebra.Poly;
import net.hydromatic.integral.algebra.RationalFunction;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Element of a field in an {@link ExtensionTower}.
 *
 * <p>An element of level -1 is a rational constant. An element of level
 * k &ge; 0 is a rational function in the generator of level k whose
 * coefficients are elements of lower levels.
 *
 * <p>Elements are kept at the lowest level that can hold them: a rational
 * function that does not depend on its generator is stored as its constant
 * coefficient. This makes {@link #equals} canonical, as {@link
 * net.hydromatic.integral.algebra.Field} requires.
 */
public final class TowerElement {
  public final int level;
  private final @Nullable BigRational constant;
  private final @Nullable RationalFunction<TowerElement> rf;

  private TowerElement(int level, @Nullable BigRational constant,
      @Nullable RationalFunction<TowerElement> rf) {
    this.level = level;
    this.constant = constant;
    this.rf = rf;
  }

  /** Creates a constant element. */
  public static TowerElement of(BigRational constant) {
    return new TowerElement(-1, requireNonNull(constant), null);
  }

  /** Creates an element of a given level, lowering it if the rational
   * function is constant. */
  public static TowerElement of(int level,
      RationalFunction<TowerElement> rf) {
    checkArgument(level >= 0);
    if (rf.isConstant()) {
      return rf.numerator.coefficient(0);
    }
    return new TowerElement(level, null, rf);
  }

  /** Creates an element of a given level from a polynomial in its
   * generator. */
  public static TowerElement of(int level, Poly<TowerElement> p) {
    return of(level, RationalFunction.of(p));
  }

  /** Returns the value of a constant element. */
  public BigRational constant() {
    checkArgument(level < 0, "not a constant: %s", this);
    return requireNonNull(constant);
  }

  /** Returns this element as a rational function in the generator of its
   * level. */
  public RationalFunction<TowerElement> rf() {
    checkArgument(level >= 0, "constant has no rational function");
    return requireNonNull(rf);
  }

  public boolean isConstant() {
    return level < 0;
  }

  public boolean isZero() {
    return constant != null && constant.isZero();
  }

  @Override public int hashCode() {
    return Objects.hash(level, constant, rf);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof TowerElement
        && level == ((TowerElement) o).level
        && Objects.equals(constant, ((TowerElement) o).constant)
        && Objects.equals(rf, ((TowerElement) o).rf);
  }

  @Override public String toString() {
    return level < 0 ? String.valueOf(constant) : "[" + level + ": " + rf + "]";
  }
}

// End TowerElement.java
