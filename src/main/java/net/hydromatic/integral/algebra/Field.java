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

import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Field of elements of type {@code E}.
 *
 * <p>Polynomials and rational functions are parameterized by the field of
 * their coefficients. Elements must have canonical {@code equals}, so that
 * an element is zero if and only if it equals {@link #zero()}.
 *
 * @param <E> Element type
 */
public interface Field<E> {
  E zero();

  E one();

  /** Returns the image of a rational number in this field. */
  E fromRational(BigRational r);

  E add(E a, E b);

  E negate(E a);

  E multiply(E a, E b);

  /**
   * Divides one element by another.
   *
   * @throws ArithmeticException if {@code b} is zero
   */
  E divide(E a, E b);

  default E subtract(E a, E b) {
    return add(a, negate(b));
  }

  default boolean isZero(E a) {
    return a.equals(zero());
  }

  default boolean isOne(E a) {
    return a.equals(one());
  }

  default E inverse(E a) {
    return divide(one(), a);
  }

  /**
   * Returns the element as a rational number if it is a constant of this
   * field (an image of {@link #fromRational}), otherwise null.
   */
  default @Nullable BigRational toRational(E a) {
    return null;
  }
}

// End Field.java
