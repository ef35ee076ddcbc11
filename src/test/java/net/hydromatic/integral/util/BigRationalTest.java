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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link BigRational} and {@link Deadline}. */
public class BigRationalTest {
  @Test void testNormalize() {
    assertThat(BigRational.of(4, 6), hasToString("2/3"));
    assertThat(BigRational.of(4, -6), hasToString("-2/3"));
    assertThat(BigRational.of(0, -6), is(BigRational.ZERO));
    assertThat(BigRational.of(6, 3), hasToString("2"));
    assertThat(BigRational.of(6, 3).isInteger(), is(true));
    assertThrows(ArithmeticException.class, () -> BigRational.of(1, 0));
  }

  @Test void testArithmetic() {
    final BigRational half = BigRational.of(1, 2);
    final BigRational third = BigRational.of(1, 3);
    assertThat(half.add(third), is(BigRational.of(5, 6)));
    assertThat(half.subtract(third), is(BigRational.of(1, 6)));
    assertThat(half.multiply(third), is(BigRational.of(1, 6)));
    assertThat(half.divide(third), is(BigRational.of(3, 2)));
    assertThat(half.negate().abs(), is(half));
    assertThat(third.reciprocal(), is(BigRational.of(3)));
    assertThat(BigRational.of(2, 3).pow(-2), is(BigRational.of(9, 4)));
    assertThat(half.compareTo(third) > 0, is(true));
    assertThat(half.max(third), is(half));
  }

  @Test void testParse() {
    assertThat(BigRational.parse("2.5"), is(BigRational.of(5, 2)));
    assertThat(BigRational.parse("-17"), is(BigRational.of(-17)));
    assertThat(BigRational.parse("0.125"), is(BigRational.of(1, 8)));
    assertThat(BigRational.parse("1e2"), is(BigRational.of(100)));
  }

  @Test void testRoot() {
    assertThat(BigRational.of(4, 9).root(2), is(BigRational.of(2, 3)));
    assertThat(BigRational.of(-8, 27).root(3), is(BigRational.of(-2, 3)));
    assertThat(BigRational.of(2).root(2), nullValue());
    assertThat(BigRational.of(-4).root(2), nullValue());
    assertThat(BigRational.ZERO.root(5), is(BigRational.ZERO));
  }

  @Test void testSmallInteger() {
    assertThat(BigRational.of(7).isSmallInteger(), is(true));
    assertThat(BigRational.of(7).intValueExact(), is(7));
    assertThat(BigRational.of(1L << 40).isSmallInteger(), is(false));
    assertThat(BigRational.of(1, 2).isSmallInteger(), is(false));
    assertThrows(ArithmeticException.class,
        () -> BigRational.of(1, 2).intValueExact());
  }

  @Test void testDeadline() {
    assertThat(Deadline.NONE.isExpired(), is(false));
    assertThat(Deadline.ofMillis(0), is(Deadline.NONE));
    final Deadline later = Deadline.ofMillis(60_000);
    assertThat(later.min(Deadline.NONE), is(later));
    assertThat(Deadline.NONE.min(later), is(later));
  }
}

// End BigRationalTest.java
