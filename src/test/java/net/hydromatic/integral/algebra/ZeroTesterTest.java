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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.integral.parse.ExprParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link ZeroTester}. */
public class ZeroTesterTest {
  private static ZeroTester.Result test(String s) {
    return ZeroTester.test(ExprParser.parse(s));
  }

  private static ZeroTester.Result testEqual(String s0, String s1) {
    return ZeroTester.testEqual(ExprParser.parse(s0), ExprParser.parse(s1));
  }

  @Test void testZero() {
    assertThat(test("0"), is(ZeroTester.Result.ZERO));
    assertThat(test("(x + 1)^2 - x^2 - 2 * x - 1"), is(ZeroTester.Result.ZERO));
    assertThat(test("sin(x)^2 + cos(x)^2 - 1"), is(ZeroTester.Result.ZERO));
    assertThat(test("exp(x + y) - exp(x) * exp(y)"),
        is(ZeroTester.Result.ZERO));
  }

  @Test void testNonZero() {
    assertThat(test("x - 1"), is(ZeroTester.Result.NON_ZERO));
    assertThat(test("sin(x) - cos(x)"), is(ZeroTester.Result.NON_ZERO));
    assertThat(test("0.001"), is(ZeroTester.Result.NON_ZERO));
  }

  @Test void testEqual() {
    assertThat(testEqual("ln(abs(x^2))", "2 * ln(abs(x))"),
        is(ZeroTester.Result.ZERO));
    assertThat(testEqual("tan(x)", "sin(x) / cos(x)"),
        is(ZeroTester.Result.ZERO));
    assertThat(testEqual("x^2", "x^3"), is(ZeroTester.Result.NON_ZERO));
  }

  /** Undefined everywhere, so there are too few points to decide. */
  @Test void testUnknown() {
    assertThat(test("ln(-1 - x^2)"), is(ZeroTester.Result.UNKNOWN));
  }
}

// End ZeroTesterTest.java
