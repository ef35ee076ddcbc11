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
package net.hydromatic.integral.calculus;

import static net.hydromatic.integral.Matchers.isEquivalentTo;
import static net.hydromatic.integral.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.parse.ExprParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link Differentiator}. */
public class DifferentiatorTest {
  private final Expr.Sym x = expr.sym("x");

  private Expr d(String s) {
    return Differentiator.derivative(ExprParser.parse(s), x);
  }

  @Test void testPolynomial() {
    assertThat(d("x^3 + 2 * x + 7"),
        is(Simplifier.simplify(ExprParser.parse("3 * x^2 + 2"))));
    assertThat(d("5"), is(expr.zero()));
    assertThat(d("a * y"), is(expr.zero()));
    assertThat(d("a * x"), is(expr.sym("a")));
  }

  @Test void testProductQuotient() {
    assertThat(d("x * sin(x)"), isEquivalentTo("sin(x) + x * cos(x)"));
    assertThat(d("1 / x"), isEquivalentTo("-1 / x^2"));
    assertThat(d("(x + 1) / (x - 1)"), isEquivalentTo("-2 / (x - 1)^2"));
  }

  @Test void testChainRule() {
    assertThat(d("exp(x^2)"), isEquivalentTo("2 * x * exp(x^2)"));
    assertThat(d("sin(3 * x + 1)"), isEquivalentTo("3 * cos(3 * x + 1)"));
    assertThat(d("sqrt(1 + x^2)"), isEquivalentTo("x / sqrt(1 + x^2)"));
    assertThat(d("ln(abs(cos(x)))"), isEquivalentTo("-tan(x)"));
  }

  @Test void testFunctions() {
    assertThat(d("ln(x)"), isEquivalentTo("1 / x"));
    assertThat(d("tan(x)"), isEquivalentTo("1 / cos(x)^2"));
    assertThat(d("arctan(x)"), isEquivalentTo("1 / (1 + x^2)"));
    assertThat(d("arcsin(x / 2)"), isEquivalentTo("1 / sqrt(4 - x^2)"));
    assertThat(d("sinh(x)"), isEquivalentTo("cosh(x)"));
  }

  @Test void testVariableExponent() {
    assertThat(d("2^x"), isEquivalentTo("2^x * ln(2)"));
    assertThat(d("x^x"), isEquivalentTo("x^x * (ln(x) + 1)"));
  }

  @Test void testIntegral() {
    // fundamental theorem of calculus
    assertThat(d("integral(exp(x^2), x)"),
        is(Simplifier.simplify(ExprParser.parse("exp(x^2)"))));
    assertThat(d("integral(exp(t^2), t, 0, x)"), isEquivalentTo("exp(x^2)"));
    assertThat(d("integral(exp(t^2), t, 0, 1)"), is(expr.zero()));
  }
}

// End DifferentiatorTest.java
