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
package net.hydromatic.integral.integrate;

import static net.hydromatic.integral.Matchers.isAntiderivativeOf;
import static net.hydromatic.integral.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.parse.ExprParser;
import net.hydromatic.integral.util.Deadline;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link IntegrationTable}. */
public class IntegrationTableTest {
  private final Expr.Sym x = expr.sym("x");
  private final IntegrationTable table = IntegrationTable.standard();

  private @Nullable Expr lookup(String s) {
    return table.lookup(Simplifier.simplify(ExprParser.parse(s)), x);
  }

  private void check(String s) {
    final Expr e = lookup(s);
    assertThat(s, e, notNullValue());
    assertThat(s, e, isAntiderivativeOf(s, x));
  }

  @Test void testPowers() {
    check("x");
    check("x^7");
    check("x^(-3)");
    check("sqrt(x)");
    check("1 / x");
    check("(3 * x + 1)^4");
    check("1 / (2 * x - 5)");
    check("5");
    check("y^2");
  }

  @Test void testFunctions() {
    check("exp(2 * x + 1)");
    check("3^x");
    check("sin(4 * x)");
    check("cos(x / 2)");
    check("tan(x)");
    check("sec(x)");
    check("ln(x)");
    check("cosh(3 * x)");
    check("sin(x)^2");
    check("cos(2 * x)^2");
  }

  @Test void testQuadratics() {
    check("1 / (x^2 + 4)");
    check("1 / (x^2 - 9)");
    check("1 / sqrt(1 - x^2)");
    check("1 / sqrt(x^2 + 1)");
    check("sqrt(4 - x^2)");
    check("x / (x^2 + 3)");
  }

  @Test void testProducts() {
    check("x * exp(x^2)");
    check("x^2 * exp(x)");
    check("x * sin(2 * x)");
    check("x * cos(x)");
    check("x^3 * ln(x)");
    check("ln(x) / x");
    check("1 / (x * ln(x))");
  }

  @Test void testNoMatch() {
    assertThat(lookup("exp(x^2)"), nullValue());
    assertThat(lookup("sin(x) / x"), nullValue());
    assertThat(lookup("x * tan(x)"), nullValue());
  }

  /** A symbolic exponent might be -1, so the power rules do not apply. */
  @Test void testSymbolicExponent() {
    assertThat(lookup("x^a"), nullValue());
    assertThat(lookup("(2 * x + 1)^a"), nullValue());
    assertThat(lookup("x^a * ln(x)"), nullValue());
    check("x^2 * ln(x)");
  }

  /** A custom table replaces the standard entries. */
  @Test void testCustom() {
    final IntegrationTable custom =
        IntegrationTable.of(
            table.entries().subList(0, 1));
    assertThat(custom.entries().get(0), hasToString("x"));
    assertThat(custom.lookup(x, x), notNullValue());
    assertThat(custom.lookup(expr.sin(x), x), nullValue());
    final StrategyOutcome outcome =
        custom.attempt(
            IntegrationRequest.of(expr.sin(x), x, Deadline.NONE),
            Integrator.create());
    assertThat(outcome.kind, is(StrategyOutcome.Kind.NOT_APPLICABLE));
  }
}

// End IntegrationTableTest.java
