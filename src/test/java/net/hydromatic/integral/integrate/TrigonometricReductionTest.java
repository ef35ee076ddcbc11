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

import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.parse.ExprParser;
import net.hydromatic.integral.util.Deadline;
import org.junit.jupiter.api.Test;

/** Tests for {@link TrigonometricReduction}. */
public class TrigonometricReductionTest {
  private final Expr.Sym x = expr.sym("x");
  private final Integrator integrator = Integrator.create();
  private final TrigonometricReduction strategy = new TrigonometricReduction();

  private StrategyOutcome attempt(String s) {
    final Expr f = Simplifier.simplify(ExprParser.parse(s));
    return strategy.attempt(IntegrationRequest.of(f, x, Deadline.NONE),
        integrator);
  }

  private void check(String s) {
    final StrategyOutcome outcome = attempt(s);
    assertThat(s, outcome.kind, is(StrategyOutcome.Kind.FOUND));
    assertThat(s, Simplifier.simplify(outcome.expr()),
        isAntiderivativeOf(s, x));
  }

  @Test void testOddPowers() {
    check("sin(x)^3 * cos(x)");
    check("sin(x)^2 * cos(x)^3");
    check("sin(2 * x)^5");
    check("3 * sin(x)^3 * cos(x)^5");
    check("cos(x + 1)^3");
  }

  @Test void testEvenPowers() {
    check("sin(x)^4");
    check("cos(3 * x)^6");
    check("sin(x)^2 * cos(x)^2");
    check("sin(x)^4 * cos(x)^2");
  }

  @Test void testTanSec() {
    check("tan(x)^2");
    check("tan(2 * x)^5");
    check("sec(x)^3");
    check("sec(x)^4");
    check("cos(x)^(-3)");
  }

  @Test void testProductToSum() {
    check("sin(2 * x) * cos(3 * x)");
    check("sin(x) * sin(4 * x)");
    check("cos(x) * cos(x / 2)");
    assertThat(
        TrigonometricReduction.productToSum(
            Simplifier.simplify(ExprParser.parse("sin(x) * cos(x)")), x),
        nullValue());
    assertThat(
        TrigonometricReduction.productToSum(
            Simplifier.simplify(ExprParser.parse("sin(x) * cos(2 * x)")), x),
        notNullValue());
  }

  @Test void testReductionFormulas() {
    final Expr a = expr.num(2);
    final Expr theta = expr.mul(a, x);
    assertThat(
        Simplifier.simplify(TrigonometricReduction.sinPower(theta, x, a, 5)),
        isAntiderivativeOf("sin(2 * x)^5", x));
    assertThat(
        Simplifier.simplify(TrigonometricReduction.cosPower(theta, x, a, 4)),
        isAntiderivativeOf("cos(2 * x)^4", x));
    assertThat(
        Simplifier.simplify(TrigonometricReduction.tanPower(theta, x, a, 3)),
        isAntiderivativeOf("tan(2 * x)^3", x));
    assertThat(
        Simplifier.simplify(TrigonometricReduction.secPower(theta, x, a, 5)),
        isAntiderivativeOf("sec(2 * x)^5", x));
  }

  @Test void testNotApplicable() {
    assertThat(attempt("sin(x^2)^3").kind,
        is(StrategyOutcome.Kind.NOT_APPLICABLE));
    assertThat(attempt("x * sin(x)").kind,
        is(StrategyOutcome.Kind.NOT_APPLICABLE));
    assertThat(attempt("exp(x)").kind,
        is(StrategyOutcome.Kind.NOT_APPLICABLE));
  }

  /** Powers above the limit are left to other strategies. */
  @Test void testMaxPower() {
    final Integrator limited =
        Integrator.builder().withProp(Prop.TRIG_MAX_POWER, 3).build();
    final Expr f = Simplifier.simplify(ExprParser.parse("tan(x)^5"));
    assertThat(
        strategy.attempt(IntegrationRequest.of(f, x, Deadline.NONE), limited)
            .kind,
        is(StrategyOutcome.Kind.NOT_APPLICABLE));
  }
}

// End TrigonometricReductionTest.java
