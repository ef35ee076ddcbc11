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
import net.hydromatic.integral.function.Liate;
import net.hydromatic.integral.parse.ExprParser;
import net.hydromatic.integral.util.Deadline;
import org.junit.jupiter.api.Test;

/** Tests for {@link IntegrationByParts}. */
public class IntegrationByPartsTest {
  private final Expr.Sym x = expr.sym("x");
  private final Integrator integrator = Integrator.create();
  private final IntegrationByParts strategy = new IntegrationByParts();

  private static Expr parse(String s) {
    return Simplifier.simplify(ExprParser.parse(s));
  }

  private StrategyOutcome attempt(String s) {
    return strategy.attempt(
        IntegrationRequest.of(parse(s), x, Deadline.NONE), integrator);
  }

  private void check(String s) {
    final StrategyOutcome outcome = attempt(s);
    assertThat(s, outcome.kind, is(StrategyOutcome.Kind.FOUND));
    assertThat(s, Simplifier.simplify(outcome.expr()),
        isAntiderivativeOf(s, x));
  }

  @Test void testClassify() {
    assertThat(IntegrationByParts.classify(parse("ln(x)"), x),
        is(Liate.LOGARITHMIC));
    assertThat(IntegrationByParts.classify(parse("arctan(x)"), x),
        is(Liate.INVERSE_TRIGONOMETRIC));
    assertThat(IntegrationByParts.classify(parse("x^2 + 1"), x),
        is(Liate.ALGEBRAIC));
    assertThat(IntegrationByParts.classify(parse("cos(x)^2"), x),
        is(Liate.TRIGONOMETRIC));
    assertThat(IntegrationByParts.classify(parse("2^x"), x),
        is(Liate.EXPONENTIAL));
    assertThat(IntegrationByParts.classify(parse("exp(3 * x)"), x),
        is(Liate.EXPONENTIAL));
  }

  @Test void testChoose() {
    final IntegrationByParts.Parts parts =
        IntegrationByParts.choose(parse("x * ln(x)"), x);
    assertThat(parts, notNullValue());
    assertThat(parts.u, is(parse("ln(x)")));
    assertThat(parts.dv, is(x));
    // same class: nothing to choose
    assertThat(IntegrationByParts.choose(parse("x * (x + 1)"), x),
        nullValue());
    // algebraic u must be a polynomial
    assertThat(IntegrationByParts.choose(parse("sqrt(x) * exp(x)"), x),
        nullValue());
    assertThat(IntegrationByParts.choose(parse("sin(x)"), x), nullValue());
  }

  @Test void testRepeated() {
    check("x^3 * exp(x)");
    check("x^2 * sin(x)");
    check("x * arctan(x)");
    check("x^2 * ln(x)");
  }

  /** The integral reappears, and the equation is solved for it. */
  @Test void testCyclic() {
    check("exp(x) * sin(x)");
    check("exp(2 * x) * cos(3 * x)");
  }

  @Test void testMaxSteps() {
    final Integrator limited =
        Integrator.builder().withProp(Prop.BY_PARTS_MAX_STEPS, 1).build();
    final StrategyOutcome outcome =
        strategy.attempt(
            IntegrationRequest.of(parse("x^3 * exp(x)"), x, Deadline.NONE),
            limited);
    // one step leaves x^2 exp(x), which the table integrates
    assertThat(outcome.kind, is(StrategyOutcome.Kind.FOUND));
    assertThat(Simplifier.simplify(outcome.expr()),
        isAntiderivativeOf("x^3 * exp(x)", x));
  }

  @Test void testNotApplicable() {
    assertThat(attempt("exp(x^2)").kind,
        is(StrategyOutcome.Kind.NOT_APPLICABLE));
    assertThat(attempt("sin(x) / x").kind,
        is(StrategyOutcome.Kind.NOT_APPLICABLE));
  }
}

// End IntegrationByPartsTest.java
