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
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;

import java.util.List;
import net.hydromatic.integral.algebra.Exprs;
import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.parse.ExprParser;
import net.hydromatic.integral.util.Deadline;
import org.junit.jupiter.api.Test;

/** Tests for {@link USubstitution}. */
public class USubstitutionTest {
  private final Expr.Sym x = expr.sym("x");
  private final Expr.Sym u = expr.sym("u");
  private final Integrator integrator = Integrator.create();

  private static Expr parse(String s) {
    return Simplifier.simplify(ExprParser.parse(s));
  }

  private void check(String s) {
    final StrategyOutcome outcome =
        new USubstitution().attempt(
            IntegrationRequest.of(parse(s), x, Deadline.NONE), integrator);
    assertThat(s, outcome.kind, is(StrategyOutcome.Kind.FOUND));
    assertThat(s, Simplifier.simplify(outcome.expr()),
        isAntiderivativeOf(s, x));
  }

  @Test void testReduce() {
    assertThat(
        USubstitution.reduce(parse("sin(x)^3 * cos(x)"), x, parse("sin(x)"),
            u),
        is(parse("u^3")));
    assertThat(
        USubstitution.reduce(parse("x * exp(x^2)"), x, parse("x^2"), u),
        is(parse("exp(u) / 2")));
    // x^2 = u, so x^4 = u^2
    assertThat(
        USubstitution.reduce(parse("x^5 * cos(x^2)"), x, parse("x^2"), u),
        is(parse("u^2 * cos(u) / 2")));
    assertThat(
        USubstitution.reduce(parse("sin(x^2)"), x, parse("sin(x)"), u),
        nullValue());
  }

  /** Rewriting x as a root of u = x ^ n holds only for positive x, so x
   * may occur only in powers that are multiples of n. */
  @Test void testReducePowerMultiple() {
    assertThat(
        USubstitution.reduce(parse("x^3 * cos(x^2)"), x, parse("x^2"), u),
        is(parse("u * cos(u) / 2")));
    assertThat(
        USubstitution.reduce(parse("exp(x) / x^2"), x, parse("x^2"), u),
        nullValue());
    assertThat(
        USubstitution.reduce(parse("x^2 / (x^4 + 1)"), x, parse("x^2"), u),
        nullValue());
    assertThat(
        USubstitution.reduce(parse("exp(x) / x^2 - exp(x) / x"), x,
            parse("1 / x^2"), u),
        nullValue());
    // u = 1 / x, so x = 1 / u for all x
    assertThat(
        USubstitution.reduce(parse("exp(1 / x) / x^2"), x, parse("1 / x"),
            u),
        is(parse("-exp(u)")));
  }

  /** A substitution that does not make the integrand smaller is not a
   * candidate. */
  @Test void testCandidatesShrink() {
    final Expr f = parse("exp(x) / x^2 - exp(x) / x");
    for (SubstitutionCandidate candidate
        : USubstitution.candidates(f, x, 100, Deadline.NONE)) {
      assertThat(candidate.toString(),
          Exprs.size(candidate.reduced) < Exprs.size(f), is(true));
    }
  }

  @Test void testDeadline() throws InterruptedException {
    final Deadline deadline = Deadline.ofMillis(1);
    Thread.sleep(20);
    final Expr f = parse("2 * x * cos(x^2 + 1)");
    assertThat(USubstitution.candidates(f, x, 100, deadline), empty());
    final StrategyOutcome outcome =
        new USubstitution().attempt(IntegrationRequest.of(f, x, deadline),
            integrator);
    assertThat(outcome.kind, is(StrategyOutcome.Kind.TIMED_OUT));
  }

  /** Integrands that are too large are not attempted. */
  @Test void testMaxSize() {
    Expr f = x;
    for (int i = 0; i < 100; i++) {
      f = expr.sin(expr.add(f, expr.one()));
    }
    final StrategyOutcome outcome =
        new USubstitution().attempt(
            IntegrationRequest.of(f, x, Deadline.NONE), integrator);
    assertThat(outcome.kind, is(StrategyOutcome.Kind.NOT_APPLICABLE));
  }

  @Test void testCandidates() {
    final List<SubstitutionCandidate> candidates =
        USubstitution.candidates(parse("2 * x * cos(x^2 + 1)"), x, 100,
            Deadline.NONE);
    assertThat(candidates, not(empty()));
    final SubstitutionCandidate best = candidates.get(0);
    assertThat(best.inner, is(parse("x^2 + 1")));
    assertThat(best.reduced, is(parse("cos(u)")));
    assertThat(best, hasToString("u = x^2 + 1: cos(u)"));
  }

  /** The fresh variable does not clash with symbols in the integrand. */
  @Test void testFreshVariable() {
    final List<SubstitutionCandidate> candidates =
        USubstitution.candidates(parse("u * x * exp(x^2)"), x, 100,
            Deadline.NONE);
    assertThat(candidates, not(empty()));
    assertThat(candidates.get(0).u, hasToString("u1"));
  }

  @Test void testIntegrate() {
    check("sin(x)^3 * cos(x)");
    check("exp(sin(x)) * cos(x)");
    check("x^2 * sqrt(x^3 + 1)");
    check("ln(x)^3 / x");
    check("cos(x^2) * x");
    check("exp(x) / (1 + exp(x))");
    check("x^5 * cos(x^2)");
    check("exp(1 / x) / x^2");
  }
}

// End USubstitutionTest.java
