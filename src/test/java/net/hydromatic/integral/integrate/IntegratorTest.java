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
import static net.hydromatic.integral.Matchers.isUnevaluated;
import static net.hydromatic.integral.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeout;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.function.FunctionRegistry;
import net.hydromatic.integral.parse.ExprParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link Integrator}. */
public class IntegratorTest {
  private final Expr.Sym x = expr.sym("x");
  private final Integrator integrator = Integrator.create();

  private Expr integrate(String s) {
    return integrator.integrate(ExprParser.parse(s), x);
  }

  /** Checks that an integrand has a closed-form antiderivative. */
  private void checkClosed(String s) {
    assertThat(s, integrate(s), isAntiderivativeOf(s, x));
  }

  /** Checks that an integrand is returned as an unevaluated integral. */
  private void checkUnevaluated(String s) {
    assertThat(s, integrate(s), isUnevaluated(x));
  }

  /** Returns a tracer that records the kind of every strategy that finds
   * an antiderivative. */
  private static Tracer recordFound(List<StrategyKind> list) {
    Tracer tracer = Tracers.empty();
    for (StrategyKind kind : StrategyKind.values()) {
      tracer = Tracers.withOnOutcome(tracer, kind, outcome -> {
        if (outcome.kind == StrategyOutcome.Kind.FOUND) {
          list.add(kind);
        }
      });
    }
    return tracer;
  }

  @Test void testPolynomial() {
    assertThat(integrate("x^3"),
        is(Simplifier.simplify(ExprParser.parse("x^4 / 4"))));
    checkClosed("3 * x^2 + 2 * x + 1");
    checkClosed("(x + 1)^5");
    checkClosed("7");
    checkClosed("a * x");
  }

  @Test void testRational() {
    checkClosed("1 / (x^2 - 1)");
    checkClosed("1 / (x^3 - x)");
    checkClosed("(x^3 + 1) / (x^2 + x)");
    checkClosed("1 / (x^2 + 2 * x + 5)");
    checkClosed("x / (x^2 + 1)^2");
    checkClosed("1 / (x^4 + 4)");
  }

  @Test void testExponentialAndLogarithm() {
    checkClosed("2 * x * exp(x^2)");
    checkClosed("x * ln(x)");
    checkClosed("ln(x)");
    checkClosed("x^2 * exp(3 * x)");
    checkClosed("exp(x) * sin(x)");
    checkClosed("1 / (x * ln(x))");
    checkClosed("2^x");
    checkClosed("exp(x) / (exp(2 * x) + 1)");
    checkClosed("exp(x) / (exp(3 * x) + 1)");
  }

  @Test void testTrigonometric() {
    checkClosed("sin(x)^3 * cos(x)");
    checkClosed("sin(x)^2 * cos(x)^2");
    checkClosed("sin(2 * x) * cos(3 * x)");
    checkClosed("tan(x)^3");
    checkClosed("sec(x)^3");
    checkClosed("x * cos(x)");
  }

  @Test void testSubstitution() {
    checkClosed("cos(x^2) * x");
    checkClosed("exp(sin(x)) * cos(x)");
    checkClosed("x^2 * sqrt(x^3 + 1)");
    checkClosed("ln(x)^3 / x");
  }

  @Test void testLinearity() {
    checkClosed("x^2 + sin(x) + exp(x)");
    checkClosed("(x + 1) * (x + exp(x))");
  }

  /** Integrands with no elementary antiderivative. */
  @Test void testNonElementary() {
    checkUnevaluated("exp(x^2)");
    checkUnevaluated("sin(x) / x");
    checkUnevaluated("exp(x) / x");
    checkUnevaluated("1 / ln(x)");
    checkUnevaluated("sin(sin(x))");
  }

  /** Risch proves that exp(x^2) has no elementary antiderivative. */
  @Test void testProvenNonElementary() {
    final List<StrategyOutcome> outcomes = new ArrayList<>();
    final Integrator integrator =
        Integrator.builder()
            .withTracer(
                Tracers.withOnOutcome(Tracers.empty(), StrategyKind.RISCH,
                    outcomes::add))
            .build();
    final Expr e = integrator.integrate(ExprParser.parse("exp(x^2)"), x);
    assertThat(e, isUnevaluated(x));
    assertThat(outcomes.get(outcomes.size() - 1).kind,
        is(StrategyOutcome.Kind.PROVEN_NON_ELEMENTARY));
  }

  /** Cheaper strategies are tried first. */
  @Test void testStrategyOrder() {
    final List<StrategyKind> found = new ArrayList<>();
    final Integrator integrator =
        Integrator.builder().withTracer(recordFound(found)).build();
    integrator.integrate(ExprParser.parse("x^3"), x);
    assertThat(found, is(ImmutableList.of(StrategyKind.TABLE)));

    found.clear();
    integrator.integrate(ExprParser.parse("1 / (x^3 - x)"), x);
    assertThat(found.get(0), is(StrategyKind.RATIONAL));

    final List<StrategyKind> kinds = new ArrayList<>();
    for (Strategy strategy : integrator.strategies()) {
      kinds.add(strategy.kind());
    }
    assertThat(kinds, is(ImmutableList.copyOf(StrategyKind.values())));
  }

  /** A strategy that throws is skipped, and the integrator carries on. */
  @Test void testNeverThrows() {
    final List<RuntimeException> exceptions = new ArrayList<>();
    final Strategy broken = new Strategy() {
      @Override public StrategyKind kind() {
        return StrategyKind.TABLE;
      }

      @Override public StrategyOutcome attempt(IntegrationRequest request,
          Integrator integrator) {
        throw new IllegalStateException("broken");
      }
    };
    final Integrator integrator =
        Integrator.builder()
            .withStrategies(ImmutableList.of(broken, new SymbolicFallback()))
            .withTracer(
                Tracers.withOnException(Tracers.empty(), exceptions::add))
            .build();
    assertThat(integrator.integrate(ExprParser.parse("x^2"), x),
        isUnevaluated(x));
    assertThat(exceptions, hasSize(1));
    assertThat(exceptions.get(0), instanceOf(IllegalStateException.class));
  }

  /** A wrong antiderivative is rejected unless verification is off. */
  @Test void testVerify() {
    final Strategy wrong = new Strategy() {
      @Override public StrategyKind kind() {
        return StrategyKind.TABLE;
      }

      @Override public StrategyOutcome attempt(IntegrationRequest request,
          Integrator integrator) {
        return StrategyOutcome.found(request.variable);
      }
    };
    final List<Expr> rejected = new ArrayList<>();
    final List<Strategy> strategies =
        ImmutableList.of(wrong, new SymbolicFallback());
    final Integrator integrator =
        Integrator.builder()
            .withStrategies(strategies)
            .withTracer(Tracers.withOnRejected(Tracers.empty(), rejected::add))
            .build();
    assertThat(integrator.integrate(ExprParser.parse("x^2"), x),
        isUnevaluated(x));
    assertThat(rejected, is(ImmutableList.<Expr>of(x)));

    final Integrator trusting =
        Integrator.builder()
            .withStrategies(strategies)
            .withProp(Prop.VERIFY_RESULTS, false)
            .build();
    assertThat(trusting.integrate(ExprParser.parse("x^2"), x), is(x));
  }

  @Test void testWithStrategiesRequiresFallback() {
    assertThrows(IllegalArgumentException.class, () ->
        Integrator.builder().withStrategies(ImmutableList.of(new Linearity())));
  }

  /** Integrating an unevaluated integral again gives the same integral. */
  @Test void testFallbackIdempotent() {
    final Expr e = integrate("exp(x^2)");
    assertThat(e, isUnevaluated(x));
    assertThat(integrator.integrate(e, x), is(e));
    final Expr e2 = integrate("sin(x) / x");
    assertThat(integrator.integrate(e2, x), is(e2));
  }

  @Test void testMaxDepth() {
    final List<IntegrationRequest> requests = new ArrayList<>();
    final Integrator shallow =
        Integrator.builder()
            .withProp(Prop.MAX_DEPTH, 0)
            .withTracer(
                Tracers.withOnDepthExceeded(Tracers.empty(), requests::add))
            .build();
    // The sum needs nested requests, one per term
    assertThat(shallow.integrate(ExprParser.parse("x + sin(x)"), x),
        isUnevaluated(x));
    assertThat(requests, not(empty()));
    assertThat(integrate("x + sin(x)"), isAntiderivativeOf("x + sin(x)", x));
  }

  /** Deeply nested integrands terminate within the time budget. */
  @Test void testDeepInputTerminates() {
    Expr e = x;
    for (int i = 0; i < 40; i++) {
      e = i % 2 == 0
          ? expr.add(expr.sin(expr.mul(expr.num(2), e)), x)
          : expr.mul(expr.exp(e), x);
    }
    final Expr f = e;
    final Integrator integrator =
        Integrator.builder().withProp(Prop.TIME_BUDGET_MILLIS, 2_000).build();
    final Expr result =
        assertTimeout(Duration.ofSeconds(60),
            () -> integrator.integrate(f, x));
    if (!Integrator.isClosed(result)) {
      assertThat(result, isUnevaluated(x));
    }
  }

  /** A deep input returns within a small time budget. */
  @Test void testDeepInputRespectsBudget() {
    Expr e = x;
    for (int i = 0; i < 300; i++) {
      e = expr.sin(expr.add(e, expr.one()));
    }
    final Expr f = e;
    final Integrator integrator =
        Integrator.builder().withProp(Prop.TIME_BUDGET_MILLIS, 1_000).build();
    final Expr result =
        assertTimeout(Duration.ofSeconds(20),
            () -> integrator.integrate(f, x));
    assertThat(result, isUnevaluated(x));
  }

  /** Every antiderivative that a strategy finds is correct, even when the
   * integrator does not verify it. Each strategy runs alone, then all run
   * together. */
  @Test void testStrategiesSoundWithoutVerification() {
    final List<String> integrands =
        ImmutableList.of("x^3",
            "1 / (x^2 - 1)",
            "2 * x * exp(x^2)",
            "x * ln(x)",
            "sin(x)^3 * cos(x)",
            "exp(x^2)",
            "sin(x) / x",
            "1 / x^3",
            "exp(x) / x^2 - exp(x) / x",
            "exp(1 / x) / x^2",
            "cos(1 / x) / x^2",
            "x^3 * exp(x^2)");
    final Strategy fallback = new SymbolicFallback();
    final Map<String, Integrator> integrators = new LinkedHashMap<>();
    for (Strategy strategy : integrator.strategies()) {
      if (strategy.kind() != StrategyKind.FALLBACK) {
        integrators.put(strategy.kind().name(),
            Integrator.builder()
                .withStrategies(ImmutableList.of(strategy, fallback))
                .withProp(Prop.VERIFY_RESULTS, false)
                .build());
      }
    }
    integrators.put("ALL",
        Integrator.builder().withProp(Prop.VERIFY_RESULTS, false).build());
    integrators.forEach((name, unverified) -> {
      for (String s : integrands) {
        final Expr e = unverified.integrate(ExprParser.parse(s), x);
        if (Integrator.isClosed(e)) {
          assertThat(name + ": " + s, e, isAntiderivativeOf(s, x));
        }
      }
    });
  }

  @Test void testDefinite() {
    assertThat(
        integrator.integrateDefinite(ExprParser.parse("x^2"), x, expr.zero(),
            expr.one()),
        is(expr.num(1, 3)));
    assertThat(
        integrator.integrateDefinite(ExprParser.parse("1 / x"), x,
            expr.one(), expr.exp(expr.one())),
        is(expr.one()));
    final Expr e =
        integrator.integrateDefinite(ExprParser.parse("exp(x^2)"), x,
            expr.zero(), expr.one());
    assertThat(e, instanceOf(Expr.Integral.class));
    assertThat(((Expr.Integral) e).isDefinite(), is(true));
  }

  /** A custom registry is consulted for function calls. */
  @Test void testRegistry() {
    final List<StrategyKind> found = new ArrayList<>();
    final Integrator integrator =
        Integrator.builder()
            .withTable(IntegrationTable.of(ImmutableList.of()))
            .withRegistry(
                FunctionRegistry.of(
                    ImmutableMap.of("cos", u -> expr.sin(u))))
            .withTracer(recordFound(found))
            .build();
    final Expr e = integrator.integrate(ExprParser.parse("3 * cos(2 * x)"), x);
    assertThat(e, isAntiderivativeOf("3 * cos(2 * x)", x));
    assertThat(found, hasItem(StrategyKind.REGISTRY));
  }

  /** A different variable treats x as a constant. */
  @Test void testOtherVariable() {
    final Expr.Sym y = expr.sym("y");
    final Expr e = integrator.integrate(ExprParser.parse("x * y^2"), y);
    assertThat(e, isAntiderivativeOf("x * y^2", y));
  }
}

// End IntegratorTest.java
