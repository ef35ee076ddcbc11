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

import static net.hydromatic.integral.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.parse.ExprParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link Tracers}. */
public class TracersTest {
  private final Expr.Sym x = expr.sym("x");

  @Test void testPrintTo() {
    final StringWriter sw = new StringWriter();
    final Integrator integrator =
        Integrator.builder()
            .withTracer(Tracers.printTo(new PrintWriter(sw)))
            .build();
    integrator.integrate(ExprParser.parse("x^2"), x);
    final String s = sw.toString();
    assertThat(s, containsString("TABLE x^2 -> FOUND"));
    assertThat(s, containsString("result x^2 dx = "));
    // strategies that do not apply are not printed
    assertThat(s, not(containsString("NOT_APPLICABLE")));
  }

  /** Nested requests are indented. */
  @Test void testPrintNested() {
    final StringWriter sw = new StringWriter();
    final Integrator integrator =
        Integrator.builder()
            .withTracer(Tracers.printTo(new PrintWriter(sw)))
            .build();
    integrator.integrate(ExprParser.parse("x^2 + sin(x)"), x);
    assertThat(sw.toString(), containsString("\n  result "));
  }

  @Test void testOnResult() {
    final List<Expr> results = new ArrayList<>();
    final Integrator integrator =
        Integrator.builder()
            .withTracer(Tracers.withOnResult(Tracers.empty(), results::add))
            .build();
    final Expr e = integrator.integrate(ExprParser.parse("x^2 + sin(x)"), x);
    // only the top-level result is reported
    assertThat(results, hasSize(1));
    assertThat(results.get(0), is(e));
  }

  @Test void testOnOutcomeFiltersKind() {
    final List<StrategyOutcome> outcomes = new ArrayList<>();
    final Integrator integrator =
        Integrator.builder()
            .withTracer(
                Tracers.withOnOutcome(Tracers.empty(), StrategyKind.FALLBACK,
                    outcomes::add))
            .build();
    integrator.integrate(ExprParser.parse("x^2"), x);
    assertThat(outcomes, hasSize(0));
    integrator.integrate(ExprParser.parse("sin(sin(x))"), x);
    assertThat(outcomes, hasSize(1));
    assertThat(outcomes.get(0).kind, is(StrategyOutcome.Kind.FOUND));
  }
}

// End TracersTest.java
