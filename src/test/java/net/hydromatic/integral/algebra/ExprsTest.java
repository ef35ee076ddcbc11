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

import static net.hydromatic.integral.algebra.Rationals.poly;
import static net.hydromatic.integral.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import java.util.List;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.parse.ExprParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link Exprs}, {@link Replacer}, {@link Evaluator} and
 * {@link Polynomials}. */
public class ExprsTest {
  private final Expr.Sym x = expr.sym("x");
  private final Expr.Sym y = expr.sym("y");

  private static Expr parse(String s) {
    return Simplifier.simplify(ExprParser.parse(s));
  }

  @Test void testFreeOf() {
    assertThat(Exprs.freeOf(parse("y^2 + sin(y)"), x), is(true));
    assertThat(Exprs.freeOf(parse("y + sin(x)"), x), is(false));
    // the variable of an indefinite integral is not free
    assertThat(Exprs.freeOf(expr.integral(parse("x^2"), x), x), is(false));
    // a definite integral depends only on its bounds
    assertThat(
        Exprs.freeOf(
            expr.integral(parse("x^2"), x, expr.zero(), expr.one()), x),
        is(true));
  }

  @Test void testSymbols() {
    assertThat(Exprs.symbols(parse("y * sin(x) + a")), hasSize(3));
    assertThat(Exprs.freshSymbol(parse("x + u"), "u"), hasToString("u1"));
    assertThat(Exprs.freshSymbol(parse("x"), "u"), hasToString("u"));
  }

  @Test void testSplit() {
    final Exprs.Split split = Exprs.split(parse("3 * y * x^2 * sin(x)"), x);
    assertThat(split.coefficient, is(parse("3 * y")));
    assertThat(split.dependent, is(parse("x^2 * sin(x)")));
    final Exprs.Split split2 = Exprs.split(parse("5 * y"), x);
    assertThat(split2.dependent, is(expr.one()));
  }

  @Test void testLinear() {
    final Exprs.Linear linear = Exprs.linear(parse("3 * x + 2"), x);
    assertThat(linear, notNullValue());
    assertThat(linear.a, is(expr.num(3)));
    assertThat(linear.b, is(expr.num(2)));
    assertThat(Exprs.linear(x, x).isIdentity(), is(true));
    assertThat(Exprs.linear(parse("2 * (x + y)"), x).b, is(parse("2 * y")));
    assertThat(Exprs.linear(parse("x^2"), x), nullValue());
    assertThat(Exprs.linear(parse("y"), x), nullValue());
  }

  @Test void testReplace() {
    final Expr e = parse("sin(x) + x^2");
    assertThat(Simplifier.simplify(Replacer.replace(e, x, y)),
        is(parse("sin(y) + y^2")));
    assertThat(Replacer.substitute(e, x, expr.num(0)), is(expr.num(0)));
    assertThat(Simplifier.simplify(Replacer.replace(e, expr.sin(x), y)),
        is(parse("y + x^2")));
  }

  @Test void testEvaluate() {
    assertThat(Evaluator.evaluate(parse("x^2 + 1"), x, 2d), closeTo(5d, 1e-12));
    assertThat(Evaluator.evaluate(parse("ln(abs(x))"), x, -Math.E),
        closeTo(1d, 1e-12));
    assertThat(Evaluator.evaluate(parse("x^(1/3)"), x, -8d),
        closeTo(-2d, 1e-12));
    assertThat(Evaluator.evaluate(parse("sin(pi * x)"), x, 0.5d),
        closeTo(1d, 1e-12));
  }

  @Test void testPolynomials() {
    assertThat(Polynomials.toPoly(parse("(x + 1)^2"), x),
        is(poly(1, 2, 1)));
    assertThat(Polynomials.toPoly(parse("sin(x)"), x), nullValue());
    assertThat(Polynomials.toPoly(parse("1 / x"), x), nullValue());
    assertThat(
        Polynomials.toRationalFunction(parse("(x^2 - 1) / (x - 1)"), x)
            .isPolynomial(),
        is(true));
    assertThat(Polynomials.fromPoly(poly(1, 0, 1), x), is(parse("x^2 + 1")));

    final List<Expr> coefficients =
        Polynomials.coefficients(parse("y * x^2 + 3"), x);
    assertThat(coefficients, notNullValue());
    assertThat(coefficients, hasSize(3));
    assertThat(coefficients.get(0), is(expr.num(3)));
    assertThat(coefficients.get(2), is(y));
  }
}

// End ExprsTest.java
