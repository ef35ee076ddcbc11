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
package net.hydromatic.integral.parse;

import static net.hydromatic.integral.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.function.BuiltIn;
import org.junit.jupiter.api.Test;

/** Tests for {@link ExprParser}. */
public class ExprParserTest {
  private static void checkRoundTrip(String s) {
    assertThat(ExprParser.parse(s), hasToString(s));
  }

  private static ExprParseException parseError(String s) {
    return assertThrows(ExprParseException.class, () -> ExprParser.parse(s));
  }

  @Test void testUnparse() {
    checkRoundTrip("x");
    checkRoundTrip("x^2");
    checkRoundTrip("sin(x)");
    checkRoundTrip("x + 1");
    checkRoundTrip("exp(2 * x)");
  }

  @Test void testPrecedence() {
    final Expr e = ExprParser.parse("1 + 2 * x^2");
    assertThat(e, instanceOf(Expr.Add.class));
    final Expr product = ((Expr.Add) e).terms.get(1);
    assertThat(product, instanceOf(Expr.Mul.class));
    assertThat(((Expr.Mul) product).factors.get(1),
        is(expr.pow(expr.sym("x"), 2)));
    // "^" is right-associative, and binds tighter than unary minus
    assertThat(ExprParser.parse("2^3^2"),
        is(expr.pow(expr.num(2), expr.pow(expr.num(3), expr.num(2)))));
    assertThat(ExprParser.parse("-x^2"),
        is(expr.neg(expr.pow(expr.sym("x"), 2))));
  }

  @Test void testAtoms() {
    assertThat(ExprParser.parse("1.25"), is(expr.num(5, 4)));
    assertThat(ExprParser.parse("-3"), is(expr.num(-3)));
    assertThat(ExprParser.parse("e"), is(expr.exp(expr.one())));
    assertThat(ExprParser.parse("cosh(y)"),
        is(expr.call(BuiltIn.COSH, expr.sym("y"))));
  }

  @Test void testIntegral() {
    final Expr e = ExprParser.parse("integral(x^2, x, 0, 1)");
    assertThat(e, instanceOf(Expr.Integral.class));
    assertThat(((Expr.Integral) e).isDefinite(), is(true));
    assertThat(((Expr.Integral) ExprParser.parse("integral(x, x)"))
        .isDefinite(), is(false));
  }

  @Test void testErrors() {
    ExprParseException e = parseError("x +");
    assertThat(e.getMessage(), is("unexpected end of input"));
    assertThat(e.pos(), is(3));

    e = parseError("foo(x)");
    assertThat(e.getMessage(), is("unknown function 'foo'"));
    assertThat(e.pos(), is(0));

    e = parseError("(x + 1");
    assertThat(e.getMessage(), is("expected ')'"));

    e = parseError("x $ 1");
    assertThat(e.getMessage(), is("unexpected '$'"));
    assertThat(e.pos(), is(2));

    e = parseError("sin(x, y)");
    assertThat(e.getMessage(), containsString("requires 1 argument"));

    e = parseError("integral(x, 2)");
    assertThat(e.getMessage(),
        is("integration variable must be a name"));

    final String description =
        parseError("1 + )").describeTo(new StringBuilder()).toString();
    assertThat(description, is("Error: unexpected ')'\n1 + )\n    ^"));
  }
}

// End ExprParserTest.java
