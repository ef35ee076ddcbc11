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
package net.hydromatic.integral.integrate.risch;

import static net.hydromatic.integral.Matchers.isEquivalentTo;
import static net.hydromatic.integral.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.parse.ExprParser;
import net.hydromatic.integral.util.BigRational;
import net.hydromatic.integral.util.Deadline;
import org.junit.jupiter.api.Test;

/** Tests for {@link TowerBuilder} and {@link ExtensionTower}. */
public class TowerBuilderTest {
  private final Expr.Sym x = expr.sym("x");

  private TowerBuilder builder() {
    return new TowerBuilder(x, 8, Deadline.NONE);
  }

  private static Expr parse(String s) {
    return Simplifier.simplify(ExprParser.parse(s));
  }

  @Test void testVariable() {
    final TowerBuilder b = builder();
    final TowerElement e = b.convert(parse("x^2 + 1 / x"));
    assertThat(e.level, is(0));
    assertThat(b.tower().height(), is(0));
    assertThat(b.convert(parse("3 / 4")),
        is(TowerElement.of(BigRational.of(3, 4))));
    assertThat(b.tower().derivative(b.tower().generator(0)).isConstant(),
        is(true));
  }

  @Test void testExponential() {
    final TowerBuilder b = builder();
    final TowerElement t = b.convert(parse("exp(x)"));
    assertThat(t.level, is(1));
    assertThat(b.tower().level(1).kind, is(TowerLevel.Kind.EXPONENTIAL));
    // exp(2 x) = exp(x) ^ 2 adds no level
    final TowerElement t2 = b.convert(parse("exp(2 * x)"));
    assertThat(t2, is(TowerField.INSTANCE.power(t, 2)));
    assertThat(b.convert(parse("exp(-x)")),
        is(TowerField.INSTANCE.power(t, -1)));
    assertThat(b.tower().height(), is(1));
    // D(exp(x)) = exp(x)
    assertThat(b.tower().derivative(t), is(t));
  }

  /** Exponentials share a level built on the greatest common divisor of
   * their arguments, whichever is met first. */
  @Test void testPrepare() {
    final TowerField f = TowerField.INSTANCE;
    final TowerBuilder b = builder();
    final Expr e = parse("exp(2 * x) + exp(3 * x)");
    b.prepare(e);
    assertThat(b.tower().height(), is(1));
    assertThat(b.tower().level(1).generator, is(parse("exp(x)")));
    final TowerElement t = b.tower().generator(1);
    assertThat(b.convert(e), is(f.add(f.power(t, 2), f.power(t, 3))));

    // Arguments that are not rational functions are left to convert
    final TowerBuilder b2 = builder();
    b2.prepare(parse("exp(sin(x)) + exp(a * x)"));
    assertThat(b2.tower().height(), is(0));
  }

  @Test void testGcd() {
    assertThat(TowerBuilder.gcd(BigRational.ONE, BigRational.of(3, 2)),
        is(BigRational.of(1, 2)));
    assertThat(
        TowerBuilder.gcd(BigRational.of(2, 3), BigRational.of(-4, 9)),
        is(BigRational.of(2, 9)));
  }

  @Test void testLogarithm() {
    final TowerBuilder b = builder();
    final TowerElement t = b.convert(parse("ln(x)"));
    assertThat(t.level, is(1));
    assertThat(b.tower().level(1).kind, is(TowerLevel.Kind.LOGARITHMIC));
    // ln(x^2) = 2 ln(x), and ln(abs(x)) = ln(x)
    assertThat(b.convert(parse("ln(x^2)")),
        is(TowerField.INSTANCE.multiply(TowerElement.of(BigRational.of(2)),
            t)));
    assertThat(b.convert(parse("ln(abs(x))")), is(t));
    // ln(x exp(x)) = ln(x) + x
    assertThat(b.convert(parse("ln(x * exp(x))")),
        is(TowerField.INSTANCE.add(t, b.convert(x))));
    assertThat(b.tower().height(), is(1));
  }

  @Test void testNested() {
    final TowerBuilder b = builder();
    final TowerElement e = b.convert(parse("exp(exp(x)) * ln(ln(x))"));
    assertThat(b.tower().levels(), hasSize(5));
    assertThat(e.level, is(4));
    assertThat(b.convert(expr.exp(expr.ln(x))), is(b.tower().generator(0)));
  }

  @Test void testUnsupported() {
    for (String s
        : ImmutableList.of("sin(x)", "sqrt(x)", "y * x", "ln(2)",
            "x^100")) {
      assertThrows(TowerBuilder.UnsupportedExtensionException.class,
          () -> builder().convert(parse(s)), s);
    }
    // exp(x + 1) is e exp(x), and e is not rational
    final TowerBuilder b0 = builder();
    b0.convert(parse("exp(x)"));
    assertThrows(TowerBuilder.UnsupportedExtensionException.class,
        () -> b0.convert(parse("exp(x + 1)")));

    // ln(2 x) and ln(x) differ by a constant, so they cannot both be
    // generators
    final TowerBuilder b = builder();
    b.convert(parse("ln(2 * x)"));
    assertThrows(TowerBuilder.UnsupportedExtensionException.class,
        () -> b.convert(parse("ln(x)")));
  }

  @Test void testMaxLevels() {
    final TowerBuilder b = new TowerBuilder(x, 1, Deadline.NONE);
    b.convert(parse("exp(x)"));
    assertThrows(TowerBuilder.UnsupportedExtensionException.class,
        () -> b.convert(parse("ln(x)")));
  }

  @Test void testSpan() {
    final TowerBuilder b = builder();
    final TowerElement one = TowerElement.of(BigRational.ONE);
    final TowerElement t = b.convert(x);
    final TowerElement target = b.convert(parse("3 + 2 * x"));
    assertThat(TowerBuilder.span(ImmutableList.of(one, t), target),
        is(ImmutableList.of(BigRational.of(3), BigRational.of(2))));
    assertThat(TowerBuilder.span(ImmutableList.of(one, t),
        b.convert(parse("x^2"))), nullValue());
  }

  @Test void testToExpr() {
    final TowerBuilder b = builder();
    final Expr e = parse("x * exp(x) + ln(x) / x");
    assertThat(b.tower().toExpr(b.convert(e)),
        isEquivalentTo("x * exp(x) + ln(x) / x"));
  }
}

// End TowerBuilderTest.java
