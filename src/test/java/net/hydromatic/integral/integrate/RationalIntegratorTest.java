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
import static net.hydromatic.integral.algebra.Rationals.poly;
import static net.hydromatic.integral.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

import net.hydromatic.integral.algebra.Polynomials;
import net.hydromatic.integral.algebra.RationalFunction;
import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.parse.ExprParser;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link RationalIntegrator} and
 * {@link PartialFractionDecomposition}. */
public class RationalIntegratorTest {
  private final Expr.Sym x = expr.sym("x");

  private @Nullable PartialFractionDecomposition decompose(String s) {
    final RationalFunction<BigRational> f =
        Polynomials.toRationalFunction(
            Simplifier.simplify(ExprParser.parse(s)), x);
    assertThat(f, notNullValue());
    return PartialFractionDecomposition.decompose(f);
  }

  private @Nullable Expr integrate(String s) {
    return RationalIntegrator.integrate(
        Simplifier.simplify(ExprParser.parse(s)), x);
  }

  @Test void testDecomposeLinear() {
    final PartialFractionDecomposition pfd = decompose("1 / (x^2 - 1)");
    assertThat(pfd, notNullValue());
    assertThat(pfd.polynomial.isZero(), is(true));
    assertThat(pfd.quadraticTerms, hasSize(0));
    assertThat(pfd.linearTerms, hasSize(2));
    // 1 / (x^2 - 1) = (1/2) / (x - 1) - (1/2) / (x + 1)
    for (PartialFractionDecomposition.LinearTerm term : pfd.linearTerms) {
      assertThat(term.multiplicity, is(1));
      assertThat(term.coefficient,
          is(term.root.signum() > 0 ? BigRational.HALF
              : BigRational.HALF.negate()));
    }
  }

  @Test void testDecomposeRepeated() {
    // x / (x - 1)^2 = 1 / (x - 1) + 1 / (x - 1)^2
    final PartialFractionDecomposition pfd = decompose("x / (x - 1)^2");
    assertThat(pfd, notNullValue());
    assertThat(pfd.linearTerms, hasSize(2));
    for (PartialFractionDecomposition.LinearTerm term : pfd.linearTerms) {
      assertThat(term.root, is(BigRational.ONE));
      assertThat(term.coefficient, is(BigRational.ONE));
    }
  }

  @Test void testDecomposeQuadratic() {
    final PartialFractionDecomposition pfd = decompose("x^3 / (x^2 + 1)");
    assertThat(pfd, notNullValue());
    assertThat(pfd.polynomial, is(poly(0, 1)));
    assertThat(pfd.linearTerms, hasSize(0));
    assertThat(pfd.quadraticTerms, hasSize(1));
    assertThat(pfd.quadraticTerms.get(0).numerator, is(poly(0, -1)));
    assertThat(pfd.quadraticTerms.get(0).quadratic, is(poly(1, 0, 1)));
  }

  /** x^3 - 2 has an irreducible cubic factor. */
  @Test void testIrreducibleCubic() {
    assertThat(decompose("1 / (x^3 - 2)"), nullValue());
    assertThat(integrate("1 / (x^3 - 2)"), nullValue());
  }

  @Test void testNotRational() {
    assertThat(integrate("sin(x) / x"), nullValue());
    assertThat(integrate("sqrt(x)"), nullValue());
  }

  @Test void testIntegrate() {
    for (String s
        : new String[] {"x^2 + 1", "1 / (x - 3)", "1 / (x - 3)^4",
            "(2 * x + 1) / (x^2 + x + 1)", "1 / (x^2 + 1)^3",
            "(x^4 + 1) / (x^2 * (x^2 + 4))", "1 / (x^4 + 4)"}) {
      final Expr e = integrate(s);
      assertThat(s, e, notNullValue());
      assertThat(s, Simplifier.simplify(e), isAntiderivativeOf(s, x));
    }
  }
}

// End RationalIntegratorTest.java
