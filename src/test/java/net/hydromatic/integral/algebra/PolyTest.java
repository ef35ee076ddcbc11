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

import static net.hydromatic.integral.algebra.Rationals.Q;
import static net.hydromatic.integral.algebra.Rationals.poly;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.integral.util.BigRational;
import org.junit.jupiter.api.Test;

/** Tests for {@link Poly}, {@link RationalFunction}, {@link Factorizer}
 * and {@link LinearSystems}. */
public class PolyTest {
  private static BigRational q(long n) {
    return BigRational.of(n);
  }

  @Test void testArithmetic() {
    final Poly<BigRational> p = poly(-1, 0, 1); // t^2 - 1
    final Poly<BigRational> r = poly(-1, 1); // t - 1
    assertThat(p.degree(), is(2));
    assertThat(r.multiply(poly(1, 1)), is(p));
    assertThat(p.add(r), is(poly(-2, 1, 1)));
    assertThat(p.subtract(p).isZero(), is(true));
    assertThat(p.derivative(), is(poly(0, 2)));
    assertThat(p.evaluate(q(3)), is(q(8)));
    assertThat(r.pow(2), is(poly(1, -2, 1)));
    assertThat(r.shift(2), is(poly(0, 0, -1, 1)));
    assertThat(poly(2, 4).monic(), is(Poly.of(Q, BigRational.of(1, 2), q(1))));
    assertThat(poly(0, 0, 3, 1).lowestDegree(), is(2));
  }

  @Test void testDivide() {
    final Poly.DivisionResult<BigRational> d =
        poly(-1, 0, 1).divide(poly(-1, 1));
    assertThat(d.quotient, is(poly(1, 1)));
    assertThat(d.remainder.isZero(), is(true));
    final Poly.DivisionResult<BigRational> d2 =
        poly(1, 0, 1).divide(poly(-2, 1));
    assertThat(d2.quotient, is(poly(2, 1)));
    assertThat(d2.remainder, is(poly(5)));
    assertThat(poly(1, 0, 1).isDivisibleBy(poly(-2, 1)), is(false));
  }

  @Test void testGcd() {
    final Poly<BigRational> a = poly(-1, 0, 1);
    final Poly<BigRational> b = poly(1, 2, 1);
    assertThat(Poly.gcd(a, b), is(poly(1, 1)));
    final Poly.ExtendedGcd<BigRational> e = Poly.extendedGcd(a, b);
    assertThat(e.gcd, is(poly(1, 1)));
    assertThat(e.s.multiply(a).add(e.t.multiply(b)), is(e.gcd));

    // s (t - 1) + t' (t + 2) = 3, with deg s < 1
    final Poly.ExtendedGcd<BigRational> d =
        Poly.diophantine(poly(-1, 1), poly(2, 1), poly(3));
    assertThat(d.s.multiply(poly(-1, 1)).add(d.t.multiply(poly(2, 1))),
        is(poly(3)));
    assertThat(d.s.degree() < 1, is(true));
    assertThrows(ArithmeticException.class,
        () -> Poly.diophantine(poly(-1, 1), poly(1, -2, 1), poly(1)));
  }

  @Test void testSquarefree() {
    // (t - 1)^2 (t + 2)
    final Poly<BigRational> p = poly(-1, 1).pow(2).multiply(poly(2, 1));
    final List<Poly<BigRational>> factors = p.squarefree();
    assertThat(factors, hasSize(2));
    assertThat(factors.get(0), is(poly(2, 1)));
    assertThat(factors.get(1), is(poly(-1, 1)));
    assertThat(p.isSquarefree(), is(false));
    assertThat(poly(-1, 0, 1).isSquarefree(), is(true));
  }

  @Test void testResultant() {
    // Roots of t^2 + 1 are i and -i; (i - 2)(-i - 2) = 5
    assertThat(Poly.resultant(poly(1, 0, 1), poly(-2, 1)), is(q(5)));
    assertThat(Poly.resultant(poly(-1, 0, 1), poly(-1, 1)), is(q(0)));
  }

  @Test void testInterpolate() {
    final Poly<BigRational> p =
        Poly.interpolate(Q, ImmutableList.of(q(0), q(1), q(2)),
            ImmutableList.of(q(1), q(2), q(5)));
    assertThat(p, is(poly(1, 0, 1)));
  }

  @Test void testRationalFunction() {
    final RationalFunction<BigRational> f =
        RationalFunction.of(poly(-1, 0, 1), poly(-2, 2));
    assertThat(f.isPolynomial(), is(true));
    assertThat(f.numerator, is(poly(1, 1).scale(BigRational.of(1, 2))));
    final RationalFunction<BigRational> g =
        RationalFunction.of(poly(1), poly(0, 1));
    assertThat(g.add(g.negate()).isZero(), is(true));
    assertThat(g.multiply(RationalFunction.of(poly(0, 1))).isConstant(),
        is(true));
    assertThrows(ArithmeticException.class,
        () -> RationalFunction.of(poly(1), poly()));
  }

  @Test void testRationalRoots() {
    assertThat(Rationals.rationalRoots(poly(1, -3, 2)),
        is(ImmutableList.of(BigRational.of(1, 2), q(1))));
    assertThat(Rationals.rationalRoots(poly(-2, 0, 1)), hasSize(0));
    assertThat(Rationals.rationalRoots(poly(0, 0, -1, 1)),
        is(ImmutableList.of(q(0), q(1))));
  }

  @Test void testFactor() {
    final Factorizer.Factorization f = Factorizer.factor(poly(-1, 0, 0, 0, 1));
    assertThat(f.isComplete(), is(true));
    assertThat(f.factors, hasSize(3));
    assertThat(f.factors.get(0).kind, is(Factorizer.Kind.LINEAR));
    assertThat(f.factors.get(1).kind, is(Factorizer.Kind.LINEAR));
    assertThat(f.factors.get(2).poly, is(poly(1, 0, 1)));

    // t^4 + 4 = (t^2 - 2t + 2) (t^2 + 2t + 2)
    final Factorizer.Factorization f2 = Factorizer.factor(poly(4, 0, 0, 0, 1));
    assertThat(f2.isComplete(), is(true));
    assertThat(f2.factors.get(0).poly, is(poly(2, -2, 1)));
    assertThat(f2.factors.get(1).poly, is(poly(2, 2, 1)));

    final Factorizer.Factorization f3 = Factorizer.factor(poly(-2, 0, 0, 1));
    assertThat(f3.isComplete(), is(false));

    // 3 (t - 1)^2
    final Factorizer.Factorization f4 = Factorizer.factor(poly(3, -6, 3));
    assertThat(f4.unit, is(q(3)));
    assertThat(f4.factors.get(0).multiplicity, is(2));
  }

  @Test void testLinearSystem() {
    // 2a + b = 3, a - b = 0
    final List<BigRational> solution =
        LinearSystems.solve(Q,
            ImmutableList.of(ImmutableList.of(q(2), q(1)),
                ImmutableList.of(q(1), q(-1))),
            ImmutableList.of(q(3), q(0)), 2);
    assertThat(solution, is(ImmutableList.of(q(1), q(1))));
    // a + b = 1, 2a + 2b = 3
    assertThat(
        LinearSystems.solve(Q,
            ImmutableList.of(ImmutableList.of(q(1), q(1)),
                ImmutableList.of(q(2), q(2))),
            ImmutableList.of(q(1), q(3)), 2),
        nullValue());
  }
}

// End PolyTest.java
