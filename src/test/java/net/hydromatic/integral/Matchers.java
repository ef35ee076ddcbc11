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
package net.hydromatic.integral;

import net.hydromatic.integral.algebra.ZeroTester;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.calculus.Differentiator;
import net.hydromatic.integral.integrate.Integrator;
import net.hydromatic.integral.parse.ExprParser;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in integration tests. */
public abstract class Matchers {
  private Matchers() {}

  /**
   * Matches an expression that is free of unevaluated integrals and whose
   * derivative with respect to {@code x} is equal to {@code f}.
   */
  public static Matcher<Expr> isAntiderivativeOf(Expr f, Expr.Sym x) {
    return new TypeSafeMatcher<Expr>() {
      @Override protected boolean matchesSafely(Expr e) {
        if (!Integrator.isClosed(e)) {
          return false;
        }
        final Expr derivative = Differentiator.derivative(e, x);
        return ZeroTester.testEqual(derivative, f) == ZeroTester.Result.ZERO;
      }

      @Override public void describeTo(Description description) {
        description.appendText("antiderivative of " + f + " with respect to "
            + x);
      }

      @Override protected void describeMismatchSafely(Expr e,
          Description description) {
        description.appendText("was " + e);
        if (Integrator.isClosed(e)) {
          description.appendText(", whose derivative is "
              + Differentiator.derivative(e, x));
        }
      }
    };
  }

  /** As {@link #isAntiderivativeOf(Expr, Expr.Sym)}, parsing the integrand. */
  public static Matcher<Expr> isAntiderivativeOf(String f, Expr.Sym x) {
    return isAntiderivativeOf(ExprParser.parse(f), x);
  }

  /** Matches an unevaluated indefinite integral with respect to {@code x}. */
  public static Matcher<Expr> isUnevaluated(Expr.Sym x) {
    return new CustomTypeSafeMatcher<Expr>("unevaluated integral over " + x) {
      @Override protected boolean matchesSafely(Expr e) {
        return Integrator.isUnevaluated(e, x);
      }
    };
  }

  /** Matches an expression that is zero at every sample point. */
  public static Matcher<Expr> isZero() {
    return new CustomTypeSafeMatcher<Expr>("zero") {
      @Override protected boolean matchesSafely(Expr e) {
        return ZeroTester.test(e) == ZeroTester.Result.ZERO;
      }
    };
  }

  /** Matches an expression equal to another at every sample point. */
  public static Matcher<Expr> isEquivalentTo(String expected) {
    final Expr e1 = ExprParser.parse(expected);
    return new CustomTypeSafeMatcher<Expr>("equivalent to " + e1) {
      @Override protected boolean matchesSafely(Expr e) {
        return ZeroTester.testEqual(e, e1) == ZeroTester.Result.ZERO;
      }
    };
  }
}

// End Matchers.java
