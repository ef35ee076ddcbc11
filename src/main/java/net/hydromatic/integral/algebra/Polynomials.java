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
import static net.hydromatic.integral.ast.ExprBuilder.expr;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Conversions between expressions and polynomials or rational functions in
 * one variable.
 */
public class Polynomials {
  private Polynomials() {}

  /** Largest exponent converted to a polynomial power. */
  private static final int MAX_DEGREE = 64;

  /**
   * Converts an expression to a polynomial in {@code x} with rational
   * coefficients, or returns null if it is not one.
   */
  public static @Nullable Poly<BigRational> toPoly(Expr e, Expr.Sym x) {
    final @Nullable RationalFunction<BigRational> f =
        toRationalFunction(e, x);
    return f != null && f.isPolynomial() ? f.numerator : null;
  }

  /**
   * Converts an expression to a rational function in {@code x} with
   * rational coefficients, or returns null if it is not one.
   */
  public static @Nullable RationalFunction<BigRational> toRationalFunction(
      Expr e, Expr.Sym x) {
    switch (e.op) {
      case NUM:
        return RationalFunction.constant(Q, ((Expr.Num) e).value);
      case SYM:
        return e.equals(x) ? RationalFunction.of(Poly.t(Q)) : null;
      case ADD:
        RationalFunction<BigRational> sum =
            RationalFunction.constant(Q, BigRational.ZERO);
        for (Expr term : ((Expr.Add) e).terms) {
          final @Nullable RationalFunction<BigRational> f =
              toRationalFunction(term, x);
          if (f == null) {
            return null;
          }
          sum = sum.add(f);
        }
        return sum;
      case MUL:
        RationalFunction<BigRational> product =
            RationalFunction.constant(Q, BigRational.ONE);
        for (Expr factor : ((Expr.Mul) e).factors) {
          final @Nullable RationalFunction<BigRational> f =
              toRationalFunction(factor, x);
          if (f == null) {
            return null;
          }
          product = product.multiply(f);
        }
        return product;
      case POW:
        final Expr.Pow pow = (Expr.Pow) e;
        if (!(pow.exponent instanceof Expr.Num)) {
          return null;
        }
        final BigRational n = ((Expr.Num) pow.exponent).value;
        if (!n.isSmallInteger() || Math.abs(n.intValueExact()) > MAX_DEGREE) {
          return null;
        }
        final @Nullable RationalFunction<BigRational> base =
            toRationalFunction(pow.base, x);
        if (base == null) {
          return null;
        }
        if (n.signum() < 0 && base.isZero()) {
          return null;
        }
        return power(base, n.intValueExact());
      default:
        return null;
    }
  }

  private static RationalFunction<BigRational> power(
      RationalFunction<BigRational> f, int n) {
    if (n < 0) {
      return power(RationalFunction.of(f.denominator, f.numerator), -n);
    }
    return RationalFunction.of(f.numerator.pow(n), f.denominator.pow(n));
  }

  /** Converts a polynomial in {@code x} to a simplified expression. */
  public static Expr fromPoly(Poly<BigRational> p, Expr.Sym x) {
    final List<Expr> terms = new ArrayList<>();
    for (int i = 0; i <= p.degree(); i++) {
      final BigRational c = p.coefficient(i);
      if (!c.isZero()) {
        terms.add(expr.mul(expr.num(c), expr.pow(x, i)));
      }
    }
    return Simplifier.simplify(expr.add(terms));
  }

  /** Converts a rational function in {@code x} to a simplified expression. */
  public static Expr fromRationalFunction(
      RationalFunction<BigRational> f, Expr.Sym x) {
    if (f.isPolynomial()) {
      return fromPoly(f.numerator, x);
    }
    return Simplifier.simplify(
        expr.div(fromPoly(f.numerator, x), fromPoly(f.denominator, x)));
  }

  /**
   * Returns the coefficients of an expression that is a polynomial in
   * {@code x} whose coefficients are free of {@code x} but may contain
   * other symbols; lowest degree first. Returns null if the expression is
   * not such a polynomial.
   *
   * <p>For example, {@code a * x ^ 2 + b} gives {@code [b, 0, a]}.
   */
  public static @Nullable List<Expr> coefficients(Expr e, Expr.Sym x) {
    final List<List<Expr>> lists = new ArrayList<>();
    for (Expr term : Exprs.terms(Expander.expand(e))) {
      final Exprs.Split split = Exprs.split(term, x);
      final int degree;
      if (split.dependent.isNum(1)) {
        degree = 0;
      } else if (split.dependent.equals(x)) {
        degree = 1;
      } else if (split.dependent instanceof Expr.Pow
          && ((Expr.Pow) split.dependent).base.equals(x)
          && ((Expr.Pow) split.dependent).exponent instanceof Expr.Num) {
        final BigRational n =
            ((Expr.Num) ((Expr.Pow) split.dependent).exponent).value;
        if (!n.isSmallInteger() || n.signum() < 0
            || n.intValueExact() > MAX_DEGREE) {
          return null;
        }
        degree = n.intValueExact();
      } else {
        return null;
      }
      while (lists.size() <= degree) {
        lists.add(new ArrayList<>());
      }
      lists.get(degree).add(split.coefficient);
    }
    final List<Expr> coefficients = new ArrayList<>();
    for (List<Expr> list : lists) {
      coefficients.add(Simplifier.simplifyAdd(list));
    }
    if (coefficients.isEmpty()) {
      coefficients.add(expr.zero());
    }
    return coefficients;
  }
}

// End Polynomials.java
