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
package net.hydromatic.integral.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.integral.function.BuiltIn;
import net.hydromatic.integral.util.BigRational;

/**
 * Builds expressions.
 *
 * <p>The builder does not simplify; {@code add(x, x)} is a sum of two terms.
 * It does collapse sums and products of zero or one operands.
 */
public enum ExprBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  expr;

  private final Expr.Num zero = new Expr.Num(BigRational.ZERO);
  private final Expr.Num one = new Expr.Num(BigRational.ONE);
  private final Expr.Num minusOne = new Expr.Num(BigRational.MINUS_ONE);
  private final Expr.Num half = new Expr.Num(BigRational.HALF);

  public Expr.Num zero() {
    return zero;
  }

  public Expr.Num one() {
    return one;
  }

  public Expr.Num num(BigRational value) {
    if (value.isZero()) {
      return zero;
    }
    if (value.isOne()) {
      return one;
    }
    if (value.equals(BigRational.MINUS_ONE)) {
      return minusOne;
    }
    if (value.equals(BigRational.HALF)) {
      return half;
    }
    return new Expr.Num(value);
  }

  public Expr.Num num(long value) {
    return num(BigRational.of(value));
  }

  public Expr.Num num(long numerator, long denominator) {
    return num(BigRational.of(numerator, denominator));
  }

  public Expr.Sym sym(String name) {
    return new Expr.Sym(name);
  }

  public Expr add(Expr... terms) {
    return add(ImmutableList.copyOf(terms));
  }

  public Expr add(List<? extends Expr> terms) {
    switch (terms.size()) {
      case 0:
        return zero;
      case 1:
        return terms.get(0);
      default:
        return new Expr.Add(ImmutableList.copyOf(terms));
    }
  }

  public Expr mul(Expr... factors) {
    return mul(ImmutableList.copyOf(factors));
  }

  public Expr mul(List<? extends Expr> factors) {
    switch (factors.size()) {
      case 0:
        return one;
      case 1:
        return factors.get(0);
      default:
        return new Expr.Mul(ImmutableList.copyOf(factors));
    }
  }

  public Expr mul(BigRational coefficient, Expr e) {
    return mul(num(coefficient), e);
  }

  public Expr neg(Expr e) {
    return mul(minusOne, e);
  }

  public Expr sub(Expr a, Expr b) {
    return add(a, neg(b));
  }

  public Expr div(Expr a, Expr b) {
    return mul(a, pow(b, minusOne));
  }

  public Expr reciprocal(Expr e) {
    return pow(e, minusOne);
  }

  public Expr pow(Expr base, Expr exponent) {
    return new Expr.Pow(base, exponent);
  }

  public Expr pow(Expr base, long exponent) {
    return pow(base, num(exponent));
  }

  public Expr pow(Expr base, BigRational exponent) {
    return pow(base, num(exponent));
  }

  public Expr sqrt(Expr e) {
    return pow(e, half);
  }

  public Expr.Call call(BuiltIn fn, Expr arg) {
    return new Expr.Call(fn, arg);
  }

  public Expr exp(Expr e) {
    return call(BuiltIn.EXP, e);
  }

  public Expr ln(Expr e) {
    return call(BuiltIn.LN, e);
  }

  /** Creates "ln(abs(e))", the logarithm that appears in antiderivatives. */
  public Expr lnAbs(Expr e) {
    return call(BuiltIn.LN, call(BuiltIn.ABS, e));
  }

  public Expr sin(Expr e) {
    return call(BuiltIn.SIN, e);
  }

  public Expr cos(Expr e) {
    return call(BuiltIn.COS, e);
  }

  public Expr tan(Expr e) {
    return call(BuiltIn.TAN, e);
  }

  public Expr abs(Expr e) {
    return call(BuiltIn.ABS, e);
  }

  public Expr.Integral integral(Expr integrand, Expr.Sym variable) {
    return new Expr.Integral(integrand, variable, null, null);
  }

  public Expr.Integral integral(
      Expr integrand, Expr.Sym variable, Expr lower, Expr upper) {
    return new Expr.Integral(integrand, variable, lower, upper);
  }
}

// End ExprBuilder.java
