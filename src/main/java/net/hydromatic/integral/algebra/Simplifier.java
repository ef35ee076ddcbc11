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

import static net.hydromatic.integral.ast.ExprBuilder.expr;
import static net.hydromatic.integral.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.function.BuiltIn;
import net.hydromatic.integral.util.BigRational;

/**
 * Simplifier of expressions.
 *
 * <p>Converts an expression to a canonical form. Simplification is
 * idempotent: simplifying a simplified expression returns an equal
 * expression. Rules include:
 *
 * <ul>
 *   <li>{@code x + 2 * x} &rarr; {@code 3 * x} (collect like terms)
 *   <li>{@code x * x ^ 2} &rarr; {@code x ^ 3} (collect powers)
 *   <li>{@code 2 * (x + 1)} &rarr; {@code 2 * x + 2} (distribute a numeric
 *       coefficient over a sole sum)
 *   <li>{@code (x ^ 2) ^ 3} &rarr; {@code x ^ 6}
 *   <li>{@code (x ^ 2) ^ (1/2)} &rarr; {@code abs(x)}
 *   <li>{@code exp(x) * exp(2 * x)} &rarr; {@code exp(3 * x)}
 *   <li>{@code ln(exp(u))} &rarr; {@code u}, and the other identities in
 *       {@link BuiltIn#simplify(Expr)}
 * </ul>
 */
public class Simplifier {
  private Simplifier() {}

  /** Largest integer exponent to which a number is raised exactly. */
  private static final int MAX_NUMERIC_EXPONENT = 1000;

  /** Maximum number of passes when re-collecting the factors of a product. */
  private static final int MAX_PASSES = 4;

  /** Orders the terms of a sum by their non-numeric part. */
  private static final Ordering<Expr> TERM_ORDERING =
      Expr.ORDERING.onResultOf(e -> splitTerm(e).body);

  /** Simplifies an expression. */
  public static Expr simplify(Expr e) {
    switch (e.op) {
      case NUM:
      case SYM:
        return e;
      case ADD:
        return simplifyAdd(
            transformEager(((Expr.Add) e).terms, Simplifier::simplify));
      case MUL:
        return simplifyMul(
            transformEager(((Expr.Mul) e).factors, Simplifier::simplify));
      case POW:
        final Expr.Pow pow = (Expr.Pow) e;
        return simplifyPow(simplify(pow.base), simplify(pow.exponent));
      case CALL:
        final Expr.Call call = (Expr.Call) e;
        return simplifyCall(call.fn, simplify(call.arg));
      case INTEGRAL:
        final Expr.Integral integral = (Expr.Integral) e;
        if (integral.lower == null || integral.upper == null) {
          return expr.integral(simplify(integral.integrand), integral.variable);
        }
        return expr.integral(
            simplify(integral.integrand),
            integral.variable,
            simplify(integral.lower),
            simplify(integral.upper));
      default:
        throw new AssertionError(e.op);
    }
  }

  /** Simplifies a sum whose terms are already simplified. */
  static Expr simplifyAdd(List<Expr> terms) {
    final List<Expr> flat = new ArrayList<>();
    flatten(terms, Expr.Add.class, flat);
    BigRational constant = BigRational.ZERO;
    final Map<Expr, BigRational> coefficients = new LinkedHashMap<>();
    for (Expr term : flat) {
      if (term instanceof Expr.Num) {
        constant = constant.add(((Expr.Num) term).value);
        continue;
      }
      final Term t = splitTerm(term);
      coefficients.merge(t.body, t.coefficient, BigRational::add);
    }
    final List<Expr> list = new ArrayList<>();
    coefficients.forEach(
        (body, coefficient) -> {
          if (!coefficient.isZero()) {
            list.add(times(coefficient, body));
          }
        });
    list.sort(TERM_ORDERING);
    if (!constant.isZero()) {
      list.add(expr.num(constant));
    }
    return expr.add(list);
  }

  /** Simplifies a product whose factors are already simplified. */
  static Expr simplifyMul(List<Expr> factors) {
    List<Expr> list = factors;
    for (int pass = 0; ; pass++) {
      final List<Expr> flat = new ArrayList<>();
      flatten(list, Expr.Mul.class, flat);
      BigRational coefficient = BigRational.ONE;
      final Map<Expr, Expr> powers = new LinkedHashMap<>();
      final List<Expr> expArgs = new ArrayList<>();
      for (Expr factor : flat) {
        if (factor instanceof Expr.Num) {
          coefficient = coefficient.multiply(((Expr.Num) factor).value);
          continue;
        }
        final Expr base;
        final Expr exponent;
        if (factor instanceof Expr.Pow) {
          base = ((Expr.Pow) factor).base;
          exponent = ((Expr.Pow) factor).exponent;
        } else {
          base = factor;
          exponent = expr.one();
        }
        if (base.isCall(BuiltIn.EXP)) {
          // exp(u) ^ e = exp(u * e); gather all exponentials into one
          expArgs.add(
              simplifyMul(ImmutableList.of(((Expr.Call) base).arg, exponent)));
          continue;
        }
        powers.merge(
            base, exponent, (e0, e1) -> simplifyAdd(ImmutableList.of(e0, e1)));
      }
      if (coefficient.isZero()) {
        return expr.zero();
      }
      final List<Expr> out = new ArrayList<>();
      if (!expArgs.isEmpty()) {
        final Expr e = simplifyCall(BuiltIn.EXP, simplifyAdd(expArgs));
        if (!e.isNum(1)) {
          out.add(e);
        }
      }
      powers.forEach((base, exponent) -> out.add(simplifyPow(base, exponent)));
      if (pass < MAX_PASSES && needsAnotherPass(out)) {
        out.add(expr.num(coefficient));
        list = out;
        continue;
      }
      final List<Expr> nonNum = new ArrayList<>();
      for (Expr e : out) {
        if (e instanceof Expr.Num) {
          coefficient = coefficient.multiply(((Expr.Num) e).value);
        } else {
          nonNum.add(e);
        }
      }
      if (coefficient.isZero()) {
        return expr.zero();
      }
      nonNum.sort(Expr.ORDERING);
      if (nonNum.isEmpty()) {
        return expr.num(coefficient);
      }
      if (nonNum.size() == 1 && nonNum.get(0) instanceof Expr.Add
          && !coefficient.isOne()) {
        // Distribute: c * (a + b) = c * a + c * b
        final BigRational c = coefficient;
        return simplifyAdd(
            transformEager(
                ((Expr.Add) nonNum.get(0)).terms,
                t -> simplifyMul(ImmutableList.of(expr.num(c), t))));
      }
      if (!coefficient.isOne()) {
        nonNum.add(0, expr.num(coefficient));
      }
      return expr.mul(nonNum);
    }
  }

  /**
   * Returns whether a list of factors needs to be collected again: because it
   * contains a number or a product, or two factors have the same base.
   */
  private static boolean needsAnotherPass(List<Expr> factors) {
    final Set<Expr> bases = new HashSet<>();
    for (Expr e : factors) {
      if (e instanceof Expr.Num) {
        continue;
      }
      if (e instanceof Expr.Mul) {
        return true;
      }
      final Expr base = e instanceof Expr.Pow ? ((Expr.Pow) e).base : e;
      if (!bases.add(base)) {
        return true;
      }
    }
    return false;
  }

  /** Simplifies a power whose base and exponent are already simplified. */
  static Expr simplifyPow(Expr base, Expr exponent) {
    if (exponent.isNum(0)) {
      return expr.one();
    }
    if (exponent.isNum(1)) {
      return base;
    }
    if (base.isNum(1)) {
      return expr.one();
    }
    if (base.isNum(0)) {
      if (exponent instanceof Expr.Num
          && ((Expr.Num) exponent).value.signum() > 0) {
        return expr.zero();
      }
      return expr.pow(base, exponent);
    }
    if (base instanceof Expr.Num && exponent instanceof Expr.Num) {
      return numericPower(((Expr.Num) base).value, ((Expr.Num) exponent).value);
    }
    final boolean integerExponent =
        exponent instanceof Expr.Num && ((Expr.Num) exponent).value.isInteger();
    if (base instanceof Expr.Pow) {
      final Expr.Pow pow = (Expr.Pow) base;
      if (integerExponent) {
        // (c ^ f) ^ n = c ^ (f * n) for integer n
        return simplifyPow(
            pow.base, simplifyMul(ImmutableList.of(pow.exponent, exponent)));
      }
      if (pow.exponent instanceof Expr.Num && exponent instanceof Expr.Num) {
        final BigRational f = ((Expr.Num) pow.exponent).value;
        final BigRational g = ((Expr.Num) exponent).value;
        if (f.isInteger() && !f.numerator.testBit(0)) {
          // (c ^ 2k) ^ g = abs(c) ^ (2k * g)
          return simplifyPow(
              simplifyCall(BuiltIn.ABS, pow.base), expr.num(f.multiply(g)));
        }
        if (isNonNegative(pow.base)) {
          return simplifyPow(pow.base, expr.num(f.multiply(g)));
        }
      }
    }
    if (base instanceof Expr.Mul) {
      final Expr.Mul mul = (Expr.Mul) base;
      if (integerExponent) {
        return simplifyMul(
            transformEager(mul.factors, f -> simplifyPow(f, exponent)));
      }
      final Expr first = mul.factors.get(0);
      if (first instanceof Expr.Num
          && ((Expr.Num) first).value.signum() > 0) {
        // (c * y) ^ e = c ^ e * y ^ e for c > 0
        final Expr rest = expr.mul(mul.factors.subList(1, mul.factors.size()));
        return simplifyMul(
            ImmutableList.of(
                simplifyPow(first, exponent), expr.pow(rest, exponent)));
      }
    }
    if (base.isCall(BuiltIn.EXP)) {
      return simplifyCall(
          BuiltIn.EXP,
          simplifyMul(ImmutableList.of(((Expr.Call) base).arg, exponent)));
    }
    if (base.isCall(BuiltIn.ABS) && integerExponent
        && !((Expr.Num) exponent).value.numerator.testBit(0)) {
      // abs(u) ^ 2k = u ^ 2k
      return simplifyPow(((Expr.Call) base).arg, exponent);
    }
    return expr.pow(base, exponent);
  }

  private static Expr numericPower(BigRational base, BigRational exponent) {
    if (exponent.isInteger()) {
      if (exponent.numerator.bitLength() > 31
          || Math.abs(exponent.intValueExact()) > MAX_NUMERIC_EXPONENT) {
        return expr.pow(expr.num(base), expr.num(exponent));
      }
      return expr.num(base.pow(exponent.intValueExact()));
    }
    if (exponent.denominator.bitLength() < 31) {
      final BigRational root = base.root(exponent.denominator.intValue());
      if (root != null) {
        return numericPower(root, BigRational.of(exponent.numerator));
      }
    }
    return expr.pow(expr.num(base), expr.num(exponent));
  }

  /** Returns whether an expression is obviously non-negative. */
  private static boolean isNonNegative(Expr e) {
    if (e instanceof Expr.Num) {
      return ((Expr.Num) e).value.signum() >= 0;
    }
    return e.isCall(BuiltIn.ABS)
        || e.isCall(BuiltIn.EXP)
        || e.isCall(BuiltIn.COSH);
  }

  /** Simplifies a function call whose argument is already simplified. */
  static Expr simplifyCall(BuiltIn fn, Expr arg) {
    final Expr e = fn.simplify(arg);
    if (e != null) {
      return simplify(e);
    }
    return expr.call(fn, arg);
  }

  private static void flatten(
      List<Expr> exprs, Class<? extends Expr> clazz, List<Expr> out) {
    for (Expr e : exprs) {
      if (clazz.isInstance(e)) {
        flatten(e.operands(), clazz, out);
      } else {
        out.add(e);
      }
    }
  }

  /** Returns "c * body", flattening if body is a product. */
  private static Expr times(BigRational c, Expr body) {
    if (c.isOne()) {
      return body;
    }
    if (body instanceof Expr.Mul) {
      return expr.mul(
          ImmutableList.<Expr>builder()
              .add(expr.num(c))
              .addAll(((Expr.Mul) body).factors)
              .build());
    }
    return expr.mul(expr.num(c), body);
  }

  /**
   * Splits a simplified term into a numeric coefficient and the rest. For
   * example, "3 * x * y" becomes (3, "x * y"), and "x" becomes (1, "x").
   */
  static Term splitTerm(Expr e) {
    if (e instanceof Expr.Num) {
      return new Term(((Expr.Num) e).value, expr.one());
    }
    if (e instanceof Expr.Mul) {
      final List<Expr> factors = ((Expr.Mul) e).factors;
      final Expr first = factors.get(0);
      if (first instanceof Expr.Num) {
        return new Term(
            ((Expr.Num) first).value,
            expr.mul(factors.subList(1, factors.size())));
      }
    }
    return new Term(BigRational.ONE, e);
  }

  /** Numeric coefficient and non-numeric body of a term. */
  static class Term {
    final BigRational coefficient;
    final Expr body;

    Term(BigRational coefficient, Expr body) {
      this.coefficient = coefficient;
      this.body = body;
    }
  }
}

// End Simplifier.java
