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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expands expressions.
 *
 * <p>Distributes products over sums, and raises sums to small positive
 * integer powers, so that {@code (x + 1) * (x - 1)} becomes
 * {@code x ^ 2 - 1}. The arguments of function calls are expanded too.
 * Products that would have more than {@link #MAX_TERMS} terms are left
 * alone.
 */
public class Expander {
  private Expander() {}

  /** Maximum number of terms in an expanded product. */
  static final int MAX_TERMS = 2000;

  /** Largest power of a sum that is multiplied out. */
  static final int MAX_POWER = 20;

  /** Expands an expression; the result is simplified. */
  public static Expr expand(Expr e) {
    return Simplifier.simplify(distribute(Simplifier.simplify(e)));
  }

  private static Expr distribute(Expr e) {
    switch (e.op) {
      case ADD:
        return Simplifier.simplifyAdd(
            transformEager(((Expr.Add) e).terms, Expander::distribute));
      case MUL:
        final List<Expr> factors =
            transformEager(((Expr.Mul) e).factors, Expander::distribute);
        final @Nullable List<Expr> terms = multiply(factors);
        return terms == null
            ? Simplifier.simplifyMul(factors)
            : Simplifier.simplifyAdd(terms);
      case POW:
        final Expr.Pow pow = (Expr.Pow) e;
        final Expr base = distribute(pow.base);
        if (base instanceof Expr.Add
            && pow.exponent instanceof Expr.Num
            && ((Expr.Num) pow.exponent).value.isInteger()) {
          final Expr.Num n = (Expr.Num) pow.exponent;
          if (n.value.signum() > 0
              && n.value.compareTo(BigRational.of(MAX_POWER)) <= 0) {
            final @Nullable List<Expr> powerTerms =
                power(((Expr.Add) base).terms, n.value.intValueExact());
            if (powerTerms != null) {
              return Simplifier.simplifyAdd(powerTerms);
            }
          }
        }
        return Simplifier.simplifyPow(base, distribute(pow.exponent));
      case CALL:
        final Expr.Call call = (Expr.Call) e;
        return Simplifier.simplifyCall(call.fn, distribute(call.arg));
      default:
        return e;
    }
  }

  /**
   * Multiplies a list of factors, some of which may be sums, into a list of
   * terms; returns null if there are too many terms.
   */
  private static @Nullable List<Expr> multiply(List<Expr> factors) {
    List<Expr> terms = ImmutableList.of(expr.one());
    for (Expr factor : factors) {
      final List<Expr> fs = factor instanceof Expr.Add
          ? ((Expr.Add) factor).terms
          : ImmutableList.of(factor);
      if ((long) terms.size() * fs.size() > MAX_TERMS) {
        return null;
      }
      terms = cross(terms, fs);
    }
    return terms;
  }

  /** Raises a sum to a positive integer power; null if too large. */
  private static @Nullable List<Expr> power(List<Expr> terms, int n) {
    List<Expr> result = terms;
    for (int i = 1; i < n; i++) {
      if ((long) result.size() * terms.size() > MAX_TERMS) {
        return null;
      }
      // Collect after each step, so that (x + 1) ^ n has n + 1 terms
      final Expr sum = Simplifier.simplifyAdd(cross(result, terms));
      result = sum instanceof Expr.Add
          ? ((Expr.Add) sum).terms
          : ImmutableList.of(sum);
    }
    return result;
  }

  private static List<Expr> cross(List<Expr> terms0, List<Expr> terms1) {
    final List<Expr> list = new ArrayList<>(terms0.size() * terms1.size());
    for (Expr t0 : terms0) {
      for (Expr t1 : terms1) {
        list.add(Simplifier.simplifyMul(ImmutableList.of(t0, t1)));
      }
    }
    return list;
  }
}

// End Expander.java
