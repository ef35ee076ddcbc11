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

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.integral.ast.Expr;

/**
 * Decides whether an expression is identically zero.
 *
 * <p>First the expression is expanded and simplified; if that gives zero,
 * the answer is {@link Result#ZERO}. Otherwise the expression is evaluated
 * at a fixed set of sample points. Points where the expression is not
 * defined (NaN or infinite) are skipped.
 */
public class ZeroTester {
  private ZeroTester() {}

  /** Sample points. Irregular, so that they avoid the usual singularities. */
  private static final List<Double> POINTS =
      ImmutableList.of(0.1237, 0.3519, 0.5381, 0.7193, 0.9047, 1.3271,
          1.8713, 2.4391, 3.1729, -0.4127, -0.8361, -1.7139);

  /** Minimum number of points at which the expression must be defined. */
  private static final int MIN_VALID_POINTS = 3;

  /** Relative tolerance below which a value is considered zero. */
  private static final double ZERO_TOLERANCE = 1e-8;

  /** Relative magnitude above which a value is certainly not zero. */
  private static final double NON_ZERO_TOLERANCE = 1e-5;

  /** Result of a zero test. */
  public enum Result {
    /** The expression is zero, symbolically or at every sample point. */
    ZERO,
    /** The expression is clearly non-zero at some sample point. */
    NON_ZERO,
    /** Too few points were defined, or the values were inconclusive. */
    UNKNOWN
  }

  /** Tests whether an expression is zero. */
  public static Result test(Expr e) {
    final Expr e2 = Expander.expand(e);
    if (e2.isNum(0)) {
      return Result.ZERO;
    }
    if (e2 instanceof Expr.Num) {
      return Result.NON_ZERO;
    }
    final List<Expr.Sym> symbols = Exprs.symbols(e2).asList();
    final List<Expr> terms = Exprs.terms(e2);
    int valid = 0;
    boolean inconclusive = false;
    for (int i = 0; i < POINTS.size(); i++) {
      final Map<Expr.Sym, Double> bindings = new HashMap<>();
      for (int j = 0; j < symbols.size(); j++) {
        // Each symbol gets a different point
        bindings.put(symbols.get(j), POINTS.get((i + 5 * j) % POINTS.size()));
      }
      final Evaluator evaluator = new Evaluator(bindings);
      double value = 0d;
      double scale = 1d;
      for (Expr term : terms) {
        final double v = evaluator.evaluate(term);
        value += v;
        scale += Math.abs(v);
      }
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        continue;
      }
      ++valid;
      final double relative = Math.abs(value) / scale;
      if (relative > NON_ZERO_TOLERANCE) {
        return Result.NON_ZERO;
      }
      if (relative > ZERO_TOLERANCE) {
        inconclusive = true;
      }
    }
    if (valid < MIN_VALID_POINTS || inconclusive) {
      return Result.UNKNOWN;
    }
    return Result.ZERO;
  }

  /** Returns whether two expressions are equal in value. */
  public static Result testEqual(Expr e0, Expr e1) {
    return test(expr.sub(e0, e1));
  }
}

// End ZeroTester.java
