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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.util.BigRational;

/**
 * Evaluates expressions numerically, as doubles.
 *
 * <p>Symbols take their values from a map. The symbol "pi" is
 * {@link Math#PI} unless bound. Any other unbound symbol gets a fixed value
 * derived from its name, so that distinct parameters get distinct values.
 * An unevaluated integral evaluates to NaN.
 */
public class Evaluator {
  private final ImmutableMap<Expr.Sym, Double> bindings;

  public Evaluator(Map<Expr.Sym, Double> bindings) {
    this.bindings = ImmutableMap.copyOf(bindings);
  }

  /** Evaluates an expression with a single binding. */
  public static double evaluate(Expr e, Expr.Sym x, double value) {
    return new Evaluator(ImmutableMap.of(x, value)).evaluate(e);
  }

  /** Returns the value given to an unbound symbol. */
  static double defaultValue(Expr.Sym sym) {
    if (sym.name.equals("pi")) {
      return Math.PI;
    }
    // A value in [0.6, 1.6), stable for a given name
    final int h = sym.name.hashCode() & 0x7fffffff;
    return 0.6 + (h % 1009) / 1009d;
  }

  public double evaluate(Expr e) {
    switch (e.op) {
      case NUM:
        return ((Expr.Num) e).value.doubleValue();
      case SYM:
        final Double value = bindings.get((Expr.Sym) e);
        return value != null ? value : defaultValue((Expr.Sym) e);
      case ADD:
        double sum = 0d;
        for (Expr term : ((Expr.Add) e).terms) {
          sum += evaluate(term);
        }
        return sum;
      case MUL:
        double product = 1d;
        for (Expr factor : ((Expr.Mul) e).factors) {
          product *= evaluate(factor);
        }
        return product;
      case POW:
        final Expr.Pow pow = (Expr.Pow) e;
        return power(evaluate(pow.base), pow.exponent);
      case CALL:
        final Expr.Call call = (Expr.Call) e;
        return call.fn.apply(evaluate(call.arg));
      case INTEGRAL:
        return Double.NaN;
      default:
        throw new AssertionError(e.op);
    }
  }

  /**
   * Raises a number to a power. A negative base with a rational exponent
   * whose denominator is odd gives the real root, so that
   * {@code (-8) ^ (1/3)} is -2.
   */
  private double power(double base, Expr exponent) {
    if (base < 0 && exponent instanceof Expr.Num) {
      final BigRational r = ((Expr.Num) exponent).value;
      if (!r.isInteger() && r.denominator.testBit(0)) {
        final double magnitude = Math.pow(-base, r.doubleValue());
        return r.numerator.testBit(0) ? -magnitude : magnitude;
      }
    }
    return Math.pow(base, evaluate(exponent));
  }
}

// End Evaluator.java
