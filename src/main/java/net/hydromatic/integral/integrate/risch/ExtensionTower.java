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

import static net.hydromatic.integral.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.algebra.Poly;
import net.hydromatic.integral.algebra.RationalFunction;
import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.util.BigRational;

/**
 * Tower of differential fields Q(x) = K0 &sub; K1 &sub; ... &sub; Kn, each
 * obtained from the previous by adjoining an exponential or a logarithm.
 */
public class ExtensionTower {
  public final Expr.Sym variable;
  private final List<TowerLevel> levels = new ArrayList<>();

  ExtensionTower(Expr.Sym variable) {
    this.variable = variable;
    final TowerElement one = TowerField.INSTANCE.one();
    levels.add(
        new TowerLevel(0, TowerLevel.Kind.VARIABLE, variable, one, one));
  }

  /** Returns the levels, starting with the variable. */
  public List<TowerLevel> levels() {
    return ImmutableList.copyOf(levels);
  }

  public TowerLevel level(int i) {
    return levels.get(i);
  }

  /** Returns the number of levels above the variable. */
  public int height() {
    return levels.size() - 1;
  }

  TowerLevel add(TowerLevel.Kind kind, Expr generator, TowerElement argument,
      TowerElement eta) {
    final TowerLevel level =
        new TowerLevel(levels.size(), kind, generator, argument, eta);
    levels.add(level);
    return level;
  }

  /** Returns the generator of a level as an element. */
  public TowerElement generator(int i) {
    return TowerElement.of(i, Poly.t(TowerField.INSTANCE));
  }

  /** Returns the derivative of an element with respect to x. */
  public TowerElement derivative(TowerElement e) {
    if (e.isConstant()) {
      return TowerField.INSTANCE.zero();
    }
    final RationalFunction<TowerElement> rf = e.rf();
    final Poly<TowerElement> n = rf.numerator;
    final Poly<TowerElement> d = rf.denominator;
    // (n / d)' = (n' d - n d') / d^2
    final Poly<TowerElement> numerator =
        derivative(n, e.level).multiply(d)
            .subtract(n.multiply(derivative(d, e.level)));
    return TowerElement.of(e.level,
        RationalFunction.of(numerator, d.multiply(d)));
  }

  /**
   * Returns the derivative of a polynomial in the generator of level
   * {@code k}, whose coefficients belong to lower levels.
   */
  public Poly<TowerElement> derivative(Poly<TowerElement> p, int k) {
    final TowerField f = TowerField.INSTANCE;
    final TowerLevel level = levels.get(k);
    switch (level.kind) {
      case VARIABLE:
        return p.derivative();
      case EXPONENTIAL:
        // D(a t^i) = (D(a) + i eta a) t^i
        final List<TowerElement> list = new ArrayList<>();
        for (int i = 0; i <= p.degree(); i++) {
          final TowerElement a = p.coefficient(i);
          final TowerElement n = f.fromRational(BigRational.of(i));
          list.add(
              f.add(derivative(a), f.multiply(n, f.multiply(level.eta, a))));
        }
        return Poly.of(f, list);
      case LOGARITHMIC:
        // D(a t^i) = D(a) t^i + i a eta t^(i-1)
        final List<TowerElement> list2 = new ArrayList<>();
        for (int i = 0; i <= p.degree(); i++) {
          list2.add(derivative(p.coefficient(i)));
        }
        return Poly.of(f, list2).add(p.derivative().scale(level.eta));
      default:
        throw new AssertionError(level.kind);
    }
  }

  /** Converts an element back to an expression in x. */
  public Expr toExpr(TowerElement e) {
    return Simplifier.simplify(toExpr0(e));
  }

  private Expr toExpr0(TowerElement e) {
    if (e.isConstant()) {
      return expr.num(e.constant());
    }
    final RationalFunction<TowerElement> rf = e.rf();
    final Expr t = levels.get(e.level).generator;
    final Expr n = toExpr0(rf.numerator, t);
    if (rf.isPolynomial()) {
      return n;
    }
    return expr.div(n, toExpr0(rf.denominator, t));
  }

  private Expr toExpr0(Poly<TowerElement> p, Expr t) {
    final List<Expr> terms = new ArrayList<>();
    for (int i = 0; i <= p.degree(); i++) {
      final TowerElement c = p.coefficient(i);
      if (!c.isZero()) {
        terms.add(expr.mul(toExpr0(c), expr.pow(t, i)));
      }
    }
    return expr.add(terms);
  }

  @Override public String toString() {
    return levels.toString();
  }
}

// End ExtensionTower.java
