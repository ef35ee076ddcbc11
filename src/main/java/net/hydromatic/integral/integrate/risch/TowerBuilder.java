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

import static net.hydromatic.integral.algebra.Rationals.Q;
import static net.hydromatic.integral.ast.ExprBuilder.expr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import net.hydromatic.integral.algebra.Exprs;
import net.hydromatic.integral.algebra.LinearSystems;
import net.hydromatic.integral.algebra.Poly;
import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.function.BuiltIn;
import net.hydromatic.integral.util.BigRational;
import net.hydromatic.integral.util.Deadline;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts an expression into an element of an {@link ExtensionTower},
 * adding a level for each exponential or logarithm it meets.
 *
 * <p>Before a generator is added, the structure theorem is applied: if its
 * logarithmic derivative is a rational linear combination of those of the
 * existing generators, it is not transcendental over the tower. An exact
 * alias such as exp(2x) = exp(x)^2 reuses the existing level; any other
 * dependency is rejected, as are functions other than exp and ln,
 * fractional powers, transcendental constants and free parameters.
 */
public class TowerBuilder {
  private final ExtensionTower tower;
  private final int maxLevels;
  private final Deadline deadline;
  private final TowerField f = TowerField.INSTANCE;

  public TowerBuilder(Expr.Sym variable, int maxLevels, Deadline deadline) {
    this.tower = new ExtensionTower(variable);
    this.maxLevels = maxLevels;
    this.deadline = deadline;
  }

  public ExtensionTower tower() {
    return tower;
  }

  /**
   * Adds levels for the exponentials in an expression, before the
   * expression is converted.
   *
   * <p>Exponentials whose arguments are rational multiples of each other
   * share one level, built on the greatest common divisor of the
   * multiples. Thus in {@code exp(2x) + exp(3x)} the level is
   * t = exp(x), and the terms become t^2 and t^3, whichever exponential
   * is met first. Only arguments that are rational functions of the
   * variable are grouped; others get their levels during conversion.
   */
  public void prepare(Expr e) {
    final List<Expr> arguments = new ArrayList<>();
    collectExponents(e, arguments);
    final List<Expr> bases = new ArrayList<>();
    final List<TowerElement> baseElements = new ArrayList<>();
    final List<BigRational> divisors = new ArrayList<>();
    for (Expr a : arguments) {
      final TowerElement g = convert(a);
      if (g.isConstant()) {
        continue;
      }
      int i = 0;
      for (; i < bases.size(); i++) {
        final TowerElement q = f.divide(g, baseElements.get(i));
        if (q.isConstant()) {
          divisors.set(i, gcd(divisors.get(i), q.constant()));
          break;
        }
      }
      if (i == bases.size()) {
        bases.add(a);
        baseElements.add(g);
        divisors.add(BigRational.ONE);
      }
    }
    for (int i = 0; i < bases.size(); i++) {
      convert(
          expr.exp(
              Simplifier.simplify(
                  expr.mul(expr.num(divisors.get(i)), bases.get(i)))));
    }
  }

  /** Collects the arguments of exponentials that are rational functions of
   * the variable, less any logarithmic terms. */
  private void collectExponents(Expr e, List<Expr> arguments) {
    if (e.isCall(BuiltIn.EXP)) {
      final List<Expr> rest = new ArrayList<>();
      for (Expr term : Exprs.terms(((Expr.Call) e).arg)) {
        if (!isLogTerm(term)) {
          rest.add(term);
        }
      }
      if (!rest.isEmpty()) {
        final Expr a = Simplifier.simplify(expr.add(rest));
        if (isRational(a) && !arguments.contains(a)) {
          arguments.add(a);
        }
      }
    }
    for (Expr operand : e.operands()) {
      collectExponents(operand, arguments);
    }
  }

  /** Returns whether an expression is built from the variable and numbers
   * by sums, products and integer powers. */
  private boolean isRational(Expr e) {
    switch (e.op) {
      case NUM:
        return true;
      case SYM:
        return e.equals(tower.variable);
      case ADD:
      case MUL:
        for (Expr operand : e.operands()) {
          if (!isRational(operand)) {
            return false;
          }
        }
        return true;
      case POW:
        final Expr.Pow pow = (Expr.Pow) e;
        return pow.exponent instanceof Expr.Num
            && ((Expr.Num) pow.exponent).value.isSmallInteger()
            && isRational(pow.base);
      default:
        return false;
    }
  }

  /** Returns whether a term is "ln(u)" or "c * ln(u)". */
  private static boolean isLogTerm(Expr term) {
    return term.isCall(BuiltIn.LN)
        || (term instanceof Expr.Mul
            && ((Expr.Mul) term).factors.size() == 2
            && ((Expr.Mul) term).factors.get(0) instanceof Expr.Num
            && ((Expr.Mul) term).factors.get(1).isCall(BuiltIn.LN));
  }

  /** Greatest common divisor of two non-zero rationals; positive. */
  static BigRational gcd(BigRational a, BigRational b) {
    return BigRational.of(
        a.numerator.multiply(b.denominator)
            .gcd(b.numerator.multiply(a.denominator)),
        a.denominator.multiply(b.denominator));
  }

  /**
   * Converts an expression to a tower element.
   *
   * @throws UnsupportedExtensionException if the expression is outside the
   *   class of functions this builder can represent
   */
  public TowerElement convert(Expr e) {
    switch (e.op) {
      case NUM:
        return f.fromRational(((Expr.Num) e).value);
      case SYM:
        if (e.equals(tower.variable)) {
          return tower.generator(0);
        }
        throw new UnsupportedExtensionException("free parameter " + e);
      case ADD:
        TowerElement sum = f.zero();
        for (Expr term : ((Expr.Add) e).terms) {
          sum = f.add(sum, convert(term));
        }
        return sum;
      case MUL:
        TowerElement product = f.one();
        for (Expr factor : ((Expr.Mul) e).factors) {
          product = f.multiply(product, convert(factor));
        }
        return product;
      case POW:
        final Expr.Pow pow = (Expr.Pow) e;
        final int n = smallInteger(pow.exponent);
        return f.power(convert(pow.base), n);
      case CALL:
        checkDeadline();
        final Expr.Call call = (Expr.Call) e;
        if (call.fn == BuiltIn.EXP) {
          return exponential(call.arg);
        }
        if (call.fn == BuiltIn.LN) {
          return logarithm(call.arg);
        }
        throw new UnsupportedExtensionException("function " + call.fn);
      default:
        throw new UnsupportedExtensionException("expression " + e);
    }
  }

  private void checkDeadline() {
    if (deadline.isExpired()) {
      throw new TimeoutException();
    }
  }

  private static int smallInteger(Expr e) {
    if (e instanceof Expr.Num
        && ((Expr.Num) e).value.isSmallInteger()
        && Math.abs(((Expr.Num) e).value.intValueExact()) <= 64) {
      return ((Expr.Num) e).value.intValueExact();
    }
    throw new UnsupportedExtensionException("power " + e);
  }

  /** Converts "exp(arg)". Terms "c * ln(u)" of the argument with integer c
   * become factors "u ^ c". */
  private TowerElement exponential(Expr arg) {
    TowerElement factor = f.one();
    final List<Expr> rest = new ArrayList<>();
    for (Expr term : Exprs.terms(arg)) {
      if (term.isCall(BuiltIn.LN)) {
        factor = f.multiply(factor, convert(((Expr.Call) term).arg));
      } else if (isLogTerm(term)) {
        final Expr.Mul mul = (Expr.Mul) term;
        final int n = smallInteger(mul.factors.get(0));
        final Expr u = ((Expr.Call) mul.factors.get(1)).arg;
        factor = f.multiply(factor, f.power(convert(u), n));
      } else {
        rest.add(term);
      }
    }
    if (rest.isEmpty()) {
      return factor;
    }
    final Expr a = Simplifier.simplify(expr.add(rest));
    final TowerElement g = convert(a);
    if (g.isConstant()) {
      if (g.isZero()) {
        return factor;
      }
      throw new UnsupportedExtensionException("transcendental constant exp("
          + a + ")");
    }
    for (TowerLevel level : tower.levels()) {
      if (level.kind == TowerLevel.Kind.EXPONENTIAL
          && level.argument.equals(g)) {
        return f.multiply(factor, tower.generator(level.index));
      }
    }
    final @Nullable List<BigRational> combination =
        dependence(tower.derivative(g));
    if (combination == null) {
      final TowerLevel level =
          newLevel(TowerLevel.Kind.EXPONENTIAL, expr.exp(a), g,
              tower.derivative(g));
      return f.multiply(factor, tower.generator(level.index));
    }
    // g = sum of q_j g_j with integer q_j is exp(g) = product of t_j ^ q_j
    TowerElement alias = f.one();
    TowerElement remainder = g;
    final List<TowerLevel> levels = dependenceLevels();
    for (int i = 0; i < levels.size(); i++) {
      final BigRational q = combination.get(i);
      if (q.isZero()) {
        continue;
      }
      final TowerLevel level = levels.get(i);
      if (level.kind != TowerLevel.Kind.EXPONENTIAL || !q.isSmallInteger()) {
        throw new UnsupportedExtensionException("exp(" + a
            + ") depends algebraically on " + level.generator);
      }
      alias = f.multiply(alias,
          f.power(tower.generator(level.index), q.intValueExact()));
      remainder =
          f.subtract(remainder, f.multiply(f.fromRational(q), level.argument));
    }
    if (!remainder.isZero()) {
      throw new UnsupportedExtensionException("exp(" + a
          + ") differs from a product of exponentials by a constant");
    }
    return f.multiply(factor, alias);
  }

  /** Converts "ln(arg)", splitting logarithms of products and powers. */
  private TowerElement logarithm(Expr arg) {
    if (arg.isCall(BuiltIn.ABS)) {
      return logarithm(((Expr.Call) arg).arg);
    }
    if (arg.isCall(BuiltIn.EXP)) {
      return convert(((Expr.Call) arg).arg);
    }
    if (arg instanceof Expr.Pow
        && ((Expr.Pow) arg).exponent instanceof Expr.Num
        && ((Expr.Num) ((Expr.Pow) arg).exponent).value.isSmallInteger()) {
      final Expr.Pow pow = (Expr.Pow) arg;
      final BigRational n = ((Expr.Num) pow.exponent).value;
      return f.multiply(f.fromRational(n), logarithm(pow.base));
    }
    if (arg instanceof Expr.Mul) {
      final Expr.Sym x = tower.variable;
      final List<Expr> constants = new ArrayList<>();
      final List<Expr> dependents = new ArrayList<>();
      for (Expr factor : ((Expr.Mul) arg).factors) {
        (Exprs.freeOf(factor, x) ? constants : dependents).add(factor);
      }
      if (dependents.size() >= 2) {
        // ln(c u v) = ln(c u) + ln(v); the constant stays with one factor
        constants.add(dependents.remove(0));
        TowerElement sum =
            logarithm(Simplifier.simplify(expr.mul(constants)));
        for (Expr dependent : dependents) {
          sum = f.add(sum, logarithm(dependent));
        }
        return sum;
      }
    }
    final TowerElement u = convert(arg);
    if (u.isConstant()) {
      if (u.equals(f.one())) {
        return f.zero();
      }
      throw new UnsupportedExtensionException("transcendental constant ln("
          + arg + ")");
    }
    for (TowerLevel level : tower.levels()) {
      if (level.kind == TowerLevel.Kind.LOGARITHMIC
          && level.argument.equals(u)) {
        return tower.generator(level.index);
      }
    }
    final TowerElement eta = f.divide(tower.derivative(u), u);
    if (dependence(eta) != null) {
      throw new UnsupportedExtensionException("ln(" + arg
          + ") depends algebraically on the tower " + tower);
    }
    final TowerLevel level =
        newLevel(TowerLevel.Kind.LOGARITHMIC, expr.ln(arg), u, eta);
    return tower.generator(level.index);
  }

  private TowerLevel newLevel(TowerLevel.Kind kind, Expr generator,
      TowerElement argument, TowerElement eta) {
    if (tower.height() >= maxLevels) {
      throw new UnsupportedExtensionException("more than " + maxLevels
          + " levels");
    }
    return tower.add(kind, generator, argument, eta);
  }

  /** Returns the levels whose logarithmic derivatives take part in the
   * structure theorem: every level but the variable. */
  private List<TowerLevel> dependenceLevels() {
    return tower.levels().subList(1, tower.levels().size());
  }

  /**
   * Returns rationals q such that {@code target = sum q_i eta_i} over the
   * levels above the variable, or null if there are none.
   */
  private @Nullable List<BigRational> dependence(TowerElement target) {
    final List<TowerElement> basis = new ArrayList<>();
    for (TowerLevel level : dependenceLevels()) {
      basis.add(level.eta);
    }
    return span(basis, target);
  }

  /**
   * Returns rationals q such that {@code sum q_i basis_i = target}, or
   * null if there are none.
   *
   * <p>Each row (one entry per basis element, then the target) is
   * multiplied by a common denominator in the generator of its highest
   * level and split into one row per power of that generator, until every
   * entry is rational.
   */
  static @Nullable List<BigRational> span(List<TowerElement> basis,
      TowerElement target) {
    final TowerField f = TowerField.INSTANCE;
    final Deque<List<TowerElement>> pending = new ArrayDeque<>();
    final List<TowerElement> first = new ArrayList<>(basis);
    first.add(target);
    pending.add(first);
    final List<List<BigRational>> matrix = new ArrayList<>();
    final List<BigRational> rhs = new ArrayList<>();
    while (!pending.isEmpty()) {
      final List<TowerElement> row = pending.pop();
      int k = -1;
      for (TowerElement e : row) {
        k = Math.max(k, e.level);
      }
      if (k < 0) {
        final List<BigRational> values = new ArrayList<>();
        for (TowerElement e : row) {
          values.add(e.constant());
        }
        rhs.add(values.remove(values.size() - 1));
        matrix.add(values);
        continue;
      }
      Poly<TowerElement> denominator = Poly.one(f);
      for (TowerElement e : row) {
        if (e.level == k) {
          denominator = lcm(denominator, e.rf().denominator);
        }
      }
      final List<Poly<TowerElement>> polys = new ArrayList<>();
      int degree = 0;
      for (TowerElement e : row) {
        final Poly<TowerElement> p =
            e.level == k
                ? e.rf().numerator
                    .multiply(denominator.quotient(e.rf().denominator))
                : denominator.scale(e);
        polys.add(p);
        degree = Math.max(degree, p.degree());
      }
      for (int i = 0; i <= degree; i++) {
        final List<TowerElement> next = new ArrayList<>();
        for (Poly<TowerElement> p : polys) {
          next.add(p.coefficient(i));
        }
        pending.add(next);
      }
    }
    return LinearSystems.solve(Q, matrix, rhs, basis.size());
  }

  private static Poly<TowerElement> lcm(Poly<TowerElement> a,
      Poly<TowerElement> b) {
    return a.multiply(b).quotient(Poly.gcd(a, b)).monic();
  }

  /** Thrown when an expression cannot be represented in a tower. */
  public static class UnsupportedExtensionException
      extends RuntimeException {
    UnsupportedExtensionException(String message) {
      super(message);
    }
  }

  /** Thrown when the time budget runs out while building a tower. */
  public static class TimeoutException extends RuntimeException {
    TimeoutException() {
      super("time budget exhausted");
    }
  }
}

// End TowerBuilder.java
