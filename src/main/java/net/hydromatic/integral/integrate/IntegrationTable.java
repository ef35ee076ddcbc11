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
package net.hydromatic.integral.integrate;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.integral.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import net.hydromatic.integral.algebra.Exprs;
import net.hydromatic.integral.algebra.Polynomials;
import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.calculus.Differentiator;
import net.hydromatic.integral.function.BuiltIn;
import net.hydromatic.integral.util.BigRational;
import net.hydromatic.integral.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Table of canonical integrals.
 *
 * <p>The integrand is split into a coefficient that is free of the variable
 * and a core; the core is matched against each entry in turn, and the first
 * entry that matches gives the antiderivative. In the entries, {@code a},
 * {@code b} and {@code k} stand for expressions free of {@code x}.
 *
 * <p>A table is immutable. {@link #standard()} returns the built-in table;
 * a different table can be given to {@link Integrator.Builder#withTable}.
 */
public class IntegrationTable implements Strategy {
  private static final IntegrationTable STANDARD =
      new IntegrationTable(standardEntries());

  private final ImmutableList<Entry> entries;

  private IntegrationTable(List<Entry> entries) {
    this.entries = ImmutableList.copyOf(entries);
  }

  /** Returns the standard table. */
  public static IntegrationTable standard() {
    return STANDARD;
  }

  /** Creates a table with the given entries. */
  public static IntegrationTable of(List<Entry> entries) {
    return new IntegrationTable(entries);
  }

  public ImmutableList<Entry> entries() {
    return entries;
  }

  @Override public StrategyKind kind() {
    return StrategyKind.TABLE;
  }

  @Override public StrategyOutcome attempt(IntegrationRequest request,
      Integrator integrator) {
    final @Nullable Expr e = lookup(request.integrand, request.variable);
    return e == null
        ? StrategyOutcome.notApplicable()
        : StrategyOutcome.found(e);
  }

  /**
   * Looks up the antiderivative of a simplified integrand; returns null if
   * no entry matches.
   */
  public @Nullable Expr lookup(Expr f, Expr.Sym x) {
    if (Exprs.freeOf(f, x)) {
      return Simplifier.simplify(expr.mul(f, x));
    }
    final Exprs.Split split = Exprs.split(f, x);
    for (Entry entry : entries) {
      final @Nullable Expr e = entry.rule.apply(split.dependent, x);
      if (e != null) {
        return Simplifier.simplify(expr.mul(split.coefficient, e));
      }
    }
    return null;
  }

  /** Entry in the table. */
  public static class Entry {
    /** Description of the integrand, for example "sin(a*x+b)". */
    public final String name;
    public final Rule rule;

    public Entry(String name, Rule rule) {
      this.name = requireNonNull(name);
      this.rule = requireNonNull(rule);
    }

    @Override public String toString() {
      return name;
    }
  }

  /** Computes the antiderivative of a core, if the core has the right form. */
  @FunctionalInterface
  public interface Rule {
    @Nullable Expr apply(Expr core, Expr.Sym x);
  }

  /** Builds the standard entries. */
  private static List<Entry> standardEntries() {
    final List<Entry> list = new ArrayList<>();

    list.add(
        new Entry("x", (f, x) ->
            f.equals(x) ? expr.mul(expr.num(1, 2), expr.pow(x, 2)) : null));

    list.add(
        new Entry("1/x", (f, x) ->
            isPow(f, x, -1) ? expr.lnAbs(x) : null));

    // x ^ n -> x ^ (n + 1) / (n + 1); n numeric and not -1. A symbolic n
    // might be -1.
    list.add(
        new Entry("x^n", (f, x) -> {
          if (!(f instanceof Expr.Pow) || !((Expr.Pow) f).base.equals(x)) {
            return null;
          }
          final Expr n = ((Expr.Pow) f).exponent;
          if (!(n instanceof Expr.Num) || n.isNum(-1)) {
            return null;
          }
          final Expr n1 = expr.add(n, expr.one());
          return expr.div(expr.pow(x, n1), n1);
        }));

    list.add(
        new Entry("1/(a*x+b)", (f, x) -> {
          final Exprs.@Nullable Linear u = powOfLinear(f, x, -1);
          return u == null ? null : expr.div(expr.lnAbs(base(f)), u.a);
        }));

    // (a x + b) ^ n -> (a x + b) ^ (n + 1) / (a (n + 1))
    list.add(
        new Entry("(a*x+b)^n", (f, x) -> {
          if (!(f instanceof Expr.Pow)) {
            return null;
          }
          final Expr n = ((Expr.Pow) f).exponent;
          if (!(n instanceof Expr.Num) || n.isNum(-1)) {
            return null;
          }
          final Exprs.@Nullable Linear u =
              Exprs.linear(((Expr.Pow) f).base, x);
          if (u == null) {
            return null;
          }
          final Expr n1 = expr.add(n, expr.one());
          return expr.div(expr.pow(((Expr.Pow) f).base, n1),
              expr.mul(u.a, n1));
        }));

    list.add(
        new Entry("exp(a*x+b)", (f, x) -> {
          final Exprs.@Nullable Linear u = callOfLinear(f, BuiltIn.EXP, x);
          return u == null ? null : expr.div(f, u.a);
        }));

    // k ^ (a x + b) -> k ^ (a x + b) / (a ln(k))
    list.add(
        new Entry("k^(a*x+b)", (f, x) -> {
          if (!(f instanceof Expr.Pow)) {
            return null;
          }
          final Expr k = ((Expr.Pow) f).base;
          if (!Exprs.freeOf(k, x) || k.isNum(0) || k.isNum(1)) {
            return null;
          }
          final Exprs.@Nullable Linear u =
              Exprs.linear(((Expr.Pow) f).exponent, x);
          return u == null ? null : expr.div(f, expr.mul(u.a, expr.ln(k)));
        }));

    // f(a x + b) -> F(a x + b) / a, for each function with an
    // antiderivative
    for (BuiltIn fn : ImmutableList.of(BuiltIn.LN, BuiltIn.SIN, BuiltIn.COS,
        BuiltIn.TAN, BuiltIn.COT, BuiltIn.SEC, BuiltIn.CSC, BuiltIn.SINH,
        BuiltIn.COSH, BuiltIn.TANH, BuiltIn.ARCTAN, BuiltIn.ARCSIN,
        BuiltIn.ARCCOS)) {
      list.add(
          new Entry(fn.functionName + "(a*x+b)", (f, x) -> {
            final Exprs.@Nullable Linear u = callOfLinear(f, fn, x);
            if (u == null) {
              return null;
            }
            final Expr arg = ((Expr.Call) f).arg;
            return expr.div(requireNonNull(fn.antiderivative(arg)), u.a);
          }));
    }

    // ln(abs(u)) -> (u ln(abs(u)) - u) / a
    list.add(
        new Entry("ln(abs(a*x+b))", (f, x) -> {
          if (!f.isCall(BuiltIn.LN)) {
            return null;
          }
          final Exprs.@Nullable Linear u =
              callOfLinear(((Expr.Call) f).arg, BuiltIn.ABS, x);
          if (u == null) {
            return null;
          }
          final Expr arg = ((Expr.Call) ((Expr.Call) f).arg).arg;
          return expr.div(expr.sub(expr.mul(arg, f), arg), u.a);
        }));

    list.add(
        new Entry("abs(a*x+b)", (f, x) -> {
          final Exprs.@Nullable Linear u = callOfLinear(f, BuiltIn.ABS, x);
          if (u == null) {
            return null;
          }
          final Expr arg = ((Expr.Call) f).arg;
          return expr.div(expr.mul(arg, f), expr.mul(expr.num(2), u.a));
        }));

    // Squares of sec, csc and sech, in their various forms
    list.add(squareEntry("sec(a*x+b)^2", BuiltIn.SEC, 2, BuiltIn.TAN, false));
    list.add(squareEntry("cos(a*x+b)^-2", BuiltIn.COS, -2, BuiltIn.TAN, false));
    list.add(squareEntry("csc(a*x+b)^2", BuiltIn.CSC, 2, BuiltIn.COT, true));
    list.add(squareEntry("sin(a*x+b)^-2", BuiltIn.SIN, -2, BuiltIn.COT, true));
    list.add(
        squareEntry("cosh(a*x+b)^-2", BuiltIn.COSH, -2, BuiltIn.TANH, false));

    // sin(u) ^ 2 -> x / 2 - sin(2 u) / (4 a)
    list.add(
        new Entry("sin(a*x+b)^2", (f, x) -> {
          final Exprs.@Nullable Linear u = squareOf(f, BuiltIn.SIN, x);
          return u == null ? null : sinSquared(f, x, u, -1);
        }));
    list.add(
        new Entry("cos(a*x+b)^2", (f, x) -> {
          final Exprs.@Nullable Linear u = squareOf(f, BuiltIn.COS, x);
          return u == null ? null : sinSquared(f, x, u, 1);
        }));

    // sec(u) tan(u) -> sec(u) / a; csc(u) cot(u) -> -csc(u) / a
    list.add(
        productEntry("sec(a*x+b)*tan(a*x+b)", BuiltIn.SEC, 1, BuiltIn.TAN, 1,
            (u, a) -> expr.div(expr.call(BuiltIn.SEC, u), a)));
    list.add(
        productEntry("sin(a*x+b)/cos(a*x+b)^2", BuiltIn.SIN, 1, BuiltIn.COS,
            -2, (u, a) -> expr.div(expr.reciprocal(expr.cos(u)), a)));
    list.add(
        productEntry("csc(a*x+b)*cot(a*x+b)", BuiltIn.CSC, 1, BuiltIn.COT, 1,
            (u, a) -> expr.neg(expr.div(expr.call(BuiltIn.CSC, u), a))));
    list.add(
        productEntry("cos(a*x+b)/sin(a*x+b)^2", BuiltIn.COS, 1, BuiltIn.SIN,
            -2,
            (u, a) -> expr.neg(expr.div(expr.reciprocal(expr.sin(u)), a))));
    list.add(
        productEntry("sin(a*x+b)/cos(a*x+b)", BuiltIn.SIN, 1, BuiltIn.COS, -1,
            (u, a) -> expr.neg(expr.div(expr.lnAbs(expr.cos(u)), a))));
    list.add(
        productEntry("cos(a*x+b)/sin(a*x+b)", BuiltIn.COS, 1, BuiltIn.SIN, -1,
            (u, a) -> expr.div(expr.lnAbs(expr.sin(u)), a)));

    // 1 / (c x ^ 2 + d), c d > 0 -> arctan(x / sqrt(k)) / (c sqrt(k))
    list.add(
        new Entry("1/(x^2+k)", (f, x) -> {
          final @Nullable Quadratic q = quadraticPower(f, x, -1);
          if (q == null || q.k.signum() <= 0) {
            return null;
          }
          final Expr s = expr.sqrt(expr.num(q.k));
          return expr.div(expr.call(BuiltIn.ARCTAN, expr.div(x, s)),
              expr.mul(q.c, s));
        }));

    // 1 / (c x ^ 2 - d) -> (ln|x - r| - ln|x + r|) / (2 c r), r = sqrt(k)
    list.add(
        new Entry("1/(x^2-k)", (f, x) -> {
          final @Nullable Quadratic q = quadraticPower(f, x, -1);
          if (q == null || q.k.signum() >= 0) {
            return null;
          }
          final Expr r = expr.sqrt(expr.num(q.k.negate()));
          return expr.div(
              expr.sub(expr.lnAbs(expr.sub(x, r)), expr.lnAbs(expr.add(x, r))),
              expr.mul(expr.num(2), expr.num(q.c), r));
        }));

    // 1 / sqrt(d - m x ^ 2) -> arcsin(x / sqrt(k)) / sqrt(m)
    list.add(
        new Entry("1/sqrt(k-x^2)", (f, x) -> {
          final @Nullable Quadratic q =
              quadraticPower(f, x, BigRational.HALF.negate());
          if (q == null || q.c.signum() >= 0 || q.k.signum() >= 0) {
            return null;
          }
          return expr.div(arcsin(x, q.k.negate()),
              expr.sqrt(expr.num(q.c.negate())));
        }));

    // 1 / sqrt(c x ^ 2 + d) -> ln|x + sqrt(x ^ 2 + k)| / sqrt(c)
    list.add(
        new Entry("1/sqrt(x^2+k)", (f, x) -> {
          final @Nullable Quadratic q =
              quadraticPower(f, x, BigRational.HALF.negate());
          if (q == null || q.c.signum() <= 0) {
            return null;
          }
          return expr.div(asinhLog(x, q.k), expr.sqrt(expr.num(q.c)));
        }));

    // sqrt(d - m x ^ 2)
    //   -> sqrt(m) (x sqrt(r - x ^ 2) + r arcsin(x / sqrt(r))) / 2
    list.add(
        new Entry("sqrt(k-x^2)", (f, x) -> {
          final @Nullable Quadratic q = quadraticPower(f, x, BigRational.HALF);
          if (q == null || q.c.signum() >= 0 || q.k.signum() >= 0) {
            return null;
          }
          final BigRational r = q.k.negate();
          final Expr root =
              expr.sqrt(expr.sub(expr.num(r), expr.pow(x, 2)));
          return expr.mul(expr.num(1, 2), expr.sqrt(expr.num(q.c.negate())),
              expr.add(expr.mul(x, root), expr.mul(expr.num(r), arcsin(x, r))));
        }));

    // sqrt(c x ^ 2 + d)
    //   -> sqrt(c) (x sqrt(x ^ 2 + k) + k ln|x + sqrt(x ^ 2 + k)|) / 2
    list.add(
        new Entry("sqrt(x^2+k)", (f, x) -> {
          final @Nullable Quadratic q = quadraticPower(f, x, BigRational.HALF);
          if (q == null || q.c.signum() <= 0) {
            return null;
          }
          final Expr root =
              expr.sqrt(expr.add(expr.pow(x, 2), expr.num(q.k)));
          return expr.mul(expr.num(1, 2), expr.sqrt(expr.num(q.c)),
              expr.add(expr.mul(x, root),
                  expr.mul(expr.num(q.k), asinhLog(x, q.k))));
        }));

    // x / (c x ^ 2 + d) -> ln|c x ^ 2 + d| / (2 c)
    list.add(
        new Entry("x/(x^2+k)", (f, x) -> {
          final @Nullable List<Expr> pair =
              pair(f, e -> e.equals(x),
                  e -> quadraticPower(e, x, BigRational.MINUS_ONE) != null);
          if (pair == null) {
            return null;
          }
          final Quadratic q =
              requireNonNull(quadraticPower(pair.get(1), x,
                  BigRational.MINUS_ONE));
          return expr.div(expr.lnAbs(base(pair.get(1))),
              expr.mul(expr.num(2), expr.num(q.c)));
        }));

    // x exp(a x ^ 2 + b) -> exp(a x ^ 2 + b) / (2 a)
    list.add(
        new Entry("x*exp(a*x^2+b)", (f, x) -> {
          final @Nullable List<Expr> pair =
              pair(f, e -> e.equals(x), e -> e.isCall(BuiltIn.EXP));
          if (pair == null) {
            return null;
          }
          final @Nullable List<Expr> c =
              Polynomials.coefficients(((Expr.Call) pair.get(1)).arg, x);
          if (c == null || c.size() != 3 || !c.get(1).isNum(0)) {
            return null;
          }
          return expr.div(pair.get(1), expr.mul(expr.num(2), c.get(2)));
        }));

    // p(x) exp(a x + b) -> exp(a x + b) sum_k (-1)^k p^(k)(x) / a^(k+1)
    list.add(
        new Entry("p(x)*exp(a*x+b)", (f, x) -> {
          if (!(f instanceof Expr.Mul)) {
            return null;
          }
          final List<Expr> factors = ((Expr.Mul) f).factors;
          final int i =
              indexOf(factors, e -> callOfLinear(e, BuiltIn.EXP, x) != null);
          if (i < 0) {
            return null;
          }
          final Expr p = productWithout(factors, i);
          final @Nullable List<Expr> c = Polynomials.coefficients(p, x);
          if (c == null || c.size() > MAX_POLY_DEGREE + 1) {
            return null;
          }
          final Expr e = factors.get(i);
          final Expr a =
              requireNonNull(callOfLinear(e, BuiltIn.EXP, x)).a;
          final List<Expr> terms = new ArrayList<>();
          Expr d = p;
          for (int k = 0; k < c.size(); k++) {
            terms.add(
                expr.div(k % 2 == 0 ? d : expr.neg(d), expr.pow(a, k + 1)));
            d = Differentiator.derivative(d, x);
          }
          return expr.mul(e, expr.add(terms));
        }));

    // x sin(a x + b) -> sin(a x + b) / a ^ 2 - x cos(a x + b) / a
    list.add(
        new Entry("x*sin(a*x+b)", (f, x) -> {
          final @Nullable List<Expr> pair =
              pair(f, e -> e.equals(x),
                  e -> callOfLinear(e, BuiltIn.SIN, x) != null);
          if (pair == null) {
            return null;
          }
          final Expr u = ((Expr.Call) pair.get(1)).arg;
          final Expr a =
              requireNonNull(callOfLinear(pair.get(1), BuiltIn.SIN, x)).a;
          return expr.sub(expr.div(expr.sin(u), expr.pow(a, 2)),
              expr.div(expr.mul(x, expr.cos(u)), a));
        }));

    // x cos(a x + b) -> cos(a x + b) / a ^ 2 + x sin(a x + b) / a
    list.add(
        new Entry("x*cos(a*x+b)", (f, x) -> {
          final @Nullable List<Expr> pair =
              pair(f, e -> e.equals(x),
                  e -> callOfLinear(e, BuiltIn.COS, x) != null);
          if (pair == null) {
            return null;
          }
          final Expr u = ((Expr.Call) pair.get(1)).arg;
          final Expr a =
              requireNonNull(callOfLinear(pair.get(1), BuiltIn.COS, x)).a;
          return expr.add(expr.div(expr.cos(u), expr.pow(a, 2)),
              expr.div(expr.mul(x, expr.sin(u)), a));
        }));

    // exp(a x) sin(b x) -> exp(a x) (a sin(b x) - b cos(b x)) / (a^2 + b^2)
    list.add(expTrigEntry("exp(a*x)*sin(b*x)", BuiltIn.SIN));
    // exp(a x) cos(b x) -> exp(a x) (a cos(b x) + b sin(b x)) / (a^2 + b^2)
    list.add(expTrigEntry("exp(a*x)*cos(b*x)", BuiltIn.COS));

    // x ^ n ln(x) -> x ^ (n + 1) ln(x) / (n + 1) - x ^ (n + 1) / (n + 1) ^ 2
    list.add(
        new Entry("x^n*ln(x)", (f, x) -> {
          final @Nullable List<Expr> pair =
              pair(f, e -> e.equals(x) || isPowOfX(e, x),
                  e -> e.equals(expr.ln(x)));
          if (pair == null) {
            return null;
          }
          final Expr n = exponent(pair.get(0));
          if (n.isNum(-1)) {
            return null;
          }
          final Expr n1 = expr.add(n, expr.one());
          final Expr xn1 = expr.pow(x, n1);
          return expr.sub(expr.div(expr.mul(xn1, expr.ln(x)), n1),
              expr.div(xn1, expr.pow(n1, 2)));
        }));

    // ln(x) / x -> ln(x) ^ 2 / 2
    list.add(
        new Entry("ln(x)/x", (f, x) -> {
          final @Nullable List<Expr> pair =
              pair(f, e -> isPow(e, x, -1), e -> e.equals(expr.ln(x)));
          return pair == null
              ? null
              : expr.mul(expr.num(1, 2), expr.pow(expr.ln(x), 2));
        }));

    // 1 / (x ln(x)) -> ln|ln(x)|
    list.add(
        new Entry("1/(x*ln(x))", (f, x) -> {
          final @Nullable List<Expr> pair =
              pair(f, e -> isPow(e, x, -1),
                  e -> e.equals(expr.pow(expr.ln(x), -1)));
          return pair == null ? null : expr.lnAbs(expr.ln(x));
        }));

    return list;
  }

  /** Maximum degree of the polynomial in "p(x) * exp(a * x + b)". */
  private static final int MAX_POLY_DEGREE = 8;

  /** Returns whether e is {@code x ^ n}. */
  private static boolean isPow(Expr e, Expr.Sym x, long n) {
    return e instanceof Expr.Pow
        && ((Expr.Pow) e).base.equals(x)
        && ((Expr.Pow) e).exponent.isNum(n);
  }

  /** Returns whether e is {@code x ^ n} with n free of x. */
  private static boolean isPowOfX(Expr e, Expr.Sym x) {
    return e instanceof Expr.Pow
        && ((Expr.Pow) e).base.equals(x)
        && ((Expr.Pow) e).exponent instanceof Expr.Num;
  }

  private static Expr base(Expr e) {
    return e instanceof Expr.Pow ? ((Expr.Pow) e).base : e;
  }

  private static Expr exponent(Expr e) {
    return e instanceof Expr.Pow ? ((Expr.Pow) e).exponent : expr.one();
  }

  /**
   * If {@code e} is {@code fn(a x + b)}, returns the linear argument;
   * otherwise null.
   */
  static Exprs.@Nullable Linear callOfLinear(Expr e, BuiltIn fn,
      Expr.Sym x) {
    return e.isCall(fn) ? Exprs.linear(((Expr.Call) e).arg, x) : null;
  }

  /**
   * If {@code e} is {@code (a x + b) ^ n}, returns the linear base;
   * otherwise null.
   */
  private static Exprs.@Nullable Linear powOfLinear(Expr e, Expr.Sym x,
      long n) {
    return e instanceof Expr.Pow && ((Expr.Pow) e).exponent.isNum(n)
        ? Exprs.linear(((Expr.Pow) e).base, x)
        : null;
  }

  /** If {@code e} is {@code fn(a x + b) ^ 2}, returns the argument. */
  private static Exprs.@Nullable Linear squareOf(Expr e, BuiltIn fn,
      Expr.Sym x) {
    return e instanceof Expr.Pow && ((Expr.Pow) e).exponent.isNum(2)
        ? callOfLinear(((Expr.Pow) e).base, fn, x)
        : null;
  }

  /** Returns {@code x / 2 + sign * sin(2 u) / (4 a)}. */
  private static Expr sinSquared(Expr f, Expr.Sym x, Exprs.Linear u,
      int sign) {
    final Expr arg = ((Expr.Call) ((Expr.Pow) f).base).arg;
    return expr.add(expr.mul(expr.num(1, 2), x),
        expr.div(expr.mul(expr.num(sign), expr.sin(expr.mul(expr.num(2), arg))),
            expr.mul(expr.num(4), u.a)));
  }

  /**
   * Creates an entry for {@code fn(u) ^ n}, whose antiderivative is
   * {@code +/- g(u) / a}.
   */
  private static Entry squareEntry(String name, BuiltIn fn, int n, BuiltIn g,
      boolean negate) {
    return new Entry(name, (f, x) -> {
      if (!(f instanceof Expr.Pow) || !((Expr.Pow) f).exponent.isNum(n)) {
        return null;
      }
      final Expr base = ((Expr.Pow) f).base;
      final Exprs.@Nullable Linear u = callOfLinear(base, fn, x);
      if (u == null) {
        return null;
      }
      final Expr e = expr.div(expr.call(g, ((Expr.Call) base).arg), u.a);
      return negate ? expr.neg(e) : e;
    });
  }

  /**
   * Creates an entry for a product {@code fn0(u) ^ n0 * fn1(u) ^ n1} of two
   * functions of the same linear argument.
   */
  private static Entry productEntry(String name, BuiltIn fn0, int n0,
      BuiltIn fn1, int n1, ProductRule rule) {
    return new Entry(name, (f, x) -> {
      final @Nullable List<Expr> pair =
          pair(f, e -> isCallPower(e, fn0, n0), e -> isCallPower(e, fn1, n1));
      if (pair == null) {
        return null;
      }
      final Expr u = ((Expr.Call) base(pair.get(0))).arg;
      if (!u.equals(((Expr.Call) base(pair.get(1))).arg)) {
        return null;
      }
      final Exprs.@Nullable Linear linear = Exprs.linear(u, x);
      return linear == null ? null : rule.apply(u, linear.a);
    });
  }

  private static boolean isCallPower(Expr e, BuiltIn fn, int n) {
    return n == 1
        ? e.isCall(fn)
        : e instanceof Expr.Pow
            && ((Expr.Pow) e).exponent.isNum(n)
            && ((Expr.Pow) e).base.isCall(fn);
  }

  /** Creates an entry for {@code exp(a x + c) * fn(b x + d)}. */
  private static Entry expTrigEntry(String name, BuiltIn fn) {
    return new Entry(name, (f, x) -> {
      final @Nullable List<Expr> pair =
          pair(f, e -> callOfLinear(e, BuiltIn.EXP, x) != null,
              e -> callOfLinear(e, fn, x) != null);
      if (pair == null) {
        return null;
      }
      final Expr a =
          requireNonNull(callOfLinear(pair.get(0), BuiltIn.EXP, x)).a;
      final Expr b = requireNonNull(callOfLinear(pair.get(1), fn, x)).a;
      final Expr v = ((Expr.Call) pair.get(1)).arg;
      final Expr numerator = fn == BuiltIn.SIN
          ? expr.sub(expr.mul(a, expr.sin(v)), expr.mul(b, expr.cos(v)))
          : expr.add(expr.mul(a, expr.cos(v)), expr.mul(b, expr.sin(v)));
      return expr.div(expr.mul(pair.get(0), numerator),
          expr.add(expr.pow(a, 2), expr.pow(b, 2)));
    });
  }

  /** Returns {@code arcsin(x / sqrt(r))}. */
  private static Expr arcsin(Expr.Sym x, BigRational r) {
    return expr.call(BuiltIn.ARCSIN, expr.div(x, expr.sqrt(expr.num(r))));
  }

  /** Returns {@code ln|x + sqrt(x ^ 2 + k)|}. */
  private static Expr asinhLog(Expr.Sym x, BigRational k) {
    return expr.lnAbs(
        expr.add(x, expr.sqrt(expr.add(expr.pow(x, 2), expr.num(k)))));
  }

  /**
   * If {@code e} is {@code (c x ^ 2 + d) ^ n} with rational c and d,
   * returns c and k = d / c; otherwise null.
   */
  private static @Nullable Quadratic quadraticPower(Expr e, Expr.Sym x,
      long n) {
    return quadraticPower(e, x, BigRational.of(n));
  }

  private static @Nullable Quadratic quadraticPower(Expr e, Expr.Sym x,
      BigRational n) {
    if (!(e instanceof Expr.Pow)
        || !((Expr.Pow) e).exponent.equals(expr.num(n))) {
      return null;
    }
    final @Nullable List<Expr> c =
        Polynomials.coefficients(((Expr.Pow) e).base, x);
    if (c == null
        || c.size() != 3
        || !c.get(1).isNum(0)
        || !c.get(0).isNum()
        || !c.get(2).isNum()
        || c.get(0).isNum(0)) {
      return null;
    }
    final BigRational c2 = c.get(2).asNum().value;
    return new Quadratic(c2, c.get(0).asNum().value.divide(c2));
  }

  /**
   * If {@code e} is a product of two factors that satisfy two predicates,
   * in either order, returns them in the order of the predicates;
   * otherwise null.
   */
  private static @Nullable List<Expr> pair(Expr e, Predicate<Expr> p0,
      Predicate<Expr> p1) {
    if (!(e instanceof Expr.Mul) || ((Expr.Mul) e).factors.size() != 2) {
      return null;
    }
    final Expr f0 = ((Expr.Mul) e).factors.get(0);
    final Expr f1 = ((Expr.Mul) e).factors.get(1);
    if (p0.test(f0) && p1.test(f1)) {
      return ImmutableList.of(f0, f1);
    }
    if (p0.test(f1) && p1.test(f0)) {
      return ImmutableList.of(f1, f0);
    }
    return null;
  }

  private static int indexOf(List<Expr> list, Predicate<Expr> predicate) {
    for (int i = 0; i < list.size(); i++) {
      if (predicate.test(list.get(i))) {
        return i;
      }
    }
    return -1;
  }

  /** Returns the product of all factors but one. */
  private static Expr productWithout(List<Expr> factors, int i) {
    return expr.mul(Static.remove(factors, i));
  }

  /** Builds the antiderivative of a product of two trigonometric calls. */
  @FunctionalInterface
  private interface ProductRule {
    Expr apply(Expr u, Expr a);
  }

  /** Quadratic {@code c (x ^ 2 + k)}. */
  private static class Quadratic {
    final BigRational c;
    final BigRational k;

    Quadratic(BigRational c, BigRational k) {
      this.c = c;
      this.k = k;
    }
  }
}

// End IntegrationTable.java
