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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.integral.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for inspecting expressions. */
public class Exprs {
  private Exprs() {}

  /** Returns whether an expression does not contain a given symbol. */
  public static boolean freeOf(Expr e, Expr.Sym x) {
    return !contains(e, x);
  }

  /** Returns whether an expression contains a given sub-expression. */
  public static boolean contains(Expr e, Expr sub) {
    if (e.equals(sub)) {
      return true;
    }
    if (e instanceof Expr.Integral
        && sub.equals(((Expr.Integral) e).variable)) {
      // The variable of an indefinite integral is free; of a definite
      // integral, it is bound and only the bounds matter.
      final Expr.Integral integral = (Expr.Integral) e;
      if (!integral.isDefinite()) {
        return true;
      }
      return contains(requireNonNull(integral.lower), sub)
          || contains(requireNonNull(integral.upper), sub);
    }
    for (Expr operand : e.operands()) {
      if (contains(operand, sub)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the number of nodes in an expression tree. */
  public static int size(Expr e) {
    int n = 1;
    for (Expr operand : e.operands()) {
      n += size(operand);
    }
    return n;
  }

  /** Returns the terms of a sum, or a singleton list. */
  public static List<Expr> terms(Expr e) {
    return e instanceof Expr.Add
        ? ((Expr.Add) e).terms
        : ImmutableList.of(e);
  }

  /** Returns the factors of a product, or a singleton list. */
  public static List<Expr> factors(Expr e) {
    return e instanceof Expr.Mul
        ? ((Expr.Mul) e).factors
        : ImmutableList.of(e);
  }

  /** Returns the symbols in an expression, sorted by name. */
  public static ImmutableSortedSet<Expr.Sym> symbols(Expr e) {
    final Set<Expr.Sym> set = new TreeSet<>(Expr.ORDERING);
    collectSymbols(e, set);
    return ImmutableSortedSet.copyOf(Expr.ORDERING, set);
  }

  private static void collectSymbols(Expr e, Set<Expr.Sym> set) {
    if (e instanceof Expr.Sym) {
      set.add((Expr.Sym) e);
    } else if (e.op == Op.INTEGRAL) {
      set.add(((Expr.Integral) e).variable);
    }
    for (Expr operand : e.operands()) {
      collectSymbols(operand, set);
    }
  }

  /**
   * Returns a symbol that does not occur in an expression, based on a given
   * name: "u", "u1", "u2", ...
   */
  public static Expr.Sym freshSymbol(Expr e, String name) {
    final Set<Expr.Sym> symbols = symbols(e);
    Expr.Sym sym = expr.sym(name);
    for (int i = 1; symbols.contains(sym); i++) {
      sym = expr.sym(name + i);
    }
    return sym;
  }

  /**
   * Splits a simplified expression into the product of a part free of
   * {@code x} and a part that depends on {@code x}.
   *
   * <p>For example, {@code 3 * a * x ^ 2 * sin(x)} splits into
   * {@code 3 * a} and {@code x ^ 2 * sin(x)}.
   */
  public static Split split(Expr e, Expr.Sym x) {
    if (freeOf(e, x)) {
      return new Split(e, expr.one());
    }
    final List<Expr> free = new ArrayList<>();
    final List<Expr> dependent = new ArrayList<>();
    for (Expr factor : factors(e)) {
      (freeOf(factor, x) ? free : dependent).add(factor);
    }
    return new Split(
        Simplifier.simplifyMul(free), Simplifier.simplifyMul(dependent));
  }

  /**
   * If an expression is linear in {@code x}, that is {@code a * x + b} with
   * {@code a} non-zero and {@code a}, {@code b} free of {@code x}, returns
   * the coefficients; otherwise null.
   */
  public static @Nullable Linear linear(Expr e, Expr.Sym x) {
    if (e.equals(x)) {
      return new Linear(expr.one(), expr.zero());
    }
    final List<Expr> as = new ArrayList<>();
    final List<Expr> bs = new ArrayList<>();
    for (Expr term : terms(Expander.expand(e))) {
      if (freeOf(term, x)) {
        bs.add(term);
        continue;
      }
      final Split split = split(term, x);
      if (!split.dependent.equals(x)) {
        return null;
      }
      as.add(split.coefficient);
    }
    final Expr a = Simplifier.simplifyAdd(as);
    if (a.isNum(0)) {
      return null;
    }
    return new Linear(a, Simplifier.simplifyAdd(bs));
  }

  /** Product of a factor free of a variable and a dependent factor. */
  public static class Split {
    /** Factor free of the variable; 1 if there is none. */
    public final Expr coefficient;
    /** Factor that depends on the variable; 1 if there is none. */
    public final Expr dependent;

    Split(Expr coefficient, Expr dependent) {
      this.coefficient = requireNonNull(coefficient);
      this.dependent = requireNonNull(dependent);
    }
  }

  /** Coefficients of a linear expression {@code a * x + b}. */
  public static class Linear {
    public final Expr a;
    public final Expr b;

    Linear(Expr a, Expr b) {
      this.a = requireNonNull(a);
      this.b = requireNonNull(b);
    }

    /** Returns whether this is {@code x}, that is, a = 1 and b = 0. */
    public boolean isIdentity() {
      return a.isNum(1) && b.isNum(0);
    }
  }
}

// End Exprs.java
