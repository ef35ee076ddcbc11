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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.ast.Shuttle;

/**
 * Shuttle that replaces sub-expressions.
 *
 * <p>Each node is checked against the map before its operands are visited,
 * so replacing {@code sin(x)} by {@code u} in {@code sin(x) ^ 2} gives
 * {@code u ^ 2}. The result is not simplified.
 */
public class Replacer extends Shuttle {
  private final ImmutableMap<Expr, Expr> map;

  private Replacer(Map<Expr, Expr> map) {
    this.map = ImmutableMap.copyOf(map);
  }

  /** Replaces every occurrence of {@code from} in {@code e} by {@code to}. */
  public static Expr replace(Expr e, Expr from, Expr to) {
    return e.accept(new Replacer(ImmutableMap.of(from, to)));
  }

  /** Replaces occurrences of the keys of a map by their values. */
  public static Expr replace(Expr e, Map<Expr, Expr> map) {
    return e.accept(new Replacer(map));
  }

  /**
   * Replaces a symbol by an expression and simplifies. Used to evaluate
   * an antiderivative at a bound.
   */
  public static Expr substitute(Expr e, Expr.Sym x, Expr value) {
    return Simplifier.simplify(replace(e, x, value));
  }

  private Expr lookup(Expr e) {
    final Expr e2 = map.get(e);
    return e2 == null ? e : requireNonNull(e2);
  }

  @Override public Expr visit(Expr.Num num) {
    return lookup(num);
  }

  @Override public Expr visit(Expr.Sym sym) {
    return lookup(sym);
  }

  @Override public Expr visit(Expr.Add add) {
    final Expr e = lookup(add);
    return e != add ? e : super.visit(add);
  }

  @Override public Expr visit(Expr.Mul mul) {
    final Expr e = lookup(mul);
    return e != mul ? e : super.visit(mul);
  }

  @Override public Expr visit(Expr.Pow pow) {
    final Expr e = lookup(pow);
    return e != pow ? e : super.visit(pow);
  }

  @Override public Expr visit(Expr.Call call) {
    final Expr e = lookup(call);
    return e != call ? e : super.visit(call);
  }

  @Override public Expr visit(Expr.Integral integral) {
    final Expr e = lookup(integral);
    return e != integral ? e : super.visit(integral);
  }
}

// End Replacer.java
