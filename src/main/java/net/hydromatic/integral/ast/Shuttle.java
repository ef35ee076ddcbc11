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

import static net.hydromatic.integral.ast.ExprBuilder.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Visits and transforms expression trees.
 *
 * <p>The default implementation of each method rebuilds a node only if one of
 * its operands changed.
 */
public class Shuttle {
  protected List<Expr> visitList(List<Expr> exprs) {
    final List<Expr> list = new ArrayList<>(exprs.size());
    boolean changed = false;
    for (Expr e : exprs) {
      final Expr e2 = e.accept(this);
      changed |= e2 != e;
      list.add(e2);
    }
    return changed ? list : exprs;
  }

  public Expr visit(Expr.Num num) {
    return num; // leaf
  }

  public Expr visit(Expr.Sym sym) {
    return sym; // leaf
  }

  public Expr visit(Expr.Add add) {
    final List<Expr> terms = visitList(add.terms);
    return terms == add.terms ? add : expr.add(terms);
  }

  public Expr visit(Expr.Mul mul) {
    final List<Expr> factors = visitList(mul.factors);
    return factors == mul.factors ? mul : expr.mul(factors);
  }

  public Expr visit(Expr.Pow pow) {
    final Expr base = pow.base.accept(this);
    final Expr exponent = pow.exponent.accept(this);
    return base == pow.base && exponent == pow.exponent
        ? pow
        : expr.pow(base, exponent);
  }

  public Expr visit(Expr.Call call) {
    final Expr arg = call.arg.accept(this);
    return arg == call.arg ? call : expr.call(call.fn, arg);
  }

  /** Visits an integral. The bound variable is not visited. */
  public Expr visit(Expr.Integral integral) {
    final Expr integrand = integral.integrand.accept(this);
    if (integral.lower == null || integral.upper == null) {
      return integrand == integral.integrand
          ? integral
          : expr.integral(integrand, integral.variable);
    }
    final Expr lower = integral.lower.accept(this);
    final Expr upper = integral.upper.accept(this);
    return integrand == integral.integrand
            && lower == integral.lower
            && upper == integral.upper
        ? integral
        : expr.integral(integrand, integral.variable, lower, upper);
  }
}

// End Shuttle.java
