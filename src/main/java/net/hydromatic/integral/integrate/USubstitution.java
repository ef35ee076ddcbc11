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

import static net.hydromatic.integral.ast.ExprBuilder.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.integral.algebra.Exprs;
import net.hydromatic.integral.algebra.Replacer;
import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.ast.Shuttle;
import net.hydromatic.integral.calculus.Differentiator;
import net.hydromatic.integral.util.BigRational;
import net.hydromatic.integral.util.Deadline;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Strategy that integrates by substitution.
 *
 * <p>Looks for an inner expression g(x) such that f(x) / g'(x), with g(x)
 * replaced by a new variable u, no longer contains x. Candidates are the
 * arguments of function calls, the bases and exponents of powers, and the
 * factors of products. The candidates that reduce are ranked (see
 * {@link SubstitutionCandidate#compareTo}) and tried in order, up to
 * {@link Prop#SUBSTITUTION_MAX_CANDIDATES}; the first whose reduced
 * integrand can be integrated in u wins.
 *
 * <p>For example, for {@code sin(x) ^ 3 * cos(x)}, g = sin(x) reduces the
 * integrand to {@code u ^ 3}.
 */
public class USubstitution implements Strategy {
  /** Integrands larger than this are not attempted. */
  static final int MAX_SIZE = 200;

  @Override public StrategyKind kind() {
    return StrategyKind.SUBSTITUTION;
  }

  @Override public StrategyOutcome attempt(IntegrationRequest request,
      Integrator integrator) {
    final Expr f = request.integrand;
    final Expr.Sym x = request.variable;
    if (Exprs.size(f) > MAX_SIZE) {
      return StrategyOutcome.notApplicable();
    }
    final int max = integrator.intValue(Prop.SUBSTITUTION_MAX_CANDIDATES);
    final List<SubstitutionCandidate> candidates =
        candidates(f, x, max * 4, request.deadline);
    if (request.deadline.isExpired()) {
      return StrategyOutcome.timedOut();
    }
    int tried = 0;
    for (SubstitutionCandidate candidate : candidates) {
      if (tried++ >= max) {
        break;
      }
      if (request.deadline.isExpired()) {
        return StrategyOutcome.timedOut();
      }
      final Expr g =
          integrator.integrate(request.nested(candidate.reduced, candidate.u));
      if (Integrator.isClosed(g)) {
        return StrategyOutcome.found(
            Replacer.replace(g, candidate.u, candidate.inner));
      }
    }
    return StrategyOutcome.notApplicable();
  }

  /**
   * Returns the candidates that reduce an integrand, best first.
   *
   * <p>A candidate whose reduced integrand is not smaller than the integrand
   * is discarded, so that nested substitutions cannot cycle. Stops early,
   * returning the candidates found so far, if the deadline expires.
   *
   * @param f Integrand
   * @param x Variable
   * @param limit Maximum number of inner expressions to examine
   * @param deadline Deadline
   */
  static List<SubstitutionCandidate> candidates(Expr f, Expr.Sym x,
      int limit, Deadline deadline) {
    final Set<Expr> inners = new LinkedHashSet<>();
    collect(f, x, inners);
    final Expr.Sym u = Exprs.freshSymbol(f, "u");
    final int size = Exprs.size(f);
    final List<SubstitutionCandidate> list = new ArrayList<>();
    int examined = 0;
    for (Expr inner : inners) {
      if (examined++ >= limit || deadline.isExpired()) {
        break;
      }
      final @Nullable Expr reduced = reduce(f, x, inner, u);
      if (reduced != null && Exprs.size(reduced) < size) {
        list.add(new SubstitutionCandidate(inner, u, reduced));
      }
    }
    Collections.sort(list);
    return list;
  }

  /** Collects the inner expressions of an expression. */
  private static void collect(Expr e, Expr.Sym x, Set<Expr> inners) {
    switch (e.op) {
      case CALL:
        add(((Expr.Call) e).arg, x, inners);
        break;
      case POW:
        add(((Expr.Pow) e).base, x, inners);
        add(((Expr.Pow) e).exponent, x, inners);
        break;
      case MUL:
        for (Expr factor : ((Expr.Mul) e).factors) {
          add(factor, x, inners);
        }
        break;
      default:
        break;
    }
    for (Expr operand : e.operands()) {
      collect(operand, x, inners);
    }
  }

  private static void add(Expr e, Expr.Sym x, Set<Expr> inners) {
    if (!e.equals(x) && !Exprs.freeOf(e, x)) {
      inners.add(e);
    }
  }

  /**
   * Computes {@code f / g'} with g replaced by u; returns null if the result
   * still contains x.
   */
  static @Nullable Expr reduce(Expr f, Expr.Sym x, Expr g, Expr.Sym u) {
    final Expr dg = Differentiator.derivative(g, x);
    if (dg.isNum(0)) {
      return null;
    }
    final Expr q = Simplifier.simplify(expr.div(f, dg));
    final Expr replaced;
    if (g instanceof Expr.Pow
        && ((Expr.Pow) g).base.equals(x)
        && ((Expr.Pow) g).exponent instanceof Expr.Num) {
      // g = x ^ n; also rewrite x ^ m as u ^ (m / n)
      final BigRational n = ((Expr.Num) ((Expr.Pow) g).exponent).value;
      final PowerReplacer replacer = new PowerReplacer(x, u, n);
      replaced = q.accept(replacer);
      if (replacer.failed) {
        return null;
      }
    } else {
      replaced = Replacer.replace(q, g, u);
    }
    final Expr reduced = Simplifier.simplify(replaced);
    return Exprs.freeOf(reduced, x) ? reduced : null;
  }

  /**
   * Shuttle that replaces {@code x ^ m} by {@code u ^ (m / n)}.
   *
   * <p>That identity holds for all x only if m / n is an integer. If x
   * occurs with any other power, sets {@link #failed}.
   */
  private static class PowerReplacer extends Shuttle {
    private final Expr.Sym x;
    private final Expr.Sym u;
    private final BigRational n;
    boolean failed;

    PowerReplacer(Expr.Sym x, Expr.Sym u, BigRational n) {
      this.x = x;
      this.u = u;
      this.n = n;
    }

    @Override public Expr visit(Expr.Sym sym) {
      return sym.equals(x) ? power(BigRational.ONE) : sym;
    }

    @Override public Expr visit(Expr.Pow pow) {
      if (pow.base.equals(x) && pow.exponent instanceof Expr.Num) {
        return power(((Expr.Num) pow.exponent).value);
      }
      return super.visit(pow);
    }

    private Expr power(BigRational m) {
      final BigRational k = m.divide(n);
      if (!k.isInteger()) {
        failed = true;
        return x;
      }
      return expr.pow(u, k);
    }
  }
}

// End USubstitution.java
