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
import java.util.List;
import net.hydromatic.integral.algebra.Expander;
import net.hydromatic.integral.algebra.Exprs;
import net.hydromatic.integral.ast.Expr;

/**
 * Strategy that integrates sums term by term and pulls out constant
 * factors.
 *
 * <p>If the integrand is a product that contains sums, it is expanded
 * first. The strategy succeeds only if every term has a closed-form
 * antiderivative.
 */
public class Linearity implements Strategy {
  @Override public StrategyKind kind() {
    return StrategyKind.LINEARITY;
  }

  @Override public StrategyOutcome attempt(IntegrationRequest request,
      Integrator integrator) {
    final Expr f = request.integrand;
    final Expr.Sym x = request.variable;
    if (f instanceof Expr.Add) {
      return sum(request, integrator, ((Expr.Add) f).terms);
    }
    final Exprs.Split split = Exprs.split(f, x);
    if (!split.coefficient.isNum(1)) {
      // Constant multiple: integral(c g) = c integral(g)
      final Expr g = integrator.integrate(request.nested(split.dependent));
      if (!Integrator.isClosed(g)) {
        return StrategyOutcome.notApplicable();
      }
      return StrategyOutcome.found(expr.mul(split.coefficient, g));
    }
    final Expr expanded = Expander.expand(f);
    if (expanded instanceof Expr.Add && !expanded.equals(f)) {
      return sum(request, integrator, ((Expr.Add) expanded).terms);
    }
    return StrategyOutcome.notApplicable();
  }

  private static StrategyOutcome sum(IntegrationRequest request,
      Integrator integrator, List<Expr> terms) {
    final List<Expr> results = new ArrayList<>();
    for (Expr term : terms) {
      final Expr g = integrator.integrate(request.nested(term));
      if (!Integrator.isClosed(g)) {
        return StrategyOutcome.notApplicable();
      }
      results.add(g);
    }
    return StrategyOutcome.found(expr.add(results));
  }
}

// End Linearity.java
