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

import java.util.Optional;
import net.hydromatic.integral.algebra.Exprs;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.function.AntiderivativeRule;
import net.hydromatic.integral.function.FunctionRegistry;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Strategy that looks up the antiderivative of a function call in a
 * {@link FunctionRegistry}.
 *
 * <p>Handles {@code c * f(a * x + b)}, whose antiderivative is
 * {@code c * F(a * x + b) / a}.
 */
public class RegistryLookup implements Strategy {
  private final FunctionRegistry registry;

  public RegistryLookup(FunctionRegistry registry) {
    this.registry = requireNonNull(registry);
  }

  @Override public StrategyKind kind() {
    return StrategyKind.REGISTRY;
  }

  @Override public StrategyOutcome attempt(IntegrationRequest request,
      Integrator integrator) {
    final Expr.Sym x = request.variable;
    final Exprs.Split split = Exprs.split(request.integrand, x);
    if (!(split.dependent instanceof Expr.Call)) {
      return StrategyOutcome.notApplicable();
    }
    final Expr.Call call = (Expr.Call) split.dependent;
    final Exprs.@Nullable Linear u = Exprs.linear(call.arg, x);
    if (u == null) {
      return StrategyOutcome.notApplicable();
    }
    final Optional<AntiderivativeRule> rule =
        registry.lookupAntiderivative(call.fn.functionName);
    if (!rule.isPresent()) {
      return StrategyOutcome.notApplicable();
    }
    return StrategyOutcome.found(
        expr.div(expr.mul(split.coefficient, rule.get().apply(call.arg)),
            u.a));
  }
}

// End RegistryLookup.java
