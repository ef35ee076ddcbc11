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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.util.Deadline;

/**
 * Request to integrate an expression with respect to a variable.
 *
 * <p>Requests are immutable. A strategy that needs to integrate a
 * sub-problem creates a request using {@link #nested(Expr)}, which
 * increments the depth, so that the dispatcher can bound recursion.
 */
public final class IntegrationRequest {
  public final Expr integrand;
  public final Expr.Sym variable;
  /** Recursion depth; 0 for a top-level request. */
  public final int depth;
  public final Deadline deadline;
  /** Strategies that must not be tried for this request. */
  public final ImmutableSet<StrategyKind> suppressed;

  private IntegrationRequest(Expr integrand, Expr.Sym variable, int depth,
      Deadline deadline, ImmutableSet<StrategyKind> suppressed) {
    this.integrand = requireNonNull(integrand);
    this.variable = requireNonNull(variable);
    this.depth = depth;
    this.deadline = requireNonNull(deadline);
    this.suppressed = requireNonNull(suppressed);
  }

  /** Creates a top-level request. */
  public static IntegrationRequest of(Expr integrand, Expr.Sym variable,
      Deadline deadline) {
    return new IntegrationRequest(integrand, variable, 0, deadline,
        ImmutableSet.of());
  }

  /**
   * Creates a request for a sub-problem in the same variable, one level
   * deeper, with the same deadline and suppressed strategies.
   */
  public IntegrationRequest nested(Expr integrand) {
    return nested(integrand, variable);
  }

  /** Creates a request for a sub-problem in a different variable. */
  public IntegrationRequest nested(Expr integrand, Expr.Sym variable) {
    return new IntegrationRequest(integrand, variable, depth + 1, deadline,
        suppressed);
  }

  /** Returns a copy of this request that does not try a given strategy. */
  public IntegrationRequest suppress(StrategyKind kind) {
    if (suppressed.contains(kind)) {
      return this;
    }
    return new IntegrationRequest(integrand, variable, depth, deadline,
        Sets.immutableEnumSet(
            ImmutableSet.<StrategyKind>builder().addAll(suppressed).add(kind)
                .build()));
  }

  /** Returns a copy of this request with a different integrand. */
  public IntegrationRequest withIntegrand(Expr integrand) {
    if (integrand.equals(this.integrand)) {
      return this;
    }
    return new IntegrationRequest(integrand, variable, depth, deadline,
        suppressed);
  }

  /** Returns a copy of this request with an earlier deadline. */
  public IntegrationRequest withDeadline(Deadline deadline) {
    return new IntegrationRequest(integrand, variable, depth,
        this.deadline.min(deadline), suppressed);
  }

  @Override public String toString() {
    return "IntegrationRequest{integrand=" + integrand
        + ", variable=" + variable
        + ", depth=" + depth
        + (suppressed.isEmpty() ? "" : ", suppressed=" + suppressed)
        + "}";
  }
}

// End IntegrationRequest.java
