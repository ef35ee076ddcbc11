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

import net.hydromatic.integral.ast.Expr;

/** Called on various events during integration. */
public interface Tracer {
  /** Called when a strategy has produced an outcome. */
  void onOutcome(IntegrationRequest request, StrategyKind kind,
      StrategyOutcome outcome);

  /**
   * Called when a strategy throws. The integrator treats the strategy as not
   * applicable and carries on.
   */
  void onException(IntegrationRequest request, StrategyKind kind,
      RuntimeException e);

  /**
   * Called when a strategy's antiderivative fails verification: its
   * derivative is not equal to the integrand.
   */
  void onRejected(IntegrationRequest request, StrategyKind kind,
      Expr antiderivative);

  /** Called when a request is too deep to attempt any strategy. */
  void onDepthExceeded(IntegrationRequest request);

  /** Called with the result of each request, nested or not. */
  void onResult(IntegrationRequest request, Expr result);
}

// End Tracer.java
