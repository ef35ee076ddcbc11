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

/**
 * Strategy for integrating an expression.
 *
 * <p>A strategy must not throw; it reports its result as a
 * {@link StrategyOutcome}. If it needs to integrate a sub-problem it calls
 * {@link Integrator#integrate(IntegrationRequest)} with a nested request.
 */
public interface Strategy {
  /** Returns the kind of this strategy. */
  StrategyKind kind();

  /** Attempts to integrate the integrand of a request. */
  StrategyOutcome attempt(IntegrationRequest request, Integrator integrator);
}

// End Strategy.java
