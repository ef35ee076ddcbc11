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
package net.hydromatic.integral.integrate.risch;

import static java.util.Objects.requireNonNull;

import net.hydromatic.integral.ast.Expr;

/**
 * Level of an {@link ExtensionTower}: a generator t and its derivative.
 *
 * <p>Level 0 is always the integration variable x, with x' = 1. Each
 * higher level is an exponential t = exp(g), with t' = g' t, or a logarithm
 * t = ln(u), with t' = u' / u, where g and u are elements of lower levels.
 */
public class TowerLevel {
  /** Kind of generator. */
  public enum Kind {
    VARIABLE,
    EXPONENTIAL,
    LOGARITHMIC
  }

  public final int index;
  public final Kind kind;
  /** The generator as an expression, used when converting back. */
  public final Expr generator;
  /** The argument: g for exp(g), u for ln(u); 1 for the variable. */
  public final TowerElement argument;
  /** For an exponential, g'; for a logarithm, u' / u; for x, 1. The
   * derivative of the generator is {@code eta * t} for an exponential and
   * {@code eta} otherwise. */
  public final TowerElement eta;

  TowerLevel(int index, Kind kind, Expr generator, TowerElement argument,
      TowerElement eta) {
    this.index = index;
    this.kind = requireNonNull(kind);
    this.generator = requireNonNull(generator);
    this.argument = requireNonNull(argument);
    this.eta = requireNonNull(eta);
  }

  @Override public String toString() {
    return "t" + index + " = " + generator;
  }
}

// End TowerLevel.java
