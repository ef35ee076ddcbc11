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
 * Kind of integration strategy.
 *
 * <p>The dispatcher tries strategies in the order of this enum's constants.
 */
public enum StrategyKind {
  /** Table of canonical forms. */
  TABLE,
  /** Rational functions, via partial fractions. */
  RATIONAL,
  /** Lookup of a function's antiderivative by name. */
  REGISTRY,
  /** Integration by parts. */
  BY_PARTS,
  /** U-substitution. */
  SUBSTITUTION,
  /** Powers and products of sines and cosines. */
  TRIGONOMETRIC,
  /** Risch decision procedure for exponential and logarithmic towers. */
  RISCH,
  /** Sums and constant multiples, term by term. */
  LINEARITY,
  /** Unevaluated integral. */
  FALLBACK
}

// End StrategyKind.java
