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

import net.hydromatic.integral.ast.Expr;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of an attempt by a {@link Strategy} to integrate an expression.
 *
 * <p>Strategies report what happened using this class, never by throwing.
 */
public final class StrategyOutcome {
  private static final StrategyOutcome NOT_APPLICABLE =
      new StrategyOutcome(Kind.NOT_APPLICABLE, null, null);
  private static final StrategyOutcome TIMED_OUT =
      new StrategyOutcome(Kind.TIMED_OUT, null, null);

  public final Kind kind;

  /**
   * The antiderivative, if {@link Kind#FOUND}; the integral that was proven
   * to have no elementary antiderivative, if
   * {@link Kind#PROVEN_NON_ELEMENTARY}; otherwise null.
   */
  public final @Nullable Expr expr;

  /** Why the strategy could not proceed, if {@link Kind#UNSUPPORTED}. */
  public final @Nullable String reason;

  private StrategyOutcome(Kind kind, @Nullable Expr expr,
      @Nullable String reason) {
    this.kind = requireNonNull(kind);
    this.expr = expr;
    this.reason = reason;
  }

  /** Creates an outcome that carries an antiderivative. */
  public static StrategyOutcome found(Expr antiderivative) {
    return new StrategyOutcome(Kind.FOUND, requireNonNull(antiderivative),
        null);
  }

  /** Returns the outcome "this strategy does not handle the integrand". */
  public static StrategyOutcome notApplicable() {
    return NOT_APPLICABLE;
  }

  /**
   * Creates an outcome that states that an integral has been proven to have
   * no elementary antiderivative.
   */
  public static StrategyOutcome provenNonElementary(Expr.Integral integral) {
    return new StrategyOutcome(Kind.PROVEN_NON_ELEMENTARY,
        requireNonNull(integral), null);
  }

  /** Returns the outcome "the time budget ran out". */
  public static StrategyOutcome timedOut() {
    return TIMED_OUT;
  }

  /**
   * Creates an outcome that states that the integrand is outside the class
   * of functions that a strategy can model.
   */
  public static StrategyOutcome unsupported(String reason) {
    return new StrategyOutcome(Kind.UNSUPPORTED, null, requireNonNull(reason));
  }

  /** Returns the expression; throws if there is none. */
  public Expr expr() {
    return requireNonNull(expr, "expr");
  }

  @Override public String toString() {
    switch (kind) {
      case FOUND:
      case PROVEN_NON_ELEMENTARY:
        return kind + "(" + expr + ")";
      case UNSUPPORTED:
        return kind + "(" + reason + ")";
      default:
        return kind.toString();
    }
  }

  /** Kind of outcome. */
  public enum Kind {
    /** An antiderivative was found. */
    FOUND,
    /** The strategy does not handle this integrand; try the next one. */
    NOT_APPLICABLE,
    /** There is no elementary antiderivative; stop. */
    PROVEN_NON_ELEMENTARY,
    /** The time budget expired; go straight to the fallback. */
    TIMED_OUT,
    /**
     * The integrand is outside what the strategy can model; treated like
     * {@link #NOT_APPLICABLE}.
     */
    UNSUPPORTED
  }
}

// End StrategyOutcome.java
