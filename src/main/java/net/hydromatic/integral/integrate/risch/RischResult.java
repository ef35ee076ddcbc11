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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.integral.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.util.BigRational;

/**
 * Result of integrating a tower element.
 *
 * <p>An elementary result is {@code rational + sum c_i ln|v_i| + extra},
 * where {@code rational} and each {@code v_i} are tower elements and
 * {@code extra} is a closed expression (used for parts that were handed
 * to the rational-function integrator).
 */
public final class RischResult {
  /** Kind of result. */
  public enum Kind {
    ELEMENTARY,
    /** The integral is proven not to be elementary. */
    NON_ELEMENTARY,
    /** The procedure could not decide. */
    UNDECIDED,
    TIMED_OUT
  }

  private static final RischResult NON_ELEMENTARY =
      new RischResult(Kind.NON_ELEMENTARY, TowerField.INSTANCE.zero(),
          ImmutableList.of(), expr.zero());
  private static final RischResult UNDECIDED =
      new RischResult(Kind.UNDECIDED, TowerField.INSTANCE.zero(),
          ImmutableList.of(), expr.zero());
  private static final RischResult TIMED_OUT =
      new RischResult(Kind.TIMED_OUT, TowerField.INSTANCE.zero(),
          ImmutableList.of(), expr.zero());

  public final Kind kind;
  public final TowerElement rational;
  public final ImmutableList<LogTerm> logs;
  public final Expr extra;

  private RischResult(Kind kind, TowerElement rational,
      ImmutableList<LogTerm> logs, Expr extra) {
    this.kind = requireNonNull(kind);
    this.rational = requireNonNull(rational);
    this.logs = requireNonNull(logs);
    this.extra = requireNonNull(extra);
  }

  public static RischResult elementary(TowerElement rational,
      List<LogTerm> logs, Expr extra) {
    return new RischResult(Kind.ELEMENTARY, rational,
        ImmutableList.copyOf(logs), extra);
  }

  public static RischResult elementary(TowerElement rational) {
    return elementary(rational, ImmutableList.of(), expr.zero());
  }

  public static RischResult nonElementary() {
    return NON_ELEMENTARY;
  }

  public static RischResult undecided() {
    return UNDECIDED;
  }

  public static RischResult timedOut() {
    return TIMED_OUT;
  }

  /** Returns whether part of the integral is held as a closed
   * expression rather than in the tower. */
  public boolean hasExtra() {
    return !extra.equals(expr.zero());
  }

  public boolean isElementary() {
    return kind == Kind.ELEMENTARY;
  }

  /**
   * Adds the integrals of two parts of an integrand.
   *
   * <p>A part that is not elementary makes the sum not elementary: each
   * part comes from a condition that every elementary integral satisfies.
   * Otherwise a timeout, then an undecided part, spoils the sum.
   */
  public RischResult plus(RischResult o) {
    if (kind == Kind.NON_ELEMENTARY || o.kind == Kind.NON_ELEMENTARY) {
      return NON_ELEMENTARY;
    }
    if (kind == Kind.TIMED_OUT || o.kind == Kind.TIMED_OUT) {
      return TIMED_OUT;
    }
    if (kind == Kind.UNDECIDED || o.kind == Kind.UNDECIDED) {
      return UNDECIDED;
    }
    final List<LogTerm> list = new ArrayList<>(logs);
    list.addAll(o.logs);
    final Expr sum =
        !hasExtra() ? o.extra
            : !o.hasExtra() ? extra
            : expr.add(extra, o.extra);
    return elementary(TowerField.INSTANCE.add(rational, o.rational), list,
        sum);
  }

  /** Converts an elementary result to an expression in x. */
  public Expr toExpr(ExtensionTower tower) {
    checkArgument(isElementary(), "not elementary: %s", kind);
    final List<Expr> terms = new ArrayList<>();
    terms.add(tower.toExpr(rational));
    for (LogTerm log : logs) {
      terms.add(
          expr.mul(expr.num(log.coefficient),
              expr.lnAbs(tower.toExpr(log.argument))));
    }
    terms.add(extra);
    return Simplifier.simplify(expr.add(terms));
  }

  @Override public String toString() {
    return kind == Kind.ELEMENTARY
        ? rational + " + " + logs + " + " + extra
        : kind.toString();
  }

  /** Term "c ln|v|" of an elementary integral. */
  public static class LogTerm {
    public final BigRational coefficient;
    public final TowerElement argument;

    public LogTerm(BigRational coefficient, TowerElement argument) {
      this.coefficient = requireNonNull(coefficient);
      this.argument = requireNonNull(argument);
    }

    @Override public String toString() {
      return coefficient + " ln(" + argument + ")";
    }
  }
}

// End RischResult.java
