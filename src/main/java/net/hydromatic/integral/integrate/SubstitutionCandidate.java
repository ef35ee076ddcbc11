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

import com.google.common.collect.ComparisonChain;
import net.hydromatic.integral.algebra.Exprs;
import net.hydromatic.integral.ast.Expr;

/**
 * Candidate for u-substitution: an inner expression g(x), and the integrand
 * rewritten in terms of a new variable u = g(x).
 */
public class SubstitutionCandidate
    implements Comparable<SubstitutionCandidate> {
  /** The inner expression, g(x). */
  public final Expr inner;
  /** The variable that replaces the inner expression. */
  public final Expr.Sym u;
  /** The integrand divided by g'(x), with g(x) replaced by u. */
  public final Expr reduced;
  /** Size of the reduced integrand; smaller is better. */
  public final int score;

  SubstitutionCandidate(Expr inner, Expr.Sym u, Expr reduced) {
    this.inner = requireNonNull(inner);
    this.u = requireNonNull(u);
    this.reduced = requireNonNull(reduced);
    this.score = Exprs.size(reduced);
  }

  /**
   * Orders candidates best first: smallest reduced integrand, then largest
   * inner expression, then by expression order.
   */
  @Override public int compareTo(SubstitutionCandidate o) {
    return ComparisonChain.start()
        .compare(score, o.score)
        .compare(Exprs.size(o.inner), Exprs.size(inner))
        .compare(inner, o.inner, Expr.ORDERING)
        .result();
  }

  @Override public String toString() {
    return "u = " + inner + ": " + reduced;
  }
}

// End SubstitutionCandidate.java
