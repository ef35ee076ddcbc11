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
import static net.hydromatic.integral.algebra.Rationals.Q;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.algebra.Factorizer;
import net.hydromatic.integral.algebra.LinearSystems;
import net.hydromatic.integral.algebra.Poly;
import net.hydromatic.integral.algebra.RationalFunction;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Partial fraction decomposition of a rational function over Q.
 *
 * <p>A rational function P / Q is written as a polynomial plus a sum of
 * terms {@code A / (t - r) ^ j} for each linear factor of Q and
 * {@code (B t + C) / g ^ j} for each irreducible quadratic factor g.
 */
public class PartialFractionDecomposition {
  public final Poly<BigRational> polynomial;
  public final ImmutableList<LinearTerm> linearTerms;
  public final ImmutableList<QuadraticTerm> quadraticTerms;

  private PartialFractionDecomposition(Poly<BigRational> polynomial,
      List<LinearTerm> linearTerms, List<QuadraticTerm> quadraticTerms) {
    this.polynomial = requireNonNull(polynomial);
    this.linearTerms = ImmutableList.copyOf(linearTerms);
    this.quadraticTerms = ImmutableList.copyOf(quadraticTerms);
  }

  /**
   * Decomposes a rational function; returns null if its denominator has an
   * irreducible factor of degree greater than 2 (or one that could not be
   * found).
   */
  public static @Nullable PartialFractionDecomposition decompose(
      RationalFunction<BigRational> f) {
    final Poly.DivisionResult<BigRational> division =
        f.numerator.divide(f.denominator);
    final Poly<BigRational> polynomial = division.quotient;
    if (division.remainder.isZero()) {
      return new PartialFractionDecomposition(polynomial, ImmutableList.of(),
          ImmutableList.of());
    }
    final Factorizer.Factorization factorization =
        Factorizer.factor(f.denominator);
    if (!factorization.isComplete()) {
      return null;
    }
    final Poly<BigRational> monic = f.denominator.monic();
    final Poly<BigRational> remainder =
        division.remainder.scale(factorization.unit.reciprocal());

    // One basis polynomial per unknown: monic / (t - r) ^ j for linear
    // factors; t * monic / g ^ j and monic / g ^ j for quadratic factors.
    final List<Poly<BigRational>> basis = new ArrayList<>();
    for (Factorizer.Factor factor : factorization.factors) {
      for (int j = 1; j <= factor.multiplicity; j++) {
        final Poly<BigRational> b = monic.quotient(factor.poly.pow(j));
        if (factor.kind == Factorizer.Kind.QUADRATIC) {
          basis.add(b.shift(1));
        }
        basis.add(b);
      }
    }
    final int n = monic.degree();
    final List<List<BigRational>> matrix = new ArrayList<>();
    final List<BigRational> rhs = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      final List<BigRational> row = new ArrayList<>();
      for (Poly<BigRational> b : basis) {
        row.add(b.coefficient(i));
      }
      matrix.add(row);
      rhs.add(remainder.coefficient(i));
    }
    final @Nullable List<BigRational> solution =
        LinearSystems.solve(Q, matrix, rhs, basis.size());
    if (solution == null) {
      throw new IntegrationException("no partial fractions for " + f);
    }

    final List<LinearTerm> linearTerms = new ArrayList<>();
    final List<QuadraticTerm> quadraticTerms = new ArrayList<>();
    int k = 0;
    for (Factorizer.Factor factor : factorization.factors) {
      for (int j = 1; j <= factor.multiplicity; j++) {
        if (factor.kind == Factorizer.Kind.QUADRATIC) {
          final BigRational b = solution.get(k++);
          final BigRational c = solution.get(k++);
          if (!b.isZero() || !c.isZero()) {
            quadraticTerms.add(
                new QuadraticTerm(Poly.of(Q, c, b), factor.poly, j));
          }
        } else {
          final BigRational a = solution.get(k++);
          if (!a.isZero()) {
            linearTerms.add(
                new LinearTerm(a, factor.poly.coefficient(0).negate(), j));
          }
        }
      }
    }
    return new PartialFractionDecomposition(polynomial, linearTerms,
        quadraticTerms);
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder();
    b.append(polynomial);
    for (LinearTerm term : linearTerms) {
      b.append(" + ").append(term);
    }
    for (QuadraticTerm term : quadraticTerms) {
      b.append(" + ").append(term);
    }
    return b.toString();
  }

  /** Term {@code coefficient / (t - root) ^ multiplicity}. */
  public static class LinearTerm {
    public final BigRational coefficient;
    public final BigRational root;
    public final int multiplicity;

    LinearTerm(BigRational coefficient, BigRational root, int multiplicity) {
      this.coefficient = requireNonNull(coefficient);
      this.root = requireNonNull(root);
      this.multiplicity = multiplicity;
    }

    @Override public String toString() {
      return coefficient + "/(t - " + root + ")^" + multiplicity;
    }
  }

  /** Term {@code numerator / quadratic ^ multiplicity}. */
  public static class QuadraticTerm {
    /** Numerator, of degree at most 1. */
    public final Poly<BigRational> numerator;
    /** Monic irreducible quadratic. */
    public final Poly<BigRational> quadratic;
    public final int multiplicity;

    QuadraticTerm(Poly<BigRational> numerator, Poly<BigRational> quadratic,
        int multiplicity) {
      this.numerator = requireNonNull(numerator);
      this.quadratic = requireNonNull(quadratic);
      this.multiplicity = multiplicity;
    }

    @Override public String toString() {
      return "(" + numerator + ")/(" + quadratic + ")^" + multiplicity;
    }
  }
}

// End PartialFractionDecomposition.java
