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
import static net.hydromatic.integral.algebra.Rationals.Q;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.algebra.Factorizer;
import net.hydromatic.integral.algebra.Poly;
import net.hydromatic.integral.util.BigRational;

/**
 * Rothstein-Trager residue reduction.
 *
 * <p>For a simple fraction a / d (d squarefree and normal, deg a &lt;
 * deg d) computes the resultant {@code R(z) = res_t(d, a - z d')} by
 * evaluating it at deg d + 1 points and interpolating. The integral has an
 * elementary form only if the roots of R are constants. If they are, each
 * rational root z contributes {@code z ln(gcd(d, a - z d'))}.
 */
public class ResidueReduction {
  /** Kind of residues. */
  public enum Kind {
    /** All residues are rational; {@link #logs} holds the log terms. */
    RATIONAL,
    /** Residues are constant but some are irrational. */
    IRRATIONAL,
    /** Some residue is not constant; the integral is not elementary. */
    NON_CONSTANT,
    /** The resultant vanished identically. */
    DEGENERATE
  }

  public final Kind kind;
  public final ImmutableList<RischResult.LogTerm> logs;

  private ResidueReduction(Kind kind, List<RischResult.LogTerm> logs) {
    this.kind = requireNonNull(kind);
    this.logs = ImmutableList.copyOf(logs);
  }

  /** Computes the residues of {@code a / d} in the generator of level
   * {@code k}. */
  public static ResidueReduction reduce(ExtensionTower tower, int k,
      Poly<TowerElement> a, Poly<TowerElement> d) {
    final TowerField f = TowerField.INSTANCE;
    final Poly<TowerElement> dd = tower.derivative(d, k);
    final List<TowerElement> zs = new ArrayList<>();
    final List<TowerElement> values = new ArrayList<>();
    for (int i = 0; i <= d.degree(); i++) {
      final TowerElement z = f.fromRational(BigRational.of(i));
      zs.add(z);
      values.add(Poly.resultant(d, a.subtract(dd.scale(z))));
    }
    final Poly<TowerElement> r = Poly.interpolate(f, zs, values);
    if (r.isZero()) {
      return new ResidueReduction(Kind.DEGENERATE, ImmutableList.of());
    }
    final Poly<TowerElement> monic = r.monic();
    final List<BigRational> coefficients = new ArrayList<>();
    for (TowerElement c : monic.coefficients()) {
      if (!c.isConstant()) {
        return new ResidueReduction(Kind.NON_CONSTANT, ImmutableList.of());
      }
      coefficients.add(c.constant());
    }
    final Poly<BigRational> rq = Poly.of(Q, coefficients);
    if (rq.degree() <= 0) {
      return new ResidueReduction(Kind.RATIONAL, ImmutableList.of());
    }
    final Factorizer.Factorization factorization = Factorizer.factor(rq);
    final List<RischResult.LogTerm> logs = new ArrayList<>();
    for (Factorizer.Factor factor : factorization.factors) {
      if (factor.kind != Factorizer.Kind.LINEAR) {
        return new ResidueReduction(Kind.IRRATIONAL, ImmutableList.of());
      }
      final BigRational z = factor.poly.coefficient(0).negate();
      if (z.isZero()) {
        continue;
      }
      final Poly<TowerElement> v =
          Poly.gcd(d, a.subtract(dd.scale(f.fromRational(z))));
      if (v.degree() > 0) {
        logs.add(new RischResult.LogTerm(z, TowerElement.of(k, v)));
      }
    }
    return new ResidueReduction(Kind.RATIONAL, logs);
  }
}

// End ResidueReduction.java
