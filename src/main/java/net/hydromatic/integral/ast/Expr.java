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
package net.hydromatic.integral.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import net.hydromatic.integral.function.BuiltIn;
import net.hydromatic.integral.util.BigRational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Mathematical expression.
 *
 * <p>Expressions are immutable trees. Equality is structural. Sub-classes are
 * nested inside this class; create them using {@link ExprBuilder#expr}.
 */
public abstract class Expr implements Comparable<Expr> {
  /**
   * Total ordering on expressions. Sorts first by {@link Op}, then
   * structurally. Used to put the operands of sums and products into
   * canonical order.
   */
  public static final Ordering<Expr> ORDERING =
      Ordering.from(Expr::compareExprs);

  private static final Comparator<Iterable<Expr>> LEXICOGRAPHIC =
      ORDERING.lexicographical();

  public final Op op;

  /** Hash code, cached because expressions are compared often. */
  private int hash;

  Expr(Op op) {
    this.op = requireNonNull(op);
  }

  /** Accepts a shuttle, returning a possibly rewritten expression. */
  public abstract Expr accept(Shuttle shuttle);

  /** Returns the immediate sub-expressions. */
  public abstract List<Expr> operands();

  abstract StringBuilder unparse(StringBuilder buf, int left, int right);

  abstract int computeHashCode();

  @Override
  public final int hashCode() {
    int h = hash;
    if (h == 0) {
      h = computeHashCode();
      if (h == 0) {
        h = 1;
      }
      hash = h;
    }
    return h;
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder(), 0, 0).toString();
  }

  @Override
  public int compareTo(Expr o) {
    return compareExprs(this, o);
  }

  /** Returns whether this is a numeric literal. */
  public boolean isNum() {
    return op == Op.NUM;
  }

  /** Returns whether this is a numeric literal with a given value. */
  public boolean isNum(long value) {
    return op == Op.NUM && ((Num) this).value.equals(BigRational.of(value));
  }

  /** Returns whether this is a call to a given function. */
  public boolean isCall(BuiltIn fn) {
    return op == Op.CALL && ((Call) this).fn == fn;
  }

  /** Returns this expression as a numeric literal; fails if it is not. */
  public Num asNum() {
    return (Num) this;
  }

  private static int compareExprs(Expr e0, Expr e1) {
    if (e0 == e1) {
      return 0;
    }
    int c = e0.op.compareTo(e1.op);
    if (c != 0) {
      return c;
    }
    switch (e0.op) {
      case NUM:
        return ((Num) e0).value.compareTo(((Num) e1).value);
      case SYM:
        return ((Sym) e0).name.compareTo(((Sym) e1).name);
      case ADD:
      case MUL:
        return LEXICOGRAPHIC.compare(e0.operands(), e1.operands());
      case POW:
        c = compareExprs(((Pow) e0).base, ((Pow) e1).base);
        if (c != 0) {
          return c;
        }
        return compareExprs(((Pow) e0).exponent, ((Pow) e1).exponent);
      case CALL:
        c = ((Call) e0).fn.compareTo(((Call) e1).fn);
        if (c != 0) {
          return c;
        }
        return compareExprs(((Call) e0).arg, ((Call) e1).arg);
      case INTEGRAL:
        return LEXICOGRAPHIC.compare(e0.operands(), e1.operands());
      default:
        throw new AssertionError(e0.op);
    }
  }

  /** Numeric literal, an exact rational. */
  public static class Num extends Expr {
    public final BigRational value;

    Num(BigRational value) {
      super(Op.NUM);
      this.value = requireNonNull(value);
    }

    @Override
    int computeHashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Num && value.equals(((Num) o).value);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public List<Expr> operands() {
      return ImmutableList.of();
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (value.signum() < 0 && left > 0) {
        return buf.append('(').append(value).append(')');
      }
      if (!value.isInteger()
          && (left > Op.MUL.left || right > Op.MUL.right)) {
        return buf.append('(').append(value).append(')');
      }
      return buf.append(value);
    }
  }

  /** Symbol, such as "x". */
  public static class Sym extends Expr {
    public final String name;

    Sym(String name) {
      super(Op.SYM);
      this.name = requireNonNull(name);
    }

    @Override
    int computeHashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Sym && name.equals(((Sym) o).name);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public List<Expr> operands() {
      return ImmutableList.of();
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(name);
    }
  }

  /** Sum of two or more terms. */
  public static class Add extends Expr {
    public final ImmutableList<Expr> terms;

    Add(ImmutableList<Expr> terms) {
      super(Op.ADD);
      this.terms = requireNonNull(terms);
    }

    @Override
    int computeHashCode() {
      return terms.hashCode() * 37 + 1;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Add && terms.equals(((Add) o).terms);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public List<Expr> operands() {
      return terms;
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (left > op.left || right > op.right) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      for (int i = 0; i < terms.size(); i++) {
        final Expr term = terms.get(i);
        final int termRight = i == terms.size() - 1 ? right : op.left;
        if (i == 0) {
          term.unparse(buf, left, termRight);
        } else if (isNegative(term)) {
          buf.append(" - ");
          negateForPrint(term).unparse(buf, op.right, termRight);
        } else {
          buf.append(" + ");
          term.unparse(buf, op.right, termRight);
        }
      }
      return buf;
    }

    /** Returns whether a term prints with a leading minus sign. */
    private static boolean isNegative(Expr e) {
      if (e instanceof Num) {
        return ((Num) e).value.signum() < 0;
      }
      if (e instanceof Mul) {
        final Expr first = ((Mul) e).factors.get(0);
        return first instanceof Num && ((Num) first).value.signum() < 0;
      }
      return false;
    }

    private static Expr negateForPrint(Expr e) {
      if (e instanceof Num) {
        return new Num(((Num) e).value.negate());
      }
      final Mul mul = (Mul) e;
      final BigRational c = ((Num) mul.factors.get(0)).value.negate();
      final List<Expr> factors = new ArrayList<>(mul.factors);
      if (c.isOne()) {
        factors.remove(0);
      } else {
        factors.set(0, new Num(c));
      }
      return factors.size() == 1
          ? factors.get(0)
          : new Mul(ImmutableList.copyOf(factors));
    }
  }

  /** Product of two or more factors. */
  public static class Mul extends Expr {
    public final ImmutableList<Expr> factors;

    Mul(ImmutableList<Expr> factors) {
      super(Op.MUL);
      this.factors = requireNonNull(factors);
    }

    @Override
    int computeHashCode() {
      return factors.hashCode() * 37 + 2;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Mul && factors.equals(((Mul) o).factors);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public List<Expr> operands() {
      return factors;
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return unparseQuotient(buf, factors, left, right);
    }
  }

  /** Power, "base ^ exponent". */
  public static class Pow extends Expr {
    public final Expr base;
    public final Expr exponent;

    Pow(Expr base, Expr exponent) {
      super(Op.POW);
      this.base = requireNonNull(base);
      this.exponent = requireNonNull(exponent);
    }

    @Override
    int computeHashCode() {
      return Objects.hash(base, exponent);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Pow
              && base.equals(((Pow) o).base)
              && exponent.equals(((Pow) o).exponent);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public List<Expr> operands() {
      return ImmutableList.of(base, exponent);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (isNegativeExponent(exponent)) {
        return unparseQuotient(buf, ImmutableList.of(this), left, right);
      }
      if (exponent instanceof Num && ((Num) exponent).value.equals(
          BigRational.HALF)) {
        return base.unparse(buf.append("sqrt("), 0, 0).append(')');
      }
      if (left > op.left || right > op.right) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      base.unparse(buf, left, op.left);
      buf.append(op.padded);
      return exponent.unparse(buf, op.right, right);
    }
  }

  /** Application of a built-in function to an argument. */
  public static class Call extends Expr {
    public final BuiltIn fn;
    public final Expr arg;

    Call(BuiltIn fn, Expr arg) {
      super(Op.CALL);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    int computeHashCode() {
      return Objects.hash(fn, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Call
              && fn == ((Call) o).fn
              && arg.equals(((Call) o).arg);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public List<Expr> operands() {
      return ImmutableList.of(arg);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return arg.unparse(buf.append(fn.functionName).append('('), 0, 0)
          .append(')');
    }
  }

  /**
   * Unevaluated integral of an integrand with respect to a variable,
   * optionally with lower and upper bounds.
   */
  public static class Integral extends Expr {
    public final Expr integrand;
    public final Sym variable;
    public final @Nullable Expr lower;
    public final @Nullable Expr upper;

    Integral(
        Expr integrand, Sym variable, @Nullable Expr lower,
        @Nullable Expr upper) {
      super(Op.INTEGRAL);
      this.integrand = requireNonNull(integrand);
      this.variable = requireNonNull(variable);
      this.lower = lower;
      this.upper = upper;
      if ((lower == null) != (upper == null)) {
        throw new IllegalArgumentException("bounds must both be present");
      }
    }

    /** Returns whether this integral has bounds. */
    public boolean isDefinite() {
      return lower != null;
    }

    @Override
    int computeHashCode() {
      return Objects.hash(integrand, variable, lower, upper);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Integral
              && integrand.equals(((Integral) o).integrand)
              && variable.equals(((Integral) o).variable)
              && Objects.equals(lower, ((Integral) o).lower)
              && Objects.equals(upper, ((Integral) o).upper);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public List<Expr> operands() {
      if (lower == null || upper == null) {
        return ImmutableList.of(integrand, variable);
      }
      return ImmutableList.of(integrand, variable, lower, upper);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      buf.append("integral(");
      integrand.unparse(buf, 0, 0);
      variable.unparse(buf.append(", "), 0, 0);
      if (lower != null && upper != null) {
        lower.unparse(buf.append(", "), 0, 0);
        upper.unparse(buf.append(", "), 0, 0);
      }
      return buf.append(')');
    }
  }

  private static boolean isNegativeExponent(Expr exponent) {
    return exponent instanceof Num && ((Num) exponent).value.signum() < 0;
  }

  /**
   * Prints a list of factors as a quotient. Numeric coefficients and factors
   * with negative numeric exponents go into the denominator, so that
   * "x * y ^ -2 * 1/3" prints as "x / (3 * y ^ 2)".
   */
  static StringBuilder unparseQuotient(
      StringBuilder buf, List<Expr> factors, int left, int right) {
    BigRational coefficient = BigRational.ONE;
    final List<Expr> numerators = new ArrayList<>();
    final List<Expr> denominators = new ArrayList<>();
    for (Expr factor : factors) {
      if (factor instanceof Num) {
        coefficient = coefficient.multiply(((Num) factor).value);
      } else if (factor instanceof Pow
          && isNegativeExponent(((Pow) factor).exponent)) {
        final Pow pow = (Pow) factor;
        final BigRational e = ((Num) pow.exponent).value.negate();
        denominators.add(e.isOne() ? pow.base : new Pow(pow.base, new Num(e)));
      } else {
        numerators.add(factor);
      }
    }
    final boolean negative = coefficient.signum() < 0;
    final BigRational abs = coefficient.abs();
    if (!abs.numerator.equals(BigInteger.ONE) || numerators.isEmpty()
        && denominators.isEmpty()) {
      numerators.add(0, new Num(BigRational.of(abs.numerator)));
    }
    if (!abs.denominator.equals(BigInteger.ONE)) {
      denominators.add(0, new Num(BigRational.of(abs.denominator)));
    }
    if (numerators.isEmpty()) {
      numerators.add(new Num(BigRational.ONE));
    }
    final Op op = Op.MUL;
    if (left > op.left || right > op.right || negative && left > 0) {
      return unparseQuotient(buf.append('('), factors, 0, 0).append(')');
    }
    if (negative) {
      buf.append('-');
    }
    final boolean hasDenominator = !denominators.isEmpty();
    for (int i = 0; i < numerators.size(); i++) {
      if (i > 0) {
        buf.append(op.padded);
      }
      numerators.get(i).unparse(
          buf,
          i == 0 ? (negative ? op.right : left) : op.right,
          i == numerators.size() - 1 && !hasDenominator ? right : op.left);
    }
    if (hasDenominator) {
      buf.append(" / ");
      if (denominators.size() == 1) {
        denominators.get(0).unparse(buf, op.right + 1, right);
      } else {
        buf.append('(');
        for (int i = 0; i < denominators.size(); i++) {
          if (i > 0) {
            buf.append(op.padded);
          }
          denominators.get(i).unparse(
              buf, i == 0 ? 0 : op.right, i == denominators.size() - 1
                  ? 0 : op.left);
        }
        buf.append(')');
      }
    }
    return buf;
  }
}

// End Expr.java
