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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.integral.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.integral.algebra.Replacer;
import net.hydromatic.integral.algebra.Simplifier;
import net.hydromatic.integral.algebra.ZeroTester;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.calculus.Differentiator;
import net.hydromatic.integral.function.FunctionRegistry;
import net.hydromatic.integral.integrate.risch.RischIntegrator;
import net.hydromatic.integral.util.Deadline;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes indefinite and definite integrals.
 *
 * <p>The integrator is a dispatcher. It tries each {@link Strategy} in the
 * order of its {@link StrategyKind}: table, rational functions, registry,
 * integration by parts, substitution, trigonometric reduction, Risch,
 * linearity, and finally the unevaluated fallback. The first strategy that
 * finds an antiderivative wins. If the Risch strategy proves that there is
 * no elementary antiderivative, the integral is returned unevaluated.
 *
 * <p>Strategies may call the integrator recursively, with a deeper
 * {@link IntegrationRequest}. A request deeper than {@link Prop#MAX_DEPTH}
 * is returned unevaluated without trying any strategy, and a request whose
 * deadline has passed is returned unevaluated too; so integration always
 * terminates.
 *
 * <p>The integrator never throws. If a strategy throws, the exception is
 * passed to the {@link Tracer} and the strategy is treated as not
 * applicable.
 *
 * <p>An integrator is immutable and thread-safe. Create one using
 * {@link #create()} or {@link #builder()}.
 */
public class Integrator {
  private final ImmutableList<Strategy> strategies;
  private final Tracer tracer;
  private final ImmutableMap<Prop, Object> props;

  private Integrator(List<Strategy> strategies, Tracer tracer,
      Map<Prop, Object> props) {
    final List<Strategy> list = new ArrayList<>(strategies);
    list.sort((s0, s1) -> s0.kind().compareTo(s1.kind()));
    this.strategies = ImmutableList.copyOf(list);
    this.tracer = requireNonNull(tracer);
    this.props = ImmutableMap.copyOf(props);
  }

  /** Creates an integrator with the standard strategies and settings. */
  public static Integrator create() {
    return builder().build();
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the value of an integer property. */
  public int intValue(Prop prop) {
    return prop.intValue(props);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Prop prop) {
    return prop.booleanValue(props);
  }

  /** Returns the strategies, in the order that they are tried. */
  public ImmutableList<Strategy> strategies() {
    return strategies;
  }

  /**
   * Returns an antiderivative of {@code f} with respect to {@code x}, or
   * the unevaluated integral if none can be found.
   */
  public Expr integrate(Expr f, Expr.Sym x) {
    requireNonNull(f, "f");
    requireNonNull(x, "x");
    final Deadline deadline =
        Deadline.ofMillis(intValue(Prop.TIME_BUDGET_MILLIS));
    return integrate(IntegrationRequest.of(f, x, deadline));
  }

  /**
   * Returns the definite integral of {@code f} with respect to {@code x}
   * from {@code a} to {@code b}.
   *
   * <p>If an antiderivative F is found, returns {@code F(b) - F(a)};
   * otherwise returns the unevaluated definite integral.
   */
  public Expr integrateDefinite(Expr f, Expr.Sym x, Expr a, Expr b) {
    requireNonNull(a, "a");
    requireNonNull(b, "b");
    final Expr antiderivative = integrate(f, x);
    if (!containsIntegral(antiderivative)) {
      try {
        return Simplifier.simplify(
            expr.sub(Replacer.replace(antiderivative, x, b),
                Replacer.replace(antiderivative, x, a)));
      } catch (RuntimeException e) {
        tracer.onException(IntegrationRequest.of(f, x, Deadline.NONE),
            StrategyKind.FALLBACK, e);
      }
    }
    return expr.integral(simplifyQuietly(f, x), x, a, b);
  }

  /** Integrates a request. Called by strategies to solve sub-problems. */
  public Expr integrate(IntegrationRequest request) {
    final Expr result = dispatch(request);
    tracer.onResult(request, result);
    return result;
  }

  private Expr dispatch(IntegrationRequest request) {
    final Expr.Sym x = request.variable;
    if (request.integrand instanceof Expr.Integral) {
      final Expr.Integral integral = (Expr.Integral) request.integrand;
      if (!integral.isDefinite() && integral.variable.equals(x)) {
        // Integrating an unevaluated integral again gives the same integral
        return integral;
      }
    }
    if (request.depth > intValue(Prop.MAX_DEPTH)) {
      tracer.onDepthExceeded(request);
      return expr.integral(request.integrand, x);
    }
    final Expr f;
    try {
      f = Simplifier.simplify(request.integrand);
    } catch (RuntimeException e) {
      tracer.onException(request, StrategyKind.FALLBACK, e);
      return expr.integral(request.integrand, x);
    }
    final IntegrationRequest request2 = request.withIntegrand(f);
    for (Strategy strategy : strategies) {
      final StrategyKind kind = strategy.kind();
      if (request2.suppressed.contains(kind)) {
        continue;
      }
      if (request2.deadline.isExpired()) {
        break;
      }
      final StrategyOutcome outcome;
      try {
        outcome = strategy.attempt(request2, this);
      } catch (RuntimeException e) {
        tracer.onException(request2, kind, e);
        continue;
      }
      tracer.onOutcome(request2, kind, outcome);
      switch (outcome.kind) {
        case FOUND:
          final Expr antiderivative;
          try {
            antiderivative = Simplifier.simplify(outcome.expr());
          } catch (RuntimeException e) {
            tracer.onException(request2, kind, e);
            continue;
          }
          if (kind != StrategyKind.FALLBACK
              && booleanValue(Prop.VERIFY_RESULTS)
              && !verify(request2, kind, antiderivative)) {
            tracer.onRejected(request2, kind, antiderivative);
            continue;
          }
          return antiderivative;
        case PROVEN_NON_ELEMENTARY:
          return outcome.expr();
        case TIMED_OUT:
          return expr.integral(f, x);
        default:
          continue;
      }
    }
    return expr.integral(f, x);
  }

  /**
   * Returns false if an antiderivative is proven wrong: its derivative
   * differs from the integrand.
   */
  private boolean verify(IntegrationRequest request, StrategyKind kind,
      Expr antiderivative) {
    try {
      final Expr derivative =
          Differentiator.derivative(antiderivative, request.variable);
      return ZeroTester.testEqual(derivative, request.integrand)
          != ZeroTester.Result.NON_ZERO;
    } catch (RuntimeException e) {
      tracer.onException(request, kind, e);
      return false;
    }
  }

  /** Simplifies; if simplification fails, reports and returns the input. */
  private Expr simplifyQuietly(Expr f, Expr.Sym x) {
    try {
      return Simplifier.simplify(f);
    } catch (RuntimeException e) {
      tracer.onException(IntegrationRequest.of(f, x, Deadline.NONE),
          StrategyKind.FALLBACK, e);
      return f;
    }
  }

  /** Returns whether an expression contains an unevaluated integral. */
  static boolean containsIntegral(Expr e) {
    if (e instanceof Expr.Integral) {
      return true;
    }
    for (Expr operand : e.operands()) {
      if (containsIntegral(operand)) {
        return true;
      }
    }
    return false;
  }

  /** Returns whether an expression is closed: has no unevaluated integral. */
  public static boolean isClosed(Expr e) {
    return !containsIntegral(e);
  }

  /** Returns whether a result is an unevaluated integral of a variable. */
  public static boolean isUnevaluated(Expr e, Expr.Sym x) {
    return e instanceof Expr.Integral
        && !((Expr.Integral) e).isDefinite()
        && ((Expr.Integral) e).variable.equals(x);
  }

  /** Builder for {@link Integrator}. */
  public static class Builder {
    private IntegrationTable table = IntegrationTable.standard();
    private FunctionRegistry registry = FunctionRegistry.builtIn();
    private Tracer tracer = Tracers.empty();
    private final Map<Prop, Object> props = new EnumMap<>(Prop.class);
    private @Nullable List<Strategy> strategies;

    private Builder() {}

    /** Sets the table of canonical integrals. */
    public Builder withTable(IntegrationTable table) {
      this.table = requireNonNull(table);
      return this;
    }

    /** Sets the registry of function antiderivatives. */
    public Builder withRegistry(FunctionRegistry registry) {
      this.registry = requireNonNull(registry);
      return this;
    }

    public Builder withTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
      return this;
    }

    /** Sets a property. */
    public Builder withProp(Prop prop, Object value) {
      prop.set(props, requireNonNull(value));
      return this;
    }

    /**
     * Sets the strategies, replacing the standard ones. The list must
     * include a {@link StrategyKind#FALLBACK} strategy.
     */
    public Builder withStrategies(List<? extends Strategy> strategies) {
      checkArgument(
          strategies.stream().anyMatch(s -> s.kind() == StrategyKind.FALLBACK),
          "strategies must include a fallback");
      this.strategies = ImmutableList.copyOf(strategies);
      return this;
    }

    public Integrator build() {
      final List<Strategy> list = strategies != null
          ? strategies
          : ImmutableList.<Strategy>of(
              table,
              new RationalIntegrator(),
              new RegistryLookup(registry),
              new IntegrationByParts(),
              new USubstitution(),
              new TrigonometricReduction(),
              new RischIntegrator(),
              new Linearity(),
              new SymbolicFallback());
      return new Integrator(list, tracer, props);
    }
  }
}

// End Integrator.java
