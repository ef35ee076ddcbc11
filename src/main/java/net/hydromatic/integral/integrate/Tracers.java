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

import java.io.PrintWriter;
import java.util.function.Consumer;
import net.hydromatic.integral.ast.Expr;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each outcome of a
   * given kind of strategy, then calls the underlying tracer.
   */
  public static Tracer withOnOutcome(Tracer tracer, StrategyKind kind,
      Consumer<StrategyOutcome> consumer) {
    final StrategyKind expectedKind = requireNonNull(kind);
    return new DelegatingTracer(tracer) {
      @Override public void onOutcome(IntegrationRequest request,
          StrategyKind kind, StrategyOutcome outcome) {
        if (kind == expectedKind) {
          consumer.accept(outcome);
        }
        super.onOutcome(request, kind, outcome);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each exception
   * thrown by a strategy, then calls the underlying tracer.
   */
  public static Tracer withOnException(Tracer tracer,
      Consumer<RuntimeException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onException(IntegrationRequest request,
          StrategyKind kind, RuntimeException e) {
        consumer.accept(e);
        super.onException(request, kind, e);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each rejected
   * antiderivative, then calls the underlying tracer.
   */
  public static Tracer withOnRejected(Tracer tracer,
      Consumer<Expr> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRejected(IntegrationRequest request,
          StrategyKind kind, Expr antiderivative) {
        consumer.accept(antiderivative);
        super.onRejected(request, kind, antiderivative);
      }
    };
  }

  public static Tracer withOnDepthExceeded(Tracer tracer,
      Consumer<IntegrationRequest> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDepthExceeded(IntegrationRequest request) {
        consumer.accept(request);
        super.onDepthExceeded(request);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the result of each
   * top-level request, then calls the underlying tracer.
   */
  public static Tracer withOnResult(Tracer tracer, Consumer<Expr> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(IntegrationRequest request,
          Expr result) {
        if (request.depth == 0) {
          consumer.accept(result);
        }
        super.onResult(request, result);
      }
    };
  }

  /** Returns a tracer that writes one line per event to a writer. */
  public static Tracer printTo(PrintWriter w) {
    return new PrintTracer(w);
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onOutcome(IntegrationRequest request,
        StrategyKind kind, StrategyOutcome outcome) {
    }

    @Override public void onException(IntegrationRequest request,
        StrategyKind kind, RuntimeException e) {
    }

    @Override public void onRejected(IntegrationRequest request,
        StrategyKind kind, Expr antiderivative) {
    }

    @Override public void onDepthExceeded(IntegrationRequest request) {
    }

    @Override public void onResult(IntegrationRequest request, Expr result) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override public void onOutcome(IntegrationRequest request,
        StrategyKind kind, StrategyOutcome outcome) {
      tracer.onOutcome(request, kind, outcome);
    }

    @Override public void onException(IntegrationRequest request,
        StrategyKind kind, RuntimeException e) {
      tracer.onException(request, kind, e);
    }

    @Override public void onRejected(IntegrationRequest request,
        StrategyKind kind, Expr antiderivative) {
      tracer.onRejected(request, kind, antiderivative);
    }

    @Override public void onDepthExceeded(IntegrationRequest request) {
      tracer.onDepthExceeded(request);
    }

    @Override public void onResult(IntegrationRequest request, Expr result) {
      tracer.onResult(request, result);
    }
  }

  /** Tracer that writes to a {@link PrintWriter}. */
  private static class PrintTracer implements Tracer {
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void print(IntegrationRequest request, String message) {
      for (int i = 0; i < request.depth; i++) {
        w.print("  ");
      }
      w.println(message);
      w.flush();
    }

    @Override public void onOutcome(IntegrationRequest request,
        StrategyKind kind, StrategyOutcome outcome) {
      if (outcome.kind != StrategyOutcome.Kind.NOT_APPLICABLE) {
        print(request, kind + " " + request.integrand + " -> " + outcome);
      }
    }

    @Override public void onException(IntegrationRequest request,
        StrategyKind kind, RuntimeException e) {
      print(request, kind + " " + request.integrand + " threw " + e);
    }

    @Override public void onRejected(IntegrationRequest request,
        StrategyKind kind, Expr antiderivative) {
      print(request, kind + " " + request.integrand + " rejected "
          + antiderivative);
    }

    @Override public void onDepthExceeded(IntegrationRequest request) {
      print(request, "depth " + request.depth + " exceeded for "
          + request.integrand);
    }

    @Override public void onResult(IntegrationRequest request, Expr result) {
      print(request, "result " + request.integrand + " d"
          + request.variable + " = " + result);
    }
  }
}

// End Tracers.java
