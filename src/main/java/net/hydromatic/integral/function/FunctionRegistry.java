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
package net.hydromatic.integral.function;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;

/**
 * Name-keyed catalog of antiderivative rules.
 *
 * <p>A registry is immutable and is passed to the integrator when it is
 * created; tests can supply a different one.
 */
public interface FunctionRegistry {
  /** Returns the antiderivative rule for a function name, if known. */
  Optional<AntiderivativeRule> lookupAntiderivative(String name);

  /** Returns the registry of all {@link BuiltIn} functions. */
  static FunctionRegistry builtIn() {
    return MapRegistry.BUILT_IN;
  }

  /** Returns a registry that knows no functions. */
  static FunctionRegistry empty() {
    return MapRegistry.EMPTY;
  }

  /** Creates a registry from a map of rules. */
  static FunctionRegistry of(Map<String, AntiderivativeRule> rules) {
    return new MapRegistry(ImmutableMap.copyOf(rules));
  }

  /** Registry backed by an immutable map. */
  final class MapRegistry implements FunctionRegistry {
    static final MapRegistry EMPTY = new MapRegistry(ImmutableMap.of());

    static final MapRegistry BUILT_IN = new MapRegistry(builtInRules());

    private final ImmutableMap<String, AntiderivativeRule> rules;

    MapRegistry(ImmutableMap<String, AntiderivativeRule> rules) {
      this.rules = requireNonNull(rules);
    }

    private static ImmutableMap<String, AntiderivativeRule> builtInRules() {
      final ImmutableMap.Builder<String, AntiderivativeRule> b =
          ImmutableMap.builder();
      for (BuiltIn builtIn : BuiltIn.values()) {
        if (builtIn.hasAntiderivative()) {
          b.put(
              builtIn.functionName,
              u -> requireNonNull(builtIn.antiderivative(u)));
        }
      }
      return b.build();
    }

    @Override
    public Optional<AntiderivativeRule> lookupAntiderivative(String name) {
      return Optional.ofNullable(rules.get(name));
    }

    @Override
    public String toString() {
      return "FunctionRegistry" + rules.keySet();
    }
  }
}

// End FunctionRegistry.java
