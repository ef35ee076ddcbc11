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
import static net.hydromatic.integral.util.Static.PROPERTY_PREFIX;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.integral.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that configures an {@link Integrator}.
 *
 * <p>The default value of each property can be overridden by a system
 * property whose name is "integral." followed by the property's camel-case
 * name; for example, {@code -Dintegral.maxDepth=6}.
 *
 * @see Integrator.Builder#withProp(Prop, Object)
 */
public enum Prop {
  /**
   * Integer property "maxDepth" is the maximum depth of nested integration
   * requests. A request deeper than this goes straight to the unevaluated
   * fallback. Default is 10.
   */
  MAX_DEPTH("maxDepth", Integer.class, 10),

  /**
   * Integer property "timeBudgetMillis" is the wall-clock budget, in
   * milliseconds, of a top-level call. Zero means no limit. Default is
   * 10,000.
   */
  TIME_BUDGET_MILLIS("timeBudgetMillis", Integer.class, 10_000),

  /**
   * Integer property "rischTimeBudgetMillis" is the wall-clock budget, in
   * milliseconds, of each invocation of the Risch decision procedure.
   * Default is 2,000.
   */
  RISCH_TIME_BUDGET_MILLIS("rischTimeBudgetMillis", Integer.class, 2_000),

  /**
   * Integer property "rischMaxLevels" is the maximum number of transcendental
   * levels (not counting the variable) in a differential extension tower.
   * Default is 8.
   */
  RISCH_MAX_LEVELS("rischMaxLevels", Integer.class, 8),

  /** Maximum number of steps of repeated integration by parts. */
  BY_PARTS_MAX_STEPS("byPartsMaxSteps", Integer.class, 6),

  /** Maximum number of substitution candidates to try. */
  SUBSTITUTION_MAX_CANDIDATES("substitutionMaxCandidates", Integer.class, 12),

  /** Largest power of sine or cosine that trigonometric reduction handles. */
  TRIG_MAX_POWER("trigMaxPower", Integer.class, 24),

  /**
   * Boolean property "verifyResults" controls whether the integrator checks
   * each antiderivative by differentiating it. A result that is proven wrong
   * is discarded and the next strategy is tried. Default is true.
   */
  VERIFY_RESULTS("verifyResults", Boolean.class, true);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
    this.defaultValue = systemDefault(camelName, type, defaultValue);
  }

  /** Applies a system property override to a default value. */
  private static Object systemDefault(String camelName, Class<?> type,
      Object defaultValue) {
    final String propName = PROPERTY_PREFIX + camelName;
    if (type == Integer.class) {
      return Static.getIntProperty(propName, (Integer) defaultValue);
    }
    if (type == Boolean.class) {
      return Static.getBooleanProperty(propName, (Boolean) defaultValue);
    }
    return defaultValue;
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
      return;
    }
    checkArgument(type.isInstance(value),
        "value for property %s must have type %s", camelName, type);
    if (type == Integer.class) {
      checkArgument((Integer) value >= 0,
          "value for property %s must not be negative", camelName);
    }
    map.put(this, value);
  }
}

// End Prop.java
