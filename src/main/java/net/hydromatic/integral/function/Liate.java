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

/**
 * Classes of factor in the LIATE heuristic for integration by parts.
 *
 * <p>Declared in priority order: a factor of an earlier class is the better
 * choice for "u".
 */
public enum Liate {
  LOGARITHMIC,
  INVERSE_TRIGONOMETRIC,
  ALGEBRAIC,
  TRIGONOMETRIC,
  EXPONENTIAL;

  /** Returns whether this class is a better choice for "u" than another. */
  public boolean outranks(Liate other) {
    return ordinal() < other.ordinal();
  }
}

// End Liate.java
