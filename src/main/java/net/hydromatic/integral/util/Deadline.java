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
package net.hydromatic.integral.util;

/**
 * Point in wall-clock time after which work should stop.
 *
 * <p>Checked at coarse checkpoints only; nothing is interrupted.
 */
public final class Deadline {
  /** Deadline that never expires. */
  public static final Deadline NONE = new Deadline(Long.MAX_VALUE);

  private final long nanos;

  private Deadline(long nanos) {
    this.nanos = nanos;
  }

  /**
   * Creates a deadline a given number of milliseconds from now. Zero or a
   * negative value means no deadline.
   */
  public static Deadline ofMillis(long millis) {
    if (millis <= 0) {
      return NONE;
    }
    return new Deadline(System.nanoTime() + millis * 1_000_000L);
  }

  /** Returns whichever of this and another deadline expires first. */
  public Deadline min(Deadline other) {
    if (this == NONE) {
      return other;
    }
    if (other == NONE) {
      return this;
    }
    return nanos - other.nanos <= 0 ? this : other;
  }

  public boolean isExpired() {
    return this != NONE && System.nanoTime() - nanos >= 0;
  }

  @Override
  public String toString() {
    if (this == NONE) {
      return "Deadline(none)";
    }
    return "Deadline(" + (nanos - System.nanoTime()) / 1_000_000L + "ms)";
  }
}

// End Deadline.java
