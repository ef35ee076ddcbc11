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
package net.hydromatic.integral.parse;

/** Exception caused by a parse error. */
public class ExprParseException extends RuntimeException {
  private final String text;
  private final int pos;

  ExprParseException(String message, String text, int pos) {
    super(message);
    this.text = text;
    this.pos = pos;
  }

  /** Returns the zero-based offset in the text at which the error occurred. */
  public int pos() {
    return pos;
  }

  @Override public String toString() {
    return super.toString() + " at " + pos;
  }

  /** Describes the error, with a caret under the offending character. */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Error: ").append(getMessage()).append('\n')
        .append(text).append('\n');
    for (int i = 0; i < pos; i++) {
      buf.append(' ');
    }
    return buf.append('^');
  }
}

// End ExprParseException.java
