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

import static net.hydromatic.integral.ast.ExprBuilder.expr;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.integral.ast.Expr;
import net.hydromatic.integral.function.BuiltIn;
import net.hydromatic.integral.util.BigRational;

/**
 * Parses infix text into an expression.
 *
 * <p>The grammar is as follows. Operators {@code +} and {@code -} bind
 * loosest, then {@code *} and {@code /}, then unary minus, then {@code ^},
 * which is right-associative, so {@code -x ^ 2} is {@code -(x ^ 2)} and
 * {@code 2 ^ 3 ^ 2} is {@code 2 ^ 9}.
 *
 * <pre>{@code
 * expr    ::= term { ("+" | "-") term }
 * term    ::= unary { ("*" | "/") unary }
 * unary   ::= "-" unary | power
 * power   ::= primary [ "^" unary ]
 * primary ::= number | name | name "(" expr { "," expr } ")"
 *           | "(" expr ")"
 * }</pre>
 *
 * <p>Decimal numbers are exact; "0.25" is 1/4. The name "e" is Euler's
 * number, {@code exp(1)}. Function names are those of {@link BuiltIn}
 * (including aliases such as "log" and "atan"), plus "sqrt" and
 * "integral", which takes an integrand, a variable, and optionally lower
 * and upper bounds.
 *
 * <p>The result is not simplified.
 */
public class ExprParser {
  private final String text;
  private int pos;

  private ExprParser(String text) {
    this.text = text;
  }

  /** Parses a string; throws {@link ExprParseException} if invalid. */
  public static Expr parse(String text) {
    final ExprParser parser = new ExprParser(text);
    final Expr e = parser.parseExpr();
    parser.skipSpace();
    if (parser.pos < text.length()) {
      throw parser.error("unexpected '" + text.charAt(parser.pos) + "'");
    }
    return e;
  }

  private ExprParseException error(String message) {
    return new ExprParseException(message, text, pos);
  }

  private void skipSpace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      ++pos;
    }
  }

  /** Consumes a character if it is next, after skipping spaces. */
  private boolean accept(char c) {
    skipSpace();
    if (pos < text.length() && text.charAt(pos) == c) {
      ++pos;
      return true;
    }
    return false;
  }

  private void expect(char c) {
    if (!accept(c)) {
      throw error("expected '" + c + "'");
    }
  }

  private Expr parseExpr() {
    Expr e = parseTerm();
    for (;;) {
      if (accept('+')) {
        e = expr.add(e, parseTerm());
      } else if (accept('-')) {
        e = expr.sub(e, parseTerm());
      } else {
        return e;
      }
    }
  }

  private Expr parseTerm() {
    Expr e = parseUnary();
    for (;;) {
      if (accept('*')) {
        e = expr.mul(e, parseUnary());
      } else if (accept('/')) {
        e = expr.div(e, parseUnary());
      } else {
        return e;
      }
    }
  }

  private Expr parseUnary() {
    if (accept('-')) {
      final Expr e = parseUnary();
      if (e instanceof Expr.Num) {
        return expr.num(((Expr.Num) e).value.negate());
      }
      return expr.neg(e);
    }
    return parsePower();
  }

  private Expr parsePower() {
    final Expr base = parsePrimary();
    if (accept('^')) {
      return expr.pow(base, parseUnary());
    }
    return base;
  }

  private Expr parsePrimary() {
    skipSpace();
    if (pos >= text.length()) {
      throw error("unexpected end of input");
    }
    final char c = text.charAt(pos);
    if (c == '(') {
      ++pos;
      final Expr e = parseExpr();
      expect(')');
      return e;
    }
    if (Character.isDigit(c) || c == '.') {
      return parseNumber();
    }
    if (Character.isLetter(c) || c == '_') {
      final int start = pos;
      while (pos < text.length()
          && (Character.isLetterOrDigit(text.charAt(pos))
              || text.charAt(pos) == '_')) {
        ++pos;
      }
      final String name = text.substring(start, pos);
      if (accept('(')) {
        return parseCall(name, start);
      }
      if (name.equals("e")) {
        return expr.exp(expr.one());
      }
      return expr.sym(name);
    }
    throw error("unexpected '" + c + "'");
  }

  private Expr parseNumber() {
    final int start = pos;
    while (pos < text.length()
        && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
      ++pos;
    }
    final String s = text.substring(start, pos);
    try {
      return expr.num(BigRational.parse(s));
    } catch (NumberFormatException e) {
      pos = start;
      throw error("invalid number '" + s + "'");
    }
  }

  private Expr parseCall(String name, int start) {
    final List<Expr> args = new ArrayList<>();
    if (!accept(')')) {
      do {
        args.add(parseExpr());
      } while (accept(','));
      expect(')');
    }
    switch (name) {
      case "sqrt":
        checkArgCount(name, args, 1, start);
        return expr.sqrt(args.get(0));
      case "integral":
        if (args.size() != 2 && args.size() != 4) {
          pos = start;
          throw error("integral requires 2 or 4 arguments");
        }
        if (!(args.get(1) instanceof Expr.Sym)) {
          pos = start;
          throw error("integration variable must be a name");
        }
        final Expr.Sym x = (Expr.Sym) args.get(1);
        return args.size() == 2
            ? expr.integral(args.get(0), x)
            : expr.integral(args.get(0), x, args.get(2), args.get(3));
      default:
        final BuiltIn fn = BuiltIn.BY_NAME.get(name);
        if (fn == null) {
          pos = start;
          throw error("unknown function '" + name + "'");
        }
        checkArgCount(name, args, 1, start);
        return expr.call(fn, args.get(0));
    }
  }

  private void checkArgCount(String name, List<Expr> args, int count,
      int start) {
    if (args.size() != count) {
      pos = start;
      throw error("function '" + name + "' requires " + count
          + " argument" + (count == 1 ? "" : "s"));
    }
  }
}

// End ExprParser.java
