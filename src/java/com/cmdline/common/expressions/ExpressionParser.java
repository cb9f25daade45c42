// =================================================================================================
// Copyright 2026 The cmdline-commons Authors
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================


package com.cmdline.common.expressions;

import java.util.logging.Logger;

import com.google.common.base.CharMatcher;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

import com.cmdline.common.base.InternalInvariantBrokenException;

/**
 * Parses the string interpolation language.  The grammar, tried as ordered choice with full
 * backtracking:
 *
 * <pre>
 * expr           := ws* inner_expr ws*
 * inner_expr     := if_then_else | concat_expr
 * if_then_else   := "if" ws+ concat_expr ws+ "then" ws+ inner_expr ws+ "else" ws+ inner_expr
 * concat_expr    := unary_expr ws+ "+" ws+ concat_expr | unary_expr
 * unary_expr     := ("lower" | "upper") ws* "(" expr ")" | primary_expr
 * primary_expr   := "$" [A-Za-z0-9]+ | "\"" literal_chars "\"" | "(" expr ")"
 * </pre>
 *
 * <p>Keywords are case sensitive and concatenation is right-associative.  Literals accept the
 * escapes {@code \"}, {@code \\}, {@code \n} and {@code \t}.
 *
 * <p>Each production takes the offset at which to start matching and, on a match, returns the
 * offset just past what it consumed, so backing out of a failed alternative is simply a matter of
 * retrying from the original offset.
 */
public final class ExpressionParser {

  private static final Logger LOG = Logger.getLogger(ExpressionParser.class.getName());

  /**
   * Maximum nesting of productions before parsing is abandoned with an
   * {@link InternalInvariantBrokenException}.
   */
  public static final int MAX_DEPTH = 50;

  private static final int NO_MATCH = -1;

  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

  private final String input;

  private ExpressionParser(String input) {
    this.input = input;
  }

  /**
   * Parses {@code content} as a single expression.  The whole of {@code content} must be consumed.
   *
   * @param content Text of the expression.
   * @return The parsed expression, or absent if {@code content} is not a valid expression.
   * @throws InternalInvariantBrokenException if the expression nests more deeply than
   *     {@link #MAX_DEPTH} allows.
   */
  public static Optional<Expression> tryParse(String content) {
    Preconditions.checkNotNull(content);

    Optional<Parsed<Expression>> parsed = new ExpressionParser(content).parseExpression(0, 0);
    if (!parsed.isPresent()) {
      LOG.fine("Not a valid expression: " + content);
      return Optional.absent();
    }
    if (parsed.get().end != content.length()) {
      LOG.fine(String.format("Unexpected text at offset %d of expression: %s",
          parsed.get().end, content));
      return Optional.absent();
    }
    return Optional.of(parsed.get().value);
  }

  private Optional<Parsed<Expression>> parseExpression(int pos, int depth) {
    int nextDepth = descend(depth);

    Optional<Parsed<Expression>> inner = parseInnerExpression(skipWhitespace(pos), nextDepth);
    if (!inner.isPresent()) {
      return inner;
    }
    return matched(inner.get().value, skipWhitespace(inner.get().end));
  }

  private Optional<Parsed<Expression>> parseInnerExpression(int pos, int depth) {
    int nextDepth = descend(depth);

    Optional<Parsed<Expression>> conditional = parseConditional(pos, nextDepth);
    if (conditional.isPresent()) {
      return conditional;
    }
    return parseConcatenation(pos, nextDepth);
  }

  private Optional<Parsed<Expression>> parseConditional(int pos, int depth) {
    int p = requireWhitespace(matchText(pos, "if"));
    if (p == NO_MATCH) {
      return noMatch();
    }

    Optional<Parsed<Expression>> condition = parseConcatenation(p, depth);
    if (!condition.isPresent()) {
      return noMatch();
    }

    p = requireWhitespace(matchText(requireWhitespace(condition.get().end), "then"));
    if (p == NO_MATCH) {
      return noMatch();
    }

    Optional<Parsed<Expression>> thenExpression = parseInnerExpression(p, depth);
    if (!thenExpression.isPresent()) {
      return noMatch();
    }

    p = requireWhitespace(matchText(requireWhitespace(thenExpression.get().end), "else"));
    if (p == NO_MATCH) {
      return noMatch();
    }

    Optional<Parsed<Expression>> elseExpression = parseInnerExpression(p, depth);
    if (!elseExpression.isPresent()) {
      return noMatch();
    }

    return matched(
        new ConditionalExpression(
            condition.get().value,
            thenExpression.get().value,
            elseExpression.get().value),
        elseExpression.get().end);
  }

  private Optional<Parsed<Expression>> parseConcatenation(int pos, int depth) {
    int nextDepth = descend(depth);

    Optional<Parsed<Expression>> left = parseUnary(pos, nextDepth);
    if (!left.isPresent()) {
      return left;
    }

    int p = requireWhitespace(matchText(requireWhitespace(left.get().end), "+"));
    if (p != NO_MATCH) {
      Optional<Parsed<Expression>> right = parseConcatenation(p, nextDepth);
      if (right.isPresent()) {
        return matched(
            new ConcatenationExpression(left.get().value, right.get().value),
            right.get().end);
      }
    }

    // No operator follows, so the operand stands alone.
    return left;
  }

  private Optional<Parsed<Expression>> parseUnary(int pos, int depth) {
    for (Operator operator : Operator.values()) {
      int p = matchText(pos, operator.getKeyword());
      if (p == NO_MATCH) {
        continue;
      }

      Optional<Parsed<Expression>> operand = parseGroup(skipWhitespace(p), depth);
      if (operand.isPresent()) {
        return matched(new OperatorExpression(operator, operand.get().value), operand.get().end);
      }
    }

    return parsePrimary(pos, depth);
  }

  private Optional<Parsed<Expression>> parsePrimary(int pos, int depth) {
    Optional<Parsed<Expression>> variable = parseVariable(pos);
    if (variable.isPresent()) {
      return variable;
    }

    Optional<Parsed<Expression>> literal = parseLiteral(pos);
    if (literal.isPresent()) {
      return literal;
    }

    Optional<Parsed<Expression>> group = parseGroup(pos, depth);
    if (group.isPresent()) {
      return matched(new ParenthesisExpression(group.get().value), group.get().end);
    }

    return noMatch();
  }

  /**
   * Matches {@code "(" expr ")"}, returning the inner expression.
   */
  private Optional<Parsed<Expression>> parseGroup(int pos, int depth) {
    int p = matchText(pos, "(");
    if (p == NO_MATCH) {
      return noMatch();
    }

    Optional<Parsed<Expression>> inner = parseExpression(p, depth);
    if (!inner.isPresent()) {
      return noMatch();
    }

    p = matchText(inner.get().end, ")");
    if (p == NO_MATCH) {
      return noMatch();
    }
    return matched(inner.get().value, p);
  }

  private Optional<Parsed<Expression>> parseVariable(int pos) {
    int p = matchText(pos, "$");
    if (p == NO_MATCH) {
      return noMatch();
    }

    int end = p;
    while (end < input.length() && VariableExpression.NAME_CHARS.matches(input.charAt(end))) {
      ++end;
    }
    if (end == p) {
      return noMatch();
    }

    return matched(new VariableExpression(input.substring(p, end)), end);
  }

  private Optional<Parsed<Expression>> parseLiteral(int pos) {
    int p = matchText(pos, "\"");
    if (p == NO_MATCH) {
      return noMatch();
    }

    StringBuilder value = new StringBuilder();
    while (p < input.length()) {
      char c = input.charAt(p++);
      if (c == '"') {
        return matched(new StringLiteral(value.toString()), p);
      }

      if (c == '\\') {
        if (p == input.length()) {
          return noMatch();
        }
        switch (input.charAt(p++)) {
          case '"':
            value.append('"');
            break;
          case '\\':
            value.append('\\');
            break;
          case 'n':
            value.append('\n');
            break;
          case 't':
            value.append('\t');
            break;
          default:
            return noMatch();
        }
      } else {
        value.append(c);
      }
    }

    // Ran off the end without a closing quote.
    return noMatch();
  }

  private int matchText(int pos, String text) {
    if (pos == NO_MATCH || !input.startsWith(text, pos)) {
      return NO_MATCH;
    }
    return pos + text.length();
  }

  private int skipWhitespace(int pos) {
    while (pos < input.length() && WHITESPACE.matches(input.charAt(pos))) {
      ++pos;
    }
    return pos;
  }

  /**
   * Skips one or more whitespace characters, failing if there are none at {@code pos}.
   */
  private int requireWhitespace(int pos) {
    if (pos == NO_MATCH) {
      return NO_MATCH;
    }
    int end = skipWhitespace(pos);
    return end > pos ? end : NO_MATCH;
  }

  private static int descend(int depth) {
    if (depth >= MAX_DEPTH) {
      throw new InternalInvariantBrokenException(
          "Expression nesting exceeds maximum depth of " + MAX_DEPTH);
    }
    return depth + 1;
  }

  private static <T> Optional<Parsed<T>> matched(T value, int end) {
    return Optional.of(new Parsed<T>(value, end));
  }

  private static <T> Optional<Parsed<T>> noMatch() {
    return Optional.absent();
  }

  /**
   * A successful match: the value produced and the offset just past the consumed input.
   */
  private static final class Parsed<T> {
    final T value;
    final int end;

    Parsed(T value, int end) {
      this.value = value;
      this.end = end;
    }
  }
}
