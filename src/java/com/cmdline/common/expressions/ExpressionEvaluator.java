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

import java.util.Locale;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

import com.cmdline.common.base.InternalInvariantBrokenException;

/**
 * Evaluates expression trees against an {@link ExpressionEnvironment}.
 *
 * <p>Variables that the environment does not define evaluate to the empty string.  A conditional
 * evaluates its condition and then only the branch it selects; any string but the empty string
 * selects the then branch.
 */
public final class ExpressionEvaluator implements Expression.Visitor<Optional<String>> {

  private final ExpressionEnvironment env;

  public ExpressionEvaluator(ExpressionEnvironment env) {
    this.env = Preconditions.checkNotNull(env);
  }

  /**
   * Evaluates {@code expression} in {@code env}.
   *
   * @param expression The expression to evaluate.
   * @param env Environment in which to resolve variables.
   * @return The expression's value, or absent if some part of it failed to evaluate.
   */
  public static Optional<String> evaluate(Expression expression, ExpressionEnvironment env) {
    Preconditions.checkNotNull(expression);
    return expression.accept(new ExpressionEvaluator(env));
  }

  @Override
  public Optional<String> visit(StringLiteral literal) {
    return Optional.of(literal.getValue());
  }

  @Override
  public Optional<String> visit(VariableExpression variable) {
    return Optional.of(env.tryGetVariable(variable.getVariableName()).or(""));
  }

  @Override
  public Optional<String> visit(ConcatenationExpression concatenation) {
    Optional<String> left = concatenation.getLeft().accept(this);
    if (!left.isPresent()) {
      return Optional.absent();
    }
    Optional<String> right = concatenation.getRight().accept(this);
    if (!right.isPresent()) {
      return Optional.absent();
    }
    return Optional.of(left.get() + right.get());
  }

  @Override
  public Optional<String> visit(ConditionalExpression conditional) {
    Optional<String> condition = conditional.getCondition().accept(this);
    if (!condition.isPresent()) {
      return Optional.absent();
    }

    if (!condition.get().isEmpty()) {
      return conditional.getThenExpression().accept(this);
    }

    Optional<Expression> elseExpression = conditional.getElseExpression();
    return elseExpression.isPresent() ? elseExpression.get().accept(this) : Optional.of("");
  }

  @Override
  public Optional<String> visit(OperatorExpression operator) {
    Optional<String> operand = operator.getOperand().accept(this);
    if (!operand.isPresent()) {
      return Optional.absent();
    }

    switch (operator.getOperator()) {
      case TO_LOWER_CASE:
        return Optional.of(operand.get().toLowerCase(Locale.ROOT));
      case TO_UPPER_CASE:
        return Optional.of(operand.get().toUpperCase(Locale.ROOT));
      default:
        throw new InternalInvariantBrokenException(
            "Unhandled operator: " + operator.getOperator());
    }
  }

  @Override
  public Optional<String> visit(ParenthesisExpression parenthesis) {
    return parenthesis.getInnerExpression().accept(this);
  }
}
