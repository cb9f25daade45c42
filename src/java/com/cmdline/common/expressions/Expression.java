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

import com.google.common.base.Optional;

/**
 * A node of the string interpolation language.  The set of node kinds is closed: every kind has a
 * method on {@link Visitor}, so a new kind cannot be added without every visitor handling it.
 */
public abstract class Expression {

  Expression() {
    // Only the node kinds in this package.
  }

  /**
   * Dispatches to the {@code visitor} method for this node's kind.
   *
   * @param visitor The visitor to dispatch to.
   * @param <T> The visitor's result type.
   * @return The visitor's result.
   */
  public abstract <T> T accept(Visitor<T> visitor);

  /**
   * Evaluates this expression.
   *
   * @param env Environment in which to resolve variables.
   * @return The value of the expression, or absent if it could not be evaluated.
   */
  public final Optional<String> tryEvaluate(ExpressionEnvironment env) {
    return ExpressionEvaluator.evaluate(this, env);
  }

  /**
   * Handles each kind of expression node.
   *
   * @param <T> The result type.
   */
  public interface Visitor<T> {
    T visit(StringLiteral literal);

    T visit(VariableExpression variable);

    T visit(ConcatenationExpression concatenation);

    T visit(ConditionalExpression conditional);

    T visit(OperatorExpression operator);

    T visit(ParenthesisExpression parenthesis);
  }
}
