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

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Application of a unary {@link Operator} to an operand.
 */
public final class OperatorExpression extends Expression {
  private final Operator operator;
  private final Expression operand;

  public OperatorExpression(Operator operator, Expression operand) {
    this.operator = Preconditions.checkNotNull(operator);
    this.operand = Preconditions.checkNotNull(operand);
  }

  public Operator getOperator() {
    return operator;
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof OperatorExpression)) {
      return false;
    }
    OperatorExpression other = (OperatorExpression) o;
    return operator == other.operator && operand.equals(other.operand);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(operator, operand);
  }

  @Override
  public String toString() {
    return String.format("%s(%s)", operator.getKeyword(), operand);
  }
}
