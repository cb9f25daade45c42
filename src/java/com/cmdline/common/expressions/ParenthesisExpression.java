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

import com.google.common.base.Preconditions;

/**
 * A parenthesized expression.  Evaluates to its inner expression.
 */
public final class ParenthesisExpression extends Expression {
  private final Expression innerExpression;

  public ParenthesisExpression(Expression innerExpression) {
    this.innerExpression = Preconditions.checkNotNull(innerExpression);
  }

  public Expression getInnerExpression() {
    return innerExpression;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return (o instanceof ParenthesisExpression)
        && innerExpression.equals(((ParenthesisExpression) o).innerExpression);
  }

  @Override
  public int hashCode() {
    return innerExpression.hashCode() * 31 + 1;
  }

  @Override
  public String toString() {
    return String.format("Paren(%s)", innerExpression);
  }
}
