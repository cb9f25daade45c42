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
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

/**
 * An {@code if ... then ... else ...} expression.  The condition holds when it evaluates to a
 * non-empty string.
 *
 * <p>The else branch is optional here even though the textual grammar always requires one; a
 * conditional without an else branch can only be built programmatically, and yields the empty
 * string when its condition does not hold.
 */
public final class ConditionalExpression extends Expression {
  private final Expression condition;
  private final Expression thenExpression;
  private final Optional<Expression> elseExpression;

  public ConditionalExpression(Expression condition, Expression thenExpression) {
    this(condition, thenExpression, Optional.<Expression>absent());
  }

  public ConditionalExpression(
      Expression condition,
      Expression thenExpression,
      Expression elseExpression) {
    this(condition, thenExpression, Optional.of(elseExpression));
  }

  public ConditionalExpression(
      Expression condition,
      Expression thenExpression,
      Optional<Expression> elseExpression) {
    this.condition = Preconditions.checkNotNull(condition);
    this.thenExpression = Preconditions.checkNotNull(thenExpression);
    this.elseExpression = Preconditions.checkNotNull(elseExpression);
  }

  public Expression getCondition() {
    return condition;
  }

  public Expression getThenExpression() {
    return thenExpression;
  }

  public Optional<Expression> getElseExpression() {
    return elseExpression;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof ConditionalExpression)) {
      return false;
    }
    ConditionalExpression other = (ConditionalExpression) o;
    return condition.equals(other.condition)
        && thenExpression.equals(other.thenExpression)
        && elseExpression.equals(other.elseExpression);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(condition, thenExpression, elseExpression);
  }

  @Override
  public String toString() {
    return String.format("If(%s, %s, %s)", condition, thenExpression, elseExpression);
  }
}
