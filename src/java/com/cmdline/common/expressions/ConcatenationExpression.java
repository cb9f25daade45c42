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
 * Concatenation of two expressions.
 */
public final class ConcatenationExpression extends Expression {
  private final Expression left;
  private final Expression right;

  public ConcatenationExpression(Expression left, Expression right) {
    this.left = Preconditions.checkNotNull(left);
    this.right = Preconditions.checkNotNull(right);
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof ConcatenationExpression)) {
      return false;
    }
    ConcatenationExpression other = (ConcatenationExpression) o;
    return left.equals(other.left) && right.equals(other.right);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(left, right);
  }

  @Override
  public String toString() {
    return String.format("Concat(%s, %s)", left, right);
  }
}
