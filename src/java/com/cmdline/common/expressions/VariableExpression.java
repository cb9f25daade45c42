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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/**
 * A reference to a variable, resolved against an {@link ExpressionEnvironment} at evaluation time.
 */
public final class VariableExpression extends Expression {

  /**
   * Characters that may appear in a variable name.
   */
  public static final CharMatcher NAME_CHARS =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .precomputed();

  private final String variableName;

  /**
   * @param variableName Name of the variable; must be non-empty and alphanumeric.
   * @throws IllegalArgumentException if {@code variableName} is not a valid name.
   */
  public VariableExpression(String variableName) {
    Preconditions.checkNotNull(variableName);
    Preconditions.checkArgument(isValidVariableName(variableName),
        "Invalid variable name: %s", variableName);
    this.variableName = variableName;
  }

  /**
   * @return Whether {@code name} is a non-empty run of ASCII letters and digits.
   */
  public static boolean isValidVariableName(@Nullable String name) {
    return name != null && !name.isEmpty() && NAME_CHARS.matchesAllOf(name);
  }

  public String getVariableName() {
    return variableName;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return (o instanceof VariableExpression)
        && variableName.equals(((VariableExpression) o).variableName);
  }

  @Override
  public int hashCode() {
    return variableName.hashCode();
  }

  @Override
  public String toString() {
    return String.format("Variable(%s)", variableName);
  }
}
