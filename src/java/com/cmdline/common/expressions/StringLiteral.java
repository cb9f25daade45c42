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
 * A string literal.
 */
public final class StringLiteral extends Expression {
  private final String value;

  public StringLiteral(String value) {
    this.value = Preconditions.checkNotNull(value);
  }

  public String getValue() {
    return value;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return (o instanceof StringLiteral) && value.equals(((StringLiteral) o).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return String.format("StringLiteral(%s)", value);
  }
}
