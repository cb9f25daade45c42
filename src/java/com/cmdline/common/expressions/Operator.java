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

/**
 * Unary operators, applied with call syntax: {@code lower(EXPR)}.
 */
public enum Operator {
  TO_LOWER_CASE("lower"),
  TO_UPPER_CASE("upper");

  private final String keyword;

  private Operator(String keyword) {
    this.keyword = keyword;
  }

  /**
   * @return The case-sensitive keyword that names this operator in expressions.
   */
  public String getKeyword() {
    return keyword;
  }
}
