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
 * Resolves variable names during expression evaluation.
 */
public interface ExpressionEnvironment {

  /**
   * Looks up a variable.
   *
   * @param variableName Name of the variable, without the leading {@code $}.
   * @return The variable's value, or absent if the environment has no such variable.
   */
  Optional<String> tryGetVariable(String variableName);
}
