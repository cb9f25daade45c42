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

import java.util.Map;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Stock {@link ExpressionEnvironment} implementations.
 */
public final class ExpressionEnvironments {

  private static final ExpressionEnvironment EMPTY = new ExpressionEnvironment() {
    @Override public Optional<String> tryGetVariable(String variableName) {
      return Optional.absent();
    }

    @Override public String toString() {
      return "ExpressionEnvironments.empty()";
    }
  };

  private ExpressionEnvironments() {
    // utility
  }

  /**
   * @return An environment that defines no variables.
   */
  public static ExpressionEnvironment empty() {
    return EMPTY;
  }

  /**
   * Creates an environment backed by an immutable copy of {@code variables}.  Lookups are case
   * sensitive.
   *
   * @param variables Variable values, keyed by name.
   * @return An environment over a snapshot of {@code variables}.
   */
  public static ExpressionEnvironment fromMap(Map<String, String> variables) {
    final ImmutableMap<String, String> snapshot = ImmutableMap.copyOf(variables);
    return new ExpressionEnvironment() {
      @Override public Optional<String> tryGetVariable(String variableName) {
        Preconditions.checkNotNull(variableName);
        return Optional.fromNullable(snapshot.get(variableName));
      }

      @Override public String toString() {
        return "ExpressionEnvironments.fromMap(" + snapshot + ")";
      }
    };
  }
}
