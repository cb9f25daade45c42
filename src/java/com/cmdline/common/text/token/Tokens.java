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

package com.cmdline.common.text.token;

import com.google.common.base.Function;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;

/**
 * Utility functions for working with {@link Token tokens}.
 */
public final class Tokens {

  /**
   * Extracts the contents of a token, without delimiting quotes.
   */
  public static final Function<Token, String> CONTENTS = new Function<Token, String>() {
    @Override public String apply(Token token) {
      return token.toString();
    }
  };

  private Tokens() {
    // utility
  }

  /**
   * Materializes the contents of each token, in order.
   *
   * @param tokens Tokens to convert.
   * @return The token contents.
   */
  public static ImmutableList<String> toStrings(Iterable<Token> tokens) {
    return FluentIterable.from(tokens).transform(CONTENTS).toList();
  }
}
