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

package com.cmdline.common.text.tokenizer;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import com.cmdline.common.text.token.Token;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Where a cursor sits among the tokens of a line being edited.
 *
 * @see CommandLineTokenizer#locate(String, int, java.util.Set)
 */
public final class CursorLocation {
  private final ImmutableList<Token> tokens;
  private final int tokenIndex;
  private final Token currentToken;

  CursorLocation(List<Token> tokens, int tokenIndex, Token currentToken) {
    checkArgument(tokenIndex >= 0 && tokenIndex <= tokens.size());
    this.tokens = ImmutableList.copyOf(tokens);
    this.tokenIndex = tokenIndex;
    this.currentToken = checkNotNull(currentToken);
  }

  /**
   * @return The tokens of the line, including an empty token inserted at the cursor when the cursor
   *     sat between two tokens.
   */
  public ImmutableList<Token> getTokens() {
    return tokens;
  }

  /**
   * @return Index of the current token in {@link #getTokens()}, or {@code getTokens().size()} when
   *     the cursor is past the last token.
   */
  public int getTokenIndex() {
    return tokenIndex;
  }

  public Token getCurrentToken() {
    return currentToken;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tokenIndex", tokenIndex)
        .add("currentToken", currentToken.describe())
        .toString();
  }
}
