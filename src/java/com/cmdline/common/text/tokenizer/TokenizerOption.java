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

/**
 * Policy switches for {@link CommandLineTokenizer}.
 */
public enum TokenizerOption {
  /**
   * Tolerate incomplete lines, such as a line still being typed: an unclosed quote on the last
   * token and quotes closed in the middle of a token are accepted instead of rejected.
   */
  ALLOW_PARTIAL_INPUT,

  /**
   * Treat {@code "} as a token delimiter, allowing whitespace inside the token.
   */
  HANDLE_DOUBLE_QUOTE_AS_TOKEN_DELIMITER('"'),

  /**
   * Treat {@code '} as a token delimiter, allowing whitespace inside the token.
   */
  HANDLE_SINGLE_QUOTE_AS_TOKEN_DELIMITER('\'');

  private static final char NO_QUOTE = '\0';

  private final char quote;

  private TokenizerOption() {
    this(NO_QUOTE);
  }

  private TokenizerOption(char quote) {
    this.quote = quote;
  }

  /**
   * @return Whether this option enables {@code c} as a token delimiter.
   */
  boolean enablesQuote(char c) {
    return quote != NO_QUOTE && quote == c;
  }
}
