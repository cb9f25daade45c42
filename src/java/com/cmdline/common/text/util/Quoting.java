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

package com.cmdline.common.text.util;

import org.apache.commons.lang.StringUtils;

import com.cmdline.common.text.token.Token;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Quotes values so that tokenizing them yields them back as single tokens.
 */
public final class Quoting {

  public static final char DEFAULT_QUOTE = '"';

  private static final String SEPARATORS = " \t";

  private Quoting() {
    // utility
  }

  /**
   * Equivalent to calling {@link #quoteIfNeeded(String, char)} with {@link #DEFAULT_QUOTE}.
   */
  public static String quoteIfNeeded(String value) {
    return quoteIfNeeded(value, DEFAULT_QUOTE);
  }

  /**
   * Wraps {@code value} in {@code quote} characters if it is empty or contains a space or tab.
   *
   * @param value The value to quote.
   * @param quote The quote character to wrap with.
   * @return The quoted value, or {@code value} itself if no quoting is needed.
   */
  public static String quoteIfNeeded(String value, char quote) {
    checkNotNull(value);
    checkArgument(Token.QUOTES.matches(quote), "Not a quote character: %s", quote);

    if (!value.isEmpty() && !StringUtils.containsAny(value, SEPARATORS)) {
      return value;
    }
    return quote + value + quote;
  }
}
