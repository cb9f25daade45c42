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

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import com.cmdline.common.text.Substring;

/**
 * A token split out of a command line.  The {@link #getContents() contents} never include the
 * quote characters that delimited the token; the outer offsets do.
 */
public final class Token {

  /**
   * Characters that may delimit a quoted token.
   */
  public static final CharMatcher QUOTES = CharMatcher.anyOf("\"'");

  private final Substring contents;
  private final boolean startsWithQuote;
  private final boolean endsWithQuote;

  /**
   * Creates an unquoted token.
   *
   * @param contents The token's characters.
   */
  public Token(Substring contents) {
    this(contents, false, false);
  }

  /**
   * Creates a token.
   *
   * @param contents The token's characters, excluding any delimiting quotes.
   * @param startsWithQuote Whether a quote character immediately precedes {@code contents}.
   * @param endsWithQuote Whether a quote character immediately follows {@code contents}.
   * @throws IllegalArgumentException if a quote flag is set but there is no quote character at the
   *     corresponding position in the base string.
   */
  public Token(Substring contents, boolean startsWithQuote, boolean endsWithQuote) {
    this.contents = Preconditions.checkNotNull(contents);

    String base = contents.getBase();
    if (startsWithQuote) {
      int quoteIndex = contents.getStartingOffset() - 1;
      Preconditions.checkArgument(quoteIndex >= 0 && QUOTES.matches(base.charAt(quoteIndex)),
          "No opening quote precedes offset %s", contents.getStartingOffset());
    }
    if (endsWithQuote) {
      int quoteIndex = contents.getEndingOffset();
      Preconditions.checkArgument(
          quoteIndex < base.length() && QUOTES.matches(base.charAt(quoteIndex)),
          "No closing quote at offset %s", quoteIndex);
    }

    this.startsWithQuote = startsWithQuote;
    this.endsWithQuote = endsWithQuote;
  }

  public Substring getContents() {
    return contents;
  }

  public boolean startsWithQuote() {
    return startsWithQuote;
  }

  public boolean endsWithQuote() {
    return endsWithQuote;
  }

  public int getInnerLength() {
    return contents.length();
  }

  /**
   * @return The offset in the original line at which the token starts, including an opening quote.
   */
  public int getOuterStartingOffset() {
    return startsWithQuote ? contents.getStartingOffset() - 1 : contents.getStartingOffset();
  }

  /**
   * @return The exclusive offset in the original line at which the token ends, including a closing
   *     quote.
   */
  public int getOuterEndingOffset() {
    return endsWithQuote ? contents.getEndingOffset() + 1 : contents.getEndingOffset();
  }

  public int getOuterLength() {
    return getOuterEndingOffset() - getOuterStartingOffset();
  }

  /**
   * @return The token exactly as it appeared in the original line, quotes included.
   */
  public Substring getOuter() {
    return new Substring(contents.getBase(), getOuterStartingOffset(), getOuterLength());
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof Token)) {
      return false;
    }
    Token other = (Token) o;
    return startsWithQuote == other.startsWithQuote
        && endsWithQuote == other.endsWithQuote
        && contents.equals(other.contents);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(contents, startsWithQuote, endsWithQuote);
  }

  /**
   * @return The token's contents, without delimiting quotes.
   */
  @Override
  public String toString() {
    return contents.toString();
  }

  /**
   * @return A debugging representation including offsets and quote flags.
   */
  public String describe() {
    return MoreObjects.toStringHelper(this)
        .add("contents", contents)
        .add("offset", contents.getStartingOffset())
        .add("startsWithQuote", startsWithQuote)
        .add("endsWithQuote", endsWithQuote)
        .toString();
  }
}
