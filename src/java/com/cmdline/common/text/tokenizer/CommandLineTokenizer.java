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

import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.google.common.base.CharMatcher;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import com.cmdline.common.text.Substring;
import com.cmdline.common.text.token.Token;
import com.cmdline.common.text.token.Tokens;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndex;

/**
 * Splits command lines into {@link Token tokens}, observing quotes.
 *
 * <p>Tokens are separated by runs of Unicode whitespace.  A token that starts with an enabled quote
 * character runs until the matching quote of the same kind, and may contain whitespace and the
 * other kind of quote.  A quote character in the middle of an unquoted token is ordinary content.
 *
 * <p>Unless {@link TokenizerOption#ALLOW_PARTIAL_INPUT} is given, an unclosed quote, or a closing
 * quote followed directly by more characters, is rejected with an
 * {@link IllegalArgumentException} raised while iterating, at the offending token.
 */
public final class CommandLineTokenizer {

  private static final Logger LOG = Logger.getLogger(CommandLineTokenizer.class.getName());

  public static final String UNTERMINATED_QUOTES = "unterminated quotes";
  public static final String TERMINATING_QUOTES_NOT_END_OF_TOKEN =
      "terminating quotes not at end of token";

  private static final char NOT_IN_QUOTES = '\0';

  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

  private CommandLineTokenizer() {
    // utility
  }

  /**
   * Equivalent to calling {@link #tokenize(String, Set)} with double quotes as the only delimiter.
   */
  public static FluentIterable<Token> tokenize(String line) {
    return tokenize(line, EnumSet.of(TokenizerOption.HANDLE_DOUBLE_QUOTE_AS_TOKEN_DELIMITER));
  }

  /**
   * Equivalent to calling {@link #tokenize(String, Set)} with the given options.
   */
  public static FluentIterable<Token> tokenize(String line, TokenizerOption... options) {
    return tokenize(line, Sets.immutableEnumSet(ImmutableList.copyOf(options)));
  }

  /**
   * Lazily tokenizes {@code line}.  Each iteration of the returned iterable makes a single forward
   * pass over the line; syntax errors surface from the iterator when the bad token is reached.
   *
   * @param line The line to split.
   * @param options Tokenizing policy.
   * @return The tokens of {@code line}, in order.
   */
  public static FluentIterable<Token> tokenize(final String line, Set<TokenizerOption> options) {
    checkNotNull(line);
    final Set<TokenizerOption> optionSet = Sets.immutableEnumSet(checkNotNull(options));

    return new FluentIterable<Token>() {
      @Override public Iterator<Token> iterator() {
        return new TokenIterator(line, optionSet);
      }
    };
  }

  /**
   * Tokenizes {@code line} eagerly, returning the contents of each token.
   */
  public static ImmutableList<String> tokenizeToStrings(String line, TokenizerOption... options) {
    return Tokens.toStrings(tokenize(line, options));
  }

  /**
   * Finds the token under a cursor, as a line editor does when completing the current word.  The
   * line is tokenized with {@link TokenizerOption#ALLOW_PARTIAL_INPUT} added to {@code options}.
   *
   * <p>A cursor touching a token's outer span (quotes included, end inclusive) selects that token.
   * A cursor in whitespace between tokens selects a new empty token inserted at the cursor.  A
   * cursor past the last token selects an empty token at index {@code tokens.size()}, which is not
   * added to the token list.
   *
   * @param line The line being edited.
   * @param cursorIndex The cursor offset, in {@code [0, line.length()]}.
   * @param options Tokenizing policy.
   * @return The location of the cursor among the line's tokens.
   */
  public static CursorLocation locate(String line, int cursorIndex, Set<TokenizerOption> options) {
    checkNotNull(line);
    checkPositionIndex(cursorIndex, line.length());

    EnumSet<TokenizerOption> partialOptions = EnumSet.of(TokenizerOption.ALLOW_PARTIAL_INPUT);
    partialOptions.addAll(options);
    List<Token> tokens = Lists.newArrayList(tokenize(line, partialOptions));

    int tokenIndex;
    for (tokenIndex = 0; tokenIndex < tokens.size(); ++tokenIndex) {
      Token token = tokens.get(tokenIndex);
      if (cursorIndex > token.getOuterEndingOffset()) {
        continue;
      }
      if (cursorIndex < token.getOuterStartingOffset()) {
        tokens.add(tokenIndex, new Token(new Substring(line, cursorIndex, 0)));
      }
      break;
    }

    Token current = tokenIndex < tokens.size()
        ? tokens.get(tokenIndex)
        : new Token(new Substring(line, cursorIndex, 0));
    return new CursorLocation(tokens, tokenIndex, current);
  }

  private static final class TokenIterator extends AbstractIterator<Token> {
    private final String line;
    private final Set<TokenizerOption> options;
    private final boolean allowPartialInput;

    private int index = 0;

    TokenIterator(String line, Set<TokenizerOption> options) {
      this.line = line;
      this.options = options;
      this.allowPartialInput = options.contains(TokenizerOption.ALLOW_PARTIAL_INPUT);
    }

    private boolean isDelimiter(char c) {
      for (TokenizerOption option : options) {
        if (option.enablesQuote(c)) {
          return true;
        }
      }
      return false;
    }

    @Override
    protected Token computeNext() {
      // Set once the token opened with a quote, whether or not it has been closed yet.
      boolean quoted = false;

      // The quote that opened the current token while we are still inside it.
      char inQuotes = NOT_IN_QUOTES;

      boolean endQuotePresent = false;
      int tokenStartIndex = -1;
      int tokenEndIndex = -1;

      // Runs one step past the end of the line so a token in progress gets finished.
      for (; index <= line.length(); ++index) {
        if (index == line.length() || WHITESPACE.matches(line.charAt(index))) {
          boolean completeToken = false;

          if (tokenStartIndex >= 0 && inQuotes == NOT_IN_QUOTES) {
            completeToken = true;
            endQuotePresent = quoted;
          } else if (index == line.length() && inQuotes != NOT_IN_QUOTES && allowPartialInput) {
            completeToken = true;
          }

          if (completeToken) {
            if (tokenEndIndex < 0) {
              tokenEndIndex = index;
            }
            ++index;
            return new Token(
                new Substring(line, tokenStartIndex, tokenEndIndex - tokenStartIndex),
                quoted,
                endQuotePresent);
          }
        } else if (isDelimiter(line.charAt(index))) {
          char c = line.charAt(index);
          if (tokenStartIndex < 0) {
            inQuotes = c;
            quoted = true;
            tokenStartIndex = index + 1;
          } else if (quoted && inQuotes == c) {
            if (index + 1 != line.length() && !WHITESPACE.matches(line.charAt(index + 1))) {
              if (!allowPartialInput) {
                LOG.fine(String.format("Quote at offset %d closes a token early in: %s",
                    index, line));
                throw new IllegalArgumentException(TERMINATING_QUOTES_NOT_END_OF_TOKEN);
              }
            } else {
              inQuotes = NOT_IN_QUOTES;
              endQuotePresent = true;
              tokenEndIndex = index;
            }
          }
          // Otherwise the quote is embedded content: inside an unquoted token, a quote of the
          // other kind, or a quote we already decided to keep as partial input.
        } else if (tokenStartIndex < 0) {
          tokenStartIndex = index;
        }
      }

      if (tokenStartIndex >= 0) {
        LOG.fine(String.format("Quote opened at offset %d is never closed in: %s",
            tokenStartIndex - 1, line));
        throw new IllegalArgumentException(UNTERMINATED_QUOTES);
      }

      return endOfData();
    }
  }
}
