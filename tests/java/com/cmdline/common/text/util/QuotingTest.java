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

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import com.cmdline.common.text.tokenizer.CommandLineTokenizer;
import com.cmdline.common.text.tokenizer.TokenizerOption;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public class QuotingTest {

  @Test
  public void testNoQuotingNeeded() {
    String value = "plain";
    assertSame(value, Quoting.quoteIfNeeded(value));
  }

  @Test
  public void testQuotesEmpty() {
    assertEquals("\"\"", Quoting.quoteIfNeeded(""));
  }

  @Test
  public void testQuotesSeparators() {
    assertEquals("\"a b\"", Quoting.quoteIfNeeded("a b"));
    assertEquals("\"a\tb\"", Quoting.quoteIfNeeded("a\tb"));
    assertEquals("'a b'", Quoting.quoteIfNeeded("a b", '\''));
  }

  @Test
  public void testOtherWhitespaceLeftAlone() {
    assertEquals("a\nb", Quoting.quoteIfNeeded("a\nb"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsNonQuote() {
    Quoting.quoteIfNeeded("a b", '*');
  }

  @Test
  public void testQuotedValuesTokenizeBack() {
    String line = Quoting.quoteIfNeeded("first value") + " "
        + Quoting.quoteIfNeeded("second") + " "
        + Quoting.quoteIfNeeded("");
    assertEquals(ImmutableList.of("first value", "second", ""),
        CommandLineTokenizer.tokenizeToStrings(line,
            TokenizerOption.HANDLE_DOUBLE_QUOTE_AS_TOKEN_DELIMITER));
  }
}
