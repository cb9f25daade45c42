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

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import com.cmdline.common.text.Substring;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TokenTest {

  @Test
  public void testQuotedToken() {
    String line = "\"a b\" c";
    Token token = new Token(new Substring(line, 1, 3), true, true);

    assertEquals("a b", token.toString());
    assertEquals(3, token.getInnerLength());
    assertEquals(0, token.getOuterStartingOffset());
    assertEquals(5, token.getOuterEndingOffset());
    assertEquals(5, token.getOuterLength());
    assertEquals("\"a b\"", token.getOuter().toString());
    assertTrue(token.startsWithQuote());
    assertTrue(token.endsWithQuote());
  }

  @Test
  public void testUnquotedToken() {
    Token token = new Token(new Substring("abc def", 4, 3));

    assertEquals("def", token.toString());
    assertEquals(4, token.getOuterStartingOffset());
    assertEquals(7, token.getOuterEndingOffset());
    assertEquals(token.getContents(), token.getOuter());
    assertFalse(token.startsWithQuote());
    assertFalse(token.endsWithQuote());
  }

  @Test
  public void testOpenQuoteOnly() {
    Token token = new Token(new Substring("'ab", 1), true, false);
    assertEquals("ab", token.toString());
    assertEquals("'ab", token.getOuter().toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingOpeningQuote() {
    new Token(new Substring("abc", 1, 1), true, false);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOpeningQuoteBeforeStartOfLine() {
    new Token(new Substring("abc", 0, 1), true, false);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testClosingQuotePastEndOfLine() {
    new Token(new Substring("\"ab", 1), true, true);
  }

  @Test
  public void testEquals() {
    String line = "\"x\"";
    assertEquals(new Token(new Substring(line, 1, 1), true, true),
        new Token(new Substring(line, 1, 1), true, true));
    assertFalse(new Token(new Substring(line, 1, 1), true, true)
        .equals(new Token(new Substring(line, 1, 1), true, false)));
  }

  @Test
  public void testDescribe() {
    String description = new Token(new Substring("ab", 0)).describe();
    assertTrue(description, description.contains("contents=ab"));
    assertTrue(description, description.contains("startsWithQuote=false"));
  }

  @Test
  public void testToStrings() {
    String line = "one \"two\"";
    assertEquals(ImmutableList.of("one", "two"),
        Tokens.toStrings(ImmutableList.of(
            new Token(new Substring(line, 0, 3)),
            new Token(new Substring(line, 5, 3), true, true))));
    assertEquals(ImmutableList.<String>of(), Tokens.toStrings(ImmutableList.<Token>of()));
  }
}
