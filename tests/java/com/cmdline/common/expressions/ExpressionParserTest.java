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
import com.google.common.base.Strings;

import org.junit.Test;

import com.cmdline.common.base.InternalInvariantBrokenException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class ExpressionParserTest {

  private static final Expression X = new VariableExpression("x");
  private static final Expression Y = new VariableExpression("y");
  private static final Expression Z = new VariableExpression("z");

  @Test
  public void testBlankIsInvalid() {
    assertInvalid("");
    assertInvalid(" ");
    assertInvalid("\t");
  }

  @Test
  public void testTrailingTextIsInvalid() {
    assertInvalid("$foo something trailing");
    assertInvalid("$x)");
  }

  @Test
  public void testVariable() {
    assertParses(new VariableExpression("foo"), "$foo");
    assertParses(new VariableExpression("f1o2o3"), "$f1o2o3");
    assertParses(new VariableExpression("X"), "  $X  ");
  }

  @Test
  public void testBadVariableNames() {
    assertInvalid("$");
    assertInvalid("$f@f");
    assertInvalid("$$f");
    assertInvalid("foo");
  }

  @Test
  public void testLiteral() {
    assertParses(new StringLiteral("foo"), "\"foo\"");
    assertParses(new StringLiteral(""), "\"\"");
    assertParses(new StringLiteral("a {b} $c"), "\"a {b} $c\"");
  }

  @Test
  public void testLiteralEscapes() {
    assertParses(new StringLiteral("\"foo"), "\"\\\"foo\"");
    assertParses(new StringLiteral("back\\slash"), "\"back\\\\slash\"");
    assertParses(new StringLiteral("foo\nbar"), "\"foo\\nbar\"");
    assertParses(new StringLiteral("foo\tbar"), "\"foo\\tbar\"");
  }

  @Test
  public void testBadLiterals() {
    assertInvalid("\"foo\\x\"");
    assertInvalid("\"foo\\'\"");
    assertInvalid("\"foo\\\"");
    assertInvalid("\"foo\\");
    assertInvalid("\"foo");
  }

  @Test
  public void testConditional() {
    assertParses(new ConditionalExpression(X, Y, Z), "if $x then $y else $z");
    assertParses(new ConditionalExpression(X, Y, Z), "if  $x  then  $y  else  $z");
    assertParses(new ConditionalExpression(X, Y, Z), " if $x then $y else $z ");
  }

  @Test
  public void testConditionalRequiresWhitespace() {
    assertInvalid("if$x then $y else $z");
    assertInvalid("if $x then$y else $z");
    assertInvalid("if $x then $y else$z");
  }

  @Test
  public void testConditionalKeywordsAreCaseSensitive() {
    assertInvalid("IF $x then $y else $z");
    assertInvalid("if $x THEN $y else $z");
    assertInvalid("if $x then $y ELSE $z");
  }

  @Test
  public void testMalformedConditionals() {
    assertInvalid("if");
    assertInvalid("if $");
    assertInvalid("if $x");
    assertInvalid("if $x then");
    assertInvalid("if $x then $");
    assertInvalid("if $x then $y");
    assertInvalid("if $x then $y else");
    assertInvalid("if $x then $y else $");
    assertInvalid("if $x else $y then $z");
  }

  @Test
  public void testNestedConditionals() {
    Expression a = new VariableExpression("a");
    Expression b = new VariableExpression("b");
    assertParses(
        new ConditionalExpression(a, new ConditionalExpression(b, X, Y), Z),
        "if $a then if $b then $x else $y else $z");
  }

  @Test
  public void testConditionalWithConcatenations() {
    assertParses(
        new ConditionalExpression(
            new ConcatenationExpression(X, Y),
            new StringLiteral("yes"),
            new ConcatenationExpression(new StringLiteral("no: "), Z)),
        "if $x + $y then \"yes\" else \"no: \" + $z");
  }

  @Test
  public void testConcatenation() {
    assertParses(new ConcatenationExpression(X, Y), "$x + $y");
    assertParses(new ConcatenationExpression(X, Y), "$x  +\t$y ");
  }

  @Test
  public void testConcatenationIsRightAssociative() {
    assertParses(
        new ConcatenationExpression(X, new ConcatenationExpression(Y, Z)),
        "$x + $y + $z");
  }

  @Test
  public void testConcatenationNeedsTwoOperands() {
    assertInvalid("$x +");
    assertInvalid("$x + ");
    assertInvalid("+ $y");
  }

  @Test
  public void testConcatenationRequiresWhitespace() {
    assertInvalid("$x+$y");
    assertInvalid("$x +$y");
    assertInvalid("$x+ $y");
  }

  @Test
  public void testOperators() {
    assertParses(new OperatorExpression(Operator.TO_LOWER_CASE, X), "lower($x)");
    assertParses(new OperatorExpression(Operator.TO_UPPER_CASE, X), "upper($x)");
  }

  @Test
  public void testOperatorWhitespace() {
    assertParses(new OperatorExpression(Operator.TO_LOWER_CASE, X), "lower ($x)");
    assertParses(new OperatorExpression(Operator.TO_LOWER_CASE, X), "lower( $x)");
    assertParses(new OperatorExpression(Operator.TO_LOWER_CASE, X), "lower($x )");
  }

  @Test
  public void testOperatorsAreCaseSensitive() {
    assertInvalid("Lower($x)");
    assertInvalid("Upper($x)");
    assertInvalid("lower $x");
  }

  @Test
  public void testOperatorOnCompoundOperand() {
    assertParses(
        new OperatorExpression(Operator.TO_UPPER_CASE,
            new ConditionalExpression(X, Y, new StringLiteral(""))),
        "upper(if $x then $y else \"\")");
    assertParses(
        new ConcatenationExpression(
            new OperatorExpression(Operator.TO_UPPER_CASE, X),
            new OperatorExpression(Operator.TO_LOWER_CASE, Y)),
        "upper($x) + lower($y)");
  }

  @Test
  public void testParentheses() {
    assertParses(new ParenthesisExpression(X), "($x)");
    assertParses(new ParenthesisExpression(X), "( $x)");
    assertParses(new ParenthesisExpression(X), "($x )");
    assertParses(
        new ConcatenationExpression(
            new ParenthesisExpression(new ConcatenationExpression(X, Y)), Z),
        "($x + $y) + $z");
    assertInvalid("($x");
    assertInvalid("()");
  }

  @Test
  public void testModerateNesting() {
    assertParses(
        new ParenthesisExpression(new ParenthesisExpression(
            new ParenthesisExpression(new ParenthesisExpression(X)))),
        "(((($x))))");
  }

  @Test
  public void testLongConcatenation() {
    Expression expected = Z;
    for (int i = 0; i < 9; i++) {
      expected = new ConcatenationExpression(Z, expected);
    }
    assertParses(expected, "$z + $z + $z + $z + $z + $z + $z + $z + $z + $z");
  }

  @Test(expected = InternalInvariantBrokenException.class)
  public void testDeepNestingTripsDepthGuard() {
    ExpressionParser.tryParse(Strings.repeat("(", 60) + "$x" + Strings.repeat(")", 60));
  }

  private static void assertParses(Expression expected, String content) {
    assertEquals(Optional.of(expected), ExpressionParser.tryParse(content));
  }

  private static void assertInvalid(String content) {
    assertFalse(content, ExpressionParser.tryParse(content).isPresent());
  }
}
