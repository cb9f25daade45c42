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

import org.junit.Before;
import org.junit.Test;

import com.cmdline.common.testing.easymock.EasyMockTest;

import static org.easymock.EasyMock.expect;
import static org.junit.Assert.assertEquals;

public class ExpressionEvaluatorTest extends EasyMockTest {

  private ExpressionEnvironment env;

  @Before
  public void setUp() {
    env = createMock(ExpressionEnvironment.class);
  }

  @Test
  public void testLiteral() {
    control.replay();

    assertEquals(Optional.of("foo"), evaluate(new StringLiteral("foo")));
  }

  @Test
  public void testVariable() {
    expect(env.tryGetVariable("name")).andReturn(Optional.of("value"));

    control.replay();

    assertEquals(Optional.of("value"), evaluate(new VariableExpression("name")));
  }

  @Test
  public void testUnresolvedVariableIsEmpty() {
    expect(env.tryGetVariable("missing")).andReturn(Optional.<String>absent());

    control.replay();

    assertEquals(Optional.of(""), evaluate(new VariableExpression("missing")));
  }

  @Test
  public void testConcatenation() {
    expect(env.tryGetVariable("a")).andReturn(Optional.of("left"));

    control.replay();

    assertEquals(Optional.of("left-right"), evaluate(new ConcatenationExpression(
        new VariableExpression("a"),
        new ConcatenationExpression(new StringLiteral("-"), new StringLiteral("right")))));
  }

  @Test
  public void testConditionalEvaluatesOnlyThenBranch() {
    expect(env.tryGetVariable("cond")).andReturn(Optional.of("false"));
    expect(env.tryGetVariable("yes")).andReturn(Optional.of("Y"));

    control.replay();

    assertEquals(Optional.of("Y"), evaluate(new ConditionalExpression(
        new VariableExpression("cond"),
        new VariableExpression("yes"),
        new VariableExpression("no"))));
  }

  @Test
  public void testConditionalEvaluatesOnlyElseBranch() {
    expect(env.tryGetVariable("cond")).andReturn(Optional.<String>absent());
    expect(env.tryGetVariable("no")).andReturn(Optional.of("N"));

    control.replay();

    assertEquals(Optional.of("N"), evaluate(new ConditionalExpression(
        new VariableExpression("cond"),
        new VariableExpression("yes"),
        new VariableExpression("no"))));
  }

  @Test
  public void testConditionalWithoutElse() {
    control.replay();

    assertEquals(Optional.of(""), evaluate(
        new ConditionalExpression(new StringLiteral(""), new StringLiteral("then"))));
    assertEquals(Optional.of("then"), evaluate(
        new ConditionalExpression(new StringLiteral(" "), new StringLiteral("then"))));
  }

  @Test
  public void testOperators() {
    expect(env.tryGetVariable("v")).andReturn(Optional.of("MiXeD")).times(2);

    control.replay();

    assertEquals(Optional.of("mixed"),
        evaluate(new OperatorExpression(Operator.TO_LOWER_CASE, new VariableExpression("v"))));
    assertEquals(Optional.of("MIXED"),
        evaluate(new OperatorExpression(Operator.TO_UPPER_CASE, new VariableExpression("v"))));
  }

  @Test
  public void testCaseConversionIgnoresDefaultLocale() {
    control.replay();

    assertEquals(Optional.of("title"),
        evaluate(new OperatorExpression(Operator.TO_LOWER_CASE, new StringLiteral("TITLE"))));
    assertEquals(Optional.of("INFO"),
        evaluate(new OperatorExpression(Operator.TO_UPPER_CASE, new StringLiteral("info"))));
  }

  @Test
  public void testParenthesis() {
    control.replay();

    assertEquals(Optional.of("inner"),
        evaluate(new ParenthesisExpression(new StringLiteral("inner"))));
  }

  @Test
  public void testParsedExpression() {
    expect(env.tryGetVariable("name")).andReturn(Optional.of("World"));
    expect(env.tryGetVariable("loud")).andReturn(Optional.of("yes"));

    control.replay();

    Expression expression = ExpressionParser.tryParse(
        "\"Hello, \" + (if $loud then upper($name) else $name) + \"!\"").get();
    assertEquals(Optional.of("Hello, WORLD!"), expression.tryEvaluate(env));
  }

  private Optional<String> evaluate(Expression expression) {
    return ExpressionEvaluator.evaluate(expression, env);
  }
}
