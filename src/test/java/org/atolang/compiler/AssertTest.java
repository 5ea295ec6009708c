/*
 * Copyright 2025 The Atolang Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.atolang.compiler;

import static com.google.common.truth.Truth.assertThat;
import static org.atolang.compiler.TestAsts.assertion;
import static org.atolang.compiler.TestAsts.binary;
import static org.atolang.compiler.TestAsts.file;
import static org.atolang.compiler.TestAsts.group;
import static org.atolang.compiler.TestAsts.module;
import static org.atolang.compiler.TestAsts.num;
import static org.atolang.compiler.TestAsts.plusMinus;
import static org.atolang.compiler.TestAsts.qty;
import static org.atolang.compiler.TestAsts.range;
import static org.atolang.compiler.TestAsts.ref;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.atolang.ast.Ast;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class AssertTest {

  private final MockTypeGraph graph = new MockTypeGraph();

  private ImmutableList<String> compileTop(Ast.Node... body) {
    Compiler.compile(file(module("Top", body)), graph);
    ImmutableList<String> lines = graph.lines("Top");
    // Skip the block's own traits.
    return lines.subList(4, lines.size());
  }

  @Test
  public void within() {
    ImmutableList<String> lines =
        compileTop(
            assertion(ref("r.resistance"), "within", plusMinus(qty("10", "kohm"), qty("5", "%"))));
    assertThat(lines)
        .containsExactly(
            "Top: child _lit_2: Numbers{min=9500, max=10500, unit=Ohm}",
            "Top: child _assert_3: IsSubset{constrained=true}",
            "Top: link _assert_3 -> r.resistance (operand[0])",
            "Top: link _assert_3 -> _lit_2 (operand[1])")
        .inOrder();
  }

  @Test
  public void operators(
      @TestParameter({
            ">: GreaterThan",
            ">=: GreaterOrEqual",
            "<: LessThan",
            "<=: LessOrEqual",
            "within: IsSubset",
            "is: Is"
          })
          String mapping) {
    int colon = mapping.indexOf(':');
    String operator = mapping.substring(0, colon);
    String predicate = mapping.substring(colon + 2);
    ImmutableList<String> lines = compileTop(assertion(ref("a"), operator, qty("1", "V")));
    assertThat(lines).contains("Top: child _assert_3: " + predicate + "{constrained=true}");
  }

  @Test
  public void unsupportedOperator() {
    DslException e =
        assertThrows(
            DslException.class, () -> compileTop(assertion(ref("a"), "!=", qty("1", "V"))));
    assertThat(e).hasMessageThat().isEqualTo("Unsupported comparison operator: `!=`");
  }

  @Test
  public void exactlyOneComparison() {
    Ast.AssertStmt chained =
        new Ast.AssertStmt(
            new Ast.ComparisonExpression(
                num("0"),
                ImmutableList.of(
                    new Ast.ComparisonClause("<", ref("a")),
                    new Ast.ComparisonClause("<", num("5")))));
    DslException e = assertThrows(DslException.class, () -> compileTop(chained));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Assertions must have exactly one comparison, found 2");
  }

  @Test
  public void arithmetic() {
    ImmutableList<String> lines =
        compileTop(
            assertion(
                binary("+", ref("a"), qty("1", "V")),
                "<",
                group(binary("*", ref("b"), num("2")))));
    assertThat(lines)
        .containsExactly(
            "Top: child _lit_2: Numbers{min=1, max=1, unit=Volt}",
            "Top: child _expr_3: Add",
            "Top: link _expr_3 -> a (operand[0])",
            "Top: link _expr_3 -> _lit_2 (operand[1])",
            "Top: child _lit_4: Numbers{min=2, max=2, unit=Dimensionless}",
            "Top: child _expr_5: Multiply",
            "Top: link _expr_5 -> b (operand[0])",
            "Top: link _expr_5 -> _lit_4 (operand[1])",
            "Top: child _assert_6: LessThan{constrained=true}",
            "Top: link _assert_6 -> _expr_3 (operand[0])",
            "Top: link _assert_6 -> _expr_5 (operand[1])")
        .inOrder();
  }

  @Test
  public void boundedLiteral() {
    ImmutableList<String> lines =
        compileTop(assertion(ref("v"), "within", range(qty("3.3", "V"), qty("5", null))));
    assertThat(lines).contains("Top: child _lit_2: Numbers{min=3.3, max=5, unit=Volt}");
  }

  @Test
  public void unsupportedArithmetic() {
    DslException e =
        assertThrows(
            DslException.class,
            () -> compileTop(assertion(binary("%", ref("a"), num("2")), "<", num("1"))));
    assertThat(e).hasMessageThat().isEqualTo("Unsupported arithmetic operator: `%`");
  }
}
