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
import static org.atolang.compiler.TestAsts.all;
import static org.atolang.compiler.TestAsts.assign;
import static org.atolang.compiler.TestAsts.experiment;
import static org.atolang.compiler.TestAsts.file;
import static org.atolang.compiler.TestAsts.forIn;
import static org.atolang.compiler.TestAsts.importStd;
import static org.atolang.compiler.TestAsts.module;
import static org.atolang.compiler.TestAsts.newArray;
import static org.atolang.compiler.TestAsts.newOf;
import static org.atolang.compiler.TestAsts.pin;
import static org.atolang.compiler.TestAsts.refs;
import static org.atolang.compiler.TestAsts.signal;
import static org.atolang.compiler.TestAsts.sliced;
import static org.atolang.compiler.TestAsts.str;
import static org.atolang.compiler.TestAsts.trait;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.atolang.ast.Ast;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class ForLoopTest {

  private final MockTypeGraph graph = new MockTypeGraph();

  /** Compiles module Top, with FOR_LOOP enabled and an array {@code rs} of four Resistors. */
  private void compileTop(Ast.Node... body) {
    Ast.Node[] stmts = new Ast.Node[body.length + 1];
    stmts[0] = assign("rs", newArray("Resistor", 4));
    System.arraycopy(body, 0, stmts, 1, body.length);
    Compiler.compile(
        file(experiment("FOR_LOOP"), importStd("Resistor"), module("Top", stmts)), graph);
  }

  /** Returns the identifiers of the children with an mpn trait, in declaration order. */
  private ImmutableList<String> mpnOwners() {
    return graph.lines("Top").stream()
        .filter(l -> l.startsWith("Top: child ") && l.contains("._has_mpn_assigned_"))
        .map(l -> l.substring("Top: child ".length(), l.indexOf("._has_mpn_assigned_")))
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void requiresExperiment() {
    DslException e =
        assertThrows(
            DslException.class,
            () ->
                Compiler.compile(
                    file(
                        importStd("Resistor"),
                        module(
                            "Top",
                            assign("a", newOf("Resistor")),
                            forIn("x", refs("a"), assign("x.mpn", str("M"))))),
                    graph));
    assertThat(e).hasMessageThat().isEqualTo("Experiment FOR_LOOP is not enabled");
  }

  @Test
  public void overFieldList() {
    compileTop(
        assign("a", newOf("Resistor")),
        assign("b", newOf("Resistor")),
        forIn("x", refs("a", "b"), assign("x.package", str("0402"))));
    assertThat(graph.lines("Top"))
        .containsAtLeast(
            "Top: child a._has_package_requirements_2: has_package_requirements{size=I0402}",
            "Top: link a -> a._has_package_requirements_2 (trait)",
            "Top: child b._has_package_requirements_3: has_package_requirements{size=I0402}",
            "Top: link b -> b._has_package_requirements_3 (trait)")
        .inOrder();
  }

  @Test
  public void overWholeArray() {
    compileTop(forIn("r", all("rs"), assign("r.mpn", str("M"))));
    assertThat(mpnOwners()).containsExactly("rs.0", "rs.1", "rs.2", "rs.3").inOrder();
    assertThat(graph.lines("Top")).contains("Top: link rs.2 -> rs.2._has_mpn_assigned_4 (trait)");
  }

  @Test
  public void overSlice() {
    compileTop(forIn("r", sliced("rs", 1, 3, null), assign("r.mpn", str("M"))));
    assertThat(mpnOwners()).containsExactly("rs.1", "rs.2").inOrder();
  }

  @Test
  public void overSliceWithStep() {
    compileTop(forIn("r", sliced("rs", null, null, 2), assign("r.mpn", str("M"))));
    assertThat(mpnOwners()).containsExactly("rs.0", "rs.2").inOrder();
  }

  @Test
  public void overReversedSlice() {
    compileTop(forIn("r", sliced("rs", null, null, -1), assign("r.mpn", str("M"))));
    assertThat(mpnOwners()).containsExactly("rs.3", "rs.2", "rs.1", "rs.0").inOrder();
  }

  @Test
  public void overNegativeBounds() {
    compileTop(forIn("r", sliced("rs", -2, null, null), assign("r.mpn", str("M"))));
    assertThat(mpnOwners()).containsExactly("rs.2", "rs.3").inOrder();
  }

  @Test
  public void emptySlice() {
    compileTop(forIn("r", sliced("rs", 3, 1, null), assign("r.mpn", str("M"))));
    assertThat(mpnOwners()).isEmpty();
  }

  @Test
  public void zeroStep() {
    DslException e =
        assertThrows(
            DslException.class,
            () -> compileTop(forIn("r", sliced("rs", null, null, 0), assign("r.mpn", str("M")))));
    assertThat(e).hasMessageThat().isEqualTo("Slice step cannot be zero");
  }

  @Test
  public void undeclaredContainer() {
    DslException e =
        assertThrows(
            DslException.class,
            () -> compileTop(forIn("r", all("nope"), assign("r.mpn", str("M")))));
    assertThat(e).hasMessageThat().isEqualTo("Field `nope` is not defined in scope");
  }

  @Test
  public void loopVariableDoesNotOutliveTheLoop() {
    DslException e =
        assertThrows(
            DslException.class,
            () ->
                compileTop(
                    forIn("r", all("rs"), assign("r.mpn", str("M"))),
                    assign("r.package", str("0402"))));
    assertThat(e).hasMessageThat().isEqualTo("Field `r` is not defined in scope");
  }

  @Test
  public void loopVariableMayNotShadowASymbol() {
    DslException e =
        assertThrows(
            DslException.class,
            () -> compileTop(forIn("Resistor", all("rs"), assign("Resistor.mpn", str("M")))));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Alias `Resistor` would shadow an existing symbol in scope");
  }

  @Test
  public void loopBodyStatementsAreChecked(
      @TestParameter({"ImportStmt", "PinDeclaration", "SignaldefStmt", "TraitStmt"})
          String kind) {
    Ast.Node bad =
        switch (kind) {
          case "ImportStmt" -> importStd("Capacitor");
          case "PinDeclaration" -> pin("1");
          case "SignaldefStmt" -> signal("s");
          default -> trait("is_lead", null);
        };
    DslException e =
        assertThrows(DslException.class, () -> compileTop(forIn("r", all("rs"), bad)));
    assertThat(e).hasMessageThat().isEqualTo("Invalid statement in for loop: " + kind);
  }

  @Test
  public void newAssignmentInLoopBody() {
    Ast.Node bad = assign("r.extra", newOf("Resistor")).at(7, 9);
    DslException e =
        assertThrows(
            DslException.class,
            () ->
                compileTop(
                    forIn("r", all("rs"), assign("r.mpn", str("M")), bad)));
    assertThat(e).hasMessageThat().isEqualTo("Invalid statement in for loop: new assignment (7:9)");
    assertThat(mpnOwners()).isEmpty();
  }

  @Test
  public void nestedLoops() {
    compileTop(
        assign("a", newOf("Resistor")),
        forIn(
            "x",
            refs("a"),
            forIn("y", sliced("rs", 0, 2, null), assign("y.mpn", str("M")))));
    assertThat(mpnOwners()).containsExactly("rs.0", "rs.1").inOrder();
  }
}
