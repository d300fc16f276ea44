// Copyright 2026 The Flowrefine Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.flowrefine.java.refine;

import static com.google.common.truth.Truth.assertThat;
import static net.flowrefine.java.syntax.TestUtils.assertContainsError;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.flowrefine.java.items.AbstractState;
import net.flowrefine.java.items.ItemTable;
import net.flowrefine.java.syntax.ContractParser;
import net.flowrefine.java.syntax.Diagnostic;
import net.flowrefine.java.syntax.DiagnosticKind;
import net.flowrefine.java.syntax.GlobalMode;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the normalization of dependency relations into edges. */
@RunWith(JUnit4.class)
public class ClauseNormalizerTest {

  private final ItemTable table = new ItemTable();
  private final Diagnostics diagnostics = new Diagnostics();

  @Before
  public void declare() {
    for (String name : new String[] {"A", "B", "X", "Y", "Z"}) {
      table.declareVariable(name);
    }
  }

  private ImmutableList<Edge> normalize(String text) throws Diagnostic.Exception {
    return ClauseNormalizer.normalize(ContractParser.parseDepends(table, text), diagnostics);
  }

  // Returns the edges in the form "O => I".
  private static List<String> strings(List<Edge> edges) {
    return edges.stream().map(Edge::toString).toList();
  }

  private void assertValid(String text, String... edges) throws Exception {
    assertThat(strings(normalize(text))).containsExactlyElementsIn(edges).inOrder();
    assertThat(diagnostics.getDiagnostics()).isEmpty();
  }

  private void assertInvalid(DiagnosticKind kind, String expectedError, String text)
      throws Exception {
    normalize(text);
    assertContainsError(diagnostics.getDiagnostics(), kind, expectedError);
  }

  @Test
  public void testCrossProduct() throws Exception {
    assertValid(
        "(A, B) => (X, Y, Z)",
        "A => X",
        "A => Y",
        "A => Z",
        "B => X",
        "B => Y",
        "B => Z");
  }

  @Test
  public void testSeveralClauses() throws Exception {
    assertValid("(A => X, B => (X, Y))", "A => X", "B => X", "B => Y");
  }

  @Test
  public void testSelfDependency() throws Exception {
    assertValid("A =>+ X", "A => A", "A => X");
    assertValid("(A, B) =>+ null", "A => A", "B => B");
  }

  @Test
  public void testSelfDependencyAlreadyListed() throws Exception {
    assertValid("A =>+ (X, A)", "A => X", "A => A");
  }

  @Test
  public void testNullInput() throws Exception {
    assertValid("(A, B) => null", "A => null", "B => null");
  }

  @Test
  public void testNullOutput() throws Exception {
    assertValid("(A => X, null => (Y, Z))", "A => X", "null => Y", "null => Z");
  }

  @Test
  public void testNullRelation() throws Exception {
    assertValid("null");
  }

  @Test
  public void testFunctionResultAsOutput() throws Exception {
    assertValid("F'Result => X", "'Result => X");
  }

  @Test
  public void testNullOutputMustBeLast() throws Exception {
    assertInvalid(
        DiagnosticKind.MALFORMED_RELATION,
        "test.ads:1:2: null output list must be the last clause",
        "(null => X, A => Y)");
  }

  @Test
  public void testNullDependsOnNull() throws Exception {
    assertInvalid(
        DiagnosticKind.MALFORMED_RELATION, "useless dependence clause 'null => null'", "null => null");
  }

  @Test
  public void testSelfDependentNull() throws Exception {
    assertInvalid(
        DiagnosticKind.USELESS_SELF_DEPENDENCY, "null cannot depend on itself", "null =>+ X");
    assertThat(diagnostics.getDiagnostics()).hasSize(1);
  }

  @Test
  public void testDuplicateOutput() throws Exception {
    ImmutableList<Edge> edges = normalize("(A => X, (B, A) => Y)");
    assertContainsError(
        diagnostics.getDiagnostics(),
        DiagnosticKind.DUPLICATE_OUTPUT,
        "test.ads:1:14: 'A' appears more than once as an output");
    assertThat(strings(edges)).containsExactly("A => X", "B => Y").inOrder();
  }

  @Test
  public void testDuplicateInput() throws Exception {
    ImmutableList<Edge> edges = normalize("A => (X, Y, X)");
    assertContainsError(
        diagnostics.getDiagnostics(),
        DiagnosticKind.DUPLICATE_INPUT,
        "'X' appears more than once in the input list");
    assertThat(strings(edges)).containsExactly("A => X", "A => Y").inOrder();
  }

  @Test
  public void testFunctionResultAsInput() throws Exception {
    ImmutableList<Edge> edges = normalize("(A => F'Result, B => X)");
    assertContainsError(
        diagnostics.getDiagnostics(),
        DiagnosticKind.MALFORMED_RELATION,
        "function result 'F'Result' cannot act as an input");
    assertThat(strings(edges)).containsExactly("B => X");
  }

  @Test
  public void testMalformedLists() throws Exception {
    assertInvalid(DiagnosticKind.MALFORMED_RELATION, "empty input list", "A => ()");
    assertInvalid(
        DiagnosticKind.MALFORMED_RELATION,
        "output list may only contain names, found '(A, B)'",
        "(X, (A, B)) => Y");
  }

  @Test
  public void testStateAndConstituentTogether() throws Exception {
    AbstractState s = table.declareState("S");
    table.refine(s, ImmutableList.of(table.get("A")));
    assertInvalid(
        DiagnosticKind.CANNOT_MENTION_STATE_AND_CONSTITUENT_TOGETHER,
        "cannot mention state 'S' and its constituent 'A' in the same relation",
        "(S => X, Y => A)");
  }

  @Test
  public void testUnresolvedNameAborts() throws Exception {
    Diagnostic.Exception ex =
        assertThrows(Diagnostic.Exception.class, () -> normalize("(A => X, B => W)"));
    assertThat(ex.diagnostics()).hasSize(1);
    assertThat(ex.diagnostics().get(0).kind()).isEqualTo(DiagnosticKind.UNRESOLVED_REFERENCE);
    assertThat(ex.diagnostics().get(0).subject()).isEqualTo("W");
    assertThat(ex).hasMessageThat().isEqualTo("test.ads:1:15: name 'W' is not defined");
  }

  @Test
  public void testCompleteFromGlobals() throws Exception {
    ClassifiedGlobals globals =
        GlobalClassifier.classify(
            ContractParser.parseGlobal(table, "(Input => A, In_Out => B, Output => (X, Y))"),
            GlobalMode.INPUT,
            diagnostics);
    ImmutableList<Edge> edges = ClauseNormalizer.completeFromGlobals(normalize("X => A"), globals);
    assertThat(strings(edges))
        .containsExactly("X => A", "Y => A", "Y => B", "B => A", "B => B")
        .inOrder();
    assertThat(diagnostics.getDiagnostics()).isEmpty();
  }

  @Test
  public void testCompleteFromGlobalsWithoutInputs() throws Exception {
    AbstractState s = table.declareState("S");
    table.refineToNull(s);
    ClassifiedGlobals globals =
        GlobalClassifier.classify(
            ContractParser.parseGlobal(table, "(Proof_In => A, Output => (X, S))"),
            GlobalMode.INPUT,
            diagnostics);
    ImmutableList<Edge> edges = ClauseNormalizer.completeFromGlobals(ImmutableList.of(), globals);
    assertThat(strings(edges)).containsExactly("X => null");
  }
}
