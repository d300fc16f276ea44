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

/** Tests of the matching of refined global lists against abstract ones. */
@RunWith(JUnit4.class)
public class GlobalMatcherTest {

  private final ItemTable table = new ItemTable();
  private final Diagnostics diagnostics = new Diagnostics();

  private AbstractState s;

  // S => (A, B), T => (C, D), W => (E, V), V => (F, G), N => null; U is not refined.
  @Before
  public void declare() {
    for (String name : new String[] {"A", "B", "C", "D", "E", "F", "G", "X", "Y"}) {
      table.declareVariable(name);
    }
    s = table.declareState("S");
    AbstractState t = table.declareState("T");
    AbstractState w = table.declareState("W");
    AbstractState v = table.declareState("V");
    table.declareState("U");
    table.refine(s, ImmutableList.of(table.get("A"), table.get("B")));
    table.refine(t, ImmutableList.of(table.get("C"), table.get("D")));
    table.refine(w, ImmutableList.of(table.get("E"), v));
    table.refine(v, ImmutableList.of(table.get("F"), table.get("G")));
    table.refineToNull(table.declareState("N"));
  }

  private ClassifiedGlobals classify(String text) throws Diagnostic.Exception {
    return GlobalClassifier.classify(
        ContractParser.parseGlobal(table, text), GlobalMode.INPUT, diagnostics);
  }

  private GlobalMatcher.Result match(String abs, String ref) throws Exception {
    ClassifiedGlobals a = classify(abs);
    ClassifiedGlobals r = classify(ref);
    assertThat(diagnostics.getDiagnostics()).isEmpty();
    return GlobalMatcher.match(a, r, diagnostics);
  }

  private void assertMatched(String abs, String ref) throws Exception {
    GlobalMatcher.Result result = match(abs, ref);
    assertThat(diagnostics.getDiagnostics()).isEmpty();
    assertThat(result.isMatched()).isTrue();
  }

  private List<Diagnostic> assertInvalid(String abs, String ref) throws Exception {
    GlobalMatcher.Result result = match(abs, ref);
    assertThat(result.isMatched()).isFalse();
    return diagnostics.getDiagnostics();
  }

  @Test
  public void testInputState() throws Exception {
    assertMatched("Input => S", "Input => A");
    assertMatched("S", "(A, B)");
  }

  @Test
  public void testInputStateWithWrongConstituentMode() throws Exception {
    List<Diagnostic> errors = assertInvalid("Input => S", "(Input => A, Output => B)");
    assertContainsError(
        errors,
        DiagnosticKind.WRONG_CONSTITUENT_MODE,
        "test.ads:1:24: constituent 'B' of Input state 'S' cannot have mode Output");
  }

  @Test
  public void testInputStateWithoutConstituents() throws Exception {
    GlobalMatcher.Result result = match("Input => S", "null");
    assertContainsError(
        diagnostics.getDiagnostics(),
        DiagnosticKind.MISSING_CONSTITUENT,
        "global refinement of state 'S' must include at least one constituent of mode Input");
    assertThat(result.getViolations()).hasSize(1);
    assertThat(result.getViolations().get(0).getState()).isSameInstanceAs(s);
    assertThat(result.getViolations().get(0).getConstituent()).isNull();
  }

  @Test
  public void testProofInState() throws Exception {
    assertMatched("Proof_In => S", "Proof_In => B");
    assertContainsError(
        assertInvalid("Proof_In => T", "Input => C"),
        DiagnosticKind.WRONG_CONSTITUENT_MODE,
        "constituent 'C' of Proof_In state 'T' cannot have mode Input");
  }

  @Test
  public void testOutputStateFullCoverage() throws Exception {
    GlobalMatcher.Result result = match("Output => S", "Output => A");
    assertThat(result.getViolations()).hasSize(1);
    assertThat(result.getViolations().get(0).getConstituent()).isSameInstanceAs(table.get("B"));
    List<Diagnostic> errors = diagnostics.getDiagnostics();
    assertThat(errors).hasSize(1);
    Diagnostic d =
        assertContainsError(
            errors,
            DiagnosticKind.MISSING_CONSTITUENT,
            "test.ads:1:11: output state 'S' must be replaced by all its constituents in global"
                + " refinement: constituent 'B' is missing");
    assertThat(d.subject()).isEqualTo("B");
  }

  @Test
  public void testOutputStateWithNestedConstituents() throws Exception {
    assertMatched("Output => W", "Output => (E, F, G)");
    assertMatched("Output => W", "Output => (V, E)");
  }

  @Test
  public void testOutputStateMissingNestedConstituent() throws Exception {
    GlobalMatcher.Result result = match("Output => W", "Output => (E, F)");
    assertThat(result.getViolations()).hasSize(1);
    assertThat(result.getViolations().get(0).getConstituent()).isSameInstanceAs(table.get("G"));
  }

  @Test
  public void testOutputStateWithWrongConstituentMode() throws Exception {
    List<Diagnostic> errors = assertInvalid("Output => S", "(Output => A, In_Out => B)");
    assertContainsError(
        errors,
        DiagnosticKind.WRONG_CONSTITUENT_MODE,
        "constituent 'B' of Output state 'S' cannot have mode In_Out");
  }

  @Test
  public void testInOutStateWithInOutConstituent() throws Exception {
    assertMatched("In_Out => S", "In_Out => A");
  }

  @Test
  public void testInOutStateWithInputAndOutputConstituents() throws Exception {
    assertMatched("In_Out => S", "(Input => A, Output => B)");
  }

  @Test
  public void testInOutStateWithPartialOutput() throws Exception {
    assertMatched("In_Out => S", "Output => A");
  }

  @Test
  public void testInOutStateWithInputOnly() throws Exception {
    GlobalMatcher.Result result = match("In_Out => S", "Input => A");
    assertThat(result.getViolations()).hasSize(1);
    assertThat(result.getViolations().get(0).getKind())
        .isEqualTo(DiagnosticKind.INCONSISTENT_MODE_REFINEMENT);
    assertContainsError(
        diagnostics.getDiagnostics(),
        DiagnosticKind.INCONSISTENT_MODE_REFINEMENT,
        "global refinement of In_Out state 'S' must include a constituent of mode In_Out");
  }

  @Test
  public void testInOutStateWithAllConstituentsAsOutput() throws Exception {
    assertContainsError(
        assertInvalid("In_Out => S", "Output => (A, B)"),
        DiagnosticKind.INCONSISTENT_MODE_REFINEMENT,
        "In_Out state 'S'");
  }

  @Test
  public void testInOutStateWithProofInConstituent() throws Exception {
    List<Diagnostic> errors = assertInvalid("In_Out => S", "(Proof_In => A, In_Out => B)");
    assertThat(errors).hasSize(1);
    assertContainsError(
        errors,
        DiagnosticKind.WRONG_CONSTITUENT_MODE,
        "constituent 'A' of In_Out state 'S' cannot have mode Proof_In");
  }

  @Test
  public void testSeveralStates() throws Exception {
    assertMatched("(Input => S, Output => T)", "(Input => A, Output => (C, D))");
  }

  @Test
  public void testNullRefinedStateNeedsNoConstituents() throws Exception {
    assertMatched("(Input => X, Output => N)", "Input => X");
  }

  @Test
  public void testPlainItems() throws Exception {
    assertMatched("(Input => X, In_Out => U)", "(In_Out => U, Input => X)");
  }

  @Test
  public void testInconsistentItemMode() throws Exception {
    List<Diagnostic> errors = assertInvalid("(Input => X, Output => Y)", "Output => (X, Y)");
    assertContainsError(
        errors,
        DiagnosticKind.INCONSISTENT_ITEM_MODE,
        "test.ads:1:12: global item 'X' has mode Output in the refinement but mode Input in the"
            + " abstract contract");
    assertThat(errors).hasSize(1);
  }

  @Test
  public void testMissingGlobalItem() throws Exception {
    GlobalMatcher.Result result = match("(X, Y)", "X");
    assertThat(result.getMissing()).containsExactly(table.get("Y"));
    assertContainsError(
        diagnostics.getDiagnostics(),
        DiagnosticKind.MISSING_GLOBAL_ITEM,
        "global item 'Y' of mode Input is missing from the global refinement");
  }

  @Test
  public void testExtraGlobalItem() throws Exception {
    GlobalMatcher.Result result = match("X", "(X, Y)");
    assertThat(result.getExtra()).containsExactly(table.get("Y"));
    assertContainsError(
        diagnostics.getDiagnostics(),
        DiagnosticKind.EXTRA_GLOBAL_ITEM,
        "global item 'Y' does not appear in the abstract global contract");
  }

  @Test
  public void testExtraConstituent() throws Exception {
    assertContainsError(
        assertInvalid("X", "(X, A)"),
        DiagnosticKind.EXTRA_CONSTITUENT,
        "constituent 'A' of state 'S' is not allowed");
  }

  @Test
  public void testRefinedStateMustBeReplaced() throws Exception {
    List<Diagnostic> errors = assertInvalid("Input => S", "Input => S");
    assertContainsError(
        errors,
        DiagnosticKind.EXTRA_GLOBAL_ITEM,
        "state 'S' has a visible refinement and must be replaced by its constituents");
    assertContainsError(errors, DiagnosticKind.MISSING_CONSTITUENT, "state 'S'");
  }
}
