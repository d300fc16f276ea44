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

package net.flowrefine.java.items;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the item table and the state hierarchy it records. */
@RunWith(JUnit4.class)
public class ItemTableTest {

  private final ItemTable table = new ItemTable();

  @Test
  public void testDeclareAndLookup() throws Exception {
    Parameter p = table.declareParameter("P", Parameter.Role.IN_OUT);
    DataObject x = table.declareVariable("X");
    DataObject k = table.declareConstant("K");
    AbstractState s = table.declareState("S");

    assertThat(table.lookup("P")).isSameInstanceAs(p);
    assertThat(table.lookup("Q")).isNull();
    assertThat(table.get("X")).isSameInstanceAs(x);
    assertThat(table.getState("S")).isSameInstanceAs(s);
    assertThat(table.getItems()).containsExactly(p, x, k, s).inOrder();
    assertThat(k.getId()).isEqualTo(2);

    assertThat(p.kind()).isEqualTo(Item.Kind.PARAMETER);
    assertThat(p.getRole().toString()).isEqualTo("in out");
    assertThat(k.isConstant()).isTrue();
    assertThat(x.isConstant()).isFalse();
    assertThat(s.isState()).isTrue();
    assertThat(s.hasVisibleRefinement()).isFalse();
    assertThat(s.getRefinement()).isEqualTo(AbstractState.Refinement.NONE);
  }

  @Test
  public void testRedeclarationFails() throws Exception {
    table.declareVariable("X");
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> table.declareState("X"));
    assertThat(ex).hasMessageThat().contains("'X' is already declared");
  }

  @Test
  public void testGetStateOfVariableFails() throws Exception {
    table.declareVariable("X");
    assertThrows(IllegalArgumentException.class, () -> table.getState("X"));
    assertThrows(IllegalArgumentException.class, () -> table.get("Y"));
  }

  @Test
  public void testSpecialItems() throws Exception {
    assertThat(Item.NULL.isNull()).isTrue();
    assertThat(Item.NULL.toString()).isEqualTo("null");
    assertThat(Item.FUNCTION_RESULT.kind()).isEqualTo(Item.Kind.FUNCTION_RESULT);
    assertThat(Item.FUNCTION_RESULT.hasVisibleRefinement()).isFalse();
  }

  @Test
  public void testExternalProperties() throws Exception {
    AbstractState all = table.declareExternalState("Port");
    DataObject reg =
        table.declareExternalVariable(
            "Reg", ExternalProperty.ASYNC_WRITERS, ExternalProperty.EFFECTIVE_READS);
    assertThat(all.getExternalProperties()).containsExactlyElementsIn(ExternalProperty.values());
    assertThat(reg.getExternalProperties())
        .containsExactly(ExternalProperty.ASYNC_WRITERS, ExternalProperty.EFFECTIVE_READS);
    assertThat(reg.isExternal()).isTrue();
    assertThat(table.declareVariable("X").isExternal()).isFalse();
    assertThat(ExternalProperty.ASYNC_READERS.toString()).isEqualTo("Async_Readers");
  }

  @Test
  public void testNestedRefinement() throws Exception {
    AbstractState s = table.declareState("S");
    AbstractState t = table.declareState("T");
    DataObject a = table.declareVariable("A");
    DataObject b = table.declareVariable("B");
    DataObject c = table.declareVariable("C");
    table.refine(s, ImmutableList.of(a, t));
    table.refine(t, ImmutableList.of(b, c));

    assertThat(s.hasNonNullRefinement()).isTrue();
    assertThat(s.getConstituents()).containsExactly(a, t).inOrder();
    assertThat(b.getEncapsulatingState()).isSameInstanceAs(t);
    assertThat(t.getEncapsulatingState()).isSameInstanceAs(s);

    assertThat(s.hasConstituent(a)).isTrue();
    assertThat(s.hasConstituent(b)).isFalse();
    assertThat(s.encloses(b)).isTrue();
    assertThat(t.encloses(a)).isFalse();
    assertThat(s.encloses(s)).isFalse();
    assertThat(s.encloses(Item.NULL)).isFalse();
    assertThat(s.constituentFor(c)).isSameInstanceAs(t);
    assertThat(s.constituentFor(a)).isSameInstanceAs(a);
    assertThat(t.constituentFor(a)).isNull();
  }

  @Test
  public void testNullRefinement() throws Exception {
    AbstractState s = table.declareState("S");
    table.refineToNull(s);
    assertThat(s.hasVisibleRefinement()).isTrue();
    assertThat(s.hasNullRefinement()).isTrue();
    assertThat(s.getConstituents()).isEmpty();
    IllegalStateException ex =
        assertThrows(IllegalStateException.class, () -> table.refineToNull(s));
    assertThat(ex).hasMessageThat().contains("already refined");
  }

  @Test
  public void testInvalidRefinements() throws Exception {
    AbstractState s = table.declareState("S");
    AbstractState t = table.declareState("T");
    DataObject a = table.declareVariable("A");
    Parameter p = table.declareParameter("P", Parameter.Role.IN);

    assertThrows(IllegalArgumentException.class, () -> table.refine(s, ImmutableList.of()));
    assertThrows(IllegalArgumentException.class, () -> table.refine(s, ImmutableList.of(a, a)));
    assertThrows(IllegalArgumentException.class, () -> table.refine(s, ImmutableList.of(p)));
    assertThrows(IllegalArgumentException.class, () -> table.refine(s, ImmutableList.of(s)));
    assertThat(s.hasVisibleRefinement()).isFalse();

    table.refine(s, ImmutableList.of(a));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> table.refine(t, ImmutableList.of(a)));
    assertThat(ex).hasMessageThat().contains("A is already a constituent of S");
    assertThat(t.hasVisibleRefinement()).isFalse();
  }
}
