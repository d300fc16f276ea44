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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.flowrefine.java.items.AbstractState;
import net.flowrefine.java.items.Item;
import net.flowrefine.java.syntax.Diagnostic;
import net.flowrefine.java.syntax.DiagnosticKind;

/**
 * The result of checking the refinement of one subprogram or package: the diagnostics, and the
 * edges, items and constituents that failed to match.
 *
 * <p>A verdict is accepted exactly when it carries no diagnostics.
 */
@AutoValue
public abstract class RefinementVerdict {

  /** Returns the name of the subprogram or package that was checked. */
  public abstract String unitName();

  /** Returns every diagnostic of the check, in order of discovery. */
  public abstract ImmutableList<Diagnostic> diagnostics();

  /** Returns the abstract dependencies that no refined dependency justifies. */
  public abstract ImmutableList<Edge> unmatchedEdges();

  /** Returns the refined dependencies that no abstract dependency justifies. */
  public abstract ImmutableList<Edge> unconsumedEdges();

  /** Returns the plain abstract global items absent from the global refinement. */
  public abstract ImmutableList<Item> missingGlobals();

  /** Returns the refined global items that the abstract global list does not account for. */
  public abstract ImmutableList<Item> extraGlobals();

  /** Returns the states whose constituents fail the coverage rule of their mode. */
  public abstract ImmutableList<CoverageViolation> coverageViolations();

  /** Returns the refined states whose constituents discharged some abstract dependency. */
  public abstract ImmutableSet<AbstractState> touchedStates();

  public boolean isAccepted() {
    return diagnostics().isEmpty();
  }

  /** Returns the diagnostics of the given kind. */
  public ImmutableList<Diagnostic> diagnostics(DiagnosticKind kind) {
    return diagnostics().stream().filter(d -> d.kind() == kind).collect(toImmutableList());
  }

  static Builder builder(String unitName) {
    return new AutoValue_RefinementVerdict.Builder().unitName(unitName);
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder unitName(String value);

    abstract Builder diagnostics(ImmutableList<Diagnostic> value);

    abstract ImmutableList.Builder<Edge> unmatchedEdgesBuilder();

    abstract ImmutableList.Builder<Edge> unconsumedEdgesBuilder();

    abstract ImmutableList.Builder<Item> missingGlobalsBuilder();

    abstract ImmutableList.Builder<Item> extraGlobalsBuilder();

    abstract ImmutableList.Builder<CoverageViolation> coverageViolationsBuilder();

    abstract ImmutableSet.Builder<AbstractState> touchedStatesBuilder();

    abstract RefinementVerdict build();
  }
}
