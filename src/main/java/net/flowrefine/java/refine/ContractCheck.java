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

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/**
 * A ContractCheck is one check of the refinement of a subprogram or package, created by a {@link
 * RefinementChecker}.
 *
 * <p>A check moves through the phases {@code UNCHECKED → NORMALIZING → MATCHING} and ends either
 * {@code ACCEPTED} or {@code REJECTED}. A check that finds nothing to match goes straight from
 * {@code NORMALIZING} to its final phase. Once final, {@link #run} returns the same verdict
 * without checking again.
 */
public abstract class ContractCheck {

  /** The phase of a check. */
  public enum Phase {
    UNCHECKED,
    NORMALIZING,
    MATCHING,
    ACCEPTED,
    REJECTED;

    public boolean isFinal() {
      return this == ACCEPTED || this == REJECTED;
    }
  }

  private final String unitName;
  private Phase phase = Phase.UNCHECKED;
  @Nullable private RefinementVerdict verdict;

  ContractCheck(String unitName) {
    this.unitName = unitName;
  }

  /** Returns the name of the subprogram or package being checked. */
  public final String getUnitName() {
    return unitName;
  }

  public final Phase getPhase() {
    return phase;
  }

  /**
   * Runs the check, if it has not run yet, and returns its verdict.
   *
   * @throws IllegalStateException if called while the same check is running
   */
  public final RefinementVerdict run() {
    if (verdict != null) {
      return verdict;
    }
    Preconditions.checkState(phase == Phase.UNCHECKED, "re-entrant check of %s", unitName);
    Diagnostics diagnostics = new Diagnostics();
    RefinementVerdict.Builder builder = RefinementVerdict.builder(unitName);

    phase = Phase.NORMALIZING;
    if (normalize(diagnostics)) {
      phase = Phase.MATCHING;
      match(diagnostics, builder);
    }

    verdict = builder.diagnostics(diagnostics.getDiagnostics()).build();
    phase = verdict.isAccepted() ? Phase.ACCEPTED : Phase.REJECTED;
    finish(verdict);
    return verdict;
  }

  /**
   * Normalizes the contracts under check, reporting problems to {@code diagnostics}. Returns
   * whether there is anything to match.
   */
  abstract boolean normalize(Diagnostics diagnostics);

  /** Matches the normalized contracts, recording the outcome in {@code builder}. */
  abstract void match(Diagnostics diagnostics, RefinementVerdict.Builder builder);

  /** Called once with the final verdict. */
  abstract void finish(RefinementVerdict verdict);
}
