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
import net.flowrefine.java.items.AbstractState;
import net.flowrefine.java.items.Item;
import net.flowrefine.java.syntax.DiagnosticKind;

/**
 * A CoverageViolation records that the constituents of a state in a refined global list do not
 * account for the state's mode in the abstract global list.
 */
public final class CoverageViolation {

  private final AbstractState state;
  @Nullable private final Item constituent;
  private final DiagnosticKind kind;

  CoverageViolation(AbstractState state, @Nullable Item constituent, DiagnosticKind kind) {
    this.state = Preconditions.checkNotNull(state);
    this.constituent = constituent;
    this.kind = Preconditions.checkNotNull(kind);
  }

  public AbstractState getState() {
    return state;
  }

  /**
   * Returns the constituent that is missing or misplaced, or null if the violation concerns the
   * constituents as a whole.
   */
  @Nullable
  public Item getConstituent() {
    return constituent;
  }

  public DiagnosticKind getKind() {
    return kind;
  }

  @Override
  public String toString() {
    return kind + "(" + state + (constituent != null ? ", " + constituent : "") + ")";
  }
}
