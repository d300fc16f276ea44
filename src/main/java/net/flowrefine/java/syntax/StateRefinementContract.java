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

package net.flowrefine.java.syntax;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Syntax node for the state refinement contract of a package body: a list of clauses {@code
 * State => Constituent}, {@code State => (Constituent, ...)} or {@code State => null}.
 */
public final class StateRefinementContract extends Node {

  /** Syntax node for one clause of a state refinement contract. */
  public static final class Clause extends Node {
    private final Name state;
    private final ContractExpression constituents;

    public Clause(Location location, Name state, ContractExpression constituents) {
      super(location);
      this.state = Preconditions.checkNotNull(state);
      this.constituents = Preconditions.checkNotNull(constituents);
    }

    public Name getState() {
      return state;
    }

    public ContractExpression getConstituents() {
      return constituents;
    }

    @Override
    public String toString() {
      return state + " => " + constituents;
    }
  }

  private final ImmutableList<Clause> clauses;

  public StateRefinementContract(Location location, List<Clause> clauses) {
    super(location);
    this.clauses = ImmutableList.copyOf(clauses);
  }

  public ImmutableList<Clause> getClauses() {
    return clauses;
  }

  @Override
  public String toString() {
    return "(" + Joiner.on(", ").join(clauses) + ")";
  }
}
