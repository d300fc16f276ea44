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
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Syntax node for a flow relation: either {@code null}, meaning nothing flows, or a list of
 * dependency clauses.
 */
public final class DependencyRelation extends Node {

  private final boolean isNull;
  private final ImmutableList<DependencyClause> clauses;

  private DependencyRelation(
      Location location, boolean isNull, ImmutableList<DependencyClause> clauses) {
    super(location);
    this.isNull = isNull;
    this.clauses = clauses;
  }

  /** Returns the relation {@code null}. */
  public static DependencyRelation nullRelation(Location location) {
    return new DependencyRelation(location, true, ImmutableList.of());
  }

  public static DependencyRelation of(Location location, List<DependencyClause> clauses) {
    return new DependencyRelation(location, false, ImmutableList.copyOf(clauses));
  }

  public boolean isNull() {
    return isNull;
  }

  /** Returns the clauses of the relation; empty for the null relation. */
  public ImmutableList<DependencyClause> getClauses() {
    return clauses;
  }

  @Override
  public String toString() {
    return isNull ? "null" : "(" + Joiner.on(", ").join(clauses) + ")";
  }
}
