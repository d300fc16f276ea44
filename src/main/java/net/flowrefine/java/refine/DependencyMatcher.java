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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.flowrefine.java.items.AbstractState;
import net.flowrefine.java.items.Item;
import net.flowrefine.java.syntax.DiagnosticKind;

/**
 * The DependencyMatcher decides whether the normalized edges of a refined flow relation justify,
 * and are justified by, the normalized edges of the abstract relation.
 *
 * <p>Each abstract edge consumes every refined edge that matches it, so an abstract edge {@code S
 * => X} over a refined state {@code S} consumes {@code C1 => X} and {@code C2 => X} alike. A
 * refined edge is consumed at most once: a consumed edge leaves the pool, and abstract edges are
 * matched in order of declaration.
 */
public final class DependencyMatcher {

  /** The outcome of matching one pair of relations. */
  public static final class Result {
    private final ImmutableList<Edge> unmatched;
    private final ImmutableList<Edge> unconsumed;
    private final ImmutableSet<AbstractState> touchedStates;

    private Result(
        ImmutableList<Edge> unmatched,
        ImmutableList<Edge> unconsumed,
        ImmutableSet<AbstractState> touchedStates) {
      this.unmatched = unmatched;
      this.unconsumed = unconsumed;
      this.touchedStates = touchedStates;
    }

    /** Returns the abstract edges that no refined edge justifies. */
    public ImmutableList<Edge> getUnmatched() {
      return unmatched;
    }

    /** Returns the refined edges left over that no abstract edge justifies. */
    public ImmutableList<Edge> getUnconsumed() {
      return unconsumed;
    }

    /** Returns the refined states whose constituents discharged some abstract edge. */
    public ImmutableSet<AbstractState> getTouchedStates() {
      return touchedStates;
    }

    public boolean isMatched() {
      return unmatched.isEmpty() && unconsumed.isEmpty();
    }
  }

  private final Diagnostics diagnostics;
  private final List<Edge> pool;
  private final Set<AbstractState> touched = new LinkedHashSet<>();

  private DependencyMatcher(List<Edge> refinedEdges, Diagnostics diagnostics) {
    this.pool = new ArrayList<>(refinedEdges);
    this.diagnostics = diagnostics;
  }

  /**
   * Matches the abstract edges against the refined edges, reporting a {@code MISSING_REFINEMENT}
   * for each abstract edge left unmatched and an {@code EXTRA_OR_UNMATCHED_REFINEMENT} for each
   * refined edge left over.
   *
   * @param tolerateNullInputs whether a left-over refined edge whose input is null goes unreported
   */
  public static Result match(
      List<Edge> abstractEdges,
      List<Edge> refinedEdges,
      boolean tolerateNullInputs,
      Diagnostics diagnostics) {
    DependencyMatcher m = new DependencyMatcher(refinedEdges, diagnostics);
    ImmutableList.Builder<Edge> unmatched = ImmutableList.builder();
    for (Edge edge : abstractEdges) {
      if (!m.matchEdge(edge)) {
        diagnostics.errorf(
            DiagnosticKind.MISSING_REFINEMENT,
            edge.getSource(),
            edge.getOutput(),
            "dependence '%s' has no matching refinement in body",
            edge);
        unmatched.add(edge);
      }
    }

    ImmutableList.Builder<Edge> unconsumed = ImmutableList.builder();
    for (Edge edge : m.pool) {
      if (edge.hasNullInput() && tolerateNullInputs) {
        continue;
      }
      diagnostics.errorf(
          DiagnosticKind.EXTRA_OR_UNMATCHED_REFINEMENT,
          edge.getSource(),
          edge.getOutput(),
          "refined dependence '%s' does not match any dependence of the abstract contract",
          edge);
      unconsumed.add(edge);
    }
    return new Result(unmatched.build(), unconsumed.build(), ImmutableSet.copyOf(m.touched));
  }

  // Consumes from the pool every refined edge that matches the abstract edge.
  private boolean matchEdge(Edge edge) {
    Item output = edge.getOutput();
    Item input = edge.getInput();
    boolean matched = false;
    for (Iterator<Edge> it = pool.iterator(); it.hasNext(); ) {
      Edge ref = it.next();
      if ((matches(output, ref.getOutput()) && matches(input, ref.getInput()))
          || matchesSelfDependence(output, input, ref)) {
        it.remove();
        matched = true;
        touch(output);
        touch(input);
      }
    }
    // An edge between nothing and nothing needs no refined clause; a state refined to null
    // counts as nothing here.
    return matched || (isNullish(output) && isNullish(input));
  }

  /**
   * Reports whether a refined edge accounts for the abstract self-dependence {@code S => S} of a
   * state with visible constituents: the refinement may show a constituent of {@code S} depending
   * on nothing, or nothing depending on a constituent, since the refinement of the state itself may
   * carry the dependence.
   */
  private static boolean matchesSelfDependence(Item output, Item input, Edge ref) {
    if (output != input || !(output instanceof AbstractState state)) {
      return false;
    }
    if (!state.hasNonNullRefinement()) {
      return false;
    }
    return (ref.getInput().isNull() && state.encloses(ref.getOutput()))
        || (ref.getOutput().isNull() && state.encloses(ref.getInput()));
  }

  private void touch(Item item) {
    if (item instanceof AbstractState state && state.hasVisibleRefinement()) {
      touched.add(state);
    }
  }

  private static boolean isNullish(Item item) {
    return item.isNull() || (item instanceof AbstractState s && s.hasNullRefinement());
  }

  /**
   * Reports whether a refined item matches an abstract item. A null {@code ref} denotes the
   * absence of any refined item, which only null and states refined to null match.
   */
  static boolean matches(Item abs, @Nullable Item ref) {
    switch (abs.kind()) {
      case NULL -> {
        return ref == null || ref.isNull();
      }
      case FUNCTION_RESULT -> {
        return ref == Item.FUNCTION_RESULT;
      }
      case PARAMETER, OBJECT -> {
        return ref == abs;
      }
      case STATE -> {
        AbstractState state = (AbstractState) abs;
        return switch (state.getRefinement()) {
          case NULL -> ref == null || ref.isNull();
          case NON_NULL -> state.encloses(ref);
          case NONE -> ref == state;
        };
      }
    }
    throw new IllegalStateException(abs.kind().toString());
  }
}
