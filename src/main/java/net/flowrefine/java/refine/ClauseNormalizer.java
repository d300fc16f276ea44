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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.flowrefine.java.items.AbstractState;
import net.flowrefine.java.items.Item;
import net.flowrefine.java.syntax.Aggregate;
import net.flowrefine.java.syntax.ContractExpression;
import net.flowrefine.java.syntax.Diagnostic;
import net.flowrefine.java.syntax.DiagnosticKind;
import net.flowrefine.java.syntax.DependencyClause;
import net.flowrefine.java.syntax.DependencyRelation;
import net.flowrefine.java.syntax.GlobalMode;
import net.flowrefine.java.syntax.Name;
import net.flowrefine.java.syntax.Node;

/**
 * The ClauseNormalizer rewrites a flow relation into a flat list of {@link Edge}s, each with one
 * output and one input.
 *
 * <p>A clause {@code (A, B) => (X, Y, Z)} yields the six edges {@code A => X}, {@code A => Y},
 * {@code A => Z}, {@code B => X}, {@code B => Y} and {@code B => Z}. The self-dependency shorthand
 * {@code A =>+ X} is expanded as if written {@code A => (A, X)}. A clause whose input list is
 * {@code null} yields one edge {@code A => null} per output; the null input marks that the clause
 * explicitly lists no inputs.
 *
 * <p>A malformed clause is reported and skipped; the remaining clauses are still normalized. Only
 * an unresolved name aborts normalization, by throwing {@link Diagnostic.Exception}.
 */
public final class ClauseNormalizer {

  private final Diagnostics diagnostics;
  private final Mentions mentions = new Mentions();
  private final Map<Item, DependencyClause> outputs = new LinkedHashMap<>();
  private final List<Edge> edges = new ArrayList<>();

  private ClauseNormalizer(Diagnostics diagnostics) {
    this.diagnostics = diagnostics;
  }

  /**
   * Normalizes the given relation. The null relation yields no edges.
   *
   * @throws Diagnostic.Exception if the relation contains an unresolved name
   */
  public static ImmutableList<Edge> normalize(DependencyRelation relation, Diagnostics diagnostics)
      throws Diagnostic.Exception {
    ClauseNormalizer n = new ClauseNormalizer(diagnostics);
    ImmutableList<DependencyClause> clauses = relation.getClauses();
    for (int i = 0; i < clauses.size(); i++) {
      n.normalizeClause(clauses.get(i), i == clauses.size() - 1);
    }
    n.mentions.checkStatesAndConstituents(diagnostics);
    return ImmutableList.copyOf(n.edges);
  }

  private void normalizeClause(DependencyClause clause, boolean isLast)
      throws Diagnostic.Exception {
    ImmutableList<Item> inputs = inputsOf(clause);
    if (inputs == null) {
      return;
    }

    if (clause.getOutputs().kind() == ContractExpression.Kind.NULL) {
      if (clause.isSelfDependent()) {
        diagnostics.errorf(
            DiagnosticKind.USELESS_SELF_DEPENDENCY,
            clause,
            "useless dependence, null cannot depend on itself");
      } else if (!isLast) {
        diagnostics.errorf(
            DiagnosticKind.MALFORMED_RELATION,
            clause,
            "null output list must be the last clause of a dependency relation");
      } else if (inputs.isEmpty()) {
        diagnostics.errorf(
            DiagnosticKind.MALFORMED_RELATION, clause, "useless dependence clause 'null => null'");
      } else {
        for (Item input : inputs) {
          edges.add(new Edge(Item.NULL, input, clause));
        }
      }
      return;
    }

    ImmutableList<Name> outputNames = namesOf(clause.getOutputs(), "output");
    if (outputNames == null) {
      return;
    }
    for (Name name : outputNames) {
      Item output = Diagnostics.resolve(name);
      mentions.add(output, name);
      DependencyClause previous = outputs.putIfAbsent(output, clause);
      if (previous != null) {
        diagnostics.errorf(
            DiagnosticKind.DUPLICATE_OUTPUT,
            name,
            output,
            "'%s' appears more than once as an output of the dependency relation",
            output.getName());
        continue;
      }

      if (clause.isSelfDependent() && !inputs.contains(output)) {
        edges.add(new Edge(output, output, clause));
      }
      if (inputs.isEmpty() && !clause.isSelfDependent()) {
        edges.add(new Edge(output, Item.NULL, clause));
      }
      for (Item input : inputs) {
        edges.add(new Edge(output, input, clause));
      }
    }
  }

  /**
   * Returns the inputs of a clause, empty for {@code null}, or null if the input list is
   * malformed.
   */
  @Nullable
  private ImmutableList<Item> inputsOf(DependencyClause clause) throws Diagnostic.Exception {
    ContractExpression expr = clause.getInputs();
    if (expr.kind() == ContractExpression.Kind.NULL) {
      return ImmutableList.of();
    }
    ImmutableList<Name> names = namesOf(expr, "input");
    if (names == null) {
      return null;
    }
    ImmutableList.Builder<Item> inputs = ImmutableList.builder();
    Set<Item> seen = new HashSet<>();
    for (Name name : names) {
      Item input = Diagnostics.resolve(name);
      if (input.kind() == Item.Kind.FUNCTION_RESULT) {
        diagnostics.errorf(
            DiagnosticKind.MALFORMED_RELATION,
            name,
            "function result '%s' cannot act as an input",
            name.getName());
        return null;
      }
      mentions.add(input, name);
      if (!seen.add(input)) {
        diagnostics.errorf(
            DiagnosticKind.DUPLICATE_INPUT,
            name,
            input,
            "'%s' appears more than once in the input list of '%s'",
            input.getName(),
            clause);
        continue;
      }
      inputs.add(input);
    }
    return inputs.build();
  }

  /**
   * Returns the names of a single name or an aggregate of names, or null after reporting an
   * expression of any other shape.
   */
  @Nullable
  private ImmutableList<Name> namesOf(ContractExpression expr, String what) {
    switch (expr.kind()) {
      case NAME -> {
        return ImmutableList.of((Name) expr);
      }
      case AGGREGATE -> {
        ImmutableList<ContractExpression> elements = ((Aggregate) expr).getElements();
        if (elements.isEmpty()) {
          diagnostics.errorf(DiagnosticKind.MALFORMED_RELATION, expr, "empty %s list", what);
          return null;
        }
        ImmutableList.Builder<Name> names = ImmutableList.builder();
        for (ContractExpression e : elements) {
          if (e.kind() != ContractExpression.Kind.NAME) {
            diagnostics.errorf(
                DiagnosticKind.MALFORMED_RELATION,
                e,
                "%s list may only contain names, found '%s'",
                what,
                e);
            return null;
          }
          names.add((Name) e);
        }
        return names.build();
      }
      default -> {
        diagnostics.errorf(
            DiagnosticKind.MALFORMED_RELATION, expr, "unexpected %s '%s'", what, expr);
        return null;
      }
    }
  }

  /**
   * Adds to {@code edges} the dependencies implied by a global contract for the outputs that the
   * edges leave unmentioned: each such Output or In_Out item depends on every Input and In_Out item,
   * or on null if there are none. States with a visible null refinement take no part.
   *
   * @param edges the normalized edges of the abstract flow relation
   * @param globals the classified abstract global contract
   */
  public static ImmutableList<Edge> completeFromGlobals(
      List<Edge> edges, ClassifiedGlobals globals) {
    Set<Item> mentioned = new HashSet<>();
    for (Edge e : edges) {
      mentioned.add(e.getOutput());
    }
    List<Item> inputs = new ArrayList<>();
    for (GlobalMode mode : new GlobalMode[] {GlobalMode.INPUT, GlobalMode.IN_OUT}) {
      for (Item item : globals.get(mode)) {
        if (!hasNullRefinement(item)) {
          inputs.add(item);
        }
      }
    }

    ImmutableList.Builder<Edge> result = ImmutableList.<Edge>builder().addAll(edges);
    for (GlobalMode mode : new GlobalMode[] {GlobalMode.OUTPUT, GlobalMode.IN_OUT}) {
      for (Item output : globals.get(mode)) {
        if (mentioned.contains(output) || hasNullRefinement(output)) {
          continue;
        }
        Node source = globals.nodeOf(output);
        if (inputs.isEmpty()) {
          result.add(new Edge(output, Item.NULL, source));
        }
        for (Item input : inputs) {
          result.add(new Edge(output, input, source));
        }
      }
    }
    return result.build();
  }

  private static boolean hasNullRefinement(Item item) {
    return item instanceof AbstractState s && s.hasNullRefinement();
  }
}
