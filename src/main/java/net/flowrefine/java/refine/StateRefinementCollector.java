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
import com.google.common.flogger.GoogleLogger;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.flowrefine.java.items.AbstractState;
import net.flowrefine.java.items.ExternalProperty;
import net.flowrefine.java.items.Item;
import net.flowrefine.java.items.ItemTable;
import net.flowrefine.java.items.NamedItem;
import net.flowrefine.java.syntax.Aggregate;
import net.flowrefine.java.syntax.ContractExpression;
import net.flowrefine.java.syntax.Diagnostic;
import net.flowrefine.java.syntax.DiagnosticKind;
import net.flowrefine.java.syntax.Name;
import net.flowrefine.java.syntax.StateRefinementContract;

/**
 * The StateRefinementCollector reads the state refinement contract of a package body, checks that
 * it is well formed, and records each refinement in the {@link ItemTable}, which makes it visible
 * to the refinement checks of the package's subprograms.
 *
 * <p>Besides the shape of each clause, the collector checks that every abstract state of the
 * package is refined exactly once, that no item is a constituent of two states, and that the
 * external properties of each state agree with those of its constituents.
 */
public final class StateRefinementCollector {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ItemTable table;
  private final ImmutableSet<AbstractState> declaredStates;
  private final Diagnostics diagnostics;
  private final Map<AbstractState, StateRefinementContract.Clause> refined = new LinkedHashMap<>();
  private final Map<NamedItem, AbstractState> claimed = new HashMap<>();

  private StateRefinementCollector(
      ItemTable table, List<AbstractState> declaredStates, Diagnostics diagnostics) {
    this.table = table;
    this.declaredStates = ImmutableSet.copyOf(declaredStates);
    this.diagnostics = diagnostics;
  }

  /**
   * Collects the refinements of a package's abstract states.
   *
   * @param contract the state refinement contract of the package body
   * @param declaredStates the abstract states declared by the package specification
   * @param table the table in which to record the refinements
   * @param diagnostics the sink for errors in the contract
   * @throws Diagnostic.Exception if the contract contains an unresolved name
   */
  public static void collect(
      StateRefinementContract contract,
      List<AbstractState> declaredStates,
      ItemTable table,
      Diagnostics diagnostics)
      throws Diagnostic.Exception {
    StateRefinementCollector c = new StateRefinementCollector(table, declaredStates, diagnostics);
    for (StateRefinementContract.Clause clause : contract.getClauses()) {
      c.collectClause(clause);
    }
    for (AbstractState state : declaredStates) {
      if (!state.hasVisibleRefinement() && !c.refined.containsKey(state)) {
        diagnostics.errorf(
            DiagnosticKind.UNREFINED_STATE,
            contract,
            state,
            "abstract state '%s' must be refined",
            state.getName());
      }
    }
  }

  private void collectClause(StateRefinementContract.Clause clause) throws Diagnostic.Exception {
    Name target = clause.getState();
    Item item = Diagnostics.resolve(target);
    if (!(item instanceof AbstractState state) || !declaredStates.contains(item)) {
      diagnostics.errorf(
          DiagnosticKind.MALFORMED_RELATION,
          target,
          "'%s' is not an abstract state of this package",
          target.getName());
      return;
    }
    if (!refined.containsKey(state) && restatesRecordedRefinement(state, clause)) {
      refined.put(state, clause);
      logger.atFinest().log("refinement of %s already recorded", state.getName());
      return;
    }
    if (refined.containsKey(state) || state.hasVisibleRefinement()) {
      diagnostics.errorf(
          DiagnosticKind.DUPLICATE_STATE_REFINEMENT,
          target,
          state,
          "state '%s' is refined more than once",
          state.getName());
      return;
    }
    refined.put(state, clause);

    ContractExpression expr = clause.getConstituents();
    if (expr.kind() == ContractExpression.Kind.NULL) {
      table.refineToNull(state);
      logger.atFinest().log("refined %s to null", state.getName());
      return;
    }

    Map<NamedItem, Name> constituents = new LinkedHashMap<>();
    for (Name name : constituentNames(state, expr)) {
      NamedItem constituent = constituentOf(state, name);
      if (constituent != null) {
        constituents.put(constituent, name);
      }
    }
    checkExternalProperties(state, constituents, clause);
    if (!constituents.isEmpty()) {
      table.refine(state, ImmutableList.copyOf(constituents.keySet()));
      logger.atFinest().log("refined %s into %s", state.getName(), constituents.keySet());
    }
  }

  // Reports whether the table already holds exactly the refinement the clause states, as it does
  // when the same package is checked again.
  private static boolean restatesRecordedRefinement(
      AbstractState state, StateRefinementContract.Clause clause) throws Diagnostic.Exception {
    ContractExpression expr = clause.getConstituents();
    switch (state.getRefinement()) {
      case NONE -> {
        return false;
      }
      case NULL -> {
        return expr.kind() == ContractExpression.Kind.NULL;
      }
      case NON_NULL -> {
        ImmutableList<ContractExpression> elements =
            expr.kind() == ContractExpression.Kind.AGGREGATE
                ? ((Aggregate) expr).getElements()
                : ImmutableList.of(expr);
        ImmutableList.Builder<Item> items = ImmutableList.builder();
        for (ContractExpression e : elements) {
          if (e.kind() != ContractExpression.Kind.NAME) {
            return false;
          }
          items.add(Diagnostics.resolve((Name) e));
        }
        return items.build().equals(state.getConstituents());
      }
    }
    throw new IllegalStateException(state.getRefinement().toString());
  }

  private ImmutableList<Name> constituentNames(AbstractState state, ContractExpression expr) {
    if (expr.kind() == ContractExpression.Kind.NAME) {
      return ImmutableList.of((Name) expr);
    }
    ImmutableList<ContractExpression> elements = ((Aggregate) expr).getElements();
    if (elements.isEmpty()) {
      diagnostics.errorf(
          DiagnosticKind.MALFORMED_RELATION,
          expr,
          "empty constituent list in the refinement of state '%s'",
          state.getName());
    }
    ImmutableList.Builder<Name> names = ImmutableList.builder();
    for (ContractExpression e : elements) {
      switch (e.kind()) {
        case NAME -> names.add((Name) e);
        case NULL ->
            diagnostics.errorf(
                DiagnosticKind.MALFORMED_RELATION,
                e,
                "null cannot be mixed with constituents in the refinement of state '%s'",
                state.getName());
        case AGGREGATE ->
            diagnostics.errorf(
                DiagnosticKind.MALFORMED_RELATION,
                e,
                "unexpected nested list '%s' in the refinement of state '%s'",
                e,
                state.getName());
      }
    }
    return names.build();
  }

  // Returns the item a constituent name denotes, or null after reporting why it cannot be one.
  @Nullable
  private NamedItem constituentOf(AbstractState state, Name name) throws Diagnostic.Exception {
    Item item = Diagnostics.resolve(name);
    if (item.kind() != Item.Kind.OBJECT && item.kind() != Item.Kind.STATE) {
      diagnostics.errorf(
          DiagnosticKind.MALFORMED_RELATION,
          name,
          "'%s' cannot act as a constituent of state '%s'",
          name.getName(),
          state.getName());
      return null;
    }
    NamedItem constituent = (NamedItem) item;
    if (constituent == state
        || (constituent instanceof AbstractState sub && sub.encloses(state))) {
      diagnostics.errorf(
          DiagnosticKind.MALFORMED_RELATION,
          name,
          constituent,
          "state '%s' cannot be a constituent of itself",
          state.getName());
      return null;
    }
    AbstractState owner = claimed.get(constituent);
    if (owner == null) {
      owner = constituent.getEncapsulatingState();
    }
    if (owner != null) {
      diagnostics.errorf(
          DiagnosticKind.DUPLICATE_CONSTITUENT,
          name,
          constituent,
          "'%s' is already a constituent of state '%s'",
          constituent.getName(),
          owner.getName());
      return null;
    }
    claimed.put(constituent, state);
    return constituent;
  }

  private void checkExternalProperties(
      AbstractState state,
      Map<NamedItem, Name> constituents,
      StateRefinementContract.Clause clause) {
    if (!state.isExternal()) {
      for (Map.Entry<NamedItem, Name> e : constituents.entrySet()) {
        if (e.getKey().isExternal()) {
          diagnostics.errorf(
              DiagnosticKind.EXTERNAL_PROPERTY_MISMATCH,
              e.getValue(),
              e.getKey(),
              "non-external state '%s' cannot contain external constituent '%s'",
              state.getName(),
              e.getKey().getName());
        }
      }
      return;
    }

    Set<ExternalProperty> stateProperties = state.getExternalProperties();
    for (Map.Entry<NamedItem, Name> e : constituents.entrySet()) {
      for (ExternalProperty property : e.getKey().getExternalProperties()) {
        if (!stateProperties.contains(property)) {
          diagnostics.errorf(
              DiagnosticKind.EXTERNAL_PROPERTY_MISMATCH,
              e.getValue(),
              e.getKey(),
              "constituent '%s' introduces external property %s in refinement of state '%s'",
              e.getKey().getName(),
              property,
              state.getName());
        }
      }
    }
    if (constituents.isEmpty()) {
      return;
    }
    for (ExternalProperty property : stateProperties) {
      if (constituents.keySet().stream()
          .noneMatch(c -> c.getExternalProperties().contains(property))) {
        diagnostics.errorf(
            DiagnosticKind.EXTERNAL_PROPERTY_MISMATCH,
            clause,
            state,
            "external state '%s' requires at least one constituent with property %s",
            state.getName(),
            property);
      }
    }
  }
}
