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
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.flowrefine.java.items.AbstractState;
import net.flowrefine.java.items.Item;
import net.flowrefine.java.items.ItemTable;
import net.flowrefine.java.syntax.Aggregate;
import net.flowrefine.java.syntax.ContractExpression;
import net.flowrefine.java.syntax.DependencyClause;
import net.flowrefine.java.syntax.DependencyRelation;
import net.flowrefine.java.syntax.Diagnostic;
import net.flowrefine.java.syntax.DiagnosticKind;
import net.flowrefine.java.syntax.GlobalMode;
import net.flowrefine.java.syntax.GlobalRelation;
import net.flowrefine.java.syntax.Name;
import net.flowrefine.java.syntax.Node;
import net.flowrefine.java.syntax.StateRefinementContract;

/**
 * The RefinementChecker decides whether the refined contracts of a body are a faithful
 * decomposition of the abstract contracts of the corresponding specification.
 *
 * <p>For a subprogram, it normalizes the abstract and refined flow relations with the {@link
 * ClauseNormalizer} and matches them with the {@link DependencyMatcher}, and classifies the
 * abstract and refined global lists with the {@link GlobalClassifier} and matches them with the
 * {@link GlobalMatcher}. For a package, it collects the state refinement contract with the {@link
 * StateRefinementCollector}. Packages must be checked before the subprograms whose contracts
 * mention their states.
 *
 * <p>Each check reports a {@link RefinementVerdict}. The checker forwards the verdict's
 * diagnostics to its {@link DiagnosticHandler}, except those it has already forwarded: checking a
 * structurally identical contract again, as happens for each instance of a generic unit, emits
 * nothing new.
 *
 * <p>A checker is not thread-safe.
 */
public final class RefinementChecker {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final CheckerOptions options;
  private final DiagnosticHandler handler;
  private final Set<Diagnostic> emitted = new HashSet<>();

  public RefinementChecker(CheckerOptions options, DiagnosticHandler handler) {
    this.options = Preconditions.checkNotNull(options);
    this.handler = Preconditions.checkNotNull(handler);
  }

  /** Returns a checker with default options that discards the diagnostics it emits. */
  public static RefinementChecker create() {
    return new RefinementChecker(CheckerOptions.DEFAULT, DiagnosticHandler.NOOP);
  }

  public CheckerOptions getOptions() {
    return options;
  }

  /**
   * Returns a check of the refined contracts of a subprogram body against the abstract contracts
   * of its specification.
   */
  public ContractCheck newSubprogramCheck(
      String name, SubprogramContracts spec, SubprogramContracts body) {
    return new SubprogramCheck(name, spec, body);
  }

  /**
   * Returns a check of the state refinement contract of a package body. Running it records the
   * refinements in {@code table}.
   */
  public ContractCheck newPackageCheck(
      String name,
      List<AbstractState> declaredStates,
      StateRefinementContract contract,
      ItemTable table) {
    return new PackageCheck(name, declaredStates, contract, table);
  }

  /** Checks a subprogram. Equivalent to {@code newSubprogramCheck(...).run()}. */
  public RefinementVerdict checkSubprogram(
      String name, SubprogramContracts spec, SubprogramContracts body) {
    return newSubprogramCheck(name, spec, body).run();
  }

  /** Checks a package. Equivalent to {@code newPackageCheck(...).run()}. */
  public RefinementVerdict checkPackage(
      String name,
      List<AbstractState> declaredStates,
      StateRefinementContract contract,
      ItemTable table) {
    return newPackageCheck(name, declaredStates, contract, table).run();
  }

  private void emit(RefinementVerdict verdict) {
    logger.atFine().log(
        "%s: %s, %d diagnostics",
        verdict.unitName(),
        verdict.isAccepted() ? "accepted" : "rejected",
        verdict.diagnostics().size());
    for (Diagnostic diagnostic : verdict.diagnostics()) {
      if (emitted.add(diagnostic)) {
        handler.handle(diagnostic);
      }
    }
  }

  private final class SubprogramCheck extends ContractCheck {

    private final SubprogramContracts spec;
    private final SubprogramContracts body;

    @Nullable private ImmutableList<Edge> abstractEdges;
    @Nullable private ImmutableList<Edge> refinedEdges;
    @Nullable private ClassifiedGlobals abstractGlobals;
    @Nullable private ClassifiedGlobals refinedGlobals;

    SubprogramCheck(String name, SubprogramContracts spec, SubprogramContracts body) {
      super(name);
      this.spec = Preconditions.checkNotNull(spec);
      this.body = Preconditions.checkNotNull(body);
    }

    @Override
    boolean normalize(Diagnostics diagnostics) {
      logger.atFine().log("checking refinement of subprogram %s", getUnitName());
      if (body.isEmpty()) {
        return false;
      }
      if (options.requireVisibleRefinement() && !mentionsVisibleRefinement(spec)) {
        Node where = body.depends() != null ? body.depends() : body.global();
        useless(
            diagnostics,
            where,
            "useless refinement, subprogram '%s' does not depend on abstract state with"
                + " visible refinement",
            getUnitName());
        return false;
      }
      normalizeGlobals(diagnostics);
      normalizeDepends(diagnostics);
      return (abstractEdges != null && refinedEdges != null)
          || (abstractGlobals != null && refinedGlobals != null);
    }

    private void normalizeGlobals(Diagnostics diagnostics) {
      GlobalRelation specGlobal = spec.global();
      GlobalRelation bodyGlobal = body.global();
      if (specGlobal != null && !specGlobal.isNull()) {
        abstractGlobals = classify(specGlobal, "Global", diagnostics);
      }
      if (bodyGlobal == null) {
        return;
      }
      if (specGlobal == null) {
        useless(
            diagnostics,
            bodyGlobal,
            "useless refinement, declaration of subprogram '%s' lacks a Global contract",
            getUnitName());
      } else if (specGlobal.isNull()) {
        useless(
            diagnostics,
            bodyGlobal,
            "useless refinement, subprogram '%s' has a null Global contract",
            getUnitName());
      } else if (abstractGlobals != null) {
        refinedGlobals = classify(bodyGlobal, "Refined_Global", diagnostics);
      }
    }

    @Nullable
    private ClassifiedGlobals classify(
        GlobalRelation relation, String what, Diagnostics diagnostics) {
      try {
        return GlobalClassifier.classify(relation, GlobalMode.INPUT, diagnostics);
      } catch (Diagnostic.Exception ex) {
        abandon(what, ex, diagnostics);
        return null;
      }
    }

    private void normalizeDepends(Diagnostics diagnostics) {
      DependencyRelation specDepends = spec.depends();
      DependencyRelation bodyDepends = body.depends();
      if (bodyDepends == null) {
        return;
      }
      if (specDepends == null) {
        useless(
            diagnostics,
            bodyDepends,
            "useless refinement, declaration of subprogram '%s' lacks a Depends contract",
            getUnitName());
        return;
      }
      if (specDepends.isNull()) {
        useless(
            diagnostics,
            bodyDepends,
            "useless refinement, subprogram '%s' has a null Depends contract",
            getUnitName());
        return;
      }
      try {
        ImmutableList<Edge> edges = ClauseNormalizer.normalize(specDepends, diagnostics);
        if (options.completeDependsFromGlobal() && abstractGlobals != null) {
          edges = ClauseNormalizer.completeFromGlobals(edges, abstractGlobals);
        }
        ImmutableList<Edge> refined = ClauseNormalizer.normalize(bodyDepends, diagnostics);
        abstractEdges = edges;
        refinedEdges = refined;
      } catch (Diagnostic.Exception ex) {
        abandon("Depends", ex, diagnostics);
      }
    }

    @Override
    void match(Diagnostics diagnostics, RefinementVerdict.Builder builder) {
      if (abstractEdges != null && refinedEdges != null) {
        DependencyMatcher.Result result =
            DependencyMatcher.match(
                abstractEdges, refinedEdges, options.tolerateNullInputRefinements(), diagnostics);
        builder.unmatchedEdgesBuilder().addAll(result.getUnmatched());
        builder.unconsumedEdgesBuilder().addAll(result.getUnconsumed());
        builder.touchedStatesBuilder().addAll(result.getTouchedStates());
      }
      if (abstractGlobals != null && refinedGlobals != null) {
        GlobalMatcher.Result result =
            GlobalMatcher.match(abstractGlobals, refinedGlobals, diagnostics);
        builder.coverageViolationsBuilder().addAll(result.getViolations());
        builder.missingGlobalsBuilder().addAll(result.getMissing());
        builder.extraGlobalsBuilder().addAll(result.getExtra());
      }
    }

    @Override
    void finish(RefinementVerdict verdict) {
      emit(verdict);
    }

    private void abandon(String what, Diagnostic.Exception ex, Diagnostics diagnostics) {
      logger.atFine().log("abandoning %s contract of %s: %s", what, getUnitName(), ex.getMessage());
      diagnostics.addAll(ex.diagnostics());
    }
  }

  private final class PackageCheck extends ContractCheck {

    private final ImmutableList<AbstractState> declaredStates;
    private final StateRefinementContract contract;
    private final ItemTable table;

    PackageCheck(
        String name,
        List<AbstractState> declaredStates,
        StateRefinementContract contract,
        ItemTable table) {
      super(name);
      this.declaredStates = ImmutableList.copyOf(declaredStates);
      this.contract = Preconditions.checkNotNull(contract);
      this.table = Preconditions.checkNotNull(table);
    }

    // Collecting the refinement is the whole check; there is nothing left to match.
    @Override
    boolean normalize(Diagnostics diagnostics) {
      logger.atFine().log("checking state refinement of package %s", getUnitName());
      try {
        StateRefinementCollector.collect(contract, declaredStates, table, diagnostics);
      } catch (Diagnostic.Exception ex) {
        logger.atFine().log(
            "abandoning state refinement of %s: %s", getUnitName(), ex.getMessage());
        diagnostics.addAll(ex.diagnostics());
      }
      return false;
    }

    @Override
    void match(Diagnostics diagnostics, RefinementVerdict.Builder builder) {
      throw new IllegalStateException("package checks have no matching phase");
    }

    @Override
    void finish(RefinementVerdict verdict) {
      emit(verdict);
    }
  }

  @FormatMethod
  private static void useless(
      Diagnostics diagnostics, Node where, String format, Object... args) {
    diagnostics.errorf(DiagnosticKind.USELESS_REFINEMENT, where, format, args);
  }

  /** Reports whether the contracts mention a state whose refinement is visible. */
  private static boolean mentionsVisibleRefinement(SubprogramContracts contracts) {
    Set<Item> items = new HashSet<>();
    DependencyRelation depends = contracts.depends();
    if (depends != null) {
      for (DependencyClause clause : depends.getClauses()) {
        collectItems(clause.getOutputs(), items);
        collectItems(clause.getInputs(), items);
      }
    }
    GlobalRelation global = contracts.global();
    if (global != null) {
      collectItems(global, items);
    }
    return items.stream().anyMatch(Item::hasVisibleRefinement);
  }

  private static void collectItems(GlobalRelation relation, Set<Item> items) {
    switch (relation.kind()) {
      case NULL -> {}
      case ITEMS -> collectItems(relation.getItems(), items);
      case MODED -> {
        for (GlobalRelation.Moded moded : relation.getModed()) {
          collectItems(moded.getList(), items);
        }
      }
    }
  }

  private static void collectItems(ContractExpression expr, Set<Item> items) {
    switch (expr.kind()) {
      case NULL -> {}
      case NAME -> {
        Item item = ((Name) expr).getItem();
        if (item != null) {
          items.add(item);
        }
      }
      case AGGREGATE -> {
        for (ContractExpression e : ((Aggregate) expr).getElements()) {
          collectItems(e, items);
        }
      }
    }
  }
}
