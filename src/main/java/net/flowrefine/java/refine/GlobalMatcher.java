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
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.flowrefine.java.items.AbstractState;
import net.flowrefine.java.items.Item;
import net.flowrefine.java.items.NamedItem;
import net.flowrefine.java.syntax.DiagnosticKind;
import net.flowrefine.java.syntax.GlobalMode;
import net.flowrefine.java.syntax.Node;

/**
 * The GlobalMatcher decides whether a refined global list is a valid decomposition of an abstract
 * one.
 *
 * <p>A state with a visible non-null refinement must be represented in the refined list by its
 * constituents, subject to a coverage rule that depends on the state's mode:
 *
 * <ul>
 *   <li>Input: at least one constituent of mode Input, and none of any other mode.
 *   <li>Output: every constituent of mode Output.
 *   <li>In_Out: a constituent of mode In_Out; or constituents of modes Input and Output; or a
 *       constituent of mode Output while other constituents go unmentioned. No constituent of
 *       mode Proof_In.
 *   <li>Proof_In: at least one constituent of mode Proof_In, and none of any other mode.
 * </ul>
 *
 * A state with a visible null refinement needs no representation at all. Every other item must
 * keep its mode. Items of the refined list accounted for by none of these rules are reported as
 * extra.
 *
 * <p>The matcher works on private copies of the refined sets, removing each item as it is
 * accounted for.
 */
public final class GlobalMatcher {

  /** The outcome of matching one pair of global lists. */
  public static final class Result {
    private final ImmutableList<CoverageViolation> violations;
    private final ImmutableList<Item> missing;
    private final ImmutableList<Item> extra;
    private final int errors;

    private Result(
        ImmutableList<CoverageViolation> violations,
        ImmutableList<Item> missing,
        ImmutableList<Item> extra,
        int errors) {
      this.violations = violations;
      this.missing = missing;
      this.extra = extra;
      this.errors = errors;
    }

    /** Returns the coverage violations of states with visible refinements. */
    public ImmutableList<CoverageViolation> getViolations() {
      return violations;
    }

    /** Returns the plain abstract items absent from the refinement. */
    public ImmutableList<Item> getMissing() {
      return missing;
    }

    /** Returns the refined items that the abstract list does not account for. */
    public ImmutableList<Item> getExtra() {
      return extra;
    }

    public boolean isMatched() {
      return errors == 0;
    }
  }

  private static final GlobalMode[] STATE_ORDER = {
    GlobalMode.INPUT, GlobalMode.IN_OUT, GlobalMode.OUTPUT, GlobalMode.PROOF_IN
  };

  private final ClassifiedGlobals abstractGlobals;
  private final ClassifiedGlobals refinedGlobals;
  private final Diagnostics diagnostics;
  private final Map<GlobalMode, Set<Item>> pools = new EnumMap<>(GlobalMode.class);

  private final ImmutableList.Builder<CoverageViolation> violations = ImmutableList.builder();
  private final ImmutableList.Builder<Item> missing = ImmutableList.builder();
  private final ImmutableList.Builder<Item> extra = ImmutableList.builder();
  private int errors;

  private GlobalMatcher(
      ClassifiedGlobals abstractGlobals, ClassifiedGlobals refinedGlobals, Diagnostics diagnostics) {
    this.abstractGlobals = abstractGlobals;
    this.refinedGlobals = refinedGlobals;
    this.diagnostics = diagnostics;
    for (GlobalMode mode : GlobalMode.values()) {
      pools.put(mode, new LinkedHashSet<>(refinedGlobals.get(mode)));
    }
  }

  /** Matches a refined global list against the abstract list it refines. */
  public static Result match(
      ClassifiedGlobals abstractGlobals, ClassifiedGlobals refinedGlobals, Diagnostics diagnostics) {
    GlobalMatcher m = new GlobalMatcher(abstractGlobals, refinedGlobals, diagnostics);
    for (GlobalMode mode : STATE_ORDER) {
      for (AbstractState state : abstractGlobals.getRefinedStates()) {
        if (abstractGlobals.modeOf(state) != mode) {
          continue;
        }
        switch (mode) {
          case INPUT, PROOF_IN -> m.checkReadOnlyState(state, mode);
          case IN_OUT -> m.checkInOutState(state);
          case OUTPUT -> m.checkOutputState(state);
        }
      }
    }
    for (Item item : abstractGlobals.getItems()) {
      if (!item.hasVisibleRefinement()) {
        m.checkPlainItem(item, abstractGlobals.modeOf(item));
      }
    }
    m.reportLeftovers();
    return new Result(m.violations.build(), m.missing.build(), m.extra.build(), m.errors);
  }

  /**
   * Removes from the pools every refined item that is a constituent of {@code state}, at any
   * depth, and returns them with their refined modes.
   */
  private Map<Item, GlobalMode> takeConstituents(AbstractState state) {
    Map<Item, GlobalMode> uses = new LinkedHashMap<>();
    for (GlobalMode mode : GlobalMode.values()) {
      for (Iterator<Item> it = pools.get(mode).iterator(); it.hasNext(); ) {
        Item item = it.next();
        if (state.encloses(item)) {
          uses.put(item, mode);
          it.remove();
        }
      }
    }
    return uses;
  }

  // Input and Proof_In states: at least one constituent of the state's mode, none of another.
  private void checkReadOnlyState(AbstractState state, GlobalMode mode) {
    boolean found = false;
    for (Map.Entry<Item, GlobalMode> use : takeConstituents(state).entrySet()) {
      if (use.getValue() == mode) {
        found = true;
      } else {
        wrongMode(state, mode, use.getKey(), use.getValue());
      }
    }
    if (!found) {
      violation(state, null, DiagnosticKind.MISSING_CONSTITUENT);
      diagnostics.errorf(
          DiagnosticKind.MISSING_CONSTITUENT,
          abstractNode(state),
          state,
          "global refinement of state '%s' must include at least one constituent of mode %s",
          state.getName(),
          mode);
    }
  }

  // Output states: every constituent, at any depth, of mode Output.
  private void checkOutputState(AbstractState state) {
    Map<Item, GlobalMode> uses = takeConstituents(state);
    for (Map.Entry<Item, GlobalMode> use : uses.entrySet()) {
      if (use.getValue() != GlobalMode.OUTPUT) {
        wrongMode(state, GlobalMode.OUTPUT, use.getKey(), use.getValue());
      }
    }
    coverAll(state, state, uses);
  }

  private void coverAll(AbstractState top, AbstractState state, Map<Item, GlobalMode> uses) {
    for (NamedItem constituent : state.getConstituents()) {
      if (uses.containsKey(constituent)) {
        continue;
      }
      if (constituent instanceof AbstractState sub && sub.hasVisibleRefinement()) {
        if (sub.hasNullRefinement()) {
          continue;
        }
        if (uses.keySet().stream().anyMatch(sub::encloses)) {
          coverAll(top, sub, uses);
          continue;
        }
      }
      violation(top, constituent, DiagnosticKind.MISSING_CONSTITUENT);
      diagnostics.errorf(
          DiagnosticKind.MISSING_CONSTITUENT,
          abstractNode(top),
          constituent,
          "output state '%s' must be replaced by all its constituents in global refinement: "
              + "constituent '%s' is missing",
          top.getName(),
          constituent.getName());
    }
  }

  private void checkInOutState(AbstractState state) {
    Map<Item, GlobalMode> uses = takeConstituents(state);
    boolean hasInOut = false;
    boolean hasInput = false;
    boolean hasOutput = false;
    Set<Item> mentioned = new LinkedHashSet<>();
    for (Map.Entry<Item, GlobalMode> use : uses.entrySet()) {
      switch (use.getValue()) {
        case IN_OUT -> hasInOut = true;
        case INPUT -> hasInput = true;
        case OUTPUT -> hasOutput = true;
        case PROOF_IN -> {
          wrongMode(state, GlobalMode.IN_OUT, use.getKey(), use.getValue());
          continue;
        }
      }
      mentioned.add(use.getKey());
    }
    if (hasInOut
        || (hasInput && hasOutput)
        || (hasOutput && !mentionsAll(state, mentioned))) {
      return;
    }
    violation(state, null, DiagnosticKind.INCONSISTENT_MODE_REFINEMENT);
    diagnostics.errorf(
        DiagnosticKind.INCONSISTENT_MODE_REFINEMENT,
        abstractNode(state),
        state,
        "global refinement of In_Out state '%s' must include a constituent of mode In_Out, or"
            + " constituents of modes Input and Output, or a constituent of mode Output with"
            + " other constituents left out",
        state.getName());
  }

  // Reports whether every constituent that carries data is mentioned, itself or through its own
  // constituents.
  private static boolean mentionsAll(AbstractState state, Set<Item> mentioned) {
    for (NamedItem constituent : state.getConstituents()) {
      if (mentioned.contains(constituent)) {
        continue;
      }
      if (constituent instanceof AbstractState sub && sub.hasVisibleRefinement()) {
        if (sub.hasNullRefinement()) {
          continue;
        }
        if (mentioned.stream().anyMatch(sub::encloses) && mentionsAll(sub, mentioned)) {
          continue;
        }
      }
      return false;
    }
    return true;
  }

  private void checkPlainItem(Item item, GlobalMode mode) {
    GlobalMode refinedMode = null;
    for (GlobalMode m : GlobalMode.values()) {
      if (pools.get(m).remove(item)) {
        refinedMode = m;
        break;
      }
    }
    if (refinedMode == null) {
      missing.add(item);
      errors++;
      diagnostics.errorf(
          DiagnosticKind.MISSING_GLOBAL_ITEM,
          abstractNode(item),
          item,
          "global item '%s' of mode %s is missing from the global refinement",
          item.getName(),
          mode);
    } else if (refinedMode != mode) {
      errors++;
      diagnostics.errorf(
          DiagnosticKind.INCONSISTENT_ITEM_MODE,
          refinedNode(item),
          item,
          "global item '%s' has mode %s in the refinement but mode %s in the abstract contract",
          item.getName(),
          refinedMode,
          mode);
    }
  }

  private void reportLeftovers() {
    for (GlobalMode mode : GlobalMode.values()) {
      for (Item item : pools.get(mode)) {
        extra.add(item);
        errors++;
        AbstractState owner =
            item instanceof NamedItem named ? named.getEncapsulatingState() : null;
        if (owner != null) {
          diagnostics.errorf(
              DiagnosticKind.EXTRA_CONSTITUENT,
              refinedNode(item),
              item,
              "constituent '%s' of state '%s' is not allowed: the abstract global contract does"
                  + " not mention '%s'",
              item.getName(),
              owner.getName(),
              owner.getName());
        } else if (item instanceof AbstractState state && state.hasVisibleRefinement()) {
          diagnostics.errorf(
              DiagnosticKind.EXTRA_GLOBAL_ITEM,
              refinedNode(item),
              item,
              "state '%s' has a visible refinement and must be replaced by its constituents",
              item.getName());
        } else {
          diagnostics.errorf(
              DiagnosticKind.EXTRA_GLOBAL_ITEM,
              refinedNode(item),
              item,
              "global item '%s' does not appear in the abstract global contract",
              item.getName());
        }
      }
    }
  }

  private void wrongMode(
      AbstractState state, GlobalMode stateMode, Item constituent, GlobalMode constituentMode) {
    violation(state, constituent, DiagnosticKind.WRONG_CONSTITUENT_MODE);
    diagnostics.errorf(
        DiagnosticKind.WRONG_CONSTITUENT_MODE,
        refinedNode(constituent),
        constituent,
        "constituent '%s' of %s state '%s' cannot have mode %s",
        constituent.getName(),
        stateMode,
        state.getName(),
        constituentMode);
  }

  private void violation(AbstractState state, @Nullable Item constituent, DiagnosticKind kind) {
    violations.add(new CoverageViolation(state, constituent, kind));
    errors++;
  }

  private Node abstractNode(Item item) {
    return abstractGlobals.nodeOf(item);
  }

  private Node refinedNode(Item item) {
    return refinedGlobals.nodeOf(item);
  }
}
