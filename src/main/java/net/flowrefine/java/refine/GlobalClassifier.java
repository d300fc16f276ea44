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
import java.util.EnumSet;
import java.util.Set;
import net.flowrefine.java.items.DataObject;
import net.flowrefine.java.items.Item;
import net.flowrefine.java.syntax.Aggregate;
import net.flowrefine.java.syntax.ContractExpression;
import net.flowrefine.java.syntax.Diagnostic;
import net.flowrefine.java.syntax.DiagnosticKind;
import net.flowrefine.java.syntax.GlobalMode;
import net.flowrefine.java.syntax.GlobalRelation;
import net.flowrefine.java.syntax.Name;

/**
 * The GlobalClassifier partitions the items of a global list by access mode.
 *
 * <p>An unmoded list takes the default mode supplied by the caller, which is Input for both
 * Global and Refined_Global contracts. Within a moded list, each mode may appear once, and the
 * list it selects must itself be unmoded.
 */
public final class GlobalClassifier {

  private final Diagnostics diagnostics;
  private final ClassifiedGlobals.Builder globals = ClassifiedGlobals.builder();
  private final Mentions mentions = new Mentions();

  private GlobalClassifier(Diagnostics diagnostics) {
    this.diagnostics = diagnostics;
  }

  /**
   * Classifies a global list.
   *
   * @param relation the global list
   * @param defaultMode the mode of the items of an unmoded list
   * @param diagnostics the sink for errors in the list
   * @throws Diagnostic.Exception if the list contains an unresolved name
   */
  public static ClassifiedGlobals classify(
      GlobalRelation relation, GlobalMode defaultMode, Diagnostics diagnostics)
      throws Diagnostic.Exception {
    GlobalClassifier c = new GlobalClassifier(diagnostics);
    switch (relation.kind()) {
      case NULL -> {}
      case ITEMS -> c.classifyItems(relation.getItems(), defaultMode);
      case MODED -> c.classifyModed(relation);
    }
    c.mentions.checkStatesAndConstituents(diagnostics);
    return c.globals.build();
  }

  private void classifyModed(GlobalRelation relation) throws Diagnostic.Exception {
    Set<GlobalMode> seen = EnumSet.noneOf(GlobalMode.class);
    for (GlobalRelation.Moded moded : relation.getModed()) {
      if (!seen.add(moded.getMode())) {
        diagnostics.errorf(
            DiagnosticKind.MALFORMED_RELATION,
            moded,
            "duplicate global mode %s",
            moded.getMode());
        continue;
      }
      GlobalRelation list = moded.getList();
      switch (list.kind()) {
        case NULL -> {}
        case ITEMS -> classifyItems(list.getItems(), moded.getMode());
        case MODED ->
            diagnostics.errorf(
                DiagnosticKind.MALFORMED_RELATION,
                list,
                "moded global list cannot appear under mode %s",
                moded.getMode());
      }
    }
  }

  private void classifyItems(ContractExpression expr, GlobalMode mode)
      throws Diagnostic.Exception {
    switch (expr.kind()) {
      case NULL -> {}
      case NAME -> addItem((Name) expr, mode);
      case AGGREGATE -> {
        ImmutableList<ContractExpression> elements = ((Aggregate) expr).getElements();
        if (elements.isEmpty()) {
          diagnostics.errorf(DiagnosticKind.MALFORMED_RELATION, expr, "empty global list");
        }
        for (ContractExpression e : elements) {
          if (e.kind() == ContractExpression.Kind.NAME) {
            addItem((Name) e, mode);
          } else {
            diagnostics.errorf(
                DiagnosticKind.MALFORMED_RELATION,
                e,
                "global list may only contain names, found '%s'",
                e);
          }
        }
      }
    }
  }

  private void addItem(Name name, GlobalMode mode) throws Diagnostic.Exception {
    Item item = Diagnostics.resolve(name);
    switch (item.kind()) {
      case PARAMETER -> {
        diagnostics.errorf(
            DiagnosticKind.MALFORMED_RELATION,
            name,
            item,
            "formal parameter '%s' cannot act as a global item",
            item.getName());
        return;
      }
      case FUNCTION_RESULT, NULL -> {
        diagnostics.errorf(
            DiagnosticKind.MALFORMED_RELATION,
            name,
            "'%s' cannot act as a global item",
            name.getName());
        return;
      }
      case OBJECT, STATE -> {}
    }
    mentions.add(item, name);
    if (item instanceof DataObject object && object.isConstant() && mode.isWritable()) {
      diagnostics.errorf(
          DiagnosticKind.ILLEGAL_CONSTANT_MODE,
          name,
          item,
          "constant '%s' cannot have mode %s",
          item.getName(),
          mode);
      return;
    }
    if (globals.contains(item)) {
      diagnostics.errorf(
          DiagnosticKind.DUPLICATE_GLOBAL_ITEM,
          name,
          item,
          "duplicate global item '%s'",
          item.getName());
      return;
    }
    globals.add(mode, item, name);
  }
}
