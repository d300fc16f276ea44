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

import java.util.LinkedHashMap;
import java.util.Map;
import net.flowrefine.java.items.AbstractState;
import net.flowrefine.java.items.Item;
import net.flowrefine.java.items.NamedItem;
import net.flowrefine.java.syntax.DiagnosticKind;
import net.flowrefine.java.syntax.Node;

/** Mentions records where each item is first mentioned in one relation. */
final class Mentions {

  private final Map<Item, Node> first = new LinkedHashMap<>();

  void add(Item item, Node node) {
    first.putIfAbsent(item, node);
  }

  /**
   * Reports each item mentioned in the same relation as a state that encloses it. Whether the
   * relation is abstract or refined, a state and its own constituent never appear together.
   */
  void checkStatesAndConstituents(Diagnostics diagnostics) {
    for (Map.Entry<Item, Node> e : first.entrySet()) {
      if (!(e.getKey() instanceof NamedItem item)) {
        continue;
      }
      for (AbstractState s = item.getEncapsulatingState();
          s != null;
          s = s.getEncapsulatingState()) {
        if (first.containsKey(s)) {
          diagnostics.errorf(
              DiagnosticKind.CANNOT_MENTION_STATE_AND_CONSTITUENT_TOGETHER,
              e.getValue(),
              item,
              "cannot mention state '%s' and its constituent '%s' in the same relation",
              s.getName(),
              item.getName());
          break;
        }
      }
    }
  }
}
