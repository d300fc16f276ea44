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

package net.flowrefine.java.items;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * An ItemTable holds the items of one compilation unit, indexed by name.
 *
 * <p>The table is populated by the symbol-table builder as declarations are elaborated, and by
 * the state refinement collector as refinements become visible. The refinement checker only
 * queries it.
 */
public final class ItemTable {

  private final Map<String, NamedItem> byName = new HashMap<>();
  private final List<NamedItem> items = new ArrayList<>();

  public ItemTable() {}

  @CanIgnoreReturnValue
  public Parameter declareParameter(String name, Parameter.Role role) {
    return add(new Parameter(items.size(), name, role));
  }

  @CanIgnoreReturnValue
  public DataObject declareVariable(String name) {
    return add(
        new DataObject(items.size(), name, DataObject.ObjectKind.VARIABLE, ImmutableSet.of()));
  }

  /** Declares a volatile variable with the given external properties (all four if none given). */
  @CanIgnoreReturnValue
  public DataObject declareExternalVariable(String name, ExternalProperty... properties) {
    return add(
        new DataObject(
            items.size(), name, DataObject.ObjectKind.VARIABLE, externalProperties(properties)));
  }

  @CanIgnoreReturnValue
  public DataObject declareConstant(String name) {
    return add(
        new DataObject(items.size(), name, DataObject.ObjectKind.CONSTANT, ImmutableSet.of()));
  }

  @CanIgnoreReturnValue
  public AbstractState declareState(String name) {
    return add(new AbstractState(items.size(), name, ImmutableSet.of()));
  }

  /**
   * Declares an external state with the given properties. An external state declared without
   * explicit properties has all of them.
   */
  @CanIgnoreReturnValue
  public AbstractState declareExternalState(String name, ExternalProperty... properties) {
    return add(new AbstractState(items.size(), name, externalProperties(properties)));
  }

  private static ImmutableSet<ExternalProperty> externalProperties(ExternalProperty... properties) {
    if (properties.length == 0) {
      return ImmutableSet.copyOf(EnumSet.allOf(ExternalProperty.class));
    }
    return ImmutableSet.copyOf(properties);
  }

  private <T extends NamedItem> T add(T item) {
    Preconditions.checkArgument(
        !byName.containsKey(item.getName()), "'%s' is already declared", item.getName());
    byName.put(item.getName(), item);
    items.add(item);
    return item;
  }

  /** Returns the item of the given name, or null if there is none. */
  @Nullable
  public NamedItem lookup(String name) {
    return byName.get(name);
  }

  /** Returns the item of the given name, which must be declared. */
  public NamedItem get(String name) {
    NamedItem item = byName.get(name);
    Preconditions.checkArgument(item != null, "'%s' is not declared", name);
    return item;
  }

  /** Returns the state of the given name, which must be declared. */
  public AbstractState getState(String name) {
    NamedItem item = get(name);
    Preconditions.checkArgument(item instanceof AbstractState, "'%s' is not a state", name);
    return (AbstractState) item;
  }

  /** Returns all items in order of declaration. */
  public ImmutableList<NamedItem> getItems() {
    return ImmutableList.copyOf(items);
  }

  /**
   * Records the refinement of {@code state} into the given constituents, which must be objects or
   * states not yet belonging to any state.
   */
  public void refine(AbstractState state, List<? extends NamedItem> constituents) {
    Preconditions.checkArgument(!constituents.isEmpty(), "use refineToNull");
    ImmutableList<NamedItem> list = ImmutableList.copyOf(constituents);
    Preconditions.checkArgument(
        ImmutableSet.copyOf(list).size() == list.size(), "duplicate constituent in %s", list);
    for (NamedItem c : list) {
      Preconditions.checkArgument(
          c.kind() == Item.Kind.OBJECT || c.kind() == Item.Kind.STATE,
          "constituent %s must be an object or a state",
          c);
      Preconditions.checkArgument(c != state, "state %s cannot be its own constituent", state);
      Preconditions.checkArgument(
          c.getEncapsulatingState() == null,
          "%s is already a constituent of %s",
          c,
          c.getEncapsulatingState());
    }
    state.setRefinement(AbstractState.Refinement.NON_NULL, list);
    for (NamedItem c : list) {
      c.setEncapsulatingState(state);
    }
  }

  /** Records that {@code state} is refined to null: it has no constituents. */
  public void refineToNull(AbstractState state) {
    state.setRefinement(AbstractState.Refinement.NULL, ImmutableList.of());
  }
}
