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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.flowrefine.java.items.AbstractState;
import net.flowrefine.java.items.Item;
import net.flowrefine.java.syntax.GlobalMode;
import net.flowrefine.java.syntax.Node;

/**
 * ClassifiedGlobals is the result of classifying a global list: four disjoint ordered sets of
 * items, one per {@link GlobalMode}, together with the node at which each item was mentioned.
 *
 * <p>It also records which of the states among the items had a visible null or non-null
 * refinement at the time of classification.
 */
public final class ClassifiedGlobals {

  /** The classification of the null global list. */
  public static final ClassifiedGlobals EMPTY = builder().build();

  private final ImmutableMap<GlobalMode, ImmutableSet<Item>> sets;
  private final ImmutableMap<Item, GlobalMode> modes;
  private final ImmutableMap<Item, Node> nodes;
  private final ImmutableSet<AbstractState> nullRefinedStates;
  private final ImmutableSet<AbstractState> refinedStates;

  private ClassifiedGlobals(Builder builder) {
    ImmutableMap.Builder<GlobalMode, ImmutableSet<Item>> sets = ImmutableMap.builder();
    ImmutableSet.Builder<AbstractState> nullRefined = ImmutableSet.builder();
    ImmutableSet.Builder<AbstractState> refined = ImmutableSet.builder();
    for (GlobalMode mode : GlobalMode.values()) {
      Set<Item> items = builder.sets.get(mode);
      sets.put(mode, ImmutableSet.copyOf(items));
      for (Item item : items) {
        if (item instanceof AbstractState s && s.hasNullRefinement()) {
          nullRefined.add(s);
        } else if (item instanceof AbstractState s && s.hasNonNullRefinement()) {
          refined.add(s);
        }
      }
    }
    this.sets = sets.buildOrThrow();
    this.modes = ImmutableMap.copyOf(builder.modes);
    this.nodes = ImmutableMap.copyOf(builder.nodes);
    this.nullRefinedStates = nullRefined.build();
    this.refinedStates = refined.build();
  }

  /** Returns the items classified under {@code mode}, in order of appearance. */
  public ImmutableSet<Item> get(GlobalMode mode) {
    return sets.get(mode);
  }

  /** Returns the mode of {@code item}, or null if the item does not appear. */
  @Nullable
  public GlobalMode modeOf(Item item) {
    return modes.get(item);
  }

  /** Returns the node at which {@code item} was mentioned, or null if it does not appear. */
  @Nullable
  public Node nodeOf(Item item) {
    return nodes.get(item);
  }

  public boolean contains(Item item) {
    return modes.containsKey(item);
  }

  public boolean isEmpty() {
    return modes.isEmpty();
  }

  /** Returns all items, mode by mode in the order Input, Output, In_Out, Proof_In. */
  public ImmutableList<Item> getItems() {
    ImmutableList.Builder<Item> all = ImmutableList.builder();
    for (GlobalMode mode : GlobalMode.values()) {
      all.addAll(sets.get(mode));
    }
    return all.build();
  }

  /** Returns the states among the items whose visible refinement is null. */
  public ImmutableSet<AbstractState> getNullRefinedStates() {
    return nullRefinedStates;
  }

  /** Returns the states among the items that have a visible non-null refinement. */
  public ImmutableSet<AbstractState> getRefinedStates() {
    return refinedStates;
  }

  @Override
  public String toString() {
    List<String> parts = new ArrayList<>();
    for (GlobalMode mode : GlobalMode.values()) {
      ImmutableSet<Item> items = sets.get(mode);
      if (!items.isEmpty()) {
        parts.add(mode + " => (" + Joiner.on(", ").join(items) + ")");
      }
    }
    return parts.isEmpty() ? "null" : "(" + Joiner.on(", ").join(parts) + ")";
  }

  static Builder builder() {
    return new Builder();
  }

  /** Accumulates the items of a global list. */
  static final class Builder {
    private final Map<GlobalMode, Set<Item>> sets = new EnumMap<>(GlobalMode.class);
    private final Map<Item, GlobalMode> modes = new LinkedHashMap<>();
    private final Map<Item, Node> nodes = new LinkedHashMap<>();

    private Builder() {
      for (GlobalMode mode : GlobalMode.values()) {
        sets.put(mode, new LinkedHashSet<>());
      }
    }

    boolean contains(Item item) {
      return modes.containsKey(item);
    }

    @CanIgnoreReturnValue
    Builder add(GlobalMode mode, Item item, Node node) {
      Preconditions.checkArgument(!contains(item), "duplicate global item %s", item);
      sets.get(mode).add(item);
      modes.put(item, mode);
      nodes.put(item, node);
      return this;
    }

    ClassifiedGlobals build() {
      return new ClassifiedGlobals(this);
    }
  }
}
