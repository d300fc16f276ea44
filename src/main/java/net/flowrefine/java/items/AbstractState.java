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
import javax.annotation.Nullable;

/**
 * An abstract state: a named abstraction over hidden objects and states of a package.
 *
 * <p>A state starts out with no visible refinement. Once the compiler has elaborated the state's
 * refinement, it becomes either a null refinement or an ordered list of constituents. The
 * transition happens at most once, through {@link ItemTable#refine} or {@link
 * ItemTable#refineToNull}, and is never undone.
 */
public final class AbstractState extends NamedItem {

  /** The refinement of a state, as currently visible. */
  public enum Refinement {
    NONE,
    NULL,
    NON_NULL
  }

  private Refinement refinement = Refinement.NONE;
  private ImmutableList<NamedItem> constituents = ImmutableList.of();

  AbstractState(int id, String name, ImmutableSet<ExternalProperty> externalProperties) {
    super(Kind.STATE, id, name, externalProperties);
  }

  public Refinement getRefinement() {
    return refinement;
  }

  @Override
  public boolean hasVisibleRefinement() {
    return refinement != Refinement.NONE;
  }

  public boolean hasNullRefinement() {
    return refinement == Refinement.NULL;
  }

  public boolean hasNonNullRefinement() {
    return refinement == Refinement.NON_NULL;
  }

  /** Returns the constituents of this state, in the order of the refinement. */
  public ImmutableList<NamedItem> getConstituents() {
    return constituents;
  }

  /** Reports whether {@code item} is one of the constituents listed by this state's refinement. */
  public boolean hasConstituent(@Nullable Item item) {
    return item instanceof NamedItem named && named.getEncapsulatingState() == this;
  }

  /**
   * Reports whether {@code item} is a constituent of this state at any depth, following the
   * encapsulating-state links of nested refinements.
   */
  public boolean encloses(@Nullable Item item) {
    if (!(item instanceof NamedItem named)) {
      return false;
    }
    for (AbstractState s = named.getEncapsulatingState();
        s != null;
        s = s.getEncapsulatingState()) {
      if (s == this) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the constituent of this state that is, or encloses, {@code item}, or null if this
   * state does not enclose the item.
   */
  @Nullable
  public NamedItem constituentFor(Item item) {
    if (!(item instanceof NamedItem named)) {
      return null;
    }
    for (NamedItem x = named; x.getEncapsulatingState() != null; x = x.getEncapsulatingState()) {
      if (x.getEncapsulatingState() == this) {
        return x;
      }
    }
    return null;
  }

  void setRefinement(Refinement refinement, ImmutableList<NamedItem> constituents) {
    Preconditions.checkState(
        this.refinement == Refinement.NONE, "state %s is already refined", getName());
    Preconditions.checkArgument(refinement != Refinement.NONE);
    Preconditions.checkArgument(
        (refinement == Refinement.NULL) == constituents.isEmpty(),
        "a null refinement has no constituents");
    this.refinement = refinement;
    this.constituents = constituents;
  }
}
