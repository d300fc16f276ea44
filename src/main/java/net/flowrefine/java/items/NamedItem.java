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
import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;

/**
 * An item declared in the source program and entered in an {@link ItemTable}: a {@link
 * Parameter}, a {@link DataObject} or an {@link AbstractState}.
 */
public abstract class NamedItem extends Item {

  private final int id;
  private final String name;
  private final ImmutableSet<ExternalProperty> externalProperties;

  // set by ItemTable when the enclosing state is refined
  @Nullable private AbstractState encapsulatingState;

  NamedItem(Kind kind, int id, String name, ImmutableSet<ExternalProperty> externalProperties) {
    super(kind);
    this.id = id;
    this.name = Preconditions.checkNotNull(name);
    this.externalProperties = externalProperties;
  }

  /** Returns the index of this item within its table, in order of declaration. */
  public int getId() {
    return id;
  }

  @Override
  public String getName() {
    return name;
  }

  /** Returns the external properties of this item; empty unless the item is external. */
  public ImmutableSet<ExternalProperty> getExternalProperties() {
    return externalProperties;
  }

  public boolean isExternal() {
    return !externalProperties.isEmpty();
  }

  /**
   * Returns the state whose refinement lists this item as a constituent, or null if the item is
   * not (yet) a constituent of any state.
   */
  @Nullable
  public AbstractState getEncapsulatingState() {
    return encapsulatingState;
  }

  void setEncapsulatingState(AbstractState state) {
    Preconditions.checkState(
        encapsulatingState == null,
        "%s is already a constituent of %s",
        getName(),
        encapsulatingState);
    this.encapsulatingState = state;
  }
}
