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

package net.flowrefine.java.syntax;

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;
import net.flowrefine.java.items.Item;

/**
 * Syntax node for a name occurring in a contract, together with the item it resolved to. An
 * unresolved name has a null item.
 */
public final class Name extends ContractExpression {

  private final String name;
  @Nullable private final Item item;

  public Name(Location location, String name, @Nullable Item item) {
    super(location, Kind.NAME);
    this.name = Preconditions.checkNotNull(name);
    this.item = item;
  }

  /** Returns a resolved name that spells the item's own name. */
  public static Name of(Location location, Item item) {
    return new Name(location, item.getName(), item);
  }

  public String getName() {
    return name;
  }

  /** Returns the item this name denotes, or null if name resolution failed. */
  @Nullable
  public Item getItem() {
    return item;
  }

  @Override
  public String toString() {
    return name;
  }
}
