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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Syntax node for a global list. It is one of:
 *
 * <ul>
 *   <li>{@code null};
 *   <li>an unmoded list of items, {@code X} or {@code (X, Y)}, whose mode is implied by context;
 *   <li>a moded list, {@code (Input => X, Output => (Y, Z))}, where each mode selects a nested
 *       global list.
 * </ul>
 */
public final class GlobalRelation extends Node {

  /** Kind of the relation. */
  public enum Kind {
    NULL,
    ITEMS,
    MODED,
  }

  /** Syntax node for one {@code Mode => List} association of a moded global list. */
  public static final class Moded extends Node {
    private final GlobalMode mode;
    private final GlobalRelation list;

    public Moded(Location location, GlobalMode mode, GlobalRelation list) {
      super(location);
      this.mode = Preconditions.checkNotNull(mode);
      this.list = Preconditions.checkNotNull(list);
    }

    public GlobalMode getMode() {
      return mode;
    }

    public GlobalRelation getList() {
      return list;
    }

    @Override
    public String toString() {
      return mode + " => " + list;
    }
  }

  private final Kind kind;
  @Nullable private final ContractExpression items;
  private final ImmutableList<Moded> moded;

  private GlobalRelation(
      Location location,
      Kind kind,
      @Nullable ContractExpression items,
      ImmutableList<Moded> moded) {
    super(location);
    this.kind = kind;
    this.items = items;
    this.moded = moded;
  }

  public static GlobalRelation nullRelation(Location location) {
    return new GlobalRelation(location, Kind.NULL, null, ImmutableList.of());
  }

  public static GlobalRelation items(Location location, ContractExpression items) {
    return new GlobalRelation(
        location, Kind.ITEMS, Preconditions.checkNotNull(items), ImmutableList.of());
  }

  public static GlobalRelation moded(Location location, List<Moded> moded) {
    return new GlobalRelation(location, Kind.MODED, null, ImmutableList.copyOf(moded));
  }

  public Kind kind() {
    return kind;
  }

  public boolean isNull() {
    return kind == Kind.NULL;
  }

  /** Returns the items of an unmoded list. */
  public ContractExpression getItems() {
    Preconditions.checkState(kind == Kind.ITEMS, "not an unmoded list: %s", this);
    return items;
  }

  /** Returns the associations of a moded list; empty for other kinds. */
  public ImmutableList<Moded> getModed() {
    return moded;
  }

  @Override
  public String toString() {
    return switch (kind) {
      case NULL -> "null";
      case ITEMS -> items.toString();
      case MODED -> "(" + Joiner.on(", ").join(moded) + ")";
    };
  }
}
