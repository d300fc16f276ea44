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

/**
 * An Item is the resolved meaning of a name occurring in a flow or global contract: a parameter,
 * an object, an abstract state, the function result, or {@code null}.
 *
 * <p>Items are owned by an {@link ItemTable} and compared by identity. The two special items
 * {@link #NULL} and {@link #FUNCTION_RESULT} are singletons.
 */
public abstract class Item {

  /**
   * Kind of the item. This is similar to using instanceof, except that it can be used in a
   * switch/case.
   */
  public enum Kind {
    NULL,
    FUNCTION_RESULT,
    PARAMETER,
    OBJECT,
    STATE,
  }

  /** The {@code null} item: no output, or no input. */
  public static final Item NULL = new Special(Kind.NULL, "null");

  /** The pseudo-item denoting the result of the function whose contract is being checked. */
  public static final Item FUNCTION_RESULT = new Special(Kind.FUNCTION_RESULT, "'Result");

  private final Kind kind;

  Item(Kind kind) {
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  /** Returns the name of the item, as it should appear in diagnostics. */
  public abstract String getName();

  public final boolean isNull() {
    return kind == Kind.NULL;
  }

  public final boolean isState() {
    return kind == Kind.STATE;
  }

  /**
   * Reports whether this item is an abstract state whose refinement is currently visible, either
   * as null or as a list of constituents.
   */
  public boolean hasVisibleRefinement() {
    return false;
  }

  @Override
  public String toString() {
    return getName();
  }

  private static final class Special extends Item {
    private final String name;

    private Special(Kind kind, String name) {
      super(kind);
      this.name = name;
    }

    @Override
    public String getName() {
      return name;
    }
  }
}
