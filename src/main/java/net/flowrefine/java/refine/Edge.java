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

import com.google.common.base.Preconditions;
import net.flowrefine.java.items.Item;
import net.flowrefine.java.syntax.Location;
import net.flowrefine.java.syntax.Node;

/**
 * An Edge is a normalized dependency: exactly one output depending on exactly one input. Either
 * side may be {@link Item#NULL}; an edge whose input is null records that its clause had an
 * explicitly empty input list.
 *
 * <p>Each edge remembers the node it was derived from, normally its {@code DependencyClause}, for
 * error reporting.
 */
public final class Edge {

  private final Item output;
  private final Item input;
  private final Node source;

  Edge(Item output, Item input, Node source) {
    this.output = Preconditions.checkNotNull(output);
    this.input = Preconditions.checkNotNull(input);
    this.source = Preconditions.checkNotNull(source);
  }

  public Item getOutput() {
    return output;
  }

  public Item getInput() {
    return input;
  }

  /** Returns the syntax node this edge was derived from. */
  public Node getSource() {
    return source;
  }

  public Location getLocation() {
    return source.getStartLocation();
  }

  public boolean hasNullInput() {
    return input.isNull();
  }

  @Override
  public String toString() {
    return output + " => " + input;
  }
}
