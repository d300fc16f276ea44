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
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Syntax node for a parenthesized list of expressions, such as {@code (X, Y)}. */
public final class Aggregate extends ContractExpression {

  private final ImmutableList<ContractExpression> elements;

  public Aggregate(Location location, List<? extends ContractExpression> elements) {
    super(location, Kind.AGGREGATE);
    this.elements = ImmutableList.copyOf(elements);
  }

  public ImmutableList<ContractExpression> getElements() {
    return elements;
  }

  @Override
  public String toString() {
    return "(" + Joiner.on(", ").join(elements) + ")";
  }
}
