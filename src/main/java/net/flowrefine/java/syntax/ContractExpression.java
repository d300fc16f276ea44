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

/**
 * Base class for the expressions of a contract: {@code null}, a name, or a parenthesized
 * aggregate of expressions.
 *
 * <p>The tree permits shapes that no contract allows, such as nested aggregates or {@code null}
 * inside an aggregate; the checker reports those rather than the parser.
 */
public abstract class ContractExpression extends Node {

  /**
   * Kind of the expression. This is similar to using instanceof, except that it can be used in a
   * switch/case.
   */
  public enum Kind {
    NULL,
    NAME,
    AGGREGATE,
  }

  private final Kind kind;

  ContractExpression(Location location, Kind kind) {
    super(location);
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }
}
