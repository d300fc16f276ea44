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

/** A Node is a node in the syntax tree of a contract. */
public abstract class Node {

  private final Location location;

  Node(Location location) {
    this.location = Preconditions.checkNotNull(location);
  }

  /** Returns the location of the start of this node. */
  public final Location getStartLocation() {
    return location;
  }
}
