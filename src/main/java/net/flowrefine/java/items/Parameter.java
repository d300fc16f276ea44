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

import com.google.common.collect.ImmutableSet;

/** A formal parameter of the subprogram whose contract is being checked. */
public final class Parameter extends NamedItem {

  /** The mode of a formal parameter. */
  public enum Role {
    IN,
    OUT,
    IN_OUT,
    GENERIC_IN,
    GENERIC_IN_OUT;

    @Override
    public String toString() {
      return super.toString().toLowerCase().replace('_', ' ');
    }
  }

  private final Role role;

  Parameter(int id, String name, Role role) {
    super(Kind.PARAMETER, id, name, ImmutableSet.of());
    this.role = role;
  }

  public Role getRole() {
    return role;
  }
}
