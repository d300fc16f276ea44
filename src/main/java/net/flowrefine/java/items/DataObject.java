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

/** A variable or constant. */
public final class DataObject extends NamedItem {

  /** Discriminates variables from constants. */
  public enum ObjectKind {
    VARIABLE,
    CONSTANT
  }

  private final ObjectKind objectKind;

  DataObject(
      int id, String name, ObjectKind objectKind, ImmutableSet<ExternalProperty> externalProperties) {
    super(Kind.OBJECT, id, name, externalProperties);
    this.objectKind = objectKind;
  }

  public ObjectKind getObjectKind() {
    return objectKind;
  }

  public boolean isConstant() {
    return objectKind == ObjectKind.CONSTANT;
  }
}
