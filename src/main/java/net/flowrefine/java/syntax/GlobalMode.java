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

import javax.annotation.Nullable;

/** The access mode of a global item. */
public enum GlobalMode {
  INPUT("Input"),
  OUTPUT("Output"),
  IN_OUT("In_Out"),
  PROOF_IN("Proof_In");

  private final String keyword;

  GlobalMode(String keyword) {
    this.keyword = keyword;
  }

  /** Returns the mode whose keyword is {@code keyword}, ignoring case, or null. */
  @Nullable
  public static GlobalMode fromKeyword(String keyword) {
    for (GlobalMode mode : values()) {
      if (mode.keyword.equalsIgnoreCase(keyword)) {
        return mode;
      }
    }
    return null;
  }

  /** Reports whether items of this mode may be written. */
  public boolean isWritable() {
    return this == OUTPUT || this == IN_OUT;
  }

  @Override
  public String toString() {
    return keyword;
  }
}
