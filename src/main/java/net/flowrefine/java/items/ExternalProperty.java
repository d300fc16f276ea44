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
 * The properties of external (volatile) states and objects that are visible to the environment
 * outside the program.
 */
public enum ExternalProperty {
  /** The environment may read the item at any time. */
  ASYNC_READERS("Async_Readers"),
  /** The environment may write the item at any time. */
  ASYNC_WRITERS("Async_Writers"),
  /** Every read of the item is significant. */
  EFFECTIVE_READS("Effective_Reads"),
  /** Every write of the item is significant. */
  EFFECTIVE_WRITES("Effective_Writes");

  private final String displayName;

  ExternalProperty(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
