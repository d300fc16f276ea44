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

import com.google.auto.value.AutoValue;
import javax.annotation.Nullable;
import net.flowrefine.java.syntax.DependencyRelation;
import net.flowrefine.java.syntax.GlobalRelation;

/**
 * The flow and global contracts attached to one declaration of a subprogram: either the abstract
 * Depends and Global of its specification, or the Refined_Depends and Refined_Global of its body.
 * Either may be absent.
 */
@AutoValue
public abstract class SubprogramContracts {

  @Nullable
  public abstract DependencyRelation depends();

  @Nullable
  public abstract GlobalRelation global();

  public static SubprogramContracts of(
      @Nullable DependencyRelation depends, @Nullable GlobalRelation global) {
    return new AutoValue_SubprogramContracts(depends, global);
  }

  public static SubprogramContracts ofDepends(DependencyRelation depends) {
    return of(depends, null);
  }

  public static SubprogramContracts ofGlobal(GlobalRelation global) {
    return of(null, global);
  }

  /** Returns the contracts of a declaration that has neither. */
  public static SubprogramContracts none() {
    return of(null, null);
  }

  public boolean isEmpty() {
    return depends() == null && global() == null;
  }
}
