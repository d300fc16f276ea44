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

/**
 * CheckerOptions is a set of options that affect how strictly a {@link RefinementChecker} reads
 * the contracts it checks, analogous to the command-line options of a typical compiler.
 *
 * <p>The {@link #DEFAULT} options represent the desired behavior for new uses of the checker.
 */
@AutoValue
public abstract class CheckerOptions {

  /** The default options for refinement checking. New clients should use these defaults. */
  public static final CheckerOptions DEFAULT = builder().build();

  /**
   * When the abstract Global contract names an output that the abstract Depends contract leaves
   * out, treat that output as depending on every input of the Global contract before matching the
   * Refined_Depends contract.
   */
  public abstract boolean completeDependsFromGlobal();

  /**
   * Report a refinement of a subprogram whose abstract contracts mention no state with a visible
   * refinement as useless, and check it no further.
   */
  public abstract boolean requireVisibleRefinement();

  /**
   * Leave unreported a refined dependence with a null input that no abstract dependence accounts
   * for. Such a dependence only records that its clause lists no inputs.
   */
  public abstract boolean tolerateNullInputRefinements();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_CheckerOptions.Builder()
        .completeDependsFromGlobal(true)
        .requireVisibleRefinement(false)
        .tolerateNullInputRefinements(true);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link CheckerOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder completeDependsFromGlobal(boolean value);

    public abstract Builder requireVisibleRefinement(boolean value);

    public abstract Builder tolerateNullInputRefinements(boolean value);

    public abstract CheckerOptions build();
  }
}
