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

/**
 * Syntax node for one clause of a flow relation, {@code Outputs => Inputs}, or {@code Outputs =>+
 * Inputs} when each output also depends on itself.
 */
public final class DependencyClause extends Node {

  private final ContractExpression outputs;
  private final ContractExpression inputs;
  private final boolean selfDependent;

  public DependencyClause(
      Location location,
      ContractExpression outputs,
      ContractExpression inputs,
      boolean selfDependent) {
    super(location);
    this.outputs = Preconditions.checkNotNull(outputs);
    this.inputs = Preconditions.checkNotNull(inputs);
    this.selfDependent = selfDependent;
  }

  public ContractExpression getOutputs() {
    return outputs;
  }

  public ContractExpression getInputs() {
    return inputs;
  }

  /** Reports whether the clause uses the {@code =>+} shorthand. */
  public boolean isSelfDependent() {
    return selfDependent;
  }

  @Override
  public String toString() {
    return outputs + (selfDependent ? " =>+ " : " => ") + inputs;
  }
}
