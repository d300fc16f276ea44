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

/** The kinds of problem the refinement checker reports. */
public enum DiagnosticKind {
  /** A clause or list has a shape no contract allows. */
  MALFORMED_RELATION,
  /** {@code null =>+ ...}: null cannot depend on itself. */
  USELESS_SELF_DEPENDENCY,
  /** An item is an output of more than one clause of a flow relation. */
  DUPLICATE_OUTPUT,
  /** An item is listed more than once among the inputs of a clause. */
  DUPLICATE_INPUT,
  /** An item appears more than once in a global list. */
  DUPLICATE_GLOBAL_ITEM,
  /** A constant appears with a mode that writes it. */
  ILLEGAL_CONSTANT_MODE,
  /** An abstract dependency has no counterpart in the refined flow relation. */
  MISSING_REFINEMENT,
  /** A refined dependency is not justified by any abstract dependency. */
  EXTRA_OR_UNMATCHED_REFINEMENT,
  /** A constituent of a state appears with a mode that the state's mode forbids. */
  WRONG_CONSTITUENT_MODE,
  /** A constituent that the state's mode requires is absent. */
  MISSING_CONSTITUENT,
  /** The constituents of an In_Out state are neither read nor written as the state is. */
  INCONSISTENT_MODE_REFINEMENT,
  /** A plain global item changes mode in the refinement. */
  INCONSISTENT_ITEM_MODE,
  /** A plain global item of the abstract contract is absent from the refinement. */
  MISSING_GLOBAL_ITEM,
  /** A plain global item appears only in the refinement. */
  EXTRA_GLOBAL_ITEM,
  /** A constituent of a state that the abstract contract does not mention. */
  EXTRA_CONSTITUENT,
  /** A refinement was supplied where there is nothing to refine. */
  USELESS_REFINEMENT,
  /** A state and one of its constituents appear in the same relation. */
  CANNOT_MENTION_STATE_AND_CONSTITUENT_TOGETHER,
  /** A name in a contract could not be resolved; checking of that contract stops. */
  UNRESOLVED_REFERENCE,
  /** A state is refined more than once. */
  DUPLICATE_STATE_REFINEMENT,
  /** An item is a constituent of more than one state, or twice of the same state. */
  DUPLICATE_CONSTITUENT,
  /** An abstract state of a package has no refinement. */
  UNREFINED_STATE,
  /** The external properties of a state and its constituents disagree. */
  EXTERNAL_PROPERTY_MISMATCH,
}
