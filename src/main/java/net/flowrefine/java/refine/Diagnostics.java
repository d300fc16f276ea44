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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.flowrefine.java.items.Item;
import net.flowrefine.java.syntax.Diagnostic;
import net.flowrefine.java.syntax.DiagnosticKind;
import net.flowrefine.java.syntax.Location;
import net.flowrefine.java.syntax.Name;
import net.flowrefine.java.syntax.Node;

/**
 * Diagnostics is the sink into which one check reports the problems it finds. Each distinct
 * diagnostic is kept once, in order of first report.
 */
public final class Diagnostics {

  private final Set<Diagnostic> diagnostics = new LinkedHashSet<>();

  public Diagnostics() {}

  // Formats and reports an error at the start of the specified node.
  @FormatMethod
  void errorf(DiagnosticKind kind, Node node, String format, Object... args) {
    add(new Diagnostic(kind, node.getStartLocation(), String.format(format, args), null));
  }

  // Formats and reports an error about the given item at the start of the specified node.
  @FormatMethod
  void errorf(DiagnosticKind kind, Node node, Item subject, String format, Object... args) {
    add(
        new Diagnostic(
            kind, node.getStartLocation(), String.format(format, args), subject.getName()));
  }

  public void add(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }

  public void addAll(List<Diagnostic> list) {
    diagnostics.addAll(list);
  }

  public boolean isEmpty() {
    return diagnostics.isEmpty();
  }

  public int size() {
    return diagnostics.size();
  }

  public ImmutableList<Diagnostic> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  /**
   * Returns the item a name denotes, or throws the exception that aborts the current contract if
   * the name is unresolved.
   */
  static Item resolve(Name name) throws Diagnostic.Exception {
    Item item = name.getItem();
    if (item == null) {
      throw new Diagnostic.Exception(unresolved(name.getStartLocation(), name.getName()));
    }
    return item;
  }

  private static Diagnostic unresolved(Location loc, String name) {
    return new Diagnostic(
        DiagnosticKind.UNRESOLVED_REFERENCE,
        loc,
        String.format("name '%s' is not defined", name),
        name);
  }
}
