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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A Diagnostic describes a violation found by the refinement checker: its kind, the location of
 * the offending node, a message, and optionally the name of the state or item concerned.
 *
 * <p>Diagnostics are values: two diagnostics with the same kind, location and message are equal.
 */
public final class Diagnostic {

  private final DiagnosticKind kind;
  private final Location location;
  private final String message;
  @Nullable private final String subject;

  public Diagnostic(
      DiagnosticKind kind, Location location, String message, @Nullable String subject) {
    this.kind = Preconditions.checkNotNull(kind);
    this.location = Preconditions.checkNotNull(location);
    this.message = Preconditions.checkNotNull(message);
    this.subject = subject;
  }

  public DiagnosticKind kind() {
    return kind;
  }

  public Location location() {
    return location;
  }

  public String message() {
    return message;
  }

  /** Returns the name of the state or item the diagnostic is about, if any. */
  @Nullable
  public String subject() {
    return subject;
  }

  /** Returns a string of the form {@code "file:line:col: message"}. */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof Diagnostic d
        && kind == d.kind
        && location.equals(d.location)
        && message.equals(d.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, location, message);
  }

  /**
   * A Diagnostic.Exception aborts the checking of one contract. It carries the diagnostics that
   * explain why.
   */
  public static final class Exception extends java.lang.Exception {

    private final ImmutableList<Diagnostic> diagnostics;

    public Exception(List<Diagnostic> diagnostics) {
      super(messageOf(diagnostics));
      Preconditions.checkArgument(!diagnostics.isEmpty());
      this.diagnostics = ImmutableList.copyOf(diagnostics);
    }

    public Exception(Diagnostic diagnostic) {
      this(ImmutableList.of(diagnostic));
    }

    private static String messageOf(List<Diagnostic> diagnostics) {
      return diagnostics.isEmpty() ? "" : Joiner.on("\n").join(diagnostics);
    }

    /** Returns the diagnostics, which are never empty. */
    public ImmutableList<Diagnostic> diagnostics() {
      return diagnostics;
    }
  }
}
