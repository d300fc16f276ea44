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
import java.util.Objects;

/** A Location denotes a position within a source file, for use in diagnostics. */
public final class Location implements Comparable<Location> {

  /** The location of contracts that have no source, such as those synthesized by the checker. */
  public static final Location BUILTIN = new Location("<builtin>", 0, 0);

  private final String file;
  private final int line;
  private final int column;

  private Location(String file, int line, int column) {
    this.file = Preconditions.checkNotNull(file);
    this.line = line;
    this.column = column;
  }

  /** Returns a location for the given file, 1-based line and 1-based column. */
  public static Location fromFileLineColumn(String file, int line, int column) {
    return new Location(file, line, column);
  }

  public String file() {
    return file;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  @Override
  public int compareTo(Location that) {
    int cmp = this.file.compareTo(that.file);
    if (cmp != 0) {
      return cmp;
    }
    cmp = Integer.compare(this.line, that.line);
    return cmp != 0 ? cmp : Integer.compare(this.column, that.column);
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof Location loc
        && this.file.equals(loc.file)
        && this.line == loc.line
        && this.column == loc.column;
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column);
  }

  /** Returns "file:line:col", omitting zero line and column. */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder(file);
    if (line != 0) {
      buf.append(':').append(line);
      if (column != 0) {
        buf.append(':').append(column);
      }
    }
    return buf.toString();
  }
}
