/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.dependentc.ast;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Location in a source file where a node starts.
 *
 * <p>Positions take no part in the meaning of a program: node equality
 * ignores them, and the checker only copies them into diagnostics. A node
 * that the substituter or evaluator builds takes the position of the node it
 * replaces; a node built without a source has {@link #ZERO}.
 */
public class Pos {
  /** Position of a node that has no source. */
  public static final Pos ZERO = new Pos("", 0, 0);

  public final String file;
  /** One-based line, or 0 if unknown. */
  public final int line;
  /** One-based column, or 0 if unknown. */
  public final int column;

  public Pos(String file, int line, int column) {
    this.file = requireNonNull(file);
    this.line = line;
    this.column = column;
  }

  @Override public int hashCode() {
    return Objects.hash(file, line, column);
  }

  @Override public boolean equals(Object o) {
    if (!(o instanceof Pos)) {
      return false;
    }
    final Pos that = (Pos) o;
    return line == that.line
        && column == that.column
        && file.equals(that.file);
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes this position in the form "file:line:column", omitting the file
   * if it is empty. */
  public StringBuilder describeTo(StringBuilder buf) {
    if (!file.isEmpty()) {
      buf.append(file).append(':');
    }
    return buf.append(line).append(':').append(column);
  }
}

// End Pos.java
