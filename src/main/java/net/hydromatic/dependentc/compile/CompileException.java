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
package net.hydromatic.dependentc.compile;

import static java.util.Objects.requireNonNull;

import net.hydromatic.dependentc.ast.Pos;

/**
 * Error that stops the checking of a declaration.
 *
 * <p>Unchecked, so that it can escape from visitors and shuttles.
 * {@link #toString()} gives the diagnostic in the conventional
 * "file:line:column: error: message" form.
 */
public class CompileException extends RuntimeException {
  /** Where the error was detected. */
  public final Pos pos;

  public CompileException(String message, Pos pos) {
    super(message);
    this.pos = requireNonNull(pos);
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    pos.describeTo(buf);
    return buf.append(": error: ").append(getMessage());
  }
}

// End CompileException.java
