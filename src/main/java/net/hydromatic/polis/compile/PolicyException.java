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
package net.hydromatic.polis.compile;

import static java.util.Objects.requireNonNull;

import net.hydromatic.polis.ast.Pos;

/**
 * Error in a policy formula.
 *
 * <p>Validation returns these in a list; they are only thrown when a formula
 * cannot be processed at all, for example if its body cannot be reordered so
 * that every variable is bound before use.
 */
public class PolicyException extends RuntimeException {
  private final Pos pos;

  public PolicyException(String message, Pos pos) {
    super(message);
    this.pos = requireNonNull(pos);
  }

  public PolicyException(String message) {
    this(message, Pos.ZERO);
  }

  @Override
  public String toString() {
    return pos.equals(Pos.ZERO)
        ? super.toString()
        : super.toString() + " at " + pos;
  }

  public Pos pos() {
    return pos;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }
}

// End PolicyException.java
