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
package net.hydromatic.polis.theory;

import static java.util.Objects.requireNonNull;

import net.hydromatic.polis.ast.PolicyAst.Formula;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Request to insert a formula into, or delete it from, a theory. */
public class Event {
  public final Formula formula;
  public final boolean insert;

  public Event(Formula formula, boolean insert) {
    this.formula = requireNonNull(formula);
    this.insert = insert;
  }

  /** Creates an event that inserts a formula. */
  public static Event insert(Formula formula) {
    return new Event(formula, true);
  }

  /** Creates an event that deletes a formula. */
  public static Event delete(Formula formula) {
    return new Event(formula, false);
  }

  @Override
  public String toString() {
    return (insert ? "+" : "-") + formula;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return this == o
        || o instanceof Event
            && insert == ((Event) o).insert
            && formula.equals(((Event) o).formula);
  }

  @Override
  public int hashCode() {
    return formula.hashCode() * 2 + (insert ? 1 : 0);
  }
}

// End Event.java
