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

import java.util.List;
import java.util.Set;
import net.hydromatic.polis.ast.PolicyAst.Rule;

/** Called on various events while a theory changes. */
public interface Tracer {
  /** Called when a rule has been added to a theory. */
  void onInsert(RuleTheory theory, Rule rule);

  /** Called when a rule has been removed from a theory. */
  void onDelete(RuleTheory theory, Rule rule);

  /**
   * Called after a changeset has been applied, with the events that were
   * requested and the events that changed the theory.
   */
  void onUpdate(RuleTheory theory, List<Event> events, List<Event> changes);

  /** Called after tables have been loaded in bulk. */
  void onInitialize(RuleTheory theory, Set<String> tables, int factCount);

  /**
   * Called with the exception that aborted a changeset. Returns whether a
   * handler was found. The exception is rethrown regardless.
   */
  boolean onException(RuleTheory theory, Throwable e);
}

// End Tracer.java
