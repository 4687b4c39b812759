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

/**
 * Theories: stores of datalog rules and facts, indexed by table.
 *
 * <h2>Key Classes</h2>
 *
 * <ul>
 *   <li>{@link net.hydromatic.polis.theory.RuleTheory} - A named collection of
 *       rules. Applies changesets of {@link net.hydromatic.polis.theory.Event
 *       events}, answers the lookups a top-down evaluator needs, and replaces
 *       whole tables of facts in bulk.
 *   <li>{@link net.hydromatic.polis.theory.RuleTheories} - Creates theories.
 *       A theory is nonrecursive, action or unsafe; the kinds differ only in
 *       which changesets they accept.
 *   <li>{@link net.hydromatic.polis.theory.UpdateValidator} - Decides which
 *       changesets a theory accepts.
 *   <li>{@link net.hydromatic.polis.theory.RuleSet} - Index from table name to
 *       rules, with argument indexes on facts.
 *   <li>{@link net.hydromatic.polis.theory.Tracer} - Callbacks on each change
 *       to a theory.
 *   <li>{@link net.hydromatic.polis.theory.Prop} - Settings of theories and
 *       graphs.
 * </ul>
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * Map<String, RuleTheory> theories = new HashMap<>();
 * RuleTheory theory =
 *     RuleTheories.builder().name("classification").theories(theories)
 *         .build(TheoryKind.NONRECURSIVE);
 * theories.put("classification", theory);
 *
 * List<Event> events = ImmutableList.of(Event.insert(rule));
 * if (theory.updateWouldCauseErrors(events).isEmpty()) {
 *   theory.update(events);
 * }
 * }</pre>
 */
package net.hydromatic.polis.theory;

// End package-info.java
