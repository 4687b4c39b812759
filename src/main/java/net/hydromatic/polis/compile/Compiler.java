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

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import net.hydromatic.polis.ast.PolicyAst.Atom;
import net.hydromatic.polis.ast.PolicyAst.Formula;
import net.hydromatic.polis.ast.PolicyAst.Rule;
import net.hydromatic.polis.theory.RuleTheory;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks and normalizes formulas on behalf of a theory.
 *
 * <p>A theory never decides by itself whether a formula is safe; it asks its
 * compiler, and reports whatever list of errors comes back.
 *
 * @see DatalogCompiler
 */
public interface Compiler {
  /**
   * Returns a formula equivalent to the given one whose rule body is ordered
   * so that every variable is bound before it is used in a negated literal.
   * Atoms are returned unchanged.
   *
   * @throws PolicyException if no such order exists
   */
  Formula reorderForSafety(Formula formula);

  /** Returns whether a formula is an atom. */
  boolean isAtom(Formula formula);

  /** Returns whether a formula is well-formed datalog. */
  boolean isDatalog(Formula formula);

  /**
   * Returns the errors that would arise from inserting a fact into theory
   * {@code theory}.
   *
   * @param atom Fact
   * @param theories Theories, keyed by name, against which table arities
   *     are checked
   * @param theory Name of the theory the fact is destined for
   */
  List<PolicyException> factErrors(
      Atom atom, Map<String, RuleTheory> theories, @Nullable String theory);

  /**
   * Returns the errors that would arise from inserting a rule into theory
   * {@code theory}.
   */
  List<PolicyException> ruleErrors(
      Rule rule, Map<String, RuleTheory> theories, @Nullable String theory);

  /**
   * Returns an error if the head of a rule belongs to another theory, unless
   * {@code permitHead} accepts the head.
   */
  List<PolicyException> ruleHeadHasNoTheory(
      Rule rule, Predicate<Atom> permitHead);
}

// End Compiler.java
