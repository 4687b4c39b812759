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

import static java.lang.String.format;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.polis.ast.PolicyAst.Atom;
import net.hydromatic.polis.ast.PolicyAst.Formula;
import net.hydromatic.polis.ast.PolicyAst.Rule;
import net.hydromatic.polis.compile.Compiler;
import net.hydromatic.polis.compile.PolicyException;

/** Implementations of {@link UpdateValidator}. */
public abstract class UpdateValidators {
  private UpdateValidators() {}

  /**
   * Returns the validator of a nonrecursive theory. Facts and rules get the
   * compiler's full checks.
   *
   * <p>Does not check that rules are non-recursive; whoever owns the theories
   * does that, with a {@link net.hydromatic.polis.graph.RuleDependencyGraph},
   * because recursion can span theories.
   */
  public static UpdateValidator nonrecursive() {
    return Nonrecursive.INSTANCE;
  }

  /**
   * Returns the validator of an action theory. Facts get the full checks;
   * rules are only checked for a head that belongs to another theory, which
   * is allowed if the head is an update ({@code t+} or {@code t-}).
   *
   * <p>Negation safety is not checked. Some action tables are only defined
   * for certain bound arguments, and the check would reject rules that use
   * them correctly.
   */
  public static UpdateValidator action() {
    return Action.INSTANCE;
  }

  /** Returns a validator that accepts every changeset. */
  public static UpdateValidator unsafe() {
    return (theory, events) -> ImmutableList.of();
  }

  /** Validator that checks facts fully and delegates rules. */
  private abstract static class FormulaValidator implements UpdateValidator {
    @Override
    public List<PolicyException> updateWouldCauseErrors(
        RuleTheory theory, List<Event> events) {
      final Compiler compiler = theory.compiler();
      final ImmutableList.Builder<PolicyException> errors =
          ImmutableList.builder();
      for (Event event : events) {
        final Formula formula = event.formula;
        if (!compiler.isDatalog(formula)) {
          errors.add(
              new PolicyException(
                  format("Non-formula found: %s", formula), formula.pos()));
        } else if (compiler.isAtom(formula)) {
          errors.addAll(
              compiler.factErrors(
                  (Atom) formula, theory.theories(), theory.name()));
        } else {
          errors.addAll(ruleErrors(theory, compiler, (Rule) formula));
        }
      }
      return errors.build();
    }

    abstract List<PolicyException> ruleErrors(
        RuleTheory theory, Compiler compiler, Rule rule);
  }

  /** Validator of a nonrecursive theory. */
  private static class Nonrecursive extends FormulaValidator {
    static final UpdateValidator INSTANCE = new Nonrecursive();

    @Override
    List<PolicyException> ruleErrors(
        RuleTheory theory, Compiler compiler, Rule rule) {
      return compiler.ruleErrors(rule, theory.theories(), theory.name());
    }
  }

  /** Validator of an action theory. */
  private static class Action extends FormulaValidator {
    static final UpdateValidator INSTANCE = new Action();

    @Override
    List<PolicyException> ruleErrors(
        RuleTheory theory, Compiler compiler, Rule rule) {
      return compiler.ruleHeadHasNoTheory(rule, Atom::isUpdate);
    }
  }
}

// End UpdateValidators.java
