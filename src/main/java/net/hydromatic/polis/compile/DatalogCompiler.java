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

import static java.lang.String.format;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import net.hydromatic.polis.ast.PolicyAst.Atom;
import net.hydromatic.polis.ast.PolicyAst.Formula;
import net.hydromatic.polis.ast.PolicyAst.Literal;
import net.hydromatic.polis.ast.PolicyAst.Rule;
import net.hydromatic.polis.theory.RuleTheory;
import net.hydromatic.polis.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiler for plain datalog: atoms, and rules whose bodies are positive or
 * negated atoms.
 *
 * <p>A rule is safe if:
 *
 * <ul>
 *   <li>Each variable in the head appears in a positive body atom
 *   <li>Each variable in a negated body atom appears in a positive body atom
 * </ul>
 *
 * <p>A fact is valid if it is ground and belongs to no other theory.
 * Both facts and rules must agree with the arity that their theory already
 * has for each table they mention.
 */
public class DatalogCompiler implements Compiler {
  public static final DatalogCompiler INSTANCE = new DatalogCompiler();

  protected DatalogCompiler() {}

  @Override
  public boolean isAtom(Formula formula) {
    return formula instanceof Atom;
  }

  @Override
  public boolean isDatalog(Formula formula) {
    if (formula instanceof Atom) {
      return !((Atom) formula).table.isEmpty();
    }
    if (formula instanceof Rule) {
      final Rule rule = (Rule) formula;
      return !rule.head.table.isEmpty()
          && Static.allMatch(rule.body, literal -> !literal.table().isEmpty());
    }
    return false;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Positive literals keep their relative order. Each negated literal is
   * placed directly after the first positive literal at which all of its
   * variables are bound, and negated literals that are placed at the same
   * point keep their relative order.
   */
  @Override
  public Formula reorderForSafety(Formula formula) {
    if (!(formula instanceof Rule)) {
      return formula;
    }
    final Rule rule = (Rule) formula;
    final List<Literal> body = new ArrayList<>();
    final LinkedList<Literal> pending = new LinkedList<>();
    for (Literal literal : rule.body) {
      if (literal.negated) {
        pending.add(literal);
      }
    }
    final Set<String> bound = new HashSet<>();
    flush(pending, bound, body);
    for (Literal literal : rule.body) {
      if (!literal.negated) {
        body.add(literal);
        bound.addAll(literal.atom.variables());
        flush(pending, bound, body);
      }
    }
    if (!pending.isEmpty()) {
      throw new PolicyException(
          format(
              "Could not reorder rule for safety: %s; unbound literals %s",
              rule, pending),
          rule.pos);
    }
    if (body.equals(rule.body)) {
      return rule;
    }
    return new Rule(rule.head, body, rule.pos);
  }

  /** Moves each pending literal whose variables are all bound into body. */
  private static void flush(
      List<Literal> pending, Set<String> bound, List<Literal> body) {
    for (Iterator<Literal> i = pending.iterator(); i.hasNext(); ) {
      final Literal literal = i.next();
      if (bound.containsAll(literal.atom.variables())) {
        body.add(literal);
        i.remove();
      }
    }
  }

  @Override
  public List<PolicyException> factErrors(
      Atom atom, Map<String, RuleTheory> theories, @Nullable String theory) {
    final ImmutableList.Builder<PolicyException> errors =
        ImmutableList.builder();
    if (!atom.isGround()) {
      errors.add(
          new PolicyException(
              format("Fact is not ground: %s", atom), atom.pos));
    }
    if (atom.theory != null) {
      errors.add(
          new PolicyException(
              format("Fact may not belong to another theory: %s", atom),
              atom.pos));
    }
    checkArity(atom, theories, theory, errors);
    return errors.build();
  }

  @Override
  public List<PolicyException> ruleErrors(
      Rule rule, Map<String, RuleTheory> theories, @Nullable String theory) {
    final ImmutableList.Builder<PolicyException> errors =
        ImmutableList.builder();
    checkSafety(rule, errors);
    errors.addAll(ruleHeadHasNoTheory(rule, head -> false));
    checkArity(rule.head, theories, theory, errors);
    for (Literal literal : rule.body) {
      checkArity(literal.atom, theories, theory, errors);
    }
    return errors.build();
  }

  @Override
  public List<PolicyException> ruleHeadHasNoTheory(
      Rule rule, Predicate<Atom> permitHead) {
    if (rule.head.theory != null && !permitHead.test(rule.head)) {
      return ImmutableList.of(
          new PolicyException(
              format(
                  "Rule head may not belong to another theory: %s", rule.head),
              rule.pos));
    }
    return ImmutableList.of();
  }

  /** Checks that every variable in the rule is bound by a positive literal. */
  private static void checkSafety(
      Rule rule, ImmutableList.Builder<PolicyException> errors) {
    final Set<String> groundedVars = new HashSet<>();
    for (Literal literal : rule.body) {
      if (!literal.negated) {
        groundedVars.addAll(literal.atom.variables());
      }
    }

    for (String varName : rule.head.variables()) {
      if (!groundedVars.contains(varName)) {
        errors.add(
            new PolicyException(
                format(
                    "Rule is unsafe. Variable '%s' in head does not appear"
                        + " in positive body atom: %s",
                    varName, rule),
                rule.pos));
      }
    }

    for (Literal literal : rule.body) {
      if (literal.negated) {
        for (String varName : literal.atom.variables()) {
          if (!groundedVars.contains(varName)) {
            errors.add(
                new PolicyException(
                    format(
                        "Rule is unsafe. Variable '%s' in negated atom does"
                            + " not appear in positive body atom: %s",
                        varName, rule),
                    rule.pos));
          }
        }
      }
    }
  }

  /**
   * Checks that an atom has the arity that its theory already has for its
   * table. The theory is the atom's qualifier if it has one, otherwise the
   * theory the formula is destined for.
   */
  private static void checkArity(
      Atom atom,
      Map<String, RuleTheory> theories,
      @Nullable String theoryName,
      ImmutableList.Builder<PolicyException> errors) {
    final String target = atom.theory != null ? atom.theory : theoryName;
    if (target == null) {
      return;
    }
    final RuleTheory theory = theories.get(target);
    if (theory == null) {
      return;
    }
    final Integer arity = theory.arity(atom.table);
    if (arity != null && arity != atom.arity()) {
      errors.add(
          new PolicyException(
              format(
                  "Atom %s/%d does not match arity %d of table %s in theory %s",
                  atom.table, atom.arity(), arity, atom.table, target),
              atom.pos));
    }
  }
}

// End DatalogCompiler.java
