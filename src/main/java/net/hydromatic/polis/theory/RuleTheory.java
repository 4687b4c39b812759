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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.polis.ast.PolicyAst.Atom;
import net.hydromatic.polis.ast.PolicyAst.Formula;
import net.hydromatic.polis.ast.PolicyAst.Literal;
import net.hydromatic.polis.ast.PolicyAst.Rule;
import net.hydromatic.polis.compile.Compiler;
import net.hydromatic.polis.compile.PolicyException;
import net.hydromatic.polis.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collection of rules and facts, indexed by the table of each rule's head.
 *
 * <p>All changes are made by the caller, synchronously; a theory has no
 * internal locking, and assumes that calls that modify it are not made
 * concurrently.
 *
 * <p>A changeset is applied event by event. If an event fails, {@link
 * #update} throws, and the events before it remain applied. Callers that need
 * all or nothing should first call {@link #updateWouldCauseErrors}.
 *
 * <p>The kinds of theory differ only in their {@link UpdateValidator}; create
 * them using {@link RuleTheories}.
 */
public class RuleTheory {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(RuleTheory.class);

  private final @Nullable String name;
  private final @Nullable String abbr;
  private final TheoryKind kind;
  private final UpdateValidator validator;
  private final Compiler compiler;
  private final Map<String, RuleTheory> theories;
  private final Tracer tracer;
  private final boolean reorderForSafety;
  private final int eventLogLimit;

  private final RuleSet rules = new RuleSet();

  RuleTheory(
      @Nullable String name,
      @Nullable String abbr,
      TheoryKind kind,
      UpdateValidator validator,
      Compiler compiler,
      Map<String, RuleTheory> theories,
      Tracer tracer,
      Map<Prop, Object> props) {
    this.name = name;
    this.abbr = abbr;
    this.kind = requireNonNull(kind);
    this.validator = requireNonNull(validator);
    this.compiler = requireNonNull(compiler);
    this.theories = requireNonNull(theories);
    this.tracer = requireNonNull(tracer);
    this.reorderForSafety = Prop.REORDER_FOR_SAFETY.booleanValue(props);
    this.eventLogLimit = Prop.EVENT_LOG_LIMIT.intValue(props);
  }

  @Override
  public String toString() {
    return kind.lowerName + " theory " + (name == null ? "<anonymous>" : name);
  }

  public @Nullable String name() {
    return name;
  }

  public @Nullable String abbr() {
    return abbr;
  }

  public TheoryKind kind() {
    return kind;
  }

  /** Returns the compiler that checks and reorders formulas. */
  public Compiler compiler() {
    return compiler;
  }

  /**
   * Returns the registry of theories, by name, that this theory checks its
   * formulas against. It usually contains this theory.
   */
  public Map<String, RuleTheory> theories() {
    return Collections.unmodifiableMap(theories);
  }

  // External interface

  /**
   * Applies a changeset, and returns the events that changed the theory.
   *
   * <p>Inserting a rule that is already present, or deleting one that is
   * absent, changes nothing, and the event is not returned.
   *
   * <p>If an event throws, the remaining events are not applied, and the
   * exception propagates; events before it stay applied.
   */
  public List<Event> update(List<Event> events) {
    LOGGER.debug(
        "{}: update {}", this, Static.abbreviate(events, eventLogLimit));
    final ImmutableList.Builder<Event> changes = ImmutableList.builder();
    try {
      for (Event event : events) {
        final Rule rule = toRule(reorder(event.formula));
        if (event.insert ? insertActual(rule) : deleteActual(rule)) {
          changes.add(event);
        }
      }
    } catch (RuntimeException e) {
      LOGGER.error(
          "{}: update failed; earlier events of the changeset remain applied",
          this,
          e);
      tracer.onException(this, e);
      throw e;
    }
    final List<Event> changeList = changes.build();
    tracer.onUpdate(this, events, changeList);
    return changeList;
  }

  /** Inserts a formula; returns it if it changed the theory. */
  public List<Formula> insert(Formula formula) {
    return formulas(update(ImmutableList.of(Event.insert(formula))));
  }

  /** Deletes a formula; returns it if it changed the theory. */
  public List<Formula> delete(Formula formula) {
    return formulas(update(ImmutableList.of(Event.delete(formula))));
  }

  private static List<Formula> formulas(List<Event> events) {
    return Static.transformEager(events, event -> event.formula);
  }

  /**
   * Returns the errors that applying a changeset would cause. Does not modify
   * the theory.
   *
   * <p>Does not check whether the changeset would make rules recursive.
   */
  public List<PolicyException> updateWouldCauseErrors(List<Event> events) {
    LOGGER.debug(
        "{}: updateWouldCauseErrors {}",
        this,
        Static.abbreviate(events, eventLogLimit));
    return validator.updateWouldCauseErrors(this, events);
  }

  /** Replaces the contents of this theory with the given formulas. */
  public List<Event> define(Iterable<? extends Formula> formulas) {
    empty();
    final ImmutableList.Builder<Event> events = ImmutableList.builder();
    for (Formula formula : formulas) {
      events.add(Event.insert(formula));
    }
    return update(events.build());
  }

  /** Deletes every rule. */
  public void empty() {
    rules.clear();
  }

  /** Deletes every rule that defines one of the given tables. */
  public void empty(Collection<String> tablenames) {
    empty(tablenames, false);
  }

  /**
   * Deletes every rule that defines one of the given tables, or, if {@code
   * invert}, every rule that defines any other table.
   */
  public void empty(Collection<String> tablenames, boolean invert) {
    final Collection<String> toClear;
    if (invert) {
      final Set<String> keep = ImmutableSet.copyOf(tablenames);
      toClear =
          Static.filterEager(
              definedTablenames(), table -> !keep.contains(table));
    } else {
      toClear = tablenames;
    }
    for (String table : toClear) {
      rules.clearTable(table);
    }
  }

  /** Returns all rules except facts. */
  public List<Rule> policy() {
    return Static.filterEager(content(), rule -> !rule.isFact());
  }

  /**
   * Replaces the contents of tables with facts, typically a snapshot from a
   * data source.
   *
   * <p>Clears each table in {@code tablenames}, then inserts each fact. A
   * fact whose table is not in {@code tablenames} clears that table before
   * the first such fact is inserted. Facts are not validated.
   */
  public void initializeTables(
      Collection<String> tablenames, Iterable<? extends Formula> facts) {
    LOGGER.info("{}: initializeTables {}", this, tablenames);
    final Set<String> cleared = new LinkedHashSet<>(tablenames);
    for (String table : tablenames) {
      rules.clearTable(table);
    }
    int count = 0;
    for (Formula formula : facts) {
      final Rule fact = toRule(formula);
      if (cleared.add(fact.head.table)) {
        rules.clearTable(fact.head.table);
      }
      rules.addRule(fact.head.table, fact);
      ++count;
    }
    LOGGER.info(
        "{}: initialized {} tables with {} facts", this, cleared.size(), count);
    tracer.onInitialize(this, ImmutableSet.copyOf(cleared), count);
  }

  /**
   * Returns whether this theory contains a formula. An atom is contained if
   * its table has the fact; a rule is compared after reordering its body as
   * {@link #update} would.
   */
  public boolean contains(Formula formula) {
    if (compiler.isAtom(formula)) {
      final Atom atom = (Atom) formula;
      return rules.contains(atom.table, atom.toRule());
    }
    if (!(formula instanceof Rule)) {
      return false;
    }
    final Rule rule = (Rule) formula;
    if (rules.contains(rule.head.table, rule)) {
      return true;
    }
    final Formula reordered;
    try {
      reordered = reorder(rule);
    } catch (PolicyException e) {
      // A rule that cannot be reordered cannot have been inserted.
      return false;
    }
    return reordered != rule
        && rules.contains(rule.head.table, (Rule) reordered);
  }

  // Interface required by the top-down evaluator

  /**
   * Returns the rules that a top-down evaluator must consider when a literal
   * of {@code table} is at the top of its stack.
   */
  public List<Rule> headIndex(String table) {
    return headIndex(table, null);
  }

  /**
   * Returns the rules of {@code table} whose heads could match {@code
   * matchLiteral}; empty if the table is not defined here.
   */
  public List<Rule> headIndex(String table, @Nullable Atom matchLiteral) {
    if (rules.containsKey(table)) {
      return rules.getRules(table, matchLiteral);
    }
    return ImmutableList.of();
  }

  /** Returns the atom to unify with, given a rule from {@link #headIndex}. */
  public Atom head(Rule rule) {
    return rule.head;
  }

  /**
   * Returns the literals to push onto the evaluation stack, given a rule from
   * {@link #headIndex}.
   */
  public List<Literal> body(Rule rule) {
    return rule.body;
  }

  /**
   * Returns the number of arguments of a table, or null if the table is not
   * defined here.
   *
   * <p>Looks at one rule only. Nothing prevents rules of different arities for
   * the same table; if there are some, the result depends on which rule
   * happens to be first.
   */
  public @Nullable Integer arity(String table) {
    final List<Rule> formulas = headIndex(table);
    if (formulas.isEmpty()) {
      return null;
    }
    return head(formulas.get(0)).arity();
  }

  /**
   * Returns the number of arguments of a table, considering only rules whose
   * head is qualified by {@code theory} (or unqualified, if {@code theory} is
   * null); null if there are none.
   */
  public @Nullable Integer getAritySelf(String table, @Nullable String theory) {
    for (Rule rule : rules.getRules(table)) {
      if (Objects.equals(rule.head.theory, theory)) {
        return rule.head.arity();
      }
    }
    return null;
  }

  /** Returns every rule and fact. */
  public List<Rule> content() {
    return content(rules.keys());
  }

  /** Returns every rule and fact that defines one of the given tables. */
  public List<Rule> content(Iterable<String> tablenames) {
    final ImmutableList.Builder<Rule> results = ImmutableList.builder();
    for (String table : tablenames) {
      results.addAll(rules.getRules(table));
    }
    return results.build();
  }

  /** Returns the tables that have at least one rule or fact. */
  public List<String> definedTablenames() {
    return rules.keys();
  }

  /** Returns a summary of the number of rules per table. */
  public Map<String, Integer> statistics() {
    final ImmutableMap.Builder<String, Integer> b = ImmutableMap.builder();
    for (String table : rules.keys()) {
      b.put(table, rules.getRules(table).size());
    }
    return b.build();
  }

  // Internal interface

  private Formula reorder(Formula formula) {
    return reorderForSafety ? compiler.reorderForSafety(formula) : formula;
  }

  /** Converts a formula to a rule; an atom becomes a fact. */
  private Rule toRule(Formula formula) {
    if (compiler.isAtom(formula)) {
      return ((Atom) formula).toRule();
    }
    if (formula instanceof Rule) {
      return (Rule) formula;
    }
    throw new PolicyException(
        format("Non-formula found: %s", formula), formula.pos());
  }

  /** Inserts a rule; returns whether the theory changed. */
  private boolean insertActual(Rule rule) {
    if (!rules.addRule(rule.head.table, rule)) {
      return false;
    }
    tracer.onInsert(this, rule);
    return true;
  }

  /** Deletes a rule; returns whether the theory changed. */
  private boolean deleteActual(Rule rule) {
    if (!rules.discardRule(rule.head.table, rule)) {
      return false;
    }
    tracer.onDelete(this, rule);
    return true;
  }
}

// End RuleTheory.java
