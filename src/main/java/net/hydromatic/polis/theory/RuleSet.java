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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.polis.ast.PolicyAst.Atom;
import net.hydromatic.polis.ast.PolicyAst.Rule;
import net.hydromatic.polis.util.OrderedSet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Index from table name to the rules whose head is that table.
 *
 * <p>Rules are compared structurally, so adding a rule equal to one already
 * present changes nothing. A table with no rules is not a key.
 *
 * <p>Facts (rules with empty bodies) are held apart from other rules, so that
 * a lookup on behalf of a literal with constant arguments can use an index
 * rather than scan every fact of the table.
 */
public class RuleSet {
  private final Map<String, Table> tables = new LinkedHashMap<>();

  /**
   * Adds a rule to a table. Returns whether the rule was not already
   * present.
   *
   * @throws IllegalArgumentException if the table is not the rule's head
   */
  public boolean addRule(String table, Rule rule) {
    checkArgument(
        table.equals(rule.head.table),
        "rule %s does not belong to table %s",
        rule,
        table);
    final Table t = tables.computeIfAbsent(table, k -> new Table());
    return rule.isFact() ? t.facts.add(rule) : t.rules.add(rule);
  }

  /** Removes a rule from a table. Returns whether the rule was present. */
  public boolean discardRule(String table, Rule rule) {
    final Table t = tables.get(table);
    if (t == null) {
      return false;
    }
    final boolean changed =
        rule.isFact() ? t.facts.discard(rule) : t.rules.discard(rule);
    if (t.isEmpty()) {
      tables.remove(table);
    }
    return changed;
  }

  /** Removes every rule of a table. */
  public void clearTable(String table) {
    tables.remove(table);
  }

  /** Removes every rule. */
  public void clear() {
    tables.clear();
  }

  /** Returns whether a table contains a rule. */
  public boolean contains(String table, Rule rule) {
    final Table t = tables.get(table);
    return t != null
        && (rule.isFact() ? t.facts.contains(rule) : t.rules.contains(rule));
  }

  /** Returns whether a table has at least one rule. */
  public boolean containsKey(String table) {
    return tables.containsKey(table);
  }

  /** Returns the rules of a table: its facts, then its other rules. */
  public List<Rule> getRules(String table) {
    return getRules(table, null);
  }

  /**
   * Returns the rules of a table whose head could match a literal.
   *
   * <p>A head cannot match if, at some position, both it and the literal have
   * a constant and the constants are different. If {@code matchLiteral} is
   * null, returns all rules of the table.
   *
   * <p>Facts precede rules. Without {@code matchLiteral}, each group is in
   * insertion order. With it, the facts that are ground at the literal's
   * constant positions come first, then the facts that are not, so the facts
   * may be out of insertion order.
   */
  public List<Rule> getRules(String table, @Nullable Atom matchLiteral) {
    final Table t = tables.get(table);
    if (t == null) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<Rule> b = ImmutableList.builder();
    if (matchLiteral == null) {
      b.addAll(t.facts.all());
      b.addAll(t.rules);
    } else {
      b.addAll(t.facts.find(matchLiteral));
      for (Rule rule : t.rules) {
        if (FactSet.couldMatch(rule.head, matchLiteral)) {
          b.add(rule);
        }
      }
    }
    return b.build();
  }

  /** Returns the tables that have at least one rule. */
  public List<String> keys() {
    return ImmutableList.copyOf(tables.keySet());
  }

  /** Returns the number of rules in all tables. */
  public int size() {
    int n = 0;
    for (Table t : tables.values()) {
      n += t.facts.size() + t.rules.size();
    }
    return n;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    int i = 0;
    for (String table : tables.keySet()) {
      if (i++ > 0) {
        b.append(", ");
      }
      b.append(table).append(": ").append(getRules(table));
    }
    return b.append('}').toString();
  }

  /** Rules of one table. */
  private static class Table {
    final FactSet facts = new FactSet();
    final OrderedSet<Rule> rules = new OrderedSet<>();

    boolean isEmpty() {
      return facts.isEmpty() && rules.isEmpty();
    }
  }
}

// End RuleSet.java
