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
package net.hydromatic.polis.graph;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import net.hydromatic.polis.ast.PolicyAst.Atom;
import net.hydromatic.polis.ast.PolicyAst.Formula;
import net.hydromatic.polis.ast.PolicyAst.Literal;
import net.hydromatic.polis.ast.PolicyAst.Rule;
import net.hydromatic.polis.theory.Event;
import net.hydromatic.polis.theory.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Graph of the dependencies between tables that a set of rules creates.
 *
 * <p>Each rule contributes its head table as a node, and an edge from its head
 * table to the table of each body literal. An edge through a negated literal
 * carries the negation label; other edges have no label.
 *
 * <p>A node is named after the table, prefixed by the theory if the atom is
 * qualified; {@code nova:p} and {@code p} are different nodes.
 *
 * <p>Because it is a {@link BagGraph}, deleting a rule removes exactly what
 * inserting it added, and a table stays as long as some remaining rule
 * mentions it. The graph does not know which rules are present, so deleting
 * a rule that was never inserted corrupts the counts. Feed it only the events
 * that changed the theory, that is, the result of
 * {@link net.hydromatic.polis.theory.RuleTheory#update}, not the changeset
 * that was submitted.
 */
public class RuleDependencyGraph extends BagGraph<String, String> {
  private final String negationLabel;

  /** Creates an empty graph whose negated edges have label "-". */
  public RuleDependencyGraph() {
    this(ImmutableMap.of());
  }

  /** Creates an empty graph, reading {@link Prop#NEGATION_LABEL}. */
  public RuleDependencyGraph(Map<Prop, Object> props) {
    this(Prop.NEGATION_LABEL.stringValue(props));
  }

  private RuleDependencyGraph(String negationLabel) {
    this.negationLabel = requireNonNull(negationLabel);
  }

  @Override
  protected RuleDependencyGraph newGraph() {
    return new RuleDependencyGraph(negationLabel);
  }

  public String negationLabel() {
    return negationLabel;
  }

  /** Returns the name of the node for an atom's table. */
  public static String nodeName(Atom atom) {
    return atom.theory == null ? atom.table : atom.theory + ":" + atom.table;
  }

  /**
   * Adds the dependencies of a formula. The formula must be one that the
   * theory has just inserted.
   */
  public void formulaInsert(Formula formula) {
    final Rule rule = toRule(formula);
    final String head = nodeName(rule.head);
    addNode(head);
    for (Literal literal : rule.body) {
      addEdge(head, nodeName(literal.atom), label(literal));
    }
  }

  /**
   * Removes the dependencies of a formula. The formula must be one that the
   * theory has just deleted; deleting a formula that was never inserted
   * removes the counts of other formulas.
   */
  public void formulaDelete(Formula formula) {
    final Rule rule = toRule(formula);
    final String head = nodeName(rule.head);
    for (Literal literal : rule.body) {
      deleteEdge(head, nodeName(literal.atom), label(literal));
    }
    deleteNode(head);
  }

  /**
   * Applies the dependencies of each event, in order. Pass the events that
   * {@link net.hydromatic.polis.theory.RuleTheory#update} returned.
   */
  public void formulaUpdate(List<Event> events) {
    for (Event event : events) {
      if (event.insert) {
        formulaInsert(event.formula);
      } else {
        formulaDelete(event.formula);
      }
    }
  }

  /** Returns whether some table depends on itself. */
  public boolean isRecursive() {
    return hasCycle();
  }

  /** Returns whether no table depends on itself through a negation. */
  public boolean isStratified() {
    return stratification() != null;
  }

  /**
   * Assigns each table a stratum such that a table is in a higher stratum
   * than every table it reads through a negation; null if impossible.
   */
  public @Nullable Map<String, Integer> stratification() {
    return stratification(ImmutableSet.of(negationLabel));
  }

  private @Nullable String label(Literal literal) {
    return literal.negated ? negationLabel : null;
  }

  private static Rule toRule(Formula formula) {
    if (formula instanceof Atom) {
      return ((Atom) formula).toRule();
    }
    if (formula instanceof Rule) {
      return (Rule) formula;
    }
    throw new IllegalArgumentException("not a datalog formula: " + formula);
  }
}

// End RuleDependencyGraph.java
