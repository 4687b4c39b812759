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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.polis.ast.PolicyAst.Atom;
import net.hydromatic.polis.ast.PolicyAst.Rule;
import net.hydromatic.polis.ast.PolicyAst.Term;
import net.hydromatic.polis.util.OrderedSet;

/**
 * The facts of one table, with indexes on the constants at chosen argument
 * positions.
 *
 * <p>An index for a set of positions is created the first time a literal with
 * constants at exactly those positions is looked up, and is kept up to date
 * from then on.
 */
class FactSet {
  private final OrderedSet<Rule> facts = new OrderedSet<>();
  private final Map<List<Integer>, Index> indexes = new HashMap<>();

  boolean add(Rule fact) {
    if (!facts.add(fact)) {
      return false;
    }
    for (Index index : indexes.values()) {
      index.add(fact);
    }
    return true;
  }

  boolean discard(Rule fact) {
    if (!facts.discard(fact)) {
      return false;
    }
    for (Index index : indexes.values()) {
      index.remove(fact);
    }
    return true;
  }

  boolean contains(Rule fact) {
    return facts.contains(fact);
  }

  boolean isEmpty() {
    return facts.isEmpty();
  }

  int size() {
    return facts.size();
  }

  /** Returns all facts, in the order they were added. */
  List<Rule> all() {
    return ImmutableList.copyOf(facts);
  }

  /**
   * Returns the facts that could match a literal: those that, at every
   * position where the literal has a constant, have the same constant or a
   * non-constant.
   *
   * <p>Facts with constants at all of the literal's constant positions come
   * first, in the order they were added, followed by the facts that lack
   * one. This is not the order of {@link #all()}.
   */
  List<Rule> find(Atom literal) {
    final ImmutableList.Builder<Integer> positions = ImmutableList.builder();
    final ImmutableList.Builder<Term> key = ImmutableList.builder();
    for (int i = 0; i < literal.arguments.size(); i++) {
      final Term term = literal.arguments.get(i);
      if (term.isConstant()) {
        positions.add(i);
        key.add(term);
      }
    }
    final List<Integer> positionList = positions.build();
    if (positionList.isEmpty()) {
      return all();
    }
    final Index index =
        indexes.computeIfAbsent(positionList, p -> new Index(p, facts));
    return index.get(key.build(), literal);
  }

  /**
   * Returns whether an atom could unify with a literal; false if at some
   * position both have a constant and the constants differ. Arity is not
   * checked.
   */
  static boolean couldMatch(Atom head, Atom literal) {
    final int n = Math.min(head.arguments.size(), literal.arguments.size());
    for (int i = 0; i < n; i++) {
      final Term term = head.arguments.get(i);
      final Term term2 = literal.arguments.get(i);
      if (term.isConstant() && term2.isConstant() && !term.equals(term2)) {
        return false;
      }
    }
    return true;
  }

  /** Index of facts on the constants at a list of positions. */
  private static class Index {
    final List<Integer> positions;
    final SetMultimap<List<Term>, Rule> map = LinkedHashMultimap.create();

    /**
     * Facts that lack a constant at some indexed position; they are checked
     * against each literal.
     */
    final OrderedSet<Rule> wildcards = new OrderedSet<>();

    Index(List<Integer> positions, Iterable<Rule> facts) {
      this.positions = positions;
      for (Rule fact : facts) {
        add(fact);
      }
    }

    /** Returns the key of a fact, or an empty list if it has none. */
    private List<Term> keyOf(Rule fact) {
      final List<Term> arguments = fact.head.arguments;
      final ImmutableList.Builder<Term> key = ImmutableList.builder();
      for (int position : positions) {
        if (position >= arguments.size()
            || !arguments.get(position).isConstant()) {
          return ImmutableList.of();
        }
        key.add(arguments.get(position));
      }
      return key.build();
    }

    void add(Rule fact) {
      final List<Term> key = keyOf(fact);
      if (key.isEmpty()) {
        wildcards.add(fact);
      } else {
        map.put(key, fact);
      }
    }

    void remove(Rule fact) {
      final List<Term> key = keyOf(fact);
      if (key.isEmpty()) {
        wildcards.discard(fact);
      } else {
        map.remove(key, fact);
      }
    }

    List<Rule> get(List<Term> key, Atom literal) {
      final ImmutableList.Builder<Rule> b = ImmutableList.builder();
      b.addAll(map.get(key));
      for (Rule fact : wildcards) {
        if (couldMatch(fact.head, literal)) {
          b.add(fact);
        }
      }
      return b.build();
    }
  }
}

// End FactSet.java
