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

import static net.hydromatic.polis.TestUtils.atom;
import static net.hydromatic.polis.TestUtils.pos;
import static net.hydromatic.polis.TestUtils.rule;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.polis.ast.PolicyAst.Rule;
import org.junit.jupiter.api.Test;

/** Unit test for {@link RuleSet}. */
class RuleSetTest {
  private static Rule fact(String table, Object... args) {
    return atom(table, args).toRule();
  }

  @Test
  void testAddAndDiscard() {
    final RuleSet rules = new RuleSet();
    assertThat(rules.addRule("p", fact("p", 1)), is(true));
    assertThat(rules.addRule("p", fact("p", 1)), is(false));
    assertThat(rules.addRule("q", fact("q", 2)), is(true));
    assertThat(rules.size(), is(2));
    assertThat(rules.keys(), is(ImmutableList.of("p", "q")));
    assertThat(rules.contains("p", fact("p", 1)), is(true));
    assertThat(rules.contains("q", fact("p", 1)), is(false));

    assertThat(rules.discardRule("p", fact("p", 9)), is(false));
    assertThat(rules.discardRule("z", fact("z", 9)), is(false));
    assertThat(rules.discardRule("p", fact("p", 1)), is(true));

    // A table with no rules is not a key.
    assertThat(rules.containsKey("p"), is(false));
    assertThat(rules.keys(), is(ImmutableList.of("q")));
    assertThat(rules.getRules("p").isEmpty(), is(true));
  }

  @Test
  void testWrongTable() {
    final RuleSet rules = new RuleSet();
    assertThrows(
        IllegalArgumentException.class,
        () -> rules.addRule("q", fact("p", 1)));
  }

  @Test
  void testFactsBeforeRules() {
    final RuleSet rules = new RuleSet();
    final Rule r = rule(atom("p", "X"), pos(atom("q", "X")));
    rules.addRule("p", r);
    rules.addRule("p", fact("p", 1));
    rules.addRule("p", fact("p", 2));
    assertThat(
        rules.getRules("p"),
        is(ImmutableList.of(fact("p", 1), fact("p", 2), r)));
    assertThat(rules.toString(), is("{p: [p(1), p(2), p(X) :- q(X)]}"));
  }

  @Test
  void testMatchLiteral() {
    final RuleSet rules = new RuleSet();
    rules.addRule("p", fact("p", 1, "a"));
    rules.addRule("p", fact("p", 2, "b"));
    rules.addRule("p", fact("p", 1, "c"));
    final Rule r1 = rule(atom("p", "X", "z"), pos(atom("q", "X")));
    final Rule r2 = rule(atom("p", 2, "Y"), pos(atom("q", "Y")));
    rules.addRule("p", r1);
    rules.addRule("p", r2);

    assertThat(
        rules.getRules("p", atom("p", 1, "Y")),
        is(ImmutableList.of(fact("p", 1, "a"), fact("p", 1, "c"), r1)));
    assertThat(
        rules.getRules("p", atom("p", 2, "b")),
        is(ImmutableList.of(fact("p", 2, "b"), r2)));
    assertThat(
        rules.getRules("p", atom("p", "X", "Y")), is(rules.getRules("p")));
    assertThat(rules.getRules("p", atom("p", 3, "a")).isEmpty(), is(true));
  }

  @Test
  void testIndexIsMaintained() {
    final RuleSet rules = new RuleSet();
    rules.addRule("p", fact("p", 1, "a"));
    rules.addRule("p", fact("p", 2, "b"));
    assertThat(
        rules.getRules("p", atom("p", 1, "Y")),
        is(ImmutableList.of(fact("p", 1, "a"))));

    // The index on the first argument now exists; changes must reach it.
    rules.addRule("p", fact("p", 1, "d"));
    rules.discardRule("p", fact("p", 1, "a"));
    assertThat(
        rules.getRules("p", atom("p", 1, "Y")),
        is(ImmutableList.of(fact("p", 1, "d"))));
  }

  @Test
  void testNonGroundFact() {
    // Without validation, a fact may contain a variable; it matches any
    // constant at that position.
    final RuleSet rules = new RuleSet();
    rules.addRule("p", fact("p", "X", "q"));
    rules.addRule("p", fact("p", 1, "r"));

    // Indexed facts come before non-ground ones, whatever the order they were
    // added in.
    assertThat(
        rules.getRules("p", atom("p", 1, "Y")),
        is(ImmutableList.of(fact("p", 1, "r"), fact("p", "X", "q"))));
    assertThat(
        rules.getRules("p", atom("p", 1, "s")).isEmpty(), is(true));
  }

  @Test
  void testClear() {
    final RuleSet rules = new RuleSet();
    rules.addRule("p", fact("p", 1));
    rules.addRule("q", fact("q", 1));
    rules.clearTable("p");
    assertThat(rules.keys(), is(ImmutableList.of("q")));
    rules.clear();
    assertThat(rules.size(), is(0));
    assertThat(rules.keys().isEmpty(), is(true));
  }
}

// End RuleSetTest.java
