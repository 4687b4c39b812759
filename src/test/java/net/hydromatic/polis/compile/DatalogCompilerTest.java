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

import static net.hydromatic.polis.TestUtils.atom;
import static net.hydromatic.polis.TestUtils.not;
import static net.hydromatic.polis.TestUtils.pos;
import static net.hydromatic.polis.TestUtils.qualified;
import static net.hydromatic.polis.TestUtils.rule;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.polis.ast.PolicyAst.Atom;
import net.hydromatic.polis.ast.PolicyAst.Formula;
import net.hydromatic.polis.ast.PolicyAst.Rule;
import net.hydromatic.polis.ast.Pos;
import org.junit.jupiter.api.Test;

/** Unit test for {@link DatalogCompiler}. */
class DatalogCompilerTest {
  private final Compiler compiler = DatalogCompiler.INSTANCE;

  @Test
  void testIsDatalog() {
    assertThat(compiler.isDatalog(atom("p", 1)), is(true));
    assertThat(compiler.isDatalog(atom("")), is(false));
    assertThat(
        compiler.isDatalog(rule(atom("p", "X"), pos(atom("q", "X")))),
        is(true));
    assertThat(
        compiler.isDatalog(rule(atom("p", "X"), pos(atom("", "X")))),
        is(false));
    final Formula formula = () -> Pos.ZERO;
    assertThat(compiler.isDatalog(formula), is(false));
    assertThat(compiler.isAtom(atom("p", 1)), is(true));
    assertThat(compiler.isAtom(atom("p", 1).toRule()), is(false));
  }

  @Test
  void testReorderMovesNegation() {
    final Rule rule =
        rule(atom("p", "X"), not(atom("r", "X")), pos(atom("q", "X")));
    assertThat(
        compiler.reorderForSafety(rule),
        hasToString("p(X) :- q(X), not r(X)"));
  }

  @Test
  void testReorderKeepsPositiveOrder() {
    final Rule rule =
        rule(
            atom("p", "X", "Y"),
            not(atom("s", "Y")),
            not(atom("r", "X")),
            pos(atom("q", "X")),
            pos(atom("t", "Y")));
    assertThat(
        compiler.reorderForSafety(rule),
        hasToString("p(X, Y) :- q(X), not r(X), t(Y), not s(Y)"));
  }

  @Test
  void testReorderPreservesPosition() {
    final Pos position = new Pos("policy.txt", 3, 1, 3, 30);
    final Rule rule =
        new Rule(
            atom("p", "X"),
            ImmutableList.of(not(atom("r", "X")), pos(atom("q", "X"))),
            position);
    final Formula reordered = compiler.reorderForSafety(rule);
    assertThat(reordered.pos(), is(position));
  }

  @Test
  void testReorderUnchanged() {
    final Rule safe =
        rule(atom("p", "X"), pos(atom("q", "X")), not(atom("r", "X")));
    assertThat(compiler.reorderForSafety(safe), sameInstance(safe));

    // A negated literal without variables is safe anywhere.
    final Rule ground =
        rule(atom("p", "X"), not(atom("r", 1)), pos(atom("q", "X")));
    assertThat(compiler.reorderForSafety(ground), sameInstance(ground));

    final Atom atom = atom("p", 1);
    assertThat(compiler.reorderForSafety(atom), sameInstance(atom));
  }

  @Test
  void testReorderFails() {
    final Rule rule =
        rule(atom("p", "X"), pos(atom("q", "X")), not(atom("r", "Y")));
    final PolicyException e =
        assertThrows(
            PolicyException.class, () -> compiler.reorderForSafety(rule));
    assertThat(
        e.getMessage(),
        is(
            "Could not reorder rule for safety: p(X) :- q(X), not r(Y);"
                + " unbound literals [not r(Y)]"));
  }

  @Test
  void testFactErrors() {
    assertThat(
        compiler.factErrors(atom("p", 1), ImmutableMap.of(), "t").isEmpty(),
        is(true));
    final List<PolicyException> errors =
        compiler.factErrors(
            qualified("nova", "p", "X"), ImmutableMap.of(), "t");
    assertThat(errors.size(), is(2));
    assertThat(errors.get(0).getMessage(), startsWith("Fact is not ground"));
    assertThat(
        errors.get(1).getMessage(),
        startsWith("Fact may not belong to another theory"));
  }

  @Test
  void testRuleErrors() {
    assertThat(
        compiler
            .ruleErrors(
                rule(atom("p", "X"), pos(atom("q", "X", "Y"))),
                ImmutableMap.of(),
                null)
            .isEmpty(),
        is(true));

    // Head variable "Y" appears only in a negated literal.
    final List<PolicyException> errors =
        compiler.ruleErrors(
            rule(
                atom("p", "X", "Y"),
                pos(atom("q", "X")),
                not(atom("r", "X", "Y"))),
            ImmutableMap.of(),
            null);
    assertThat(errors.size(), is(2));
    assertThat(
        errors.get(0).getMessage(),
        startsWith("Rule is unsafe. Variable 'Y' in head"));
    assertThat(
        errors.get(1).getMessage(),
        startsWith("Rule is unsafe. Variable 'Y' in negated atom"));
  }

  @Test
  void testRuleHeadHasNoTheory() {
    final Rule rule =
        rule(qualified("nova", "servers-", "X"), pos(atom("q", "X")));
    assertThat(
        compiler.ruleHeadHasNoTheory(rule, head -> false).size(), is(1));
    assertThat(
        compiler.ruleHeadHasNoTheory(rule, Atom::isUpdate).isEmpty(),
        is(true));
    assertThat(
        compiler
            .ruleHeadHasNoTheory(
                rule(atom("p", "X"), pos(atom("q", "X"))), head -> false)
            .isEmpty(),
        is(true));
  }

  @Test
  void testErrorPosition() {
    final String text = "p(X) :- q(X).\nr(Y) :- not s(Y).";
    final Pos position = Pos.of(text, "policy.txt", 14, 31);
    final Rule rule =
        new Rule(
            atom("r", "Y"),
            ImmutableList.of(not(atom("s", "Y"))),
            position);
    final List<PolicyException> errors =
        compiler.ruleErrors(rule, ImmutableMap.of(), null);
    assertThat(errors.size(), is(2));
    assertThat(errors.get(0).pos(), is(position));
    assertThat(
        errors.get(0).describeTo(new StringBuilder()).toString(),
        startsWith("policy.txt:2.1-2.18 Error: Rule is unsafe."));
  }
}

// End DatalogCompilerTest.java
