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
import static net.hydromatic.polis.TestUtils.not;
import static net.hydromatic.polis.TestUtils.pos;
import static net.hydromatic.polis.TestUtils.qualified;
import static net.hydromatic.polis.TestUtils.rule;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.polis.ast.PolicyAst.Atom;
import net.hydromatic.polis.ast.PolicyAst.Formula;
import net.hydromatic.polis.ast.PolicyAst.Rule;
import net.hydromatic.polis.ast.Pos;
import net.hydromatic.polis.compile.PolicyException;
import org.junit.jupiter.api.Test;

/** Unit test for {@link RuleTheory}. */
class RuleTheoryTest {
  /** {@code p(X) :- q(X)}. */
  private static final Rule P_Q = rule(atom("p", "X"), pos(atom("q", "X")));

  private static RuleTheory theory() {
    final Map<String, RuleTheory> theories = new HashMap<>();
    final RuleTheory theory =
        RuleTheories.builder()
            .name("test")
            .theories(theories)
            .build(TheoryKind.NONRECURSIVE);
    theories.put("test", theory);
    return theory;
  }

  @Test
  void testInsertIsIdempotent() {
    final RuleTheory theory = theory();
    assertThat(theory.insert(atom("p", 1)), is(ImmutableList.of(atom("p", 1))));
    assertThat(theory.insert(atom("p", 1)).isEmpty(), is(true));
    assertThat(theory.content(), is(ImmutableList.of(atom("p", 1).toRule())));
  }

  @Test
  void testDeleteAbsent() {
    final RuleTheory theory = theory();
    assertThat(theory.delete(atom("p", 1)).isEmpty(), is(true));
    theory.insert(atom("p", 1));
    assertThat(theory.delete(atom("p", 1)), is(ImmutableList.of(atom("p", 1))));
    assertThat(theory.content().isEmpty(), is(true));
    assertThat(theory.definedTablenames().isEmpty(), is(true));
  }

  @Test
  void testUpdateReturnsChanges() {
    final RuleTheory theory = theory();
    final List<Event> events =
        ImmutableList.of(
            Event.insert(atom("p", 1)),
            Event.insert(atom("p", 1)),
            Event.delete(atom("q", 2)),
            Event.insert(P_Q));
    assertThat(
        theory.update(events),
        is(ImmutableList.of(Event.insert(atom("p", 1)), Event.insert(P_Q))));

    // Inserting then deleting in one changeset leaves nothing behind, and
    // both events count as changes.
    final List<Event> events2 =
        ImmutableList.of(
            Event.insert(atom("r", 1)), Event.delete(atom("r", 1)));
    assertThat(theory.update(events2), is(events2));
    assertThat(theory.contains(atom("r", 1)), is(false));
  }

  @Test
  void testDefineAndContent() {
    final RuleTheory theory = theory();
    final List<Formula> formulas =
        ImmutableList.of(atom("p", 1), P_Q, atom("q", 2));
    theory.define(formulas);
    assertThat(
        theory.content(),
        is(
            ImmutableList.of(
                atom("p", 1).toRule(), P_Q, atom("q", 2).toRule())));
    assertThat(
        theory.content(ImmutableList.of("q")),
        is(ImmutableList.of(atom("q", 2).toRule())));
    assertThat(theory.definedTablenames(), is(ImmutableList.of("p", "q")));
    for (Formula formula : formulas) {
      assertThat(theory.contains(formula), is(true));
    }

    // Define replaces the previous contents.
    theory.define(ImmutableList.of(atom("r", 3)));
    assertThat(theory.content(), is(ImmutableList.of(atom("r", 3).toRule())));
  }

  @Test
  void testPolicyExcludesFacts() {
    final RuleTheory theory = theory();
    theory.define(ImmutableList.of(atom("p", 1), P_Q, atom("q", 2)));
    assertThat(theory.policy(), is(ImmutableList.of(P_Q)));
  }

  @Test
  void testPolicyWithNullaryTables() {
    final RuleTheory theory = theory();
    final Rule q = rule(atom("q"), pos(atom("p")));
    theory.insert(atom("p"));
    theory.insert(q);
    assertThat(theory.policy(), is(ImmutableList.of(q)));
    assertThat(theory.arity("p"), is(0));
  }

  @Test
  void testReinitializeTable() {
    final RuleTheory theory = theory();
    theory.initializeTables(
        ImmutableList.of("p"), ImmutableList.of(atom("p", 1), atom("p", 2)));
    theory.initializeTables(
        ImmutableList.of("p"), ImmutableList.of(atom("p", 3)));
    assertThat(theory.content(), is(ImmutableList.of(atom("p", 3).toRule())));
  }

  @Test
  void testStatistics() {
    final RuleTheory theory = theory();
    theory.define(ImmutableList.of(atom("p", 1), P_Q, atom("q", 2)));
    assertThat(theory.statistics(), is(ImmutableMap.of("p", 2, "q", 1)));
  }

  @Test
  void testReorderOnInsert() {
    final RuleTheory theory = theory();
    final Rule unordered =
        rule(atom("p", "X"), not(atom("r", "X")), pos(atom("q", "X")));
    final Rule ordered =
        rule(atom("p", "X"), pos(atom("q", "X")), not(atom("r", "X")));
    theory.insert(unordered);
    assertThat(theory.policy(), is(ImmutableList.of(ordered)));
    assertThat(theory.contains(unordered), is(true));
    assertThat(theory.contains(ordered), is(true));

    // Deleting the unordered form deletes the stored form.
    assertThat(theory.delete(unordered), is(ImmutableList.of(unordered)));
    assertThat(theory.policy().isEmpty(), is(true));
  }

  @Test
  void testNoReorder() {
    final RuleTheory theory =
        RuleTheories.builder()
            .name("raw")
            .prop(Prop.REORDER_FOR_SAFETY, false)
            .build(TheoryKind.NONRECURSIVE);
    final Rule unordered =
        rule(atom("p", "X"), not(atom("r", "X")), pos(atom("q", "X")));
    final Rule ordered =
        rule(atom("p", "X"), pos(atom("q", "X")), not(atom("r", "X")));
    theory.insert(unordered);
    assertThat(theory.policy(), is(ImmutableList.of(unordered)));
    assertThat(theory.contains(ordered), is(false));
  }

  @Test
  void testFailedUpdateKeepsEarlierEvents() {
    final List<Throwable> exceptions = new ArrayList<>();
    final List<List<Event>> updates = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnUpdate(
            Tracers.withOnException(Tracers.empty(), exceptions::add),
            updates::add);
    final RuleTheory theory =
        RuleTheories.builder().name("test").tracer(tracer).buildUnsafe();
    final Rule unsafe = rule(atom("p", "X"), not(atom("r", "X")));
    final List<Event> events =
        ImmutableList.of(
            Event.insert(atom("q", 1)),
            Event.insert(unsafe),
            Event.insert(atom("q", 2)));
    final PolicyException e =
        assertThrows(PolicyException.class, () -> theory.update(events));
    assertThat(e.getMessage(), startsWith("Could not reorder rule for safety"));
    assertThat(theory.contains(atom("q", 1)), is(true));
    assertThat(theory.contains(atom("q", 2)), is(false));
    assertThat(exceptions, is(ImmutableList.of(e)));
    assertThat(updates.isEmpty(), is(true));
  }

  @Test
  void testNonFormula() {
    final RuleTheory theory = theory();
    final Formula formula = () -> Pos.ZERO;
    final PolicyException e =
        assertThrows(PolicyException.class, () -> theory.insert(formula));
    assertThat(e.getMessage(), startsWith("Non-formula found"));
    assertThat(theory.contains(formula), is(false));
  }

  @Test
  void testTracer() {
    final List<Rule> inserted = new ArrayList<>();
    final List<Rule> deleted = new ArrayList<>();
    final List<List<Event>> updates = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnInsert(tracer, inserted::add);
    tracer = Tracers.withOnDelete(tracer, deleted::add);
    tracer = Tracers.withOnUpdate(tracer, updates::add);
    final RuleTheory theory =
        RuleTheories.builder()
            .name("test")
            .tracer(tracer)
            .build(TheoryKind.NONRECURSIVE);

    theory.update(
        ImmutableList.of(
            Event.insert(atom("p", 1)),
            Event.insert(atom("p", 1)),
            Event.insert(P_Q)));
    theory.delete(atom("p", 1));
    theory.delete(atom("p", 1));
    assertThat(inserted, is(ImmutableList.of(atom("p", 1).toRule(), P_Q)));
    assertThat(deleted, is(ImmutableList.of(atom("p", 1).toRule())));
    assertThat(
        updates,
        is(
            ImmutableList.<List<Event>>of(
                ImmutableList.of(
                    Event.insert(atom("p", 1)), Event.insert(P_Q)),
                ImmutableList.of(Event.delete(atom("p", 1))),
                ImmutableList.of())));
  }

  @Test
  void testInitializeTables() {
    final List<Set<String>> initialized = new ArrayList<>();
    final RuleTheory theory =
        RuleTheories.builder()
            .name("test")
            .tracer(Tracers.withOnInitialize(Tracers.empty(), initialized::add))
            .buildUnsafe();
    theory.define(
        ImmutableList.of(
            atom("p", 9), atom("q", 8), atom("r", 7), atom("s", 6), P_Q));

    theory.initializeTables(
        ImmutableList.of("p", "q"),
        ImmutableList.of(atom("p", 1), atom("r", 2)));
    assertThat(theory.contains(atom("p", 9)), is(false));
    assertThat(theory.contains(P_Q), is(false));
    assertThat(theory.contains(atom("p", 1)), is(true));
    assertThat(theory.contains(atom("q", 8)), is(false));
    assertThat(theory.contains(atom("r", 7)), is(false));
    assertThat(theory.contains(atom("r", 2)), is(true));
    assertThat(theory.contains(atom("s", 6)), is(true));
    assertThat(
        ImmutableSet.copyOf(theory.definedTablenames()),
        is(ImmutableSet.of("p", "r", "s")));
    assertThat(
        initialized, is(ImmutableList.of(ImmutableSet.of("p", "q", "r"))));
  }

  @Test
  void testEmpty() {
    final RuleTheory theory = theory();
    final List<Formula> formulas =
        ImmutableList.of(atom("p", 1), atom("q", 2), atom("r", 3));
    theory.define(formulas);
    theory.empty(ImmutableList.of("p"));
    assertThat(theory.definedTablenames(), is(ImmutableList.of("q", "r")));

    theory.define(formulas);
    theory.empty(ImmutableList.of("p"), true);
    assertThat(theory.definedTablenames(), is(ImmutableList.of("p")));

    theory.empty();
    assertThat(theory.content().isEmpty(), is(true));
  }

  @Test
  void testArity() {
    final RuleTheory theory = theory();
    assertThat(theory.arity("p"), nullValue());
    theory.insert(atom("p", 1, 2));
    assertThat(theory.arity("p"), is(2));
    assertThat(theory.getAritySelf("p", null), is(2));
    assertThat(theory.getAritySelf("p", "nova"), nullValue());

    final Atom head = qualified("nova", "p", "X", "Y", "Z");
    theory.insert(rule(head, pos(atom("q", "X", "Y", "Z"))));
    assertThat(theory.getAritySelf("p", "nova"), is(3));
    assertThat(theory.arity("p"), is(2));
    assertThat(theory.arity("q"), nullValue());
  }

  @Test
  void testHeadIndex() {
    final RuleTheory theory = theory();
    final Rule r = rule(atom("p", "X", "b"), pos(atom("q", "X")));
    theory.define(ImmutableList.of(atom("p", 1, "a"), atom("p", 2, "a"), r));
    assertThat(theory.headIndex("z").isEmpty(), is(true));
    assertThat(
        theory.headIndex("p"),
        is(
            ImmutableList.of(
                atom("p", 1, "a").toRule(), atom("p", 2, "a").toRule(), r)));
    final List<Rule> rules = theory.headIndex("p", atom("p", 2, "Y"));
    assertThat(rules, is(ImmutableList.of(atom("p", 2, "a").toRule(), r)));
    assertThat(theory.head(r), is(atom("p", "X", "b")));
    assertThat(theory.body(r), is(ImmutableList.of(pos(atom("q", "X")))));
  }

  @Test
  void testAccessors() {
    final RuleTheory theory =
        RuleTheories.builder().name("alpha").abbr("a").build(TheoryKind.ACTION);
    assertThat(theory.name(), is("alpha"));
    assertThat(theory.abbr(), is("a"));
    assertThat(theory.kind(), is(TheoryKind.ACTION));
    assertThat(theory, hasToString("action theory alpha"));
    assertThat(RuleTheories.unsafe("u").kind(), is(TheoryKind.NONRECURSIVE));
    assertThat(
        RuleTheories.builder().build(TheoryKind.NONRECURSIVE),
        hasToString("nonrecursive theory <anonymous>"));
    assertThrows(
        UnsupportedOperationException.class,
        () -> theory.theories().put("x", theory));
  }
}

// End RuleTheoryTest.java
