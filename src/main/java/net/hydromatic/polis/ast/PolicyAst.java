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
package net.hydromatic.polis.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.polis.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Formulas of a policy: atoms, literals and rules.
 *
 * <p>All nodes are immutable. Equality is structural and ignores {@link Pos
 * positions}, so that two rules written in different places of a policy are
 * the same rule.
 */
public class PolicyAst {
  private PolicyAst() {
    // Utility class
  }

  /**
   * A statement that can be inserted into or deleted from a theory.
   *
   * <p>{@link Atom} and {@link Rule} are the well-formed datalog formulas.
   * Other implementations may come from richer front ends; validation rejects
   * them.
   */
  public interface Formula {
    /** Returns where this formula was written. */
    Pos pos();
  }

  /** Base class for arguments of atoms. */
  public abstract static class Term {
    /** Returns whether this term is a constant. */
    public abstract boolean isConstant();
  }

  /** A variable term. */
  public static class Variable extends Term {
    public final String name;

    public Variable(String name) {
      this.name = requireNonNull(name);
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return this == o
          || o instanceof Variable && name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /** A constant term; its value is a string or a number. */
  public static class Constant extends Term {
    public final Object value;

    public Constant(Object value) {
      this.value = requireNonNull(value);
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public String toString() {
      if (value instanceof String) {
        return "\"" + value + "\"";
      }
      return value.toString();
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return this == o
          || o instanceof Constant && value.equals(((Constant) o).value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }
  }

  /**
   * An atom: {@code table(term, ...)}, optionally qualified by the theory that
   * owns the table, as in {@code nova:servers(X)}.
   */
  public static class Atom implements Formula {
    public final @Nullable String theory;
    public final String table;
    public final List<Term> arguments;
    public final Pos pos;

    public Atom(
        @Nullable String theory,
        String table,
        List<? extends Term> arguments,
        Pos pos) {
      this.theory = theory;
      this.table = requireNonNull(table);
      this.arguments = ImmutableList.copyOf(arguments);
      this.pos = requireNonNull(pos);
    }

    public Atom(String table, List<? extends Term> arguments) {
      this(null, table, arguments, Pos.ZERO);
    }

    @Override
    public Pos pos() {
      return pos;
    }

    public int arity() {
      return arguments.size();
    }

    /** Returns whether every argument is a constant. */
    public boolean isGround() {
      return Static.allMatch(arguments, Term::isConstant);
    }

    /**
     * Returns whether this atom denotes a change to a table rather than the
     * table itself; such tables are named {@code t+} (insert) and {@code t-}
     * (delete).
     */
    public boolean isUpdate() {
      return table.endsWith("+") || table.endsWith("-");
    }

    /** Returns the names of the variables in this atom, in order. */
    public Set<String> variables() {
      final ImmutableSet.Builder<String> b = ImmutableSet.builder();
      for (Term term : arguments) {
        if (term instanceof Variable) {
          b.add(((Variable) term).name);
        }
      }
      return b.build();
    }

    /** Converts this atom into a rule with an empty body, that is, a fact. */
    public Rule toRule() {
      return new Rule(this, ImmutableList.of(), pos);
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      if (theory != null) {
        b.append(theory).append(':');
      }
      b.append(table).append('(');
      for (int i = 0; i < arguments.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        b.append(arguments.get(i));
      }
      return b.append(')').toString();
    }

    @Override
    public boolean equals(@Nullable Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Atom)) {
        return false;
      }
      final Atom that = (Atom) o;
      return table.equals(that.table)
          && Objects.equals(theory, that.theory)
          && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
      return Objects.hash(theory, table, arguments);
    }
  }

  /** An atom in a rule body; positive or negated. */
  public static class Literal {
    public final Atom atom;
    public final boolean negated;

    public Literal(Atom atom, boolean negated) {
      this.atom = requireNonNull(atom);
      this.negated = negated;
    }

    /** Returns the table that this literal reads. */
    public String table() {
      return atom.table;
    }

    @Override
    public String toString() {
      return negated ? "not " + atom : atom.toString();
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return this == o
          || o instanceof Literal
              && negated == ((Literal) o).negated
              && atom.equals(((Literal) o).atom);
    }

    @Override
    public int hashCode() {
      return atom.hashCode() * 31 + (negated ? 1 : 0);
    }
  }

  /** A rule: {@code head :- body}. A rule with an empty body is a fact. */
  public static class Rule implements Formula {
    public final Atom head;
    public final List<Literal> body;
    public final Pos pos;

    public Rule(Atom head, List<Literal> body, Pos pos) {
      this.head = requireNonNull(head);
      this.body = ImmutableList.copyOf(body);
      this.pos = requireNonNull(pos);
    }

    public Rule(Atom head, List<Literal> body) {
      this(head, body, Pos.ZERO);
    }

    @Override
    public Pos pos() {
      return pos;
    }

    /** Returns whether this rule has an empty body. */
    public boolean isFact() {
      return body.isEmpty();
    }

    @Override
    public String toString() {
      if (body.isEmpty()) {
        return head.toString();
      }
      final StringBuilder b = new StringBuilder();
      b.append(head).append(" :- ");
      for (int i = 0; i < body.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        b.append(body.get(i));
      }
      return b.toString();
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return this == o
          || o instanceof Rule
              && head.equals(((Rule) o).head)
              && body.equals(((Rule) o).body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(head, body);
    }
  }
}

// End PolicyAst.java
