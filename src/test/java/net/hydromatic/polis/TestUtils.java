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
package net.hydromatic.polis;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.polis.ast.PolicyAst.Atom;
import net.hydromatic.polis.ast.PolicyAst.Constant;
import net.hydromatic.polis.ast.PolicyAst.Literal;
import net.hydromatic.polis.ast.PolicyAst.Rule;
import net.hydromatic.polis.ast.PolicyAst.Term;
import net.hydromatic.polis.ast.PolicyAst.Variable;
import net.hydromatic.polis.ast.Pos;

/** Utilities for building formulas in tests. */
public abstract class TestUtils {
  private TestUtils() {}

  /**
   * Creates an atom. A string argument that starts with an upper-case letter
   * is a variable; any other argument is a constant.
   */
  public static Atom atom(String table, Object... args) {
    return new Atom(null, table, terms(args), Pos.ZERO);
  }

  /** Creates an atom qualified by a theory name. */
  public static Atom qualified(String theory, String table, Object... args) {
    return new Atom(theory, table, terms(args), Pos.ZERO);
  }

  private static List<Term> terms(Object[] args) {
    final List<Term> terms = new ArrayList<>();
    for (Object arg : args) {
      if (arg instanceof String
          && !((String) arg).isEmpty()
          && Character.isUpperCase(((String) arg).charAt(0))) {
        terms.add(new Variable((String) arg));
      } else {
        terms.add(new Constant(arg));
      }
    }
    return terms;
  }

  /** Creates a positive literal. */
  public static Literal pos(Atom atom) {
    return new Literal(atom, false);
  }

  /** Creates a negated literal. */
  public static Literal not(Atom atom) {
    return new Literal(atom, true);
  }

  /** Creates a rule. */
  public static Rule rule(Atom head, Literal... body) {
    return new Rule(head, ImmutableList.copyOf(body));
  }
}

// End TestUtils.java
