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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.polis.compile.Compiler;
import net.hydromatic.polis.compile.DatalogCompiler;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Factory methods for {@link RuleTheory}. */
public abstract class RuleTheories {
  private RuleTheories() {}

  /** Creates a nonrecursive theory with default settings. */
  public static RuleTheory nonrecursive(String name) {
    return builder().name(name).build(TheoryKind.NONRECURSIVE);
  }

  /** Creates an action theory with default settings. */
  public static RuleTheory action(String name) {
    return builder().name(name).build(TheoryKind.ACTION);
  }

  /**
   * Creates a nonrecursive theory that accepts every changeset. Used by tests
   * and other callers that have already validated their formulas.
   */
  public static RuleTheory unsafe(String name) {
    return builder().name(name).buildUnsafe();
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder of {@link RuleTheory}. */
  public static class Builder {
    private @Nullable String name;
    private @Nullable String abbr;
    private Map<String, RuleTheory> theories = new HashMap<>();
    private Compiler compiler = DatalogCompiler.INSTANCE;
    private Tracer tracer = Tracers.empty();
    private final Map<Prop, Object> props = new LinkedHashMap<>();

    Builder() {}

    public Builder name(@Nullable String name) {
      this.name = name;
      return this;
    }

    public Builder abbr(@Nullable String abbr) {
      this.abbr = abbr;
      return this;
    }

    /**
     * Sets the registry of theories that formulas are checked against.
     *
     * <p>The registry is shared, not copied. The theory does not add itself;
     * the caller must put it in the registry if its own tables' arities are
     * to be checked.
     */
    public Builder theories(Map<String, RuleTheory> theories) {
      this.theories = requireNonNull(theories);
      return this;
    }

    public Builder compiler(Compiler compiler) {
      this.compiler = requireNonNull(compiler);
      return this;
    }

    public Builder tracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
      return this;
    }

    /** Sets a property; a null value reverts it to its default. */
    public Builder prop(Prop prop, @Nullable Object value) {
      prop.set(props, value);
      return this;
    }

    /** Creates a theory of the given kind. */
    public RuleTheory build(TheoryKind kind) {
      switch (kind) {
      case NONRECURSIVE:
        return build(kind, UpdateValidators.nonrecursive());
      case ACTION:
        return build(kind, UpdateValidators.action());
      default:
        throw new AssertionError("unknown kind " + kind);
      }
    }

    /** Creates a nonrecursive theory that does not validate changesets. */
    public RuleTheory buildUnsafe() {
      return build(TheoryKind.NONRECURSIVE, UpdateValidators.unsafe());
    }

    private RuleTheory build(TheoryKind kind, UpdateValidator validator) {
      return new RuleTheory(
          name,
          abbr,
          kind,
          validator,
          compiler,
          theories,
          tracer,
          ImmutableMap.copyOf(props));
    }
  }
}

// End RuleTheories.java
