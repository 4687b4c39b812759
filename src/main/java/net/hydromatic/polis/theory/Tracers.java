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

import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.polis.ast.PolicyAst.Rule;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each inserted rule,
   * then calls the underlying tracer.
   */
  public static Tracer withOnInsert(Tracer tracer, Consumer<Rule> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInsert(RuleTheory theory, Rule rule) {
        consumer.accept(rule);
        super.onInsert(theory, rule);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each deleted rule,
   * then calls the underlying tracer.
   */
  public static Tracer withOnDelete(Tracer tracer, Consumer<Rule> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDelete(RuleTheory theory, Rule rule) {
        consumer.accept(rule);
        super.onDelete(theory, rule);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the effective events
   * of each changeset, then calls the underlying tracer.
   */
  public static Tracer withOnUpdate(
      Tracer tracer, Consumer<List<Event>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onUpdate(
          RuleTheory theory, List<Event> events, List<Event> changes) {
        consumer.accept(changes);
        super.onUpdate(theory, events, changes);
      }
    };
  }

  public static Tracer withOnInitialize(
      Tracer tracer, Consumer<Set<String>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInitialize(
          RuleTheory theory, Set<String> tables, int factCount) {
        consumer.accept(tables);
        super.onInitialize(theory, tables, factCount);
      }
    };
  }

  public static Tracer withOnException(
      Tracer tracer, Consumer<Throwable> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean onException(RuleTheory theory, Throwable e) {
        consumer.accept(e);
        super.onException(theory, e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onInsert(RuleTheory theory, Rule rule) {}

    @Override
    public void onDelete(RuleTheory theory, Rule rule) {}

    @Override
    public void onUpdate(
        RuleTheory theory, List<Event> events, List<Event> changes) {}

    @Override
    public void onInitialize(
        RuleTheory theory, Set<String> tables, int factCount) {}

    @Override
    public boolean onException(RuleTheory theory, Throwable e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onInsert(RuleTheory theory, Rule rule) {
      tracer.onInsert(theory, rule);
    }

    @Override
    public void onDelete(RuleTheory theory, Rule rule) {
      tracer.onDelete(theory, rule);
    }

    @Override
    public void onUpdate(
        RuleTheory theory, List<Event> events, List<Event> changes) {
      tracer.onUpdate(theory, events, changes);
    }

    @Override
    public void onInitialize(
        RuleTheory theory, Set<String> tables, int factCount) {
      tracer.onInitialize(theory, tables, factCount);
    }

    @Override
    public boolean onException(RuleTheory theory, Throwable e) {
      return tracer.onException(theory, e);
    }
  }
}

// End Tracers.java
