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
package net.hydromatic.polis.util;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.function.Function;
import java.util.function.Predicate;

/** Utilities. */
public class Static {
  private Static() {}

  /** Returns whether a predicate is true for all elements of a list. */
  public static <E> boolean allMatch(
      Iterable<? extends E> iterable, Predicate<E> predicate) {
    for (E e : iterable) {
      if (!predicate.test(e)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Eagerly converts a Collection to an ImmutableList, applying a mapping
   * function to each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      Collection<? extends E> elements, Function<E, T> mapper) {
    if (elements.isEmpty()) {
      // Save ourselves the effort of creating a Builder.
      return ImmutableList.of();
    }
    final ImmutableList.Builder<T> b =
        ImmutableList.builderWithExpectedSize(elements.size());
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }

  /**
   * Eagerly converts an Iterable to an ImmutableList, keeping elements that
   * pass a predicate.
   */
  public static <E> ImmutableList<E> filterEager(
      Iterable<? extends E> elements, Predicate<E> predicate) {
    final ImmutableList.Builder<E> b = ImmutableList.builder();
    for (E e : elements) {
      if (predicate.test(e)) {
        b.add(e);
      }
    }
    return b.build();
  }

  /**
   * Returns an object whose {@link Object#toString()} renders at most {@code
   * limit} elements of a collection, followed by a count of the rest.
   *
   * <p>The string is only built when asked for, so the result can be passed
   * as a logging argument without cost when the log level is disabled.
   */
  public static Object abbreviate(Collection<?> elements, int limit) {
    checkArgument(limit >= 0, "limit must be non-negative: %s", limit);
    return new Object() {
      @Override
      public String toString() {
        final StringBuilder b = new StringBuilder("[");
        int i = 0;
        for (Object e : elements) {
          if (i == limit) {
            b.append(i > 0 ? "; " : "")
                .append("... ")
                .append(elements.size() - limit)
                .append(" more");
            break;
          }
          if (i++ > 0) {
            b.append("; ");
          }
          b.append(e);
        }
        return b.append(']').toString();
      }
    };
  }
}

// End Static.java
