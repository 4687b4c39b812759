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

import static java.util.Objects.requireNonNull;

import java.util.AbstractSet;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Set that remembers the order in which elements were added, and whose
 * {@link #add} and {@link #discard} report whether they changed it.
 *
 * <p>Membership test, addition and removal are O(1). Iteration is in
 * insertion order; re-adding an element that is already present does not
 * move it.
 *
 * <p>Unlike {@link java.util.LinkedHashSet}, it can iterate backwards and
 * pop from either end, and two {@code OrderedSet}s are equal only if they
 * contain the same elements in the same order.
 *
 * <p>An {@code OrderedSet} is never equal to a set of another class. This
 * breaks the {@link java.util.Set#equals} contract, which compares elements
 * only, and the relation is not symmetric: a {@code HashSet} may still
 * consider itself equal to an {@code OrderedSet}. Copy to an immutable set
 * before comparing with other sets.
 *
 * @param <E> Element type
 */
public class OrderedSet<E> extends AbstractSet<E> {
  private final Map<E, Entry<E>> map = new HashMap<>();

  /** Sentinel of the circular doubly-linked list. */
  private final Entry<E> end = new Entry<>(null);

  private int modCount;

  /** Creates an empty OrderedSet. */
  public OrderedSet() {
    end.prev = end;
    end.next = end;
  }

  /** Creates an OrderedSet containing the given elements, in order. */
  public OrderedSet(Iterable<? extends E> elements) {
    this();
    for (E e : elements) {
      add(e);
    }
  }

  @Override
  public int size() {
    return map.size();
  }

  @Override
  public boolean contains(Object o) {
    return map.containsKey(o);
  }

  /** Adds an element at the end; returns whether the set changed. */
  @Override
  public boolean add(E e) {
    requireNonNull(e);
    if (map.containsKey(e)) {
      return false;
    }
    final Entry<E> entry = new Entry<>(e);
    entry.prev = end.prev;
    entry.next = end;
    end.prev.next = entry;
    end.prev = entry;
    map.put(e, entry);
    ++modCount;
    return true;
  }

  /** Removes an element; returns whether the set changed. */
  public boolean discard(Object o) {
    final Entry<E> entry = map.remove(o);
    if (entry == null) {
      return false;
    }
    unlink(entry);
    return true;
  }

  @Override
  public boolean remove(Object o) {
    return discard(o);
  }

  @Override
  public void clear() {
    map.clear();
    end.prev = end;
    end.next = end;
    ++modCount;
  }

  private void unlink(Entry<E> entry) {
    entry.prev.next = entry.next;
    entry.next.prev = entry.prev;
    ++modCount;
  }

  /**
   * Removes and returns the last element (if {@code last}) or the first.
   *
   * @throws NoSuchElementException if the set is empty
   */
  public E pop(boolean last) {
    if (map.isEmpty()) {
      throw new NoSuchElementException("pop from an empty set");
    }
    final Entry<E> entry = last ? end.prev : end.next;
    final E e = requireNonNull(entry.element);
    discard(e);
    return e;
  }

  @Override
  public Iterator<E> iterator() {
    return new Itr(true);
  }

  /** Returns an iterator over the elements, last added first. */
  public Iterator<E> descendingIterator() {
    return new Itr(false);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    }
    if (o instanceof OrderedSet) {
      final OrderedSet<?> that = (OrderedSet<?>) o;
      if (size() != that.size()) {
        return false;
      }
      final Iterator<?> thatIterator = that.iterator();
      for (E e : this) {
        if (!e.equals(thatIterator.next())) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return super.hashCode();
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("OrderedSet[");
    int i = 0;
    for (E e : this) {
      if (i++ > 0) {
        b.append(", ");
      }
      b.append(e);
    }
    return b.append(']').toString();
  }

  /** Node of the linked list. */
  private static class Entry<E> {
    final @Nullable E element;
    Entry<E> prev;
    Entry<E> next;

    @SuppressWarnings("initialization")
    Entry(@Nullable E element) {
      this.element = element;
    }
  }

  /** Iterator that walks the list in one direction. */
  private class Itr implements Iterator<E> {
    private final boolean forward;
    private Entry<E> next;
    private @Nullable Entry<E> lastReturned;
    private int expectedModCount = modCount;

    Itr(boolean forward) {
      this.forward = forward;
      this.next = forward ? end.next : end.prev;
    }

    @Override
    public boolean hasNext() {
      return next != end;
    }

    @Override
    public E next() {
      if (modCount != expectedModCount) {
        throw new ConcurrentModificationException();
      }
      if (next == end) {
        throw new NoSuchElementException();
      }
      lastReturned = next;
      next = forward ? next.next : next.prev;
      return requireNonNull(lastReturned.element);
    }

    @Override
    public void remove() {
      if (lastReturned == null) {
        throw new IllegalStateException();
      }
      if (modCount != expectedModCount) {
        throw new ConcurrentModificationException();
      }
      discard(lastReturned.element);
      lastReturned = null;
      expectedModCount = modCount;
    }
  }
}

// End OrderedSet.java
