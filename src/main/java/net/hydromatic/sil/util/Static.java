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
package net.hydromatic.sil.util;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/** Utilities. */
public class Static {
  private Static() {}

  /** Returns whether a predicate is true for at least one element of a list. */
  public static <E> boolean anyMatch(
      Iterable<? extends E> iterable, Predicate<E> predicate) {
    for (E e : iterable) {
      if (predicate.test(e)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns whether two lists have the same length and, at each position,
   * the same object.
   *
   * <p>Used by {@code copy} methods to decide whether a node is unchanged.
   */
  public static <E> boolean sameElements(
      List<? extends E> list1, List<? extends E> list2) {
    if (list1 == list2) {
      return true;
    }
    if (list1.size() != list2.size()) {
      return false;
    }
    for (int i = 0; i < list1.size(); i++) {
      if (list1.get(i) != list2.get(i)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Eagerly converts a List to an ImmutableList, applying a mapping function
   * to each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      List<? extends E> elements, Function<E, T> mapper) {
    switch (elements.size()) {
      case 0:
        return ImmutableList.of();

      case 1:
        return ImmutableList.of(mapper.apply(elements.get(0)));

      default:
        final ImmutableList.Builder<T> b =
            ImmutableList.builderWithExpectedSize(elements.size());
        elements.forEach(e -> b.add(mapper.apply(e)));
        return b.build();
    }
  }

  /**
   * Eagerly filters a List, returning an ImmutableList.
   *
   * <p>If every element passes, returns the original list if it is already
   * immutable.
   */
  public static <E> ImmutableList<E> filterEager(
      List<E> elements, Predicate<E> predicate) {
    final ImmutableList.Builder<E> b = ImmutableList.builder();
    int n = 0;
    for (E e : elements) {
      if (predicate.test(e)) {
        b.add(e);
        ++n;
      }
    }
    if (n == elements.size() && elements instanceof ImmutableList) {
      return (ImmutableList<E>) elements;
    }
    return b.build();
  }

  /** Returns a list with an element appended. */
  public static <E> List<E> append(List<E> list, E e) {
    return ImmutableList.<E>builder().addAll(list).add(e).build();
  }
}

// End Static.java
