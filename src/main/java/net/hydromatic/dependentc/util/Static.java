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
package net.hydromatic.dependentc.util;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/** List utilities. */
public class Static {
  private Static() {}

  /**
   * Returns whether two lists hold the same objects, compared by identity, in
   * the same order.
   *
   * <p>A shuttle rebuilds a node only if some child came back as a different
   * object.
   */
  public static <E> boolean allSame(List<E> list0, List<E> list1) {
    if (list0 == list1) {
      return true;
    }
    if (list0.size() != list1.size()) {
      return false;
    }
    final Iterator<E> iterator1 = list1.iterator();
    for (E e0 : list0) {
      if (e0 != iterator1.next()) {
        return false;
      }
    }
    return true;
  }

  /** Returns a view of {@code list} without its first {@code n} elements. */
  public static <E> List<E> skip(List<E> list, int n) {
    return list.subList(n, list.size());
  }

  /** Applies {@code mapper} to each element, once, and returns the results
   * as an immutable list. */
  public static <E, T> ImmutableList<T> transformEager(List<E> elements,
      Function<? super E, ? extends T> mapper) {
    return elements.stream().map(mapper).collect(toImmutableList());
  }
}

// End Static.java
