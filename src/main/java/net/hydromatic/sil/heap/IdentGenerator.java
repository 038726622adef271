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
package net.hydromatic.sil.heap;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import net.hydromatic.sil.ast.Ident;

/**
 * Generates fresh identifiers.
 *
 * <p>Each generated identifier has a stamp that this generator has never
 * used before, and that no identifier it has been told to avoid has.
 * Belongs to one {@link Session}; not thread-safe.
 */
public class IdentGenerator {
  private int stamp = 0;
  private final Set<Integer> reserved = new HashSet<>();

  /**
   * Marks the stamps of some identifiers as used, so that no generated
   * identifier will collide with them.
   */
  public void avoid(Iterable<Ident> ids) {
    ids.forEach(this::avoid);
  }

  /** Marks the stamp of an identifier as used. */
  public void avoid(Ident id) {
    if (id.stamp >= stamp) {
      reserved.add(id.stamp);
    }
  }

  /** Generates a fresh identifier of a given kind and name. */
  public Ident create(Ident.Kind kind, String name) {
    for (;;) {
      final int s = stamp++;
      // a skipped stamp is consumed; the next call will not see it
      if (!reserved.remove(s)) {
        return Ident.of(kind, name, s);
      }
    }
  }

  /** Generates a list of fresh primed identifiers. */
  public ImmutableList<Ident> createPrimed(String name, int count) {
    final ImmutableList.Builder<Ident> b = ImmutableList.builder();
    for (int i = 0; i < count; i++) {
      b.add(create(Ident.Kind.PRIMED, name));
    }
    return b.build();
  }

  /** Returns the stamp that the next identifier will have, at least. */
  public int nextStamp() {
    return stamp;
  }
}

// End IdentGenerator.java
