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
package net.hydromatic.sil.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.util.List;
import java.util.Objects;
import net.hydromatic.sil.util.Static;

/**
 * Parameter of a doubly-linked list segment.
 *
 * <p>Represents {@code \(cell, blink, flink, svars). exists evars. body};
 * {@code blink} is the backward link of {@code cell}, {@code flink} its
 * forward link.
 */
public final class HparaDll implements Comparable<HparaDll> {
  public final Ident cell;
  public final Ident blink;
  public final Ident flink;
  public final ImmutableList<Ident> svars;
  public final ImmutableList<Ident> evars;
  public final ImmutableList<Hpred> body;

  private final int hash;
  private final int instHash;

  HparaDll(
      Ident cell,
      Ident blink,
      Ident flink,
      ImmutableList<Ident> svars,
      ImmutableList<Ident> evars,
      ImmutableList<Hpred> body) {
    this.cell = requireNonNull(cell);
    this.blink = requireNonNull(blink);
    this.flink = requireNonNull(flink);
    this.svars = requireNonNull(svars);
    this.evars = requireNonNull(evars);
    this.body = requireNonNull(body);
    assert bound().size() == 3 + svars.size() + evars.size()
        : "bound identifiers not distinct: " + this;
    final int h = Objects.hash(cell, blink, flink, svars, evars);
    this.hash = h * 31 + Hpred.hashList(body, false);
    this.instHash = h * 31 + Hpred.hashList(body, true);
  }

  /** Returns the identifiers bound by this closure. */
  public ImmutableSet<Ident> bound() {
    return ImmutableSet.<Ident>builder()
        .add(cell, blink, flink)
        .addAll(svars)
        .addAll(evars)
        .build();
  }

  /**
   * Returns the identifiers free in the body, excluding those bound by this
   * closure.
   */
  public Iterable<Ident> freeVars() {
    final ImmutableSet<Ident> bound = bound();
    return Iterables.filter(
        Iterables.concat(Iterables.transform(body, Hpred::freeVars)),
        id -> !bound.contains(id));
  }

  /** Creates a copy with a given body, or this if the body is the same. */
  public HparaDll copy(List<Hpred> body) {
    return Static.sameElements(body, this.body)
        ? this
        : new HparaDll(
            cell, blink, flink, svars, evars, ImmutableList.copyOf(body));
  }

  /** Compares two parameters; if {@code inst}, instrumentation counts. */
  public static int compare(HparaDll p1, HparaDll p2, boolean inst) {
    if (p1 == p2) {
      return 0;
    }
    final int c =
        ComparisonChain.start()
            .compare(p1.cell, p2.cell)
            .compare(p1.blink, p2.blink)
            .compare(p1.flink, p2.flink)
            .compare(p1.svars, p2.svars, Hpara.IDENTS)
            .compare(p1.evars, p2.evars, Hpara.IDENTS)
            .result();
    return c != 0 ? c : Hpred.compareLists(p1.body, p2.body, inst);
  }

  /** Returns a hash code, including instrumentation if {@code inst}. */
  public int hashCode(boolean inst) {
    return inst ? instHash : hash;
  }

  @Override
  public int compareTo(HparaDll o) {
    return compare(this, o, false);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof HparaDll
            && hash == ((HparaDll) obj).hash
            && compare(this, (HparaDll) obj, false) == 0;
  }

  @Override
  public String toString() {
    return "(\\" + cell + ", " + blink + ", " + flink + ", " + svars
        + ". exists " + evars + ". " + body + ")";
  }
}

// End HparaDll.java
