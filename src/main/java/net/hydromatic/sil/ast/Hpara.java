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
import com.google.common.collect.Ordering;
import java.util.List;
import java.util.Objects;
import net.hydromatic.sil.util.Static;

/**
 * Parameter of a singly-linked list segment.
 *
 * <p>Represents the inductive definition
 * {@code \(root, next, svars). exists evars. body}: one unfolding step of the
 * list. Identifiers {@code root}, {@code next}, {@code svars} and {@code
 * evars} are disjoint; the body refers to no other identifier.
 *
 * <p>{@link #equals}, {@link #hashCode} and {@link #compareTo} ignore the
 * instrumentation of the body.
 */
public final class Hpara implements Comparable<Hpara> {
  static final Ordering<Iterable<Ident>> IDENTS =
      Ordering.<Ident>natural().lexicographical();

  public final Ident root;
  public final Ident next;
  /** Shared variables, threaded through every unfolding. */
  public final ImmutableList<Ident> svars;
  /** Existential variables, fresh in each unfolding. */
  public final ImmutableList<Ident> evars;
  public final ImmutableList<Hpred> body;

  private final int hash;
  private final int instHash;

  Hpara(
      Ident root,
      Ident next,
      ImmutableList<Ident> svars,
      ImmutableList<Ident> evars,
      ImmutableList<Hpred> body) {
    this.root = requireNonNull(root);
    this.next = requireNonNull(next);
    this.svars = requireNonNull(svars);
    this.evars = requireNonNull(evars);
    this.body = requireNonNull(body);
    assert bound().size() == 2 + svars.size() + evars.size()
        : "bound identifiers not distinct: " + this;
    final int h = Objects.hash(root, next, svars, evars);
    this.hash = h * 31 + Hpred.hashList(body, false);
    this.instHash = h * 31 + Hpred.hashList(body, true);
  }

  /** Returns the identifiers bound by this closure. */
  public ImmutableSet<Ident> bound() {
    return ImmutableSet.<Ident>builder()
        .add(root, next)
        .addAll(svars)
        .addAll(evars)
        .build();
  }

  /**
   * Returns the identifiers free in the body, in order, with repetitions;
   * excludes the identifiers bound by this closure. A nested parameter's
   * identifiers are excluded by that parameter's own closure.
   */
  public Iterable<Ident> freeVars() {
    final ImmutableSet<Ident> bound = bound();
    return Iterables.filter(
        Iterables.concat(Iterables.transform(body, Hpred::freeVars)),
        id -> !bound.contains(id));
  }

  /** Creates a copy with a given body, or this if the body is the same. */
  public Hpara copy(List<Hpred> body) {
    return Static.sameElements(body, this.body)
        ? this
        : new Hpara(root, next, svars, evars, ImmutableList.copyOf(body));
  }

  /** Compares two parameters; if {@code inst}, instrumentation counts. */
  public static int compare(Hpara p1, Hpara p2, boolean inst) {
    if (p1 == p2) {
      return 0;
    }
    final int c =
        ComparisonChain.start()
            .compare(p1.root, p2.root)
            .compare(p1.next, p2.next)
            .compare(p1.svars, p2.svars, IDENTS)
            .compare(p1.evars, p2.evars, IDENTS)
            .result();
    return c != 0 ? c : Hpred.compareLists(p1.body, p2.body, inst);
  }

  /** Returns a hash code, including instrumentation if {@code inst}. */
  public int hashCode(boolean inst) {
    return inst ? instHash : hash;
  }

  @Override
  public int compareTo(Hpara o) {
    return compare(this, o, false);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Hpara
            && hash == ((Hpara) obj).hash
            && compare(this, (Hpara) obj, false) == 0;
  }

  @Override
  public String toString() {
    return "(\\" + root + ", " + next + ", " + svars + ". exists " + evars
        + ". " + body + ")";
  }
}

// End Hpara.java
