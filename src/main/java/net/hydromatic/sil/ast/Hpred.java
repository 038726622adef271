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
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Ordering;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import net.hydromatic.sil.util.Static;

/**
 * Heap predicate: an atomic fact about the heap.
 *
 * <p>A heap predicate is a {@link PointsTo points-to} fact, a singly-linked
 * {@link Lseg list segment}, or a {@link Dllseg doubly-linked list segment}.
 *
 * <p>{@link #equals}, {@link #hashCode} and {@link #compareTo} ignore
 * instrumentation; use {@link #equal(Hpred, Hpred, boolean)} and {@link
 * #compare(Hpred, Hpred, boolean)} to take it into account.
 */
public abstract class Hpred implements Comparable<Hpred> {
  static final Ordering<Iterable<Exp>> EXPS =
      Ordering.<Exp>natural().lexicographical();

  public final Op op;
  private final int hash;
  private final int instHash;

  Hpred(Op op, int hash, int instHash) {
    this.op = requireNonNull(op);
    this.hash = hash;
    this.instHash = instHash;
  }

  /** Creates an ordered set of heap predicates, ignoring instrumentation. */
  public static ImmutableSortedSet<Hpred> setOf(
      Iterable<? extends Hpred> hpreds) {
    return ImmutableSortedSet.copyOf(Ordering.natural(), hpreds);
  }

  /** Accepts a shuttle, returning the rewritten predicate. */
  public abstract Hpred accept(Shuttle shuttle);

  /**
   * Returns the identifiers free in this predicate, in order, with
   * repetitions. The sequence is lazy and may be iterated more than once.
   *
   * <p>For a list segment, the identifiers bound by its parameter are
   * excluded.
   */
  public abstract Iterable<Ident> freeVars();

  /**
   * Returns the expressions that denote entry points into this predicate:
   * the address of a points-to, the start of a list segment, the first and
   * last cells of a doubly-linked segment.
   */
  public abstract List<Exp> entries();

  /**
   * Returns whether this predicate describes an Objective-C object: a
   * points-to whose type is the size of an Objective-C class.
   */
  public boolean isObjcObject() {
    return false;
  }

  /** Compares two predicates; if {@code inst}, compares instrumentation too. */
  public static int compare(Hpred h1, Hpred h2, boolean inst) {
    if (h1 == h2) {
      return 0;
    }
    final int c = h1.op.compareTo(h2.op);
    return c != 0 ? c : h1.compareSameOp(h2, inst);
  }

  /**
   * Returns whether two predicates are equal; if {@code inst},
   * instrumentation must be equal too.
   */
  public static boolean equal(Hpred h1, Hpred h2, boolean inst) {
    return h1 == h2
        || h1.hashCode(inst) == h2.hashCode(inst) && compare(h1, h2, inst) == 0;
  }

  /** Returns a hash code, including instrumentation if {@code inst}. */
  public final int hashCode(boolean inst) {
    return inst ? instHash : hash;
  }

  abstract int compareSameOp(Hpred o, boolean inst);

  @Override
  public int compareTo(Hpred o) {
    return compare(this, o, false);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Hpred && equal(this, (Hpred) obj, false);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  static int compareLists(List<Hpred> list1, List<Hpred> list2, boolean inst) {
    final int n = Math.min(list1.size(), list2.size());
    for (int i = 0; i < n; i++) {
      final int c = compare(list1.get(i), list2.get(i), inst);
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(list1.size(), list2.size());
  }

  static int hashList(List<Hpred> list, boolean inst) {
    int h = 1;
    for (Hpred hpred : list) {
      h = h * 31 + hpred.hashCode(inst);
    }
    return h;
  }

  /** Points-to fact, "lexp |-> strexp : texp". */
  public static final class PointsTo extends Hpred {
    public final Exp lexp;
    public final Strexp strexp;
    /** Type of the cell, usually a {@link Exp.Sizeof}. */
    public final Exp texp;

    PointsTo(Exp lexp, Strexp strexp, Exp texp) {
      super(
          Op.POINTS_TO,
          Objects.hash(lexp, strexp.hashCode(false), texp),
          Objects.hash(lexp, strexp.hashCode(true), texp));
      this.lexp = requireNonNull(lexp);
      this.strexp = requireNonNull(strexp);
      this.texp = requireNonNull(texp);
    }

    @Override
    public Hpred accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public PointsTo copy(Exp lexp, Strexp strexp, Exp texp) {
      return lexp == this.lexp && strexp == this.strexp && texp == this.texp
          ? this
          : new PointsTo(lexp, strexp, texp);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return Iterables.concat(
          lexp.freeVars(), strexp.freeVars(), texp.freeVars());
    }

    @Override
    public List<Exp> entries() {
      return ImmutableList.of(lexp);
    }

    @Override
    public boolean isObjcObject() {
      return texp instanceof Exp.Sizeof
          && ((Exp.Sizeof) texp).typ.isObjcClass();
    }

    @Override
    int compareSameOp(Hpred o, boolean inst) {
      final PointsTo that = (PointsTo) o;
      int c = lexp.compareTo(that.lexp);
      if (c == 0) {
        c = Strexp.compare(strexp, that.strexp, inst);
      }
      return c != 0 ? c : texp.compareTo(that.texp);
    }

    @Override
    public String toString() {
      return lexp + op.padded + strexp + " : " + texp;
    }
  }

  /** Singly-linked list segment from {@code from} to {@code to}. */
  public static final class Lseg extends Hpred {
    public final LsegKind kind;
    public final Hpara para;
    public final Exp from;
    public final Exp to;
    /** Actual arguments for the parameter's shared variables. */
    public final ImmutableList<Exp> shared;

    Lseg(
        LsegKind kind,
        Hpara para,
        Exp from,
        Exp to,
        ImmutableList<Exp> shared) {
      super(
          Op.LSEG,
          Objects.hash(kind, para.hashCode(false), from, to, shared),
          Objects.hash(kind, para.hashCode(true), from, to, shared));
      this.kind = requireNonNull(kind);
      this.para = requireNonNull(para);
      this.from = requireNonNull(from);
      this.to = requireNonNull(to);
      this.shared = requireNonNull(shared);
    }

    @Override
    public Hpred accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Lseg copy(Hpara para, Exp from, Exp to, List<Exp> shared) {
      return para == this.para
              && from == this.from
              && to == this.to
              && Static.sameElements(shared, this.shared)
          ? this
          : new Lseg(kind, para, from, to, ImmutableList.copyOf(shared));
    }

    /** Creates a copy with a different kind. */
    public Lseg withKind(LsegKind kind) {
      return kind == this.kind ? this : new Lseg(kind, para, from, to, shared);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return Iterables.concat(
          para.freeVars(),
          from.freeVars(),
          to.freeVars(),
          Iterables.concat(Iterables.transform(shared, Exp::freeVars)));
    }

    @Override
    public List<Exp> entries() {
      return ImmutableList.of(from);
    }

    @Override
    int compareSameOp(Hpred o, boolean inst) {
      final Lseg that = (Lseg) o;
      final int c = kind.compareTo(that.kind);
      if (c != 0) {
        return c;
      }
      final int c2 = Hpara.compare(para, that.para, inst);
      if (c2 != 0) {
        return c2;
      }
      return ComparisonChain.start()
          .compare(from, that.from)
          .compare(to, that.to)
          .compare(shared, that.shared, EXPS)
          .result();
    }

    @Override
    public String toString() {
      return "lseg" + kind.name().toLowerCase(Locale.ROOT)
          + "(" + para + ", " + from + ", " + to + ", " + shared + ")";
    }
  }

  /**
   * Doubly-linked list segment.
   *
   * <p>{@code firstCell} is the first cell and {@code blinkOut} its backward
   * link; {@code lastCell} is the last cell and {@code flinkOut} its forward
   * link.
   */
  public static final class Dllseg extends Hpred {
    public final LsegKind kind;
    public final HparaDll para;
    public final Exp firstCell;
    public final Exp blinkOut;
    public final Exp flinkOut;
    public final Exp lastCell;
    public final ImmutableList<Exp> shared;

    Dllseg(
        LsegKind kind,
        HparaDll para,
        Exp firstCell,
        Exp blinkOut,
        Exp flinkOut,
        Exp lastCell,
        ImmutableList<Exp> shared) {
      super(
          Op.DLLSEG,
          Objects.hash(
              kind,
              para.hashCode(false),
              firstCell,
              blinkOut,
              flinkOut,
              lastCell,
              shared),
          Objects.hash(
              kind,
              para.hashCode(true),
              firstCell,
              blinkOut,
              flinkOut,
              lastCell,
              shared));
      this.kind = requireNonNull(kind);
      this.para = requireNonNull(para);
      this.firstCell = requireNonNull(firstCell);
      this.blinkOut = requireNonNull(blinkOut);
      this.flinkOut = requireNonNull(flinkOut);
      this.lastCell = requireNonNull(lastCell);
      this.shared = requireNonNull(shared);
    }

    @Override
    public Hpred accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Dllseg copy(
        HparaDll para,
        Exp firstCell,
        Exp blinkOut,
        Exp flinkOut,
        Exp lastCell,
        List<Exp> shared) {
      return para == this.para
              && firstCell == this.firstCell
              && blinkOut == this.blinkOut
              && flinkOut == this.flinkOut
              && lastCell == this.lastCell
              && Static.sameElements(shared, this.shared)
          ? this
          : new Dllseg(
              kind,
              para,
              firstCell,
              blinkOut,
              flinkOut,
              lastCell,
              ImmutableList.copyOf(shared));
    }

    /** Creates a copy with a different kind. */
    public Dllseg withKind(LsegKind kind) {
      return kind == this.kind
          ? this
          : new Dllseg(
              kind, para, firstCell, blinkOut, flinkOut, lastCell, shared);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return Iterables.concat(
          para.freeVars(),
          Iterables.concat(
              Iterables.transform(
                  ImmutableList.of(firstCell, blinkOut, flinkOut, lastCell),
                  Exp::freeVars)),
          Iterables.concat(Iterables.transform(shared, Exp::freeVars)));
    }

    @Override
    public List<Exp> entries() {
      return ImmutableList.of(firstCell, lastCell);
    }

    @Override
    int compareSameOp(Hpred o, boolean inst) {
      final Dllseg that = (Dllseg) o;
      final int c = kind.compareTo(that.kind);
      if (c != 0) {
        return c;
      }
      final int c2 = HparaDll.compare(para, that.para, inst);
      if (c2 != 0) {
        return c2;
      }
      return ComparisonChain.start()
          .compare(firstCell, that.firstCell)
          .compare(blinkOut, that.blinkOut)
          .compare(flinkOut, that.flinkOut)
          .compare(lastCell, that.lastCell)
          .compare(shared, that.shared, EXPS)
          .result();
    }

    @Override
    public String toString() {
      return "dllseg" + kind.name().toLowerCase(Locale.ROOT)
          + "(" + para + ", " + firstCell + ", " + blinkOut + ", " + flinkOut
          + ", " + lastCell + ", " + shared + ")";
    }
  }
}

// End Hpred.java
