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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Structured expression: the value of a heap cell.
 *
 * <p>A structured expression is a scalar ({@link Eexp}), a C structure
 * ({@link Estruct}) or an array ({@link Earray}); each carries an {@link
 * Inst instrumentation}.
 *
 * <p>{@link #equals}, {@link #hashCode} and {@link #compareTo} ignore
 * instrumentation; use {@link #equal(Strexp, Strexp, boolean)} and {@link
 * #compare(Strexp, Strexp, boolean)} to take it into account.
 */
public abstract class Strexp implements Comparable<Strexp> {
  public final Op op;
  public final Inst inst;
  private final int hash;
  private final int instHash;

  Strexp(Op op, Inst inst, int hash, int contentInstHash) {
    this.op = requireNonNull(op);
    this.inst = requireNonNull(inst);
    this.hash = hash;
    this.instHash = contentInstHash * 31 + inst.hashCode();
  }

  /** Accepts a shuttle, returning the rewritten value. */
  public abstract Strexp accept(Shuttle shuttle);

  /**
   * Returns the identifiers occurring in this value, in order, with
   * repetitions. The sequence is lazy and may be iterated more than once.
   */
  public abstract Iterable<Ident> freeVars();

  /** Compares two values; if {@code inst}, compares instrumentation too. */
  public static int compare(Strexp s1, Strexp s2, boolean inst) {
    if (s1 == s2) {
      return 0;
    }
    final int c = s1.op.compareTo(s2.op);
    return c != 0 ? c : s1.compareSameOp(s2, inst);
  }

  /**
   * Returns whether two values are equal; if {@code inst}, instrumentation
   * must be equal too.
   */
  public static boolean equal(Strexp s1, Strexp s2, boolean inst) {
    return s1 == s2
        || s1.hashCode(inst) == s2.hashCode(inst) && compare(s1, s2, inst) == 0;
  }

  /** Returns a hash code, including instrumentation if {@code inst}. */
  public final int hashCode(boolean inst) {
    return inst ? instHash : hash;
  }

  abstract int compareSameOp(Strexp o, boolean inst);

  /** Compares instrumentations if {@code inst} is set. */
  int compareInst(Strexp o, boolean inst) {
    return inst ? this.inst.compareTo(o.inst) : 0;
  }

  @Override
  public int compareTo(Strexp o) {
    return compare(this, o, false);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Strexp && equal(this, (Strexp) obj, false);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  /** Compares two lists of entries whose values are structured expressions. */
  static <K> int compareEntries(
      List<Map.Entry<K, Strexp>> list1,
      List<Map.Entry<K, Strexp>> list2,
      Comparator<K> keyComparator,
      boolean inst) {
    final int n = Math.min(list1.size(), list2.size());
    for (int i = 0; i < n; i++) {
      final Map.Entry<K, Strexp> e1 = list1.get(i);
      final Map.Entry<K, Strexp> e2 = list2.get(i);
      int c = keyComparator.compare(e1.getKey(), e2.getKey());
      if (c == 0) {
        c = compare(e1.getValue(), e2.getValue(), inst);
      }
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(list1.size(), list2.size());
  }

  static <K> int hashEntries(List<Map.Entry<K, Strexp>> list, boolean inst) {
    int h = 1;
    for (Map.Entry<K, Strexp> e : list) {
      h = h * 31 + e.getKey().hashCode();
      h = h * 31 + e.getValue().hashCode(inst);
    }
    return h;
  }

  /** Returns whether two lists of entries have identical keys and values. */
  static <K, V> boolean sameEntries(
      List<Map.Entry<K, V>> list1, List<Map.Entry<K, V>> list2) {
    if (list1.size() != list2.size()) {
      return false;
    }
    for (int i = 0; i < list1.size(); i++) {
      if (list1.get(i).getKey() != list2.get(i).getKey()
          || list1.get(i).getValue() != list2.get(i).getValue()) {
        return false;
      }
    }
    return true;
  }

  /** Scalar value: an expression with its instrumentation. */
  public static final class Eexp extends Strexp {
    public final Exp exp;

    Eexp(Exp exp, Inst inst) {
      super(Op.EEXP, inst, exp.hashCode(), exp.hashCode());
      this.exp = requireNonNull(exp);
    }

    @Override
    public Strexp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Eexp copy(Exp exp, Inst inst) {
      return exp == this.exp && inst == this.inst ? this : new Eexp(exp, inst);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return exp.freeVars();
    }

    @Override
    int compareSameOp(Strexp o, boolean inst) {
      final Eexp that = (Eexp) o;
      final int c = exp.compareTo(that.exp);
      return c != 0 ? c : compareInst(o, inst);
    }

    @Override
    public String toString() {
      return exp.toString();
    }
  }

  /** C structure: a list of fields, each with a value. */
  public static final class Estruct extends Strexp {
    public final ImmutableList<Map.Entry<String, Strexp>> fields;

    Estruct(ImmutableList<Map.Entry<String, Strexp>> fields, Inst inst) {
      super(
          Op.ESTRUCT,
          inst,
          hashEntries(fields, false),
          hashEntries(fields, true));
      this.fields = requireNonNull(fields);
    }

    @Override
    public Strexp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Estruct copy(List<Map.Entry<String, Strexp>> fields, Inst inst) {
      return sameEntries(fields, this.fields) && inst == this.inst
          ? this
          : new Estruct(ImmutableList.copyOf(fields), inst);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return Iterables.concat(
          Iterables.transform(fields, e -> e.getValue().freeVars()));
    }

    @Override
    int compareSameOp(Strexp o, boolean inst) {
      final Estruct that = (Estruct) o;
      final int c =
          compareEntries(
              fields, that.fields, Comparator.<String>naturalOrder(), inst);
      return c != 0 ? c : compareInst(o, inst);
    }

    @Override
    public String toString() {
      return fields.stream()
          .map(e -> e.getKey() + ":" + e.getValue())
          .collect(Collectors.joining(", ", "{", "}"));
    }
  }

  /**
   * Array of a given length, with values at some indices.
   *
   * <p>Two conditions are imposed on, and used by, arrays. First, each index
   * is less than the length; for instance, {@code x |-> [10 | e1: v1]}
   * implies {@code e1 <= 9}. Second, distinct entries have distinct indices;
   * for instance, {@code x |-> [10 | e1: v1, e2: v2]} implies {@code e1 !=
   * e2}. This class does not check these conditions; whoever builds or
   * rewrites an array must maintain them.
   */
  public static final class Earray extends Strexp {
    public final Exp length;
    public final ImmutableList<Map.Entry<Exp, Strexp>> elements;

    Earray(
        Exp length, ImmutableList<Map.Entry<Exp, Strexp>> elements, Inst inst) {
      super(
          Op.EARRAY,
          inst,
          length.hashCode() * 31 + hashEntries(elements, false),
          length.hashCode() * 31 + hashEntries(elements, true));
      this.length = requireNonNull(length);
      this.elements = requireNonNull(elements);
    }

    @Override
    public Strexp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Earray copy(
        Exp length, List<Map.Entry<Exp, Strexp>> elements, Inst inst) {
      return length == this.length
              && sameEntries(elements, this.elements)
              && inst == this.inst
          ? this
          : new Earray(length, ImmutableList.copyOf(elements), inst);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return Iterables.concat(
          length.freeVars(),
          Iterables.concat(
              Iterables.transform(
                  elements,
                  e ->
                      Iterables.concat(
                          e.getKey().freeVars(), e.getValue().freeVars()))));
    }

    @Override
    int compareSameOp(Strexp o, boolean inst) {
      final Earray that = (Earray) o;
      int c = length.compareTo(that.length);
      if (c == 0) {
        c =
            compareEntries(
                elements, that.elements, Comparator.<Exp>naturalOrder(), inst);
      }
      return c != 0 ? c : compareInst(o, inst);
    }

    @Override
    public String toString() {
      return elements.stream()
          .map(e -> e.getKey() + ":" + e.getValue())
          .collect(Collectors.joining(", ", "[" + length + "|", "]"));
    }
  }
}

// End Strexp.java
