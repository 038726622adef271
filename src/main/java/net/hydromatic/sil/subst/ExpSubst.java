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
package net.hydromatic.sil.subst;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.ExpShuttle;
import net.hydromatic.sil.ast.Ident;
import net.hydromatic.sil.type.Typ;

/**
 * Substitution from identifiers to expressions.
 *
 * <p>The domain has no repeated identifiers. Bindings keep the order in which
 * they were added; {@link #toList()}, {@link #find} and the partitioning
 * methods all follow that order.
 *
 * <p>Immutable; every transformation produces a new substitution.
 */
public final class ExpSubst extends Subst {
  public static final ExpSubst EMPTY = new ExpSubst(ImmutableMap.of());

  private final ImmutableMap<Ident, Exp> map;
  private final ExpShuttle expShuttle = new Renamer();

  private ExpSubst(ImmutableMap<Ident, Exp> map) {
    this.map = requireNonNull(map);
  }

  /**
   * Creates a substitution from a list of bindings.
   *
   * <p>If an identifier occurs more than once, each occurrence must map to
   * the same expression; only assertions check this.
   */
  public static ExpSubst of(List<? extends Map.Entry<Ident, Exp>> bindings) {
    assert noConflicts(bindings) : "conflicting bindings " + bindings;
    return ofDuplicates(bindings);
  }

  /**
   * Creates a substitution from a list of bindings that may bind an
   * identifier more than once; keeps the first binding of each identifier.
   */
  public static ExpSubst ofDuplicates(
      List<? extends Map.Entry<Ident, Exp>> bindings) {
    if (bindings.isEmpty()) {
      return EMPTY;
    }
    final Map<Ident, Exp> map = new LinkedHashMap<>();
    for (Map.Entry<Ident, Exp> binding : bindings) {
      map.putIfAbsent(binding.getKey(), binding.getValue());
    }
    return new ExpSubst(ImmutableMap.copyOf(map));
  }

  /** Creates a substitution with a single binding. */
  public static ExpSubst of(Ident id, Exp exp) {
    return new ExpSubst(ImmutableMap.of(id, exp));
  }

  private static boolean noConflicts(
      List<? extends Map.Entry<Ident, Exp>> bindings) {
    final Map<Ident, Exp> map = new LinkedHashMap<>();
    for (Map.Entry<Ident, Exp> binding : bindings) {
      final Exp previous =
          map.putIfAbsent(binding.getKey(), binding.getValue());
      if (previous != null && !previous.equals(binding.getValue())) {
        return false;
      }
    }
    return true;
  }

  private static ExpSubst ofMap(Map<Ident, Exp> map) {
    return map.isEmpty() ? EMPTY : new ExpSubst(ImmutableMap.copyOf(map));
  }

  /** Returns the bindings, in order. */
  public ImmutableList<Map.Entry<Ident, Exp>> toList() {
    return map.entrySet().asList();
  }

  @Override
  public boolean isEmpty() {
    return map.isEmpty();
  }

  /** Returns the number of bindings. */
  public int size() {
    return map.size();
  }

  /** Returns the identifiers in the domain, in order. */
  public ImmutableList<Ident> domain() {
    return map.keySet().asList();
  }

  /** Returns the expressions in the range, in order, with repetitions. */
  public ImmutableList<Exp> range() {
    return map.values().asList();
  }

  /**
   * Returns the identifiers that occur in the range, in order, with
   * repetitions. The sequence is lazy and may be iterated more than once.
   */
  public Iterable<Ident> freeVars() {
    return Iterables.concat(Iterables.transform(map.values(), Exp::freeVars));
  }

  /** Returns the expression bound to an identifier, or empty. */
  public Optional<Exp> get(Ident id) {
    return Optional.ofNullable(map.get(id));
  }

  /**
   * Returns the expression bound to the first identifier that satisfies a
   * predicate.
   *
   * @throws BindingNotFoundException if no identifier satisfies it
   */
  public Exp find(Predicate<Ident> predicate) {
    return findOpt(predicate)
        .orElseThrow(
            () -> new BindingNotFoundException("no binding in " + this));
  }

  /**
   * Returns the expression bound to the first identifier that satisfies a
   * predicate, or empty.
   */
  public Optional<Exp> findOpt(Predicate<Ident> predicate) {
    for (Map.Entry<Ident, Exp> e : map.entrySet()) {
      if (predicate.test(e.getKey())) {
        return Optional.of(e.getValue());
      }
    }
    return Optional.empty();
  }

  /** Restricts the domain to identifiers that satisfy a predicate. */
  public ExpSubst filter(Predicate<Ident> predicate) {
    return filterPair((id, exp) -> predicate.test(id));
  }

  /** Restricts to bindings that satisfy a predicate. */
  public ExpSubst filterPair(BiPredicate<Ident, Exp> predicate) {
    final Map<Ident, Exp> filtered = new LinkedHashMap<>();
    map.forEach(
        (id, exp) -> {
          if (predicate.test(id, exp)) {
            filtered.put(id, exp);
          }
        });
    return filtered.size() == map.size() ? this : ofMap(filtered);
  }

  /**
   * Splits into the bindings whose expression satisfies a predicate and the
   * rest.
   */
  public Partition rangePartition(Predicate<Exp> predicate) {
    return partition((id, exp) -> predicate.test(exp));
  }

  /**
   * Splits into the bindings whose identifier satisfies a predicate and the
   * rest.
   */
  public Partition domainPartition(Predicate<Ident> predicate) {
    return partition((id, exp) -> predicate.test(id));
  }

  private Partition partition(BiPredicate<Ident, Exp> predicate) {
    final Map<Ident, Exp> accepted = new LinkedHashMap<>();
    final Map<Ident, Exp> rejected = new LinkedHashMap<>();
    map.forEach(
        (id, exp) ->
            (predicate.test(id, exp) ? accepted : rejected).put(id, exp));
    return new Partition(ofMap(accepted), ofMap(rejected));
  }

  /**
   * Returns the bindings common to two substitutions: each identifier bound
   * to the same expression in both. Keeps the order of {@code s1}.
   */
  public static ExpSubst join(ExpSubst s1, ExpSubst s2) {
    return s1.filterPair((id, exp) -> exp.equals(s2.map.get(id)));
  }

  /**
   * Computes the common part of two substitutions, and what remains of
   * each.
   *
   * <p>The common part equals {@link #join(ExpSubst, ExpSubst)}. An
   * identifier bound to different expressions occurs in both remainders.
   */
  public static Diff symmetricDifference(ExpSubst s1, ExpSubst s2) {
    final Partition p1 =
        s1.partition((id, exp) -> exp.equals(s2.map.get(id)));
    final ExpSubst left = p1.rejected;
    final ExpSubst right =
        s2.filterPair((id, exp) -> !exp.equals(s1.map.get(id)));
    return new Diff(p1.accepted, left, right);
  }

  /**
   * Adds a binding.
   *
   * <p>Returns empty if {@code id} is already bound to a different
   * expression; returns this substitution if it is bound to the same
   * expression.
   */
  public Optional<ExpSubst> extend(Ident id, Exp exp) {
    final Exp existing = map.get(id);
    if (existing != null) {
      return existing.equals(exp) ? Optional.of(this) : Optional.empty();
    }
    final ImmutableMap<Ident, Exp> extended =
        ImmutableMap.<Ident, Exp>builder().putAll(map).put(id, exp).build();
    return Optional.of(new ExpSubst(extended));
  }

  /** Applies a function to each expression in the range. */
  public ExpSubst rangeMap(UnaryOperator<Exp> expFn) {
    return map(id -> id, expFn);
  }

  /**
   * Applies functions to each identifier and each expression.
   *
   * <p>The identifier function must not map two identifiers to the same
   * identifier unless their expressions also coincide.
   */
  public ExpSubst map(UnaryOperator<Ident> idFn, UnaryOperator<Exp> expFn) {
    final ImmutableList.Builder<Map.Entry<Ident, Exp>> b =
        ImmutableList.builder();
    map.forEach(
        (id, exp) ->
            b.add(Maps.immutableEntry(idFn.apply(id), expFn.apply(exp))));
    return of(b.build());
  }

  @Override
  ExpShuttle expShuttle() {
    return expShuttle;
  }

  /**
   * {@inheritDoc}
   *
   * <p>A binder is renamed only if its image is an identifier.
   */
  @Override
  Ident applyToBinder(Ident id) {
    final Exp exp = map.get(id);
    return exp instanceof Exp.Var ? ((Exp.Var) exp).id : id;
  }

  @Override
  public Typ apply(Typ typ) {
    return typ;
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  /**
   * {@inheritDoc}
   *
   * <p>Two substitutions are equal if they have the same bindings in the
   * same order.
   */
  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof ExpSubst
            && toList().equals(((ExpSubst) obj).toList());
  }

  @Override
  public String toString() {
    return map.toString();
  }

  /** Replaces each bound identifier by its image. */
  private class Renamer extends ExpShuttle {
    @Override
    protected Exp visit(Exp.Var var) {
      final Exp exp = map.get(var.id);
      return exp == null ? var : exp;
    }
  }

  /** Result of {@link #rangePartition} and {@link #domainPartition}. */
  public static final class Partition {
    /** Bindings that satisfy the predicate. */
    public final ExpSubst accepted;
    /** Bindings that do not. */
    public final ExpSubst rejected;

    Partition(ExpSubst accepted, ExpSubst rejected) {
      this.accepted = requireNonNull(accepted);
      this.rejected = requireNonNull(rejected);
    }

    @Override
    public int hashCode() {
      return Objects.hash(accepted, rejected);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Partition
              && accepted.equals(((Partition) obj).accepted)
              && rejected.equals(((Partition) obj).rejected);
    }

    @Override
    public String toString() {
      return "(" + accepted + ", " + rejected + ")";
    }
  }

  /** Result of {@link #symmetricDifference}. */
  public static final class Diff {
    public final ExpSubst common;
    /** Bindings of the first substitution that are not common. */
    public final ExpSubst left;
    /** Bindings of the second substitution that are not common. */
    public final ExpSubst right;

    Diff(ExpSubst common, ExpSubst left, ExpSubst right) {
      this.common = requireNonNull(common);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(common, left, right);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Diff
              && common.equals(((Diff) obj).common)
              && left.equals(((Diff) obj).left)
              && right.equals(((Diff) obj).right);
    }

    @Override
    public String toString() {
      return "(" + common + ", " + left + ", " + right + ")";
    }
  }
}

// End ExpSubst.java
