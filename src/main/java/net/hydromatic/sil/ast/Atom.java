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
import com.google.common.collect.Iterables;
import com.google.common.collect.Ordering;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import net.hydromatic.sil.util.Static;

/**
 * Pure atomic formula: an equality, a disequality, or a (possibly negated)
 * predicate applied to expressions.
 */
public abstract class Atom implements Comparable<Atom> {
  private static final Ordering<Iterable<Exp>> LEXICOGRAPHICAL =
      Ordering.<Exp>natural().lexicographical();

  public final Op op;

  Atom(Op op) {
    this.op = requireNonNull(op);
  }

  /** Accepts a shuttle, returning the rewritten atom. */
  public abstract Atom accept(Shuttle shuttle);

  /** Returns the expressions in this atom, in order. */
  public abstract List<Exp> exps();

  /** Returns whether this atom refers to the address of a local variable. */
  public boolean hasLocalAddr() {
    return Static.anyMatch(exps(), Exp::hasLocalAddr);
  }

  /**
   * Returns the identifiers occurring in this atom, in order, with
   * repetitions. The sequence is lazy and may be iterated more than once.
   */
  public Iterable<Ident> freeVars() {
    return Iterables.concat(Iterables.transform(exps(), Exp::freeVars));
  }

  @Override
  public int compareTo(Atom o) {
    if (this == o) {
      return 0;
    }
    final int c = op.compareTo(o.op);
    return c != 0 ? c : compareSameOp(o);
  }

  abstract int compareSameOp(Atom o);

  @Override
  public boolean equals(Object obj) {
    return obj == this || obj instanceof Atom && compareTo((Atom) obj) == 0;
  }

  @Override
  public abstract int hashCode();

  /**
   * Binary atom; an {@link Op#ATOM_EQ equality} or {@link Op#ATOM_NEQ
   * disequality}.
   */
  public static final class Binary extends Atom {
    public final Exp left;
    public final Exp right;

    Binary(Op op, Exp left, Exp right) {
      super(op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public Atom accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Binary copy(Exp left, Exp right) {
      return left == this.left && right == this.right
          ? this
          : new Binary(op, left, right);
    }

    @Override
    public List<Exp> exps() {
      return ImmutableList.of(left, right);
    }

    @Override
    int compareSameOp(Atom o) {
      final Binary that = (Binary) o;
      return ComparisonChain.start()
          .compare(left, that.left)
          .compare(right, that.right)
          .result();
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override
    public String toString() {
      return left + op.padded + right;
    }
  }

  /**
   * Application of a predicate symbol; {@link Op#ATOM_PRED positive} or
   * {@link Op#ATOM_NPRED negated}.
   */
  public static final class Pred extends Atom {
    public final PredSymbol symbol;
    public final ImmutableList<Exp> args;

    Pred(Op op, PredSymbol symbol, ImmutableList<Exp> args) {
      super(op);
      this.symbol = requireNonNull(symbol);
      this.args = requireNonNull(args);
    }

    @Override
    public Atom accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Whether the predicate is negated. */
    public boolean negated() {
      return op == Op.ATOM_NPRED;
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Pred copy(List<Exp> args) {
      return Static.sameElements(args, this.args)
          ? this
          : new Pred(op, symbol, ImmutableList.copyOf(args));
    }

    @Override
    public List<Exp> exps() {
      return args;
    }

    @Override
    int compareSameOp(Atom o) {
      final Pred that = (Pred) o;
      return ComparisonChain.start()
          .compare(symbol, that.symbol)
          .compare(args, that.args, LEXICOGRAPHICAL)
          .result();
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, symbol, args);
    }

    @Override
    public String toString() {
      return (negated() ? "!" : "")
          + symbol
          + args.stream()
              .map(Exp::toString)
              .collect(Collectors.joining(", ", "(", ")"));
    }
  }
}

// End Atom.java
