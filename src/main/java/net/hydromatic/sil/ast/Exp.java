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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Ordering;
import java.util.Objects;
import net.hydromatic.sil.type.Typ;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expression: a program value or an address.
 *
 * <p>Expressions are immutable, totally ordered, and compared structurally.
 * Sub-classes are nested in this class so that the names stay short.
 */
public abstract class Exp implements Comparable<Exp> {
  public static final Const ZERO = new Const(0L);
  public static final Const ONE = new Const(1L);

  private static final Ordering<@Nullable Exp> NULLS_FIRST =
      Ordering.<Exp>natural().nullsFirst();

  public final Op op;

  Exp(Op op) {
    this.op = requireNonNull(op);
  }

  /** Creates a reference to an identifier. */
  public static Var var(Ident id) {
    return new Var(id);
  }

  /** Creates a constant. The value must be a Long, Double or String. */
  @SuppressWarnings("rawtypes")
  public static Const const_(Comparable value) {
    return new Const(value);
  }

  /** Creates an integer constant. */
  public static Const int_(long value) {
    return value == 0L ? ZERO : value == 1L ? ONE : new Const(value);
  }

  /** Creates the address of a program variable. */
  public static Lvar lvar(Pvar pvar) {
    return new Lvar(pvar);
  }

  /** Creates a field offset. */
  public static Lfield lfield(Exp exp, String fieldName, Typ typ) {
    return new Lfield(exp, fieldName, typ);
  }

  /** Creates an array offset. */
  public static Lindex lindex(Exp array, Exp index) {
    return new Lindex(array, index);
  }

  /** Creates a unary operation. */
  public static UnOp unOp(Op operator, Exp exp, @Nullable Typ typ) {
    return new UnOp(operator, exp, typ);
  }

  /** Creates a binary operation. */
  public static BinOp binOp(Op operator, Exp left, Exp right) {
    return new BinOp(operator, left, right);
  }

  /** Creates a cast. */
  public static Cast cast(Typ typ, Exp exp) {
    return new Cast(typ, exp);
  }

  /** Creates a "sizeof" expression; used as the type of a points-to. */
  public static Sizeof sizeof(Typ typ, @Nullable Exp length) {
    return new Sizeof(typ, length);
  }

  /** Accepts a shuttle, returning the rewritten expression. */
  public abstract Exp accept(ExpShuttle shuttle);

  /**
   * Returns the identifiers occurring in this expression, in order, with
   * repetitions. The sequence is lazy and may be iterated more than once.
   */
  public abstract Iterable<Ident> freeVars();

  /** Returns whether this expression refers to the address of a local. */
  public abstract boolean hasLocalAddr();

  @Override
  public final int compareTo(Exp o) {
    if (this == o) {
      return 0;
    }
    final int c = op.compareTo(o.op);
    return c != 0 ? c : compareSameOp(o);
  }

  /** Compares with an expression that has the same {@link #op}. */
  abstract int compareSameOp(Exp o);

  @Override
  public boolean equals(Object obj) {
    return obj == this || obj instanceof Exp && compareTo((Exp) obj) == 0;
  }

  @Override
  public abstract int hashCode();

  /** Reference to a logical identifier. */
  public static final class Var extends Exp {
    public final Ident id;

    Var(Ident id) {
      super(Op.VAR);
      this.id = requireNonNull(id);
    }

    @Override
    public Exp accept(ExpShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return ImmutableList.of(id);
    }

    @Override
    public boolean hasLocalAddr() {
      return false;
    }

    @Override
    int compareSameOp(Exp o) {
      return id.compareTo(((Var) o).id);
    }

    @Override
    public int hashCode() {
      return id.hashCode();
    }

    @Override
    public String toString() {
      return id.toString();
    }
  }

  /** Constant. */
  @SuppressWarnings("rawtypes")
  public static final class Const extends Exp {
    public final Comparable value;

    Const(Comparable value) {
      super(Op.CONST);
      this.value = requireNonNull(value);
      checkArgument(
          value instanceof Long
              || value instanceof Double
              || value instanceof String,
          "invalid constant %s",
          value);
    }

    @Override
    public Exp accept(ExpShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return ImmutableList.of();
    }

    @Override
    public boolean hasLocalAddr() {
      return false;
    }

    /** Returns whether this is the integer zero. */
    public boolean isZero() {
      return value.equals(0L);
    }

    @SuppressWarnings("unchecked")
    @Override
    int compareSameOp(Exp o) {
      final Const that = (Const) o;
      if (value.getClass() != that.value.getClass()) {
        return value
            .getClass()
            .getSimpleName()
            .compareTo(that.value.getClass().getSimpleName());
      }
      return value.compareTo(that.value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return value instanceof String ? "\"" + value + "\"" : value.toString();
    }
  }

  /** Address of a program variable. */
  public static final class Lvar extends Exp {
    public final Pvar pvar;

    Lvar(Pvar pvar) {
      super(Op.LVAR);
      this.pvar = requireNonNull(pvar);
    }

    @Override
    public Exp accept(ExpShuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return ImmutableList.of();
    }

    @Override
    public boolean hasLocalAddr() {
      return !pvar.isGlobal();
    }

    @Override
    int compareSameOp(Exp o) {
      return pvar.compareTo(((Lvar) o).pvar);
    }

    @Override
    public int hashCode() {
      return pvar.hashCode() + 11;
    }

    @Override
    public String toString() {
      return "&" + pvar;
    }
  }

  /** Offset of a field; "exp.fieldName". */
  public static final class Lfield extends Exp {
    public final Exp exp;
    public final String fieldName;
    public final Typ typ;

    Lfield(Exp exp, String fieldName, Typ typ) {
      super(Op.LFIELD);
      this.exp = requireNonNull(exp);
      this.fieldName = requireNonNull(fieldName);
      this.typ = requireNonNull(typ);
    }

    @Override
    public Exp accept(ExpShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Lfield copy(Exp exp, Typ typ) {
      return exp == this.exp && typ == this.typ
          ? this
          : new Lfield(exp, fieldName, typ);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return exp.freeVars();
    }

    @Override
    public boolean hasLocalAddr() {
      return exp.hasLocalAddr();
    }

    @Override
    int compareSameOp(Exp o) {
      final Lfield that = (Lfield) o;
      return ComparisonChain.start()
          .compare(exp, that.exp)
          .compare(fieldName, that.fieldName)
          .compare(typ, that.typ)
          .result();
    }

    @Override
    public int hashCode() {
      return Objects.hash(exp, fieldName, typ);
    }

    @Override
    public String toString() {
      return exp + "." + fieldName;
    }
  }

  /** Offset of an array element; "array[index]". */
  public static final class Lindex extends Exp {
    public final Exp array;
    public final Exp index;

    Lindex(Exp array, Exp index) {
      super(Op.LINDEX);
      this.array = requireNonNull(array);
      this.index = requireNonNull(index);
    }

    @Override
    public Exp accept(ExpShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Lindex copy(Exp array, Exp index) {
      return array == this.array && index == this.index
          ? this
          : new Lindex(array, index);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return Iterables.concat(array.freeVars(), index.freeVars());
    }

    @Override
    public boolean hasLocalAddr() {
      return array.hasLocalAddr() || index.hasLocalAddr();
    }

    @Override
    int compareSameOp(Exp o) {
      final Lindex that = (Lindex) o;
      return ComparisonChain.start()
          .compare(array, that.array)
          .compare(index, that.index)
          .result();
    }

    @Override
    public int hashCode() {
      return Objects.hash(array, index, 13);
    }

    @Override
    public String toString() {
      return array + "[" + index + "]";
    }
  }

  /** Unary operation. */
  public static final class UnOp extends Exp {
    public final Op operator;
    public final Exp exp;
    public final @Nullable Typ typ;

    UnOp(Op operator, Exp exp, @Nullable Typ typ) {
      super(Op.UN_OP);
      this.operator = requireNonNull(operator);
      this.exp = requireNonNull(exp);
      this.typ = typ;
      checkArgument(operator.isUnary(), "not a unary operator: %s", operator);
    }

    @Override
    public Exp accept(ExpShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public UnOp copy(Exp exp, @Nullable Typ typ) {
      return exp == this.exp && typ == this.typ
          ? this
          : new UnOp(operator, exp, typ);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return exp.freeVars();
    }

    @Override
    public boolean hasLocalAddr() {
      return exp.hasLocalAddr();
    }

    @Override
    int compareSameOp(Exp o) {
      final UnOp that = (UnOp) o;
      return ComparisonChain.start()
          .compare(operator, that.operator)
          .compare(exp, that.exp)
          .compare(typ, that.typ, Ordering.<Typ>natural().nullsFirst())
          .result();
    }

    @Override
    public int hashCode() {
      return Objects.hash(operator, exp, typ);
    }

    @Override
    public String toString() {
      return operator.padded + exp;
    }
  }

  /** Binary operation. */
  public static final class BinOp extends Exp {
    public final Op operator;
    public final Exp left;
    public final Exp right;

    BinOp(Op operator, Exp left, Exp right) {
      super(Op.BIN_OP);
      this.operator = requireNonNull(operator);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
      checkArgument(operator.isBinary(), "not a binary operator: %s", operator);
    }

    @Override
    public Exp accept(ExpShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public BinOp copy(Exp left, Exp right) {
      return left == this.left && right == this.right
          ? this
          : new BinOp(operator, left, right);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return Iterables.concat(left.freeVars(), right.freeVars());
    }

    @Override
    public boolean hasLocalAddr() {
      return left.hasLocalAddr() || right.hasLocalAddr();
    }

    @Override
    int compareSameOp(Exp o) {
      final BinOp that = (BinOp) o;
      return ComparisonChain.start()
          .compare(operator, that.operator)
          .compare(left, that.left)
          .compare(right, that.right)
          .result();
    }

    @Override
    public int hashCode() {
      return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
      return "(" + left + operator.padded + right + ")";
    }
  }

  /** Type cast. */
  public static final class Cast extends Exp {
    public final Typ typ;
    public final Exp exp;

    Cast(Typ typ, Exp exp) {
      super(Op.CAST);
      this.typ = requireNonNull(typ);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Exp accept(ExpShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Cast copy(Typ typ, Exp exp) {
      return typ == this.typ && exp == this.exp ? this : new Cast(typ, exp);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return exp.freeVars();
    }

    @Override
    public boolean hasLocalAddr() {
      return exp.hasLocalAddr();
    }

    @Override
    int compareSameOp(Exp o) {
      final Cast that = (Cast) o;
      return ComparisonChain.start()
          .compare(typ, that.typ)
          .compare(exp, that.exp)
          .result();
    }

    @Override
    public int hashCode() {
      return Objects.hash(typ, exp, 17);
    }

    @Override
    public String toString() {
      return "(" + typ + ")" + exp;
    }
  }

  /**
   * Size of a type, with an optional dynamic length; serves as the type
   * annotation of a {@link Hpred.PointsTo}.
   */
  public static final class Sizeof extends Exp {
    public final Typ typ;
    public final @Nullable Exp length;

    Sizeof(Typ typ, @Nullable Exp length) {
      super(Op.SIZEOF);
      this.typ = requireNonNull(typ);
      this.length = length;
    }

    @Override
    public Exp accept(ExpShuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Sizeof copy(Typ typ, @Nullable Exp length) {
      return typ == this.typ && length == this.length
          ? this
          : new Sizeof(typ, length);
    }

    @Override
    public Iterable<Ident> freeVars() {
      return length == null ? ImmutableList.of() : length.freeVars();
    }

    @Override
    public boolean hasLocalAddr() {
      return length != null && length.hasLocalAddr();
    }

    @Override
    int compareSameOp(Exp o) {
      final Sizeof that = (Sizeof) o;
      return ComparisonChain.start()
          .compare(typ, that.typ)
          .compare(length, that.length, NULLS_FIRST)
          .result();
    }

    @Override
    public int hashCode() {
      return Objects.hash(typ, length, 19);
    }

    @Override
    public String toString() {
      return "sizeof(" + typ + (length == null ? "" : ", " + length) + ")";
    }
  }
}

// End Exp.java
