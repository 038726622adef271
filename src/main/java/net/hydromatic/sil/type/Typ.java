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
package net.hydromatic.sil.type;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type expression.
 *
 * <p>The analyzer treats types as opaque values; this layer only needs to
 * compare them, and to rewrite {@link Var template variables} when applying a
 * {@link net.hydromatic.sil.subst.TypeSubst}.
 */
public abstract class Typ implements Comparable<Typ> {
  public static final Int INT = new Int("int");
  public static final Int LONG = new Int("long");
  public static final Int CHAR = new Int("char");
  public static final Float FLOAT = new Float("float");
  public static final Float DOUBLE = new Float("double");
  public static final Void VOID = new Void();

  /** Prefix of the names of Objective-C blocks. */
  public static final String BLOCK_PREFIX = "__objc_anonymous_block_";

  public final Op op;

  Typ(Op op) {
    this.op = requireNonNull(op);
  }

  /** Creates an integral type. */
  public static Int int_(String name) {
    return new Int(name);
  }

  /** Creates a floating-point type. */
  public static Float float_(String name) {
    return new Float(name);
  }

  /** Creates a pointer type. */
  public static Ptr ptr(Typ elementType) {
    return new Ptr(elementType);
  }

  /** Creates a C struct type. */
  public static Struct struct(String name) {
    return new Struct(Struct.Kind.C_STRUCT, name);
  }

  /** Creates a C++ class type. */
  public static Struct cppClass(String name) {
    return new Struct(Struct.Kind.CPP_CLASS, name);
  }

  /** Creates an Objective-C class type. */
  public static Struct objcClass(String name) {
    return new Struct(Struct.Kind.OBJC_CLASS, name);
  }

  /** Creates an array type, with a static length or null. */
  public static Array array(Typ elementType, @Nullable Long length) {
    return new Array(elementType, length);
  }

  /** Creates a template type variable. */
  public static Var var(String name) {
    return new Var(name);
  }

  /**
   * Returns a copy of this type with each component type transformed, or this
   * type if the components are unchanged.
   */
  public abstract Typ copy(UnaryOperator<Typ> transform);

  /**
   * Returns the zero value of this type if it is numeric (integral, floating
   * point or pointer), otherwise empty.
   */
  public Optional<Exp> zeroValueOpt() {
    return Optional.empty();
  }

  /** Returns the zero value of a numeric type; throws otherwise. */
  public Exp zeroValue() {
    return zeroValueOpt()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "no zero value for non-numerical type " + this));
  }

  /** Returns whether this is an Objective-C class. */
  public boolean isObjcClass() {
    return false;
  }

  /** Returns whether a name contains {@link #BLOCK_PREFIX}. */
  public static boolean hasBlockPrefix(String name) {
    return name.contains(BLOCK_PREFIX);
  }

  @Override
  public final int compareTo(Typ o) {
    if (this == o) {
      return 0;
    }
    final int c = op.compareTo(o.op);
    return c != 0 ? c : compareSameOp(o);
  }

  /** Compares with a type that has the same {@link #op}. */
  abstract int compareSameOp(Typ o);

  @Override
  public boolean equals(Object obj) {
    return obj == this || obj instanceof Typ && compareTo((Typ) obj) == 0;
  }

  @Override
  public abstract int hashCode();

  /** Integral type, such as "int" or "char". */
  public static final class Int extends Typ {
    public final String name;

    Int(String name) {
      super(Op.TY_INT);
      this.name = requireNonNull(name);
    }

    @Override
    public Typ copy(UnaryOperator<Typ> transform) {
      return this;
    }

    @Override
    public Optional<Exp> zeroValueOpt() {
      return Optional.of(Exp.ZERO);
    }

    @Override
    int compareSameOp(Typ o) {
      return name.compareTo(((Int) o).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Floating-point type. */
  public static final class Float extends Typ {
    public final String name;

    Float(String name) {
      super(Op.TY_FLOAT);
      this.name = requireNonNull(name);
    }

    @Override
    public Typ copy(UnaryOperator<Typ> transform) {
      return this;
    }

    @Override
    public Optional<Exp> zeroValueOpt() {
      return Optional.of(Exp.const_(0.0d));
    }

    @Override
    int compareSameOp(Typ o) {
      return name.compareTo(((Float) o).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() + 17;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** The "void" type. */
  public static final class Void extends Typ {
    Void() {
      super(Op.TY_VOID);
    }

    @Override
    public Typ copy(UnaryOperator<Typ> transform) {
      return this;
    }

    @Override
    int compareSameOp(Typ o) {
      return 0;
    }

    @Override
    public int hashCode() {
      return 37;
    }

    @Override
    public String toString() {
      return "void";
    }
  }

  /** Pointer type. */
  public static final class Ptr extends Typ {
    public final Typ elementType;

    Ptr(Typ elementType) {
      super(Op.TY_PTR);
      this.elementType = requireNonNull(elementType);
    }

    @Override
    public Typ copy(UnaryOperator<Typ> transform) {
      final Typ elementType = transform.apply(this.elementType);
      return elementType == this.elementType ? this : new Ptr(elementType);
    }

    @Override
    public Optional<Exp> zeroValueOpt() {
      return Optional.of(Exp.ZERO);
    }

    @Override
    int compareSameOp(Typ o) {
      return elementType.compareTo(((Ptr) o).elementType);
    }

    @Override
    public int hashCode() {
      return elementType.hashCode() * 31 + 1;
    }

    @Override
    public String toString() {
      return elementType + "*";
    }
  }

  /** Struct or class type, identified by its kind and name. */
  public static final class Struct extends Typ {
    public final Kind kind;
    public final String name;

    Struct(Kind kind, String name) {
      super(Op.TY_STRUCT);
      this.kind = requireNonNull(kind);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public Typ copy(UnaryOperator<Typ> transform) {
      return this;
    }

    @Override
    public boolean isObjcClass() {
      return kind == Kind.OBJC_CLASS;
    }

    @Override
    int compareSameOp(Typ o) {
      final Struct that = (Struct) o;
      final int c = kind.compareTo(that.kind);
      return c != 0 ? c : name.compareTo(that.name);
    }

    @Override
    public int hashCode() {
      return (name.hashCode() * 31 + kind.ordinal()) * 31 + 2;
    }

    @Override
    public String toString() {
      return kind.keyword + " " + name;
    }

    /** Language construct that declares a struct type. */
    public enum Kind {
      C_STRUCT("struct"),
      CPP_CLASS("class"),
      OBJC_CLASS("objc_class");

      public final String keyword;

      Kind(String keyword) {
        this.keyword = keyword;
      }
    }
  }

  /** Array type. */
  public static final class Array extends Typ {
    public final Typ elementType;
    public final @Nullable Long length;

    Array(Typ elementType, @Nullable Long length) {
      super(Op.TY_ARRAY);
      this.elementType = requireNonNull(elementType);
      this.length = length;
    }

    @Override
    public Typ copy(UnaryOperator<Typ> transform) {
      final Typ elementType = transform.apply(this.elementType);
      return elementType == this.elementType
          ? this
          : new Array(elementType, length);
    }

    @Override
    int compareSameOp(Typ o) {
      final Array that = (Array) o;
      final int c = elementType.compareTo(that.elementType);
      if (c != 0) {
        return c;
      }
      if (length == null) {
        return that.length == null ? 0 : -1;
      }
      return that.length == null ? 1 : length.compareTo(that.length);
    }

    @Override
    public int hashCode() {
      return Objects.hash(elementType, length);
    }

    @Override
    public String toString() {
      return elementType + "[" + (length == null ? "" : length) + "]";
    }
  }

  /** Template type variable, such as "T" in "vector&lt;T&gt;". */
  public static final class Var extends Typ {
    public final String name;

    Var(String name) {
      super(Op.TY_VAR);
      this.name = requireNonNull(name);
    }

    @Override
    public Typ copy(UnaryOperator<Typ> transform) {
      return this;
    }

    @Override
    int compareSameOp(Typ o) {
      return name.compareTo(((Var) o).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + 3;
    }

    @Override
    public String toString() {
      return "'" + name;
    }
  }
}

// End Typ.java
