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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import net.hydromatic.sil.type.Typ;

/** Offset for an lvalue: either a field, or an array index. */
public abstract class Offset {
  private Offset() {}

  /** Creates a field offset. */
  public static Field field(String fieldName, Typ typ) {
    return new Field(fieldName, typ);
  }

  /** Creates an index offset. */
  public static Index index(Exp exp) {
    return new Index(exp);
  }

  /**
   * Returns the offsets of an expression, outermost last.
   *
   * <p>For example, the offsets of {@code x.f[i].g} are {@code [f, [i], g]}.
   */
  public static List<Offset> of(Exp exp) {
    final Deque<Offset> offsets = new ArrayDeque<>();
    for (Exp e = exp; ; ) {
      switch (e.op) {
        case LFIELD:
          final Exp.Lfield lfield = (Exp.Lfield) e;
          offsets.addFirst(field(lfield.fieldName, lfield.typ));
          e = lfield.exp;
          break;
        case LINDEX:
          final Exp.Lindex lindex = (Exp.Lindex) e;
          offsets.addFirst(index(lindex.index));
          e = lindex.array;
          break;
        case CAST:
          e = ((Exp.Cast) e).exp;
          break;
        case SIZEOF:
          final Exp.Sizeof sizeof = (Exp.Sizeof) e;
          if (sizeof.length == null) {
            return ImmutableList.copyOf(offsets);
          }
          e = sizeof.length;
          break;
        default:
          return ImmutableList.copyOf(offsets);
      }
    }
  }

  /** Applies a list of offsets to an expression; inverse of {@link #of}. */
  public static Exp apply(Exp exp, List<Offset> offsets) {
    Exp e = exp;
    for (Offset offset : offsets) {
      e = offset.apply(e);
    }
    return e;
  }

  /** Applies this offset to an expression. */
  public abstract Exp apply(Exp exp);

  /** Field offset. */
  public static final class Field extends Offset {
    public final String fieldName;
    public final Typ typ;

    Field(String fieldName, Typ typ) {
      this.fieldName = requireNonNull(fieldName);
      this.typ = requireNonNull(typ);
    }

    @Override
    public Exp apply(Exp exp) {
      return Exp.lfield(exp, fieldName, typ);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fieldName, typ);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Field
              && fieldName.equals(((Field) o).fieldName)
              && typ.equals(((Field) o).typ);
    }

    @Override
    public String toString() {
      return fieldName;
    }
  }

  /** Array index offset. */
  public static final class Index extends Offset {
    public final Exp exp;

    Index(Exp exp) {
      this.exp = requireNonNull(exp);
    }

    @Override
    public Exp apply(Exp exp) {
      return Exp.lindex(exp, this.exp);
    }

    @Override
    public int hashCode() {
      return exp.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Index && exp.equals(((Index) o).exp);
    }

    @Override
    public String toString() {
      return "[" + exp + "]";
    }
  }
}

// End Offset.java
