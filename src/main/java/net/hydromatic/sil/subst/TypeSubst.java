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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.sil.ast.ExpShuttle;
import net.hydromatic.sil.ast.Ident;
import net.hydromatic.sil.type.Typ;

/**
 * Substitution from template type variables to types.
 *
 * <p>Rewrites types wherever they occur (field offsets, casts, sizes,
 * instruction types) and never touches identifiers.
 */
public final class TypeSubst extends Subst {
  private final ImmutableMap<String, Typ> map;
  private final ExpShuttle expShuttle =
      new ExpShuttle() {
        @Override
        protected Typ visit(Typ typ) {
          return apply(typ);
        }
      };

  private TypeSubst(ImmutableMap<String, Typ> map) {
    this.map = requireNonNull(map);
  }

  /** Creates a type substitution from a map of variable names to types. */
  public static TypeSubst of(Map<String, ? extends Typ> map) {
    return new TypeSubst(ImmutableMap.copyOf(map));
  }

  @Override
  public boolean isEmpty() {
    return map.isEmpty();
  }

  @Override
  public Typ apply(Typ typ) {
    if (typ instanceof Typ.Var) {
      final Typ t = map.get(((Typ.Var) typ).name);
      return t == null ? typ : t;
    }
    return typ.copy(this::apply);
  }

  @Override
  ExpShuttle expShuttle() {
    return expShuttle;
  }

  @Override
  Ident applyToBinder(Ident id) {
    return id;
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof TypeSubst && map.equals(((TypeSubst) obj).map);
  }

  @Override
  public String toString() {
    return map.toString();
  }
}

// End TypeSubst.java
