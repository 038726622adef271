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

import net.hydromatic.sil.type.Typ;

/**
 * Visits and transforms expressions.
 *
 * <p>The default implementation rebuilds each node from its transformed
 * children, returning the original node if nothing changed. Override {@link
 * #visit(Exp.Var)} to rename identifiers, {@link #visit(Typ)} to rewrite
 * types.
 */
public class ExpShuttle {
  /** Rewrites a type that occurs inside an expression. */
  protected Typ visit(Typ typ) {
    return typ; // leaf
  }

  protected Exp visit(Exp.Var var) {
    return var; // leaf
  }

  protected Exp visit(Exp.Const constant) {
    return constant; // leaf
  }

  protected Exp visit(Exp.Lvar lvar) {
    return lvar; // leaf
  }

  protected Exp visit(Exp.Lfield lfield) {
    return lfield.copy(lfield.exp.accept(this), visit(lfield.typ));
  }

  protected Exp visit(Exp.Lindex lindex) {
    return lindex.copy(lindex.array.accept(this), lindex.index.accept(this));
  }

  protected Exp visit(Exp.UnOp unOp) {
    return unOp.copy(
        unOp.exp.accept(this), unOp.typ == null ? null : visit(unOp.typ));
  }

  protected Exp visit(Exp.BinOp binOp) {
    return binOp.copy(binOp.left.accept(this), binOp.right.accept(this));
  }

  protected Exp visit(Exp.Cast cast) {
    return cast.copy(visit(cast.typ), cast.exp.accept(this));
  }

  protected Exp visit(Exp.Sizeof sizeof) {
    return sizeof.copy(
        visit(sizeof.typ),
        sizeof.length == null ? null : sizeof.length.accept(this));
  }
}

// End ExpShuttle.java
