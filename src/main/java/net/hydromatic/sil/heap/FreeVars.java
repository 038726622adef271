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
package net.hydromatic.sil.heap;

import com.google.common.collect.Iterables;
import net.hydromatic.sil.ast.Atom;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpara;
import net.hydromatic.sil.ast.HparaDll;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Ident;
import net.hydromatic.sil.ast.Strexp;
import net.hydromatic.sil.subst.ExpSubst;

/**
 * Free identifiers of terms.
 *
 * <p>Each method returns a lazy sequence, in order, with repetitions; the
 * sequence is computed afresh each time it is iterated, so a caller that
 * stops early does not pay for the rest of the term.
 *
 * <p>A list-segment parameter binds its root, next, shared and existential
 * identifiers. A nested parameter first removes its own bound identifiers,
 * so the exclusion applies at every depth; {@link #shallow(Hpara)} and
 * {@link #of(Hpred)} agree.
 */
public abstract class FreeVars {
  private FreeVars() {}

  public static Iterable<Ident> of(Exp exp) {
    return exp.freeVars();
  }

  public static Iterable<Ident> of(Atom atom) {
    return atom.freeVars();
  }

  public static Iterable<Ident> of(Strexp strexp) {
    return strexp.freeVars();
  }

  public static Iterable<Ident> of(Hpred hpred) {
    return hpred.freeVars();
  }

  /** Returns the identifiers in the range of a substitution. */
  public static Iterable<Ident> of(ExpSubst subst) {
    return subst.freeVars();
  }

  /** Returns the free identifiers of a list of heap predicates. */
  public static Iterable<Ident> ofHpreds(Iterable<? extends Hpred> hpreds) {
    return Iterables.concat(Iterables.transform(hpreds, Hpred::freeVars));
  }

  /** Returns the free identifiers of a parameter's body. */
  public static Iterable<Ident> shallow(Hpara para) {
    return para.freeVars();
  }

  /** Returns the free identifiers of a doubly-linked parameter's body. */
  public static Iterable<Ident> shallow(HparaDll para) {
    return para.freeVars();
  }
}

// End FreeVars.java
