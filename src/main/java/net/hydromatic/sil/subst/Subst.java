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

import static net.hydromatic.sil.util.Static.transformEager;

import com.google.common.collect.Maps;
import java.util.Map;
import net.hydromatic.sil.ast.Atom;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.ExpShuttle;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Ident;
import net.hydromatic.sil.ast.Instr;
import net.hydromatic.sil.ast.Shuttle;
import net.hydromatic.sil.ast.Strexp;
import net.hydromatic.sil.type.Typ;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Substitution: either an {@link ExpSubst} from identifiers to expressions,
 * or a {@link TypeSubst} from template type variables to types.
 *
 * <p>Applying a substitution never enters the closure of a list-segment
 * parameter; the identifiers there are bound, and only instantiation may
 * specialize a closure's body.
 */
public abstract class Subst {
  /** Lazily created. */
  private @Nullable Shuttle shuttle;

  Subst() {}

  /** Returns the empty substitution. */
  public static ExpSubst empty() {
    return ExpSubst.EMPTY;
  }

  /** Returns whether this substitution has no effect. */
  public abstract boolean isEmpty();

  /** Returns the shuttle that rewrites expressions. */
  abstract ExpShuttle expShuttle();

  /** Rewrites an identifier that an instruction binds. */
  abstract Ident applyToBinder(Ident id);

  /** Rewrites a type. */
  public abstract Typ apply(Typ typ);

  /** Applies this substitution to an expression. */
  public Exp apply(Exp exp) {
    return isEmpty() ? exp : exp.accept(expShuttle());
  }

  /** Applies this substitution to an atom. */
  public Atom apply(Atom atom) {
    return isEmpty() ? atom : atom.accept(shuttle());
  }

  /** Applies this substitution to a structured value. */
  public Strexp apply(Strexp strexp) {
    return isEmpty() ? strexp : strexp.accept(shuttle());
  }

  /**
   * Applies this substitution to a heap predicate. Does not enter the
   * closures of list-segment parameters.
   */
  public Hpred apply(Hpred hpred) {
    return isEmpty() ? hpred : hpred.accept(shuttle());
  }

  /**
   * Applies this substitution to an instruction, including the identifiers
   * that it binds (the target of a load, the result of a call, the
   * temporaries being removed).
   */
  public Instr apply(Instr instr) {
    if (isEmpty()) {
      return instr;
    }
    switch (instr.op) {
      case LOAD:
        final Instr.Load load = (Instr.Load) instr;
        return load.copy(
            applyToBinder(load.id), apply(load.exp), apply(load.typ));

      case STORE:
        final Instr.Store store = (Instr.Store) instr;
        return store.copy(
            apply(store.lexp), apply(store.typ), apply(store.rexp));

      case PRUNE:
        final Instr.Prune prune = (Instr.Prune) instr;
        return prune.copy(apply(prune.cond));

      case CALL:
        final Instr.Call call = (Instr.Call) instr;
        return call.copy(
            call.retId == null ? null : applyToBinder(call.retId),
            call.retTyp == null ? null : apply(call.retTyp),
            apply(call.fun),
            transformEager(
                call.args,
                arg ->
                    entry(arg, apply(arg.getKey()), apply(arg.getValue()))));

      case REMOVE_TEMPS:
        final Instr.RemoveTemps removeTemps = (Instr.RemoveTemps) instr;
        return removeTemps.copy(
            transformEager(removeTemps.temps, this::applyToBinder));

      case DECLARE_LOCALS:
        final Instr.DeclareLocals declareLocals = (Instr.DeclareLocals) instr;
        return declareLocals.copy(
            transformEager(
                declareLocals.locals,
                local ->
                    entry(local, local.getKey(), apply(local.getValue()))));

      case NULLIFY:
      case ABSTRACT:
        return instr;

      default:
        throw new AssertionError("unknown instruction " + instr.op);
    }
  }

  private Shuttle shuttle() {
    if (shuttle == null) {
      shuttle = Shuttle.ofExp(this::apply);
    }
    return shuttle;
  }

  private static <K, V> Map.Entry<K, V> entry(
      Map.Entry<K, V> e, K key, V value) {
    return key == e.getKey() && value == e.getValue()
        ? e
        : Maps.immutableEntry(key, value);
  }
}

// End Subst.java
