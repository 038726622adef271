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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import net.hydromatic.sil.type.Typ;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds atoms, structured values, heap predicates and instructions. */
public enum SilBuilder {
  /**
   * The singleton instance of the builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  sil;

  // atoms

  /** Creates an equality "left = right". */
  public Atom.Binary eq(Exp left, Exp right) {
    return new Atom.Binary(Op.ATOM_EQ, left, right);
  }

  /** Creates a disequality "left != right". */
  public Atom.Binary neq(Exp left, Exp right) {
    return new Atom.Binary(Op.ATOM_NEQ, left, right);
  }

  /** Creates an application of a predicate. */
  public Atom.Pred pred(PredSymbol symbol, List<? extends Exp> args) {
    return new Atom.Pred(Op.ATOM_PRED, symbol, ImmutableList.copyOf(args));
  }

  /** Creates a negated application of a predicate. */
  public Atom.Pred npred(PredSymbol symbol, List<? extends Exp> args) {
    return new Atom.Pred(Op.ATOM_NPRED, symbol, ImmutableList.copyOf(args));
  }

  // structured values

  public Strexp.Eexp eexp(Exp exp, Inst inst) {
    return new Strexp.Eexp(exp, inst);
  }

  public Strexp.Estruct estruct(
      List<Map.Entry<String, Strexp>> fields, Inst inst) {
    return new Strexp.Estruct(ImmutableList.copyOf(fields), inst);
  }

  /**
   * Creates an array value. The caller must ensure that every index is less
   * than the length, and that the indices are distinct.
   */
  public Strexp.Earray earray(
      Exp length, List<Map.Entry<Exp, Strexp>> elements, Inst inst) {
    return new Strexp.Earray(length, ImmutableList.copyOf(elements), inst);
  }

  /** Creates a field or array entry. */
  public <K> Map.Entry<K, Strexp> entry(K key, Strexp value) {
    return Maps.immutableEntry(key, value);
  }

  // heap predicates

  public Hpred.PointsTo pointsTo(Exp lexp, Strexp strexp, Exp texp) {
    return new Hpred.PointsTo(lexp, strexp, texp);
  }

  public Hpred.Lseg lseg(
      LsegKind kind, Hpara para, Exp from, Exp to, List<? extends Exp> shared) {
    checkArgument(
        shared.size() == para.svars.size(),
        "expected %s shared arguments, got %s",
        para.svars.size(),
        shared.size());
    return new Hpred.Lseg(kind, para, from, to, ImmutableList.copyOf(shared));
  }

  public Hpred.Dllseg dllseg(
      LsegKind kind,
      HparaDll para,
      Exp firstCell,
      Exp blinkOut,
      Exp flinkOut,
      Exp lastCell,
      List<? extends Exp> shared) {
    checkArgument(
        shared.size() == para.svars.size(),
        "expected %s shared arguments, got %s",
        para.svars.size(),
        shared.size());
    return new Hpred.Dllseg(
        kind,
        para,
        firstCell,
        blinkOut,
        flinkOut,
        lastCell,
        ImmutableList.copyOf(shared));
  }

  public Hpara hpara(
      Ident root,
      Ident next,
      List<Ident> svars,
      List<Ident> evars,
      List<? extends Hpred> body) {
    return new Hpara(
        root,
        next,
        ImmutableList.copyOf(svars),
        ImmutableList.copyOf(evars),
        ImmutableList.copyOf(body));
  }

  public HparaDll hparaDll(
      Ident cell,
      Ident blink,
      Ident flink,
      List<Ident> svars,
      List<Ident> evars,
      List<? extends Hpred> body) {
    return new HparaDll(
        cell,
        blink,
        flink,
        ImmutableList.copyOf(svars),
        ImmutableList.copyOf(evars),
        ImmutableList.copyOf(body));
  }

  // instructions

  public Instr.Load load(Ident id, Exp exp, Typ typ, Location loc) {
    return new Instr.Load(id, exp, typ, loc);
  }

  public Instr.Store store(Exp lexp, Typ typ, Exp rexp, Location loc) {
    return new Instr.Store(lexp, typ, rexp, loc);
  }

  public Instr.Prune prune(
      Exp cond, Location loc, boolean trueBranch, IfKind ifKind) {
    return new Instr.Prune(cond, loc, trueBranch, ifKind);
  }

  /** Creates a call whose result, if any, is bound to {@code retId}. */
  public Instr.Call call(
      @Nullable Ident retId,
      @Nullable Typ retTyp,
      Exp fun,
      List<Map.Entry<Exp, Typ>> args,
      Location loc,
      CallFlags flags) {
    return new Instr.Call(
        retId, retTyp, fun, ImmutableList.copyOf(args), loc, flags);
  }

  public Instr.Nullify nullify(Pvar pvar, Location loc) {
    return new Instr.Nullify(pvar, loc);
  }

  public Instr.Abstract abstract_(Location loc) {
    return new Instr.Abstract(loc);
  }

  public Instr.RemoveTemps removeTemps(List<Ident> temps, Location loc) {
    return temps.isEmpty() && loc.equals(Location.NONE)
        ? Instr.SKIP
        : new Instr.RemoveTemps(ImmutableList.copyOf(temps), loc);
  }

  public Instr.DeclareLocals declareLocals(
      List<Map.Entry<Pvar, Typ>> locals, Location loc) {
    return new Instr.DeclareLocals(ImmutableList.copyOf(locals), loc);
  }

  // utilities

  /** Converts a list of expressions to a sorted set. */
  public ImmutableSortedSet<Exp> elistToEset(Iterable<? extends Exp> exps) {
    return ImmutableSortedSet.copyOf(exps);
  }
}

// End SilBuilder.java
