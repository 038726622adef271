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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.sil.type.Typ;
import net.hydromatic.sil.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Instruction of the intermediate language.
 *
 * <p>Instructions are values; symbolic execution consults them, and
 * substitutions rewrite them, but nothing mutates them.
 */
public abstract class Instr {
  /** Instruction that does nothing. */
  public static final RemoveTemps SKIP =
      new RemoveTemps(ImmutableList.of(), Location.NONE);

  public final Op op;
  public final Location loc;

  Instr(Op op, Location loc) {
    this.op = requireNonNull(op);
    this.loc = requireNonNull(loc);
  }

  /** Returns the location of this instruction. */
  public Location loc() {
    return loc;
  }

  /**
   * Returns the expressions that occur in this instruction, including the
   * identifiers it binds.
   */
  public abstract List<Exp> exps();

  /**
   * Returns whether this instruction is auxiliary: it manipulates the
   * analysis state but does not correspond to a statement of the program.
   */
  public boolean isAuxiliary() {
    return false;
  }

  /**
   * Returns this instruction with the call flag {@link
   * CallFlags#withBlockParameters} set if it is a call that passes an
   * Objective-C block; otherwise returns this instruction.
   */
  public Instr addWithBlockParametersFlag() {
    return this;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Instr
            && ((Instr) obj).op == op
            && sameContents((Instr) obj);
  }

  /** Compares with an instruction that has the same {@link #op}. */
  abstract boolean sameContents(Instr o);

  @Override
  public abstract int hashCode();

  /** Load the value at address {@code exp} into identifier {@code id}. */
  public static final class Load extends Instr {
    public final Ident id;
    public final Exp exp;
    public final Typ typ;

    Load(Ident id, Exp exp, Typ typ, Location loc) {
      super(Op.LOAD, loc);
      this.id = requireNonNull(id);
      this.exp = requireNonNull(exp);
      this.typ = requireNonNull(typ);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Load copy(Ident id, Exp exp, Typ typ) {
      return id == this.id && exp == this.exp && typ == this.typ
          ? this
          : new Load(id, exp, typ, loc);
    }

    @Override
    public List<Exp> exps() {
      return ImmutableList.of(Exp.var(id), exp);
    }

    @Override
    boolean sameContents(Instr o) {
      final Load that = (Load) o;
      return id.equals(that.id)
          && exp.equals(that.exp)
          && typ.equals(that.typ)
          && loc.equals(that.loc);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, id, exp, typ, loc);
    }

    @Override
    public String toString() {
      return id + " = *" + exp + ":" + typ;
    }
  }

  /** Store {@code rexp} at address {@code lexp}. */
  public static final class Store extends Instr {
    public final Exp lexp;
    public final Typ typ;
    public final Exp rexp;

    Store(Exp lexp, Typ typ, Exp rexp, Location loc) {
      super(Op.STORE, loc);
      this.lexp = requireNonNull(lexp);
      this.typ = requireNonNull(typ);
      this.rexp = requireNonNull(rexp);
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Store copy(Exp lexp, Typ typ, Exp rexp) {
      return lexp == this.lexp && typ == this.typ && rexp == this.rexp
          ? this
          : new Store(lexp, typ, rexp, loc);
    }

    @Override
    public List<Exp> exps() {
      return ImmutableList.of(lexp, rexp);
    }

    @Override
    boolean sameContents(Instr o) {
      final Store that = (Store) o;
      return lexp.equals(that.lexp)
          && typ.equals(that.typ)
          && rexp.equals(that.rexp)
          && loc.equals(that.loc);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, lexp, typ, rexp, loc);
    }

    @Override
    public String toString() {
      return "*" + lexp + ":" + typ + " = " + rexp;
    }
  }

  /**
   * Prune the state according to a condition; {@code trueBranch} says
   * whether this is the "then" branch of the conditional.
   */
  public static final class Prune extends Instr {
    public final Exp cond;
    public final boolean trueBranch;
    public final IfKind ifKind;

    Prune(Exp cond, Location loc, boolean trueBranch, IfKind ifKind) {
      super(Op.PRUNE, loc);
      this.cond = requireNonNull(cond);
      this.trueBranch = trueBranch;
      this.ifKind = requireNonNull(ifKind);
    }

    /** Creates a copy with a given condition, or this if it is the same. */
    public Prune copy(Exp cond) {
      return cond == this.cond
          ? this
          : new Prune(cond, loc, trueBranch, ifKind);
    }

    @Override
    public List<Exp> exps() {
      return ImmutableList.of(cond);
    }

    @Override
    boolean sameContents(Instr o) {
      final Prune that = (Prune) o;
      return cond.equals(that.cond)
          && trueBranch == that.trueBranch
          && ifKind == that.ifKind
          && loc.equals(that.loc);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, cond, trueBranch, ifKind, loc);
    }

    @Override
    public String toString() {
      return "PRUNE(" + cond + ", " + trueBranch + ")";
    }
  }

  /**
   * Call a function; if {@code retId} is not null, binds the result to it.
   */
  public static final class Call extends Instr {
    public final @Nullable Ident retId;
    public final @Nullable Typ retTyp;
    public final Exp fun;
    public final ImmutableList<Map.Entry<Exp, Typ>> args;
    public final CallFlags flags;

    Call(
        @Nullable Ident retId,
        @Nullable Typ retTyp,
        Exp fun,
        ImmutableList<Map.Entry<Exp, Typ>> args,
        Location loc,
        CallFlags flags) {
      super(Op.CALL, loc);
      this.retId = retId;
      this.retTyp = retTyp;
      this.fun = requireNonNull(fun);
      this.args = requireNonNull(args);
      this.flags = requireNonNull(flags);
      checkArgument(
          (retId == null) == (retTyp == null),
          "return identifier and type must both be present or absent");
    }

    /** Creates a copy with given contents, or this if they are the same. */
    public Call copy(
        @Nullable Ident retId,
        @Nullable Typ retTyp,
        Exp fun,
        List<Map.Entry<Exp, Typ>> args) {
      return retId == this.retId
              && retTyp == this.retTyp
              && fun == this.fun
              && Strexp.sameEntries(args, this.args)
          ? this
          : new Call(
              retId, retTyp, fun, ImmutableList.copyOf(args), loc, flags);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Functions and blocks are referenced by name, as string constants. The
     * flag is set if the callee is such a name and at least one argument is
     * the name of a block.
     */
    @Override
    public Call addWithBlockParametersFlag() {
      if (flags.withBlockParameters
          || !isFunctionName(fun)
          || !Static.anyMatch(args, arg -> isBlockName(arg.getKey()))) {
        return this;
      }
      return new Call(
          retId, retTyp, fun, args, loc, flags.withBlockParameters());
    }

    private static boolean isFunctionName(Exp exp) {
      return exp instanceof Exp.Const
          && ((Exp.Const) exp).value instanceof String;
    }

    private static boolean isBlockName(Exp exp) {
      return isFunctionName(exp)
          && Typ.hasBlockPrefix((String) ((Exp.Const) exp).value);
    }

    @Override
    public List<Exp> exps() {
      final ImmutableList.Builder<Exp> b = ImmutableList.builder();
      if (retId != null) {
        b.add(Exp.var(retId));
      }
      b.add(fun);
      args.forEach(arg -> b.add(arg.getKey()));
      return b.build();
    }

    @Override
    boolean sameContents(Instr o) {
      final Call that = (Call) o;
      return Objects.equals(retId, that.retId)
          && Objects.equals(retTyp, that.retTyp)
          && fun.equals(that.fun)
          && args.equals(that.args)
          && flags.equals(that.flags)
          && loc.equals(that.loc);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, retId, retTyp, fun, args, flags, loc);
    }

    @Override
    public String toString() {
      return (retId == null ? "" : retId + " = ") + fun
          + Static.transformEager(args, Map.Entry::getKey);
    }
  }

  /** Nullify a program variable. */
  public static final class Nullify extends Instr {
    public final Pvar pvar;

    Nullify(Pvar pvar, Location loc) {
      super(Op.NULLIFY, loc);
      this.pvar = requireNonNull(pvar);
    }

    @Override
    public List<Exp> exps() {
      return ImmutableList.of();
    }

    @Override
    public boolean isAuxiliary() {
      return true;
    }

    @Override
    boolean sameContents(Instr o) {
      return pvar.equals(((Nullify) o).pvar) && loc.equals(o.loc);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, pvar, loc);
    }

    @Override
    public String toString() {
      return "NULLIFY(" + pvar + ")";
    }
  }

  /** Apply abstraction. */
  public static final class Abstract extends Instr {
    Abstract(Location loc) {
      super(Op.ABSTRACT, loc);
    }

    @Override
    public List<Exp> exps() {
      return ImmutableList.of();
    }

    @Override
    public boolean isAuxiliary() {
      return true;
    }

    @Override
    boolean sameContents(Instr o) {
      return loc.equals(o.loc);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, loc);
    }

    @Override
    public String toString() {
      return "APPLY_ABSTRACTION";
    }
  }

  /** Remove temporaries. */
  public static final class RemoveTemps extends Instr {
    public final ImmutableList<Ident> temps;

    RemoveTemps(ImmutableList<Ident> temps, Location loc) {
      super(Op.REMOVE_TEMPS, loc);
      this.temps = requireNonNull(temps);
    }

    /** Creates a copy with given temporaries, or this if they are the same. */
    public RemoveTemps copy(List<Ident> temps) {
      return Static.sameElements(temps, this.temps)
          ? this
          : new RemoveTemps(ImmutableList.copyOf(temps), loc);
    }

    @Override
    public List<Exp> exps() {
      return Static.transformEager(temps, Exp::var);
    }

    @Override
    public boolean isAuxiliary() {
      return true;
    }

    @Override
    boolean sameContents(Instr o) {
      return temps.equals(((RemoveTemps) o).temps) && loc.equals(o.loc);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, temps, loc);
    }

    @Override
    public String toString() {
      return "REMOVE_TEMPS" + temps;
    }
  }

  /** Declare local variables. */
  public static final class DeclareLocals extends Instr {
    public final ImmutableList<Map.Entry<Pvar, Typ>> locals;

    DeclareLocals(ImmutableList<Map.Entry<Pvar, Typ>> locals, Location loc) {
      super(Op.DECLARE_LOCALS, loc);
      this.locals = requireNonNull(locals);
    }

    /** Creates a copy with given locals, or this if they are the same. */
    public DeclareLocals copy(List<Map.Entry<Pvar, Typ>> locals) {
      return Strexp.sameEntries(locals, this.locals)
          ? this
          : new DeclareLocals(ImmutableList.copyOf(locals), loc);
    }

    @Override
    public List<Exp> exps() {
      return ImmutableList.of();
    }

    @Override
    public boolean isAuxiliary() {
      return true;
    }

    @Override
    boolean sameContents(Instr o) {
      return locals.equals(((DeclareLocals) o).locals) && loc.equals(o.loc);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, locals, loc);
    }

    @Override
    public String toString() {
      return "DECLARE_LOCALS"
          + Static.transformEager(locals, Map.Entry::getKey);
    }
  }
}

// End Instr.java
