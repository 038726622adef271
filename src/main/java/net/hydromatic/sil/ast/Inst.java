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
import com.google.common.collect.Ordering;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Instrumentation of a heap value: records how the value was produced.
 *
 * <p>Instrumentation is diagnostic; it never changes the logical meaning of
 * a formula, which is why equality of {@link Strexp} and {@link Hpred}
 * ignores it unless asked otherwise.
 *
 * <p>Kinds {@link Kind#FORMAL}, {@link Kind#REARRANGE} and {@link
 * Kind#UPDATE} carry a tri-state <em>zero flag</em> (true if the pointer was
 * dereferenced without testing for null, false if it was tested, null if
 * unknown) and a <em>null case flag</em> (true if the value was obtained by
 * case analysis on null in a procedure call). Kinds {@link Kind#REARRANGE},
 * {@link Kind#UPDATE} and {@link Kind#RETURN_FROM_CALL} carry a line number;
 * {@link Kind#REARRANGE} and {@link Kind#UPDATE} carry a path position.
 */
public final class Inst implements Comparable<Inst> {
  private static final Ordering<@Nullable Boolean> BOOLEAN_NULLS_FIRST =
      Ordering.<Boolean>natural().nullsFirst();
  private static final Ordering<@Nullable PathPos> POS_NULLS_FIRST =
      Ordering.<PathPos>natural().nullsFirst();

  public static final Inst ABSTRACTION = new Inst(Kind.ABSTRACTION);
  public static final Inst ACTUAL_PRECONDITION =
      new Inst(Kind.ACTUAL_PRECONDITION);
  public static final Inst ALLOC = new Inst(Kind.ALLOC);
  /** For formal parameters. */
  public static final Inst FORMAL =
      new Inst(Kind.FORMAL, null, false, -1, null);
  /** For formal parameters and heap values at the start of a procedure. */
  public static final Inst INITIAL = new Inst(Kind.INITIAL);
  /** For values read by a lookup in the heap. */
  public static final Inst LOOKUP = new Inst(Kind.LOOKUP);
  public static final Inst NONE = new Inst(Kind.NONE);
  public static final Inst NULLIFY = new Inst(Kind.NULLIFY);
  public static final Inst TAINT = new Inst(Kind.TAINT);

  public final Kind kind;
  public final @Nullable Boolean zeroFlag;
  public final boolean nullCaseFlag;
  public final int line;
  public final @Nullable PathPos pos;

  private Inst(
      Kind kind,
      @Nullable Boolean zeroFlag,
      boolean nullCaseFlag,
      int line,
      @Nullable PathPos pos) {
    this.kind = requireNonNull(kind);
    this.zeroFlag = zeroFlag;
    this.nullCaseFlag = nullCaseFlag;
    this.line = line;
    this.pos = pos;
  }

  private Inst(Kind kind) {
    this(kind, null, false, -1, null);
    checkArgument(!kind.flagged && !kind.located, "kind %s has fields", kind);
  }

  /** Creates a {@link Kind#FORMAL} instrumentation. */
  public static Inst formal(@Nullable Boolean zeroFlag, boolean nullCaseFlag) {
    return new Inst(Kind.FORMAL, zeroFlag, nullCaseFlag, -1, null);
  }

  /**
   * Creates a {@link Kind#REARRANGE} instrumentation; {@code nonZero} says
   * whether the pointer is known to be non-null.
   */
  public static Inst rearrange(boolean nonZero, Location loc, PathPos pos) {
    return rearrange(nonZero, false, loc.line, pos);
  }

  /** Creates a {@link Kind#REARRANGE} instrumentation with all fields. */
  public static Inst rearrange(
      @Nullable Boolean zeroFlag,
      boolean nullCaseFlag,
      int line,
      PathPos pos) {
    return new Inst(
        Kind.REARRANGE, zeroFlag, nullCaseFlag, line, requireNonNull(pos));
  }

  /** Creates an {@link Kind#UPDATE} instrumentation. */
  public static Inst update(Location loc, PathPos pos) {
    return update(null, false, loc.line, pos);
  }

  /** Creates an {@link Kind#UPDATE} instrumentation with all fields. */
  public static Inst update(
      @Nullable Boolean zeroFlag,
      boolean nullCaseFlag,
      int line,
      PathPos pos) {
    return new Inst(
        Kind.UPDATE, zeroFlag, nullCaseFlag, line, requireNonNull(pos));
  }

  /** Creates a {@link Kind#RETURN_FROM_CALL} instrumentation. */
  public static Inst returnFromCall(int line) {
    return new Inst(Kind.RETURN_FROM_CALL, null, false, line, null);
  }

  /** Returns the zero flag; null for kinds that do not carry one. */
  public @Nullable Boolean zeroFlag() {
    return kind.flagged ? zeroFlag : null;
  }

  /**
   * Returns a copy with the null case flag set. Only {@link Kind#FORMAL} and
   * {@link Kind#REARRANGE} values change; others are returned unchanged.
   */
  public Inst setNullCaseFlag() {
    if (kind != Kind.FORMAL && kind != Kind.REARRANGE || nullCaseFlag) {
      return this;
    }
    return new Inst(kind, zeroFlag, true, line, pos);
  }

  /**
   * Returns a copy whose location is {@code loc}. The zero and null-case
   * flags are unchanged.
   */
  public Inst newLoc(Location loc) {
    if (!kind.located || loc.line == line) {
      return this;
    }
    return new Inst(kind, zeroFlag, nullCaseFlag, loc.line, pos);
  }

  /**
   * Replaces {@code instOld} by {@code instNew}, preserving the zero flag of
   * {@code instOld}.
   *
   * <p>If both zero flags are known, the result's flag is their disjunction;
   * if only one is known, that one.
   */
  public static Inst update(Inst instOld, Inst instNew) {
    if (!instNew.kind.flagged) {
      return instNew;
    }
    final Boolean zeroFlag =
        combineZeroFlags(instOld.zeroFlag(), instNew.zeroFlag);
    return Objects.equals(zeroFlag, instNew.zeroFlag)
        ? instNew
        : new Inst(
            instNew.kind,
            zeroFlag,
            instNew.nullCaseFlag,
            instNew.line,
            instNew.pos);
  }

  private static @Nullable Boolean combineZeroFlags(
      @Nullable Boolean z1, @Nullable Boolean z2) {
    if (z1 == null) {
      return z2;
    }
    if (z2 == null) {
      return z1;
    }
    return z1 || z2;
  }

  /**
   * Joins two instrumentations of the same value reached along different
   * paths.
   *
   * <p>Equal instrumentations join to themselves, and {@link #NONE} absorbs
   * anything. A value that was {@link Kind#ALLOC allocated}, is {@link
   * Kind#INITIAL initial}, or was {@link Kind#UPDATE updated} on one path
   * cannot be merged with a value of different provenance; the result is then
   * {@link JoinResult.Incompatible} and the caller must keep the two paths
   * apart. Other combinations join to {@link #NONE}.
   */
  public static JoinResult partialJoin(Inst inst1, Inst inst2) {
    if (inst1.equals(inst2)) {
      return JoinResult.joined(inst1);
    }
    if (inst1.kind == Kind.NONE || inst2.kind == Kind.NONE) {
      return JoinResult.joined(NONE);
    }
    for (Kind kind : Kind.STRICT) {
      if (inst1.kind == kind || inst2.kind == kind) {
        return JoinResult.incompatible(
            inst1, inst2, "cannot join " + kind + " with different provenance");
      }
    }
    return JoinResult.joined(NONE);
  }

  /**
   * Meets two instrumentations of the same value described by two conjoined
   * facts. Never fails.
   *
   * <p>Equal instrumentations meet to themselves; {@link #NONE} carries no
   * information, so the other argument wins; otherwise the lesser in the
   * ordering of {@link #compareTo(Inst)} wins.
   */
  public static Inst partialMeet(Inst inst1, Inst inst2) {
    if (inst1.equals(inst2)) {
      return inst1;
    }
    if (inst1.kind == Kind.NONE) {
      return inst2;
    }
    if (inst2.kind == Kind.NONE) {
      return inst1;
    }
    return inst1.compareTo(inst2) <= 0 ? inst1 : inst2;
  }

  @Override
  public int compareTo(Inst o) {
    if (this == o) {
      return 0;
    }
    return ComparisonChain.start()
        .compare(kind, o.kind)
        .compare(zeroFlag, o.zeroFlag, BOOLEAN_NULLS_FIRST)
        .compareFalseFirst(nullCaseFlag, o.nullCaseFlag)
        .compare(line, o.line)
        .compare(pos, o.pos, POS_NULLS_FIRST)
        .result();
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, zeroFlag, nullCaseFlag, line, pos);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this || obj instanceof Inst && compareTo((Inst) obj) == 0;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder(kind.camelName);
    if (kind.flagged) {
      buf.append("(zf=")
          .append(zeroFlag)
          .append(", ncf=")
          .append(nullCaseFlag);
      if (kind.located) {
        buf.append(", line=").append(line).append(", pos=").append(pos);
      }
      buf.append(')');
    } else if (kind.located) {
      buf.append('(').append(line).append(')');
    }
    return buf.toString();
  }

  /** Kind of instrumentation. */
  public enum Kind {
    ABSTRACTION("abstraction", false, false),
    ACTUAL_PRECONDITION("actual_precondition", false, false),
    ALLOC("alloc", false, false),
    FORMAL("formal", true, false),
    INITIAL("initial", false, false),
    LOOKUP("lookup", false, false),
    NONE("none", false, false),
    NULLIFY("nullify", false, false),
    REARRANGE("rearrange", true, true),
    TAINT("taint", false, false),
    UPDATE("update", true, true),
    RETURN_FROM_CALL("return_from_call", false, true);

    /** Kinds that cannot be joined with a different instrumentation. */
    static final Kind[] STRICT = {ALLOC, INITIAL, UPDATE};

    public final String camelName;
    /** Whether this kind carries a zero flag and a null case flag. */
    final boolean flagged;
    /** Whether this kind carries a line number. */
    final boolean located;

    Kind(String camelName, boolean flagged, boolean located) {
      this.camelName = camelName;
      this.flagged = flagged;
      this.located = located;
    }
  }
}

// End Inst.java
