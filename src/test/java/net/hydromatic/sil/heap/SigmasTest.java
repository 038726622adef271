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

import static net.hydromatic.sil.Fixtures.X;
import static net.hydromatic.sil.Fixtures.Y;
import static net.hydromatic.sil.Fixtures.Z;
import static net.hydromatic.sil.Fixtures.cell;
import static net.hydromatic.sil.Fixtures.dllPara;
import static net.hydromatic.sil.Fixtures.simplePara;
import static net.hydromatic.sil.Fixtures.var;
import static net.hydromatic.sil.ast.SilBuilder.sil;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Ident;
import net.hydromatic.sil.ast.Inst;
import net.hydromatic.sil.ast.LsegKind;
import net.hydromatic.sil.ast.Op;
import org.junit.jupiter.api.Test;

/** Tests {@link Sigmas}. */
public class SigmasTest {
  private static final Hpred CELL = cell(var(Z), Exp.ZERO, Exp.ONE, Inst.NONE);
  private static final Hpred LSEG_PE =
      sil.lseg(LsegKind.PE, simplePara(), var(X), var(Y), ImmutableList.of());
  private static final Hpred DLLSEG_PE =
      sil.dllseg(
          LsegKind.PE,
          dllPara(),
          var(X),
          Exp.ZERO,
          var(Y),
          var(Z),
          ImmutableList.of());

  private static Session nelseg() {
    final Session session = new Session();
    Prop.NELSEG.set(session.map, true);
    return session;
  }

  /** Without "nelseg", the sigma is a single case. */
  @Test
  void testNoSplit() {
    final List<Hpred> sigma = ImmutableList.of(CELL, LSEG_PE);
    final List<Sigmas.Case> cases = Sigmas.toSigmaNe(new Session(), sigma);
    assertThat(cases, hasSize(1));
    assertThat(cases.get(0).pure, empty());
    assertThat(cases.get(0).sigma, is(sigma));
  }

  @Test
  void testSplitLseg() {
    final List<Sigmas.Case> cases =
        Sigmas.toSigmaNe(nelseg(), ImmutableList.of(CELL, LSEG_PE));
    assertThat(cases, hasSize(2));
    assertThat(cases.get(0).pure, contains(sil.eq(var(X), var(Y))));
    assertThat(cases.get(0).sigma, contains(CELL));
    assertThat(cases.get(1).pure, empty());
    assertThat(
        cases.get(1).sigma,
        contains(CELL, ((Hpred.Lseg) LSEG_PE).withKind(LsegKind.NE)));
  }

  @Test
  void testSplitDllseg() {
    final List<Sigmas.Case> cases =
        Sigmas.toSigmaNe(nelseg(), ImmutableList.of(DLLSEG_PE));
    assertThat(cases, hasSize(2));
    assertThat(
        cases.get(0).pure,
        contains(sil.eq(var(X), var(Y)), sil.eq(Exp.ZERO, var(Z))));
    assertThat(cases.get(0).sigma, empty());
    assertThat(
        cases.get(1).sigma,
        contains(((Hpred.Dllseg) DLLSEG_PE).withKind(LsegKind.NE)));
  }

  /** Each possibly-empty segment doubles the number of cases. */
  @Test
  void testSplitTwice() {
    final Hpred nonEmpty =
        sil.lseg(
            LsegKind.NE, simplePara(), var(Y), var(Z), ImmutableList.of());
    final List<Sigmas.Case> cases =
        Sigmas.toSigmaNe(
            nelseg(), ImmutableList.of(LSEG_PE, nonEmpty, DLLSEG_PE));
    assertThat(cases, hasSize(4));
    assertThat(cases.get(0).pure, hasSize(3));
    assertThat(cases.get(0).sigma, contains(nonEmpty));
    assertThat(cases.get(3).pure, empty());
    assertThat(cases.get(3).sigma, hasSize(3));
  }

  @Test
  void testLexps() {
    final List<Hpred> sigma = ImmutableList.of(CELL, LSEG_PE, DLLSEG_PE);
    assertThat(
        Sigmas.lexps(e -> true, sigma),
        contains(var(Z), var(X), var(X), var(Z)));
    assertThat(
        Sigmas.lexps(e -> !e.equals(var(X)), sigma), contains(var(Z), var(Z)));
  }

  /**
   * In the footprint part, an array index that mentions a non-footprint
   * identifier is replaced by a fresh footprint variable.
   */
  @Test
  void testArrayCleanNewIndex() {
    final List<Exp> replaced = new ArrayList<>();
    final Session session =
        new Session()
            .withTracer(
                Tracers.withOnCleanArrayIndex(
                    Tracers.empty(), (index, fresh) -> replaced.add(index)));
    final Ident i = Ident.footprint("i", 500);
    final Exp footprintIndex = Exp.binOp(Op.PLUS, var(i), Exp.ONE);
    assertThat(
        Sigmas.arrayCleanNewIndex(session, true, footprintIndex),
        sameInstance(footprintIndex));
    assertThat(
        Sigmas.arrayCleanNewIndex(session, true, Exp.ONE),
        sameInstance(Exp.ONE));

    // Outside the footprint part, any index is kept
    final Exp mixed = Exp.binOp(Op.PLUS, var(i), var(X));
    assertThat(
        Sigmas.arrayCleanNewIndex(session, false, mixed), sameInstance(mixed));
    assertThat(replaced, empty());

    final Exp cleaned = Sigmas.arrayCleanNewIndex(session, true, mixed);
    assertThat(cleaned, instanceOf(Exp.Var.class));
    assertThat(((Exp.Var) cleaned).id.isFootprint(), is(true));
    assertThat(cleaned, hasToString("@footprint$0"));
    assertThat(replaced, contains(mixed));

    // Each replacement is a new variable
    final Exp yIndex = Exp.binOp(Op.PLUS, var(X), var(Y));
    final Exp cleaned2 = Sigmas.arrayCleanNewIndex(session, true, yIndex);
    assertThat(cleaned2, not(is(cleaned)));
    assertThat(replaced, hasSize(2));
  }
}

// End SigmasTest.java
