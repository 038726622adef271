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

import static net.hydromatic.sil.Fixtures.DATA;
import static net.hydromatic.sil.Fixtures.NEXT;
import static net.hydromatic.sil.Fixtures.ROOT;
import static net.hydromatic.sil.Fixtures.X;
import static net.hydromatic.sil.Fixtures.Y;
import static net.hydromatic.sil.Fixtures.Z;
import static net.hydromatic.sil.Fixtures.bind;
import static net.hydromatic.sil.Fixtures.cell;
import static net.hydromatic.sil.Fixtures.dataPara;
import static net.hydromatic.sil.Fixtures.var;
import static net.hydromatic.sil.ast.SilBuilder.sil;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.emptyIterable;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpara;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Ident;
import net.hydromatic.sil.ast.Inst;
import net.hydromatic.sil.ast.LsegKind;
import net.hydromatic.sil.subst.ExpSubst;
import org.junit.jupiter.api.Test;

/** Tests {@link FreeVars}, {@link FreeFinder} and {@link IdentGenerator}. */
public class FreeVarsTest {
  @Test
  void testOf() {
    assertThat(FreeVars.of(Exp.ONE), emptyIterable());
    assertThat(FreeVars.of(sil.eq(var(X), var(X))), contains(X, X));
    final ExpSubst subst =
        ExpSubst.of(ImmutableList.of(bind(X, var(Y)), bind(Y, var(Z))));
    assertThat(FreeVars.of(subst), contains(Y, Z));
    final List<Hpred> sigma =
        ImmutableList.of(
            cell(var(X), var(Y), Exp.ZERO, Inst.NONE),
            sil.lseg(
                LsegKind.PE,
                dataPara(),
                var(Z),
                var(X),
                ImmutableList.of(var(Y))));
    assertThat(FreeVars.ofHpreds(sigma), contains(X, Y, Z, X, Y));
  }

  /**
   * A parameter's bound identifiers are not free, and neither are those of
   * a parameter nested in its body.
   */
  @Test
  void testShallow() {
    assertThat(FreeVars.shallow(dataPara()), emptyIterable());
    final Hpara open =
        sil.hpara(
            ROOT,
            NEXT,
            ImmutableList.of(),
            ImmutableList.of(),
            ImmutableList.of(
                cell(var(ROOT), var(NEXT), var(X), Inst.NONE),
                sil.lseg(
                    LsegKind.NE,
                    dataPara(),
                    var(NEXT),
                    var(DATA),
                    ImmutableList.of(var(ROOT)))));
    assertThat(FreeVars.shallow(open), contains(X, DATA));
    final Hpred lseg =
        sil.lseg(LsegKind.NE, open, var(Y), var(Z), ImmutableList.of());
    assertThat(FreeVars.of(lseg), contains(X, DATA, Y, Z));
  }

  @Test
  void testFreeFinder() {
    final List<Ident> ids = new ArrayList<>();
    new FreeFinder(ids::add)
        .add(var(X))
        .add(sil.neq(var(Y), Exp.ZERO))
        .addAll(ImmutableList.of(var(Z), Exp.ONE))
        .add(cell(var(X), var(Y), Exp.ZERO, Inst.NONE));
    assertThat(ids, contains(X, Y, Z, X, Y));

    final List<Hpred> sigma =
        ImmutableList.of(
            cell(var(X), var(Y), var(X), Inst.NONE),
            cell(var(Z), var(Y), Exp.ZERO, Inst.NONE));
    assertThat(FreeFinder.freeIds(sigma), contains(X, Y, Z));
  }

  @Test
  void testIdentGenerator() {
    final IdentGenerator generator = new IdentGenerator();
    generator.avoid(
        ImmutableList.of(Ident.normal("a", 1), Ident.normal("b", 2)));
    final Ident t0 = generator.create(Ident.Kind.PRIMED, "t");
    assertThat(t0.stamp, is(0));
    assertThat(t0.isPrimed(), is(true));
    final List<Ident> ts = generator.createPrimed("t", 2);
    assertThat(ts.get(0).stamp, is(3));
    assertThat(ts.get(1).stamp, is(4));
    assertThat(generator.nextStamp(), is(5));

    // Stamps already passed need not be reserved
    generator.avoid(Ident.normal("c", 4));
    assertThat(generator.create(Ident.Kind.FOOTPRINT, "f").stamp, is(5));
  }
}

// End FreeVarsTest.java
