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

import static net.hydromatic.sil.Fixtures.NODE_SIZE;
import static net.hydromatic.sil.Fixtures.X;
import static net.hydromatic.sil.Fixtures.Y;
import static net.hydromatic.sil.Fixtures.Z;
import static net.hydromatic.sil.Fixtures.cell;
import static net.hydromatic.sil.Fixtures.dataPara;
import static net.hydromatic.sil.Fixtures.dllPara;
import static net.hydromatic.sil.Fixtures.scalar;
import static net.hydromatic.sil.Fixtures.simplePara;
import static net.hydromatic.sil.Fixtures.var;
import static net.hydromatic.sil.ast.SilBuilder.sil;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpara;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Ident;
import net.hydromatic.sil.ast.Inst;
import net.hydromatic.sil.ast.LsegKind;
import org.junit.jupiter.api.Test;

/** Tests {@link Predicates}. */
public class PredicatesTest {
  @Test
  void testEmpty() {
    final Predicates.Env env = Predicates.emptyEnv();
    assertThat(env.isEmpty(), is(true));
    env.process(cell(var(X), var(Y), var(Z), Inst.NONE));
    assertThat(env.isEmpty(), is(true));
    final List<String> seen = new ArrayList<>();
    env.iter((p, i) -> seen.add("sll" + i), (p, i) -> seen.add("dll" + i));
    assertThat(seen, empty());
  }

  /**
   * Equal parameters get one id; ids are assigned in order of registration
   * and shared between singly- and doubly-linked parameters.
   */
  @Test
  void testIds() {
    final Predicates.Env env = Predicates.emptyEnv();
    env.process(
        sil.lseg(
            LsegKind.NE, simplePara(), var(X), var(Y), ImmutableList.of()));
    env.process(
        sil.dllseg(
            LsegKind.PE,
            dllPara(),
            var(X),
            Exp.ZERO,
            Exp.ZERO,
            var(Y),
            ImmutableList.of()));
    env.process(
        sil.lseg(
            LsegKind.PE, simplePara(), var(Y), var(Z), ImmutableList.of()));
    assertThat(env.isEmpty(), is(false));
    assertThat(env.register(simplePara()), is(0));
    assertThat(env.register(dllPara()), is(1));
    assertThat(env.register(dataPara()), is(2));

    final List<String> seen = new ArrayList<>();
    env.iter((p, i) -> seen.add("sll" + i), (p, i) -> seen.add("dll" + i));
    assertThat(seen, contains("sll0", "dll1", "sll2"));

    // The registry is consumed
    seen.clear();
    env.iter((p, i) -> seen.add("sll" + i), (p, i) -> seen.add("dll" + i));
    assertThat(seen, empty());
    final Hpred lseg =
        sil.lseg(
            LsegKind.NE, simplePara(), var(X), var(Y), ImmutableList.of());
    assertThrows(IllegalStateException.class, () -> env.process(lseg));
  }

  /** A parameter whose body contains a segment registers the inner one. */
  @Test
  void testNested() {
    final Ident root = Ident.primed("r", 401);
    final Ident next = Ident.primed("n", 402);
    final Hpara outer =
        sil.hpara(
            root,
            next,
            ImmutableList.of(),
            ImmutableList.of(),
            ImmutableList.of(
                sil.pointsTo(var(root), scalar(var(next)), NODE_SIZE),
                sil.lseg(
                    LsegKind.PE,
                    simplePara(),
                    var(root),
                    var(next),
                    ImmutableList.of())));
    final List<Hpara> registered = new ArrayList<>();
    final List<Integer> registeredIds = new ArrayList<>();
    final Session session =
        new Session()
            .withTracer(
                Tracers.withOnRegister(
                    Tracers.empty(),
                    (p, i) -> {
                      registered.add(p);
                      registeredIds.add(i);
                    },
                    (p, i) -> {
                      throw new AssertionError(p);
                    }));
    final Predicates.Env env = Predicates.emptyEnv(session);
    env.process(
        sil.lseg(LsegKind.NE, outer, var(X), var(Y), ImmutableList.of()));
    assertThat(registered, contains(outer, simplePara()));
    assertThat(registeredIds, contains(0, 1));

    final List<Hpara> paras = new ArrayList<>();
    final List<Integer> ids = new ArrayList<>();
    env.iter(
        (p, i) -> {
          paras.add(p);
          ids.add(i);
        },
        (p, i) -> {
          throw new AssertionError(p);
        });
    assertThat(paras, contains(outer, simplePara()));
    assertThat(ids, contains(0, 1));
  }

  /** A tracer sees doubly-linked parameters with their own type. */
  @Test
  void testTracerDll() {
    final List<String> events = new ArrayList<>();
    final Session session =
        new Session()
            .withTracer(
                Tracers.withOnRegister(
                    Tracers.empty(),
                    (p, i) -> events.add("sll" + i + ":" + p.evars.size()),
                    (p, i) -> events.add("dll" + i + ":" + p.evars.size())));
    final Predicates.Env env = Predicates.emptyEnv(session);
    env.process(
        sil.lseg(
            LsegKind.NE, simplePara(), var(X), var(Y), ImmutableList.of()));
    env.process(
        sil.dllseg(
            LsegKind.PE,
            dllPara(),
            var(X),
            Exp.ZERO,
            Exp.ZERO,
            var(Y),
            ImmutableList.of()));
    assertThat(events, contains("sll0:0", "dll1:1"));
  }
}

// End PredicatesTest.java
