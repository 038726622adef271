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
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpara;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Ident;
import net.hydromatic.sil.ast.Inst;
import org.junit.jupiter.api.Test;

/** Tests {@link Instantiator}. */
public class InstantiatorTest {
  /** Unfolds "\(root, next, []). [root |-> next]" with (x, y, []). */
  @Test
  void testSimple() {
    final Instantiator instantiator = new Instantiator(new Session());
    final Instantiator.Instantiation i =
        instantiator.instantiate(
            simplePara(), var(X), var(Y), ImmutableList.of());
    assertThat(i.fresh, empty());
    assertThat(
        i.body, contains(sil.pointsTo(var(X), scalar(var(Y)), NODE_SIZE)));
  }

  /** Shared variables get the actuals; existentials get fresh names. */
  @Test
  void testExistentials() {
    final Instantiator instantiator = new Instantiator(new Session());
    final Instantiator.Instantiation i =
        instantiator.instantiate(
            dataPara(), var(X), var(Y), ImmutableList.of(var(Z)));
    assertThat(i.fresh, hasSize(1));
    final Ident t = i.fresh.get(0);
    assertThat(t.isPrimed(), is(true));
    assertThat(t.name, is("t"));
    assertThat(
        i.body,
        contains(
            cell(var(X), var(Y), var(t), Inst.NONE),
            sil.pointsTo(var(t), scalar(var(Z)), NODE_SIZE)));
  }

  /**
   * Two unfoldings of the same parameter create different identifiers, and
   * neither reuses an identifier of the actual arguments.
   */
  @Test
  void testFreshness() {
    final Session session = new Session();
    final Instantiator instantiator = new Instantiator(session);
    final Ident a = Ident.normal("a", 0);
    final Ident b = Ident.primed("t", 1);
    final Hpara para = dataPara();
    final List<Exp> actuals = ImmutableList.of(var(a));
    final Instantiator.Instantiation i1 =
        instantiator.instantiate(para, var(a), var(b), actuals);
    final Instantiator.Instantiation i2 =
        instantiator.instantiate(para, var(a), var(b), actuals);
    final Ident t1 = i1.fresh.get(0);
    final Ident t2 = i2.fresh.get(0);
    assertThat(t1, not(t2));
    for (Ident t : ImmutableList.of(t1, t2)) {
      assertThat(t.stamp, not(a.stamp));
      assertThat(t.stamp, not(b.stamp));
    }
    assertThat(t1.stamp, is(2));
    assertThat(t2.stamp, is(3));
  }

  @Test
  void testArity() {
    final Instantiator instantiator = new Instantiator(new Session());
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                instantiator.instantiate(
                    dataPara(), var(X), var(Y), ImmutableList.of()));
    assertThat(
        e.getMessage(),
        is("parameter has 1 shared variables but 0 actual arguments"));
  }

  @Test
  void testDll() {
    final Instantiator instantiator = new Instantiator(new Session());
    final Instantiator.Instantiation i =
        instantiator.instantiate(
            dllPara(), var(X), var(Y), var(Z), ImmutableList.of());
    assertThat(i.fresh, hasSize(1));
    final Hpred.PointsTo pointsTo = (Hpred.PointsTo) i.body.get(0);
    assertThat(pointsTo.lexp, is(var(X)));
    final String expected =
        "{prev:y$102, next:z$103, data:_t$" + i.fresh.get(0).stamp + "}";
    assertThat(pointsTo.strexp, hasToString(expected));
  }

  /** The name of fresh identifiers is a property of the session. */
  @Test
  void testFreshIdentName() {
    final Session session = new Session();
    Prop.FRESH_IDENT_NAME.set(session.map, "w");
    final Instantiator.Instantiation i =
        new Instantiator(session)
            .instantiate(
                dataPara(), var(X), Exp.ZERO, ImmutableList.of(Exp.ONE));
    assertThat(i.fresh.get(0).name, is("w"));
  }

  @Test
  void testTracer() {
    final List<String> events = new ArrayList<>();
    final Session session =
        new Session()
            .withTracer(
                Tracers.withOnInstantiate(
                    Tracers.empty(),
                    (fresh, body) -> events.add(fresh.size() + ":" + body)));
    final Instantiator instantiator = new Instantiator(session);
    instantiator.instantiate(
        simplePara(), var(X), var(Y), ImmutableList.of());
    assertThat(events, hasSize(1));
    assertThat(
        events.get(0), is("0:[x$101 |-> y$102 : sizeof(struct node)]"));

    instantiator.instantiate(
        dllPara(), var(X), Exp.ZERO, var(Y), ImmutableList.of());
    assertThat(events, hasSize(2));
    assertThat(events.get(1).startsWith("1:"), is(true));
  }
}

// End InstantiatorTest.java
