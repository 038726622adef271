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

import static net.hydromatic.sil.Fixtures.DATA;
import static net.hydromatic.sil.Fixtures.LOC;
import static net.hydromatic.sil.Fixtures.NEXT;
import static net.hydromatic.sil.Fixtures.NODE;
import static net.hydromatic.sil.Fixtures.NODE_SIZE;
import static net.hydromatic.sil.Fixtures.POS;
import static net.hydromatic.sil.Fixtures.ROOT;
import static net.hydromatic.sil.Fixtures.SHARED;
import static net.hydromatic.sil.Fixtures.X;
import static net.hydromatic.sil.Fixtures.Y;
import static net.hydromatic.sil.Fixtures.Z;
import static net.hydromatic.sil.Fixtures.cell;
import static net.hydromatic.sil.Fixtures.dataPara;
import static net.hydromatic.sil.Fixtures.dllPara;
import static net.hydromatic.sil.Fixtures.exps;
import static net.hydromatic.sil.Fixtures.simplePara;
import static net.hydromatic.sil.Fixtures.var;
import static net.hydromatic.sil.ast.SilBuilder.sil;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.emptyIterable;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Iterator;
import net.hydromatic.sil.type.Typ;
import org.junit.jupiter.api.Test;

/** Tests {@link Strexp}, {@link Hpred} and {@link Hpara}. */
public class HpredTest {
  /**
   * Two structured values that differ only in instrumentation are equal by
   * default, and unequal if instrumentation is compared.
   */
  @Test
  void testEqualityIgnoresInst() {
    final Strexp s1 = sil.eexp(var(X), Inst.ALLOC);
    final Strexp s2 = sil.eexp(var(X), Inst.update(LOC, POS));
    assertThat(s1.equals(s2), is(true));
    assertThat(s1.hashCode(), is(s2.hashCode()));
    assertThat(s1.compareTo(s2), is(0));
    assertThat(Strexp.equal(s1, s2, false), is(true));
    assertThat(Strexp.equal(s1, s2, true), is(false));
    assertThat(Strexp.compare(s1, s2, true), not(is(0)));

    final Hpred h1 = cell(var(X), var(Y), var(Z), Inst.ALLOC);
    final Hpred h2 = cell(var(X), var(Y), var(Z), Inst.TAINT);
    assertThat(h1, is(h2));
    assertThat(h1.hashCode(), is(h2.hashCode()));
    assertThat(Hpred.equal(h1, h2, false), is(true));
    assertThat(Hpred.equal(h1, h2, true), is(false));
    assertThat(Hpred.equal(h1, h1, true), is(true));
    assertThat(Hpred.compare(h1, h2, true), not(is(0)));
    assertThat(
        Hpred.compare(h1, h2, true), is(-Hpred.compare(h2, h1, true)));
  }

  @Test
  void testStructuralEquality() {
    final Hpred h1 = cell(var(X), var(Y), var(Z), Inst.NONE);
    final Hpred h2 = cell(var(X), var(Y), var(Z), Inst.NONE);
    final Hpred h3 = cell(var(X), var(Z), var(Y), Inst.NONE);
    assertThat(h1 == h2, is(false));
    assertThat(h1, is(h2));
    assertThat(h1.equals(h3), is(false));
    assertThat(h1.compareTo(h3) < 0, is(true));
    final String expected =
        "x$101 |-> {next:y$102, data:z$103} : sizeof(struct node)";
    assertThat(h1, hasToString(expected));
  }

  @Test
  void testSetOf() {
    final Hpred h1 = cell(var(Y), var(X), var(Z), Inst.NONE);
    final Hpred h2 = cell(var(X), var(Y), var(Z), Inst.ALLOC);
    final Hpred h3 = cell(var(X), var(Y), var(Z), Inst.NONE);
    assertThat(Hpred.setOf(ImmutableList.of(h1, h2, h3)), contains(h2, h1));
  }

  @Test
  void testEntries() {
    final Hpred pointsTo = cell(var(X), var(Y), var(Z), Inst.NONE);
    assertThat(pointsTo.entries(), contains(var(X)));
    final Hpred lseg =
        sil.lseg(LsegKind.NE, simplePara(), var(X), var(Y), exps());
    assertThat(lseg.entries(), contains(var(X)));
    final Hpred dllseg =
        sil.dllseg(
            LsegKind.PE, dllPara(), var(X), Exp.ZERO, Exp.ZERO, var(Z), exps());
    assertThat(dllseg.entries(), contains(var(X), var(Z)));
  }

  /**
   * The free identifiers of a segment exclude those bound by its parameter.
   */
  @Test
  void testFreeVars() {
    final Hpara para = dataPara();
    assertThat(
        para.bound(), is(ImmutableSet.of(ROOT, NEXT, SHARED, DATA)));
    assertThat(para.freeVars(), emptyIterable());

    final Hpred lseg =
        sil.lseg(LsegKind.PE, para, var(X), var(Y), exps(var(Z)));
    assertThat(lseg.freeVars(), contains(X, Y, Z));

    final Hpred pointsTo = cell(var(X), var(Y), var(X), Inst.NONE);
    assertThat(pointsTo.freeVars(), contains(X, Y, X));

    final Atom atom = sil.neq(var(Z), Exp.binOp(Op.PLUS, var(X), Exp.ONE));
    assertThat(atom.freeVars(), contains(Z, X));
  }

  /**
   * A parameter whose body refers to an identifier outside its closure
   * reports it; a nested parameter excludes its own bound identifiers.
   */
  @Test
  void testFreeVarsNested() {
    final Hpara inner = dataPara();
    final Ident outerRoot = Ident.primed("r", 401);
    final Ident outerNext = Ident.primed("n", 402);
    final Hpara outer =
        sil.hpara(
            outerRoot,
            outerNext,
            ImmutableList.of(),
            ImmutableList.of(),
            ImmutableList.of(
                sil.lseg(
                    LsegKind.NE,
                    inner,
                    var(outerRoot),
                    var(outerNext),
                    exps(var(X)))));
    assertThat(outer.freeVars(), contains(X));
    final Hpred lseg =
        sil.lseg(LsegKind.NE, outer, var(Y), Exp.ZERO, exps());
    assertThat(lseg.freeVars(), contains(X, Y));
  }

  /** A sequence of free identifiers may be iterated more than once. */
  @Test
  void testFreeVarsRestartable() {
    final Hpred pointsTo = cell(var(Z), var(Y), var(X), Inst.NONE);
    final Iterable<Ident> freeVars = pointsTo.freeVars();
    final Iterator<Ident> iterator = freeVars.iterator();
    assertThat(iterator.next(), is(Z));
    assertThat(freeVars, contains(Z, Y, X));
    assertThat(freeVars, contains(Z, Y, X));
    assertThat(iterator.next(), is(Y));
  }

  @Test
  void testHparaEquality() {
    assertThat(simplePara(), is(simplePara()));
    assertThat(simplePara().hashCode(), is(simplePara().hashCode()));
    assertThat(simplePara().equals(dataPara()), is(false));
    final Hpara p = simplePara();
    assertThat(p.copy(p.body), is(p));
    final Hpara p2 =
        p.copy(
            ImmutableList.of(
                sil.pointsTo(
                    var(ROOT), sil.eexp(var(NEXT), Inst.ALLOC), NODE_SIZE)));
    assertThat(p2, is(p));
    assertThat(Hpara.compare(p, p2, true), not(is(0)));
  }

  @Test
  void testLsegShared() {
    assertThat(
        sil.lseg(LsegKind.NE, dataPara(), var(X), var(Y), exps(var(Z)))
            .withKind(LsegKind.PE)
            .kind,
        is(LsegKind.PE));
  }

  /** A points-to describes an object if its type is an Objective-C class. */
  @Test
  void testIsObjcObject() {
    final Strexp value = sil.eexp(var(Y), Inst.NONE);
    final Typ nsObject = Typ.objcClass("NSObject");
    assertThat(nsObject.isObjcClass(), is(true));
    assertThat(nsObject, hasToString("objc_class NSObject"));
    assertThat(nsObject.equals(Typ.cppClass("NSObject")), is(false));
    assertThat(Typ.objcClass("node").equals(NODE), is(false));

    assertThat(
        sil.pointsTo(var(X), value, Exp.sizeof(nsObject, null)).isObjcObject(),
        is(true));
    assertThat(
        sil.pointsTo(var(X), value, NODE_SIZE).isObjcObject(), is(false));
    final Exp cppSize = Exp.sizeof(Typ.cppClass("NSObject"), null);
    assertThat(sil.pointsTo(var(X), value, cppSize).isObjcObject(), is(false));
    assertThat(sil.pointsTo(var(X), value, var(Z)).isObjcObject(), is(false));
    assertThat(
        sil.lseg(
                LsegKind.NE, simplePara(), var(X), var(Y), ImmutableList.of())
            .isObjcObject(),
        is(false));
  }
}

// End HpredTest.java
