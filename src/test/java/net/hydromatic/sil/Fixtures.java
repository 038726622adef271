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
package net.hydromatic.sil;

import static net.hydromatic.sil.ast.SilBuilder.sil;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpara;
import net.hydromatic.sil.ast.HparaDll;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Ident;
import net.hydromatic.sil.ast.Inst;
import net.hydromatic.sil.ast.Location;
import net.hydromatic.sil.ast.PathPos;
import net.hydromatic.sil.ast.Strexp;
import net.hydromatic.sil.type.Typ;

/** Terms shared by tests. */
public class Fixtures {
  public static final Typ NODE = Typ.struct("node");
  public static final Exp NODE_SIZE = Exp.sizeof(NODE, null);
  public static final Location LOC = Location.of("list.c", 12);
  public static final PathPos POS = PathPos.of("append", 3);

  public static final Ident X = Ident.normal("x", 101);
  public static final Ident Y = Ident.normal("y", 102);
  public static final Ident Z = Ident.normal("z", 103);
  public static final Ident ROOT = Ident.primed("root", 201);
  public static final Ident NEXT = Ident.primed("next", 202);
  public static final Ident DATA = Ident.primed("data", 203);
  public static final Ident SHARED = Ident.primed("shared", 204);

  private Fixtures() {}

  public static Exp var(Ident id) {
    return Exp.var(id);
  }

  public static Map.Entry<Ident, Exp> bind(Ident id, Exp exp) {
    return Maps.immutableEntry(id, exp);
  }

  /** Returns a scalar with no instrumentation. */
  public static Strexp.Eexp scalar(Exp exp) {
    return sil.eexp(exp, Inst.NONE);
  }

  /** Returns "lexp |-> {next: next, data: data} : sizeof(node)". */
  public static Hpred.PointsTo cell(Exp lexp, Exp next, Exp data, Inst inst) {
    return sil.pointsTo(
        lexp,
        sil.estruct(
            ImmutableList.of(
                sil.entry("next", sil.eexp(next, inst)),
                sil.entry("data", sil.eexp(data, inst))),
            Inst.NONE),
        NODE_SIZE);
  }

  /** Returns "\(root, next, []). exists []. [root |-> next]". */
  public static Hpara simplePara() {
    return sil.hpara(
        ROOT,
        NEXT,
        ImmutableList.of(),
        ImmutableList.of(),
        ImmutableList.of(
            sil.pointsTo(var(ROOT), scalar(var(NEXT)), NODE_SIZE)));
  }

  /**
   * Returns "\(root, next, [shared]). exists [data]. [root |-> {next: next,
   * data: data}, data |-> shared]".
   */
  public static Hpara dataPara() {
    return sil.hpara(
        ROOT,
        NEXT,
        ImmutableList.of(SHARED),
        ImmutableList.of(DATA),
        ImmutableList.of(
            cell(var(ROOT), var(NEXT), var(DATA), Inst.NONE),
            sil.pointsTo(var(DATA), scalar(var(SHARED)), NODE_SIZE)));
  }

  /**
   * Returns "\(cell, blink, flink, []). exists [data]. [cell |-> {prev:
   * blink, next: flink, data: data}]".
   */
  public static HparaDll dllPara() {
    final Ident cell = Ident.primed("cell", 301);
    final Ident blink = Ident.primed("blink", 302);
    final Ident flink = Ident.primed("flink", 303);
    final Ident data = Ident.primed("data", 304);
    return sil.hparaDll(
        cell,
        blink,
        flink,
        ImmutableList.of(),
        ImmutableList.of(data),
        ImmutableList.of(
            sil.pointsTo(
                var(cell),
                sil.estruct(
                    ImmutableList.of(
                        sil.entry("prev", scalar(var(blink))),
                        sil.entry("next", scalar(var(flink))),
                        sil.entry("data", scalar(var(data)))),
                    Inst.NONE),
                NODE_SIZE)));
  }

  /** Returns a list of expressions. */
  public static List<Exp> exps(Exp... exps) {
    return ImmutableList.copyOf(exps);
  }
}

// End Fixtures.java
