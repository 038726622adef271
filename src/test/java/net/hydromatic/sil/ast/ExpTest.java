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

import static net.hydromatic.sil.Fixtures.NODE;
import static net.hydromatic.sil.Fixtures.X;
import static net.hydromatic.sil.Fixtures.Y;
import static net.hydromatic.sil.Fixtures.exps;
import static net.hydromatic.sil.Fixtures.var;
import static net.hydromatic.sil.ast.SilBuilder.sil;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.sil.type.Typ;
import org.junit.jupiter.api.Test;

/** Tests {@link Exp} and the zero values of {@link Typ}. */
public class ExpTest {
  private static final Pvar LOCAL = Pvar.local("buf", "append");
  private static final Pvar GLOBAL = Pvar.global("head");

  @Test
  void testZeroValue() {
    assertThat(Typ.INT.zeroValue(), is(Exp.ZERO));
    assertThat(Typ.ptr(NODE).zeroValue(), is(Exp.ZERO));
    assertThat(Typ.DOUBLE.zeroValue(), is(Exp.const_(0.0d)));
    assertThat(NODE.zeroValueOpt().isPresent(), is(false));
    assertThat(Typ.VOID.zeroValueOpt().isPresent(), is(false));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, NODE::zeroValue);
    assertThat(
        e.getMessage().startsWith("no zero value for non-numerical type"),
        is(true));
  }

  /**
   * An expression has a local address if it mentions the address of a
   * non-global program variable, however deeply nested.
   */
  @Test
  void testHasLocalAddr() {
    assertThat(var(X).hasLocalAddr(), is(false));
    assertThat(Exp.int_(3).hasLocalAddr(), is(false));
    assertThat(Exp.lvar(GLOBAL).hasLocalAddr(), is(false));
    assertThat(Exp.lvar(LOCAL).hasLocalAddr(), is(true));

    final Exp nested =
        Exp.binOp(
            Op.PLUS_PI,
            var(Y),
            Exp.cast(
                Typ.ptr(NODE),
                Exp.lindex(
                    Exp.lfield(Exp.lvar(LOCAL), "data", NODE), Exp.ONE)));
    assertThat(nested.hasLocalAddr(), is(true));
    assertThat(
        Exp.unOp(Op.NEG, Exp.lvar(GLOBAL), Typ.INT).hasLocalAddr(),
        is(false));
    assertThat(Exp.sizeof(NODE, Exp.lvar(LOCAL)).hasLocalAddr(), is(true));
    assertThat(Exp.sizeof(NODE, null).hasLocalAddr(), is(false));

    assertThat(sil.eq(var(X), Exp.lvar(LOCAL)).hasLocalAddr(), is(true));
    assertThat(sil.neq(var(X), Exp.lvar(GLOBAL)).hasLocalAddr(), is(false));
  }

  /**
   * Converting a list to a set removes duplicates and sorts; variables
   * precede constants.
   */
  @Test
  void testElistToEset() {
    assertThat(
        sil.elistToEset(
            exps(Exp.int_(2), var(Y), Exp.int_(2), var(X), Exp.ZERO)),
        contains(var(X), var(Y), Exp.ZERO, Exp.int_(2)));
    assertThat(sil.elistToEset(ImmutableList.of()).isEmpty(), is(true));
  }

  @Test
  void testToString() {
    assertThat(
        Exp.binOp(Op.PLUS, var(X), Exp.unOp(Op.NEG, var(Y), null)),
        hasToString("(x$101 + -y$102)"));
    assertThat(Exp.sizeof(NODE, null), hasToString("sizeof(struct node)"));
  }
}

// End ExpTest.java
