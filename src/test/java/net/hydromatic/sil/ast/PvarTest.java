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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.sil.type.Typ;
import org.junit.jupiter.api.Test;

/** Tests {@link Pvar}. */
public class PvarTest {
  /**
   * A local static is named after its procedure, so the procedure name occurs
   * in the variable name exactly once.
   */
  @Test
  void testIsStaticLocalName() {
    assertThat(
        Pvar.global("nextId_counter").isStaticLocalName("nextId"), is(true));
    assertThat(Pvar.global("nextId").isStaticLocalName("nextId"), is(true));
    assertThat(
        Pvar.global("nextId_nextId_counter").isStaticLocalName("nextId"),
        is(false));
    assertThat(
        Pvar.local("counter", "nextId").isStaticLocalName("nextId"),
        is(false));
    assertThrows(
        IllegalArgumentException.class,
        () -> Pvar.global("counter").isStaticLocalName(""));
  }

  @Test
  void testIsBlock() {
    assertThat(
        Pvar.local(Typ.BLOCK_PREFIX + "Downloader_start_1", "start").isBlock(),
        is(true));
    assertThat(
        Pvar.local("copy" + Typ.BLOCK_PREFIX + "2", "start").isBlock(),
        is(true));
    assertThat(Pvar.local("block", "start").isBlock(), is(false));
    assertThat(Pvar.global("__objc_anonymous").isBlock(), is(false));
  }
}

// End PvarTest.java
