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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop}. */
public class PropTest {
  @Test
  void testLookup() {
    assertThat(Prop.lookup("nelseg"), is(Prop.NELSEG));
    assertThat(Prop.lookup("NELSEG"), is(Prop.NELSEG));
    assertThat(
        Prop.lookup("compactParameterBodies"),
        is(Prop.COMPACT_PARAMETER_BODIES));
    assertThat(Prop.lookup("FRESH_IDENT_NAME"), is(Prop.FRESH_IDENT_NAME));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> Prop.lookup("x"));
    assertThat(e.getMessage(), is("property x not found"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.COMPACT_PARAMETER_BODIES));
  }

  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.NELSEG.booleanValue(map), is(false));
    assertThat(Prop.COMPACT_PARAMETER_BODIES.booleanValue(map), is(true));
    assertThat(Prop.FRESH_IDENT_NAME.stringValue(map), is("t"));
  }

  @Test
  void testSet() {
    final Session session = new Session();
    Prop.NELSEG.set(session.map, true);
    assertThat(session.booleanValue(Prop.NELSEG), is(true));
    Prop.NELSEG.set(session.map, null);
    assertThat(session.booleanValue(Prop.NELSEG), is(false));
    Prop.FRESH_IDENT_NAME.set(session.map, "v");
    assertThat(Prop.FRESH_IDENT_NAME.remove(session.map), is("v"));
    assertThat(Prop.FRESH_IDENT_NAME.remove(session.map), nullValue());
  }

  @Test
  void testWrongType() {
    final Session session = new Session();
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.NELSEG.set(session.map, "yes"));
    assertThrows(
        IllegalArgumentException.class,
        () -> session.stringValue(Prop.NELSEG));
  }
}

// End PropTest.java
