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

import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State shared by the operations of one analysis task: property values, a
 * tracer, and the generator of fresh identifiers.
 *
 * <p>Each task should have its own session; a session is not thread-safe.
 */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;

  /** Generator of fresh identifiers. */
  public final IdentGenerator identGenerator = new IdentGenerator();

  private Tracer tracer = Tracers.empty();

  /**
   * Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied. It may be immutable if the session is for a narrow,
   * internal use. Otherwise, it should probably be a {@link LinkedHashMap}
   * to provide deterministic iteration order.
   *
   * @param map Map that contains property values
   */
  public Session(Map<Prop, Object> map) {
    this.map = requireNonNull(map);
  }

  /** Creates a Session with default property values. */
  public Session() {
    this(new LinkedHashMap<>());
  }

  /** Returns the tracer. */
  public Tracer tracer() {
    return tracer;
  }

  /** Sets the tracer; returns this session. */
  public Session withTracer(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
    return this;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Prop prop) {
    return prop.booleanValue(map);
  }

  /** Returns the value of a string property. */
  public String stringValue(Prop prop) {
    return prop.stringValue(map);
  }
}

// End Session.java
