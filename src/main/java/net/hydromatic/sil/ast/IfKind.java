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

/** Kind of conditional that gave rise to a {@link Instr.Prune}. */
public enum IfKind {
  /** Boolean expression converted to an integer. */
  BEXP,
  DO_WHILE,
  FOR,
  IF,
  /** Short-circuit "&amp;&amp;" or "||". */
  LAND_LOR,
  WHILE,
  SWITCH;

  /** Returns whether the condition controls a loop. */
  public boolean isLoop() {
    return this == DO_WHILE || this == FOR || this == WHILE;
  }
}

// End IfKind.java
