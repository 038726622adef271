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

import java.util.Objects;

/** Flags of a {@link Instr.Call}. */
public final class CallFlags {
  public static final CallFlags DEFAULT =
      new CallFlags(false, false, false, false);

  /** Whether the call is dispatched on the receiver's dynamic type. */
  public final boolean virtual;
  /** Whether the callee is declared in an interface. */
  public final boolean interface_;
  /** Whether the callee never returns. */
  public final boolean noReturn;
  /** Whether some argument is an Objective-C block. */
  public final boolean withBlockParameters;

  private CallFlags(
      boolean virtual,
      boolean interface_,
      boolean noReturn,
      boolean withBlockParameters) {
    this.virtual = virtual;
    this.interface_ = interface_;
    this.noReturn = noReturn;
    this.withBlockParameters = withBlockParameters;
  }

  public static CallFlags of(
      boolean virtual, boolean interface_, boolean noReturn) {
    return of(virtual, interface_, noReturn, false);
  }

  public static CallFlags of(
      boolean virtual,
      boolean interface_,
      boolean noReturn,
      boolean withBlockParameters) {
    return !virtual && !interface_ && !noReturn && !withBlockParameters
        ? DEFAULT
        : new CallFlags(virtual, interface_, noReturn, withBlockParameters);
  }

  /** Returns a copy with {@link #withBlockParameters} set. */
  public CallFlags withBlockParameters() {
    return withBlockParameters
        ? this
        : new CallFlags(virtual, interface_, noReturn, true);
  }

  @Override
  public int hashCode() {
    return Objects.hash(virtual, interface_, noReturn, withBlockParameters);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof CallFlags
            && ((CallFlags) obj).virtual == virtual
            && ((CallFlags) obj).interface_ == interface_
            && ((CallFlags) obj).noReturn == noReturn
            && ((CallFlags) obj).withBlockParameters == withBlockParameters;
  }

  @Override
  public String toString() {
    return "{virtual=" + virtual + ", interface=" + interface_
        + ", noReturn=" + noReturn
        + ", withBlockParameters=" + withBlockParameters + "}";
  }
}

// End CallFlags.java
