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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Comparator;
import java.util.Objects;
import net.hydromatic.sil.type.Typ;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Program variable; either local to a procedure, or global. */
public final class Pvar implements Comparable<Pvar> {
  private static final Comparator<Pvar> COMPARATOR =
      Comparator.comparing((Pvar p) -> p.name)
          .thenComparing(
              p -> p.procName,
              Comparator.nullsFirst(Comparator.<String>naturalOrder()));

  public final String name;
  /** Name of the declaring procedure, or null if the variable is global. */
  public final @Nullable String procName;

  private Pvar(String name, @Nullable String procName) {
    this.name = requireNonNull(name, "name");
    this.procName = procName;
  }

  /** Creates a variable local to a procedure. */
  public static Pvar local(String name, String procName) {
    return new Pvar(name, requireNonNull(procName, "procName"));
  }

  /** Creates a global variable. */
  public static Pvar global(String name) {
    return new Pvar(name, null);
  }

  public boolean isGlobal() {
    return procName == null;
  }

  /**
   * Returns whether this is an Objective-C local static of procedure {@code
   * procName}.
   *
   * <p>The front end names such a variable by embedding the name of its
   * procedure in it, so the procedure name must occur exactly once.
   */
  public boolean isStaticLocalName(String procName) {
    checkArgument(!procName.isEmpty(), "empty procedure name");
    final int i = name.indexOf(procName);
    return i >= 0 && name.indexOf(procName, i + procName.length()) < 0;
  }

  /** Returns whether this variable points to an Objective-C block. */
  public boolean isBlock() {
    return Typ.hasBlockPrefix(name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, procName);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Pvar
            && ((Pvar) obj).name.equals(name)
            && Objects.equals(((Pvar) obj).procName, procName);
  }

  @Override
  public int compareTo(Pvar o) {
    return COMPARATOR.compare(this, o);
  }

  @Override
  public String toString() {
    return procName == null ? "#GB$" + name : name;
  }
}

// End Pvar.java
