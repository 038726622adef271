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

import java.util.Objects;

/**
 * Logical identifier.
 *
 * <p>A {@link Kind#NORMAL normal} identifier stands for a program temporary;
 * a {@link Kind#PRIMED primed} identifier is existentially quantified, and is
 * the kind generated when a list-segment parameter is instantiated; a {@link
 * Kind#FOOTPRINT footprint} identifier denotes a value in the footprint
 * (inferred precondition).
 */
public final class Ident implements Comparable<Ident> {
  public final Kind kind;
  public final String name;
  public final int stamp;

  private Ident(Kind kind, String name, int stamp) {
    this.kind = requireNonNull(kind, "kind");
    this.name = requireNonNull(name, "name");
    this.stamp = stamp;
    checkArgument(!name.isEmpty(), "empty name");
    checkArgument(stamp >= 0, "negative stamp %s", stamp);
  }

  /** Creates an identifier. */
  public static Ident of(Kind kind, String name, int stamp) {
    return new Ident(kind, name, stamp);
  }

  /** Creates a normal identifier. */
  public static Ident normal(String name, int stamp) {
    return new Ident(Kind.NORMAL, name, stamp);
  }

  /** Creates a primed (existential) identifier. */
  public static Ident primed(String name, int stamp) {
    return new Ident(Kind.PRIMED, name, stamp);
  }

  /** Creates a footprint identifier. */
  public static Ident footprint(String name, int stamp) {
    return new Ident(Kind.FOOTPRINT, name, stamp);
  }

  public boolean isNormal() {
    return kind == Kind.NORMAL;
  }

  public boolean isPrimed() {
    return kind == Kind.PRIMED;
  }

  public boolean isFootprint() {
    return kind == Kind.FOOTPRINT;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, name, stamp);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Ident
            && ((Ident) obj).kind == kind
            && ((Ident) obj).stamp == stamp
            && ((Ident) obj).name.equals(name);
  }

  /**
   * {@inheritDoc}
   *
   * <p>Collate first on kind, then on stamp, then on name.
   */
  @Override
  public int compareTo(Ident o) {
    int c = kind.compareTo(o.kind);
    if (c == 0) {
      c = Integer.compare(stamp, o.stamp);
    }
    if (c == 0) {
      c = name.compareTo(o.name);
    }
    return c;
  }

  @Override
  public String toString() {
    return kind.prefix + name + "$" + stamp;
  }

  /** Kind of identifier. */
  public enum Kind {
    NORMAL(""),
    PRIMED("_"),
    FOOTPRINT("@");

    final String prefix;

    Kind(String prefix) {
      this.prefix = prefix;
    }
  }
}

// End Ident.java
