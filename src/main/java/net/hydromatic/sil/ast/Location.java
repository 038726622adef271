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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Source location of an instruction. */
public class Location {
  public static final Location NONE = new Location("", -1, -1);

  public final String file;
  public final int line;
  public final int column;

  /** Creates a Location. */
  public Location(String file, int line, int column) {
    this.file = requireNonNull(file);
    this.line = line;
    this.column = column;
  }

  /** Creates a Location with no column. */
  public static Location of(String file, int line) {
    return new Location(file, line, -1);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Location
            && this.line == ((Location) o).line
            && this.column == ((Location) o).column
            && this.file.equals(((Location) o).file);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file).append(file.isEmpty() ? "" : ":").append(line);
    if (column >= 0) {
      buf.append('.').append(column);
    }
    return buf;
  }
}

// End Location.java
