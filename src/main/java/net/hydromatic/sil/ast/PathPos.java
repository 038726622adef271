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

/** Position in a path: a procedure and a node of its control-flow graph. */
public final class PathPos implements Comparable<PathPos> {
  public final String procName;
  public final int nodeId;

  private PathPos(String procName, int nodeId) {
    this.procName = requireNonNull(procName);
    this.nodeId = nodeId;
  }

  public static PathPos of(String procName, int nodeId) {
    return new PathPos(procName, nodeId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(procName, nodeId);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof PathPos
            && ((PathPos) obj).nodeId == nodeId
            && ((PathPos) obj).procName.equals(procName);
  }

  @Override
  public int compareTo(PathPos o) {
    final int c = procName.compareTo(o.procName);
    return c != 0 ? c : Integer.compare(nodeId, o.nodeId);
  }

  @Override
  public String toString() {
    return procName + ":" + nodeId;
  }
}

// End PathPos.java
