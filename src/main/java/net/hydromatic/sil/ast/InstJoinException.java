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

/**
 * Thrown by {@link JoinResult#orElseThrow()} when two instrumentations cannot
 * be joined. The caller should keep the two paths as separate disjuncts.
 */
public class InstJoinException extends RuntimeException {
  private final JoinResult.Incompatible result;

  InstJoinException(JoinResult.Incompatible result) {
    super("inst partial join failed on " + result.left + " " + result.right);
    this.result = result;
  }

  /** Returns the failed result, which holds both instrumentations. */
  public JoinResult.Incompatible result() {
    return result;
  }
}

// End InstJoinException.java
