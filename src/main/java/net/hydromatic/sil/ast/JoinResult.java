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

import java.util.Optional;

/**
 * Result of {@link Inst#partialJoin(Inst, Inst)}: either {@link Joined} or
 * {@link Incompatible}.
 */
public abstract class JoinResult {
  private JoinResult() {}

  static JoinResult joined(Inst inst) {
    return new Joined(inst);
  }

  static JoinResult incompatible(Inst left, Inst right, String reason) {
    return new Incompatible(left, right, reason);
  }

  /** Whether the join succeeded. */
  public abstract boolean isJoined();

  /** Returns the joined instrumentation, or empty if incompatible. */
  public abstract Optional<Inst> toOptional();

  /**
   * Returns the joined instrumentation, or throws {@link InstJoinException}
   * if incompatible.
   */
  public abstract Inst orElseThrow();

  /** Successful join. */
  public static final class Joined extends JoinResult {
    public final Inst inst;

    Joined(Inst inst) {
      this.inst = requireNonNull(inst);
    }

    @Override
    public boolean isJoined() {
      return true;
    }

    @Override
    public Optional<Inst> toOptional() {
      return Optional.of(inst);
    }

    @Override
    public Inst orElseThrow() {
      return inst;
    }

    @Override
    public String toString() {
      return "joined(" + inst + ")";
    }
  }

  /** The two instrumentations cannot be merged. */
  public static final class Incompatible extends JoinResult {
    public final Inst left;
    public final Inst right;
    public final String reason;

    Incompatible(Inst left, Inst right, String reason) {
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
      this.reason = requireNonNull(reason);
    }

    @Override
    public boolean isJoined() {
      return false;
    }

    @Override
    public Optional<Inst> toOptional() {
      return Optional.empty();
    }

    @Override
    public Inst orElseThrow() {
      throw new InstJoinException(this);
    }

    @Override
    public String toString() {
      return "incompatible(" + left + ", " + right + "): " + reason;
    }
  }
}

// End JoinResult.java
