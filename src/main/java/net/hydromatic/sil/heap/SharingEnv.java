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

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpara;
import net.hydromatic.sil.ast.HparaDll;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Shuttle;
import net.hydromatic.sil.ast.Strexp;

/**
 * Table of canonical terms, for compaction by hash-consing.
 *
 * <p>Compaction replaces each sub-term by a canonical instance of the terms
 * that are equal to it, including instrumentation. Terms are compacted
 * bottom-up, so equal sub-terms that were built independently end up as
 * one instance.
 *
 * <p>Create one environment per compaction pass and discard it afterwards.
 * An environment must not be shared between tasks that run concurrently.
 */
public class SharingEnv {
  private final Session session;
  private final Map<Exp, Exp> exps = new HashMap<>();
  private final Map<Key<Strexp>, Strexp> strexps = new HashMap<>();
  private final Map<Key<Hpred>, Hpred> hpreds = new HashMap<>();
  private final Map<Key<Hpara>, Hpara> paras = new HashMap<>();
  private final Map<Key<HparaDll>, HparaDll> dllParas = new HashMap<>();
  private final Compactor compactor = new Compactor();

  /** Whether the most recently interned predicate was already present. */
  private boolean lastShared;

  public SharingEnv(Session session) {
    this.session = requireNonNull(session);
  }

  /** Creates an environment with a default session. */
  public static SharingEnv create() {
    return new SharingEnv(new Session());
  }

  /** Returns a canonical expression equal to a given expression. */
  public Exp compact(Exp exp) {
    return exps.computeIfAbsent(exp, e -> e);
  }

  /** Returns a compacted structured value equal to a given value. */
  public Strexp compact(Strexp strexp) {
    return strexp.accept(compactor);
  }

  /** Returns a compacted heap predicate equal to a given predicate. */
  public Hpred compact(Hpred hpred) {
    final Hpred h = hpred.accept(compactor);
    session.tracer().onCompact(h, lastShared);
    return h;
  }

  /** Returns the number of distinct terms in the tables. */
  public int size() {
    return exps.size()
        + strexps.size()
        + hpreds.size()
        + paras.size()
        + dllParas.size();
  }

  private Strexp intern(Strexp strexp) {
    return strexps.computeIfAbsent(
        new Key<>(
            strexp,
            s -> s.hashCode(true),
            (s1, s2) -> Strexp.equal(s1, s2, true)),
        k -> k.t);
  }

  private Hpred intern(Hpred hpred) {
    final Key<Hpred> key =
        new Key<>(
            hpred,
            h -> h.hashCode(true),
            (h1, h2) -> Hpred.equal(h1, h2, true));
    final Hpred h = hpreds.get(key);
    lastShared = h != null;
    if (h != null) {
      return h;
    }
    hpreds.put(key, hpred);
    return hpred;
  }

  /** Compacts sub-terms, then interns the term itself. */
  private class Compactor extends Shuttle {
    @Override
    protected Exp visit(Exp exp) {
      return compact(exp);
    }

    @Override
    protected Strexp visit(Strexp.Eexp eexp) {
      return intern(super.visit(eexp));
    }

    @Override
    protected Strexp visit(Strexp.Estruct estruct) {
      return intern(super.visit(estruct));
    }

    @Override
    protected Strexp visit(Strexp.Earray earray) {
      return intern(super.visit(earray));
    }

    @Override
    protected Hpred visit(Hpred.PointsTo pointsTo) {
      return intern(super.visit(pointsTo));
    }

    @Override
    protected Hpred visit(Hpred.Lseg lseg) {
      return intern(super.visit(lseg));
    }

    @Override
    protected Hpred visit(Hpred.Dllseg dllseg) {
      return intern(super.visit(dllseg));
    }

    @Override
    protected Hpara visit(Hpara para) {
      if (!session.booleanValue(Prop.COMPACT_PARAMETER_BODIES)) {
        return para;
      }
      final Hpara p = para.copy(visitHpreds(para.body));
      return paras.computeIfAbsent(
          new Key<>(
              p,
              p2 -> p2.hashCode(true),
              (p1, p2) -> Hpara.compare(p1, p2, true) == 0),
          k -> k.t);
    }

    @Override
    protected HparaDll visit(HparaDll para) {
      if (!session.booleanValue(Prop.COMPACT_PARAMETER_BODIES)) {
        return para;
      }
      final HparaDll p = para.copy(visitHpreds(para.body));
      return dllParas.computeIfAbsent(
          new Key<>(
              p,
              p2 -> p2.hashCode(true),
              (p1, p2) -> HparaDll.compare(p1, p2, true) == 0),
          k -> k.t);
    }
  }

  /**
   * Wraps a term so that hashing and equality take instrumentation into
   * account.
   *
   * @param <T> Term type
   */
  private static final class Key<T> {
    final T t;
    final int hash;
    final BiPredicate<T, T> equal;

    Key(T t, ToIntFunction<T> hasher, BiPredicate<T, T> equal) {
      this.t = t;
      this.hash = hasher.applyAsInt(t);
      this.equal = equal;
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @SuppressWarnings("unchecked")
    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Key
              && hash == ((Key<?>) obj).hash
              && equal.test(t, ((Key<T>) obj).t);
    }
  }
}

// End SharingEnv.java
