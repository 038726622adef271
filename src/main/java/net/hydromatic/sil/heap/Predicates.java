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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.function.ObjIntConsumer;
import net.hydromatic.sil.ast.Hpara;
import net.hydromatic.sil.ast.HparaDll;
import net.hydromatic.sil.ast.Hpred;

/**
 * Numbers the parameters of list segments, so that a formatter can define
 * each parameter once and refer to it by id.
 *
 * <p>Register every predicate with {@link Env#process(Hpred)}, then call
 * {@link Env#iter} once. Ids are assigned from 0, in order of registration,
 * shared between singly- and doubly-linked parameters.
 */
public abstract class Predicates {
  private Predicates() {}

  /** Creates an empty environment with a default session. */
  public static Env emptyEnv() {
    return new Env(new Session());
  }

  /** Creates an empty environment. */
  public static Env emptyEnv(Session session) {
    return new Env(session);
  }

  /**
   * Registry of parameters. Not thread-safe; belongs to one formatting pass.
   */
  public static final class Env {
    private final Session session;
    private final Map<Hpara, Integer> paraIds = new HashMap<>();
    private final Map<HparaDll, Integer> dllParaIds = new HashMap<>();
    private final Deque<Object> todo = new ArrayDeque<>();
    private int nextId = 0;
    private boolean consumed;

    Env(Session session) {
      this.session = requireNonNull(session);
    }

    /** Returns whether no parameter has been registered. */
    public boolean isEmpty() {
      return paraIds.isEmpty() && dllParaIds.isEmpty();
    }

    /**
     * Registers the parameters of a heap predicate, and of the predicates in
     * their bodies.
     */
    public void process(Hpred hpred) {
      checkState(!consumed, "registry has already been iterated");
      switch (hpred.op) {
        case LSEG:
          register(((Hpred.Lseg) hpred).para);
          break;
        case DLLSEG:
          register(((Hpred.Dllseg) hpred).para);
          break;
        default:
          break;
      }
    }

    /** Returns the id of a parameter, registering it if necessary. */
    public int register(Hpara para) {
      final Integer id = paraIds.get(para);
      if (id != null) {
        return id;
      }
      final int newId = nextId++;
      paraIds.put(para, newId);
      todo.add(para);
      session.tracer().onRegister(newId, para);
      para.body.forEach(this::process);
      return newId;
    }

    /** Returns the id of a doubly-linked parameter, registering it if new. */
    public int register(HparaDll para) {
      final Integer id = dllParaIds.get(para);
      if (id != null) {
        return id;
      }
      final int newId = nextId++;
      dllParaIds.put(para, newId);
      todo.add(para);
      session.tracer().onRegister(newId, para);
      para.body.forEach(this::process);
      return newId;
    }

    /**
     * Calls {@code f} for each singly-linked parameter and {@code fDll} for
     * each doubly-linked parameter, in order of id.
     *
     * <p>Consumes the registry; a second call does nothing.
     */
    public void iter(ObjIntConsumer<Hpara> f, ObjIntConsumer<HparaDll> fDll) {
      consumed = true;
      while (!todo.isEmpty()) {
        final Object para = todo.remove();
        if (para instanceof Hpara) {
          f.accept((Hpara) para, paraIds.get(para));
        } else {
          fDll.accept((HparaDll) para, dllParaIds.get(para));
        }
      }
    }
  }
}

// End Predicates.java
