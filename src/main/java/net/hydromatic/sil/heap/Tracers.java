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

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.ObjIntConsumer;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpara;
import net.hydromatic.sil.ast.HparaDll;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Ident;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on the body of each
   * instantiation, singly- or doubly-linked, then calls the underlying
   * tracer.
   */
  public static Tracer withOnInstantiate(
      Tracer tracer, BiConsumer<List<Ident>, List<Hpred>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInstantiate(
          Hpara para, List<Ident> fresh, List<Hpred> body) {
        consumer.accept(fresh, body);
        super.onInstantiate(para, fresh, body);
      }

      @Override
      public void onInstantiate(
          HparaDll para, List<Ident> fresh, List<Hpred> body) {
        consumer.accept(fresh, body);
        super.onInstantiate(para, fresh, body);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each compacted
   * predicate, then calls the underlying tracer.
   */
  public static Tracer withOnCompact(
      Tracer tracer, BiConsumer<Hpred, Boolean> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCompact(Hpred hpred, boolean shared) {
        consumer.accept(hpred, shared);
        super.onCompact(hpred, shared);
      }
    };
  }

  /**
   * Returns a tracer that calls {@code f} on each registered singly-linked
   * parameter and {@code fDll} on each doubly-linked parameter, with its id,
   * then calls the underlying tracer.
   */
  public static Tracer withOnRegister(
      Tracer tracer,
      ObjIntConsumer<Hpara> f,
      ObjIntConsumer<HparaDll> fDll) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRegister(int id, Hpara para) {
        f.accept(para, id);
        super.onRegister(id, para);
      }

      @Override
      public void onRegister(int id, HparaDll para) {
        fDll.accept(para, id);
        super.onRegister(id, para);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each replaced array
   * index and its replacement, then calls the underlying tracer.
   */
  public static Tracer withOnCleanArrayIndex(
      Tracer tracer, BiConsumer<Exp, Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCleanArrayIndex(Exp index, Exp fresh) {
        consumer.accept(index, fresh);
        super.onCleanArrayIndex(index, fresh);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onInstantiate(
        Hpara para, List<Ident> fresh, List<Hpred> body) {}

    @Override
    public void onInstantiate(
        HparaDll para, List<Ident> fresh, List<Hpred> body) {}

    @Override
    public void onCompact(Hpred hpred, boolean shared) {}

    @Override
    public void onRegister(int id, Hpara para) {}

    @Override
    public void onRegister(int id, HparaDll para) {}

    @Override
    public void onCleanArrayIndex(Exp index, Exp fresh) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onInstantiate(
        Hpara para, List<Ident> fresh, List<Hpred> body) {
      tracer.onInstantiate(para, fresh, body);
    }

    @Override
    public void onInstantiate(
        HparaDll para, List<Ident> fresh, List<Hpred> body) {
      tracer.onInstantiate(para, fresh, body);
    }

    @Override
    public void onCompact(Hpred hpred, boolean shared) {
      tracer.onCompact(hpred, shared);
    }

    @Override
    public void onRegister(int id, Hpara para) {
      tracer.onRegister(id, para);
    }

    @Override
    public void onRegister(int id, HparaDll para) {
      tracer.onRegister(id, para);
    }

    @Override
    public void onCleanArrayIndex(Exp index, Exp fresh) {
      tracer.onCleanArrayIndex(index, fresh);
    }
  }
}

// End Tracers.java
