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

import com.google.common.collect.ImmutableSet;
import java.util.function.Consumer;
import net.hydromatic.sil.ast.Atom;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Ident;
import net.hydromatic.sil.ast.Strexp;
import net.hydromatic.sil.subst.ExpSubst;

/**
 * Pushes the free identifiers of several terms into a consumer.
 *
 * <p>Identifiers are pushed in order, with repetitions, following the rule of
 * {@link FreeVars}.
 */
public class FreeFinder {
  final Consumer<Ident> consumer;

  public FreeFinder(Consumer<Ident> consumer) {
    this.consumer = requireNonNull(consumer);
  }

  /** Finds the distinct free identifiers in a list of heap predicates. */
  public static ImmutableSet<Ident> freeIds(Iterable<? extends Hpred> hpreds) {
    final ImmutableSet.Builder<Ident> set = ImmutableSet.builder();
    final FreeFinder finder = new FreeFinder(set::add);
    hpreds.forEach(finder::add);
    return set.build();
  }

  public FreeFinder add(Exp exp) {
    exp.freeVars().forEach(consumer);
    return this;
  }

  public FreeFinder addAll(Iterable<? extends Exp> exps) {
    exps.forEach(this::add);
    return this;
  }

  public FreeFinder add(Strexp strexp) {
    strexp.freeVars().forEach(consumer);
    return this;
  }

  public FreeFinder add(Hpred hpred) {
    hpred.freeVars().forEach(consumer);
    return this;
  }

  public FreeFinder add(Atom atom) {
    atom.freeVars().forEach(consumer);
    return this;
  }

  /** Adds the identifiers in the range of a substitution. */
  public FreeFinder add(ExpSubst subst) {
    subst.freeVars().forEach(consumer);
    return this;
  }
}

// End FreeFinder.java
