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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpara;
import net.hydromatic.sil.ast.HparaDll;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Ident;
import net.hydromatic.sil.subst.ExpSubst;
import net.hydromatic.sil.util.Static;

/**
 * Unfolds list-segment parameters.
 *
 * <p>Instantiating {@code \(root, next, svars). exists evars. body} with
 * actual arguments substitutes the arguments for {@code root}, {@code next}
 * and {@code svars} in the body, and fresh primed identifiers for {@code
 * evars}. The result is one cell of the list, as heap predicates.
 *
 * <p>The fresh identifiers come from the session's {@link IdentGenerator},
 * so they are distinct from any identifier generated before, from every
 * identifier in the actual arguments, and from the free identifiers of the
 * parameter. Repeatedly unfolding the same segment
 * therefore never aliases unrelated cells.
 */
public class Instantiator {
  private final Session session;

  public Instantiator(Session session) {
    this.session = requireNonNull(session);
  }

  /**
   * Instantiates a singly-linked parameter.
   *
   * @param para Parameter
   * @param root Actual argument for the root
   * @param next Actual argument for the next cell
   * @param actuals Actual arguments for the shared variables
   * @throws IllegalArgumentException if there are not as many actuals as
   *     shared variables
   */
  public Instantiation instantiate(
      Hpara para, Exp root, Exp next, List<? extends Exp> actuals) {
    checkArity(para.svars, actuals);
    session.identGenerator.avoid(para.freeVars());
    new FreeFinder(session.identGenerator::avoid)
        .add(root)
        .add(next)
        .addAll(actuals);
    final ImmutableList<Ident> fresh = freshIdents(para.evars.size());
    final ImmutableList.Builder<Map.Entry<Ident, Exp>> bindings =
        ImmutableList.builder();
    bindings.add(Maps.immutableEntry(para.root, root));
    bindings.add(Maps.immutableEntry(para.next, next));
    bind(bindings, para.svars, actuals, para.evars, fresh);
    final Instantiation instantiation =
        instantiate(ExpSubst.of(bindings.build()), para.body, fresh);
    session.tracer().onInstantiate(para, fresh, instantiation.body);
    return instantiation;
  }

  /**
   * Instantiates a doubly-linked parameter.
   *
   * @param para Parameter
   * @param cell Actual argument for the cell
   * @param blink Actual argument for the backward link
   * @param flink Actual argument for the forward link
   * @param actuals Actual arguments for the shared variables
   * @throws IllegalArgumentException if there are not as many actuals as
   *     shared variables
   */
  public Instantiation instantiate(
      HparaDll para,
      Exp cell,
      Exp blink,
      Exp flink,
      List<? extends Exp> actuals) {
    checkArity(para.svars, actuals);
    session.identGenerator.avoid(para.freeVars());
    new FreeFinder(session.identGenerator::avoid)
        .add(cell)
        .add(blink)
        .add(flink)
        .addAll(actuals);
    final ImmutableList<Ident> fresh = freshIdents(para.evars.size());
    final ImmutableList.Builder<Map.Entry<Ident, Exp>> bindings =
        ImmutableList.builder();
    bindings.add(Maps.immutableEntry(para.cell, cell));
    bindings.add(Maps.immutableEntry(para.blink, blink));
    bindings.add(Maps.immutableEntry(para.flink, flink));
    bind(bindings, para.svars, actuals, para.evars, fresh);
    final Instantiation instantiation =
        instantiate(ExpSubst.of(bindings.build()), para.body, fresh);
    session.tracer().onInstantiate(para, fresh, instantiation.body);
    return instantiation;
  }

  private static void checkArity(
      List<Ident> svars, List<? extends Exp> actuals) {
    checkArgument(
        svars.size() == actuals.size(),
        "parameter has %s shared variables but %s actual arguments",
        svars.size(),
        actuals.size());
  }

  private ImmutableList<Ident> freshIdents(int count) {
    return session.identGenerator.createPrimed(
        session.stringValue(Prop.FRESH_IDENT_NAME), count);
  }

  private static void bind(
      ImmutableList.Builder<Map.Entry<Ident, Exp>> bindings,
      List<Ident> svars,
      List<? extends Exp> actuals,
      List<Ident> evars,
      List<Ident> fresh) {
    for (int i = 0; i < svars.size(); i++) {
      bindings.add(Maps.immutableEntry(svars.get(i), actuals.get(i)));
    }
    for (int i = 0; i < evars.size(); i++) {
      bindings.add(Maps.immutableEntry(evars.get(i), Exp.var(fresh.get(i))));
    }
  }

  private static Instantiation instantiate(
      ExpSubst subst, List<Hpred> body, ImmutableList<Ident> fresh) {
    return new Instantiation(fresh, Static.transformEager(body, subst::apply));
  }

  /** Result of instantiating a parameter. */
  public static final class Instantiation {
    /** Identifiers created for the existential variables, in order. */
    public final ImmutableList<Ident> fresh;
    /** The instantiated body. */
    public final ImmutableList<Hpred> body;

    Instantiation(ImmutableList<Ident> fresh, ImmutableList<Hpred> body) {
      this.fresh = requireNonNull(fresh);
      this.body = requireNonNull(body);
    }

    @Override
    public String toString() {
      return "exists " + fresh + ". " + body;
    }
  }
}

// End Instantiator.java
