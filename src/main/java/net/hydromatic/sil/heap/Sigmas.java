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
import static net.hydromatic.sil.ast.SilBuilder.sil;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import net.hydromatic.sil.ast.Atom;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Ident;
import net.hydromatic.sil.ast.LsegKind;
import net.hydromatic.sil.util.Static;

/** Operations on sigmas, the spatial parts of symbolic heaps. */
public abstract class Sigmas {
  private Sigmas() {}

  /**
   * Converts a sigma into a list of cases that contain no possibly-empty
   * list segments.
   *
   * <p>If property {@link Prop#NELSEG} is false, returns the sigma
   * unchanged, as a single case with no equalities. Otherwise each
   * possibly-empty segment splits each case in two: one where the segment is
   * empty (its ends are equal) and one where it is non-empty. The order of
   * predicates within a case follows the sigma.
   */
  public static List<Case> toSigmaNe(Session session, List<Hpred> sigma) {
    if (!session.booleanValue(Prop.NELSEG)) {
      return ImmutableList.of(new Case(ImmutableList.of(), sigma));
    }
    List<Case> cases = ImmutableList.of(Case.EMPTY);
    for (Hpred hpred : sigma) {
      final List<Case> next = new ArrayList<>();
      switch (hpred.op) {
        case LSEG:
          final Hpred.Lseg lseg = (Hpred.Lseg) hpred;
          if (lseg.kind == LsegKind.PE) {
            for (Case c : cases) {
              next.add(c.plus(sil.eq(lseg.from, lseg.to)));
              next.add(c.plus(lseg.withKind(LsegKind.NE)));
            }
            break;
          }
          cases.forEach(c -> next.add(c.plus(hpred)));
          break;

        case DLLSEG:
          final Hpred.Dllseg dllseg = (Hpred.Dllseg) hpred;
          if (dllseg.kind == LsegKind.PE) {
            for (Case c : cases) {
              next.add(
                  c.plus(sil.eq(dllseg.firstCell, dllseg.flinkOut))
                      .plus(sil.eq(dllseg.blinkOut, dllseg.lastCell)));
              next.add(c.plus(dllseg.withKind(LsegKind.NE)));
            }
            break;
          }
          cases.forEach(c -> next.add(c.plus(hpred)));
          break;

        default:
          cases.forEach(c -> next.add(c.plus(hpred)));
      }
      cases = next;
    }
    return ImmutableList.copyOf(cases);
  }

  /**
   * Returns the entry points of the predicates in a sigma that satisfy a
   * filter, in order.
   *
   * @see Hpred#entries()
   */
  public static ImmutableList<Exp> lexps(
      Predicate<Exp> filter, List<Hpred> sigma) {
    final ImmutableList.Builder<Exp> b = ImmutableList.builder();
    for (Hpred hpred : sigma) {
      b.addAll(Static.filterEager(hpred.entries(), filter));
    }
    return b.build();
  }

  /**
   * Prepares an expression to be added as a new index of an array.
   *
   * <p>In the footprint part of a state, every identifier in an index must be
   * a footprint identifier. If {@code footprintPart} and {@code index}
   * mentions any other identifier, returns a fresh footprint variable;
   * otherwise returns {@code index}.
   */
  public static Exp arrayCleanNewIndex(
      Session session, boolean footprintPart, Exp index) {
    if (!footprintPart
        || Iterables.all(index.freeVars(), Ident::isFootprint)) {
      return index;
    }
    session.identGenerator.avoid(index.freeVars());
    final Exp fresh =
        Exp.var(
            session.identGenerator.create(Ident.Kind.FOOTPRINT, "footprint"));
    session.tracer().onCleanArrayIndex(index, fresh);
    return fresh;
  }

  /** One case of a sigma: pure equalities and a sigma. */
  public static final class Case {
    static final Case EMPTY = new Case(ImmutableList.of(), ImmutableList.of());

    public final ImmutableList<Atom> pure;
    public final ImmutableList<Hpred> sigma;

    Case(List<? extends Atom> pure, List<? extends Hpred> sigma) {
      this.pure = ImmutableList.copyOf(requireNonNull(pure));
      this.sigma = ImmutableList.copyOf(requireNonNull(sigma));
    }

    Case plus(Atom atom) {
      return new Case(Static.append(pure, atom), sigma);
    }

    Case plus(Hpred hpred) {
      return new Case(pure, Static.append(sigma, hpred));
    }

    @Override
    public String toString() {
      return pure + " | " + sigma;
    }
  }
}

// End Sigmas.java
