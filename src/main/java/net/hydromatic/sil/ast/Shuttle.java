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

import static net.hydromatic.sil.util.Static.sameElements;
import static net.hydromatic.sil.util.Static.transformEager;

import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Visits and transforms structured values, heap predicates and atoms.
 *
 * <p>The default implementation rebuilds each node from its transformed
 * children, returning the original node if nothing changed.
 *
 * <p>{@link #visit(Exp)} is called once for each expression at the top of a
 * leaf position (the address of a points-to, the bounds of a list segment,
 * the value of a scalar, an array index); it does not descend into the
 * expression. {@link #visit(Inst)} is called for each instrumentation.
 *
 * <p>By default a shuttle does not enter the closure of a list-segment
 * parameter, because the identifiers of the body are bound there; {@link
 * #ofInst(UnaryOperator)} creates a shuttle that does.
 *
 * <p>A shuttle does not re-establish the invariants of arrays; if it maps
 * two indices to the same expression, the caller must normalize the result.
 */
public class Shuttle {
  /** Rewrites an expression at a leaf position. */
  protected Exp visit(Exp exp) {
    return exp; // leaf
  }

  /** Rewrites an instrumentation. */
  protected Inst visit(Inst inst) {
    return inst; // leaf
  }

  // structured values

  protected Strexp visit(Strexp.Eexp eexp) {
    return eexp.copy(visit(eexp.exp), visit(eexp.inst));
  }

  protected Strexp visit(Strexp.Estruct estruct) {
    return estruct.copy(
        transformEager(
            estruct.fields,
            e -> entry(e, e.getKey(), e.getValue().accept(this))),
        visit(estruct.inst));
  }

  protected Strexp visit(Strexp.Earray earray) {
    return earray.copy(
        visit(earray.length),
        transformEager(
            earray.elements,
            e -> entry(e, visit(e.getKey()), e.getValue().accept(this))),
        visit(earray.inst));
  }

  // heap predicates

  protected Hpred visit(Hpred.PointsTo pointsTo) {
    return pointsTo.copy(
        visit(pointsTo.lexp),
        pointsTo.strexp.accept(this),
        visit(pointsTo.texp));
  }

  protected Hpred visit(Hpred.Lseg lseg) {
    return lseg.copy(
        visit(lseg.para),
        visit(lseg.from),
        visit(lseg.to),
        transformEager(lseg.shared, this::visit));
  }

  protected Hpred visit(Hpred.Dllseg dllseg) {
    return dllseg.copy(
        visit(dllseg.para),
        visit(dllseg.firstCell),
        visit(dllseg.blinkOut),
        visit(dllseg.flinkOut),
        visit(dllseg.lastCell),
        transformEager(dllseg.shared, this::visit));
  }

  /** Rewrites a parameter; by default, leaves the closure alone. */
  protected Hpara visit(Hpara para) {
    return para;
  }

  /** Rewrites a doubly-linked parameter; by default, leaves it alone. */
  protected HparaDll visit(HparaDll para) {
    return para;
  }

  // atoms

  protected Atom visit(Atom.Binary binary) {
    return binary.copy(visit(binary.left), visit(binary.right));
  }

  protected Atom visit(Atom.Pred pred) {
    return pred.copy(transformEager(pred.args, this::visit));
  }

  /**
   * Rewrites each predicate in a list; returns the list itself if no
   * predicate changes.
   */
  public List<Hpred> visitHpreds(List<Hpred> hpreds) {
    final List<Hpred> list = transformEager(hpreds, h -> h.accept(this));
    return sameElements(list, hpreds) ? hpreds : list;
  }

  /**
   * Rewrites each atom in a list; returns the list itself if no atom
   * changes.
   */
  public List<Atom> visitAtoms(List<Atom> atoms) {
    final List<Atom> list = transformEager(atoms, a -> a.accept(this));
    return sameElements(list, atoms) ? atoms : list;
  }

  /** Returns the old entry if key and value are unchanged, else a new one. */
  private static <K, V> Map.Entry<K, V> entry(
      Map.Entry<K, V> e, K key, V value) {
    return key == e.getKey() && value == e.getValue()
        ? e
        : Maps.immutableEntry(key, value);
  }

  /**
   * Creates a shuttle that applies a function to each leaf expression. It
   * does not enter parameter closures.
   */
  public static Shuttle ofExp(UnaryOperator<Exp> f) {
    return new Shuttle() {
      @Override
      protected Exp visit(Exp exp) {
        return f.apply(exp);
      }
    };
  }

  /**
   * Creates a shuttle that applies one function to each leaf expression and
   * another to each instrumentation. It does not enter parameter closures.
   */
  public static Shuttle ofExpInst(UnaryOperator<Exp> f, UnaryOperator<Inst> g) {
    return new Shuttle() {
      @Override
      protected Exp visit(Exp exp) {
        return f.apply(exp);
      }

      @Override
      protected Inst visit(Inst inst) {
        return g.apply(inst);
      }
    };
  }

  /**
   * Creates a shuttle that applies a function to each instrumentation,
   * including the instrumentations in the bodies of parameters.
   */
  public static Shuttle ofInst(UnaryOperator<Inst> g) {
    return new Shuttle() {
      @Override
      protected Inst visit(Inst inst) {
        return g.apply(inst);
      }

      @Override
      protected Hpara visit(Hpara para) {
        return para.copy(visitHpreds(para.body));
      }

      @Override
      protected HparaDll visit(HparaDll para) {
        return para.copy(visitHpreds(para.body));
      }
    };
  }
}

// End Shuttle.java
