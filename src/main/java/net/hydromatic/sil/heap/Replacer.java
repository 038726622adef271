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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.sil.ast.Atom;
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Shuttle;
import net.hydromatic.sil.ast.Strexp;

/**
 * Replaces whole expressions in a term.
 *
 * <p>Each leaf expression that equals the left side of a pair is replaced by
 * the right side of the first such pair. Sub-expressions are not examined,
 * and there is no renaming of bound identifiers; this is syntactic
 * replacement, not substitution.
 */
public class Replacer extends Shuttle {
  private final Map<Exp, Exp> map;

  private Replacer(Map<Exp, Exp> map) {
    this.map = map;
  }

  /** Creates a replacer from a list of (old, new) pairs. */
  public static Replacer of(List<? extends Map.Entry<Exp, Exp>> pairs) {
    final Map<Exp, Exp> map = new LinkedHashMap<>();
    pairs.forEach(pair -> map.putIfAbsent(pair.getKey(), pair.getValue()));
    return new Replacer(map);
  }

  public static Hpred replace(
      List<? extends Map.Entry<Exp, Exp>> pairs, Hpred hpred) {
    return hpred.accept(of(pairs));
  }

  public static Atom replace(
      List<? extends Map.Entry<Exp, Exp>> pairs, Atom atom) {
    return atom.accept(of(pairs));
  }

  public static Strexp replace(
      List<? extends Map.Entry<Exp, Exp>> pairs, Strexp strexp) {
    return strexp.accept(of(pairs));
  }

  @Override
  protected Exp visit(Exp exp) {
    final Exp e = map.get(exp);
    return e == null ? exp : e;
  }
}

// End Replacer.java
