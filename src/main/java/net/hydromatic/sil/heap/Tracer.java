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
import net.hydromatic.sil.ast.Exp;
import net.hydromatic.sil.ast.Hpara;
import net.hydromatic.sil.ast.HparaDll;
import net.hydromatic.sil.ast.Hpred;
import net.hydromatic.sil.ast.Ident;

/** Called on various events in the heap layer. */
public interface Tracer {
  /**
   * Called after a list-segment parameter has been instantiated.
   *
   * @param para Parameter
   * @param fresh Identifiers created for the existential variables
   * @param body Instantiated body
   */
  void onInstantiate(Hpara para, List<Ident> fresh, List<Hpred> body);

  /** Called after a doubly-linked parameter has been instantiated. */
  void onInstantiate(HparaDll para, List<Ident> fresh, List<Hpred> body);

  /**
   * Called when a heap predicate has been compacted.
   *
   * @param hpred Canonical predicate
   * @param shared Whether an equal predicate was already in the table
   */
  void onCompact(Hpred hpred, boolean shared);

  /** Called when {@link Predicates} assigns an id to a parameter. */
  void onRegister(int id, Hpara para);

  /**
   * Called when {@link Predicates} assigns an id to a doubly-linked
   * parameter.
   */
  void onRegister(int id, HparaDll para);

  /**
   * Called when {@link Sigmas#arrayCleanNewIndex} replaces an array index
   * that mentions identifiers outside the footprint.
   *
   * @param index Original index
   * @param fresh Fresh footprint variable that replaces it
   */
  void onCleanArrayIndex(Exp index, Exp fresh);
}

// End Tracer.java
