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

/**
 * Sub-types of SIL terms, and the operators that appear in expressions.
 *
 * <p>The ordinal of an op is significant: terms of different kinds are
 * ordered by the ordinal of their op.
 */
public enum Op {
  // expressions
  VAR,
  CONST,
  LVAR,
  LFIELD,
  LINDEX,
  UN_OP,
  BIN_OP,
  CAST,
  SIZEOF,

  // unary operators
  NEG("-"),
  LNOT("!"),
  BNOT("~"),

  // binary operators
  PLUS(" + "),
  MINUS(" - "),
  TIMES(" * "),
  DIVIDE(" / "),
  MOD(" % "),
  PLUS_PI(" +pi "),
  MINUS_PI(" -pi "),
  MINUS_PP(" -pp "),
  LT(" < "),
  GT(" > "),
  LE(" <= "),
  GE(" >= "),
  EQ(" == "),
  NE(" != "),
  LAND(" && "),
  LOR(" || "),

  // atoms
  ATOM_EQ(" = "),
  ATOM_NEQ(" != "),
  ATOM_PRED,
  ATOM_NPRED,

  // structured values
  EEXP,
  ESTRUCT,
  EARRAY,

  // heap predicates
  POINTS_TO(" |-> "),
  LSEG,
  DLLSEG,

  // instructions
  LOAD,
  STORE,
  PRUNE,
  CALL,
  NULLIFY,
  ABSTRACT,
  REMOVE_TEMPS,
  DECLARE_LOCALS,

  // types
  TY_INT,
  TY_FLOAT,
  TY_VOID,
  TY_PTR,
  TY_STRUCT,
  TY_ARRAY,
  TY_VAR;

  /** Padded string, for operators. */
  public final String padded;

  Op() {
    this("");
  }

  Op(String padded) {
    this.padded = padded;
  }

  /** Returns whether this is a unary operator. */
  public boolean isUnary() {
    return this == NEG || this == LNOT || this == BNOT;
  }

  /** Returns whether this is a binary operator. */
  public boolean isBinary() {
    return compareTo(PLUS) >= 0 && compareTo(LOR) <= 0;
  }
}

// End Op.java
