/*
 * Copyright 2020 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.tensorexpr.ir;

/** The closed set of expression node kinds. */
public enum ExprKind {
  IMMEDIATE,
  VAR,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  MAX,
  MIN,
  AND,
  OR,
  XOR,
  LSHIFT,
  RSHIFT,
  COMPARE_SELECT,
  CAST,
  BROADCAST,
  RAMP,
  INTRINSICS,

  // Canonical forms introduced by the simplifier.
  TERM,
  POLYNOMIAL,
  ROUND_OFF;

  /** Whether nodes of this kind are {@link BinaryOp}s. */
  public boolean isBinaryOp() {
    switch (this) {
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case MOD:
      case MAX:
      case MIN:
      case AND:
      case OR:
      case XOR:
      case LSHIFT:
      case RSHIFT:
      case ROUND_OFF:
        return true;
      default:
        return false;
    }
  }

  /** Whether the operator is only defined over integral operands. */
  public boolean isBitwise() {
    switch (this) {
      case AND:
      case OR:
      case XOR:
      case LSHIFT:
      case RSHIFT:
        return true;
      default:
        return false;
    }
  }
}
