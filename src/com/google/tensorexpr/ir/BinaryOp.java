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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

/**
 * A binary operator node. The result type is the promotion of the operand
 * types; both operands must have the same number of lanes.
 */
public class BinaryOp extends Expr {

  private final Expr lhs;
  private final Expr rhs;
  private final boolean propagateNans;

  BinaryOp(ExprKind kind, Expr lhs, Expr rhs, boolean propagateNans) {
    super(kind, Dtype.promote(checkNotNull(lhs).getDtype(), checkNotNull(rhs).getDtype()));
    checkArgument(kind.isBinaryOp(), "not a binary operator: %s", kind);
    checkArgument(
        !kind.isBitwise() || getDtype().isIntegral(),
        "%s requires integral operands, got %s",
        kind,
        getDtype());
    this.lhs = lhs;
    this.rhs = rhs;
    this.propagateNans = propagateNans;
  }

  public final Expr getLhs() {
    return lhs;
  }

  public final Expr getRhs() {
    return rhs;
  }

  /**
   * For {@code MAX} and {@code MIN}: whether a NaN operand makes the result
   * NaN rather than selecting the other operand.
   */
  public final boolean propagatesNans() {
    return propagateNans;
  }

  @Override
  public final ImmutableList<Expr> getChildren() {
    return ImmutableList.of(lhs, rhs);
  }

  @Override
  public Expr accept(IrMutator mutator) {
    switch (getKind()) {
      case ADD:
        return mutator.visitAdd(this);
      case SUB:
        return mutator.visitSub(this);
      case MUL:
        return mutator.visitMul(this);
      case DIV:
        return mutator.visitDiv(this);
      case MOD:
        return mutator.visitMod(this);
      case MAX:
        return mutator.visitMax(this);
      case MIN:
        return mutator.visitMin(this);
      case AND:
        return mutator.visitAnd(this);
      case OR:
        return mutator.visitOr(this);
      case XOR:
        return mutator.visitXor(this);
      case LSHIFT:
        return mutator.visitLshift(this);
      case RSHIFT:
        return mutator.visitRshift(this);
      default:
        throw new IllegalStateException("unexpected binary operator " + getKind());
    }
  }

  @Override
  boolean isEquivalentShallow(Expr other) {
    return propagateNans == ((BinaryOp) other).propagateNans;
  }
}
