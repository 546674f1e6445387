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

/** Converts its operand to another scalar type, keeping the lane count. */
public final class Cast extends Expr {

  private final Expr operand;

  Cast(Dtype dtype, Expr operand) {
    super(ExprKind.CAST, dtype);
    this.operand = checkNotNull(operand);
    checkArgument(
        dtype.getLanes() == operand.getDtype().getLanes(),
        "cannot cast %s to %s",
        operand.getDtype(),
        dtype);
  }

  public Expr getOperand() {
    return operand;
  }

  @Override
  public ImmutableList<Expr> getChildren() {
    return ImmutableList.of(operand);
  }

  @Override
  public Expr accept(IrMutator mutator) {
    return mutator.visitCast(this);
  }

  @Override
  boolean isEquivalentShallow(Expr other) {
    return true;
  }
}
