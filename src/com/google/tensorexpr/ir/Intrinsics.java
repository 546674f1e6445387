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

/** A call to a math intrinsic. */
public final class Intrinsics extends Expr {

  private final IntrinsicOp op;
  private final ImmutableList<Expr> params;

  Intrinsics(IntrinsicOp op, ImmutableList<Expr> params) {
    super(ExprKind.INTRINSICS, resultType(op, params));
    checkArgument(
        params.size() == op.getArity(),
        "%s takes %s operands, got %s",
        op,
        op.getArity(),
        params.size());
    this.op = op;
    this.params = params;
  }

  private static Dtype resultType(IntrinsicOp op, ImmutableList<Expr> params) {
    checkNotNull(op);
    if (params.isEmpty()) {
      return Dtype.FLOAT;
    }
    Dtype type = params.get(0).getDtype();
    for (Expr param : params) {
      type = Dtype.promote(type, param.getDtype());
    }
    if (type.isIntegral() && !op.preservesIntegralType()) {
      return type.withScalarType(ScalarType.FLOAT);
    }
    return type;
  }

  public IntrinsicOp getOp() {
    return op;
  }

  public ImmutableList<Expr> getParams() {
    return params;
  }

  public boolean isPure() {
    return op.isPure();
  }

  @Override
  public ImmutableList<Expr> getChildren() {
    return params;
  }

  @Override
  public Expr accept(IrMutator mutator) {
    return mutator.visitIntrinsics(this);
  }

  @Override
  boolean isEquivalentShallow(Expr other) {
    return op == ((Intrinsics) other).op;
  }
}
