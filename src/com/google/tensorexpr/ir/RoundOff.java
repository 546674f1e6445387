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

/**
 * The rounding idiom {@code (dividend / divisor) * divisor}: the multiple of
 * {@code divisor} nearest to {@code dividend} in the direction of zero, under
 * truncating integer division.
 *
 * <p>Kept as its own node during simplification so the idiom is not folded
 * into an opaque product.
 */
public final class RoundOff extends BinaryOp {

  RoundOff(Expr dividend, Expr divisor) {
    super(ExprKind.ROUND_OFF, dividend, divisor, false);
  }

  public Expr getDividend() {
    return getLhs();
  }

  public Expr getDivisor() {
    return getRhs();
  }

  @Override
  public Expr accept(IrMutator mutator) {
    return mutator.visitRoundOff(this);
  }
}
