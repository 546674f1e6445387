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

import com.google.common.collect.ImmutableList;

/** The vector {@code [base, base + stride, base + 2 * stride, ...]}. */
public final class Ramp extends Expr {

  private final Expr base;
  private final Expr stride;

  Ramp(Expr base, Expr stride, int lanes) {
    super(ExprKind.RAMP, Dtype.promote(base.getDtype(), stride.getDtype()).withLanes(lanes));
    checkArgument(base.getDtype().getLanes() == 1, "ramp base must be scalar: %s", base);
    this.base = base;
    this.stride = stride;
  }

  public Expr getBase() {
    return base;
  }

  public Expr getStride() {
    return stride;
  }

  public int getLanes() {
    return getDtype().getLanes();
  }

  @Override
  public ImmutableList<Expr> getChildren() {
    return ImmutableList.of(base, stride);
  }

  @Override
  public Expr accept(IrMutator mutator) {
    return mutator.visitRamp(this);
  }

  @Override
  boolean isEquivalentShallow(Expr other) {
    return true;
  }
}
