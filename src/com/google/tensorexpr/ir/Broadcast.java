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

/** A vector whose lanes all hold the same scalar value. */
public final class Broadcast extends Expr {

  private final Expr value;

  Broadcast(Expr value, int lanes) {
    super(ExprKind.BROADCAST, value.getDtype().withLanes(lanes));
    checkArgument(value.getDtype().getLanes() == 1, "cannot broadcast a vector: %s", value);
    this.value = value;
  }

  public Expr getValue() {
    return value;
  }

  public int getLanes() {
    return getDtype().getLanes();
  }

  @Override
  public ImmutableList<Expr> getChildren() {
    return ImmutableList.of(value);
  }

  @Override
  public Expr accept(IrMutator mutator) {
    return mutator.visitBroadcast(this);
  }

  @Override
  boolean isEquivalentShallow(Expr other) {
    return true;
  }
}
