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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

/** {@code (lhs op rhs) ? ifTrue : ifFalse}. */
public final class CompareSelect extends Expr {

  private final Expr lhs;
  private final Expr rhs;
  private final Expr ifTrue;
  private final Expr ifFalse;
  private final CompareOp compareOp;

  CompareSelect(Expr lhs, Expr rhs, Expr ifTrue, Expr ifFalse, CompareOp compareOp) {
    super(ExprKind.COMPARE_SELECT, Dtype.promote(ifTrue.getDtype(), ifFalse.getDtype()));
    // Only checked for the lane count.
    Dtype.promote(lhs.getDtype(), rhs.getDtype());
    Dtype.promote(lhs.getDtype(), getDtype());
    this.lhs = lhs;
    this.rhs = rhs;
    this.ifTrue = ifTrue;
    this.ifFalse = ifFalse;
    this.compareOp = checkNotNull(compareOp);
  }

  public Expr getLhs() {
    return lhs;
  }

  public Expr getRhs() {
    return rhs;
  }

  public Expr getIfTrue() {
    return ifTrue;
  }

  public Expr getIfFalse() {
    return ifFalse;
  }

  public CompareOp getCompareOp() {
    return compareOp;
  }

  @Override
  public ImmutableList<Expr> getChildren() {
    return ImmutableList.of(lhs, rhs, ifTrue, ifFalse);
  }

  @Override
  public Expr accept(IrMutator mutator) {
    return mutator.visitCompareSelect(this);
  }

  @Override
  boolean isEquivalentShallow(Expr other) {
    return compareOp == ((CompareSelect) other).compareOp;
  }
}
