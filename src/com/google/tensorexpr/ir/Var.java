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

/** A named variable. Two variables with the same name and type are the same variable. */
public final class Var extends Expr {

  private final String name;

  Var(String name, Dtype dtype) {
    super(ExprKind.VAR, dtype);
    this.name = checkNotNull(name);
    checkArgument(!name.isEmpty(), "variables must be named");
  }

  public String getName() {
    return name;
  }

  @Override
  public ImmutableList<Expr> getChildren() {
    return ImmutableList.of();
  }

  @Override
  public Expr accept(IrMutator mutator) {
    return mutator.visitVar(this);
  }

  @Override
  boolean isEquivalentShallow(Expr other) {
    return name.equals(((Var) other).name);
  }
}
