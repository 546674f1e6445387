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

/** {@code buffer[index] = value}. */
public final class Store extends Stmt {

  private final Var buffer;
  private final Expr index;
  private final Expr value;

  Store(Var buffer, Expr index, Expr value) {
    super(StmtKind.STORE);
    this.buffer = checkNotNull(buffer);
    this.index = checkNotNull(index);
    this.value = checkNotNull(value);
  }

  public Var getBuffer() {
    return buffer;
  }

  public Expr getIndex() {
    return index;
  }

  public Expr getValue() {
    return value;
  }

  @Override
  public ImmutableList<Expr> getExpressions() {
    return ImmutableList.of(buffer, index, value);
  }

  @Override
  public ImmutableList<Stmt> getStatements() {
    return ImmutableList.of();
  }

  @Override
  public Stmt accept(IrMutator mutator) {
    return mutator.visitStore(this);
  }
}
