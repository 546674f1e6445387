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

import com.google.common.collect.ImmutableList;

/** A sequence of statements. */
public final class Block extends Stmt {

  private final ImmutableList<Stmt> stmts;

  Block(ImmutableList<Stmt> stmts) {
    super(StmtKind.BLOCK);
    this.stmts = stmts;
  }

  @Override
  public ImmutableList<Expr> getExpressions() {
    return ImmutableList.of();
  }

  @Override
  public ImmutableList<Stmt> getStatements() {
    return stmts;
  }

  @Override
  public Stmt accept(IrMutator mutator) {
    return mutator.visitBlock(this);
  }
}
