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
import org.jspecify.annotations.Nullable;

/** {@code if (condition) thenStmt else elseStmt}; the else branch is optional. */
public final class Cond extends Stmt {

  private final Expr condition;
  private final Stmt thenStmt;
  private final @Nullable Stmt elseStmt;

  Cond(Expr condition, Stmt thenStmt, @Nullable Stmt elseStmt) {
    super(StmtKind.COND);
    this.condition = checkNotNull(condition);
    this.thenStmt = checkNotNull(thenStmt);
    this.elseStmt = elseStmt;
  }

  public Expr getCondition() {
    return condition;
  }

  public Stmt getThen() {
    return thenStmt;
  }

  public @Nullable Stmt getElse() {
    return elseStmt;
  }

  @Override
  public ImmutableList<Expr> getExpressions() {
    return ImmutableList.of(condition);
  }

  @Override
  public ImmutableList<Stmt> getStatements() {
    return elseStmt == null ? ImmutableList.of(thenStmt) : ImmutableList.of(thenStmt, elseStmt);
  }

  @Override
  public Stmt accept(IrMutator mutator) {
    return mutator.visitCond(this);
  }
}
