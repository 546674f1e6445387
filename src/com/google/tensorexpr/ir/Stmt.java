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

/** An immutable statement node. */
public abstract class Stmt {

  private final StmtKind kind;

  Stmt(StmtKind kind) {
    this.kind = checkNotNull(kind);
  }

  public final StmtKind getKind() {
    return kind;
  }

  /** The expressions embedded directly in this statement, in order. */
  public abstract ImmutableList<Expr> getExpressions();

  /** The statements nested directly in this statement, in order. */
  public abstract ImmutableList<Stmt> getStatements();

  public abstract Stmt accept(IrMutator mutator);

  /** Whether {@code other} is a structurally identical statement tree. */
  public final boolean isEquivalentTo(Stmt other) {
    if (this == other) {
      return true;
    }
    if (other == null || kind != other.kind) {
      return false;
    }
    ImmutableList<Expr> exprs = getExpressions();
    ImmutableList<Expr> otherExprs = other.getExpressions();
    ImmutableList<Stmt> stmts = getStatements();
    ImmutableList<Stmt> otherStmts = other.getStatements();
    if (exprs.size() != otherExprs.size() || stmts.size() != otherStmts.size()) {
      return false;
    }
    for (int i = 0; i < exprs.size(); i++) {
      if (!exprs.get(i).isEquivalentTo(otherExprs.get(i))) {
        return false;
      }
    }
    for (int i = 0; i < stmts.size(); i++) {
      if (!stmts.get(i).isEquivalentTo(otherStmts.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return IrPrinter.print(this);
  }
}
