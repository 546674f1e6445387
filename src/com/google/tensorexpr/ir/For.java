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

/** {@code for (var = start; var < stop; var++) body}. */
public final class For extends Stmt {

  private final Var var;
  private final Expr start;
  private final Expr stop;
  private final Stmt body;

  For(Var var, Expr start, Expr stop, Stmt body) {
    super(StmtKind.FOR);
    this.var = checkNotNull(var);
    this.start = checkNotNull(start);
    this.stop = checkNotNull(stop);
    this.body = checkNotNull(body);
  }

  public Var getVar() {
    return var;
  }

  public Expr getStart() {
    return start;
  }

  public Expr getStop() {
    return stop;
  }

  public Stmt getBody() {
    return body;
  }

  @Override
  public ImmutableList<Expr> getExpressions() {
    return ImmutableList.of(var, start, stop);
  }

  @Override
  public ImmutableList<Stmt> getStatements() {
    return ImmutableList.of(body);
  }

  @Override
  public Stmt accept(IrMutator mutator) {
    return mutator.visitFor(this);
  }
}
