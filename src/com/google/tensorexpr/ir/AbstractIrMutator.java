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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * An {@link IrMutator} that rewrites children first and rebuilds a node only
 * when one of its children changed identity. Subclasses override the kinds
 * they rewrite.
 */
public abstract class AbstractIrMutator implements IrMutator {

  @Override
  public Expr visitImmediate(Immediate n) {
    return n;
  }

  @Override
  public Expr visitVar(Var n) {
    return n;
  }

  /** Shared by all binary operators not overridden individually. */
  protected Expr visitBinaryOp(BinaryOp n) {
    Expr lhs = n.getLhs().accept(this);
    Expr rhs = n.getRhs().accept(this);
    if (lhs == n.getLhs() && rhs == n.getRhs()) {
      return n;
    }
    return IR.binaryOp(n.getKind(), lhs, rhs, n.propagatesNans());
  }

  @Override
  public Expr visitAdd(BinaryOp n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitSub(BinaryOp n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitMul(BinaryOp n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitDiv(BinaryOp n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitMod(BinaryOp n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitMax(BinaryOp n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitMin(BinaryOp n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitAnd(BinaryOp n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitOr(BinaryOp n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitXor(BinaryOp n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitLshift(BinaryOp n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitRshift(BinaryOp n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitRoundOff(RoundOff n) {
    return visitBinaryOp(n);
  }

  @Override
  public Expr visitCompareSelect(CompareSelect n) {
    Expr lhs = n.getLhs().accept(this);
    Expr rhs = n.getRhs().accept(this);
    Expr ifTrue = n.getIfTrue().accept(this);
    Expr ifFalse = n.getIfFalse().accept(this);
    if (lhs == n.getLhs()
        && rhs == n.getRhs()
        && ifTrue == n.getIfTrue()
        && ifFalse == n.getIfFalse()) {
      return n;
    }
    return IR.compareSelect(lhs, rhs, ifTrue, ifFalse, n.getCompareOp());
  }

  @Override
  public Expr visitCast(Cast n) {
    Expr operand = n.getOperand().accept(this);
    return operand == n.getOperand() ? n : IR.cast(n.getDtype(), operand);
  }

  @Override
  public Expr visitBroadcast(Broadcast n) {
    Expr value = n.getValue().accept(this);
    return value == n.getValue() ? n : IR.broadcast(value, n.getLanes());
  }

  @Override
  public Expr visitRamp(Ramp n) {
    Expr base = n.getBase().accept(this);
    Expr stride = n.getStride().accept(this);
    if (base == n.getBase() && stride == n.getStride()) {
      return n;
    }
    return IR.ramp(base, stride, n.getLanes());
  }

  @Override
  public Expr visitIntrinsics(Intrinsics n) {
    ImmutableList<Expr> params = mutateAll(n.getParams());
    return params == null ? n : IR.intrinsic(n.getOp(), params);
  }

  @Override
  public Expr visitTerm(Term n) {
    ImmutableList<Expr> variables = mutateAll(n.getVariables());
    return variables == null ? n : Term.create(n.getHasher(), n.getScalar(), variables);
  }

  @Override
  public Expr visitPolynomial(Polynomial n) {
    ImmutableList.Builder<Term> terms = ImmutableList.builder();
    boolean changed = false;
    for (Term term : n.getTerms()) {
      Expr newTerm = term.accept(this);
      checkState(newTerm instanceof Term, "polynomial term rewritten to %s", newTerm);
      terms.add((Term) newTerm);
      changed |= newTerm != term;
    }
    return changed ? Polynomial.create(n.getHasher(), n.getScalar(), terms.build()) : n;
  }

  /** Rewrites every expression in {@code exprs}; returns null if none changed. */
  protected final @Nullable ImmutableList<Expr> mutateAll(ImmutableList<Expr> exprs) {
    ImmutableList.Builder<Expr> result = ImmutableList.builder();
    boolean changed = false;
    for (Expr e : exprs) {
      Expr newExpr = e.accept(this);
      result.add(newExpr);
      changed |= newExpr != e;
    }
    return changed ? result.build() : null;
  }

  @Override
  public Stmt visitBlock(Block n) {
    ImmutableList.Builder<Stmt> stmts = ImmutableList.builder();
    boolean changed = false;
    for (Stmt stmt : n.getStatements()) {
      Stmt newStmt = stmt.accept(this);
      stmts.add(newStmt);
      changed |= newStmt != stmt;
    }
    return changed ? IR.block(stmts.build()) : n;
  }

  @Override
  public Stmt visitFor(For n) {
    Expr start = n.getStart().accept(this);
    Expr stop = n.getStop().accept(this);
    Stmt body = n.getBody().accept(this);
    if (start == n.getStart() && stop == n.getStop() && body == n.getBody()) {
      return n;
    }
    return IR.forLoop(n.getVar(), start, stop, body);
  }

  @Override
  public Stmt visitCond(Cond n) {
    Expr condition = n.getCondition().accept(this);
    Stmt thenStmt = n.getThen().accept(this);
    Stmt elseStmt = n.getElse() == null ? null : n.getElse().accept(this);
    if (condition == n.getCondition() && thenStmt == n.getThen() && elseStmt == n.getElse()) {
      return n;
    }
    return IR.cond(condition, thenStmt, elseStmt);
  }

  @Override
  public Stmt visitLet(Let n) {
    Expr value = n.getValue().accept(this);
    return value == n.getValue() ? n : IR.let(n.getVar(), value);
  }

  @Override
  public Stmt visitStore(Store n) {
    Expr index = n.getIndex().accept(this);
    Expr value = n.getValue().accept(this);
    if (index == n.getIndex() && value == n.getValue()) {
      return n;
    }
    return IR.store(n.getBuffer(), index, value);
  }
}
