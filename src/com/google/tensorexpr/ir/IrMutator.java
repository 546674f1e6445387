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

/**
 * A rewrite over the IR with one method per node kind. Each method returns the
 * node to put in place of its argument: the argument itself when nothing
 * changed, otherwise a new node.
 *
 * <p>Every kind has a method, including the canonical forms the simplifier
 * introduces, so an implementation cannot silently miss one.
 *
 * @see AbstractIrMutator
 */
public interface IrMutator {

  Expr visitImmediate(Immediate n);

  Expr visitVar(Var n);

  Expr visitAdd(BinaryOp n);

  Expr visitSub(BinaryOp n);

  Expr visitMul(BinaryOp n);

  Expr visitDiv(BinaryOp n);

  Expr visitMod(BinaryOp n);

  Expr visitMax(BinaryOp n);

  Expr visitMin(BinaryOp n);

  Expr visitAnd(BinaryOp n);

  Expr visitOr(BinaryOp n);

  Expr visitXor(BinaryOp n);

  Expr visitLshift(BinaryOp n);

  Expr visitRshift(BinaryOp n);

  Expr visitCompareSelect(CompareSelect n);

  Expr visitCast(Cast n);

  Expr visitBroadcast(Broadcast n);

  Expr visitRamp(Ramp n);

  Expr visitIntrinsics(Intrinsics n);

  Expr visitTerm(Term n);

  Expr visitPolynomial(Polynomial n);

  Expr visitRoundOff(RoundOff n);

  Stmt visitBlock(Block n);

  Stmt visitFor(For n);

  Stmt visitCond(Cond n);

  Stmt visitLet(Let n);

  Stmt visitStore(Store n);
}
