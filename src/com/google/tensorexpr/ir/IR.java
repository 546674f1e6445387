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
import java.util.List;
import org.jspecify.annotations.Nullable;

/** An IR construction helper class. */
public final class IR {

  private IR() {}

  public static Immediate intImm(int value) {
    return Immediate.of(ScalarType.INT, value);
  }

  public static Immediate longImm(long value) {
    return Immediate.of(ScalarType.LONG, value);
  }

  public static Immediate floatImm(float value) {
    return Immediate.of(ScalarType.FLOAT, value);
  }

  public static Immediate doubleImm(double value) {
    return Immediate.of(ScalarType.DOUBLE, value);
  }

  public static Immediate imm(ScalarType type, long value) {
    return Immediate.of(type, value);
  }

  public static Var var(String name, Dtype dtype) {
    return new Var(name, dtype);
  }

  public static Var intVar(String name) {
    return new Var(name, Dtype.INT);
  }

  public static BinaryOp add(Expr lhs, Expr rhs) {
    return new BinaryOp(ExprKind.ADD, lhs, rhs, false);
  }

  public static BinaryOp sub(Expr lhs, Expr rhs) {
    return new BinaryOp(ExprKind.SUB, lhs, rhs, false);
  }

  public static BinaryOp mul(Expr lhs, Expr rhs) {
    return new BinaryOp(ExprKind.MUL, lhs, rhs, false);
  }

  public static BinaryOp div(Expr lhs, Expr rhs) {
    return new BinaryOp(ExprKind.DIV, lhs, rhs, false);
  }

  public static BinaryOp mod(Expr lhs, Expr rhs) {
    return new BinaryOp(ExprKind.MOD, lhs, rhs, false);
  }

  public static BinaryOp max(Expr lhs, Expr rhs, boolean propagateNans) {
    return new BinaryOp(ExprKind.MAX, lhs, rhs, propagateNans);
  }

  public static BinaryOp min(Expr lhs, Expr rhs, boolean propagateNans) {
    return new BinaryOp(ExprKind.MIN, lhs, rhs, propagateNans);
  }

  public static BinaryOp and(Expr lhs, Expr rhs) {
    return new BinaryOp(ExprKind.AND, lhs, rhs, false);
  }

  public static BinaryOp or(Expr lhs, Expr rhs) {
    return new BinaryOp(ExprKind.OR, lhs, rhs, false);
  }

  public static BinaryOp xor(Expr lhs, Expr rhs) {
    return new BinaryOp(ExprKind.XOR, lhs, rhs, false);
  }

  public static BinaryOp lshift(Expr lhs, Expr rhs) {
    return new BinaryOp(ExprKind.LSHIFT, lhs, rhs, false);
  }

  public static BinaryOp rshift(Expr lhs, Expr rhs) {
    return new BinaryOp(ExprKind.RSHIFT, lhs, rhs, false);
  }

  public static RoundOff roundOff(Expr dividend, Expr divisor) {
    return new RoundOff(dividend, divisor);
  }

  /** Creates a binary operator of the given kind. */
  public static BinaryOp binaryOp(ExprKind kind, Expr lhs, Expr rhs, boolean propagateNans) {
    if (kind == ExprKind.ROUND_OFF) {
      return new RoundOff(lhs, rhs);
    }
    return new BinaryOp(kind, lhs, rhs, propagateNans);
  }

  public static CompareSelect compareSelect(
      Expr lhs, Expr rhs, Expr ifTrue, Expr ifFalse, CompareOp compareOp) {
    return new CompareSelect(lhs, rhs, ifTrue, ifFalse, compareOp);
  }

  public static Cast cast(Dtype dtype, Expr operand) {
    return new Cast(dtype, operand);
  }

  public static Broadcast broadcast(Expr value, int lanes) {
    return new Broadcast(value, lanes);
  }

  public static Ramp ramp(Expr base, Expr stride, int lanes) {
    return new Ramp(base, stride, lanes);
  }

  public static Intrinsics intrinsic(IntrinsicOp op, Expr... params) {
    return new Intrinsics(op, ImmutableList.copyOf(params));
  }

  public static Intrinsics intrinsic(IntrinsicOp op, List<Expr> params) {
    return new Intrinsics(op, ImmutableList.copyOf(params));
  }

  public static Block block(Stmt... stmts) {
    return new Block(ImmutableList.copyOf(stmts));
  }

  public static Block block(List<Stmt> stmts) {
    return new Block(ImmutableList.copyOf(stmts));
  }

  public static For forLoop(Var var, Expr start, Expr stop, Stmt body) {
    checkArgument(var.getDtype().isIntegral(), "loop variable must be integral: %s", var);
    return new For(var, start, stop, body);
  }

  public static Cond cond(Expr condition, Stmt thenStmt, @Nullable Stmt elseStmt) {
    return new Cond(condition, thenStmt, elseStmt);
  }

  public static Let let(Var var, Expr value) {
    return new Let(var, value);
  }

  public static Store store(Var buffer, Expr index, Expr value) {
    return new Store(buffer, index, value);
  }
}
