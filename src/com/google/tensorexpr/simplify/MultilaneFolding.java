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

package com.google.tensorexpr.simplify;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.tensorexpr.ir.Broadcast;
import com.google.tensorexpr.ir.Expr;
import com.google.tensorexpr.ir.ExprKind;
import com.google.tensorexpr.ir.IR;
import com.google.tensorexpr.ir.Ramp;
import org.jspecify.annotations.Nullable;

/**
 * Arithmetic over vector constructors. Adding, subtracting or multiplying
 * Broadcasts and Ramps yields another Broadcast or Ramp whose scalar operands
 * carry the arithmetic, e.g. {@code Ramp(a, s) + Broadcast(b)} is {@code
 * Ramp(a + b, s)}.
 *
 * <p>The returned nodes have unsimplified operands; callers simplify them.
 */
final class MultilaneFolding {

  private MultilaneFolding() {}

  /**
   * Combines {@code lhs + rhs} or {@code lhs - rhs}. Returns null when either
   * operand is not a multilane primitive.
   */
  static @Nullable Expr combine(ExprKind kind, Expr lhs, Expr rhs) {
    checkArgument(kind == ExprKind.ADD || kind == ExprKind.SUB, kind);
    if (lhs instanceof Broadcast) {
      Broadcast broadcast = (Broadcast) lhs;
      if (rhs instanceof Broadcast) {
        Expr value = op(kind, broadcast.getValue(), ((Broadcast) rhs).getValue());
        return IR.broadcast(value, broadcast.getLanes());
      }
      if (rhs instanceof Ramp) {
        Ramp ramp = (Ramp) rhs;
        Expr base = op(kind, broadcast.getValue(), ramp.getBase());
        Expr stride = ramp.getStride();
        if (kind == ExprKind.SUB) {
          stride = IR.sub(ExprUtil.constantOf(stride.getDtype(), 0), stride);
        }
        return IR.ramp(base, stride, ramp.getLanes());
      }
    } else if (lhs instanceof Ramp) {
      Ramp ramp = (Ramp) lhs;
      if (rhs instanceof Ramp) {
        Ramp other = (Ramp) rhs;
        return IR.ramp(
            op(kind, ramp.getBase(), other.getBase()),
            op(kind, ramp.getStride(), other.getStride()),
            ramp.getLanes());
      }
      if (rhs instanceof Broadcast) {
        Expr base = op(kind, ramp.getBase(), ((Broadcast) rhs).getValue());
        return IR.ramp(base, ramp.getStride(), ramp.getLanes());
      }
    }
    return null;
  }

  /**
   * Combines {@code lhs * rhs}. Returns null when either operand is not a
   * multilane primitive, or when both are Ramps, whose product is not linear.
   */
  static @Nullable Expr multiply(Expr lhs, Expr rhs) {
    if (lhs instanceof Broadcast && rhs instanceof Broadcast) {
      Expr value = IR.mul(((Broadcast) lhs).getValue(), ((Broadcast) rhs).getValue());
      return IR.broadcast(value, lhs.getDtype().getLanes());
    }
    Broadcast broadcast = null;
    Ramp ramp = null;
    if (lhs instanceof Broadcast && rhs instanceof Ramp) {
      broadcast = (Broadcast) lhs;
      ramp = (Ramp) rhs;
    } else if (lhs instanceof Ramp && rhs instanceof Broadcast) {
      broadcast = (Broadcast) rhs;
      ramp = (Ramp) lhs;
    } else {
      return null;
    }
    return IR.ramp(
        IR.mul(broadcast.getValue(), ramp.getBase()),
        IR.mul(broadcast.getValue(), ramp.getStride()),
        ramp.getLanes());
  }

  private static Expr op(ExprKind kind, Expr lhs, Expr rhs) {
    return kind == ExprKind.ADD ? IR.add(lhs, rhs) : IR.sub(lhs, rhs);
  }
}
