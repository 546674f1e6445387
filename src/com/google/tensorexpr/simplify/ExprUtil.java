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

import com.google.common.math.LongMath;
import com.google.tensorexpr.ir.Broadcast;
import com.google.tensorexpr.ir.Dtype;
import com.google.tensorexpr.ir.Expr;
import com.google.tensorexpr.ir.ExprEvaluator;
import com.google.tensorexpr.ir.ExprKind;
import com.google.tensorexpr.ir.IR;
import com.google.tensorexpr.ir.Immediate;
import org.jspecify.annotations.Nullable;

/** Static helpers for examining and building expressions during simplification. */
final class ExprUtil {

  private ExprUtil() {}

  /**
   * Returns the constant scalar value of {@code e}: {@code e} itself if it is
   * an immediate, or the value of a broadcast of an immediate. Returns null for
   * anything else.
   */
  static @Nullable Immediate asScalarConstant(Expr e) {
    if (e instanceof Immediate) {
      return (Immediate) e;
    }
    if (e instanceof Broadcast && ((Broadcast) e).getValue() instanceof Immediate) {
      return (Immediate) ((Broadcast) e).getValue();
    }
    return null;
  }

  /**
   * Returns the constant {@code value} with type {@code dtype}: an immediate
   * for scalar types, a broadcast immediate for vector types.
   */
  static Expr constantOf(Dtype dtype, long value) {
    return withLanes(Immediate.of(dtype.getScalarType(), value), dtype);
  }

  /** Converts the scalar constant {@code value} to {@code dtype}, broadcasting it if needed. */
  static Expr withLanes(Immediate value, Dtype dtype) {
    Immediate scalar = value.castTo(dtype.getScalarType());
    return dtype.getLanes() == 1 ? scalar : IR.broadcast(scalar, dtype.getLanes());
  }

  /** Wraps {@code e} in a cast unless it already has type {@code dtype}. */
  static Expr castIfNeeded(Expr e, Dtype dtype) {
    if (e.getDtype().equals(dtype)) {
      return e;
    }
    Immediate constant = asScalarConstant(e);
    if (constant != null) {
      return withLanes(constant, dtype);
    }
    return IR.cast(dtype, e);
  }

  /** Evaluates an operator whose operands are all immediates. */
  static Immediate evaluateOp(Expr op) {
    return ExprEvaluator.evaluateConstant(op);
  }

  static Immediate add(Immediate lhs, Immediate rhs) {
    return evaluateOp(IR.add(lhs, rhs));
  }

  static Immediate mul(Immediate lhs, Immediate rhs) {
    return evaluateOp(IR.mul(lhs, rhs));
  }

  static Immediate div(Immediate lhs, Immediate rhs) {
    return evaluateOp(IR.div(lhs, rhs));
  }

  static Immediate negate(Immediate value) {
    return mul(value, Immediate.of(value.getScalarType(), -1));
  }

  /** Whether {@code e} is a Broadcast or a Ramp. */
  static boolean isMultilanePrimitive(Expr e) {
    return e.getKind() == ExprKind.BROADCAST || e.getKind() == ExprKind.RAMP;
  }

  /** Whether {@code e} is an integral immediate equal to zero. */
  static boolean isIntegralZero(Expr e) {
    return e instanceof Immediate && e.getDtype().isIntegral() && ((Immediate) e).isEqualTo(0);
  }

  /**
   * The non-negative greatest common divisor of two integral immediates. A
   * {@code Long.MIN_VALUE} operand has no representable magnitude, so one is
   * returned and callers do not factor.
   */
  static long gcd(long a, long b) {
    if (a == Long.MIN_VALUE || b == Long.MIN_VALUE) {
      return 1;
    }
    return LongMath.gcd(Math.abs(a), Math.abs(b));
  }
}
