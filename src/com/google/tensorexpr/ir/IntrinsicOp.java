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

/** Math intrinsics. */
public enum IntrinsicOp {
  SIN(1),
  COS(1),
  TAN(1),
  ASIN(1),
  ACOS(1),
  ATAN(1),
  ATAN2(2),
  SINH(1),
  COSH(1),
  TANH(1),
  SIGMOID(1),
  EXP(1),
  EXPM1(1),
  LOG(1),
  LOG2(1),
  LOG10(1),
  LOG1P(1),
  SQRT(1),
  RSQRT(1),
  ABS(1),
  FLOOR(1),
  CEIL(1),
  ROUND(1),
  TRUNC(1),
  FRAC(1),
  POW(2),
  FMOD(2),
  REMAINDER(2),
  RAND(0);

  private final int arity;

  IntrinsicOp(int arity) {
    this.arity = arity;
  }

  public int getArity() {
    return arity;
  }

  /** Whether the intrinsic always yields the same result for the same operands. */
  public boolean isPure() {
    return this != RAND;
  }

  /** Whether integral operands keep their type. Other intrinsics compute in floating point. */
  public boolean preservesIntegralType() {
    return this == ABS;
  }

  public String getName() {
    return name().toLowerCase();
  }

  /** Applies the intrinsic to floating point operands. */
  double apply(double[] args) {
    switch (this) {
      case SIN:
        return Math.sin(args[0]);
      case COS:
        return Math.cos(args[0]);
      case TAN:
        return Math.tan(args[0]);
      case ASIN:
        return Math.asin(args[0]);
      case ACOS:
        return Math.acos(args[0]);
      case ATAN:
        return Math.atan(args[0]);
      case ATAN2:
        return Math.atan2(args[0], args[1]);
      case SINH:
        return Math.sinh(args[0]);
      case COSH:
        return Math.cosh(args[0]);
      case TANH:
        return Math.tanh(args[0]);
      case SIGMOID:
        return 1.0 / (1.0 + Math.exp(-args[0]));
      case EXP:
        return Math.exp(args[0]);
      case EXPM1:
        return Math.expm1(args[0]);
      case LOG:
        return Math.log(args[0]);
      case LOG2:
        return Math.log(args[0]) / Math.log(2.0);
      case LOG10:
        return Math.log10(args[0]);
      case LOG1P:
        return Math.log1p(args[0]);
      case SQRT:
        return Math.sqrt(args[0]);
      case RSQRT:
        return 1.0 / Math.sqrt(args[0]);
      case ABS:
        return Math.abs(args[0]);
      case FLOOR:
        return Math.floor(args[0]);
      case CEIL:
        return Math.ceil(args[0]);
      case ROUND:
        return Math.rint(args[0]);
      case TRUNC:
        return args[0] < 0 ? Math.ceil(args[0]) : Math.floor(args[0]);
      case FRAC:
        return args[0] - (args[0] < 0 ? Math.ceil(args[0]) : Math.floor(args[0]));
      case POW:
        return Math.pow(args[0], args[1]);
      case FMOD:
        return args[0] % args[1];
      case REMAINDER:
        return Math.IEEEremainder(args[0], args[1]);
      case RAND:
        throw new IllegalStateException("rand has no fixed value");
    }
    throw new AssertionError(this);
  }
}
