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

/**
 * A scalar literal. Integral and boolean values are kept in a {@code long},
 * truncated to the width of their type; floating point values in a {@code
 * double}, rounded to the precision of their type.
 */
public final class Immediate extends Expr {

  private final long longValue;
  private final double doubleValue;

  private Immediate(ScalarType type, long longValue, double doubleValue) {
    super(ExprKind.IMMEDIATE, Dtype.of(type));
    this.longValue = longValue;
    this.doubleValue = doubleValue;
  }

  /** Creates an immediate of the given type holding {@code value}, converted to that type. */
  public static Immediate of(ScalarType type, long value) {
    if (type.isFloatingPoint()) {
      return new Immediate(type, 0, type.round((double) value));
    }
    return new Immediate(type, type.wrap(value), 0);
  }

  /** Creates an immediate of the given type holding {@code value}, converted to that type. */
  public static Immediate of(ScalarType type, double value) {
    if (type.isFloatingPoint()) {
      return new Immediate(type, 0, type.round(value));
    }
    if (type == ScalarType.BOOL) {
      return new Immediate(type, value != 0 ? 1 : 0, 0);
    }
    return new Immediate(type, type.wrap((long) value), 0);
  }

  public ScalarType getScalarType() {
    return getDtype().getScalarType();
  }

  @Override
  public boolean isConstant() {
    return true;
  }

  /** The value as a {@code long}; floating point values are truncated. */
  public long asLong() {
    return getDtype().isFloatingPoint() ? (long) doubleValue : longValue;
  }

  public double asDouble() {
    return getDtype().isFloatingPoint() ? doubleValue : (double) longValue;
  }

  /** Converts this value to {@code type} with C cast semantics. */
  public Immediate castTo(ScalarType type) {
    if (type == getScalarType()) {
      return this;
    }
    return getDtype().isFloatingPoint() ? of(type, doubleValue) : of(type, longValue);
  }

  /** Whether this immediate compares equal to {@code value}. */
  public boolean isEqualTo(long value) {
    return getDtype().isFloatingPoint() ? doubleValue == value : longValue == value;
  }

  public boolean isNegative() {
    return getDtype().isFloatingPoint() ? doubleValue < 0 : longValue < 0;
  }

  @Override
  public ImmutableList<Expr> getChildren() {
    return ImmutableList.of();
  }

  @Override
  public Expr accept(IrMutator mutator) {
    return mutator.visitImmediate(this);
  }

  @Override
  boolean isEquivalentShallow(Expr other) {
    checkArgument(other instanceof Immediate);
    Immediate that = (Immediate) other;
    return getDtype().isFloatingPoint()
        ? Double.compare(doubleValue, that.doubleValue) == 0
        : longValue == that.longValue;
  }

  /** The raw bits of the value, for hashing. */
  long getBits() {
    return getDtype().isFloatingPoint() ? Double.doubleToLongBits(doubleValue) : longValue;
  }
}
