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
 * The element types of the IR. Declaration order is promotion order: when two
 * types meet in a binary operation the later one wins.
 */
public enum ScalarType {
  BOOL(1, false),
  BYTE(8, false),
  SHORT(16, false),
  INT(32, false),
  LONG(64, false),
  FLOAT(32, true),
  DOUBLE(64, true);

  private final int bits;
  private final boolean floatingPoint;

  ScalarType(int bits, boolean floatingPoint) {
    this.bits = bits;
    this.floatingPoint = floatingPoint;
  }

  public int getBits() {
    return bits;
  }

  public boolean isFloatingPoint() {
    return floatingPoint;
  }

  public boolean isIntegral() {
    return !floatingPoint;
  }

  /** Returns the wider of the two types. */
  public static ScalarType promote(ScalarType a, ScalarType b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  /** Truncates {@code value} to this type's width, sign extending the result. */
  long wrap(long value) {
    switch (this) {
      case BOOL:
        return value != 0 ? 1 : 0;
      case BYTE:
        return (byte) value;
      case SHORT:
        return (short) value;
      case INT:
        return (int) value;
      default:
        return value;
    }
  }

  /** Rounds {@code value} to the precision of this floating point type. */
  double round(double value) {
    return this == FLOAT ? (double) (float) value : value;
  }
}
