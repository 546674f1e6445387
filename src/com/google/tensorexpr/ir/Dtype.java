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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;

/** The type of an expression: a scalar type and a number of vector lanes. */
@Immutable
public final class Dtype {

  public static final Dtype BOOL = new Dtype(ScalarType.BOOL, 1);
  public static final Dtype BYTE = new Dtype(ScalarType.BYTE, 1);
  public static final Dtype SHORT = new Dtype(ScalarType.SHORT, 1);
  public static final Dtype INT = new Dtype(ScalarType.INT, 1);
  public static final Dtype LONG = new Dtype(ScalarType.LONG, 1);
  public static final Dtype FLOAT = new Dtype(ScalarType.FLOAT, 1);
  public static final Dtype DOUBLE = new Dtype(ScalarType.DOUBLE, 1);

  private final ScalarType scalarType;
  private final int lanes;

  private Dtype(ScalarType scalarType, int lanes) {
    this.scalarType = checkNotNull(scalarType);
    checkArgument(lanes >= 1, "lanes must be positive: %s", lanes);
    this.lanes = lanes;
  }

  public static Dtype of(ScalarType scalarType) {
    return of(scalarType, 1);
  }

  public static Dtype of(ScalarType scalarType, int lanes) {
    return new Dtype(scalarType, lanes);
  }

  public ScalarType getScalarType() {
    return scalarType;
  }

  public int getLanes() {
    return lanes;
  }

  public boolean isFloatingPoint() {
    return scalarType.isFloatingPoint();
  }

  public boolean isIntegral() {
    return scalarType.isIntegral();
  }

  public Dtype withLanes(int newLanes) {
    return newLanes == lanes ? this : new Dtype(scalarType, newLanes);
  }

  public Dtype withScalarType(ScalarType newScalarType) {
    return newScalarType == scalarType ? this : new Dtype(newScalarType, lanes);
  }

  /**
   * Promotes two types to the type of a binary operation over them.
   *
   * @throws MalformedInputException if the lane counts differ
   */
  public static Dtype promote(Dtype a, Dtype b) {
    if (a.lanes != b.lanes) {
      throw new MalformedInputException("mismatched lanes: " + a + " and " + b);
    }
    return a.withScalarType(ScalarType.promote(a.scalarType, b.scalarType));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Dtype)) {
      return false;
    }
    Dtype other = (Dtype) o;
    return scalarType == other.scalarType && lanes == other.lanes;
  }

  @Override
  public int hashCode() {
    return Objects.hash(scalarType, lanes);
  }

  @Override
  public String toString() {
    String name = scalarType.name().toLowerCase();
    return lanes == 1 ? name : name + "x" + lanes;
  }
}
