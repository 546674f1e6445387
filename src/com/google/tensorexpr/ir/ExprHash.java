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

import com.google.errorprone.annotations.Immutable;

/**
 * A structural hash of an expression. Hashes are totally ordered, which gives
 * the simplifier its canonical order for the operands of commutative
 * operators.
 */
@Immutable
public final class ExprHash implements Comparable<ExprHash> {

  private final long value;

  ExprHash(long value) {
    this.value = value;
  }

  public long asLong() {
    return value;
  }

  @Override
  public int compareTo(ExprHash other) {
    return Long.compare(value, other.value);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ExprHash && ((ExprHash) o).value == value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return String.format("%016x", value);
  }
}
