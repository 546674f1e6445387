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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DtypeTest {

  @Test
  public void testPromoteScalarTypes() {
    assertThat(Dtype.promote(Dtype.INT, Dtype.INT)).isEqualTo(Dtype.INT);
    assertThat(Dtype.promote(Dtype.INT, Dtype.LONG)).isEqualTo(Dtype.LONG);
    assertThat(Dtype.promote(Dtype.LONG, Dtype.FLOAT)).isEqualTo(Dtype.FLOAT);
    assertThat(Dtype.promote(Dtype.DOUBLE, Dtype.BYTE)).isEqualTo(Dtype.DOUBLE);
  }

  @Test
  public void testPromoteKeepsLanes() {
    Dtype intx8 = Dtype.of(ScalarType.INT, 8);
    Dtype floatx8 = Dtype.of(ScalarType.FLOAT, 8);
    assertThat(Dtype.promote(intx8, floatx8)).isEqualTo(floatx8);
  }

  @Test
  public void testPromoteMismatchedLanes() {
    MalformedInputException e =
        assertThrows(
            MalformedInputException.class,
            () -> Dtype.promote(Dtype.INT, Dtype.of(ScalarType.INT, 4)));
    assertThat(e).hasMessageThat().contains("mismatched lanes");
  }

  @Test
  public void testToString() {
    assertThat(Dtype.INT.toString()).isEqualTo("int");
    assertThat(Dtype.of(ScalarType.FLOAT, 8).toString()).isEqualTo("floatx8");
  }

  @Test
  public void testEquality() {
    assertThat(Dtype.of(ScalarType.INT)).isEqualTo(Dtype.INT);
    assertThat(Dtype.INT.withLanes(4)).isEqualTo(Dtype.of(ScalarType.INT, 4));
    assertThat(Dtype.INT.withLanes(4)).isNotEqualTo(Dtype.INT);
    assertThat(Dtype.INT.withScalarType(ScalarType.LONG)).isEqualTo(Dtype.LONG);
  }

  @Test
  public void testInvalidLanes() {
    assertThrows(IllegalArgumentException.class, () -> Dtype.of(ScalarType.INT, 0));
  }

  @Test
  public void testBinaryOpTypes() {
    Var x = IR.intVar("x");
    assertThat(IR.add(x, IR.longImm(1)).getDtype()).isEqualTo(Dtype.LONG);
    assertThat(IR.mul(x, IR.floatImm(2)).getDtype()).isEqualTo(Dtype.FLOAT);
    assertThrows(IllegalArgumentException.class, () -> IR.and(x, IR.floatImm(1)));
    assertThrows(
        MalformedInputException.class,
        () -> IR.add(x, IR.var("v", Dtype.of(ScalarType.INT, 8))));
  }
}
