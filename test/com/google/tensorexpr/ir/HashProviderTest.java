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

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class HashProviderTest {

  private HashProvider hasher;

  @Before
  public void setUp() {
    hasher = new HashProvider();
  }

  @Test
  public void testStructurallyEqualTreesHashEqual() {
    Expr a = IR.add(IR.intVar("x"), IR.mul(IR.intImm(2), IR.intVar("y")));
    Expr b = IR.add(IR.intVar("x"), IR.mul(IR.intImm(2), IR.intVar("y")));
    assertThat(a).isNotSameInstanceAs(b);
    assertThat(hasher.hash(a)).isEqualTo(hasher.hash(b));
  }

  @Test
  public void testOperandOrderMatters() {
    Var x = IR.intVar("x");
    Var y = IR.intVar("y");
    assertThat(hasher.hash(IR.sub(x, y))).isNotEqualTo(hasher.hash(IR.sub(y, x)));
    assertThat(hasher.hash(IR.add(x, y))).isNotEqualTo(hasher.hash(IR.add(y, x)));
  }

  @Test
  public void testKindMatters() {
    Var x = IR.intVar("x");
    Var y = IR.intVar("y");
    assertThat(hasher.hash(IR.add(x, y))).isNotEqualTo(hasher.hash(IR.mul(x, y)));
    assertThat(hasher.hash(IR.max(x, y, true))).isNotEqualTo(hasher.hash(IR.max(x, y, false)));
  }

  @Test
  public void testTypeMatters() {
    assertThat(hasher.hash(IR.intImm(1))).isNotEqualTo(hasher.hash(IR.longImm(1)));
    assertThat(hasher.hash(IR.intVar("x")))
        .isNotEqualTo(hasher.hash(IR.var("x", Dtype.of(ScalarType.INT, 4))));
    assertThat(hasher.hash(IR.intImm(1))).isNotEqualTo(hasher.hash(IR.intImm(2)));
  }

  @Test
  public void testFloatValues() {
    assertThat(hasher.hash(IR.doubleImm(0.5))).isEqualTo(hasher.hash(IR.doubleImm(0.5)));
    assertThat(hasher.hash(IR.doubleImm(0.5))).isNotEqualTo(hasher.hash(IR.doubleImm(0.25)));
  }

  @Test
  public void testSeparateProvidersAgree() {
    Expr e = IR.div(IR.intVar("x"), IR.intImm(3));
    assertThat(new HashProvider().hash(e)).isEqualTo(hasher.hash(e));
  }

  @Test
  public void testHashCombineIsOrdered() {
    ExprHash a = hasher.hash(IR.intVar("a"));
    ExprHash b = hasher.hash(IR.intVar("b"));
    assertThat(hasher.hashCombine(ImmutableList.of(a, b)))
        .isEqualTo(hasher.hashCombine(ImmutableList.of(a, b)));
    assertThat(hasher.hashCombine(ImmutableList.of(a, b)))
        .isNotEqualTo(hasher.hashCombine(ImmutableList.of(b, a)));
  }
}
