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

import static com.google.common.truth.Truth.assertThat;
import static com.google.tensorexpr.ir.testing.ExprSubject.assertExpr;

import com.google.common.collect.ImmutableList;
import com.google.tensorexpr.ir.BinaryOp;
import com.google.tensorexpr.ir.CompareOp;
import com.google.tensorexpr.ir.Dtype;
import com.google.tensorexpr.ir.Expr;
import com.google.tensorexpr.ir.ExprHash;
import com.google.tensorexpr.ir.ExprKind;
import com.google.tensorexpr.ir.HashProvider;
import com.google.tensorexpr.ir.Immediate;
import com.google.tensorexpr.ir.IR;
import com.google.tensorexpr.ir.IntrinsicOp;
import com.google.tensorexpr.ir.Polynomial;
import com.google.tensorexpr.ir.ScalarType;
import com.google.tensorexpr.ir.Term;
import com.google.tensorexpr.ir.Var;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for the folding stage alone, whose output still holds Terms and Polynomials. */
@RunWith(JUnit4.class)
public final class PolynomialTransformerTest {

  private PolynomialTransformer transformer;
  private HashProvider hasher;
  private Var x;
  private Var y;

  @Before
  public void setUp() {
    transformer = new PolynomialTransformer(new SimplifierOptions());
    hasher = new HashProvider();
    x = IR.intVar("x");
    y = IR.intVar("y");
  }

  private Expr fold(Expr e) {
    return e.accept(transformer);
  }

  private Term term(int scalar, Expr... variables) {
    return Term.create(hasher, IR.intImm(scalar), variables);
  }

  @Test
  public void testFoldConstants() {
    assertExpr(fold(IR.add(IR.intImm(3), IR.intImm(4)))).isImmediate(7);
    assertExpr(fold(IR.sub(IR.intImm(3), IR.intImm(4)))).isImmediate(-1);
    assertExpr(fold(IR.mul(IR.add(IR.intImm(1), IR.intImm(2)), IR.intImm(5)))).isImmediate(15);
    assertExpr(fold(IR.div(IR.intImm(-7), IR.intImm(2)))).isImmediate(-3);
    assertExpr(fold(IR.mod(IR.intImm(7), IR.intImm(3)))).isImmediate(1);
    assertExpr(fold(IR.and(IR.intImm(6), IR.intImm(3)))).isImmediate(2);
    assertExpr(fold(IR.lshift(IR.intImm(1), IR.intImm(4)))).isImmediate(16);
    assertExpr(fold(IR.max(IR.intImm(3), IR.intImm(5), false))).isImmediate(5);
    assertExpr(fold(IR.min(IR.intImm(3), IR.intImm(5), false))).isImmediate(3);
  }

  @Test
  public void testConstantDivisionByZeroIsKept() {
    Expr div = IR.div(IR.intImm(4), IR.intImm(0));
    assertExpr(fold(div)).isEquivalentTo(div);
    Expr mod = IR.mod(IR.intImm(4), IR.intImm(0));
    assertExpr(fold(mod)).isEquivalentTo(mod);
  }

  @Test
  public void testLikeTermsCombine() {
    assertExpr(fold(IR.add(x, x))).isEquivalentTo(term(2, x));
    assertExpr(fold(IR.sub(x, x))).isImmediate(0);
    assertExpr(fold(IR.sub(IR.mul(x, y), IR.mul(y, x)))).isImmediate(0);
  }

  @Test
  public void testScalarsAccumulate() {
    Expr e = IR.add(IR.add(x, IR.intImm(2)), IR.intImm(3));
    assertExpr(fold(e)).isEquivalentTo(Polynomial.create(hasher, IR.intImm(5), term(1, x)));
  }

  @Test
  public void testIdentities() {
    assertExpr(fold(IR.add(x, IR.intImm(0)))).isEquivalentTo(x);
    assertExpr(fold(IR.add(IR.intImm(0), x))).isEquivalentTo(x);
    assertExpr(fold(IR.sub(x, IR.intImm(0)))).isEquivalentTo(x);
    assertExpr(fold(IR.mul(x, IR.intImm(1)))).isEquivalentTo(x);
    assertExpr(fold(IR.mul(IR.intImm(0), x))).isImmediate(0);
    assertExpr(fold(IR.div(x, IR.intImm(1)))).isEquivalentTo(x);
    assertExpr(fold(IR.div(IR.intImm(0), x))).isImmediate(0);
  }

  @Test
  public void testZeroMinusX() {
    assertExpr(fold(IR.sub(IR.intImm(0), x))).isEquivalentTo(term(-1, x));
  }

  @Test
  public void testProductOfSums() {
    // (x + 1) * (x - 1) - x * x
    Expr e = IR.sub(IR.mul(IR.add(x, IR.intImm(1)), IR.sub(x, IR.intImm(1))), IR.mul(x, x));
    assertExpr(fold(e)).isImmediate(-1);
  }

  @Test
  public void testScalarDistributesOverSum() {
    Expr e = IR.mul(IR.add(x, IR.intImm(3)), IR.intImm(2));
    assertExpr(fold(e)).isEquivalentTo(Polynomial.create(hasher, IR.intImm(6), term(2, x)));
  }

  @Test
  public void testRoundOffFromMod() {
    Expr e = IR.sub(x, IR.mod(x, IR.intImm(4)));
    assertExpr(fold(e)).isEquivalentTo(term(1, IR.roundOff(x, IR.intImm(4))));
  }

  @Test
  public void testRoundOffFromModInsideSum() {
    // (x + 3) - x % 4
    Expr e = IR.sub(IR.add(x, IR.intImm(3)), IR.mod(x, IR.intImm(4)));
    assertExpr(fold(e))
        .isEquivalentTo(
            Polynomial.create(hasher, IR.intImm(3), term(1, IR.roundOff(x, IR.intImm(4)))));
  }

  @Test
  public void testRoundOffFromDivision() {
    Expr quotient = IR.div(x, IR.intImm(4));
    assertExpr(fold(IR.mul(quotient, IR.intImm(4))))
        .isEquivalentTo(term(1, IR.roundOff(x, IR.intImm(4))));
    assertExpr(fold(IR.mul(IR.intImm(8), quotient)))
        .isEquivalentTo(term(2, IR.roundOff(x, IR.intImm(4))));
    assertExpr(fold(IR.mul(IR.div(x, y), y))).isEquivalentTo(term(1, IR.roundOff(x, y)));
  }

  @Test
  public void testNoRoundOffWhenScalarIsNotAMultiple() {
    Expr e = IR.mul(IR.div(x, IR.intImm(4)), IR.intImm(6));
    assertExpr(fold(e)).isEquivalentTo(term(6, IR.div(x, IR.intImm(4))));
  }

  @Test
  public void testRoundOffDetectionDisabled() {
    SimplifierOptions options = new SimplifierOptions();
    options.setDetectRoundOff(false);
    transformer = new PolynomialTransformer(options);
    Expr e = IR.mul(IR.div(x, IR.intImm(4)), IR.intImm(4));
    assertExpr(fold(e)).isEquivalentTo(term(4, IR.div(x, IR.intImm(4))));
  }

  @Test
  public void testDivisionGcd() {
    Expr e = IR.div(IR.mul(x, IR.intImm(6)), IR.intImm(4));
    assertExpr(fold(e)).isEquivalentTo(IR.div(term(3, x), IR.intImm(2)));
  }

  @Test
  public void testDivisionGcdCancelsDivisor() {
    Expr e = IR.div(IR.add(IR.mul(x, IR.intImm(4)), IR.intImm(8)), IR.intImm(4));
    assertExpr(fold(e)).isEquivalentTo(Polynomial.create(hasher, IR.intImm(2), term(1, x)));
  }

  @Test
  public void testFloatingPointDivisionIsKept() {
    Var f = IR.var("f", Dtype.FLOAT);
    Expr e = IR.div(IR.mul(f, IR.floatImm(6)), IR.floatImm(4));
    Term sixF = Term.create(hasher, IR.floatImm(6), f);
    assertExpr(fold(e)).isEquivalentTo(IR.div(sixF, IR.floatImm(4)));
  }

  @Test
  public void testCast() {
    assertExpr(fold(IR.cast(Dtype.INT, IR.doubleImm(2.75)))).isImmediate(2);
    assertExpr(fold(IR.cast(Dtype.INT, x))).isEquivalentTo(x);
    Expr widened = IR.cast(Dtype.LONG, x);
    assertExpr(fold(widened)).isEquivalentTo(widened);
  }

  @Test
  public void testCompareSelect() {
    Expr constant =
        IR.compareSelect(
            IR.intImm(1), IR.intImm(2), IR.intImm(3), IR.intImm(4), CompareOp.LT);
    assertExpr(fold(constant)).isImmediate(3);

    Expr variable = IR.compareSelect(x, IR.intImm(2), IR.intImm(3), IR.intImm(4), CompareOp.LT);
    assertExpr(fold(variable)).isEquivalentTo(variable);
  }

  @Test
  public void testIntrinsics() {
    Expr sqrt = fold(IR.intrinsic(IntrinsicOp.SQRT, IR.add(IR.doubleImm(7), IR.doubleImm(9))));
    assertExpr(sqrt).isConstant();
    assertThat(((Immediate) sqrt).asDouble()).isEqualTo(4.0);

    Expr rand = IR.intrinsic(IntrinsicOp.RAND);
    assertExpr(fold(rand)).isEquivalentTo(rand);
  }

  @Test
  public void testMultilaneFolding() {
    Expr ramp = IR.ramp(IR.intImm(0), IR.intImm(1), 8);
    Expr e = IR.add(ramp, IR.broadcast(IR.intImm(2), 8));
    assertExpr(fold(e)).isEquivalentTo(IR.ramp(IR.intImm(2), IR.intImm(1), 8));
  }

  @Test
  public void testVectorScalarIsBroadcast() {
    Var v = IR.var("v", Dtype.of(ScalarType.INT, 8));
    Expr e = IR.mul(IR.broadcast(IR.intImm(3), 8), v);
    assertExpr(fold(e)).isEquivalentTo(term(3, v));
  }

  @Test
  public void testAddOrUpdateTerm() {
    Map<ExprHash, Term> terms = new LinkedHashMap<>();
    transformer.addOrUpdateTerm(terms, term(2, x));
    transformer.addOrUpdateTerm(terms, term(3, y));
    transformer.addOrUpdateTerm(terms, term(5, x));
    assertThat(terms).hasSize(2);
    assertExpr(terms.get(term(1, x).hashVars())).isEquivalentTo(term(7, x));

    transformer.addOrUpdateTerm(terms, term(-3, y));
    assertThat(terms).hasSize(1);
  }

  @Test
  public void testVerifiedMergesAgree() {
    SimplifierOptions options = new SimplifierOptions();
    options.setVerifyHashMerges(true);
    transformer = new PolynomialTransformer(options);
    Expr e = IR.add(IR.mul(x, y), IR.add(IR.mul(y, x), x));
    Expr folded = fold(e);
    assertExpr(folded).hasKind(ExprKind.POLYNOMIAL);
    assertThat(((Polynomial) folded).getTerms()).hasSize(2);
  }

  @Test
  public void testMakeTermCombinesDivisionWithVariableDenominator() {
    Term made = transformer.makeTerm(IR.intImm(3), ImmutableList.of(y, IR.div(x, y), x));
    assertExpr(made).isEquivalentTo(term(3, IR.roundOff(x, y), x));
  }

  @Test
  public void testNarrowSumIsCastBeforeWideMultiply() {
    Expr folded = fold(IR.mul(IR.add(x, y), IR.longImm(2)));
    assertExpr(folded).hasKind(ExprKind.TERM);
    Term product = (Term) folded;
    assertThat(product.getScalar().getScalarType()).isEqualTo(ScalarType.LONG);
    assertThat(product.getVariables()).hasSize(1);
    Expr widened = product.getVariables().get(0);
    assertExpr(widened).hasKind(ExprKind.CAST);
    assertThat(widened.getDtype()).isEqualTo(Dtype.LONG);
  }

  @Test
  public void testNarrowTermsMergeInTheWiderType() {
    Var l = IR.var("l", Dtype.LONG);
    Expr folded = fold(IR.add(IR.add(x, l), x));
    assertExpr(folded).hasKind(ExprKind.POLYNOMIAL);
    for (Term t : ((Polynomial) folded).getTerms()) {
      assertThat(t.getScalar().getScalarType()).isEqualTo(ScalarType.LONG);
    }
  }

  @Test
  public void testMinValueNumeratorIsNotReduced() {
    Var l = IR.var("l", Dtype.LONG);
    Expr folded = fold(IR.div(IR.mul(IR.longImm(Long.MIN_VALUE), l), IR.longImm(4)));
    assertExpr(folded).hasKind(ExprKind.DIV);
    assertExpr(((BinaryOp) folded).getRhs()).isImmediate(4);
  }
}
