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

import com.google.tensorexpr.ir.BinaryOp;
import com.google.tensorexpr.ir.Dtype;
import com.google.tensorexpr.ir.Expr;
import com.google.tensorexpr.ir.ExprEvaluator;
import com.google.tensorexpr.ir.ExprKind;
import com.google.tensorexpr.ir.HashProvider;
import com.google.tensorexpr.ir.IR;
import com.google.tensorexpr.ir.Polynomial;
import com.google.tensorexpr.ir.ScalarType;
import com.google.tensorexpr.ir.Term;
import com.google.tensorexpr.ir.Var;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TermExpanderTest {

  private SimplifierOptions options;
  private HashProvider hasher;
  private Var x;
  private Var y;

  @Before
  public void setUp() {
    options = new SimplifierOptions();
    hasher = new HashProvider();
    x = IR.intVar("x");
    y = IR.intVar("y");
  }

  private Expr expand(Expr e) {
    return e.accept(new TermExpander(new PolynomialTransformer(options), options));
  }

  private Term term(int scalar, Expr... variables) {
    return Term.create(hasher, IR.intImm(scalar), variables);
  }

  @Test
  public void testTerm() {
    assertExpr(expand(term(2, x))).isEquivalentTo(IR.mul(IR.intImm(2), x));
    assertExpr(expand(term(1, x))).isEquivalentTo(x);
    assertExpr(expand(term(-1, x))).isEquivalentTo(IR.mul(IR.intImm(-1), x));
  }

  @Test
  public void testTermProductOrder() {
    Term xy = term(3, x, y);
    Expr expanded = expand(xy);
    Expr first = xy.getVariables().get(0);
    Expr second = xy.getVariables().get(1);
    assertExpr(expanded).isEquivalentTo(IR.mul(IR.mul(IR.intImm(3), first), second));
  }

  @Test
  public void testTermWithWiderScalar() {
    Term term = Term.create(hasher, IR.longImm(2), x);
    assertExpr(expand(term)).isEquivalentTo(IR.mul(IR.longImm(2), x));
    assertThat(expand(term).getDtype()).isEqualTo(Dtype.LONG);

    Term unit = Term.create(hasher, IR.longImm(1), x);
    assertExpr(expand(unit)).isEquivalentTo(IR.cast(Dtype.LONG, x));
  }

  @Test
  public void testVectorTerm() {
    Var v = IR.var("v", Dtype.of(ScalarType.INT, 8));
    assertExpr(expand(term(2, v))).isEquivalentTo(IR.mul(IR.broadcast(IR.intImm(2), 8), v));
  }

  @Test
  public void testNegativeTermsBecomeSubtraction() {
    Polynomial poly = Polynomial.create(hasher, IR.intImm(0), term(1, x), term(-1, y));
    assertExpr(expand(poly)).isEquivalentTo(IR.sub(x, y));
  }

  @Test
  public void testNegativeScalarBecomesSubtraction() {
    Polynomial poly = Polynomial.create(hasher, IR.intImm(-3), term(1, x));
    assertExpr(expand(poly)).isEquivalentTo(IR.sub(x, IR.intImm(3)));
  }

  @Test
  public void testScalarLeadsWithoutPositiveTerms() {
    Polynomial poly = Polynomial.create(hasher, IR.intImm(5), term(-2, x));
    assertExpr(expand(poly)).isEquivalentTo(IR.sub(IR.intImm(5), IR.mul(IR.intImm(2), x)));
  }

  @Test
  public void testOnlyNegativeTerms() {
    Polynomial poly = Polynomial.create(hasher, IR.intImm(0), term(-1, x), term(-3, y));
    Expr expanded = expand(poly);
    assertExpr(expanded).hasKind(ExprKind.SUB);
    assertExpr(expanded).hasNoCanonicalForms();
    ExprEvaluator evaluator = ExprEvaluator.builder().bind(x, 2).bind(y, 5).build();
    assertThat(evaluator.evaluateScalar(expanded).asLong()).isEqualTo(-17);
  }

  @Test
  public void testFactorization() {
    Polynomial poly = Polynomial.create(hasher, IR.intImm(4), term(2, x));
    assertExpr(expand(poly)).isEquivalentTo(IR.mul(IR.intImm(2), IR.add(x, IR.intImm(2))));
  }

  @Test
  public void testFactorizationOfTerms() {
    Polynomial poly = Polynomial.create(hasher, IR.intImm(0), term(2, x), term(4, y));
    Expr expanded = expand(poly);
    assertExpr(expanded).hasKind(ExprKind.MUL);
    assertExpr(((BinaryOp) expanded).getLhs()).isImmediate(2);
    ExprEvaluator evaluator = ExprEvaluator.builder().bind(x, 3).bind(y, 7).build();
    assertThat(evaluator.evaluateScalar(expanded).asLong()).isEqualTo(34);
  }

  @Test
  public void testNoFactorizationWithoutCommonDivisor() {
    Polynomial poly = Polynomial.create(hasher, IR.intImm(3), term(2, x));
    assertExpr(expand(poly)).isEquivalentTo(IR.add(IR.mul(IR.intImm(2), x), IR.intImm(3)));
  }

  @Test
  public void testFactorizationDisabled() {
    options.setFactorizePolynomials(false);
    Polynomial poly = Polynomial.create(hasher, IR.intImm(4), term(2, x));
    assertExpr(expand(poly)).isEquivalentTo(IR.add(IR.mul(IR.intImm(2), x), IR.intImm(4)));
  }

  @Test
  public void testNoFactorizationForFloats() {
    Var f = IR.var("f", Dtype.FLOAT);
    Polynomial poly =
        Polynomial.create(hasher, IR.floatImm(4), Term.create(hasher, IR.floatImm(2), f));
    assertExpr(expand(poly)).isEquivalentTo(IR.add(IR.mul(IR.floatImm(2), f), IR.floatImm(4)));
  }

  @Test
  public void testFactorizePolynomial() {
    TermExpander expander = new TermExpander(new PolynomialTransformer(options), options);
    Polynomial poly = Polynomial.create(hasher, IR.intImm(-6), term(9, x), term(-3, y));
    Term factorized = expander.factorizePolynomial(poly);
    assertThat(factorized).isNotNull();
    assertExpr(factorized.getScalar()).isImmediate(3);
    assertExpr(factorized.getVariables().get(0))
        .isEquivalentTo(Polynomial.create(hasher, IR.intImm(-2), term(3, x), term(-1, y)));

    Polynomial coprime = Polynomial.create(hasher, IR.intImm(1), term(2, x));
    assertThat(expander.factorizePolynomial(coprime)).isNull();
  }

  @Test
  public void testFactorizePolynomialWithMinValueCoefficient() {
    TermExpander expander = new TermExpander(new PolynomialTransformer(options), options);
    Var a = IR.var("a", Dtype.LONG);
    Polynomial poly =
        Polynomial.create(
            hasher,
            IR.longImm(Long.MIN_VALUE),
            Term.create(hasher, IR.longImm(2), a));
    assertThat(expander.factorizePolynomial(poly)).isNull();

    Term minTimesA = Term.create(hasher, IR.longImm(Long.MIN_VALUE), a);
    Polynomial minTerm = Polynomial.create(hasher, IR.longImm(4), minTimesA);
    assertThat(expander.factorizePolynomial(minTerm)).isNull();
  }

  @Test
  public void testRoundOff() {
    Expr roundOff = IR.roundOff(x, IR.intImm(4));
    assertExpr(expand(roundOff)).isEquivalentTo(IR.mul(IR.div(x, IR.intImm(4)), IR.intImm(4)));
  }

  @Test
  public void testNestedCanonicalForms() {
    Expr e = IR.add(term(2, x), IR.roundOff(term(1, y), IR.intImm(8)));
    Expr expanded = expand(e);
    assertExpr(expanded).hasNoCanonicalForms();
    assertExpr(expanded)
        .isEquivalentTo(
            IR.add(IR.mul(IR.intImm(2), x), IR.mul(IR.div(y, IR.intImm(8)), IR.intImm(8))));
  }
}
