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

package com.google.tensorexpr.ir.testing;

import static com.google.common.truth.Fact.fact;
import static com.google.common.truth.Fact.simpleFact;
import static com.google.common.truth.Truth.assertAbout;

import com.google.common.truth.FailureMetadata;
import com.google.common.truth.Subject;
import com.google.tensorexpr.ir.Expr;
import com.google.tensorexpr.ir.ExprKind;
import com.google.tensorexpr.ir.Immediate;
import org.jspecify.annotations.Nullable;

/**
 * A Truth Subject for expression trees. Usage:
 *
 * <pre>
 *   import static com.google.tensorexpr.ir.testing.ExprSubject.assertExpr;
 *   ...
 *   assertExpr(simplified).isEquivalentTo(IR.add(x, IR.intImm(1)));
 *   assertExpr(simplified).isImmediate(7);
 * </pre>
 */
public final class ExprSubject extends Subject {

  private final @Nullable Expr actual;

  public static ExprSubject assertExpr(@Nullable Expr e) {
    return assertAbout(exprs()).that(e);
  }

  public static Subject.Factory<ExprSubject, Expr> exprs() {
    return ExprSubject::new;
  }

  private ExprSubject(FailureMetadata failureMetadata, @Nullable Expr e) {
    super(failureMetadata, e);
    this.actual = e;
  }

  /** Checks that the expression is structurally identical to {@code expected}. */
  public void isEquivalentTo(Expr expected) {
    isNotNull();
    if (!actual.isEquivalentTo(expected)) {
      failWithActual(fact("expected", expected));
    }
  }

  public void isNotEquivalentTo(Expr unexpected) {
    isNotNull();
    if (actual.isEquivalentTo(unexpected)) {
      failWithActual(fact("expected not to be equivalent to", unexpected));
    }
  }

  public void hasKind(ExprKind kind) {
    isNotNull();
    check("getKind()").that(actual.getKind()).isEqualTo(kind);
  }

  /** Checks that the expression is a one lane immediate equal to {@code value}. */
  public void isImmediate(long value) {
    isNotNull();
    if (!(actual instanceof Immediate)) {
      failWithActual(simpleFact("expected to be an immediate"));
      return;
    }
    if (!((Immediate) actual).isEqualTo(value)) {
      failWithActual(fact("expected immediate", value));
    }
  }

  public void isConstant() {
    isNotNull();
    if (!actual.isConstant()) {
      failWithActual(simpleFact("expected to be a constant"));
    }
  }

  /** Checks that no Term, Polynomial or RoundOff remains anywhere in the tree. */
  public void hasNoCanonicalForms() {
    isNotNull();
    Expr found = findCanonicalForm(actual);
    if (found != null) {
      failWithActual(fact("expected no Term, Polynomial or RoundOff, but found", found));
    }
  }

  private static @Nullable Expr findCanonicalForm(Expr e) {
    switch (e.getKind()) {
      case TERM:
      case POLYNOMIAL:
      case ROUND_OFF:
        return e;
      default:
        break;
    }
    for (Expr child : e.getChildren()) {
      Expr found = findCanonicalForm(child);
      if (found != null) {
        return found;
      }
    }
    return null;
  }
}
