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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.tensorexpr.simplify.ExprUtil.castIfNeeded;
import static com.google.tensorexpr.simplify.ExprUtil.constantOf;
import static com.google.tensorexpr.simplify.ExprUtil.withLanes;

import com.google.common.annotations.VisibleForTesting;
import com.google.tensorexpr.ir.AbstractIrMutator;
import com.google.tensorexpr.ir.Dtype;
import com.google.tensorexpr.ir.Expr;
import com.google.tensorexpr.ir.HashProvider;
import com.google.tensorexpr.ir.IR;
import com.google.tensorexpr.ir.Immediate;
import com.google.tensorexpr.ir.Polynomial;
import com.google.tensorexpr.ir.RoundOff;
import com.google.tensorexpr.ir.Term;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The second simplification stage: rewrites the {@link Term}s, {@link
 * Polynomial}s and {@link RoundOff}s left by {@link PolynomialTransformer}
 * back into plain arithmetic. Terms with negative scalars are emitted as
 * subtractions, so {@code x + -1 * y} comes out as {@code x - y}.
 */
class TermExpander extends AbstractIrMutator {

  private static final Logger logger = Logger.getLogger(TermExpander.class.getName());

  private final HashProvider hasher;
  private final boolean factorizePolynomials;

  TermExpander(PolynomialTransformer simplifier, SimplifierOptions options) {
    this.hasher = simplifier.getHasher();
    this.factorizePolynomials = checkNotNull(options).getFactorizePolynomials();
  }

  /** Emits {@code scalar * v1 * v2 ...}, leaving out a scalar of one. */
  @Override
  public Expr visitTerm(Term n) {
    Dtype dtype = n.getDtype();
    Immediate scalar = n.getScalar();
    if (scalar.isEqualTo(0)) {
      return constantOf(dtype, 0);
    }
    Expr product = scalar.isEqualTo(1) ? null : withLanes(scalar, dtype);
    for (Expr variable : n.getVariables()) {
      Expr expanded = variable.accept(this);
      product = product == null ? expanded : IR.mul(product, expanded);
    }
    return castIfNeeded(checkNotNull(product), dtype);
  }

  @Override
  public Expr visitPolynomial(Polynomial n) {
    Dtype dtype = n.getDtype();
    if (factorizePolynomials && dtype.isIntegral()) {
      Term factorized = factorizePolynomial(n);
      if (factorized != null) {
        if (logger.isLoggable(Level.FINEST)) {
          logger.finest("Factorized " + n + " to " + factorized);
        }
        return factorized.accept(this);
      }
    }

    List<Term> addTerms = new ArrayList<>();
    List<Term> subTerms = new ArrayList<>();
    for (Term term : n.getTerms()) {
      if (term.getScalar().isEqualTo(0)) {
        continue;
      }
      if (term.getScalar().isNegative()) {
        subTerms.add(term);
      } else {
        addTerms.add(term);
      }
    }

    Expr result = null;
    for (Term term : addTerms) {
      Expr expanded = term.accept(this);
      result = result == null ? expanded : IR.add(result, expanded);
    }

    // With nothing to subtract from, a non-zero constant leads.
    Immediate scalar = n.getScalar();
    boolean scalarEmitted = false;
    if (result == null && !scalar.isEqualTo(0)) {
      result = withLanes(scalar, dtype);
      scalarEmitted = true;
    }

    for (Term term : subTerms) {
      if (result == null) {
        result = term.accept(this);
        continue;
      }
      Term positive = Term.create(hasher, ExprUtil.negate(term.getScalar()), term.getVariables());
      result = IR.sub(result, positive.accept(this));
    }

    if (!scalarEmitted && !scalar.isEqualTo(0)) {
      result =
          scalar.isNegative()
              ? IR.sub(result, withLanes(ExprUtil.negate(scalar), dtype))
              : IR.add(result, withLanes(scalar, dtype));
    }

    if (result == null) {
      return constantOf(dtype, 0);
    }
    return castIfNeeded(result, dtype);
  }

  /**
   * Factors the greatest common divisor of a polynomial's scalars out, giving
   * {@code gcd * (polynomial / gcd)}. Returns null if that divisor is one.
   */
  @VisibleForTesting
  @Nullable Term factorizePolynomial(Polynomial poly) {
    long gcd = ExprUtil.gcd(poly.getScalar().asLong(), 0);
    for (Term term : poly.getTerms()) {
      gcd = ExprUtil.gcd(gcd, term.getScalar().asLong());
    }
    if (gcd <= 1) {
      return null;
    }

    Immediate divisor = Immediate.of(poly.getScalar().getScalarType(), gcd);
    List<Term> terms = new ArrayList<>();
    for (Term term : poly.getTerms()) {
      Immediate termDivisor = divisor.castTo(term.getScalar().getScalarType());
      terms.add(
          Term.create(hasher, ExprUtil.div(term.getScalar(), termDivisor), term.getVariables()));
    }
    Polynomial inner =
        Polynomial.create(hasher, ExprUtil.div(poly.getScalar(), divisor), terms);
    return Term.create(hasher, divisor, inner);
  }

  /** Emits {@code (dividend / divisor) * divisor}. */
  @Override
  public Expr visitRoundOff(RoundOff n) {
    Expr dividend = n.getDividend().accept(this);
    Expr divisor = n.getDivisor().accept(this);
    return castIfNeeded(IR.mul(IR.div(dividend, divisor), divisor), n.getDtype());
  }
}
