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
import static com.google.common.base.Preconditions.checkState;
import static com.google.tensorexpr.simplify.ExprUtil.asScalarConstant;
import static com.google.tensorexpr.simplify.ExprUtil.castIfNeeded;
import static com.google.tensorexpr.simplify.ExprUtil.constantOf;
import static com.google.tensorexpr.simplify.ExprUtil.evaluateOp;
import static com.google.tensorexpr.simplify.ExprUtil.isIntegralZero;
import static com.google.tensorexpr.simplify.ExprUtil.isMultilanePrimitive;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.tensorexpr.ir.AbstractIrMutator;
import com.google.tensorexpr.ir.BinaryOp;
import com.google.tensorexpr.ir.Broadcast;
import com.google.tensorexpr.ir.Cast;
import com.google.tensorexpr.ir.CompareSelect;
import com.google.tensorexpr.ir.Dtype;
import com.google.tensorexpr.ir.Expr;
import com.google.tensorexpr.ir.ExprHash;
import com.google.tensorexpr.ir.ExprKind;
import com.google.tensorexpr.ir.HashProvider;
import com.google.tensorexpr.ir.IR;
import com.google.tensorexpr.ir.Immediate;
import com.google.tensorexpr.ir.Intrinsics;
import com.google.tensorexpr.ir.Polynomial;
import com.google.tensorexpr.ir.ScalarType;
import com.google.tensorexpr.ir.Term;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The first simplification stage: folds arithmetic into {@link Term}s (grouped
 * by multiplication) and {@link Polynomial}s (grouped by addition), combining
 * and cancelling like terms, folding constants and recognizing the rounding
 * idiom {@code x - x % c}.
 *
 * <p>Operands are rewritten before their parent, so every rule below sees
 * operands that are already in canonical form. The output may still hold
 * Terms, Polynomials and RoundOffs; {@link TermExpander} removes them.
 */
class PolynomialTransformer extends AbstractIrMutator {

  private static final Logger logger = Logger.getLogger(PolynomialTransformer.class.getName());

  private final HashProvider hasher = new HashProvider();
  private final boolean detectRoundOff;
  private final boolean foldMultilanePrimitives;
  private final boolean verifyHashMerges;

  PolynomialTransformer(SimplifierOptions options) {
    checkNotNull(options);
    this.detectRoundOff = options.getDetectRoundOff();
    this.foldMultilanePrimitives = options.getFoldMultilanePrimitives();
    this.verifyHashMerges = options.getVerifyHashMerges();
  }

  HashProvider getHasher() {
    return hasher;
  }

  @Override
  public Expr visitAdd(BinaryOp n) {
    Expr lhs = n.getLhs().accept(this);
    Expr rhs = n.getRhs().accept(this);
    return addOrSubtract(n, lhs, rhs, false);
  }

  @Override
  public Expr visitSub(BinaryOp n) {
    Expr lhs = n.getLhs().accept(this);
    Expr rhs = n.getRhs().accept(this);
    return addOrSubtract(n, lhs, rhs, true);
  }

  /**
   * Folds {@code lhs + rhs}, or {@code lhs - rhs} when {@code negated}. The
   * right operand's terms are negated as they are merged, so no negation node
   * is ever built and {@code x - x} cancels exactly.
   */
  private Expr addOrSubtract(BinaryOp n, Expr lhs, Expr rhs, boolean negated) {
    if (lhs.isConstant() && rhs.isConstant()) {
      return evaluateOp(rebuild(n, lhs, rhs));
    }

    if (foldMultilanePrimitives && isMultilanePrimitive(lhs) && isMultilanePrimitive(rhs)) {
      Expr combined = MultilaneFolding.combine(n.getKind(), lhs, rhs);
      if (combined != null) {
        return combined.accept(this);
      }
    }

    Dtype dtype = n.getDtype();
    lhs = widen(lhs, dtype);
    rhs = widen(rhs, dtype);
    Immediate lhsScalar = asScalarConstant(lhs);
    Immediate rhsScalar = asScalarConstant(rhs);
    if (rhsScalar != null && rhsScalar.isEqualTo(0)) {
      return castIfNeeded(lhs, dtype);
    }
    if (!negated && lhsScalar != null && lhsScalar.isEqualTo(0)) {
      return castIfNeeded(rhs, dtype);
    }

    Map<ExprHash, Term> terms = new LinkedHashMap<>();
    ScalarType type = dtype.getScalarType();
    Immediate scalar = collectTerms(lhs, lhsScalar, false, type, terms);
    scalar = ExprUtil.add(scalar, collectTerms(rhs, rhsScalar, negated, type, terms));
    return finishPolynomial(scalar, terms, dtype);
  }

  /**
   * Adds the terms of {@code e} to {@code terms}, negated if requested, and
   * returns its constant part. Operands that are neither constants, Terms nor
   * Polynomials become a term with a scalar of one. Scalars are converted to
   * {@code type} first, so they combine in the type of the sum.
   */
  private Immediate collectTerms(
      Expr e,
      @Nullable Immediate constant,
      boolean negated,
      ScalarType type,
      Map<ExprHash, Term> terms) {
    if (constant != null) {
      Immediate value = constant.castTo(type);
      return negated ? ExprUtil.negate(value) : value;
    }
    if (e instanceof Polynomial) {
      Polynomial poly = (Polynomial) e;
      for (Term term : poly.getTerms()) {
        Term converted = withScalarType(term, type);
        addOrUpdateTerm(terms, negated ? negate(converted) : converted);
      }
      Immediate value = poly.getScalar().castTo(type);
      return negated ? ExprUtil.negate(value) : value;
    }
    Term term = withScalarType(asTerm(e), type);
    addOrUpdateTerm(terms, negated ? negate(term) : term);
    return Immediate.of(type, 0);
  }

  private Term withScalarType(Term term, ScalarType type) {
    if (term.getScalar().getScalarType() == type) {
      return term;
    }
    return Term.create(hasher, term.getScalar().castTo(type), term.getVariables());
  }

  /**
   * Inserts {@code term} into {@code terms}. A term over the same variables as
   * one already present is combined with it, and dropped if the scalars
   * cancel.
   */
  @VisibleForTesting
  void addOrUpdateTerm(Map<ExprHash, Term> terms, Term term) {
    ExprHash key = term.hashVars();
    Term existing = terms.get(key);
    if (existing == null) {
      terms.put(key, term);
      return;
    }
    if (verifyHashMerges) {
      checkState(
          sameVariables(existing, term),
          "Variable hash collision between %s and %s",
          existing,
          term);
    }
    Immediate scalar = ExprUtil.add(existing.getScalar(), term.getScalar());
    if (scalar.isEqualTo(0)) {
      terms.remove(key);
      return;
    }
    Term merged = makeTerm(scalar, existing.getVariables());
    if (merged.hashVars().equals(key)) {
      terms.put(key, merged);
    } else {
      terms.remove(key);
      addOrUpdateTerm(terms, merged);
    }
  }

  private static boolean sameVariables(Term a, Term b) {
    ImmutableList<Expr> aVars = a.getVariables();
    ImmutableList<Expr> bVars = b.getVariables();
    if (aVars.size() != bVars.size()) {
      return false;
    }
    for (int i = 0; i < aVars.size(); i++) {
      if (!aVars.get(i).isEquivalentTo(bVars.get(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Builds the sum of {@code scalar} and {@code terms} in its smallest form: a
   * constant if no terms are left, a lone term if the scalar is zero, and a
   * Polynomial otherwise.
   */
  private Expr finishPolynomial(Immediate scalar, Map<ExprHash, Term> terms, Dtype dtype) {
    scalar = scalar.castTo(dtype.getScalarType());
    if (detectRoundOff && dtype.isIntegral()) {
      scalar = combineRoundOffs(scalar, terms);
    }
    if (terms.isEmpty()) {
      return ExprUtil.withLanes(scalar, dtype);
    }
    if (scalar.isEqualTo(0) && terms.size() == 1) {
      return castIfNeeded(terms.values().iterator().next(), dtype);
    }
    return castIfNeeded(Polynomial.fromMap(hasher, scalar, terms), dtype);
  }

  private Term negate(Term term) {
    return Term.create(hasher, ExprUtil.negate(term.getScalar()), term.getVariables());
  }

  private Term asTerm(Expr e) {
    if (e instanceof Term) {
      return (Term) e;
    }
    return makeTerm(Immediate.of(e.getDtype().getScalarType(), 1), ImmutableList.of(e));
  }

  /**
   * Creates a term. With round-off detection on, a component {@code a / d}
   * whose denominator {@code d} also divides the rest of the term is combined
   * with it into {@code RoundOff(a, d)}, so {@code 4 * (x / 4)} becomes
   * {@code RoundOff(x, 4)} and {@code y * (x / y)} becomes {@code RoundOff(x, y)}.
   */
  @VisibleForTesting
  Term makeTerm(Immediate scalar, List<? extends Expr> variables) {
    Term term = Term.create(hasher, scalar, variables);
    ScalarType type = term.getDtype().getScalarType();
    if (scalar.getScalarType() != type) {
      // The product is computed in the term's type, so its scalar is too.
      scalar = scalar.castTo(type);
      term = Term.create(hasher, scalar, variables);
    }
    if (!detectRoundOff || !term.getDtype().isIntegral()) {
      return term;
    }
    Immediate newScalar = scalar;
    List<Expr> components = new ArrayList<>(term.getVariables());
    boolean changed = false;
    for (int i = 0; i < components.size(); i++) {
      if (components.get(i).getKind() != ExprKind.DIV) {
        continue;
      }
      BinaryOp div = (BinaryOp) components.get(i);
      Expr denominator = div.getRhs();
      Immediate denominatorScalar;
      List<Expr> denominatorVariables;
      Immediate constant = asScalarConstant(denominator);
      if (constant != null) {
        denominatorScalar = constant;
        denominatorVariables = ImmutableList.of();
      } else if (denominator instanceof Term) {
        denominatorScalar = ((Term) denominator).getScalar();
        denominatorVariables = ((Term) denominator).getVariables();
      } else {
        denominatorScalar = Immediate.of(denominator.getDtype().getScalarType(), 1);
        denominatorVariables = ImmutableList.of(denominator);
      }
      if (!denominatorScalar.getDtype().isIntegral()
          || denominatorScalar.isEqualTo(0)
          || (denominatorVariables.isEmpty()
              && (denominatorScalar.isEqualTo(1) || denominatorScalar.isEqualTo(-1)))) {
        continue;
      }
      if (!evaluateOp(IR.mod(newScalar, denominatorScalar)).isEqualTo(0)) {
        continue;
      }
      List<Expr> rest = new ArrayList<>(components);
      rest.remove(i);
      if (!removeComponents(rest, denominatorVariables)) {
        continue;
      }
      rest.add(IR.roundOff(div.getLhs(), denominator));
      newScalar = ExprUtil.div(newScalar, denominatorScalar);
      components = rest;
      changed = true;
      // Start over, the remaining components moved.
      i = -1;
    }
    if (!changed) {
      return term;
    }
    Term result = Term.create(hasher, newScalar, components);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Matched round-off idiom: " + term + " to " + result);
    }
    return result;
  }

  /**
   * Removes one structurally equal occurrence of each of {@code toRemove}.
   * Returns false if one is missing.
   */
  private boolean removeComponents(List<Expr> components, List<Expr> toRemove) {
    for (Expr e : toRemove) {
      ExprHash hash = hasher.hash(e);
      boolean found = false;
      for (int i = 0; i < components.size(); i++) {
        if (hasher.hash(components.get(i)).equals(hash)) {
          components.remove(i);
          found = true;
          break;
        }
      }
      if (!found) {
        return false;
      }
    }
    return true;
  }

  /**
   * Rewrites {@code k * a - k * (a % c)} within a sum as {@code k * (a / c) *
   * c}, c a constant. The sum must hold every term of {@code k * a}; a
   * constant part of {@code a} is taken from the sum's scalar. Returns the new
   * scalar.
   */
  private Immediate combineRoundOffs(Immediate scalar, Map<ExprHash, Term> terms) {
    for (Term term : ImmutableList.copyOf(terms.values())) {
      if (terms.get(term.hashVars()) != term || term.getVariables().size() != 1) {
        continue;
      }
      Expr mod = term.getVariables().get(0);
      if (mod.getKind() != ExprKind.MOD) {
        continue;
      }
      Expr dividend = ((BinaryOp) mod).getLhs();
      Expr divisor = ((BinaryOp) mod).getRhs();
      Immediate divisorValue = asScalarConstant(divisor);
      if (divisorValue == null || divisorValue.isEqualTo(0)) {
        continue;
      }

      Immediate multiple = ExprUtil.negate(term.getScalar());
      Immediate dividendScalar;
      List<Term> dividendTerms;
      if (dividend instanceof Polynomial) {
        dividendScalar = ((Polynomial) dividend).getScalar();
        dividendTerms = ((Polynomial) dividend).getTerms();
      } else {
        dividendScalar = Immediate.of(dividend.getDtype().getScalarType(), 0);
        dividendTerms = ImmutableList.of(asTerm(dividend));
      }
      if (!containsScaled(terms, dividendTerms, multiple)) {
        continue;
      }

      terms.remove(term.hashVars());
      for (Term dividendTerm : dividendTerms) {
        terms.remove(dividendTerm.hashVars());
      }
      scalar = ExprUtil.add(scalar, ExprUtil.negate(ExprUtil.mul(dividendScalar, multiple)));
      // Folded as a product so the division is in canonical form.
      Expr roundOff = IR.mul(IR.div(dividend, divisor), divisor).accept(this);
      if (!multiple.isEqualTo(1)) {
        roundOff = multiplyByScalar(roundOff, multiple, roundOff.getDtype());
      }
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Matched round-off idiom: " + mod + " to " + roundOff);
      }
      Immediate roundOffScalar =
          collectTerms(roundOff, asScalarConstant(roundOff), false, scalar.getScalarType(), terms);
      scalar = ExprUtil.add(scalar, roundOffScalar);
    }
    return scalar;
  }

  /** Whether {@code terms} holds each of {@code expected}, scaled by {@code multiple}. */
  private static boolean containsScaled(
      Map<ExprHash, Term> terms, List<Term> expected, Immediate multiple) {
    for (Term term : expected) {
      Term present = terms.get(term.hashVars());
      if (present == null) {
        return false;
      }
      Immediate scaled = ExprUtil.mul(term.getScalar(), multiple);
      if (present.getScalar().asLong() != scaled.asLong()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public Expr visitMul(BinaryOp n) {
    Expr lhs = n.getLhs().accept(this);
    Expr rhs = n.getRhs().accept(this);

    if (lhs.isConstant() && rhs.isConstant()) {
      return evaluateOp(rebuild(n, lhs, rhs));
    }

    if (foldMultilanePrimitives && isMultilanePrimitive(lhs) && isMultilanePrimitive(rhs)) {
      Expr combined = MultilaneFolding.multiply(lhs, rhs);
      if (combined != null) {
        return combined.accept(this);
      }
    }

    Dtype dtype = n.getDtype();
    lhs = widen(lhs, dtype);
    rhs = widen(rhs, dtype);
    Immediate scalar = asScalarConstant(lhs);
    Expr variable = rhs;
    if (scalar == null) {
      scalar = asScalarConstant(rhs);
      variable = lhs;
    }
    if (scalar != null) {
      if (scalar.isEqualTo(1)) {
        return castIfNeeded(variable, dtype);
      }
      if (scalar.isEqualTo(0)) {
        return constantOf(dtype, 0);
      }
      return castIfNeeded(multiplyByScalar(variable, scalar, dtype), dtype);
    }
    return castIfNeeded(multiply(lhs, rhs, dtype), dtype);
  }

  private Expr multiplyByScalar(Expr e, Immediate scalar, Dtype dtype) {
    if (e instanceof Polynomial) {
      Polynomial poly = (Polynomial) e;
      Map<ExprHash, Term> terms = new LinkedHashMap<>();
      for (Term term : poly.getTerms()) {
        addScaledTerm(terms, term, scalar);
      }
      return finishPolynomial(ExprUtil.mul(poly.getScalar(), scalar), terms, dtype);
    }
    if (e instanceof Term) {
      Term term = (Term) e;
      Immediate product = ExprUtil.mul(term.getScalar(), scalar);
      if (product.isEqualTo(0)) {
        return constantOf(dtype, 0);
      }
      return makeTerm(product, term.getVariables());
    }
    return makeTerm(scalar, ImmutableList.of(e));
  }

  /** Multiplies two operands, neither of which is a constant. */
  private Expr multiply(Expr lhs, Expr rhs, Dtype dtype) {
    boolean lhsPoly = lhs instanceof Polynomial;
    boolean rhsPoly = rhs instanceof Polynomial;
    if (lhsPoly && rhsPoly) {
      return multiplyPolynomials((Polynomial) lhs, (Polynomial) rhs, dtype);
    }
    if (lhsPoly) {
      return polyByTerm((Polynomial) lhs, asTerm(rhs), dtype);
    }
    if (rhsPoly) {
      return polyByTerm((Polynomial) rhs, asTerm(lhs), dtype);
    }

    if (lhs instanceof Term && rhs instanceof Term) {
      Term product = mulTerms((Term) lhs, (Term) rhs);
      return product == null ? constantOf(dtype, 0) : product;
    }
    if (lhs instanceof Term) {
      return insertIntoTerm((Term) lhs, rhs);
    }
    if (rhs instanceof Term) {
      return insertIntoTerm((Term) rhs, lhs);
    }
    return makeTerm(Immediate.of(dtype.getScalarType(), 1), ImmutableList.of(lhs, rhs));
  }

  /**
   * Multiplies two terms: the scalars are multiplied and the variable lists
   * concatenated. Returns null if the product's scalar is zero.
   */
  private @Nullable Term mulTerms(Term lhs, Term rhs) {
    Immediate scalar = ExprUtil.mul(lhs.getScalar(), rhs.getScalar());
    if (scalar.isEqualTo(0)) {
      return null;
    }
    List<Expr> variables = new ArrayList<>(lhs.getVariables());
    variables.addAll(rhs.getVariables());
    return makeTerm(scalar, variables);
  }

  /** Distributes {@code term} over every term and the scalar of {@code poly}. */
  private Expr polyByTerm(Polynomial poly, Term term, Dtype dtype) {
    Map<ExprHash, Term> terms = new LinkedHashMap<>();
    for (Term polyTerm : poly.getTerms()) {
      Term product = mulTerms(polyTerm, term);
      if (product != null) {
        addOrUpdateTerm(terms, product);
      }
    }
    addScaledTerm(terms, term, poly.getScalar());
    return finishPolynomial(Immediate.of(dtype.getScalarType(), 0), terms, dtype);
  }

  /** Multiplies out every pair of terms, as well as the terms by the other scalar. */
  private Expr multiplyPolynomials(Polynomial lhs, Polynomial rhs, Dtype dtype) {
    Map<ExprHash, Term> terms = new LinkedHashMap<>();
    for (Term lhsTerm : lhs.getTerms()) {
      for (Term rhsTerm : rhs.getTerms()) {
        Term product = mulTerms(lhsTerm, rhsTerm);
        if (product != null) {
          addOrUpdateTerm(terms, product);
        }
      }
    }
    for (Term lhsTerm : lhs.getTerms()) {
      addScaledTerm(terms, lhsTerm, rhs.getScalar());
    }
    for (Term rhsTerm : rhs.getTerms()) {
      addScaledTerm(terms, rhsTerm, lhs.getScalar());
    }
    return finishPolynomial(ExprUtil.mul(lhs.getScalar(), rhs.getScalar()), terms, dtype);
  }

  private void addScaledTerm(Map<ExprHash, Term> terms, Term term, Immediate scalar) {
    Immediate product = ExprUtil.mul(term.getScalar(), scalar);
    if (!product.isEqualTo(0)) {
      addOrUpdateTerm(terms, makeTerm(product, term.getVariables()));
    }
  }

  /** Adds {@code e} to the variables of {@code term}. */
  private Expr insertIntoTerm(Term term, Expr e) {
    List<Expr> variables = new ArrayList<>(term.getVariables());
    variables.add(e);
    return makeTerm(term.getScalar(), variables);
  }

  @Override
  public Expr visitDiv(BinaryOp n) {
    Expr lhs = n.getLhs().accept(this);
    Expr rhs = n.getRhs().accept(this);

    if (lhs.isConstant() && rhs.isConstant()) {
      if (isIntegralZero(rhs)) {
        return rebuild(n, lhs, rhs);
      }
      return evaluateOp(rebuild(n, lhs, rhs));
    }

    Dtype dtype = n.getDtype();
    Immediate denominator = asScalarConstant(rhs);
    if (denominator != null && denominator.isEqualTo(1)) {
      return castIfNeeded(lhs, dtype);
    }

    // Division does not distribute over addition, so only common scalar
    // factors are removed.
    if (dtype.isIntegral()) {
      lhs = widen(lhs, dtype);
      rhs = widen(rhs, dtype);
      Immediate numerator = asScalarConstant(lhs);
      if (numerator != null && numerator.isEqualTo(0)) {
        return constantOf(dtype, 0);
      }
      Expr factorized = factorizeDivision(lhs, rhs);
      if (factorized != null) {
        return factorized.accept(this);
      }
    }
    return rebuild(n, lhs, rhs);
  }

  /**
   * Divides the numerator and the denominator by the greatest common divisor
   * of their scalars, e.g. {@code (6 * x) / 4} to {@code (3 * x) / 2}.
   * Returns null when there is no common factor greater than one.
   */
  private @Nullable Expr factorizeDivision(Expr lhs, Expr rhs) {
    Immediate denominator = rhs instanceof Term ? ((Term) rhs).getScalar() : asScalarConstant(rhs);
    if (denominator == null || denominator.isEqualTo(0)) {
      return null;
    }
    long gcd;
    if (lhs instanceof Polynomial) {
      Polynomial poly = (Polynomial) lhs;
      gcd = ExprUtil.gcd(poly.getScalar().asLong(), denominator.asLong());
      for (Term term : poly.getTerms()) {
        gcd = ExprUtil.gcd(gcd, term.getScalar().asLong());
      }
    } else if (lhs instanceof Term) {
      gcd = ExprUtil.gcd(((Term) lhs).getScalar().asLong(), denominator.asLong());
    } else {
      Immediate numerator = asScalarConstant(lhs);
      if (numerator == null) {
        return null;
      }
      gcd = ExprUtil.gcd(numerator.asLong(), denominator.asLong());
    }
    if (gcd <= 1) {
      return null;
    }
    return IR.div(divideScalars(lhs, gcd), divideScalars(rhs, gcd));
  }

  /** Divides every scalar of {@code e} by {@code divisor}, which divides them exactly. */
  private Expr divideScalars(Expr e, long divisor) {
    if (e instanceof Polynomial) {
      Polynomial poly = (Polynomial) e;
      List<Term> terms = new ArrayList<>();
      for (Term term : poly.getTerms()) {
        terms.add(divideScalar(term, divisor));
      }
      return Polynomial.create(hasher, divideScalar(poly.getScalar(), divisor), terms);
    }
    if (e instanceof Term) {
      return divideScalar((Term) e, divisor);
    }
    Immediate constant = checkNotNull(asScalarConstant(e));
    Immediate quotient = divideScalar(constant, divisor);
    return e instanceof Broadcast ? IR.broadcast(quotient, e.getDtype().getLanes()) : quotient;
  }

  private Term divideScalar(Term term, long divisor) {
    return Term.create(hasher, divideScalar(term.getScalar(), divisor), term.getVariables());
  }

  private static Immediate divideScalar(Immediate value, long divisor) {
    return ExprUtil.div(value, Immediate.of(value.getScalarType(), divisor));
  }

  /**
   * Mod, the bitwise operators, Max, Min and RoundOff: rebuilt only if an
   * operand changed, and evaluated if both operands are now constant.
   */
  @Override
  protected Expr visitBinaryOp(BinaryOp n) {
    Expr lhs = n.getLhs().accept(this);
    Expr rhs = n.getRhs().accept(this);
    Expr node = rebuild(n, lhs, rhs);
    if (!lhs.isConstant() || !rhs.isConstant()) {
      return node;
    }
    if ((n.getKind() == ExprKind.MOD || n.getKind() == ExprKind.ROUND_OFF) && isIntegralZero(rhs)) {
      return node;
    }
    return evaluateOp(node);
  }

  @Override
  public Expr visitCompareSelect(CompareSelect n) {
    Expr node = super.visitCompareSelect(n);
    for (Expr child : node.getChildren()) {
      if (!child.isConstant()) {
        return node;
      }
    }
    return evaluateOp(node);
  }

  @Override
  public Expr visitCast(Cast n) {
    Expr operand = n.getOperand().accept(this);
    if (operand.isConstant()) {
      return evaluateOp(IR.cast(n.getDtype(), operand));
    }
    if (operand.getDtype().equals(n.getDtype())) {
      return operand;
    }
    return operand == n.getOperand() ? n : IR.cast(n.getDtype(), operand);
  }

  @Override
  public Expr visitIntrinsics(Intrinsics n) {
    Expr node = super.visitIntrinsics(n);
    if (!n.isPure()) {
      return node;
    }
    for (Expr param : node.getChildren()) {
      if (!param.isConstant()) {
        return node;
      }
    }
    return evaluateOp(node);
  }

  /**
   * Casts a folded sum or product computed in a narrower type than {@code
   * dtype} to that type. The narrow arithmetic may wrap, so the cast keeps it
   * as a single component rather than redistributing it in the wider type. A
   * lone unit term does no arithmetic of its own and is left alone.
   */
  private static Expr widen(Expr e, Dtype dtype) {
    if (!(e instanceof Term || e instanceof Polynomial)
        || e.getDtype().getScalarType() == dtype.getScalarType()) {
      return e;
    }
    if (e instanceof Term) {
      Term term = (Term) e;
      if (term.getScalar().isEqualTo(1) && term.getVariables().size() == 1) {
        return e;
      }
    }
    return IR.cast(Dtype.of(dtype.getScalarType(), e.getDtype().getLanes()), e);
  }

  /** Returns {@code n} if its operands are unchanged, otherwise a copy over the new operands. */
  private static Expr rebuild(BinaryOp n, Expr lhs, Expr rhs) {
    if (lhs == n.getLhs() && rhs == n.getRhs()) {
      return n;
    }
    return IR.binaryOp(n.getKind(), lhs, rhs, n.propagatesNans());
  }
}
