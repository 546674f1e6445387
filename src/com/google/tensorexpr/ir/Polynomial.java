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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * A sum of a constant scalar and one or more {@link Term}s, e.g. {@code 2 * x
 * + y + 5}. Terms are kept sorted by structural hash.
 */
public final class Polynomial extends Expr {

  private final HashProvider hasher;
  private final Immediate scalar;
  private final ImmutableList<Term> terms;
  private final ExprHash termsHash;

  private Polynomial(HashProvider hasher, Immediate scalar, ImmutableList<Term> terms) {
    super(ExprKind.POLYNOMIAL, TypePromotion.promoteWithScalar(scalar, terms));
    this.hasher = hasher;
    this.scalar = scalar;
    this.terms = terms;
    this.termsHash = hasher.hashCombine(Lists.transform(terms, hasher::hash));
  }

  public static Polynomial create(HashProvider hasher, Immediate scalar, Term... terms) {
    return create(hasher, scalar, Arrays.asList(terms));
  }

  /**
   * Creates a polynomial, sorting {@code terms} into canonical order.
   *
   * @throws MalformedInputException if {@code terms} is empty
   */
  public static Polynomial create(HashProvider hasher, Immediate scalar, List<Term> terms) {
    checkNotNull(hasher);
    checkNotNull(scalar);
    if (terms.isEmpty()) {
      throw new MalformedInputException("polynomial " + scalar + " has no terms");
    }
    return new Polynomial(
        hasher, scalar, ImmutableList.sortedCopyOf(Comparator.comparing(hasher::hash), terms));
  }

  /** Creates a polynomial with a zero scalar of the promoted type of {@code terms}. */
  public static Polynomial create(HashProvider hasher, List<Term> terms) {
    Dtype type = TypePromotion.promoteAll(terms);
    return create(hasher, Immediate.of(type.getScalarType(), 0), terms);
  }

  /** Creates a polynomial from terms keyed by their {@link Term#hashVars() variable hash}. */
  public static Polynomial fromMap(
      HashProvider hasher, Immediate scalar, Map<ExprHash, Term> termsByVariables) {
    return create(hasher, scalar, ImmutableList.copyOf(termsByVariables.values()));
  }

  public Immediate getScalar() {
    return scalar;
  }

  /** The terms, in canonical order. */
  public ImmutableList<Term> getTerms() {
    return terms;
  }

  public HashProvider getHasher() {
    return hasher;
  }

  /** A hash of the terms alone, excluding the scalar. */
  public ExprHash hashVars() {
    return termsHash;
  }

  @Override
  public ImmutableList<Expr> getChildren() {
    return ImmutableList.<Expr>builder().add(scalar).addAll(terms).build();
  }

  @Override
  public Expr accept(IrMutator mutator) {
    return mutator.visitPolynomial(this);
  }

  @Override
  boolean isEquivalentShallow(Expr other) {
    return true;
  }
}
