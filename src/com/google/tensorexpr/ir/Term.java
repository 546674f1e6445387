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

/**
 * A product of a constant scalar and one or more variable components, e.g.
 * {@code 3 * x * y}. Components are kept sorted by structural hash so two
 * terms over the same components always list them in the same order.
 *
 * <p>Repeated components stay repeated: {@code x * x} is a term with two
 * components, not an exponent.
 */
public final class Term extends Expr {

  private final HashProvider hasher;
  private final Immediate scalar;
  private final ImmutableList<Expr> variables;
  private final ExprHash variablesHash;

  private Term(HashProvider hasher, Immediate scalar, ImmutableList<Expr> variables) {
    super(ExprKind.TERM, TypePromotion.promoteWithScalar(scalar, variables));
    this.hasher = hasher;
    this.scalar = scalar;
    this.variables = variables;
    this.variablesHash = hasher.hashCombine(Lists.transform(variables, hasher::hash));
  }

  public static Term create(HashProvider hasher, Immediate scalar, Expr... variables) {
    return create(hasher, scalar, Arrays.asList(variables));
  }

  /**
   * Creates a term, sorting {@code variables} into canonical order.
   *
   * @throws MalformedInputException if {@code variables} is empty
   */
  public static Term create(HashProvider hasher, Immediate scalar, List<? extends Expr> variables) {
    checkNotNull(hasher);
    checkNotNull(scalar);
    if (variables.isEmpty()) {
      throw new MalformedInputException("term " + scalar + " has no variables");
    }
    return new Term(
        hasher, scalar, ImmutableList.sortedCopyOf(Comparator.comparing(hasher::hash), variables));
  }

  public Immediate getScalar() {
    return scalar;
  }

  /** The components, in canonical order. */
  public ImmutableList<Expr> getVariables() {
    return variables;
  }

  public HashProvider getHasher() {
    return hasher;
  }

  /**
   * A hash of the components alone. Terms with equal variable hashes differ
   * only in their scalar and can be added together.
   */
  public ExprHash hashVars() {
    return variablesHash;
  }

  @Override
  public ImmutableList<Expr> getChildren() {
    return ImmutableList.<Expr>builder().add(scalar).addAll(variables).build();
  }

  @Override
  public Expr accept(IrMutator mutator) {
    return mutator.visitTerm(this);
  }

  @Override
  boolean isEquivalentShallow(Expr other) {
    return true;
  }
}
