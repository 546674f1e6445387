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

import java.util.List;

/** Computes the type of nodes that combine many operands. */
public final class TypePromotion {

  private TypePromotion() {}

  /**
   * Promotes a constant scalar together with the components it multiplies or
   * is added to. The scalar is one lane wide, so it takes the lane count of the
   * components before promotion.
   */
  public static Dtype promoteWithScalar(Immediate scalar, List<? extends Expr> components) {
    Dtype type = scalar.getDtype();
    if (components.isEmpty()) {
      return type;
    }
    type = type.withLanes(components.get(0).getDtype().getLanes());
    for (Expr e : components) {
      type = Dtype.promote(type, e.getDtype());
    }
    return type;
  }

  /**
   * Promotes the types of all of {@code exprs}.
   *
   * @throws MalformedInputException if {@code exprs} is empty
   */
  public static Dtype promoteAll(List<? extends Expr> exprs) {
    if (exprs.isEmpty()) {
      throw new MalformedInputException("empty list of types");
    }
    Dtype type = exprs.get(0).getDtype();
    for (Expr e : exprs) {
      type = Dtype.promote(type, e.getDtype());
    }
    return type;
  }
}
