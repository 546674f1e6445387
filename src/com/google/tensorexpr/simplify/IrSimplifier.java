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

import com.google.tensorexpr.ir.Expr;
import com.google.tensorexpr.ir.Stmt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Simplifies expressions and statements to a canonical form. Simplification
 * runs in two stages: {@link PolynomialTransformer} folds the tree into terms
 * and polynomials, then {@link TermExpander} turns them back into plain
 * arithmetic.
 *
 * <p>The result is semantically equivalent to the input and is itself a
 * fixed point: simplifying it again returns a structurally equal tree. The
 * input is never modified.
 *
 * <p>Each call uses its own passes and hash cache, so concurrent calls on
 * different threads are safe.
 */
public final class IrSimplifier {

  private static final Logger logger = Logger.getLogger(IrSimplifier.class.getName());

  private IrSimplifier() {}

  public static Expr simplify(Expr e) {
    return simplify(e, new SimplifierOptions());
  }

  public static Expr simplify(Expr e, SimplifierOptions options) {
    checkNotNull(e);
    PolynomialTransformer simplifier = new PolynomialTransformer(options);
    Expr folded = e.accept(simplifier);
    // There may be terms left in the tree, expand them.
    Expr result = folded.accept(new TermExpander(simplifier, options));
    if (result != e && logger.isLoggable(Level.FINE)) {
      logger.fine("Simplified " + e + " to " + result);
    }
    return result;
  }

  public static Stmt simplify(Stmt s) {
    return simplify(s, new SimplifierOptions());
  }

  public static Stmt simplify(Stmt s, SimplifierOptions options) {
    checkNotNull(s);
    PolynomialTransformer simplifier = new PolynomialTransformer(options);
    Stmt folded = s.accept(simplifier);
    Stmt result = folded.accept(new TermExpander(simplifier, options));
    if (result != s && logger.isLoggable(Level.FINE)) {
      logger.fine("Simplified statement:\n" + result);
    }
    return result;
  }
}
