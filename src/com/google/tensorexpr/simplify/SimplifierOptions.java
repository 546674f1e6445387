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

import java.io.Serializable;

/**
 * Options for {@link IrSimplifier}. The passes read the options once, when
 * they are created, so changing an options object does not affect a
 * simplification already in progress.
 */
public class SimplifierOptions implements Serializable {

  private static final long serialVersionUID = 1L;

  private boolean factorizePolynomials = true;

  private boolean detectRoundOff = true;

  private boolean foldMultilanePrimitives = true;

  private boolean verifyHashMerges = false;

  public SimplifierOptions() {}

  /** Factor the greatest common divisor out of a polynomial's coefficients on expansion. */
  public void setFactorizePolynomials(boolean factorizePolynomials) {
    this.factorizePolynomials = factorizePolynomials;
  }

  public boolean getFactorizePolynomials() {
    return factorizePolynomials;
  }

  /** Recognize {@code x - x % c} and {@code (x / c) * c} as a {@code RoundOff}. */
  public void setDetectRoundOff(boolean detectRoundOff) {
    this.detectRoundOff = detectRoundOff;
  }

  public boolean getDetectRoundOff() {
    return detectRoundOff;
  }

  /** Combine arithmetic over Broadcast and Ramp vectors into a single vector node. */
  public void setFoldMultilanePrimitives(boolean foldMultilanePrimitives) {
    this.foldMultilanePrimitives = foldMultilanePrimitives;
  }

  public boolean getFoldMultilanePrimitives() {
    return foldMultilanePrimitives;
  }

  /**
   * When terms are combined because their variable hashes match, also compare
   * the variables structurally and fail on a mismatch. Off by default: a
   * 64-bit hash collision between distinct variable sets is not expected in
   * practice, and the comparison costs a tree walk per merge.
   */
  public void setVerifyHashMerges(boolean verifyHashMerges) {
    this.verifyHashMerges = verifyHashMerges;
  }

  public boolean getVerifyHashMerges() {
    return verifyHashMerges;
  }
}
