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

/**
 * Thrown when an IR construct is built from operands that cannot form a valid
 * node: a {@link Term} without variables, a {@link Polynomial} without terms,
 * type promotion over no operands, or operands whose lane counts disagree.
 *
 * <p>Raised during simplification it aborts the enclosing call; it is never
 * recovered from inside the simplifier.
 */
public class MalformedInputException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public MalformedInputException(String message) {
    super(message);
  }
}
