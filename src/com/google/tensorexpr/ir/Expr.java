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

/**
 * An immutable expression node. Nodes are shared freely between trees; a
 * rewrite never changes a node but returns a new one in its place.
 */
public abstract class Expr {

  private final ExprKind kind;
  private final Dtype dtype;

  Expr(ExprKind kind, Dtype dtype) {
    this.kind = checkNotNull(kind);
    this.dtype = checkNotNull(dtype);
  }

  public final ExprKind getKind() {
    return kind;
  }

  public final Dtype getDtype() {
    return dtype;
  }

  /** Whether this node is a compile time constant. Only immediates are. */
  public boolean isConstant() {
    return false;
  }

  /** The operands of this node, in order. */
  public abstract ImmutableList<Expr> getChildren();

  /** Dispatches to the {@code visit} method of {@code mutator} for this kind of node. */
  public abstract Expr accept(IrMutator mutator);

  /**
   * Compares the attributes that are not children: kind, type and per-kind data
   * such as an immediate's value or a variable's name.
   */
  abstract boolean isEquivalentShallow(Expr other);

  /** Whether {@code other} is a structurally identical tree. */
  public final boolean isEquivalentTo(Expr other) {
    if (this == other) {
      return true;
    }
    if (other == null || kind != other.kind || !dtype.equals(other.dtype)) {
      return false;
    }
    if (!isEquivalentShallow(other)) {
      return false;
    }
    ImmutableList<Expr> children = getChildren();
    ImmutableList<Expr> otherChildren = other.getChildren();
    if (children.size() != otherChildren.size()) {
      return false;
    }
    for (int i = 0; i < children.size(); i++) {
      if (!children.get(i).isEquivalentTo(otherChildren.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return IrPrinter.print(this);
  }
}
