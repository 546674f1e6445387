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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Computes the value of an expression for a binding of its variables. Values
 * are computed lane by lane; each lane of a vector expression is a separate
 * {@link Immediate}.
 *
 * <p>Integral arithmetic wraps to the width of the result type and divides
 * with truncation toward zero.
 */
public final class ExprEvaluator {

  private static final ExprEvaluator CONSTANT_EVALUATOR = builder().build();

  private final ImmutableMap<String, ImmutableList<Immediate>> bindings;
  private final Random random;

  private ExprEvaluator(ImmutableMap<String, ImmutableList<Immediate>> bindings, Random random) {
    this.bindings = bindings;
    this.random = random;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Evaluates an expression with no variables, such as an operator over two immediates. */
  public static Immediate evaluateConstant(Expr e) {
    return CONSTANT_EVALUATOR.evaluateScalar(e);
  }

  /** Evaluates every lane of {@code e}. */
  public ImmutableList<Immediate> evaluate(Expr e) {
    ImmutableList.Builder<Immediate> lanes = ImmutableList.builder();
    for (int lane = 0; lane < e.getDtype().getLanes(); lane++) {
      lanes.add(evaluateLane(e, lane));
    }
    return lanes.build();
  }

  /** Evaluates a one lane expression. */
  public Immediate evaluateScalar(Expr e) {
    checkArgument(e.getDtype().getLanes() == 1, "not a scalar: %s", e);
    return evaluateLane(e, 0);
  }

  private Immediate evaluateLane(Expr e, int lane) {
    ScalarType type = e.getDtype().getScalarType();
    switch (e.getKind()) {
      case IMMEDIATE:
        return (Immediate) e;
      case VAR:
        {
          ImmutableList<Immediate> values = bindings.get(((Var) e).getName());
          checkArgument(values != null, "unbound variable %s", e);
          return values.size() == 1 ? values.get(0) : values.get(lane);
        }
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case MOD:
      case MAX:
      case MIN:
      case AND:
      case OR:
      case XOR:
      case LSHIFT:
      case RSHIFT:
      case ROUND_OFF:
        {
          BinaryOp op = (BinaryOp) e;
          Immediate lhs = evaluateLane(op.getLhs(), lane).castTo(type);
          Immediate rhs = evaluateLane(op.getRhs(), lane).castTo(type);
          return arithmetic(e.getKind(), type, lhs, rhs, op.propagatesNans());
        }
      case COMPARE_SELECT:
        {
          CompareSelect select = (CompareSelect) e;
          ScalarType compareType =
              ScalarType.promote(
                  select.getLhs().getDtype().getScalarType(),
                  select.getRhs().getDtype().getScalarType());
          Immediate lhs = evaluateLane(select.getLhs(), lane).castTo(compareType);
          Immediate rhs = evaluateLane(select.getRhs(), lane).castTo(compareType);
          int comparison =
              compareType.isFloatingPoint()
                  ? Double.compare(lhs.asDouble(), rhs.asDouble())
                  : Long.compare(lhs.asLong(), rhs.asLong());
          Expr chosen =
              select.getCompareOp().test(comparison) ? select.getIfTrue() : select.getIfFalse();
          return evaluateLane(chosen, lane).castTo(type);
        }
      case CAST:
        return evaluateLane(((Cast) e).getOperand(), lane).castTo(type);
      case BROADCAST:
        return evaluateLane(((Broadcast) e).getValue(), 0).castTo(type);
      case RAMP:
        {
          Ramp ramp = (Ramp) e;
          Immediate base = evaluateLane(ramp.getBase(), 0).castTo(type);
          Immediate stride = evaluateLane(ramp.getStride(), 0).castTo(type);
          Immediate offset =
              arithmetic(ExprKind.MUL, type, stride, Immediate.of(type, lane), false);
          return arithmetic(ExprKind.ADD, type, base, offset, false);
        }
      case INTRINSICS:
        return intrinsic((Intrinsics) e, type, lane);
      case TERM:
        {
          Term term = (Term) e;
          Immediate product = term.getScalar().castTo(type);
          for (Expr variable : term.getVariables()) {
            Immediate value = evaluateLane(variable, lane).castTo(type);
            product = arithmetic(ExprKind.MUL, type, product, value, false);
          }
          return product;
        }
      case POLYNOMIAL:
        {
          Polynomial polynomial = (Polynomial) e;
          Immediate sum = polynomial.getScalar().castTo(type);
          for (Term term : polynomial.getTerms()) {
            Immediate value = evaluateLane(term, lane).castTo(type);
            sum = arithmetic(ExprKind.ADD, type, sum, value, false);
          }
          return sum;
        }
    }
    throw new IllegalStateException("unexpected expression " + e.getKind());
  }

  private Immediate intrinsic(Intrinsics e, ScalarType type, int lane) {
    if (e.getOp() == IntrinsicOp.RAND) {
      return Immediate.of(type, random.nextDouble());
    }
    ImmutableList<Expr> params = e.getParams();
    if (type.isIntegral() && e.getOp() == IntrinsicOp.ABS) {
      return Immediate.of(type, Math.abs(evaluateLane(params.get(0), lane).asLong()));
    }
    double[] args = new double[params.size()];
    for (int i = 0; i < args.length; i++) {
      args[i] = evaluateLane(params.get(i), lane).asDouble();
    }
    return Immediate.of(type, e.getOp().apply(args));
  }

  private static Immediate arithmetic(
      ExprKind kind, ScalarType type, Immediate lhs, Immediate rhs, boolean propagateNans) {
    if (type.isFloatingPoint()) {
      double x = lhs.asDouble();
      double y = rhs.asDouble();
      switch (kind) {
        case ADD:
          return Immediate.of(type, x + y);
        case SUB:
          return Immediate.of(type, x - y);
        case MUL:
          return Immediate.of(type, x * y);
        case DIV:
          return Immediate.of(type, x / y);
        case MOD:
          return Immediate.of(type, x % y);
        case ROUND_OFF:
          return Immediate.of(type, (x / y) * y);
        case MAX:
          return Immediate.of(type, maxOrMin(x, y, true, propagateNans));
        case MIN:
          return Immediate.of(type, maxOrMin(x, y, false, propagateNans));
        default:
          throw new IllegalStateException(kind + " is not defined for " + type);
      }
    }
    long x = lhs.asLong();
    long y = rhs.asLong();
    switch (kind) {
      case ADD:
        return Immediate.of(type, x + y);
      case SUB:
        return Immediate.of(type, x - y);
      case MUL:
        return Immediate.of(type, x * y);
      case DIV:
        checkDivisor(y);
        return Immediate.of(type, x / y);
      case MOD:
        checkDivisor(y);
        return Immediate.of(type, x % y);
      case ROUND_OFF:
        checkDivisor(y);
        return Immediate.of(type, (x / y) * y);
      case MAX:
        return Immediate.of(type, Math.max(x, y));
      case MIN:
        return Immediate.of(type, Math.min(x, y));
      case AND:
        return Immediate.of(type, x & y);
      case OR:
        return Immediate.of(type, x | y);
      case XOR:
        return Immediate.of(type, x ^ y);
      case LSHIFT:
        return Immediate.of(type, x << y);
      case RSHIFT:
        return Immediate.of(type, x >> y);
      default:
        throw new IllegalStateException(kind + " is not a binary operator");
    }
  }

  /**
   * Without NaN propagation a NaN operand is ignored and the other operand is
   * selected.
   */
  private static double maxOrMin(double x, double y, boolean max, boolean propagateNans) {
    if (Double.isNaN(x) || Double.isNaN(y)) {
      if (propagateNans) {
        return Double.NaN;
      }
      return Double.isNaN(x) ? y : x;
    }
    return max ? Math.max(x, y) : Math.min(x, y);
  }

  private static void checkDivisor(long divisor) {
    if (divisor == 0) {
      throw new ArithmeticException("integer division by zero");
    }
  }

  /** Binds variables to values for an {@link ExprEvaluator}. */
  public static final class Builder {
    private final Map<String, ImmutableList<Immediate>> bindings = new LinkedHashMap<>();
    private Random random = new Random();

    private Builder() {}

    /** Binds {@code var} to one value per lane, or to one value for all lanes. */
    @CanIgnoreReturnValue
    public Builder bind(Var var, long... values) {
      ImmutableList.Builder<Immediate> immediates = ImmutableList.builder();
      for (long value : values) {
        immediates.add(Immediate.of(var.getDtype().getScalarType(), value));
      }
      return bind(var, immediates.build());
    }

    /** Binds {@code var} to one value per lane, or to one value for all lanes. */
    @CanIgnoreReturnValue
    public Builder bind(Var var, double... values) {
      ImmutableList.Builder<Immediate> immediates = ImmutableList.builder();
      for (double value : values) {
        immediates.add(Immediate.of(var.getDtype().getScalarType(), value));
      }
      return bind(var, immediates.build());
    }

    private Builder bind(Var var, ImmutableList<Immediate> values) {
      checkArgument(
          values.size() == 1 || values.size() == var.getDtype().getLanes(),
          "%s has %s lanes, got %s values",
          var,
          var.getDtype().getLanes(),
          values.size());
      bindings.put(var.getName(), values);
      return this;
    }

    /** Sets the source of values for {@link IntrinsicOp#RAND}. */
    @CanIgnoreReturnValue
    public Builder setRandom(Random random) {
      this.random = checkNotNull(random);
      return this;
    }

    public ExprEvaluator build() {
      return new ExprEvaluator(ImmutableMap.copyOf(bindings), random);
    }
  }
}
