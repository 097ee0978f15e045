package com.verlumen.formuladiscovery.formula;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.stream.Stream;

/**
 * Operators available to formula trees.
 *
 * <p>Every operator is total: numeric edge cases degrade to fixed values instead of producing
 * errors.
 */
public enum Operator {
  ADD(Arity.BINARY, "+"),
  SUBTRACT(Arity.BINARY, "-"),
  MULTIPLY(Arity.BINARY, "*"),
  DIVIDE(Arity.BINARY, "/"),
  POWER(Arity.BINARY, "pow"),
  MAX(Arity.BINARY, "max"),
  MIN(Arity.BINARY, "min"),
  SQRT(Arity.UNARY, "sqrt"),
  LOG(Arity.UNARY, "log"),
  EXP(Arity.UNARY, "exp"),
  ABS(Arity.UNARY, "abs"),
  NEGATE(Arity.UNARY, "-");

  /** Denominators with a smaller magnitude are treated as zero. */
  static final double DIVISION_EPSILON = 1e-10;

  /** Bound applied to the exponent of {@link #EXP}. */
  static final double EXP_CLAMP = 10.0;

  /** Operators drawn when a random binary node is generated, in generation order. */
  public static final ImmutableList<Operator> BINARY_OPERATORS = ofArity(Arity.BINARY);

  /** Operators drawn when a random unary node is generated, in generation order. */
  public static final ImmutableList<Operator> UNARY_OPERATORS = ofArity(Arity.UNARY);

  enum Arity {
    UNARY,
    BINARY
  }

  private final Arity arity;
  private final String symbol;

  Operator(Arity arity, String symbol) {
    this.arity = arity;
    this.symbol = symbol;
  }

  public boolean isBinary() {
    return arity == Arity.BINARY;
  }

  /** The infix symbol or function name used when rendering this operator. */
  public String symbol() {
    return symbol;
  }

  /** True for the four arithmetic operators rendered in infix form. */
  boolean isInfix() {
    return this == ADD || this == SUBTRACT || this == MULTIPLY || this == DIVIDE;
  }

  /**
   * Applies this operator. For unary operators {@code right} is ignored.
   *
   * @param left the left operand, or the only operand of a unary operator
   * @param right the right operand of a binary operator
   */
  public double apply(double left, double right) {
    switch (this) {
      case ADD:
        return left + right;
      case SUBTRACT:
        return left - right;
      case MULTIPLY:
        return left * right;
      case DIVIDE:
        if (Math.abs(right) < DIVISION_EPSILON) {
          return 1.0;
        }
        return left / right;
      case POWER:
        if (left < 0 && right != Math.rint(right)) {
          return 0.0;
        }
        return Math.pow(left, right);
      case MAX:
        return Math.max(left, right);
      case MIN:
        return Math.min(left, right);
      case SQRT:
        return left < 0 ? 0.0 : Math.sqrt(left);
      case LOG:
        return left <= 0 ? 0.0 : Math.log(left);
      case EXP:
        return Math.exp(Math.max(-EXP_CLAMP, Math.min(EXP_CLAMP, left)));
      case ABS:
        return Math.abs(left);
      case NEGATE:
        return -left;
    }
    throw new AssertionError("Unhandled operator: " + this);
  }

  private static ImmutableList<Operator> ofArity(Arity arity) {
    return Stream.of(values()).filter(op -> op.arity == arity).collect(toImmutableList());
  }
}
