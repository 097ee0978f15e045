package com.verlumen.formuladiscovery.formula;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

/**
 * An operator applied to one or two operands. Binary operators always have both children; unary
 * operators only have {@code left}, and {@code right} is null.
 */
public record Operation(Operator operator, Node left, Node right) implements Node {
  public Operation {
    checkNotNull(operator, "Operator cannot be null");
    checkNotNull(left, "Left operand cannot be null");
    checkArgument(
        operator.isBinary() == (right != null),
        "Operator %s expects %s operand(s)",
        operator,
        operator.isBinary() ? 2 : 1);
  }

  public static Operation unary(Operator operator, Node operand) {
    return new Operation(operator, operand, null);
  }

  public static Operation binary(Operator operator, Node left, Node right) {
    return new Operation(operator, left, checkNotNull(right));
  }

  @Override
  public double evaluate(VariableSource variables) {
    double leftValue = left.evaluate(variables);
    if (right == null) {
      return operator.apply(leftValue, 0.0);
    }
    return operator.apply(leftValue, right.evaluate(variables));
  }

  @Override
  public Operation copy() {
    return new Operation(operator, left.copy(), right == null ? null : right.copy());
  }

  /** Returns an operation with the same children and a different operator of the same arity. */
  public Operation withOperator(Operator replacement) {
    return new Operation(replacement, left, right);
  }

  @Override
  public ImmutableList<Node> children() {
    return right == null ? ImmutableList.of(left) : ImmutableList.of(left, right);
  }

  @Override
  public String toString() {
    if (right == null) {
      return operator.symbol() + "(" + left + ")";
    }
    if (operator.isInfix()) {
      return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
    return operator.symbol() + "(" + left + ", " + right + ")";
  }
}
