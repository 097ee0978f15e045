package com.verlumen.formuladiscovery.formula;

import com.google.common.collect.ImmutableList;
import java.util.Locale;

/** A numeric literal. */
public record Constant(double value) implements Node {
  public static Constant of(double value) {
    return new Constant(value);
  }

  @Override
  public double evaluate(VariableSource variables) {
    return value;
  }

  @Override
  public Constant copy() {
    return new Constant(value);
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public String toString() {
    return format(value);
  }

  /**
   * Integral values print without a fractional part ({@code 2}, {@code -3}); everything else
   * prints with six decimals.
   */
  static String format(double value) {
    if (value == Math.rint(value)) {
      String text = String.format(Locale.ROOT, "%.10f", value);
      if (text.indexOf('.') < 0) {
        return text;
      }
      text = text.replaceAll("0+$", "");
      return text.endsWith(".") ? text.substring(0, text.length() - 1) : text;
    }
    return String.format(Locale.ROOT, "%.6f", value);
  }
}
