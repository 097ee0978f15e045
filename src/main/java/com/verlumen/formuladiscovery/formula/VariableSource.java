package com.verlumen.formuladiscovery.formula;

import com.verlumen.formuladiscovery.features.TrainingInputs;
import java.util.Map;

/** Supplies variable values during evaluation. */
@FunctionalInterface
public interface VariableSource {
  /** Returns the value bound to {@code variable}, or {@code 0.0} if there is none. */
  double valueOf(Variable variable);

  /** A source backed by a name-keyed map; missing names and null values read as {@code 0.0}. */
  static VariableSource fromMap(Map<String, Double> variables) {
    if (variables == null) {
      return variable -> 0.0;
    }
    return variable -> {
      Double value = variables.get(variable.name());
      return value == null ? 0.0 : value;
    };
  }

  /**
   * A source backed by training inputs through each variable's pre-bound feature. Unbound names
   * and absent optional metrics read as {@code 0.0}.
   */
  static VariableSource fromInputs(TrainingInputs inputs) {
    return variable ->
        variable.feature().isPresent() ? variable.feature().get().valueOf(inputs) : 0.0;
  }
}
