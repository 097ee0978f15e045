package com.verlumen.formuladiscovery.formula;

import com.verlumen.formuladiscovery.features.TrainingInputs;

/** An executable formula over training inputs. */
@FunctionalInterface
public interface FormulaFunction {
  double apply(TrainingInputs inputs);
}
