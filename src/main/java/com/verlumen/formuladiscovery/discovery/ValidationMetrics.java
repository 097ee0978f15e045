package com.verlumen.formuladiscovery.discovery;

/**
 * Out-of-sample quality of a discovered formula, measured on the examples held back from
 * training.
 *
 * @param meanAbsoluteError mean absolute error on the validation examples
 * @param rootMeanSquaredError root mean squared error on the validation examples
 * @param spearmanCorrelation rank correlation of predictions with realized returns
 * @param trainingCount number of examples the formula was evolved on
 * @param validationCount number of held-back examples
 */
public record ValidationMetrics(
    double meanAbsoluteError,
    double rootMeanSquaredError,
    double spearmanCorrelation,
    int trainingCount,
    int validationCount) {}
