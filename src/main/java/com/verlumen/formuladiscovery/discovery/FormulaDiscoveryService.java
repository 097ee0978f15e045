package com.verlumen.formuladiscovery.discovery;

import com.google.common.collect.ImmutableList;

/** Discovers formulas for a set of training examples, optionally one per market regime. */
public interface FormulaDiscoveryService {
  /**
   * Runs one evolution per requested regime range, or a single one when the request names no
   * ranges. Buckets with too few examples are skipped.
   */
  ImmutableList<DiscoveredFormula> discover(DiscoveryRequest request);
}
