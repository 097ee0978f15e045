package com.verlumen.formuladiscovery.evolution;

import com.google.inject.AbstractModule;

public class EvolutionModule extends AbstractModule {
  public static EvolutionModule create() {
    return new EvolutionModule();
  }

  @Override
  protected void configure() {
    bind(EvolutionEngine.class).to(EvolutionEngineImpl.class);
    bind(FitnessCalculator.class).to(FitnessCalculatorImpl.class);
    bind(FormulaGenerator.class).to(FormulaGeneratorImpl.class);
    bind(GeneticOperators.class).to(GeneticOperatorsImpl.class);
    bind(Selection.class).to(SelectionImpl.class);
  }

  private EvolutionModule() {}
}
