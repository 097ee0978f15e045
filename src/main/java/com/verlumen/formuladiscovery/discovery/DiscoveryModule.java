package com.verlumen.formuladiscovery.discovery;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.verlumen.formuladiscovery.evolution.EvolutionModule;
import io.jenetics.util.RandomRegistry;
import java.util.OptionalLong;
import java.util.Random;
import java.util.random.RandomGenerator;

@AutoValue
public abstract class DiscoveryModule extends AbstractModule {
  public static DiscoveryModule create() {
    return new AutoValue_DiscoveryModule(OptionalLong.empty());
  }

  public static DiscoveryModule create(long seed) {
    return new AutoValue_DiscoveryModule(OptionalLong.of(seed));
  }

  abstract OptionalLong seed();

  @Override
  protected void configure() {
    install(EvolutionModule.create());
    bind(FormulaDiscoveryService.class).to(FormulaDiscoveryServiceImpl.class);
  }

  /** A fresh generator per run; seeded runs are reproducible regime by regime. */
  @Provides
  RandomGenerator provideRandomGenerator() {
    if (seed().isPresent()) {
      return new Random(seed().getAsLong());
    }
    return RandomRegistry.random();
  }
}
