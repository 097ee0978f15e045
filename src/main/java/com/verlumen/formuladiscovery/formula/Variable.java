package com.verlumen.formuladiscovery.formula;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.verlumen.formuladiscovery.features.Feature;
import java.util.Optional;

/**
 * A reference to a named input. The name is resolved against {@link Feature} once, when the node
 * is built, so evaluation against {@code TrainingInputs} needs no name lookup.
 */
public record Variable(String name, Optional<Feature> feature) implements Node {
  public Variable {
    checkNotNull(name, "Variable name cannot be null");
    checkArgument(!name.isEmpty(), "Variable name cannot be empty");
    checkNotNull(feature);
  }

  public static Variable of(String name) {
    return new Variable(name, Feature.fromVariableName(name));
  }

  /** True when the name is one of the recognized feature names. */
  public boolean isBound() {
    return feature.isPresent();
  }

  @Override
  public double evaluate(VariableSource variables) {
    return variables.valueOf(this);
  }

  @Override
  public Variable copy() {
    return new Variable(name, feature);
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public String toString() {
    return name;
  }
}
