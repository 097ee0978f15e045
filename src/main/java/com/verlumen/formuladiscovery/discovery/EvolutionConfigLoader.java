package com.verlumen.formuladiscovery.discovery;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.verlumen.formuladiscovery.evolution.EvolutionConfig;
import com.verlumen.formuladiscovery.evolution.FitnessType;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link EvolutionConfig} overrides from JSON or YAML files.
 *
 * <p>Keys are snake_case property names, e.g. {@code population_size} or {@code fitness_type}.
 * Keys that are left out keep their default value; unknown keys are rejected.
 */
public final class EvolutionConfigLoader {
  private static final Gson GSON = new Gson();

  private EvolutionConfigLoader() {}

  /**
   * Loads a config from a file, auto-detecting format based on extension.
   *
   * @param path The path to the config file (.json or .yaml/.yml)
   * @return The loaded config
   */
  public static EvolutionConfig load(String path) {
    String content;
    try {
      content = Files.readString(Path.of(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load evolution config from: " + path, e);
    }
    return parse(content, path);
  }

  /** Loads a config from a classpath resource, auto-detecting format based on extension. */
  public static EvolutionConfig loadResource(String resourcePath) {
    String normalizedPath = resourcePath.startsWith("/") ? resourcePath : "/" + resourcePath;
    try (InputStream is = EvolutionConfigLoader.class.getResourceAsStream(normalizedPath)) {
      if (is == null) {
        throw new IllegalArgumentException("Resource not found: " + resourcePath);
      }
      return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8), resourcePath);
    } catch (IOException e) {
      throw new UncheckedIOException(
          "Failed to load evolution config from resource: " + resourcePath, e);
    }
  }

  public static EvolutionConfig parseJson(String jsonContent) {
    JsonElement root;
    try {
      root = JsonParser.parseString(jsonContent);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Evolution config is not valid JSON", e);
    }
    return fromJson(root);
  }

  public static EvolutionConfig parseYaml(String yamlContent) {
    Map<String, Object> yamlMap;
    try {
      yamlMap = new Yaml().load(yamlContent);
    } catch (YAMLException | ClassCastException e) {
      throw new IllegalArgumentException("Evolution config is not a valid YAML mapping", e);
    }
    return fromJson(GSON.toJsonTree(yamlMap));
  }

  private static EvolutionConfig parse(String content, String name) {
    String lowerName = name.toLowerCase(Locale.ROOT);
    if (lowerName.endsWith(".yaml") || lowerName.endsWith(".yml")) {
      return parseYaml(content);
    } else if (lowerName.endsWith(".json")) {
      return parseJson(content);
    } else {
      throw new IllegalArgumentException(
          "Unsupported file format. Use .json, .yaml, or .yml: " + name);
    }
  }

  private static EvolutionConfig fromJson(JsonElement root) {
    EvolutionConfig.Builder builder = EvolutionConfig.builder();
    // An empty document means no overrides.
    if (root == null || root.isJsonNull()) {
      return builder.build();
    }
    if (!root.isJsonObject()) {
      throw new IllegalArgumentException("Evolution config must be a mapping");
    }

    JsonObject object = root.getAsJsonObject();
    for (String key : object.keySet()) {
      JsonElement value = object.get(key);
      try {
        apply(builder, key, value);
      } catch (NumberFormatException
          | ArithmeticException
          | UnsupportedOperationException
          | IllegalStateException e) {
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
      }
    }
    return builder.build();
  }

  private static void apply(EvolutionConfig.Builder builder, String key, JsonElement value) {
    switch (key) {
      case "population_size" -> builder.setPopulationSize(intValue(value));
      case "max_generations" -> builder.setMaxGenerations(intValue(value));
      case "max_depth" -> builder.setMaxDepth(intValue(value));
      case "max_nodes" -> builder.setMaxNodes(intValue(value));
      case "mutation_rate" -> builder.setMutationRate(value.getAsDouble());
      case "crossover_rate" -> builder.setCrossoverRate(value.getAsDouble());
      case "tournament_size" -> builder.setTournamentSize(intValue(value));
      case "elitism_count" -> builder.setElitismCount(intValue(value));
      case "fitness_type" -> builder.setFitnessType(FitnessType.fromString(value.getAsString()));
      case "complexity_weight" -> builder.setComplexityWeight(value.getAsDouble());
      case "symmetric_mutation" -> builder.setSymmetricMutation(value.getAsBoolean());
      default -> throw new IllegalArgumentException("Unknown evolution config key: " + key);
    }
  }

  /** Rejects fractional and out-of-range values with {@link ArithmeticException}. */
  private static int intValue(JsonElement value) {
    return value.getAsBigDecimal().intValueExact();
  }
}
