package com.verlumen.formuladiscovery.features;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Reads training examples from JSON.
 *
 * <p>The document is an array of objects of the form:
 *
 * <pre>{@code
 * {"symbol": "AAPL", "date": "2023-01-31", "target_date": "2023-07-31",
 *  "target_return": 0.05, "inputs": {"cagr": 0.11, "regime": 0.2, "sharpe": 1.3}}
 * }</pre>
 *
 * <p>Inputs are keyed by formula variable name. Missing scores and metrics read as {@code 0.0};
 * missing optional metrics stay absent.
 */
public final class TrainingExampleReader {

  /** Reads examples from a JSON file. */
  public static ImmutableList<TrainingExample> readFile(String path) {
    try (Reader reader = Files.newBufferedReader(Path.of(path), StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read training examples from: " + path, e);
    }
  }

  /** Reads examples from a JSON document. */
  public static ImmutableList<TrainingExample> read(Reader reader) {
    JsonElement root;
    try {
      root = JsonParser.parseReader(reader);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Training examples are not valid JSON", e);
    }
    checkArgument(root.isJsonArray(), "Training examples must be a JSON array");

    JsonArray array = root.getAsJsonArray();
    ImmutableList.Builder<TrainingExample> examples = ImmutableList.builder();
    for (int i = 0; i < array.size(); i++) {
      JsonElement element = array.get(i);
      checkArgument(element.isJsonObject(), "Training example %s is not an object", i);
      try {
        examples.add(parseExample(element.getAsJsonObject()));
      } catch (RuntimeException e) {
        throw new IllegalArgumentException("Invalid training example at index " + i, e);
      }
    }
    return examples.build();
  }

  private static TrainingExample parseExample(JsonObject object) {
    String symbol = requiredMember(object, "symbol").getAsString();
    LocalDate date = parseDate(requiredMember(object, "date"));
    LocalDate targetDate = parseDate(requiredMember(object, "target_date"));
    double targetReturn = requiredMember(object, "target_return").getAsDouble();

    TrainingInputs.Builder inputs = TrainingInputs.builder();
    if (object.has("inputs")) {
      JsonObject inputObject = object.getAsJsonObject("inputs");
      for (String name : inputObject.keySet()) {
        JsonElement value = inputObject.get(name);
        if (value.isJsonNull()) {
          continue;
        }
        Feature feature =
            Feature.fromVariableName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown input: " + name));
        feature.set(inputs, value.getAsDouble());
      }
    }
    return TrainingExample.create(symbol, date, targetDate, inputs.build(), targetReturn);
  }

  private static JsonElement requiredMember(JsonObject object, String name) {
    JsonElement element = object.get(name);
    checkArgument(element != null && !element.isJsonNull(), "Missing field: %s", name);
    return element;
  }

  private static LocalDate parseDate(JsonElement element) {
    try {
      return LocalDate.parse(element.getAsString());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid date: " + element, e);
    }
  }

  private TrainingExampleReader() {}
}
