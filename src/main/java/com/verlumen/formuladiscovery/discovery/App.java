package com.verlumen.formuladiscovery.discovery;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.formuladiscovery.evolution.EvolutionConfig;
import com.verlumen.formuladiscovery.features.TrainingExample;
import com.verlumen.formuladiscovery.features.TrainingExampleReader;
import com.verlumen.formuladiscovery.regime.RegimeRange;
import com.verlumen.formuladiscovery.regime.RegimeSplitter;
import java.util.List;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Command line entry point. Reads training examples, runs discovery and prints the discovered
 * formulas as JSON to stdout.
 */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private final FormulaDiscoveryService discoveryService;

  @Inject
  App(FormulaDiscoveryService discoveryService) {
    this.discoveryService = discoveryService;
  }

  /** Runs discovery for {@code request} and renders the result as a JSON array. */
  String run(DiscoveryRequest request) {
    ImmutableList<DiscoveredFormula> formulas = discoveryService.discover(request);
    logger.atInfo().log("Discovery produced %d formula(s)", formulas.size());
    return GSON.toJson(toJson(formulas));
  }

  static JsonArray toJson(List<DiscoveredFormula> formulas) {
    JsonArray array = new JsonArray();
    for (DiscoveredFormula formula : formulas) {
      JsonObject object = new JsonObject();
      object.addProperty("formula_type", formula.formulaType().wireName());
      object.addProperty("security_type", formula.securityType().wireName());
      object.addProperty("expression", formula.expression());
      formula
          .regimeRange()
          .ifPresent(
              range -> {
                object.addProperty("regime", range.name());
                object.addProperty("regime_min", range.min());
                object.addProperty("regime_max", range.max());
              });
      object.addProperty("training_fitness", formula.trainingFitness());
      object.addProperty("complexity", formula.complexity());

      ValidationMetrics metrics = formula.validation();
      JsonObject validation = new JsonObject();
      validation.addProperty("mae", metrics.meanAbsoluteError());
      validation.addProperty("rmse", metrics.rootMeanSquaredError());
      validation.addProperty("spearman_correlation", metrics.spearmanCorrelation());
      validation.addProperty("training_count", metrics.trainingCount());
      validation.addProperty("validation_count", metrics.validationCount());
      object.add("validation", validation);
      array.add(object);
    }
    return array;
  }

  static DiscoveryRequest createRequest(Namespace namespace) {
    ImmutableList<TrainingExample> examples =
        TrainingExampleReader.readFile(namespace.getString("examples"));
    String configPath = namespace.getString("config");
    EvolutionConfig config =
        configPath == null ? EvolutionConfig.defaults() : EvolutionConfigLoader.load(configPath);
    ImmutableList<RegimeRange> ranges =
        namespace.getBoolean("allRegimes")
            ? RegimeSplitter.defaultRegimeRanges()
            : ImmutableList.of();

    return DiscoveryRequest.builder()
        .setFormulaType(FormulaType.fromString(namespace.getString("formulaType")))
        .setSecurityType(SecurityType.fromString(namespace.getString("securityType")))
        .setExamples(examples)
        .setRegimeRanges(ranges)
        .setEvolutionConfig(config)
        .setNormalize(namespace.getBoolean("normalize"))
        .build();
  }

  public static void main(String[] args) {
    ArgumentParser argumentParser = createArgumentParser();
    Namespace namespace;
    try {
      namespace = argumentParser.parseArgs(args);
    } catch (ArgumentParserException e) {
      argumentParser.handleError(e);
      System.exit(2);
      return;
    }

    Long seed = namespace.getLong("seed");
    DiscoveryModule module = seed == null ? DiscoveryModule.create() : DiscoveryModule.create(seed);
    App app = Guice.createInjector(module).getInstance(App.class);
    try {
      System.out.println(app.run(createRequest(namespace)));
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Formula discovery failed");
      System.exit(1);
    }
  }

  static ArgumentParser createArgumentParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("FormulaDiscovery")
            .build()
            .defaultHelp(true)
            .description("Discovers scoring and expected-return formulas from training examples");

    parser.addArgument("--examples")
      .required(true)
      .help("JSON file with training examples");

    parser.addArgument("--config")
      .help("YAML or JSON file with evolution settings");

    parser.addArgument("--formulaType")
      .choices("expected_return", "scoring")
      .setDefault("expected_return")
      .help("Kind of formula to discover");

    parser.addArgument("--securityType")
      .choices("stock", "etf")
      .setDefault("stock")
      .help("Security type the examples describe");

    parser.addArgument("--seed")
      .type(Long.class)
      .help("Seed for reproducible runs");

    parser.addArgument("--normalize")
      .action(Arguments.storeTrue())
      .help("Min-max normalize inputs before evolving");

    parser.addArgument("--allRegimes")
      .action(Arguments.storeTrue())
      .help("Discover one formula per default market regime");

    return parser;
  }
}
