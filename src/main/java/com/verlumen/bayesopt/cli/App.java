package com.verlumen.bayesopt.cli;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.bayesopt.acquisition.ImpatienceRule;
import com.verlumen.bayesopt.checkpoint.CheckpointStore;
import com.verlumen.bayesopt.orchestration.OptimizationConfig;
import com.verlumen.bayesopt.orchestration.OptimizationModule;
import com.verlumen.bayesopt.orchestration.OptimizationOrchestrator;
import com.verlumen.bayesopt.orchestration.OptimizationRequest;
import com.verlumen.bayesopt.orchestration.OptimizationResult;
import com.verlumen.bayesopt.orchestration.Verbosity;
import com.verlumen.bayesopt.surrogate.Kernel;
import com.verlumen.bayesopt.surrogate.KernelKind;
import java.io.IOException;
import java.nio.file.Paths;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;

/** Runs the optimizer against one of the {@link DemoFunction}s. */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final OptimizationOrchestrator orchestrator;
  private final CheckpointStore checkpointStore;

  @Inject
  App(OptimizationOrchestrator orchestrator, CheckpointStore checkpointStore) {
    this.orchestrator = orchestrator;
    this.checkpointStore = checkpointStore;
  }

  OptimizationResult run(Namespace namespace) throws IOException {
    DemoFunction function = DemoFunction.fromName(namespace.getString("function"));
    OptimizationConfig config = buildConfig(namespace);
    OptimizationRequest.Builder request =
        OptimizationRequest.builder()
            .setScoringFunction(function)
            .setBounds(function.bounds())
            .setConfig(config);
    if (config.initialize() && config.initPoints() == 0) {
      request.setInitialGrid(function.suggestedGrid());
    }
    String resume = namespace.getString("resume");
    if (resume != null) {
      logger.atInfo().log("Resuming from %s", resume);
      request.setResumedLog(checkpointStore.load(Paths.get(resume)));
    }

    logger.atInfo().log("Optimizing %s over %s", function, function.bounds());
    OptimizationResult result = orchestrator.run(request.build());
    logger.atInfo().log(
        "Best score %s at %s after %d observations",
        result.best().score(), result.bestParameters(), result.observations().size());
    return result;
  }

  public static void main(String[] args) throws Exception {
    try {
      Namespace namespace = createParser().parseArgs(args);
      Long seed = namespace.getLong("seed");
      OptimizationModule module =
          seed == null ? OptimizationModule.create() : OptimizationModule.create(seed);
      App app = Guice.createInjector(module).getInstance(App.class);
      OptimizationResult result = app.run(namespace);
      System.out.printf("%s\t%s%n", result.bestParameters(), result.best().score());
    } catch (Exception e) {
      logger.atSevere().withCause(e).log("Optimization failed");
      throw e;
    }
  }

  static OptimizationConfig buildConfig(Namespace namespace) {
    int parallelism = namespace.getInt("parallelism");
    OptimizationConfig.Builder config =
        OptimizationConfig.builder()
            .setInitialize(!namespace.getBoolean("skipInitialization"))
            .setInitPoints(namespace.getInt("initPoints"))
            .setNIters(namespace.getInt("nIters"))
            .setBulkNew(namespace.getInt("bulkNew"))
            .setKernel(
                Kernel.create(
                    KernelKind.fromName(namespace.getString("kernel")),
                    namespace.getDouble("beta")))
            .setAcquisition(namespace.getString("acq"))
            .setKappa(namespace.getDouble("kappa"))
            .setEps(namespace.getDouble("eps"))
            .setGsPoints(namespace.getInt("gsPoints"))
            .setConvThresh(namespace.getDouble("convThresh"))
            .setNoiseAdd(namespace.getDouble("noiseAdd"))
            .setVerbosity(Verbosity.fromLevel(namespace.getInt("verbose")))
            .setParallel(parallelism > 1)
            .setParallelism(parallelism);
    Integer impatienceRounds = namespace.getInt("impatienceRounds");
    if (impatienceRounds != null) {
      config.setImpatience(ImpatienceRule.create(namespace.getString("newAcq"), impatienceRounds));
    }
    Double minClusterUtility = namespace.getDouble("minClusterUtility");
    if (minClusterUtility != null) {
      config.setMinClusterUtility(minClusterUtility);
    }
    String checkpoint = namespace.getString("checkpoint");
    if (checkpoint != null) {
      config.setCheckpointPath(Paths.get(checkpoint));
    }
    return config.build();
  }

  static ArgumentParser createParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("bayesopt")
            .build()
            .defaultHelp(true)
            .description("Bayesian optimization of a built-in demo scoring function");

    parser.addArgument("--function")
        .choices("bumps", "mixed")
        .setDefault("bumps")
        .help("Demo scoring function to maximize");

    // Initial design
    parser.addArgument("--initPoints")
        .type(Integer.class)
        .setDefault(0)
        .help("Latin hypercube initial design size; 0 uses the function's suggested grid");
    parser.addArgument("--skipInitialization")
        .action(Arguments.storeTrue())
        .help("Start from the --resume log without scoring an initial design");
    parser.addArgument("--resume").help("Checkpoint file of an earlier run to continue");

    // Loop
    parser.addArgument("--nIters")
        .type(Integer.class)
        .setDefault(12)
        .help("Total number of distinct parameter sets to score");
    parser.addArgument("--bulkNew")
        .type(Integer.class)
        .setDefault(1)
        .help("Candidates scored per iteration");

    // Surrogate and acquisition
    parser.addArgument("--kernel").setDefault("Matern52").help("Gaussian process kernel");
    parser.addArgument("--beta")
        .type(Double.class)
        .setDefault(0.0)
        .help("Starting log10 length-scale parameter of the kernel");
    parser.addArgument("--acq")
        .choices("ucb", "ei", "eips", "poi")
        .setDefault("ucb")
        .help("Acquisition function");
    parser.addArgument("--newAcq")
        .setDefault("ucb")
        .help("Acquisition function that replaces eips after --impatienceRounds");
    parser.addArgument("--impatienceRounds")
        .type(Integer.class)
        .help("Distinct observations after which eips is replaced by --newAcq");
    parser.addArgument("--kappa").type(Double.class).setDefault(2.576).help("UCB tuning");
    parser.addArgument("--eps").type(Double.class).setDefault(0.0).help("EI, EIPS and POI tuning");
    parser.addArgument("--gsPoints")
        .type(Integer.class)
        .setDefault(OptimizationConfig.DEFAULT_GS_POINTS)
        .help("Starting points of the local optimum search");
    parser.addArgument("--convThresh")
        .type(Double.class)
        .setDefault(OptimizationConfig.DEFAULT_CONV_THRESH)
        .help("Local optimizer tolerance in multiples of machine epsilon");

    // Batch selection
    parser.addArgument("--minClusterUtility")
        .type(Double.class)
        .help("Keep local optima within this fraction of the best utility; default keeps one");
    parser.addArgument("--noiseAdd")
        .type(Double.class)
        .setDefault(0.25)
        .help("Half-width of the noise around optima, as a fraction of each range");

    // Runtime
    parser.addArgument("--checkpoint").help("File the observations are saved to after each batch");
    parser.addArgument("--parallelism")
        .type(Integer.class)
        .setDefault(1)
        .help("Scoring workers; more than 1 scores candidates concurrently");
    parser.addArgument("--seed").type(Long.class).help("Random seed for reproducible runs");
    parser.addArgument("--verbose")
        .type(Integer.class)
        .choices(0, 1, 2)
        .setDefault(1)
        .help("0 is quiet, 1 reports progress, 2 reports every observation");

    return parser;
  }
}
