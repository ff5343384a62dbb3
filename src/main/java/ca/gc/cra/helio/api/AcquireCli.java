package ca.gc.cra.helio.api;

import ca.gc.cra.helio.application.pipeline.AcquireReport;
import ca.gc.cra.helio.application.pipeline.AcquireUseCase;
import ca.gc.cra.helio.config.AcquireConfig;
import ca.gc.cra.helio.config.CompositionRoot;
import ca.gc.cra.helio.config.ConfigMerger;
import ca.gc.cra.helio.config.DefaultsForMode;
import ca.gc.cra.helio.domain.acquire.AcquisitionException;
import ca.gc.cra.helio.domain.acquire.AcquisitionPlan;
import ca.gc.cra.helio.domain.container.AssemblyException;
import ca.gc.cra.helio.domain.raster.ResamplePolicy;
import ca.gc.cra.helio.logging.LoggingConfigurator;
import ca.gc.cra.helio.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for one acquisition run: fetch, reconcile, and write the container.
 *
 * @since 0.1.0
 */
public final class AcquireCli {
  private static final Logger log = LoggerFactory.getLogger(AcquireCli.class);
  private static final String MODE = "acquire";
  private static final String SUMMARY_USAGE =
      "usage: helio acquire [config=PATH] [out=PATH] [timestampOut=PATH] [schema=RAW|COMPOSITE|COMPRESSED] "
          + "[mode=INDEPENDENT|ANCHORED|SINGLE] [channels=ID,...] [referenceChannel=ID] "
          + "[resample=SCALE|FIT] [timestamp=ISO-8601] [--dry-run] [--allow-overwrite] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      HELIO acquire

      Usage:
        helio acquire out=./solar.dat schema=RAW mode=INDEPENDENT channels=9,10,11 [options]

      Output:
        out=PATH                  Container file (default ~/.helio/out/solar.dat)
        timestampOut=PATH         Sidecar file receiving the canonical timestamp
                                  Existing files are kept unless --allow-overwrite is given;
                                  scheduled runs that reuse out= need the flag
        schema=RAW|COMPOSITE|COMPRESSED
        debugDir=PATH             Write a PNG preview per acquired channel

      Acquisition:
        mode=INDEPENDENT|ANCHORED|SINGLE  Timestamp reconciliation (default ANCHORED)
        channels=ID,...           Channels to fetch; the second wave when anchored
        referenceChannel=ID       Anchor channel for ANCHORED mode (default 19)
        timestamp=ISO-8601        Nominal capture time (default: now, truncated to seconds)
        timestampPrecision=SECONDS|MILLIS
        sourceUrl=TEMPLATE        URL with {date} and {sourceId} placeholders
        connectTimeoutMillis=N    readTimeoutMillis=N    maxConcurrency=N

      Normalization:
        resample=SCALE|FIT        scaleFactor=0.5 or targetWidth=N targetHeight=N
        mirrorChannels=ID,...     Mirror these channels left-right
        compressedFormat=png      Encoding for schema=COMPRESSED

      Composite:
        expectedChannels=N        Channels per container, a multiple of 3 (default 6)
        compositeFillMissing=true|false  Replace missing channels with black planes
        compositeChannels=ID,...  Channel slots used when filling

      Flags:
        config=PATH               YAML file (common + acquire sections)
        --dry-run                 Validate and print the plan without fetching
        --allow-overwrite         Replace an existing container and sidecar (required on repeat runs)
        metricsExporter=otlp|none otelEndpoint=URL otelResourceAttributes=K=V,...
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private AcquireCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments (without the {@code acquire} command)
   */
  public static void main(String[] args) {
    String[] withCommand = new String[args.length + 1];
    withCommand[0] = MODE;
    System.arraycopy(args, 0, withCommand, 1, args.length);
    System.exit(run(CliInput.parse(withCommand)).code());
  }

  /**
   * Executes one acquisition and maps its outcome to an exit code.
   *
   * @param input parsed dispatcher input; the first non-flag token is the command
   * @return exit code capturing the outcome
   */
  static ExitCode run(CliInput input) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for acquire CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.afterCommand()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yamlConfig;
    try {
      yamlConfig = ConfigCliUtils.loadYaml(ConfigCliUtils.extractConfigPath(kv), MODE);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    AcquireConfig config;
    String metricsExporter;
    try {
      Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn));
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      if (input.hasFlag("--dry-run")) {
        effective.put("dryRun", "true");
      }
      if (input.hasFlag("--allow-overwrite")) {
        effective.put("allowOverwrite", "true");
      }
      metricsExporter = TelemetryConfigurator.configureMetrics(effective);
      config = AcquireConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid acquire arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      validatePaths(config);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid acquire path configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (config.dryRun()) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(config, metricsExporter)) {
      AcquireUseCase useCase = root.acquireUseCase();
      log.info("Configured acquire: mode={}, schema={}, channels={}, out={}, metricsExporter={}",
          config.mode(), config.schema(), AcquireConfig.formatChannels(config.channels()), config.out(),
          metricsExporter);
      return execute(useCase);
    }
  }

  static ExitCode execute(AcquireUseCase useCase) {
    try {
      AcquireReport report = useCase.run();
      log.info("Acquire completed: {} of {} channel(s), {} bytes",
          report.outcome().successfulResults().size(),
          report.outcome().successfulResults().size() + report.outcome().failures().size(),
          report.bytesWritten());
      return ExitCode.SUCCESS;
    } catch (AcquisitionException ex) {
      log.error("Acquisition failed: {}", ex.getMessage(), ex);
      return ExitCode.ACQUISITION_FAILED;
    } catch (AssemblyException ex) {
      log.error("Container not written: {}", ex.getMessage(), ex);
      return ExitCode.ACQUISITION_FAILED;
    } catch (IOException ex) {
      log.error("Acquire I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Acquire interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("Acquire configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in acquire pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void validatePaths(AcquireConfig config) {
    boolean create = !config.dryRun();
    Paths.validateWritableFile(config.out(), create, config.allowOverwrite());
    config.timestampOut().ifPresent(p -> Paths.validateWritableFile(p, create, config.allowOverwrite()));
    config.debugDir().ifPresent(p -> Paths.validateWritableDir(p, create));
  }

  private static void printDryRunPlan(AcquireConfig config) {
    AcquisitionPlan plan = config.plan();
    ResamplePolicy resample = config.resample();
    CliPrinter.printLines(
        "Acquire dry-run: nothing will be fetched or written.",
        " Mode              : " + plan.mode(),
        " Reference channel : " + (plan.referenceChannel().isPresent()
            ? Integer.toString(plan.referenceChannel().getAsInt()) : "<none>"),
        " Channels          : " + AcquireConfig.formatChannels(plan.channels()),
        " Schema            : " + config.schema(),
        " Resample          : " + (resample.kind() == ResamplePolicy.Kind.FIT
            ? "FIT " + resample.targetWidth() + "x" + resample.targetHeight()
            : "SCALE " + resample.scaleFactor()),
        " Timestamp         : " + config.timestamp().map(Object::toString).orElse("<now>"),
        " Source URL        : " + config.sourceUrl(),
        " Output            : " + config.out(),
        " Timestamp sidecar : " + config.timestampOut().map(Path::toString).orElse("<none>"),
        " Preview directory : " + config.debugDir().map(Path::toString).orElse("<none>"),
        " Allow overwrite   : " + config.allowOverwrite(),
        " Re-run without --dry-run to acquire.");
  }
}
