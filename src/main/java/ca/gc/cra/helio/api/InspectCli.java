package ca.gc.cra.helio.api;

import ca.gc.cra.helio.config.ConfigMerger;
import ca.gc.cra.helio.config.DefaultsForMode;
import ca.gc.cra.helio.domain.container.CompositeRecord;
import ca.gc.cra.helio.domain.container.CompressedRecord;
import ca.gc.cra.helio.domain.container.Container;
import ca.gc.cra.helio.domain.container.ContainerSchema;
import ca.gc.cra.helio.domain.container.ImageRecord;
import ca.gc.cra.helio.domain.container.PlaneRecord;
import ca.gc.cra.helio.domain.time.CaptureTimestamps;
import ca.gc.cra.helio.infrastructure.container.ContainerCodec;
import ca.gc.cra.helio.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the header and record layout of a container file.
 *
 * @since 0.1.0
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final String MODE = "inspect";
  private static final String SUMMARY_USAGE = "usage: helio inspect in=PATH schema=RAW|COMPOSITE|COMPRESSED";
  private static final String HELP_TEXT = """
      HELIO inspect

      Usage:
        helio inspect in=./solar.dat schema=RAW

      Options:
        in=PATH                          Container to read (default ~/.helio/out/solar.dat)
        schema=RAW|COMPOSITE|COMPRESSED  Layout the file was written with
        config=PATH                      YAML file (common + inspect sections)
        --help                           Show this message
      """;

  private InspectCli() {}

  /**
   * Reads and lists a container.
   *
   * @param input parsed dispatcher input; the first non-flag token is the command
   * @return exit code capturing the outcome
   */
  static ExitCode run(CliInput input) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    Path in;
    ContainerSchema schema;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.afterCommand()));
      Optional<Map<String, String>> yaml = ConfigCliUtils.loadYaml(ConfigCliUtils.extractConfigPath(kv), MODE);
      Map<String, String> effective =
          ConfigMerger.buildEffectiveConfig(MODE, yaml, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      in = Path.of(Strings.requireNonBlank("in", effective.get("in")));
      schema = ContainerSchema.valueOf(
          Strings.requireNonBlank("schema", effective.get("schema")).toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid inspect arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      Container container = ContainerCodec.decode(Files.readAllBytes(in), schema);
      CliPrinter.printLines(describe(in, container));
      return ExitCode.SUCCESS;
    } catch (NoSuchFileException ex) {
      log.error("Container does not exist: {}", in);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to decode {} as {}: {}", in, schema, ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    }
  }

  static String[] describe(Path path, Container container) {
    String[] lines = new String[container.imageCount() + 2];
    lines[0] = "Container " + path + " (" + container.schema() + ", " + container.serializedLength() + " bytes)";
    lines[1] = " Timestamp : " + CaptureTimestamps.formatHeader(container.timestamp())
        + "  Records: " + container.imageCount();
    int i = 2;
    for (ImageRecord record : container.records()) {
      lines[i] = " [" + (i - 2) + "] " + describe(record);
      i++;
    }
    return lines;
  }

  private static String describe(ImageRecord record) {
    if (record instanceof PlaneRecord plane) {
      return "channel " + plane.channelId() + " " + plane.width() + "x" + plane.height() + " gray";
    }
    if (record instanceof CompositeRecord composite) {
      return "composite " + composite.width() + "x" + composite.height() + " rgb";
    }
    CompressedRecord compressed = (CompressedRecord) record;
    return "channel " + compressed.channelId() + " " + compressed.byteLength() + " bytes encoded";
  }
}
