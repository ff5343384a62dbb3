package ca.gc.cra.helio.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Supplies flattened default configuration maps for each HELIO CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI invocations.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode (acquire, inspect)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "acquire" -> buildAcquireDefaults();
      case "inspect" -> buildInspectDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildAcquireDefaults() {
    AcquireConfig defaults = AcquireConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("out", defaults.out().toString());
    map.put("timestampOut", pathOrBlank(defaults.timestampOut()));
    map.put("schema", defaults.schema().name());
    map.put("mode", defaults.mode().name());
    map.put("channels", AcquireConfig.formatChannels(defaults.channels()));
    map.put("referenceChannel", Integer.toString(defaults.referenceChannel()));
    map.put("expectedChannels", Integer.toString(defaults.expectedChannels()));
    map.put("resample", defaults.resample().kind().name());
    map.put("scaleFactor", "0.5");
    map.put("targetWidth", Integer.toString(defaults.resample().targetWidth()));
    map.put("targetHeight", Integer.toString(defaults.resample().targetHeight()));
    map.put("timestampPrecision", defaults.timestampPrecision().name());
    map.put("timestamp", "");
    map.put("sourceUrl", defaults.sourceUrl());
    map.put("connectTimeoutMillis", Integer.toString(defaults.connectTimeoutMillis()));
    map.put("readTimeoutMillis", Integer.toString(defaults.readTimeoutMillis()));
    map.put("maxConcurrency", Integer.toString(defaults.maxConcurrency()));
    map.put("compressedFormat", defaults.compressedFormat());
    map.put("mirrorChannels", "");
    map.put("compositeFillMissing", Boolean.toString(defaults.compositeFillMissing()));
    map.put("compositeChannels", AcquireConfig.formatChannels(defaults.compositeChannels()));
    map.put("debugDir", pathOrBlank(defaults.debugDir()));
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildInspectDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", AcquireConfig.defaults().out().toString());
    map.put("schema", AcquireConfig.defaults().schema().name());
    return map;
  }

  private static String pathOrBlank(Optional<Path> path) {
    return path.map(Path::toString).orElse("");
  }
}
