package ca.gc.cra.helio.config;

import ca.gc.cra.helio.domain.acquire.AcquisitionPlan;
import ca.gc.cra.helio.domain.acquire.ChannelRequest;
import ca.gc.cra.helio.domain.acquire.ReconciliationMode;
import ca.gc.cra.helio.domain.container.ContainerSchema;
import ca.gc.cra.helio.domain.raster.ColorPolicy;
import ca.gc.cra.helio.domain.raster.NormalizationPolicy;
import ca.gc.cra.helio.domain.raster.ResamplePolicy;
import ca.gc.cra.helio.domain.time.CaptureTimestamps;
import ca.gc.cra.helio.domain.time.TimestampPrecision;
import ca.gc.cra.helio.validation.Numbers;
import ca.gc.cra.helio.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable configuration for one {@code helio acquire} run.
 * <p><strong>Why:</strong> Consolidates CLI flags, YAML settings, and embedded defaults so a run is reproducible
 * from its effective key/value map.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Describe the channels to fetch, the reconciliation mode, and the output schema.</li>
 *   <li>Describe the per-channel normalization rule and transport limits.</li>
 *   <li>Reject combinations the pipeline cannot honour (e.g., a composite without a fixed raster size).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param out container destination
 * @param timestampOut optional sidecar file receiving the canonical timestamp
 * @param schema container layout
 * @param mode timestamp reconciliation mode
 * @param channels channels fetched (second wave when anchored), in request order
 * @param referenceChannel anchored reference channel
 * @param expectedChannels composite cardinality
 * @param resample resampling rule
 * @param timestampPrecision precision kept from filename timestamps
 * @param timestamp optional nominal timestamp override; empty means "now"
 * @param sourceUrl source URL template with {@code {date}} and {@code {sourceId}} placeholders
 * @param connectTimeoutMillis transport connect timeout
 * @param readTimeoutMillis transport read timeout
 * @param maxConcurrency upper bound on worker threads per wave
 * @param compressedFormat image format for the compressed schema
 * @param mirrorChannels channels mirrored left-right after resampling
 * @param compositeFillMissing whether missing composite channels are replaced by black planes
 * @param compositeChannels channels expected by fill mode
 * @param debugDir optional preview directory
 * @param allowOverwrite whether an existing container may be replaced
 * @param dryRun whether to print the plan without fetching
 * @since 0.1.0
 * @implNote The COMPOSITE schema requires {@link ResamplePolicy.Kind#FIT} so every plane shares one size.
 * @see ca.gc.cra.helio.application.pipeline.AcquireUseCase
 */
public record AcquireConfig(
    Path out,
    Optional<Path> timestampOut,
    ContainerSchema schema,
    ReconciliationMode mode,
    List<Integer> channels,
    int referenceChannel,
    int expectedChannels,
    ResamplePolicy resample,
    TimestampPrecision timestampPrecision,
    Optional<Instant> timestamp,
    String sourceUrl,
    int connectTimeoutMillis,
    int readTimeoutMillis,
    int maxConcurrency,
    String compressedFormat,
    Set<Integer> mirrorChannels,
    boolean compositeFillMissing,
    List<Integer> compositeChannels,
    Optional<Path> debugDir,
    boolean allowOverwrite,
    boolean dryRun) {

  /** Default Helioviewer image endpoint. */
  public static final String DEFAULT_SOURCE_URL =
      "https://api.helioviewer.org/v2/getJP2Image/?date={date}&sourceId={sourceId}";
  private static final int MAX_TIMEOUT_MILLIS = 600_000;
  private static final int MAX_CONCURRENCY = 64;
  private static final int MAX_RASTER_DIMENSION = 0xFFFF;

  /**
   * Normalizes values and enforces cross-field invariants.
   *
   * @throws IllegalArgumentException if a value is out of range or the combination is unsupported
   */
  public AcquireConfig {
    out = normalizePath("out", out);
    timestampOut = timestampOut == null ? Optional.empty() : timestampOut.map(p -> normalizePath("timestampOut", p));
    debugDir = debugDir == null ? Optional.empty() : debugDir.map(p -> normalizePath("debugDir", p));
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(mode, "mode");
    channels = List.copyOf(Objects.requireNonNull(channels, "channels"));
    Objects.requireNonNull(resample, "resample");
    Objects.requireNonNull(timestampPrecision, "timestampPrecision");
    timestamp = timestamp == null ? Optional.empty() : timestamp;
    sourceUrl = Strings.requireTemplate("sourceUrl", sourceUrl, "{date}", "{sourceId}");
    Numbers.requireRange("connectTimeoutMillis", connectTimeoutMillis, 1, MAX_TIMEOUT_MILLIS);
    Numbers.requireRange("readTimeoutMillis", readTimeoutMillis, 1, MAX_TIMEOUT_MILLIS);
    Numbers.requireRange("maxConcurrency", maxConcurrency, 1, MAX_CONCURRENCY);
    Numbers.requireRange("referenceChannel", referenceChannel, 0, ChannelRequest.MAX_CHANNEL_ID);
    Numbers.requireRange("expectedChannels", expectedChannels, 3, 3 * 0xFF);
    if (expectedChannels % 3 != 0) {
      throw new IllegalArgumentException("expectedChannels must be a multiple of 3 (was " + expectedChannels + ")");
    }
    compressedFormat = Strings.requirePrintableAscii("compressedFormat", compressedFormat, 16).toLowerCase(Locale.ROOT);
    mirrorChannels = mirrorChannels == null ? Set.of() : Set.copyOf(mirrorChannels);
    compositeChannels = compositeChannels == null ? List.of() : List.copyOf(compositeChannels);

    if (resample.kind() == ResamplePolicy.Kind.FIT) {
      Numbers.requireRange("targetWidth", resample.targetWidth(), 1, MAX_RASTER_DIMENSION);
      Numbers.requireRange("targetHeight", resample.targetHeight(), 1, MAX_RASTER_DIMENSION);
    } else {
      Numbers.requirePositive("scaleFactor", resample.scaleFactor(), 1.0);
    }
    if (schema == ContainerSchema.COMPOSITE && resample.kind() != ResamplePolicy.Kind.FIT) {
      throw new IllegalArgumentException("schema=COMPOSITE requires resample=FIT so all planes share one size");
    }
    if (compositeFillMissing && compositeChannels.size() != expectedChannels) {
      throw new IllegalArgumentException("compositeChannels must list exactly expectedChannels ("
          + expectedChannels + ") channels when compositeFillMissing=true");
    }
    // Validates the channel layout for the mode.
    new AcquisitionPlan(mode, channels,
        mode == ReconciliationMode.ANCHORED ? OptionalInt.of(referenceChannel) : OptionalInt.empty());
  }

  /**
   * Returns the baseline configuration: an anchored six-channel composite written under {@code ~/.helio/out}.
   *
   * @return default configuration
   */
  public static AcquireConfig defaults() {
    return new AcquireConfig(
        defaultBaseDirectory().resolve("solar.dat"),
        Optional.empty(),
        ContainerSchema.COMPOSITE,
        ReconciliationMode.ANCHORED,
        List.of(9, 10, 11, 13, 16),
        19,
        6,
        ResamplePolicy.fit(2048, 2048),
        TimestampPrecision.SECONDS,
        Optional.empty(),
        DEFAULT_SOURCE_URL,
        10_000,
        60_000,
        6,
        "png",
        Set.of(),
        false,
        List.of(9, 10, 11, 13, 16, 19),
        Optional.empty(),
        false,
        false);
  }

  /**
   * Creates a configuration from CLI-style key/value pairs, falling back to {@link #defaults()} per key.
   *
   * @param options effective key/value map, typically from {@link ConfigMerger}
   * @return populated configuration
   * @throws IllegalArgumentException when a value is invalid; the message names the offending key
   */
  public static AcquireConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    AcquireConfig d = defaults();

    ResamplePolicy.Kind resampleKind = parseEnum(ResamplePolicy.Kind.class, "resample", options.get("resample"),
        d.resample().kind());
    ResamplePolicy resample = resampleKind == ResamplePolicy.Kind.FIT
        ? ResamplePolicy.fit(
            parseInt(options, "targetWidth", d.resample().targetWidth(), 1, MAX_RASTER_DIMENSION),
            parseInt(options, "targetHeight", d.resample().targetHeight(), 1, MAX_RASTER_DIMENSION))
        : ResamplePolicy.scale(parseScale(options.get("scaleFactor")));

    return new AcquireConfig(
        optionalString(options.get("out")).map(v -> parsePath("out", v)).orElse(d.out()),
        optionalString(options.get("timestampOut")).map(v -> parsePath("timestampOut", v)),
        parseEnum(ContainerSchema.class, "schema", options.get("schema"), d.schema()),
        parseEnum(ReconciliationMode.class, "mode", options.get("mode"), d.mode()),
        optionalString(options.get("channels")).map(v -> parseChannels("channels", v)).orElse(d.channels()),
        parseInt(options, "referenceChannel", d.referenceChannel(), 0, ChannelRequest.MAX_CHANNEL_ID),
        parseInt(options, "expectedChannels", d.expectedChannels(), 3, 3 * 0xFF),
        resample,
        parseEnum(TimestampPrecision.class, "timestampPrecision", options.get("timestampPrecision"),
            d.timestampPrecision()),
        optionalString(options.get("timestamp")).map(CaptureTimestamps::parseNominal),
        optionalString(options.get("sourceUrl")).orElse(d.sourceUrl()),
        parseInt(options, "connectTimeoutMillis", d.connectTimeoutMillis(), 1, MAX_TIMEOUT_MILLIS),
        parseInt(options, "readTimeoutMillis", d.readTimeoutMillis(), 1, MAX_TIMEOUT_MILLIS),
        parseInt(options, "maxConcurrency", d.maxConcurrency(), 1, MAX_CONCURRENCY),
        optionalString(options.get("compressedFormat")).orElse(d.compressedFormat()),
        optionalString(options.get("mirrorChannels"))
            .map(v -> Set.copyOf(parseChannels("mirrorChannels", v)))
            .orElse(d.mirrorChannels()),
        parseBoolean(options.get("compositeFillMissing"), d.compositeFillMissing()),
        optionalString(options.get("compositeChannels"))
            .map(v -> parseChannels("compositeChannels", v))
            .orElse(d.compositeChannels()),
        optionalString(options.get("debugDir")).map(v -> parsePath("debugDir", v)),
        parseBoolean(options.get("allowOverwrite"), false),
        parseBoolean(options.get("dryRun"), false));
  }

  /**
   * Builds the acquisition plan described by this configuration.
   *
   * @return plan for the orchestrator
   */
  public AcquisitionPlan plan() {
    return switch (mode) {
      case INDEPENDENT -> AcquisitionPlan.independent(channels);
      case ANCHORED -> AcquisitionPlan.anchored(referenceChannel, channels);
      case SINGLE -> AcquisitionPlan.single(channels.get(0));
    };
  }

  /**
   * Builds the normalization rule implied by the schema.
   *
   * <p>RAW and COMPOSITE keep one byte per pixel; COMPRESSED re-encodes. Only RAW verifies the plane length.</p>
   *
   * @return normalization policy
   */
  public NormalizationPolicy normalizationPolicy() {
    ColorPolicy color = schema == ContainerSchema.COMPRESSED ? ColorPolicy.ENCODED : ColorPolicy.GRAYSCALE;
    return new NormalizationPolicy(
        resample, color, compressedFormat, schema == ContainerSchema.RAW, mirrorChannels);
  }

  /**
   * Renders the channel list as it is accepted on the command line.
   *
   * @param channels channel ids
   * @return comma separated ids
   */
  public static String formatChannels(List<Integer> channels) {
    StringBuilder sb = new StringBuilder();
    for (int channel : channels) {
      if (sb.length() > 0) {
        sb.append(',');
      }
      sb.append(channel);
    }
    return sb.toString();
  }

  static List<Integer> parseChannels(String name, String raw) {
    List<Integer> parsed = new ArrayList<>();
    Set<Integer> seen = new LinkedHashSet<>();
    for (String token : raw.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      int channel = Numbers.parseInt(name, token, 0, ChannelRequest.MAX_CHANNEL_ID);
      if (!seen.add(channel)) {
        throw new IllegalArgumentException(name + " lists channel " + channel + " more than once");
      }
      parsed.add(channel);
    }
    if (parsed.isEmpty()) {
      throw new IllegalArgumentException(name + " must list at least one channel id");
    }
    return parsed;
  }

  private static double parseScale(String raw) {
    if (raw == null || raw.isBlank()) {
      return 0.5;
    }
    try {
      return Numbers.requirePositive("scaleFactor", Double.parseDouble(raw.trim()), 1.0);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("scaleFactor must be a number (was '" + raw + "')", ex);
    }
  }

  private static int parseInt(Map<String, String> options, String key, int fallback, int min, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseInt(key, raw, min, max);
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String raw, E fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(key + " must be one of " + List.of(type.getEnumConstants())
          + " (was '" + raw + "')", ex);
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static Path parsePath(String name, String value) {
    String raw = Strings.requireNonBlank(name, value);
    if (raw.equals("~") || raw.startsWith("~/")) {
      raw = System.getProperty("user.home", ".") + raw.substring(1);
    }
    try {
      return Path.of(raw).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Path normalizePath(String name, Path path) {
    Objects.requireNonNull(path, name + " must not be null");
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }

  private static Path defaultBaseDirectory() {
    String home = System.getProperty("user.home", ".");
    return Path.of(home, ".helio", "out");
  }
}
