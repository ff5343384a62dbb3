package ca.gc.cra.helio.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and cross-key invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (!"acquire".equalsIgnoreCase(mode)) {
      return;
    }
    String out = trim(effective.get("out"));
    String timestampOut = trim(effective.get("timestampOut"));
    if (!out.isEmpty() && !timestampOut.isEmpty() && samePath(out, timestampOut)) {
      throw new IllegalArgumentException("timestampOut must differ from out");
    }

    String schema = trim(effective.get("schema")).toUpperCase(Locale.ROOT);
    String acquireMode = trim(effective.get("mode")).toUpperCase(Locale.ROOT);
    boolean fill = parseBoolean(effective.get("compositeFillMissing"), false);
    if ("COMPOSITE".equals(schema) && "SINGLE".equals(acquireMode) && !fill) {
      throw new IllegalArgumentException(
          "schema=COMPOSITE cannot be produced from mode=SINGLE unless compositeFillMissing=true");
    }
  }

  private static boolean samePath(String a, String b) {
    try {
      return Path.of(a).toAbsolutePath().normalize().equals(Path.of(b).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("invalid path: " + ex.getInput(), ex);
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
