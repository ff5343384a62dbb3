package ca.gc.cra.helio.api;

import ca.gc.cra.helio.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Shared helpers for mixing CLI flags with YAML configuration files.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes {@code config=} (or {@code --config=}) from the argument map and returns its value.
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Loads the mode section of a YAML file.
   *
   * @throws IllegalArgumentException if the file is missing or its content is malformed
   * @throws IOException if the file cannot be read
   */
  static Optional<Map<String, String>> loadYaml(String configPath, String mode) throws IOException {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
    }
    return YamlConfigLoader.load(yamlPath, mode);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
