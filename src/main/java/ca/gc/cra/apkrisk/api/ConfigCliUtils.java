package ca.gc.cra.apkrisk.api;

import ca.gc.cra.apkrisk.config.ConfigMerger;
import ca.gc.cra.apkrisk.config.DefaultsForMode;
import ca.gc.cra.apkrisk.config.YamlConfigLoader;
import ca.gc.cra.apkrisk.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Shared helpers for mixing CLI arguments with YAML configuration.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static Map<String, String> effectiveConfig(String command, Map<String, String> cli, Consumer<String> warn)
      throws IOException {
    return effectiveConfig(command, command, cli, warn);
  }

  /**
   * Removes {@code config=PATH} from the CLI map, loads that YAML file, and merges
   * CLI > YAML > defaults.
   *
   * @param command CLI command whose defaults and validation apply
   * @param yamlSection YAML section merged over {@code common}
   * @param cli parsed CLI arguments
   * @param warn receives override warnings
   * @return effective flat configuration
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the YAML file is missing or malformed, or validation fails
   */
  static Map<String, String> effectiveConfig(
      String command, String yamlSection, Map<String, String> cli, Consumer<String> warn) throws IOException {
    Map<String, String> remaining = new LinkedHashMap<>(cli);
    String configPath = remaining.remove("config");
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path file = Paths.requireReadableFile("config", Path.of(configPath));
      yaml = YamlConfigLoader.load(file, yamlSection);
    }
    return ConfigMerger.buildEffectiveConfig(command, yaml, remaining, DefaultsForMode.asFlatMap(command), warn);
  }
}
